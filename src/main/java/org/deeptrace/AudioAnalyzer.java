package org.deeptrace;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Indicadores de voz sintética a partir de DSP clássico: pitch por autocorrelação,
 * jitter por cruzamentos de zero, perfil de energia, taxa de cruzamentos de zero
 * e centróide espectral.
 */
public class AudioAnalyzer {

    private static final Logger logger = Logger.getLogger(AudioAnalyzer.class.getName());

    static final int PITCH_FRAME = 1024;
    static final int PITCH_HOP = 512;
    static final int CENTROID_FRAME = 2048;
    static final double MIN_PITCH_HZ = 50;
    static final double MAX_PITCH_HZ = 500;
    static final int MIN_PERIOD_SAMPLES = 32;
    static final int MAX_PERIOD_SAMPLES = 640;

    private final AudioExtractor extractor;
    private final int energySegments;

    public AudioAnalyzer(AudioExtractor extractor, int energySegments) {
        this.extractor = extractor;
        this.energySegments = energySegments;
    }

    public AudioAnalyzer(DeepTraceConfig config) {
        this(new AudioExtractor(config), config.energySegments());
    }

    /**
     * Extrai e analisa o áudio do vídeo. Nunca lança exceção.
     */
    public AudioFeatures analyzeAudio(Path video) {
        Signal<AudioClip> clip = extractor.extract(video);
        if (!clip.isAvailable()) {
            return AudioFeatures.invalid(clip.reason());
        }
        return analyzeSamples(clip.get());
    }

    public AudioFeatures analyzeSamples(AudioClip clip) {
        if (clip.isEmpty()) {
            return AudioFeatures.invalid("Failed to load audio data");
        }
        float[] audio = clip.samples();
        int sr = clip.sampleRate();

        PitchFeatures pitch = computePitchFeatures(audio, sr);
        Jitter jitter = computeJitter(audio);
        List<Double> energy = computeEnergyProfile(audio, energySegments);
        double zcr = computeZeroCrossingRate(audio);
        double centroid = computeSpectralCentroid(audio, sr);

        logger.info(String.format("🎵 Áudio: pitch %.1f Hz (score %.1f), jitter %.5f (score %.1f)",
                pitch.mean(), pitch.varianceScore(), jitter.value(), jitter.score()));
        return new AudioFeatures(clip.durationSeconds(), sr, pitch.mean(), pitch.std(), pitch.varianceScore(),
                jitter.value(), jitter.score(), energy, zcr, centroid, true, null);
    }

    /**
     * Pitch por janela via pico de autocorrelação na faixa de lags de 50-500 Hz.
     */
    public static PitchFeatures computePitchFeatures(float[] audio, int sampleRate) {
        int minLag = sampleRate / 500;
        int maxLag = sampleRate / 50;
        List<Double> pitches = new ArrayList<>();

        if (maxLag <= PITCH_FRAME) {
            for (int start = 0; start < audio.length - PITCH_FRAME; start += PITCH_HOP) {
                double zeroLag = autocorrelation(audio, start, 0);
                int peakLag = -1;
                double peak = Double.NEGATIVE_INFINITY;
                for (int lag = minLag; lag < maxLag; lag++) {
                    double c = autocorrelation(audio, start, lag);
                    if (c > peak) {
                        peak = c;
                        peakLag = lag;
                    }
                }
                if (peakLag > 0 && peak > 0.3 * zeroLag) {
                    double hz = (double) sampleRate / peakLag;
                    if (hz > MIN_PITCH_HZ && hz < MAX_PITCH_HZ) {
                        pitches.add(hz);
                    }
                }
            }
        }

        if (pitches.isEmpty()) {
            return new PitchFeatures(0.0, 0.0, 50.0);
        }
        double[] values = Stats.toArray(pitches);
        double mean = Stats.mean(values);
        double std = Stats.std(values);
        double cv = std / (mean + 1e-6);

        double score;
        if (cv < 0.05) {
            score = 70 + (0.05 - cv) * 600;
        } else if (cv > 0.3) {
            score = 50 + (cv - 0.3) * 100;
        } else {
            score = cv * 100;
        }
        return new PitchFeatures(mean, std, Stats.clipScore(score));
    }

    private static double autocorrelation(float[] audio, int start, int lag) {
        double sum = 0;
        int end = start + PITCH_FRAME - lag;
        for (int i = start; i < end; i++) {
            sum += (double) audio[i] * audio[i + lag];
        }
        return sum;
    }

    /**
     * Jitter: variação média entre períodos consecutivos estimados a cada dois
     * cruzamentos de zero. O instante do cruzamento é interpolado linearmente entre amostras.
     */
    public static Jitter computeJitter(float[] audio) {
        List<Double> crossings = new ArrayList<>();
        for (int i = 0; i + 1 < audio.length; i++) {
            if (signBit(audio[i]) != signBit(audio[i + 1])) {
                double a = audio[i];
                double b = audio[i + 1];
                double frac = a != b ? a / (a - b) : 0.0;
                crossings.add(i + Stats.clip(frac, 0.0, 1.0));
            }
        }
        if (crossings.size() < 4) {
            return new Jitter(0.0, 50.0);
        }

        List<Double> periods = new ArrayList<>();
        for (int i = 0; i < crossings.size() - 2; i += 2) {
            double period = crossings.get(i + 2) - crossings.get(i);
            if (period > MIN_PERIOD_SAMPLES && period < MAX_PERIOD_SAMPLES) {
                periods.add(period);
            }
        }
        if (periods.size() < 3) {
            return new Jitter(0.0, 50.0);
        }

        double[] p = Stats.toArray(periods);
        double diffSum = 0;
        for (int i = 1; i < p.length; i++) {
            diffSum += Math.abs(p[i] - p[i - 1]);
        }
        double jitter = (diffSum / (p.length - 1)) / (Stats.mean(p) + 1e-6);

        double score;
        if (jitter < 0.001) {
            score = 80;
        } else if (jitter > 0.02) {
            score = Math.min(100, 50 + jitter * 1000);
        } else {
            score = jitter * 2500;
        }
        return new Jitter(jitter, Stats.clipScore(score));
    }

    private static boolean signBit(float v) {
        return Float.floatToRawIntBits(v) < 0;
    }

    /**
     * RMS de {@code segments} segmentos de mesmo tamanho; vazio se o áudio for curto demais.
     */
    public static List<Double> computeEnergyProfile(float[] audio, int segments) {
        int segmentSize = audio.length / segments;
        List<Double> energy = new ArrayList<>();
        if (segmentSize == 0) {
            return energy;
        }
        for (int s = 0; s < segments; s++) {
            double sum = 0;
            int start = s * segmentSize;
            for (int i = start; i < start + segmentSize; i++) {
                sum += (double) audio[i] * audio[i];
            }
            energy.add(Math.sqrt(sum / segmentSize));
        }
        return energy;
    }

    public static double computeZeroCrossingRate(float[] audio) {
        if (audio.length == 0) {
            return 0.0;
        }
        int crossings = 0;
        for (int i = 0; i + 1 < audio.length; i++) {
            if (signBit(audio[i]) != signBit(audio[i + 1])) {
                crossings++;
            }
        }
        return (double) crossings / audio.length;
    }

    /**
     * Centróide espectral médio com janelas de Hann de 2048 amostras e 50% de sobreposição.
     */
    public static double computeSpectralCentroid(float[] audio, int sampleRate) {
        double[] window = new double[CENTROID_FRAME];
        for (int n = 0; n < CENTROID_FRAME; n++) {
            window[n] = 0.5 - 0.5 * Math.cos(2 * Math.PI * n / (CENTROID_FRAME - 1));
        }

        List<Double> centroids = new ArrayList<>();
        double[] frame = new double[CENTROID_FRAME];
        for (int start = 0; start < audio.length - CENTROID_FRAME; start += CENTROID_FRAME / 2) {
            for (int n = 0; n < CENTROID_FRAME; n++) {
                frame[n] = audio[start + n] * window[n];
            }
            double[] spectrum = Fft.realMagnitudes(frame);
            double weighted = 0;
            double total = 0;
            for (int k = 0; k < spectrum.length; k++) {
                double freq = (double) k * sampleRate / CENTROID_FRAME;
                weighted += freq * spectrum[k];
                total += spectrum[k];
            }
            if (total > 0) {
                centroids.add(weighted / total);
            }
        }
        return centroids.isEmpty() ? 0.0 : Stats.mean(Stats.toArray(centroids));
    }

    public record PitchFeatures(double mean, double std, double varianceScore) {
    }

    public record Jitter(double value, double score) {
    }
}
