package org.deeptrace;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Correlação cruzada entre a energia de movimento da boca e o perfil de energia do áudio.
 */
public class LipSyncAnalyzer {

    private static final Logger logger = Logger.getLogger(LipSyncAnalyzer.class.getName());

    private static final int MOUTH_WIDTH = 64;
    private static final int MOUTH_HEIGHT = 32;
    private static final double MISMATCH_CORRELATION = 0.2;
    private static final double MAX_LAG_SECONDS = 0.5;

    private final FaceDetector detector;
    private final VideoFrameReader frameReader;

    public LipSyncAnalyzer(FaceDetector detector, VideoFrameReader frameReader) {
        this.detector = detector;
        this.frameReader = frameReader;
    }

    /**
     * Região da boca em tons de cinza: faixa de 60-90% da altura e 20-80% da largura do maior rosto.
     */
    public Optional<GrayImage> extractMouthRegion(RgbFrame frame) {
        Optional<Region> face = detector.largestFace(frame);
        if (face.isEmpty()) {
            return Optional.empty();
        }
        Region mouth = face.get().mouthRegion().clip(frame.width(), frame.height());
        if (mouth.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(frame.toGray().crop(mouth));
    }

    /**
     * Diferença absoluta média da boca entre frames consecutivos; 0 no primeiro frame e sem rosto.
     */
    public List<Double> computeMouthMovement(List<RgbFrame> frames) {
        List<Double> movements = new ArrayList<>();
        GrayImage previous = null;
        for (RgbFrame frame : frames) {
            Optional<GrayImage> mouth = extractMouthRegion(frame);
            if (mouth.isEmpty()) {
                movements.add(0.0);
                continue;
            }
            GrayImage resized = mouth.get().resize(MOUTH_WIDTH, MOUTH_HEIGHT).quantize();
            movements.add(previous != null ? resized.meanAbsDifference(previous) : 0.0);
            previous = resized;
        }
        return movements;
    }

    public LipSyncFeatures analyzeSync(Path video, List<Double> audioEnergy, int maxFrames)
            throws IOException, InterruptedException {
        if (frameReader == null) {
            throw new IllegalStateException("LipSyncAnalyzer criado sem VideoFrameReader");
        }
        VideoInfo info = frameReader.probe(video);
        List<RgbFrame> frames = frameReader.readFrames(video, info, maxFrames);
        return analyzeSync(frames, info.fps(), audioEnergy);
    }

    public LipSyncFeatures analyzeSync(List<RgbFrame> frames, double fps, List<Double> audioEnergy) {
        if (frames.isEmpty()) {
            return new LipSyncFeatures(List.of(), audioEnergy, 0.0, 50.0, 0, List.of());
        }
        List<Double> mouthEnergy = computeMouthMovement(frames);
        return correlate(mouthEnergy, audioEnergy, fps);
    }

    /**
     * Alinha os dois sinais, encontra a defasagem de maior correlação e marca as janelas
     * em que a correlação local cai abaixo de 0.2.
     */
    static LipSyncFeatures correlate(List<Double> mouthEnergy, List<Double> audioEnergy, double fps) {
        double maxCorr = 0;
        int lag = 0;
        List<TimeInterval> mismatches = new ArrayList<>();

        if (!audioEnergy.isEmpty() && !mouthEnergy.isEmpty()) {
            int n = Math.min(audioEnergy.size(), mouthEnergy.size());
            double[] audio = zNormalize(resample(Stats.toArray(audioEnergy), n));
            double[] mouth = zNormalize(resample(Stats.toArray(mouthEnergy), n));

            double best = Double.NEGATIVE_INFINITY;
            int bestIndex = 0;
            for (int k = -(n - 1); k <= n - 1; k++) {
                double c = 0;
                for (int i = Math.max(0, -k); i < n && i + k < n; i++) {
                    c += audio[i + k] * mouth[i];
                }
                if (c > best) {
                    best = c;
                    bestIndex = k + n - 1;
                }
            }
            lag = bestIndex - (n - 1);
            maxCorr = best / n;

            int window = Math.max(1, n / 10);
            int step = Math.max(1, window / 2);
            for (int i = 0; i < n - window; i += step) {
                double local = Stats.pearson(audio, mouth, i, i + window);
                if (Double.isNaN(local) || local < MISMATCH_CORRELATION) {
                    mismatches.add(new TimeInterval(i / fps, (i + window) / fps));
                }
            }
        }

        double lagPenalty = Math.abs(lag) > fps * MAX_LAG_SECONDS
                ? Math.min(50, Math.abs(lag) / fps * 50)
                : 0;
        double syncScore = Stats.clipScore(Math.max(0, maxCorr * 100 - lagPenalty));
        logger.fine(String.format("Lip-sync: corr %.3f, lag %d, %d janelas divergentes",
                maxCorr, lag, mismatches.size()));
        return new LipSyncFeatures(mouthEnergy, audioEnergy, maxCorr, syncScore, lag, mismatches);
    }

    /**
     * Reamostragem linear para {@code length} pontos igualmente espaçados.
     */
    static double[] resample(double[] values, int length) {
        double[] out = new double[length];
        if (values.length == 1 || length == 1) {
            Arrays.fill(out, values[0]);
            return out;
        }
        for (int i = 0; i < length; i++) {
            double pos = (double) i / (length - 1) * (values.length - 1);
            int lo = (int) Math.floor(pos);
            int hi = Math.min(lo + 1, values.length - 1);
            double frac = pos - lo;
            out[i] = values[lo] + (values[hi] - values[lo]) * frac;
        }
        return out;
    }

    static double[] zNormalize(double[] values) {
        double mean = Stats.mean(values);
        double std = Stats.std(values) + 1e-6;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (values[i] - mean) / std;
        }
        return out;
    }
}
