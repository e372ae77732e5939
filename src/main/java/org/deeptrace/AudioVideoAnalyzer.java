package org.deeptrace;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Análise multimodal completa: indicadores de falsificação de áudio combinados
 * com a sincronia labial.
 */
public class AudioVideoAnalyzer {

    private static final Logger logger = Logger.getLogger(AudioVideoAnalyzer.class.getName());

    static final int MIN_MOUTH_SAMPLES = 50;

    private final AudioAnalyzer audioAnalyzer;
    private final LipSyncAnalyzer lipSyncAnalyzer;
    private final int maxFrames;

    public AudioVideoAnalyzer(AudioAnalyzer audioAnalyzer, LipSyncAnalyzer lipSyncAnalyzer, int maxFrames) {
        this.audioAnalyzer = audioAnalyzer;
        this.lipSyncAnalyzer = lipSyncAnalyzer;
        this.maxFrames = maxFrames;
    }

    /**
     * Extrai áudio e frames do vídeo. Falhas de áudio ou de lip-sync resultam em
     * scores neutros, nunca em exceção de mídia.
     */
    public MultiModalAnalysis analyze(Path video) throws InterruptedException {
        AudioFeatures audio = audioAnalyzer.analyzeAudio(video);
        LipSyncFeatures lipSync = null;
        String lipSyncFailure = null;
        if (audio.isValid() && !audio.energyProfile().isEmpty()) {
            try {
                lipSync = lipSyncAnalyzer.analyzeSync(video, audio.energyProfile(), maxFrames);
            } catch (IOException e) {
                logger.warning("⚠️ Lip-sync indisponível: " + e.getMessage());
                lipSyncFailure = e.getMessage();
            }
        }
        MultiModalAnalysis result = combine(audio, lipSync);
        if (lipSyncFailure != null) {
            Map<String, Object> details = new LinkedHashMap<>(result.analysisDetails());
            details.put("lip_sync_error", lipSyncFailure);
            result = new MultiModalAnalysis(result.audioFeatures(), null, result.audioSpoofScore(),
                    result.lipSyncScore(), result.combinedScore(), result.confidence(), details);
        }
        return result;
    }

    /**
     * Variante para quando os frames já foram decodificados.
     */
    public MultiModalAnalysis analyze(AudioFeatures audio, List<RgbFrame> frames, double fps) {
        LipSyncFeatures lipSync = null;
        if (audio.isValid() && !audio.energyProfile().isEmpty()) {
            lipSync = lipSyncAnalyzer.analyzeSync(frames, fps, audio.energyProfile());
        }
        return combine(audio, lipSync);
    }

    public AudioAnalyzer getAudioAnalyzer() {
        return audioAnalyzer;
    }

    /**
     * combined = 0.4 (100 - spoof) + 0.6 lipSync; lip-sync ausente conta como 50.
     */
    public static MultiModalAnalysis combine(AudioFeatures audio, LipSyncFeatures lipSync) {
        double spoof = audio.spoofScore();
        double lipScore = lipSync != null ? lipSync.syncScore() : 50.0;
        double combined = Stats.clipScore((100 - spoof) * 0.4 + lipScore * 0.6);

        double confidence = audio.isValid() ? 80.0 : 30.0;
        if (lipSync != null && lipSync.mouthMovementEnergy().size() >= MIN_MOUTH_SAMPLES) {
            confidence += 20.0;
        }

        Map<String, Object> pitch = new LinkedHashMap<>();
        pitch.put("mean", audio.pitchMean());
        pitch.put("std", audio.pitchStd());
        pitch.put("score", audio.pitchVarianceScore());
        Map<String, Object> jitter = new LinkedHashMap<>();
        jitter.put("value", audio.jitterMean());
        jitter.put("score", audio.jitterScore());
        Map<String, Object> sync = new LinkedHashMap<>();
        sync.put("correlation", lipSync != null ? lipSync.correlation() : 0.0);
        sync.put("lag_frames", lipSync != null ? lipSync.lagFrames() : 0);
        sync.put("mismatch_count", lipSync != null ? lipSync.mismatchRegions().size() : 0);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("audio_valid", audio.isValid());
        details.put("audio_duration", audio.durationSeconds());
        details.put("pitch_analysis", pitch);
        details.put("jitter_analysis", jitter);
        details.put("lip_sync", sync);
        if (!audio.isValid()) {
            details.put("audio_error", audio.errorMessage());
        }

        logger.info(String.format("🎙️ Multimodal: spoof %.1f, lip-sync %.1f, combinado %.1f",
                spoof, lipScore, combined));
        return new MultiModalAnalysis(audio, lipSync, spoof, lipScore, combined,
                Math.min(confidence, 100.0), details);
    }
}
