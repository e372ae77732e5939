package org.deeptrace;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Classificação por regras do tipo de deepfake a partir dos sinais já calculados.
 * Determinística, sem pesos aprendidos.
 */
public class FakeTypeClassifier {

    private static final Logger logger = Logger.getLogger(FakeTypeClassifier.class.getName());

    private static final int MAX_KEY_INDICATORS = 3;

    private final FakeTypeThresholds thresholds;

    public FakeTypeClassifier(FakeTypeThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public FakeTypeClassifier() {
        this(FakeTypeThresholds.defaults());
    }

    public FakeTypeThresholds getThresholds() {
        return thresholds;
    }

    public FakeTypeResult classify(ModelPrediction prediction,
                                   Signal<ForensicsMetrics> forensics,
                                   Signal<MultiModalAnalysis> multimodal,
                                   Signal<TimelineStats> timeline) {
        Map<FakeType, Double> scores = new EnumMap<>(FakeType.class);
        for (FakeType type : FakeType.values()) {
            scores.put(type, 0.0);
        }
        List<String> evidence = new ArrayList<>();

        if (prediction.isReal()) {
            if (prediction.confidence() > thresholds.realModelConfidence()) {
                add(scores, FakeType.AUTHENTIC, 50);
                evidence.add(fmt("Model predicts REAL with %.1f%% confidence", prediction.confidence()));
            }
        } else {
            evidence.add(fmt("Model predicts FAKE with %.1f%% confidence", prediction.confidence()));
        }

        forensics.toOptional().ifPresent(m -> analyzeForensics(m, scores, evidence));
        multimodal.toOptional().ifPresent(m -> analyzeMultimodal(m, scores, evidence));
        timeline.toOptional().ifPresent(t -> analyzeTimeline(t, scores, evidence));

        FakeType primary;
        double confidence;
        double maxFake = 0;
        FakeType maxType = FakeType.UNKNOWN_MANIPULATION;
        double totalFake = 0;
        for (FakeType type : FakeType.values()) {
            if (!type.isManipulation()) continue;
            double s = scores.get(type);
            totalFake += s;
            if (s > maxFake) {
                maxFake = s;
                maxType = type;
            }
        }

        double authentic = scores.get(FakeType.AUTHENTIC);
        if (prediction.isReal() && prediction.confidence() > thresholds.realModelConfidence()
                && authentic > 40 && authentic >= maxFake) {
            primary = FakeType.AUTHENTIC;
            confidence = Math.min(95, prediction.confidence());
        } else if (totalFake == 0) {
            primary = FakeType.UNKNOWN_MANIPULATION;
            confidence = 40.0;
        } else {
            confidence = maxFake / totalFake * 100;
            if (maxFake < 20) {
                primary = FakeType.UNKNOWN_MANIPULATION;
                confidence = Math.min(50, confidence);
            } else {
                primary = maxType;
                confidence = Math.min(95, confidence);
            }
        }

        Map<String, Double> allScores = new LinkedHashMap<>();
        scores.forEach((type, s) -> allScores.put(type.getValue(), s));

        logger.info(String.format(Locale.ROOT, "🧬 Tipo de fake: %s (%.1f%%)", primary.getValue(), confidence));
        return new FakeTypeResult(primary, confidence, allScores, evidence,
                explanation(primary, evidence), primary.getRecommendations());
    }

    private void analyzeForensics(ForensicsMetrics m, Map<FakeType, Double> scores, List<String> evidence) {
        if (m.faceConsistencyScore() < thresholds.faceConsistency()) {
            add(scores, FakeType.GAN_FACE_SWAP, 25);
            evidence.add(fmt("Low face consistency: %.1f%%", m.faceConsistencyScore()));
        } else {
            add(scores, FakeType.AUTHENTIC, 15);
        }

        if (m.temporalStabilityScore() < thresholds.temporalStability()) {
            add(scores, FakeType.GAN_FACE_SWAP, 15);
            add(scores, FakeType.FACE_REENACTMENT, 10);
            evidence.add(fmt("Low temporal stability: %.1f%%", m.temporalStabilityScore()));
        }

        if (m.eyeBlinkScore() < thresholds.blinkScore()) {
            add(scores, FakeType.GAN_FACE_SWAP, 20);
            add(scores, FakeType.FACE_REENACTMENT, 15);
            evidence.add(fmt("Abnormal blink pattern: %.1f%%", m.eyeBlinkScore()));
        }

        if (m.compressionArtifactScore() > thresholds.artifact()) {
            add(scores, FakeType.GAN_FACE_SWAP, 10);
            add(scores, FakeType.UNKNOWN_MANIPULATION, 5);
            evidence.add(fmt("High compression artifacts: %.1f%%", m.compressionArtifactScore()));
        }
    }

    private void analyzeMultimodal(MultiModalAnalysis m, Map<FakeType, Double> scores, List<String> evidence) {
        if (m.lipSyncScore() < thresholds.lipSync()) {
            add(scores, FakeType.LIP_SYNC, 35);
            evidence.add(fmt("Poor lip-audio sync: %.1f%%", m.lipSyncScore()));
        }

        if (m.audioSpoofScore() > thresholds.audioSpoof()) {
            add(scores, FakeType.LIP_SYNC, 20);
            evidence.add(fmt("Audio spoofing indicators: %.1f%%", m.audioSpoofScore()));
        }

        m.lipSyncCorrelation().ifPresent(correlation -> {
            if (correlation < thresholds.lipSyncCorrelation()) {
                add(scores, FakeType.LIP_SYNC, 25);
                evidence.add(fmt("Low audio-visual correlation: %.2f", correlation));
            }
        });
    }

    private void analyzeTimeline(TimelineStats stats, Map<FakeType, Double> scores, List<String> evidence) {
        if (stats.temporalVariance() > thresholds.temporalVariance()) {
            add(scores, FakeType.FACE_REENACTMENT, 15);
            evidence.add(fmt("High temporal probability variance: %.3f", stats.temporalVariance()));
        }

        if (stats.anomalyRatio() > thresholds.anomalyRatio()) {
            add(scores, FakeType.GAN_FACE_SWAP, 10);
            add(scores, FakeType.FACE_REENACTMENT, 10);
            evidence.add(fmt("High anomaly ratio: %.1f%%", stats.anomalyRatio() * 100));
        }

        if (stats.meanFakeProbability() > thresholds.meanFakeProbability()) {
            add(scores, FakeType.GAN_FACE_SWAP, 10);
            evidence.add(fmt("Consistently high fake probability: %.1f%%", stats.meanFakeProbability() * 100));
        }
    }

    private static String explanation(FakeType type, List<String> evidence) {
        if (evidence.isEmpty()) {
            return type.getExplanation();
        }
        List<String> key = evidence.subList(0, Math.min(MAX_KEY_INDICATORS, evidence.size()));
        return type.getExplanation() + " Key indicators: " + String.join("; ", key) + ".";
    }

    private static void add(Map<FakeType, Double> scores, FakeType type, double points) {
        scores.merge(type, points, Double::sum);
    }

    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
