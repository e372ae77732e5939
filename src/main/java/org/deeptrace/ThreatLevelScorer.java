package org.deeptrace;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Combina predição do modelo, forense, multimodal, timeline e tipo de fake num nível de ameaça
 * com explicação e recomendações.
 *
 * <p>Sinais indisponíveis entram com peso zero e os pesos restantes são renormalizados;
 * sem nenhum sinal disponível o nível é {@link ThreatLevel#UNKNOWN}.</p>
 */
public class ThreatLevelScorer {

    private static final Logger logger = Logger.getLogger(ThreatLevelScorer.class.getName());

    private static final double NEUTRAL = 50.0;
    private static final int MAX_KEY_RISKS = 3;

    private final ThreatThresholds thresholds;
    private final ThreatWeights weights;

    public ThreatLevelScorer(ThreatThresholds thresholds, ThreatWeights weights) {
        this.thresholds = thresholds;
        this.weights = weights;
    }

    public ThreatLevelScorer() {
        this(ThreatThresholds.defaults(), ThreatWeights.defaults());
    }

    public ThreatLevelScorer(DeepTraceConfig config) {
        this(config.threatThresholds(), config.threatWeights());
    }

    public ThreatWeights getWeights() {
        return weights;
    }

    public ThreatAssessment assess(ModelPrediction prediction,
                                   Signal<ForensicsMetrics> forensics,
                                   Signal<MultiModalAnalysis> multimodal,
                                   Signal<TimelineStats> timeline,
                                   Signal<FakeTypeResult> fakeType) {
        List<String> risks = new ArrayList<>();
        List<String> mitigations = new ArrayList<>();
        Map<ThreatComponent, Double> available = new EnumMap<>(ThreatComponent.class);

        scoreModel(prediction, available, risks, mitigations);
        forensics.toOptional().ifPresent(m -> scoreForensics(m, available, risks, mitigations));
        multimodal.toOptional().ifPresent(m -> scoreMultimodal(m, available, risks, mitigations));
        timeline.toOptional().ifPresent(t -> scoreTemporal(t, available, risks, mitigations));
        fakeType.toOptional().ifPresent(f -> scoreFakeType(f, available, risks, mitigations));

        Map<String, Double> componentScores = new LinkedHashMap<>();
        List<String> unavailable = new ArrayList<>();
        double weightSum = 0;
        double weighted = 0;
        ThreatComponent topComponent = null;
        double topContribution = -1;
        for (ThreatComponent c : ThreatComponent.values()) {
            Double score = available.get(c);
            if (score == null) {
                componentScores.put(c.getKey(), NEUTRAL);
                unavailable.add(c.getKey());
                continue;
            }
            componentScores.put(c.getKey(), score);
            double w = weights.weight(c);
            weightSum += w;
            weighted += score * w;
            if (score * w > topContribution) {
                topContribution = score * w;
                topComponent = c;
            }
        }

        ThreatLevel level;
        double overall;
        if (weightSum <= 0) {
            level = ThreatLevel.UNKNOWN;
            overall = NEUTRAL;
            logger.warning("⚠️ Nenhum sinal disponível para o score de ameaça");
        } else {
            overall = Stats.clipScore(weighted / weightSum);
            level = thresholds.levelFor(overall);
        }

        double confidence = confidence(forensics, multimodal, timeline);
        String explanation = explanation(level, overall, topComponent, componentScores, risks);

        logger.info(String.format(Locale.ROOT, "🛡️ Nível de ameaça: %s (score %.1f, confiança %.0f%%)",
                level.getDisplayName(), overall, confidence));
        return new ThreatAssessment(level, level.getDisplayName(), overall, confidence, componentScores,
                unavailable, risks, mitigations, explanation, level.getRecommendations(), level.getColorCode());
    }

    private void scoreModel(ModelPrediction prediction, Map<ThreatComponent, Double> scores,
                            List<String> risks, List<String> mitigations) {
        double confidence = prediction.confidence();
        switch (prediction.label()) {
            case FAKE -> {
                scores.put(ThreatComponent.MODEL_CONFIDENCE, confidence);
                if (confidence > 80) {
                    risks.add(fmt("Model detects FAKE with high confidence (%.1f%%)", confidence));
                } else if (confidence > 60) {
                    risks.add(fmt("Model detects FAKE with moderate confidence (%.1f%%)", confidence));
                }
            }
            case REAL -> {
                scores.put(ThreatComponent.MODEL_CONFIDENCE, 100 - confidence);
                if (confidence > 80) {
                    mitigations.add(fmt("Model detects REAL with high confidence (%.1f%%)", confidence));
                }
            }
            case UNKNOWN -> logger.fine("Predição do modelo indisponível, componente com peso zero");
        }
    }

    private void scoreForensics(ForensicsMetrics m, Map<ThreatComponent, Double> scores,
                                List<String> risks, List<String> mitigations) {
        scores.put(ThreatComponent.FORENSICS_SCORE, 100 - m.overallForensicsScore());

        if (m.faceConsistencyScore() < 50) {
            risks.add(fmt("Low face consistency score (%.1f%%)", m.faceConsistencyScore()));
        } else if (m.faceConsistencyScore() > 80) {
            mitigations.add(fmt("High face consistency (%.1f%%)", m.faceConsistencyScore()));
        }

        if (m.eyeBlinkScore() < 40) {
            risks.add(fmt("Abnormal eye blink pattern (%.1f%%)", m.eyeBlinkScore()));
        }

        if (m.temporalStabilityScore() < 50) {
            risks.add(fmt("Low temporal stability (%.1f%%)", m.temporalStabilityScore()));
        } else if (m.temporalStabilityScore() > 80) {
            mitigations.add(fmt("Good temporal stability (%.1f%%)", m.temporalStabilityScore()));
        }

        if (m.compressionArtifactScore() > 60) {
            risks.add(fmt("High compression artifacts (%.1f%%)", m.compressionArtifactScore()));
        }
    }

    private void scoreMultimodal(MultiModalAnalysis m, Map<ThreatComponent, Double> scores,
                                 List<String> risks, List<String> mitigations) {
        scores.put(ThreatComponent.AUDIO_SCORE, 100 - m.combinedScore());

        if (m.lipSyncScore() < 40) {
            risks.add(fmt("Poor lip-audio synchronization (%.1f%%)", m.lipSyncScore()));
        } else if (m.lipSyncScore() > 70) {
            mitigations.add(fmt("Good lip-audio sync (%.1f%%)", m.lipSyncScore()));
        }

        if (m.audioSpoofScore() > 60) {
            risks.add(fmt("Audio spoofing indicators detected (%.1f%%)", m.audioSpoofScore()));
        }
    }

    private void scoreTemporal(TimelineStats stats, Map<ThreatComponent, Double> scores,
                               List<String> risks, List<String> mitigations) {
        double mean = stats.meanFakeProbability();
        double consistency = stats.temporalConsistencyScore();
        scores.put(ThreatComponent.TEMPORAL_SCORE, Stats.clipScore(mean * 100 * 0.6 + (100 - consistency) * 0.4));

        if (mean > 0.7) {
            risks.add(fmt("High average fake probability (%.1f%%)", mean * 100));
        }
        if (stats.anomalyRatio() > 0.2) {
            risks.add(fmt("High temporal anomaly rate (%.1f%%)", stats.anomalyRatio() * 100));
        }
        if (consistency > 80) {
            mitigations.add(fmt("High temporal consistency (%.1f%%)", consistency));
        }
    }

    private void scoreFakeType(FakeTypeResult result, Map<ThreatComponent, Double> scores,
                               List<String> risks, List<String> mitigations) {
        double confidence = result.confidence();
        switch (result.primaryType()) {
            case AUTHENTIC -> {
                scores.put(ThreatComponent.FAKE_TYPE_SCORE, Math.max(0, 100 - confidence));
                if (confidence > 70) {
                    mitigations.add(fmt("Classified as authentic (%.1f%% confidence)", confidence));
                }
            }
            case GAN_FACE_SWAP, LIP_SYNC, FACE_REENACTMENT -> {
                scores.put(ThreatComponent.FAKE_TYPE_SCORE, confidence);
                if (confidence > 60) {
                    risks.add(fmt("Classified as %s (%.1f%% confidence)",
                            result.primaryType().getDisplayName(), confidence));
                }
            }
            case UNKNOWN_MANIPULATION -> {
                scores.put(ThreatComponent.FAKE_TYPE_SCORE, NEUTRAL);
                risks.add("Unable to determine manipulation type with confidence");
            }
        }
    }

    /**
     * Confiança da avaliação: base 60, somando conforme os sinais presentes, limitada a 95.
     */
    static double confidence(Signal<ForensicsMetrics> forensics, Signal<MultiModalAnalysis> multimodal,
                             Signal<TimelineStats> timeline) {
        double confidence = 60;
        if (forensics.isAvailable()) {
            confidence += 15;
            if (forensics.get().frameCount() >= 50) {
                confidence += 5;
            }
        }
        if (multimodal.isAvailable()) {
            confidence += 10;
            if (multimodal.get().audioFeatures().isValid()) {
                confidence += 5;
            }
        }
        if (timeline.isAvailable()) {
            confidence += 5;
        }
        return Math.min(95, confidence);
    }

    private static String explanation(ThreatLevel level, double score, ThreatComponent top,
                                      Map<String, Double> componentScores, List<String> risks) {
        StringBuilder sb = new StringBuilder(level.getDescription());
        sb.append("\n\n").append(fmt("Overall threat score: %.1f/100. ", score));
        if (top != null) {
            sb.append(fmt("Primary concern: %s (%.1f/100).", top.getDisplayName(), componentScores.get(top.getKey())));
        }
        if (!risks.isEmpty()) {
            sb.append("\n\nKey risk factors: ")
                    .append(String.join("; ", risks.subList(0, Math.min(MAX_KEY_RISKS, risks.size()))));
        }
        return sb.toString();
    }

    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
