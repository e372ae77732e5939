package org.deeptrace;

import org.junit.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ThreatLevelScorerTest {

    private final ThreatLevelScorer scorer = new ThreatLevelScorer();

    static ForensicsMetrics forensics(double face, double blink, double stability, double artifacts,
                                      double overall, int frames) {
        return new ForensicsMetrics(face, 0.3, blink, stability, artifacts, 0.0, artifacts, overall,
                frames, frames, Map.of());
    }

    static MultiModalAnalysis multimodal(double spoof, double lipSync, double combined) {
        return new MultiModalAnalysis(AudioFeatures.invalid("no audio track"), null, spoof, lipSync, combined,
                60.0, Map.of());
    }

    private static FakeTypeResult fakeType(FakeType type, double confidence) {
        return new FakeTypeResult(type, confidence, Map.of(), List.of(), type.getExplanation(),
                type.getRecommendations());
    }

    @Test
    public void consistentAuthenticSignalsAreSafe() {
        ThreatAssessment assessment = scorer.assess(
                new ModelPrediction(PredictionLabel.REAL, 90),
                Signal.available(forensics(90, 80, 85, 10, 85, 60)),
                Signal.available(multimodal(20, 80, 80)),
                Signal.available(TimelineStats.summary(0.1, 90, 0.0, 100)),
                Signal.available(fakeType(FakeType.AUTHENTIC, 85)));

        assertEquals(13.25, assessment.overallScore(), 1e-9);
        assertEquals(ThreatLevel.SAFE, assessment.level());
        assertEquals("Safe", assessment.levelDisplay());
        assertTrue(assessment.unavailableComponents().isEmpty());
        assertEquals(10.0, assessment.componentScores().get("model_confidence"), 1e-9);
        assertEquals(15.0, assessment.componentScores().get("forensics_score"), 1e-9);
        assertEquals(20.0, assessment.componentScores().get("audio_score"), 1e-9);
        assertEquals(10.0, assessment.componentScores().get("temporal_score"), 1e-9);
        assertEquals(15.0, assessment.componentScores().get("fake_type_score"), 1e-9);
        assertTrue(assessment.mitigatingFactors().contains("Model detects REAL with high confidence (90.0%)"));
    }

    @Test
    public void missingComponentsAreRenormalized() {
        ThreatAssessment assessment = scorer.assess(
                new ModelPrediction(PredictionLabel.FAKE, 95),
                Signal.available(forensics(30, 20, 30, 70, 20, 60)),
                Signal.available(multimodal(70, 30, 25)),
                Signal.unavailable("no classifier"),
                Signal.unavailable("disabled"));

        assertEquals(86.0, assessment.overallScore(), 1e-9);
        assertEquals(ThreatLevel.CRITICAL, assessment.level());
        assertEquals(List.of("temporal_score", "fake_type_score"), assessment.unavailableComponents());
        assertEquals(50.0, assessment.componentScores().get("temporal_score"), 0.0);
        assertTrue(assessment.recommendations().contains("BLOCK: Do not publish or distribute this content"));
        assertTrue(assessment.recommendations().contains("Immediately escalate to security/legal team"));
        assertTrue(assessment.explanation().contains("Overall threat score: 86.0/100."));
        assertTrue(assessment.explanation().contains("Primary concern: model confidence (95.0/100)."));
        assertEquals("#dc3545", assessment.colorCode());
    }

    @Test
    public void nothingAvailableIsUnknown() {
        ThreatAssessment assessment = scorer.assess(ModelPrediction.unknown(),
                Signal.unavailable("a"), Signal.unavailable("b"), Signal.unavailable("c"), Signal.unavailable("d"));

        assertEquals(ThreatLevel.UNKNOWN, assessment.level());
        assertEquals(50.0, assessment.overallScore(), 0.0);
        assertEquals(5, assessment.unavailableComponents().size());
        assertEquals(60.0, assessment.confidence(), 0.0);
    }

    @Test
    public void confidenceGrowsWithSignals() {
        double confidence = ThreatLevelScorer.confidence(
                Signal.available(forensics(90, 80, 85, 10, 85, 50)),
                Signal.available(multimodal(20, 80, 80)),
                Signal.available(TimelineStats.summary(0.1, 90, 0.0, 100)));

        // 60 + 15 + 5 + 10 + 5, sem o bônus de áudio válido
        assertEquals(95.0, confidence, 0.0);
        assertEquals(75.0, ThreatLevelScorer.confidence(
                Signal.available(forensics(90, 80, 85, 10, 85, 10)),
                Signal.unavailable("x"), Signal.unavailable("y")), 0.0);
    }

    @Test
    public void weightsAreNormalized() {
        ThreatWeights weights = ThreatWeights.of(2, 2, 2, 2, 2);

        assertEquals(1.0, weights.sum(), 1e-12);
        assertEquals(0.2, weights.weight(ThreatComponent.AUDIO_SCORE), 1e-12);
        assertEquals(1.0, ThreatWeights.defaults().sum(), 1e-12);
    }

    @Test
    public void missingWeightsCountAsZero() {
        Map<ThreatComponent, Double> raw = new EnumMap<>(ThreatComponent.class);
        raw.put(ThreatComponent.MODEL_CONFIDENCE, 1.0);

        ThreatWeights weights = ThreatWeights.of(raw);

        assertEquals(1.0, weights.weight(ThreatComponent.MODEL_CONFIDENCE), 0.0);
        assertEquals(0.0, weights.weight(ThreatComponent.FORENSICS_SCORE), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeWeightIsRejected() {
        ThreatWeights.of(0.5, -0.1, 0.2, 0.2, 0.2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroWeightsAreRejected() {
        ThreatWeights.of(0, 0, 0, 0, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void thresholdsMustAscend() {
        new ThreatThresholds(60, 40, 80);
    }

    @Test
    public void levelBoundariesAreInclusive() {
        ThreatThresholds thresholds = ThreatThresholds.defaults();

        assertEquals(ThreatLevel.SAFE, thresholds.levelFor(25));
        assertEquals(ThreatLevel.SUSPICIOUS, thresholds.levelFor(25.01));
        assertEquals(ThreatLevel.HIGH_RISK, thresholds.levelFor(80));
        assertEquals(ThreatLevel.CRITICAL, thresholds.levelFor(80.5));
    }
}
