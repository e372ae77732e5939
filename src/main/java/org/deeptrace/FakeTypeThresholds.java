package org.deeptrace;

/**
 * Limiares das regras do {@link FakeTypeClassifier}.
 */
public record FakeTypeThresholds(
        double faceConsistency,
        double temporalStability,
        double lipSync,
        double artifact,
        double blinkScore,
        double audioSpoof,
        double lipSyncCorrelation,
        double temporalVariance,
        double anomalyRatio,
        double meanFakeProbability,
        double realModelConfidence
) {

    public FakeTypeThresholds {
        ErrorHandler.checkScore("faceConsistency", faceConsistency);
        ErrorHandler.checkScore("temporalStability", temporalStability);
        ErrorHandler.checkScore("lipSync", lipSync);
        ErrorHandler.checkScore("artifact", artifact);
        ErrorHandler.checkScore("realModelConfidence", realModelConfidence);
    }

    /**
     * Limiares configuráveis por propriedade; os demais ficam nos padrões.
     */
    public FakeTypeThresholds(double faceConsistency, double temporalStability, double lipSync, double artifact) {
        this(faceConsistency, temporalStability, lipSync, artifact, 30, 60, 0.3, 0.15, 0.2, 0.8, 70);
    }

    public static FakeTypeThresholds defaults() {
        return new FakeTypeThresholds(60, 55, 40, 50);
    }
}
