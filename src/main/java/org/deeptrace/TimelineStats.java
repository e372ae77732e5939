package org.deeptrace;

/**
 * Estatísticas temporais da probabilidade de fake ao longo dos frames.
 */
public record TimelineStats(
        double meanFakeProbability,
        double stdFakeProbability,
        double maxFakeProbability,
        double minFakeProbability,
        double temporalVariance,
        double temporalConsistencyScore,
        int anomalyCount,
        double anomalyRatio,
        int totalFrames
) {

    public TimelineStats {
        ErrorHandler.checkScore("temporalConsistencyScore", temporalConsistencyScore);
        if (meanFakeProbability < 0 || meanFakeProbability > 1) {
            throw new IllegalArgumentException("meanFakeProbability fora de [0, 1]");
        }
    }

    /**
     * Estatísticas resumidas apenas com média e consistência, para entradas externas.
     */
    public static TimelineStats summary(double meanFakeProbability, double temporalConsistencyScore,
                                        double anomalyRatio, int totalFrames) {
        double variance = 0.5 * (1 - temporalConsistencyScore / 100);
        return new TimelineStats(meanFakeProbability, 0, meanFakeProbability, meanFakeProbability,
                variance, temporalConsistencyScore, (int) Math.round(anomalyRatio * totalFrames),
                anomalyRatio, totalFrames);
    }
}
