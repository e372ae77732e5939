package org.deeptrace;

/**
 * Opinião do classificador sobre um único frame.
 * Invariante: {@code fakeProbability + realProbability ≈ 1}.
 */
public record FrameProbability(
        int frameIndex,
        double fakeProbability,
        double realProbability,
        double timestampMs,
        boolean isAnomaly,
        double anomalyScore
) {

    private static final double SUM_TOLERANCE = 1e-6;

    public FrameProbability {
        if (!Double.isFinite(fakeProbability) || !Double.isFinite(realProbability)) {
            throw new IllegalArgumentException("Probabilidade não finita: fake=" + fakeProbability
                    + ", real=" + realProbability);
        }
        if (fakeProbability < 0 || fakeProbability > 1 || realProbability < 0 || realProbability > 1) {
            throw new IllegalArgumentException("Probabilidades fora de [0, 1]");
        }
        if (Math.abs(fakeProbability + realProbability - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("fake + real deve somar 1: " + (fakeProbability + realProbability));
        }
    }
}
