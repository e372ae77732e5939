package org.deeptrace;

import java.util.Collections;
import java.util.List;

/**
 * Características de áudio usadas como indicadores de voz sintética.
 * {@code pitchVarianceScore} e {@code jitterScore}: 0-100, maior = mais suspeito.
 */
public record AudioFeatures(
        double durationSeconds,
        int sampleRate,
        double pitchMean,
        double pitchStd,
        double pitchVarianceScore,
        double jitterMean,
        double jitterScore,
        List<Double> energyProfile,
        double zeroCrossingRate,
        double spectralCentroidMean,
        boolean isValid,
        String errorMessage
) {

    public AudioFeatures {
        energyProfile = energyProfile != null ? List.copyOf(energyProfile) : Collections.emptyList();
        ErrorHandler.checkScore("pitchVarianceScore", pitchVarianceScore);
        ErrorHandler.checkScore("jitterScore", jitterScore);
        if (!isValid && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("Áudio inválido exige errorMessage");
        }
    }

    /**
     * Resultado neutro para quando não há áudio utilizável.
     */
    public static AudioFeatures invalid(String errorMessage) {
        return new AudioFeatures(0, 0, 0, 0, 50, 0, 50, List.of(), 0, 0, false, errorMessage);
    }

    /**
     * Score de falsificação de áudio: média dos scores de pitch e jitter, ou 50 sem áudio válido.
     */
    public double spoofScore() {
        return isValid ? pitchVarianceScore * 0.5 + jitterScore * 0.5 : 50.0;
    }
}
