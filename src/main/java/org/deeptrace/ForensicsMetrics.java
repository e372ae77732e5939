package org.deeptrace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resultado completo da análise forense visual de um vídeo.
 * Scores 0-100; {@code eyeBlinkRate} em piscadas por segundo.
 * Em {@code compressionArtifactScore}, valores maiores são mais suspeitos;
 * nos demais scores, valores maiores indicam conteúdo mais autêntico.
 */
public record ForensicsMetrics(
        double faceConsistencyScore,
        double eyeBlinkRate,
        double eyeBlinkScore,
        double temporalStabilityScore,
        double compressionArtifactScore,
        double blockinessIndex,
        double frequencyAnomalyScore,
        double overallForensicsScore,
        int frameCount,
        int facesDetected,
        Map<String, Map<String, Object>> analysisDetails
) {

    public ForensicsMetrics {
        ErrorHandler.checkScore("faceConsistencyScore", faceConsistencyScore);
        ErrorHandler.checkScore("eyeBlinkScore", eyeBlinkScore);
        ErrorHandler.checkScore("temporalStabilityScore", temporalStabilityScore);
        ErrorHandler.checkScore("compressionArtifactScore", compressionArtifactScore);
        ErrorHandler.checkScore("frequencyAnomalyScore", frequencyAnomalyScore);
        ErrorHandler.checkScore("overallForensicsScore", overallForensicsScore);
        if (eyeBlinkRate < 0) throw new IllegalArgumentException("eyeBlinkRate deve ser >= 0");
        if (frameCount < 0 || facesDetected < 0) throw new IllegalArgumentException("contagens devem ser >= 0");
        analysisDetails = analysisDetails != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(analysisDetails))
                : Map.of();
    }

    /**
     * Overall = 0.25 rosto + 0.20 piscadas + 0.25 estabilidade + 0.30 (100 - artefatos).
     */
    public static double overallScore(double face, double blink, double stability, double artifacts) {
        return Stats.clipScore(face * 0.25 + blink * 0.20 + stability * 0.25 + (100 - artifacts) * 0.30);
    }

    /**
     * Métricas apenas com os scores agregados, para quem as recebe de outra fonte.
     */
    public static ForensicsMetrics ofScores(double face, double blink, double stability, double artifacts,
                                            int frameCount) {
        return new ForensicsMetrics(face, 0.0, blink, stability, artifacts, 0.0, artifacts,
                overallScore(face, blink, stability, artifacts), frameCount, 0, Map.of());
    }
}
