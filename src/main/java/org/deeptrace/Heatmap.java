package org.deeptrace;

import java.nio.file.Path;

/**
 * Explicação Grad-CAM de um frame: mapa de saliência normalizado [0,1] na resolução do
 * backbone, mapa colorido (JET) e sobreposição na resolução do frame original.
 *
 * @param savedPath arquivo PNG da sobreposição, ou nulo se não foi gravado
 */
public record Heatmap(
        int frameIndex,
        float[][] saliency,
        RgbFrame colored,
        RgbFrame overlay,
        PredictionLabel predictedLabel,
        double confidence,
        Path savedPath
) {

    public Heatmap {
        if (saliency == null || colored == null || overlay == null || predictedLabel == null) {
            throw new IllegalArgumentException("Campos obrigatórios do heatmap ausentes");
        }
        ErrorHandler.checkScore("confidence", confidence);
    }

    Heatmap withSavedPath(Path path) {
        return new Heatmap(frameIndex, saliency, colored, overlay, predictedLabel, confidence, path);
    }
}
