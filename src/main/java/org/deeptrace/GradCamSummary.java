package org.deeptrace;

import java.util.List;

/**
 * Resumo da sequência Grad-CAM gravada.
 */
public record GradCamSummary(int framesProcessed, double averageConfidence) {

    public static GradCamSummary of(List<Heatmap> heatmaps) {
        double sum = 0;
        for (Heatmap h : heatmaps) {
            sum += h.confidence();
        }
        return new GradCamSummary(heatmaps.size(), heatmaps.isEmpty() ? 0 : sum / heatmaps.size());
    }
}
