package org.deeptrace;

import java.util.List;

/**
 * Resultado agregado de uma análise. Seções de estágios indisponíveis ficam nulas;
 * o motivo está em {@code stageLog}. Quando {@code error} está presente, a entrada não
 * pôde ser aberta ou decodificada e nenhuma seção foi calculada.
 */
public record ExplainabilityReport(
        String videoName,
        VideoInfo videoInfo,
        PredictionLabel predictionLabel,
        double predictionConfidence,
        List<String> gradcamImages,
        GradCamSummary gradcamSummary,
        TimelineChart timelineData,
        TimelineStats timelineStats,
        ForensicsMetrics forensicsMetrics,
        String forensicsSummary,
        MultiModalAnalysis multimodalAnalysis,
        double audioVideoScore,
        FakeTypeResult fakeType,
        ThreatAssessment threat,
        List<StageOutcome> stageLog,
        String error,
        String analysisTimestamp,
        double analysisDurationMs
) {

    public ExplainabilityReport {
        gradcamImages = gradcamImages != null ? List.copyOf(gradcamImages) : List.of();
        stageLog = stageLog != null ? List.copyOf(stageLog) : List.of();
    }

    /**
     * Relatório de erro de entrada: seções vazias e scores neutros.
     */
    public static ExplainabilityReport failed(String videoName, ModelPrediction prediction, String error,
                                              List<StageOutcome> stageLog, String timestamp, double durationMs) {
        return new ExplainabilityReport(videoName, null, prediction.label(), prediction.confidence(),
                List.of(), null, TimelineChart.empty(), null, null, "", null, 50.0, null, null,
                stageLog, error, timestamp, durationMs);
    }

    public boolean isSuccessful() {
        return error == null;
    }

    public ThreatLevel threatLevel() {
        return threat != null ? threat.level() : ThreatLevel.UNKNOWN;
    }

    public double threatScore() {
        return threat != null ? threat.overallScore() : 50.0;
    }

    public String threatColor() {
        return threatLevel().getColorCode();
    }
}
