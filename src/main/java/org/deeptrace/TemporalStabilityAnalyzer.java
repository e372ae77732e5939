package org.deeptrace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Estabilidade temporal: consistência do fluxo óptico e SSIM entre frames consecutivos,
 * normalizados para 256x256 em tons de cinza.
 */
public class TemporalStabilityAnalyzer {

    private static final int ANALYSIS_SIZE = 256;

    private final OpticalFlow opticalFlow;
    private final List<Double> flowMagnitudes = new ArrayList<>();
    private final List<Double> ssimValues = new ArrayList<>();
    private GrayImage previous;

    public TemporalStabilityAnalyzer() {
        this(new OpticalFlow());
    }

    public TemporalStabilityAnalyzer(OpticalFlow opticalFlow) {
        this.opticalFlow = opticalFlow;
    }

    public void reset() {
        previous = null;
        flowMagnitudes.clear();
        ssimValues.clear();
    }

    public StabilityObservation addFrame(RgbFrame frame) {
        GrayImage gray = frame.toGray().resize(ANALYSIS_SIZE, ANALYSIS_SIZE).quantize();
        if (previous == null) {
            previous = gray;
            return new StabilityObservation(0.0, 1.0);
        }

        double magnitude = opticalFlow.meanMagnitude(previous, gray);
        double ssim = Ssim.mean(previous, gray);
        flowMagnitudes.add(magnitude);
        ssimValues.add(ssim);
        previous = gray;
        return new StabilityObservation(magnitude, ssim);
    }

    public DetailedScore computeStabilityScore() {
        if (flowMagnitudes.size() < 2) {
            return DetailedScore.withReason(100.0, "Insufficient frames");
        }

        double[] flows = Stats.toArray(flowMagnitudes);
        double[] ssims = Stats.toArray(ssimValues);
        double flowMean = Stats.mean(flows);
        double flowStd = Stats.std(flows);
        double flowCv = flowStd / (flowMean + 1e-6);
        double ssimMean = Stats.mean(ssims);
        double ssimStd = Stats.std(ssims);

        double flowScore = Math.max(0, 100 - flowCv * 100);
        double ssimScore = ssimMean * 100;
        double ssimConsistency = Math.max(0, 100 - ssimStd * 500);
        double score = flowScore * 0.3 + ssimScore * 0.4 + ssimConsistency * 0.3;

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("flow_consistency", flowScore);
        components.put("ssim_quality", ssimScore);
        components.put("ssim_consistency", ssimConsistency);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("flow_mean", flowMean);
        details.put("flow_std", flowStd);
        details.put("flow_coefficient_variation", flowCv);
        details.put("ssim_mean", ssimMean);
        details.put("ssim_std", ssimStd);
        details.put("component_scores", components);
        return new DetailedScore(Stats.clipScore(score), details);
    }

    public record StabilityObservation(double flowMagnitude, double ssim) {
    }
}
