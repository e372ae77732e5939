package org.deeptrace;

import java.util.List;

/**
 * Série pronta para gráficos de linha: rótulos, timestamps (s), datasets em %,
 * marcadores de anomalia e as estatísticas.
 */
public record TimelineChart(
        List<String> labels,
        List<Double> timestamps,
        List<Dataset> datasets,
        List<AnomalyPoint> anomalies,
        TimelineStats statistics
) {

    public TimelineChart {
        labels = List.copyOf(labels);
        timestamps = List.copyOf(timestamps);
        datasets = List.copyOf(datasets);
        anomalies = List.copyOf(anomalies);
    }

    public static TimelineChart empty() {
        return new TimelineChart(List.of(), List.of(), List.of(), List.of(), null);
    }

    public record Dataset(
            String label,
            List<Double> data,
            String borderColor,
            String backgroundColor,
            List<Integer> borderDash,
            boolean fill,
            double tension
    ) {
        public Dataset {
            data = List.copyOf(data);
            borderDash = borderDash != null ? List.copyOf(borderDash) : null;
        }
    }

    public record AnomalyPoint(int x, double y) {
    }
}
