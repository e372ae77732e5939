package org.deeptrace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Artefatos de compressão: blocagem na grade 8x8 e anomalias no perfil radial
 * do espectro de frequências. Valores maiores são mais suspeitos.
 */
public class CompressionArtifactDetector {

    private static final int BLOCK_SIZE = 8;
    private static final int SPECTRUM_SIZE = 256;
    private static final int RING_STEP = 5;
    private static final double RING_HALF_WIDTH = 2.5;

    private final List<Double> blockinessValues = new ArrayList<>();
    private final List<Double> frequencyAnomalies = new ArrayList<>();

    public void reset() {
        blockinessValues.clear();
        frequencyAnomalies.clear();
    }

    public ArtifactObservation addFrame(RgbFrame frame) {
        GrayImage gray = frame.toGray();
        double blockiness = blockiness(gray, BLOCK_SIZE);
        double anomaly = frequencyAnomaly(gray.resize(SPECTRUM_SIZE, SPECTRUM_SIZE).quantize());
        blockinessValues.add(blockiness);
        frequencyAnomalies.add(anomaly);
        return new ArtifactObservation(blockiness, anomaly);
    }

    /**
     * Razão média entre a descontinuidade nas bordas de bloco e a descontinuidade
     * no interior do bloco, por linha e por coluna.
     */
    static double blockiness(GrayImage gray, int blockSize) {
        int hBlocks = gray.height() / blockSize;
        int wBlocks = gray.width() / blockSize;
        if (hBlocks < 2 || wBlocks < 2) {
            return 0.0;
        }
        int h = hBlocks * blockSize;
        int w = wBlocks * blockSize;
        int half = blockSize / 2;

        double hDiff = 0;
        for (int i = 1; i < hBlocks; i++) {
            int row = i * blockSize;
            double boundary = 0;
            double internal = 0;
            for (int x = 0; x < w; x++) {
                boundary += Math.abs(gray.get(x, row) - gray.get(x, row - 1));
                internal += Math.abs(gray.get(x, row - half) - gray.get(x, row - half - 1));
            }
            hDiff += (boundary / w) / (internal / w + 1e-6);
        }

        double vDiff = 0;
        for (int j = 1; j < wBlocks; j++) {
            int col = j * blockSize;
            double boundary = 0;
            double internal = 0;
            for (int y = 0; y < h; y++) {
                boundary += Math.abs(gray.get(col, y) - gray.get(col - 1, y));
                internal += Math.abs(gray.get(col - half, y) - gray.get(col - half - 1, y));
            }
            vDiff += (boundary / h) / (internal / h + 1e-6);
        }
        return (hDiff / hBlocks + vDiff / wBlocks) / 2;
    }

    /**
     * Irregularidade do perfil radial do log-espectro: desvio padrão das diferenças
     * entre anéis consecutivos dividido pela magnitude média do perfil.
     */
    static double frequencyAnomaly(GrayImage gray) {
        double[][] magnitude = Fft.shiftedMagnitude(gray);
        int size = magnitude.length;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : magnitude) {
            for (int x = 0; x < row.length; x++) {
                row[x] = Math.log(row[x] + 1);
                min = Math.min(min, row[x]);
                max = Math.max(max, row[x]);
            }
        }
        double range = max - min + 1e-6;

        // Os anéis [r - 2.5, r + 2.5) são contíguos: cada pixel cai em no máximo um
        int center = size / 2;
        int rings = (center - 1) / RING_STEP;
        double[] ringSum = new double[rings + 1];
        int[] ringCount = new int[rings + 1];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                double r = Math.hypot(x - center, y - center);
                int ring = (int) Math.floor((r + RING_HALF_WIDTH) / RING_STEP);
                if (ring >= 1 && ring <= rings) {
                    ringSum[ring] += (magnitude[y][x] - min) / range;
                    ringCount[ring]++;
                }
            }
        }
        List<Double> profile = new ArrayList<>();
        for (int ring = 1; ring <= rings; ring++) {
            if (ringCount[ring] > 0) {
                profile.add(ringSum[ring] / ringCount[ring]);
            }
        }
        if (profile.size() < 3) {
            return 0.0;
        }

        double[] values = Stats.toArray(profile);
        double[] diffs = new double[values.length - 1];
        double meanAbs = 0;
        for (int i = 0; i < values.length; i++) {
            meanAbs += Math.abs(values[i]);
            if (i > 0) {
                diffs[i - 1] = Math.abs(values[i] - values[i - 1]);
            }
        }
        meanAbs /= values.length;
        return Stats.std(diffs) / (meanAbs + 1e-6);
    }

    public ArtifactScores computeArtifactScore() {
        if (blockinessValues.isEmpty()) {
            return new ArtifactScores(0.0, 0.0, 0.0, Map.of("reason", "No frames analyzed"));
        }
        double[] blocks = Stats.toArray(blockinessValues);
        double[] freqs = Stats.toArray(frequencyAnomalies);
        double meanBlockiness = Stats.mean(blocks);
        double meanFrequency = Stats.mean(freqs);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mean_blockiness", meanBlockiness);
        details.put("std_blockiness", Stats.std(blocks));
        details.put("mean_frequency_anomaly", meanFrequency);
        details.put("std_frequency_anomaly", Stats.std(freqs));
        details.put("frames_analyzed", blocks.length);
        return new ArtifactScores(Math.min(100, meanBlockiness * 30), Math.min(100, meanFrequency * 100),
                meanBlockiness, details);
    }

    public record ArtifactObservation(double blockiness, double frequencyAnomaly) {
    }

    /**
     * Scores de blocagem e de frequência (0-100) e o índice bruto de blocagem médio.
     */
    public record ArtifactScores(double blockinessScore, double frequencyScore, double meanBlockiness,
                                 Map<String, Object> details) {

        public ArtifactScores {
            details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
        }

        public double combined() {
            return (blockinessScore + frequencyScore) / 2;
        }
    }
}
