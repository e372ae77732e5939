package org.deeptrace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Consistência do rosto principal ao longo do vídeo: aparência (histograma),
 * tamanho e movimento do centro entre frames consecutivos.
 *
 * <p>Acumula estado por vídeo; chamar {@link #reset()} antes de reutilizar.</p>
 */
public class FaceConsistencyAnalyzer {

    private static final int FACE_SIZE = 64;
    private static final int HISTOGRAM_BINS = 64;

    private final FaceDetector detector;
    private final List<double[]> faceFeatures = new ArrayList<>();
    private final List<Integer> faceWidths = new ArrayList<>();
    private final List<int[]> faceCenters = new ArrayList<>();

    public FaceConsistencyAnalyzer(FaceDetector detector) {
        this.detector = detector;
    }

    public void reset() {
        faceFeatures.clear();
        faceWidths.clear();
        faceCenters.clear();
    }

    /**
     * Registra o maior rosto do frame; vazio quando nenhum rosto é encontrado.
     */
    public Optional<FaceObservation> addFrame(RgbFrame frame) {
        Optional<Region> largest = detector.largestFace(frame);
        if (largest.isEmpty()) {
            return Optional.empty();
        }
        Region face = largest.get();
        if (face.isEmpty()) {
            return Optional.empty();
        }

        GrayImage crop = frame.toGray().crop(face).resize(FACE_SIZE, FACE_SIZE).quantize();
        faceFeatures.add(ImageOps.normalizedHistogram(crop, HISTOGRAM_BINS));
        faceWidths.add(face.width());
        int cx = face.x() + face.width() / 2;
        int cy = face.y() + face.height() / 2;
        faceCenters.add(new int[]{cx, cy});

        return Optional.of(new FaceObservation(face, cx, cy));
    }

    public int facesDetected() {
        return faceFeatures.size();
    }

    public DetailedScore computeConsistencyScore() {
        if (faceFeatures.size() < 2) {
            return DetailedScore.withReason(100.0, "Insufficient frames for analysis");
        }

        double[] similarities = new double[faceFeatures.size() - 1];
        for (int i = 1; i < faceFeatures.size(); i++) {
            double corr = ImageOps.histogramCorrelation(faceFeatures.get(i), faceFeatures.get(i - 1));
            similarities[i - 1] = Math.max(0, corr);
        }
        double meanSimilarity = Stats.mean(similarities);

        double[] widths = new double[faceWidths.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = faceWidths.get(i);
        }
        double sizeVariance = Stats.std(widths) / (Stats.mean(widths) + 1e-6);

        double[] movements = new double[faceCenters.size() - 1];
        for (int i = 1; i < faceCenters.size(); i++) {
            int[] a = faceCenters.get(i - 1);
            int[] b = faceCenters.get(i);
            movements[i - 1] = Math.hypot(b[0] - a[0], b[1] - a[1]);
        }
        double movementVariance = Stats.std(movements) / (Stats.mean(movements) + 1e-6);

        double featureScore = meanSimilarity * 100;
        double sizeScore = Math.max(0, 100 - sizeVariance * 200);
        double positionScore = Math.max(0, 100 - movementVariance * 50);
        double score = featureScore * 0.5 + sizeScore * 0.25 + positionScore * 0.25;

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("feature", featureScore);
        components.put("size", sizeScore);
        components.put("position", positionScore);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mean_feature_similarity", meanSimilarity);
        details.put("size_variance_ratio", sizeVariance);
        details.put("movement_variance_ratio", movementVariance);
        details.put("component_scores", components);
        details.put("frames_analyzed", faceFeatures.size());
        return new DetailedScore(Stats.clipScore(score), details);
    }

    /**
     * Rosto encontrado em um frame e seu centro inteiro.
     */
    public record FaceObservation(Region box, int centerX, int centerY) {
    }
}
