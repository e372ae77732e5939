package org.deeptrace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detector de piscadas para análise de vivacidade, baseado em uma aproximação
 * do eye aspect ratio (EAR) por frame.
 */
public class EyeBlinkDetector {

    public static final double EAR_THRESHOLD = 0.2;
    public static final int CONSECUTIVE_FRAMES = 2;

    private static final double UNDETECTED_EAR = 0.3;
    private static final double DEFAULT_EAR = 0.5;
    private static final double NORMAL_BLINKS_PER_MINUTE = 17.0;

    private final FaceDetector detector;
    private final List<Double> earHistory = new ArrayList<>();
    private int blinkCount;
    private int consecutiveClosed;
    private int frameCount;

    public EyeBlinkDetector(FaceDetector detector) {
        this.detector = detector;
    }

    public void reset() {
        earHistory.clear();
        blinkCount = 0;
        consecutiveClosed = 0;
        frameCount = 0;
    }

    public int getBlinkCount() {
        return blinkCount;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public BlinkObservation addFrame(RgbFrame frame) {
        frameCount++;
        Optional<Region> face = detector.largestFace(frame);
        if (face.isEmpty()) {
            return new BlinkObservation(0, null);
        }

        List<Region> eyes = detector.detectEyes(frame, face.get());
        if (eyes.size() < 2) {
            earHistory.add(UNDETECTED_EAR);
            consecutiveClosed++;
            if (consecutiveClosed >= CONSECUTIVE_FRAMES && earHistory.size() >= CONSECUTIVE_FRAMES + 2) {
                int end = earHistory.size() - CONSECUTIVE_FRAMES;
                double previousOpen = (earHistory.get(end - 2) + earHistory.get(end - 1)) / 2.0;
                if (previousOpen > EAR_THRESHOLD * 1.5) {
                    blinkCount++;
                    consecutiveClosed = 0;
                }
            }
            return new BlinkObservation(eyes.size(), UNDETECTED_EAR);
        }

        GrayImage gray = frame.toGray();
        double sum = 0;
        int used = Math.min(2, eyes.size());
        for (int i = 0; i < used; i++) {
            sum += eyeAspectRatio(gray, eyes.get(i));
        }
        double avgEar = sum / used;
        earHistory.add(avgEar);

        if (avgEar < EAR_THRESHOLD) {
            consecutiveClosed++;
        } else {
            if (consecutiveClosed >= CONSECUTIVE_FRAMES) {
                blinkCount++;
            }
            consecutiveClosed = 0;
        }
        return new BlinkObservation(eyes.size(), avgEar);
    }

    /**
     * Altura/largura da caixa do maior componente claro (limiar de Otsu) na região do olho.
     */
    static double eyeAspectRatio(GrayImage gray, Region eye) {
        Region r = eye.clip(gray.width(), gray.height());
        if (r.isEmpty()) {
            return DEFAULT_EAR;
        }
        GrayImage crop = gray.crop(r);
        List<ImageOps.Component> components = ImageOps.connectedComponents(
                ImageOps.otsuMask(crop), crop.width(), crop.height());
        if (components.isEmpty()) {
            return DEFAULT_EAR;
        }
        ImageOps.Component largest = components.get(0);
        for (ImageOps.Component c : components) {
            if (c.area() > largest.area()) {
                largest = c;
            }
        }
        Region box = largest.bounds();
        return box.width() == 0 ? DEFAULT_EAR : (double) box.height() / box.width();
    }

    public BlinkRate computeBlinkRate(double fps) {
        if (frameCount == 0) {
            return new BlinkRate(0.0, DetailedScore.withReason(50.0, "No frames processed"));
        }
        double durationSeconds = frameCount / fps;
        if (durationSeconds <= 0) {
            return new BlinkRate(0.0, DetailedScore.withReason(50.0, "Zero duration"));
        }

        double blinksPerSecond = blinkCount / durationSeconds;
        double blinksPerMinute = blinksPerSecond * 60;
        double score = blinkScore(blinksPerMinute);

        double[] ears = Stats.toArray(earHistory);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("blink_count", blinkCount);
        details.put("duration_seconds", durationSeconds);
        details.put("blinks_per_minute", blinksPerMinute);
        details.put("normal_range", "15-20 per minute");
        details.put("ear_mean", Stats.mean(ears));
        details.put("ear_std", Stats.std(ears));
        return new BlinkRate(blinksPerSecond, new DetailedScore(Stats.clipScore(score), details));
    }

    /**
     * Penaliza o desvio da taxa fisiológica (15-20/min), com punição maior
     * para taxas muito baixas ou muito altas.
     */
    static double blinkScore(double blinksPerMinute) {
        if (blinksPerMinute < 5) {
            return Math.max(0, 30 - (5 - blinksPerMinute) * 6);
        }
        if (blinksPerMinute > 40) {
            return Math.max(0, 50 - (blinksPerMinute - 40) * 2);
        }
        return Math.max(0, 100 - Math.abs(blinksPerMinute - NORMAL_BLINKS_PER_MINUTE) * 3);
    }

    /**
     * Olhos encontrados e EAR médio do frame (nulo quando não há rosto).
     */
    public record BlinkObservation(int eyesFound, Double ear) {
    }

    public record BlinkRate(double blinksPerSecond, DetailedScore score) {
    }
}
