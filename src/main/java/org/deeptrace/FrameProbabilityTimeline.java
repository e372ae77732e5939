package org.deeptrace;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Probabilidade de fake por frame, com marcação de saltos bruscos entre frames
 * consecutivos, suavização e exportação para gráfico.
 *
 * <p>Estado por vídeo; {@link #reset()} antes de reutilizar.</p>
 */
public class FrameProbabilityTimeline {

    private static final Logger logger = Logger.getLogger(FrameProbabilityTimeline.class.getName());

    private double fps;
    private final double anomalyThreshold;
    private final int smoothingWindow;
    private final List<FrameProbability> frames = new ArrayList<>();

    public FrameProbabilityTimeline(double fps, double anomalyThreshold, int smoothingWindow) {
        if (fps <= 0) throw new IllegalArgumentException("fps deve ser > 0");
        if (smoothingWindow <= 0) throw new IllegalArgumentException("smoothingWindow deve ser > 0");
        this.fps = fps;
        this.anomalyThreshold = anomalyThreshold;
        this.smoothingWindow = smoothingWindow;
    }

    public FrameProbabilityTimeline(double fps) {
        this(fps, 0.3, 5);
    }

    /**
     * Timeline por frame a partir do classificador: backbone → pooling global → camada linear,
     * sem o estágio temporal, para isolar a opinião de cada frame.
     */
    public static FrameProbabilityTimeline fromClassifier(DeepfakeClassifier classifier, List<Tensor3> input,
                                                          double fps, double anomalyThreshold, int smoothingWindow) {
        FrameProbabilityTimeline timeline = new FrameProbabilityTimeline(fps, anomalyThreshold, smoothingWindow);
        synchronized (classifier) {
            for (int i = 0; i < input.size(); i++) {
                float[] pooled = classifier.backbone(input.get(i)).spatialMean();
                timeline.addFrame(i, classifier.linearHead(pooled), null);
            }
        }
        logger.info("📈 Timeline por frame: " + timeline.size() + " frames");
        return timeline;
    }

    public void reset() {
        frames.clear();
    }

    public int size() {
        return frames.size();
    }

    public double getFps() {
        return fps;
    }

    public List<FrameProbability> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    /**
     * Converte logits em probabilidades e anexa o frame.
     *
     * @param timestampMs nulo para derivar de {@code index / fps}
     */
    public FrameProbability addFrame(int frameIndex, float[] logits, Double timestampMs) {
        if (logits == null || logits.length == 0) {
            throw new IllegalArgumentException("logits vazio");
        }
        double fake;
        double real;
        if (logits.length == 1) {
            // Logit único interpretado como logit da classe FAKE
            fake = 1.0 / (1.0 + Math.exp(-logits[0]));
            real = 1.0 - fake;
        } else {
            double[] probs = Softmax.apply(logits);
            fake = probs[0];
            real = probs[1];
            if (logits.length > 2) {
                double sum = fake + real;
                fake /= sum;
                real /= sum;
            }
        }

        double ts = timestampMs != null ? timestampMs : frameIndex / fps * 1000;
        boolean anomaly = false;
        double anomalyScore = 0.0;
        if (!frames.isEmpty()) {
            double change = Math.abs(fake - frames.get(frames.size() - 1).fakeProbability());
            if (change > anomalyThreshold) {
                anomaly = true;
                anomalyScore = change;
            }
        }

        FrameProbability fp = new FrameProbability(frameIndex, fake, real, ts, anomaly, anomalyScore);
        frames.add(fp);
        if (anomaly) {
            logger.fine(() -> String.format("Anomalia no frame %d: Δ=%.3f", frameIndex, fp.anomalyScore()));
        }
        return fp;
    }

    /**
     * Anexa uma sequência de logits a partir de {@code startFrame}.
     *
     * @param fps nulo para manter o fps atual
     */
    public List<FrameProbability> addBatch(int startFrame, float[][] logitsSequence, Double fps) {
        if (fps != null) {
            if (fps <= 0) throw new IllegalArgumentException("fps deve ser > 0");
            this.fps = fps;
        }
        List<FrameProbability> added = new ArrayList<>();
        for (int i = 0; i < logitsSequence.length; i++) {
            added.add(addFrame(startFrame + i, logitsSequence[i], null));
        }
        return added;
    }

    /**
     * Média móvel centrada; séries menores que a janela são devolvidas sem alteração.
     */
    public List<Double> smoothedProbabilities() {
        List<Double> probs = new ArrayList<>();
        for (FrameProbability f : frames) {
            probs.add(f.fakeProbability());
        }
        if (probs.size() < smoothingWindow) {
            return probs;
        }
        int half = smoothingWindow / 2;
        List<Double> smoothed = new ArrayList<>();
        for (int i = 0; i < probs.size(); i++) {
            int start = Math.max(0, i - half);
            int end = Math.min(probs.size(), i + half + 1);
            double sum = 0;
            for (int j = start; j < end; j++) {
                sum += probs.get(j);
            }
            smoothed.add(sum / (end - start));
        }
        return smoothed;
    }

    public Signal<TimelineStats> temporalStats() {
        if (frames.isEmpty()) {
            return Signal.unavailable("Empty timeline");
        }
        double[] probs = new double[frames.size()];
        int anomalies = 0;
        for (int i = 0; i < probs.length; i++) {
            probs[i] = frames.get(i).fakeProbability();
            if (frames.get(i).isAnomaly()) {
                anomalies++;
            }
        }

        double variance = 0.0;
        if (probs.length > 1) {
            for (int i = 1; i < probs.length; i++) {
                variance += Math.abs(probs[i] - probs[i - 1]);
            }
            variance /= probs.length - 1;
        }
        double consistency = Math.max(0, 100 * (1 - variance / 0.5));

        return Signal.available(new TimelineStats(
                Stats.mean(probs),
                Stats.std(probs),
                Stats.max(probs),
                Stats.min(probs),
                variance,
                Stats.clipScore(consistency),
                anomalies,
                (double) anomalies / probs.length,
                probs.length));
    }

    public TimelineChart toChartData() {
        if (frames.isEmpty()) {
            return TimelineChart.empty();
        }
        List<String> labels = new ArrayList<>();
        List<Double> timestamps = new ArrayList<>();
        List<Double> fake = new ArrayList<>();
        List<Double> real = new ArrayList<>();
        List<TimelineChart.AnomalyPoint> anomalies = new ArrayList<>();
        for (FrameProbability f : frames) {
            labels.add("Frame " + f.frameIndex());
            timestamps.add(f.timestampMs() / 1000);
            fake.add(f.fakeProbability() * 100);
            real.add(f.realProbability() * 100);
            if (f.isAnomaly()) {
                anomalies.add(new TimelineChart.AnomalyPoint(f.frameIndex(), f.fakeProbability() * 100));
            }
        }
        List<Double> smoothed = new ArrayList<>();
        for (double p : smoothedProbabilities()) {
            smoothed.add(p * 100);
        }

        List<TimelineChart.Dataset> datasets = List.of(
                new TimelineChart.Dataset("Fake Probability (%)", fake,
                        "rgb(255, 99, 132)", "rgba(255, 99, 132, 0.2)", null, true, 0.1),
                new TimelineChart.Dataset("Real Probability (%)", real,
                        "rgb(75, 192, 192)", "rgba(75, 192, 192, 0.2)", null, true, 0.1),
                new TimelineChart.Dataset("Smoothed Fake Probability (%)", smoothed,
                        "rgb(255, 159, 64)", null, List.of(5, 5), false, 0.3));
        return new TimelineChart(labels, timestamps, datasets, anomalies, temporalStats().orElse(null));
    }

    /**
     * Exportação completa: frames, gráfico e metadados.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fps", fps);
        metadata.put("total_frames", frames.size());
        metadata.put("duration_seconds", fps > 0 ? frames.size() / fps : 0);
        metadata.put("generated_at", LocalDateTime.now().toString());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("frames", List.copyOf(frames));
        out.put("chart_data", toChartData());
        out.put("metadata", metadata);
        return out;
    }
}
