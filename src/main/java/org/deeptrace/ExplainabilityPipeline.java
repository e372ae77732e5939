package org.deeptrace;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Orquestra as análises de explicabilidade de um vídeo depois da inferência do classificador.
 *
 * <p>Cada estágio produz um {@link Signal}; falhas e estouros de tempo viram sinais indisponíveis
 * registrados no log de estágios, e a avaliação segue com confiança reduzida. Só erros de entrada
 * (vídeo que não abre ou não decodifica) encerram a análise, com um relatório de erro.
 * Se a inferência do classificador falhar, a predição vira UNKNOWN e os estágios que
 * dependem do modelo ficam indisponíveis.
 * Falha na captura do Grad-CAM é erro de ligação e é propagada.</p>
 *
 * <p>Cada chamada de {@link #analyze(AnalysisRequest)} monta seu próprio conjunto de analisadores,
 * então uma instância pode ser compartilhada entre threads.</p>
 */
public class ExplainabilityPipeline implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ExplainabilityPipeline.class.getName());

    private final DeepTraceConfig config;
    private final VideoFrameReader frameReader;
    private final ExecutorService stageExecutor;

    public ExplainabilityPipeline(DeepTraceConfig config, VideoFrameReader frameReader) {
        this.config = config;
        this.frameReader = frameReader;
        this.stageExecutor = Executors.newCachedThreadPool(new StageThreadFactory());
    }

    public ExplainabilityPipeline(DeepTraceConfig config) {
        this(config, new VideoFrameReader(config));
    }

    public ExplainabilityReport analyze(AnalysisRequest request) throws InterruptedException {
        long start = System.nanoTime();
        String timestamp = LocalDateTime.now().toString();
        String videoName = request.videoName();
        Path outputDir = config.outputDir();
        AnalysisAuditLog audit = new AnalysisAuditLog(outputDir.resolve(videoName + "_analysis.log"));
        audit.analysisStart(videoName);
        logger.info("🎬 Iniciando análise de explicabilidade: " + videoName);

        ModelPrediction prediction = request.prediction() != null ? request.prediction() : ModelPrediction.unknown();
        int maxFrames = request.maxFrames() != null ? request.maxFrames() : config.maxFrames();

        // Entrada: sondagem e decodificação. Falha aqui é fatal para a análise.
        VideoInfo info;
        List<RgbFrame> frames;
        try {
            if (request.frames() != null) {
                if (request.frames().isEmpty()) {
                    throw new MediaAccessException("Nenhum frame fornecido para análise");
                }
                frames = request.frames().size() > maxFrames
                        ? request.frames().subList(0, maxFrames) : request.frames();
                double frameFps = request.fps() != null ? request.fps() : config.defaultFps();
                info = new VideoInfo(frames.get(0).width(), frames.get(0).height(),
                        frameFps, frames.size(), frames.size() / frameFps);
            } else {
                ErrorHandler.checkMediaFile(request.video(), "Vídeo");
                info = frameReader.probe(request.video());
                frames = needsFrames(request) ? frameReader.readFrames(request.video(), info, maxFrames) : List.of();
            }
        } catch (IOException e) {
            logger.severe("❌ Entrada inválida: " + e.getMessage());
            audit.criticalError("input", e.getMessage());
            double durationMs = elapsedMs(start);
            audit.analysisSummary(durationMs);
            return ExplainabilityReport.failed(videoName, prediction, e.getMessage(), audit.getOutcomes(),
                    timestamp, durationMs);
        }
        audit.event("INPUT", info + " | frames carregados: " + frames.size());
        double fps = info.fps();

        List<Tensor3> tensors = request.inputTensors();
        DeepfakeClassifier classifier = request.classifier();
        String inferenceFailure = null;
        if (classifier != null) {
            // Falha do modelo só derruba os estágios que dependem dele
            try {
                if (tensors == null && !frames.isEmpty()) {
                    tensors = new FramePreprocessor(config).toTensors(frames);
                }
                if (request.prediction() == null && tensors != null && !tensors.isEmpty()) {
                    float[] logits;
                    synchronized (classifier) {
                        logits = classifier.forward(tensors);
                    }
                    prediction = ModelPrediction.fromLogits(logits);
                    audit.event("PREDICTION", prediction.label() + " "
                            + String.format(Locale.ROOT, "%.1f%%", prediction.confidence()));
                }
            } catch (RuntimeException e) {
                inferenceFailure = "Classifier inference failed: " + e.getMessage();
                logger.log(Level.WARNING, "⚠️ " + inferenceFailure, e);
                audit.event("PREDICTION", inferenceFailure);
                if (request.prediction() == null) {
                    prediction = ModelPrediction.unknown();
                }
            }
        }
        final List<Tensor3> input = tensors;
        final List<RgbFrame> decoded = frames;
        final String modelFailure = inferenceFailure;

        // Grad-CAM
        Signal<List<Heatmap>> heatmaps = runStage(request, AnalysisStage.GRADCAM, audit, () -> {
            if (modelFailure != null) {
                return Signal.unavailable(modelFailure);
            }
            if (classifier == null || input == null || input.isEmpty() || decoded.isEmpty()) {
                return Signal.unavailable("Classifier, input tensors and frames are required");
            }
            try (GradCamExplainer explainer = new GradCamExplainer(classifier)) {
                int length = Math.min(input.size(), decoded.size());
                return Signal.available(explainer.generateSequence(input, decoded.subList(0, length),
                        outputDir.resolve("gradcam"), videoName, config.gradCamAlpha()));
            }
        });

        // Timeline
        Signal<FrameProbabilityTimeline> timeline = runStage(request, AnalysisStage.TIMELINE, audit, () -> {
            if (modelFailure != null) {
                return Signal.unavailable(modelFailure);
            }
            if (classifier == null || input == null || input.isEmpty()) {
                return Signal.unavailable("Classifier and input tensors are required");
            }
            return Signal.available(FrameProbabilityTimeline.fromClassifier(classifier, input, fps,
                    config.timelineAnomalyThreshold(), config.timelineSmoothingWindow()));
        });
        Signal<TimelineStats> timelineStats = timeline.isAvailable()
                ? timeline.get().temporalStats() : Signal.unavailable(timeline.reason());

        // Forense visual
        FaceDetector detector = new SkinToneFaceDetector();
        Signal<ForensicsMetrics> forensics = runStage(request, AnalysisStage.FORENSICS, audit, () -> {
            if (decoded.isEmpty()) {
                return Signal.unavailable("No frames decoded");
            }
            ForensicsAnalyzer analyzer = new ForensicsAnalyzer(fps, detector, frameReader);
            return Signal.available(analyzer.analyzeFrames(decoded));
        });

        // Multimodal
        Signal<MultiModalAnalysis> multimodal = runStage(request, AnalysisStage.MULTIMODAL, audit, () -> {
            if (request.video() == null) {
                return Signal.unavailable("No video file for audio extraction");
            }
            AudioAnalyzer audioAnalyzer = new AudioAnalyzer(config);
            AudioVideoAnalyzer analyzer = new AudioVideoAnalyzer(audioAnalyzer,
                    new LipSyncAnalyzer(detector, frameReader), maxFrames);
            AudioFeatures audio = audioAnalyzer.analyzeAudio(request.video());
            return Signal.available(analyzer.analyze(audio, decoded, fps));
        });

        // Tipo de fake
        final ModelPrediction verdict = prediction;
        Signal<FakeTypeResult> fakeType = runStage(request, AnalysisStage.CLASSIFICATION, audit, () ->
                Signal.available(new FakeTypeClassifier(config.fakeTypeThresholds())
                        .classify(verdict, forensics, multimodal, timelineStats)));

        // Nível de ameaça
        Signal<ThreatAssessment> threat = runStage(request, AnalysisStage.THREAT, audit, () ->
                Signal.available(new ThreatLevelScorer(config)
                        .assess(verdict, forensics, multimodal, timelineStats, fakeType)));

        List<String> images = new ArrayList<>();
        heatmaps.toOptional().ifPresent(list -> list.forEach(h -> images.add(h.savedPath().toString())));

        double durationMs = elapsedMs(start);
        audit.analysisSummary(durationMs);
        ExplainabilityReport report = new ExplainabilityReport(
                videoName,
                info,
                prediction.label(),
                prediction.confidence(),
                images,
                heatmaps.map(GradCamSummary::of).orElse(null),
                timeline.map(FrameProbabilityTimeline::toChartData).orElse(TimelineChart.empty()),
                timelineStats.orElse(null),
                forensics.orElse(null),
                forensics.map(ForensicsSummary::text).orElse(""),
                multimodal.orElse(null),
                multimodal.map(MultiModalAnalysis::combinedScore).orElse(50.0),
                fakeType.orElse(null),
                threat.orElse(null),
                audit.getOutcomes(),
                null,
                timestamp,
                durationMs);
        logger.info(String.format(Locale.ROOT, "✅ Análise concluída: %s | ameaça %s (%.1f) | %.0fms",
                videoName, report.threatLevel().getDisplayName(), report.threatScore(), durationMs));
        return report;
    }

    @Override
    public void close() {
        stageExecutor.shutdownNow();
    }

    private static boolean needsFrames(AnalysisRequest request) {
        return request.isEnabled(AnalysisStage.GRADCAM) || request.isEnabled(AnalysisStage.FORENSICS)
                || request.isEnabled(AnalysisStage.MULTIMODAL)
                || (request.classifier() != null && request.inputTensors() == null);
    }

    /**
     * Executa um estágio no executor, com o orçamento de tempo configurado.
     */
    private <T> Signal<T> runStage(AnalysisRequest request, AnalysisStage stage, AnalysisAuditLog audit,
                                   StageTask<T> task) throws InterruptedException {
        if (!request.isEnabled(stage)) {
            audit.stage(new StageOutcome(stage, StageOutcome.Status.SKIPPED, "disabled", 0));
            return Signal.unavailable(stage.getDisplayName() + " disabled");
        }

        long start = System.nanoTime();
        Future<Signal<T>> future = stageExecutor.submit(task);

        int timeout = config.stageTimeoutSeconds();
        try {
            Signal<T> result = timeout > 0 ? future.get(timeout, TimeUnit.SECONDS) : future.get();
            long ms = Math.round(elapsedMs(start));
            if (result.isAvailable()) {
                audit.stage(new StageOutcome(stage, StageOutcome.Status.COMPLETED, null, ms));
            } else {
                logger.warning("⚠️ " + stage.getDisplayName() + " indisponível: " + result.reason());
                audit.stage(new StageOutcome(stage, StageOutcome.Status.UNAVAILABLE, result.reason(), ms));
            }
            return result;
        } catch (TimeoutException e) {
            // Interrompe o worker para liberar o lock do classificador
            future.cancel(true);
            String reason = stage.getDisplayName() + " timed out after " + timeout + "s";
            logger.warning("⚠️ " + reason);
            audit.stage(new StageOutcome(stage, StageOutcome.Status.TIMED_OUT, reason, Math.round(elapsedMs(start))));
            return Signal.unavailable(reason);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (stage == AnalysisStage.GRADCAM && cause instanceof IllegalStateException ise) {
                audit.criticalError(stage.getDisplayName(), ise.getMessage());
                throw ise;
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw (InterruptedException) cause;
            }
            String reason = stage.getDisplayName() + " failed: " + cause.getMessage();
            logger.log(Level.WARNING, "⚠️ " + reason, cause);
            audit.stage(new StageOutcome(stage, StageOutcome.Status.FAILED, reason, Math.round(elapsedMs(start))));
            return Signal.unavailable(reason);
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    @FunctionalInterface
    private interface StageTask<T> extends Callable<Signal<T>> {
    }

    private static final class StageThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "deeptrace-stage-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
