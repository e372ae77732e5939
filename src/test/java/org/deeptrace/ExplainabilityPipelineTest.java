package org.deeptrace;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ExplainabilityPipelineTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path outputDir;
    private ExplainabilityPipeline pipeline;

    @Before
    public void setUp() {
        outputDir = folder.getRoot().toPath().resolve("out");
        DeepTraceConfig config = DeepTraceConfig.defaults()
                .with("output.dir", outputDir.toString())
                .with("gradcam.input.size", "16");
        pipeline = new ExplainabilityPipeline(config);
    }

    @After
    public void tearDown() {
        pipeline.close();
    }

    private static List<RgbFrame> frames(int count) {
        List<RgbFrame> frames = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            frames.add(SyntheticMedia.texturedFrame(i));
        }
        return frames;
    }

    private static final float[][] CHANNEL_ZERO = {{1, 0, 0}, {-1, 0, 0}};

    private static StageOutcome.Status statusOf(ExplainabilityReport report, AnalysisStage stage) {
        return report.stageLog().stream()
                .filter(o -> o.stage() == stage)
                .findFirst()
                .orElseThrow()
                .status();
    }

    @Test
    public void suppliedFramesWithoutClassifier() throws Exception {
        AnalysisRequest request = AnalysisRequest.forFrames(frames(6), 25.0)
                .prediction(new ModelPrediction(PredictionLabel.REAL, 90))
                .videoName("clip")
                .build();

        ExplainabilityReport report = pipeline.analyze(request);

        assertTrue(report.isSuccessful());
        assertEquals("clip", report.videoName());
        assertEquals(64, report.videoInfo().width());
        assertEquals(25.0, report.videoInfo().fps(), 0.0);
        assertEquals(PredictionLabel.REAL, report.predictionLabel());
        assertNotNull(report.forensicsMetrics());
        assertEquals(6, report.forensicsMetrics().frameCount());
        assertNull(report.timelineStats());
        assertNull(report.multimodalAnalysis());
        assertEquals(50.0, report.audioVideoScore(), 0.0);
        assertTrue(report.gradcamImages().isEmpty());
        assertNotNull(report.fakeType());
        assertNotNull(report.threat());
        assertTrue(report.threat().unavailableComponents().contains("temporal_score"));

        assertEquals(6, report.stageLog().size());
        assertEquals(StageOutcome.Status.UNAVAILABLE, statusOf(report, AnalysisStage.GRADCAM));
        assertEquals(StageOutcome.Status.UNAVAILABLE, statusOf(report, AnalysisStage.TIMELINE));
        assertEquals(StageOutcome.Status.COMPLETED, statusOf(report, AnalysisStage.FORENSICS));
        assertEquals(StageOutcome.Status.UNAVAILABLE, statusOf(report, AnalysisStage.MULTIMODAL));
        assertEquals(StageOutcome.Status.COMPLETED, statusOf(report, AnalysisStage.CLASSIFICATION));
        assertEquals(StageOutcome.Status.COMPLETED, statusOf(report, AnalysisStage.THREAT));

        assertTrue(Files.exists(outputDir.resolve("clip_analysis.log")));
    }

    @Test
    public void classifierEnablesExplanations() throws Exception {
        LinearProbeClassifier model = LinearProbeClassifier.channelZeroProbe();
        AnalysisRequest request = AnalysisRequest.forFrames(frames(3), 30.0)
                .classifier(model)
                .videoName("linear")
                .build();

        ExplainabilityReport report = pipeline.analyze(request);

        assertTrue(report.isSuccessful());
        assertTrue(report.predictionLabel() != PredictionLabel.UNKNOWN);
        assertEquals(3, report.gradcamImages().size());
        assertEquals(3, report.gradcamSummary().framesProcessed());
        assertTrue(Files.exists(outputDir.resolve("gradcam").resolve("linear_gradcam_frame_0000.png")));
        assertNotNull(report.timelineStats());
        assertEquals(3, report.timelineStats().totalFrames());
        assertEquals(3, report.timelineData().labels().size());
        assertEquals(StageOutcome.Status.COMPLETED, statusOf(report, AnalysisStage.GRADCAM));
        assertEquals(0, model.registeredHooks());
    }

    @Test(expected = IllegalStateException.class)
    public void gradCamCaptureFailureIsNotMasked() throws Exception {
        AnalysisRequest request = AnalysisRequest.forFrames(frames(2), 30.0)
                .classifier(LinearProbeClassifier.withoutHooks())
                .build();

        pipeline.analyze(request);
    }

    @Test
    public void disabledStagesAreSkipped() throws Exception {
        AnalysisRequest request = AnalysisRequest.forFrames(frames(4), 25.0)
                .prediction(new ModelPrediction(PredictionLabel.FAKE, 80))
                .stages(EnumSet.of(AnalysisStage.FORENSICS))
                .build();

        ExplainabilityReport report = pipeline.analyze(request);

        assertTrue(report.isSuccessful());
        assertNotNull(report.forensicsMetrics());
        assertNull(report.fakeType());
        assertNull(report.threat());
        assertEquals(ThreatLevel.UNKNOWN, report.threatLevel());
        assertEquals(StageOutcome.Status.SKIPPED, statusOf(report, AnalysisStage.THREAT));
        assertEquals(StageOutcome.Status.SKIPPED, statusOf(report, AnalysisStage.GRADCAM));
    }

    @Test
    public void maxFramesTruncatesSuppliedFrames() throws Exception {
        AnalysisRequest request = AnalysisRequest.forFrames(frames(6), 25.0)
                .maxFrames(2)
                .build();

        ExplainabilityReport report = pipeline.analyze(request);

        assertEquals(2, report.videoInfo().frameCount());
        assertEquals(2, report.forensicsMetrics().frameCount());
    }

    @Test
    public void missingVideoGivesErrorReport() throws Exception {
        AnalysisRequest request = AnalysisRequest.forVideo(folder.getRoot().toPath().resolve("missing.mp4")).build();

        ExplainabilityReport report = pipeline.analyze(request);

        assertFalse(report.isSuccessful());
        assertTrue(report.error().contains("missing.mp4"));
        assertEquals("missing", report.videoName());
        assertNull(report.forensicsMetrics());
        assertEquals(ThreatLevel.UNKNOWN, report.threatLevel());
        assertEquals(50.0, report.threatScore(), 0.0);
        assertTrue(report.stageLog().isEmpty());
    }

    @Test
    public void emptyFrameListGivesErrorReport() throws Exception {
        ExplainabilityReport report = pipeline.analyze(AnalysisRequest.forFrames(List.of(), 25.0).build());

        assertFalse(report.isSuccessful());
        assertNotNull(report.error());
    }

    @Test
    public void classifierCrashFallsBackToUnknownPrediction() throws Exception {
        LinearProbeClassifier crashing = new LinearProbeClassifier(CHANNEL_ZERO, new float[]{0, 0}, true) {
            @Override
            public float[] forward(List<Tensor3> input) {
                throw new RuntimeException("model backend crashed");
            }
        };
        AnalysisRequest request = AnalysisRequest.forFrames(frames(3), 30.0)
                .classifier(crashing)
                .videoName("crash")
                .build();

        ExplainabilityReport report = pipeline.analyze(request);

        assertTrue(report.isSuccessful());
        assertEquals(PredictionLabel.UNKNOWN, report.predictionLabel());
        assertTrue(report.gradcamImages().isEmpty());
        assertNull(report.timelineStats());
        assertEquals(StageOutcome.Status.UNAVAILABLE, statusOf(report, AnalysisStage.GRADCAM));
        assertEquals(StageOutcome.Status.UNAVAILABLE, statusOf(report, AnalysisStage.TIMELINE));
        assertEquals(StageOutcome.Status.COMPLETED, statusOf(report, AnalysisStage.FORENSICS));
        assertNotNull(report.threat());
        assertTrue(report.threat().unavailableComponents().contains("model_confidence"));
    }

    @Test
    public void nonFiniteLogitsFallBackToUnknownPrediction() throws Exception {
        LinearProbeClassifier broken = new LinearProbeClassifier(CHANNEL_ZERO, new float[]{Float.NaN, 0}, true);
        AnalysisRequest request = AnalysisRequest.forFrames(frames(2), 30.0)
                .classifier(broken)
                .build();

        ExplainabilityReport report = pipeline.analyze(request);

        assertTrue(report.isSuccessful());
        assertEquals(PredictionLabel.UNKNOWN, report.predictionLabel());
        assertEquals(StageOutcome.Status.UNAVAILABLE, statusOf(report, AnalysisStage.TIMELINE));
        assertNotNull(report.threat());
    }

    @Test(timeout = 30_000)
    public void slowStagesTimeOutAndAssessmentContinues() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(2);
        LinearProbeClassifier slow = new LinearProbeClassifier(CHANNEL_ZERO, new float[]{0, 0}, true) {
            @Override
            public Tensor3 backbone(Tensor3 frame) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("backbone interrompido", e);
                }
                return frame;
            }
        };
        DeepTraceConfig config = DeepTraceConfig.defaults()
                .with("output.dir", outputDir.toString())
                .with("gradcam.input.size", "16")
                .with("stage.timeout.seconds", "1");
        AnalysisRequest request = AnalysisRequest.forFrames(frames(3), 30.0)
                .prediction(new ModelPrediction(PredictionLabel.FAKE, 80))
                .classifier(slow)
                .build();

        ExplainabilityReport report;
        try (ExplainabilityPipeline bounded = new ExplainabilityPipeline(config)) {
            report = bounded.analyze(request);
            // Os workers estourados precisam ser interrompidos antes do shutdown do executor
            assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        }

        assertTrue(report.isSuccessful());
        assertEquals(StageOutcome.Status.TIMED_OUT, statusOf(report, AnalysisStage.GRADCAM));
        assertEquals(StageOutcome.Status.TIMED_OUT, statusOf(report, AnalysisStage.TIMELINE));
        assertEquals(StageOutcome.Status.COMPLETED, statusOf(report, AnalysisStage.FORENSICS));
        assertEquals(StageOutcome.Status.COMPLETED, statusOf(report, AnalysisStage.THREAT));
        assertNull(report.timelineStats());
        assertTrue(report.threat().unavailableComponents().contains("temporal_score"));
        assertFalse(report.threat().unavailableComponents().contains("model_confidence"));
    }
}
