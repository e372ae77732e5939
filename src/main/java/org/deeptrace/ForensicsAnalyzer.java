package org.deeptrace;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Suíte forense completa: consistência do rosto, piscadas, estabilidade temporal
 * e artefatos de compressão, combinados em {@link ForensicsMetrics}.
 *
 * <p>Não é thread-safe; use uma instância por vídeo em análise.</p>
 */
public class ForensicsAnalyzer {

    private static final Logger logger = Logger.getLogger(ForensicsAnalyzer.class.getName());

    private final FaceConsistencyAnalyzer faceAnalyzer;
    private final EyeBlinkDetector blinkDetector;
    private final TemporalStabilityAnalyzer stabilityAnalyzer;
    private final CompressionArtifactDetector artifactDetector;
    private final VideoFrameReader frameReader;
    private double fps;
    private int frameCount;

    public ForensicsAnalyzer(double fps, FaceDetector detector, VideoFrameReader frameReader) {
        this.fps = fps;
        this.faceAnalyzer = new FaceConsistencyAnalyzer(detector);
        this.blinkDetector = new EyeBlinkDetector(detector);
        this.stabilityAnalyzer = new TemporalStabilityAnalyzer();
        this.artifactDetector = new CompressionArtifactDetector();
        this.frameReader = frameReader;
    }

    public ForensicsAnalyzer(double fps) {
        this(fps, new SkinToneFaceDetector(), null);
    }

    public void reset() {
        faceAnalyzer.reset();
        blinkDetector.reset();
        stabilityAnalyzer.reset();
        artifactDetector.reset();
        frameCount = 0;
    }

    public double getFps() {
        return fps;
    }

    public void setFps(double fps) {
        if (fps <= 0) {
            throw new IllegalArgumentException("fps deve ser > 0");
        }
        this.fps = fps;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public FrameForensics addFrame(RgbFrame frame) {
        return addFrame(FrameSample.of(frameCount, frame, fps));
    }

    public FrameForensics addFrame(FrameSample sample) {
        RgbFrame frame = sample.pixels();
        frameCount++;
        return new FrameForensics(
                sample.index(),
                sample.timestampSeconds(),
                faceAnalyzer.addFrame(frame),
                blinkDetector.addFrame(frame),
                stabilityAnalyzer.addFrame(frame),
                artifactDetector.addFrame(frame));
    }

    /**
     * Analisa o vídeo inteiro (ou os primeiros {@code maxFrames}) em streaming.
     *
     * @throws MediaAccessException se o vídeo não puder ser aberto ou decodificado
     */
    public ForensicsMetrics analyzeVideo(Path video, Integer maxFrames) throws IOException, InterruptedException {
        if (frameReader == null) {
            throw new IllegalStateException("ForensicsAnalyzer criado sem VideoFrameReader");
        }
        reset();
        VideoInfo info = frameReader.probe(video);
        this.fps = info.fps();
        logger.info("🔬 Análise forense: " + video.getFileName() + " " + info);
        frameReader.forEachFrame(video, info, maxFrames, this::addFrame);
        return computeMetrics();
    }

    public ForensicsMetrics analyzeFrames(List<RgbFrame> frames) {
        reset();
        for (RgbFrame frame : frames) {
            addFrame(frame);
        }
        return computeMetrics();
    }

    public ForensicsMetrics computeMetrics() {
        DetailedScore face = faceAnalyzer.computeConsistencyScore();
        EyeBlinkDetector.BlinkRate blink = blinkDetector.computeBlinkRate(fps);
        DetailedScore stability = stabilityAnalyzer.computeStabilityScore();
        CompressionArtifactDetector.ArtifactScores artifacts = artifactDetector.computeArtifactScore();

        double artifactCombined = artifacts.combined();
        double overall = ForensicsMetrics.overallScore(face.score(), blink.score().score(),
                stability.score(), artifactCombined);

        Map<String, Map<String, Object>> details = new LinkedHashMap<>();
        details.put("face", face.details());
        details.put("blink", blink.score().details());
        details.put("stability", stability.details());
        details.put("artifacts", artifacts.details());

        ForensicsMetrics metrics = new ForensicsMetrics(
                face.score(),
                blink.blinksPerSecond(),
                blink.score().score(),
                stability.score(),
                artifactCombined,
                artifacts.meanBlockiness(),
                artifacts.frequencyScore(),
                overall,
                frameCount,
                faceAnalyzer.facesDetected(),
                details);
        logger.info(String.format("🔬 Forense: %d frames, %d rostos, overall %.1f",
                frameCount, metrics.facesDetected(), overall));
        return metrics;
    }

    /**
     * Resultado parcial de um frame em cada sub-analisador.
     */
    public record FrameForensics(
            int frameIndex,
            double timestampSeconds,
            Optional<FaceConsistencyAnalyzer.FaceObservation> face,
            EyeBlinkDetector.BlinkObservation blink,
            TemporalStabilityAnalyzer.StabilityObservation stability,
            CompressionArtifactDetector.ArtifactObservation artifacts
    ) {
    }
}
