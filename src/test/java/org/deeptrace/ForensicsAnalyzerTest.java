package org.deeptrace;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ForensicsAnalyzerTest {

    private static List<RgbFrame> movingTexture(int count) {
        List<RgbFrame> frames = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            frames.add(SyntheticMedia.texturedFrame(i));
        }
        return frames;
    }

    @Test
    public void analysisIsDeterministic() {
        ForensicsAnalyzer analyzer = new ForensicsAnalyzer(25.0);
        List<RgbFrame> frames = movingTexture(8);

        ForensicsMetrics first = analyzer.analyzeFrames(frames);
        ForensicsMetrics second = analyzer.analyzeFrames(frames);

        assertEquals(first.faceConsistencyScore(), second.faceConsistencyScore(), 0.0);
        assertEquals(first.eyeBlinkScore(), second.eyeBlinkScore(), 0.0);
        assertEquals(first.temporalStabilityScore(), second.temporalStabilityScore(), 0.0);
        assertEquals(first.compressionArtifactScore(), second.compressionArtifactScore(), 0.0);
        assertEquals(first.overallForensicsScore(), second.overallForensicsScore(), 0.0);
        assertEquals(8, second.frameCount());
    }

    @Test
    public void addingWithoutResetAccumulates() {
        ForensicsAnalyzer analyzer = new ForensicsAnalyzer(25.0);
        analyzer.analyzeFrames(movingTexture(4));
        for (RgbFrame frame : movingTexture(3)) {
            analyzer.addFrame(frame);
        }

        assertEquals(7, analyzer.computeMetrics().frameCount());

        analyzer.reset();
        assertEquals(0, analyzer.getFrameCount());
    }

    @Test
    public void frameTimestampsFollowFps() {
        ForensicsAnalyzer analyzer = new ForensicsAnalyzer(10.0);
        analyzer.addFrame(SyntheticMedia.texturedFrame(0));
        ForensicsAnalyzer.FrameForensics second = analyzer.addFrame(SyntheticMedia.texturedFrame(1));

        assertEquals(1, second.frameIndex());
        assertEquals(0.1, second.timestampSeconds(), 1e-9);
    }

    @Test
    public void noFramesGivesNeutralMetrics() {
        ForensicsMetrics metrics = new ForensicsAnalyzer(30.0).analyzeFrames(List.of());

        assertEquals(100.0, metrics.faceConsistencyScore(), 0.0);
        assertEquals(50.0, metrics.eyeBlinkScore(), 0.0);
        assertEquals(100.0, metrics.temporalStabilityScore(), 0.0);
        assertEquals(0.0, metrics.compressionArtifactScore(), 0.0);
        assertEquals(90.0, metrics.overallForensicsScore(), 1e-9);
    }

    @Test
    public void staticSceneIsStable() {
        ForensicsMetrics metrics = new ForensicsAnalyzer(30.0)
                .analyzeFrames(SyntheticMedia.repeat(SyntheticMedia.faceFrame(), 6));

        assertEquals(100.0, metrics.faceConsistencyScore(), 1e-6);
        assertEquals(6, metrics.facesDetected());
        assertTrue(metrics.temporalStabilityScore() > 90);
    }

    @Test
    public void overallWeightsAreFixed() {
        assertEquals(100 * 0.25 + 40 * 0.20 + 80 * 0.25 + 70 * 0.30,
                ForensicsMetrics.overallScore(100, 40, 80, 30), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void scoresOutsideRangeAreRejected() {
        ForensicsMetrics.ofScores(120, 50, 50, 50, 10);
    }

    @Test
    public void summaryFlagsWeakSignals() {
        List<String> lines = ForensicsSummary.lines(ForensicsMetrics.ofScores(40, 30, 45, 70, 10));

        assertEquals(5, lines.size());
        assertTrue(lines.get(0).startsWith("⚠️ Low face consistency"));
        assertTrue(lines.get(3).startsWith("⚠️ High artifacts"));
        assertTrue(lines.get(4).startsWith("📊 Overall forensics score"));
    }

    @Test
    public void blinkScorePenalizesExtremes() {
        assertEquals(0.0, EyeBlinkDetector.blinkScore(0), 1e-9);
        assertEquals(30.0, EyeBlinkDetector.blinkScore(50), 1e-9);
    }
}
