package org.deeptrace;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;

public class DeepTraceConfigTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @After
    public void clearSystemProperties() {
        System.clearProperty("deeptrace.video.max.frames");
    }

    @Test
    public void bundledDefaults() {
        DeepTraceConfig config = DeepTraceConfig.defaults();

        assertEquals(30.0, config.defaultFps(), 0.0);
        assertEquals(300, config.maxFrames());
        assertEquals(0.3, config.timelineAnomalyThreshold(), 0.0);
        assertEquals(5, config.timelineSmoothingWindow());
        assertEquals(0, config.stageTimeoutSeconds());
        assertEquals(ThreatThresholds.defaults(), config.threatThresholds());
        assertEquals(FakeTypeThresholds.defaults(), config.fakeTypeThresholds());
        assertEquals(0.35, config.threatWeights().weight(ThreatComponent.MODEL_CONFIDENCE), 1e-12);
    }

    @Test
    public void externalFileOverridesDefaults() throws IOException {
        Path file = folder.newFile("custom.properties").toPath();
        Files.writeString(file, "video.max.frames=42\nthreat.threshold.safe=10\n", StandardCharsets.UTF_8);

        DeepTraceConfig config = DeepTraceConfig.load(file);

        assertEquals(42, config.maxFrames());
        assertEquals(10.0, config.threatThresholds().safeMax(), 0.0);
        assertEquals(55.0, config.threatThresholds().suspiciousMax(), 0.0);
    }

    @Test(expected = IOException.class)
    public void missingExternalFileFails() throws IOException {
        DeepTraceConfig.load(folder.getRoot().toPath().resolve("missing.properties"));
    }

    @Test
    public void systemPropertyWins() {
        System.setProperty("deeptrace.video.max.frames", "12");

        assertEquals(12, DeepTraceConfig.defaults().maxFrames());
    }

    @Test
    public void withReturnsModifiedCopy() {
        DeepTraceConfig base = DeepTraceConfig.defaults();
        DeepTraceConfig changed = base.with("gradcam.alpha", "0.7");

        assertEquals(0.7, changed.gradCamAlpha(), 0.0);
        assertEquals(0.5, base.gradCamAlpha(), 0.0);
    }

    @Test
    public void invalidNumberFallsBackToDefault() {
        DeepTraceConfig config = DeepTraceConfig.defaults().with("video.max.frames", "many");

        assertEquals(300, config.maxFrames());
    }

    @Test
    public void weightsFromConfigAreNormalized() {
        DeepTraceConfig config = DeepTraceConfig.defaults()
                .with("threat.weight.model.confidence", "1")
                .with("threat.weight.forensics.score", "1")
                .with("threat.weight.audio.score", "0")
                .with("threat.weight.temporal.score", "0")
                .with("threat.weight.fake.type.score", "0");

        assertEquals(0.5, config.threatWeights().weight(ThreatComponent.FORENSICS_SCORE), 1e-12);
    }
}
