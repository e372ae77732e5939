package org.deeptrace;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void parsesAllOptions() throws Exception {
        Path config = folder.newFile("custom.properties").toPath();

        Main.CliOptions options = Main.CliOptions.parse(new String[]{
                "video.mp4", "--label", "fake", "--confidence", "87.5", "--out", "reports",
                "--max-frames", "120", "--config", config.toString()});

        assertEquals(Path.of("video.mp4"), options.video());
        assertEquals(PredictionLabel.FAKE, options.label());
        assertEquals(87.5, options.confidence(), 0.0);
        assertEquals(Path.of("reports"), options.outputDir());
        assertEquals(Integer.valueOf(120), options.maxFrames());
        assertEquals(config, options.configFile());
    }

    @Test
    public void videoAloneIsEnough() {
        Main.CliOptions options = Main.CliOptions.parse(new String[]{"clip.avi"});

        assertEquals(PredictionLabel.UNKNOWN, options.label());
        assertNull(options.maxFrames());
        assertNull(options.configFile());
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingVideo() {
        Main.CliOptions.parse(new String[]{"--label", "REAL"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void twoVideos() {
        Main.CliOptions.parse(new String[]{"a.mp4", "b.mp4"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownOption() {
        Main.CliOptions.parse(new String[]{"a.mp4", "--verbose"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingOptionValue() {
        Main.CliOptions.parse(new String[]{"a.mp4", "--out"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidLabel() {
        Main.CliOptions.parse(new String[]{"a.mp4", "--label", "maybe"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void confidenceOutOfRange() {
        Main.CliOptions.parse(new String[]{"a.mp4", "--label", "REAL", "--confidence", "140"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void confidenceRequiresLabel() {
        Main.CliOptions.parse(new String[]{"a.mp4", "--confidence", "60"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void fractionalMaxFrames() {
        Main.CliOptions.parse(new String[]{"a.mp4", "--max-frames", "2.5"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingConfigFile() {
        Main.CliOptions.parse(new String[]{"a.mp4", "--config", "/nonexistent/deeptrace.properties"});
    }
}
