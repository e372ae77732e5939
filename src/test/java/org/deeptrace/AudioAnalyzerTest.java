package org.deeptrace;

import org.junit.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class AudioAnalyzerTest {

    private static final int SAMPLE_RATE = 16000;

    private final AudioAnalyzer analyzer = new AudioAnalyzer(new AudioExtractor("ffmpeg", SAMPLE_RATE, 10), 100);

    @Test
    public void pureToneHasStablePitchAndNoJitter() {
        float[] tone = SyntheticMedia.sine(150, SAMPLE_RATE, 2.0, 0.5);

        AudioFeatures features = analyzer.analyzeSamples(new AudioClip(tone, SAMPLE_RATE));

        assertTrue(features.isValid());
        assertEquals(150.0, features.pitchMean(), 2.0);
        assertTrue("jitter=" + features.jitterMean(), features.jitterMean() < 0.001);
        assertEquals(80.0, features.jitterScore(), 0.0);
        assertEquals(2.0, features.durationSeconds(), 1e-9);
    }

    @Test
    public void pitchOfSilenceIsNeutral() {
        AudioAnalyzer.PitchFeatures pitch = AudioAnalyzer.computePitchFeatures(new float[SAMPLE_RATE], SAMPLE_RATE);

        assertEquals(0.0, pitch.mean(), 0.0);
        assertEquals(50.0, pitch.varianceScore(), 0.0);
    }

    @Test
    public void jitterNeedsEnoughCrossings() {
        AudioAnalyzer.Jitter jitter = AudioAnalyzer.computeJitter(new float[]{0.1f, -0.1f, 0.1f});

        assertEquals(0.0, jitter.value(), 0.0);
        assertEquals(50.0, jitter.score(), 0.0);
    }

    @Test
    public void energyProfileHasOneValuePerSegment() {
        float[] tone = SyntheticMedia.sine(200, SAMPLE_RATE, 1.0, 0.5);

        List<Double> energy = AudioAnalyzer.computeEnergyProfile(tone, 100);

        assertEquals(100, energy.size());
        // RMS de uma senoide de amplitude A é A/sqrt(2)
        assertEquals(0.5 / Math.sqrt(2), energy.get(50), 0.01);
        assertTrue(AudioAnalyzer.computeEnergyProfile(new float[10], 100).isEmpty());
    }

    @Test
    public void zeroCrossingRateAndCentroidFollowFrequency() {
        float[] low = SyntheticMedia.sine(150, SAMPLE_RATE, 1.0, 0.5);
        float[] high = SyntheticMedia.sine(2000, SAMPLE_RATE, 1.0, 0.5);

        assertTrue(AudioAnalyzer.computeZeroCrossingRate(high) > AudioAnalyzer.computeZeroCrossingRate(low));
        assertTrue(AudioAnalyzer.computeSpectralCentroid(high, SAMPLE_RATE)
                > AudioAnalyzer.computeSpectralCentroid(low, SAMPLE_RATE));
        assertEquals(0.0, AudioAnalyzer.computeZeroCrossingRate(new float[0]), 0.0);
    }

    @Test
    public void missingVideoGivesInvalidFeatures() {
        AudioFeatures features = analyzer.analyzeAudio(Path.of("does-not-exist.mp4"));

        assertFalse(features.isValid());
        assertNotNull(features.errorMessage());
        assertEquals(50.0, features.spoofScore(), 0.0);
    }

    @Test
    public void emptyClipIsInvalid() {
        AudioFeatures features = analyzer.analyzeSamples(new AudioClip(new float[0], SAMPLE_RATE));

        assertFalse(features.isValid());
        assertEquals("Failed to load audio data", features.errorMessage());
    }
}
