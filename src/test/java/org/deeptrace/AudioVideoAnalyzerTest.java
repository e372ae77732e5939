package org.deeptrace;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

public class AudioVideoAnalyzerTest {

    private static AudioFeatures validAudio(double pitchScore, double jitterScore, List<Double> energy) {
        return new AudioFeatures(2.0, 16000, 150, 1, pitchScore, 0.0005, jitterScore, energy, 0.02, 300, true, null);
    }

    private static LipSyncFeatures lipSync(double score, int samples) {
        List<Double> mouth = new ArrayList<>();
        for (int i = 0; i < samples; i++) {
            mouth.add((double) i);
        }
        return new LipSyncFeatures(mouth, mouth, score / 100, score, 0, List.of());
    }

    @Test
    public void combinedWeighsAudioAndLipSync() {
        MultiModalAnalysis analysis = AudioVideoAnalyzer.combine(validAudio(40, 20, List.of()), lipSync(90, 60));

        assertEquals(30.0, analysis.audioSpoofScore(), 1e-9);
        assertEquals(90.0, analysis.lipSyncScore(), 0.0);
        assertEquals(70 * 0.4 + 90 * 0.6, analysis.combinedScore(), 1e-9);
        assertEquals(100.0, analysis.confidence(), 0.0);
    }

    @Test
    public void fewMouthSamplesLowerConfidence() {
        MultiModalAnalysis analysis = AudioVideoAnalyzer.combine(validAudio(40, 20, List.of()), lipSync(90, 10));

        assertEquals(80.0, analysis.confidence(), 0.0);
    }

    @Test
    public void invalidAudioIsNeutral() {
        MultiModalAnalysis analysis = AudioVideoAnalyzer.combine(AudioFeatures.invalid("no audio stream"), null);

        assertEquals(50.0, analysis.audioSpoofScore(), 0.0);
        assertEquals(50.0, analysis.lipSyncScore(), 0.0);
        assertEquals(50.0, analysis.combinedScore(), 1e-9);
        assertEquals(30.0, analysis.confidence(), 0.0);
        assertEquals("no audio stream", analysis.analysisDetails().get("audio_error"));
        assertFalse(analysis.lipSyncCorrelation().isPresent());
    }

    @Test
    public void lipSyncNeedsEnergyProfile() {
        AudioVideoAnalyzer analyzer = new AudioVideoAnalyzer(
                new AudioAnalyzer(new AudioExtractor("ffmpeg", 16000, 5), 50),
                new LipSyncAnalyzer(new SkinToneFaceDetector(), null), 300);

        MultiModalAnalysis analysis = analyzer.analyze(validAudio(40, 20, List.of()),
                SyntheticMedia.repeat(SyntheticMedia.faceFrame(), 3), 30);

        assertNull(analysis.lipSyncFeatures());
    }
}
