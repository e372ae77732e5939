package org.deeptrace;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FaceConsistencyAnalyzerTest {

    private FaceConsistencyAnalyzer analyzer;

    @Before
    public void setUp() {
        analyzer = new FaceConsistencyAnalyzer(new SkinToneFaceDetector());
    }

    @Test
    public void identicalFramesWithStableFaceAreConsistent() {
        RgbFrame frame = SyntheticMedia.faceFrame();
        for (int i = 0; i < 10; i++) {
            assertTrue(analyzer.addFrame(frame).isPresent());
        }

        DetailedScore score = analyzer.computeConsistencyScore();
        assertTrue("score=" + score.score(), score.score() >= 95);
        assertEquals(10, analyzer.facesDetected());
    }

    @Test
    public void alternatingFacesAreInconsistent() {
        RgbFrame a = SyntheticMedia.faceFrame(40, 40, 50, 60, SyntheticMedia.SKIN);
        RgbFrame b = SyntheticMedia.faceFrame(150, 80, 100, 120, SyntheticMedia.DARK_SKIN);
        for (int i = 0; i < 10; i++) {
            analyzer.addFrame(i % 2 == 0 ? a : b);
        }

        DetailedScore score = analyzer.computeConsistencyScore();
        assertTrue("score=" + score.score(), score.score() < 50);
    }

    @Test
    public void fewerThanTwoFacesFailsOpen() {
        analyzer.addFrame(SyntheticMedia.faceFrame());

        DetailedScore score = analyzer.computeConsistencyScore();
        assertEquals(100.0, score.score(), 0.0);
        assertTrue(score.hasReason());
    }

    @Test
    public void framesWithoutFaceAreIgnored() {
        RgbFrame empty = RgbFrame.filled(320, 240, 30, 60, 200);
        assertTrue(analyzer.addFrame(empty).isEmpty());
        assertEquals(0, analyzer.facesDetected());
    }

    @Test
    public void resetClearsAccumulatedFaces() {
        analyzer.addFrame(SyntheticMedia.faceFrame());
        analyzer.addFrame(SyntheticMedia.faceFrame());
        analyzer.reset();
        assertEquals(0, analyzer.facesDetected());
    }
}
