package org.deeptrace;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SkinToneFaceDetectorTest {

    private final SkinToneFaceDetector detector = new SkinToneFaceDetector();

    @Test
    public void skinRangeInYCbCr() {
        assertTrue(SkinToneFaceDetector.isSkin(224, 172, 140));
        assertTrue(SkinToneFaceDetector.isSkin(120, 80, 60));
        assertFalse(SkinToneFaceDetector.isSkin(30, 60, 200));
        assertFalse(SkinToneFaceDetector.isSkin(0, 255, 0));
    }

    @Test
    public void detectsRectangularSkinRegion() {
        List<Region> faces = detector.detectFaces(SyntheticMedia.faceFrame(100, 60, 80, 100, SyntheticMedia.SKIN));

        assertEquals(1, faces.size());
        Region face = faces.get(0);
        assertEquals(100, face.x());
        assertEquals(60, face.y());
        assertEquals(80, face.width());
        assertEquals(100, face.height());
    }

    @Test
    public void smallSkinPatchesAreNotFaces() {
        assertTrue(detector.detectFaces(SyntheticMedia.faceFrame(10, 10, 12, 12, SyntheticMedia.SKIN)).isEmpty());
    }

    @Test
    public void largestFaceComesFirst() {
        RgbFrame frame = SyntheticMedia.faceFrame(10, 10, 40, 40, SyntheticMedia.SKIN);
        int[] px = frame.pixels();
        int skin = RgbFrame.pack(224, 172, 140);
        for (int y = 100; y < 200; y++) {
            for (int x = 150; x < 250; x++) {
                px[y * 320 + x] = skin;
            }
        }
        RgbFrame twoFaces = new RgbFrame(320, 240, px);

        assertEquals(100, detector.largestFace(twoFaces).orElseThrow().width());
    }

    @Test
    public void eyesAreDarkBlobsInUpperBand() {
        int[] px = SyntheticMedia.faceFrame(100, 40, 100, 140, SyntheticMedia.SKIN).pixels();
        int dark = RgbFrame.pack(20, 20, 20);
        for (int y = 80; y < 88; y++) {
            for (int x = 120; x < 136; x++) {
                px[y * 320 + x] = dark;
                px[y * 320 + x + 44] = dark;
            }
        }
        RgbFrame frame = new RgbFrame(320, 240, px);
        Region face = detector.largestFace(frame).orElseThrow();

        List<Region> eyes = detector.detectEyes(frame, face);
        assertEquals(2, eyes.size());
        assertTrue(eyes.get(0).x() < eyes.get(1).x());
    }
}
