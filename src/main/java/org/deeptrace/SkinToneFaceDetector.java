package org.deeptrace;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Detector determinístico baseado em cor de pele no espaço YCbCr.
 *
 * <p>Rostos são componentes conexos da máscara de pele com pelo menos 30x30 pixels
 * e proporção plausível. Olhos são manchas escuras não-pele na faixa superior do rosto.
 * Frames grandes são reduzidos antes da detecção e as regiões reescalonadas.</p>
 */
public class SkinToneFaceDetector implements FaceDetector {

    private static final Logger logger = Logger.getLogger(SkinToneFaceDetector.class.getName());

    private static final int MIN_FACE_SIZE = 30;
    private static final int DETECTION_WIDTH = 320;
    private static final double MIN_ASPECT = 0.4;
    private static final double MAX_ASPECT = 2.5;
    private static final double MIN_FILL_RATIO = 0.35;

    private static final double EYE_BAND_TOP = 0.15;
    private static final double EYE_BAND_BOTTOM = 0.55;
    private static final double EYE_DARKNESS = 0.6;
    private static final double MIN_EYE_AREA_RATIO = 0.002;

    @Override
    public List<Region> detectFaces(RgbFrame frame) {
        double scale = 1.0;
        RgbFrame work = frame;
        if (frame.width() > DETECTION_WIDTH) {
            scale = (double) frame.width() / DETECTION_WIDTH;
            work = frame.resize(DETECTION_WIDTH, Math.max(1, (int) Math.round(frame.height() / scale)));
        }

        boolean[] mask = new boolean[work.width() * work.height()];
        for (int y = 0; y < work.height(); y++) {
            for (int x = 0; x < work.width(); x++) {
                mask[y * work.width() + x] = isSkin(work.red(x, y), work.green(x, y), work.blue(x, y));
            }
        }

        int minSize = (int) Math.ceil(MIN_FACE_SIZE / scale);
        List<Region> faces = new ArrayList<>();
        for (ImageOps.Component component : ImageOps.connectedComponents(mask, work.width(), work.height())) {
            Region box = component.bounds();
            if (box.width() < minSize || box.height() < minSize) {
                continue;
            }
            double aspect = (double) box.width() / box.height();
            if (aspect < MIN_ASPECT || aspect > MAX_ASPECT) {
                continue;
            }
            if ((double) component.area() / box.area() < MIN_FILL_RATIO) {
                continue;
            }
            faces.add(scale == 1.0 ? box : rescale(box, scale, frame));
        }
        faces.sort(Comparator.comparingInt(Region::area).reversed());
        logger.fine(() -> "Rostos detectados: " + faces.size());
        return faces;
    }

    @Override
    public List<Region> detectEyes(RgbFrame frame, Region face) {
        Region band = new Region(face.x(), face.y() + (int) (face.height() * EYE_BAND_TOP),
                face.width(), (int) (face.height() * (EYE_BAND_BOTTOM - EYE_BAND_TOP))).clip(frame.width(), frame.height());
        if (band.isEmpty()) {
            return List.of();
        }

        RgbFrame crop = frame.crop(band);
        GrayImage gray = crop.toGray();
        double cutoff = gray.mean() * EYE_DARKNESS;
        boolean[] mask = new boolean[crop.width() * crop.height()];
        for (int y = 0; y < crop.height(); y++) {
            for (int x = 0; x < crop.width(); x++) {
                mask[y * crop.width() + x] = gray.get(x, y) < cutoff
                        && !isSkin(crop.red(x, y), crop.green(x, y), crop.blue(x, y));
            }
        }

        int minArea = Math.max(4, (int) (face.area() * MIN_EYE_AREA_RATIO));
        List<ImageOps.Component> blobs = new ArrayList<>();
        for (ImageOps.Component component : ImageOps.connectedComponents(mask, crop.width(), crop.height())) {
            if (component.area() >= minArea) {
                blobs.add(component);
            }
        }
        blobs.sort(Comparator.comparingInt(ImageOps.Component::area).reversed());

        List<Region> eyes = new ArrayList<>();
        for (ImageOps.Component blob : blobs.subList(0, Math.min(2, blobs.size()))) {
            Region b = blob.bounds();
            // Margem em volta da mancha para que a região contenha pálpebra e pele
            int padX = Math.max(2, b.width() / 2);
            int padY = Math.max(2, b.height());
            eyes.add(new Region(band.x() + b.x() - padX, band.y() + b.y() - padY,
                    b.width() + 2 * padX, b.height() + 2 * padY).clip(frame.width(), frame.height()));
        }
        eyes.sort(Comparator.comparingInt(Region::x));
        return eyes;
    }

    /**
     * Faixa clássica de pele em YCbCr: Cb 77-127, Cr 133-173.
     */
    static boolean isSkin(int r, int g, int b) {
        double cb = 128 - 0.168736 * r - 0.331264 * g + 0.5 * b;
        double cr = 128 + 0.5 * r - 0.418688 * g - 0.081312 * b;
        return cb >= 77 && cb <= 127 && cr >= 133 && cr <= 173;
    }

    private static Region rescale(Region box, double scale, RgbFrame frame) {
        return new Region((int) Math.round(box.x() * scale), (int) Math.round(box.y() * scale),
                (int) Math.round(box.width() * scale), (int) Math.round(box.height() * scale))
                .clip(frame.width(), frame.height());
    }
}
