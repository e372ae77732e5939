package org.deeptrace;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Localizador de rostos e olhos usado pelas análises forenses e de lip-sync.
 * Todas as regiões retornadas estão em coordenadas do frame.
 */
public interface FaceDetector {

    List<Region> detectFaces(RgbFrame frame);

    List<Region> detectEyes(RgbFrame frame, Region face);

    default Optional<Region> largestFace(RgbFrame frame) {
        return detectFaces(frame).stream().max(Comparator.comparingInt(Region::area));
    }
}
