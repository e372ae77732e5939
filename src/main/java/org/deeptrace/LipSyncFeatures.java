package org.deeptrace;

import java.util.Collections;
import java.util.List;

/**
 * Sincronia entre movimento da boca e energia do áudio.
 *
 * @param correlation      pico da correlação cruzada normalizada (-1..1)
 * @param syncScore        0-100, maior = melhor sincronia
 * @param lagFrames        defasagem do melhor alinhamento, com sinal
 * @param mismatchRegions  janelas com correlação local abaixo de 0.2 ou indefinida
 */
public record LipSyncFeatures(
        List<Double> mouthMovementEnergy,
        List<Double> audioEnergy,
        double correlation,
        double syncScore,
        int lagFrames,
        List<TimeInterval> mismatchRegions
) {

    public LipSyncFeatures {
        mouthMovementEnergy = mouthMovementEnergy != null ? List.copyOf(mouthMovementEnergy) : Collections.emptyList();
        audioEnergy = audioEnergy != null ? List.copyOf(audioEnergy) : Collections.emptyList();
        mismatchRegions = mismatchRegions != null ? List.copyOf(mismatchRegions) : Collections.emptyList();
        ErrorHandler.checkScore("syncScore", syncScore);
    }
}
