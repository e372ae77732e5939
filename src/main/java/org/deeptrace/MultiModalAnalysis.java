package org.deeptrace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resultado multimodal: áudio, lip-sync (quando calculado) e o score combinado de autenticidade.
 */
public record MultiModalAnalysis(
        AudioFeatures audioFeatures,
        LipSyncFeatures lipSyncFeatures,
        double audioSpoofScore,
        double lipSyncScore,
        double combinedScore,
        double confidence,
        Map<String, Object> analysisDetails
) {

    public MultiModalAnalysis {
        if (audioFeatures == null) throw new IllegalArgumentException("audioFeatures não pode ser nulo");
        ErrorHandler.checkScore("audioSpoofScore", audioSpoofScore);
        ErrorHandler.checkScore("lipSyncScore", lipSyncScore);
        ErrorHandler.checkScore("combinedScore", combinedScore);
        ErrorHandler.checkScore("confidence", confidence);
        analysisDetails = analysisDetails != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(analysisDetails))
                : Map.of();
    }

    public Optional<LipSyncFeatures> lipSync() {
        return Optional.ofNullable(lipSyncFeatures);
    }

    /**
     * Correlação do lip-sync, quando calculado.
     */
    public Optional<Double> lipSyncCorrelation() {
        return lipSync().map(LipSyncFeatures::correlation);
    }
}
