package org.deeptrace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Score 0-100 de um sub-analisador acompanhado dos detalhes que o justificam.
 */
public record DetailedScore(double score, Map<String, Object> details) {

    public DetailedScore {
        if (Double.isNaN(score) || score < 0 || score > 100) {
            throw new IllegalArgumentException("score deve estar entre 0 e 100: " + score);
        }
        details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
    }

    /**
     * Score neutro/padrão com o motivo pelo qual a análise não foi possível.
     */
    public static DetailedScore withReason(double score, String reason) {
        return new DetailedScore(score, Map.of("reason", reason));
    }

    public boolean hasReason() {
        return details.containsKey("reason");
    }
}
