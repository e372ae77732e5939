package org.deeptrace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classificação do tipo de manipulação com evidências e recomendações.
 *
 * @param allScores pontuação acumulada por categoria, chaveada por {@link FakeType#getValue()}
 */
public record FakeTypeResult(
        FakeType primaryType,
        double confidence,
        Map<String, Double> allScores,
        List<String> evidence,
        String explanation,
        List<String> recommendations
) {

    public FakeTypeResult {
        if (primaryType == null) throw new IllegalArgumentException("primaryType não pode ser nulo");
        ErrorHandler.checkScore("confidence", confidence);
        allScores = Collections.unmodifiableMap(new LinkedHashMap<>(allScores));
        evidence = List.copyOf(evidence);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Relatório no formato consumido pelo dashboard.
     */
    public Map<String, Object> classificationReport() {
        Map<String, Object> classification = new LinkedHashMap<>();
        classification.put("type", primaryType.getValue());
        classification.put("type_display", primaryType.getDisplayName());
        classification.put("confidence", confidence);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("classification", classification);
        report.put("all_type_scores", allScores);
        report.put("evidence", evidence);
        report.put("explanation", explanation);
        report.put("recommendations", recommendations);
        return report;
    }
}
