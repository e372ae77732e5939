package org.deeptrace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Veredito final ponderado com justificativa.
 *
 * @param overallScore          0-100, maior = mais ameaça
 * @param confidence            confiança da avaliação conforme os sinais disponíveis
 * @param componentScores       score por componente; componentes indisponíveis aparecem com 50
 * @param unavailableComponents componentes que entraram com peso zero
 */
public record ThreatAssessment(
        ThreatLevel level,
        String levelDisplay,
        double overallScore,
        double confidence,
        Map<String, Double> componentScores,
        List<String> unavailableComponents,
        List<String> riskFactors,
        List<String> mitigatingFactors,
        String explanation,
        List<String> recommendations,
        String colorCode
) {

    public ThreatAssessment {
        if (level == null) throw new IllegalArgumentException("level não pode ser nulo");
        ErrorHandler.checkScore("overallScore", overallScore);
        ErrorHandler.checkScore("confidence", confidence);
        componentScores = Collections.unmodifiableMap(new LinkedHashMap<>(componentScores));
        unavailableComponents = List.copyOf(unavailableComponents);
        riskFactors = List.copyOf(riskFactors);
        mitigatingFactors = List.copyOf(mitigatingFactors);
        recommendations = List.copyOf(recommendations);
    }
}
