package org.deeptrace;

import java.util.EnumMap;
import java.util.Map;

/**
 * Pesos dos componentes do score de ameaça, sempre normalizados para somar 1.
 */
public final class ThreatWeights {

    private final Map<ThreatComponent, Double> weights;

    private ThreatWeights(Map<ThreatComponent, Double> weights) {
        this.weights = weights;
    }

    public static ThreatWeights defaults() {
        return of(0.35, 0.25, 0.15, 0.15, 0.10);
    }

    public static ThreatWeights of(double modelConfidence, double forensicsScore, double audioScore,
                                   double temporalScore, double fakeTypeScore) {
        Map<ThreatComponent, Double> raw = new EnumMap<>(ThreatComponent.class);
        raw.put(ThreatComponent.MODEL_CONFIDENCE, modelConfidence);
        raw.put(ThreatComponent.FORENSICS_SCORE, forensicsScore);
        raw.put(ThreatComponent.AUDIO_SCORE, audioScore);
        raw.put(ThreatComponent.TEMPORAL_SCORE, temporalScore);
        raw.put(ThreatComponent.FAKE_TYPE_SCORE, fakeTypeScore);
        return of(raw);
    }

    /**
     * Componentes ausentes do mapa recebem peso zero.
     */
    public static ThreatWeights of(Map<ThreatComponent, Double> raw) {
        double total = 0;
        for (ThreatComponent c : ThreatComponent.values()) {
            double w = raw.getOrDefault(c, 0.0);
            if (w < 0 || Double.isNaN(w) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("Peso inválido para " + c.getKey() + ": " + w);
            }
            total += w;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("A soma dos pesos deve ser > 0");
        }
        Map<ThreatComponent, Double> normalized = new EnumMap<>(ThreatComponent.class);
        for (ThreatComponent c : ThreatComponent.values()) {
            normalized.put(c, raw.getOrDefault(c, 0.0) / total);
        }
        return new ThreatWeights(normalized);
    }

    public double weight(ThreatComponent component) {
        return weights.get(component);
    }

    public double sum() {
        double total = 0;
        for (double w : weights.values()) {
            total += w;
        }
        return total;
    }

    @Override
    public String toString() {
        return "ThreatWeights" + weights;
    }
}
