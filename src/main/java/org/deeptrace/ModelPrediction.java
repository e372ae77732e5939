package org.deeptrace;

/**
 * Veredito do próprio classificador: rótulo e confiança em porcentagem (0-100).
 */
public record ModelPrediction(PredictionLabel label, double confidence) {

    public ModelPrediction {
        if (label == null) throw new IllegalArgumentException("label não pode ser nulo");
        ErrorHandler.checkScore("confidence", confidence);
    }

    public static ModelPrediction unknown() {
        return new ModelPrediction(PredictionLabel.UNKNOWN, 0.0);
    }

    /**
     * Predição a partir dos logits da sequência: argmax e probabilidade softmax em %.
     */
    public static ModelPrediction fromLogits(float[] logits) {
        if (logits == null || logits.length == 0) {
            throw new IllegalArgumentException("logits vazio");
        }
        for (float logit : logits) {
            if (!Float.isFinite(logit)) {
                throw new IllegalArgumentException("Logit não finito: " + logit);
            }
        }
        double[] probs = Softmax.apply(logits);
        int predicted = Softmax.argmax(logits);
        return new ModelPrediction(PredictionLabel.fromClassIndex(predicted), probs[predicted] * 100);
    }

    public boolean isFake() {
        return label == PredictionLabel.FAKE;
    }

    public boolean isReal() {
        return label == PredictionLabel.REAL;
    }
}
