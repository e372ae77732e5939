package org.deeptrace;

/**
 * Amostras mono normalizadas em [-1, 1) e a taxa de amostragem.
 */
public record AudioClip(float[] samples, int sampleRate) {

    public AudioClip {
        if (samples == null) throw new IllegalArgumentException("samples não pode ser nulo");
        if (sampleRate <= 0) throw new IllegalArgumentException("sampleRate deve ser > 0");
    }

    public double durationSeconds() {
        return (double) samples.length / sampleRate;
    }

    public boolean isEmpty() {
        return samples.length == 0;
    }
}
