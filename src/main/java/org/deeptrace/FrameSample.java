package org.deeptrace;

/**
 * Frame de vídeo com posição e instante. Pertence a quem chamou; os analisadores só leem.
 */
public record FrameSample(int index, RgbFrame pixels, double timestampSeconds) {

    public FrameSample {
        if (index < 0) throw new IllegalArgumentException("index deve ser >= 0");
        if (pixels == null) throw new IllegalArgumentException("pixels não pode ser nulo");
    }

    /**
     * Instante derivado de {@code index / fps}.
     */
    public static FrameSample of(int index, RgbFrame pixels, double fps) {
        if (fps <= 0) throw new IllegalArgumentException("fps deve ser > 0");
        return new FrameSample(index, pixels, index / fps);
    }
}
