package org.deeptrace;

/**
 * Intervalo de tempo em segundos, [start, end).
 */
public record TimeInterval(double startSeconds, double endSeconds) {

    public TimeInterval {
        if (endSeconds < startSeconds) {
            throw new IllegalArgumentException("Intervalo invertido: " + startSeconds + " > " + endSeconds);
        }
    }

    public double duration() {
        return endSeconds - startSeconds;
    }
}
