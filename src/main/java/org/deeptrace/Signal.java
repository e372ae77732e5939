package org.deeptrace;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resultado de um estágio de análise: disponível com valor, ou indisponível com o motivo.
 * Estágios indisponíveis entram na fusão com peso zero.
 */
public final class Signal<T> {

    private final T value;
    private final String reason;

    private Signal(T value, String reason) {
        this.value = value;
        this.reason = reason;
    }

    public static <T> Signal<T> available(T value) {
        return new Signal<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Signal<T> unavailable(String reason) {
        return new Signal<>(null, reason == null || reason.isBlank() ? "unavailable" : reason);
    }

    public static <T> Signal<T> ofNullable(T value, String reasonIfMissing) {
        return value != null ? available(value) : unavailable(reasonIfMissing);
    }

    public boolean isAvailable() {
        return value != null;
    }

    public T get() {
        if (value == null) {
            throw new NoSuchElementException("Sinal indisponível: " + reason);
        }
        return value;
    }

    public String reason() {
        return reason;
    }

    public T orElse(T other) {
        return value != null ? value : other;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <R> Signal<R> map(Function<? super T, ? extends R> mapper) {
        return value != null ? available(mapper.apply(value)) : unavailable(reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signal<?> other)) return false;
        return Objects.equals(value, other.value) && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, reason);
    }

    @Override
    public String toString() {
        return value != null ? "Signal[" + value + "]" : "Signal.unavailable[" + reason + "]";
    }
}
