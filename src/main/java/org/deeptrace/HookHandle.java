package org.deeptrace;

/**
 * Registro de hook no classificador; {@link #remove()} deve ser idempotente.
 */
public interface HookHandle extends AutoCloseable {

    void remove();

    @Override
    default void close() {
        remove();
    }
}
