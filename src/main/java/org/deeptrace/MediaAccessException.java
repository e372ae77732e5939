package org.deeptrace;

import java.io.IOException;

/**
 * Arquivo de mídia inexistente, ilegível ou que o decodificador não consegue abrir.
 */
public class MediaAccessException extends IOException {

    public MediaAccessException(String message) {
        super(message);
    }

    public MediaAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
