package com.photoorg.app.pipeline;

/**
 * Violação detectada antes de qualquer worker iniciar. Nada foi criado.
 */
public class PreRunValidationException extends Exception {

    public PreRunValidationException(String message) {
        super(message);
    }

    public PreRunValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
