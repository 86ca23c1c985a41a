package com.photoorg.app.config;

import java.util.List;

/**
 * Configuração inválida. Reúne todas as violações encontradas de uma vez.
 */
public class ConfigValidationException extends RuntimeException {

    private final List<String> violations;

    public ConfigValidationException(List<String> violations) {
        super("Configuração inválida: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> violations() {
        return violations;
    }
}
