package com.photoorg.app.index;

import java.util.Locale;

/**
 * Destino final de um arquivo dentro de uma sessão.
 */
public enum FileStatus {
    ORGANIZED,
    DUPLICATE,
    REVIEW,
    ERROR;

    /**
     * Registros canônicos são a primeira cópia de um conteúdo: no máximo um por hash.
     */
    public boolean isCanonical() {
        return this == ORGANIZED || this == REVIEW;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FileStatus fromDb(String v) {
        return valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
