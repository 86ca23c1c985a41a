package com.photoorg.app.scan;

import java.util.Locale;

/**
 * Tipo de mídia derivado da extensão do arquivo.
 */
public enum MediaType {
    PHOTO("PHOTO"),
    VIDEO("VIDEO"),
    UNKNOWN("OTHER");

    private final String folder;

    MediaType(String folder) {
        this.folder = folder;
    }

    /** Pasta raiz na árvore de destino (PHOTO, VIDEO, OTHER). */
    public String folder() {
        return folder;
    }

    public String duplicatesFolder() {
        return folder + "_DUPLICATES";
    }

    /** Valor gravado na coluna media_type. */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MediaType fromDb(String v) {
        if (v == null || v.isBlank()) return UNKNOWN;
        try {
            return valueOf(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
