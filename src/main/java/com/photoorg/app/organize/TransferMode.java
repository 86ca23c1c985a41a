package com.photoorg.app.organize;

import java.util.Locale;

public enum TransferMode {
    /** A origem fica intacta. */
    COPY,
    /** A origem é removida depois que o destino está completo. */
    MOVE;

    public static TransferMode parse(String v) {
        if (v == null || v.isBlank()) return COPY;
        return valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
