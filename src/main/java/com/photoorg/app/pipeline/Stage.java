package com.photoorg.app.pipeline;

/**
 * Estados de um arquivo no pipeline. Só avançam; RECORDED e FAILED são finais.
 */
public enum Stage {
    SCANNED,
    HASHING,
    CLAIMING,
    PLACING,
    RECORDED,
    FAILED;

    public boolean isTerminal() {
        return this == RECORDED || this == FAILED;
    }

    public boolean canMoveTo(Stage next) {
        if (isTerminal()) return false;
        if (next == FAILED) return true;
        return next.ordinal() > ordinal();
    }
}
