package com.photoorg.app.organize;

import java.io.IOException;

/**
 * Falha ao colocar um arquivo no destino. Artefatos parciais já foram removidos.
 */
public class PlacementException extends IOException {

    private final boolean collision;

    public PlacementException(String message, boolean collision, Throwable cause) {
        super(message, cause);
        this.collision = collision;
    }

    public PlacementException(String message, Throwable cause) {
        this(message, false, cause);
    }

    /** O destino já estava ocupado por outro arquivo. */
    public boolean isCollision() {
        return collision;
    }
}
