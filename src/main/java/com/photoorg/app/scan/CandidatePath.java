package com.photoorg.app.scan;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Arquivo encontrado pelo scanner: caminho absoluto e o tipo sugerido pela extensão.
 */
public record CandidatePath(Path path, MediaType mediaHint) {

    public CandidatePath {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(mediaHint, "mediaHint");
        if (!path.isAbsolute()) {
            throw new IllegalArgumentException("CandidatePath precisa ser absoluto: " + path);
        }
    }

    public String fileName() {
        return path.getFileName().toString();
    }
}
