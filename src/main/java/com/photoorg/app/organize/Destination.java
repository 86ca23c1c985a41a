package com.photoorg.app.organize;

import com.photoorg.app.index.FileStatus;

/**
 * Categoria e caminho relativo (separador {@code /}) decididos para um arquivo.
 */
public record Destination(FileStatus category, String relativePath) {

    public Destination {
        if (category == FileStatus.ERROR) {
            throw new IllegalArgumentException("Erro não tem destino");
        }
        if (relativePath == null || relativePath.isBlank() || relativePath.startsWith("/")) {
            throw new IllegalArgumentException("Destino relativo inválido: " + relativePath);
        }
    }

    public String fileName() {
        int slash = relativePath.lastIndexOf('/');
        return slash >= 0 ? relativePath.substring(slash + 1) : relativePath;
    }
}
