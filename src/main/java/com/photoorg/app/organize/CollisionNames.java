package com.photoorg.app.organize;

import org.apache.commons.io.FilenameUtils;

/**
 * Nomes alternativos para destinos ocupados por outro conteúdo.
 *
 * <pre>
 * tentativa 0: PHOTO/2023/04/IMG_1.jpg
 * tentativa 1: PHOTO/2023/04/IMG_1_3fa2c9d1.jpg
 * tentativa n: PHOTO/2023/04/IMG_1_3fa2c9d1_n.jpg
 * </pre>
 */
public final class CollisionNames {

    public static final int HASH_PREFIX_LENGTH = 8;

    private CollisionNames() {}

    /**
     * @param relativePath caminho relativo com separador {@code /}
     */
    public static String candidate(String relativePath, String hash, int attempt) {
        if (attempt < 0) throw new IllegalArgumentException("attempt < 0");
        if (attempt == 0) return relativePath;

        int slash = relativePath.lastIndexOf('/');
        String dir = slash >= 0 ? relativePath.substring(0, slash + 1) : "";
        String name = slash >= 0 ? relativePath.substring(slash + 1) : relativePath;

        String stem = FilenameUtils.getBaseName(name);
        String ext = FilenameUtils.getExtension(name);
        String prefix = hashPrefix(hash);

        StringBuilder sb = new StringBuilder(dir).append(stem).append('_').append(prefix);
        if (attempt > 1) sb.append('_').append(attempt);
        if (!ext.isEmpty()) sb.append('.').append(ext);
        return sb.toString();
    }

    public static String hashPrefix(String hash) {
        if (hash == null || hash.isEmpty()) return "nohash";
        return hash.length() <= HASH_PREFIX_LENGTH ? hash : hash.substring(0, HASH_PREFIX_LENGTH);
    }
}
