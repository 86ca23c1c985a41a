package com.photoorg.app.scan;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.io.FilenameUtils;

/**
 * Regras de exclusão e extensões aceitas por tipo de mídia.
 * Extensões são guardadas em minúsculas, com o ponto.
 */
public record ScanRules(
        boolean excludeHidden,
        List<String> excludePatterns,
        Set<String> imageExtensions,
        Set<String> videoExtensions,
        Set<String> otherExtensions
) {

    public ScanRules {
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        imageExtensions = lower(imageExtensions);
        videoExtensions = lower(videoExtensions);
        otherExtensions = lower(otherExtensions);
    }

    /**
     * Tipo de mídia pela extensão; vazio se a extensão não está em nenhuma lista.
     */
    public Optional<MediaType> mediaTypeOf(String fileName) {
        String ext = extensionOf(fileName);
        if (ext.isEmpty()) return Optional.empty();
        if (imageExtensions.contains(ext)) return Optional.of(MediaType.PHOTO);
        if (videoExtensions.contains(ext)) return Optional.of(MediaType.VIDEO);
        if (otherExtensions.contains(ext)) return Optional.of(MediaType.UNKNOWN);
        return Optional.empty();
    }

    /** ".jpg" para "IMG_1.JPG"; vazio sem extensão. */
    public static String extensionOf(String fileName) {
        String ext = FilenameUtils.getExtension(fileName);
        // ".hidden" é nome, não extensão
        if (ext.isEmpty() || FilenameUtils.getBaseName(fileName).isEmpty()) return "";
        return "." + ext.toLowerCase(Locale.ROOT);
    }

    private static Set<String> lower(Set<String> exts) {
        if (exts == null) return Set.of();
        return exts.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
