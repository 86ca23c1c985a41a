package com.photoorg.app.organize;

import java.util.Objects;

import com.photoorg.app.index.ClaimResult;
import com.photoorg.app.index.FileStatus;
import com.photoorg.app.metadata.CaptureDate;
import com.photoorg.app.scan.MediaType;

/**
 * Função pura: tipo de mídia, data e resultado do claim para categoria e caminho.
 *
 * <pre>
 * PHOTO/2023/04/IMG_1.jpg      organizado
 * ToReview/PHOTO/IMG_1.jpg     sem data
 * PHOTO_DUPLICATES/IMG_1.jpg   duplicata
 * </pre>
 */
public final class Classifier {

    public static final String REVIEW_FOLDER = "ToReview";

    private Classifier() {}

    /**
     * Destino canônico desejado, antes do claim.
     */
    public static Destination canonical(String fileName, MediaType type, CaptureDate date) {
        requireName(fileName);
        Objects.requireNonNull(type, "type");
        if (date != null) {
            return new Destination(FileStatus.ORGANIZED,
                    type.folder() + "/" + date.yearText() + "/" + date.monthText() + "/" + fileName);
        }
        return new Destination(FileStatus.REVIEW, REVIEW_FOLDER + "/" + type.folder() + "/" + fileName);
    }

    public static Destination duplicate(String fileName, MediaType type) {
        requireName(fileName);
        return new Destination(FileStatus.DUPLICATE, type.duplicatesFolder() + "/" + fileName);
    }

    /**
     * Para {@code Won} o destino é o que o índice confirmou (pode ter sufixo de colisão).
     */
    public static Destination classify(String fileName, MediaType type, CaptureDate date, ClaimResult claim) {
        Objects.requireNonNull(claim, "claim");
        if (claim instanceof ClaimResult.Won won) {
            FileStatus category = date != null ? FileStatus.ORGANIZED : FileStatus.REVIEW;
            return new Destination(category, won.destination());
        }
        return duplicate(fileName, type);
    }

    private static void requireName(String fileName) {
        if (fileName == null || fileName.isBlank() || fileName.contains("/")) {
            throw new IllegalArgumentException("Nome de arquivo inválido: " + fileName);
        }
    }
}
