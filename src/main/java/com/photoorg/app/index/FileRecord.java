package com.photoorg.app.index;

import java.time.Instant;
import java.util.Objects;

import com.photoorg.app.metadata.CaptureDate;
import com.photoorg.app.scan.MediaType;

/**
 * Registro imutável da decisão tomada para um arquivo.
 *
 * <p>{@code destPath} é relativo à raiz de destino, com separador {@code /}.
 * {@code duplicateOf} aponta para o destino do registro canônico quando o
 * status é {@link FileStatus#DUPLICATE}. {@code id} é 0 antes da gravação.
 */
public record FileRecord(
        long id,
        String hash,
        String sourcePath,
        String destPath,
        String duplicateOf,
        MediaType mediaType,
        Integer year,
        Integer month,
        FileStatus status,
        long sessionId,
        Instant createdAt,
        Long sizeBytes,
        String worker,
        String message
) {

    public FileRecord {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(mediaType, "mediaType");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        if (status.isCanonical() && (hash == null || destPath == null)) {
            throw new IllegalArgumentException("Registro canônico exige hash e destino");
        }
        if (status == FileStatus.DUPLICATE && hash == null) {
            throw new IllegalArgumentException("Duplicata sem hash");
        }
    }

    public FileRecord withId(long newId) {
        return new FileRecord(newId, hash, sourcePath, destPath, duplicateOf, mediaType, year, month,
                status, sessionId, createdAt, sizeBytes, worker, message);
    }

    public static FileRecord duplicate(long sessionId, String hash, String sourcePath, String destPath,
                                       String duplicateOf, MediaType mediaType, CaptureDate date,
                                       long sizeBytes, String worker) {
        return new FileRecord(0, hash, sourcePath, destPath, duplicateOf, mediaType,
                yearOf(date), monthOf(date), FileStatus.DUPLICATE, sessionId, Instant.now(),
                sizeBytes, worker, null);
    }

    /**
     * Registro de falha. Hash, data e tamanho podem faltar dependendo do estágio em que falhou.
     */
    public static FileRecord error(long sessionId, String hash, String sourcePath, MediaType mediaType,
                                   CaptureDate date, Long sizeBytes, String worker, String message) {
        return new FileRecord(0, hash, sourcePath, null, null, mediaType,
                yearOf(date), monthOf(date), FileStatus.ERROR, sessionId, Instant.now(),
                sizeBytes, worker, message);
    }

    static Integer yearOf(CaptureDate date) {
        return date == null ? null : date.year();
    }

    static Integer monthOf(CaptureDate date) {
        return date == null ? null : date.month();
    }
}
