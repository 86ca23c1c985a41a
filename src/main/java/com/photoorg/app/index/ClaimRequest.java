package com.photoorg.app.index;

import java.time.Instant;
import java.util.Objects;

import com.photoorg.app.metadata.CaptureDate;
import com.photoorg.app.scan.MediaType;

/**
 * Pedido de registro canônico para um conteúdo.
 *
 * @param candidateDestination destino relativo desejado; o índice pode trocá-lo
 *                             pelo nome de colisão se já pertencer a outro hash
 * @param firstAttempt         primeira tentativa de nome livre no disco (0 = o próprio candidato)
 */
public record ClaimRequest(
        long sessionId,
        String hash,
        String sourcePath,
        MediaType mediaType,
        CaptureDate captureDate,
        FileStatus status,
        String candidateDestination,
        int firstAttempt,
        long sizeBytes,
        String worker
) {

    public ClaimRequest {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(mediaType, "mediaType");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(candidateDestination, "candidateDestination");
        if (!status.isCanonical()) {
            throw new IllegalArgumentException("Claim só aceita status canônico: " + status);
        }
        if (firstAttempt < 0) {
            throw new IllegalArgumentException("firstAttempt negativo: " + firstAttempt);
        }
    }

    public ClaimRequest withFirstAttempt(int attempt) {
        return new ClaimRequest(sessionId, hash, sourcePath, mediaType, captureDate, status,
                candidateDestination, attempt, sizeBytes, worker);
    }

    FileRecord toRecord(String destination) {
        return new FileRecord(0, hash, sourcePath, destination, null, mediaType,
                FileRecord.yearOf(captureDate), FileRecord.monthOf(captureDate), status,
                sessionId, Instant.now(), sizeBytes, worker, null);
    }
}
