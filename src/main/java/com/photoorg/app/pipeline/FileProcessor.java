package com.photoorg.app.pipeline;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.photoorg.app.hash.ContentHasher;
import com.photoorg.app.index.ClaimRequest;
import com.photoorg.app.index.ClaimResult;
import com.photoorg.app.index.DuplicateIndex;
import com.photoorg.app.index.FileRecord;
import com.photoorg.app.index.FileStatus;
import com.photoorg.app.metadata.CaptureDate;
import com.photoorg.app.metadata.DateResolver;
import com.photoorg.app.organize.Classifier;
import com.photoorg.app.organize.Destination;
import com.photoorg.app.organize.Placer;

/**
 * Caminho de um arquivo: data, hash, claim, classificação, colocação e registro.
 */
final class FileProcessor implements FileHandler {

    private static final Logger logger = LoggerFactory.getLogger(FileProcessor.class);

    private static final int MAX_MESSAGE = 500;

    private final long sessionId;
    private final DuplicateIndex index;
    private final ContentHasher hasher;
    private final DateResolver dateResolver;
    private final Placer placer;

    FileProcessor(long sessionId, DuplicateIndex index, ContentHasher hasher, DateResolver dateResolver, Placer placer) {
        this.sessionId = sessionId;
        this.index = index;
        this.hasher = hasher;
        this.dateResolver = dateResolver;
        this.placer = placer;
    }

    @Override
    public void handle(FileJob job) throws Exception {
        Path source = job.path();
        String sourcePath = source.toString();
        String fileName = job.candidate().fileName();
        String worker = Thread.currentThread().getName();

        job.advance(Stage.HASHING);
        CaptureDate date = resolveDate(source);
        job.captureDate(date);
        long size = Files.size(source);
        job.sizeBytes(size);
        String hash = hasher.hash(source);
        job.hash(hash);

        job.advance(Stage.CLAIMING);
        Destination wanted = Classifier.canonical(fileName, job.mediaType(), date);
        int firstAttempt = placer.firstFreeAttempt(wanted.relativePath(), hash);
        ClaimRequest request = new ClaimRequest(sessionId, hash, sourcePath, job.mediaType(), date,
                wanted.category(), wanted.relativePath(), firstAttempt, size, worker);
        ClaimResult claim = index.claim(request);
        if (claim instanceof ClaimResult.LostTo lostTo && releaseIfStale(lostTo, hash)) {
            claim = index.claim(request.withFirstAttempt(placer.firstFreeAttempt(wanted.relativePath(), hash)));
        }
        Destination dest = Classifier.classify(fileName, job.mediaType(), date, claim);

        if (claim instanceof ClaimResult.Won won) {
            job.advance(Stage.PLACING);
            try {
                placer.place(source, won.destination(), hash);
            } catch (Exception e) {
                index.release(won);
                throw e;
            }
            if (!job.settle(dest.category())) {
                logger.warn("Resultado de {} descartado: arquivo já finalizado por timeout", source);
                return;
            }
            logger.info("{} {} -> {}", label(dest.category()), source, won.destination());
            return;
        }

        ClaimResult.LostTo lost = (ClaimResult.LostTo) claim;
        String placedAt;
        if (lost.alreadyPlaced()) {
            placedAt = lost.priorPlacement();
            logger.debug("{} já colocado em {}", source, placedAt);
        } else {
            job.advance(Stage.PLACING);
            placedAt = placer.placeWithSuffix(source, dest.relativePath(), hash);
        }
        if (!job.settle(FileStatus.DUPLICATE)) {
            logger.warn("Resultado de {} descartado: arquivo já finalizado por timeout", source);
            return;
        }
        index.append(FileRecord.duplicate(sessionId, hash, sourcePath, placedAt, lost.existingDestination(),
                job.mediaType(), date, size, worker));
        logger.info("DUPLICADO {} -> {} (original {})", source, placedAt, lost.existingDestination());
    }

    @Override
    public void recordFailure(FileJob job, Throwable cause) {
        String message = StringUtils.abbreviate(describe(cause), MAX_MESSAGE);
        try {
            index.append(FileRecord.error(sessionId, job.hash(), job.path().toString(), job.mediaType(),
                    job.captureDate(), job.sizeBytes(), job.workerName(), message));
        } catch (RuntimeException e) {
            logger.error("Não foi possível registrar o erro de {}: {}", job.path(), message, e);
        }
    }

    /**
     * Um claim de sessão anterior cujo arquivo não existe no destino (execução
     * interrompida entre o claim e a colocação) é liberado para ser refeito.
     *
     * @return true se o hash ficou livre para um novo claim
     */
    private boolean releaseIfStale(ClaimResult.LostTo lost, String hash) {
        if (placer.isDryRun() || !index.isDurable() || lost.existingSessionId() == sessionId) return false;
        if (Files.exists(placer.resolve(lost.existingDestination()), LinkOption.NOFOLLOW_LINKS)) return false;

        Optional<FileRecord> owner = index.findCanonical(hash);
        if (owner.isEmpty()) return true;
        FileRecord stale = owner.get();
        if (stale.sessionId() == sessionId || !stale.destPath().equals(lost.existingDestination())) {
            // outro worker já refez o claim
            return false;
        }
        logger.warn("Claim da sessão {} aponta para {} ausente no destino; refazendo", stale.sessionId(), stale.destPath());
        index.release(new ClaimResult.Won(stale));
        return true;
    }

    private CaptureDate resolveDate(Path source) {
        try {
            return dateResolver.resolve(source).orElse(null);
        } catch (RuntimeException e) {
            logger.debug("Resolução de data falhou para {}", source, e);
            return null;
        }
    }

    private static String label(FileStatus status) {
        return status == FileStatus.REVIEW ? "REVISAR" : "ORGANIZADO";
    }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        String type = cause.getClass().getSimpleName();
        return StringUtils.isBlank(msg) ? type : type + ": " + msg;
    }
}
