package com.photoorg.app.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.photoorg.app.config.Config;
import com.photoorg.app.config.OrganizerConfig;
import com.photoorg.app.database.BusyRetry;
import com.photoorg.app.database.Database;
import com.photoorg.app.hash.ContentHasher;
import com.photoorg.app.index.DuplicateIndex;
import com.photoorg.app.index.InMemoryDuplicateIndex;
import com.photoorg.app.index.SessionStart;
import com.photoorg.app.index.SessionStatus;
import com.photoorg.app.index.SessionTotals;
import com.photoorg.app.index.SqliteDuplicateIndex;
import com.photoorg.app.metadata.DateResolver;
import com.photoorg.app.metadata.FilenameDateResolver;
import com.photoorg.app.metadata.MediaDateResolver;
import com.photoorg.app.organize.Placer;
import com.photoorg.app.scan.PathScanner;
import com.photoorg.app.scan.ScanMetrics;

/**
 * Executa uma sessão: valida os caminhos, abre o índice, varre a origem,
 * processa tudo no {@link WorkerPool} e fecha a sessão com os totais.
 */
public final class Organizer {

    private static final Logger logger = LoggerFactory.getLogger(Organizer.class);

    public static final String MDC_SESSION = "session";

    private static final ObjectMapper JSON = new ObjectMapper();

    private final OrganizerConfig config;
    private final DateResolver dateResolver;

    public Organizer(OrganizerConfig config) {
        this(config, new MediaDateResolver(new FilenameDateResolver(config.photographicPrefixes())));
    }

    public Organizer(OrganizerConfig config, DateResolver dateResolver) {
        this.config = config;
        this.dateResolver = dateResolver;
    }

    /**
     * Caminho do banco desta configuração.
     */
    public static Path databaseFile(OrganizerConfig config) {
        return config.database() != null ? config.database() : Config.getDbFilePath();
    }

    /**
     * @param cancel pedido de parada cooperativa (ex.: shutdown hook)
     * @throws PreRunValidationException antes de criar qualquer coisa
     */
    public SessionSummary run(AtomicBoolean cancel) throws PreRunValidationException {
        PathSafety.Resolved paths = PathSafety.validate(config.source(), config.destination());
        int workers = config.workerCount();
        boolean dryRun = config.dryRun();

        if (!dryRun) {
            try {
                Files.createDirectories(paths.destination());
            } catch (IOException e) {
                throw new PreRunValidationException("Não foi possível criar o destino: " + paths.destination(), e);
            }
        }

        Path dbFile = dryRun ? null : databaseFile(config).toAbsolutePath();
        try (DuplicateIndex index = openIndex(dbFile, workers)) {
            return runSession(index, paths, workers, cancel, dbFile);
        }
    }

    private DuplicateIndex openIndex(Path dbFile, int workers) {
        if (dbFile == null) {
            logger.info("[DRY-RUN] Índice em memória; nenhum arquivo será escrito");
            return new InMemoryDuplicateIndex();
        }
        OrganizerConfig.DatabaseSettings db = config.databaseSettings();
        Database database = Database.open(dbFile, workers + 2, db.busyTimeout());
        return new SqliteDuplicateIndex(database, new BusyRetry(db.busyRetries(), db.busyBackoff()), true);
    }

    private SessionSummary runSession(DuplicateIndex index, PathSafety.Resolved paths, int workers,
                                      AtomicBoolean cancel, Path dbFile) {
        Instant started = Instant.now();
        long t0 = System.nanoTime();

        long sessionId = index.openSession(new SessionStart(started, config.dryRun(), workers,
                paths.source().toString(), paths.destination().toString(), snapshotJson(workers)));
        MDC.put(MDC_SESSION, String.valueOf(sessionId));

        logger.info("Sessão {} iniciada: {} -> {} ({} workers, {}{})", sessionId, paths.source(), paths.destination(),
                workers, config.transfer(), config.dryRun() ? ", dry-run" : "");

        PipelineStats stats = new PipelineStats();
        ScanMetrics scanMetrics = new ScanMetrics();
        Placer placer = new Placer(paths.destination(), config.transfer(), config.dryRun());
        sweepPartials(placer);
        ContentHasher hasher = new ContentHasher(config.performance().hashAlgorithm(), config.performance().bufferSize());
        FileProcessor processor = new FileProcessor(sessionId, index, hasher, dateResolver, placer);
        PathScanner scanner = new PathScanner(config.scanRules());

        SessionStatus status = SessionStatus.COMPLETED;
        RuntimeException failure = null;
        try (WorkerPool pool = new WorkerPool(workers, config.performance().queueCapacity(), processor, stats,
                cancel, config.performance().fileTimeout())) {
            pool.start();
            try {
                scanner.scan(paths.source(), pool::submit, scanMetrics, cancel);
            } catch (IOException e) {
                failure = new UncheckedIOException("Varredura da origem falhou", e);
                status = SessionStatus.FAILED;
            } catch (RuntimeException e) {
                failure = e;
                status = SessionStatus.FAILED;
            }
            try {
                pool.drain();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                status = SessionStatus.CANCELED;
            }
        } finally {
            MDC.remove(MDC_SESSION);
        }

        if (status == SessionStatus.COMPLETED && cancel.get()) {
            status = SessionStatus.CANCELED;
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - t0);
        SessionTotals totals = stats.snapshot(scanMetrics.scanErrors.sum());
        index.closeSession(sessionId, status, totals, duration.toMillis());

        if (status == SessionStatus.COMPLETED && index instanceof SqliteDuplicateIndex sqlite
                && config.databaseSettings().vacuumOnCompletion()) {
            sqlite.database().optimize();
        }

        SessionSummary summary = new SessionSummary(sessionId, status, config.dryRun(), workers, totals,
                stats.photosOrganized.sum(), stats.videosOrganized.sum(), duration, dbFile);
        logger.info("Sessão {} finalizada: {} (vistos={}, organizados={}, duplicados={}, revisão={}, erros={}, erros scan={})",
                sessionId, status, totals.filesSeen(), totals.organized(), totals.duplicates(), totals.review(),
                totals.errors(), totals.scanErrors());

        if (failure != null) {
            logger.error("Sessão {} falhou", sessionId, failure);
            throw failure;
        }
        return summary;
    }

    private static void sweepPartials(Placer placer) {
        try {
            int removed = placer.sweepPartials();
            if (removed > 0) {
                logger.info("{} temporários de execução interrompida removidos", removed);
            }
        } catch (IOException e) {
            logger.warn("Não foi possível limpar temporários em {}", placer.destRoot(), e);
        }
    }

    private String snapshotJson(int workers) {
        try {
            return JSON.writeValueAsString(config.snapshot(workers));
        } catch (JsonProcessingException e) {
            logger.warn("Snapshot da configuração não serializado", e);
            return null;
        }
    }
}
