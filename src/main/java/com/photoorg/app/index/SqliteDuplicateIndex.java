package com.photoorg.app.index;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.photoorg.app.database.BusyRetry;
import com.photoorg.app.database.Database;
import com.photoorg.app.database.OrganizerDao;
import com.photoorg.app.organize.CollisionNames;

/**
 * Índice durável sobre SQLite. A unicidade vem dos índices parciais
 * {@code ux_files_canonical_hash} e {@code ux_files_canonical_dest}.
 */
public final class SqliteDuplicateIndex implements DuplicateIndex {

    private static final Logger logger = LoggerFactory.getLogger(SqliteDuplicateIndex.class);

    private final Database database;
    private final Jdbi jdbi;
    private final BusyRetry retry;
    private final boolean ownsDatabase;

    public SqliteDuplicateIndex(Database database, BusyRetry retry, boolean ownsDatabase) {
        this.database = database;
        this.jdbi = database.jdbi();
        this.retry = retry;
        this.ownsDatabase = ownsDatabase;
    }

    @Override
    public long openSession(SessionStart start) {
        return retry.call("openSession", () -> jdbi.withExtension(OrganizerDao.class, dao ->
                dao.startSession(start.startedAt().toString(), start.dryRun(), start.workerCount(),
                        start.sourceRoot(), start.destRoot(), start.configSnapshot())));
    }

    @Override
    public void closeSession(long sessionId, SessionStatus status, SessionTotals totals, long durationMs) {
        int updated = retry.call("closeSession", () -> jdbi.withExtension(OrganizerDao.class, dao ->
                dao.finishSession(sessionId, Instant.now().toString(), status.name(), totals, durationMs)));
        if (updated == 0) {
            logger.warn("Sessão {} já estava fechada", sessionId);
        }
    }

    @Override
    public ClaimResult claim(ClaimRequest request) {
        int attempt = request.firstAttempt();
        int last = attempt + MAX_DESTINATION_ATTEMPTS;
        int rounds = 0;
        while (attempt < last && rounds++ < MAX_DESTINATION_ATTEMPTS * 2) {
            String dest = CollisionNames.candidate(request.candidateDestination(), request.hash(), attempt);
            FileRecord candidate = request.toRecord(dest);

            int inserted = retry.call("claim", () ->
                    jdbi.withExtension(OrganizerDao.class, dao -> dao.insertIfAbsent(candidate)));
            if (inserted == 1) {
                FileRecord stored = findCanonical(request.hash())
                        .filter(r -> r.sourcePath().equals(request.sourcePath()) && r.sessionId() == request.sessionId())
                        .orElseThrow(() -> new IllegalStateException("Claim inserido mas não encontrado: " + request.hash()));
                return new ClaimResult.Won(stored);
            }

            Optional<FileRecord> owner = findCanonical(request.hash());
            if (owner.isPresent()) {
                FileRecord existing = owner.get();
                String prior = retry.call("priorPlacement", () -> jdbi.withExtension(OrganizerDao.class,
                        dao -> dao.findPriorPlacement(request.hash(), request.sourcePath()).orElse(null)));
                return new ClaimResult.LostTo(existing.destPath(), existing.sessionId(), prior);
            }

            boolean destTaken = retry.call("destinationOwner", () -> jdbi.withExtension(OrganizerDao.class,
                    dao -> dao.findDestinationOwner(dest).isPresent()));
            if (destTaken) {
                attempt++;
            } else {
                // o dono foi liberado entre o insert e a consulta; mesmo nome de novo
                logger.debug("Claim recusado sem dono visível para {}, repetindo", dest);
            }
        }
        throw new IllegalStateException("Nenhum destino livre para " + request.candidateDestination());
    }

    @Override
    public void release(ClaimResult.Won claim) {
        FileRecord rec = claim.record();
        int deleted = retry.call("release", () -> jdbi.withExtension(OrganizerDao.class,
                dao -> dao.deleteClaim(rec.id(), rec.hash())));
        if (deleted == 0) {
            logger.warn("Release ignorado: claim {} não encontrado para {}", rec.id(), rec.hash());
        }
    }

    @Override
    public FileRecord append(FileRecord record) {
        if (record.status().isCanonical()) {
            throw new IllegalArgumentException("Registros canônicos só entram via claim");
        }
        long id = retry.call("append", () -> jdbi.withExtension(OrganizerDao.class, dao -> dao.insert(record)));
        return record.withId(id);
    }

    @Override
    public Optional<FileRecord> findCanonical(String hash) {
        return retry.call("findCanonical", () -> jdbi.withExtension(OrganizerDao.class, dao -> dao.findCanonical(hash)));
    }

    @Override
    public List<FileRecord> records() {
        return jdbi.withExtension(OrganizerDao.class, OrganizerDao::fetchAllFiles);
    }

    @Override
    public List<FileRecord> records(long sessionId) {
        return jdbi.withExtension(OrganizerDao.class, dao -> dao.fetchFilesBySession(sessionId));
    }

    @Override
    public List<SessionRow> sessions(int limit) {
        return jdbi.withExtension(OrganizerDao.class, dao -> dao.fetchRecentSessions(Math.max(0, limit)));
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    public Database database() {
        return database;
    }

    @Override
    public void close() {
        if (ownsDatabase) {
            database.close();
        }
    }
}
