package com.photoorg.app.index;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.photoorg.app.organize.CollisionNames;

/**
 * Índice do dry-run: mesmas regras de claim do SQLite, guardado em memória
 * e descartado ao final da execução.
 */
public final class InMemoryDuplicateIndex implements DuplicateIndex {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDuplicateIndex.class);

    private final Object lock = new Object();

    private final List<FileRecord> records = new ArrayList<>();
    private final Map<String, FileRecord> canonicalByHash = new HashMap<>();
    private final Map<String, String> ownerByDestination = new HashMap<>();
    private final Map<Long, SessionRow> sessions = new LinkedHashMap<>();

    private long nextRecordId = 1;
    private long nextSessionId = 1;

    @Override
    public long openSession(SessionStart start) {
        synchronized (lock) {
            long id = nextSessionId++;
            sessions.put(id, new SessionRow(id, start.startedAt(), null, SessionStatus.RUNNING, start.dryRun(),
                    start.workerCount(), start.sourceRoot(), start.destRoot(), start.configSnapshot(),
                    SessionTotals.empty(), null));
            return id;
        }
    }

    @Override
    public void closeSession(long sessionId, SessionStatus status, SessionTotals totals, long durationMs) {
        synchronized (lock) {
            SessionRow row = sessions.get(sessionId);
            if (row == null || row.status() != SessionStatus.RUNNING) return;
            sessions.put(sessionId, new SessionRow(row.id(), row.startedAt(), Instant.now(), status, row.dryRun(),
                    row.workerCount(), row.sourceRoot(), row.destRoot(), row.configSnapshot(), totals, durationMs));
        }
    }

    @Override
    public ClaimResult claim(ClaimRequest request) {
        synchronized (lock) {
            FileRecord existing = canonicalByHash.get(request.hash());
            if (existing != null) {
                return new ClaimResult.LostTo(existing.destPath(), existing.sessionId(),
                        priorPlacement(request.hash(), request.sourcePath()));
            }
            int last = request.firstAttempt() + MAX_DESTINATION_ATTEMPTS;
            for (int attempt = request.firstAttempt(); attempt < last; attempt++) {
                String dest = CollisionNames.candidate(request.candidateDestination(), request.hash(), attempt);
                if (ownerByDestination.containsKey(dest)) continue;

                FileRecord rec = request.toRecord(dest).withId(nextRecordId++);
                records.add(rec);
                canonicalByHash.put(rec.hash(), rec);
                ownerByDestination.put(dest, rec.hash());
                return new ClaimResult.Won(rec);
            }
            throw new IllegalStateException("Nenhum destino livre para " + request.candidateDestination());
        }
    }

    @Override
    public void release(ClaimResult.Won claim) {
        FileRecord rec = claim.record();
        synchronized (lock) {
            FileRecord current = canonicalByHash.get(rec.hash());
            if (current == null || current.id() != rec.id()) {
                logger.warn("Release ignorado: claim {} não é o canônico atual de {}", rec.id(), rec.hash());
                return;
            }
            canonicalByHash.remove(rec.hash());
            ownerByDestination.remove(rec.destPath());
            records.removeIf(r -> r.id() == rec.id());
        }
    }

    @Override
    public FileRecord append(FileRecord record) {
        if (record.status().isCanonical()) {
            throw new IllegalArgumentException("Registros canônicos só entram via claim");
        }
        synchronized (lock) {
            FileRecord stored = record.withId(nextRecordId++);
            records.add(stored);
            return stored;
        }
    }

    @Override
    public Optional<FileRecord> findCanonical(String hash) {
        synchronized (lock) {
            return Optional.ofNullable(canonicalByHash.get(hash));
        }
    }

    @Override
    public List<FileRecord> records() {
        synchronized (lock) {
            return List.copyOf(records);
        }
    }

    @Override
    public List<FileRecord> records(long sessionId) {
        synchronized (lock) {
            return records.stream().filter(r -> r.sessionId() == sessionId).toList();
        }
    }

    @Override
    public List<SessionRow> sessions(int limit) {
        synchronized (lock) {
            return sessions.values().stream()
                    .sorted(Comparator.comparingLong(SessionRow::id).reversed())
                    .limit(Math.max(0, limit))
                    .toList();
        }
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    @Override
    public void close() {
        // nada a liberar
    }

    private String priorPlacement(String hash, String sourcePath) {
        for (FileRecord r : records) {
            if (r.destPath() != null && hash.equals(r.hash()) && sourcePath.equals(r.sourcePath())) {
                return r.destPath();
            }
        }
        return null;
    }
}
