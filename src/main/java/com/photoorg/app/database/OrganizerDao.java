package com.photoorg.app.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import com.photoorg.app.index.FileRecord;
import com.photoorg.app.index.FileStatus;
import com.photoorg.app.index.SessionRow;
import com.photoorg.app.index.SessionStatus;
import com.photoorg.app.index.SessionTotals;
import com.photoorg.app.scan.MediaType;

/**
 * Todas as instruções são de comando único em autocommit; nenhuma transação
 * explícita atravessa o claim.
 */
public interface OrganizerDao {

    // --- Sessões -------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO sessions(started_at, status, dry_run, worker_count, source_root, dest_root, config_snapshot)
        VALUES (:startedAt, 'RUNNING', :dryRun, :workerCount, :sourceRoot, :destRoot, :configSnapshot)
        """)
    @GetGeneratedKeys("id")
    long startSession(@Bind("startedAt") String startedAt,
                      @Bind("dryRun") boolean dryRun,
                      @Bind("workerCount") int workerCount,
                      @Bind("sourceRoot") String sourceRoot,
                      @Bind("destRoot") String destRoot,
                      @Bind("configSnapshot") String configSnapshot);

    @SqlUpdate("""
        UPDATE sessions
           SET ended_at = :endedAt,
               status = :status,
               files_seen = :t.filesSeen,
               organized = :t.organized,
               duplicates = :t.duplicates,
               review = :t.review,
               errors = :t.errors,
               scan_errors = :t.scanErrors,
               duration_ms = :durationMs
         WHERE id = :id
           AND status = 'RUNNING'
        """)
    int finishSession(@Bind("id") long id,
                      @Bind("endedAt") String endedAt,
                      @Bind("status") String status,
                      @BindMethods("t") SessionTotals totals,
                      @Bind("durationMs") long durationMs);

    @SqlQuery("SELECT * FROM sessions ORDER BY id DESC LIMIT :limit")
    @RegisterRowMapper(SessionRowMapper.class)
    List<SessionRow> fetchRecentSessions(@Bind("limit") int limit);

    // --- Registros -----------------------------------------------------------

    /**
     * O claim: recusado pelos índices únicos parciais quando o hash ou o destino
     * já têm dono canônico.
     *
     * @return 1 se inserido, 0 se recusado
     */
    @SqlUpdate("""
        INSERT OR IGNORE INTO files(hash, source_path, dest_path, duplicate_of, media_type, year, month,
                                    status, session_id, created_at, size_bytes, worker, message)
        VALUES (:hash, :sourcePath, :destPath, :duplicateOf, :mediaType, :year, :month,
                :status, :sessionId, :createdAt, :sizeBytes, :worker, :message)
        """)
    int insertIfAbsent(@Bind("hash") String hash,
                       @Bind("sourcePath") String sourcePath,
                       @Bind("destPath") String destPath,
                       @Bind("duplicateOf") String duplicateOf,
                       @Bind("mediaType") String mediaType,
                       @Bind("year") Integer year,
                       @Bind("month") Integer month,
                       @Bind("status") String status,
                       @Bind("sessionId") long sessionId,
                       @Bind("createdAt") String createdAt,
                       @Bind("sizeBytes") Long sizeBytes,
                       @Bind("worker") String worker,
                       @Bind("message") String message);

    @SqlUpdate("""
        INSERT INTO files(hash, source_path, dest_path, duplicate_of, media_type, year, month,
                          status, session_id, created_at, size_bytes, worker, message)
        VALUES (:hash, :sourcePath, :destPath, :duplicateOf, :mediaType, :year, :month,
                :status, :sessionId, :createdAt, :sizeBytes, :worker, :message)
        """)
    @GetGeneratedKeys("id")
    long insert(@Bind("hash") String hash,
                @Bind("sourcePath") String sourcePath,
                @Bind("destPath") String destPath,
                @Bind("duplicateOf") String duplicateOf,
                @Bind("mediaType") String mediaType,
                @Bind("year") Integer year,
                @Bind("month") Integer month,
                @Bind("status") String status,
                @Bind("sessionId") long sessionId,
                @Bind("createdAt") String createdAt,
                @Bind("sizeBytes") Long sizeBytes,
                @Bind("worker") String worker,
                @Bind("message") String message);

    default int insertIfAbsent(FileRecord r) {
        return insertIfAbsent(r.hash(), r.sourcePath(), r.destPath(), r.duplicateOf(), r.mediaType().dbValue(),
                r.year(), r.month(), r.status().dbValue(), r.sessionId(), r.createdAt().toString(),
                r.sizeBytes(), r.worker(), r.message());
    }

    default long insert(FileRecord r) {
        return insert(r.hash(), r.sourcePath(), r.destPath(), r.duplicateOf(), r.mediaType().dbValue(),
                r.year(), r.month(), r.status().dbValue(), r.sessionId(), r.createdAt().toString(),
                r.sizeBytes(), r.worker(), r.message());
    }

    @SqlQuery("SELECT * FROM files WHERE hash = :hash AND status IN ('organized', 'review')")
    @RegisterRowMapper(FileRecordMapper.class)
    Optional<FileRecord> findCanonical(@Bind("hash") String hash);

    @SqlQuery("SELECT hash FROM files WHERE dest_path = :destPath AND status IN ('organized', 'review')")
    Optional<String> findDestinationOwner(@Bind("destPath") String destPath);

    @SqlQuery("""
        SELECT dest_path
          FROM files
         WHERE hash = :hash
           AND source_path = :sourcePath
           AND dest_path IS NOT NULL
         ORDER BY id
         LIMIT 1
        """)
    Optional<String> findPriorPlacement(@Bind("hash") String hash, @Bind("sourcePath") String sourcePath);

    /**
     * Remove um claim vencido. Só apaga a linha canônica exata.
     */
    @SqlUpdate("""
        DELETE FROM files
         WHERE id = :id
           AND hash = :hash
           AND status IN ('organized', 'review')
        """)
    int deleteClaim(@Bind("id") long id, @Bind("hash") String hash);

    @SqlQuery("SELECT * FROM files ORDER BY id")
    @RegisterRowMapper(FileRecordMapper.class)
    List<FileRecord> fetchAllFiles();

    @SqlQuery("SELECT * FROM files WHERE session_id = :sessionId ORDER BY id")
    @RegisterRowMapper(FileRecordMapper.class)
    List<FileRecord> fetchFilesBySession(@Bind("sessionId") long sessionId);

    // --- Mappers -------------------------------------------------------------

    final class FileRecordMapper implements RowMapper<FileRecord> {
        @Override
        public FileRecord map(ResultSet rs, StatementContext ctx) throws SQLException {
            return new FileRecord(
                    rs.getLong("id"),
                    rs.getString("hash"),
                    rs.getString("source_path"),
                    rs.getString("dest_path"),
                    rs.getString("duplicate_of"),
                    MediaType.fromDb(rs.getString("media_type")),
                    nullableInt(rs, "year"),
                    nullableInt(rs, "month"),
                    FileStatus.fromDb(rs.getString("status")),
                    rs.getLong("session_id"),
                    Instant.parse(rs.getString("created_at")),
                    nullableLong(rs, "size_bytes"),
                    rs.getString("worker"),
                    rs.getString("message"));
        }

        static Integer nullableInt(ResultSet rs, String column) throws SQLException {
            int v = rs.getInt(column);
            return rs.wasNull() ? null : v;
        }

        static Long nullableLong(ResultSet rs, String column) throws SQLException {
            long v = rs.getLong(column);
            return rs.wasNull() ? null : v;
        }
    }

    final class SessionRowMapper implements RowMapper<SessionRow> {
        @Override
        public SessionRow map(ResultSet rs, StatementContext ctx) throws SQLException {
            SessionTotals totals = new SessionTotals(
                    rs.getLong("files_seen"),
                    rs.getLong("organized"),
                    rs.getLong("duplicates"),
                    rs.getLong("review"),
                    rs.getLong("errors"),
                    rs.getLong("scan_errors"));
            String endedAt = rs.getString("ended_at");
            return new SessionRow(
                    rs.getLong("id"),
                    Instant.parse(rs.getString("started_at")),
                    endedAt == null ? null : Instant.parse(endedAt),
                    SessionStatus.valueOf(rs.getString("status")),
                    rs.getInt("dry_run") != 0,
                    rs.getInt("worker_count"),
                    rs.getString("source_root"),
                    rs.getString("dest_root"),
                    rs.getString("config_snapshot"),
                    totals,
                    FileRecordMapper.nullableLong(rs, "duration_ms"));
        }
    }
}
