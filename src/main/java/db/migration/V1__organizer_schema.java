package db.migration;

import java.sql.Connection;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V1__organizer_schema extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS sessions (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    started_at TEXT NOT NULL,
                    ended_at TEXT,
                    status TEXT NOT NULL,
                    dry_run INTEGER NOT NULL DEFAULT 0,
                    worker_count INTEGER NOT NULL,
                    source_root TEXT NOT NULL,
                    dest_root TEXT NOT NULL,
                    config_snapshot TEXT,
                    files_seen INTEGER NOT NULL DEFAULT 0,
                    organized INTEGER NOT NULL DEFAULT 0,
                    duplicates INTEGER NOT NULL DEFAULT 0,
                    review INTEGER NOT NULL DEFAULT 0,
                    errors INTEGER NOT NULL DEFAULT 0,
                    scan_errors INTEGER NOT NULL DEFAULT 0,
                    duration_ms INTEGER
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS files (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    hash TEXT,
                    source_path TEXT NOT NULL,
                    dest_path TEXT,
                    duplicate_of TEXT,
                    media_type TEXT NOT NULL,
                    year INTEGER,
                    month INTEGER,
                    status TEXT NOT NULL,
                    session_id INTEGER NOT NULL REFERENCES sessions(id),
                    created_at TEXT NOT NULL
                )
                """);

            // No máximo um registro canônico por hash e por destino.
            st.execute("""
                CREATE UNIQUE INDEX IF NOT EXISTS ux_files_canonical_hash
                    ON files(hash) WHERE status IN ('organized', 'review')
                """);
            st.execute("""
                CREATE UNIQUE INDEX IF NOT EXISTS ux_files_canonical_dest
                    ON files(dest_path) WHERE status IN ('organized', 'review')
                """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_files_hash_source ON files(hash, source_path)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_files_session ON files(session_id)");
        }
    }
}
