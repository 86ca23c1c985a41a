package db.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Tamanho, worker e mensagem de erro por registro.
 */
public final class V2__file_details extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        addColumnIfMissing(conn, "files", "size_bytes", "INTEGER");
        addColumnIfMissing(conn, "files", "worker", "TEXT");
        addColumnIfMissing(conn, "files", "message", "TEXT");

        try (var st = conn.createStatement()) {
            st.execute("CREATE INDEX IF NOT EXISTS idx_files_status ON files(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sessions_started ON sessions(started_at)");
        }
    }

    private void addColumnIfMissing(Connection conn, String table, String column, String type) throws SQLException {
        if (!tableExists(conn, table) || columnExists(conn, table, column)) return;
        try (var st = conn.createStatement()) {
            st.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + type);
        }
    }

    private boolean tableExists(Connection conn, String table) throws SQLException {
        String sql = "SELECT name FROM sqlite_master WHERE type='table' AND name = ?";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private boolean columnExists(Connection conn, String table, String column) throws SQLException {
        try (var st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                if (column.equalsIgnoreCase(rs.getString("name"))) return true;
            }
        }
        return false;
    }
}
