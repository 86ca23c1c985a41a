package com.photoorg.app.database;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.photoorg.app.config.Config;

import static org.junit.jupiter.api.Assertions.*;

public class DatabaseLifecycleTest {

    @TempDir
    Path tmp;

    @Test
    void openCreatesSchemaAndIsReopenable() throws Exception {
        Path file = tmp.resolve("nested/dir/organizer.db");

        try (Database db = Database.open(file, 2, Duration.ofSeconds(5))) {
            assertTrue(Files.exists(file), "arquivo do banco deve existir depois de aberto");
            assertEquals(file.toAbsolutePath().normalize(), db.file());

            List<String> tables = db.jdbi().withHandle(h -> h.createQuery(
                    "SELECT name FROM sqlite_master WHERE type = 'table' ORDER BY name")
                    .mapTo(String.class).list());
            assertTrue(tables.contains("files"), tables.toString());
            assertTrue(tables.contains("sessions"), tables.toString());

            List<String> columns = db.jdbi().withHandle(h -> h.createQuery("SELECT name FROM pragma_table_info('files')")
                    .mapTo(String.class).list());
            assertTrue(columns.containsAll(List.of("size_bytes", "worker", "message")), columns.toString());

            String mode = db.jdbi().withHandle(h -> h.createQuery("PRAGMA journal_mode").mapTo(String.class).one());
            assertEquals("wal", mode.toLowerCase());

            db.optimize();
        }

        // segunda abertura: migrações já aplicadas
        try (Database db = Database.open(file, 2, Duration.ofSeconds(5))) {
            int applied = db.jdbi().withHandle(h -> h.createQuery(
                    "SELECT COUNT(*) FROM flyway_schema_history WHERE success = 1 AND version IS NOT NULL")
                    .mapTo(Integer.class).one());
            assertTrue(applied >= 2);
        }
    }

    @Test
    void deleteFilesRemovesSidecars() throws Exception {
        Path file = tmp.resolve("x.db");
        Files.writeString(file, "");
        Files.writeString(tmp.resolve("x.db-wal"), "");
        Files.writeString(tmp.resolve("x.db-shm"), "");

        assertTrue(Database.deleteFiles(file));
        assertFalse(Files.exists(file));
        assertFalse(Files.exists(tmp.resolve("x.db-wal")));
        assertFalse(Files.exists(tmp.resolve("x.db-shm")));
        assertFalse(Database.deleteFiles(file));
    }

    @Test
    void defaultLocationHonorsDataDirProperty() {
        String dataDir = System.getProperty("photoorg.dataDir");
        Path db = Config.getDbFilePath();
        assertEquals("organizer.db", db.getFileName().toString());
        if (dataDir != null && !dataDir.isBlank()) {
            assertEquals(Path.of(dataDir).resolve("organizer.db"), db);
        }
        assertTrue(Config.getDbUrl(db).startsWith("jdbc:sqlite:"));
    }
}
