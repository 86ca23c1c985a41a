package com.photoorg.app.maintenance;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class ResetServiceTest {

    @TempDir
    Path tmp;

    @Test
    void removesDatabaseAndCategoryFoldersOnly() throws Exception {
        Path dest = tmp.resolve("dest");
        Path db = tmp.resolve("data/organizer.db");
        Files.createDirectories(db.getParent());
        Files.writeString(db, "");
        Files.writeString(tmp.resolve("data/organizer.db-wal"), "");
        for (String f : List.of("PHOTO/2023/04", "VIDEO_DUPLICATES", "ToReview/PHOTO", "Outros")) {
            Files.createDirectories(dest.resolve(f));
        }
        Files.writeString(dest.resolve("PHOTO/2023/04/a.jpg"), "a");
        Files.writeString(dest.resolve("Outros/b.jpg"), "b");
        Path src = Files.createDirectories(tmp.resolve("src"));
        Files.writeString(src.resolve("c.jpg"), "c");

        ResetService reset = new ResetService(dest, db, src);
        List<Path> plan = reset.plan();
        assertEquals(4, plan.size(), plan.toString());

        ResetService.ResetResult result = reset.execute();

        assertTrue(result.databaseRemoved());
        assertEquals(3, result.foldersRemoved());
        assertFalse(Files.exists(db));
        assertFalse(Files.exists(tmp.resolve("data/organizer.db-wal")));
        assertFalse(Files.exists(dest.resolve("PHOTO")));
        assertFalse(Files.exists(dest.resolve("ToReview")));
        assertTrue(Files.exists(dest.resolve("Outros/b.jpg")));
        assertTrue(Files.exists(src.resolve("c.jpg")));
        assertTrue(reset.plan().isEmpty());
    }

    @Test
    void refusesWhenSourceLivesInsideCategoryFolder() throws Exception {
        Path dest = tmp.resolve("dest");
        Path src = Files.createDirectories(dest.resolve("PHOTO/origem"));
        Files.writeString(src.resolve("a.jpg"), "a");

        ResetService reset = new ResetService(dest, tmp.resolve("o.db"), src);

        assertThrows(java.io.IOException.class, reset::execute);
        assertTrue(Files.exists(src.resolve("a.jpg")));
    }

    @Test
    void removesLogFileWhenGiven() throws Exception {
        Path dest = Files.createDirectories(tmp.resolve("dest"));
        Path log = Files.writeString(Files.createDirectories(tmp.resolve("logs")).resolve("photoorg.log"), "x");

        ResetService reset = new ResetService(dest, tmp.resolve("o.db"), null, log);
        assertEquals(List.of(log.toAbsolutePath().normalize()), reset.plan());

        ResetService.ResetResult result = reset.execute();

        assertTrue(result.logRemoved());
        assertFalse(result.databaseRemoved());
        assertFalse(Files.exists(log));
    }

    @Test
    void logFileFollowsSystemProperty() {
        System.setProperty(ResetService.LOG_FILE_PROPERTY, "/var/tmp/outro.log");
        try {
            assertEquals(Path.of("/var/tmp/outro.log"), ResetService.currentLogFile());
        } finally {
            System.clearProperty(ResetService.LOG_FILE_PROPERTY);
        }
        assertEquals(Path.of("photoorg.log"), ResetService.currentLogFile());
    }

    @Test
    void knownFolders() {
        assertEquals(List.of("PHOTO", "PHOTO_DUPLICATES", "VIDEO", "VIDEO_DUPLICATES", "OTHER", "OTHER_DUPLICATES", "ToReview"),
                ResetService.categoryFolders());
    }
}
