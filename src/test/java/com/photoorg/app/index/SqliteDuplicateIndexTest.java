package com.photoorg.app.index;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.photoorg.app.database.BusyRetry;
import com.photoorg.app.database.Database;

import static org.junit.jupiter.api.Assertions.*;

public class SqliteDuplicateIndexTest extends DuplicateIndexContract {

    @TempDir
    Path tmp;

    private Path dbFile;

    @Override
    protected DuplicateIndex newIndex() {
        dbFile = tmp.resolve("index.db");
        return open(dbFile);
    }

    private static SqliteDuplicateIndex open(Path file) {
        return new SqliteDuplicateIndex(Database.open(file, 8, Duration.ofSeconds(10)),
                new BusyRetry(6, Duration.ofMillis(20)), true);
    }

    @Test
    void durableAcrossReopen() {
        ClaimResult.Won won = (ClaimResult.Won) index.claim(request("persist", "/src/a.jpg", "PHOTO/2023/04/a.jpg"));
        index.close();

        try (SqliteDuplicateIndex reopened = open(dbFile)) {
            assertTrue(reopened.isDurable());
            FileRecord rec = reopened.findCanonical("persist").orElseThrow();
            assertEquals(won.record().id(), rec.id());
            assertEquals("PHOTO/2023/04/a.jpg", rec.destPath());
            assertEquals(Long.valueOf(10), rec.sizeBytes());

            long s2 = reopened.openSession(new SessionStart(Instant.now(), false, 1, "/src", "/dst", null));
            ClaimRequest again = new ClaimRequest(s2, "persist", "/src/b.jpg", rec.mediaType(), null,
                    FileStatus.REVIEW, "ToReview/PHOTO/b.jpg", 0, 10, "t");
            ClaimResult.LostTo lost = assertInstanceOf(ClaimResult.LostTo.class, reopened.claim(again));
            assertEquals(session, lost.existingSessionId());
        }
        index = null;
        assertTrue(Files.exists(dbFile));
    }
}
