package com.photoorg.app.index;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.photoorg.app.metadata.CaptureDate;
import com.photoorg.app.scan.MediaType;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mesmo comportamento esperado do índice em memória e do SQLite.
 */
abstract class DuplicateIndexContract {

    protected DuplicateIndex index;
    protected long session;

    protected abstract DuplicateIndex newIndex() throws Exception;

    @BeforeEach
    void openIndex() throws Exception {
        index = newIndex();
        session = index.openSession(new SessionStart(Instant.now(), false, 2, "/src", "/dst", "{}"));
    }

    @AfterEach
    void closeIndex() {
        if (index != null) index.close();
    }

    protected ClaimRequest request(String hash, String source, String dest) {
        return new ClaimRequest(session, hash, source, MediaType.PHOTO, new CaptureDate(2023, 4),
                FileStatus.ORGANIZED, dest, 0, 10, "t");
    }

    @Test
    void firstClaimWinsSecondLoses() {
        ClaimResult first = index.claim(request("h1", "/src/a.jpg", "PHOTO/2023/04/a.jpg"));
        ClaimResult second = index.claim(request("h1", "/src/b.jpg", "PHOTO/2023/04/b.jpg"));

        ClaimResult.Won won = assertInstanceOf(ClaimResult.Won.class, first);
        assertEquals("PHOTO/2023/04/a.jpg", won.destination());
        assertTrue(won.record().id() > 0);
        assertEquals(Integer.valueOf(2023), won.record().year());

        ClaimResult.LostTo lost = assertInstanceOf(ClaimResult.LostTo.class, second);
        assertEquals("PHOTO/2023/04/a.jpg", lost.existingDestination());
        assertEquals(session, lost.existingSessionId());
        assertFalse(lost.alreadyPlaced());
    }

    @Test
    void occupiedDestinationGetsCollisionName() {
        index.claim(request("aaaaaaaaaaaa", "/src/x/IMG_1.jpg", "PHOTO/2023/04/IMG_1.jpg"));
        ClaimResult other = index.claim(request("bbbbbbbbbbbb", "/src/y/IMG_1.jpg", "PHOTO/2023/04/IMG_1.jpg"));

        ClaimResult.Won won = assertInstanceOf(ClaimResult.Won.class, other);
        assertEquals("PHOTO/2023/04/IMG_1_bbbbbbbb.jpg", won.destination());
    }

    @Test
    void firstAttemptIsRespected() {
        ClaimRequest r = new ClaimRequest(session, "cccccccccc", "/src/a.jpg", MediaType.PHOTO, null,
                FileStatus.REVIEW, "ToReview/PHOTO/a.jpg", 2, 1, "t");
        ClaimResult.Won won = assertInstanceOf(ClaimResult.Won.class, index.claim(r));
        assertEquals("ToReview/PHOTO/a_cccccccc_2.jpg", won.destination());
        assertEquals(FileStatus.REVIEW, won.record().status());
        assertNull(won.record().year());
    }

    @Test
    void samePathClaimedAgainReportsPriorPlacement() {
        index.claim(request("h2", "/src/a.jpg", "PHOTO/2023/04/a.jpg"));
        ClaimResult again = index.claim(request("h2", "/src/a.jpg", "PHOTO/2023/04/a.jpg"));

        ClaimResult.LostTo lost = assertInstanceOf(ClaimResult.LostTo.class, again);
        assertTrue(lost.alreadyPlaced());
        assertEquals("PHOTO/2023/04/a.jpg", lost.priorPlacement());
    }

    @Test
    void releaseFreesHashAndDestination() {
        ClaimResult.Won won = (ClaimResult.Won) index.claim(request("h3", "/src/a.jpg", "PHOTO/2023/04/a.jpg"));
        index.release(won);

        assertTrue(index.findCanonical("h3").isEmpty());
        assertTrue(index.records().isEmpty());

        ClaimResult retry = index.claim(request("h3", "/src/b.jpg", "PHOTO/2023/04/a.jpg"));
        assertEquals("PHOTO/2023/04/a.jpg", assertInstanceOf(ClaimResult.Won.class, retry).destination());
    }

    @Test
    void appendKeepsNonCanonicalRecords() {
        ClaimResult.Won won = (ClaimResult.Won) index.claim(request("h4", "/src/a.jpg", "PHOTO/2023/04/a.jpg"));
        FileRecord dup = index.append(FileRecord.duplicate(session, "h4", "/src/b.jpg", "PHOTO_DUPLICATES/b.jpg",
                won.destination(), MediaType.PHOTO, new CaptureDate(2023, 4), 10, "t"));
        FileRecord err = index.append(FileRecord.error(session, null, "/src/c.jpg", MediaType.PHOTO, null, null,
                "t", "IOException: falhou"));

        assertTrue(dup.id() > 0);
        assertTrue(err.id() > dup.id());
        assertEquals(3, index.records().size());
        assertEquals(3, index.records(session).size());
        assertEquals(FileStatus.ERROR, index.records().get(2).status());
        assertEquals("IOException: falhou", index.records().get(2).message());
        assertEquals("PHOTO/2023/04/a.jpg", index.records().get(1).duplicateOf());

        assertThrows(IllegalArgumentException.class, () -> index.append(won.record()));
    }

    @Test
    void sessionLifecycle() {
        index.closeSession(session, SessionStatus.COMPLETED, new SessionTotals(3, 1, 1, 0, 1, 2), 1234);
        index.closeSession(session, SessionStatus.FAILED, SessionTotals.empty(), 1);

        List<SessionRow> rows = index.sessions(5);
        assertEquals(1, rows.size());
        SessionRow row = rows.get(0);
        assertEquals(SessionStatus.COMPLETED, row.status(), "sessão fechada não é reaberta");
        assertEquals(3, row.totals().filesSeen());
        assertEquals(2, row.totals().scanErrors());
        assertEquals(Long.valueOf(1234), row.durationMs());
        assertNotNull(row.endedAt());

        long second = index.openSession(new SessionStart(Instant.now(), true, 1, "/s", "/d", null));
        assertEquals(second, index.sessions(1).get(0).id());
        assertEquals(SessionStatus.RUNNING, index.sessions(1).get(0).status());
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<ClaimResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String src = "/src/copy" + i + ".jpg";
                Callable<ClaimResult> task = () -> {
                    go.await();
                    return index.claim(request("samehash", src, "PHOTO/2023/04/IMG_1.jpg"));
                };
                futures.add(pool.submit(task));
            }
            go.countDown();

            int won = 0;
            int lost = 0;
            for (Future<ClaimResult> f : futures) {
                ClaimResult r = f.get(30, TimeUnit.SECONDS);
                if (r instanceof ClaimResult.Won) won++;
                else lost++;
            }
            assertEquals(1, won);
            assertEquals(threads - 1, lost);
            assertEquals(1, index.records().size());
        } finally {
            pool.shutdownNow();
        }
    }
}
