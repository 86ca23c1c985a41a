package com.photoorg.app.report;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.photoorg.app.index.ClaimRequest;
import com.photoorg.app.index.ClaimResult;
import com.photoorg.app.index.FileRecord;
import com.photoorg.app.index.FileStatus;
import com.photoorg.app.index.InMemoryDuplicateIndex;
import com.photoorg.app.index.SessionStart;
import com.photoorg.app.index.SessionStatus;
import com.photoorg.app.index.SessionTotals;
import com.photoorg.app.metadata.CaptureDate;
import com.photoorg.app.scan.MediaType;

import static org.junit.jupiter.api.Assertions.*;

public class StatsReportTest {

    @Test
    void totalsByStatusMediaAndYear() {
        try (InMemoryDuplicateIndex index = new InMemoryDuplicateIndex()) {
            long s = index.openSession(new SessionStart(Instant.now(), false, 2, "/src", "/dst", null));
            index.claim(new ClaimRequest(s, "h1", "/src/a.jpg", MediaType.PHOTO, new CaptureDate(2021, 3),
                    FileStatus.ORGANIZED, "PHOTO/2021/03/a.jpg", 0, 1, "w"));
            index.claim(new ClaimRequest(s, "h2", "/src/b.jpg", MediaType.PHOTO, new CaptureDate(2023, 1),
                    FileStatus.ORGANIZED, "PHOTO/2023/01/b.jpg", 0, 1, "w"));
            ClaimResult.Won v = (ClaimResult.Won) index.claim(new ClaimRequest(s, "h3", "/src/c.mp4", MediaType.VIDEO,
                    new CaptureDate(2021, 8), FileStatus.ORGANIZED, "VIDEO/2021/08/c.mp4", 0, 1, "w"));
            index.claim(new ClaimRequest(s, "h4", "/src/d.jpg", MediaType.PHOTO, null,
                    FileStatus.REVIEW, "ToReview/PHOTO/d.jpg", 0, 1, "w"));
            index.append(FileRecord.duplicate(s, "h3", "/src/c2.mp4", "VIDEO_DUPLICATES/c2.mp4", v.destination(),
                    MediaType.VIDEO, null, 1, "w"));
            index.append(FileRecord.error(s, null, "/src/e.jpg", MediaType.PHOTO, null, null, "w", "falha"));
            index.closeSession(s, SessionStatus.COMPLETED, new SessionTotals(6, 3, 1, 1, 1, 0), 10);

            StatsReport r = StatsReport.of(index);

            assertEquals(6, r.totalRecords());
            assertEquals(3, r.count(FileStatus.ORGANIZED));
            assertEquals(1, r.count(FileStatus.REVIEW));
            assertEquals(1, r.count(FileStatus.DUPLICATE));
            assertEquals(1, r.count(FileStatus.ERROR));
            assertEquals(Long.valueOf(3), r.byMedia().get(MediaType.PHOTO));
            assertEquals(Long.valueOf(1), r.byMedia().get(MediaType.VIDEO));
            assertEquals(Long.valueOf(2), r.byYear().get(2021));
            assertEquals(Long.valueOf(1), r.byYear().get(2023));
            assertEquals(s, r.lastSession().id());

            String text = r.render();
            assertTrue(text.contains("Registros: 6"), text);
            assertTrue(text.contains("2021"), text);
            assertTrue(text.contains("Última sessão: #" + s + " COMPLETED"), text);
        }
    }

    @Test
    void emptyIndex() {
        try (InMemoryDuplicateIndex index = new InMemoryDuplicateIndex()) {
            StatsReport r = StatsReport.of(index);
            assertEquals(0, r.totalRecords());
            assertNull(r.lastSession());
            assertEquals(0, r.count(FileStatus.ORGANIZED));
            assertFalse(r.render().contains("Última sessão"));
        }
    }
}
