package com.photoorg.app.pipeline;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.photoorg.app.index.FileStatus;
import com.photoorg.app.scan.CandidatePath;
import com.photoorg.app.scan.MediaType;

import static org.junit.jupiter.api.Assertions.*;

public class FileJobTest {

    private final PipelineStats stats = new PipelineStats();

    private FileJob job(MediaType type) {
        return new FileJob(new CandidatePath(Path.of("/src/a.mp4").toAbsolutePath(), type), stats);
    }

    @Test
    void stagesOnlyMoveForward() {
        FileJob j = job(MediaType.VIDEO);
        assertEquals(Stage.SCANNED, j.stage());
        assertTrue(j.advance(Stage.HASHING));
        assertTrue(j.advance(Stage.CLAIMING));
        assertFalse(j.advance(Stage.HASHING));
        assertTrue(j.advance(Stage.PLACING));
        assertEquals(Stage.PLACING, j.stage());
    }

    @Test
    void settleIsOneShotAndCounts() {
        FileJob j = job(MediaType.VIDEO);
        assertTrue(j.settle(FileStatus.ORGANIZED));
        assertFalse(j.settle(FileStatus.ERROR));

        assertEquals(FileStatus.ORGANIZED, j.outcome());
        assertEquals(Stage.RECORDED, j.stage());
        assertEquals(1, stats.organized.sum());
        assertEquals(1, stats.videosOrganized.sum());
        assertEquals(0, stats.errors.sum());
        assertFalse(j.advance(Stage.FAILED), "estado terminal");
    }

    @Test
    void errorEndsInFailed() {
        FileJob j = job(MediaType.PHOTO);
        j.advance(Stage.HASHING);
        assertTrue(j.settle(FileStatus.ERROR));
        assertEquals(Stage.FAILED, j.stage());
        assertEquals(1, stats.errors.sum());
    }
}
