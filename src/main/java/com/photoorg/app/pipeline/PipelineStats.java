package com.photoorg.app.pipeline;

import java.util.concurrent.atomic.LongAdder;

import com.photoorg.app.index.FileStatus;
import com.photoorg.app.index.SessionTotals;
import com.photoorg.app.scan.MediaType;

/**
 * Contadores compartilhados pelos workers. Cada arquivo entra uma única vez
 * via {@link FileJob#settle(FileStatus)}.
 */
public final class PipelineStats {
    public final LongAdder seen = new LongAdder();
    public final LongAdder organized = new LongAdder();
    public final LongAdder duplicates = new LongAdder();
    public final LongAdder review = new LongAdder();
    public final LongAdder errors = new LongAdder();
    public final LongAdder photosOrganized = new LongAdder();
    public final LongAdder videosOrganized = new LongAdder();

    void record(FileStatus status, MediaType type) {
        switch (status) {
            case ORGANIZED -> {
                organized.increment();
                if (type == MediaType.PHOTO) photosOrganized.increment();
                else if (type == MediaType.VIDEO) videosOrganized.increment();
            }
            case DUPLICATE -> duplicates.increment();
            case REVIEW -> review.increment();
            case ERROR -> errors.increment();
        }
    }

    public long settled() {
        return organized.sum() + duplicates.sum() + review.sum() + errors.sum();
    }

    public SessionTotals snapshot(long scanErrors) {
        return new SessionTotals(seen.sum(), organized.sum(), duplicates.sum(), review.sum(), errors.sum(), scanErrors);
    }
}
