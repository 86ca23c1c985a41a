package com.photoorg.app.index;

import java.time.Instant;

public record SessionRow(
        long id,
        Instant startedAt,
        Instant endedAt,
        SessionStatus status,
        boolean dryRun,
        int workerCount,
        String sourceRoot,
        String destRoot,
        String configSnapshot,
        SessionTotals totals,
        Long durationMs
) {}
