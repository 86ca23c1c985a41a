package com.photoorg.app.index;

import java.time.Instant;

/**
 * Dados gravados na abertura de uma sessão. {@code configSnapshot} é JSON.
 */
public record SessionStart(
        Instant startedAt,
        boolean dryRun,
        int workerCount,
        String sourceRoot,
        String destRoot,
        String configSnapshot
) {}
