package com.photoorg.app.pipeline;

import java.nio.file.Path;
import java.time.Duration;

import com.photoorg.app.index.SessionStatus;
import com.photoorg.app.index.SessionTotals;

/**
 * Resultado de uma execução completa.
 *
 * @param database arquivo SQLite usado, ou null no dry-run
 */
public record SessionSummary(
        long sessionId,
        SessionStatus status,
        boolean dryRun,
        int workers,
        SessionTotals totals,
        long photosOrganized,
        long videosOrganized,
        Duration duration,
        Path database
) {

    public String describe() {
        return String.format("""
                Sessão %d %s%s
                  workers:     %d
                  vistos:      %d
                  organizados: %d (fotos %d, vídeos %d)
                  duplicados:  %d
                  revisão:     %d
                  erros:       %d
                  erros scan:  %d
                  duração:     %.1fs""",
                sessionId, status, dryRun ? " [DRY-RUN]" : "", workers,
                totals.filesSeen(), totals.organized(), photosOrganized, videosOrganized,
                totals.duplicates(), totals.review(), totals.errors(), totals.scanErrors(),
                duration.toMillis() / 1000.0);
    }
}
