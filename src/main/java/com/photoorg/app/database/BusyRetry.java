package com.photoorg.app.database;

import java.time.Duration;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Repete uma operação curta enquanto o SQLite responder BUSY/LOCKED,
 * com backoff exponencial limitado.
 */
public final class BusyRetry {

    private static final Logger logger = LoggerFactory.getLogger(BusyRetry.class);

    private static final long MAX_BACKOFF_MS = 2_000;

    private final int attempts;
    private final Duration backoff;

    public BusyRetry(int attempts, Duration backoff) {
        this.attempts = Math.max(1, attempts);
        this.backoff = backoff == null ? Duration.ZERO : backoff;
    }

    public <T> T call(String what, Supplier<T> op) {
        long waitMs = Math.max(1, backoff.toMillis());
        RuntimeException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return op.get();
            } catch (RuntimeException e) {
                if (!isBusy(e)) throw e;
                last = e;
                if (attempt == attempts) break;
                logger.debug("SQLite ocupado em {} (tentativa {}/{}), aguardando {} ms", what, attempt, attempts, waitMs);
                try {
                    Thread.sleep(waitMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StoreBusyException("Interrompido aguardando o banco em " + what, e);
                }
                waitMs = Math.min(MAX_BACKOFF_MS, waitMs * 2);
            }
        }
        throw new StoreBusyException("Banco ocupado após " + attempts + " tentativas em " + what, last);
    }

    static boolean isBusy(Throwable t) {
        Throwable cur = t;
        int depth = 0;
        while (cur != null && depth++ < 16) {
            if (cur instanceof SQLiteException sqlite) {
                SQLiteErrorCode code = sqlite.getResultCode();
                if (code != null) {
                    String name = code.name();
                    if (name.startsWith("SQLITE_BUSY") || name.startsWith("SQLITE_LOCKED")) return true;
                }
            }
            String msg = cur.getMessage();
            if (msg != null && (msg.contains("SQLITE_BUSY") || msg.contains("database is locked"))) return true;
            cur = cur.getCause();
        }
        return false;
    }
}
