package com.photoorg.app.database;

/**
 * O SQLite continuou ocupado (BUSY/LOCKED) depois de todas as tentativas.
 */
public class StoreBusyException extends RuntimeException {

    public StoreBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
