package com.photoorg.app.index;

public enum SessionStatus {
    RUNNING,
    COMPLETED,
    CANCELED,
    FAILED
}
