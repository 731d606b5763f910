package com.sitemirror.core.model;

/** PENDING → RUNNING → (COMPLETED | CANCELLED | CAPPED | FAILED) */
public enum SessionState {
    PENDING,
    RUNNING,
    COMPLETED,
    CANCELLED,
    CAPPED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
