package com.streamfirst.mosaic.domain;

/**
 * Lifecycle of a mosaic job. {@link #DONE} and {@link #ERROR} are terminal.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
