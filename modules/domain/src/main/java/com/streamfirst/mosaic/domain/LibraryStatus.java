package com.streamfirst.mosaic.domain;

/**
 * Lifecycle of a tile library.
 */
public enum LibraryStatus {
    /** Archive stored, indexing not started yet */
    QUEUED,
    /** Indexer is reading the archive */
    PROCESSING,
    /** Tiles and bucket index are available for composition */
    READY,
    /** Indexing failed; the message says why */
    ERROR;

    public boolean isTerminal() {
        return this == READY || this == ERROR;
    }
}
