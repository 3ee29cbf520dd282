package com.streamfirst.mosaic.ports;

import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.LibrarySnapshot;

import java.util.Optional;

/**
 * Persists the content of ready tile libraries so they survive cache eviction and restarts.
 */
public interface LibrarySnapshotPort {

    /**
     * Stores the snapshot of a library, replacing any previous one.
     */
    void save(LibraryId id, LibrarySnapshot snapshot);

    /**
     * Loads a library snapshot.
     *
     * @return the snapshot, or empty if none was stored
     * @throws java.io.UncheckedIOException if a stored snapshot cannot be read
     */
    Optional<LibrarySnapshot> load(LibraryId id);

    void delete(LibraryId id);
}
