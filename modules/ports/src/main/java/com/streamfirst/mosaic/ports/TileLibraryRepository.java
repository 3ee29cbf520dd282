package com.streamfirst.mosaic.ports;

import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.domain.TileLibrary;

import java.util.List;
import java.util.Optional;

/**
 * Durable record store for tile libraries. Records hold status, progress, message and tile count;
 * tile content lives in the library snapshot (see {@link LibrarySnapshotPort}).
 */
public interface TileLibraryRepository {

    /**
     * Inserts or replaces the record of a library.
     *
     * @param library the library; implementations store it without content
     */
    void save(TileLibrary library);

    /**
     * Finds a library record by id.
     *
     * @param id the library id
     * @return the record, or empty if the library does not exist
     */
    Optional<TileLibrary> findById(LibraryId id);

    /**
     * Lists the libraries owned by a session, oldest first.
     */
    List<TileLibrary> findBySession(SessionId sessionId);

    /**
     * Deletes a library record.
     *
     * @return true if a record was removed
     */
    boolean delete(LibraryId id);
}
