package com.streamfirst.mosaic.adapters;

import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.domain.TileLibrary;
import com.streamfirst.mosaic.ports.TileLibraryRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TileLibraryRepository for testing and development.
 * Stores records only; tile content is dropped on save exactly as a database table would.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryTileLibraryRepository implements TileLibraryRepository {

    private final Map<LibraryId, TileLibrary> records = new ConcurrentHashMap<>();

    @Override
    public void save(TileLibrary library) {
        records.put(library.getId(), library.withoutContent());
        log.debug("Saved library record {} ({}, {}%)", library.getId(), library.getStatus(), library.getProgress());
    }

    @Override
    public Optional<TileLibrary> findById(LibraryId id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<TileLibrary> findBySession(SessionId sessionId) {
        return records.values().stream()
                .filter(library -> library.getSessionId().equals(sessionId))
                .sorted(Comparator.comparing(TileLibrary::getCreatedAt))
                .toList();
    }

    @Override
    public boolean delete(LibraryId id) {
        boolean removed = records.remove(id) != null;
        log.debug("Deleted library record {}: {}", id, removed);
        return removed;
    }

    /**
     * Gets the number of stored records. Useful for testing.
     */
    public int size() {
        return records.size();
    }
}
