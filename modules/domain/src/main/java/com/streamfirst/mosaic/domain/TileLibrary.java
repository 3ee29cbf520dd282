package com.streamfirst.mosaic.domain;

import java.time.Instant;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * A processed, indexed collection of tiles. Created {@link LibraryStatus#QUEUED} on submission and
 * mutated only by the indexer. The durable record of a library carries no tiles; they are kept in
 * memory and in the library snapshot (see {@link #withoutContent()} and {@link #withContent}).
 */
@Value
@EqualsAndHashCode(of = {"id", "status", "progress", "message", "tileCount"})
public class TileLibrary {

    /** Minimum number of tiles a library needs to become ready */
    public static final int MIN_READY_TILES = 10;

    @NonNull LibraryId id;

    /** Session owning the library */
    @NonNull SessionId sessionId;

    /** Display name given on submission */
    @NonNull String name;

    @NonNull @With LibraryStatus status;

    /** Coarse completion percentage, 0 to 100 */
    @With int progress;

    /** Human-readable state description */
    @NonNull @With String message;

    /** Number of tiles once ready; kept on the durable record */
    int tileCount;

    /** Tiles in library order; empty unless the content is loaded */
    @NonNull List<Tile> tiles;

    @NonNull BucketIndex bucketIndex;

    @NonNull Instant createdAt;

    public static TileLibrary queued(
            LibraryId id, SessionId sessionId, String name, int quantization, Instant createdAt) {
        return new TileLibrary(id, sessionId, name, LibraryStatus.QUEUED, 0, "Queued", 0,
                List.of(), BucketIndex.empty(quantization), createdAt);
    }

    /**
     * Marks the library ready with its final content.
     *
     * @throws IllegalStateException if fewer than {@link #MIN_READY_TILES} tiles are supplied
     */
    public TileLibrary ready(List<Tile> readyTiles, BucketIndex index) {
        if (readyTiles.size() < MIN_READY_TILES) {
            throw new IllegalStateException("A ready library needs at least " + MIN_READY_TILES
                    + " tiles, got " + readyTiles.size());
        }
        checkIndexed(readyTiles, index);
        return new TileLibrary(id, sessionId, name, LibraryStatus.READY, 100,
                "Ready: " + readyTiles.size() + " tiles", readyTiles.size(),
                List.copyOf(readyTiles), index, createdAt);
    }

    public TileLibrary failed(String reason) {
        return withStatus(LibraryStatus.ERROR).withMessage(reason);
    }

    /**
     * The record-only form stored durably: same state, no tiles.
     */
    public TileLibrary withoutContent() {
        if (tiles.isEmpty()) {
            return this;
        }
        return new TileLibrary(id, sessionId, name, status, progress, message, tileCount,
                List.of(), BucketIndex.empty(bucketIndex.quantization()), createdAt);
    }

    /**
     * Reattaches content loaded from the library snapshot.
     *
     * @throws IllegalStateException if the content does not match the recorded tile count
     */
    public TileLibrary withContent(List<Tile> loadedTiles, BucketIndex index) {
        if (loadedTiles.size() != tileCount) {
            throw new IllegalStateException("Snapshot of library " + id + " holds " + loadedTiles.size()
                    + " tiles, record says " + tileCount);
        }
        checkIndexed(loadedTiles, index);
        return new TileLibrary(id, sessionId, name, status, progress, message, tileCount,
                List.copyOf(loadedTiles), index, createdAt);
    }

    /**
     * True when the tiles and bucket index are loaded, i.e. the library can be composed with.
     */
    public boolean hasContent() {
        return tileCount > 0 && tiles.size() == tileCount;
    }

    public boolean isReady() {
        return status == LibraryStatus.READY;
    }

    public Tile tile(int index) {
        return tiles.get(index);
    }

    public LibraryView view() {
        return new LibraryView(id, name, status, progress, message, tileCount);
    }

    private static void checkIndexed(List<Tile> tiles, BucketIndex index) {
        for (int i = 0; i < tiles.size(); i++) {
            if (tiles.get(i).index() != i) {
                throw new IllegalStateException("Tile at position " + i + " has index " + tiles.get(i).index());
            }
        }
        if (index.tileCount() != tiles.size()) {
            throw new IllegalStateException("Bucket index covers " + index.tileCount()
                    + " tiles, library has " + tiles.size());
        }
    }

    @Override
    public String toString() {
        return "TileLibrary{"
                + "id=" + id
                + ", status=" + status
                + ", progress=" + progress
                + ", tileCount=" + tileCount
                + ", loaded=" + hasContent()
                + '}';
    }
}
