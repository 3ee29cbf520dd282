package com.streamfirst.mosaic.domain;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Durable form of a ready library's content: parallel tile path and average color lists plus the
 * bucket membership. Enough to rebuild the in-memory library after a restart.
 */
public record LibrarySnapshot(List<StoragePath> tilePaths, List<Rgb> tileColors,
                              Map<BucketKey, List<Integer>> buckets) {
    public LibrarySnapshot {
        Objects.requireNonNull(tilePaths, "Tile paths cannot be null");
        Objects.requireNonNull(tileColors, "Tile colors cannot be null");
        Objects.requireNonNull(buckets, "Buckets cannot be null");
        if (tilePaths.size() != tileColors.size()) {
            throw new IllegalArgumentException("Snapshot has " + tilePaths.size() + " paths but "
                    + tileColors.size() + " colors");
        }
        tilePaths = List.copyOf(tilePaths);
        tileColors = List.copyOf(tileColors);
        buckets = Map.copyOf(buckets);
    }

    public static LibrarySnapshot of(TileLibrary library) {
        return new LibrarySnapshot(
                library.getTiles().stream().map(Tile::storagePath).toList(),
                library.getTiles().stream().map(Tile::avgColor).toList(),
                library.getBucketIndex().asMap());
    }

    public List<Tile> tiles() {
        return IntStream.range(0, tilePaths.size())
                .mapToObj(i -> new Tile(i, tilePaths.get(i), tileColors.get(i)))
                .toList();
    }

    public BucketIndex bucketIndex(int quantization) {
        return BucketIndex.of(quantization, buckets);
    }
}
