package com.streamfirst.mosaic.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Quantized-color spatial index of a tile library. Maps each occupied {@link BucketKey} to the
 * indices of the tiles whose average color falls into it, in ascending index order.
 * Instances are immutable; use {@link Builder} while indexing.
 */
public final class BucketIndex {

    private static final int[] NO_TILES = new int[0];

    private final int quantization;
    private final Map<BucketKey, int[]> buckets;
    private final int tileCount;

    private BucketIndex(int quantization, Map<BucketKey, int[]> buckets) {
        if (quantization <= 0) {
            throw new IllegalArgumentException("Quantization width must be positive: " + quantization);
        }
        this.quantization = quantization;
        this.buckets = Collections.unmodifiableMap(buckets);
        this.tileCount = buckets.values().stream().mapToInt(members -> members.length).sum();
    }

    public static BucketIndex empty(int quantization) {
        return new BucketIndex(quantization, Map.of());
    }

    /**
     * Rebuilds an index from persisted bucket membership lists.
     */
    public static BucketIndex of(int quantization, Map<BucketKey, List<Integer>> members) {
        Map<BucketKey, int[]> copy = new LinkedHashMap<>();
        members.forEach((key, indices) -> copy.put(
                Objects.requireNonNull(key, "Bucket key cannot be null"),
                indices.stream().mapToInt(Integer::intValue).sorted().toArray()));
        return new BucketIndex(quantization, copy);
    }

    /**
     * Builds the index for an ordered tile list, deriving every bucket from the tile's own color.
     */
    public static BucketIndex forTiles(int quantization, List<Tile> tiles) {
        Builder builder = new Builder(quantization);
        tiles.forEach(builder::add);
        return builder.build();
    }

    public int quantization() {
        return quantization;
    }

    public BucketKey keyFor(Rgb color) {
        return color.bucket(quantization);
    }

    /**
     * Tile indices stored under {@code key}; empty when the bucket is unoccupied.
     * The returned array must not be modified.
     */
    public int[] members(BucketKey key) {
        return buckets.getOrDefault(key, NO_TILES);
    }

    public Map<BucketKey, List<Integer>> asMap() {
        Map<BucketKey, List<Integer>> view = new LinkedHashMap<>();
        buckets.forEach((key, indices) -> view.put(key, Arrays.stream(indices).boxed().toList()));
        return view;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public int tileCount() {
        return tileCount;
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BucketIndex other)) {
            return false;
        }
        return quantization == other.quantization && asMap().equals(other.asMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(quantization, asMap());
    }

    @Override
    public String toString() {
        return "BucketIndex{quantization=" + quantization
                + ", buckets=" + buckets.size()
                + ", tiles=" + tileCount + '}';
    }

    /**
     * Accumulates tiles in library order.
     */
    public static final class Builder {
        private final int quantization;
        private final Map<BucketKey, List<Integer>> members = new LinkedHashMap<>();

        public Builder(int quantization) {
            this.quantization = quantization;
        }

        public Builder add(Tile tile) {
            members.computeIfAbsent(tile.avgColor().bucket(quantization), k -> new ArrayList<>())
                    .add(tile.index());
            return this;
        }

        public BucketIndex build() {
            return BucketIndex.of(quantization, members);
        }
    }
}
