package com.streamfirst.mosaic.domain;

import java.util.Objects;

/**
 * One normalized thumbnail of a tile library.
 *
 * @param index position of the tile within its library, stable for the library's lifetime
 * @param storagePath where the thumbnail is stored
 * @param avgColor area-averaged color of the thumbnail
 */
public record Tile(int index, StoragePath storagePath, Rgb avgColor) {
    public Tile {
        if (index < 0) {
            throw new IllegalArgumentException("Tile index cannot be negative: " + index);
        }
        Objects.requireNonNull(storagePath, "Tile storage path cannot be null");
        Objects.requireNonNull(avgColor, "Tile average color cannot be null");
    }
}
