package com.streamfirst.mosaic.domain;

/**
 * What callers may see of a tile library. Tile paths and colors stay internal.
 */
public record LibraryView(LibraryId id, String name, LibraryStatus status, int progress,
                          String message, int tileCount) {
}
