package com.streamfirst.mosaic.domain;

/**
 * A cell of the quantized color cube: each component is a channel value divided by the
 * quantization width.
 */
public record BucketKey(int r, int g, int b) {

    /**
     * Returns the key shifted by the given offsets.
     */
    public BucketKey offset(int dr, int dg, int db) {
        return new BucketKey(r + dr, g + dg, b + db);
    }
}
