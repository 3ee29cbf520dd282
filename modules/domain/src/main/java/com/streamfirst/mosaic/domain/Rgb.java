package com.streamfirst.mosaic.domain;

/**
 * An 8-bit per channel RGB color, used for tile and cell average colors.
 */
public record Rgb(int r, int g, int b) {

    public Rgb {
        checkChannel("red", r);
        checkChannel("green", g);
        checkChannel("blue", b);
    }

    /**
     * Unpacks a color from the {@code 0xRRGGBB} layout used by {@code BufferedImage.getRGB}.
     * The alpha byte is ignored.
     */
    public static Rgb fromPacked(int argb) {
        return new Rgb((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }

    public int packed() {
        return (r << 16) | (g << 8) | b;
    }

    /**
     * Squared Euclidean distance in RGB space.
     */
    public int distanceSquared(Rgb other) {
        int dr = r - other.r;
        int dg = g - other.g;
        int db = b - other.b;
        return dr * dr + dg * dg + db * db;
    }

    /**
     * The quantized color bucket this color falls into for quantization width {@code q}.
     */
    public BucketKey bucket(int q) {
        return new BucketKey(r / q, g / q, b / q);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel out of range: " + value);
        }
    }

    @Override
    public String toString() {
        return "(" + r + "," + g + "," + b + ")";
    }
}
