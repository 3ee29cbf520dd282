package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.Rgb;

/**
 * Shifts a tile's colors toward the average color of the cell it is placed in. Each channel is
 * scaled by a factor clamped to [0.6, 1.6], quantized to hundredths and applied through a
 * lookup table.
 */
final class ColorCorrection {

  static final double MIN_SCALE = 0.6;
  static final double MAX_SCALE = 1.6;

  private static final int MIN_PERCENT = (int) Math.round(MIN_SCALE * 100);
  private static final int MAX_PERCENT = (int) Math.round(MAX_SCALE * 100);
  private static final int[][] TABLES = new int[MAX_PERCENT - MIN_PERCENT + 1][];

  static {
    for (int percent = MIN_PERCENT; percent <= MAX_PERCENT; percent++) {
      int[] table = new int[256];
      double scale = percent / 100.0;
      for (int i = 0; i < 256; i++) {
        table[i] = Math.max(0, Math.min(255, (int) (i * scale)));
      }
      TABLES[percent - MIN_PERCENT] = table;
    }
  }

  private ColorCorrection() {}

  /**
   * Scale factor for one channel: {@code (1 - strength) + strength * (cell + 1) / (tile + 1)},
   * clamped.
   */
  static double scale(int cellChannel, int tileChannel, double strength) {
    double ratio = (cellChannel + 1.0) / (tileChannel + 1.0);
    double s = (1.0 - strength) + strength * ratio;
    return Math.max(MIN_SCALE, Math.min(MAX_SCALE, s));
  }

  static int[] lookupTable(double scale) {
    int percent = Math.max(MIN_PERCENT, Math.min(MAX_PERCENT, (int) (scale * 100)));
    return TABLES[percent - MIN_PERCENT];
  }

  /**
   * Returns corrected copies of packed RGB pixels. With {@code strength <= 0} the input array is
   * returned unchanged.
   */
  static int[] apply(int[] pixels, Rgb tileAvg, Rgb cellAvg, double strength) {
    if (strength <= 0.0) {
      return pixels;
    }
    int[] red = lookupTable(scale(cellAvg.r(), tileAvg.r(), strength));
    int[] green = lookupTable(scale(cellAvg.g(), tileAvg.g(), strength));
    int[] blue = lookupTable(scale(cellAvg.b(), tileAvg.b(), strength));
    int[] corrected = new int[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      int p = pixels[i];
      corrected[i] = (red[(p >> 16) & 0xFF] << 16) | (green[(p >> 8) & 0xFF] << 8) | blue[p & 0xFF];
    }
    return corrected;
  }
}
