package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.JobParameters;
import com.streamfirst.mosaic.domain.Rgb;
import com.streamfirst.mosaic.domain.Target;
import com.streamfirst.mosaic.domain.Tile;
import com.streamfirst.mosaic.domain.TileLibrary;
import com.streamfirst.mosaic.ports.FileStoragePort;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntPredicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders a target image as a grid of library tiles.
 *
 * <p>Cells are visited row by row. Each cell takes the tile closest to its average color that is
 * neither among the last {@code repeatWindowK} placements nor the tile directly left of or above
 * it, optionally shifted toward the cell color. The output has exactly the target's dimensions;
 * edge cells are cropped. Rendering is deterministic for a given library, target and parameter
 * set.
 */
@Slf4j
@RequiredArgsConstructor
public class MosaicCompositor {

  static final int COMPOSITE_PROGRESS = 95;
  static final int BLEND_PROGRESS = 97;

  private final FileStoragePort storage;
  private final MosaicSettings settings;

  /**
   * Loads the target from storage and composes it.
   *
   * @throws IllegalStateException if the library is not ready or its content is not loaded
   * @throws UncheckedIOException if the target cannot be read or decoded
   */
  public CompositeResult compose(
      Target target, TileLibrary library, JobParameters parameters, ProgressListener listener) {
    BufferedImage image;
    try {
      image = TileImages.decode(storage.read(target.storagePath()));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot decode target " + target.id(), e);
    }
    return compose(image, library, parameters, listener);
  }

  public CompositeResult compose(
      BufferedImage targetImage,
      TileLibrary library,
      JobParameters parameters,
      ProgressListener listener) {
    if (!library.isReady() || !library.hasContent()) {
      throw new IllegalStateException("Library " + library.getId() + " is not ready for use");
    }
    BufferedImage source = TileImages.toRgb(targetImage);
    int width = source.getWidth();
    int height = source.getHeight();
    int cell = parameters.cellSize();
    int columns = (width + cell - 1) / cell;
    int rows = (height + cell - 1) / cell;
    log.debug(
        "Composing {}x{} target as {}x{} cells of {}px from library {}",
        width,
        height,
        columns,
        rows,
        cell,
        library.getId());

    int[] targetPixels = TileImages.pixels(source);
    BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    TileMatcher matcher =
        new TileMatcher(
            library.getTiles(),
            library.getBucketIndex(),
            settings.getCandidateCap(),
            settings.getMaxSearchRadius());
    RecentTiles recent = new RecentTiles(parameters.repeatWindowK());
    TileCache cache = new TileCache(library, cell, settings.getTileCacheSize());
    int[] selections = new int[columns * rows];
    int total = selections.length;

    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        int cellIndex = row * columns + column;
        int x0 = column * cell;
        int y0 = row * cell;
        int w = Math.min(cell, width - x0);
        int h = Math.min(cell, height - y0);

        Rgb cellColor = TileImages.averageColor(targetPixels, width, x0, y0, w, h);
        int left = column > 0 ? selections[cellIndex - 1] : -1;
        int above = row > 0 ? selections[cellIndex - columns] : -1;
        IntPredicate forbidden = i -> i == left || i == above || recent.contains(i);

        int chosen = matcher.select(cellColor, forbidden);
        selections[cellIndex] = chosen;
        recent.add(chosen);

        Tile tile = library.tile(chosen);
        int[] tilePixels =
            ColorCorrection.apply(
                cache.get(chosen), tile.avgColor(), cellColor, parameters.colorStrength());
        out.setRGB(x0, y0, w, h, tilePixels, 0, cell);
      }
      listener.onProgress((row + 1) * columns * COMPOSITE_PROGRESS / total, "Compositing");
    }

    if (parameters.overlayStrength() > 0.0) {
      listener.onProgress(BLEND_PROGRESS, "Blending");
      blend(out, targetPixels, parameters.overlayStrength());
    }
    log.debug("Composed {} cells, {} tile loads", total, cache.loads);
    return new CompositeResult(out, columns, rows, selections);
  }

  /** {@code out = mosaic * (1 - alpha) + target * alpha}, per channel, rounded. */
  static void blend(BufferedImage mosaic, int[] targetPixels, double alpha) {
    int width = mosaic.getWidth();
    int height = mosaic.getHeight();
    int[] mosaicPixels = TileImages.pixels(mosaic);
    for (int i = 0; i < mosaicPixels.length; i++) {
      int m = mosaicPixels[i];
      int t = targetPixels[i];
      int r = mix((m >> 16) & 0xFF, (t >> 16) & 0xFF, alpha);
      int g = mix((m >> 8) & 0xFF, (t >> 8) & 0xFF, alpha);
      int b = mix(m & 0xFF, t & 0xFF, alpha);
      mosaicPixels[i] = (r << 16) | (g << 8) | b;
    }
    mosaic.setRGB(0, 0, width, height, mosaicPixels, 0, width);
  }

  private static int mix(int mosaic, int target, double alpha) {
    return (int) Math.round(mosaic * (1.0 - alpha) + target * alpha);
  }

  /** Tile pixels at cell size, least recently used evicted first. */
  private final class TileCache {

    private final TileLibrary library;
    private final int cellSize;
    private final Map<Integer, int[]> entries;
    private int loads;

    TileCache(TileLibrary library, int cellSize, int capacity) {
      this.library = library;
      this.cellSize = cellSize;
      this.entries =
          new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Integer, int[]> eldest) {
              return size() > capacity;
            }
          };
    }

    int[] get(int tileIndex) {
      int[] pixels = entries.get(tileIndex);
      if (pixels == null) {
        pixels = load(library.tile(tileIndex));
        entries.put(tileIndex, pixels);
        loads++;
      }
      return pixels;
    }

    private int[] load(Tile tile) {
      try {
        BufferedImage image = TileImages.decode(storage.read(tile.storagePath()));
        return TileImages.pixels(TileImages.resize(image, cellSize, cellSize));
      } catch (IOException | UncheckedIOException e) {
        log.warn(
            "Cannot load tile {} of library {}, using its average color",
            tile.index(),
            library.getId(),
            e);
        int[] fill = new int[cellSize * cellSize];
        Arrays.fill(fill, tile.avgColor().packed());
        return fill;
      }
    }
  }
}
