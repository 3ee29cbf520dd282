package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.BucketIndex;
import com.streamfirst.mosaic.domain.BucketKey;
import com.streamfirst.mosaic.domain.Rgb;
import com.streamfirst.mosaic.domain.Tile;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Approximate nearest-tile lookup over a library's bucket index.
 *
 * <p>The search grows a cube of buckets around the query color, radius 0, 1, 2, ... in Chebyshev
 * distance, collecting the tiles it finds in first-encountered order. It stops once the candidate
 * cap is reached or the maximum radius has been scanned. Candidates are ranked by squared RGB
 * distance (stable, so ties keep encounter order) and the first one not forbidden wins. When every
 * candidate is forbidden the best one is returned anyway. A query that finds no candidates at all
 * ranks the whole library instead.
 */
public final class TileMatcher {

  private final List<Tile> tiles;
  private final BucketIndex index;
  private final int candidateCap;
  private final int maxRadius;

  public TileMatcher(List<Tile> tiles, BucketIndex index, int candidateCap, int maxRadius) {
    if (tiles.isEmpty()) {
      throw new IllegalArgumentException("Cannot match against an empty library");
    }
    this.tiles = tiles;
    this.index = index;
    this.candidateCap = candidateCap;
    this.maxRadius = maxRadius;
  }

  /**
   * Picks the tile for a cell.
   *
   * @param color average color of the cell
   * @param forbidden tiles to avoid if any alternative exists
   * @return index of the chosen tile
   */
  public int select(Rgb color, IntPredicate forbidden) {
    int[] ranked = rank(color, candidates(color));
    for (int tileIndex : ranked) {
      if (!forbidden.test(tileIndex)) {
        return tileIndex;
      }
    }
    return ranked[0];
  }

  /**
   * Candidate tile indices in first-encountered order; every tile of the library when the bucket
   * search finds nothing.
   */
  int[] candidates(Rgb color) {
    BucketKey center = index.keyFor(color);
    boolean[] seen = new boolean[tiles.size()];
    int[] found = new int[16];
    int count = 0;
    for (int radius = 0; radius <= maxRadius; radius++) {
      for (int dr = -radius; dr <= radius; dr++) {
        for (int dg = -radius; dg <= radius; dg++) {
          for (int db = -radius; db <= radius; db++) {
            // inner shells were collected at smaller radii
            if (Math.max(Math.abs(dr), Math.max(Math.abs(dg), Math.abs(db))) != radius) {
              continue;
            }
            for (int member : index.members(center.offset(dr, dg, db))) {
              if (!seen[member]) {
                seen[member] = true;
                if (count == found.length) {
                  found = Arrays.copyOf(found, count * 2);
                }
                found[count++] = member;
              }
            }
          }
        }
      }
      if (count >= candidateCap) {
        break;
      }
    }
    if (count == 0) {
      int[] all = new int[tiles.size()];
      Arrays.setAll(all, i -> i);
      return all;
    }
    return Arrays.copyOf(found, count);
  }

  private int[] rank(Rgb color, int[] candidates) {
    Integer[] order = new Integer[candidates.length];
    int[] distance = new int[candidates.length];
    for (int i = 0; i < candidates.length; i++) {
      order[i] = i;
      distance[i] = color.distanceSquared(tiles.get(candidates[i]).avgColor());
    }
    Arrays.sort(order, Comparator.comparingInt(i -> distance[i]));
    int[] ranked = new int[candidates.length];
    for (int i = 0; i < order.length; i++) {
      ranked[i] = candidates[order[i]];
    }
    return ranked;
  }
}
