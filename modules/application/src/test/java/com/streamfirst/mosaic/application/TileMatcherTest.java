package com.streamfirst.mosaic.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.mosaic.domain.BucketIndex;
import com.streamfirst.mosaic.domain.Rgb;
import com.streamfirst.mosaic.domain.StoragePath;
import com.streamfirst.mosaic.domain.Tile;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.IntPredicate;
import org.junit.jupiter.api.Test;

class TileMatcherTest {

  private static List<Tile> tiles(Rgb... colors) {
    List<Tile> tiles = new ArrayList<>();
    for (int i = 0; i < colors.length; i++) {
      tiles.add(new Tile(i, StoragePath.of("t" + i + ".jpg"), colors[i]));
    }
    return tiles;
  }

  private static TileMatcher matcher(List<Tile> tiles, int cap, int radius) {
    return new TileMatcher(tiles, BucketIndex.forTiles(8, tiles), cap, radius);
  }

  /** First closest allowed candidate in encounter order, or the first closest overall. */
  private static int linearScan(List<Tile> tiles, int[] candidates, Rgb query, IntPredicate forbidden) {
    int best = -1;
    int bestAllowed = -1;
    for (int candidate : candidates) {
      int distance = query.distanceSquared(tiles.get(candidate).avgColor());
      if (best < 0 || distance < query.distanceSquared(tiles.get(best).avgColor())) {
        best = candidate;
      }
      if (!forbidden.test(candidate) && (bestAllowed < 0
          || distance < query.distanceSquared(tiles.get(bestAllowed).avgColor()))) {
        bestAllowed = candidate;
      }
    }
    return bestAllowed >= 0 ? bestAllowed : best;
  }

  @Test
  void saturatedSearchMatchesLinearScanUnderForbiddenSets() {
    Random random = new Random(42);
    List<Tile> tiles = new ArrayList<>();
    for (int i = 0; i < 300; i++) {
      // coarse colors so that equal distances are common
      tiles.add(new Tile(i, StoragePath.of("t" + i + ".jpg"),
          new Rgb(random.nextInt(16) * 17, random.nextInt(16) * 17, random.nextInt(16) * 17)));
    }
    TileMatcher matcher = matcher(tiles, Integer.MAX_VALUE, 32);
    double[] densities = {0.0, 0.1, 0.5, 0.9, 1.0};

    for (int q = 0; q < 200; q++) {
      Rgb query = new Rgb(random.nextInt(256), random.nextInt(256), random.nextInt(256));
      double density = densities[q % densities.length];
      Set<Integer> blocked = new HashSet<>();
      for (int i = 0; i < tiles.size(); i++) {
        if (random.nextDouble() < density) {
          blocked.add(i);
        }
      }
      IntPredicate forbidden = blocked::contains;
      int[] candidates = matcher.candidates(query);

      int chosen = matcher.select(query, forbidden);

      assertThat(candidates).hasSize(tiles.size());
      assertThat(chosen).isEqualTo(linearScan(tiles, candidates, query, forbidden));
      int bestAllowed = tiles.stream()
          .filter(t -> !blocked.contains(t.index()))
          .mapToInt(t -> query.distanceSquared(t.avgColor()))
          .min()
          .orElse(tiles.stream().mapToInt(t -> query.distanceSquared(t.avgColor())).min().orElseThrow());
      assertThat(query.distanceSquared(tiles.get(chosen).avgColor())).isEqualTo(bestAllowed);
    }
  }

  @Test
  void skipsForbiddenTiles() {
    List<Tile> tiles = tiles(new Rgb(100, 100, 100), new Rgb(104, 100, 100), new Rgb(200, 0, 0));
    TileMatcher matcher = matcher(tiles, 2000, 8);

    assertThat(matcher.select(new Rgb(100, 100, 100), i -> false)).isEqualTo(0);
    assertThat(matcher.select(new Rgb(100, 100, 100), i -> i == 0)).isEqualTo(1);
  }

  @Test
  void fallsBackToBestWhenEverythingIsForbidden() {
    List<Tile> tiles = tiles(new Rgb(10, 10, 10), new Rgb(12, 12, 12), new Rgb(90, 90, 90));
    TileMatcher matcher = matcher(tiles, 2000, 8);

    assertThat(matcher.select(new Rgb(11, 11, 12), i -> true)).isEqualTo(1);
  }

  @Test
  void equalDistancesKeepIndexOrderWithinABucket() {
    List<Tile> tiles = tiles(new Rgb(50, 50, 50), new Rgb(50, 50, 50), new Rgb(50, 50, 50));
    TileMatcher matcher = matcher(tiles, 2000, 8);

    assertThat(matcher.select(new Rgb(50, 50, 50), i -> false)).isEqualTo(0);
    assertThat(matcher.select(new Rgb(50, 50, 50), i -> i == 0)).isEqualTo(1);
  }

  @Test
  void scansWholeLibraryWhenNoBucketIsInRange() {
    List<Tile> tiles = tiles(new Rgb(255, 255, 255), new Rgb(200, 200, 255), new Rgb(255, 0, 0));
    TileMatcher matcher = matcher(tiles, 2000, 1);

    assertThat(matcher.candidates(new Rgb(0, 0, 0))).containsExactly(0, 1, 2);
    assertThat(matcher.select(new Rgb(0, 0, 0), i -> false)).isEqualTo(2);
    assertThat(matcher.select(new Rgb(0, 0, 0), i -> i == 2)).isEqualTo(1);
  }

  @Test
  void collectsInnerShellsFirstAndStopsAtTheCap() {
    List<Tile> tiles = tiles(
        new Rgb(20, 20, 20),
        new Rgb(100, 100, 100),
        new Rgb(17, 17, 17),
        new Rgb(30, 30, 30));
    TileMatcher capped = matcher(tiles, 1, 8);
    TileMatcher open = matcher(tiles, 2000, 8);

    assertThat(capped.candidates(new Rgb(18, 18, 18))).containsExactly(0, 2);
    assertThat(open.candidates(new Rgb(18, 18, 18))).containsExactly(0, 2, 3);
  }
}
