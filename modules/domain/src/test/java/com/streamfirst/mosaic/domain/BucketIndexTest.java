package com.streamfirst.mosaic.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BucketIndexTest {

    private static Tile tile(int index, int r, int g, int b) {
        return new Tile(index, StoragePath.of("thumbs", "t" + index + ".jpg"), new Rgb(r, g, b));
    }

    @Test
    void groupsTilesByQuantizedColor() {
        List<Tile> tiles = List.of(
                tile(0, 0, 0, 0),
                tile(1, 7, 7, 7),
                tile(2, 8, 0, 0),
                tile(3, 255, 255, 255));

        BucketIndex index = BucketIndex.forTiles(8, tiles);

        assertThat(index.tileCount()).isEqualTo(4);
        assertThat(index.bucketCount()).isEqualTo(3);
        assertThat(index.members(new BucketKey(0, 0, 0))).containsExactly(0, 1);
        assertThat(index.members(new BucketKey(1, 0, 0))).containsExactly(2);
        assertThat(index.members(new BucketKey(31, 31, 31))).containsExactly(3);
        assertThat(index.members(new BucketKey(5, 5, 5))).isEmpty();
    }

    @Test
    void keyForDividesEachChannel() {
        BucketIndex index = BucketIndex.empty(8);

        assertThat(index.keyFor(new Rgb(17, 200, 63))).isEqualTo(new BucketKey(2, 25, 7));
    }

    @Test
    void rebuildsEqualIndexFromMembership() {
        BucketIndex built = BucketIndex.forTiles(8, List.of(tile(0, 10, 10, 10), tile(1, 12, 9, 14)));

        BucketIndex rebuilt = BucketIndex.of(8, Map.of(new BucketKey(1, 1, 1), List.of(1, 0)));

        assertThat(rebuilt).isEqualTo(built);
        assertThat(rebuilt.members(new BucketKey(1, 1, 1))).containsExactly(0, 1);
    }

    @Test
    void differentQuantizationIsNotEqual() {
        assertThat(BucketIndex.empty(8)).isNotEqualTo(BucketIndex.empty(16));
    }

    @Test
    void offsetMovesKey() {
        assertThat(new BucketKey(3, 3, 3).offset(-1, 0, 2)).isEqualTo(new BucketKey(2, 3, 5));
    }
}
