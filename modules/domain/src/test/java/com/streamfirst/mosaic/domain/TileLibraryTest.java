package com.streamfirst.mosaic.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class TileLibraryTest {

    private final TileLibrary queued = TileLibrary.queued(
            LibraryId.random(), SessionId.LEGACY, "beach.zip", 8, Instant.parse("2024-01-01T00:00:00Z"));

    private static List<Tile> tiles(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new Tile(i, StoragePath.of("t" + i + ".jpg"), new Rgb(i * 20, 0, 0)))
                .toList();
    }

    @Test
    void startsQueuedWithoutContent() {
        assertThat(queued.getStatus()).isEqualTo(LibraryStatus.QUEUED);
        assertThat(queued.getProgress()).isZero();
        assertThat(queued.hasContent()).isFalse();
    }

    @Test
    void readyRequiresMinimumTileCount() {
        List<Tile> nine = tiles(9);

        assertThatThrownBy(() -> queued.ready(nine, BucketIndex.forTiles(8, nine)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void readyCarriesContentAndMessage() {
        List<Tile> twelve = tiles(12);

        TileLibrary ready = queued.ready(twelve, BucketIndex.forTiles(8, twelve));

        assertThat(ready.isReady()).isTrue();
        assertThat(ready.getProgress()).isEqualTo(100);
        assertThat(ready.getMessage()).isEqualTo("Ready: 12 tiles");
        assertThat(ready.hasContent()).isTrue();
        assertThat(ready.view().tileCount()).isEqualTo(12);
    }

    @Test
    void durableFormDropsAndRegainsContent() {
        List<Tile> twelve = tiles(12);
        TileLibrary ready = queued.ready(twelve, BucketIndex.forTiles(8, twelve));

        TileLibrary record = ready.withoutContent();

        assertThat(record.hasContent()).isFalse();
        assertThat(record.getTileCount()).isEqualTo(12);
        assertThat(record).isEqualTo(ready);
        assertThat(record.withContent(twelve, BucketIndex.forTiles(8, twelve)).hasContent()).isTrue();
        assertThatThrownBy(() -> record.withContent(tiles(11), BucketIndex.forTiles(8, tiles(11))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedKeepsReasonVerbatim() {
        TileLibrary failed = queued.failed("Too few valid images (3), at least 10 required");

        assertThat(failed.getStatus()).isEqualTo(LibraryStatus.ERROR);
        assertThat(failed.getMessage()).isEqualTo("Too few valid images (3), at least 10 required");
    }
}
