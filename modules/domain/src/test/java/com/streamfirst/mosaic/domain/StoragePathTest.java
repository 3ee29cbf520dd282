package com.streamfirst.mosaic.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class StoragePathTest {

    @Test
    void joinsComponentsAndResolvesChildren() {
        StoragePath dir = StoragePath.of("libraries", "abc");

        assertThat(dir.resolve("thumbs/t_0000001.jpg").path())
                .isEqualTo("libraries/abc/thumbs/t_0000001.jpg");
        assertThat(dir.resolve("x.jpg").getParent()).isEqualTo(dir);
    }

    @Test
    void normalizesSeparators() {
        assertThat(StoragePath.of("targets\\t1\\target.png").path()).isEqualTo("targets/t1/target.png");
        assertThat(StoragePath.of("results/").path()).isEqualTo("results");
    }

    @Test
    void rejectsPathsLeavingTheRoot() {
        assertThatThrownBy(() -> StoragePath.of("/etc/passwd")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StoragePath.of("a/../../b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StoragePath.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportsNameAndLowercaseExtension() {
        StoragePath path = StoragePath.of("targets/t1/Photo.JPEG");

        assertThat(path.getFileName()).isEqualTo("Photo.JPEG");
        assertThat(path.getExtension()).isEqualTo(".jpeg");
        assertThat(StoragePath.of("README").getExtension()).isEmpty();
    }

    @Test
    void prefixMatchesWholeSegmentsOnly() {
        StoragePath dir = StoragePath.of("libraries/abc");

        assertThat(StoragePath.of("libraries/abc/meta.json").startsWith(dir)).isTrue();
        assertThat(dir.startsWith(dir)).isTrue();
        assertThat(StoragePath.of("libraries/abcd/meta.json").startsWith(dir)).isFalse();
    }
}
