package com.streamfirst.mosaic.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.mosaic.domain.Rgb;
import org.junit.jupiter.api.Test;

class ColorCorrectionTest {

  @Test
  void scaleIsClamped() {
    assertThat(ColorCorrection.scale(100, 100, 0.5)).isEqualTo(1.0);
    assertThat(ColorCorrection.scale(255, 0, 1.0)).isEqualTo(1.6);
    assertThat(ColorCorrection.scale(0, 255, 1.0)).isEqualTo(0.6);
  }

  @Test
  void lookupTablesSaturate() {
    assertThat(ColorCorrection.lookupTable(1.0)[200]).isEqualTo(200);
    assertThat(ColorCorrection.lookupTable(1.6)[200]).isEqualTo(255);
    assertThat(ColorCorrection.lookupTable(0.6)[100]).isEqualTo(60);
    assertThat(ColorCorrection.lookupTable(1.237)[100]).isEqualTo(123);
  }

  @Test
  void zeroStrengthLeavesPixelsAlone() {
    int[] pixels = {0x102030, 0xFFFFFF};

    assertThat(ColorCorrection.apply(pixels, new Rgb(1, 2, 3), new Rgb(200, 0, 0), 0.0))
        .isSameAs(pixels);
  }

  @Test
  void shiftsEachChannelTowardCellColor() {
    int[] pixels = {new Rgb(100, 100, 100).packed()};

    int[] corrected =
        ColorCorrection.apply(pixels, new Rgb(100, 100, 100), new Rgb(200, 100, 50), 1.0);

    assertThat(Rgb.fromPacked(corrected[0])).isEqualTo(new Rgb(160, 100, 60));
  }
}
