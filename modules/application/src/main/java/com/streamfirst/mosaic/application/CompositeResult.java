package com.streamfirst.mosaic.application;

import java.awt.image.BufferedImage;
import lombok.NonNull;
import lombok.Value;

/**
 * A rendered mosaic together with the tile chosen for each grid cell, in row-major order.
 */
@Value
public class CompositeResult {

  @NonNull BufferedImage image;

  int columns;

  int rows;

  @NonNull int[] selections;

  /** Chosen tile indices in row-major order, as a copy. */
  public int[] getSelections() {
    return selections.clone();
  }

  public int selectionAt(int column, int row) {
    if (column < 0 || column >= columns || row < 0 || row >= rows) {
      throw new IndexOutOfBoundsException("Cell (" + column + "," + row + ") outside "
          + columns + "x" + rows + " grid");
    }
    return selections[row * columns + column];
  }

  public int cellCount() {
    return selections.length;
  }
}
