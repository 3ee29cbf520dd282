package com.streamfirst.mosaic.application;

/**
 * Receives coarse progress of a running composition.
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (percent, message) -> {};

  /**
   * @param percent completion between 0 and 100
   * @param message short description of the current phase
   */
  void onProgress(int percent, String message);
}
