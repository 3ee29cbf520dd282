package com.streamfirst.mosaic.application;

/** Turns caught exceptions into the message stored on a failed entity. */
final class Failures {

  private Failures() {}

  static String describe(Throwable failure) {
    String message = failure.getMessage();
    return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
  }
}
