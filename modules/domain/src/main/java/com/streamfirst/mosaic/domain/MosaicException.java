package com.streamfirst.mosaic.domain;

/**
 * Base type of every failure the mosaic engine reports deliberately.
 */
public class MosaicException extends RuntimeException {

    public MosaicException(String message) {
        super(message);
    }

    public MosaicException(String message, Throwable cause) {
        super(message, cause);
    }
}
