package com.streamfirst.mosaic.domain;

/**
 * The supplied images cannot produce a usable result, e.g. fewer valid tiles than required.
 * Recoverable by resubmitting fresh input.
 */
public class ContentException extends MosaicException {

    public ContentException(String message) {
        super(message);
    }
}
