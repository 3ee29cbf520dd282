package com.streamfirst.mosaic.domain;

/**
 * A configured budget was exhausted: thumbnail storage, archive entries or worker capacity.
 */
public class ResourceExceededException extends MosaicException {

    public ResourceExceededException(String message) {
        super(message);
    }

    public ResourceExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
