package com.streamfirst.mosaic.domain;

/**
 * A referenced entity or artifact does not exist (anymore) for the calling session.
 */
public class EntityNotFoundException extends MosaicException {

    public EntityNotFoundException(String message) {
        super(message);
    }
}
