package com.streamfirst.mosaic.domain;

/**
 * A submission was rejected: out-of-range parameters, a reference to an entity the caller does
 * not own or that does not exist, or an entity in the wrong state. Raised synchronously;
 * nothing is created.
 */
public class ValidationException extends MosaicException {

    public ValidationException(String message) {
        super(message);
    }
}
