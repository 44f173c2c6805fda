package org.dparam.core;

/**
 * Non-positive width, negative pass count or a window too short for the
 * selected smoothing algorithm.
 */
public class InvalidParameterException extends DParameterException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
