package org.dparam.core;

/**
 * Base type of every failure raised by the D-parameter computation.
 */
public class DParameterException extends RuntimeException {

    public DParameterException(String message) {
        super(message);
    }
}
