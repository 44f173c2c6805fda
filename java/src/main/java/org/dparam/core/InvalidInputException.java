package org.dparam.core;

/**
 * Signal data unusable by the pipeline: mismatched lengths, too few points,
 * non-finite values or repeated x positions.
 */
public class InvalidInputException extends DParameterException {

    public InvalidInputException(String message) {
        super(message);
    }
}
