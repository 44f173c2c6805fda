package org.dparam.core;

/**
 * Raised for a smoothing algorithm name that is not one of {@link SmoothingAlgorithm}.
 */
public class UnsupportedAlgorithmException extends DParameterException {

    private final String name;

    public UnsupportedAlgorithmException(String name) {
        super("Unsupported smoothing algorithm: " + name);
        this.name = name;
    }

    public String getName() { return name; }
}
