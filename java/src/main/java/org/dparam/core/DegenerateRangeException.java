package org.dparam.core;

/**
 * The derivative is flat, so it cannot be mapped onto the data range.
 */
public class DegenerateRangeException extends DParameterException {

    private final double range;

    public DegenerateRangeException(double range) {
        super(String.format("Derivative range %.3e is too small to normalize", range));
        this.range = range;
    }

    public double getRange() { return range; }
}
