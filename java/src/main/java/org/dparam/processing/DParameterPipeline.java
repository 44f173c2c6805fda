package org.dparam.processing;

import org.dparam.core.*;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the D-parameter of a curve: smooth, differentiate, smooth the
 * derivative, normalize it onto the data range and measure its extrema.
 *
 * <p>Runs hold no state, so one instance may serve several threads as long as
 * each call gets its own signal.
 */
public class DParameterPipeline {
    private static final Logger logger = Logger.getLogger(DParameterPipeline.class.getName());

    private final SignalSmoother smoother;
    private final DerivativeEngine derivativeEngine;
    private final Normalizer normalizer;
    private final ExtremaLocator extremaLocator;

    public DParameterPipeline() {
        this(new SignalSmoother(), new DerivativeEngine(), new Normalizer(), new ExtremaLocator());
    }

    public DParameterPipeline(SignalSmoother smoother, DerivativeEngine derivativeEngine,
                              Normalizer normalizer, ExtremaLocator extremaLocator) {
        this.smoother = smoother;
        this.derivativeEngine = derivativeEngine;
        this.normalizer = normalizer;
        this.extremaLocator = extremaLocator;
    }

    /**
     * Run the full computation. All checks happen before any arithmetic.
     *
     * @throws InvalidInputException if the signal cannot be differentiated
     * @throws InvalidParameterException on a bad width, pass count or window
     * @throws UnsupportedAlgorithmException if the config has no algorithm
     * @throws DegenerateRangeException if the smoothed derivative is flat
     */
    public DParameterResult run(Signal signal, PipelineConfig config) {
        if (signal == null) {
            throw new InvalidInputException("Signal is required");
        }
        if (config == null) {
            throw new InvalidParameterException("Pipeline configuration is required");
        }
        signal.validate();
        config.validate();

        SmoothingConfig pre = config.preSmoothing();
        SmoothingConfig post = config.postSmoothing();
        // A stage that never runs does not need a usable window
        if (config.getPreSmoothPasses() > 0) {
            smoother.checkParameters(pre);
        }
        if (config.getPostSmoothPasses() > 0) {
            smoother.checkParameters(post);
        }

        double[] x = signal.getX();
        double[] y = signal.getY();

        double[] smoothed = smoother.smooth(y, pre, config.getPreSmoothPasses());
        double[] derivative = derivativeEngine.differentiate(x, smoothed);
        derivative = smoother.smooth(derivative, post, config.getPostSmoothPasses());
        double[] normalized = normalizer.normalize(derivative, y);
        Extrema extrema = extremaLocator.locate(normalized, x);

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("%s: %s with %s", signal.getSourceId(), extrema, config));
        }

        return new DParameterResult(normalized, extrema.getMinIndex(), extrema.getMaxIndex(),
            extrema.getCenter(), extrema.getSeparation(), config);
    }

    public DParameterResult run(double[] x, double[] y, PipelineConfig config) {
        return run(new Signal(x, y), config);
    }
}
