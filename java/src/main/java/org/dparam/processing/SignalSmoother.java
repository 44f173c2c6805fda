package org.dparam.processing;

import org.dparam.core.*;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies one of the {@link SmoothingAlgorithm}s to a sequence of samples.
 *
 * <p>Every algorithm returns a new array of the same length as its input. Windows
 * are aligned like "same"-mode convolution: a window of length M covers
 * {@code [i - (M - 1 - (M - 1) / 2), i + (M - 1) / 2]}, which is symmetric for odd M
 * and reaches one sample further to the left for even M. Near the ends only the
 * samples inside the data are used; the convolution kernels are renormalized over
 * that overlap so a constant sequence stays constant up to the last sample.
 * Windows wider than the data are cut to {@code 2n + 1} samples, which still
 * reach every sample from every position.
 */
public class SignalSmoother {
    private static final Logger logger = Logger.getLogger(SignalSmoother.class.getName());

    /** Gaussian kernels are cut off at this many sigmas. */
    public static final double GAUSSIAN_TRUNCATE = 4.0;

    /** Window lengths are derived from the width at this many samples per unit. */
    public static final double WINDOW_SCALE = 10.0;

    public double[] smooth(double[] data, double width, SmoothingAlgorithm algorithm) {
        return smooth(data, new SmoothingConfig(algorithm, width));
    }

    public double[] smooth(double[] data, SmoothingConfig config) {
        checkParameters(config);
        double width = config.getWidth();

        switch (config.getAlgorithm()) {
            case GAUSSIAN:
                return gaussian(data, width);
            case SAVITZKY_GOLAY:
                return new SavitzkyGolayFilter(clampWindow(savitzkyGolayWindow(width), data.length)).filter(data);
            case MOVING_AVERAGE:
                return movingAverage(data, clampWindow(windowLength(width), data.length));
            case WIENER:
                return new WienerFilter(clampWindow(windowLength(width), data.length)).filter(data);
            case NONE:
                return data.clone();
            default:
                throw new UnsupportedAlgorithmException(config.getAlgorithm().name());
        }
    }

    /**
     * Apply the same smoothing {@code passes} times, each pass working on the
     * output of the previous one. Zero passes returns a copy of the input.
     */
    public double[] smooth(double[] data, SmoothingConfig config, int passes) {
        if (passes < 0) {
            throw new InvalidParameterException("Number of passes must not be negative, got " + passes);
        }
        double[] current = data.clone();
        for (int pass = 0; pass < passes; pass++) {
            current = smooth(current, config);
        }
        if (passes > 0 && logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Smoothed %d samples with %s, %d pass(es)",
                data.length, config, passes));
        }
        return current;
    }

    /**
     * Reject a configuration whose derived window is too short for its algorithm.
     *
     * @throws InvalidParameterException if the window rule is violated
     */
    public void checkParameters(SmoothingConfig config) {
        switch (config.getAlgorithm()) {
            case SAVITZKY_GOLAY:
                savitzkyGolayWindow(config.getWidth());
                break;
            case MOVING_AVERAGE:
            case WIENER:
                windowLength(config.getWidth());
                break;
            case GAUSSIAN:
            case NONE:
                break;
            default:
                throw new UnsupportedAlgorithmException(config.getAlgorithm().name());
        }
    }

    /**
     * Window of the moving average and Wiener filters: {@code floor(width * 10)}.
     */
    public static int windowLength(double width) {
        int window = (int) Math.floor(width * WINDOW_SCALE);
        if (window < 1) {
            throw new InvalidParameterException(String.format(
                "Width %.3f gives a window of %d samples, at least 1 is needed", width, window));
        }
        return window;
    }

    /**
     * Window of the Savitzky-Golay filter: {@code floor(width * 10)}, bumped to the
     * next odd number, and long enough for a cubic.
     */
    public static int savitzkyGolayWindow(double width) {
        int window = (int) Math.floor(width * WINDOW_SCALE);
        if (window % 2 == 0) {
            window++;
        }
        if (window <= SavitzkyGolayFilter.POLYNOMIAL_ORDER) {
            throw new InvalidParameterException(String.format(
                "Width %.3f gives a Savitzky-Golay window of %d samples, more than %d are needed",
                width, window, SavitzkyGolayFilter.POLYNOMIAL_ORDER));
        }
        return window;
    }

    /**
     * Cut a window to an odd length of at least {@code 2n + 1} (and never below 5,
     * the shortest cubic window), leaving shorter windows as they are.
     */
    static int clampWindow(int window, int n) {
        long limit = Math.max(2L * n + 1, 5);
        return (int) Math.min(window, limit);
    }

    /**
     * Kernel radius in samples; saturates at {@code Integer.MAX_VALUE} for huge sigmas.
     */
    static int gaussianRadius(double sigma) {
        return (int) (GAUSSIAN_TRUNCATE * sigma + 0.5);
    }

    static double[] gaussianKernel(double sigma) {
        return gaussianKernel(sigma, gaussianRadius(sigma));
    }

    static double[] gaussianKernel(double sigma, int radius) {
        double[] kernel = new double[2 * radius + 1];
        for (int k = -radius; k <= radius; k++) {
            double t = k / sigma;
            kernel[k + radius] = Math.exp(-0.5 * t * t);
        }
        return kernel;
    }

    private double[] gaussian(double[] data, double sigma) {
        // Offsets past n never overlap the data
        int radius = Math.min(gaussianRadius(sigma), data.length);
        if (radius == 0) {
            return data.clone();
        }
        return convolve(data, gaussianKernel(sigma, radius));
    }

    private double[] movingAverage(double[] data, int window) {
        double[] kernel = new double[window];
        Arrays.fill(kernel, 1.0);
        return convolve(data, kernel);
    }

    /**
     * Weighted window average with the kernel restricted to, and renormalized over,
     * the samples that exist. Kernels here are non-negative.
     */
    static double[] convolve(double[] data, double[] kernel) {
        int n = data.length;
        int right = (kernel.length - 1) / 2;
        int left = kernel.length - 1 - right;
        double[] out = new double[n];

        for (int i = 0; i < n; i++) {
            int lo = Math.max(0, i - left);
            int hi = Math.min(n - 1, i + right);
            double sum = 0;
            double weight = 0;
            for (int j = lo; j <= hi; j++) {
                double w = kernel[j - i + left];
                sum += w * data[j];
                weight += w;
            }
            out[i] = sum / weight;
        }
        return out;
    }
}
