package org.dparam.processing;

import org.dparam.core.InvalidParameterException;

/**
 * Adaptive Wiener filter driven by the local mean and variance of a sliding window.
 *
 * <p>The noise power is the mean of all local variances. Each sample is pulled
 * toward its local mean by {@code noise / localVariance}; where the local variance
 * does not exceed the noise the local mean is used as is. Windows at the ends
 * only cover the samples that exist.
 */
public class WienerFilter {

    private final int window;

    public WienerFilter(int window) {
        if (window < 1) {
            throw new InvalidParameterException("Wiener window must be at least 1, got " + window);
        }
        this.window = window;
    }

    public int getWindow() { return window; }

    public double[] filter(double[] data) {
        int n = data.length;
        int right = (window - 1) / 2;
        int left = window - 1 - right;

        double[] localMean = new double[n];
        double[] localVar = new double[n];
        double noise = 0;

        for (int i = 0; i < n; i++) {
            int lo = Math.max(0, i - left);
            int hi = Math.min(n - 1, i + right);
            int count = hi - lo + 1;

            double sum = 0;
            double sumSq = 0;
            for (int j = lo; j <= hi; j++) {
                sum += data[j];
                sumSq += data[j] * data[j];
            }
            double mean = sum / count;
            localMean[i] = mean;
            localVar[i] = sumSq / count - mean * mean;
            noise += localVar[i];
        }
        if (n > 0) {
            noise /= n;
        }

        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            if (localVar[i] <= noise) {
                out[i] = localMean[i];
            } else {
                out[i] = localMean[i] + (data[i] - localMean[i]) * (1 - noise / localVar[i]);
            }
        }
        return out;
    }
}
