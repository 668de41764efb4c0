package com.phillippitts.bes3t.service.decode;

/**
 * Signal statistics behind the decoder heuristics.
 */
public final class SignalStatistics {

    private SignalStatistics() {}

    /**
     * Smoothness score: mean absolute first difference divided by the peak-to-peak range,
     * computed over the first {@code window} samples. Lower is smoother; physically real
     * spectra score low while noise-like mis-splits score high.
     *
     * @return the score, or 0 when fewer than two samples are available or the range is zero
     */
    public static double smoothness(double[] values, int window) {
        int n = Math.min(values.length, window);
        if (n < 2) {
            return 0.0;
        }
        double min = values[0];
        double max = values[0];
        double diffSum = 0.0;
        for (int i = 1; i < n; i++) {
            double v = values[i];
            diffSum += Math.abs(v - values[i - 1]);
            if (v < min) {
                min = v;
            }
            if (v > max) {
                max = v;
            }
        }
        double range = max - min;
        if (range == 0.0) {
            return 0.0;
        }
        return (diffSum / (n - 1)) / range;
    }

    /**
     * Largest absolute value; NaN if any value is NaN, 0 for an empty array.
     */
    public static double maxAbs(double[] values) {
        double max = 0.0;
        for (double v : values) {
            if (Double.isNaN(v)) {
                return Double.NaN;
            }
            double abs = Math.abs(v);
            if (abs > max) {
                max = abs;
            }
        }
        return max;
    }

    /**
     * True when a decoded magnitude is finite and not above {@code limit}.
     */
    public static boolean isPlausibleMagnitude(double maxAbs, double limit) {
        return Double.isFinite(maxAbs) && maxAbs <= limit;
    }
}
