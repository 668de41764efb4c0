package com.phillippitts.bes3t.service.decode;

/**
 * Samples recovered for one dataset, plus the heuristic decisions taken on the way.
 *
 * @param index            zero-based dataset position in the payload
 * @param real             real component, {@code pointCount} long
 * @param imag             imaginary component, same length as {@code real} (zeros for real data)
 * @param realScore        smoothness score of {@code real}
 * @param byteOrderSwapped whether the declared byte order was reversed
 * @param blockLayout      whether real/imaginary were stored as two blocks instead of interleaved
 * @param imagCleared      whether a noisy imaginary part was zeroed next to a clean real part
 */
public record DecodedChannel(
        int index,
        double[] real,
        double[] imag,
        double realScore,
        boolean byteOrderSwapped,
        boolean blockLayout,
        boolean imagCleared
) {

    public int pointCount() {
        return real.length;
    }
}
