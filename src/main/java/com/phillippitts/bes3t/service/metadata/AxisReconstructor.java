package com.phillippitts.bes3t.service.metadata;

import com.phillippitts.bes3t.domain.Metadata;

import java.util.OptionalDouble;

/**
 * Builds axis vectors from descriptor fields.
 *
 * <p>Resolution order for axis {@code A}: {@code AMIN}+{@code AWID}, then
 * {@code ASTRT}+{@code ASTOP}, then the index sequence {@code 0..n-1}.
 */
public final class AxisReconstructor {

    private AxisReconstructor() {}

    /**
     * @param meta       descriptor metadata
     * @param axisName   axis prefix, e.g. {@code "X"} or {@code "Y"}
     * @param pointCount number of samples along the axis
     * @return evenly spaced axis values, {@code pointCount} long (a single value when
     *         {@code pointCount == 1}, empty when {@code pointCount <= 0})
     */
    public static double[] axisVector(Metadata meta, String axisName, int pointCount) {
        if (pointCount <= 0) {
            return new double[0];
        }

        OptionalDouble min = meta.findDouble(axisName + "MIN");
        OptionalDouble width = meta.findDouble(axisName + "WID");
        if (min.isPresent() && width.isPresent()) {
            return linspace(min.getAsDouble(), width.getAsDouble(), pointCount);
        }

        OptionalDouble start = meta.findDouble(axisName + "STRT");
        OptionalDouble stop = meta.findDouble(axisName + "STOP");
        if (start.isPresent() && stop.isPresent()) {
            return linspace(start.getAsDouble(), stop.getAsDouble() - start.getAsDouble(), pointCount);
        }

        double[] index = new double[pointCount];
        for (int i = 0; i < pointCount; i++) {
            index[i] = i;
        }
        return index;
    }

    private static double[] linspace(double origin, double span, int pointCount) {
        if (pointCount == 1) {
            return new double[] {origin};
        }
        double step = span / (pointCount - 1);
        double[] values = new double[pointCount];
        for (int i = 0; i < pointCount; i++) {
            values[i] = origin + i * step;
        }
        return values;
    }
}
