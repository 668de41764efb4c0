package com.phillippitts.bes3t.domain;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A real-valued matrix over two axes. Row {@code k} of {@code zData} holds the trace at
 * {@code yData[k]}; every row has {@code xData.length} values.
 */
public record Spectrum2D(
        String filename,
        SpectrumType type,
        Optional<AcquisitionParams> params,
        String xLabel,
        String yLabel,
        double[] xData,
        double[] yData,
        double[][] zData
) implements Spectrum {

    public Spectrum2D {
        Objects.requireNonNull(filename, "Filename must not be null");
        Objects.requireNonNull(type, "Type must not be null");
        Objects.requireNonNull(params, "Params must not be null (use Optional.empty())");
        Objects.requireNonNull(xLabel, "X label must not be null");
        Objects.requireNonNull(yLabel, "Y label must not be null");
        Objects.requireNonNull(xData, "X data must not be null");
        Objects.requireNonNull(yData, "Y data must not be null");
        Objects.requireNonNull(zData, "Z data must not be null");
        if (zData.length != yData.length) {
            throw new IllegalArgumentException("Row count " + zData.length
                    + " does not match y length " + yData.length);
        }
        double[][] rows = new double[zData.length][];
        for (int k = 0; k < zData.length; k++) {
            if (zData[k] == null || zData[k].length != xData.length) {
                throw new IllegalArgumentException("Row " + k + " does not have " + xData.length + " values");
            }
            rows[k] = zData[k].clone();
        }
        xData = xData.clone();
        yData = yData.clone();
        zData = rows;
    }

    @Override
    public double[] xData() {
        return xData.clone();
    }

    @Override
    public double[] yData() {
        return yData.clone();
    }

    @Override
    public double[][] zData() {
        double[][] copy = new double[zData.length][];
        for (int k = 0; k < zData.length; k++) {
            copy[k] = zData[k].clone();
        }
        return copy;
    }

    /** Value equality: axes and rows are compared element by element. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Spectrum2D other)) {
            return false;
        }
        return filename.equals(other.filename)
                && type == other.type
                && params.equals(other.params)
                && xLabel.equals(other.xLabel)
                && yLabel.equals(other.yLabel)
                && Arrays.equals(xData, other.xData)
                && Arrays.equals(yData, other.yData)
                && Arrays.deepEquals(zData, other.zData);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(filename, type, params, xLabel, yLabel);
        result = 31 * result + Arrays.hashCode(xData);
        result = 31 * result + Arrays.hashCode(yData);
        return 31 * result + Arrays.deepHashCode(zData);
    }

    public int rowCount() {
        return yData.length;
    }

    public int columnCount() {
        return xData.length;
    }

    @Override
    public boolean isTwoDimensional() {
        return true;
    }
}
