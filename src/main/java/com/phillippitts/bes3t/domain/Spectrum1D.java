package com.phillippitts.bes3t.domain;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A single complex trace over one axis.
 *
 * @param filename display name of the originating descriptor (plus channel suffix)
 * @param type     inferred experiment type
 * @param params   acquisition parameters parsed from the file name (may be empty)
 * @param xLabel   axis label, e.g. {@code "Magnetic Field (G)"}
 * @param yLabel   intensity label
 * @param xData    axis values
 * @param realData real component, same length as {@code xData}
 * @param imagData imaginary component, same length as {@code xData}
 */
public record Spectrum1D(
        String filename,
        SpectrumType type,
        Optional<AcquisitionParams> params,
        String xLabel,
        String yLabel,
        double[] xData,
        double[] realData,
        double[] imagData
) implements Spectrum {

    /**
     * @throws IllegalArgumentException if the data vectors differ in length
     * @throws NullPointerException if any component is null
     */
    public Spectrum1D {
        Objects.requireNonNull(filename, "Filename must not be null");
        Objects.requireNonNull(type, "Type must not be null");
        Objects.requireNonNull(params, "Params must not be null (use Optional.empty())");
        Objects.requireNonNull(xLabel, "X label must not be null");
        Objects.requireNonNull(yLabel, "Y label must not be null");
        Objects.requireNonNull(xData, "X data must not be null");
        Objects.requireNonNull(realData, "Real data must not be null");
        Objects.requireNonNull(imagData, "Imaginary data must not be null");
        if (realData.length != xData.length || imagData.length != xData.length) {
            throw new IllegalArgumentException("Vector lengths differ: x=" + xData.length
                    + ", real=" + realData.length + ", imag=" + imagData.length);
        }
        xData = xData.clone();
        realData = realData.clone();
        imagData = imagData.clone();
    }

    @Override
    public double[] xData() {
        return xData.clone();
    }

    @Override
    public double[] realData() {
        return realData.clone();
    }

    @Override
    public double[] imagData() {
        return imagData.clone();
    }

    /** Value equality: vectors are compared element by element. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Spectrum1D other)) {
            return false;
        }
        return filename.equals(other.filename)
                && type == other.type
                && params.equals(other.params)
                && xLabel.equals(other.xLabel)
                && yLabel.equals(other.yLabel)
                && Arrays.equals(xData, other.xData)
                && Arrays.equals(realData, other.realData)
                && Arrays.equals(imagData, other.imagData);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(filename, type, params, xLabel, yLabel);
        result = 31 * result + Arrays.hashCode(xData);
        result = 31 * result + Arrays.hashCode(realData);
        return 31 * result + Arrays.hashCode(imagData);
    }

    public int pointCount() {
        return xData.length;
    }

    @Override
    public boolean isTwoDimensional() {
        return false;
    }
}
