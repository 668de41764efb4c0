package com.phillippitts.bes3t.service.assembly;

import com.phillippitts.bes3t.domain.AcquisitionParams;
import com.phillippitts.bes3t.domain.Metadata;
import com.phillippitts.bes3t.domain.Spectrum;
import com.phillippitts.bes3t.domain.Spectrum1D;
import com.phillippitts.bes3t.domain.Spectrum2D;
import com.phillippitts.bes3t.domain.SpectrumType;
import com.phillippitts.bes3t.service.decode.DecodedChannel;
import com.phillippitts.bes3t.service.layout.ChannelLayout;
import com.phillippitts.bes3t.service.metadata.AxisReconstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Turns a decoded channel into a {@link Spectrum1D} or, when the layout has more than one
 * row, a {@link Spectrum2D}.
 */
public final class SpectrumAssembler {

    public static final String INTENSITY_LABEL = "Intensity (a.u.)";

    private SpectrumAssembler() {}

    /**
     * Axis label in the {@code "NAME (UNIT)"} form, blank parts kept as empty strings.
     */
    public static String axisLabel(Metadata meta, String axis) {
        return meta.getString(axis + "NAM", "") + " (" + meta.getString(axis + "UNI", "") + ")";
    }

    /**
     * @param displayName descriptor base name plus channel suffix
     * @param xLabel      normalized x-axis label
     * @param xData       normalized x-axis values, {@code layout.xPoints()} long
     */
    public static Spectrum assemble(String displayName,
                                    SpectrumType type,
                                    Optional<AcquisitionParams> params,
                                    String xLabel,
                                    double[] xData,
                                    Metadata meta,
                                    ChannelLayout layout,
                                    DecodedChannel channel) {
        if (layout.isTwoDimensional()) {
            double[] yData = AxisReconstructor.axisVector(meta, "Y", layout.yPoints());
            double[][] zData = reshape(channel.real(), layout.xPoints(), layout.yPoints());
            return new Spectrum2D(displayName, type, params, xLabel, axisLabel(meta, "Y"), xData, yData, zData);
        }
        return new Spectrum1D(displayName, type, params, xLabel, INTENSITY_LABEL,
                xData, channel.real(), channel.imag());
    }

    /**
     * Row-major reshape: row {@code k} holds elements {@code [k*columns, (k+1)*columns)}.
     *
     * @throws IllegalArgumentException if {@code flat} holds fewer than {@code rows*columns} values
     */
    public static double[][] reshape(double[] flat, int columns, int rows) {
        long required = (long) rows * columns;
        if (flat.length < required) {
            throw new IllegalArgumentException("Cannot reshape " + flat.length + " values into "
                    + rows + "x" + columns);
        }
        double[][] out = new double[rows][];
        for (int k = 0; k < rows; k++) {
            out[k] = Arrays.copyOfRange(flat, k * columns, (k + 1) * columns);
        }
        return out;
    }
}
