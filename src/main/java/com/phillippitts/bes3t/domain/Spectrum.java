package com.phillippitts.bes3t.domain;

import java.util.Optional;

/**
 * A decoded spectrum: either a single trace ({@link Spectrum1D}) or a matrix ({@link Spectrum2D}).
 */
public interface Spectrum {

    /** Display name: descriptor base name, suffixed {@code _ch<n>} for multi-channel files. */
    String filename();

    SpectrumType type();

    /** Parameters recovered from the file name, when any were extracted. */
    Optional<AcquisitionParams> params();

    String xLabel();

    String yLabel();

    double[] xData();

    boolean isTwoDimensional();
}
