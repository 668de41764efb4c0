package com.phillippitts.bes3t.domain;

/**
 * Experiment classification of a spectrum.
 *
 * <p>{@link #label()} is the display/wire form ("2D T1", "Rabi", ...). Two-dimensional
 * variants exist for every one-dimensional family; {@link #HYSCORE} is inherently 2-D and
 * has no separate variant.
 */
public enum SpectrumType {

    CW("CW"),
    EDFS("EDFS"),
    T1("T1"),
    T2("T2"),
    RABI("Rabi"),
    HYSCORE("HYSCORE"),
    TWO_D("2D"),
    TWO_D_CW("2D CW"),
    TWO_D_EDFS("2D EDFS"),
    TWO_D_T1("2D T1"),
    TWO_D_T2("2D T2"),
    TWO_D_RABI("2D Rabi"),
    UNKNOWN("Unknown");

    private final String label;

    SpectrumType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** True for labels carrying the "2D" marker. */
    public boolean hasTwoDMarker() {
        return label.startsWith("2D");
    }

    /**
     * Type to report when the payload is a matrix. T1/T2 become "2D T1"/"2D T2", Unknown and
     * 2D collapse to "2D", HYSCORE stays as is, every other family gains the "2D " prefix.
     */
    public SpectrumType toTwoDimensional() {
        return switch (this) {
            case CW -> TWO_D_CW;
            case EDFS -> TWO_D_EDFS;
            case T1 -> TWO_D_T1;
            case T2 -> TWO_D_T2;
            case RABI -> TWO_D_RABI;
            case UNKNOWN -> TWO_D;
            default -> this;
        };
    }

    /**
     * Type to report when the payload is a single trace. A bare "2D" label falls back to CW;
     * other 2D-marked types lose the marker.
     */
    public SpectrumType toOneDimensional() {
        return switch (this) {
            case TWO_D, TWO_D_CW -> CW;
            case TWO_D_EDFS -> EDFS;
            case TWO_D_T1 -> T1;
            case TWO_D_T2 -> T2;
            case TWO_D_RABI -> RABI;
            default -> this;
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
