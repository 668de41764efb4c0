package com.phillippitts.bes3t.exception;

/**
 * Thrown when no data file can be paired with a descriptor.
 */
public class MissingDataFileException extends Bes3tException {

    private final String descriptorName;

    public MissingDataFileException(String descriptorName) {
        super("No data file found for descriptor: " + descriptorName);
        this.descriptorName = descriptorName;
    }

    public String getDescriptorName() {
        return descriptorName;
    }
}
