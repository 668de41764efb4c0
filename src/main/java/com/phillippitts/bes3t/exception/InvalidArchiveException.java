package com.phillippitts.bes3t.exception;

/**
 * Thrown when the input buffer cannot be read as an archive at all (not a ZIP, corrupt
 * central structures, oversized). Fatal for the whole decode call: there is no partial
 * result to salvage.
 */
public class InvalidArchiveException extends Bes3tException {

    private final long archiveSize;

    public InvalidArchiveException(String message) {
        super(message);
        this.archiveSize = -1;
    }

    public InvalidArchiveException(long archiveSize, String message) {
        super("Invalid archive (" + archiveSize + " bytes): " + message);
        this.archiveSize = archiveSize;
    }

    public InvalidArchiveException(String message, Throwable cause) {
        super(message, cause);
        this.archiveSize = -1;
    }

    /** Size of the rejected buffer in bytes, or -1 when unknown. */
    public long getArchiveSize() {
        return archiveSize;
    }
}
