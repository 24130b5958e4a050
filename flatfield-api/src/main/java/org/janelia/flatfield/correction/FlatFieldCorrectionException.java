package org.janelia.flatfield.correction;

/**
 * Base class of the failures that terminate a correction run.
 */
public class FlatFieldCorrectionException extends RuntimeException {

    public FlatFieldCorrectionException(String message) {
        super(message);
    }

    public FlatFieldCorrectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
