package org.janelia.flatfield.correction;

/**
 * Raised when the input image or the parameters cannot be corrected. Nothing has been
 * created or modified when this is thrown.
 */
public class ValidationException extends FlatFieldCorrectionException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
