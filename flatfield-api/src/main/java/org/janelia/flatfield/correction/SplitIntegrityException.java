package org.janelia.flatfield.correction;

public class SplitIntegrityException extends FlatFieldCorrectionException {

    public SplitIntegrityException(String message) {
        super(message);
    }
}
