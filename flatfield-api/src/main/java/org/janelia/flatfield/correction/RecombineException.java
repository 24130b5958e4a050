package org.janelia.flatfield.correction;

public class RecombineException extends FlatFieldCorrectionException {

    public RecombineException(String message) {
        super(message);
    }
}
