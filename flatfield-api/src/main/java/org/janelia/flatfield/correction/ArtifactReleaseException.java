package org.janelia.flatfield.correction;

/**
 * Raised after a cleanup pass in which one or more artifacts could not be released.
 * The individual failures are attached as suppressed exceptions.
 */
public class ArtifactReleaseException extends FlatFieldCorrectionException {

    public ArtifactReleaseException(String message) {
        super(message);
    }
}
