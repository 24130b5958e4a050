package org.janelia.flatfield.image;

/**
 * An artifact whose pixel data can be dropped once it is no longer needed.
 */
public interface Releasable {

    /**
     * Release the artifact's data. Calling it more than once is an error.
     */
    void release();

    boolean isReleased();
}
