package org.janelia.flatfield.correction;

import javax.annotation.Nullable;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.flatfield.image.MultichannelImage;
import org.janelia.flatfield.image.algorithms.ContrastEnhancer;

/**
 * Outcome of a successful correction run.
 *
 * @param <T> pixel type of the source image
 * @param <S> pixel type of the corrected composite
 */
public class CorrectionResult<T extends RealType<T> & NativeType<T>, S extends RealType<S> & NativeType<S>> {

    private final MultichannelImage<S> composite;
    private final CorrectionParams params;
    private final ContrastEnhancer.PercentileBounds contrastBounds;
    private final CorrectionIntermediates<T, S> intermediates;

    CorrectionResult(MultichannelImage<S> composite,
                     CorrectionParams params,
                     ContrastEnhancer.PercentileBounds contrastBounds,
                     @Nullable CorrectionIntermediates<T, S> intermediates) {
        this.composite = composite;
        this.params = params;
        this.contrastBounds = contrastBounds;
        this.intermediates = intermediates;
    }

    public MultichannelImage<S> getComposite() {
        return composite;
    }

    public CorrectionParams getParams() {
        return params;
    }

    public ContrastEnhancer.PercentileBounds getContrastBounds() {
        return contrastBounds;
    }

    public boolean hasIntermediates() {
        return intermediates != null;
    }

    /**
     * @return the retained intermediates or null if the run did not keep them
     */
    @Nullable
    public CorrectionIntermediates<T, S> getIntermediates() {
        return intermediates;
    }
}
