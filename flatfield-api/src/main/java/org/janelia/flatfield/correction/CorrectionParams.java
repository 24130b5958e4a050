package org.janelia.flatfield.correction;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.flatfield.image.PixelDepth;

/**
 * Validated correction options. Instances are created by the {@link ParameterResolver}.
 */
public class CorrectionParams {

    private final int targetChannel;
    private final double blurSigma;
    private final double contrastSaturation;
    private final PixelDepth outputDepth;
    private final boolean keepIntermediates;

    CorrectionParams(int targetChannel,
                     double blurSigma,
                     double contrastSaturation,
                     PixelDepth outputDepth,
                     boolean keepIntermediates) {
        this.targetChannel = targetChannel;
        this.blurSigma = blurSigma;
        this.contrastSaturation = contrastSaturation;
        this.outputDepth = outputDepth;
        this.keepIntermediates = keepIntermediates;
    }

    /**
     * @return 1-based index of the corrected channel
     */
    public int getTargetChannel() {
        return targetChannel;
    }

    public double getBlurSigma() {
        return blurSigma;
    }

    public double getContrastSaturation() {
        return contrastSaturation;
    }

    public PixelDepth getOutputDepth() {
        return outputDepth;
    }

    public int getOutputBitDepth() {
        return outputDepth.getBits();
    }

    public boolean isKeepIntermediates() {
        return keepIntermediates;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("targetChannel", targetChannel)
                .append("blurSigma", blurSigma)
                .append("contrastSaturation", contrastSaturation)
                .append("outputDepth", outputDepth)
                .append("keepIntermediates", keepIntermediates)
                .toString();
    }
}
