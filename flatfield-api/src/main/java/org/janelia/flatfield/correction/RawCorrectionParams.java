package org.janelia.flatfield.correction;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Correction options as supplied by the user, before they are checked and clamped.
 */
public class RawCorrectionParams {

    public static final double DEFAULT_CHANNEL = 1;
    public static final double DEFAULT_BLUR_SIGMA = 50;
    public static final double DEFAULT_CONTRAST_SATURATION = 0.35;
    public static final int DEFAULT_OUTPUT_BIT_DEPTH = 16;

    private double channel = DEFAULT_CHANNEL;
    private double blurSigma = DEFAULT_BLUR_SIGMA;
    private double contrastSaturation = DEFAULT_CONTRAST_SATURATION;
    private int outputBitDepth = DEFAULT_OUTPUT_BIT_DEPTH;
    private boolean keepIntermediates = false;

    public double getChannel() {
        return channel;
    }

    public RawCorrectionParams setChannel(double channel) {
        this.channel = channel;
        return this;
    }

    public double getBlurSigma() {
        return blurSigma;
    }

    public RawCorrectionParams setBlurSigma(double blurSigma) {
        this.blurSigma = blurSigma;
        return this;
    }

    public double getContrastSaturation() {
        return contrastSaturation;
    }

    public RawCorrectionParams setContrastSaturation(double contrastSaturation) {
        this.contrastSaturation = contrastSaturation;
        return this;
    }

    public int getOutputBitDepth() {
        return outputBitDepth;
    }

    public RawCorrectionParams setOutputBitDepth(int outputBitDepth) {
        this.outputBitDepth = outputBitDepth;
        return this;
    }

    public boolean isKeepIntermediates() {
        return keepIntermediates;
    }

    public RawCorrectionParams setKeepIntermediates(boolean keepIntermediates) {
        this.keepIntermediates = keepIntermediates;
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("channel", channel)
                .append("blurSigma", blurSigma)
                .append("contrastSaturation", contrastSaturation)
                .append("outputBitDepth", outputBitDepth)
                .append("keepIntermediates", keepIntermediates)
                .toString();
    }
}
