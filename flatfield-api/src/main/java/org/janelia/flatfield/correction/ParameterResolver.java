package org.janelia.flatfield.correction;

import org.janelia.flatfield.image.PixelDepth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the channel count of the image and turns the raw options into {@link CorrectionParams}.
 */
public class ParameterResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterResolver.class);

    public static final int MIN_CHANNELS = 2;
    public static final int DEFAULT_MAX_CHANNELS = 7;

    private final int maxChannels;

    public ParameterResolver() {
        this(DEFAULT_MAX_CHANNELS);
    }

    public ParameterResolver(int maxChannels) {
        if (maxChannels < MIN_CHANNELS) {
            throw new IllegalArgumentException("The channel limit must be at least " + MIN_CHANNELS + ": " + maxChannels);
        }
        this.maxChannels = maxChannels;
    }

    public int getMaxChannels() {
        return maxChannels;
    }

    /**
     * @param channelCount number of channels of the image to be corrected
     * @param rawParams    user options
     * @throws ValidationException if the channel count is outside [2, maxChannels] or an option cannot be used
     */
    public CorrectionParams resolve(int channelCount, RawCorrectionParams rawParams) {
        if (channelCount < MIN_CHANNELS || channelCount > maxChannels) {
            throw new ValidationException("The image has " + channelCount + " channels but only images with "
                    + MIN_CHANNELS + " to " + maxChannels + " channels can be corrected");
        }
        int targetChannel = clampChannel(rawParams.getChannel(), channelCount);
        if (targetChannel != rawParams.getChannel()) {
            LOG.debug("Requested channel {} was clamped to {}", rawParams.getChannel(), targetChannel);
        }
        double blurSigma = rawParams.getBlurSigma();
        if (!(blurSigma > 0) || Double.isInfinite(blurSigma)) {
            throw new ValidationException("Blur sigma must be a positive number: " + blurSigma);
        }
        double saturation = rawParams.getContrastSaturation();
        if (Double.isNaN(saturation) || saturation >= 100) {
            throw new ValidationException("Contrast saturation must be less than 100%: " + saturation);
        }
        PixelDepth outputDepth;
        try {
            outputDepth = PixelDepth.forOutputBitDepth(rawParams.getOutputBitDepth());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        return new CorrectionParams(
                targetChannel,
                blurSigma,
                Math.max(0, saturation),
                outputDepth,
                rawParams.isKeepIntermediates());
    }

    /**
     * Truncate the requested channel toward zero and bound it to [1, channelCount].
     * NaN selects the first channel.
     */
    public static int clampChannel(double requestedChannel, int channelCount) {
        if (Double.isNaN(requestedChannel)) {
            return 1;
        }
        double truncated = requestedChannel < 0 ? Math.ceil(requestedChannel) : Math.floor(requestedChannel);
        if (truncated < 1) {
            return 1;
        } else if (truncated > channelCount) {
            return channelCount;
        } else {
            return (int) truncated;
        }
    }
}
