package org.janelia.flatfield.image.algorithms;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.gauss3.Gauss3;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.flatfield.image.BorderMode;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximates the slowly varying illumination of a channel with a strong Gaussian blur.
 */
public class BackgroundEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(BackgroundEstimator.class);

    /**
     * Blur a 32-bit float copy of the channel. Each (slice, frame) plane is smoothed
     * on its own, there is no blending across Z or T.
     *
     * @param channel    channel to estimate the background for; it is not modified
     * @param sigma      standard deviation of the isotropic Gaussian in pixels
     * @param borderMode how pixels outside the plane are extrapolated
     * @param <T>        channel pixel type
     * @return the background estimate
     */
    public static <T extends RealType<T> & NativeType<T>> ChannelImage<FloatType> estimateBackground(ChannelImage<T> channel,
                                                                                                     double sigma,
                                                                                                     BorderMode borderMode) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("Blur sigma must be a positive number: " + sigma);
        }
        long startTime = System.currentTimeMillis();
        Img<FloatType> background = ImageAccessUtils.copyAsFloat(channel.getPixels());
        for (long t = 0; t < channel.getFrames(); t++) {
            for (long z = 0; z < channel.getSlices(); z++) {
                gaussPlane(ImageAccessUtils.getPlane(background, z, t), sigma, borderMode);
            }
        }
        LOG.debug("Estimated background of {} with sigma {} ({} border) in {}ms",
                channel.getName(), sigma, borderMode, System.currentTimeMillis() - startTime);
        return new ChannelImage<>(channel.getName() + "-background", channel.getChannel(), background);
    }

    private static void gaussPlane(RandomAccessibleInterval<FloatType> plane, double sigma, BorderMode borderMode) {
        try {
            // the separable convolution goes through a temporary buffer so the plane can be both source and target
            Gauss3.gauss(sigma, borderMode.extend(plane), plane);
        } catch (Exception e) {
            throw new IllegalStateException("Gaussian smoothing with sigma " + sigma + " failed", e);
        }
    }
}
