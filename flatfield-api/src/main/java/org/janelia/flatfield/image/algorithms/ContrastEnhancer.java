package org.janelia.flatfield.image.algorithms;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.ImageAccessUtils;
import org.janelia.flatfield.image.ImageTransforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linear contrast stretch between two percentiles of the pixel distribution.
 */
public class ContrastEnhancer {

    private static final Logger LOG = LoggerFactory.getLogger(ContrastEnhancer.class);

    /**
     * Full range of a stretched float image.
     */
    public static final double FLOAT_FULL_RANGE = 1.0;

    public static class PercentileBounds {
        public final double lo;
        public final double hi;

        PercentileBounds(double lo, double hi) {
            this.lo = lo;
            this.hi = hi;
        }

        public boolean isFlat() {
            return !(hi > lo);
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this)
                    .append("lo", lo)
                    .append("hi", hi)
                    .toString();
        }
    }

    /**
     * Find the saturation/2 and 100 - saturation/2 percentiles of the finite pixel values,
     * pooled over all planes. Percentiles use the nearest rank of the sorted values.
     *
     * @param image      image to inspect
     * @param saturation total percentage of pixels, split over both tails, that fall outside the bounds
     */
    public static <T extends RealType<T>> PercentileBounds computePercentileBounds(RandomAccessibleInterval<T> image,
                                                                                   double saturation) {
        if (!(saturation >= 0 && saturation < 100)) {
            throw new IllegalArgumentException("Saturation must be in [0, 100): " + saturation);
        }
        float[] values = sortedFiniteValues(image);
        if (values.length == 0) {
            return new PercentileBounds(0, 0);
        }
        double tailFraction = saturation / 200.;
        double lo = values[percentileRank(tailFraction, values.length)];
        double hi = values[percentileRank(1. - tailFraction, values.length)];
        return new PercentileBounds(lo, hi);
    }

    /**
     * Rescale the image so that lo maps to 0 and hi maps to the full range, clipping everything outside.
     * A flat distribution maps every pixel to 0.
     *
     * @return the stretched image, whose working range is [0, FLOAT_FULL_RANGE]
     */
    public static ChannelImage<FloatType> stretchHistogram(ChannelImage<FloatType> image, PercentileBounds bounds) {
        RandomAccessibleInterval<FloatType> stretchedView = ImageTransforms.createPixelTransformation(
                image.getPixels(),
                (s, t) -> t.setReal(stretch(s.getRealDouble(), bounds.lo, bounds.hi) * FLOAT_FULL_RANGE),
                FloatType::new
        );
        Img<FloatType> stretched = ImageAccessUtils.materializeAsNativeImg(stretchedView, null, new FloatType());
        LOG.debug("Stretched {} between {} and {}", image.getName(), bounds.lo, bounds.hi);
        return new ChannelImage<>(image.getName() + "-enhanced", image.getChannel(), stretched, 0, FLOAT_FULL_RANGE);
    }

    static double stretch(double value, double lo, double hi) {
        if (!(hi > lo) || Double.isNaN(value)) {
            return 0;
        }
        double scaled = (value - lo) / (hi - lo);
        if (scaled < 0) {
            return 0;
        } else if (scaled > 1) {
            return 1;
        } else {
            return scaled;
        }
    }

    static int percentileRank(double fraction, int n) {
        long rank = Math.round(fraction * (n - 1));
        return (int) Math.max(0, Math.min(n - 1, rank));
    }

    private static <T extends RealType<T>> float[] sortedFiniteValues(RandomAccessibleInterval<T> image) {
        long size = ImageAccessUtils.countPixels(image.dimensionsAsLongArray());
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Image is too large for a percentile computation: " + size + " pixels");
        }
        float[] values = new float[(int) size];
        int n = 0;
        Cursor<T> cursor = Views.flatIterable(image).cursor();
        while (cursor.hasNext()) {
            float v = cursor.next().getRealFloat();
            if (Float.isFinite(v)) {
                values[n++] = v;
            }
        }
        float[] finiteValues = n == values.length ? values : Arrays.copyOf(values, n);
        Arrays.sort(finiteValues);
        return finiteValues;
    }
}
