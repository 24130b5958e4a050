package org.janelia.flatfield.image.algorithms;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.ImageAccessUtils;
import org.janelia.flatfield.image.ImageTransforms;
import org.janelia.flatfield.image.PixelDepth;

/**
 * Quantizes a channel to an 8- or 16-bit integer precision.
 */
public class BitDepthConverter {

    /**
     * Map the channel's working range linearly onto [0, 2^depth - 1], rounding to the
     * nearest integer and clipping whatever falls outside.
     *
     * @param source       channel to convert; it is not modified
     * @param targetPxType integer pixel type of the result; its depth is the target depth
     * @param <S>          source pixel type
     * @param <T>          target pixel type
     */
    public static <S extends RealType<S> & NativeType<S>, T extends RealType<T> & NativeType<T>>
    ChannelImage<T> convert(ChannelImage<S> source, T targetPxType) {
        PixelDepth targetDepth = PixelDepth.fromPixelType(targetPxType);
        if (targetDepth.isFloatingPoint()) {
            throw new IllegalArgumentException("Cannot quantize to " + targetDepth);
        }
        double lo = source.getMinValue();
        double hi = source.getMaxValue();
        long maxValue = targetDepth.getMaxIntValue();
        RandomAccessibleInterval<T> convertedView = ImageTransforms.createPixelTransformation(
                source.getPixels(),
                (s, t) -> t.setReal(quantize(s.getRealDouble(), lo, hi, maxValue)),
                targetPxType::createVariable
        );
        Img<T> converted = ImageAccessUtils.materializeAsNativeImg(convertedView, null, targetPxType);
        return new ChannelImage<>(source.getName() + "-" + targetDepth.getBits() + "bit", source.getChannel(), converted);
    }

    public static long quantize(double value, double lo, double hi, long maxValue) {
        if (!(hi > lo) || Double.isNaN(value)) {
            return 0;
        }
        long q = Math.round((value - lo) / (hi - lo) * maxValue);
        return Math.max(0, Math.min(maxValue, q));
    }
}
