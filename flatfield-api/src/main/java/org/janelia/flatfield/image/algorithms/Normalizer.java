package org.janelia.flatfield.image.algorithms;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.ImageAccessUtils;
import org.janelia.flatfield.image.ImageTransforms;

/**
 * Divides a channel by its background estimate.
 */
public class Normalizer {

    /**
     * Compute source / background for every pixel. Pixels with a zero background are set to 0.
     * The ratio is neither clipped nor rescaled.
     */
    public static <T extends RealType<T> & NativeType<T>, B extends RealType<B> & NativeType<B>>
    ChannelImage<FloatType> divideByBackground(ChannelImage<T> source, ChannelImage<B> background) {
        if (!source.hasSameShape(background)) {
            throw new IllegalArgumentException("Background " + background.getName()
                    + " does not have the same shape as " + source.getName());
        }
        RandomAccessibleInterval<FloatType> ratioView = ImageTransforms.createBinaryPixelOperation(
                source.getPixels(),
                background.getPixels(),
                (s, b, r) -> r.setReal(divide(s.getRealDouble(), b.getRealDouble())),
                FloatType::new
        );
        Img<FloatType> ratio = ImageAccessUtils.materializeAsNativeImg(ratioView, null, new FloatType());
        return new ChannelImage<>(source.getName() + "-ratio", source.getChannel(), ratio);
    }

    static double divide(double value, double background) {
        return background == 0 ? 0 : value / background;
    }
}
