package org.janelia.flatfield.ij;

import ij.CompositeImage;
import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.ImageAccessUtils;
import org.janelia.flatfield.image.MultichannelImage;
import org.janelia.flatfield.image.PixelDepth;

/**
 * Copies pixel data between ImageJ hyperstacks and the correction image model.
 * ImageJ orders the planes of a hyperstack channel first, then slice, then frame,
 * and all indexes are 1-based.
 */
public class ImagePlusAdapter {

    /**
     * @return a copy of the hyperstack; the pixel type follows the bit depth of the ImageJ image
     * @throws IllegalArgumentException for RGB images
     */
    public static MultichannelImage<?> fromImagePlus(ImagePlus imp) {
        switch (imp.getBitDepth()) {
            case 8:
                return fromImagePlus(imp, new UnsignedByteType());
            case 16:
                return fromImagePlus(imp, new UnsignedShortType());
            case 32:
                return fromImagePlus(imp, new FloatType());
            default:
                throw new IllegalArgumentException("Cannot correct " + imp.getTitle() + " - "
                        + imp.getBitDepth() + "-bit (RGB) images are not supported; split the color channels first");
        }
    }

    public static <T extends RealType<T> & NativeType<T>> MultichannelImage<T> fromImagePlus(ImagePlus imp, T pxType) {
        int channels = imp.getNChannels();
        int slices = imp.getNSlices();
        int frames = imp.getNFrames();
        MultichannelImage<T> image = MultichannelImage.create(
                imp.getShortTitle(), pxType,
                imp.getWidth(), imp.getHeight(),
                channels, slices, frames);
        ImageStack stack = imp.getStack();
        for (int t = 0; t < frames; t++) {
            for (int z = 0; z < slices; z++) {
                for (int c = 0; c < channels; c++) {
                    ImageProcessor ip = stack.getProcessor(imp.getStackIndex(c + 1, z + 1, t + 1));
                    int i = 0;
                    for (T px : Views.flatIterable(getPlane(image, c, z, t))) {
                        px.setReal(ip.getf(i++));
                    }
                }
            }
        }
        return image;
    }

    public static <T extends RealType<T> & NativeType<T>> ImagePlus toImagePlus(MultichannelImage<T> image) {
        int width = (int) image.getWidth();
        int height = (int) image.getHeight();
        ImageStack stack = new ImageStack(width, height);
        for (int t = 0; t < image.getFrames(); t++) {
            for (int z = 0; z < image.getSlices(); z++) {
                for (int c = 0; c < image.getChannels(); c++) {
                    stack.addSlice(
                            "c:" + (c + 1) + " z:" + (z + 1) + " t:" + (t + 1),
                            toImageProcessor(getPlane(image, c, z, t), image.getPixelDepth(), width, height));
                }
            }
        }
        ImagePlus imp = new ImagePlus(image.getTitle(), stack);
        imp.setDimensions(image.getChannels(), image.getSlices(), image.getFrames());
        imp.setOpenAsHyperStack(true);
        if (image.getChannels() > 1) {
            return new CompositeImage(imp, CompositeImage.COLOR);
        } else {
            return imp;
        }
    }

    public static <T extends RealType<T> & NativeType<T>> ImagePlus toImagePlus(ChannelImage<T> channel, String title) {
        int width = (int) channel.getWidth();
        int height = (int) channel.getHeight();
        ImageStack stack = new ImageStack(width, height);
        for (long t = 0; t < channel.getFrames(); t++) {
            for (long z = 0; z < channel.getSlices(); z++) {
                stack.addSlice(
                        "z:" + (z + 1) + " t:" + (t + 1),
                        toImageProcessor(channel.getPlane(z, t), channel.getPixelDepth(), width, height));
            }
        }
        ImagePlus imp = new ImagePlus(title, stack);
        imp.setDimensions(1, (int) channel.getSlices(), (int) channel.getFrames());
        imp.setOpenAsHyperStack(true);
        if (!channel.getPixelDepth().hasNominalRange()) {
            imp.setDisplayRange(channel.getMinValue(), channel.getMaxValue());
        }
        return imp;
    }

    private static <T extends RealType<T> & NativeType<T>> RandomAccessibleInterval<T> getPlane(MultichannelImage<T> image,
                                                                                              int c, int z, int t) {
        return ImageAccessUtils.getPlane(image.getChannel(c + 1), z, t);
    }

    private static <T extends RealType<T>> ImageProcessor toImageProcessor(RandomAccessibleInterval<T> plane,
                                                                          PixelDepth pixelDepth,
                                                                          int width, int height) {
        ImageProcessor ip;
        switch (pixelDepth) {
            case GRAY8:
                ip = new ByteProcessor(width, height);
                break;
            case GRAY16:
                ip = new ShortProcessor(width, height);
                break;
            default:
                // ImageJ has no unsigned 32-bit type
                ip = new FloatProcessor(width, height);
                break;
        }
        int i = 0;
        for (T px : Views.flatIterable(plane)) {
            ip.setf(i++, px.getRealFloat());
        }
        return ip;
    }
}
