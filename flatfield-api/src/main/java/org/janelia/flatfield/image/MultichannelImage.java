package org.janelia.flatfield.image;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * A composite image stored as an X, Y, C, Z, T image, the hyperstack order used by ImageJ.
 * Channels are 1-based.
 *
 * @param <T> pixel type, shared by all channels
 */
public class MultichannelImage<T extends RealType<T> & NativeType<T>> {

    public static final int CHANNEL_AXIS = 2;
    public static final int SLICE_AXIS = 3;
    public static final int FRAME_AXIS = 4;

    private final String title;
    private final Img<T> pixels;
    private final PixelDepth pixelDepth;

    public static <T extends RealType<T> & NativeType<T>> MultichannelImage<T> create(String title,
                                                                                       T pxType,
                                                                                       long width, long height,
                                                                                       int channels, int slices, int frames) {
        Img<T> pixels = new ArrayImgFactory<>(pxType).create(width, height, channels, slices, frames);
        return new MultichannelImage<>(title, pixels);
    }

    public MultichannelImage(String title, Img<T> pixels) {
        if (pixels.numDimensions() != 5) {
            throw new IllegalArgumentException("A multichannel image must be an X, Y, C, Z, T image - "
                    + title + " has " + pixels.numDimensions() + " dimensions");
        }
        this.title = title;
        this.pixels = pixels;
        this.pixelDepth = PixelDepth.fromPixelType(pixels.firstElement());
    }

    public String getTitle() {
        return title;
    }

    public Img<T> getPixels() {
        return pixels;
    }

    public PixelDepth getPixelDepth() {
        return pixelDepth;
    }

    public long getWidth() {
        return pixels.dimension(0);
    }

    public long getHeight() {
        return pixels.dimension(1);
    }

    public int getChannels() {
        return (int) pixels.dimension(CHANNEL_AXIS);
    }

    public int getSlices() {
        return (int) pixels.dimension(SLICE_AXIS);
    }

    public int getFrames() {
        return (int) pixels.dimension(FRAME_AXIS);
    }

    /**
     * @param channel 1-based channel index
     * @return an X, Y, Z, T view of the channel backed by this image's pixels
     */
    public RandomAccessibleInterval<T> getChannel(int channel) {
        if (channel < 1 || channel > getChannels()) {
            throw new IllegalArgumentException("Channel " + channel + " is outside [1, " + getChannels() + "]");
        }
        return Views.hyperSlice(pixels, CHANNEL_AXIS, channel - 1);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("title", title)
                .append("pixelDepth", pixelDepth)
                .append("shape", pixels.dimensionsAsLongArray())
                .toString();
    }
}
