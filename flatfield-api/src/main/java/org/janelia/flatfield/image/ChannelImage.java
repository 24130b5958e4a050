package org.janelia.flatfield.image;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * The full Z x T stack of a single channel, stored as an X, Y, Z, T image.
 *
 * Besides the pixels a channel image carries its working value range, which is the
 * range mapped onto the integer range when the channel gets quantized. 8- and 16-bit
 * channels use the nominal range of their pixel type, the other depths use the range
 * of their data unless one is given explicitly.
 *
 * @param <T> pixel type
 */
public class ChannelImage<T extends RealType<T> & NativeType<T>> implements Releasable {

    private final String name;
    private final int channel;
    private final PixelDepth pixelDepth;
    private final double minValue;
    private final double maxValue;
    private final long[] shape;
    private Img<T> pixels;

    public ChannelImage(String name, int channel, Img<T> pixels) {
        this(name, channel, pixels, defaultRange(pixels));
    }

    public ChannelImage(String name, int channel, Img<T> pixels, double minValue, double maxValue) {
        this(name, channel, pixels, new ImageAccessUtils.ValueRange(minValue, maxValue));
    }

    private ChannelImage(String name, int channel, Img<T> pixels, ImageAccessUtils.ValueRange workingRange) {
        if (pixels.numDimensions() != 4) {
            throw new IllegalArgumentException("A channel image must be an X, Y, Z, T stack - "
                    + name + " has " + pixels.numDimensions() + " dimensions");
        }
        this.name = name;
        this.channel = channel;
        this.pixels = pixels;
        this.pixelDepth = PixelDepth.fromPixelType(pixels.firstElement());
        this.shape = pixels.dimensionsAsLongArray();
        this.minValue = workingRange.isEmpty() ? 0 : workingRange.min;
        this.maxValue = workingRange.isEmpty() ? 0 : workingRange.max;
    }

    private static <T extends RealType<T> & NativeType<T>> ImageAccessUtils.ValueRange defaultRange(Img<T> pixels) {
        PixelDepth depth = PixelDepth.fromPixelType(pixels.firstElement());
        if (depth.hasNominalRange()) {
            return new ImageAccessUtils.ValueRange(0, depth.getMaxIntValue());
        } else {
            return ImageAccessUtils.valueRange(pixels);
        }
    }

    public String getName() {
        return name;
    }

    /**
     * @return the 1-based index of the source channel this image was derived from.
     */
    public int getChannel() {
        return channel;
    }

    public PixelDepth getPixelDepth() {
        return pixelDepth;
    }

    public double getMinValue() {
        return minValue;
    }

    public double getMaxValue() {
        return maxValue;
    }

    public long getWidth() {
        return shape[0];
    }

    public long getHeight() {
        return shape[1];
    }

    public long getSlices() {
        return shape[2];
    }

    public long getFrames() {
        return shape[3];
    }

    public long[] getShape() {
        return shape.clone();
    }

    public Img<T> getPixels() {
        if (pixels == null) {
            throw new IllegalStateException("Channel image " + name + " has already been released");
        }
        return pixels;
    }

    public RandomAccessibleInterval<T> getPlane(long slice, long frame) {
        return ImageAccessUtils.getPlane(getPixels(), slice, frame);
    }

    public boolean hasSameShape(ChannelImage<?> other) {
        long[] otherShape = other.shape;
        if (shape.length != otherShape.length)
            return false;
        for (int d = 0; d < shape.length; d++) {
            if (shape[d] != otherShape[d])
                return false;
        }
        return true;
    }

    @Override
    public void release() {
        if (pixels == null) {
            throw new IllegalStateException("Channel image " + name + " has already been released");
        }
        pixels = null;
    }

    @Override
    public boolean isReleased() {
        return pixels == null;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("name", name)
                .append("channel", channel)
                .append("pixelDepth", pixelDepth)
                .append("shape", shape)
                .append("minValue", minValue)
                .append("maxValue", maxValue)
                .append("released", isReleased())
                .toString();
    }
}
