package org.janelia.flatfield.correction;

import java.util.List;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.ImageAccessUtils;
import org.janelia.flatfield.image.MultichannelImage;

/**
 * Merges channel stacks back into a composite image.
 */
public class Recombiner {

    private final int maxChannels;

    public Recombiner() {
        this(ParameterResolver.DEFAULT_MAX_CHANNELS);
    }

    public Recombiner(int maxChannels) {
        this.maxChannels = maxChannels;
    }

    /**
     * @param title    title of the composite
     * @param channels channel images in channel order; all must have the same depth and shape
     * @throws RecombineException if a channel is missing, or the channels differ in depth or shape
     */
    public <T extends RealType<T> & NativeType<T>> MultichannelImage<T> recombine(String title, List<ChannelImage<T>> channels) {
        if (channels == null || channels.isEmpty()) {
            throw new RecombineException("No channels to recombine into " + title);
        }
        if (channels.size() > maxChannels) {
            throw new RecombineException("Cannot recombine " + channels.size() + " channels - at most "
                    + maxChannels + " channels are supported");
        }
        ChannelImage<T> refChannel = channels.get(0);
        for (int ci = 0; ci < channels.size(); ci++) {
            ChannelImage<T> channel = channels.get(ci);
            if (channel == null || channel.isReleased()) {
                throw new RecombineException("Channel " + (ci + 1) + " of " + title + " is missing");
            }
            if (channel.getPixelDepth() != refChannel.getPixelDepth()) {
                throw new RecombineException("Channel " + (ci + 1) + " is " + channel.getPixelDepth()
                        + " but channel 1 is " + refChannel.getPixelDepth());
            }
            if (!channel.hasSameShape(refChannel)) {
                throw new RecombineException("Channel " + (ci + 1) + " does not have the same dimensions as channel 1");
            }
        }
        T pxType = refChannel.getPixels().firstElement().createVariable();
        Img<T> compositePixels = new ArrayImgFactory<>(pxType).create(
                refChannel.getWidth(),
                refChannel.getHeight(),
                channels.size(),
                refChannel.getSlices(),
                refChannel.getFrames());
        MultichannelImage<T> composite = new MultichannelImage<>(title, compositePixels);
        for (int c = 1; c <= channels.size(); c++) {
            ImageAccessUtils.copyPixels(channels.get(c - 1).getPixels(), composite.getChannel(c));
        }
        return composite;
    }
}
