package org.janelia.flatfield.correction;

import java.util.ArrayList;
import java.util.List;

import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.ImageAccessUtils;
import org.janelia.flatfield.image.MultichannelImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a multichannel image into independent channel stacks.
 */
public class ChannelSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelSplitter.class);

    /**
     * Copy every channel of the image into its own {@link ChannelImage} and register it.
     *
     * @return the handles of the channel images in channel order, so channel c has index c - 1
     * @throws SplitIntegrityException if the number of channel images does not match the channel count.
     *                                 The channel images created so far are released before it is thrown.
     */
    public <T extends RealType<T> & NativeType<T>> List<ArtifactId<ChannelImage<T>>> split(MultichannelImage<T> image,
                                                                                            ArtifactRegistry registry) {
        List<ArtifactId<ChannelImage<T>>> channelIds = new ArrayList<>();
        for (ChannelImage<T> channelImage : extractChannels(image)) {
            channelIds.add(registry.register(channelImage.getName(), channelImage));
        }
        if (channelIds.size() != image.getChannels()) {
            SplitIntegrityException splitException = new SplitIntegrityException(
                    "Splitting " + image.getTitle() + " produced " + channelIds.size()
                            + " channels instead of " + image.getChannels());
            for (ArtifactId<ChannelImage<T>> channelId : channelIds) {
                try {
                    registry.release(channelId);
                } catch (RuntimeException e) {
                    LOG.warn("Failed to release {} after an incomplete split", channelId, e);
                    splitException.addSuppressed(e);
                }
            }
            throw splitException;
        }
        LOG.debug("Split {} into {} channels", image.getTitle(), channelIds.size());
        return channelIds;
    }

    protected <T extends RealType<T> & NativeType<T>> List<ChannelImage<T>> extractChannels(MultichannelImage<T> image) {
        T pxType = image.getPixels().firstElement().createVariable();
        List<ChannelImage<T>> channels = new ArrayList<>();
        for (int c = 1; c <= image.getChannels(); c++) {
            Img<T> channelPixels = ImageAccessUtils.materializeAsNativeImg(image.getChannel(c), null, pxType);
            channels.add(new ChannelImage<>("C" + c + "-" + image.getTitle(), c, channelPixels));
        }
        return channels;
    }
}
