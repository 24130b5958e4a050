package org.janelia.flatfield.correction;

import java.util.ArrayList;
import java.util.List;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.flatfield.image.ChannelImage;

/**
 * Artifacts retained from a run that was asked to keep its intermediates.
 *
 * @param <T> pixel type of the source channels
 * @param <S> pixel type of the quantized channels
 */
public class CorrectionIntermediates<T extends RealType<T> & NativeType<T>, S extends RealType<S> & NativeType<S>> {

    private final ArtifactRegistry registry;
    private final int targetChannel;
    private final List<ArtifactId<ChannelImage<T>>> splitChannelIds;
    private final ArtifactId<ChannelImage<FloatType>> backgroundId;
    private final ArtifactId<ChannelImage<FloatType>> ratioId;
    private final ArtifactId<ChannelImage<FloatType>> enhancedId;
    private final List<ArtifactId<ChannelImage<S>>> quantizedChannelIds;

    CorrectionIntermediates(ArtifactRegistry registry,
                            int targetChannel,
                            List<ArtifactId<ChannelImage<T>>> splitChannelIds,
                            ArtifactId<ChannelImage<FloatType>> backgroundId,
                            ArtifactId<ChannelImage<FloatType>> ratioId,
                            ArtifactId<ChannelImage<FloatType>> enhancedId,
                            List<ArtifactId<ChannelImage<S>>> quantizedChannelIds) {
        this.registry = registry;
        this.targetChannel = targetChannel;
        this.splitChannelIds = new ArrayList<>(splitChannelIds);
        this.backgroundId = backgroundId;
        this.ratioId = ratioId;
        this.enhancedId = enhancedId;
        this.quantizedChannelIds = new ArrayList<>(quantizedChannelIds);
    }

    public ArtifactRegistry getRegistry() {
        return registry;
    }

    public List<ArtifactId<ChannelImage<T>>> getSplitChannelIds() {
        return new ArrayList<>(splitChannelIds);
    }

    /**
     * @param channel 1-based channel index
     */
    public ChannelImage<T> getSplitChannel(int channel) {
        return registry.get(splitChannelIds.get(channel - 1));
    }

    public ArtifactId<ChannelImage<FloatType>> getBackgroundId() {
        return backgroundId;
    }

    public ChannelImage<FloatType> getBackground() {
        return registry.get(backgroundId);
    }

    public ArtifactId<ChannelImage<FloatType>> getRatioId() {
        return ratioId;
    }

    public ChannelImage<FloatType> getRatio() {
        return registry.get(ratioId);
    }

    public ArtifactId<ChannelImage<FloatType>> getEnhancedId() {
        return enhancedId;
    }

    public ChannelImage<FloatType> getEnhanced() {
        return registry.get(enhancedId);
    }

    public List<ArtifactId<ChannelImage<S>>> getQuantizedChannelIds() {
        return new ArrayList<>(quantizedChannelIds);
    }

    /**
     * @param channel 1-based channel index
     */
    public ChannelImage<S> getQuantizedChannel(int channel) {
        return registry.get(quantizedChannelIds.get(channel - 1));
    }

    /**
     * @return the corrected channel as it was just before recombination
     */
    public ChannelImage<S> getCorrectedChannel() {
        return getQuantizedChannel(targetChannel);
    }

    /**
     * Release all retained artifacts. Calling it again releases nothing.
     *
     * @return the number of artifacts released by this call
     */
    public int release() {
        return registry.getResourceCleaner().releaseAll(registry);
    }
}
