package org.janelia.flatfield.correction;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.flatfield.image.BorderMode;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.MultichannelImage;
import org.janelia.flatfield.image.PixelDepth;
import org.janelia.flatfield.image.algorithms.BackgroundEstimator;
import org.janelia.flatfield.image.algorithms.BitDepthConverter;
import org.janelia.flatfield.image.algorithms.ContrastEnhancer;
import org.janelia.flatfield.image.algorithms.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Corrects the uneven illumination of one channel of a multichannel image.
 *
 * The run goes through validate, split, estimate background, normalize, enhance contrast,
 * quantize all channels, recombine and cleanup, in this order. The source image is never modified.
 * If any stage fails the run stops and every artifact created so far is released before
 * the failure propagates.
 */
public class FlatFieldCorrection {

    private static final Logger LOG = LoggerFactory.getLogger(FlatFieldCorrection.class);

    private final ParameterResolver parameterResolver;
    private final ChannelSplitter channelSplitter;
    private final Recombiner recombiner;
    private final ResourceCleaner resourceCleaner;
    private final BorderMode borderMode;

    public FlatFieldCorrection() {
        this(ParameterResolver.DEFAULT_MAX_CHANNELS, BorderMode.EDGE_REPLICATE);
    }

    public FlatFieldCorrection(int maxChannels, BorderMode borderMode) {
        this(new ParameterResolver(maxChannels),
                new ChannelSplitter(),
                new Recombiner(maxChannels),
                new ResourceCleaner(),
                borderMode);
    }

    public FlatFieldCorrection(ParameterResolver parameterResolver,
                               ChannelSplitter channelSplitter,
                               Recombiner recombiner,
                               ResourceCleaner resourceCleaner,
                               BorderMode borderMode) {
        this.parameterResolver = parameterResolver;
        this.channelSplitter = channelSplitter;
        this.recombiner = recombiner;
        this.resourceCleaner = resourceCleaner;
        this.borderMode = borderMode;
    }

    /**
     * @param image        image to correct; it is left unchanged
     * @param rawParams    user options
     * @param outputPxType pixel type of the corrected composite; it must have the requested output bit depth
     * @param <T>          source pixel type
     * @param <S>          output pixel type
     * @throws ValidationException      if the image, the options or the output pixel type cannot be used; nothing has been created yet
     * @throws SplitIntegrityException  if the image could not be split into its channels
     * @throws RecombineException       if the quantized channels could not be merged
     */
    public <T extends RealType<T> & NativeType<T>, S extends RealType<S> & NativeType<S>>
    CorrectionResult<T, S> correct(MultichannelImage<T> image, RawCorrectionParams rawParams, S outputPxType) {
        CorrectionParams params = parameterResolver.resolve(image.getChannels(), rawParams);
        PixelDepth outputPxDepth;
        try {
            outputPxDepth = PixelDepth.fromPixelType(outputPxType);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        if (outputPxDepth != params.getOutputDepth()) {
            throw new ValidationException("Output pixel type " + outputPxType.getClass().getSimpleName()
                    + " does not match the requested " + params.getOutputBitDepth() + "-bit output");
        }
        LOG.info("Correct channel {} of {} ({}) with {}", params.getTargetChannel(), image.getTitle(), image, params);
        long startTime = System.currentTimeMillis();
        try (ArtifactRegistry registry = new ArtifactRegistry(resourceCleaner)) {
            List<ArtifactId<ChannelImage<T>>> channelIds = channelSplitter.split(image, registry);
            ChannelImage<T> targetChannel = registry.get(channelIds.get(params.getTargetChannel() - 1));

            ArtifactId<ChannelImage<FloatType>> backgroundId = registry.register(
                    "background",
                    BackgroundEstimator.estimateBackground(targetChannel, params.getBlurSigma(), borderMode));
            ArtifactId<ChannelImage<FloatType>> ratioId = registry.register(
                    "ratio",
                    Normalizer.divideByBackground(targetChannel, registry.get(backgroundId)));

            ContrastEnhancer.PercentileBounds contrastBounds = ContrastEnhancer.computePercentileBounds(
                    registry.get(ratioId).getPixels(), params.getContrastSaturation());
            LOG.info("Contrast bounds for {}% saturation: {}", params.getContrastSaturation(), contrastBounds);
            ArtifactId<ChannelImage<FloatType>> enhancedId = registry.register(
                    "enhanced",
                    ContrastEnhancer.stretchHistogram(registry.get(ratioId), contrastBounds));

            List<ArtifactId<ChannelImage<S>>> quantizedChannelIds = new ArrayList<>();
            for (int c = 1; c <= image.getChannels(); c++) {
                ChannelImage<S> quantizedChannel;
                if (c == params.getTargetChannel()) {
                    quantizedChannel = BitDepthConverter.convert(registry.get(enhancedId), outputPxType);
                } else {
                    quantizedChannel = BitDepthConverter.convert(registry.get(channelIds.get(c - 1)), outputPxType);
                }
                quantizedChannelIds.add(registry.register("quantized-C" + c, quantizedChannel));
            }

            List<ChannelImage<S>> quantizedChannels = quantizedChannelIds.stream()
                    .map(registry::get)
                    .collect(Collectors.toList());
            MultichannelImage<S> composite = recombiner.recombine(image.getTitle() + "-corrected", quantizedChannels);

            CorrectionIntermediates<T, S> intermediates;
            if (params.isKeepIntermediates()) {
                registry.retainOnClose();
                intermediates = new CorrectionIntermediates<>(
                        registry,
                        params.getTargetChannel(),
                        channelIds,
                        backgroundId,
                        ratioId,
                        enhancedId,
                        quantizedChannelIds);
            } else {
                intermediates = null;
            }
            LOG.info("Finished correcting {} in {}s", image.getTitle(), (System.currentTimeMillis() - startTime) / 1000.);
            return new CorrectionResult<>(composite, params, contrastBounds, intermediates);
        }
    }
}
