package org.janelia.flatfield.cmd;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ij.IJ;
import ij.ImagePlus;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import org.apache.commons.lang3.StringUtils;
import org.janelia.flatfield.config.Config;
import org.janelia.flatfield.correction.CorrectionIntermediates;
import org.janelia.flatfield.correction.CorrectionResult;
import org.janelia.flatfield.correction.FlatFieldCorrection;
import org.janelia.flatfield.correction.ParameterResolver;
import org.janelia.flatfield.correction.RawCorrectionParams;
import org.janelia.flatfield.ij.ImagePlusAdapter;
import org.janelia.flatfield.image.BorderMode;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.MultichannelImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to correct the uneven illumination of one channel of an image file.
 */
class CorrectFlatFieldCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(CorrectFlatFieldCmd.class);

    @Parameters(commandDescription = "Flat-field correct one channel of a multichannel image")
    static class CorrectFlatFieldArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, description = "Image file to correct", required = true)
        String input;

        @Parameter(names = {"--output", "-o"}, description = "TIFF file for the corrected composite", required = true)
        String output;

        @Parameter(names = {"--channel", "-c"}, description = "1-based channel to correct; out of range values are clamped")
        Double channel;

        @Parameter(names = {"--sigma"}, description = "Standard deviation in pixels of the background blur")
        Double sigma;

        @Parameter(names = {"--saturation"}, description = "Percentage of pixels saturated by the contrast stretch")
        Double saturation;

        @Parameter(names = {"--bit-depth"}, description = "Output bit depth: 8 or 16")
        Integer bitDepth;

        @Parameter(names = {"--border-mode"}, description = "How the background blur extends the image borders")
        BorderMode borderMode;

        @Parameter(names = {"--keep-intermediates"}, description = "Keep the intermediate images of the run", arity = 0)
        boolean keepIntermediates = false;

        @Parameter(names = {"--intermediates-dir"}, description = "Directory where the kept intermediate images are written")
        String intermediatesDir;

        @Parameter(names = {"--summary"}, description = "JSON file for the run summary")
        String summary;

        CorrectFlatFieldArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (StringUtils.isNotBlank(input) && !Files.isRegularFile(Paths.get(input))) {
                errors.add("Input file " + input + " not found");
            }
            if (StringUtils.isNotBlank(intermediatesDir) && !keepIntermediates) {
                errors.add("--intermediates-dir requires --keep-intermediates");
            }
            return errors;
        }

        Path getIntermediatesDir() {
            if (StringUtils.isNotBlank(intermediatesDir)) {
                return Paths.get(intermediatesDir);
            }
            Path outputParent = Paths.get(output).toAbsolutePath().getParent();
            return outputParent != null ? outputParent : Paths.get(".");
        }
    }

    private final CorrectFlatFieldArgs args;
    private final ObjectMapper mapper;

    CorrectFlatFieldCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new CorrectFlatFieldArgs(commonArgs);
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    @Override
    CorrectFlatFieldArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        long startTime = System.currentTimeMillis();
        Config config = getConfig();
        RawCorrectionParams rawParams = getRawParams(config);
        BorderMode borderMode = args.borderMode != null
                ? args.borderMode
                : config.getEnumPropertyValue("Correction.BorderMode", BorderMode.class, BorderMode.EDGE_REPLICATE);
        FlatFieldCorrection correction = new FlatFieldCorrection(
                config.getIntegerPropertyValue("Correction.MaxChannels", ParameterResolver.DEFAULT_MAX_CHANNELS),
                borderMode);

        ImagePlus imp = IJ.openImage(args.input);
        if (imp == null) {
            throw new UncheckedIOException(new IOException("Could not read image from " + args.input));
        }
        MultichannelImage<?> image = ImagePlusAdapter.fromImagePlus(imp);
        LOG.info("Read {} from {}", image, args.input);
        RunSummary runSummary = correctImage(correction, image, rawParams)
                .setInput(args.input)
                .setOutput(args.output)
                .setBorderMode(borderMode.name())
                .setProcessingTimeMillis(System.currentTimeMillis() - startTime);
        if (StringUtils.isNotBlank(args.summary)) {
            writeSummary(runSummary, Paths.get(args.summary));
        }
        LOG.info("Finished correcting {} in {}s", args.input, (System.currentTimeMillis() - startTime) / 1000.);
    }

    private RawCorrectionParams getRawParams(Config config) {
        return new RawCorrectionParams()
                .setChannel(args.channel != null
                        ? args.channel
                        : config.getDoublePropertyValue("Correction.DefaultChannel", RawCorrectionParams.DEFAULT_CHANNEL))
                .setBlurSigma(args.sigma != null
                        ? args.sigma
                        : config.getDoublePropertyValue("Correction.DefaultSigma", RawCorrectionParams.DEFAULT_BLUR_SIGMA))
                .setContrastSaturation(args.saturation != null
                        ? args.saturation
                        : config.getDoublePropertyValue("Correction.DefaultSaturation", RawCorrectionParams.DEFAULT_CONTRAST_SATURATION))
                .setOutputBitDepth(args.bitDepth != null
                        ? args.bitDepth
                        : config.getIntegerPropertyValue("Correction.DefaultBitDepth", RawCorrectionParams.DEFAULT_OUTPUT_BIT_DEPTH))
                .setKeepIntermediates(args.keepIntermediates);
    }

    private <T extends RealType<T> & NativeType<T>> RunSummary correctImage(FlatFieldCorrection correction,
                                                                           MultichannelImage<T> image,
                                                                           RawCorrectionParams rawParams) {
        if (rawParams.getOutputBitDepth() == 8) {
            return saveResult(correction.correct(image, rawParams, new UnsignedByteType()));
        } else {
            // any other depth is either 16-bit or rejected by the correction
            return saveResult(correction.correct(image, rawParams, new UnsignedShortType()));
        }
    }

    private <T extends RealType<T> & NativeType<T>, S extends RealType<S> & NativeType<S>>
    RunSummary saveResult(CorrectionResult<T, S> result) {
        MultichannelImage<S> composite = result.getComposite();
        RunSummary runSummary = new RunSummary()
                .setTitle(composite.getTitle())
                .setChannels(composite.getChannels())
                .setSlices(composite.getSlices())
                .setFrames(composite.getFrames())
                .setTargetChannel(result.getParams().getTargetChannel())
                .setBlurSigma(result.getParams().getBlurSigma())
                .setContrastSaturation(result.getParams().getContrastSaturation())
                .setOutputBitDepth(result.getParams().getOutputBitDepth())
                .setContrastLowerBound(result.getContrastBounds().lo)
                .setContrastUpperBound(result.getContrastBounds().hi);
        saveTiff(ImagePlusAdapter.toImagePlus(composite), Paths.get(args.output));
        CorrectionIntermediates<T, S> intermediates = result.getIntermediates();
        if (intermediates != null) {
            try {
                Path intermediatesDir = args.getIntermediatesDir();
                String prefix = StringUtils.removeEndIgnoreCase(Paths.get(args.output).getFileName().toString(), ".tif");
                List<ChannelImage<?>> toSave = new ArrayList<>();
                for (int c = 1; c <= intermediates.getSplitChannelIds().size(); c++) {
                    toSave.add(intermediates.getSplitChannel(c));
                }
                toSave.add(intermediates.getBackground());
                toSave.add(intermediates.getRatio());
                toSave.add(intermediates.getEnhanced());
                toSave.add(intermediates.getCorrectedChannel());
                for (ChannelImage<?> intermediate : toSave) {
                    Path intermediateFile = intermediatesDir.resolve(prefix + "-" + intermediate.getName() + ".tif");
                    saveTiff(ImagePlusAdapter.toImagePlus(intermediate, intermediate.getName()), intermediateFile);
                    runSummary.addIntermediate(intermediateFile.toString());
                }
            } finally {
                intermediates.release();
            }
        }
        return runSummary;
    }

    private void saveTiff(ImagePlus imp, Path outputFile) {
        try {
            Path outputDir = outputFile.toAbsolutePath().getParent();
            if (outputDir != null) {
                Files.createDirectories(outputDir);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error creating the directory for " + outputFile, e);
        }
        if (!IJ.saveAsTiff(imp, outputFile.toString())) {
            throw new UncheckedIOException(new IOException("Error writing " + outputFile));
        }
        LOG.info("Saved {} to {}", imp.getTitle(), outputFile);
    }

    private void writeSummary(RunSummary runSummary, Path summaryFile) {
        try {
            Path summaryDir = summaryFile.toAbsolutePath().getParent();
            if (summaryDir != null) {
                Files.createDirectories(summaryDir);
            }
            if (args.commonArgs.noPrettyPrint) {
                mapper.writer().writeValue(summaryFile.toFile(), runSummary);
            } else {
                mapper.writerWithDefaultPrettyPrinter().writeValue(summaryFile.toFile(), runSummary);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing run summary to " + summaryFile, e);
        }
    }
}
