package org.janelia.flatfield.cmd;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What a correction run read, produced and which parameters it used.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunSummary {
    private String input;
    private String output;
    private String title;
    private int channels;
    private int slices;
    private int frames;
    private int targetChannel;
    private double blurSigma;
    private double contrastSaturation;
    private int outputBitDepth;
    private String borderMode;
    private double contrastLowerBound;
    private double contrastUpperBound;
    private long processingTimeMillis;
    private List<String> intermediates;

    public String getInput() {
        return input;
    }

    public RunSummary setInput(String input) {
        this.input = input;
        return this;
    }

    public String getOutput() {
        return output;
    }

    public RunSummary setOutput(String output) {
        this.output = output;
        return this;
    }

    public String getTitle() {
        return title;
    }

    public RunSummary setTitle(String title) {
        this.title = title;
        return this;
    }

    public int getChannels() {
        return channels;
    }

    public RunSummary setChannels(int channels) {
        this.channels = channels;
        return this;
    }

    public int getSlices() {
        return slices;
    }

    public RunSummary setSlices(int slices) {
        this.slices = slices;
        return this;
    }

    public int getFrames() {
        return frames;
    }

    public RunSummary setFrames(int frames) {
        this.frames = frames;
        return this;
    }

    public int getTargetChannel() {
        return targetChannel;
    }

    public RunSummary setTargetChannel(int targetChannel) {
        this.targetChannel = targetChannel;
        return this;
    }

    public double getBlurSigma() {
        return blurSigma;
    }

    public RunSummary setBlurSigma(double blurSigma) {
        this.blurSigma = blurSigma;
        return this;
    }

    public double getContrastSaturation() {
        return contrastSaturation;
    }

    public RunSummary setContrastSaturation(double contrastSaturation) {
        this.contrastSaturation = contrastSaturation;
        return this;
    }

    public int getOutputBitDepth() {
        return outputBitDepth;
    }

    public RunSummary setOutputBitDepth(int outputBitDepth) {
        this.outputBitDepth = outputBitDepth;
        return this;
    }

    public String getBorderMode() {
        return borderMode;
    }

    public RunSummary setBorderMode(String borderMode) {
        this.borderMode = borderMode;
        return this;
    }

    public double getContrastLowerBound() {
        return contrastLowerBound;
    }

    public RunSummary setContrastLowerBound(double contrastLowerBound) {
        this.contrastLowerBound = contrastLowerBound;
        return this;
    }

    public double getContrastUpperBound() {
        return contrastUpperBound;
    }

    public RunSummary setContrastUpperBound(double contrastUpperBound) {
        this.contrastUpperBound = contrastUpperBound;
        return this;
    }

    public long getProcessingTimeMillis() {
        return processingTimeMillis;
    }

    public RunSummary setProcessingTimeMillis(long processingTimeMillis) {
        this.processingTimeMillis = processingTimeMillis;
        return this;
    }

    public List<String> getIntermediates() {
        return intermediates;
    }

    public RunSummary addIntermediate(String intermediate) {
        if (intermediates == null) {
            intermediates = new ArrayList<>();
        }
        intermediates.add(intermediate);
        return this;
    }
}
