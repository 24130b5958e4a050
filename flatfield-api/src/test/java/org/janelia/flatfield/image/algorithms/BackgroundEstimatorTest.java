package org.janelia.flatfield.image.algorithms;

import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.flatfield.image.BorderMode;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.ImageAccessUtils;
import org.janelia.flatfield.image.PixelDepth;
import org.janelia.flatfield.image.TestUtils;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BackgroundEstimatorTest {

    @Test
    public void constantPlaneStaysConstant() {
        ChannelImage<UnsignedShortType> channel = TestUtils.createChannelImage("flat", new UnsignedShortType(),
                40, 30, 1, 1,
                (x, y, c, z, t) -> 1200);
        for (BorderMode borderMode : new BorderMode[]{BorderMode.EDGE_REPLICATE, BorderMode.MIRROR}) {
            ChannelImage<FloatType> background = BackgroundEstimator.estimateBackground(channel, 5, borderMode);
            assertEquals(PixelDepth.FLOAT32, background.getPixelDepth());
            assertArrayEquals(channel.getShape(), background.getShape());
            for (double v : TestUtils.toArray(background.getPixels())) {
                assertEquals(1200, v, 1e-2);
            }
        }
    }

    @Test
    public void edgeReplicateAndMirrorDifferOnRamp() {
        // horizontal ramp: values are constant along y so only the border along x matters
        ChannelImage<UnsignedShortType> channel = TestUtils.createChannelImage("ramp", new UnsignedShortType(),
                40, 8, 1, 1,
                (x, y, c, z, t) -> 10 * x);
        double sigma = 2;
        double[] replicated = TestUtils.toArray(
                BackgroundEstimator.estimateBackground(channel, sigma, BorderMode.EDGE_REPLICATE).getPixels());
        double[] mirrored = TestUtils.toArray(
                BackgroundEstimator.estimateBackground(channel, sigma, BorderMode.MIRROR).getPixels());
        // half-normal mean of the ramp past the border
        double offset = 10 * sigma / Math.sqrt(2 * Math.PI);
        int row = 4 * 40;
        assertEquals(offset, replicated[row], 0.5);
        assertEquals(2 * offset, mirrored[row], 1);
        assertEquals(390 - offset, replicated[row + 39], 0.5);
        assertEquals(390 - 2 * offset, mirrored[row + 39], 1);
        // away from the borders the ramp is unchanged by either mode
        assertEquals(200, replicated[row + 20], 1e-2);
        assertEquals(200, mirrored[row + 20], 1e-2);
    }

    @Test
    public void zeroBorderDarkensEdges() {
        ChannelImage<UnsignedByteType> channel = TestUtils.createChannelImage("flat", new UnsignedByteType(),
                40, 40, 1, 1,
                (x, y, c, z, t) -> 100);
        ChannelImage<FloatType> background = BackgroundEstimator.estimateBackground(channel, 4, BorderMode.ZERO);
        double[] values = TestUtils.toArray(background.getPixels());
        double corner = values[0];
        double center = values[20 * 40 + 20];
        assertTrue("Corner " + corner + " should be darker than center " + center, corner < center);
        assertEquals(100, center, 1e-2);
    }

    @Test
    public void planesAreSmoothedIndependently() {
        ChannelImage<UnsignedShortType> channel = TestUtils.createChannelImage("stack", new UnsignedShortType(),
                20, 20, 2, 2,
                (x, y, c, z, t) -> 100 + 1000 * z + 10000 * t);
        ChannelImage<FloatType> background = BackgroundEstimator.estimateBackground(channel, 8, BorderMode.EDGE_REPLICATE);
        for (long t = 0; t < 2; t++) {
            for (long z = 0; z < 2; z++) {
                for (double v : TestUtils.toArray(background.getPlane(z, t))) {
                    assertEquals(100 + 1000 * z + 10000 * t, v, 1e-1);
                }
            }
        }
    }

    @Test
    public void largerSigmaGivesFlatterBackground() {
        ChannelImage<UnsignedByteType> channel = TestUtils.createChannelImage("textured", new UnsignedByteType(),
                64, 64, 1, 1,
                (x, y, c, z, t) -> TestUtils.vignetted(x, y, 64, 64, 250));
        double previousSpread = Double.MAX_VALUE;
        for (double sigma : new double[]{1, 4, 16}) {
            ChannelImage<FloatType> background = BackgroundEstimator.estimateBackground(channel, sigma, BorderMode.EDGE_REPLICATE);
            ImageAccessUtils.ValueRange range = ImageAccessUtils.valueRange(background.getPixels());
            double spread = range.max - range.min;
            assertTrue("Sigma " + sigma + " gave spread " + spread + " >= " + previousSpread, spread < previousSpread);
            previousSpread = spread;
        }
    }

    @Test
    public void sourceIsNotModified() {
        ChannelImage<UnsignedByteType> channel = TestUtils.createChannelImage("textured", new UnsignedByteType(),
                32, 32, 1, 1,
                (x, y, c, z, t) -> TestUtils.vignetted(x, y, 32, 32, 200));
        double[] before = TestUtils.toArray(channel.getPixels());
        BackgroundEstimator.estimateBackground(channel, 3, BorderMode.EDGE_REPLICATE);
        assertArrayEquals(before, TestUtils.toArray(channel.getPixels()), 0);
    }

    @Test
    public void invalidSigma() {
        ChannelImage<UnsignedByteType> channel = TestUtils.createChannelImage("test", new UnsignedByteType(),
                4, 4, 1, 1,
                (x, y, c, z, t) -> 1);
        for (double sigma : new double[]{0, -1, Double.NaN, Double.POSITIVE_INFINITY}) {
            try {
                BackgroundEstimator.estimateBackground(channel, sigma, BorderMode.EDGE_REPLICATE);
                throw new AssertionError("Sigma " + sigma + " should have been rejected");
            } catch (IllegalArgumentException expected) {
                // expected
            }
        }
    }
}
