package org.janelia.flatfield.image;

import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MultichannelImageTest {

    @Test
    public void channelViews() {
        MultichannelImage<UnsignedShortType> image = TestUtils.createMultichannelImage("test", new UnsignedShortType(),
                5, 4, 3, 2, 2,
                (x, y, c, z, t) -> 1000 * c + 100 * t + 10 * z + x);
        assertEquals(3, image.getChannels());
        assertEquals(2, image.getSlices());
        assertEquals(2, image.getFrames());
        assertEquals(PixelDepth.GRAY16, image.getPixelDepth());
        for (int c = 1; c <= 3; c++) {
            int channel = c;
            ChannelImage<UnsignedShortType> expected = TestUtils.createChannelImage("C" + c, new UnsignedShortType(),
                    5, 4, 2, 2,
                    (x, y, ignored, z, t) -> 1000 * channel + 100 * t + 10 * z + x);
            TestUtils.assertSamePixels(expected.getPixels(), image.getChannel(c), 0);
        }
    }

    @Test
    public void invalidChannels() {
        MultichannelImage<FloatType> image = MultichannelImage.create("test", new FloatType(), 2, 2, 2, 1, 1);
        for (int c : new int[]{0, 3, -1}) {
            try {
                image.getChannel(c);
                fail("Channel " + c + " should have been rejected");
            } catch (IllegalArgumentException e) {
                assertTrue(e.getMessage().contains("Channel " + c));
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void requiresFiveDimensions() {
        new MultichannelImage<>("test", ArrayImgs.floats(2, 2, 2, 1));
    }

    @Test
    public void channelImageRelease() {
        ChannelImage<FloatType> channel = TestUtils.createChannelImage("test", new FloatType(), 2, 2, 1, 1,
                (x, y, c, z, t) -> x - y);
        assertFalse(channel.isReleased());
        assertEquals(-1, channel.getMinValue(), 0);
        assertEquals(1, channel.getMaxValue(), 0);
        channel.release();
        assertTrue(channel.isReleased());
        try {
            channel.getPixels();
            fail("Pixels of a released channel should not be accessible");
        } catch (IllegalStateException expected) {
            // expected
        }
        try {
            channel.release();
            fail("A channel must not be released twice");
        } catch (IllegalStateException expected) {
            // expected
        }
    }

    @Test
    public void nominalWorkingRange() {
        ChannelImage<UnsignedShortType> channel = TestUtils.createChannelImage("test", new UnsignedShortType(), 2, 2, 1, 1,
                (x, y, c, z, t) -> 7);
        assertEquals(0, channel.getMinValue(), 0);
        assertEquals(65535, channel.getMaxValue(), 0);
    }
}
