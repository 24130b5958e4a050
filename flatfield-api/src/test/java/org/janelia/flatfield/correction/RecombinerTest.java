package org.janelia.flatfield.correction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.MultichannelImage;
import org.janelia.flatfield.image.PixelDepth;
import org.janelia.flatfield.image.TestUtils;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class RecombinerTest {

    private final Recombiner recombiner = new Recombiner();

    @Test
    public void recombineInChannelOrder() {
        List<ChannelImage<UnsignedByteType>> channels = new ArrayList<>();
        for (int c = 1; c <= 3; c++) {
            int channel = c;
            channels.add(TestUtils.createChannelImage("C" + c, new UnsignedByteType(), 5, 4, 2, 1,
                    (x, y, ignored, z, t) -> channel * 50 + x + z));
        }
        MultichannelImage<UnsignedByteType> composite = recombiner.recombine("composite", channels);
        assertEquals("composite", composite.getTitle());
        assertEquals(3, composite.getChannels());
        assertEquals(2, composite.getSlices());
        assertEquals(1, composite.getFrames());
        assertEquals(PixelDepth.GRAY8, composite.getPixelDepth());
        for (int c = 1; c <= 3; c++) {
            TestUtils.assertSamePixels(channels.get(c - 1).getPixels(), composite.getChannel(c), 0);
        }
    }

    @Test
    public void compositeDoesNotDependOnChannels() {
        ChannelImage<UnsignedByteType> c1 = TestUtils.createChannelImage("C1", new UnsignedByteType(), 2, 2, 1, 1,
                (x, y, c, z, t) -> 9);
        ChannelImage<UnsignedByteType> c2 = TestUtils.createChannelImage("C2", new UnsignedByteType(), 2, 2, 1, 1,
                (x, y, c, z, t) -> 8);
        MultichannelImage<UnsignedByteType> composite = recombiner.recombine("composite", Arrays.asList(c1, c2));
        c1.release();
        c2.release();
        assertEquals(9, composite.getPixels().firstElement().get());
    }

    @Test
    public void invalidChannels() {
        ChannelImage<UnsignedByteType> ref = TestUtils.createChannelImage("C1", new UnsignedByteType(), 4, 4, 1, 1,
                (x, y, c, z, t) -> 1);
        ChannelImage<UnsignedByteType> otherShape = TestUtils.createChannelImage("C2", new UnsignedByteType(), 4, 4, 2, 1,
                (x, y, c, z, t) -> 1);
        ChannelImage<UnsignedByteType> released = TestUtils.createChannelImage("C3", new UnsignedByteType(), 4, 4, 1, 1,
                (x, y, c, z, t) -> 1);
        released.release();
        List<List<ChannelImage<UnsignedByteType>>> invalidInputs = Arrays.asList(
                Collections.emptyList(),
                Arrays.asList(ref, otherShape),
                Arrays.asList(ref, released),
                Arrays.asList(ref, null),
                Collections.nCopies(8, ref)
        );
        for (List<ChannelImage<UnsignedByteType>> channels : invalidInputs) {
            try {
                recombiner.recombine("composite", channels);
                fail("Recombining " + channels + " should have failed");
            } catch (RecombineException expected) {
                // expected
            }
        }
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    public void mixedDepths() {
        ChannelImage<UnsignedByteType> c1 = TestUtils.createChannelImage("C1", new UnsignedByteType(), 4, 4, 1, 1,
                (x, y, c, z, t) -> 1);
        ChannelImage<UnsignedShortType> c2 = TestUtils.createChannelImage("C2", new UnsignedShortType(), 4, 4, 1, 1,
                (x, y, c, z, t) -> 1);
        try {
            recombiner.<UnsignedByteType>recombine("composite", (List) Arrays.asList(c1, c2));
            fail("Channels of different depths must not be recombined");
        } catch (RecombineException e) {
            assertEquals("Channel 2 is GRAY16 but channel 1 is GRAY8", e.getMessage());
        }
    }
}
