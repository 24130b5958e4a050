package org.janelia.flatfield.ij;

import java.util.stream.StreamSupport;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.janelia.flatfield.image.ChannelImage;
import org.janelia.flatfield.image.MultichannelImage;
import org.janelia.flatfield.image.PixelDepth;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ImagePlusAdapterTest {

    private static MultichannelImage<UnsignedShortType> createImage() {
        MultichannelImage<UnsignedShortType> image = MultichannelImage.create("sample", new UnsignedShortType(),
                6, 4, 3, 2, 2);
        Cursor<UnsignedShortType> cursor = image.getPixels().localizingCursor();
        while (cursor.hasNext()) {
            UnsignedShortType px = cursor.next();
            px.set(pixelValue(cursor.getIntPosition(0), cursor.getIntPosition(1),
                    cursor.getIntPosition(2), cursor.getIntPosition(3), cursor.getIntPosition(4)));
        }
        return image;
    }

    private static int pixelValue(int x, int y, int c, int z, int t) {
        return 10000 * c + 1000 * t + 100 * z + 10 * y + x + 40000;
    }

    @Test
    public void toCompositeImage() {
        ImagePlus imp = ImagePlusAdapter.toImagePlus(createImage());
        assertTrue(imp.isComposite());
        assertEquals("sample", imp.getTitle());
        assertEquals(16, imp.getBitDepth());
        assertEquals(3, imp.getNChannels());
        assertEquals(2, imp.getNSlices());
        assertEquals(2, imp.getNFrames());
        for (int t = 0; t < 2; t++) {
            for (int z = 0; z < 2; z++) {
                for (int c = 0; c < 3; c++) {
                    ImageProcessor ip = imp.getStack().getProcessor(imp.getStackIndex(c + 1, z + 1, t + 1));
                    assertEquals(pixelValue(0, 0, c, z, t), ip.get(0, 0));
                    assertEquals(pixelValue(5, 3, c, z, t), ip.get(5, 3));
                }
            }
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    public void fromImagePlusKeepsHyperstackLayout() {
        MultichannelImage<UnsignedShortType> image = createImage();
        MultichannelImage<UnsignedShortType> copy =
                (MultichannelImage<UnsignedShortType>) ImagePlusAdapter.fromImagePlus(ImagePlusAdapter.toImagePlus(image));
        assertEquals(PixelDepth.GRAY16, copy.getPixelDepth());
        assertEquals(3, copy.getChannels());
        assertEquals(2, copy.getSlices());
        assertEquals(2, copy.getFrames());
        Cursor<UnsignedShortType> cursor = copy.getPixels().localizingCursor();
        while (cursor.hasNext()) {
            UnsignedShortType px = cursor.next();
            assertEquals(pixelValue(cursor.getIntPosition(0), cursor.getIntPosition(1),
                    cursor.getIntPosition(2), cursor.getIntPosition(3), cursor.getIntPosition(4)), px.get());
        }
    }

    @Test
    public void floatImage() {
        ImageStack stack = new ImageStack(2, 2);
        stack.addSlice(new FloatProcessor(2, 2, new float[]{0.5f, 1.5f, -1f, 3f}));
        stack.addSlice(new FloatProcessor(2, 2, new float[]{2f, 2f, 2f, 2f}));
        ImagePlus imp = new ImagePlus("float", stack);
        imp.setDimensions(2, 1, 1);
        MultichannelImage<?> image = ImagePlusAdapter.fromImagePlus(imp);
        assertEquals(PixelDepth.FLOAT32, image.getPixelDepth());
        assertEquals(2, image.getChannels());
        double[] channel1 = values(image.getChannel(1));
        assertEquals(0.5, channel1[0], 0);
        assertEquals(-1, channel1[2], 0);
        assertEquals(3, channel1[3], 0);
        for (double v : values(image.getChannel(2))) {
            assertEquals(2, v, 0);
        }
    }

    private static double[] values(RandomAccessibleInterval<? extends RealType<?>> image) {
        return StreamSupport.stream(Views.flatIterable(image).spliterator(), false)
                .mapToDouble(RealType::getRealDouble)
                .toArray();
    }

    @Test(expected = IllegalArgumentException.class)
    public void rgbImageIsRejected() {
        ImagePlusAdapter.fromImagePlus(new ImagePlus("rgb", new ColorProcessor(4, 4)));
    }

    @Test
    public void channelImage() {
        Img<FloatType> pixels = new ArrayImgFactory<>(new FloatType()).create(3, 2, 2, 3);
        int i = 0;
        for (FloatType px : pixels) {
            px.set(i++ * 0.1f);
        }
        ChannelImage<FloatType> channel = new ChannelImage<>("background", 2, pixels);
        ImagePlus imp = ImagePlusAdapter.toImagePlus(channel, "C2-background");
        assertEquals("C2-background", imp.getTitle());
        assertEquals(32, imp.getBitDepth());
        assertEquals(1, imp.getNChannels());
        assertEquals(2, imp.getNSlices());
        assertEquals(3, imp.getNFrames());
        // last plane, last pixel
        ImageProcessor ip = imp.getStack().getProcessor(imp.getStackIndex(1, 2, 3));
        assertEquals(35 * 0.1f, ip.getf(2, 1), 1e-5);
    }
}
