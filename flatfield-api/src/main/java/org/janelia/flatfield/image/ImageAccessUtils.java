package org.janelia.flatfield.image;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.IterableInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.ImgFactory;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.Type;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

public class ImageAccessUtils {

    public static class ValueRange {
        public final double min;
        public final double max;

        ValueRange(double min, double max) {
            this.min = min;
            this.max = max;
        }

        public boolean isEmpty() {
            return !(max >= min);
        }
    }

    /**
     * Number of pixels of an image with the given dimensions.
     */
    public static long countPixels(long[] dimensions) {
        long count = 1;
        for (long d : dimensions) {
            count *= d;
        }
        return count;
    }

    public static boolean sameShape(RandomAccessibleInterval<?> ref, RandomAccessibleInterval<?> img) {
        long[] refShape = ref.dimensionsAsLongArray();
        long[] imgShape = img.dimensionsAsLongArray();
        if (refShape.length != imgShape.length)
            return false;
        for (int d = 0; d < refShape.length; d++) {
            if (refShape[d] != imgShape[d])
                return false;
        }
        return true;
    }

    public static boolean differentShape(RandomAccessibleInterval<?> ref, RandomAccessibleInterval<?> img) {
        return !sameShape(ref, img);
    }

    /**
     * Copy the source into a newly allocated array image. Unlike a view the result
     * does not change when the source changes.
     */
    public static <T extends NativeType<T>> Img<T> materializeAsNativeImg(RandomAccessibleInterval<T> source, Interval interval, T pxType) {
        ImgFactory<T> imgFactory = new ArrayImgFactory<>(pxType);
        Img<T> img = imgFactory.create(interval == null ? source : interval);
        copyPixels(interval != null ? Views.interval(source, interval) : source, img);
        return img;
    }

    /**
     * Copy pixel values between two images of the same shape, in flat iteration order.
     */
    public static <T extends Type<T>> void copyPixels(RandomAccessibleInterval<T> source, RandomAccessibleInterval<T> target) {
        if (differentShape(source, target)) {
            throw new IllegalArgumentException("Cannot copy pixels between images of different shapes");
        }
        final IterableInterval<T> sourceIterable = Views.flatIterable(source);
        final IterableInterval<T> targetIterable = Views.flatIterable(target);
        final Cursor<T> sourceCursor = sourceIterable.cursor();
        final Cursor<T> targetCursor = targetIterable.cursor();
        while (sourceCursor.hasNext()) {
            targetCursor.next().set(sourceCursor.next());
        }
    }

    public static <T extends RealType<T>> Img<FloatType> copyAsFloat(RandomAccessibleInterval<T> source) {
        Img<FloatType> img = new ArrayImgFactory<>(new FloatType()).create(source);
        final Cursor<T> sourceCursor = Views.flatIterable(source).cursor();
        final Cursor<FloatType> targetCursor = Views.flatIterable(img).cursor();
        while (sourceCursor.hasNext()) {
            targetCursor.next().setReal(sourceCursor.next().getRealDouble());
        }
        return img;
    }

    /**
     * @return the min and max of the finite pixel values; the range is empty if there are none.
     */
    public static <T extends RealType<T>> ValueRange valueRange(RandomAccessibleInterval<T> image) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        Cursor<T> cursor = Views.flatIterable(image).cursor();
        while (cursor.hasNext()) {
            double v = cursor.next().getRealDouble();
            if (Double.isFinite(v)) {
                if (v < min) min = v;
                if (v > max) max = v;
            }
        }
        return new ValueRange(min, max);
    }

    /**
     * Select one 2-D plane of an X, Y, Z, T stack.
     */
    public static <T> RandomAccessibleInterval<T> getPlane(RandomAccessibleInterval<T> stack, long slice, long frame) {
        if (stack.numDimensions() != 4) {
            throw new IllegalArgumentException("Expected an X, Y, Z, T stack but got " + stack.numDimensions() + " dimensions");
        }
        return Views.hyperSlice(Views.hyperSlice(stack, 3, stack.min(3) + frame), 2, stack.min(2) + slice);
    }
}
