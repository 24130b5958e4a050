package org.janelia.flatfield.image;

import java.util.function.Supplier;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.BiConverter;
import net.imglib2.converter.Converter;
import net.imglib2.converter.read.BiConvertedRandomAccessibleInterval;
import net.imglib2.converter.read.ConvertedRandomAccessibleInterval;
import net.imglib2.type.Type;

public class ImageTransforms {

    public static <S extends Type<S>, T extends Type<T>>
    RandomAccessibleInterval<T> createPixelTransformation(RandomAccessibleInterval<S> img,
                                                          Converter<? super S, ? super T> pixelConverter,
                                                          Supplier<T> targetPixelSupplier) {
        Supplier<Converter<? super S, ? super T>> pixelConverterSupplier = () -> pixelConverter;
        return new ConvertedRandomAccessibleInterval<S, T>(
                img,
                pixelConverterSupplier,
                targetPixelSupplier
        );
    }

    public static <R extends Type<R>, S extends Type<S>, T extends Type<T>>
    RandomAccessibleInterval<T> createBinaryPixelOperation(RandomAccessibleInterval<R> img1,
                                                           RandomAccessibleInterval<S> img2,
                                                           BiConverter<? super R, ? super S, ? super T> op,
                                                           Supplier<T> resultPixelSupplier) {
        if (ImageAccessUtils.differentShape(img1, img2)) {
            throw new IllegalArgumentException("Binary pixel operations require images of the same shape");
        }
        Supplier<BiConverter<? super R, ? super S, ? super T>> pixelConverterSupplier = () -> op;
        return new BiConvertedRandomAccessibleInterval<R, S, T>(
                img1,
                img2,
                pixelConverterSupplier,
                resultPixelSupplier
        );
    }
}
