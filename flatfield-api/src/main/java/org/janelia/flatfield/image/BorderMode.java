package org.janelia.flatfield.image;

import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.NumericType;
import net.imglib2.view.Views;

/**
 * Out-of-bounds strategy used when a filter reads past the image border.
 */
public enum BorderMode {
    EDGE_REPLICATE {
        @Override
        public <T extends NumericType<T>> RandomAccessible<T> extend(RandomAccessibleInterval<T> img) {
            return Views.extendBorder(img);
        }
    },
    MIRROR {
        @Override
        public <T extends NumericType<T>> RandomAccessible<T> extend(RandomAccessibleInterval<T> img) {
            return Views.extendMirrorSingle(img);
        }
    },
    ZERO {
        @Override
        public <T extends NumericType<T>> RandomAccessible<T> extend(RandomAccessibleInterval<T> img) {
            return Views.extendZero(img);
        }
    };

    public abstract <T extends NumericType<T>> RandomAccessible<T> extend(RandomAccessibleInterval<T> img);
}
