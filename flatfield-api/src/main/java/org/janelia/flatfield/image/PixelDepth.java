package org.janelia.flatfield.image;

import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedIntType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Pixel precisions supported for channel data.
 */
public enum PixelDepth {
    GRAY8(8, false),
    GRAY16(16, false),
    GRAY32(32, false),
    FLOAT32(32, true);

    private final int bits;
    private final boolean floatingPoint;

    PixelDepth(int bits, boolean floatingPoint) {
        this.bits = bits;
        this.floatingPoint = floatingPoint;
    }

    public int getBits() {
        return bits;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    /**
     * @return the largest integer value for integer depths, i.e. 2^bits - 1.
     */
    public long getMaxIntValue() {
        if (floatingPoint) {
            throw new IllegalStateException(this + " is not an integer pixel depth");
        }
        return (1L << bits) - 1;
    }

    /**
     * Only 8- and 16-bit depths have a fixed nominal range; the other depths take their range from the data.
     */
    public boolean hasNominalRange() {
        return this == GRAY8 || this == GRAY16;
    }

    public static PixelDepth fromPixelType(RealType<?> pxType) {
        if (pxType instanceof UnsignedByteType) {
            return GRAY8;
        } else if (pxType instanceof UnsignedShortType) {
            return GRAY16;
        } else if (pxType instanceof UnsignedIntType) {
            return GRAY32;
        } else if (pxType instanceof FloatType) {
            return FLOAT32;
        } else {
            throw new IllegalArgumentException("Unsupported pixel type: " + pxType.getClass().getName());
        }
    }

    /**
     * Target depths for quantization.
     */
    public static PixelDepth forOutputBitDepth(int bitDepth) {
        switch (bitDepth) {
            case 8:
                return GRAY8;
            case 16:
                return GRAY16;
            default:
                throw new IllegalArgumentException("Invalid output bit depth: " + bitDepth + " - only 8 and 16 are supported");
        }
    }
}
