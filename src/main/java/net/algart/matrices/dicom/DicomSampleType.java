/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2025 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.matrices.dicom;

import net.algart.arrays.BitArray;
import net.algart.arrays.JArrays;
import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.arrays.UpdatablePArray;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Types of decoded pixel samples and their representation as AlgART matrices.
 *
 * <p>All decoded samples are little-endian. Binary samples (Bits Allocated = 1) are packed
 * starting from the least significant bit of every byte, as in DICOM; they are represented
 * by {@link BitArray}.
 */
public enum DicomSampleType {
    BIT("bit", 1, boolean.class, false),
    INT8("int8", 8, byte.class, true),
    UINT8("uint8", 8, byte.class, false),
    INT16("int16", 16, short.class, true),
    UINT16("uint16", 16, short.class, false),
    INT32("int32", 32, int.class, true),
    UINT32("uint32", 32, int.class, false),
    INT64("int64", 64, long.class, true),
    FLOAT("float", 32, float.class, true),
    DOUBLE("double", 64, double.class, true);

    private final String prettyName;
    private final int bitsPerSample;
    private final Class<?> elementType;
    private final boolean signed;

    DicomSampleType(String prettyName, int bitsPerSample, Class<?> elementType, boolean signed) {
        this.prettyName = prettyName;
        this.bitsPerSample = bitsPerSample;
        this.elementType = elementType;
        this.signed = signed;
    }

    /**
     * Returns the sample type for integer pixel data (7FE0,0010).
     *
     * @param bitsAllocated       container size: 1, 8, 16, 32 or 64.
     * @param pixelRepresentation 0 for unsigned, 1 for signed (2's complement) samples.
     * @return sample type.
     * @throws UnsupportedDicomFormatException if this combination is not supported.
     */
    public static DicomSampleType of(int bitsAllocated, int pixelRepresentation)
            throws UnsupportedDicomFormatException {
        final boolean signed = pixelRepresentation == 1;
        return switch (bitsAllocated) {
            case 1 -> BIT;
            case 8 -> signed ? INT8 : UINT8;
            case 16 -> signed ? INT16 : UINT16;
            case 32 -> signed ? INT32 : UINT32;
            case 64 -> INT64;
            default -> throw new UnsupportedDicomFormatException("Unsupported bits allocated " + bitsAllocated +
                    ": only 1, 8, 16, 32, 64 bits per sample are supported");
        };
    }

    /**
     * Returns the sample type for the given pixel data tag: {@link #FLOAT} for Float Pixel Data,
     * {@link #DOUBLE} for Double Float Pixel Data, and {@link #of(int, int)} for Pixel Data.
     *
     * @param pixelTag            pixel data tag.
     * @param bitsAllocated       bits allocated.
     * @param pixelRepresentation pixel representation.
     * @return sample type.
     * @throws UnsupportedDicomFormatException if this combination is not supported.
     */
    public static DicomSampleType of(int pixelTag, int bitsAllocated, int pixelRepresentation)
            throws UnsupportedDicomFormatException {
        return switch (pixelTag) {
            case DicomTag.FLOAT_PIXEL_DATA -> FLOAT;
            case DicomTag.DOUBLE_FLOAT_PIXEL_DATA -> DOUBLE;
            default -> of(bitsAllocated, pixelRepresentation);
        };
    }

    public String prettyName() {
        return prettyName;
    }

    public int bitsPerSample() {
        return bitsPerSample;
    }

    public OptionalInt bytesPerSample() {
        return isWholeBytes() ? OptionalInt.of(bitsPerSample >>> 3) : OptionalInt.empty();
    }

    public Class<?> elementType() {
        return elementType;
    }

    public boolean isBinary() {
        return this == BIT;
    }

    public boolean isWholeBytes() {
        return this != BIT;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT || this == DOUBLE;
    }

    /**
     * Converts little-endian samples into a Java array: <code>long[]</code> with packed bits for {@link #BIT},
     * or an array of {@link #elementType()} for other types.
     *
     * @param bytes decoded samples.
     * @return Java array.
     */
    public Object javaArray(byte[] bytes) {
        Objects.requireNonNull(bytes, "Null bytes");
        if (this == BIT || this == INT64) {
            final long[] result = new long[(bytes.length + 7) / 8];
            ByteBuffer.wrap(Arrays.copyOf(bytes, 8 * result.length))
                    .order(ByteOrder.LITTLE_ENDIAN).asLongBuffer().get(result);
            return result;
        }
        return elementType == byte.class ? bytes : JArrays.bytesToArray(bytes, elementType, ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Returns the decoded frame as AlgART matrix. For planar data (Planar Configuration = 1),
     * the dimensions are <code>columns&times;rows&times;samplesPerPixel</code>; for interleaved data,
     * they are <code>samplesPerPixel&times;columns&times;rows</code>.
     *
     * @param bytes           decoded frame.
     * @param columns         number of columns.
     * @param rows            number of rows.
     * @param samplesPerPixel number of samples per pixel.
     * @param planar          whether the samples are stored in separate planes.
     * @return matrix, backed by a new Java array.
     */
    public Matrix<UpdatablePArray> asMatrix(byte[] bytes, int columns, int rows, int samplesPerPixel, boolean planar) {
        Objects.requireNonNull(bytes, "Null bytes");
        if (columns < 0 || rows < 0) {
            throw new IllegalArgumentException("Negative columns = " + columns + " or rows = " + rows);
        }
        if (samplesPerPixel <= 0) {
            throw new IllegalArgumentException("Zero or negative samplesPerPixel = " + samplesPerPixel);
        }
        final long numberOfSamples = (long) columns * (long) rows * (long) samplesPerPixel;
        final long requiredBytes = this == BIT ? (numberOfSamples + 7) / 8 : numberOfSamples * (bitsPerSample / 8);
        if (bytes.length < requiredBytes) {
            throw new IllegalArgumentException("Too short frame: " + bytes.length + " bytes instead of " +
                    requiredBytes);
        }
        final Object javaArray = javaArray(bytes);
        final UpdatablePArray array = this == BIT ?
                BitArray.as((long[]) javaArray, numberOfSamples) :
                (UpdatablePArray) PArray.as(javaArray).subArr(0, numberOfSamples);
        return planar ?
                Matrices.matrix(array, columns, rows, samplesPerPixel) :
                Matrices.matrix(array, samplesPerPixel, columns, rows);
    }

    @Override
    public String toString() {
        return prettyName;
    }
}
