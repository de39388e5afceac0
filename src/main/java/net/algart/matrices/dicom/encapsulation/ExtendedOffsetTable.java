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

package net.algart.matrices.dicom.encapsulation;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Extended Offset Table: values of (7FE0,0001) Extended Offset Table and (7FE0,0002) Extended Offset Table
 * Lengths. For every frame, the offset is measured from the first byte of the item tag following
 * the Basic Offset Table to the item tag of the frame fragment; the length is the length of the frame
 * without the item header.
 */
public record ExtendedOffsetTable(long[] offsets, long[] lengths) {
    public ExtendedOffsetTable {
        Objects.requireNonNull(offsets, "Null offsets");
        Objects.requireNonNull(lengths, "Null lengths");
        if (offsets.length != lengths.length) {
            throw new IllegalArgumentException("There must be an equal number of Extended Offset Table offsets " +
                    "and lengths (" + offsets.length + " vs. " + lengths.length + ")");
        }
        offsets = offsets.clone();
        lengths = lengths.clone();
    }

    public static ExtendedOffsetTable fromBytes(byte[] offsets, byte[] lengths, boolean littleEndian) {
        return new ExtendedOffsetTable(toLongs(offsets, littleEndian), toLongs(lengths, littleEndian));
    }

    @Override
    public long[] offsets() {
        return offsets.clone();
    }

    @Override
    public long[] lengths() {
        return lengths.clone();
    }

    public int numberOfFrames() {
        return offsets.length;
    }

    public long offset(int index) {
        return offsets[index];
    }

    public long length(int index) {
        return lengths[index];
    }

    /**
     * Returns the value of (7FE0,0001) Extended Offset Table: 64-bit little-endian offsets.
     *
     * @return encoded offsets.
     */
    public byte[] offsetBytes() {
        return toBytes(offsets);
    }

    /**
     * Returns the value of (7FE0,0002) Extended Offset Table Lengths: 64-bit little-endian lengths.
     *
     * @return encoded lengths.
     */
    public byte[] lengthBytes() {
        return toBytes(lengths);
    }

    @Override
    public String toString() {
        return "Extended Offset Table for " + offsets.length + " frames";
    }

    private static long[] toLongs(byte[] bytes, boolean littleEndian) {
        Objects.requireNonNull(bytes, "Null bytes");
        final ByteBuffer bb = ByteBuffer.wrap(bytes)
                .order(littleEndian ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN);
        final long[] result = new long[bytes.length / 8];
        for (int i = 0; i < result.length; i++) {
            result[i] = bb.getLong();
        }
        return result;
    }

    private static byte[] toBytes(long[] values) {
        final ByteBuffer bb = ByteBuffer.allocate(8 * values.length).order(ByteOrder.LITTLE_ENDIAN);
        for (long v : values) {
            bb.putLong(v);
        }
        return bb.array();
    }
}
