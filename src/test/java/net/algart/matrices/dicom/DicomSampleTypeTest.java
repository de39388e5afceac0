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
import net.algart.arrays.Matrix;
import net.algart.arrays.UpdatablePArray;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DicomSampleTypeTest {
    @Test
    public void testOf() throws UnsupportedDicomFormatException {
        assertEquals(DicomSampleType.BIT, DicomSampleType.of(1, 0));
        assertEquals(DicomSampleType.UINT8, DicomSampleType.of(8, 0));
        assertEquals(DicomSampleType.INT16, DicomSampleType.of(16, 1));
        assertEquals(DicomSampleType.UINT32, DicomSampleType.of(32, 0));
        assertEquals(DicomSampleType.FLOAT, DicomSampleType.of(DicomTag.FLOAT_PIXEL_DATA, 32, 0));
        assertEquals(DicomSampleType.DOUBLE, DicomSampleType.of(DicomTag.DOUBLE_FLOAT_PIXEL_DATA, 64, 0));
        assertEquals(DicomSampleType.UINT16, DicomSampleType.of(DicomTag.PIXEL_DATA, 16, 0));
        assertThrows(UnsupportedDicomFormatException.class, () -> DicomSampleType.of(12, 0));
        assertEquals(2, DicomSampleType.UINT16.bytesPerSample().getAsInt());
        assertTrue(DicomSampleType.BIT.bytesPerSample().isEmpty());
    }

    @Test
    public void testInterleavedAndPlanarMatrices() {
        final byte[] bytes = {1, 0, 2, 0, 3, 0, 4, 0, 5, 0, (byte) 0xFF, (byte) 0xFF};
        final Matrix<UpdatablePArray> interleaved = DicomSampleType.UINT16.asMatrix(bytes, 2, 1, 3, false);
        assertArrayEquals(new long[]{3, 2, 1}, interleaved.dimensions());
        assertEquals(4.0, interleaved.array().getDouble(3));
        assertEquals(65535.0, interleaved.array().getDouble(5));

        final Matrix<UpdatablePArray> planar = DicomSampleType.INT16.asMatrix(bytes, 2, 1, 3, true);
        assertArrayEquals(new long[]{2, 1, 3}, planar.dimensions());
        assertEquals(-1.0, planar.array().getDouble(5));
        assertEquals(6, planar.size());

        assertThrows(IllegalArgumentException.class,
                () -> DicomSampleType.UINT16.asMatrix(bytes, 2, 2, 3, false));
    }

    @Test
    public void testBinaryMatrix() {
        final byte[] bytes = {(byte) 0b1010_1101, 1};
        final Matrix<UpdatablePArray> matrix = DicomSampleType.BIT.asMatrix(bytes, 3, 3, 1, false);
        assertInstanceOf(BitArray.class, matrix.array());
        assertArrayEquals(new long[]{1, 3, 3}, matrix.dimensions());
        final boolean[] expected = {true, false, true, true, false, true, false, true, true};
        for (int k = 0; k < expected.length; k++) {
            assertEquals(expected[k], ((BitArray) matrix.array()).getBit(k), "bit #" + k);
        }
    }

    @Test
    public void testJavaArray() {
        final Object floats = DicomSampleType.FLOAT.javaArray(new byte[]{0, 0, (byte) 0x80, 0x3F});
        assertArrayEquals(new float[]{1.0f}, (float[]) floats);
        final Object longs = DicomSampleType.INT64.javaArray(new byte[]{2, 0, 0, 0, 0, 0, 0, 0});
        assertArrayEquals(new long[]{2}, (long[]) longs);
    }
}
