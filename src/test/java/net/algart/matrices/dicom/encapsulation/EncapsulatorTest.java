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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EncapsulatorTest {
    private static final byte FE = (byte) 0xFE;
    private static final byte FF = (byte) 0xFF;

    @Test
    public void testSingleFrameWithEmptyOffsetTable() {
        final byte[] frame = {FE, FF, 0x00, (byte) 0xE1};
        final byte[] encapsulated = Encapsulator.encapsulate(List.of(frame), 1, false);
        assertArrayEquals(new byte[]{
                FE, FF, 0x00, (byte) 0xE0, 0, 0, 0, 0,
                FE, FF, 0x00, (byte) 0xE0, 4, 0, 0, 0,
                FE, FF, 0x00, (byte) 0xE1}, encapsulated);
    }

    @Test
    public void testBasicOffsetTable() {
        final byte[] encapsulated = Encapsulator.encapsulate(List.of(new byte[]{1, 2, 3, 4}, new byte[]{5, 6}));
        assertArrayEquals(new byte[]{
                FE, FF, 0x00, (byte) 0xE0, 8, 0, 0, 0, 0, 0, 0, 0, 12, 0, 0, 0,
                FE, FF, 0x00, (byte) 0xE0, 4, 0, 0, 0, 1, 2, 3, 4,
                FE, FF, 0x00, (byte) 0xE0, 2, 0, 0, 0, 5, 6}, encapsulated);
    }

    @Test
    public void testFragmentation() {
        final byte[] frame = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
        final List<byte[]> three = Encapsulator.fragmentFrame(frame, 3);
        assertEquals(3, three.size());
        assertArrayEquals(new byte[]{1, 2, 3, 4}, three.get(0));
        assertArrayEquals(new byte[]{5, 6, 7, 8}, three.get(1));
        assertArrayEquals(new byte[]{9, 10}, three.get(2));

        final List<byte[]> five = Encapsulator.fragmentFrame(frame, 5);
        for (byte[] fragment : five) {
            assertEquals(2, fragment.length);
        }

        final List<byte[]> odd = Encapsulator.fragmentFrame(new byte[]{1, 2, 3, 4, 5}, 1);
        assertArrayEquals(new byte[]{1, 2, 3, 4, 5, 0}, odd.get(0));

        final IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Encapsulator.fragmentFrame(frame, 6));
        assertTrue(e.getMessage().contains("Too many fragments"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> Encapsulator.fragmentFrame(frame, 0));
    }

    @Test
    public void testFragmentationOfAnyLength() throws IOException {
        for (int frameLength = 1; frameLength <= 40; frameLength++) {
            final byte[] frame = new byte[frameLength];
            for (int i = 0; i < frameLength; i++) {
                frame[i] = (byte) (i + 1);
            }
            for (int k = 1; k <= (frameLength + 1) / 2; k++) {
                final String message = frameLength + " bytes, " + k + " fragments";
                final List<byte[]> fragments = Encapsulator.fragmentFrame(frame, k);
                assertEquals(k, fragments.size(), message);
                final ByteArrayOutputStream joined = new ByteArrayOutputStream();
                for (byte[] fragment : fragments) {
                    assertEquals(0, fragment.length % 2, message);
                    joined.writeBytes(fragment);
                }
                final byte[] result = joined.toByteArray();
                assertEquals(frameLength + frameLength % 2, result.length, message);
                assertArrayEquals(frame, Arrays.copyOf(result, frameLength), message);

                final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(
                        Encapsulator.encapsulate(List.of(frame, frame), k, true));
                assertEquals(2 * k, pixelData.numberOfFragments(), message);
                assertArrayEquals(result, pixelData.getFrame(1), message);
            }
        }
    }

    @Test
    public void testItemizeFragment() {
        assertArrayEquals(new byte[]{FE, FF, 0x00, (byte) 0xE0, 2, 0, 0, 0, 7, 8},
                Encapsulator.itemizeFragment(new byte[]{7, 8}));
        final List<byte[]> items = Encapsulator.itemizeFrame(new byte[]{1, 2, 3, 4}, 2);
        assertEquals(2, items.size());
        assertEquals(10, items.get(1).length);
    }

    @Test
    public void testExtendedOffsetTable() {
        final Encapsulator.Extended extended = Encapsulator.encapsulateExtended(List.of(
                new byte[]{1, 2, 3}, new byte[]{4, 5, 6, 7}));
        final ExtendedOffsetTable table = extended.extendedOffsetTable();
        assertArrayEquals(new long[]{0, 12}, table.offsets());
        assertArrayEquals(new long[]{4, 4}, table.lengths());
        assertEquals(8 + 12 + 12, extended.pixelData().length);
        assertEquals(0, extended.pixelData()[4], "Basic Offset Table must be empty");

        final ExtendedOffsetTable decoded = ExtendedOffsetTable.fromBytes(
                table.offsetBytes(), table.lengthBytes(), true);
        assertArrayEquals(table.offsets(), decoded.offsets());
        assertArrayEquals(table.lengths(), decoded.lengths());
        assertThrows(IllegalArgumentException.class, () -> new ExtendedOffsetTable(new long[2], new long[1]));
    }

    @Test
    public void testBasicOffsetTableLimit() {
        Encapsulator.checkBasicOffsetTableLimit(new long[]{0xFFFFFFF7L, 100});
        final IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Encapsulator.checkBasicOffsetTableLimit(new long[]{0xFFFFFFF8L, 100}));
        assertTrue(e.getMessage().contains("Extended Offset Table"), e.getMessage());
        Encapsulator.checkBasicOffsetTableLimit(new long[]{0xFFFFFFFFFL});
    }

    @Test
    public void testSequenceDelimiter() {
        final byte[] result = Encapsulator.appendSequenceDelimiter(new byte[]{1, 2});
        assertArrayEquals(new byte[]{1, 2, FE, FF, (byte) 0xDD, (byte) 0xE0, 0, 0, 0, 0}, result);
    }
}
