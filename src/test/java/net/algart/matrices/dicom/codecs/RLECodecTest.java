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

package net.algart.matrices.dicom.codecs;

import net.algart.matrices.dicom.DicomException;
import net.algart.matrices.dicom.DicomFixtures;
import net.algart.matrices.dicom.UnsupportedDicomFormatException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class RLECodecTest {
    private static final int COLUMNS = 5;
    private static final int ROWS = 3;

    private static byte[] encodeRow(byte... row) {
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        RLECodec.encodeRow(output, row, 0, row.length);
        return output.toByteArray();
    }

    private static byte[] repeat(int value, int count) {
        final byte[] result = new byte[count];
        Arrays.fill(result, (byte) value);
        return result;
    }

    private static PixelDataOptions options(int bitsAllocated, int samplesPerPixel, int planarConfiguration) {
        return new PixelDataOptions()
                .setSizes(COLUMNS, ROWS)
                .setSamplesPerPixel(samplesPerPixel)
                .setBits(bitsAllocated, bitsAllocated)
                .setPixelRepresentation(0)
                .setPhotometricInterpretation(samplesPerPixel == 1 ? "MONOCHROME2" : "RGB")
                .setPlanarConfiguration(planarConfiguration)
                .setNumberOfFrames(1);
    }

    @Test
    public void testEncodeRow() {
        assertArrayEquals(new byte[]{(byte) 0x81, 7, (byte) 0xEB, 7}, encodeRow(repeat(7, 150)));
        assertArrayEquals(new byte[]{(byte) 0x81, 7, 0x00, 7}, encodeRow(repeat(7, 129)));
        assertArrayEquals(new byte[]{(byte) 0x81, 7}, encodeRow(repeat(7, 128)));
        assertArrayEquals(new byte[]{3, 0, 1, 0, 1}, encodeRow((byte) 0, (byte) 1, (byte) 0, (byte) 1));
        assertArrayEquals(new byte[]{0, 1, (byte) 0xFF, 2, 0, 3}, encodeRow((byte) 1, (byte) 2, (byte) 2, (byte) 3));
        assertArrayEquals(new byte[0], encodeRow());

        final byte[] literal = new byte[130];
        for (int k = 0; k < literal.length; k++) {
            literal[k] = (byte) k;
        }
        final byte[] encoded = encodeRow(literal);
        assertEquals(127, encoded[0]);
        assertEquals(1, encoded[129]);
        assertEquals(132, encoded.length);
    }

    @Test
    public void testDecodeSegment() {
        final byte[] dest = new byte[6];
        final byte[] src = {(byte) 0xFE, 9, (byte) 0x80, 1, 4, 5, 0, 6};
        assertEquals(6, RLECodec.decodeSegment(dest, src, 0, src.length));
        assertArrayEquals(new byte[]{9, 9, 9, 4, 5, 6}, dest);

        final byte[] small = new byte[2];
        assertTrue(RLECodec.decodeSegment(small, src, 0, src.length) > small.length);
        assertArrayEquals(new byte[]{9, 9}, small);
    }

    @Test
    public void testRoundTrip() throws DicomException {
        final RLECodec codec = new RLECodec();
        for (int bits : new int[]{8, 16, 32}) {
            for (int samples : new int[]{1, 3}) {
                for (int planar = 0; planar <= (samples == 1 ? 0 : 1); planar++) {
                    final PixelDataOptions options = options(bits, samples, planar);
                    final byte[] data = DicomFixtures.pixels(COLUMNS * ROWS * samples * bits / 8, bits + samples);
                    final byte[] compressed = codec.compress(data, options);
                    final int[] offsets = RLECodec.parseHeader(compressed);
                    assertEquals(samples * bits / 8, offsets.length);
                    assertEquals(RLECodec.HEADER_LENGTH, offsets[0]);
                    for (int offset : offsets) {
                        assertEquals(0, offset % 2, "segments must have even length");
                    }
                    assertArrayEquals(data, codec.decompress(compressed, options),
                            bits + " bits, " + samples + " samples, planar " + planar);
                }
            }
        }
    }

    @Test
    public void testMostSignificantByteFirst() throws DicomException {
        final PixelDataOptions options = options(16, 1, 0).setSizes(2, 1);
        final byte[] compressed = new RLECodec().compress(new byte[]{0x34, 0x12, 0x78, 0x56}, options);
        final int second = RLECodec.parseHeader(compressed)[1];
        assertArrayEquals(new byte[]{1, 0x12, 0x56}, Arrays.copyOfRange(compressed, 64, 67));
        assertArrayEquals(new byte[]{1, 0x34, 0x78}, Arrays.copyOfRange(compressed, second, second + 3));
    }

    @Test
    public void testLittleEndianSegmentOrder() throws DicomException {
        final PixelDataOptions options = options(16, 1, 0);
        final byte[] data = DicomFixtures.pixels(COLUMNS * ROWS * 2, 3);
        final byte[] compressed = new RLECodec().compress(data, options);
        final ByteBuffer header = ByteBuffer.wrap(compressed).order(ByteOrder.LITTLE_ENDIAN);
        final int msb = header.getInt(4);
        final int lsb = header.getInt(8);
        final byte[] reordered = new byte[compressed.length];
        System.arraycopy(compressed, 0, reordered, 0, RLECodec.HEADER_LENGTH);
        ByteBuffer.wrap(reordered).order(ByteOrder.LITTLE_ENDIAN).putInt(4, RLECodec.HEADER_LENGTH);
        final int lsbLength = compressed.length - lsb;
        System.arraycopy(compressed, lsb, reordered, RLECodec.HEADER_LENGTH, lsbLength);
        ByteBuffer.wrap(reordered).order(ByteOrder.LITTLE_ENDIAN).putInt(8, RLECodec.HEADER_LENGTH + lsbLength);
        System.arraycopy(compressed, msb, reordered, RLECodec.HEADER_LENGTH + lsbLength, lsb - msb);

        options.setLittleEndianSegmentOrder(true);
        assertArrayEquals(data, new RLECodec().decompress(reordered, options));
    }

    @Test
    public void testTooManySegments() {
        final PixelDataOptions options = options(64, 3, 0);
        final byte[] data = new byte[COLUMNS * ROWS * 3 * 8];
        final DicomException e = assertThrows(DicomException.class, () -> new RLECodec().compress(data, options));
        assertTrue(e.getMessage().contains("maximum of 15 segments"), e.getMessage());

        final byte[] header = new byte[RLECodec.HEADER_LENGTH];
        header[0] = 16;
        assertThrows(DicomException.class, () -> RLECodec.parseHeader(header));
        assertThrows(DicomException.class, () -> RLECodec.parseHeader(new byte[10]));
    }

    @Test
    public void testUnsupportedBits() {
        final PixelDataOptions options = options(8, 1, 0).setBits(12, 12);
        assertThrows(UnsupportedDicomFormatException.class,
                () -> new RLECodec().compress(new byte[COLUMNS * ROWS * 2], options));
        assertThrows(UnsupportedDicomFormatException.class,
                () -> new RLECodec().decompress(new byte[RLECodec.HEADER_LENGTH], options));
    }

    @Test
    public void testInvalidData() throws DicomException {
        final byte[] data = DicomFixtures.pixels(COLUMNS * ROWS, 1);
        final byte[] compressed = new RLECodec().compress(data, options(8, 1, 0));

        final DicomException segments = assertThrows(DicomException.class,
                () -> new RLECodec().decompress(compressed, options(16, 1, 0)));
        assertTrue(segments.getMessage().contains("(2 vs. 1 segments)"), segments.getMessage());

        final byte[] truncated = Arrays.copyOf(compressed, RLECodec.HEADER_LENGTH + 2);
        final DicomException amount = assertThrows(DicomException.class,
                () -> new RLECodec().decompress(truncated, options(8, 1, 0)));
        assertTrue(amount.getMessage().contains("decoded RLE segment"), amount.getMessage());

        assertThrows(DicomException.class,
                () -> new RLECodec().compress(Arrays.copyOf(data, data.length - 1), options(8, 1, 0)));
    }
}
