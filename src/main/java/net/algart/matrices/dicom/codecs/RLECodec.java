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
import net.algart.matrices.dicom.UnsupportedDicomFormatException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * RLE Lossless compression (DICOM PS3.5, Annex G).
 *
 * <p>Every byte plane of every sample is stored as a separate segment, most significant byte first;
 * each segment is compressed row by row by a PackBits-like algorithm. The frame starts with 64-byte header:
 * the number of segments and up to 15 offsets of the segments.
 */
public class RLECodec implements PixelDataCodec {
    public static final int HEADER_LENGTH = 64;
    public static final int MAX_NUMBER_OF_SEGMENTS = 15;

    private static final int MAX_RUN = 128;

    @Override
    public byte[] compress(byte[] data, PixelDataOptions options) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        Objects.requireNonNull(options, "Null codec options");
        final int bitsAllocated = options.bitsAllocated();
        checkBitsAllocated(bitsAllocated);
        final int columns = options.columns();
        final int samplesPerPixel = options.samplesPerPixel();
        final int bytesPerSample = bitsAllocated / 8;
        final int numberOfSegments = bytesPerSample * samplesPerPixel;
        if (numberOfSegments > MAX_NUMBER_OF_SEGMENTS) {
            throw new DicomException("Unable to encode as the DICOM Standard only allows a maximum of " +
                    MAX_NUMBER_OF_SEGMENTS + " segments in RLE encoded data (" + numberOfSegments +
                    " segments are necessary for " + samplesPerPixel + " samples of " + bitsAllocated + " bits)");
        }
        final int numberOfPixels = options.rows() * columns;
        if (data.length != numberOfPixels * numberOfSegments) {
            throw new DicomException("The length of the data to be encoded (" + data.length +
                    " bytes) doesn't match the expected length of the frame (" +
                    numberOfPixels * numberOfSegments + " bytes)");
        }
        final boolean planar = options.isPlanar();
        final ByteBuffer header = ByteBuffer.allocate(HEADER_LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(numberOfSegments);
        final ByteArrayOutputStream segments = new ByteArrayOutputStream();
        final byte[] plane = new byte[numberOfPixels];
        for (int s = 0; s < samplesPerPixel; s++) {
            for (int b = bytesPerSample - 1; b >= 0; b--) {
                for (int p = 0; p < numberOfPixels; p++) {
                    plane[p] = data[byteIndex(p, s, b, numberOfPixels, samplesPerPixel, bytesPerSample, planar)];
                }
                header.putInt(HEADER_LENGTH + segments.size());
                encodeSegment(segments, plane, columns);
            }
        }
        final byte[] result = new byte[HEADER_LENGTH + segments.size()];
        System.arraycopy(header.array(), 0, result, 0, HEADER_LENGTH);
        System.arraycopy(segments.toByteArray(), 0, result, HEADER_LENGTH, segments.size());
        return result;
    }

    @Override
    public byte[] decompress(byte[] data, PixelDataOptions options) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        Objects.requireNonNull(options, "Null codec options");
        final int bitsAllocated = options.bitsAllocated();
        checkBitsAllocated(bitsAllocated);
        final int samplesPerPixel = options.samplesPerPixel();
        final int bytesPerSample = bitsAllocated / 8;
        final int numberOfPixels = options.rows() * options.columns();
        final int[] offsets = parseHeader(data);
        final int numberOfSegments = offsets.length;
        if (numberOfSegments != samplesPerPixel * bytesPerSample) {
            throw new DicomException("The number of RLE segments in the pixel data doesn't match the expected " +
                    "amount (" + samplesPerPixel * bytesPerSample + " vs. " + numberOfSegments + " segments)");
        }
        final boolean planar = options.isPlanar();
        final boolean littleEndianOrder = options.isLittleEndianSegmentOrder();
        final byte[] result = new byte[numberOfPixels * numberOfSegments];
        final byte[] plane = new byte[numberOfPixels + 1];
        for (int i = 0; i < numberOfSegments; i++) {
            final int from = Math.min(offsets[i], data.length);
            final int to = i + 1 < numberOfSegments ? Math.max(from, Math.min(offsets[i + 1], data.length)) :
                    data.length;
            final int decodedLength = decodeSegment(plane, data, from, to);
            if (decodedLength != numberOfPixels && decodedLength != numberOfPixels + 1) {
                throw new DicomException("The amount of decoded RLE segment data doesn't match the expected " +
                        "amount (" + (decodedLength > plane.length ? "more than " + plane.length : decodedLength) +
                        " vs. " + numberOfPixels + " bytes)");
            }
            final int s = i / bytesPerSample;
            final int k = i % bytesPerSample;
            final int b = littleEndianOrder ? k : bytesPerSample - 1 - k;
            for (int p = 0; p < numberOfPixels; p++) {
                result[byteIndex(p, s, b, numberOfPixels, samplesPerPixel, bytesPerSample, planar)] = plane[p];
            }
        }
        return result;
    }

    /**
     * Parses 64-byte RLE header and returns the offsets of the segments.
     *
     * @param data RLE-encoded frame.
     * @return offsets of all segments.
     * @throws DicomException if the header is too short or contains invalid number of segments.
     */
    public static int[] parseHeader(byte[] data) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        if (data.length < HEADER_LENGTH) {
            throw new DicomException("The RLE header must be " + HEADER_LENGTH + " bytes long, but only " +
                    data.length + " bytes are available");
        }
        final ByteBuffer header = ByteBuffer.wrap(data, 0, HEADER_LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        final long numberOfSegments = header.getInt() & 0xFFFFFFFFL;
        if (numberOfSegments > MAX_NUMBER_OF_SEGMENTS) {
            throw new DicomException("The RLE header specifies an invalid number of segments (" +
                    numberOfSegments + ")");
        }
        final int[] result = new int[(int) numberOfSegments];
        for (int i = 0; i < result.length; i++) {
            final long offset = header.getInt() & 0xFFFFFFFFL;
            result[i] = (int) Math.min(offset, Integer.MAX_VALUE);
        }
        return result;
    }

    /**
     * Encodes one row of bytes. Runs of 2 or more identical bytes are always encoded as replicate runs;
     * other bytes are collected into literal runs. No run crosses the row boundary.
     *
     * @param output destination stream.
     * @param src    source bytes.
     * @param from   start of the row.
     * @param to     end of the row (exclusive).
     */
    public static void encodeRow(ByteArrayOutputStream output, byte[] src, int from, int to) {
        Objects.requireNonNull(output, "Null output");
        Objects.requireNonNull(src, "Null src");
        int literalStart = from;
        int pos = from;
        while (pos < to) {
            int groupEnd = pos + 1;
            while (groupEnd < to && src[groupEnd] == src[pos]) {
                groupEnd++;
            }
            if (groupEnd - pos == 1) {
                pos = groupEnd;
                continue;
            }
            writeLiteral(output, src, literalStart, pos);
            for (int k = pos; k < groupEnd; k += MAX_RUN) {
                final int length = Math.min(MAX_RUN, groupEnd - k);
                if (length > 1) {
                    output.write(257 - length);
                } else {
                    output.write(0);
                }
                output.write(src[pos]);
            }
            pos = groupEnd;
            literalStart = pos;
        }
        writeLiteral(output, src, literalStart, to);
    }

    /**
     * Decodes one RLE segment into the destination array. The segment ends at the end of source data;
     * decoding also stops when the destination is filled.
     *
     * @param dest destination array.
     * @param src  encoded data.
     * @param from start of the segment.
     * @param to   end of the segment (exclusive).
     * @return number of decoded bytes; if it is greater than <code>dest.length</code>, the segment
     * contains more data than expected (the extra bytes are not stored).
     */
    public static int decodeSegment(byte[] dest, byte[] src, int from, int to) {
        Objects.requireNonNull(dest, "Null dest");
        Objects.requireNonNull(src, "Null src");
        int srcPos = from;
        int destPos = 0;
        while (srcPos < to) {
            final byte b = src[srcPos++];
            if (b >= 0) {
                // 0 <= b <= 127: literal run
                final int n = Math.min(b + 1, to - srcPos);
                final int stored = Math.max(0, Math.min(n, dest.length - destPos));
                System.arraycopy(src, srcPos, dest, destPos, stored);
                srcPos += n;
                destPos += n;
            } else if (b != -128) {
                // -127 <= b <= -1: replicate run
                if (srcPos >= to) {
                    break;
                }
                final byte repeat = src[srcPos++];
                final int n = 1 - b;
                for (int i = 0; i < n; i++, destPos++) {
                    if (destPos < dest.length) {
                        dest[destPos] = repeat;
                    }
                }
            }
            // b == -128: no operation
            if (destPos > dest.length) {
                return destPos;
            }
        }
        return destPos;
    }

    static void encodeSegment(ByteArrayOutputStream output, byte[] plane, int columns) {
        final int start = output.size();
        for (int from = 0; from < plane.length; from += columns) {
            encodeRow(output, plane, from, Math.min(from + columns, plane.length));
        }
        if ((output.size() - start) % 2 != 0) {
            output.write(0);
        }
    }

    private static void writeLiteral(ByteArrayOutputStream output, byte[] src, int from, int to) {
        for (int k = from; k < to; k += MAX_RUN) {
            final int length = Math.min(MAX_RUN, to - k);
            output.write(length - 1);
            output.write(src, k, length);
        }
    }

    private static int byteIndex(
            int pixel,
            int sample,
            int byteInSample,
            int numberOfPixels,
            int samplesPerPixel,
            int bytesPerSample,
            boolean planar) {
        return planar ?
                (sample * numberOfPixels + pixel) * bytesPerSample + byteInSample :
                (pixel * samplesPerPixel + sample) * bytesPerSample + byteInSample;
    }

    private static void checkBitsAllocated(int bitsAllocated) throws UnsupportedDicomFormatException {
        if (bitsAllocated % 8 != 0) {
            throw new UnsupportedDicomFormatException("Unable to encode or decode RLE pixel data with " +
                    bitsAllocated + " bits allocated: it must be a multiple of 8");
        }
    }
}
