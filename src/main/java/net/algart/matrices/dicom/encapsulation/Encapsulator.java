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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds encapsulated pixel data from compressed frames: splits frames into fragments, wraps them into
 * items and adds the Basic Offset Table. All items are encoded in little-endian byte order.
 */
public final class Encapsulator {
    /**
     * Maximal offset, which can be stored in the Basic Offset Table.
     */
    public static final long MAX_BASIC_OFFSET = 0xFFFFFFFFL;

    private static final byte[] ITEM_TAG = {(byte) 0xFE, (byte) 0xFF, 0x00, (byte) 0xE0};
    private static final byte[] SEQUENCE_DELIMITER = {
            (byte) 0xFE, (byte) 0xFF, (byte) 0xDD, (byte) 0xE0, 0, 0, 0, 0};

    /**
     * Encapsulated frames together with the Extended Offset Table.
     *
     * @param pixelData           encapsulated value with empty Basic Offset Table.
     * @param extendedOffsetTable offsets and lengths of the frames.
     */
    public record Extended(byte[] pixelData, ExtendedOffsetTable extendedOffsetTable) {
        public Extended {
            Objects.requireNonNull(pixelData, "Null pixel data");
            Objects.requireNonNull(extendedOffsetTable, "Null extended offset table");
        }
    }

    private Encapsulator() {
    }

    /**
     * Splits the frame into the given number of fragments. All fragments have even length;
     * the fragment containing the end of the frame is padded with zero byte if necessary,
     * and the fragments after it (if any) are empty.
     *
     * @param frame             frame data.
     * @param numberOfFragments number of fragments, &ge;1.
     * @return list of fragments.
     * @throws IllegalArgumentException if the number of fragments is not positive or too large
     *                                  (the minimal fragment length is 2 bytes).
     */
    public static List<byte[]> fragmentFrame(byte[] frame, int numberOfFragments) {
        Objects.requireNonNull(frame, "Null frame");
        if (numberOfFragments <= 0) {
            throw new IllegalArgumentException("Zero or negative number of fragments = " + numberOfFragments);
        }
        final int frameLength = frame.length;
        if (numberOfFragments > (frameLength + 1) / 2.0) {
            throw new IllegalArgumentException("Too many fragments requested (the minimum fragment size is " +
                    "2 bytes): " + numberOfFragments + " fragments for " + frameLength + " bytes");
        }
        int length = (frameLength + numberOfFragments - 1) / numberOfFragments;
        length += length & 1;
        final List<byte[]> result = new ArrayList<>(numberOfFragments);
        for (int k = 0; k < numberOfFragments; k++) {
            final int offset = (int) Math.min((long) k * length, frameLength);
            final int fragmentLength = Math.min(length, frameLength - offset);
            // trailing fragments may be shorter, or even empty, when the frame is exhausted
            final byte[] fragment = new byte[fragmentLength + (fragmentLength & 1)];
            System.arraycopy(frame, offset, fragment, 0, fragmentLength);
            result.add(fragment);
        }
        return result;
    }

    /**
     * Returns the fragment, wrapped into an item: tag (FFFE,E000), 4-byte length, data.
     *
     * @param fragment fragment data.
     * @return the item.
     */
    public static byte[] itemizeFragment(byte[] fragment) {
        Objects.requireNonNull(fragment, "Null fragment");
        final byte[] result = new byte[8 + fragment.length];
        System.arraycopy(ITEM_TAG, 0, result, 0, 4);
        ByteBuffer.wrap(result, 4, 4).order(ByteOrder.LITTLE_ENDIAN).putInt(fragment.length);
        System.arraycopy(fragment, 0, result, 8, fragment.length);
        return result;
    }

    public static List<byte[]> itemizeFrame(byte[] frame, int numberOfFragments) {
        final List<byte[]> result = new ArrayList<>();
        for (byte[] fragment : fragmentFrame(frame, numberOfFragments)) {
            result.add(itemizeFragment(fragment));
        }
        return result;
    }

    public static byte[] encapsulate(List<byte[]> frames) {
        return encapsulate(frames, 1, true);
    }

    /**
     * Returns encapsulated frames: the Basic Offset Table item followed by the fragment items.
     * Sequence Delimitation Item is not added: it is a part of undefined-length element encoding,
     * see {@link #appendSequenceDelimiter(byte[])}.
     *
     * @param frames            compressed frames.
     * @param fragmentsPerFrame number of fragments for every frame.
     * @param hasBasicOffsetTable  whether to fill the Basic Offset Table; if <code>false</code>, it will be empty.
     * @return encapsulated pixel data.
     * @throws IllegalArgumentException if the offsets cannot be stored in the Basic Offset Table
     *                                  (use {@link #encapsulateExtended(List)} in this case).
     */
    public static byte[] encapsulate(List<byte[]> frames, int fragmentsPerFrame, boolean hasBasicOffsetTable) {
        Objects.requireNonNull(frames, "Null frames");
        final int numberOfFrames = frames.size();
        if (hasBasicOffsetTable) {
            final long[] lengths = new long[numberOfFrames];
            for (int i = 0; i < numberOfFrames; i++) {
                lengths[i] = Objects.requireNonNull(frames.get(i), "Null frame #" + i).length;
            }
            checkBasicOffsetTableLimit(lengths);
        }
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        final int tableLength = hasBasicOffsetTable ? 4 * numberOfFrames : 0;
        final ByteBuffer table = ByteBuffer.allocate(8 + tableLength).order(ByteOrder.LITTLE_ENDIAN);
        table.put(ITEM_TAG).putInt(tableLength);
        long offset = 0;
        final ByteArrayOutputStream items = new ByteArrayOutputStream();
        for (byte[] frame : frames) {
            if (hasBasicOffsetTable) {
                table.putInt((int) offset);
            }
            for (byte[] item : itemizeFrame(frame, fragmentsPerFrame)) {
                items.writeBytes(item);
                offset += item.length;
            }
        }
        output.writeBytes(table.array());
        output.writeBytes(items.toByteArray());
        return output.toByteArray();
    }

    /**
     * Returns encapsulated frames with empty Basic Offset Table, one fragment per frame,
     * and the corresponding Extended Offset Table.
     *
     * @param frames compressed frames.
     * @return encapsulated data and Extended Offset Table.
     */
    public static Extended encapsulateExtended(List<byte[]> frames) {
        Objects.requireNonNull(frames, "Null frames");
        final int numberOfFrames = frames.size();
        final long[] offsets = new long[numberOfFrames];
        final long[] lengths = new long[numberOfFrames];
        long offset = 0;
        for (int i = 0; i < numberOfFrames; i++) {
            final int length = Objects.requireNonNull(frames.get(i), "Null frame #" + i).length;
            lengths[i] = length + length % 2;
            offsets[i] = offset;
            offset += lengths[i] + 8;
        }
        return new Extended(encapsulate(frames, 1, false), new ExtendedOffsetTable(offsets, lengths));
    }

    /**
     * Returns the encapsulated data, terminated by Sequence Delimitation Item.
     *
     * @param encapsulated result of {@link #encapsulate(List, int, boolean)}.
     * @return the data with the delimiter.
     */
    public static byte[] appendSequenceDelimiter(byte[] encapsulated) {
        Objects.requireNonNull(encapsulated, "Null encapsulated data");
        final byte[] result = new byte[encapsulated.length + SEQUENCE_DELIMITER.length];
        System.arraycopy(encapsulated, 0, result, 0, encapsulated.length);
        System.arraycopy(SEQUENCE_DELIMITER, 0, result, encapsulated.length, SEQUENCE_DELIMITER.length);
        return result;
    }

    /**
     * Checks that the offsets of the frames with the given lengths can be stored in the Basic Offset Table.
     *
     * @param frameLengths lengths of all frames.
     * @throws IllegalArgumentException if the total length of all frames, except the last one, with their
     *                                  item headers exceeds 2<sup>32</sup>&minus;1.
     */
    public static void checkBasicOffsetTableLimit(long[] frameLengths) {
        Objects.requireNonNull(frameLengths, "Null frame lengths");
        if (frameLengths.length == 0) {
            return;
        }
        long total = 8L * (frameLengths.length - 1);
        for (int i = 0; i < frameLengths.length - 1; i++) {
            total += frameLengths[i];
        }
        if (total > MAX_BASIC_OFFSET) {
            throw new IllegalArgumentException("The total length of the encapsulated frame data (" + total +
                    " bytes) will be greater than the maximum allowed by the Basic Offset Table (" +
                    MAX_BASIC_OFFSET + " bytes), it's recommended that you use the Extended Offset Table " +
                    "instead (see encapsulateExtended method)");
        }
    }
}
