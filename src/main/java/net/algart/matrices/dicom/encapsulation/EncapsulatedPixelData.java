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

import net.algart.matrices.dicom.DicomException;
import net.algart.matrices.dicom.DicomIO;
import net.algart.matrices.dicom.DicomTag;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.Location;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * View of encapsulated pixel data: the value of (7FE0,0010) Pixel Data with undefined length,
 * consisting of the Basic Offset Table item, fragment items and Sequence Delimitation Item.
 *
 * <p>Frames are found by the following rules, in priority order:
 * <ol>
 *     <li>Extended Offset Table, if it is set;</li>
 *     <li>non-empty Basic Offset Table;</li>
 *     <li>a single fragment is a single frame;</li>
 *     <li>one fragment per frame, if the number of fragments is equal to the
 *     {@link #setNumberOfFrames(Integer) number of frames};</li>
 *     <li>all fragments form one frame, if the number of frames is 1;</li>
 *     <li>if there are more fragments than frames, frames are separated by JPEG EOI/EOC marker
 *     <code>FF D9</code> in the last 10 bytes of a fragment.</li>
 * </ol>
 * Without offset tables and without the number of frames, the frame boundaries cannot be determined
 * when there are several fragments, and an exception is thrown.
 *
 * <p>This class reads data directly from the stream and only the bytes that are necessary; it is not thread-safe.
 */
public final class EncapsulatedPixelData {
    static final int EOI_SEARCH_LENGTH = 10;

    private static final System.Logger LOG = System.getLogger(EncapsulatedPixelData.class.getName());
    private static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    private final DataHandle<? extends Location> in;
    private final long start;
    private boolean littleEndian = true;
    private Integer numberOfFrames = null;
    private ExtendedOffsetTable extendedOffsetTable = null;
    private Consumer<String> warningListener = null;

    /**
     * Creates the view of encapsulated data in the stream.
     *
     * @param in    input stream.
     * @param start position of the Basic Offset Table item.
     */
    public EncapsulatedPixelData(DataHandle<? extends Location> in, long start) {
        this.in = Objects.requireNonNull(in, "Null input stream");
        if (start < 0) {
            throw new IllegalArgumentException("Negative start = " + start);
        }
        this.start = start;
    }

    public static EncapsulatedPixelData of(byte[] value) {
        Objects.requireNonNull(value, "Null value");
        return new EncapsulatedPixelData(DicomIO.getBytesHandle(value), 0);
    }

    public DataHandle<? extends Location> stream() {
        return in;
    }

    public long start() {
        return start;
    }

    public boolean isLittleEndian() {
        return littleEndian;
    }

    public EncapsulatedPixelData setLittleEndian(boolean littleEndian) {
        this.littleEndian = littleEndian;
        return this;
    }

    public Integer getNumberOfFrames() {
        return numberOfFrames;
    }

    /**
     * Sets the expected number of frames, usually the value of (0028,0008) Number of Frames.
     * It is necessary for multi-frame data without offset tables.
     *
     * @param numberOfFrames number of frames or {@code null} if unknown.
     * @return a reference to this object.
     */
    public EncapsulatedPixelData setNumberOfFrames(Integer numberOfFrames) {
        if (numberOfFrames != null && numberOfFrames < 0) {
            throw new IllegalArgumentException("Negative number of frames = " + numberOfFrames);
        }
        this.numberOfFrames = numberOfFrames;
        return this;
    }

    public ExtendedOffsetTable getExtendedOffsetTable() {
        return extendedOffsetTable;
    }

    public EncapsulatedPixelData setExtendedOffsetTable(ExtendedOffsetTable extendedOffsetTable) {
        this.extendedOffsetTable = extendedOffsetTable;
        return this;
    }

    public boolean hasExtendedOffsetTable() {
        return extendedOffsetTable != null && extendedOffsetTable.numberOfFrames() > 0;
    }

    public Consumer<String> getWarningListener() {
        return warningListener;
    }

    public EncapsulatedPixelData setWarningListener(Consumer<String> warningListener) {
        this.warningListener = warningListener;
        return this;
    }

    /**
     * Parses the Basic Offset Table item.
     *
     * @return offsets of the first fragment of every frame, measured from the item tag of the first fragment;
     * empty array if the table is empty.
     * @throws IOException if the first item is not (FFFE,E000), its length is not a multiple of 4,
     *                     or in the case of I/O error.
     */
    public long[] basicOffsets() throws IOException {
        in.seek(start);
        checkAvailable(8, "Basic Offset Table item");
        in.setLittleEndian(littleEndian);
        final int tag = readTag();
        if (tag != DicomTag.ITEM) {
            throw new DicomException("Found unexpected tag " + DicomTag.toString(tag) + " instead of " +
                    DicomTag.toString(DicomTag.ITEM) + " when parsing the Basic Offset Table item");
        }
        final long length = in.readInt() & 0xFFFFFFFFL;
        if (length % 4 != 0) {
            throw new DicomException("The length of the Basic Offset Table item is not a multiple of 4");
        }
        checkAvailable(length, "Basic Offset Table");
        final long[] result = new long[(int) (length / 4)];
        for (int i = 0; i < result.length; i++) {
            result[i] = in.readInt() & 0xFFFFFFFFL;
        }
        return result;
    }

    /**
     * Returns the position of the item tag of the first fragment (just after the Basic Offset Table).
     *
     * @return position of the first fragment item.
     * @throws IOException in the case of invalid Basic Offset Table or I/O error.
     */
    public long fragmentsStart() throws IOException {
        final long[] offsets = basicOffsets();
        return start + 8 + 4L * offsets.length;
    }

    /**
     * Finds all fragment items after the Basic Offset Table.
     * The end of the fragments is Sequence Delimitation Item or the end of the stream.
     *
     * @return absolute positions of the item tags of all fragments; the length of the array is the number
     * of fragments.
     * @throws IOException if an item has undefined or truncated length, if an unexpected tag is found,
     *                     or in the case of I/O error.
     */
    public long[] parseFragments() throws IOException {
        return parseFragments(fragmentsStart());
    }

    public int numberOfFragments() throws IOException {
        return parseFragments().length;
    }

    /**
     * Reads all fragments after the Basic Offset Table.
     *
     * @return data of all fragments without item headers.
     * @throws IOException in the case of invalid structure or I/O error.
     */
    public List<byte[]> fragments() throws IOException {
        final List<byte[]> result = new ArrayList<>();
        in.seek(fragmentsStart());
        byte[] fragment;
        while ((fragment = nextFragment(Long.MAX_VALUE)) != null) {
            result.add(fragment);
        }
        return result;
    }

    /**
     * Returns new iterator over all frames. Frames are read lazily.
     *
     * @return new frame iterator.
     */
    public EncapsulatedFrameIterator frameIterator() {
        return new EncapsulatedFrameIterator(this);
    }

    /**
     * Reads all frames.
     *
     * @return list of frame data.
     * @throws IOException if the frame boundaries cannot be determined or in the case of I/O error.
     */
    public List<byte[]> frames() throws IOException {
        final List<byte[]> result = new ArrayList<>();
        final EncapsulatedFrameIterator iterator = frameIterator();
        EncapsulatedFrame frame;
        while ((frame = iterator.nextFrame()) != null) {
            result.add(frame.bytes());
        }
        return result;
    }

    /**
     * Returns the frame with the given index. With offset tables, only the bytes of this frame are read.
     * The stream position is restored after successful reading.
     *
     * @param index index of the frame.
     * @return frame data.
     * @throws IOException if there is no such frame, if the frame boundaries cannot be determined,
     *                     or in the case of I/O error.
     */
    public byte[] getFrame(int index) throws IOException {
        if (index < 0) {
            throw new IllegalArgumentException("Negative frame index = " + index);
        }
        final long savedOffset = in.offset();
        final byte[] result = readFrame(index);
        in.seek(savedOffset);
        return result;
    }

    @Override
    public String toString() {
        return "encapsulated pixel data at position 0x" + Long.toHexString(start) +
                DicomIO.prettyFileName(" in %s", in) +
                (numberOfFrames != null ? ", " + numberOfFrames + " frames expected" : "") +
                (extendedOffsetTable != null ? ", " + extendedOffsetTable : "");
    }

    static boolean hasEndOfImageMarker(byte[] fragment) {
        for (int i = Math.max(0, fragment.length - EOI_SEARCH_LENGTH); i < fragment.length - 1; i++) {
            if (fragment[i] == (byte) 0xFF && fragment[i + 1] == (byte) 0xD9) {
                return true;
            }
        }
        return false;
    }

    long[] parseFragments(long fragmentsStart) throws IOException {
        final long savedOffset = in.offset();
        final List<Long> result = new ArrayList<>();
        in.seek(fragmentsStart);
        in.setLittleEndian(littleEndian);
        while (in.length() - in.offset() >= 4) {
            final long itemOffset = in.offset();
            final int tag = readTag();
            if (tag == DicomTag.ITEM) {
                final long length = readItemLength(itemOffset);
                result.add(itemOffset);
                in.seek(Math.min(in.offset() + length, in.length()));
            } else if (tag == DicomTag.SEQUENCE_DELIMITER) {
                break;
            } else {
                throw unexpectedTag(tag, itemOffset);
            }
        }
        in.seek(savedOffset);
        return result.stream().mapToLong(Long::longValue).toArray();
    }

    // Reads the fragment item at the current position; returns null at the end of fragments.
    byte[] nextFragment(long limit) throws IOException {
        final long itemOffset = in.offset();
        if (itemOffset >= limit || in.length() - itemOffset < 4) {
            return null;
        }
        in.setLittleEndian(littleEndian);
        final int tag = readTag();
        if (tag == DicomTag.SEQUENCE_DELIMITER) {
            if (in.length() - in.offset() >= 4) {
                final long length = in.readInt() & 0xFFFFFFFFL;
                if (length != 0) {
                    warn("Expected 0x00000000 after the Sequence Delimitation Item, found 0x%X, at position 0x%X"
                            .formatted(length, itemOffset + 4));
                }
            }
            return null;
        }
        if (tag != DicomTag.ITEM) {
            throw unexpectedTag(tag, itemOffset);
        }
        final long length = readItemLength(itemOffset);
        final long available = in.length() - in.offset();
        if (length > available) {
            warn("Fragment item at position 0x%X declares length %d, but only %d bytes are available"
                    .formatted(itemOffset, length, available));
        }
        final long actualLength = Math.min(length, available);
        if (actualLength > Integer.MAX_VALUE - 8) {
            throw new DicomException("Too large fragment: " + actualLength + " >= 2^31 bytes");
        }
        final byte[] result = new byte[(int) actualLength];
        in.readFully(result);
        return result;
    }

    void warn(String message) {
        LOG.log(System.Logger.Level.WARNING, message);
        if (warningListener != null) {
            warningListener.accept(message);
        }
    }

    int readTag() throws IOException {
        final int group = in.readShort() & 0xFFFF;
        final int element = in.readShort() & 0xFFFF;
        return (group << 16) | element;
    }

    DicomException indeterminateFrameBoundaries() {
        return new DicomException("Unable to determine the frame boundaries for the encapsulated pixel data " +
                "as there is no Basic or Extended Offset Table and the number of frames has not been supplied");
    }

    private byte[] readFrame(int index) throws IOException {
        final long[] basicOffsets = basicOffsets();
        final long fragmentsStart = in.offset();
        if (hasExtendedOffsetTable()) {
            if (index >= extendedOffsetTable.numberOfFrames()) {
                throw new DicomException("There aren't enough offsets in the Extended Offset Table for " +
                        (index + 1) + " frames");
            }
            return readExtendedOffsetFrame(fragmentsStart, index);
        }
        if (basicOffsets.length > 0) {
            if (index >= basicOffsets.length) {
                throw new DicomException("There aren't enough offsets in the Basic Offset Table for " +
                        (index + 1) + " frames");
            }
            in.seek(fragmentsStart + basicOffsets[index]);
            final long limit = index < basicOffsets.length - 1 ?
                    fragmentsStart + basicOffsets[index + 1] :
                    Long.MAX_VALUE;
            final ByteArrayOutputStream result = new ByteArrayOutputStream();
            byte[] fragment;
            while ((fragment = nextFragment(limit)) != null) {
                result.writeBytes(fragment);
            }
            if (LOGGABLE_DEBUG) {
                LOG.log(System.Logger.Level.DEBUG, "Frame #%d read by Basic Offset Table: %d bytes"
                        .formatted(index, result.size()));
            }
            return result.toByteArray();
        }
        final long[] fragmentOffsets = parseFragments(fragmentsStart);
        final int numberOfFragments = fragmentOffsets.length;
        if (numberOfFragments == 1) {
            if (index == 0) {
                in.seek(fragmentOffsets[0]);
                return nextFragment(Long.MAX_VALUE);
            }
            throw new DicomException("Found 1 frame fragment in the encapsulated pixel data, the index " +
                    index + " is invalid: it must be 0");
        }
        if (numberOfFrames == null || numberOfFrames == 0) {
            throw indeterminateFrameBoundaries();
        }
        if (numberOfFragments == numberOfFrames) {
            if (index >= numberOfFragments) {
                throw new DicomException("Found " + numberOfFragments + " frame fragments in the encapsulated " +
                        "pixel data, an index " + index + " is invalid");
            }
            in.seek(fragmentOffsets[index]);
            return nextFragment(Long.MAX_VALUE);
        }
        in.seek(fragmentsStart);
        if (numberOfFrames == 1) {
            if (index != 0) {
                throw new DicomException("The index must be 0 if the number of frames is 1, but it is " + index);
            }
            final ByteArrayOutputStream result = new ByteArrayOutputStream();
            byte[] fragment;
            while ((fragment = nextFragment(Long.MAX_VALUE)) != null) {
                result.writeBytes(fragment);
            }
            return result.toByteArray();
        }
        final ByteArrayOutputStream frame = new ByteArrayOutputStream();
        int frameIndex = 0;
        byte[] fragment;
        while ((fragment = nextFragment(Long.MAX_VALUE)) != null) {
            frame.writeBytes(fragment);
            if (hasEndOfImageMarker(fragment)) {
                if (frameIndex == index) {
                    return frame.toByteArray();
                }
                frameIndex++;
                frame.reset();
            }
        }
        if (frame.size() > 0 && frameIndex == index) {
            warn("The end of the encapsulated pixel data has been reached but no JPEG EOI/EOC marker " +
                    "was found, the returned frame data may be invalid");
            return frame.toByteArray();
        }
        throw new DicomException("There is insufficient pixel data to contain " + (index + 1) + " frames");
    }

    byte[] readExtendedOffsetFrame(long fragmentsStart, int index) throws IOException {
        final long position = fragmentsStart + extendedOffsetTable.offset(index) + 8;
        final long length = extendedOffsetTable.length(index);
        if (position > in.length() || length > in.length() - position) {
            throw new DicomException("Frame #" + index + " at position 0x" + Long.toHexString(position) +
                    " with length " + length + ", specified by the Extended Offset Table, " +
                    "is out of the stream (" + in.length() + " bytes)");
        }
        if (length > Integer.MAX_VALUE - 8) {
            throw new DicomException("Too large frame #" + index + ": " + length + " >= 2^31 bytes");
        }
        in.seek(position);
        final byte[] result = new byte[(int) length];
        in.readFully(result);
        return result;
    }

    private long readItemLength(long itemOffset) throws IOException {
        if (in.length() - in.offset() < 4) {
            throw new DicomException("Unable to determine the length of the item at offset " + itemOffset +
                    " as the end of the data has been reached - the encapsulated pixel data may be invalid");
        }
        final long length = in.readInt() & 0xFFFFFFFFL;
        if (length == 0xFFFFFFFFL) {
            throw new DicomException("Undefined item length at offset " + (itemOffset + 4) +
                    " when parsing the encapsulated pixel data fragments");
        }
        return length;
    }

    private DicomException unexpectedTag(int tag, long offset) {
        return new DicomException("Unexpected tag " + DicomTag.toString(tag) + " at offset " + offset +
                " when parsing the encapsulated pixel data fragment items");
    }

    private void checkAvailable(long length, String what) throws IOException {
        if (in.length() - in.offset() < length) {
            throw new DicomException("Unexpected end of data while reading " + what + " at position 0x" +
                    Long.toHexString(in.offset()) + ": " + length + " bytes required, but only " +
                    (in.length() - in.offset()) + " available");
        }
    }
}
