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

import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.Location;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reader of DICOM data elements: decodes one element at a time from a seekable byte stream
 * in the given encoding (implicit or explicit VR, little or big endian).
 *
 * <p>Sequences (VR {@link DicomVR#SQ}) are parsed recursively by the {@link DicomDatasetReader},
 * linked with this object. Values, which are longer than {@link DicomReadingOptions#getDeferSize()},
 * are not loaded: the returned element is <i>deferred</i> and can be loaded later by
 * {@link #materialize(DicomElement)}.
 *
 * <p>This class is not thread-safe: it uses the current position of the stream.
 */
public final class DicomStreamReader {
    /**
     * The reason why the last call of {@link #readElement(boolean, boolean, DicomDataset)}
     * returned {@code null}.
     */
    public enum Termination {
        /**
         * The last call returned an element.
         */
        NONE,
        END_OF_DATA,
        /**
         * Item Delimitation Item (FFFE,E00D) was read; the stream is positioned after it.
         */
        ITEM_DELIMITER,
        /**
         * Sequence Delimitation Item (FFFE,E0DD) was found where a data element was expected;
         * the stream is positioned at its start.
         */
        SEQUENCE_DELIMITER,
        /**
         * The stop condition fired; the stream is positioned at the start of the element header.
         */
        STOP_CONDITION
    }

    static final int SCAN_CHUNK_SIZE = 8192;
    private static final int SCAN_REWIND = 3;

    private static final System.Logger LOG = System.getLogger(DicomStreamReader.class.getName());
    private static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);
    private static final boolean LOGGABLE_TRACE = LOG.isLoggable(System.Logger.Level.TRACE);

    final DataHandle<? extends Location> in;
    final DicomReadingOptions options;
    private final DicomDatasetReader datasetReader;
    private Termination termination = Termination.NONE;

    /**
     * Creates new reader.
     *
     * @param in      input stream.
     * @param options reading options; they are cloned, so further changes in this object do not
     *                affect this reader.
     */
    public DicomStreamReader(DataHandle<? extends Location> in, DicomReadingOptions options) {
        this.in = Objects.requireNonNull(in, "Null input stream");
        this.options = Objects.requireNonNull(options, "Null options").clone();
        this.datasetReader = new DicomDatasetReader(this);
    }

    DicomStreamReader(
            DataHandle<? extends Location> in,
            DicomReadingOptions options,
            DicomDatasetReader datasetReader) {
        this.in = Objects.requireNonNull(in, "Null input stream");
        this.options = Objects.requireNonNull(options, "Null options").clone();
        this.datasetReader = Objects.requireNonNull(datasetReader);
    }

    public DataHandle<? extends Location> stream() {
        return in;
    }

    public DicomReadingOptions options() {
        return options.clone();
    }

    public DicomDatasetReader datasetReader() {
        return datasetReader;
    }

    public Termination termination() {
        return termination;
    }

    /**
     * Reads all elements until the end of data, a delimiter, or the stop condition.
     * Specific Character Set (0008,0005) is converted immediately, and the resulting charsets are used
     * for sequences, nested in the following elements.
     *
     * @param implicitVR   whether the elements are encoded with implicit VR.
     * @param littleEndian whether the elements are encoded in little-endian byte order.
     * @return list of elements in the order of the stream.
     * @throws IOException in the case of any problem with reading or malformed stream in
     *                     {@link DicomValidationMode#RAISE} mode.
     */
    public List<DicomElement> readElements(boolean implicitVR, boolean littleEndian) throws IOException {
        final DicomDataset scope = new DicomDataset(implicitVR, littleEndian);
        final List<DicomElement> result = new ArrayList<>();
        DicomElement element;
        while ((element = readElement(implicitVR, littleEndian, scope)) != null) {
            if (element.tag() == DicomTag.SPECIFIC_CHARACTER_SET && element.hasValue()) {
                final List<String> terms = DicomCharacterSets.parseTerms(element.value());
                scope.setCharacterSets(terms, DicomCharacterSets.toCharsets(terms, options));
            }
            result.add(element);
        }
        return result;
    }

    /**
     * Reads the next data element, starting from the current position of the stream.
     * Returns {@code null} at the end of data, after Item Delimitation Item, before Sequence Delimitation Item
     * or when the stop condition fires; the reason is available via {@link #termination()}.
     * Elements, not included into {@link DicomReadingOptions#getSpecificTags() specific tags}, are skipped.
     *
     * @param implicitVR   whether the element is encoded with implicit VR.
     * @param littleEndian whether the element is encoded in little-endian byte order.
     * @param scope        the dataset, being assembled; nested sequence items inherit its character set.
     * @return the element or {@code null}.
     * @throws IOException in the case of any problem with reading or malformed stream in
     *                     {@link DicomValidationMode#RAISE} mode.
     */
    public DicomElement readElement(boolean implicitVR, boolean littleEndian, DicomDataset scope)
            throws IOException {
        Objects.requireNonNull(scope, "Null scope dataset");
        termination = Termination.NONE;
        while (true) {
            final long start = in.offset();
            final long available = in.length() - start;
            if (available < 8) {
                if (available > 0) {
                    options.report(LOG, "Truncated data element header at offset 0x%X: only %d bytes left"
                            .formatted(start, available));
                    in.seek(in.length());
                }
                termination = Termination.END_OF_DATA;
                return null;
            }
            final byte[] header = new byte[8];
            in.readFully(header);
            final ByteBuffer bb = ByteBuffer.wrap(header).order(byteOrder(littleEndian));
            final int tag = ((bb.getShort(0) & 0xFFFF) << 16) | (bb.getShort(2) & 0xFFFF);
            boolean elementImplicitVR = implicitVR;
            DicomVR vr = null;
            long length;
            if (implicitVR) {
                length = bb.getInt(4) & 0xFFFFFFFFL;
            } else {
                final boolean letters = DicomVR.isLetterPair(header[4], header[5]);
                final Optional<DicomVR> knownVR = letters ?
                        DicomVR.fromCode(new String(header, 4, 2, StandardCharsets.US_ASCII)) :
                        Optional.empty();
                if (knownVR.isPresent()) {
                    vr = knownVR.get();
                    if (vr.isLongForm()) {
                        if (in.length() - in.offset() < 4) {
                            options.report(LOG, "Truncated data element header of " + DicomTag.toString(tag) +
                                    " at offset 0x%X: no 4-byte length".formatted(start));
                            in.seek(in.length());
                            termination = Termination.END_OF_DATA;
                            return null;
                        }
                        in.setLittleEndian(littleEndian);
                        length = in.readInt() & 0xFFFFFFFFL;
                    } else {
                        length = bb.getShort(6) & 0xFFFF;
                    }
                } else if (!letters && options.isAssumeImplicitVRSwitch()) {
                    LOG.log(System.Logger.Level.DEBUG, () -> "Unknown VR '0x%02X%02X' of %s at offset 0x%X, assuming implicit VR encoding"
                            .formatted(header[4] & 0xFF, header[5] & 0xFF, DicomTag.toString(tag), start));
                    elementImplicitVR = true;
                    length = bb.getInt(4) & 0xFFFFFFFFL;
                } else {
                    LOG.log(System.Logger.Level.DEBUG, () -> "Unknown VR '%s' of %s at offset 0x%X, assuming explicit VR encoding with 2-byte length"
                            .formatted(new String(header, 4, 2, StandardCharsets.ISO_8859_1),
                                    DicomTag.toString(tag), start));
                    length = bb.getShort(6) & 0xFFFF;
                }
            }
            if (elementImplicitVR) {
                vr = options.getVRLookup().vr(tag).orElse(null);
            }
            final long valueOffset = in.offset();
            if (LOGGABLE_TRACE) {
                final boolean implicit = elementImplicitVR;
                final DicomVR v = vr;
                final long len = length;
                LOG.log(System.Logger.Level.TRACE, () -> "%08X: %s %s%s".formatted(
                        start, DicomTag.toString(tag),
                        implicit ? "" : (v == null ? "?? " : v.name() + " "),
                        len == DicomElement.UNDEFINED_LENGTH ? "undefined length" : "length " + len));
            }

            if (tag == DicomTag.ITEM_DELIMITER) {
                if (length != 0) {
                    options.report(LOG, "Expected 0x00000000 after item delimiter, found 0x%X, at position 0x%X"
                            .formatted(length, valueOffset - 4));
                }
                termination = Termination.ITEM_DELIMITER;
                return null;
            }
            if (tag == DicomTag.SEQUENCE_DELIMITER) {
                in.seek(start);
                options.report(LOG, "Unexpected sequence delimiter " + DicomTag.toString(tag) +
                        " at offset 0x%X instead of a data element or an item delimiter".formatted(start));
                termination = Termination.SEQUENCE_DELIMITER;
                return null;
            }
            final DicomReadingOptions.StopCondition stopCondition = options.getStopCondition();
            if (stopCondition != null && stopCondition.stop(tag, vr, length)) {
                in.seek(valueOffset - DicomVR.headerLength(vr, elementImplicitVR));
                if (LOGGABLE_DEBUG) {
                    LOG.log(System.Logger.Level.DEBUG, "Reading ended by stop condition at " +
                            DicomTag.toString(tag) + ", rewinding to 0x" + Long.toHexString(in.offset()));
                }
                termination = Termination.STOP_CONDITION;
                return null;
            }
            final boolean requested = options.isTagRequested(tag);

            if (length != DicomElement.UNDEFINED_LENGTH) {
                if (!requested) {
                    skip(valueOffset, length, tag);
                    continue;
                }
                if (vr == DicomVR.SQ) {
                    final DicomSequence sequence = datasetReader.readSequence(
                            elementImplicitVR, littleEndian, length, scope);
                    final long end = valueOffset + length;
                    if (in.offset() != end && end <= in.length()) {
                        in.seek(end);
                    }
                    return new DicomElement(tag, vr, length, valueOffset, null, sequence,
                            elementImplicitVR, littleEndian);
                }
                final byte[] value;
                if (options.hasDeferSize() && length > options.getDeferSize()
                        && tag != DicomTag.SPECIFIC_CHARACTER_SET) {
                    if (LOGGABLE_DEBUG) {
                        LOG.log(System.Logger.Level.DEBUG, "Defer size exceeded for " + DicomTag.toString(tag) +
                                " (" + length + " bytes), skipping to the next element");
                    }
                    skip(valueOffset, length, tag);
                    value = null;
                } else {
                    value = readValue(valueOffset, length, tag);
                }
                return new DicomElement(tag, vr, length, valueOffset, value, null, elementImplicitVR, littleEndian);
            }

            if (vr == DicomVR.UN && options.isInferSequenceForUN()) {
                vr = DicomVR.SQ;
            }
            if (vr == null && in.length() - in.offset() >= 4) {
                in.setLittleEndian(littleEndian);
                final int nextTag = readTag();
                in.seek(valueOffset);
                if (nextTag == DicomTag.ITEM) {
                    vr = DicomVR.SQ;
                }
            }
            if (vr == DicomVR.SQ) {
                if (LOGGABLE_DEBUG) {
                    LOG.log(System.Logger.Level.DEBUG, "%08X: Reading undefined length sequence %s"
                            .formatted(valueOffset, DicomTag.toString(tag)));
                }
                final DicomSequence sequence = datasetReader.readSequence(
                        elementImplicitVR, littleEndian, DicomElement.UNDEFINED_LENGTH, scope);
                if (!requested) {
                    continue;
                }
                return new DicomElement(tag, vr, length, valueOffset, null, sequence,
                        elementImplicitVR, littleEndian);
            }
            final byte[] value = readUndefinedLengthValue(littleEndian, options.getDeferSize());
            if (!requested) {
                continue;
            }
            return new DicomElement(tag, vr, length, valueOffset, value, null, elementImplicitVR, littleEndian);
        }
    }

    /**
     * Loads the value of the deferred element. The element header is re-read from the stream at
     * the position <code>element.valueOffset() - element.headerLength()</code> and must match
     * the tag and VR of the given element. The current stream position is preserved.
     *
     * @param element the deferred element; if it is not deferred, it is returned as-is.
     * @return the same element with loaded value.
     * @throws IOException if the stream was modified since reading or in the case of I/O error.
     */
    public DicomElement materialize(DicomElement element) throws IOException {
        Objects.requireNonNull(element, "Null element");
        if (!element.isDeferred()) {
            return element;
        }
        if (element.valueOffset() < 0) {
            throw new IllegalArgumentException("Element " + element + " was not read from a stream");
        }
        final DicomReadingOptions materializingOptions = options.clone()
                .setDeferSize(DicomReadingOptions.NO_DEFER)
                .setStopCondition(null)
                .setSpecificTags(null);
        final DicomStreamReader reader = new DicomStreamReader(in, materializingOptions);
        final long savedOffset = in.offset();
        try {
            in.seek(element.valueOffset() - element.headerLength());
            final DicomElement result = reader.readElement(
                    element.isImplicitVR(), element.isLittleEndian(), new DicomDataset());
            if (result == null) {
                throw new DicomException("Cannot re-read deferred element " + element +
                        ": " + reader.termination());
            }
            if (result.tag() != element.tag()) {
                throw new DicomException("Deferred read tag " + DicomTag.toString(result.tag()) +
                        " does not match original " + DicomTag.toString(element.tag()));
            }
            if (result.vr() != element.vr()) {
                throw new DicomException("Deferred read VR " + result.vr() +
                        " does not match original " + element.vr());
            }
            return result;
        } finally {
            in.seek(savedOffset);
        }
    }

    /**
     * Reads the value of undefined length, which is not a sequence, starting from the current position.
     * First, the value is parsed as a chain of items, terminated by Sequence Delimitation Item
     * (encapsulated pixel data). If it fails, the stream is scanned for the bytes of the
     * Sequence Delimitation tag. After this method, the stream is positioned after the delimiter
     * and its 4-byte length.
     *
     * @param littleEndian byte order.
     * @param deferSize    if non-negative and the value is longer, the value is not returned.
     * @return value bytes (without the delimiter) or {@code null} if the value is deferred.
     * @throws IOException in the case of I/O error; {@link EOFException} if there is no delimiter.
     */
    public byte[] readUndefinedLengthValue(boolean littleEndian, long deferSize) throws IOException {
        final long dataStart = in.offset();
        final long encapsulatedLength = encapsulatedValueLength(littleEndian);
        if (encapsulatedLength >= 0) {
            final long end = in.offset();
            if (deferSize >= 0 && encapsulatedLength > deferSize) {
                return null;
            }
            in.seek(dataStart);
            final byte[] result = readBytes(encapsulatedLength);
            in.seek(end);
            return result;
        }
        return scanForSequenceDelimiter(littleEndian, deferSize);
    }

    static ByteOrder byteOrder(boolean littleEndian) {
        return littleEndian ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
    }

    static byte[] tagBytes(int tag, boolean littleEndian) {
        return ByteBuffer.allocate(4).order(byteOrder(littleEndian))
                .putShort((short) (tag >>> 16))
                .putShort((short) tag)
                .array();
    }

    int readTag() throws IOException {
        final int group = in.readShort() & 0xFFFF;
        final int element = in.readShort() & 0xFFFF;
        return (group << 16) | element;
    }

    // Returns the length of the value before the delimiter or -1 if it is not a correct chain of items.
    private long encapsulatedValueLength(boolean littleEndian) throws IOException {
        final long dataStart = in.offset();
        final long streamLength = in.length();
        in.setLittleEndian(littleEndian);
        while (true) {
            final long position = in.offset();
            if (streamLength - position < 4) {
                LOG.log(System.Logger.Level.DEBUG, () -> ("End of input encountered while parsing undefined length " +
                        "value as encapsulated pixel data. Unable to find tag at position 0x%X. " +
                        "Falling back to byte by byte scan.").formatted(position));
                in.seek(dataStart);
                return -1;
            }
            final int tag = readTag();
            if (tag == DicomTag.SEQUENCE_DELIMITER) {
                final long valueLength = position - dataStart;
                if (streamLength - in.offset() >= 4) {
                    final long length = in.readInt() & 0xFFFFFFFFL;
                    if (length != 0) {
                        LOG.log(System.Logger.Level.DEBUG, () ->
                                "Expected 4 zero bytes after undefined length delimiter at position 0x%X, found 0x%X"
                                        .formatted(position + 4, length));
                    }
                } else {
                    in.seek(streamLength);
                }
                return valueLength;
            }
            if (tag != DicomTag.ITEM) {
                LOG.log(System.Logger.Level.DEBUG, () -> ("Unknown tag %s at position 0x%X found while parsing " +
                        "undefined length value as encapsulated pixel data. Falling back to byte by byte scan.")
                        .formatted(DicomTag.toString(tag), position));
                in.seek(dataStart);
                return -1;
            }
            if (streamLength - in.offset() < 4) {
                LOG.log(System.Logger.Level.DEBUG, () -> ("End of input encountered while parsing undefined length " +
                        "value as encapsulated pixel data. Unable to find length for item at position 0x%X. " +
                        "Falling back to byte by byte scan.").formatted(position));
                in.seek(dataStart);
                return -1;
            }
            final long length = in.readInt() & 0xFFFFFFFFL;
            if (in.offset() + length > streamLength) {
                LOG.log(System.Logger.Level.DEBUG, () -> ("Too long length 0x%X of the item at position 0x%X " +
                        "found while parsing undefined length value as encapsulated pixel data. " +
                        "Falling back to byte by byte scan.").formatted(length, position));
                in.seek(dataStart);
                return -1;
            }
            in.seek(in.offset() + length);
        }
    }

    private byte[] scanForSequenceDelimiter(boolean littleEndian, long deferSize) throws IOException {
        final long dataStart = in.offset();
        final byte[] delimiter = tagBytes(DicomTag.SEQUENCE_DELIMITER, littleEndian);
        final byte[] chunk = new byte[SCAN_CHUNK_SIZE];
        long chunkStart = dataStart;
        while (true) {
            in.seek(chunkStart);
            final int bytesRead = (int) Math.min(SCAN_CHUNK_SIZE, in.length() - chunkStart);
            in.readFully(chunk, 0, bytesRead);
            final int index = indexOf(chunk, bytesRead, delimiter);
            if (index >= 0) {
                final long delimiterOffset = chunkStart + index;
                in.seek(delimiterOffset + 4);
                if (in.length() - in.offset() >= 4) {
                    final byte[] lengthBytes = new byte[4];
                    in.readFully(lengthBytes);
                    if (lengthBytes[0] != 0 || lengthBytes[1] != 0 || lengthBytes[2] != 0 || lengthBytes[3] != 0) {
                        LOG.log(System.Logger.Level.ERROR, "Expected 4 zero bytes after undefined length " +
                                "delimiter at position 0x" + Long.toHexString(delimiterOffset + 4));
                    }
                } else {
                    in.seek(in.length());
                }
                final long valueLength = delimiterOffset - dataStart;
                if (deferSize >= 0 && valueLength >= deferSize) {
                    return null;
                }
                final long end = in.offset();
                in.seek(dataStart);
                final byte[] result = readBytes(valueLength);
                in.seek(end);
                return result;
            }
            if (bytesRead < SCAN_CHUNK_SIZE) {
                in.seek(dataStart);
                throw new EOFException("End of file reached before delimiter " +
                        DicomTag.toString(DicomTag.SEQUENCE_DELIMITER) + " found");
            }
            chunkStart += SCAN_CHUNK_SIZE - SCAN_REWIND;
        }
    }

    private byte[] readValue(long valueOffset, long length, int tag) throws IOException {
        final long available = in.length() - valueOffset;
        if (length > available) {
            options.report(LOG, "Data element " + DicomTag.toString(tag) +
                    " at offset 0x%X declares length %d, but only %d bytes are available"
                            .formatted(valueOffset, length, available));
            return readBytes(available);
        }
        return readBytes(length);
    }

    private void skip(long valueOffset, long length, int tag) throws IOException {
        final long end = valueOffset + length;
        if (end > in.length()) {
            options.report(LOG, "Data element " + DicomTag.toString(tag) +
                    " at offset 0x%X declares length %d, but only %d bytes are available"
                            .formatted(valueOffset, length, in.length() - valueOffset));
            in.seek(in.length());
        } else {
            in.seek(end);
        }
    }

    private byte[] readBytes(long length) throws IOException {
        if (length > Integer.MAX_VALUE - 8) {
            throw new DicomException("Too large DICOM value: " + length + " >= 2^31 bytes");
        }
        final byte[] result = new byte[(int) length];
        in.readFully(result);
        return result;
    }

    private static int indexOf(byte[] data, int length, byte[] pattern) {
        final int last = length - pattern.length;
        for (int i = 0; i <= last; i++) {
            boolean found = true;
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    found = false;
                    break;
                }
            }
            if (found) {
                return i;
            }
        }
        return -1;
    }
}
