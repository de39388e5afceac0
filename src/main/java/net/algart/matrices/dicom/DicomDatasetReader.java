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
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Assembler of DICOM datasets: drives {@link DicomStreamReader} to build a tree of data elements
 * and sequences, detecting the actual VR encoding and propagating the Specific Character Set
 * into nested sequence items.
 *
 * <p>This class is not thread-safe: it uses the current position of the stream.
 */
public final class DicomDatasetReader {
    /**
     * Special value of the byte length for {@link #readDataset(boolean, boolean, long)}:
     * the dataset is read until the end of data, a delimiter or the stop condition.
     */
    public static final long UNLIMITED = -1;

    private static final System.Logger LOG = System.getLogger(DicomDatasetReader.class.getName());
    private static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    private final DicomStreamReader streamReader;
    private final DataHandle<? extends Location> in;
    private final DicomReadingOptions options;

    /**
     * Creates new reader.
     *
     * @param in      input stream.
     * @param options reading options; they are cloned.
     */
    public DicomDatasetReader(DataHandle<? extends Location> in, DicomReadingOptions options) {
        this.streamReader = new DicomStreamReader(in, options, this);
        this.in = streamReader.in;
        this.options = streamReader.options;
    }

    DicomDatasetReader(DicomStreamReader streamReader) {
        this.streamReader = streamReader;
        this.in = streamReader.in;
        this.options = streamReader.options;
    }

    public DicomStreamReader streamReader() {
        return streamReader;
    }

    public DataHandle<? extends Location> stream() {
        return in;
    }

    /**
     * Reads top-level dataset until the end of data, Item Delimitation Item or the stop condition.
     *
     * @param implicitVR   assumed VR encoding; it is checked by {@link #isImplicitVR(boolean, boolean, boolean)}.
     * @param littleEndian byte order.
     * @return new dataset.
     * @throws IOException in the case of any problem with reading or malformed stream in
     *                     {@link DicomValidationMode#RAISE} mode.
     */
    public DicomDataset readDataset(boolean implicitVR, boolean littleEndian) throws IOException {
        return readDataset(implicitVR, littleEndian, UNLIMITED, null, true);
    }

    public DicomDataset readDataset(boolean implicitVR, boolean littleEndian, long byteLength) throws IOException {
        return readDataset(implicitVR, littleEndian, byteLength, null, true);
    }

    /**
     * Reads a dataset starting from the current position of the stream.
     *
     * @param implicitVR   assumed VR encoding.
     * @param littleEndian byte order.
     * @param byteLength   number of bytes to read or {@link #UNLIMITED}.
     * @param parent       parent dataset, from which the character set is inherited;
     *                     may be {@code null} (default repertoire).
     * @param topLevel     <code>false</code> for sequence items: then implicit VR is accepted
     *                     without warnings.
     * @return new dataset.
     * @throws IOException in the case of any problem with reading or malformed stream in
     *                     {@link DicomValidationMode#RAISE} mode.
     */
    public DicomDataset readDataset(
            boolean implicitVR,
            boolean littleEndian,
            long byteLength,
            DicomDataset parent,
            boolean topLevel) throws IOException {
        if (byteLength < 0 && byteLength != UNLIMITED) {
            throw new IllegalArgumentException("Negative byteLength = " + byteLength);
        }
        final long start = in.offset();
        final boolean actualImplicitVR = isImplicitVR(implicitVR, littleEndian, !topLevel);
        final DicomDataset result = new DicomDataset(actualImplicitVR, littleEndian);
        if (parent != null) {
            result.setCharacterSets(parent.getCharacterSetTerms(), parent.getCharsets());
        }
        try {
            while (byteLength == UNLIMITED || in.offset() - start < byteLength) {
                final DicomElement element = streamReader.readElement(actualImplicitVR, littleEndian, result);
                if (element == null) {
                    break;
                }
                if (element.tag() == DicomTag.SPECIFIC_CHARACTER_SET && element.hasValue()) {
                    final List<String> terms = DicomCharacterSets.parseTerms(element.value());
                    result.setCharacterSets(terms, DicomCharacterSets.toCharsets(terms, options));
                }
                final DicomElement previous = result.put(element);
                if (previous != null) {
                    options.report(LOG, "Duplicate data element " + DicomTag.toString(element.tag()) +
                            " at offset 0x" + Long.toHexString(element.valueOffset()) +
                            ": the previous value is replaced");
                }
            }
        } catch (EOFException e) {
            final String message = e.getMessage() + DicomIO.prettyFileName(" in file %s", in);
            if (options.getValidationMode().isException()) {
                throw new DicomException(message, e);
            }
            options.warn(LOG, message);
        }
        return result;
    }

    /**
     * Reads the sequence value, starting from the current position (the first item).
     *
     * @param implicitVR   VR encoding of the items.
     * @param littleEndian byte order.
     * @param length       declared length of the sequence or {@link DicomElement#UNDEFINED_LENGTH}.
     * @param parent       dataset, containing the sequence element; may be {@code null}.
     * @return new sequence.
     * @throws IOException in the case of any problem with reading or malformed stream in
     *                     {@link DicomValidationMode#RAISE} mode.
     */
    public DicomSequence readSequence(boolean implicitVR, boolean littleEndian, long length, DicomDataset parent)
            throws IOException {
        final boolean undefinedLength = length == DicomElement.UNDEFINED_LENGTH;
        final DicomSequence result = new DicomSequence(undefinedLength);
        if (length == 0) {
            return result;
        }
        final long start = in.offset();
        while (undefinedLength || in.offset() - start < length) {
            final DicomDataset item = readSequenceItem(implicitVR, littleEndian, parent);
            if (item == null) {
                break;
            }
            result.add(item);
        }
        return result;
    }

    /**
     * Reads one sequence item, starting from the current position (Item tag).
     *
     * @param implicitVR   VR encoding of the item.
     * @param littleEndian byte order.
     * @param parent       dataset, containing the sequence element; may be {@code null}.
     * @return new item or {@code null} if Sequence Delimitation Item was read (or there is no more data).
     * @throws IOException in the case of any problem with reading or malformed stream in
     *                     {@link DicomValidationMode#RAISE} mode.
     */
    public DicomDataset readSequenceItem(boolean implicitVR, boolean littleEndian, DicomDataset parent)
            throws IOException {
        final long itemOffset = in.offset();
        if (in.length() - itemOffset < 8) {
            options.report(LOG, "No tag to read at file position 0x%X".formatted(itemOffset));
            in.seek(in.length());
            return null;
        }
        in.setLittleEndian(littleEndian);
        final int tag = streamReader.readTag();
        final long length = in.readInt() & 0xFFFFFFFFL;
        if (tag == DicomTag.SEQUENCE_DELIMITER) {
            if (LOGGABLE_DEBUG) {
                LOG.log(System.Logger.Level.DEBUG, "%08X: End of sequence".formatted(itemOffset));
            }
            if (length != 0) {
                options.report(LOG, "Expected 0x00000000 after delimiter, found 0x%X, at position 0x%X"
                        .formatted(length, itemOffset + 4));
            }
            return null;
        }
        if (tag != DicomTag.ITEM) {
            options.report(LOG, "Expected sequence item with tag " + DicomTag.toString(DicomTag.ITEM) +
                    " at file position 0x%X, but found %s".formatted(itemOffset, DicomTag.toString(tag)));
        }
        final boolean undefinedLength = length == DicomElement.UNDEFINED_LENGTH;
        final DicomDataset result = readDataset(
                implicitVR, littleEndian, undefinedLength ? UNLIMITED : length, parent, false);
        result.setFileOffset(itemOffset);
        result.setUndefinedLengthItem(undefinedLength);
        return result;
    }

    /**
     * Checks, whether the data starting from the current position is really encoded with implicit VR.
     * The stream position is not changed.
     *
     * <p>The VR bytes of the first element are checked: if they are not two uppercase letters, the encoding
     * is implicit. If it contradicts the assumed encoding, the problem is reported according to the validation
     * mode, with the following exceptions: if the stop condition fires on the first element, or if this is
     * a sequence item, which is encoded with implicit VR inside an explicit VR dataset (allowed by the standard).
     * Sequence items of an implicit VR dataset are always implicit.
     *
     * @param assumedImplicitVR assumed encoding.
     * @param littleEndian      byte order.
     * @param inSequence        whether we are reading a sequence item.
     * @return whether the data are encoded with implicit VR.
     * @throws IOException in the case of I/O error or mismatch in {@link DicomValidationMode#RAISE} mode.
     */
    public boolean isImplicitVR(boolean assumedImplicitVR, boolean littleEndian, boolean inSequence)
            throws IOException {
        if (inSequence && assumedImplicitVR) {
            return true;
        }
        final long start = in.offset();
        try {
            if (in.length() - start < 6) {
                return assumedImplicitVR;
            }
            final byte[] bytes = new byte[6];
            in.readFully(bytes);
            final boolean foundImplicitVR = !DicomVR.isLetterPair(bytes[4], bytes[5]);
            if (foundImplicitVR != assumedImplicitVR) {
                final ByteBuffer bb = ByteBuffer.wrap(bytes).order(DicomStreamReader.byteOrder(littleEndian));
                final int tag = ((bb.getShort(0) & 0xFFFF) << 16) | (bb.getShort(2) & 0xFFFF);
                final DicomVR vr = foundImplicitVR ?
                        null :
                        DicomVR.fromCode(new String(bytes, 4, 2, StandardCharsets.US_ASCII)).orElse(null);
                final DicomReadingOptions.StopCondition stopCondition = options.getStopCondition();
                if (stopCondition != null && stopCondition.stop(tag, vr, 0)) {
                    return foundImplicitVR;
                }
                if (foundImplicitVR && inSequence) {
                    return true;
                }
                final String found = foundImplicitVR ? "implicit" : "explicit";
                final String expected = foundImplicitVR ? "explicit" : "implicit";
                final String message = "Expected " + expected + " VR, but found " + found + " VR";
                if (options.getValidationMode().isException()) {
                    throw new DicomException(message + " at offset 0x" + Long.toHexString(start));
                }
                options.report(LOG, message + " - using " + found + " VR for reading");
            }
            return foundImplicitVR;
        } finally {
            in.seek(start);
        }
    }

    /**
     * Reads elements of the Command Set (group 0000), which is always encoded with Implicit VR Little Endian.
     * After this method, the stream is positioned at the first element of the next group.
     *
     * @return the command set; empty if there are no command elements at the current position.
     * @throws IOException in the case of any problem with reading.
     */
    public DicomDataset readCommandSet() throws IOException {
        final DicomReadingOptions.StopCondition saved = options.getStopCondition();
        options.setStopCondition((tag, vr, length) -> DicomTag.group(tag) != 0);
        try {
            return readDataset(true, true, UNLIMITED, null, true);
        } finally {
            options.setStopCondition(saved);
        }
    }

    @Override
    public String toString() {
        return "DICOM dataset reader" + DicomIO.prettyFileName(" of %s", in) + " (" + options + ")";
    }
}
