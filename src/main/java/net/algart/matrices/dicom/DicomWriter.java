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

import net.algart.matrices.dicom.codecs.DeflateCodec;
import net.algart.matrices.dicom.codecs.PixelDataOptions;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Writer of DICOM datasets and files.
 *
 * <p>Element values are written as they are stored in {@link DicomElement}: strings must be already encoded
 * in the proper character set. Values of elements, read from a stream with another byte order,
 * are byte-swapped according to {@link DicomVR#bytesPerValue()}. Odd-length values are padded
 * with a space (for character strings) or a zero byte.
 *
 * <p>This class is not thread-safe.
 */
public final class DicomWriter extends DicomIO {
    private static final int MAX_SHORT_LENGTH = 0xFFFF;

    private boolean implicitVR = false;
    private boolean littleEndian = true;

    /**
     * Creates a new DICOM file; the previous file with this name is deleted, if it exists.
     *
     * @param file the file.
     * @throws IOException if the previous file cannot be deleted.
     */
    public DicomWriter(Path file) throws IOException {
        this(deletePreviousAndOpen(file));
    }

    public DicomWriter(DataHandle<? extends Location> outputStream) {
        super(Objects.requireNonNull(outputStream, "Null data handle (output stream)"));
    }

    public boolean isImplicitVR() {
        return implicitVR;
    }

    public DicomWriter setImplicitVR(boolean implicitVR) {
        this.implicitVR = implicitVR;
        return this;
    }

    public boolean isLittleEndian() {
        return littleEndian;
    }

    public DicomWriter setLittleEndian(boolean littleEndian) {
        this.littleEndian = littleEndian;
        return this;
    }

    /**
     * Sets the encoding of the main dataset according to the transfer syntax.
     *
     * @param transferSyntax transfer syntax.
     * @return a reference to this object.
     */
    public DicomWriter setTransferSyntax(TransferSyntax transferSyntax) {
        Objects.requireNonNull(transferSyntax, "Null transfer syntax");
        this.implicitVR = transferSyntax.isImplicitVR();
        this.littleEndian = transferSyntax.isLittleEndian();
        return this;
    }

    /**
     * Writes the whole file: preamble, "DICM" prefix, File Meta Information, Command Set (if not empty)
     * and the main dataset. If the file has no preamble and no file meta information, only the command set and
     * the dataset are written; if it has file meta information, but no preamble, the preamble is filled by zeros.
     *
     * <p>The encoding of the main dataset is specified by the transfer syntax of the file or,
     * if it is absent, by {@link DicomDataset#isImplicitVR()} and {@link DicomDataset#isLittleEndian()}.
     * For Deflated Explicit VR Little Endian, the main dataset is deflated.
     *
     * @param file file contents.
     * @throws IOException in the case of I/O errors or if some element cannot be encoded.
     */
    public void writeFile(DicomFileDataset file) throws IOException {
        Objects.requireNonNull(file, "Null file");
        synchronized (fileLock) {
            long t1 = debugTime();
            if (file.hasPreamble() || !file.fileMeta().isEmpty()) {
                writePreamble(file.hasPreamble() ? file.preamble() : new byte[PREAMBLE_LENGTH]);
                writeFileMeta(file.fileMeta());
            }
            if (!file.commandSet().isEmpty()) {
                writeCommandSet(file.commandSet());
            }
            final TransferSyntax transferSyntax = file.transferSyntax().orElse(null);
            if (transferSyntax != null) {
                setTransferSyntax(transferSyntax);
            } else {
                setImplicitVR(file.isImplicitVR());
                setLittleEndian(file.isLittleEndian());
            }
            if (transferSyntax != null && transferSyntax.isDeflated()) {
                final byte[] encoded = encodeDataset(file.dataset(), false, true);
                final byte[] deflated = new DeflateCodec().compress(encoded, new PixelDataOptions());
                stream.write(deflated);
                LOG.log(System.Logger.Level.DEBUG, () -> "Dataset deflated: " + encoded.length +
                        " bytes compressed to " + deflated.length + " bytes");
            } else {
                writeDataset(file.dataset());
            }
            if (BUILT_IN_TIMING && LOGGABLE_DEBUG) {
                long t2 = debugTime();
                LOG.log(System.Logger.Level.DEBUG, String.format(Locale.US,
                        "%s wrote %d bytes: %.3f ms",
                        getClass().getSimpleName(), stream.offset(), (t2 - t1) * 1e-6));
            }
        }
    }

    /**
     * Writes 128-byte preamble and "DICM" prefix.
     *
     * @param preamble preamble; must have length 128.
     * @throws IOException in the case of I/O errors.
     */
    public void writePreamble(byte[] preamble) throws IOException {
        Objects.requireNonNull(preamble, "Null preamble");
        if (preamble.length != PREAMBLE_LENGTH) {
            throw new IllegalArgumentException("The preamble must be " + PREAMBLE_LENGTH +
                    " bytes long, but it has " + preamble.length + " bytes");
        }
        synchronized (fileLock) {
            stream.write(preamble);
            stream.write(DICM_PREFIX);
        }
    }

    /**
     * Writes File Meta Information with Explicit VR Little Endian encoding. The element
     * (0002,0000) File Meta Information Group Length is recalculated; elements of other groups are not allowed.
     *
     * @param fileMeta file meta information.
     * @throws IOException in the case of I/O errors or if the dataset contains elements not in the group 0002.
     */
    public void writeFileMeta(DicomDataset fileMeta) throws IOException {
        writeGroup(fileMeta, 0x0002, false);
    }

    /**
     * Writes Command Set with Implicit VR Little Endian encoding. The element
     * (0000,0000) Command Group Length is recalculated; elements of other groups are not allowed.
     *
     * @param commandSet command set.
     * @throws IOException in the case of I/O errors or if the dataset contains elements not in the group 0000.
     */
    public void writeCommandSet(DicomDataset commandSet) throws IOException {
        writeGroup(commandSet, 0x0000, true);
    }

    /**
     * Writes all elements of the dataset in the order of increasing tags with the current encoding.
     *
     * @param dataset the dataset.
     * @throws IOException in the case of I/O errors or if some element cannot be encoded.
     */
    public void writeDataset(DicomDataset dataset) throws IOException {
        Objects.requireNonNull(dataset, "Null dataset");
        synchronized (fileLock) {
            writeDataset(stream, dataset, implicitVR, littleEndian);
        }
    }

    public void writeElement(DicomElement element) throws IOException {
        Objects.requireNonNull(element, "Null element");
        synchronized (fileLock) {
            writeElement(stream, element, implicitVR, littleEndian);
        }
    }

    /**
     * Writes the encapsulated pixel data element with undefined length and VR OB,
     * followed by Sequence Delimitation Item.
     *
     * @param pixelTag     tag of the pixel data element, usually (7FE0,0010).
     * @param encapsulated Basic Offset Table item and fragment items without the delimiter
     *                     (see {@link net.algart.matrices.dicom.encapsulation.Encapsulator}).
     * @throws IOException in the case of I/O errors.
     */
    public void writeEncapsulatedPixelData(int pixelTag, byte[] encapsulated) throws IOException {
        Objects.requireNonNull(encapsulated, "Null encapsulated data");
        synchronized (fileLock) {
            stream.setLittleEndian(littleEndian);
            writeHeader(stream, pixelTag, DicomVR.OB, DicomElement.UNDEFINED_LENGTH, implicitVR);
            stream.write(encapsulated);
            writeDelimiter(stream, DicomTag.SEQUENCE_DELIMITER);
        }
    }

    /**
     * Returns the dataset encoded as a sequence of elements, sorted by tags.
     *
     * @param dataset      the dataset.
     * @param implicitVR   whether to use Implicit VR encoding.
     * @param littleEndian byte order.
     * @return encoded dataset.
     * @throws IOException if some element cannot be encoded.
     */
    public static byte[] encodeDataset(DicomDataset dataset, boolean implicitVR, boolean littleEndian)
            throws IOException {
        Objects.requireNonNull(dataset, "Null dataset");
        try (DataHandle<Location> out = newBytesHandle()) {
            writeDataset(out, dataset, implicitVR, littleEndian);
            return readAllBytes(out);
        }
    }

    /**
     * Returns the value bytes in the byte order of the output. The odd-length value is padded.
     *
     * @param element      the element with byte value.
     * @param littleEndian byte order of the output.
     * @return value to be written.
     */
    public static byte[] outputValue(DicomElement element, boolean littleEndian) {
        Objects.requireNonNull(element, "Null element");
        byte[] value = element.value();
        final DicomVR vr = element.vr();
        final int bytesPerValue = vr == null ? 1 : vr.bytesPerValue();
        if (element.isLittleEndian() != littleEndian && bytesPerValue > 1) {
            value = swapBytes(value, bytesPerValue);
        }
        if ((value.length & 1) != 0) {
            value = Arrays.copyOf(value, value.length + 1);
            value[value.length - 1] = paddingByte(vr);
        }
        return value;
    }

    @Override
    public String toString() {
        return "DICOM writer" + prettyFileName(" to %s", stream) +
                " (" + (implicitVR ? "implicit" : "explicit") + " VR " +
                (littleEndian ? "little" : "big") + " endian)";
    }

    static byte[] swapBytes(byte[] value, int bytesPerValue) {
        final byte[] result = value.clone();
        final int n = value.length - value.length % bytesPerValue;
        for (int k = 0; k < n; k += bytesPerValue) {
            for (int i = 0; i < bytesPerValue; i++) {
                result[k + i] = value[k + bytesPerValue - 1 - i];
            }
        }
        return result;
    }

    private void writeGroup(DicomDataset dataset, int group, boolean groupImplicitVR) throws IOException {
        Objects.requireNonNull(dataset, "Null dataset");
        final int groupLengthTag = DicomTag.of(group, 0x0000);
        final DicomDataset elements = new DicomDataset(groupImplicitVR, true);
        for (DicomElement element : dataset.elements()) {
            if (DicomTag.group(element.tag()) != group) {
                throw new DicomException("Element " + DicomTag.toString(element.tag()) +
                        " cannot be written in the group " + String.format("%04X", group));
            }
            if (element.tag() != groupLengthTag) {
                elements.put(element);
            }
        }
        final byte[] encoded = encodeDataset(elements, groupImplicitVR, true);
        final byte[] groupLength = new byte[] {
                (byte) encoded.length,
                (byte) (encoded.length >>> 8),
                (byte) (encoded.length >>> 16),
                (byte) (encoded.length >>> 24)};
        synchronized (fileLock) {
            writeElement(stream, DicomElement.of(groupLengthTag, DicomVR.UL, groupLength), groupImplicitVR, true);
            stream.write(encoded);
        }
    }

    private static void writeDataset(
            DataHandle<? extends Location> out,
            DicomDataset dataset,
            boolean implicitVR,
            boolean littleEndian) throws IOException {
        for (DicomElement element : dataset.sortedElements()) {
            writeElement(out, element, implicitVR, littleEndian);
        }
    }

    private static void writeElement(
            DataHandle<? extends Location> out,
            DicomElement element,
            boolean implicitVR,
            boolean littleEndian) throws IOException {
        if (element.isDeferred()) {
            throw new IllegalArgumentException("Element " + element + " is deferred: it must be loaded " +
                    "before writing");
        }
        final DicomVR vr = outputVR(element);
        out.setLittleEndian(littleEndian);
        if (element.isSequence()) {
            writeSequence(out, element.tag(), element.sequence(), implicitVR, littleEndian);
            return;
        }
        final byte[] value = outputValue(element, littleEndian);
        if (element.isUndefinedLength()) {
            writeHeader(out, element.tag(), vr, DicomElement.UNDEFINED_LENGTH, implicitVR);
            out.write(value);
            writeDelimiter(out, DicomTag.SEQUENCE_DELIMITER);
            return;
        }
        if (!implicitVR && !vr.isLongForm() && value.length > MAX_SHORT_LENGTH) {
            throw new DicomException("Too long value of " + DicomTag.toString(element.tag()) + ": " +
                    value.length + " bytes cannot be written with VR " + vr + " (maximum " +
                    MAX_SHORT_LENGTH + ")");
        }
        writeHeader(out, element.tag(), vr, value.length, implicitVR);
        out.write(value);
    }

    private static void writeSequence(
            DataHandle<? extends Location> out,
            int tag,
            DicomSequence sequence,
            boolean implicitVR,
            boolean littleEndian) throws IOException {
        if (sequence.isUndefinedLength()) {
            writeHeader(out, tag, DicomVR.SQ, DicomElement.UNDEFINED_LENGTH, implicitVR);
            for (DicomDataset item : sequence.items()) {
                writeItem(out, item, implicitVR, littleEndian);
            }
            out.setLittleEndian(littleEndian);
            writeDelimiter(out, DicomTag.SEQUENCE_DELIMITER);
            return;
        }
        final byte[] items;
        try (DataHandle<Location> buffer = newBytesHandle()) {
            for (DicomDataset item : sequence.items()) {
                writeItem(buffer, item, implicitVR, littleEndian);
            }
            items = readAllBytes(buffer);
        }
        out.setLittleEndian(littleEndian);
        writeHeader(out, tag, DicomVR.SQ, items.length, implicitVR);
        out.write(items);
    }

    private static void writeItem(
            DataHandle<? extends Location> out,
            DicomDataset item,
            boolean implicitVR,
            boolean littleEndian) throws IOException {
        out.setLittleEndian(littleEndian);
        if (item.isUndefinedLengthItem()) {
            writeTag(out, DicomTag.ITEM);
            out.writeInt((int) DicomElement.UNDEFINED_LENGTH);
            writeDataset(out, item, implicitVR, littleEndian);
            out.setLittleEndian(littleEndian);
            writeDelimiter(out, DicomTag.ITEM_DELIMITER);
        } else {
            final byte[] encoded = encodeDataset(item, implicitVR, littleEndian);
            writeTag(out, DicomTag.ITEM);
            out.writeInt(encoded.length);
            out.write(encoded);
        }
    }

    private static void writeHeader(DataHandle<? extends Location> out, int tag, DicomVR vr, long length,
                                    boolean implicitVR) throws IOException {
        writeTag(out, tag);
        if (implicitVR) {
            out.writeInt((int) length);
            return;
        }
        out.write(vr.name().getBytes(StandardCharsets.US_ASCII));
        if (vr.isLongForm()) {
            out.writeShort(0);
            out.writeInt((int) length);
        } else {
            out.writeShort((int) length);
        }
    }

    private static void writeDelimiter(DataHandle<? extends Location> out, int tag) throws IOException {
        writeTag(out, tag);
        out.writeInt(0);
    }

    private static void writeTag(DataHandle<? extends Location> out, int tag) throws IOException {
        out.writeShort(DicomTag.group(tag));
        out.writeShort(DicomTag.element(tag));
    }

    private static DicomVR outputVR(DicomElement element) {
        if (element.isSequence()) {
            return DicomVR.SQ;
        }
        if (element.hasVR()) {
            return element.vr();
        }
        return DicomTag.knownVR(element.tag()).orElse(DicomVR.UN);
    }

    private static byte paddingByte(DicomVR vr) {
        if (vr == null || vr == DicomVR.UI) {
            return 0;
        }
        return vr.kind() == DicomVR.Kind.TEXT || vr.kind() == DicomVR.Kind.STRING ? (byte) ' ' : 0;
    }

    private static DataHandle<Location> deletePreviousAndOpen(Path file) throws IOException {
        Objects.requireNonNull(file, "Null file");
        Files.deleteIfExists(file);
        return getFileHandle(file);
    }
}
