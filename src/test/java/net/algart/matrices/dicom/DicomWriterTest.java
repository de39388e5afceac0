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

import org.junit.jupiter.api.Test;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;

import static net.algart.matrices.dicom.DicomFixtures.ascii;
import static net.algart.matrices.dicom.DicomFixtures.us;
import static org.junit.jupiter.api.Assertions.*;

public class DicomWriterTest {
    @Test
    public void testOddValuesArePadded() throws IOException {
        final DicomDataset dataset = new DicomDataset();
        dataset.put(DicomElement.of(DicomTag.SOP_INSTANCE_UID, DicomVR.UI, ascii("1.2.3")));
        dataset.put(DicomElement.of(DicomTag.PATIENT_NAME, DicomVR.PN, ascii("ABC")));
        final byte[] bytes = DicomWriter.encodeDataset(dataset, false, true);
        assertArrayEquals(new byte[]{
                0x08, 0x00, 0x18, 0x00, 'U', 'I', 6, 0, '1', '.', '2', '.', '3', 0,
                0x10, 0x00, 0x10, 0x00, 'P', 'N', 4, 0, 'A', 'B', 'C', ' '}, bytes);
    }

    @Test
    public void testElementsAreSorted() throws IOException {
        final DicomDataset dataset = new DicomDataset();
        dataset.put(DicomElement.of(DicomTag.COLUMNS, DicomVR.US, us(2)));
        dataset.put(DicomElement.of(DicomTag.ROWS, DicomVR.US, us(1)));
        final byte[] bytes = DicomWriter.encodeDataset(dataset, true, true);
        assertArrayEquals(new byte[]{
                0x28, 0x00, 0x10, 0x00, 2, 0, 0, 0, 1, 0,
                0x28, 0x00, 0x11, 0x00, 2, 0, 0, 0, 2, 0}, bytes);
    }

    @Test
    public void testBigEndianSwapsBinaryValues() throws IOException {
        final DicomDataset dataset = new DicomDataset();
        dataset.put(DicomElement.of(DicomTag.ROWS, DicomVR.US, us(0x0102)));
        dataset.put(DicomElement.of(DicomTag.PIXEL_DATA, DicomVR.OW, new byte[]{1, 2, 3, 4}));
        final byte[] bytes = DicomWriter.encodeDataset(dataset, false, false);
        assertArrayEquals(new byte[]{
                0x00, 0x28, 0x00, 0x10, 'U', 'S', 0, 2, 0x01, 0x02,
                0x7F, (byte) 0xE0, 0x00, 0x10, 'O', 'W', 0, 0, 0, 0, 0, 4, 2, 1, 4, 3}, bytes);

        final DicomDataset read = new DicomDatasetReader(DicomIO.getBytesHandle(bytes), new DicomReadingOptions())
                .readDataset(false, false);
        assertEquals(0x0102, read.reqInt(DicomTag.ROWS));
        final byte[] again = DicomWriter.encodeDataset(read, false, false);
        assertArrayEquals(bytes, again, "Values in the source byte order must not be swapped twice");
    }

    @Test
    public void testSequences() throws IOException {
        final DicomDataset item = new DicomDataset();
        item.put(DicomElement.of(DicomTag.ROWS, DicomVR.US, us(7)));
        final DicomDataset undefinedItem = new DicomDataset().setUndefinedLengthItem(true);
        undefinedItem.put(DicomElement.of(DicomTag.COLUMNS, DicomVR.US, us(8)));
        final DicomDataset dataset = new DicomDataset();
        dataset.put(DicomElement.of(0x00081115, new DicomSequence(false).add(item).add(undefinedItem)));
        dataset.put(DicomElement.of(0x00081140, new DicomSequence(true).add(item)));

        for (boolean implicitVR : new boolean[]{false, true}) {
            final byte[] bytes = DicomWriter.encodeDataset(dataset, implicitVR, true);
            final DicomReadingOptions options = DicomReadingOptions.of(DicomValidationMode.RAISE)
                    .setVRLookup(tag -> tag == 0x00081115 || tag == 0x00081140 ?
                            Optional.of(DicomVR.SQ) :
                            DicomTag.knownVR(tag));
            final DicomDataset read = new DicomDatasetReader(DicomIO.getBytesHandle(bytes), options)
                    .readDataset(implicitVR, true);
            final DicomElement defined = read.get(0x00081115);
            assertTrue(defined.isSequence(), "implicitVR=" + implicitVR);
            assertFalse(defined.isUndefinedLength());
            assertEquals(2, defined.sequence().size());
            assertEquals(7, defined.sequence().item(0).reqInt(DicomTag.ROWS));
            assertTrue(defined.sequence().item(1).isUndefinedLengthItem());
            assertEquals(8, defined.sequence().item(1).reqInt(DicomTag.COLUMNS));
            final DicomElement undefined = read.get(0x00081140);
            assertTrue(undefined.isUndefinedLength());
            assertEquals(1, undefined.sequence().size());
            assertArrayEquals(bytes, DicomWriter.encodeDataset(read, implicitVR, true));
        }
    }

    @Test
    public void testFileMetaGroupLength() throws IOException {
        final DicomDataset fileMeta = DicomFixtures.fileMeta(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN);
        fileMeta.put(DicomElement.of(DicomTag.FILE_META_INFORMATION_GROUP_LENGTH, DicomVR.UL, new byte[4]));
        final byte[] bytes;
        try (DataHandle<Location> handle = DicomIO.newBytesHandle()) {
            new DicomWriter(handle).writeFileMeta(fileMeta);
            bytes = DicomIO.readAllBytes(handle);
        }
        assertArrayEquals(new byte[]{0x02, 0x00, 0x00, 0x00, 'U', 'L', 4, 0}, Arrays.copyOf(bytes, 8));
        final int groupLength = (bytes[8] & 0xFF) | (bytes[9] & 0xFF) << 8 | (bytes[10] & 0xFF) << 16;
        assertEquals(bytes.length - 12, groupLength);

        final DicomDataset wrong = new DicomDataset();
        wrong.put(DicomElement.of(DicomTag.ROWS, DicomVR.US, us(1)));
        try (DataHandle<Location> handle = DicomIO.newBytesHandle()) {
            assertThrows(DicomException.class, () -> new DicomWriter(handle).writeFileMeta(wrong));
        }
    }

    @Test
    public void testEncapsulatedPixelData() throws IOException {
        final byte[] encapsulated = {
                (byte) 0xFE, (byte) 0xFF, 0x00, (byte) 0xE0, 0, 0, 0, 0,
                (byte) 0xFE, (byte) 0xFF, 0x00, (byte) 0xE0, 2, 0, 0, 0, 5, 6};
        final byte[] bytes;
        try (DataHandle<Location> handle = DicomIO.newBytesHandle()) {
            new DicomWriter(handle).writeEncapsulatedPixelData(DicomTag.PIXEL_DATA, encapsulated);
            bytes = DicomIO.readAllBytes(handle);
        }
        assertEquals(12 + encapsulated.length + 8, bytes.length);
        assertArrayEquals(new byte[]{(byte) 0xFE, (byte) 0xFF, (byte) 0xDD, (byte) 0xE0, 0, 0, 0, 0},
                Arrays.copyOfRange(bytes, bytes.length - 8, bytes.length));
        final DicomDataset read = new DicomDatasetReader(DicomIO.getBytesHandle(bytes), new DicomReadingOptions())
                .readDataset(false, true);
        final DicomElement pixels = read.get(DicomTag.PIXEL_DATA);
        assertTrue(pixels.isUndefinedLength());
        assertArrayEquals(encapsulated, pixels.value());
        assertArrayEquals(bytes, DicomWriter.encodeDataset(read, false, true));
    }

    @Test
    public void testInvalidElements() throws IOException {
        final DicomDataset tooLong = new DicomDataset();
        tooLong.put(DicomElement.of(DicomTag.PATIENT_NAME, DicomVR.PN, new byte[70000]));
        assertThrows(DicomException.class, () -> DicomWriter.encodeDataset(tooLong, false, true));
        assertEquals(70008, DicomWriter.encodeDataset(tooLong, true, true).length);

        final byte[] deferredSource = DicomStreamReaderTest.explicitLong(DicomTag.PIXEL_DATA, "OB", 8, new byte[8]);
        final DicomDataset deferred = new DicomDatasetReader(DicomIO.getBytesHandle(deferredSource),
                new DicomReadingOptions().setDeferSize(2)).readDataset(false, true);
        assertThrows(IllegalArgumentException.class, () -> DicomWriter.encodeDataset(deferred, false, true));
    }
}
