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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class DicomStreamReaderTest {
    static byte[] explicitShort(int tag, String vr, byte[] value, boolean littleEndian) {
        final ByteBuffer bb = ByteBuffer.allocate(8 + value.length)
                .order(littleEndian ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN);
        bb.putShort((short) (tag >>> 16)).putShort((short) tag);
        bb.put(vr.getBytes(StandardCharsets.US_ASCII));
        bb.putShort((short) value.length);
        bb.put(value);
        return bb.array();
    }

    static byte[] explicitLong(int tag, String vr, long length, byte[] value) {
        final ByteBuffer bb = ByteBuffer.allocate(12 + value.length).order(ByteOrder.LITTLE_ENDIAN);
        bb.putShort((short) (tag >>> 16)).putShort((short) tag);
        bb.put(vr.getBytes(StandardCharsets.US_ASCII));
        bb.putShort((short) 0);
        bb.putInt((int) length);
        bb.put(value);
        return bb.array();
    }

    static byte[] implicit(int tag, long length, byte[] value) {
        final ByteBuffer bb = ByteBuffer.allocate(8 + value.length).order(ByteOrder.LITTLE_ENDIAN);
        bb.putShort((short) (tag >>> 16)).putShort((short) tag);
        bb.putInt((int) length);
        bb.put(value);
        return bb.array();
    }

    static byte[] concat(byte[]... parts) {
        final ByteArrayOutputStream result = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            result.writeBytes(part);
        }
        return result.toByteArray();
    }

    private static DicomStreamReader reader(byte[] bytes, DicomReadingOptions options) {
        return new DicomStreamReader(DicomIO.getBytesHandle(bytes), options);
    }

    @Test
    public void testExplicitShortAndLongForms() throws IOException {
        final byte[] bytes = concat(
                explicitShort(DicomTag.PATIENT_NAME, "PN", "DOE^".getBytes(StandardCharsets.US_ASCII), true),
                explicitLong(DicomTag.PIXEL_DATA, "OB", 4, new byte[]{1, 2, 3, 4}));
        final DicomStreamReader reader = reader(bytes, new DicomReadingOptions());
        final DicomElement name = reader.readElement(false, true, new DicomDataset());
        assertEquals(DicomTag.PATIENT_NAME, name.tag());
        assertEquals(DicomVR.PN, name.vr());
        assertEquals(4, name.length());
        assertEquals(8, name.valueOffset());
        assertArrayEquals("DOE^".getBytes(StandardCharsets.US_ASCII), name.value());

        final DicomElement pixels = reader.readElement(false, true, new DicomDataset());
        assertEquals(DicomVR.OB, pixels.vr());
        assertEquals(12, pixels.headerLength());
        assertEquals(12 + 12, pixels.valueOffset());
        assertArrayEquals(new byte[]{1, 2, 3, 4}, pixels.value());

        assertNull(reader.readElement(false, true, new DicomDataset()));
        assertEquals(DicomStreamReader.Termination.END_OF_DATA, reader.termination());
    }

    @Test
    public void testBigEndianElement() throws IOException {
        final byte[] bytes = explicitShort(DicomTag.ROWS, "US", new byte[]{0x01, 0x02}, false);
        final DicomElement rows = reader(bytes, new DicomReadingOptions())
                .readElement(false, false, new DicomDataset());
        assertEquals(DicomTag.ROWS, rows.tag());
        assertFalse(rows.isLittleEndian());
        assertArrayEquals(new byte[]{0x01, 0x02}, rows.value());
    }

    @Test
    public void testImplicitVRUsesLookup() throws IOException {
        final byte[] bytes = concat(
                implicit(DicomTag.ROWS, 2, new byte[]{16, 0}),
                implicit(0x00091001, 2, new byte[]{7, 7}));
        final DicomStreamReader reader = reader(bytes, new DicomReadingOptions());
        final DicomElement rows = reader.readElement(true, true, new DicomDataset());
        assertEquals(DicomVR.US, rows.vr());
        assertTrue(rows.isImplicitVR());
        final DicomElement privateElement = reader.readElement(true, true, new DicomDataset());
        assertNull(privateElement.vr());
        assertFalse(privateElement.hasVR());
    }

    @Test
    public void testImplicitElementInExplicitStream() throws IOException {
        final byte[] bytes = concat(
                implicit(DicomTag.ROWS, 2, new byte[]{16, 0}),
                explicitShort(DicomTag.COLUMNS, "US", new byte[]{8, 0}, true));
        final DicomStreamReader reader = reader(bytes, new DicomReadingOptions());
        final DicomElement rows = reader.readElement(false, true, new DicomDataset());
        assertTrue(rows.isImplicitVR());
        assertEquals(DicomVR.US, rows.vr());
        assertArrayEquals(new byte[]{16, 0}, rows.value());
        final DicomElement columns = reader.readElement(false, true, new DicomDataset());
        assertFalse(columns.isImplicitVR());
        assertEquals(DicomTag.COLUMNS, columns.tag());
    }

    @Test
    public void testDeferredValueIsMaterialized() throws IOException {
        final byte[] value = {9, 8, 7, 6, 5, 4};
        final byte[] bytes = concat(
                explicitLong(DicomTag.PIXEL_DATA, "OB", value.length, value),
                explicitShort(DicomTag.of(0x7FE1, 0x0010), "LO", "AB".getBytes(StandardCharsets.US_ASCII), true));
        final DicomStreamReader reader = reader(bytes, new DicomReadingOptions().setDeferSize(4));
        final DicomElement deferred = reader.readElement(false, true, new DicomDataset());
        assertTrue(deferred.isDeferred());
        assertThrows(IllegalStateException.class, deferred::value);
        final DicomElement next = reader.readElement(false, true, new DicomDataset());
        assertEquals(DicomVR.LO, next.vr());

        final long position = reader.stream().offset();
        final DicomElement loaded = reader.materialize(deferred);
        assertArrayEquals(value, loaded.value());
        assertEquals(position, reader.stream().offset());
    }

    @Test
    public void testMaterializeDetectsModifiedStream() throws IOException {
        final byte[] bytes = explicitLong(DicomTag.PIXEL_DATA, "OB", 6, new byte[6]);
        final DicomStreamReader reader = reader(bytes, new DicomReadingOptions().setDeferSize(4));
        final DicomElement deferred = reader.readElement(false, true, new DicomDataset());
        final byte[] modified = explicitLong(DicomTag.FLOAT_PIXEL_DATA, "OF", 6, new byte[6]);
        final DicomStreamReader otherReader = reader(modified, new DicomReadingOptions());
        final DicomException e = assertThrows(DicomException.class, () -> otherReader.materialize(deferred));
        assertTrue(e.getMessage().contains("does not match"), e.getMessage());
    }

    @Test
    public void testUndefinedLengthEncapsulatedValue() throws IOException {
        final byte[] items = concat(
                new byte[]{(byte) 0xFE, (byte) 0xFF, 0x00, (byte) 0xE0, 0, 0, 0, 0},
                new byte[]{(byte) 0xFE, (byte) 0xFF, 0x00, (byte) 0xE0, 2, 0, 0, 0, 0x11, 0x22});
        final byte[] delimiter = {(byte) 0xFE, (byte) 0xFF, (byte) 0xDD, (byte) 0xE0, 0, 0, 0, 0};
        final byte[] bytes = concat(
                explicitLong(DicomTag.PIXEL_DATA, "OB", DicomElement.UNDEFINED_LENGTH, items),
                delimiter);
        final DicomStreamReader reader = reader(bytes, new DicomReadingOptions());
        final DicomElement pixels = reader.readElement(false, true, new DicomDataset());
        assertTrue(pixels.isUndefinedLength());
        assertArrayEquals(items, pixels.value());
        assertEquals(12 + items.length + delimiter.length, reader.stream().offset());
    }

    @Test
    public void testUndefinedLengthUnknownIsSequence() throws IOException {
        final byte[] item = concat(
                new byte[]{(byte) 0xFE, (byte) 0xFF, 0x00, (byte) 0xE0, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF,
                        (byte) 0xFF},
                implicit(DicomTag.ROWS, 2, new byte[]{4, 0}),
                new byte[]{(byte) 0xFE, (byte) 0xFF, 0x0D, (byte) 0xE0, 0, 0, 0, 0});
        final byte[] bytes = concat(
                explicitLong(0x00091010, "UN", DicomElement.UNDEFINED_LENGTH, item),
                new byte[]{(byte) 0xFE, (byte) 0xFF, (byte) 0xDD, (byte) 0xE0, 0, 0, 0, 0});
        final DicomElement element = reader(bytes, new DicomReadingOptions())
                .readElement(false, true, new DicomDataset());
        assertTrue(element.isSequence());
        assertEquals(DicomVR.SQ, element.vr());
        assertEquals(1, element.sequence().size());
        final DicomDataset first = element.sequence().item(0);
        assertTrue(first.isUndefinedLengthItem());
        assertEquals(4, first.reqInt(DicomTag.ROWS));
    }

    @Test
    public void testStopConditionRewinds() throws IOException {
        final byte[] bytes = concat(
                explicitShort(DicomTag.ROWS, "US", new byte[]{1, 0}, true),
                explicitLong(DicomTag.PIXEL_DATA, "OB", 2, new byte[]{1, 2}));
        final DicomReadingOptions options = new DicomReadingOptions()
                .setStopCondition((tag, vr, length) -> DicomTag.isPixelData(tag));
        final DicomStreamReader reader = reader(bytes, options);
        assertNotNull(reader.readElement(false, true, new DicomDataset()));
        assertNull(reader.readElement(false, true, new DicomDataset()));
        assertEquals(DicomStreamReader.Termination.STOP_CONDITION, reader.termination());
        assertEquals(10, reader.stream().offset());
    }

    @Test
    public void testTruncatedHeader() throws IOException {
        final byte[] bytes = concat(
                explicitShort(DicomTag.ROWS, "US", new byte[]{1, 0}, true),
                new byte[]{0x28, 0x00, 0x11});
        final DicomStreamReader lenient = reader(bytes, DicomReadingOptions.of(DicomValidationMode.WARN));
        assertNotNull(lenient.readElement(false, true, new DicomDataset()));
        assertNull(lenient.readElement(false, true, new DicomDataset()));

        final DicomStreamReader strict = reader(bytes, DicomReadingOptions.of(DicomValidationMode.RAISE));
        assertNotNull(strict.readElement(false, true, new DicomDataset()));
        assertThrows(DicomException.class, () -> strict.readElement(false, true, new DicomDataset()));
    }

    @Test
    public void testMissingSequenceDelimiter() throws IOException {
        final byte[] bytes = explicitLong(DicomTag.of(0x0009, 0x1020), "OB", DicomElement.UNDEFINED_LENGTH,
                new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10});
        final DataHandle<Location> handle = DicomIO.getBytesHandle(bytes);
        final DicomStreamReader reader = new DicomStreamReader(handle, new DicomReadingOptions());
        assertThrows(IOException.class, () -> reader.readElement(false, true, new DicomDataset()));
    }
}
