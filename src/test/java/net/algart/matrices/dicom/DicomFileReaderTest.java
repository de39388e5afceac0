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

import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.arrays.UpdatablePArray;
import net.algart.matrices.dicom.codecs.PixelDataOptions;
import net.algart.matrices.dicom.encapsulation.EncapsulatedPixelData;
import net.algart.matrices.dicom.pixels.DecodedFrame;
import net.algart.matrices.dicom.pixels.PixelDataEncoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static net.algart.matrices.dicom.DicomFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class DicomFileReaderTest {
    private static DicomFileDataset file(TransferSyntax transferSyntax, DicomDataset dataset) {
        return new DicomFileDataset(new byte[DicomIO.PREAMBLE_LENGTH], fileMeta(transferSyntax),
                new DicomDataset(true, true), dataset, transferSyntax);
    }

    private static void checkRoundTrip(TransferSyntax transferSyntax) throws IOException {
        final DicomDataset dataset = imageDataset(3, 2, 1, 16, 1, "MONOCHROME2");
        final byte[] pixels = pixels(12, 1);
        dataset.put(DicomElement.of(DicomTag.PIXEL_DATA, DicomVR.OW, pixels));
        final byte[] bytes = write(file(transferSyntax, dataset));
        try (DicomFileReader reader = reader(bytes, new DicomReadingOptions(), false)) {
            assertEquals(transferSyntax, reader.transferSyntax().orElseThrow());
            assertEquals(transferSyntax.isImplicitVR(), reader.isImplicitVR());
            assertEquals(transferSyntax.isLittleEndian(), reader.isLittleEndian());
            final DicomFileDataset result = reader.read();
            assertTrue(result.hasPreamble());
            assertEquals(transferSyntax.uid(), result.fileMeta().reqString(DicomTag.TRANSFER_SYNTAX_UID));
            final DicomDataset read = result.dataset();
            assertEquals(dataset.numberOfElements(), read.numberOfElements());
            assertEquals("Test^Patient", read.reqString(DicomTag.PATIENT_NAME));
            assertEquals(2, read.reqInt(DicomTag.ROWS));
            assertEquals(3, read.reqInt(DicomTag.COLUMNS));
            final DecodedFrame frame = reader.readFrame(read, 0);
            assertArrayEquals(pixels, frame.data(), "Decoded samples must be little-endian");
        }
    }

    @Test
    public void testExplicitLittleEndian() throws IOException {
        checkRoundTrip(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN);
    }

    @Test
    public void testImplicitLittleEndian() throws IOException {
        checkRoundTrip(TransferSyntax.IMPLICIT_VR_LITTLE_ENDIAN);
    }

    @Test
    public void testExplicitBigEndian() throws IOException {
        checkRoundTrip(TransferSyntax.EXPLICIT_VR_BIG_ENDIAN);
    }

    @Test
    public void testDeflated() throws IOException {
        checkRoundTrip(TransferSyntax.DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN);
    }

    @Test
    public void testMissingPrefix() throws IOException {
        final DicomDataset dataset = imageDataset(3, 2, 1, 8, 1, "MONOCHROME2");
        final byte[] bytes = DicomWriter.encodeDataset(dataset, false, true);
        assertThrows(DicomException.class, () -> reader(bytes, new DicomReadingOptions(), false));

        try (DicomFileReader reader = reader(bytes, new DicomReadingOptions(), true)) {
            assertNull(reader.preamble());
            assertTrue(reader.fileMeta().isEmpty());
            assertTrue(reader.transferSyntax().isEmpty());
            assertFalse(reader.isImplicitVR());
            assertTrue(reader.isLittleEndian());
            final DicomFileDataset result = reader.read();
            assertFalse(result.hasPreamble());
            assertEquals(dataset.numberOfElements(), result.dataset().numberOfElements());
        }
    }

    @Test
    public void testGuessedBigEndian() throws IOException {
        final DicomDataset dataset = imageDataset(3, 2, 1, 8, 1, "MONOCHROME2");
        final byte[] bytes = DicomWriter.encodeDataset(dataset, false, false);
        try (DicomFileReader reader = reader(bytes, new DicomReadingOptions(), true)) {
            assertFalse(reader.isImplicitVR());
            assertFalse(reader.isLittleEndian());
            assertEquals(2, reader.readDataset(false).reqInt(DicomTag.ROWS));
        }
    }

    @Test
    public void testGuessedImplicit() throws IOException {
        final DicomDataset dataset = imageDataset(3, 2, 1, 8, 1, "MONOCHROME2");
        final byte[] bytes = DicomWriter.encodeDataset(dataset, true, true);
        try (DicomFileReader reader = reader(bytes, new DicomReadingOptions(), true)) {
            assertTrue(reader.isImplicitVR());
            assertEquals(3, reader.readDataset(false).reqInt(DicomTag.COLUMNS));
        }
    }

    @Test
    public void testWrongGroupLengthIsTolerated() throws IOException {
        final DicomDataset dataset = imageDataset(3, 2, 1, 8, 1, "MONOCHROME2");
        final byte[] bytes = write(file(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN, dataset));
        // (0002,0000) UL value starts after preamble, prefix and 8-byte header
        final int valuePosition = DicomIO.PREAMBLE_LENGTH + 4 + 8;
        bytes[valuePosition] += 2;
        try (DicomFileReader reader = reader(bytes, new DicomReadingOptions(), false)) {
            assertEquals(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN, reader.transferSyntax().orElseThrow());
            assertEquals(2, reader.readDataset(false).reqInt(DicomTag.ROWS));
        }
    }

    @Test
    public void testCommandSet() throws IOException {
        final DicomDataset commandSet = new DicomDataset(true, true);
        commandSet.put(DicomElement.of(0x00000100, DicomVR.US, us(1)));
        commandSet.put(DicomElement.of(0x00000800, DicomVR.US, us(0x0101)));
        final DicomDataset dataset = imageDataset(3, 2, 1, 8, 1, "MONOCHROME2");
        final byte[] bytes = write(new DicomFileDataset(new byte[DicomIO.PREAMBLE_LENGTH],
                fileMeta(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN), commandSet, dataset,
                TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN));
        try (DicomFileReader reader = reader(bytes, new DicomReadingOptions(), false)) {
            assertEquals(3, reader.commandSet().numberOfElements());
            assertEquals(20, reader.commandSet().reqInt(0x00000000));
            assertEquals(1, reader.commandSet().reqInt(0x00000100));
            assertEquals(dataset.numberOfElements(), reader.readDataset(false).numberOfElements());
        }
    }

    @Test
    public void testStopBeforePixels() throws IOException {
        final DicomDataset dataset = imageDataset(3, 2, 1, 8, 1, "MONOCHROME2");
        dataset.put(DicomElement.of(DicomTag.PIXEL_DATA, DicomVR.OB, pixels(6, 0)));
        dataset.put(DicomElement.of(0xFFFA_FFFA, DicomVR.OB, new byte[2]));
        final byte[] bytes = write(file(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN, dataset));
        try (DicomFileReader reader = reader(bytes, new DicomReadingOptions(), false)) {
            final DicomDataset header = reader.readDataset(true);
            assertFalse(header.containsKey(DicomTag.PIXEL_DATA));
            assertEquals(dataset.numberOfElements() - 2, header.numberOfElements());
            final DicomDataset all = reader.readDataset(false);
            assertTrue(all.containsKey(DicomTag.PIXEL_DATA));
        }
    }

    @Test
    public void testEncapsulatedFramesAreReadLazily() throws IOException {
        final int numberOfFrames = 3;
        final DicomDataset dataset = imageDataset(8, 4, numberOfFrames, 8, 1, "MONOCHROME2");
        final byte[] pixels = pixels(8 * 4 * numberOfFrames, 3);
        final PixelDataOptions options = PixelDataOptions.fromDataset(dataset);
        final byte[] encapsulated = new PixelDataEncoder(TransferSyntax.RLE_LOSSLESS, options)
                .encodeAndEncapsulate(pixels);

        final byte[] bytes;
        try (DataHandle<Location> handle = DicomIO.newBytesHandle()) {
            final DicomWriter writer = new DicomWriter(handle);
            writer.writePreamble(new byte[DicomIO.PREAMBLE_LENGTH]);
            writer.writeFileMeta(fileMeta(TransferSyntax.RLE_LOSSLESS));
            writer.setTransferSyntax(TransferSyntax.RLE_LOSSLESS);
            writer.writeDataset(dataset);
            writer.writeEncapsulatedPixelData(DicomTag.PIXEL_DATA, encapsulated);
            bytes = DicomIO.readAllBytes(handle);
        }
        final DicomReadingOptions readingOptions = new DicomReadingOptions().setDeferSize(64);
        try (DicomFileReader reader = reader(bytes, readingOptions, false)) {
            final DicomDataset read = reader.readDataset(false);
            final DicomElement pixelElement = read.get(DicomTag.PIXEL_DATA);
            assertTrue(pixelElement.isDeferred());
            assertTrue(pixelElement.isUndefinedLength());

            final EncapsulatedPixelData encapsulatedPixelData = reader.encapsulatedPixelData(read);
            assertEquals(numberOfFrames, encapsulatedPixelData.basicOffsets().length);
            for (int k = numberOfFrames - 1; k >= 0; k--) {
                final DecodedFrame frame = reader.readFrame(read, k);
                assertEquals(k, frame.index());
                assertArrayEquals(Arrays.copyOfRange(pixels, k * 32, (k + 1) * 32), frame.data());
            }
            final DicomElement loaded = reader.materialize(pixelElement);
            assertArrayEquals(encapsulated, loaded.value());
        }
    }

    @Test
    public void testReadMatrix() throws IOException {
        final DicomDataset dataset = imageDataset(4, 3, 2, 16, 1, "MONOCHROME2");
        final byte[] pixels = pixels(4 * 3 * 2 * 2, 5);
        dataset.put(DicomElement.of(DicomTag.PIXEL_DATA, DicomVR.OW, pixels));
        final byte[] bytes = write(file(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN, dataset));
        try (DicomFileReader reader = reader(bytes, new DicomReadingOptions(), false)) {
            final DicomDataset read = reader.readDataset(false);
            final Matrix<UpdatablePArray> matrix = reader.readMatrix(read, 1);
            assertArrayEquals(new long[]{1, 4, 3}, matrix.dimensions());
            assertEquals(short.class, matrix.elementType());
            final PArray array = matrix.array();
            final int offset = 4 * 3 * 2;
            final int expected = (pixels[offset] & 0xFF) | (pixels[offset + 1] & 0xFF) << 8;
            assertEquals(expected, (int) array.getDouble(0));
        }
    }

    @Test
    public void testFileOnDisk(@TempDir Path folder) throws IOException {
        final Path path = folder.resolve("image.dcm");
        Files.write(path, new byte[]{1, 2, 3});
        final DicomDataset dataset = imageDataset(2, 2, 1, 8, 1, "MONOCHROME2");
        dataset.put(DicomElement.of(DicomTag.PIXEL_DATA, DicomVR.OB, pixels(4, 0)));
        try (DicomWriter writer = new DicomWriter(path)) {
            writer.writeFile(file(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN, dataset));
        }
        try (DicomFileReader reader = new DicomFileReader(path)) {
            final DicomFileDataset result = reader.read();
            assertEquals(TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN, result.transferSyntax().orElseThrow());
            assertArrayEquals(pixels(4, 0), result.dataset().get(DicomTag.PIXEL_DATA).value());
        }
        assertThrows(IOException.class, () -> new DicomFileReader(folder.resolve("absent.dcm")));
    }
}
