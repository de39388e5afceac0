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
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

public class EncapsulatedPixelDataTest {
    private static final byte FF = (byte) 0xFF;
    private static final byte D9 = (byte) 0xD9;

    private static final List<byte[]> FRAMES = List.of(
            new byte[]{1, 2, 3, 4, 5, 6, 7, 8},
            new byte[]{11, 12, 13, 14, 15, 16},
            new byte[]{21, 22, 23, 24, 25, 26, 27, 28, 29, 30});

    private static void assertFrames(List<byte[]> expected, List<byte[]> actual) {
        assertEquals(expected.size(), actual.size());
        for (int i = 0; i < expected.size(); i++) {
            assertArrayEquals(expected.get(i), actual.get(i), "frame #" + i);
        }
    }

    @Test
    public void testBasicOffsetTable() throws IOException {
        final byte[] value = Encapsulator.appendSequenceDelimiter(Encapsulator.encapsulate(FRAMES, 2, true));
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(value);
        assertArrayEquals(new long[]{0, 24, 46}, pixelData.basicOffsets());
        assertEquals(6, pixelData.numberOfFragments());
        assertFrames(FRAMES, pixelData.frames());
        for (int i = FRAMES.size() - 1; i >= 0; i--) {
            assertArrayEquals(FRAMES.get(i), pixelData.getFrame(i));
        }
        final DicomException e = assertThrows(DicomException.class, () -> pixelData.getFrame(3));
        assertTrue(e.getMessage().contains("Basic Offset Table"), e.getMessage());
    }

    @Test
    public void testGetFrameRestoresPosition() throws IOException {
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(Encapsulator.encapsulate(FRAMES));
        final EncapsulatedFrameIterator iterator = pixelData.frameIterator();
        assertArrayEquals(FRAMES.get(0), iterator.nextFrame().bytes());
        pixelData.stream().seek(5);
        assertArrayEquals(FRAMES.get(2), pixelData.getFrame(2));
        assertEquals(5, pixelData.stream().offset());
        assertArrayEquals(FRAMES.get(1), iterator.nextFrame().bytes());
        assertEquals(2, iterator.frameIndex());
    }

    @Test
    public void testOneFragmentPerFrame() throws IOException {
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(
                Encapsulator.encapsulate(FRAMES, 1, false));
        assertEquals(0, pixelData.basicOffsets().length);
        final DicomException e = assertThrows(DicomException.class, pixelData::frames);
        assertTrue(e.getMessage().contains("Unable to determine the frame boundaries"), e.getMessage());
        assertThrows(DicomException.class, () -> pixelData.getFrame(0));

        pixelData.setNumberOfFrames(3);
        assertFrames(FRAMES, pixelData.frames());
        assertArrayEquals(FRAMES.get(1), pixelData.getFrame(1));
        assertThrows(DicomException.class, () -> pixelData.getFrame(3));
    }

    @Test
    public void testSingleFragment() throws IOException {
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(
                Encapsulator.encapsulate(List.of(FRAMES.get(0)), 1, false));
        assertFrames(List.of(FRAMES.get(0)), pixelData.frames());
        assertArrayEquals(FRAMES.get(0), pixelData.getFrame(0));
        assertThrows(DicomException.class, () -> pixelData.getFrame(1));
    }

    @Test
    public void testAllFragmentsInOneFrame() throws IOException {
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(
                Encapsulator.encapsulate(List.of(FRAMES.get(2)), 3, false)).setNumberOfFrames(1);
        assertEquals(3, pixelData.numberOfFragments());
        final List<EncapsulatedFrame> frames = new ArrayList<>();
        pixelData.frameIterator().forEachRemaining(frames::add);
        assertEquals(1, frames.size());
        assertEquals(3, frames.get(0).numberOfFragments());
        assertArrayEquals(FRAMES.get(2), frames.get(0).bytes());
        assertArrayEquals(FRAMES.get(2), pixelData.getFrame(0));
    }

    @Test
    public void testEndOfImageMarkers() throws IOException {
        final List<byte[]> jpegLike = List.of(
                new byte[]{1, 2, 3, 4, 5, 6, FF, D9},
                new byte[]{7, 8, 9, 10, FF, D9});
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(
                Encapsulator.encapsulate(jpegLike, 2, false)).setNumberOfFrames(2);
        assertEquals(4, pixelData.numberOfFragments());
        assertFrames(jpegLike, pixelData.frames());
        assertArrayEquals(jpegLike.get(1), pixelData.getFrame(1));
        assertTrue(pixelData.frameIterator().next().hasEndOfImageMarker());
    }

    @Test
    public void testMissingEndOfImageMarkers() throws IOException {
        final List<String> warnings = new ArrayList<>();
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(
                        Encapsulator.encapsulate(List.of(FRAMES.get(0), FRAMES.get(1)), 2, false))
                .setNumberOfFrames(2)
                .setWarningListener(warnings::add);
        final List<byte[]> frames = pixelData.frames();
        assertEquals(1, frames.size());
        assertEquals(14, frames.get(0).length);
        assertEquals(1, warnings.size(), warnings.toString());
        assertTrue(warnings.get(0).contains("fewer frames than expected"), warnings.get(0));
        assertTrue(warnings.get(0).contains("Please confirm"), warnings.get(0));
    }

    @Test
    public void testTooFewEndOfImageMarkers() throws IOException {
        final List<String> warnings = new ArrayList<>();
        final List<byte[]> jpegLike = List.of(
                new byte[]{1, 2, 3, 4, 5, 6, FF, D9},
                new byte[]{7, 8, 9, 10, FF, D9});
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(
                        Encapsulator.encapsulate(jpegLike, 2, false))
                .setNumberOfFrames(3)
                .setWarningListener(warnings::add);
        assertFrames(jpegLike, pixelData.frames());
        assertEquals(1, warnings.size(), warnings.toString());
        assertTrue(warnings.get(0).endsWith("fewer frames than expected have been found"), warnings.get(0));
    }

    @Test
    public void testBasicOffsetsMatchFragmentPositions() throws IOException {
        for (int numberOfFrames = 1; numberOfFrames <= 4; numberOfFrames++) {
            final List<byte[]> frames = new ArrayList<>();
            for (int i = 0; i < numberOfFrames; i++) {
                final byte[] frame = new byte[6 + 2 * i];
                for (int j = 0; j < frame.length; j++) {
                    frame[j] = (byte) (10 * i + j);
                }
                frames.add(frame);
            }
            for (int fragmentsPerFrame = 1; fragmentsPerFrame <= 3; fragmentsPerFrame++) {
                final String message = numberOfFrames + " frames, " + fragmentsPerFrame + " fragments per frame";
                final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(
                        Encapsulator.encapsulate(frames, fragmentsPerFrame, true));
                final long[] offsets = pixelData.basicOffsets();
                final long[] fragments = pixelData.parseFragments();
                final long fragmentsStart = pixelData.fragmentsStart();
                assertEquals(numberOfFrames, offsets.length, message);
                assertEquals(numberOfFrames * fragmentsPerFrame, fragments.length, message);
                for (int i = 0; i < numberOfFrames; i++) {
                    assertEquals(fragments[i * fragmentsPerFrame] - fragmentsStart, offsets[i],
                            message + ", frame #" + i);
                    assertArrayEquals(frames.get(i), pixelData.getFrame(i), message + ", frame #" + i);
                }
            }
        }
    }

    @Test
    public void testFewerFragmentsThanFrames() {
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(
                Encapsulator.encapsulate(List.of(FRAMES.get(0), FRAMES.get(1)), 1, false)).setNumberOfFrames(3);
        final DicomException e = assertThrows(DicomException.class, () -> pixelData.frameIterator().nextFrame());
        assertTrue(e.getMessage().contains("fewer fragments than frames"), e.getMessage());
        final UncheckedIOException unchecked = assertThrows(UncheckedIOException.class,
                () -> pixelData.frameIterator().hasNext());
        assertInstanceOf(DicomException.class, unchecked.getCause());
    }

    @Test
    public void testExtendedOffsetTable() throws IOException {
        final List<byte[]> frames = List.of(new byte[]{1, 2, 3}, new byte[]{4, 5, 6, 7});
        final Encapsulator.Extended extended = Encapsulator.encapsulateExtended(frames);
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(extended.pixelData())
                .setExtendedOffsetTable(extended.extendedOffsetTable());
        assertTrue(pixelData.hasExtendedOffsetTable());
        assertArrayEquals(new byte[]{4, 5, 6, 7}, pixelData.getFrame(1));
        assertArrayEquals(new byte[]{1, 2, 3, 0}, pixelData.getFrame(0));
        assertEquals(2, pixelData.frames().size());
        assertThrows(DicomException.class, () -> pixelData.getFrame(2));

        pixelData.setExtendedOffsetTable(new ExtendedOffsetTable(new long[]{0}, new long[]{1000}));
        assertThrows(DicomException.class, () -> pixelData.getFrame(0));
    }

    @Test
    public void testTransferToQueue() throws IOException, InterruptedException {
        final EncapsulatedPixelData pixelData = EncapsulatedPixelData.of(Encapsulator.encapsulate(FRAMES));
        final BlockingQueue<EncapsulatedFrame> queue = new ArrayBlockingQueue<>(FRAMES.size() + 1);
        assertEquals(3, pixelData.frameIterator().transferTo(queue));
        for (int i = 0; i < FRAMES.size(); i++) {
            final EncapsulatedFrame frame = queue.take();
            assertEquals(i, frame.index());
            assertArrayEquals(FRAMES.get(i), frame.bytes());
        }
        assertTrue(queue.take().isEnd());
        assertTrue(queue.isEmpty());

        final EncapsulatedPixelData invalid = EncapsulatedPixelData.of(
                Encapsulator.encapsulate(FRAMES, 1, false));
        final BlockingQueue<EncapsulatedFrame> other = new ArrayBlockingQueue<>(4);
        assertThrows(DicomException.class, () -> invalid.frameIterator().transferTo(other));
        assertSame(EncapsulatedFrame.END, other.take());
    }

    @Test
    public void testInvalidItems() throws IOException {
        final byte[] oddTable = {(byte) 0xFE, FF, 0x00, (byte) 0xE0, 3, 0, 0, 0, 1, 2, 3};
        assertThrows(DicomException.class, () -> EncapsulatedPixelData.of(oddTable).basicOffsets());

        final byte[] wrongFirstTag = {0x08, 0x00, 0x10, 0x00, 0, 0, 0, 0};
        assertThrows(DicomException.class, () -> EncapsulatedPixelData.of(wrongFirstTag).basicOffsets());

        final byte[] unexpectedTag = {
                (byte) 0xFE, FF, 0x00, (byte) 0xE0, 0, 0, 0, 0,
                0x08, 0x00, 0x10, 0x00, 2, 0, 0, 0, 1, 2};
        final DicomException e = assertThrows(DicomException.class,
                () -> EncapsulatedPixelData.of(unexpectedTag).parseFragments());
        assertTrue(e.getMessage().contains("Unexpected tag (0008,0010)"), e.getMessage());

        final byte[] undefinedItem = {
                (byte) 0xFE, FF, 0x00, (byte) 0xE0, 0, 0, 0, 0,
                (byte) 0xFE, FF, 0x00, (byte) 0xE0, FF, FF, FF, FF};
        assertThrows(DicomException.class, () -> EncapsulatedPixelData.of(undefinedItem).parseFragments());

        final byte[] truncated = {
                (byte) 0xFE, FF, 0x00, (byte) 0xE0, 0, 0, 0, 0,
                (byte) 0xFE, FF, 0x00, (byte) 0xE0, 8, 0, 0, 0, 1, 2};
        final List<String> warnings = new ArrayList<>();
        final List<byte[]> fragments = EncapsulatedPixelData.of(truncated)
                .setWarningListener(warnings::add).fragments();
        assertEquals(1, fragments.size());
        assertArrayEquals(new byte[]{1, 2}, fragments.get(0));
        assertEquals(1, warnings.size());
    }
}
