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
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * Lazy iterator over the frames of {@link EncapsulatedPixelData}. The iterator keeps its own cursor
 * (the position of the next fragment item and the index of the next frame), so the stream may be used
 * for other purposes between calls.
 *
 * <p>{@link #nextFrame()} is the main method; {@link Iterator} methods wrap I/O errors into
 * {@link UncheckedIOException}. For parallel processing, {@link #transferTo(BlockingQueue)} feeds the frames
 * into a bounded queue, read by worker threads.
 */
public final class EncapsulatedFrameIterator implements Iterator<EncapsulatedFrame> {
    private enum Mode {
        EXTENDED_OFFSET_TABLE,
        BASIC_OFFSET_TABLE,
        ONE_FRAGMENT_PER_FRAME,
        ALL_FRAGMENTS_IN_ONE_FRAME,
        END_OF_IMAGE_MARKERS
    }

    private static final System.Logger LOG = System.getLogger(EncapsulatedFrameIterator.class.getName());

    private final EncapsulatedPixelData pixelData;
    private final DataHandle<? extends Location> in;
    private Mode mode = null;
    private long[] basicOffsets = null;
    private long fragmentsStart = -1;
    private long position = -1;
    private int frameIndex = 0;
    private int expectedNumberOfFrames = 0;
    private boolean finished = false;
    private boolean trailingFramesWarned = false;
    private EncapsulatedFrame pending = null;

    EncapsulatedFrameIterator(EncapsulatedPixelData pixelData) {
        this.pixelData = Objects.requireNonNull(pixelData, "Null pixel data");
        this.in = pixelData.stream();
    }

    public EncapsulatedPixelData pixelData() {
        return pixelData;
    }

    /**
     * Returns the index of the frame, which will be returned by the next call of {@link #nextFrame()}.
     *
     * @return the number of frames, returned by this iterator.
     */
    public int frameIndex() {
        return pending != null ? pending.index() : frameIndex;
    }

    /**
     * Reads the next frame.
     *
     * @return the next frame or {@code null} if there are no more frames.
     * @throws IOException if the frame boundaries cannot be determined, if the structure of the encapsulated
     *                     data is invalid, or in the case of I/O error.
     */
    public EncapsulatedFrame nextFrame() throws IOException {
        if (pending != null) {
            final EncapsulatedFrame result = pending;
            pending = null;
            return result;
        }
        if (finished) {
            return null;
        }
        if (mode == null) {
            initialize();
        }
        in.seek(position);
        final EncapsulatedFrame result = switch (mode) {
            case EXTENDED_OFFSET_TABLE -> nextByExtendedOffsetTable();
            case BASIC_OFFSET_TABLE -> nextByBasicOffsetTable();
            case ONE_FRAGMENT_PER_FRAME -> nextSingleFragment();
            case ALL_FRAGMENTS_IN_ONE_FRAME -> nextAllFragments();
            case END_OF_IMAGE_MARKERS -> nextByEndOfImageMarkers();
        };
        position = in.offset();
        if (result == null) {
            finished = true;
        } else {
            frameIndex++;
        }
        return result;
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            try {
                pending = nextFrame();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return pending != null;
    }

    @Override
    public EncapsulatedFrame next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more frames in " + pixelData);
        }
        final EncapsulatedFrame result = pending;
        pending = null;
        return result;
    }

    /**
     * Reads all remaining frames and puts them into the queue, followed by {@link EncapsulatedFrame#END} marker.
     * The marker is put also if reading fails.
     *
     * @param queue destination queue, usually bounded.
     * @return number of frames, put into the queue (not including the marker).
     * @throws IOException          in the case of invalid data or I/O error.
     * @throws InterruptedException if the current thread was interrupted while waiting for the queue.
     */
    public int transferTo(BlockingQueue<? super EncapsulatedFrame> queue) throws IOException, InterruptedException {
        Objects.requireNonNull(queue, "Null queue");
        int count = 0;
        try {
            EncapsulatedFrame frame;
            while ((frame = nextFrame()) != null) {
                queue.put(frame);
                count++;
            }
        } finally {
            queue.put(EncapsulatedFrame.END);
        }
        return count;
    }

    @Override
    public String toString() {
        return "frame iterator (" + (mode == null ? "not started" : mode + ", next frame #" + frameIndex()) +
                ") over " + pixelData;
    }

    private void initialize() throws IOException {
        basicOffsets = pixelData.basicOffsets();
        fragmentsStart = in.offset();
        position = fragmentsStart;
        if (pixelData.hasExtendedOffsetTable()) {
            mode = Mode.EXTENDED_OFFSET_TABLE;
            return;
        }
        if (basicOffsets.length > 0) {
            mode = Mode.BASIC_OFFSET_TABLE;
            return;
        }
        final int numberOfFragments = pixelData.parseFragments(fragmentsStart).length;
        if (numberOfFragments == 1) {
            mode = Mode.ONE_FRAGMENT_PER_FRAME;
            return;
        }
        final Integer numberOfFrames = pixelData.getNumberOfFrames();
        if (numberOfFrames == null || numberOfFrames == 0) {
            throw pixelData.indeterminateFrameBoundaries();
        }
        expectedNumberOfFrames = numberOfFrames;
        if (numberOfFragments == numberOfFrames) {
            mode = Mode.ONE_FRAGMENT_PER_FRAME;
        } else if (numberOfFrames == 1) {
            mode = Mode.ALL_FRAGMENTS_IN_ONE_FRAME;
        } else if (numberOfFragments > numberOfFrames) {
            LOG.log(System.Logger.Level.DEBUG, () -> "%d fragments for %d frames without offset tables, searching for JPEG EOI/EOC markers"
                    .formatted(numberOfFragments, numberOfFrames));
            mode = Mode.END_OF_IMAGE_MARKERS;
        } else {
            throw new DicomException("Unable to generate frames from the encapsulated pixel data as there are " +
                    "fewer fragments than frames (" + numberOfFragments + " vs. " + numberOfFrames +
                    "); the dataset may be corrupt or the number of frames may be incorrect");
        }
    }

    private EncapsulatedFrame nextByExtendedOffsetTable() throws IOException {
        if (frameIndex >= pixelData.getExtendedOffsetTable().numberOfFrames()) {
            return null;
        }
        return EncapsulatedFrame.of(frameIndex, pixelData.readExtendedOffsetFrame(fragmentsStart, frameIndex));
    }

    private EncapsulatedFrame nextByBasicOffsetTable() throws IOException {
        if (frameIndex >= basicOffsets.length) {
            return null;
        }
        final byte[] first = pixelData.nextFragment(Long.MAX_VALUE);
        if (first == null) {
            return null;
        }
        final List<byte[]> fragments = new ArrayList<>();
        fragments.add(first);
        final long limit = frameIndex == basicOffsets.length - 1 ?
                Long.MAX_VALUE :
                fragmentsStart + basicOffsets[frameIndex + 1];
        byte[] fragment;
        while ((fragment = pixelData.nextFragment(limit)) != null) {
            fragments.add(fragment);
        }
        return new EncapsulatedFrame(frameIndex, fragments);
    }

    private EncapsulatedFrame nextSingleFragment() throws IOException {
        final byte[] fragment = pixelData.nextFragment(Long.MAX_VALUE);
        return fragment == null ? null : EncapsulatedFrame.of(frameIndex, fragment);
    }

    private EncapsulatedFrame nextAllFragments() throws IOException {
        if (frameIndex > 0) {
            return null;
        }
        final List<byte[]> fragments = new ArrayList<>();
        byte[] fragment;
        while ((fragment = pixelData.nextFragment(Long.MAX_VALUE)) != null) {
            fragments.add(fragment);
        }
        return new EncapsulatedFrame(frameIndex, fragments);
    }

    private EncapsulatedFrame nextByEndOfImageMarkers() throws IOException {
        final List<byte[]> fragments = new ArrayList<>();
        byte[] fragment;
        while ((fragment = pixelData.nextFragment(Long.MAX_VALUE)) != null) {
            fragments.add(fragment);
            if (EncapsulatedPixelData.hasEndOfImageMarker(fragment)) {
                return new EncapsulatedFrame(frameIndex, fragments);
            }
        }
        if (!fragments.isEmpty()) {
            if (frameIndex >= expectedNumberOfFrames) {
                pixelData.warn("The end of the encapsulated pixel data has been reached but no JPEG EOI/EOC " +
                        "marker was found, the final frame may be invalid");
            } else {
                pixelData.warn("The end of the encapsulated pixel data has been reached but fewer frames than " +
                        "expected have been found. Please confirm that the generated frame data is correct");
                trailingFramesWarned = true;
            }
            return new EncapsulatedFrame(frameIndex, fragments);
        }
        if (frameIndex < expectedNumberOfFrames && !trailingFramesWarned) {
            pixelData.warn("The end of the encapsulated pixel data has been reached but fewer frames than " +
                    "expected have been found");
        }
        return null;
    }
}
