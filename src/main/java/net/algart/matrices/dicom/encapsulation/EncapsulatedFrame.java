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
import java.util.List;
import java.util.Objects;

/**
 * One frame of encapsulated pixel data: the list of its fragments.
 *
 * @param index     index of the frame, starting from 0; -1 for {@link #END} marker.
 * @param fragments data of all fragments without item headers.
 */
public record EncapsulatedFrame(int index, List<byte[]> fragments) {
    /**
     * Special marker, placed into a queue by {@link EncapsulatedFrameIterator#transferTo} after the last frame.
     */
    public static final EncapsulatedFrame END = new EncapsulatedFrame(-1, List.of());

    public EncapsulatedFrame {
        Objects.requireNonNull(fragments, "Null fragments");
        fragments = List.copyOf(fragments);
    }

    public static EncapsulatedFrame of(int index, byte[] data) {
        Objects.requireNonNull(data, "Null data");
        return new EncapsulatedFrame(index, List.of(data));
    }

    public boolean isEnd() {
        return index < 0;
    }

    public int numberOfFragments() {
        return fragments.size();
    }

    /**
     * Returns the frame data: concatenation of all fragments.
     *
     * @return frame bytes.
     */
    public byte[] bytes() {
        if (fragments.size() == 1) {
            return fragments.get(0).clone();
        }
        final ByteArrayOutputStream result = new ByteArrayOutputStream();
        for (byte[] fragment : fragments) {
            result.writeBytes(fragment);
        }
        return result.toByteArray();
    }

    public long length() {
        long result = 0;
        for (byte[] fragment : fragments) {
            result += fragment.length;
        }
        return result;
    }

    /**
     * Returns <code>true</code> if the last 10 bytes of the last fragment contain JPEG EOI (or JPEG 2000 EOC)
     * marker <code>FF D9</code>.
     *
     * @return whether the frame ends with an end-of-image marker.
     */
    public boolean hasEndOfImageMarker() {
        return !fragments.isEmpty() && EncapsulatedPixelData.hasEndOfImageMarker(fragments.get(fragments.size() - 1));
    }

    @Override
    public String toString() {
        return isEnd() ? "end of frames" :
                "frame #" + index + " (" + fragments.size() + " fragments, " + length() + " bytes)";
    }
}
