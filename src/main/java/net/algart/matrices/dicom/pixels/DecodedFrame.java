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

package net.algart.matrices.dicom.pixels;

import java.util.Objects;

/**
 * One decoded frame: little-endian samples, stored in containers of {@code bitsAllocated} bits.
 * The container may be narrower than Bits Allocated of the dataset: some codecs return the minimal
 * container, which is enough for the actual precision of the frame.
 *
 * @param index         frame index.
 * @param data          decoded samples.
 * @param bitsAllocated bits per container: 1, 8, 16, 32 or 64.
 */
public record DecodedFrame(int index, byte[] data, int bitsAllocated) {
    public DecodedFrame {
        Objects.requireNonNull(data, "Null data");
        if (index < 0) {
            throw new IllegalArgumentException("Negative frame index = " + index);
        }
        if (bitsAllocated != 1 && (bitsAllocated <= 0 || bitsAllocated > 64 || bitsAllocated % 8 != 0)) {
            throw new IllegalArgumentException("Illegal bits allocated " + bitsAllocated);
        }
    }

    public int length() {
        return data.length;
    }

    @Override
    public String toString() {
        return "decoded frame #" + index + " (" + data.length + " bytes, " + bitsAllocated + " bits allocated)";
    }
}
