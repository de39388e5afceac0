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
 * All decoded frames, concatenated into one little-endian buffer.
 *
 * @param data           decoded samples of all frames.
 * @param bitsAllocated  container size of every sample; may differ from Bits Allocated of the dataset
 *                       when the codec returns other containers.
 * @param numberOfFrames actual number of frames (may be greater than the expected one).
 */
public record DecodedPixels(byte[] data, int bitsAllocated, int numberOfFrames) {
    public DecodedPixels {
        Objects.requireNonNull(data, "Null data");
        if (numberOfFrames < 0) {
            throw new IllegalArgumentException("Negative number of frames = " + numberOfFrames);
        }
    }

    public int frameLength() {
        return numberOfFrames == 0 ? 0 : data.length / numberOfFrames;
    }

    @Override
    public String toString() {
        return "decoded pixels: " + numberOfFrames + " frames, " + data.length + " bytes, " +
                bitsAllocated + " bits allocated";
    }
}
