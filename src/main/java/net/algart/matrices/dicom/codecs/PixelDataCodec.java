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

package net.algart.matrices.dicom.codecs;

import net.algart.matrices.dicom.DicomException;

/**
 * Codec of one frame of pixel data: the bytes of an encapsulated frame are decoded into
 * uncompressed little-endian samples, and vice versa.
 *
 * <p>Implementations must be stateless or thread-safe: the same codec instance may be used
 * for decoding different frames in parallel threads.
 */
public interface PixelDataCodec {
    /**
     * Compresses one frame.
     *
     * @param data    uncompressed frame: little-endian samples, the layout is specified by
     *                {@link PixelDataOptions#getPlanarConfiguration() planar configuration}.
     * @param options pixel metadata and codec parameters.
     * @return encoded frame.
     * @throws DicomException if the data cannot be compressed with the given parameters.
     */
    byte[] compress(byte[] data, PixelDataOptions options) throws DicomException;

    /**
     * Decompresses one frame.
     *
     * @param data    encoded frame.
     * @param options pixel metadata and codec parameters.
     * @return uncompressed little-endian samples.
     * @throws DicomException if the data are corrupted or cannot be decoded by this codec.
     */
    byte[] decompress(byte[] data, PixelDataOptions options) throws DicomException;
}
