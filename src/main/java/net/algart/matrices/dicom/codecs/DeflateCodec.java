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

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * This class implements raw Deflate compression/decompression (RFC 1951, without ZLIB header),
 * used by Deflated Image Frame Compression transfer syntax.
 */
public class DeflateCodec implements PixelDataCodec {
    @Override
    public byte[] compress(byte[] data, PixelDataOptions options) {
        Objects.requireNonNull(data, "Null data");
        Objects.requireNonNull(options, "Null codec options");
        final Double quality = options.getQuality();
        final int level = quality == null ? Deflater.DEFAULT_COMPRESSION :
                quality <= 0.0 ? 0 : Math.max(1, (int) Math.round(9.0 * Math.min(quality, 1.0)));
        final Deflater deflater = new Deflater(level, true);
        try {
            deflater.setInput(data);
            deflater.finish();
            final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            final byte[] buffer = new byte[65536];
            while (!deflater.finished()) {
                final int compressedSize = deflater.deflate(buffer);
                outputStream.write(buffer, 0, compressedSize);
            }
            return outputStream.toByteArray();
        } finally {
            deflater.end();
        }
    }

    @Override
    public byte[] decompress(byte[] data, PixelDataOptions options) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        return inflate(data);
    }

    /**
     * Inflates raw Deflate data.
     *
     * @param data compressed data.
     * @return decompressed data.
     * @throws DicomException if the data are not a correct Deflate stream.
     */
    public static byte[] inflate(byte[] data) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        final Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(data);
            final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            final byte[] buffer = new byte[65536];
            while (!inflater.finished()) {
                final int decompressedSize = inflater.inflate(buffer);
                if (decompressedSize == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                    // - truncated stream: return what was decoded
                }
                outputStream.write(buffer, 0, decompressedSize);
            }
            return outputStream.toByteArray();
        } catch (DataFormatException e) {
            throw new DicomException("Invalid DICOM data: broken compressed data in Deflate block", e);
        } finally {
            inflater.end();
        }
    }
}
