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

import net.algart.matrices.dicom.DicomException;
import net.algart.matrices.dicom.codecs.ImageIOCodec;
import net.algart.matrices.dicom.codecs.PixelDataCodec;
import net.algart.matrices.dicom.codecs.PixelDataOptions;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Plugin, based on some {@link PixelDataCodec}.
 */
public final class CodecPlugin implements PixelDataPlugin {
    public static final String NATIVE = "algart";
    public static final String IMAGE_IO = "imageio";

    private final String name;
    private final Supplier<PixelDataCodec> codec;
    private final Supplier<List<String>> missingDependencies;

    public CodecPlugin(String name, Supplier<PixelDataCodec> codec, Supplier<List<String>> missingDependencies) {
        this.name = Objects.requireNonNull(name, "Null name");
        this.codec = Objects.requireNonNull(codec, "Null codec supplier");
        this.missingDependencies = Objects.requireNonNull(missingDependencies, "Null missing dependencies");
    }

    /**
     * Returns the plugin for the codec, implemented in this library (always available).
     *
     * @param codec codec constructor.
     * @return new plugin.
     */
    public static CodecPlugin ofNative(Supplier<PixelDataCodec> codec) {
        return new CodecPlugin(NATIVE, codec, List::of);
    }

    /**
     * Returns the plugin, decoding frames by Image I/O reader for the given format.
     *
     * @param formatName Image I/O format name, for example, "jpeg".
     * @param library    name of the library, which provides the reader, if it is not built into JDK.
     * @return new plugin.
     */
    public static CodecPlugin ofImageIOReader(String formatName, String library) {
        Objects.requireNonNull(formatName, "Null format name");
        Objects.requireNonNull(library, "Null library name");
        return new CodecPlugin(IMAGE_IO, () -> new ImageIOCodec(formatName),
                () -> ImageIOCodec.isReaderAvailable(formatName) ? List.of() : List.of(library));
    }

    public static CodecPlugin ofImageIOWriter(String formatName, String library) {
        Objects.requireNonNull(formatName, "Null format name");
        Objects.requireNonNull(library, "Null library name");
        return new CodecPlugin(IMAGE_IO, () -> new ImageIOCodec(formatName),
                () -> ImageIOCodec.isWriterAvailable(formatName) ? List.of() : List.of(library));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> missingDependencies() {
        return missingDependencies.get();
    }

    @Override
    public DecodedFrame decode(int index, byte[] data, PixelDataOptions options) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        Objects.requireNonNull(options, "Null options");
        final byte[] result = codec.get().decompress(data, options);
        return new DecodedFrame(index, result, containerBits(result.length, options));
    }

    @Override
    public byte[] encode(byte[] data, PixelDataOptions options) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        Objects.requireNonNull(options, "Null options");
        return codec.get().compress(data, options);
    }

    // Codecs may return a container, narrower or wider than Bits Allocated (Image I/O returns 8 or 16 bits)
    static int containerBits(long decodedLength, PixelDataOptions options) {
        final int bitsAllocated = options.bitsAllocated();
        if (bitsAllocated == 1) {
            return 1;
        }
        final long numberOfSamples = (long) options.rows() * (long) options.columns() *
                (long) options.samplesPerPixel();
        if (decodedLength % numberOfSamples == 0) {
            final long bytesPerSample = decodedLength / numberOfSamples;
            if (bytesPerSample == 1 || bytesPerSample == 2 || bytesPerSample == 4 || bytesPerSample == 8) {
                return (int) bytesPerSample * 8;
            }
        }
        return bitsAllocated;
    }

    @Override
    public String toString() {
        return "plugin \"" + name + "\" (" + codec.get() + ")";
    }
}
