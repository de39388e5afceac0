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
import net.algart.matrices.dicom.codecs.PixelDataOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Configurable plugin for testing the dispatching logic.
 */
final class StubPlugin implements PixelDataPlugin {
    interface Decoding {
        DecodedFrame decode(int index, byte[] data, PixelDataOptions options) throws DicomException;
    }

    interface Encoding {
        byte[] encode(byte[] data, PixelDataOptions options) throws DicomException;
    }

    private final String name;
    private final List<String> missingDependencies;
    private final Decoding decoding;
    private final Encoding encoding;
    final List<Integer> decodedIndexes = new ArrayList<>();
    final List<PixelDataOptions> encodingOptions = new ArrayList<>();

    StubPlugin(String name, List<String> missingDependencies, Decoding decoding, Encoding encoding) {
        this.name = name;
        this.missingDependencies = List.copyOf(missingDependencies);
        this.decoding = decoding;
        this.encoding = encoding;
    }

    static StubPlugin decoding(String name, Decoding decoding) {
        return new StubPlugin(name, List.of(), decoding, StubPlugin::unsupported);
    }

    static StubPlugin encoding(String name, Encoding encoding) {
        return new StubPlugin(name, List.of(), StubPlugin::unsupported, encoding);
    }

    static StubPlugin failing(String name) {
        return new StubPlugin(name, List.of(), StubPlugin::unsupported, StubPlugin::unsupported);
    }

    static StubPlugin missing(String name, String... libraries) {
        return new StubPlugin(name, List.of(libraries), StubPlugin::unsupported, StubPlugin::unsupported);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> missingDependencies() {
        return missingDependencies;
    }

    @Override
    public DecodedFrame decode(int index, byte[] data, PixelDataOptions options) throws DicomException {
        decodedIndexes.add(index);
        return decoding.decode(index, data, options);
    }

    @Override
    public byte[] encode(byte[] data, PixelDataOptions options) throws DicomException {
        encodingOptions.add(options);
        return encoding.encode(data, options);
    }

    @Override
    public String toString() {
        return "stub plugin " + name;
    }

    private static DecodedFrame unsupported(int index, byte[] data, PixelDataOptions options)
            throws DicomException {
        throw new DicomException("stub failure on frame " + index);
    }

    private static byte[] unsupported(byte[] data, PixelDataOptions options) throws DicomException {
        throw new DicomException("stub failure");
    }
}
