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

import java.util.List;

/**
 * Backend, able to decode and/or encode frames of some transfer syntax.
 * A plugin, which dependencies are missing, is never invoked: instead, its
 * {@link #missingDependencies() missing dependencies} are reported to the user.
 */
public interface PixelDataPlugin {
    /**
     * Short name of this plugin, used for pinning it in {@link PixelDataDecoder#setPluginName(String)}.
     *
     * @return plugin name.
     */
    String name();

    /**
     * Returns the human-readable names of the libraries, which are necessary for this plugin
     * but are not available now. Empty list means that the plugin can be used.
     *
     * @return missing libraries or plugins.
     */
    List<String> missingDependencies();

    default boolean isAvailable() {
        return missingDependencies().isEmpty();
    }

    /**
     * Decodes one encapsulated frame.
     *
     * @param index   frame index (for diagnostic messages).
     * @param data    encoded frame.
     * @param options validated pixel metadata.
     * @return decoded little-endian samples together with their container size.
     * @throws DicomException if the frame cannot be decoded.
     */
    DecodedFrame decode(int index, byte[] data, PixelDataOptions options) throws DicomException;

    /**
     * Encodes one frame.
     *
     * @param data    little-endian samples.
     * @param options validated pixel metadata.
     * @return encoded frame.
     * @throws DicomException if the frame cannot be encoded.
     */
    byte[] encode(byte[] data, PixelDataOptions options) throws DicomException;
}
