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
import net.algart.matrices.dicom.TransferSyntax;
import net.algart.matrices.dicom.UnsupportedDicomFormatException;
import net.algart.matrices.dicom.codecs.PixelDataOptions;
import net.algart.matrices.dicom.encapsulation.Encapsulator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Encoder of the pixel data of one image: the mirror of {@link PixelDataDecoder}.
 *
 * <p>Source frames are little-endian samples in containers of Bits Allocated bits.
 * Before passing to a plugin, every sample is resized to the codec container (1, 2, 4 or 8 bytes),
 * which is enough for Bits Allocated bits or, if {@link PixelDataOptions#isIncludeHighBits()} is
 * <code>false</code>, for Bits Stored bits.
 */
public final class PixelDataEncoder {
    private static final System.Logger LOG = System.getLogger(PixelDataEncoder.class.getName());

    private final TransferSyntax transferSyntax;
    private final PixelDataOptions options;
    private final PixelDataOptions codecOptions;
    private final List<PixelDataPlugin> plugins;
    private String pluginName = null;

    public PixelDataEncoder(TransferSyntax transferSyntax, PixelDataOptions options) throws DicomException {
        this(transferSyntax, options, registeredPlugins(transferSyntax));
    }

    public PixelDataEncoder(TransferSyntax transferSyntax, PixelDataOptions options, List<PixelDataPlugin> plugins)
            throws DicomException {
        this.transferSyntax = Objects.requireNonNull(transferSyntax, "Null transfer syntax");
        Objects.requireNonNull(options, "Null options");
        Objects.requireNonNull(plugins, "Null plugins");
        if (!transferSyntax.isEncapsulated()) {
            throw new IllegalArgumentException("Cannot encode pixel data in " + transferSyntax +
                    ": it is not a compressed transfer syntax");
        }
        this.options = options.clone();
        this.options.validate(transferSyntax);
        checkProfile();
        this.codecOptions = this.options.clone().setBitsAllocated(containerBits());
        this.plugins = List.copyOf(plugins);
    }

    public TransferSyntax transferSyntax() {
        return transferSyntax;
    }

    public PixelDataOptions options() {
        return options.clone();
    }

    public String getPluginName() {
        return pluginName;
    }

    public PixelDataEncoder setPluginName(String pluginName) {
        this.pluginName = pluginName;
        return this;
    }

    /**
     * Returns the number of bits in the containers of samples, passed to the codec.
     *
     * @return 8, 16, 32 or 64 (or 1 for binary data).
     */
    public int containerBits() {
        final int bitsAllocated = options.bitsAllocated();
        if (bitsAllocated == 1) {
            return 1;
        }
        final int bits = options.isIncludeHighBits() ? bitsAllocated : options.bitsStored();
        final int bytesToTransfer = (bits + 7) / 8;
        final int containerBytes = switch (bytesToTransfer) {
            case 1 -> 1;
            case 2 -> 2;
            case 3, 4 -> 4;
            default -> 8;
        };
        return 8 * containerBytes;
    }

    /**
     * Encodes one frame.
     *
     * @param frame little-endian samples of one frame.
     * @return encoded frame.
     * @throws DicomException if the frame has incorrect length or all plugins failed.
     */
    public byte[] encodeFrame(byte[] frame) throws DicomException {
        Objects.requireNonNull(frame, "Null frame");
        final long expected = options.frameLength(null);
        if (frame.length != expected) {
            throw new DicomException("The length of the frame to be encoded doesn't match the expected length - " +
                    frame.length + " bytes actual vs. " + expected + " expected");
        }
        final byte[] source = resize(frame);
        final List<String> failures = new ArrayList<>();
        for (PixelDataPlugin plugin : availablePlugins()) {
            try {
                return plugin.encode(source, codecOptions);
            } catch (DicomException | RuntimeException e) {
                failures.add(plugin.name() + ": " + e.getMessage());
            }
        }
        throw new DicomException("Unable to encode as exceptions were raised by all available plugins:\n  " +
                String.join("\n  ", failures));
    }

    /**
     * Encodes all frames of the native pixel data.
     *
     * @param pixelData little-endian samples of all frames.
     * @return encoded frames.
     * @throws DicomException if the data length is incorrect or some frame cannot be encoded.
     */
    public List<byte[]> encodeAll(byte[] pixelData) throws DicomException {
        Objects.requireNonNull(pixelData, "Null pixel data");
        final int n = options.numberOfFrames();
        final long frameLength = options.frameLength(null);
        if (frameLength * n != pixelData.length) {
            throw new DicomException("The length of the data to be encoded doesn't match the expected length - " +
                    pixelData.length + " bytes actual vs. " + frameLength * n + " expected");
        }
        final List<byte[]> result = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            final byte[] frame = new byte[(int) frameLength];
            System.arraycopy(pixelData, (int) (k * frameLength), frame, 0, frame.length);
            result.add(encodeFrame(frame));
            LOG.log(System.Logger.Level.TRACE, () -> "Frame encoded by " + transferSyntax);
        }
        return result;
    }

    /**
     * Encodes all frames and encapsulates them with the Basic Offset Table, one fragment per frame.
     * The Sequence Delimitation Item is not added.
     *
     * @param pixelData little-endian samples of all frames.
     * @return encapsulated value of the pixel data element.
     * @throws DicomException if some frame cannot be encoded.
     */
    public byte[] encodeAndEncapsulate(byte[] pixelData) throws DicomException {
        return Encapsulator.encapsulate(encodeAll(pixelData));
    }

    @Override
    public String toString() {
        return "pixel data encoder for " + transferSyntax +
                (pluginName != null ? " (plugin '" + pluginName + "')" : "") + ", " + options;
    }

    static List<PixelDataPlugin> registeredPlugins(TransferSyntax transferSyntax) {
        Objects.requireNonNull(transferSyntax, "Null transfer syntax");
        return PixelDataCompression.fromTransferSyntax(transferSyntax)
                .map(PixelDataCompression::encodingPlugins)
                .orElse(List.of());
    }

    static byte[] narrow(byte[] data, int fromBits, int toBits) {
        final int from = fromBits / 8;
        final int to = toBits / 8;
        final int numberOfSamples = data.length / from;
        final byte[] result = new byte[numberOfSamples * to];
        for (int i = 0, src = 0, dest = 0; i < numberOfSamples; i++, src += from, dest += to) {
            System.arraycopy(data, src, result, dest, to);
        }
        return result;
    }

    private byte[] resize(byte[] frame) {
        final int bitsAllocated = options.bitsAllocated();
        final int container = codecOptions.bitsAllocated();
        if (container == bitsAllocated) {
            return frame;
        }
        return container < bitsAllocated ?
                narrow(frame, bitsAllocated, container) :
                PixelDataDecoder.widen(frame, bitsAllocated, container, options.isSigned());
    }

    private void checkProfile() throws DicomException {
        final List<EncodingProfile> profiles = PixelDataCompression.fromTransferSyntax(transferSyntax)
                .map(PixelDataCompression::encodingProfiles)
                .orElse(List.of());
        if (profiles.isEmpty() || profiles.stream().anyMatch(p -> p.matches(options))) {
            return;
        }
        throw new DicomException("One or more of the following values is not valid for pixel data " +
                "encoded with '" + transferSyntax.prettyName() + "':\n" +
                "  (0028,0002) Samples per Pixel: " + options.samplesPerPixel() + "\n" +
                "  (0028,0004) Photometric Interpretation: " + options.getPhotometricInterpretation() + "\n" +
                "  (0028,0100) Bits Allocated: " + options.bitsAllocated() + "\n" +
                "  (0028,0101) Bits Stored: " + options.bitsStored() + "\n" +
                "  (0028,0103) Pixel Representation: " + options.pixelRepresentation() + "\n" +
                "See Part 5, Section 8.2 of the DICOM Standard for more information");
    }

    private List<PixelDataPlugin> availablePlugins() throws UnsupportedDicomFormatException {
        if (plugins.isEmpty()) {
            throw new UnsupportedDicomFormatException("Unable to encode pixel data with a transfer syntax of " +
                    transferSyntax + " as there are no encoding plugins registered for it");
        }
        if (pluginName != null) {
            final PixelDataPlugin plugin = plugins.stream()
                    .filter(p -> p.name().equals(pluginName)).findFirst().orElse(null);
            if (plugin == null) {
                throw new UnsupportedDicomFormatException("No encoding plugin named '" + pluginName +
                        "' has been added to the encoder for " + transferSyntax);
            }
            final List<String> missing = plugin.missingDependencies();
            if (!missing.isEmpty()) {
                throw new UnsupportedDicomFormatException("Unable to encode with the '" + pluginName +
                        "' encoding plugin because it's missing dependencies - requires " +
                        PixelDataDecoder.requirements(missing));
            }
            return List.of(plugin);
        }
        final List<PixelDataPlugin> result = new ArrayList<>();
        final List<String> unavailable = new ArrayList<>();
        for (PixelDataPlugin plugin : plugins) {
            final List<String> missing = plugin.missingDependencies();
            if (missing.isEmpty()) {
                result.add(plugin);
            } else {
                unavailable.add(plugin.name() + " - requires " + PixelDataDecoder.requirements(missing));
            }
        }
        if (result.isEmpty()) {
            throw new UnsupportedDicomFormatException("Unable to encode because the encoding plugins are all " +
                    "missing dependencies:\n\t" + String.join("\n\t", unavailable));
        }
        return result;
    }
}
