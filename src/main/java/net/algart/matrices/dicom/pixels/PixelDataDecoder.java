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
import net.algart.matrices.dicom.DicomIO;
import net.algart.matrices.dicom.TransferSyntax;
import net.algart.matrices.dicom.UnsupportedDicomFormatException;
import net.algart.matrices.dicom.codecs.PixelDataOptions;
import net.algart.matrices.dicom.encapsulation.EncapsulatedFrame;
import net.algart.matrices.dicom.encapsulation.EncapsulatedFrameIterator;
import net.algart.matrices.dicom.encapsulation.EncapsulatedPixelData;
import net.algart.matrices.dicom.encapsulation.ExtendedOffsetTable;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Decoder of the pixel data of one image.
 *
 * <p>Pixel metadata are validated once, in the constructor. Native (uncompressed) pixel data are sliced
 * into frames directly. Encapsulated frames are decoded by the plugins of the transfer syntax,
 * which are tried in the order of registration; the first successful result is returned, and if all
 * plugins fail, one exception lists the failure of every plugin. The caller may pin a plugin by
 * {@link #setPluginName(String)}.
 *
 * <p>The plugin, which decoded the previous frame, is tried first for the next frame.
 * All decoded data are little-endian.
 *
 * <p>This class is not thread-safe; use a separate instance in every thread.
 */
public final class PixelDataDecoder {
    private static final System.Logger LOG = System.getLogger(PixelDataDecoder.class.getName());
    private static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    private final TransferSyntax transferSyntax;
    private final PixelDataOptions options;
    private final List<PixelDataPlugin> plugins;
    private String pluginName = null;

    private List<PixelDataPlugin> availablePlugins = null;
    private PixelDataPlugin lastPlugin = null;

    /**
     * Creates a decoder with the plugins, registered in {@link PixelDataCompression}.
     *
     * @param transferSyntax transfer syntax of the pixel data.
     * @param options        pixel metadata; will be cloned.
     * @throws DicomException if the metadata are incomplete or invalid.
     */
    public PixelDataDecoder(TransferSyntax transferSyntax, PixelDataOptions options) throws DicomException {
        this(transferSyntax, options, registeredPlugins(transferSyntax));
    }

    public PixelDataDecoder(TransferSyntax transferSyntax, PixelDataOptions options, List<PixelDataPlugin> plugins)
            throws DicomException {
        this.transferSyntax = Objects.requireNonNull(transferSyntax, "Null transfer syntax");
        Objects.requireNonNull(options, "Null options");
        Objects.requireNonNull(plugins, "Null plugins");
        this.options = options.clone();
        this.options.validate(transferSyntax);
        this.plugins = List.copyOf(plugins);
    }

    public TransferSyntax transferSyntax() {
        return transferSyntax;
    }

    /**
     * Returns a copy of the pixel metadata. Note: the number of frames may increase after
     * {@link #decodeAll(EncapsulatedPixelData)}, if more frames were found than expected.
     *
     * @return pixel metadata.
     */
    public PixelDataOptions options() {
        return options.clone();
    }

    public List<PixelDataPlugin> plugins() {
        return plugins;
    }

    public int numberOfFrames() {
        return options.numberOfFrames();
    }

    /**
     * Returns the length of one decoded frame in bytes, when it is stored in containers of
     * Bits Allocated bits.
     *
     * @return frame length.
     */
    public long frameLength() {
        return options.frameLength(transferSyntax);
    }

    public String getPluginName() {
        return pluginName;
    }

    /**
     * Pins the plugin, which should be used for decoding.
     *
     * @param pluginName plugin name or {@code null} to try all available plugins.
     * @return a reference to this object.
     */
    public PixelDataDecoder setPluginName(String pluginName) {
        this.pluginName = pluginName;
        this.availablePlugins = null;
        this.lastPlugin = null;
        return this;
    }

    /**
     * Checks the length of the whole pixel data value. Too short native data are an error;
     * excess padding, and encapsulated data having the length of uncompressed data, are reported as warnings.
     *
     * @param actualLength length of the pixel data value.
     * @throws DicomException if the native data are too short.
     */
    public void validateLength(long actualLength) throws DicomException {
        final long expected = expectedTotalLength();
        if (transferSyntax.isEncapsulated()) {
            if (actualLength == expected || actualLength == expected + expected % 2) {
                options.warn(LOG, "The number of bytes of compressed pixel data matches the expected " +
                        "number for uncompressed data - check you have set the correct transfer syntax");
            }
            return;
        }
        final long padded = expected + expected % 2;
        if (actualLength < padded) {
            if (actualLength != expected) {
                throw new DicomException("The number of bytes of pixel data is less than expected (" +
                        actualLength + " vs " + padded + " bytes) - the dataset may be corrupted, have an " +
                        "invalid group 0028 element value, or the transfer syntax may be incorrect");
            }
        } else if (actualLength > padded) {
            if ("YBR_FULL_422".equals(options.getPhotometricInterpretation())) {
                final long ybrLength = expected / 2 * 3;
                if (actualLength >= ybrLength + ybrLength % 2) {
                    throw new DicomException("The number of bytes of pixel data is a third larger than " +
                            "expected (" + actualLength + " vs " + expected + " bytes) which indicates " +
                            "the set photometric interpretation 'YBR_FULL_422' is incorrect");
                }
            }
            options.warn(LOG, "The pixel data is " + actualLength + " bytes long, which indicates it " +
                    "contains " + (actualLength - expected) + " bytes of excess padding to be removed");
        }
    }

    /**
     * Decodes one frame of the pixel data value.
     *
     * @param pixelData whole value of the pixel data element (native or encapsulated).
     * @param index     frame index.
     * @return decoded frame.
     * @throws IOException if the frame cannot be decoded.
     */
    public DecodedFrame decode(byte[] pixelData, int index) throws IOException {
        Objects.requireNonNull(pixelData, "Null pixel data");
        validateLength(pixelData.length);
        if (transferSyntax.isNative()) {
            checkIndex(index);
            return nativeFrame(pixelData, index);
        }
        return decode(encapsulated(pixelData), index);
    }

    /**
     * Decodes one encapsulated frame. Only the fragments of this frame are read, if the frame
     * offset is known from the offset tables.
     *
     * @param pixelData encapsulated pixel data.
     * @param index     frame index.
     * @return decoded frame.
     * @throws IOException if the frame cannot be found or decoded.
     */
    public DecodedFrame decode(EncapsulatedPixelData pixelData, int index) throws IOException {
        Objects.requireNonNull(pixelData, "Null pixel data");
        checkEncapsulated();
        checkIndex(index);
        return checkLength(decodeFrame(index, pixelData.getFrame(index)));
    }

    /**
     * Decodes one encoded frame: the main dispatching method.
     *
     * @param index frame index (for diagnostic messages).
     * @param data  encoded frame.
     * @return decoded frame; its length is not checked.
     * @throws DicomException if all plugins failed or no plugin is available.
     */
    public DecodedFrame decodeFrame(int index, byte[] data) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        checkEncapsulated();
        final List<PixelDataPlugin> available = availablePlugins();
        long t1 = DicomIO.debugTime();
        final PixelDataPlugin previous = lastPlugin;
        if (previous != null && available.size() > 1) {
            try {
                final DecodedFrame result = previous.decode(index, data, options);
                logTiming(t1, index, previous);
                return result;
            } catch (DicomException | RuntimeException e) {
                options.warn(LOG, "The decoding plugin '" + previous.name() +
                        "' failed to decode the frame at index " + index);
                LOG.log(System.Logger.Level.DEBUG, "Decoding failure: " + e.getMessage(), e);
            }
        }
        final List<String> failures = new ArrayList<>();
        for (PixelDataPlugin plugin : available) {
            final DecodedFrame result;
            try {
                result = plugin.decode(index, data, options);
            } catch (DicomException | RuntimeException e) {
                failures.add(plugin.name() + ": " + e.getMessage());
                continue;
            }
            if (previous != null && previous != plugin) {
                options.warn(LOG, "The decoding plugin has changed from '" + previous.name() + "' to '" +
                        plugin.name() + "' during the decoding process - you may get inconsistent inter-frame " +
                        "results, consider pinning the plugin '" + plugin.name() + "' instead");
            }
            lastPlugin = plugin;
            logTiming(t1, index, plugin);
            return result;
        }
        throw new DicomException("Unable to decode as exceptions were raised by all available plugins:\n  " +
                String.join("\n  ", failures));
    }

    /**
     * Returns a lazy iterator over the decoded frames of the pixel data value.
     *
     * @param pixelData whole value of the pixel data element (native or encapsulated).
     * @return iterator; its methods throw {@link UncheckedIOException} in the case of decoding errors.
     * @throws DicomException if the length of native data is too short.
     */
    public Iterator<DecodedFrame> iterator(byte[] pixelData) throws DicomException {
        Objects.requireNonNull(pixelData, "Null pixel data");
        validateLength(pixelData.length);
        if (transferSyntax.isNative()) {
            return new NativeIterator(pixelData);
        }
        return iterator(encapsulated(pixelData));
    }

    public Iterator<DecodedFrame> iterator(EncapsulatedPixelData pixelData) {
        Objects.requireNonNull(pixelData, "Null pixel data");
        return new EncapsulatedIterator(pixelData.frameIterator());
    }

    /**
     * Decodes all frames and concatenates them. If the frames were decoded into containers of different
     * sizes, narrower samples are widened to the widest container (with sign extension for signed data);
     * the result reports the actual container size.
     *
     * @param pixelData whole value of the pixel data element (native or encapsulated).
     * @return all decoded frames.
     * @throws IOException if some frame cannot be decoded.
     */
    public DecodedPixels decodeAll(byte[] pixelData) throws IOException {
        Objects.requireNonNull(pixelData, "Null pixel data");
        if (transferSyntax.isNative()) {
            validateLength(pixelData.length);
            final int n = options.numberOfFrames();
            final List<DecodedFrame> frames = new ArrayList<>(n);
            for (int k = 0; k < n; k++) {
                frames.add(nativeFrame(pixelData, k));
            }
            return concatenate(frames);
        }
        validateLength(pixelData.length);
        return decodeAll(encapsulated(pixelData));
    }

    public DecodedPixels decodeAll(EncapsulatedPixelData pixelData) throws IOException {
        Objects.requireNonNull(pixelData, "Null pixel data");
        checkEncapsulated();
        final int n = options.numberOfFrames();
        final EncapsulatedFrameIterator iterator = pixelData.frameIterator();
        final List<DecodedFrame> frames = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            final EncapsulatedFrame frame = iterator.nextFrame();
            if (frame == null) {
                throw new DicomException("There is insufficient pixel data to contain " + n + " frames");
            }
            frames.add(checkLength(decodeFrame(k, frame.bytes())));
        }
        // Excess frames may appear when the frame boundaries were found by JPEG markers
        int excess = 0;
        EncapsulatedFrame frame;
        while ((frame = iterator.nextFrame()) != null) {
            final DecodedFrame decoded = decodeFrame(frame.index(), frame.bytes());
            if (decoded.length() == expectedLength(decoded.bitsAllocated())) {
                frames.add(decoded);
                excess++;
            }
        }
        if (excess > 0) {
            options.setNumberOfFrames(n + excess);
            options.warn(LOG, "More frames have been found in the encapsulated pixel data than expected " +
                    "from the supplied number of frames");
        }
        return concatenate(frames);
    }

    @Override
    public String toString() {
        return "pixel data decoder for " + transferSyntax +
                (pluginName != null ? " (plugin '" + pluginName + "')" : "") + ", " + options;
    }

    static List<PixelDataPlugin> registeredPlugins(TransferSyntax transferSyntax) {
        Objects.requireNonNull(transferSyntax, "Null transfer syntax");
        return PixelDataCompression.fromTransferSyntax(transferSyntax)
                .map(PixelDataCompression::decodingPlugins)
                .orElse(List.of());
    }

    static String requirements(List<String> missing) {
        if (missing.size() <= 1) {
            return String.join("", missing);
        }
        return String.join(", ", missing.subList(0, missing.size() - 1)) + " and " + missing.get(missing.size() - 1);
    }

    static byte[] widen(byte[] data, int fromBits, int toBits, boolean signed) {
        if (fromBits == toBits) {
            return data;
        }
        if (fromBits % 8 != 0 || toBits % 8 != 0 || fromBits > toBits) {
            throw new IllegalArgumentException("Cannot widen " + fromBits + "-bit samples to " + toBits + " bits");
        }
        final int from = fromBits / 8;
        final int to = toBits / 8;
        final int numberOfSamples = data.length / from;
        final byte[] result = new byte[numberOfSamples * to];
        for (int i = 0, src = 0, dest = 0; i < numberOfSamples; i++, src += from, dest += to) {
            System.arraycopy(data, src, result, dest, from);
            if (signed && data[src + from - 1] < 0) {
                for (int k = from; k < to; k++) {
                    result[dest + k] = (byte) 0xFF;
                }
            }
        }
        return result;
    }

    private List<PixelDataPlugin> availablePlugins() throws UnsupportedDicomFormatException {
        if (availablePlugins != null) {
            return availablePlugins;
        }
        if (plugins.isEmpty()) {
            throw new UnsupportedDicomFormatException("Unable to decode pixel data with a transfer syntax of " +
                    transferSyntax + " as there are no decoding plugins registered for it");
        }
        if (pluginName != null) {
            final PixelDataPlugin plugin = plugins.stream()
                    .filter(p -> p.name().equals(pluginName)).findFirst().orElse(null);
            if (plugin == null) {
                throw new UnsupportedDicomFormatException("No decoding plugin named '" + pluginName +
                        "' has been added to the decoder for " + transferSyntax);
            }
            final List<String> missing = plugin.missingDependencies();
            if (!missing.isEmpty()) {
                throw new UnsupportedDicomFormatException("Unable to decode with the '" + pluginName +
                        "' decoding plugin because it's missing dependencies - requires " + requirements(missing));
            }
            availablePlugins = List.of(plugin);
            return availablePlugins;
        }
        final List<PixelDataPlugin> result = new ArrayList<>();
        final List<String> unavailable = new ArrayList<>();
        for (PixelDataPlugin plugin : plugins) {
            final List<String> missing = plugin.missingDependencies();
            if (missing.isEmpty()) {
                result.add(plugin);
            } else {
                unavailable.add(plugin.name() + " - requires " + requirements(missing));
            }
        }
        if (result.isEmpty()) {
            throw new UnsupportedDicomFormatException("Unable to decode because the decoding plugins are all " +
                    "missing dependencies:\n\t" + String.join("\n\t", unavailable));
        }
        if (LOGGABLE_DEBUG && !unavailable.isEmpty()) {
            LOG.log(System.Logger.Level.DEBUG, () -> "Unavailable decoding plugins: " + unavailable);
        }
        availablePlugins = List.copyOf(result);
        return availablePlugins;
    }

    private EncapsulatedPixelData encapsulated(byte[] pixelData) {
        final EncapsulatedPixelData result = EncapsulatedPixelData.of(pixelData)
                .setNumberOfFrames(options.numberOfFrames())
                .setWarningListener(options.getWarningListener());
        if (options.hasExtendedOffsetTable()) {
            result.setExtendedOffsetTable(new ExtendedOffsetTable(
                    options.getExtendedOffsets(), options.getExtendedOffsetLengths()));
        }
        return result;
    }

    private DecodedFrame nativeFrame(byte[] pixelData, int index) throws DicomException {
        final int bitsAllocated = options.bitsAllocated();
        final byte[] result;
        if (bitsAllocated == 1) {
            final long numberOfBits = (long) options.rows() * options.columns() * options.samplesPerPixel();
            final long start = numberOfBits * index;
            if ((start + numberOfBits + 7) / 8 > pixelData.length) {
                throw new DicomException("There is insufficient pixel data to contain " + (index + 1) + " frames");
            }
            result = extractBits(pixelData, start, numberOfBits);
        } else {
            final long frameLength = frameLength();
            final long start = frameLength * index;
            if (start + frameLength > pixelData.length) {
                throw new DicomException("There is insufficient pixel data to contain " + (index + 1) + " frames");
            }
            result = new byte[(int) frameLength];
            System.arraycopy(pixelData, (int) start, result, 0, result.length);
            if (!transferSyntax.isLittleEndian() && bitsAllocated > 8) {
                swapBytes(result, bitsAllocated / 8);
            }
        }
        return new DecodedFrame(index, result, bitsAllocated);
    }

    private DecodedPixels concatenate(List<DecodedFrame> frames) {
        int widest = 0;
        for (DecodedFrame frame : frames) {
            widest = Math.max(widest, frame.bitsAllocated());
        }
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        for (DecodedFrame frame : frames) {
            if (frame.bitsAllocated() != widest && LOGGABLE_DEBUG) {
                final int bits = widest;
                LOG.log(System.Logger.Level.DEBUG, () -> "Widening " + frame + " to " + bits + " bits");
            }
            output.writeBytes(widen(frame.data(), frame.bitsAllocated(), widest, options.isSigned()));
        }
        return new DecodedPixels(output.toByteArray(), widest == 0 ? options.bitsAllocated() : widest,
                frames.size());
    }

    private DecodedFrame checkLength(DecodedFrame frame) throws DicomException {
        final long expected = expectedLength(frame.bitsAllocated());
        if (frame.length() != expected) {
            throw new DicomException("Unexpected number of bytes in the decoded frame with index " +
                    frame.index() + " (" + frame.length() + " bytes actual vs " + expected + " expected)");
        }
        return frame;
    }

    private long expectedLength(int bitsAllocated) {
        if (bitsAllocated == 1 || bitsAllocated == options.bitsAllocated()) {
            return options.frameLength(null);
        }
        return (long) options.rows() * options.columns() * options.samplesPerPixel() * (bitsAllocated / 8);
    }

    private long expectedTotalLength() {
        if (options.bitsAllocated() == 1) {
            return ((long) options.rows() * options.columns() * options.samplesPerPixel() *
                    options.numberOfFrames() + 7) / 8;
        }
        return frameLength() * options.numberOfFrames();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= options.numberOfFrames()) {
            throw new IndexOutOfBoundsException("Frame index " + index + " is out of range 0.." +
                    (options.numberOfFrames() - 1));
        }
    }

    private void checkEncapsulated() {
        if (!transferSyntax.isEncapsulated()) {
            throw new IllegalStateException("Pixel data of " + transferSyntax + " are not encapsulated");
        }
    }

    private void logTiming(long t1, int index, PixelDataPlugin plugin) {
        if (DicomIO.BUILT_IN_TIMING && LOGGABLE_DEBUG) {
            long t2 = DicomIO.debugTime();
            LOG.log(System.Logger.Level.DEBUG, String.format(Locale.US,
                    "%s decoded frame #%d by plugin '%s': %.3f ms",
                    getClass().getSimpleName(), index, plugin.name(), (t2 - t1) * 1e-6));
        }
    }

    private static byte[] extractBits(byte[] data, long start, long numberOfBits) {
        final byte[] result = new byte[(int) ((numberOfBits + 7) / 8)];
        if (start % 8 == 0) {
            System.arraycopy(data, (int) (start / 8), result, 0, result.length);
            if (numberOfBits % 8 != 0) {
                result[result.length - 1] &= (byte) ((1 << (numberOfBits % 8)) - 1);
            }
            return result;
        }
        for (long k = 0; k < numberOfBits; k++) {
            final long bit = start + k;
            if ((data[(int) (bit >>> 3)] & (1 << (bit & 7))) != 0) {
                result[(int) (k >>> 3)] |= (byte) (1 << (k & 7));
            }
        }
        return result;
    }

    private static void swapBytes(byte[] data, int bytesPerSample) {
        for (int p = 0; p + bytesPerSample <= data.length; p += bytesPerSample) {
            for (int i = 0, j = bytesPerSample - 1; i < j; i++, j--) {
                final byte b = data[p + i];
                data[p + i] = data[p + j];
                data[p + j] = b;
            }
        }
    }

    private final class NativeIterator implements Iterator<DecodedFrame> {
        private final byte[] pixelData;
        private int index = 0;

        private NativeIterator(byte[] pixelData) {
            this.pixelData = pixelData;
        }

        @Override
        public boolean hasNext() {
            return index < options.numberOfFrames();
        }

        @Override
        public DecodedFrame next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more frames");
            }
            try {
                return nativeFrame(pixelData, index++);
            } catch (DicomException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    private final class EncapsulatedIterator implements Iterator<DecodedFrame> {
        private final EncapsulatedFrameIterator frames;

        private EncapsulatedIterator(EncapsulatedFrameIterator frames) {
            this.frames = frames;
        }

        @Override
        public boolean hasNext() {
            return frames.hasNext();
        }

        @Override
        public DecodedFrame next() {
            final EncapsulatedFrame frame = frames.next();
            try {
                return checkLength(decodeFrame(frame.index(), frame.bytes()));
            } catch (DicomException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
