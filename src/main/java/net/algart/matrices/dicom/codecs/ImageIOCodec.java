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
import net.algart.matrices.dicom.UnsupportedDicomFormatException;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Objects;

/**
 * Codec, based on Java Image I/O plugins for the given format name ("jpeg", "jpeg2000", etc.).
 * Built-in JDK plugins support baseline JPEG only; other formats require additional plugins
 * registered in {@link ImageIO}.
 *
 * <p>Decoded samples are returned as little-endian 8- or 16-bit values.
 */
public class ImageIOCodec implements PixelDataCodec {
    private final String formatName;

    public ImageIOCodec(String formatName) {
        this.formatName = Objects.requireNonNull(formatName, "Null format name");
    }

    public String formatName() {
        return formatName;
    }

    public static boolean isReaderAvailable(String formatName) {
        Objects.requireNonNull(formatName, "Null format name");
        return ImageIO.getImageReadersByFormatName(formatName).hasNext();
    }

    public static boolean isWriterAvailable(String formatName) {
        Objects.requireNonNull(formatName, "Null format name");
        return ImageIO.getImageWritersByFormatName(formatName).hasNext();
    }

    @Override
    public byte[] compress(byte[] data, PixelDataOptions options) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        Objects.requireNonNull(options, "Null codec options");
        final int samplesPerPixel = options.samplesPerPixel();
        final int bitsAllocated = options.bitsAllocated();
        if (samplesPerPixel != 1 && samplesPerPixel != 3) {
            throw new UnsupportedDicomFormatException("Compression in " + formatName + " format for " +
                    samplesPerPixel + " samples per pixel is not supported");
        }
        if (bitsAllocated != 8 && !(bitsAllocated == 16 && samplesPerPixel == 1)) {
            throw new UnsupportedDicomFormatException("Compression in " + formatName + " format for " +
                    bitsAllocated + "-bit data with " + samplesPerPixel + " samples per pixel is not supported");
        }
        if (options.isSigned()) {
            throw new UnsupportedDicomFormatException("Compression in " + formatName +
                    " format for signed data is not supported");
        }
        final BufferedImage image = makeImage(data, options);
        final ImageWriter writer = findJDKCodec(ImageIO.getImageWritersByFormatName(formatName));
        if (writer == null) {
            throw new UnsupportedDicomFormatException("Cannot write " + formatName +
                    ": no necessary registered Image I/O plugin");
        }
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (ImageOutputStream ios = new MemoryCacheImageOutputStream(output)) {
            writer.setOutput(ios);
            final ImageWriteParam writeParam = writer.getDefaultWriteParam();
            if (options.hasQuality() && writeParam.canWriteCompressed()) {
                writeParam.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                final String[] types = writeParam.getCompressionTypes();
                if (types != null && types.length > 0 && writeParam.getCompressionType() == null) {
                    writeParam.setCompressionType(types[0]);
                }
                writeParam.setCompressionQuality((float) Math.min(options.getQuality(), 1.0));
            }
            writer.write(null, new IIOImage(image, null, null), writeParam);
        } catch (IOException e) {
            throw new DicomException("Cannot compress " + formatName + " data", e);
        } finally {
            writer.dispose();
        }
        return output.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data, PixelDataOptions options) throws DicomException {
        Objects.requireNonNull(data, "Null data");
        Objects.requireNonNull(options, "Null codec options");
        final ImageReader reader = findJDKCodec(ImageIO.getImageReadersByFormatName(formatName));
        if (reader == null) {
            throw new UnsupportedDicomFormatException("Cannot read " + formatName +
                    ": no necessary registered Image I/O plugin");
        }
        final BufferedImage image;
        try (ImageInputStream stream = new MemoryCacheImageInputStream(new ByteArrayInputStream(data))) {
            reader.setInput(stream, true, true);
            image = reader.read(0, reader.getDefaultReadParam());
        } catch (IOException | RuntimeException e) {
            throw new DicomException("Cannot decode " + formatName + " frame: " + e.getMessage(), e);
        } finally {
            reader.dispose();
        }
        return pixelBytes(image.getRaster(), options.isPlanar());
    }

    static byte[] pixelBytes(Raster raster, boolean planar) throws DicomException {
        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final int bands = raster.getNumBands();
        final int dataType = raster.getDataBuffer().getDataType();
        final int bytesPerSample = switch (dataType) {
            case DataBuffer.TYPE_BYTE -> 1;
            case DataBuffer.TYPE_USHORT, DataBuffer.TYPE_SHORT -> 2;
            default -> throw new UnsupportedDicomFormatException("Unsupported decoded image data type " +
                    dataType);
        };
        final int numberOfPixels = width * height;
        final byte[] result = new byte[numberOfPixels * bands * bytesPerSample];
        final int[] samples = new int[numberOfPixels];
        for (int band = 0; band < bands; band++) {
            raster.getSamples(0, 0, width, height, band, samples);
            for (int p = 0; p < numberOfPixels; p++) {
                final int index = (planar ? band * numberOfPixels + p : p * bands + band) * bytesPerSample;
                result[index] = (byte) samples[p];
                if (bytesPerSample == 2) {
                    result[index + 1] = (byte) (samples[p] >>> 8);
                }
            }
        }
        return result;
    }

    private static BufferedImage makeImage(byte[] data, PixelDataOptions options) throws DicomException {
        final int width = options.columns();
        final int height = options.rows();
        final int bands = options.samplesPerPixel();
        final int bytesPerSample = options.bitsAllocated() / 8;
        final int numberOfPixels = width * height;
        if (data.length < numberOfPixels * bands * bytesPerSample) {
            throw new DicomException("Too short frame: " + data.length + " bytes instead of " +
                    numberOfPixels * bands * bytesPerSample);
        }
        final int type = bands == 3 ? BufferedImage.TYPE_3BYTE_BGR :
                bytesPerSample == 2 ? BufferedImage.TYPE_USHORT_GRAY : BufferedImage.TYPE_BYTE_GRAY;
        final BufferedImage result = new BufferedImage(width, height, type);
        final WritableRaster raster = result.getRaster();
        final boolean planar = options.isPlanar();
        final int[] samples = new int[numberOfPixels];
        for (int band = 0; band < bands; band++) {
            for (int p = 0; p < numberOfPixels; p++) {
                final int index = (planar ? band * numberOfPixels + p : p * bands + band) * bytesPerSample;
                samples[p] = bytesPerSample == 2 ?
                        (data[index] & 0xFF) | (data[index + 1] & 0xFF) << 8 :
                        data[index] & 0xFF;
            }
            raster.setSamples(0, 0, width, height, band, samples);
        }
        return result;
    }

    // Prefers the plugins, built into JDK, which have the most predictable behavior.
    private static <T> T findJDKCodec(Iterator<T> iterator) {
        if (!iterator.hasNext()) {
            return null;
        }
        final T first = iterator.next();
        if (isProbableJDKClass(first)) {
            return first;
        }
        while (iterator.hasNext()) {
            final T other = iterator.next();
            if (isProbableJDKClass(other)) {
                return other;
            }
        }
        return first;
    }

    private static boolean isProbableJDKClass(Object o) {
        return o != null && o.getClass().getName().startsWith("com.sun.");
    }

    @Override
    public String toString() {
        return "ImageIOCodec (" + formatName + ")";
    }
}
