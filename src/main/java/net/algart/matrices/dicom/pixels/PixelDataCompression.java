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

import net.algart.matrices.dicom.TransferSyntax;
import net.algart.matrices.dicom.codecs.DeflateCodec;
import net.algart.matrices.dicom.codecs.RLECodec;
import net.algart.matrices.dicom.codecs.UncompressedCodec;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered compressions of pixel data: decoding and encoding plugins for every encapsulated
 * transfer syntax, in the order of preference, and allowed combinations of pixel attributes for encoding.
 */
public enum PixelDataCompression {
    ENCAPSULATED_UNCOMPRESSED(TransferSyntax.ENCAPSULATED_UNCOMPRESSED_EXPLICIT_VR_LITTLE_ENDIAN,
            List.of(CodecPlugin.ofNative(UncompressedCodec::new)),
            List.of(CodecPlugin.ofNative(UncompressedCodec::new)),
            List.of()),
    DEFLATED_IMAGE_FRAME(TransferSyntax.DEFLATED_IMAGE_FRAME_COMPRESSION,
            List.of(CodecPlugin.ofNative(DeflateCodec::new)),
            List.of(CodecPlugin.ofNative(DeflateCodec::new)),
            List.of()),
    RLE_LOSSLESS(TransferSyntax.RLE_LOSSLESS,
            List.of(CodecPlugin.ofNative(RLECodec::new)),
            List.of(CodecPlugin.ofNative(RLECodec::new)),
            EncodingProfile.RLE_LOSSLESS),
    JPEG_BASELINE_8BIT(TransferSyntax.JPEG_BASELINE_8BIT,
            List.of(CodecPlugin.ofImageIOReader("jpeg", Libraries.JDK_JPEG)),
            List.of(CodecPlugin.ofImageIOWriter("jpeg", Libraries.JDK_JPEG)),
            EncodingProfile.JPEG_BASELINE_8BIT),
    JPEG_EXTENDED_12BIT(TransferSyntax.JPEG_EXTENDED_12BIT,
            List.of(CodecPlugin.ofImageIOReader("jpeg", Libraries.JDK_JPEG)),
            List.of(),
            EncodingProfile.JPEG_EXTENDED_12BIT),
    JPEG_LOSSLESS(TransferSyntax.JPEG_LOSSLESS,
            List.of(CodecPlugin.ofImageIOReader("jpeg-lossless", Libraries.JPEG_LOSSLESS)),
            List.of(),
            List.of()),
    JPEG_LOSSLESS_SV1(TransferSyntax.JPEG_LOSSLESS_SV1,
            List.of(CodecPlugin.ofImageIOReader("jpeg-lossless", Libraries.JPEG_LOSSLESS)),
            List.of(),
            List.of()),
    JPEG_LS_LOSSLESS(TransferSyntax.JPEG_LS_LOSSLESS,
            List.of(CodecPlugin.ofImageIOReader("jpeg-ls", Libraries.JPEG_LS)),
            List.of(),
            List.of()),
    JPEG_LS_NEAR_LOSSLESS(TransferSyntax.JPEG_LS_NEAR_LOSSLESS,
            List.of(CodecPlugin.ofImageIOReader("jpeg-ls", Libraries.JPEG_LS)),
            List.of(),
            List.of()),
    JPEG_2000_LOSSLESS(TransferSyntax.JPEG_2000_LOSSLESS,
            List.of(CodecPlugin.ofImageIOReader("jpeg2000", Libraries.JPEG_2000)),
            List.of(CodecPlugin.ofImageIOWriter("jpeg2000", Libraries.JPEG_2000)),
            EncodingProfile.JPEG_2000_LOSSLESS),
    JPEG_2000(TransferSyntax.JPEG_2000,
            List.of(CodecPlugin.ofImageIOReader("jpeg2000", Libraries.JPEG_2000)),
            List.of(CodecPlugin.ofImageIOWriter("jpeg2000", Libraries.JPEG_2000)),
            EncodingProfile.JPEG_2000),
    HTJ2K_LOSSLESS(TransferSyntax.HTJ2K_LOSSLESS,
            List.of(CodecPlugin.ofImageIOReader("htj2k", Libraries.HTJ2K)),
            List.of(),
            List.of()),
    HTJ2K_LOSSLESS_RPCL(TransferSyntax.HTJ2K_LOSSLESS_RPCL,
            List.of(CodecPlugin.ofImageIOReader("htj2k", Libraries.HTJ2K)),
            List.of(),
            List.of()),
    HTJ2K(TransferSyntax.HTJ2K,
            List.of(CodecPlugin.ofImageIOReader("htj2k", Libraries.HTJ2K)),
            List.of(),
            List.of());

    private static final Map<TransferSyntax, PixelDataCompression> LOOKUP;

    static {
        final Map<TransferSyntax, PixelDataCompression> map = new EnumMap<>(TransferSyntax.class);
        for (PixelDataCompression v : values()) {
            map.put(v.transferSyntax, v);
        }
        LOOKUP = map;
    }

    private final TransferSyntax transferSyntax;
    private final List<PixelDataPlugin> decodingPlugins;
    private final List<PixelDataPlugin> encodingPlugins;
    private final List<EncodingProfile> encodingProfiles;

    PixelDataCompression(
            TransferSyntax transferSyntax,
            List<PixelDataPlugin> decodingPlugins,
            List<PixelDataPlugin> encodingPlugins,
            List<EncodingProfile> encodingProfiles) {
        assert transferSyntax.isEncapsulated();
        this.transferSyntax = Objects.requireNonNull(transferSyntax);
        this.decodingPlugins = decodingPlugins;
        this.encodingPlugins = encodingPlugins;
        this.encodingProfiles = encodingProfiles;
    }

    public static Optional<PixelDataCompression> fromTransferSyntax(TransferSyntax transferSyntax) {
        Objects.requireNonNull(transferSyntax, "Null transfer syntax");
        return Optional.ofNullable(LOOKUP.get(transferSyntax));
    }

    public TransferSyntax transferSyntax() {
        return transferSyntax;
    }

    public String prettyName() {
        return transferSyntax.prettyName();
    }

    public List<PixelDataPlugin> decodingPlugins() {
        return decodingPlugins;
    }

    public List<PixelDataPlugin> encodingPlugins() {
        return encodingPlugins;
    }

    /**
     * Returns allowed combinations of pixel attributes for encoding. Empty list means that
     * there are no restrictions.
     *
     * @return encoding profiles.
     */
    public List<EncodingProfile> encodingProfiles() {
        return encodingProfiles;
    }

    public boolean isDecodingSupported() {
        return decodingPlugins.stream().anyMatch(PixelDataPlugin::isAvailable);
    }

    public boolean isEncodingSupported() {
        return encodingPlugins.stream().anyMatch(PixelDataPlugin::isAvailable);
    }

    private static final class Libraries {
        static final String JDK_JPEG = "JDK Image I/O JPEG plugin";
        static final String JPEG_LOSSLESS = "Image I/O plugin for 'jpeg-lossless' format";
        static final String JPEG_LS = "Image I/O plugin for 'jpeg-ls' format";
        static final String JPEG_2000 = "jai-imageio-jpeg2000";
        static final String HTJ2K = "Image I/O plugin for 'htj2k' format";
    }
}
