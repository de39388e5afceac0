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

package net.algart.matrices.dicom;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Transfer syntaxes, known by this library: byte order, VR encoding and compression of the main dataset.
 */
public enum TransferSyntax {
    IMPLICIT_VR_LITTLE_ENDIAN("1.2.840.10008.1.2", "Implicit VR Little Endian", true, true, false),
    EXPLICIT_VR_LITTLE_ENDIAN("1.2.840.10008.1.2.1", "Explicit VR Little Endian", false, true, false),
    ENCAPSULATED_UNCOMPRESSED_EXPLICIT_VR_LITTLE_ENDIAN("1.2.840.10008.1.2.1.98",
            "Encapsulated Uncompressed Explicit VR Little Endian", false, true, true),
    DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN("1.2.840.10008.1.2.1.99",
            "Deflated Explicit VR Little Endian", false, true, false),
    EXPLICIT_VR_BIG_ENDIAN("1.2.840.10008.1.2.2", "Explicit VR Big Endian", false, false, false),
    JPEG_BASELINE_8BIT("1.2.840.10008.1.2.4.50", "JPEG Baseline (Process 1)"),
    JPEG_EXTENDED_12BIT("1.2.840.10008.1.2.4.51", "JPEG Extended (Process 2 and 4)"),
    JPEG_LOSSLESS("1.2.840.10008.1.2.4.57", "JPEG Lossless, Non-Hierarchical (Process 14)"),
    JPEG_LOSSLESS_SV1("1.2.840.10008.1.2.4.70", "JPEG Lossless, Non-Hierarchical, First-Order Prediction"),
    JPEG_LS_LOSSLESS("1.2.840.10008.1.2.4.80", "JPEG-LS Lossless Image Compression"),
    JPEG_LS_NEAR_LOSSLESS("1.2.840.10008.1.2.4.81", "JPEG-LS Lossy (Near-Lossless) Image Compression"),
    JPEG_2000_LOSSLESS("1.2.840.10008.1.2.4.90", "JPEG 2000 Image Compression (Lossless Only)"),
    JPEG_2000("1.2.840.10008.1.2.4.91", "JPEG 2000 Image Compression"),
    HTJ2K_LOSSLESS("1.2.840.10008.1.2.4.201", "High-Throughput JPEG 2000 Image Compression (Lossless Only)"),
    HTJ2K_LOSSLESS_RPCL("1.2.840.10008.1.2.4.202",
            "High-Throughput JPEG 2000 with RPCL Options Image Compression (Lossless Only)"),
    HTJ2K("1.2.840.10008.1.2.4.203", "High-Throughput JPEG 2000 Image Compression"),
    RLE_LOSSLESS("1.2.840.10008.1.2.5", "RLE Lossless"),
    DEFLATED_IMAGE_FRAME_COMPRESSION("1.2.840.10008.1.2.8.1", "Deflated Image Frame Compression");

    private static final Map<String, TransferSyntax> LOOKUP = new HashMap<>();

    static {
        for (TransferSyntax v : values()) {
            LOOKUP.put(v.uid, v);
        }
    }

    private final String uid;
    private final String prettyName;
    private final boolean implicitVR;
    private final boolean littleEndian;
    private final boolean encapsulated;

    TransferSyntax(String uid, String prettyName) {
        this(uid, prettyName, false, true, true);
    }

    TransferSyntax(String uid, String prettyName, boolean implicitVR, boolean littleEndian, boolean encapsulated) {
        this.uid = uid;
        this.prettyName = prettyName;
        this.implicitVR = implicitVR;
        this.littleEndian = littleEndian;
        this.encapsulated = encapsulated;
    }

    public String uid() {
        return uid;
    }

    public String prettyName() {
        return prettyName;
    }

    public boolean isImplicitVR() {
        return implicitVR;
    }

    public boolean isLittleEndian() {
        return littleEndian;
    }

    /**
     * Returns <code>true</code> if the pixel data are stored as a sequence of fragments
     * (compressed transfer syntaxes).
     *
     * @return whether the pixel data are encapsulated.
     */
    public boolean isEncapsulated() {
        return encapsulated;
    }

    /**
     * Returns <code>true</code> if the whole dataset after the file meta information is compressed
     * by the deflate algorithm.
     *
     * @return whether this is Deflated Explicit VR Little Endian.
     */
    public boolean isDeflated() {
        return this == DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN;
    }

    /**
     * Returns <code>true</code> for the syntaxes, where pixel data are stored without compression
     * as a plain byte value.
     *
     * @return whether the pixel data are native.
     */
    public boolean isNative() {
        return !encapsulated;
    }

    public static Optional<TransferSyntax> fromUID(String uid) {
        Objects.requireNonNull(uid, "Null UID");
        return Optional.ofNullable(LOOKUP.get(uid.strip()));
    }

    public static TransferSyntax fromUIDOrThrow(String uid) throws UnsupportedDicomFormatException {
        return fromUID(uid).orElseThrow(() ->
                new UnsupportedDicomFormatException("Unknown transfer syntax UID '" + uid + "'"));
    }

    @Override
    public String toString() {
        return prettyName + " (" + uid + ")";
    }
}
