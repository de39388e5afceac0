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
 * Value representations (VR) of DICOM data elements.
 *
 * <p>The "long form" VRs use 2 reserved bytes and a 4-byte length in Explicit VR encoding
 * (12-byte element header) instead of a plain 2-byte length (8-byte header).
 */
public enum DicomVR {
    AE(Kind.STRING, false),
    AS(Kind.STRING, false),
    AT(Kind.BINARY_NUMBER, false),
    CS(Kind.STRING, false),
    DA(Kind.STRING, false),
    DS(Kind.STRING, false),
    DT(Kind.STRING, false),
    FD(Kind.BINARY_NUMBER, false),
    FL(Kind.BINARY_NUMBER, false),
    IS(Kind.STRING, false),
    LO(Kind.TEXT, false),
    LT(Kind.TEXT, false),
    OB(Kind.BULK, true),
    OD(Kind.BULK, true),
    OF(Kind.BULK, true),
    OL(Kind.BULK, true),
    OV(Kind.BULK, true),
    OW(Kind.BULK, true),
    PN(Kind.TEXT, false),
    SH(Kind.TEXT, false),
    SL(Kind.BINARY_NUMBER, false),
    SQ(Kind.SEQUENCE, true),
    SS(Kind.BINARY_NUMBER, false),
    ST(Kind.TEXT, false),
    SV(Kind.BINARY_NUMBER, true),
    TM(Kind.STRING, false),
    UC(Kind.TEXT, true),
    UI(Kind.STRING, false),
    UL(Kind.BINARY_NUMBER, false),
    UN(Kind.BULK, true),
    UR(Kind.STRING, true),
    US(Kind.BINARY_NUMBER, false),
    UT(Kind.TEXT, true),
    UV(Kind.BINARY_NUMBER, true);

    /**
     * Classes of VRs, which differ in how their values are interpreted.
     */
    public enum Kind {
        /**
         * Character strings, which are decoded with the active Specific Character Set.
         */
        TEXT,
        /**
         * Character strings with the default repertoire only.
         */
        STRING,
        /**
         * Binary numbers (or tags for AT), depending on the byte order.
         */
        BINARY_NUMBER,
        /**
         * "Other" byte/word streams and unknown content.
         */
        BULK,
        SEQUENCE
    }

    /**
     * Dictionary of VRs, used to resolve VR of elements in Implicit VR encoding.
     */
    @FunctionalInterface
    public interface Lookup {
        Optional<DicomVR> vr(int tag);
    }

    private static final Map<String, DicomVR> LOOKUP;

    static {
        final Map<String, DicomVR> map = new HashMap<>();
        for (DicomVR v : values()) {
            map.put(v.name(), v);
        }
        LOOKUP = map;
    }

    private final Kind kind;
    private final boolean longForm;

    DicomVR(Kind kind, boolean longForm) {
        this.kind = kind;
        this.longForm = longForm;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns <code>true</code> if the element header in Explicit VR encoding contains 2 reserved bytes
     * and 4-byte length after this VR.
     *
     * @return whether the 12-byte explicit header is used.
     */
    public boolean isLongForm() {
        return longForm;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    /**
     * Returns the size of one binary value in bytes, which must be swapped when the byte order changes,
     * or 1 for VRs that do not depend on the byte order.
     *
     * @return size of the swapped unit: 1, 2, 4 or 8.
     */
    public int bytesPerValue() {
        return switch (this) {
            case AT, OW, SS, US -> 2;
            case FL, OF, OL, SL, UL -> 4;
            case FD, OD, OV, SV, UV -> 8;
            default -> 1;
        };
    }

    /**
     * Returns the length of the element header before the value: 8 bytes for implicit VR
     * and short explicit form, 12 bytes for long explicit form.
     *
     * @param vr         VR of the element; may be {@code null} (unknown).
     * @param implicitVR whether the element is encoded with implicit VR.
     * @return the header length.
     */
    public static int headerLength(DicomVR vr, boolean implicitVR) {
        return !implicitVR && vr != null && vr.longForm ? 12 : 8;
    }

    public static Optional<DicomVR> fromCode(String code) {
        Objects.requireNonNull(code, "Null VR code");
        return Optional.ofNullable(LOOKUP.get(code));
    }

    /**
     * Returns <code>true</code> if both bytes are uppercase Latin letters 'A'..'Z'.
     *
     * @param b0 first byte.
     * @param b1 second byte.
     * @return whether these bytes look like a VR code.
     */
    public static boolean isLetterPair(byte b0, byte b1) {
        return isLetter(b0) && isLetter(b1);
    }

    private static boolean isLetter(byte b) {
        return b >= 'A' && b <= 'Z';
    }
}
