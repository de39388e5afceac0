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

import java.util.Objects;

/**
 * DICOM data element: tag, VR, declared length, position of the value in the source stream
 * and the value itself, which is either raw bytes, or a {@link DicomSequence}, or nothing
 * (a <i>deferred</i> element, the value of which was skipped while reading and can be loaded later by
 * {@link DicomStreamReader#materialize(DicomElement)}).
 *
 * <p>This class is immutable. Methods like {@link #withValue(byte[])} return a new instance.
 * Note that {@link #value()} returns a reference to the internal array: you must not modify it.
 */
public final class DicomElement {
    public static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;

    private final int tag;
    private final DicomVR vr;
    private final long length;
    private final long valueOffset;
    private final byte[] value;
    private final DicomSequence sequence;
    private final boolean implicitVR;
    private final boolean littleEndian;

    DicomElement(
            int tag,
            DicomVR vr,
            long length,
            long valueOffset,
            byte[] value,
            DicomSequence sequence,
            boolean implicitVR,
            boolean littleEndian) {
        if (length < 0 || length > UNDEFINED_LENGTH) {
            throw new IllegalArgumentException("Invalid length " + length + " of the element " +
                    DicomTag.toString(tag));
        }
        if (value != null && sequence != null) {
            throw new IllegalArgumentException("Element cannot have both byte value and sequence");
        }
        this.tag = tag;
        this.vr = vr;
        this.length = length;
        this.valueOffset = valueOffset;
        this.value = value;
        this.sequence = sequence;
        this.implicitVR = implicitVR;
        this.littleEndian = littleEndian;
    }

    /**
     * Creates an element with the given byte value, not linked to any stream.
     * The value is not copied.
     *
     * @param tag   element tag.
     * @param vr    element VR; may be {@code null} if unknown.
     * @param value element value.
     * @return new element.
     */
    public static DicomElement of(int tag, DicomVR vr, byte[] value) {
        Objects.requireNonNull(value, "Null value");
        return new DicomElement(tag, vr, value.length, -1, value, null, false, true);
    }

    /**
     * Creates an element, the value of which is the given sequence.
     *
     * @param tag      element tag.
     * @param sequence sequence of items.
     * @return new element with VR {@link DicomVR#SQ}.
     */
    public static DicomElement of(int tag, DicomSequence sequence) {
        Objects.requireNonNull(sequence, "Null sequence");
        return new DicomElement(tag, DicomVR.SQ,
                sequence.isUndefinedLength() ? UNDEFINED_LENGTH : 0, -1, null, sequence, false, true);
    }

    public int tag() {
        return tag;
    }

    /**
     * Returns VR of this element or {@code null} if it is unknown (Implicit VR encoding
     * without dictionary information).
     *
     * @return VR or {@code null}.
     */
    public DicomVR vr() {
        return vr;
    }

    public boolean hasVR() {
        return vr != null;
    }

    /**
     * Returns the length, declared in the element header, or {@link #UNDEFINED_LENGTH}.
     *
     * @return declared length.
     */
    public long length() {
        return length;
    }

    public boolean isUndefinedLength() {
        return length == UNDEFINED_LENGTH;
    }

    /**
     * Returns the position of the first byte of the value in the source stream, or &minus;1 if
     * this element was not read from a stream.
     *
     * @return offset of the value.
     */
    public long valueOffset() {
        return valueOffset;
    }

    public boolean isDeferred() {
        return value == null && sequence == null;
    }

    public boolean isSequence() {
        return sequence != null;
    }

    public boolean hasValue() {
        return value != null;
    }

    public byte[] value() {
        if (value == null) {
            throw new IllegalStateException("Element " + DicomTag.toString(tag) + " has no byte value" +
                    (isDeferred() ? " (it is deferred)" : " (it is a sequence)"));
        }
        return value;
    }

    public DicomSequence sequence() {
        if (sequence == null) {
            throw new IllegalStateException("Element " + DicomTag.toString(tag) + " is not a sequence");
        }
        return sequence;
    }

    public boolean isImplicitVR() {
        return implicitVR;
    }

    public boolean isLittleEndian() {
        return littleEndian;
    }

    /**
     * Returns the number of bytes from the start of the element header to the start of the value.
     *
     * @return 8 or 12.
     */
    public int headerLength() {
        return DicomVR.headerLength(vr, implicitVR);
    }

    public DicomElement withValue(byte[] value) {
        Objects.requireNonNull(value, "Null value");
        return new DicomElement(tag, vr, length, valueOffset, value, null, implicitVR, littleEndian);
    }

    public DicomElement withVR(DicomVR vr) {
        return new DicomElement(tag, vr, length, valueOffset, value, sequence, implicitVR, littleEndian);
    }

    @Override
    public String toString() {
        return DicomTag.toString(tag) + " " + (vr == null ? "??" : vr.name()) +
                (isUndefinedLength() ? ", undefined length" : ", length " + length) +
                (valueOffset >= 0 ? " at 0x" + Long.toHexString(valueOffset) : "") +
                (isDeferred() ? " (deferred)" :
                        isSequence() ? ", " + sequence.size() + " items" : "");
    }
}
