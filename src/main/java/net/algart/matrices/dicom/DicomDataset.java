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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DICOM dataset: mapping from tags to {@link DicomElement data elements}.
 *
 * <p>Elements are stored in the order of adding; {@link #sortedElements()} returns them in the order of tags.
 * The dataset also stores the encoding, in which it was read: implicit/explicit VR, byte order and
 * the active Specific Character Set. Nested datasets (sequence items) additionally store
 * their offset in the source stream.
 *
 * <p>This class is not thread-safe.
 */
public final class DicomDataset {
    private final Map<Integer, DicomElement> map = new LinkedHashMap<>();
    private boolean implicitVR = false;
    private boolean littleEndian = true;
    private List<String> characterSetTerms = List.of();
    private List<Charset> charsets = DicomCharacterSets.DEFAULT;
    private long fileOffset = -1;
    private boolean undefinedLengthItem = false;

    public DicomDataset() {
    }

    public DicomDataset(boolean implicitVR, boolean littleEndian) {
        this.implicitVR = implicitVR;
        this.littleEndian = littleEndian;
    }

    public boolean isImplicitVR() {
        return implicitVR;
    }

    public DicomDataset setImplicitVR(boolean implicitVR) {
        this.implicitVR = implicitVR;
        return this;
    }

    public boolean isLittleEndian() {
        return littleEndian;
    }

    public DicomDataset setLittleEndian(boolean littleEndian) {
        this.littleEndian = littleEndian;
        return this;
    }

    public ByteOrder getByteOrder() {
        return littleEndian ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
    }

    /**
     * Returns the terms of the Specific Character Set, active for this dataset: its own (0008,0005)
     * or the one inherited from the parent dataset. Empty list means the default repertoire.
     *
     * @return character set terms.
     */
    public List<String> getCharacterSetTerms() {
        return characterSetTerms;
    }

    public List<Charset> getCharsets() {
        return charsets;
    }

    public Charset textCharset() {
        return charsets.get(0);
    }

    public DicomDataset setCharacterSets(List<String> characterSetTerms, List<Charset> charsets) {
        Objects.requireNonNull(characterSetTerms, "Null characterSetTerms");
        Objects.requireNonNull(charsets, "Null charsets");
        if (charsets.isEmpty()) {
            throw new IllegalArgumentException("Empty list of charsets");
        }
        this.characterSetTerms = List.copyOf(characterSetTerms);
        this.charsets = List.copyOf(charsets);
        return this;
    }

    public boolean hasFileOffset() {
        return fileOffset >= 0;
    }

    /**
     * Returns the position of the Item tag of this dataset in the source stream, if it is a sequence item,
     * or &minus;1 if it is unknown.
     *
     * @return item offset.
     */
    public long getFileOffset() {
        return fileOffset;
    }

    public DicomDataset setFileOffset(long fileOffset) {
        this.fileOffset = fileOffset;
        return this;
    }

    public boolean isUndefinedLengthItem() {
        return undefinedLengthItem;
    }

    public DicomDataset setUndefinedLengthItem(boolean undefinedLengthItem) {
        this.undefinedLengthItem = undefinedLengthItem;
        return this;
    }

    /**
     * Adds the element, replacing the existing element with the same tag, if any.
     *
     * @param element new element.
     * @return the previous element with this tag or {@code null}.
     */
    public DicomElement put(DicomElement element) {
        Objects.requireNonNull(element, "Null element");
        return map.put(element.tag(), element);
    }

    public DicomElement remove(int tag) {
        return map.remove(tag);
    }

    public int numberOfElements() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public boolean containsKey(int tag) {
        return map.containsKey(tag);
    }

    public DicomElement get(int tag) {
        return map.get(tag);
    }

    public Optional<DicomElement> optElement(int tag) {
        return Optional.ofNullable(map.get(tag));
    }

    public DicomElement reqElement(int tag) throws DicomException {
        final DicomElement result = map.get(tag);
        if (result == null) {
            throw new DicomException("DICOM element " + DicomTag.toString(tag) + " is required, but it is absent");
        }
        return result;
    }

    /**
     * Returns all elements in the order of adding.
     *
     * @return unmodifiable view of the elements.
     */
    public Collection<DicomElement> elements() {
        return Collections.unmodifiableCollection(map.values());
    }

    public List<DicomElement> sortedElements() {
        final List<DicomElement> result = new ArrayList<>(map.values());
        result.sort((a, b) -> Integer.compareUnsigned(a.tag(), b.tag()));
        return result;
    }

    /**
     * Returns the value of a string element, decoded with the active character set (for text VRs)
     * or with the default repertoire. Trailing spaces and zero bytes are removed; for multi-valued
     * strings the whole value with backslash separators is returned.
     *
     * @param tag the tag.
     * @return string value, if the element exists and has a byte value.
     * @throws DicomException if the element is a sequence.
     */
    public Optional<String> getString(int tag) throws DicomException {
        final DicomElement element = map.get(tag);
        if (element == null || element.isDeferred()) {
            return Optional.empty();
        }
        if (element.isSequence()) {
            throw new DicomException("DICOM element " + DicomTag.toString(tag) +
                    " is a sequence instead of expected string");
        }
        final DicomVR vr = element.vr();
        final Charset charset = vr == null || vr.isText() ? textCharset() : DicomCharacterSets.DEFAULT_CHARSET;
        return Optional.of(trimTrailing(new String(element.value(), charset)));
    }

    public String reqString(int tag) throws DicomException {
        return getString(tag).orElseThrow(() -> new DicomException(
                "DICOM element " + DicomTag.toString(tag) + " is required, but it is absent"));
    }

    public Optional<String> optString(int tag) {
        final DicomElement element = map.get(tag);
        if (element == null || !element.hasValue()) {
            return Optional.empty();
        }
        final DicomVR vr = element.vr();
        final Charset charset = vr == null || vr.isText() ? textCharset() : DicomCharacterSets.DEFAULT_CHARSET;
        return Optional.of(trimTrailing(new String(element.value(), charset)));
    }

    public int reqInt(int tag) throws DicomException {
        final long[] values = getLongArray(tag);
        if (values == null || values.length == 0) {
            throw new DicomException("DICOM element " + DicomTag.toString(tag) + " is required, but it is absent");
        }
        return checkedIntValue(values[0], tag);
    }

    public int getInt(int tag, int defaultValue) throws DicomException {
        final long[] values = getLongArray(tag);
        return values == null || values.length == 0 ? defaultValue : checkedIntValue(values[0], tag);
    }

    public Optional<Integer> optInt(int tag) {
        try {
            final long[] values = getLongArray(tag);
            return values == null || values.length == 0 || values[0] != (int) values[0] ?
                    Optional.empty() :
                    Optional.of((int) values[0]);
        } catch (DicomException e) {
            return Optional.empty();
        }
    }

    /**
     * Returns all integer values of the element. Binary VRs (US, SS, UL, SL, UV, SV, OW, OL, OV)
     * are decoded with the byte order of the element; IS is parsed as a decimal string.
     * Unsigned 64-bit values above <code>Long.MAX_VALUE</code> are returned as negative numbers.
     * Elements with unknown VR are interpreted by their length: 2 bytes as US, 4 bytes as UL,
     * else as IS.
     *
     * @param tag the tag.
     * @return values or {@code null} if there is no such element or it is deferred.
     * @throws DicomException if the element value cannot be interpreted as integers.
     */
    public long[] getLongArray(int tag) throws DicomException {
        final DicomElement element = map.get(tag);
        if (element == null || element.isDeferred()) {
            return null;
        }
        if (element.isSequence()) {
            throw new DicomException("DICOM element " + DicomTag.toString(tag) +
                    " is a sequence instead of expected integer value");
        }
        DicomVR vr = element.vr();
        final byte[] value = element.value();
        if (vr == null) {
            vr = value.length == 2 ? DicomVR.US : value.length == 4 ? DicomVR.UL : DicomVR.IS;
        }
        final ByteBuffer bb = ByteBuffer.wrap(value).order(
                element.isLittleEndian() ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN);
        final int unit = vr.bytesPerValue();
        final long[] result;
        switch (vr) {
            case US, OW -> {
                result = new long[value.length / unit];
                for (int k = 0; k < result.length; k++) {
                    result[k] = bb.getShort(k * unit) & 0xFFFF;
                }
            }
            case SS -> {
                result = new long[value.length / unit];
                for (int k = 0; k < result.length; k++) {
                    result[k] = bb.getShort(k * unit);
                }
            }
            case UL, OL -> {
                result = new long[value.length / unit];
                for (int k = 0; k < result.length; k++) {
                    result[k] = bb.getInt(k * unit) & 0xFFFFFFFFL;
                }
            }
            case SL -> {
                result = new long[value.length / unit];
                for (int k = 0; k < result.length; k++) {
                    result[k] = bb.getInt(k * unit);
                }
            }
            case UV, SV, OV -> {
                result = new long[value.length / unit];
                for (int k = 0; k < result.length; k++) {
                    result[k] = bb.getLong(k * unit);
                }
            }
            case IS, DS -> result = parseIntegerStrings(value, tag);
            default -> throw new DicomException("DICOM element " + DicomTag.toString(tag) +
                    " has VR " + vr + ", which cannot be interpreted as integer");
        }
        return result;
    }

    public int[] getIntArray(int tag) throws DicomException {
        final long[] values = getLongArray(tag);
        if (values == null) {
            return null;
        }
        final int[] result = new int[values.length];
        for (int k = 0; k < result.length; k++) {
            result[k] = checkedIntValue(values[k], tag);
        }
        return result;
    }

    /**
     * Returns the item of the sequence element.
     *
     * @param tag   tag of the sequence element.
     * @param index index of the item.
     * @return the item.
     * @throws DicomException if there is no such element, or it is not a sequence.
     */
    public DicomDataset reqItem(int tag, int index) throws DicomException {
        final DicomElement element = reqElement(tag);
        if (!element.isSequence()) {
            throw new DicomException("DICOM element " + DicomTag.toString(tag) + " is not a sequence");
        }
        final DicomSequence sequence = element.sequence();
        if (index < 0 || index >= sequence.size()) {
            throw new DicomException("Index " + index + " is out of range 0.." + (sequence.size() - 1) +
                    " for the sequence " + DicomTag.toString(tag));
        }
        return sequence.item(index);
    }

    @Override
    public String toString() {
        return "DICOM dataset, " + map.size() + " elements, " +
                (implicitVR ? "implicit" : "explicit") + " VR " +
                (littleEndian ? "little" : "big") + " endian" +
                (characterSetTerms.isEmpty() ? "" : ", character set " + String.join("\\", characterSetTerms)) +
                (fileOffset >= 0 ? " at 0x" + Long.toHexString(fileOffset) : "");
    }

    public String toString(boolean withElements) {
        if (!withElements) {
            return toString();
        }
        final StringBuilder sb = new StringBuilder(toString());
        for (DicomElement element : sortedElements()) {
            sb.append(String.format("%n  ")).append(element);
        }
        return sb.toString();
    }

    private static long[] parseIntegerStrings(byte[] value, int tag) throws DicomException {
        final String s = trimTrailing(new String(value, DicomCharacterSets.DEFAULT_CHARSET)).strip();
        if (s.isEmpty()) {
            return new long[0];
        }
        final String[] items = s.split("\\\\");
        final long[] result = new long[items.length];
        for (int k = 0; k < items.length; k++) {
            final String item = items[k].strip();
            try {
                result[k] = Long.parseLong(item.startsWith("+") ? item.substring(1) : item);
            } catch (NumberFormatException e) {
                throw new DicomException("DICOM element " + DicomTag.toString(tag) +
                        " contains invalid integer string \"" + item + "\"", e);
            }
        }
        return result;
    }

    private static int checkedIntValue(long value, int tag) throws DicomException {
        if (value != (int) value) {
            throw new DicomException("DICOM element " + DicomTag.toString(tag) +
                    " contains too large value " + value);
        }
        return (int) value;
    }

    private static String trimTrailing(String s) {
        int len = s.length();
        while (len > 0 && (s.charAt(len - 1) == ' ' || s.charAt(len - 1) == '\0')) {
            len--;
        }
        return s.substring(0, len);
    }
}
