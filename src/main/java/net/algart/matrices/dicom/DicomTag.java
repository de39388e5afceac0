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

import java.util.Map;
import java.util.Optional;

/**
 * Tags of DICOM data elements: 32-bit unsigned values, consisting of 16-bit group and 16-bit element numbers.
 * In this library, tags are represented by Java <code>int</code>; they should be compared
 * by {@link Integer#compareUnsigned(int, int)}, because group numbers &ge;0x8000 are possible.
 *
 * <p>This class contains constants for the tags, used by the reading engine itself,
 * and a minimal VR dictionary for them. Full DICOM dictionary is out of the scope of this library:
 * you may pass your own dictionary via {@link DicomReadingOptions#setVRLookup(DicomVR.Lookup)}.
 */
public final class DicomTag {
    public static final int ITEM = 0xFFFEE000;
    public static final int ITEM_DELIMITER = 0xFFFEE00D;
    public static final int SEQUENCE_DELIMITER = 0xFFFEE0DD;

    public static final int FILE_META_INFORMATION_GROUP_LENGTH = 0x00020000;
    public static final int FILE_META_INFORMATION_VERSION = 0x00020001;
    public static final int MEDIA_STORAGE_SOP_CLASS_UID = 0x00020002;
    public static final int MEDIA_STORAGE_SOP_INSTANCE_UID = 0x00020003;
    public static final int TRANSFER_SYNTAX_UID = 0x00020010;
    public static final int IMPLEMENTATION_CLASS_UID = 0x00020012;
    public static final int IMPLEMENTATION_VERSION_NAME = 0x00020013;

    public static final int SPECIFIC_CHARACTER_SET = 0x00080005;
    public static final int SOP_CLASS_UID = 0x00080016;
    public static final int SOP_INSTANCE_UID = 0x00080018;
    public static final int PATIENT_NAME = 0x00100010;

    public static final int SAMPLES_PER_PIXEL = 0x00280002;
    public static final int PHOTOMETRIC_INTERPRETATION = 0x00280004;
    public static final int PLANAR_CONFIGURATION = 0x00280006;
    public static final int NUMBER_OF_FRAMES = 0x00280008;
    public static final int ROWS = 0x00280010;
    public static final int COLUMNS = 0x00280011;
    public static final int BITS_ALLOCATED = 0x00280100;
    public static final int BITS_STORED = 0x00280101;
    public static final int HIGH_BIT = 0x00280102;
    public static final int PIXEL_REPRESENTATION = 0x00280103;

    public static final int EXTENDED_OFFSET_TABLE = 0x7FE00001;
    public static final int EXTENDED_OFFSET_TABLE_LENGTHS = 0x7FE00002;
    public static final int DOUBLE_FLOAT_PIXEL_DATA = 0x7FE00008;
    public static final int FLOAT_PIXEL_DATA = 0x7FE00009;
    public static final int PIXEL_DATA = 0x7FE00010;

    private static final Map<Integer, DicomVR> KNOWN_VRS = Map.ofEntries(
            Map.entry(FILE_META_INFORMATION_GROUP_LENGTH, DicomVR.UL),
            Map.entry(FILE_META_INFORMATION_VERSION, DicomVR.OB),
            Map.entry(MEDIA_STORAGE_SOP_CLASS_UID, DicomVR.UI),
            Map.entry(MEDIA_STORAGE_SOP_INSTANCE_UID, DicomVR.UI),
            Map.entry(TRANSFER_SYNTAX_UID, DicomVR.UI),
            Map.entry(IMPLEMENTATION_CLASS_UID, DicomVR.UI),
            Map.entry(IMPLEMENTATION_VERSION_NAME, DicomVR.SH),
            Map.entry(SPECIFIC_CHARACTER_SET, DicomVR.CS),
            Map.entry(SOP_CLASS_UID, DicomVR.UI),
            Map.entry(SOP_INSTANCE_UID, DicomVR.UI),
            Map.entry(PATIENT_NAME, DicomVR.PN),
            Map.entry(SAMPLES_PER_PIXEL, DicomVR.US),
            Map.entry(PHOTOMETRIC_INTERPRETATION, DicomVR.CS),
            Map.entry(PLANAR_CONFIGURATION, DicomVR.US),
            Map.entry(NUMBER_OF_FRAMES, DicomVR.IS),
            Map.entry(ROWS, DicomVR.US),
            Map.entry(COLUMNS, DicomVR.US),
            Map.entry(BITS_ALLOCATED, DicomVR.US),
            Map.entry(BITS_STORED, DicomVR.US),
            Map.entry(HIGH_BIT, DicomVR.US),
            Map.entry(PIXEL_REPRESENTATION, DicomVR.US),
            Map.entry(EXTENDED_OFFSET_TABLE, DicomVR.OV),
            Map.entry(EXTENDED_OFFSET_TABLE_LENGTHS, DicomVR.OV),
            Map.entry(DOUBLE_FLOAT_PIXEL_DATA, DicomVR.OD),
            Map.entry(FLOAT_PIXEL_DATA, DicomVR.OF),
            Map.entry(PIXEL_DATA, DicomVR.OB));

    private DicomTag() {
    }

    public static int of(int group, int element) {
        if (group < 0 || group > 0xFFFF) {
            throw new IllegalArgumentException("Group " + group + " is out of range 0..0xFFFF");
        }
        if (element < 0 || element > 0xFFFF) {
            throw new IllegalArgumentException("Element " + element + " is out of range 0..0xFFFF");
        }
        return (group << 16) | element;
    }

    public static int group(int tag) {
        return tag >>> 16;
    }

    public static int element(int tag) {
        return tag & 0xFFFF;
    }

    public static boolean isPrivate(int tag) {
        return (group(tag) & 1) != 0;
    }

    public static boolean isDelimiter(int tag) {
        return tag == ITEM_DELIMITER || tag == SEQUENCE_DELIMITER;
    }

    public static boolean isPixelData(int tag) {
        return tag == PIXEL_DATA || tag == FLOAT_PIXEL_DATA || tag == DOUBLE_FLOAT_PIXEL_DATA;
    }

    /**
     * Returns the VR of the tag from the minimal built-in dictionary.
     * Group length tags (gggg,0000) are always <code>UL</code>.
     *
     * @param tag the tag.
     * @return VR of this tag, if it is known.
     */
    public static Optional<DicomVR> knownVR(int tag) {
        if (element(tag) == 0 && !isPrivate(tag)) {
            return Optional.of(DicomVR.UL);
        }
        return Optional.ofNullable(KNOWN_VRS.get(tag));
    }

    public static String toString(int tag) {
        return String.format("(%04X,%04X)", group(tag), element(tag));
    }
}
