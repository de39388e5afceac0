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

import net.algart.matrices.dicom.DicomDataset;
import net.algart.matrices.dicom.DicomException;
import net.algart.matrices.dicom.DicomTag;
import net.algart.matrices.dicom.TransferSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Pixel metadata of an image (rows, columns, samples per pixel, bits allocated, etc.)
 * together with parameters of pixel data codecs.
 *
 * <p>Metadata fields are nullable: {@code null} means that the corresponding attribute is absent.
 * {@link #validate(TransferSyntax)} checks that all required attributes are present and consistent.
 */
public class PixelDataOptions implements Cloneable {
    public static final Set<String> PHOTOMETRIC_INTERPRETATIONS = Set.of(
            "MONOCHROME1", "MONOCHROME2", "PALETTE COLOR", "RGB", "YBR_FULL", "YBR_FULL_422",
            "YBR_PARTIAL_420", "YBR_ICT", "YBR_RCT", "XYB", "HSV", "ARGB", "CMYK", "YBR_PARTIAL_422");

    private Integer rows = null;
    private Integer columns = null;
    private Integer samplesPerPixel = null;
    private Integer bitsAllocated = null;
    private Integer bitsStored = null;
    private Integer pixelRepresentation = null;
    private String photometricInterpretation = null;
    private Integer planarConfiguration = null;
    private Integer numberOfFrames = null;
    private int pixelTag = DicomTag.PIXEL_DATA;
    private long[] extendedOffsets = null;
    private long[] extendedOffsetLengths = null;

    private boolean littleEndianSegmentOrder = false;
    private boolean includeHighBits = true;
    private Double quality = null;
    private Consumer<String> warningListener = null;

    public PixelDataOptions() {
    }

    /**
     * Creates options, filled from the attributes of the Image Pixel module of the dataset
     * and, if present, from the Extended Offset Table.
     *
     * @param dataset main dataset.
     * @return new options.
     * @throws DicomException if some attribute exists but cannot be interpreted as an integer.
     */
    public static PixelDataOptions fromDataset(DicomDataset dataset) throws DicomException {
        Objects.requireNonNull(dataset, "Null dataset");
        final PixelDataOptions result = new PixelDataOptions();
        result.rows = optInteger(dataset, DicomTag.ROWS);
        result.columns = optInteger(dataset, DicomTag.COLUMNS);
        result.samplesPerPixel = optInteger(dataset, DicomTag.SAMPLES_PER_PIXEL);
        result.bitsAllocated = optInteger(dataset, DicomTag.BITS_ALLOCATED);
        result.bitsStored = optInteger(dataset, DicomTag.BITS_STORED);
        result.pixelRepresentation = optInteger(dataset, DicomTag.PIXEL_REPRESENTATION);
        result.photometricInterpretation = dataset.getString(DicomTag.PHOTOMETRIC_INTERPRETATION)
                .map(String::strip).orElse(null);
        result.planarConfiguration = optInteger(dataset, DicomTag.PLANAR_CONFIGURATION);
        result.numberOfFrames = optInteger(dataset, DicomTag.NUMBER_OF_FRAMES);
        if (result.numberOfFrames == null) {
            result.numberOfFrames = 1;
        }
        for (int tag : new int[]{DicomTag.FLOAT_PIXEL_DATA, DicomTag.DOUBLE_FLOAT_PIXEL_DATA}) {
            if (dataset.containsKey(tag)) {
                result.pixelTag = tag;
            }
        }
        result.extendedOffsets = dataset.getLongArray(DicomTag.EXTENDED_OFFSET_TABLE);
        result.extendedOffsetLengths = dataset.getLongArray(DicomTag.EXTENDED_OFFSET_TABLE_LENGTHS);
        return result;
    }

    public Integer getRows() {
        return rows;
    }

    public PixelDataOptions setRows(Integer rows) {
        this.rows = rows;
        return this;
    }

    public Integer getColumns() {
        return columns;
    }

    public PixelDataOptions setColumns(Integer columns) {
        this.columns = columns;
        return this;
    }

    public PixelDataOptions setSizes(int columns, int rows) {
        return setColumns(columns).setRows(rows);
    }

    public Integer getSamplesPerPixel() {
        return samplesPerPixel;
    }

    public PixelDataOptions setSamplesPerPixel(Integer samplesPerPixel) {
        this.samplesPerPixel = samplesPerPixel;
        return this;
    }

    public Integer getBitsAllocated() {
        return bitsAllocated;
    }

    public PixelDataOptions setBitsAllocated(Integer bitsAllocated) {
        this.bitsAllocated = bitsAllocated;
        return this;
    }

    public Integer getBitsStored() {
        return bitsStored;
    }

    public PixelDataOptions setBitsStored(Integer bitsStored) {
        this.bitsStored = bitsStored;
        return this;
    }

    public PixelDataOptions setBits(int bitsAllocated, int bitsStored) {
        return setBitsAllocated(bitsAllocated).setBitsStored(bitsStored);
    }

    public Integer getPixelRepresentation() {
        return pixelRepresentation;
    }

    /**
     * Sets the pixel representation: 0 for unsigned integers, 1 for 2's complement.
     *
     * @param pixelRepresentation new value or {@code null}.
     * @return a reference to this object.
     */
    public PixelDataOptions setPixelRepresentation(Integer pixelRepresentation) {
        this.pixelRepresentation = pixelRepresentation;
        return this;
    }

    public boolean isSigned() {
        return pixelRepresentation != null && pixelRepresentation == 1;
    }

    public String getPhotometricInterpretation() {
        return photometricInterpretation;
    }

    public PixelDataOptions setPhotometricInterpretation(String photometricInterpretation) {
        this.photometricInterpretation = photometricInterpretation;
        return this;
    }

    public Integer getPlanarConfiguration() {
        return planarConfiguration;
    }

    public PixelDataOptions setPlanarConfiguration(Integer planarConfiguration) {
        this.planarConfiguration = planarConfiguration;
        return this;
    }

    public boolean isPlanar() {
        return planarConfiguration != null && planarConfiguration == 1
                && samplesPerPixel != null && samplesPerPixel > 1;
    }

    public Integer getNumberOfFrames() {
        return numberOfFrames;
    }

    public PixelDataOptions setNumberOfFrames(Integer numberOfFrames) {
        this.numberOfFrames = numberOfFrames;
        return this;
    }

    public int getPixelTag() {
        return pixelTag;
    }

    /**
     * Sets the tag of the pixel data element: (7FE0,0010) Pixel Data (default),
     * (7FE0,0008) Float Pixel Data or (7FE0,0009) Double Float Pixel Data.
     *
     * @param pixelTag the tag.
     * @return a reference to this object.
     */
    public PixelDataOptions setPixelTag(int pixelTag) {
        if (!DicomTag.isPixelData(pixelTag)) {
            throw new IllegalArgumentException("Tag " + DicomTag.toString(pixelTag) + " is not a pixel data tag");
        }
        this.pixelTag = pixelTag;
        return this;
    }

    public boolean hasExtendedOffsetTable() {
        return extendedOffsets != null;
    }

    public long[] getExtendedOffsets() {
        return extendedOffsets == null ? null : extendedOffsets.clone();
    }

    public long[] getExtendedOffsetLengths() {
        return extendedOffsetLengths == null ? null : extendedOffsetLengths.clone();
    }

    public PixelDataOptions setExtendedOffsetTable(long[] offsets, long[] lengths) {
        this.extendedOffsets = offsets == null ? null : offsets.clone();
        this.extendedOffsetLengths = lengths == null ? null : lengths.clone();
        return this;
    }

    public boolean isLittleEndianSegmentOrder() {
        return littleEndianSegmentOrder;
    }

    /**
     * Sets the order of byte segments in RLE data. The standard requires the most significant byte first
     * (<code>false</code>, default); <code>true</code> allows decoding non-conformant data,
     * where the least significant byte segment comes first.
     *
     * @param littleEndianSegmentOrder whether RLE segments are in little-endian order.
     * @return a reference to this object.
     */
    public PixelDataOptions setLittleEndianSegmentOrder(boolean littleEndianSegmentOrder) {
        this.littleEndianSegmentOrder = littleEndianSegmentOrder;
        return this;
    }

    public boolean isIncludeHighBits() {
        return includeHighBits;
    }

    /**
     * Sets whether the encoder keeps all bytes of the {@link #getBitsAllocated() bits allocated} container
     * (<code>true</code>, default), or only the bytes, necessary for {@link #getBitsStored() bits stored}.
     *
     * @param includeHighBits whether to keep unused high bytes.
     * @return a reference to this object.
     */
    public PixelDataOptions setIncludeHighBits(boolean includeHighBits) {
        this.includeHighBits = includeHighBits;
        return this;
    }

    public boolean hasQuality() {
        return quality != null;
    }

    public Double getQuality() {
        return quality;
    }

    public PixelDataOptions setQuality(Double quality) {
        this.quality = quality;
        return this;
    }

    public Consumer<String> getWarningListener() {
        return warningListener;
    }

    public PixelDataOptions setWarningListener(Consumer<String> warningListener) {
        this.warningListener = warningListener;
        return this;
    }

    /**
     * Logs the warning and passes it to the warning listener, if it is set.
     *
     * @param log     logger of the calling class.
     * @param message warning text.
     */
    public void warn(System.Logger log, String message) {
        log.log(System.Logger.Level.WARNING, message);
        if (warningListener != null) {
            warningListener.accept(message);
        }
    }

    public int rows() {
        return required(rows, "rows");
    }

    public int columns() {
        return required(columns, "columns");
    }

    public int samplesPerPixel() {
        return required(samplesPerPixel, "samples_per_pixel");
    }

    public int bitsAllocated() {
        return required(bitsAllocated, "bits_allocated");
    }

    public int bitsStored() {
        return required(bitsStored, "bits_stored");
    }

    public int numberOfFrames() {
        return required(numberOfFrames, "number_of_frames");
    }

    public int pixelRepresentation() {
        return pixelRepresentation == null ? 0 : pixelRepresentation;
    }

    /**
     * Returns the number of bytes in one decoded frame. For 1-bit data the value is rounded up
     * to whole bytes. For YBR_FULL_422 with native transfer syntaxes, the size is 2/3 of the full size
     * (subsampled chrominance).
     *
     * @param transferSyntax transfer syntax; may be {@code null}, that means "decoded data".
     * @return frame length in bytes.
     */
    public long frameLength(TransferSyntax transferSyntax) {
        long length = (long) rows() * (long) columns() * (long) samplesPerPixel();
        if (bitsAllocated() == 1) {
            return (length + 7) / 8;
        }
        length *= bitsAllocated() / 8;
        if (transferSyntax != null && transferSyntax.isNative()
                && "YBR_FULL_422".equals(photometricInterpretation)) {
            length = length / 3 * 2;
        }
        return length;
    }

    /**
     * Checks that all required pixel attributes are present and have correct values.
     * All missing attributes are listed in one exception.
     *
     * @param transferSyntax transfer syntax; may be {@code null}.
     * @throws DicomException if some attributes are missing or invalid.
     */
    public void validate(TransferSyntax transferSyntax) throws DicomException {
        final List<String> missing = new ArrayList<>();
        addIfNull(missing, bitsAllocated, "bits_allocated");
        addIfNull(missing, bitsStored, "bits_stored");
        addIfNull(missing, columns, "columns");
        addIfNull(missing, numberOfFrames, "number_of_frames");
        addIfNull(missing, photometricInterpretation, "photometric_interpretation");
        addIfNull(missing, rows, "rows");
        addIfNull(missing, samplesPerPixel, "samples_per_pixel");
        if (pixelTag == DicomTag.PIXEL_DATA) {
            addIfNull(missing, pixelRepresentation, "pixel_representation");
        }
        if (samplesPerPixel != null && samplesPerPixel > 1) {
            addIfNull(missing, planarConfiguration, "planar_configuration");
        }
        if (!missing.isEmpty()) {
            throw new DicomException("Missing expected options: " + String.join(", ", missing));
        }
        if (bitsAllocated < 1 || bitsAllocated > 64 || (bitsAllocated != 1 && bitsAllocated % 8 != 0)) {
            throw new DicomException("A bits allocated value of " + bitsAllocated +
                    " is invalid, it must be 1 or a multiple of 8 and in the range (1, 64)");
        }
        if (bitsStored < 1 || bitsStored > bitsAllocated) {
            throw new DicomException("A bits stored value of " + bitsStored +
                    " is invalid, it must be in the range (1, " + bitsAllocated + ")");
        }
        if (columns < 1 || columns > 0xFFFF) {
            throw new DicomException("A columns value of " + columns +
                    " is invalid, it must be in the range (1, 65535)");
        }
        if (rows < 1 || rows > 0xFFFF) {
            throw new DicomException("A rows value of " + rows +
                    " is invalid, it must be in the range (1, 65535)");
        }
        if (numberOfFrames < 1) {
            throw new DicomException("A number of frames value of " + numberOfFrames +
                    " is invalid, it must be greater than or equal to 1");
        }
        if (!PHOTOMETRIC_INTERPRETATIONS.contains(photometricInterpretation)) {
            throw new DicomException("Unknown photometric interpretation '" + photometricInterpretation + "'");
        }
        if (pixelTag == DicomTag.PIXEL_DATA && pixelRepresentation != 0 && pixelRepresentation != 1) {
            throw new DicomException("A pixel representation value of " + pixelRepresentation +
                    " is invalid, it must be 0 or 1");
        }
        if (samplesPerPixel != 1 && samplesPerPixel != 3) {
            throw new DicomException("A samples per pixel value of " + samplesPerPixel +
                    " is invalid, it must be 1 or 3");
        }
        if (samplesPerPixel == 3 && planarConfiguration != 0 && planarConfiguration != 1) {
            throw new DicomException("A planar configuration value of " + planarConfiguration +
                    " is invalid, it must be 0 or 1");
        }
        if ((extendedOffsets == null) != (extendedOffsetLengths == null)) {
            throw new DicomException("Extended Offset Table must contain both offsets and lengths");
        }
        if (extendedOffsets != null && extendedOffsets.length != extendedOffsetLengths.length) {
            throw new DicomException("There must be an equal number of Extended Offset Table offsets and " +
                    "lengths (" + extendedOffsets.length + " vs. " + extendedOffsetLengths.length + ")");
        }
    }

    public PixelDataOptions setTo(PixelDataOptions options) {
        Objects.requireNonNull(options, "Null options");
        setRows(options.rows);
        setColumns(options.columns);
        setSamplesPerPixel(options.samplesPerPixel);
        setBitsAllocated(options.bitsAllocated);
        setBitsStored(options.bitsStored);
        setPixelRepresentation(options.pixelRepresentation);
        setPhotometricInterpretation(options.photometricInterpretation);
        setPlanarConfiguration(options.planarConfiguration);
        setNumberOfFrames(options.numberOfFrames);
        setPixelTag(options.pixelTag);
        setExtendedOffsetTable(options.extendedOffsets, options.extendedOffsetLengths);
        setLittleEndianSegmentOrder(options.littleEndianSegmentOrder);
        setIncludeHighBits(options.includeHighBits);
        setQuality(options.quality);
        setWarningListener(options.warningListener);
        return this;
    }

    @Override
    public String toString() {
        return "PixelDataOptions: " +
                "rows=" + rows +
                ", columns=" + columns +
                ", samplesPerPixel=" + samplesPerPixel +
                ", bitsAllocated=" + bitsAllocated +
                ", bitsStored=" + bitsStored +
                ", pixelRepresentation=" + pixelRepresentation +
                ", photometricInterpretation=" + photometricInterpretation +
                ", planarConfiguration=" + planarConfiguration +
                ", numberOfFrames=" + numberOfFrames +
                ", pixelTag=" + DicomTag.toString(pixelTag) +
                (extendedOffsets != null ? ", extended offset table of " + extendedOffsets.length + " frames" : "") +
                ", littleEndianSegmentOrder=" + littleEndianSegmentOrder +
                ", includeHighBits=" + includeHighBits +
                ", quality=" + quality;
    }

    @Override
    public PixelDataOptions clone() {
        final PixelDataOptions result;
        try {
            result = (PixelDataOptions) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
        result.setTo(this);
        // - performs the necessary cloning of Java arrays
        return result;
    }

    private static Integer optInteger(DicomDataset dataset, int tag) throws DicomException {
        final long[] values = dataset.getLongArray(tag);
        if (values == null || values.length == 0) {
            return null;
        }
        if (values[0] != (int) values[0]) {
            throw new DicomException("Too large value " + values[0] + " of " + DicomTag.toString(tag));
        }
        return (int) values[0];
    }

    private static void addIfNull(List<String> missing, Object value, String name) {
        if (value == null) {
            missing.add(name);
        }
    }

    private static int required(Integer value, String name) {
        if (value == null) {
            throw new IllegalStateException("Pixel option " + name + " is required, but it is not set");
        }
        return value;
    }
}
