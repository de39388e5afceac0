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

import net.algart.arrays.Matrix;
import net.algart.arrays.UpdatablePArray;
import net.algart.matrices.dicom.codecs.DeflateCodec;
import net.algart.matrices.dicom.codecs.PixelDataOptions;
import net.algart.matrices.dicom.encapsulation.EncapsulatedPixelData;
import net.algart.matrices.dicom.encapsulation.ExtendedOffsetTable;
import net.algart.matrices.dicom.pixels.DecodedFrame;
import net.algart.matrices.dicom.pixels.PixelDataDecoder;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.handle.ReadBufferDataHandle;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Reader of DICOM files (DICOM PS3.10): preamble, "DICM" prefix, File Meta Information,
 * optional Command Set and the main dataset, encoded according to the Transfer Syntax UID.
 *
 * <p>The header (everything before the main dataset) is read in the constructor.
 * The main dataset is read by {@link #read()} or {@link #readDataset(boolean)}; pixel data can be decoded
 * frame by frame without loading the whole pixel data value, if it was deferred
 * (see {@link DicomReadingOptions#setDeferSize(long)}).
 *
 * <p>This class is not thread-safe.
 */
public final class DicomFileReader extends DicomIO {
    private final DicomReadingOptions options;
    private final boolean force;
    private byte[] preamble = null;
    private DicomDataset fileMeta = new DicomDataset(false, true);
    private DicomDataset commandSet = new DicomDataset(true, true);
    private TransferSyntax transferSyntax = null;
    private boolean implicitVR = true;
    private boolean littleEndian = true;
    private DataHandle<? extends Location> datasetStream;
    private long datasetStart = 0;

    public DicomFileReader(Path file) throws IOException {
        this(file, new DicomReadingOptions());
    }

    public DicomFileReader(Path file, DicomReadingOptions options) throws IOException {
        this(getExistingFileHandle(file), options, false, true);
    }

    /**
     * Equivalent to {@link #DicomFileReader(DataHandle, DicomReadingOptions, boolean, boolean)}
     * with <code>false</code> last argument.
     *
     * @param inputStream input stream.
     * @param options     reading options; they are cloned.
     * @param force       whether to read the file without preamble and "DICM" prefix.
     * @throws IOException if the file is not a correct DICOM file or in the case of I/O errors.
     */
    public DicomFileReader(DataHandle<Location> inputStream, DicomReadingOptions options, boolean force)
            throws IOException {
        this(inputStream, options, force, false);
    }

    /**
     * Constructs new reader and reads the file header.
     *
     * @param inputStream            input stream; automatically wrapped with {@link ReadBufferDataHandle},
     *                               if this stream is still not an instance of this class.
     * @param options                reading options; they are cloned.
     * @param force                  if <code>true</code>, the file without "DICM" prefix is read from
     *                               the beginning as a dataset without preamble and file meta information.
     * @param closeStreamOnException if <code>true</code>, the input stream is closed in the case of any exception.
     * @throws IOException if the file is not a correct DICOM file or in the case of I/O errors.
     */
    public DicomFileReader(
            DataHandle<Location> inputStream,
            DicomReadingOptions options,
            boolean force,
            boolean closeStreamOnException) throws IOException {
        super(inputStream instanceof ReadBufferDataHandle ?
                inputStream :
                new ReadBufferDataHandle<>(Objects.requireNonNull(inputStream, "Null input stream")));
        this.options = Objects.requireNonNull(options, "Null options").clone();
        this.force = force;
        this.datasetStream = stream;
        try {
            readHeader();
        } catch (IOException | RuntimeException e) {
            if (closeStreamOnException) {
                closeAfterFailure(inputStream, e);
            }
            throw e;
        }
    }

    public DicomReadingOptions options() {
        return options.clone();
    }

    public boolean isForce() {
        return force;
    }

    public byte[] preamble() {
        return preamble == null ? null : preamble.clone();
    }

    public DicomDataset fileMeta() {
        return fileMeta;
    }

    public DicomDataset commandSet() {
        return commandSet;
    }

    public Optional<TransferSyntax> transferSyntax() {
        return Optional.ofNullable(transferSyntax);
    }

    public boolean isImplicitVR() {
        return implicitVR;
    }

    public boolean isLittleEndian() {
        return littleEndian;
    }

    /**
     * Returns the stream, containing the main dataset. It is the file stream itself
     * or, for Deflated Explicit VR Little Endian, an in-memory stream with inflated data.
     *
     * @return stream of the main dataset.
     */
    public DataHandle<? extends Location> datasetStream() {
        return datasetStream;
    }

    public long datasetStart() {
        return datasetStart;
    }

    /**
     * Reads the whole file.
     *
     * @return file contents.
     * @throws IOException in the case of malformed data or I/O errors.
     */
    public DicomFileDataset read() throws IOException {
        return new DicomFileDataset(preamble, fileMeta, commandSet, readDataset(false), transferSyntax);
    }

    /**
     * Reads the main dataset.
     *
     * @param stopBeforePixels if <code>true</code>, reading stops before (7FE0,0008), (7FE0,0009) or (7FE0,0010).
     * @return main dataset.
     * @throws IOException in the case of malformed data or I/O errors.
     */
    public DicomDataset readDataset(boolean stopBeforePixels) throws IOException {
        synchronized (fileLock) {
            long t1 = debugTime();
            final DicomReadingOptions datasetOptions = options.clone();
            if (stopBeforePixels) {
                final DicomReadingOptions.StopCondition condition = options.getStopCondition();
                datasetOptions.setStopCondition((tag, vr, length) ->
                        DicomTag.isPixelData(tag) || (condition != null && condition.stop(tag, vr, length)));
            }
            datasetStream.seek(datasetStart);
            final DicomDataset result = new DicomDatasetReader(datasetStream, datasetOptions)
                    .readDataset(implicitVR, littleEndian);
            if (BUILT_IN_TIMING && LOGGABLE_DEBUG) {
                long t2 = debugTime();
                LOG.log(System.Logger.Level.DEBUG, String.format(Locale.US,
                        "%s read %d elements: %.3f ms",
                        getClass().getSimpleName(), result.numberOfElements(), (t2 - t1) * 1e-6));
            }
            return result;
        }
    }

    /**
     * Loads the value of the element, which was deferred while reading the dataset.
     *
     * @param element element of the main dataset.
     * @return the same element with loaded value.
     * @throws IOException in the case of I/O errors or if the file was modified.
     */
    public DicomElement materialize(DicomElement element) throws IOException {
        synchronized (fileLock) {
            return new DicomStreamReader(datasetStream, options).materialize(element);
        }
    }

    public PixelDataOptions pixelDataOptions(DicomDataset dataset) throws DicomException {
        Objects.requireNonNull(dataset, "Null dataset");
        return PixelDataOptions.fromDataset(dataset).setWarningListener(options.getWarningListener());
    }

    /**
     * Returns a view of the encapsulated pixel data of the dataset, which was read by this reader.
     * The fragments are read from the stream on demand.
     *
     * @param dataset main dataset.
     * @return encapsulated pixel data.
     * @throws DicomException if there is no pixel data element, or it is not encapsulated.
     */
    public EncapsulatedPixelData encapsulatedPixelData(DicomDataset dataset) throws DicomException {
        final PixelDataOptions pixelOptions = pixelDataOptions(dataset);
        final DicomElement element = pixelDataElement(dataset, pixelOptions);
        if (!element.isUndefinedLength()) {
            throw new DicomException("Pixel data element " + DicomTag.toString(element.tag()) +
                    " has defined length " + element.length() + " and is not encapsulated");
        }
        if (element.valueOffset() < 0) {
            throw new IllegalArgumentException("Pixel data element " + element + " was not read by this reader");
        }
        final EncapsulatedPixelData result = new EncapsulatedPixelData(datasetStream, element.valueOffset())
                .setLittleEndian(littleEndian)
                .setNumberOfFrames(pixelOptions.getNumberOfFrames())
                .setWarningListener(options.getWarningListener());
        if (pixelOptions.hasExtendedOffsetTable()) {
            result.setExtendedOffsetTable(new ExtendedOffsetTable(
                    pixelOptions.getExtendedOffsets(), pixelOptions.getExtendedOffsetLengths()));
        }
        return result;
    }

    public PixelDataDecoder newDecoder(DicomDataset dataset) throws DicomException {
        return new PixelDataDecoder(requireTransferSyntax(), pixelDataOptions(dataset));
    }

    /**
     * Decodes one frame of the pixel data. For encapsulated pixel data, only the fragments of this frame
     * are read, when the frame offset is known from the offset tables.
     *
     * @param dataset main dataset.
     * @param index   frame index.
     * @return decoded little-endian samples.
     * @throws IOException in the case of malformed data, decoding or I/O errors.
     */
    public DecodedFrame readFrame(DicomDataset dataset, int index) throws IOException {
        final PixelDataDecoder decoder = newDecoder(dataset);
        synchronized (fileLock) {
            if (decoder.transferSyntax().isEncapsulated()) {
                return decoder.decode(encapsulatedPixelData(dataset), index);
            }
            final DicomElement element = materialize(pixelDataElement(dataset, decoder.options()));
            return decoder.decode(element.value(), index);
        }
    }

    /**
     * Decodes one frame of the pixel data and returns it as AlgART matrix
     * (see {@link DicomSampleType#asMatrix(byte[], int, int, int, boolean)}).
     *
     * @param dataset main dataset.
     * @param index   frame index.
     * @return decoded frame.
     * @throws IOException in the case of malformed data, decoding or I/O errors.
     */
    public Matrix<UpdatablePArray> readMatrix(DicomDataset dataset, int index) throws IOException {
        final PixelDataOptions pixelOptions = pixelDataOptions(dataset);
        final DecodedFrame frame = readFrame(dataset, index);
        final DicomSampleType sampleType = DicomSampleType.of(
                pixelOptions.getPixelTag(), frame.bitsAllocated(), pixelOptions.pixelRepresentation());
        return sampleType.asMatrix(frame.data(), pixelOptions.columns(), pixelOptions.rows(),
                pixelOptions.samplesPerPixel(), pixelOptions.isPlanar());
    }

    @Override
    public void close() throws IOException {
        synchronized (fileLock) {
            if (datasetStream != stream) {
                datasetStream.close();
            }
        }
        super.close();
    }

    @Override
    public String toString() {
        return "DICOM file reader" + prettyFileName(" of %s", stream) +
                ", " + (transferSyntax == null ? "unknown transfer syntax" : transferSyntax);
    }

    private void readHeader() throws IOException {
        readPreamble();
        readFileMeta();
        commandSet = new DicomDatasetReader(stream, options).readCommandSet();
        final long position = stream.offset();
        final String uid = fileMeta.getString(DicomTag.TRANSFER_SYNTAX_UID).orElse(null);
        if (position >= stream.length()) {
            LOG.log(System.Logger.Level.DEBUG, "No main dataset after the file header");
        } else if (uid == null) {
            guessEncoding();
        } else {
            transferSyntax = TransferSyntax.fromUID(uid).orElse(null);
            if (transferSyntax == null) {
                options.warn(LOG, "Unknown transfer syntax UID '" + uid +
                        "', assuming Explicit VR Little Endian encoding of the dataset");
                implicitVR = false;
            } else {
                implicitVR = transferSyntax.isImplicitVR();
                littleEndian = transferSyntax.isLittleEndian();
                if (transferSyntax.isDeflated()) {
                    inflateDataset();
                    return;
                }
            }
        }
        datasetStart = stream.offset();
    }

    private void readPreamble() throws IOException {
        final byte[] header = new byte[PREAMBLE_LENGTH + DICM_PREFIX.length];
        final boolean enough = stream.length() >= header.length;
        stream.seek(0);
        if (enough) {
            stream.readFully(header);
        }
        if (enough && Arrays.equals(header, PREAMBLE_LENGTH, header.length, DICM_PREFIX, 0, DICM_PREFIX.length)) {
            preamble = Arrays.copyOf(header, PREAMBLE_LENGTH);
            return;
        }
        if (!force) {
            throw new DicomException("File is missing DICOM File Meta Information header or the 'DICM' " +
                    "prefix is missing from the header" + prettyFileName(" (file %s)", stream) +
                    "; use forced reading to read it anyway");
        }
        LOG.log(System.Logger.Level.INFO, "File is not conformant with the DICOM File Format: 'DICM' " +
                "prefix is missing from the File Meta Information header or the header itself is missing" +
                prettyFileName(" in %s", stream) + ". Assuming no header and continuing");
        stream.seek(0);
    }

    private void readFileMeta() throws IOException {
        final long start = stream.offset();
        final DicomReadingOptions metaOptions = options.clone()
                .setDeferSize(DicomReadingOptions.NO_DEFER)
                .setSpecificTags(null)
                .setStopCondition((tag, vr, length) -> DicomTag.group(tag) != 0x0002);
        final boolean metaImplicitVR = isImplicitVRAt(start);
        if (metaImplicitVR) {
            LOG.log(System.Logger.Level.INFO, "File Meta Information is encoded with Implicit VR Little Endian" +
                    prettyFileName(" in %s", stream));
        }
        fileMeta = new DicomDatasetReader(stream, metaOptions).readDataset(metaImplicitVR, true);
        final Optional<Integer> groupLength = fileMeta.optInt(DicomTag.FILE_META_INFORMATION_GROUP_LENGTH);
        if (groupLength.isPresent()) {
            final long actualLength = stream.offset() - (start + 12);
            if (groupLength.get() != actualLength) {
                LOG.log(System.Logger.Level.INFO, "(0002,0000) 'File Meta Information Group Length' value " +
                        "doesn't match the actual File Meta Information length (" + groupLength.get() + " vs " +
                        actualLength + " bytes)");
            }
        }
    }

    private void guessEncoding() throws IOException {
        final long position = stream.offset();
        if (stream.length() - position < 6) {
            return;
        }
        final byte[] bytes = new byte[6];
        stream.readFully(bytes);
        stream.seek(position);
        final Optional<DicomVR> vr = DicomVR.isLetterPair(bytes[4], bytes[5]) ?
                DicomVR.fromCode(new String(bytes, 4, 2, StandardCharsets.US_ASCII)) :
                Optional.empty();
        if (vr.isPresent()) {
            implicitVR = false;
            final int group = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getShort(0) & 0xFFFF;
            littleEndian = group < 1024;
        }
        LOG.log(System.Logger.Level.DEBUG, () -> "No Transfer Syntax UID, assuming " +
                (implicitVR ? "implicit" : "explicit") + " VR " + (littleEndian ? "little" : "big") + " endian");
    }

    private void inflateDataset() throws IOException {
        final long position = stream.offset();
        final long length = stream.length() - position;
        if (length > Integer.MAX_VALUE) {
            throw new DicomException("Too large deflated dataset: " + length + " >= 2^31 bytes");
        }
        final byte[] deflated = new byte[(int) length];
        stream.readFully(deflated);
        final byte[] inflated = DeflateCodec.inflate(deflated);
        LOG.log(System.Logger.Level.DEBUG, () -> "Deflated dataset: " + length + " bytes inflated to " +
                inflated.length + " bytes");
        datasetStream = getBytesHandle(inflated);
        datasetStart = 0;
    }

    private boolean isImplicitVRAt(long position) throws IOException {
        if (stream.length() - position < 6) {
            return false;
        }
        final byte[] bytes = new byte[6];
        stream.readFully(bytes);
        stream.seek(position);
        final int group = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getShort(0) & 0xFFFF;
        return group == 0x0002 && !DicomVR.isLetterPair(bytes[4], bytes[5]);
    }

    private TransferSyntax requireTransferSyntax() throws DicomException {
        if (transferSyntax != null) {
            return transferSyntax;
        }
        if (!implicitVR) {
            return littleEndian ? TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN : TransferSyntax.EXPLICIT_VR_BIG_ENDIAN;
        }
        return TransferSyntax.IMPLICIT_VR_LITTLE_ENDIAN;
    }

    private static DicomElement pixelDataElement(DicomDataset dataset, PixelDataOptions pixelOptions)
            throws DicomException {
        final DicomElement element = dataset.get(pixelOptions.getPixelTag());
        if (element == null) {
            throw new DicomException("The dataset has no pixel data element " +
                    DicomTag.toString(pixelOptions.getPixelTag()));
        }
        return element;
    }

    private static void closeAfterFailure(DataHandle<Location> inputStream, Exception e) {
        try {
            inputStream.close();
        } catch (IOException closingException) {
            e.addSuppressed(closingException);
        }
    }
}
