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
import java.util.Optional;

/**
 * Contents of a DICOM file: preamble, File Meta Information, optional Command Set and the main dataset,
 * together with the encoding of the main dataset.
 */
public final class DicomFileDataset {
    private final byte[] preamble;
    private final DicomDataset fileMeta;
    private final DicomDataset commandSet;
    private final DicomDataset dataset;
    private final TransferSyntax transferSyntax;

    public DicomFileDataset(
            byte[] preamble,
            DicomDataset fileMeta,
            DicomDataset commandSet,
            DicomDataset dataset,
            TransferSyntax transferSyntax) {
        this.preamble = preamble == null ? null : preamble.clone();
        this.fileMeta = Objects.requireNonNull(fileMeta, "Null file meta information");
        this.commandSet = Objects.requireNonNull(commandSet, "Null command set");
        this.dataset = Objects.requireNonNull(dataset, "Null dataset");
        this.transferSyntax = transferSyntax;
    }

    /**
     * Returns the 128-byte preamble or {@code null} if the file has no preamble and "DICM" prefix.
     *
     * @return preamble.
     */
    public byte[] preamble() {
        return preamble == null ? null : preamble.clone();
    }

    public boolean hasPreamble() {
        return preamble != null;
    }

    public DicomDataset fileMeta() {
        return fileMeta;
    }

    public DicomDataset commandSet() {
        return commandSet;
    }

    public DicomDataset dataset() {
        return dataset;
    }

    /**
     * Returns the transfer syntax of the main dataset, if it is known: it may be absent
     * when the file has no Transfer Syntax UID or its UID is not supported by this library.
     *
     * @return transfer syntax.
     */
    public Optional<TransferSyntax> transferSyntax() {
        return Optional.ofNullable(transferSyntax);
    }

    public boolean isImplicitVR() {
        return dataset.isImplicitVR();
    }

    public boolean isLittleEndian() {
        return dataset.isLittleEndian();
    }

    @Override
    public String toString() {
        return "DICOM file" + (preamble == null ? " without preamble" : "") +
                ", " + (transferSyntax == null ? "unknown transfer syntax" : transferSyntax) +
                ", " + fileMeta.numberOfElements() + " file meta elements" +
                (commandSet.isEmpty() ? "" : ", " + commandSet.numberOfElements() + " command elements") +
                ", " + dataset.numberOfElements() + " elements";
    }
}
