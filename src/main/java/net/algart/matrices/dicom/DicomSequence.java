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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Value of a data element with VR {@link DicomVR#SQ}: ordered list of items, each of them being
 * a {@link DicomDataset}.
 */
public final class DicomSequence {
    private final List<DicomDataset> items = new ArrayList<>();
    private final boolean undefinedLength;

    public DicomSequence(boolean undefinedLength) {
        this.undefinedLength = undefinedLength;
    }

    /**
     * Returns <code>true</code> if this sequence was encoded (or should be encoded) with undefined length,
     * terminated by the Sequence Delimitation Item.
     *
     * @return whether the sequence has undefined length.
     */
    public boolean isUndefinedLength() {
        return undefinedLength;
    }

    public DicomSequence add(DicomDataset item) {
        items.add(Objects.requireNonNull(item, "Null item"));
        return this;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public DicomDataset item(int index) {
        return items.get(index);
    }

    public List<DicomDataset> items() {
        return Collections.unmodifiableList(items);
    }

    @Override
    public String toString() {
        return "sequence of " + items.size() + " items" + (undefinedLength ? " (undefined length)" : "");
    }
}
