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

import net.algart.matrices.dicom.codecs.PixelDataOptions;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Combination of pixel attributes, allowed for some compressed transfer syntax
 * (DICOM PS3.5, section 8.2).
 *
 * @param photometricInterpretation photometric interpretation.
 * @param samplesPerPixel           samples per pixel.
 * @param pixelRepresentations      allowed pixel representations (0 unsigned, 1 signed).
 * @param bitsAllocated             allowed bits allocated.
 * @param minBitsStored             minimal bits stored.
 * @param maxBitsStored             maximal bits stored.
 */
public record EncodingProfile(
        String photometricInterpretation,
        int samplesPerPixel,
        Set<Integer> pixelRepresentations,
        Set<Integer> bitsAllocated,
        int minBitsStored,
        int maxBitsStored) {

    static final List<EncodingProfile> JPEG_BASELINE_8BIT = List.of(
            new EncodingProfile("MONOCHROME1", 1, Set.of(0), Set.of(8), 8, 8),
            new EncodingProfile("MONOCHROME2", 1, Set.of(0), Set.of(8), 8, 8),
            new EncodingProfile("YBR_FULL_422", 3, Set.of(0), Set.of(8), 8, 8),
            new EncodingProfile("RGB", 3, Set.of(0), Set.of(8), 8, 8));

    static final List<EncodingProfile> JPEG_EXTENDED_12BIT = List.of(
            new EncodingProfile("MONOCHROME1", 1, Set.of(0), Set.of(8), 8, 8),
            new EncodingProfile("MONOCHROME1", 1, Set.of(0), Set.of(16), 12, 12),
            new EncodingProfile("MONOCHROME2", 1, Set.of(0), Set.of(8), 8, 8),
            new EncodingProfile("MONOCHROME2", 1, Set.of(0), Set.of(16), 12, 12));

    static final List<EncodingProfile> JPEG_2000_LOSSLESS = List.of(
            new EncodingProfile("MONOCHROME1", 1, Set.of(0, 1), Set.of(8, 16, 24, 32, 40), 1, 38),
            new EncodingProfile("MONOCHROME2", 1, Set.of(0, 1), Set.of(8, 16, 24, 32, 40), 1, 38),
            new EncodingProfile("PALETTE COLOR", 1, Set.of(0), Set.of(8, 16), 1, 16),
            new EncodingProfile("YBR_RCT", 3, Set.of(0), Set.of(8, 16, 24, 32, 40), 1, 38),
            new EncodingProfile("RGB", 3, Set.of(0), Set.of(8, 16, 24, 32, 40), 1, 38),
            new EncodingProfile("YBR_FULL", 3, Set.of(0), Set.of(8, 16, 24, 32, 40), 1, 38));

    static final List<EncodingProfile> JPEG_2000 = List.of(
            new EncodingProfile("MONOCHROME1", 1, Set.of(0, 1), Set.of(8, 16, 24, 32, 40), 1, 38),
            new EncodingProfile("MONOCHROME2", 1, Set.of(0, 1), Set.of(8, 16, 24, 32, 40), 1, 38),
            new EncodingProfile("YBR_ICT", 3, Set.of(0), Set.of(8, 16, 24, 32, 40), 1, 38),
            new EncodingProfile("RGB", 3, Set.of(0), Set.of(8, 16, 24, 32, 40), 1, 38),
            new EncodingProfile("YBR_FULL", 3, Set.of(0), Set.of(8, 16, 24, 32, 40), 1, 38));

    static final List<EncodingProfile> RLE_LOSSLESS = List.of(
            new EncodingProfile("MONOCHROME1", 1, Set.of(0, 1), Set.of(8, 16), 1, 16),
            new EncodingProfile("MONOCHROME2", 1, Set.of(0, 1), Set.of(8, 16), 1, 16),
            new EncodingProfile("PALETTE COLOR", 1, Set.of(0), Set.of(8, 16), 1, 16),
            new EncodingProfile("YBR_FULL", 3, Set.of(0), Set.of(8), 1, 8),
            new EncodingProfile("RGB", 3, Set.of(0), Set.of(8, 16), 1, 16));

    public EncodingProfile {
        Objects.requireNonNull(photometricInterpretation, "Null photometric interpretation");
        pixelRepresentations = Set.copyOf(pixelRepresentations);
        bitsAllocated = Set.copyOf(bitsAllocated);
    }

    public boolean matches(PixelDataOptions options) {
        Objects.requireNonNull(options, "Null options");
        final int bitsStored = options.bitsStored();
        return photometricInterpretation.equals(options.getPhotometricInterpretation())
                && samplesPerPixel == options.samplesPerPixel()
                && pixelRepresentations.contains(options.pixelRepresentation())
                && bitsAllocated.contains(options.bitsAllocated())
                && bitsStored >= minBitsStored && bitsStored <= maxBitsStored;
    }
}
