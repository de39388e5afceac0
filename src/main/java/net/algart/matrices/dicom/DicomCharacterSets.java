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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Conversion of Specific Character Set (0008,0005) defined terms into Java charsets.
 */
public final class DicomCharacterSets {
    /**
     * Charset of the default character repertoire. We use ISO-8859-1 instead of pure ASCII
     * to decode non-conforming 8-bit text without losing bytes.
     */
    public static final Charset DEFAULT_CHARSET = StandardCharsets.ISO_8859_1;
    public static final List<Charset> DEFAULT = List.of(DEFAULT_CHARSET);

    private static final Map<String, String> JAVA_CHARSET_NAMES = Map.ofEntries(
            Map.entry("", "ISO-8859-1"),
            Map.entry("ISO_IR 6", "ISO-8859-1"),
            Map.entry("ISO_IR 13", "Shift_JIS"),
            Map.entry("ISO_IR 100", "ISO-8859-1"),
            Map.entry("ISO_IR 101", "ISO-8859-2"),
            Map.entry("ISO_IR 109", "ISO-8859-3"),
            Map.entry("ISO_IR 110", "ISO-8859-4"),
            Map.entry("ISO_IR 126", "ISO-8859-7"),
            Map.entry("ISO_IR 127", "ISO-8859-6"),
            Map.entry("ISO_IR 138", "ISO-8859-8"),
            Map.entry("ISO_IR 144", "ISO-8859-5"),
            Map.entry("ISO_IR 148", "ISO-8859-9"),
            Map.entry("ISO_IR 166", "TIS-620"),
            Map.entry("ISO_IR 192", "UTF-8"),
            Map.entry("ISO 2022 IR 6", "ISO-8859-1"),
            Map.entry("ISO 2022 IR 13", "Shift_JIS"),
            Map.entry("ISO 2022 IR 87", "ISO-2022-JP"),
            Map.entry("ISO 2022 IR 100", "ISO-8859-1"),
            Map.entry("ISO 2022 IR 101", "ISO-8859-2"),
            Map.entry("ISO 2022 IR 109", "ISO-8859-3"),
            Map.entry("ISO 2022 IR 110", "ISO-8859-4"),
            Map.entry("ISO 2022 IR 126", "ISO-8859-7"),
            Map.entry("ISO 2022 IR 127", "ISO-8859-6"),
            Map.entry("ISO 2022 IR 138", "ISO-8859-8"),
            Map.entry("ISO 2022 IR 144", "ISO-8859-5"),
            Map.entry("ISO 2022 IR 148", "ISO-8859-9"),
            Map.entry("ISO 2022 IR 149", "EUC-KR"),
            Map.entry("ISO 2022 IR 159", "ISO-2022-JP"),
            Map.entry("ISO 2022 IR 166", "TIS-620"),
            Map.entry("ISO 2022 IR 58", "GB2312"),
            Map.entry("GB18030", "GB18030"),
            Map.entry("GBK", "GBK"));

    private static final List<String> STAND_ALONE = List.of("ISO_IR 192", "GBK", "GB18030");

    private static final System.Logger LOG = System.getLogger(DicomCharacterSets.class.getName());

    private DicomCharacterSets() {
    }

    /**
     * Returns the charset for the given defined term, if it is known and supported by this JVM.
     *
     * @param term defined term like "ISO_IR 100"; the empty string means the default repertoire.
     * @return corresponding Java charset.
     */
    public static Optional<Charset> forTerm(String term) {
        Objects.requireNonNull(term, "Null term");
        final String name = JAVA_CHARSET_NAMES.get(term);
        if (name == null || !Charset.isSupported(name)) {
            return Optional.empty();
        }
        return Optional.of(Charset.forName(name));
    }

    /**
     * Splits the raw value of Specific Character Set into defined terms.
     * Leading and trailing spaces are removed; the first term may be empty.
     *
     * @param value raw bytes of (0008,0005).
     * @return list of terms (never empty).
     */
    public static List<String> parseTerms(byte[] value) {
        Objects.requireNonNull(value, "Null value");
        final String s = new String(value, StandardCharsets.US_ASCII);
        final List<String> result = new ArrayList<>();
        for (String term : s.split("\\\\", -1)) {
            result.add(term.replace('\0', ' ').strip());
        }
        return result;
    }

    /**
     * Converts the list of defined terms into the list of charsets.
     * Terms with common spelling errors ("ISO-IR 100", "ISO 2022-IR 100") are corrected with a warning;
     * unknown terms are reported according to the validation mode and replaced with {@link #DEFAULT_CHARSET}.
     * Stand-alone character sets (like UTF-8) do not allow code extensions: other terms are ignored.
     *
     * @param terms   Specific Character Set terms.
     * @param options reading options, defining reaction to unknown terms.
     * @return list of charsets; its first element is the charset used to decode text values.
     * @throws DicomException if some term is unknown in {@link DicomValidationMode#RAISE} mode.
     */
    public static List<Charset> toCharsets(List<String> terms, DicomReadingOptions options) throws DicomException {
        Objects.requireNonNull(terms, "Null terms");
        Objects.requireNonNull(options, "Null options");
        if (terms.isEmpty()) {
            return DEFAULT;
        }
        final List<Charset> result = new ArrayList<>();
        for (String term : terms) {
            result.add(toCharset(term, options));
        }
        if (terms.size() > 1) {
            if (STAND_ALONE.contains(terms.get(0))) {
                options.warn(LOG, "Value '" + terms.get(0) + "' for Specific Character Set does not " +
                        "allow code extensions, ignoring: " + String.join(", ", terms.subList(1, terms.size())));
                return List.of(result.get(0));
            }
            for (int k = terms.size() - 1; k >= 1; k--) {
                if (STAND_ALONE.contains(terms.get(k))) {
                    options.warn(LOG, "Value '" + terms.get(k) + "' cannot be used as code extension, ignoring it");
                    result.remove(k);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static Charset toCharset(String term, DicomReadingOptions options) throws DicomException {
        final Optional<Charset> charset = forTerm(term);
        if (charset.isPresent()) {
            return charset.get();
        }
        final String patched = patchedTerm(term);
        if (patched != null) {
            final Optional<Charset> patchedCharset = forTerm(patched);
            if (patchedCharset.isPresent()) {
                options.warn(LOG, "Incorrect value for Specific Character Set '" + term +
                        "' - assuming '" + patched + "'");
                return patchedCharset.get();
            }
        }
        options.report(LOG, "Unknown encoding '" + term + "' - using default encoding instead");
        return DEFAULT_CHARSET;
    }

    private static String patchedTerm(String term) {
        if (term.length() > 6 && term.startsWith("ISO") && term.charAt(3) != '_' && term.startsWith("IR", 4)) {
            return "ISO_IR" + term.substring(6);
        }
        if (term.length() > 12 && term.startsWith("ISO") && term.startsWith("2022", 4) &&
                term.startsWith("IR", 9) && !term.startsWith("ISO 2022 IR ")) {
            return "ISO 2022 IR " + term.substring(12);
        }
        return null;
    }
}
