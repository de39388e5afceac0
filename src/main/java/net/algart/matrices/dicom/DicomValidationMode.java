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
import java.util.function.Consumer;

/**
 * Policy of reacting to malformed data in the DICOM stream: bad delimiter lengths,
 * unexpected tags where an item or a delimiter was required, truncated headers,
 * mismatch between the assumed and the actual VR encoding.
 * See {@link DicomReadingOptions#setValidationMode(DicomValidationMode)}.
 */
public enum DicomValidationMode {
    /**
     * The problem is logged with DEBUG level, and the reading continues as well as possible.
     */
    IGNORE(false, false),
    /**
     * The problem is logged with WARNING level (and passed to the warning listener, if it is set),
     * and the reading continues as well as possible. This is the default mode.
     */
    WARN(true, false),
    /**
     * The problem leads to {@link DicomException}.
     */
    RAISE(true, true);

    private final boolean warning;
    private final boolean exception;

    DicomValidationMode(boolean warning, boolean exception) {
        this.warning = warning;
        this.exception = exception;
    }

    public boolean isWarning() {
        return warning;
    }

    public boolean isException() {
        return exception;
    }

    /**
     * Reacts to the problem according to this mode.
     *
     * @param log             logger of the calling class.
     * @param warningListener optional listener, called in {@link #WARN} mode; may be {@code null}.
     * @param message         description of the problem.
     * @throws DicomException in {@link #RAISE} mode.
     */
    public void report(System.Logger log, Consumer<String> warningListener, String message)
            throws DicomException {
        Objects.requireNonNull(log, "Null log");
        Objects.requireNonNull(message, "Null message");
        if (exception) {
            throw new DicomException(message);
        }
        if (warning) {
            log.log(System.Logger.Level.WARNING, message);
            if (warningListener != null) {
                warningListener.accept(message);
            }
        } else {
            log.log(System.Logger.Level.DEBUG, message);
        }
    }
}
