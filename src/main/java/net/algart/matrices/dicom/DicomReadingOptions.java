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

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Options of reading DICOM data element streams. Every reading session receives its own instance
 * of this class; there are no global settings.
 */
public class DicomReadingOptions implements Cloneable {
    /**
     * Predicate, evaluated for every element immediately before reading its value.
     * If it returns <code>true</code>, the reader stops and positions the stream at the start of
     * this element's header.
     */
    @FunctionalInterface
    public interface StopCondition {
        /**
         * @param tag    element tag.
         * @param vr     element VR or {@code null} if it is unknown.
         * @param length declared length, maybe {@link DicomElement#UNDEFINED_LENGTH}.
         * @return whether to stop.
         */
        boolean stop(int tag, DicomVR vr, long length);
    }

    public static final long NO_DEFER = -1;

    private DicomValidationMode validationMode = DicomValidationMode.WARN;
    private long deferSize = NO_DEFER;
    private boolean assumeImplicitVRSwitch = true;
    private boolean inferSequenceForUN = true;
    private StopCondition stopCondition = null;
    private Set<Integer> specificTags = null;
    private DicomVR.Lookup vrLookup = DicomTag::knownVR;
    private Consumer<String> warningListener = null;

    public DicomReadingOptions() {
    }

    public static DicomReadingOptions of(DicomValidationMode validationMode) {
        return new DicomReadingOptions().setValidationMode(validationMode);
    }

    public DicomValidationMode getValidationMode() {
        return validationMode;
    }

    public DicomReadingOptions setValidationMode(DicomValidationMode validationMode) {
        this.validationMode = Objects.requireNonNull(validationMode, "Null validationMode");
        return this;
    }

    public boolean hasDeferSize() {
        return deferSize != NO_DEFER;
    }

    public long getDeferSize() {
        return deferSize;
    }

    /**
     * Sets the threshold for deferred reading: values, the declared length of which is greater than
     * this number of bytes, are not loaded while reading the stream. Only their position is stored,
     * and they can be loaded later by {@link DicomStreamReader#materialize(DicomElement)}.
     *
     * @param deferSize maximal size of a value that is loaded immediately, or {@link #NO_DEFER}.
     * @return a reference to this object.
     */
    public DicomReadingOptions setDeferSize(long deferSize) {
        if (deferSize < 0 && deferSize != NO_DEFER) {
            throw new IllegalArgumentException("Negative deferSize = " + deferSize);
        }
        this.deferSize = deferSize;
        return this;
    }

    public boolean isAssumeImplicitVRSwitch() {
        return assumeImplicitVRSwitch;
    }

    /**
     * If set (default), an Explicit VR element, the VR bytes of which are not two uppercase letters,
     * is re-read as Implicit VR. In other case, such an element is read as an element of unknown VR
     * with 2-byte length.
     *
     * @param assumeImplicitVRSwitch whether to switch to implicit VR on non-letter VR bytes.
     * @return a reference to this object.
     */
    public DicomReadingOptions setAssumeImplicitVRSwitch(boolean assumeImplicitVRSwitch) {
        this.assumeImplicitVRSwitch = assumeImplicitVRSwitch;
        return this;
    }

    public boolean isInferSequenceForUN() {
        return inferSequenceForUN;
    }

    public DicomReadingOptions setInferSequenceForUN(boolean inferSequenceForUN) {
        this.inferSequenceForUN = inferSequenceForUN;
        return this;
    }

    public StopCondition getStopCondition() {
        return stopCondition;
    }

    public DicomReadingOptions setStopCondition(StopCondition stopCondition) {
        this.stopCondition = stopCondition;
        return this;
    }

    public boolean hasSpecificTags() {
        return specificTags != null;
    }

    public Set<Integer> getSpecificTags() {
        return specificTags == null ? null : Collections.unmodifiableSet(specificTags);
    }

    /**
     * Sets the set of tags to keep: other elements are skipped. Specific Character Set (0008,0005)
     * is always kept. {@code null} means "keep all elements".
     *
     * @param specificTags tags to keep or {@code null}.
     * @return a reference to this object.
     */
    public DicomReadingOptions setSpecificTags(Collection<Integer> specificTags) {
        if (specificTags == null) {
            this.specificTags = null;
        } else {
            final Set<Integer> set = new TreeSet<>(Integer::compareUnsigned);
            for (Integer tag : specificTags) {
                set.add(Objects.requireNonNull(tag, "Null tag in specificTags"));
            }
            set.add(DicomTag.SPECIFIC_CHARACTER_SET);
            this.specificTags = set;
        }
        return this;
    }

    public boolean isTagRequested(int tag) {
        return specificTags == null || specificTags.contains(tag);
    }

    public DicomVR.Lookup getVRLookup() {
        return vrLookup;
    }

    public DicomReadingOptions setVRLookup(DicomVR.Lookup vrLookup) {
        this.vrLookup = Objects.requireNonNull(vrLookup, "Null vrLookup");
        return this;
    }

    public Consumer<String> getWarningListener() {
        return warningListener;
    }

    /**
     * Sets a listener, notified about every problem reported in {@link DicomValidationMode#WARN} mode
     * in addition to logging.
     *
     * @param warningListener listener or {@code null}.
     * @return a reference to this object.
     */
    public DicomReadingOptions setWarningListener(Consumer<String> warningListener) {
        this.warningListener = warningListener;
        return this;
    }

    /**
     * Reports a malformed-stream problem according to the current {@link #getValidationMode() validation mode}.
     *
     * @param log     logger of the calling class.
     * @param message description of the problem.
     * @throws DicomException in {@link DicomValidationMode#RAISE} mode.
     */
    public void report(System.Logger log, String message) throws DicomException {
        validationMode.report(log, warningListener, message);
    }

    /**
     * Logs a warning that does not depend on the validation mode (heuristics, tolerated non-conformance)
     * and passes it to the warning listener.
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

    public DicomReadingOptions setTo(DicomReadingOptions options) {
        Objects.requireNonNull(options, "Null options");
        setValidationMode(options.validationMode);
        setDeferSize(options.deferSize);
        setAssumeImplicitVRSwitch(options.assumeImplicitVRSwitch);
        setInferSequenceForUN(options.inferSequenceForUN);
        setStopCondition(options.stopCondition);
        setSpecificTags(options.specificTags);
        setVRLookup(options.vrLookup);
        setWarningListener(options.warningListener);
        return this;
    }

    @Override
    public DicomReadingOptions clone() {
        final DicomReadingOptions result;
        try {
            result = (DicomReadingOptions) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
        result.setTo(this);
        // - copies the set of specific tags
        return result;
    }

    @Override
    public String toString() {
        return "DicomReadingOptions: " +
                "validationMode=" + validationMode +
                ", deferSize=" + (deferSize == NO_DEFER ? "none" : deferSize) +
                ", assumeImplicitVRSwitch=" + assumeImplicitVRSwitch +
                ", inferSequenceForUN=" + inferSequenceForUN +
                (stopCondition != null ? ", with stop condition" : "") +
                (specificTags != null ? ", " + specificTags.size() + " specific tags" : "");
    }
}
