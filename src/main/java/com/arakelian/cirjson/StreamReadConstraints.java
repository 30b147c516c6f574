/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.cirjson;

import org.immutables.value.Value;

import com.arakelian.cirjson.exc.StreamConstraintsException;
import com.google.common.base.Preconditions;

/**
 * Limits applied by parsers to guard against malicious or malformed input. Negative values for
 * document length and token count mean "no limit".
 *
 * <pre>
 * StreamReadConstraints constraints = ImmutableStreamReadConstraints.builder() //
 *         .maxStringLength(1_000_000) //
 *         .maxNestingDepth(64) //
 *         .build();
 * </pre>
 */
@Value.Immutable(copy = false)
public abstract class StreamReadConstraints {
    public static final int DEFAULT_MAX_DEPTH = 500;

    public static final long DEFAULT_MAX_DOC_LEN = -1L;

    public static final long DEFAULT_MAX_TOKEN_COUNT = -1L;

    public static final int DEFAULT_MAX_NUM_LEN = 1000;

    public static final int DEFAULT_MAX_STRING_LEN = 20_000_000;

    public static final int DEFAULT_MAX_NAME_LEN = 50_000;

    /** Largest scale magnitude accepted when a BigDecimal is coerced to a BigInteger **/
    private static final int MAX_BIGINT_SCALE_MAGNITUDE = 100_000;

    private static final StreamReadConstraints DEFAULTS = ImmutableStreamReadConstraints.builder().build();

    public static StreamReadConstraints defaults() {
        return DEFAULTS;
    }

    @Value.Check
    protected void check() {
        Preconditions.checkArgument(getMaxNestingDepth() >= 0, "Cannot set maxNestingDepth to a negative value");
        Preconditions.checkArgument(getMaxNumberLength() >= 0, "Cannot set maxNumberLength to a negative value");
        Preconditions.checkArgument(getMaxStringLength() >= 0, "Cannot set maxStringLength to a negative value");
        Preconditions.checkArgument(getMaxNameLength() >= 0, "Cannot set maxNameLength to a negative value");
    }

    @Value.Default
    public long getMaxDocumentLength() {
        return DEFAULT_MAX_DOC_LEN;
    }

    @Value.Default
    public int getMaxNameLength() {
        return DEFAULT_MAX_NAME_LEN;
    }

    @Value.Default
    public int getMaxNestingDepth() {
        return DEFAULT_MAX_DEPTH;
    }

    @Value.Default
    public int getMaxNumberLength() {
        return DEFAULT_MAX_NUM_LEN;
    }

    @Value.Default
    public int getMaxStringLength() {
        return DEFAULT_MAX_STRING_LEN;
    }

    @Value.Default
    public long getMaxTokenCount() {
        return DEFAULT_MAX_TOKEN_COUNT;
    }

    public final boolean hasMaxDocumentLength() {
        return getMaxDocumentLength() > 0L;
    }

    public final boolean hasMaxTokenCount() {
        return getMaxTokenCount() > 0L;
    }

    private StreamConstraintsException constraintViolation(
            final String what,
            final long value,
            final long max,
            final String method) {
        return new StreamConstraintsException(
                String.format(
                        "%s (%d) exceeds the maximum allowed (%d, from `StreamReadConstraints.%s()`)",
                        what,
                        value,
                        max,
                        method));
    }

    /**
     * Checks that the scale of a BigDecimal being converted to a BigInteger is small enough that
     * the conversion cannot take excessive time.
     *
     * @param scale
     *            scale of the BigDecimal
     * @throws StreamConstraintsException
     *             if the magnitude of the scale is too large
     */
    public final void validateBigIntegerScale(final int scale) throws StreamConstraintsException {
        final int absScale = Math.abs(scale);
        if (absScale > MAX_BIGINT_SCALE_MAGNITUDE) {
            throw new StreamConstraintsException(
                    String.format(
                            "BigDecimal scale (%d) magnitude exceeds the maximum allowed (%d)",
                            scale,
                            MAX_BIGINT_SCALE_MAGNITUDE));
        }
    }

    /**
     * Checks the number of bytes or chars read so far.
     *
     * @param len
     *            total length of input processed
     * @throws StreamConstraintsException
     *             if the document is too long
     */
    public final void validateDocumentLength(final long len) throws StreamConstraintsException {
        final long max = getMaxDocumentLength();
        if (len > max && max > 0L) {
            throw constraintViolation("Document length", len, max, "getMaxDocumentLength");
        }
    }

    /**
     * Checks the length of a floating point value, in characters.
     *
     * @param length
     *            number of characters
     * @throws StreamConstraintsException
     *             if the value is too long
     */
    public final void validateFPLength(final int length) throws StreamConstraintsException {
        if (length > getMaxNumberLength()) {
            throw constraintViolation("Number value length", length, getMaxNumberLength(), "getMaxNumberLength");
        }
    }

    /**
     * Checks the length of an integer value, in characters.
     *
     * @param length
     *            number of characters
     * @throws StreamConstraintsException
     *             if the value is too long
     */
    public final void validateIntegerLength(final int length) throws StreamConstraintsException {
        if (length > getMaxNumberLength()) {
            throw constraintViolation("Number value length", length, getMaxNumberLength(), "getMaxNumberLength");
        }
    }

    /**
     * Checks the length of a property name, in chars or bytes.
     *
     * @param length
     *            name length
     * @throws StreamConstraintsException
     *             if the name is too long
     */
    public final void validateNameLength(final int length) throws StreamConstraintsException {
        if (length > getMaxNameLength()) {
            throw constraintViolation("Name length", length, getMaxNameLength(), "getMaxNameLength");
        }
    }

    /**
     * Checks the current nesting depth.
     *
     * @param depth
     *            depth after entering a new array or object
     * @throws StreamConstraintsException
     *             if nesting is too deep
     */
    public final void validateNestingDepth(final int depth) throws StreamConstraintsException {
        if (depth > getMaxNestingDepth()) {
            throw constraintViolation("Document nesting depth", depth, getMaxNestingDepth(), "getMaxNestingDepth");
        }
    }

    /**
     * Checks the length of a string value, in chars or bytes.
     *
     * @param length
     *            string length
     * @throws StreamConstraintsException
     *             if the string is too long
     */
    public final void validateStringLength(final int length) throws StreamConstraintsException {
        if (length > getMaxStringLength()) {
            throw constraintViolation("String value length", length, getMaxStringLength(), "getMaxStringLength");
        }
    }

    /**
     * Checks the number of tokens read so far.
     *
     * @param count
     *            token count
     * @throws StreamConstraintsException
     *             if there are too many tokens
     */
    public final void validateTokenCount(final long count) throws StreamConstraintsException {
        final long max = getMaxTokenCount();
        if (count > max && max > 0L) {
            throw constraintViolation("Token count", count, max, "getMaxTokenCount");
        }
    }
}
