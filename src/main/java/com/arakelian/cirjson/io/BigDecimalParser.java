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

package com.arakelian.cirjson.io;

import java.math.BigDecimal;

import ch.randelshofer.fastdoubleparser.JavaBigDecimalParser;

/**
 * Parses BigDecimal values, using the fastdoubleparser library for long inputs where the JDK
 * implementation has quadratic cost.
 */
public final class BigDecimalParser {
    /** Longest value quoted in error messages **/
    static final int MAX_CHARS_TO_REPORT = 1000;

    /** Inputs at least this long are parsed with fastdoubleparser **/
    private static final int SIZE_FOR_FAST_PARSER = 500;

    static String getValueDesc(final String fullValue) {
        final int len = fullValue.length();
        if (len <= MAX_CHARS_TO_REPORT) {
            return String.format("\"%s\"", fullValue);
        }
        return String.format(
                "\"%s\" (truncated to %d chars (from %d))",
                fullValue.substring(0, MAX_CHARS_TO_REPORT),
                MAX_CHARS_TO_REPORT,
                len);
    }

    public static BigDecimal parse(final char[] chars) {
        return parse(chars, 0, chars.length);
    }

    /**
     * Parses a BigDecimal from a char slice.
     *
     * @param chars
     *            characters to parse
     * @param off
     *            offset of first character
     * @param len
     *            number of characters
     * @return parsed value
     * @throws NumberFormatException
     *             if the characters are not a valid number
     */
    public static BigDecimal parse(final char[] chars, final int off, final int len) {
        try {
            if (len < SIZE_FOR_FAST_PARSER) {
                return new BigDecimal(chars, off, len);
            }
            return JavaBigDecimalParser.parseBigDecimal(chars, off, len);
        } catch (final ArithmeticException | NumberFormatException e) {
            throw parseFailure(e, new String(chars, off, len));
        }
    }

    public static BigDecimal parse(final String valueStr) {
        try {
            if (valueStr.length() < SIZE_FOR_FAST_PARSER) {
                return new BigDecimal(valueStr);
            }
            return JavaBigDecimalParser.parseBigDecimal(valueStr);
        } catch (final ArithmeticException | NumberFormatException e) {
            throw parseFailure(e, valueStr);
        }
    }

    static NumberFormatException parseFailure(final Exception e, final String fullValue) {
        String desc = e.getMessage();
        if (desc == null) {
            desc = "Not a valid number representation";
        }
        return new NumberFormatException(
                "Value " + getValueDesc(fullValue) + " can not be deserialized as `java.math.BigDecimal`, reason: "
                        + desc);
    }

    public static BigDecimal parseWithFastParser(final char[] chars, final int off, final int len) {
        try {
            return JavaBigDecimalParser.parseBigDecimal(chars, off, len);
        } catch (final ArithmeticException | NumberFormatException e) {
            throw parseFailure(e, new String(chars, off, len));
        }
    }

    public static BigDecimal parseWithFastParser(final String valueStr) {
        try {
            return JavaBigDecimalParser.parseBigDecimal(valueStr);
        } catch (final ArithmeticException | NumberFormatException e) {
            throw parseFailure(e, valueStr);
        }
    }

    private BigDecimalParser() {
        // utility class
    }
}
