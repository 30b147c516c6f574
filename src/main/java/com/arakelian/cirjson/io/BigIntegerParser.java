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

import java.math.BigInteger;

import ch.randelshofer.fastdoubleparser.JavaBigIntegerParser;

/**
 * Parses BigInteger values, using the fastdoubleparser library when requested.
 */
public final class BigIntegerParser {
    public static BigInteger parse(final String valueStr) {
        try {
            return new BigInteger(valueStr);
        } catch (final NumberFormatException e) {
            throw parseFailure(e, valueStr);
        }
    }

    private static NumberFormatException parseFailure(final Exception e, final String fullValue) {
        String desc = e.getMessage();
        if (desc == null) {
            desc = "Not a valid number representation";
        }
        return new NumberFormatException(
                "Value " + BigDecimalParser.getValueDesc(fullValue)
                        + " can not be deserialized as `java.math.BigInteger`, reason: " + desc);
    }

    public static BigInteger parseWithFastParser(final String valueStr) {
        try {
            return JavaBigIntegerParser.parseBigInteger(valueStr);
        } catch (final NumberFormatException e) {
            throw parseFailure(e, valueStr);
        }
    }

    private BigIntegerParser() {
        // utility class
    }
}
