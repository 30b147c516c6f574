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

import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class NumberOutputTest {
    private static String ints(final long value) {
        final char[] chars = new char[24];
        final int end = NumberOutput.outputLong(value, chars, 2);
        final String fromChars = new String(chars, 2, end - 2);

        final byte[] bytes = new byte[24];
        final int byteEnd = NumberOutput.outputLong(value, bytes, 1);
        Assertions.assertEquals(fromChars, new String(bytes, 1, byteEnd - 1, StandardCharsets.US_ASCII));
        return fromChars;
    }

    @Test
    public void testIntegers() {
        Assertions.assertEquals("0", ints(0));
        Assertions.assertEquals("7", ints(7));
        Assertions.assertEquals("-10", ints(-10));
        Assertions.assertEquals("100", ints(100));
        Assertions.assertEquals("1234567", ints(1234567));
        Assertions.assertEquals("9223372036854775807", ints(Long.MAX_VALUE));
        Assertions.assertEquals("-9223372036854775808", ints(Long.MIN_VALUE));

        final char[] chars = new char[12];
        Assertions.assertEquals(11, NumberOutput.outputInt(Integer.MIN_VALUE, chars, 0));
        Assertions.assertEquals("-2147483648", new String(chars, 0, 11));
        final byte[] bytes = new byte[12];
        Assertions.assertEquals(10, NumberOutput.outputInt(Integer.MAX_VALUE, bytes, 0));
    }

    @Test
    public void testIntegersMatchJdk() {
        final Random random = new Random(42);
        for (int i = 0; i < 10000; i++) {
            final long v = random.nextLong() >> random.nextInt(64);
            Assertions.assertEquals(Long.toString(v), ints(v));
        }
    }

    @Test
    public void testStandardWriterIsJdk() {
        Assertions.assertEquals(Double.toString(0.3), NumberOutput.toString(0.3, false));
        Assertions.assertEquals(Float.toString(1.1f), NumberOutput.toString(1.1f, false));
    }
}
