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


package com.arakelian.cirjson.util;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.arakelian.cirjson.ImmutableStreamReadConstraints;
import com.arakelian.cirjson.StreamReadConstraints;
import com.arakelian.cirjson.exc.StreamConstraintsException;

public class TextBufferTest {
    private static String repeat(final int len) {
        final StringBuilder sb = new StringBuilder(len);
        for (int i = 0; i < len; i++) {
            sb.append((char) ('a' + i % 26));
        }
        return sb.toString();
    }

    @Test
    public void testAppendAcrossSegments() throws IOException {
        final String expected = repeat(100_000);
        final TextBuffer tb = new TextBuffer(new BufferRecycler());
        for (int i = 0; i < 1000; i++) {
            tb.append(expected.charAt(i));
        }
        tb.append(expected.toCharArray(), 1000, 49_000);
        tb.append(expected, 50_000, 50_000);

        Assertions.assertEquals(100_000, tb.size());
        Assertions.assertEquals(expected, tb.contentsAsString());
        Assertions.assertArrayEquals(expected.toCharArray(), tb.contentsAsArray());

        final StringWriter w = new StringWriter();
        Assertions.assertEquals(100_000, tb.contentsToWriter(w));
        Assertions.assertEquals(expected, w.toString());

        tb.resetWithEmpty();
        Assertions.assertEquals(0, tb.size());
        Assertions.assertEquals("", tb.contentsAsString());
        tb.releaseBuffers();
    }

    @Test
    public void testFinishCurrentSegment() throws IOException {
        final TextBuffer tb = new TextBuffer(null);
        char[] seg = tb.emptyAndGetCurrentSegment();
        final int first = seg.length;
        for (int i = 0; i < first; i++) {
            seg[i] = 'x';
        }
        seg = tb.finishCurrentSegment();
        Assertions.assertTrue(seg.length > first);
        seg[0] = 'y';
        tb.setCurrentLength(1);
        Assertions.assertEquals(first + 1, tb.size());
        Assertions.assertTrue(tb.contentsAsString().endsWith("xy"));
    }

    @Test
    public void testNumbers() throws IOException {
        final TextBuffer tb = new TextBuffer(new BufferRecycler());
        tb.resetWithCopy("-123", 0, 4);
        Assertions.assertEquals(-123, tb.contentsAsInt(true));
        tb.resetWithCopy("9876543210123", 0, 13);
        Assertions.assertEquals(9876543210123L, tb.contentsAsLong(false));
        tb.resetWithString("-2.50");
        Assertions.assertEquals(new BigDecimal("-2.50"), tb.contentsAsDecimal(false));
        Assertions.assertEquals(-2.5, tb.contentsAsDouble(true));
        Assertions.assertEquals(-2.5f, tb.contentsAsFloat(false));
    }

    @Test
    public void testReadConstrained() throws IOException {
        final StreamReadConstraints constraints = ImmutableStreamReadConstraints.builder() //
                .maxStringLength(10) //
                .build();
        final ReadConstrainedTextBuffer tb = new ReadConstrainedTextBuffer(constraints, new BufferRecycler());
        tb.resetWithCopy("0123456789", 0, 10);
        Assertions.assertEquals("0123456789", tb.contentsAsString());

        tb.resetWithCopy("0123456789x", 0, 11);
        final StreamConstraintsException e = Assertions.assertThrows(StreamConstraintsException.class,
                () -> tb.contentsAsString());
        Assertions.assertTrue(e.getMessage().startsWith("String value length (11) exceeds the maximum allowed (10"),
                e.getMessage());
        Assertions.assertThrows(StreamConstraintsException.class, () -> tb.resetWithString(repeat(11)));
    }

    @Test
    public void testSharedInput() throws IOException {
        final char[] input = "xxhelloxx".toCharArray();
        final TextBuffer tb = new TextBuffer(new BufferRecycler());
        tb.resetWithShared(input, 2, 5);
        Assertions.assertSame(input, tb.getTextBuffer());
        Assertions.assertEquals(2, tb.getTextOffset());
        Assertions.assertEquals(5, tb.size());
        Assertions.assertTrue(tb.hasTextAsCharacters());

        // appending copies the shared content first
        tb.append('!');
        Assertions.assertEquals("hello!", tb.contentsAsString());
        Assertions.assertEquals("xxhelloxx", new String(input));
    }

    @Test
    public void testFromInitialAndResetWithChar() throws IOException {
        final TextBuffer tb = TextBuffer.fromInitial("abc".toCharArray());
        Assertions.assertEquals("abc", tb.contentsAsString());
        tb.resetWith('z');
        Assertions.assertEquals("z", tb.toString());
        tb.getCurrentSegment()[1] = 'q';
        Assertions.assertEquals("zq", tb.setCurrentAndReturn(2));
    }
}
