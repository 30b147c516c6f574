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

package com.arakelian.cirjson.json.async;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.arakelian.cirjson.CirJsonFactory;
import com.arakelian.cirjson.CirJsonLocation;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonReadFeature;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.ImmutableCirJsonFactoryOptions;
import com.arakelian.cirjson.exc.StreamReadException;

public class NonBlockingByteArrayCirJsonParserTest {
    private static final CirJsonFactory FACTORY = new CirJsonFactory();

    private static final String DOC = "{\"__cirJsonId__\":\"0\",\"name\":\"café € 😀\","
            + "\"values\":[\"1\",12345,-0.125,1e10,true,false,null,\"\\u0041\\n\"],"
            + "\"nested\":{\"__cirJsonId__\":\"2\",\"deep\":[\"3\",[\"4\"]]},"
            + "\"big\":123456789012345678901234567890}\n[\"5\"] 42";

    private static String describe(final CirJsonParser p, final CirJsonToken t) throws IOException {
        return t.isScalarValue() || t.isName() ? t + ":" + p.getText() : t.toString();
    }

    private static List<String> readAll(final CirJsonParser p) throws IOException {
        final List<String> tokens = new ArrayList<>();
        CirJsonToken t;
        while ((t = p.nextToken()) != null) {
            tokens.add(describe(p, t));
        }
        return tokens;
    }

    private static final CirJsonFactory LENIENT = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
            .addEnabledReadFeatures(CirJsonReadFeature.ALLOW_JAVA_COMMENTS, //
                    CirJsonReadFeature.ALLOW_YAML_COMMENTS, //
                    CirJsonReadFeature.ALLOW_SINGLE_QUOTES, //
                    CirJsonReadFeature.ALLOW_UNQUOTED_PROPERTY_NAMES, //
                    CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS, //
                    CirJsonReadFeature.ALLOW_LEADING_ZEROS_FOR_NUMBERS, //
                    CirJsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS, //
                    CirJsonReadFeature.ALLOW_TRAILING_COMMA, //
                    CirJsonReadFeature.ALLOW_MISSING_VALUES) //
            .build());

    private static final String LENIENT_DOC = "# header\n/* block ** comment */{'__cirJsonId__':'0',"
            + "name:'it\\'s \\u00e9',// line\n\"n\":[\"1\",NaN,-Infinity,+Infinity,007,+12,-0.5e-3,,2,],"
            + "trail:{\"__cirJsonId__\":\"2\",},}";

    private static List<String> readChunked(final byte[] data, final int chunkSize) throws IOException {
        return readChunked(FACTORY, data, chunkSize);
    }

    private static List<String> readChunked(final CirJsonFactory factory, final byte[] data, final int chunkSize)
            throws IOException {
        final List<String> tokens = new ArrayList<>();
        try (final NonBlockingByteArrayCirJsonParser p = factory.createNonBlockingByteArrayParser()) {
            int offset = 0;
            for (;;) {
                final CirJsonToken t = p.nextToken();
                if (t == null) {
                    break;
                }
                if (t != CirJsonToken.NOT_AVAILABLE) {
                    tokens.add(describe(p, t));
                    continue;
                }
                Assertions.assertTrue(p.needMoreInput());
                if (offset < data.length) {
                    final int end = Math.min(data.length, offset + chunkSize);
                    p.feedInput(data, offset, end);
                    offset = end;
                } else {
                    p.endOfInput();
                }
            }
        }
        return tokens;
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 5, 7, 16, 1024 })
    public void testChunkedInputMatchesWholeInput(final int chunkSize) throws IOException {
        final List<String> expected;
        try (final CirJsonParser p = FACTORY.createParser(DOC)) {
            expected = readAll(p);
        }
        Assertions.assertEquals("START_OBJECT", expected.get(0));

        final List<String> actual = readChunked(DOC.getBytes(StandardCharsets.UTF_8), chunkSize);
        Assertions.assertEquals(expected, actual);
    }

    @Test
    public void testFeedAfterEndOfInput() throws IOException {
        try (final NonBlockingByteArrayCirJsonParser p = FACTORY.createNonBlockingByteArrayParser()) {
            final byte[] data = "[\"0\"]".getBytes(StandardCharsets.UTF_8);
            final StreamReadException bad = Assertions.assertThrows(StreamReadException.class,
                    () -> p.feedInput(data, 3, 1));
            Assertions.assertTrue(bad.getMessage().contains("Input end (1) may not be before start (3)"));

            p.endOfInput();
            final StreamReadException closed = Assertions.assertThrows(StreamReadException.class,
                    () -> p.feedInput(data, 0, data.length));
            Assertions.assertTrue(closed.getMessage().contains("Already closed, can not feed more input"));
        }
    }

    @Test
    public void testNeedMoreInput() throws IOException {
        try (final NonBlockingByteArrayCirJsonParser p = FACTORY.createNonBlockingByteArrayParser()) {
            Assertions.assertTrue(p.needMoreInput());
            Assertions.assertEquals(CirJsonToken.NOT_AVAILABLE, p.nextToken());

            final byte[] first = "[\"0\",12".getBytes(StandardCharsets.UTF_8);
            p.feedInput(first, 0, first.length);
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals("0", p.getText());

            // the number may continue in the next chunk
            Assertions.assertEquals(CirJsonToken.NOT_AVAILABLE, p.nextToken());
            Assertions.assertTrue(p.needMoreInput());

            final byte[] second = "3]".getBytes(StandardCharsets.UTF_8);
            p.feedInput(second, 0, second.length);
            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_INT, p.nextToken());
            Assertions.assertEquals(123, p.getIntValue());
            Assertions.assertEquals("/1", p.getParsingContext().pathAsString());
            Assertions.assertEquals(CirJsonToken.END_ARRAY, p.nextToken());

            Assertions.assertEquals(CirJsonToken.NOT_AVAILABLE, p.nextToken());
            p.endOfInput();
            Assertions.assertFalse(p.needMoreInput());
            Assertions.assertNull(p.nextToken());
        }
    }

    @Test
    public void testTruncatedInput() throws IOException {
        try (final NonBlockingByteArrayCirJsonParser p = FACTORY.createNonBlockingByteArrayParser()) {
            final byte[] data = "[\"0\",\"ab".getBytes(StandardCharsets.UTF_8);
            p.feedInput(data, 0, data.length);
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals(CirJsonToken.NOT_AVAILABLE, p.nextToken());
            p.endOfInput();
            final StreamReadException e = Assertions.assertThrows(StreamReadException.class, () -> p.nextToken());
            Assertions.assertTrue(e.getMessage().contains("was expecting closing quote for a string value"),
                    e.getMessage());
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 4, 9, 1024 })
    public void testChunkedNonStandardInput(final int chunkSize) throws IOException {
        final List<String> expected;
        try (final CirJsonParser p = LENIENT.createParser(LENIENT_DOC)) {
            expected = readAll(p);
        }
        Assertions.assertTrue(expected.contains("VALUE_STRING:it's \u00e9"), expected.toString());
        Assertions.assertTrue(expected.contains("VALUE_NUMBER_FLOAT:-Infinity"), expected.toString());

        final List<String> actual = readChunked(LENIENT, LENIENT_DOC.getBytes(StandardCharsets.UTF_8), chunkSize);
        Assertions.assertEquals(expected, actual);
    }

    @Test
    public void testFeedBeforeChunkConsumed() throws IOException {
        try (final NonBlockingByteArrayCirJsonParser p = FACTORY.createNonBlockingByteArrayParser()) {
            final byte[] data = "[\"0\",1]".getBytes(StandardCharsets.UTF_8);
            p.feedInput(data, 0, data.length);
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertFalse(p.needMoreInput());
            final StreamReadException e = Assertions.assertThrows(StreamReadException.class,
                    () -> p.feedInput(data, 0, data.length));
            Assertions.assertTrue(e.getMessage().contains("Still have 6 undecoded bytes"), e.getMessage());
        }
    }

    @Test
    public void testLongStringInSingleByteChunks() {
        final StringBuilder sb = new StringBuilder("[\"0\",\"");
        for (int i = 0; i < 250_000; i++) {
            sb.append("ab\u20ac\\n");
        }
        final String doc = sb.append("\"]").toString();
        final byte[] data = doc.getBytes(StandardCharsets.UTF_8);

        // each byte is decoded once, so a megabyte fed one byte at a time stays fast
        final List<String> tokens = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(20),
                () -> readChunked(data, 1));
        Assertions.assertEquals(4, tokens.size());
        final String value = tokens.get(2);
        Assertions.assertEquals("VALUE_STRING:".length() + 1_000_000, value.length());
        Assertions.assertTrue(value.endsWith("ab\u20ac\n"));
    }

    @Test
    public void testReusedChunkBuffer() throws IOException {
        final byte[] data = DOC.getBytes(StandardCharsets.UTF_8);
        final List<String> expected = readChunked(data, data.length);

        // the caller refills one small array; the parser must not depend on earlier chunks
        final byte[] scratch = new byte[3];
        final List<String> tokens = new ArrayList<>();
        try (final NonBlockingByteArrayCirJsonParser p = FACTORY.createNonBlockingByteArrayParser()) {
            int offset = 0;
            CirJsonToken t;
            while ((t = p.nextToken()) != null) {
                if (t != CirJsonToken.NOT_AVAILABLE) {
                    tokens.add(describe(p, t));
                } else if (offset < data.length) {
                    final int len = Math.min(scratch.length, data.length - offset);
                    Arrays.fill(scratch, (byte) 'x');
                    System.arraycopy(data, offset, scratch, 0, len);
                    p.feedInput(scratch, 0, len);
                    offset += len;
                } else {
                    p.endOfInput();
                }
            }
        }
        Assertions.assertEquals(expected, tokens);
    }

    @Test
    public void testTokenLocationAcrossChunks() throws IOException {
        final byte[] data = "[\"0\",\"\u00e9\",\n  true]".getBytes(StandardCharsets.UTF_8);
        try (final NonBlockingByteArrayCirJsonParser p = FACTORY.createNonBlockingByteArrayParser()) {
            int offset = 0;
            CirJsonToken t;
            while ((t = p.nextToken()) != CirJsonToken.VALUE_TRUE) {
                if (t == CirJsonToken.NOT_AVAILABLE) {
                    p.feedInput(data, offset, offset + 1);
                    offset++;
                }
            }
            final CirJsonLocation location = p.currentTokenLocation();
            Assertions.assertEquals(13L, location.getByteOffset());
            Assertions.assertEquals(2, location.getLineNr());
            Assertions.assertEquals(3, location.getColumnNr());
        }
    }

    @Test
    public void testUtf8SequenceSplitAcrossChunks() throws IOException {
        final byte[] data = "[\"0\",\"\ud83d\ude00\"]".getBytes(StandardCharsets.UTF_8);
        try (final NonBlockingByteArrayCirJsonParser p = FACTORY.createNonBlockingByteArrayParser()) {
            // cut the four byte sequence after its second byte
            p.feedInput(data, 0, 8);
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals(CirJsonToken.NOT_AVAILABLE, p.nextToken());
            p.feedInput(data, 8, data.length);
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals("\ud83d\ude00", p.getText());
            Assertions.assertEquals(CirJsonToken.END_ARRAY, p.nextToken());
        }

        try (final NonBlockingByteArrayCirJsonParser p = FACTORY.createNonBlockingByteArrayParser()) {
            p.feedInput(data, 0, 8);
            p.nextToken();
            p.nextToken();
            Assertions.assertEquals(CirJsonToken.NOT_AVAILABLE, p.nextToken());
            p.endOfInput();
            final StreamReadException e = Assertions.assertThrows(StreamReadException.class, () -> p.nextToken());
            Assertions.assertTrue(e.getMessage().contains("in a multi-byte UTF-8 character"), e.getMessage());
        }
    }
}
