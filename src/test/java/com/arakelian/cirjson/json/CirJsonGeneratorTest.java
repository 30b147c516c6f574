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


package com.arakelian.cirjson.json;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.arakelian.cirjson.CirJsonFactory;
import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonWriteFeature;
import com.arakelian.cirjson.ImmutableCirJsonFactoryOptions;
import com.arakelian.cirjson.StreamWriteFeature;
import com.arakelian.cirjson.SerializableString;
import com.arakelian.cirjson.exc.StreamWriteException;
import com.arakelian.cirjson.io.CharacterEscapes;
import com.arakelian.cirjson.io.SerializedString;

public class CirJsonGeneratorTest {
    @FunctionalInterface
    private interface GeneratorWork {
        void write(CirJsonGenerator g) throws IOException;
    }

    /** Escapes markup characters, and writes non-ASCII escapes in lower case **/
    private static class MarkupEscapes extends CharacterEscapes {
        private final int[] codes = standardAsciiEscapesForCirJson();

        MarkupEscapes() {
            codes['<'] = ESCAPE_STANDARD;
            codes['&'] = ESCAPE_CUSTOM;
            codes['#'] = ESCAPE_CUSTOM;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return codes;
        }

        @Override
        public SerializableString getEscapeSequence(final int ch) {
            if (ch == '&') {
                return new SerializedString("\\u0026");
            }
            if (ch == 'é') {
                return new SerializedString("\\u00e9");
            }
            return null;
        }
    }

    private static final CirJsonFactory DEFAULT = new CirJsonFactory();

    private static void assertWriteError(final GeneratorWork work, final String expectedMessage) {
        final CirJsonGenerator g = DEFAULT.createGenerator(new StringWriter());
        final StreamWriteException e = Assertions.assertThrows(StreamWriteException.class, () -> work.write(g));
        Assertions.assertTrue(e.getMessage().contains(expectedMessage), e.getMessage());
    }

    private static String write(final CirJsonFactory factory, final GeneratorWork work) throws IOException {
        final StringWriter sw = new StringWriter();
        try (final CirJsonGenerator g = factory.createGenerator(sw)) {
            work.write(g);
        }
        return sw.toString();
    }

    private static String writeUtf8(final CirJsonFactory factory, final GeneratorWork work) throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (final CirJsonGenerator g = factory.createGenerator(out)) {
            work.write(g);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private static void writeSample(final CirJsonGenerator g) throws IOException {
        g.writeStartObject();
        g.writeName(CirJsonGenerator.ID_NAME);
        g.writeString("0");
        g.writeStringProperty("text", "tab\there \"quoted\" café € 😀 a/b \u0001");
        g.writeNumberProperty("int", -7);
        g.writeNumberProperty("long", 3000000000L);
        g.writeNumberProperty("double", 2.5);
        g.writeNumberProperty("big", new BigInteger("12345678901234567890"));
        g.writeBooleanProperty("flag", true);
        g.writeNullProperty("none");
        g.writeArrayPropertyStart("list");
        g.writeString("1");
        g.writeNumber(1);
        g.writeEndArray();
        g.writeEndObject();
    }

    @Test
    public void testAutoCloseContent() throws IOException {
        final String out = write(DEFAULT, g -> {
            g.writeStartArray();
            g.writeString("0");
            g.writeStartObject();
            g.writeName(CirJsonGenerator.ID_NAME);
            g.writeString("1");
            g.writeName("dangling");
        });
        Assertions.assertEquals("[\"0\",{\"__cirJsonId__\":\"1\",\"dangling\":null}]", out);
    }

    @Test
    public void testCopyStructure() throws IOException {
        final String doc = "{\"__cirJsonId__\":\"7\",\"a\":[\"8\",1,2.5,\"x\",true,null],"
                + "\"b\":{\"__cirJsonId__\":\"9\"},\"c\":12345678901234567890}";
        final String out = write(DEFAULT, g -> {
            try (final CirJsonParser p = DEFAULT.createParser(doc)) {
                p.nextToken();
                g.copyCurrentStructure(p);
            }
        });
        Assertions.assertEquals(doc, out);
    }

    @Test
    public void testCustomCharacterEscapes() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .characterEscapes(new MarkupEscapes()) //
                .build());
        final GeneratorWork work = g -> {
            g.writeStartObject();
            g.writeName(CirJsonGenerator.ID_NAME);
            g.writeString("0");
            g.writeStringProperty("<b>", "a & café/ü");
            g.writeEndObject();
        };
        final String expected = "{\"__cirJsonId__\":\"0\",\"\\u003Cb>\":\"a \\u0026 caf\\u00e9/ü\"}";
        Assertions.assertEquals(expected, write(factory, work));
        Assertions.assertEquals(expected, writeUtf8(factory, work));

        // table says custom, but no sequence is provided
        final CirJsonGenerator g = factory.createGenerator(new StringWriter());
        Assertions.assertTrue(g.getCharacterEscapes() instanceof MarkupEscapes);
        final StreamWriteException e = Assertions.assertThrows(StreamWriteException.class, () -> g.writeString("#1"));
        Assertions.assertTrue(
                e.getMessage().contains("custom escape not found for character code 0x23"),
                e.getMessage());
    }

    @Test
    public void testEscapeNonAscii() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .addEnabledWriteFeatures(CirJsonWriteFeature.ESCAPE_NON_ASCII) //
                .addDisabledWriteFeatures(CirJsonWriteFeature.ESCAPE_FORWARD_SLASHES) //
                .build());
        Assertions.assertEquals("\"caf\\u00E9 a/b\"", write(factory, g -> g.writeString("café a/b")));
        Assertions.assertEquals("\"caf\\u00E9 a/b\"", writeUtf8(factory, g -> g.writeString("café a/b")));
    }

    @Test
    public void testEscaping() throws IOException {
        Assertions.assertEquals("\"tab\\there \\\"q\\\" \\\\ a\\/b \\u0001\\n\"",
                write(DEFAULT, g -> g.writeString("tab\there \"q\" \\ a/b \u0001\n")));
    }

    @Test
    public void testIdentifierErrors() {
        assertWriteError(g -> {
            g.writeStartObject();
            g.writeName("a");
        }, "Can not write property name 'a', expecting '__cirJsonId__' as the first property");

        assertWriteError(g -> {
            g.writeStartObject();
            g.writeObjectId(this);
            g.writeName(CirJsonGenerator.ID_NAME);
        }, "Can not write '__cirJsonId__' twice in the same Object");

        assertWriteError(g -> {
            g.writeStartObject();
            g.writeEndObject();
        }, "Can not close Object without writing its identifier '__cirJsonId__'");

        assertWriteError(g -> {
            g.writeStartArray();
            g.writeEndArray();
        }, "Can not close Array without writing its identifier");

        assertWriteError(g -> {
            g.writeStartArray();
            g.writeNumber(1);
        }, "Can not write a number, expecting the array identifier (a String)");

        assertWriteError(g -> {
            g.writeStartObject();
            g.writeName(CirJsonGenerator.ID_NAME);
            g.writeBoolean(true);
        }, "Can not write a boolean value, expecting the value of '__cirJsonId__' (a String)");

        assertWriteError(g -> {
            g.writeStartObject();
            g.writeObjectId(this);
            g.writeEndArray();
        }, "Current context not Array but Object");

        assertWriteError(g -> {
            g.writeStartObject();
            g.writeObjectId(this);
            g.writeNumberProperty("a", 1);
            g.writeNumberProperty("a", 2);
        }, "Duplicate Object property \"a\"");
    }

    @Test
    public void testIdsAreSequentialAndStable() throws IOException {
        final Object first = new Object();
        final Object second = new Object();
        final String out = write(DEFAULT, g -> {
            Assertions.assertEquals("0", g.getId(first, false));
            Assertions.assertEquals("1", g.getId(second, true));
            Assertions.assertEquals("0", g.getId(first, true));
            g.writeArray(new int[] { 1, 2, 3 }, 1, 2);
        });
        Assertions.assertEquals("[\"2\",2,3]", out);
    }

    @Test
    public void testNumbersAsStrings() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .addEnabledWriteFeatures(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS) //
                .build());
        final String out = write(factory, g -> {
            g.writeNumber(1);
            g.writeNumber(2L);
            g.writeNumber(0.5);
            g.writeNumber(new BigDecimal("1.25"));
        });
        Assertions.assertEquals("\"1\" \"2\" \"0.5\" \"1.25\"", out);

        Assertions.assertEquals("\"NaN\" \"-Infinity\"", write(DEFAULT, g -> {
            g.writeNumber(Double.NaN);
            g.writeNumber(Float.NEGATIVE_INFINITY);
        }));
    }

    @Test
    public void testBigDecimalAsPlain() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .addEnabledStreamWriteFeatures(StreamWriteFeature.WRITE_BIG_DECIMAL_AS_PLAIN) //
                .build());
        Assertions.assertEquals("1E+3", write(DEFAULT, g -> g.writeNumber(new BigDecimal("1E+3"))));
        Assertions.assertEquals("1000", write(factory, g -> g.writeNumber(new BigDecimal("1E+3"))));
    }

    @Test
    public void testPretty() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .pretty(true) //
                .build());
        final String out = write(factory, g -> {
            g.writeStartObject();
            g.writeObjectId(this);
            g.writeNumberProperty("a", 1);
            g.writeArrayPropertyStart("b");
            g.writeString("1");
            g.writeBoolean(false);
            g.writeEndArray();
            g.writeEndObject();
        });
        Assertions.assertEquals("{\n" + //
                "  \"__cirJsonId__\" : \"0\",\n" + //
                "  \"a\" : 1,\n" + //
                "  \"b\" : [\n" + //
                "    \"1\",\n" + //
                "    false\n" + //
                "  ]\n" + //
                "}", out);
    }

    @Test
    public void testUnquotedNames() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .addDisabledWriteFeatures(CirJsonWriteFeature.QUOTE_PROPERTY_NAMES) //
                .build());
        final String out = write(factory, g -> {
            g.writeStartObject();
            g.writeObjectId(this);
            g.writeNumberProperty("a", 1);
            g.writeEndObject();
        });
        Assertions.assertEquals("{__cirJsonId__:\"0\",a:1}", out);
    }

    @Test
    public void testUtf8AndWriterOutputMatch() throws IOException {
        final String chars = write(DEFAULT, CirJsonGeneratorTest::writeSample);
        final String bytes = writeUtf8(DEFAULT, CirJsonGeneratorTest::writeSample);
        Assertions.assertEquals(chars, bytes);
        Assertions.assertTrue(chars.startsWith("{\"__cirJsonId__\":\"0\",\"text\":\"tab\\there"), chars);
        Assertions.assertTrue(chars.endsWith("\"none\":null,\"list\":[\"1\",1]}"), chars);
    }

    @Test
    public void testWriteObjectNativeContainers() throws IOException {
        final List<Object> shared = new ArrayList<>(Arrays.asList("x", 2));
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("a", 1);
        map.put("list", shared);
        map.put("again", shared);
        map.put("self", map);
        map.put("array", new Object[] { null, Boolean.TRUE, 1.5f });

        Assertions.assertEquals("{\"__cirJsonId__\":\"0\",\"a\":1,\"list\":[\"1\",\"x\",2],\"again\":\"1\","
                + "\"self\":\"0\",\"array\":[\"2\",null,true,1.5]}", write(DEFAULT, g -> g.writeObject(map)));
    }

    @Test
    public void testWriteObjectUnsupportedType() {
        final CirJsonGenerator g = DEFAULT.createGenerator(new StringWriter());
        final UnsupportedOperationException e = Assertions.assertThrows(UnsupportedOperationException.class,
                () -> g.writeObject(new Object()));
        Assertions.assertTrue(e.getMessage().startsWith("No ObjectWriteContext configured"), e.getMessage());
    }
}
