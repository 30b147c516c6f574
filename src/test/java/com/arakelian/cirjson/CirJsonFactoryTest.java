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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.arakelian.cirjson.exc.CirJsonIOException;
import com.arakelian.cirjson.exc.StreamReadException;
import com.arakelian.cirjson.io.CirJsonEncoding;

public class CirJsonFactoryTest {
    private static final String DOC = "{\"__cirJsonId__\":\"0\",\"name\":\"café\",\"list\":[\"1\",1,2.5,null]}";

    private static void writeDoc(final CirJsonGenerator g) throws IOException {
        g.writeStartObject();
        g.writeObjectId(g);
        g.writeStringProperty("name", "café");
        g.writeArrayPropertyStart("list");
        g.writeArrayId(DOC);
        g.writeNumber(1);
        g.writeNumber(2.5);
        g.writeNull();
        g.writeEndArray();
        g.writeEndObject();
    }

    private static String copy(final CirJsonFactory factory, final CirJsonParser p) throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (final CirJsonGenerator g = factory.createGenerator(out)) {
            while (p.nextToken() != null) {
                g.copyCurrentEvent(p);
            }
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testDefaults() {
        final CirJsonFactory factory = new CirJsonFactory();
        Assertions.assertFalse(factory.isEnabled(CirJsonReadFeature.ALLOW_TRAILING_COMMA));
        Assertions.assertTrue(factory.isEnabled(StreamReadFeature.STRICT_DUPLICATE_DETECTION));
        Assertions.assertTrue(factory.isEnabled(StreamReadFeature.AUTO_CLOSE_SOURCE));
        Assertions.assertTrue(factory.isEnabled(CirJsonWriteFeature.QUOTE_PROPERTY_NAMES));
        Assertions.assertFalse(factory.isEnabled(CirJsonWriteFeature.ESCAPE_NON_ASCII));
        Assertions.assertTrue(factory.isEnabled(StreamWriteFeature.AUTO_CLOSE_TARGET));
        Assertions.assertFalse(factory.isEnabled(StreamWriteFeature.WRITE_BIG_DECIMAL_AS_PLAIN));
        Assertions.assertFalse(factory.getOptions().isPretty());
    }

    @Test
    public void testFeatureOverrides() {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .addEnabledReadFeatures(CirJsonReadFeature.ALLOW_TRAILING_COMMA) //
                .addDisabledStreamReadFeatures(StreamReadFeature.STRICT_DUPLICATE_DETECTION) //
                .addEnabledWriteFeatures(CirJsonWriteFeature.ESCAPE_NON_ASCII) //
                .addDisabledStreamWriteFeatures(StreamWriteFeature.AUTO_CLOSE_TARGET) //
                .build());
        Assertions.assertTrue(factory.isEnabled(CirJsonReadFeature.ALLOW_TRAILING_COMMA));
        Assertions.assertFalse(factory.isEnabled(StreamReadFeature.STRICT_DUPLICATE_DETECTION));
        Assertions.assertTrue(factory.isEnabled(CirJsonWriteFeature.ESCAPE_NON_ASCII));
        Assertions.assertFalse(factory.isEnabled(StreamWriteFeature.AUTO_CLOSE_TARGET));
        Assertions.assertTrue(factory.isEnabled(StreamWriteFeature.AUTO_CLOSE_CONTENT));
    }

    @ParameterizedTest
    @EnumSource(value = CirJsonEncoding.class)
    public void testGeneratorEncodings(final CirJsonEncoding encoding) throws IOException {
        final CirJsonFactory factory = new CirJsonFactory();
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (final CirJsonGenerator g = factory.createGenerator(out, encoding)) {
            writeDoc(g);
        }
        final byte[] data = out.toByteArray();
        Assertions.assertEquals(DOC, new String(data, Charset.forName(encoding.getJavaName())));
        try (final CirJsonParser p = factory.createParser(data)) {
            Assertions.assertEquals(DOC, copy(factory, p));
        }
    }

    @Test
    public void testDataInputAndOutput() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory();
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (final CirJsonGenerator g = factory.createGenerator((DataOutput) new DataOutputStream(bytes))) {
            writeDoc(g);
        }
        Assertions.assertEquals(DOC, new String(bytes.toByteArray(), StandardCharsets.UTF_8));

        try (final CirJsonParser p = factory
                .createParser((DataInput) new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())))) {
            Assertions.assertEquals(DOC, copy(factory, p));
        }
    }

    @Test
    public void testFileAndPath(@TempDir final Path dir) throws IOException {
        final CirJsonFactory factory = new CirJsonFactory();
        final Path path = dir.resolve("doc.cirjson");
        try (final CirJsonGenerator g = factory.createGenerator(path, CirJsonEncoding.UTF8)) {
            writeDoc(g);
        }
        Assertions.assertEquals(DOC, new String(Files.readAllBytes(path), StandardCharsets.UTF_8));

        try (final CirJsonParser p = factory.createParser(path)) {
            Assertions.assertEquals(DOC, copy(factory, p));
        }

        final File file = dir.resolve("doc16.cirjson").toFile();
        try (final CirJsonGenerator g = factory.createGenerator(file, CirJsonEncoding.UTF16_LE)) {
            writeDoc(g);
        }
        try (final CirJsonParser p = factory.createParser(file)) {
            Assertions.assertEquals(DOC, copy(factory, p));
        }

        Assertions.assertThrows(CirJsonIOException.class, () -> factory.createParser(dir.resolve("missing")));
    }

    @Test
    public void testParserSources() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory();
        final byte[] utf8 = DOC.getBytes(StandardCharsets.UTF_8);
        final byte[] padded = new byte[utf8.length + 4];
        System.arraycopy(utf8, 0, padded, 2, utf8.length);
        final char[] chars = ("  " + DOC + "  ").toCharArray();

        try (final CirJsonParser p = factory.createParser(utf8)) {
            Assertions.assertEquals(DOC, copy(factory, p));
        }
        try (final CirJsonParser p = factory.createParser(padded, 2, utf8.length)) {
            Assertions.assertEquals(DOC, copy(factory, p));
        }
        try (final CirJsonParser p = factory.createParser(chars, 2, DOC.length())) {
            Assertions.assertEquals(DOC, copy(factory, p));
        }
        try (final CirJsonParser p = factory.createParser(new ByteArrayInputStream(utf8))) {
            Assertions.assertEquals(DOC, copy(factory, p));
        }
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> factory.createParser(utf8, 4, utf8.length));
    }

    @Test
    public void testPrettyOption() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .pretty(true) //
                .build());
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (final CirJsonGenerator g = factory.createGenerator(out)) {
            writeDoc(g);
        }
        Assertions.assertEquals("{\n" + //
                "  \"__cirJsonId__\" : \"0\",\n" + //
                "  \"name\" : \"café\",\n" + //
                "  \"list\" : [\n" + //
                "    \"1\",\n" + //
                "    1,\n" + //
                "    2.5,\n" + //
                "    null\n" + //
                "  ]\n" + //
                "}", new String(out.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    public void testSymbolTableOptions() throws IOException {
        final CirJsonFactory interning = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .internPropertyNames(true) //
                .build());
        try (final CirJsonParser p = interning.createParser(DOC)) {
            p.nextToken();
            p.nextToken();
            p.nextToken();
            Assertions.assertSame("name", p.nextName());
        }
        try (final CirJsonParser p = interning.createParser(DOC.getBytes(StandardCharsets.UTF_8))) {
            p.nextToken();
            p.nextToken();
            p.nextToken();
            Assertions.assertSame("name", p.nextName());
        }

        final CirJsonFactory plain = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .canonicalizePropertyNames(false) //
                .build());
        try (final CirJsonParser p = plain.createParser(DOC)) {
            Assertions.assertEquals(DOC, copy(plain, p));
        }
    }

    @Test
    public void testSourceInLocation() throws IOException {
        final String bad = "[\"0\",oops]";
        try (final CirJsonParser p = new CirJsonFactory().createParser(bad)) {
            final StreamReadException e = Assertions.assertThrows(StreamReadException.class, () -> {
                while (p.nextToken() != null) {
                    // consume
                }
            });
            Assertions.assertTrue(e.getMessage().contains("REDACTED"), e.getMessage());
        }

        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .addEnabledStreamReadFeatures(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION) //
                .build());
        try (final CirJsonParser p = factory.createParser(bad)) {
            final StreamReadException e = Assertions.assertThrows(StreamReadException.class, () -> {
                while (p.nextToken() != null) {
                    // consume
                }
            });
            Assertions.assertTrue(e.getMessage().contains("Unrecognized token 'oops'"), e.getMessage());
            Assertions.assertTrue(e.getMessage().contains("(char[])\"[\"0\",oops]\""), e.getMessage());
            Assertions.assertEquals(1, e.getLocation().getLineNr());
        }
    }
}
