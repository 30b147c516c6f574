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

import java.io.ByteArrayInputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.arakelian.cirjson.CirJsonFactory;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.exc.CirJsonIOException;
import com.arakelian.cirjson.io.CirJsonEncoding;
import com.arakelian.cirjson.io.ContentReference;
import com.arakelian.cirjson.io.IOContext;
import com.arakelian.cirjson.util.BufferRecycler;

public class ByteSourceCirJsonBootstrapperTest {
    private static final String DOC = "[\"0\",\"café €\",{\"__cirJsonId__\":\"1\",\"n\":-12.5}]";

    private static byte[] bytes(final int... values) {
        final byte[] result = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (byte) values[i];
        }
        return result;
    }

    private static IOContext context() {
        return new IOContext(null, null, new BufferRecycler(), ContentReference.unknown(), false, null);
    }

    private static CirJsonEncoding detect(final byte[] data) throws IOException {
        final IOContext ctxt = context();
        final CirJsonEncoding enc = new ByteSourceCirJsonBootstrapper(ctxt, data, 0, data.length).detectEncoding();
        Assertions.assertSame(enc, ctxt.getEncoding());
        return enc;
    }

    private static void assertParses(final byte[] data) throws IOException {
        try (final CirJsonParser p = new CirJsonFactory().createParser(data)) {
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertEquals("0", p.nextTextValue());
            Assertions.assertEquals("café €", p.nextTextValue());
            Assertions.assertEquals(CirJsonToken.START_OBJECT, p.nextToken());
            Assertions.assertEquals(CirJsonToken.CIRJSON_ID_PROPERTY_NAME, p.nextToken());
            Assertions.assertEquals("1", p.nextTextValue());
            Assertions.assertEquals("n", p.nextName());
            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_FLOAT, p.nextToken());
            Assertions.assertEquals(-12.5, p.getDoubleValue());
            Assertions.assertEquals(CirJsonToken.END_OBJECT, p.nextToken());
            Assertions.assertEquals(CirJsonToken.END_ARRAY, p.nextToken());
            Assertions.assertNull(p.nextToken());
        }
    }

    @Test
    public void testDetectWithByteOrderMark() throws IOException {
        Assertions.assertEquals(CirJsonEncoding.UTF8, detect(bytes(0xEF, 0xBB, 0xBF, '{')));
        Assertions.assertEquals(CirJsonEncoding.UTF16_BE, detect(bytes(0xFE, 0xFF, 0x00, '[')));
        Assertions.assertEquals(CirJsonEncoding.UTF16_LE, detect(bytes(0xFF, 0xFE, '[', 0x00)));
        Assertions.assertEquals(CirJsonEncoding.UTF32_BE, detect(bytes(0x00, 0x00, 0xFE, 0xFF)));
        Assertions.assertEquals(CirJsonEncoding.UTF32_LE, detect(bytes(0xFF, 0xFE, 0x00, 0x00)));

        // too short for a quad
        Assertions.assertEquals(CirJsonEncoding.UTF16_BE, detect(bytes(0xFE, 0xFF)));
        Assertions.assertEquals(CirJsonEncoding.UTF16_LE, detect(bytes(0xFF, 0xFE)));
    }

    @Test
    public void testDetectWithoutByteOrderMark() throws IOException {
        Assertions.assertEquals(CirJsonEncoding.UTF8, detect("{\"a".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertEquals(CirJsonEncoding.UTF8, detect("[]".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertEquals(CirJsonEncoding.UTF8, detect(new byte[0]));
        Assertions.assertEquals(CirJsonEncoding.UTF16_BE, detect("[\"".getBytes(StandardCharsets.UTF_16BE)));
        Assertions.assertEquals(CirJsonEncoding.UTF16_LE, detect("[\"".getBytes(StandardCharsets.UTF_16LE)));
        Assertions.assertEquals(CirJsonEncoding.UTF32_BE, detect(bytes(0x00, 0x00, 0x00, '[')));
        Assertions.assertEquals(CirJsonEncoding.UTF32_LE, detect(bytes('[', 0x00, 0x00, 0x00)));
    }

    @Test
    public void testUnsupportedUcs4() {
        final CirJsonIOException e2143 = Assertions.assertThrows(CirJsonIOException.class,
                () -> detect(bytes(0x00, 0x00, 0xFF, 0xFE)));
        Assertions.assertTrue(e2143.getMessage().contains("Unsupported UCS-4 endianness (2143) detected"));

        final CirJsonIOException e3412 = Assertions.assertThrows(CirJsonIOException.class,
                () -> detect(bytes(0xFE, 0xFF, 0x00, 0x00)));
        Assertions.assertTrue(e3412.getMessage().contains("Unsupported UCS-4 endianness (3412) detected"));

        Assertions.assertThrows(CirJsonIOException.class, () -> detect(bytes(0x00, '[', 0x00, 0x00)));
    }

    @ParameterizedTest
    @ValueSource(strings = { "UTF-8", "UTF-16BE", "UTF-16LE", "UTF-32BE", "UTF-32LE" })
    public void testParseEncodedInput(final String charset) throws IOException {
        assertParses(DOC.getBytes(Charset.forName(charset)));
    }

    @Test
    public void testParseUtf8WithBom() throws IOException {
        final byte[] body = DOC.getBytes(StandardCharsets.UTF_8);
        final byte[] data = new byte[body.length + 3];
        data[0] = (byte) 0xEF;
        data[1] = (byte) 0xBB;
        data[2] = (byte) 0xBF;
        System.arraycopy(body, 0, data, 3, body.length);
        assertParses(data);

        try (final CirJsonParser p = new CirJsonFactory()
                .createParser((DataInput) new DataInputStream(new ByteArrayInputStream(data)))) {
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertEquals("0", p.nextTextValue());
        }
    }

    @Test
    public void testSkipUtf8Bom() throws IOException {
        Assertions.assertEquals('[', ByteSourceCirJsonBootstrapper
                .skipUTF8BOM(new DataInputStream(new ByteArrayInputStream(bytes(0xEF, 0xBB, 0xBF, '[')))));
        Assertions.assertEquals('[',
                ByteSourceCirJsonBootstrapper.skipUTF8BOM(new DataInputStream(new ByteArrayInputStream(bytes('[')))));
        Assertions.assertEquals(-1,
                ByteSourceCirJsonBootstrapper.skipUTF8BOM(new DataInputStream(new ByteArrayInputStream(new byte[0]))));

        final CirJsonIOException e = Assertions.assertThrows(CirJsonIOException.class,
                () -> ByteSourceCirJsonBootstrapper
                        .skipUTF8BOM(new DataInputStream(new ByteArrayInputStream(bytes(0xEF, 0x00)))));
        Assertions.assertTrue(e.getMessage().contains("should get 0xBB as part of UTF-8 BOM"), e.getMessage());
    }
}
