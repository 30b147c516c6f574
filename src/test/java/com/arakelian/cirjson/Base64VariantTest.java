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

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.arakelian.cirjson.exc.StreamReadException;

public class Base64VariantTest {
    private static final byte[] SAMPLE = { (byte) 0xFB, (byte) 0xFF, 0x00, 0x10 };

    @Test
    public void testAlphabets() {
        Assertions.assertEquals("+/8AEA==", Base64Variants.MIME_NO_LINEFEEDS.encode(SAMPLE));
        Assertions.assertEquals("-_8AEA", Base64Variants.MODIFIED_FOR_URL.encode(SAMPLE));
        Assertions.assertEquals("\"+/8AEA==\"", Base64Variants.getDefaultVariant().encode(SAMPLE, true));
        Assertions.assertArrayEquals(SAMPLE, Base64Variants.MODIFIED_FOR_URL.decode("-_8AEA"));
        Assertions.assertArrayEquals(SAMPLE, Base64Variants.MIME.decode(" +/8A\nEA== "));
        Assertions.assertFalse(Base64Variants.MODIFIED_FOR_URL.usesPadding());
        Assertions.assertTrue(Base64Variants.PEM.usesPadding());
    }

    @Test
    public void testBinaryThroughGeneratorAndParser() throws IOException {
        final byte[] data = "binary payload".getBytes(StandardCharsets.UTF_8);
        final CirJsonFactory factory = new CirJsonFactory();
        final StringWriter sw = new StringWriter();
        try (final CirJsonGenerator g = factory.createGenerator(sw)) {
            g.writeStartArray();
            g.writeArrayId(data);
            g.writeBinary(data);
            g.writeString("not base64!");
            g.writeEndArray();
        }
        Assertions.assertEquals("[\"0\",\"YmluYXJ5IHBheWxvYWQ=\",\"not base64!\"]", sw.toString());

        try (final CirJsonParser p = factory.createParser(sw.toString())) {
            p.nextToken();
            Assertions.assertThrows(StreamReadException.class, () -> p.getBinaryValue());
            p.nextToken();
            p.nextToken();
            Assertions.assertArrayEquals(data, p.getBinaryValue());
            p.nextToken();
            final StreamReadException e = Assertions.assertThrows(StreamReadException.class,
                    () -> p.getBinaryValue());
            Assertions.assertTrue(e.getMessage().startsWith("Failed to decode VALUE_STRING as base64"));
        }
    }

    @Test
    public void testLineWrapping() {
        final byte[] data = new byte[60];
        final String mime = Base64Variants.MIME.encode(data);
        Assertions.assertEquals(76, mime.indexOf('\\'));
        Assertions.assertEquals("\\n", mime.substring(76, 78));

        final String pem = Base64Variants.PEM.encode(data);
        Assertions.assertEquals(64, pem.indexOf('\\'));
        Assertions.assertArrayEquals(data, Base64Variants.PEM.decode(pem.replace("\\n", "\n")));
        Assertions.assertEquals(-1, Base64Variants.MIME_NO_LINEFEEDS.encode(data).indexOf('\\'));
    }

    @Test
    public void testValueOf() {
        Assertions.assertSame(Base64Variants.MIME, Base64Variants.valueOf("MIME"));
        Assertions.assertSame(Base64Variants.MIME_NO_LINEFEEDS, Base64Variants.valueOf("MIME-NO-LINEFEEDS"));
        Assertions.assertSame(Base64Variants.PEM, Base64Variants.valueOf("PEM"));
        Assertions.assertSame(Base64Variants.MODIFIED_FOR_URL, Base64Variants.valueOf("MODIFIED-FOR-URL"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Base64Variants.valueOf("UUENCODE"));
    }
}
