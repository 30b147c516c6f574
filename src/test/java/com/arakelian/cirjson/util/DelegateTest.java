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
import java.util.Locale;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.arakelian.cirjson.CirJsonFactory;
import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.io.SerializedString;

public class DelegateTest {
    /** Upper-cases every string value it reads **/
    private static final class UpperCaseParser extends CirJsonParserDelegate {
        private UpperCaseParser(final CirJsonParser delegate) {
            super(delegate);
        }

        @Override
        public String getText() throws IOException {
            final String text = delegate.getText();
            return delegate.currentToken() == CirJsonToken.VALUE_STRING ? text.toUpperCase(Locale.ROOT) : text;
        }
    }

    /** Writes every number doubled **/
    private static final class DoublingGenerator extends CirJsonGeneratorDelegate {
        private DoublingGenerator(final CirJsonGenerator delegate) {
            super(delegate);
        }

        @Override
        public void writeNumber(final int v) throws IOException {
            delegate.writeNumber(v * 2);
        }
    }

    private final CirJsonFactory factory = new CirJsonFactory();

    @Test
    public void testGeneratorDelegate() throws IOException {
        final StringWriter w = new StringWriter();
        try (final CirJsonGenerator g = new DoublingGenerator(factory.createGenerator(w))) {
            g.writeStartArray();
            g.writeArrayId(new Object());
            g.writeNumber(21);
            g.writeString("x");
            g.writeEndArray();
        }
        Assertions.assertEquals("[\"0\",42,\"x\"]", w.toString());
    }

    @Test
    public void testParserDelegate() throws IOException {
        final String doc = "{\"__cirJsonId__\":\"0\",\"a\":\"abc\",\"b\":[\"1\",1,2],\"c\":\"d\"}";
        try (final CirJsonParser p = new UpperCaseParser(factory.createParser(doc))) {
            Assertions.assertEquals(CirJsonToken.START_OBJECT, p.nextToken());
            Assertions.assertEquals(p.getIdName(), p.nextName());
            Assertions.assertEquals(CirJsonToken.CIRJSON_ID_PROPERTY_NAME, p.currentToken());
            Assertions.assertEquals("0", p.nextTextValue());
            Assertions.assertTrue(p.nextName(new SerializedString("a")));
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals("ABC", p.getText());
            Assertions.assertEquals("b", p.nextName());
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertSame(p, p.skipChildren());
            Assertions.assertEquals(CirJsonToken.END_ARRAY, p.currentToken());
            Assertions.assertEquals("c", p.nextName());
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals("D", p.getText());
            Assertions.assertEquals(CirJsonToken.END_OBJECT, p.nextToken());
            Assertions.assertNull(p.nextToken());
            // end of input closes the wrapped parser
            Assertions.assertTrue(p.isClosed());
        }

        try (final CirJsonParser p = new UpperCaseParser(factory.createParser(doc))) {
            Assertions.assertEquals(CirJsonToken.START_OBJECT, p.nextToken());
            Assertions.assertFalse(p.isClosed());
            p.close();
            Assertions.assertTrue(p.isClosed());
            Assertions.assertNull(p.nextToken());
        }
    }
}
