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
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.arakelian.cirjson.CirJsonFactory;
import com.arakelian.cirjson.CirJsonFactoryOptions;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonParser.NumberType;
import com.arakelian.cirjson.CirJsonReadFeature;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.ImmutableCirJsonFactoryOptions;
import com.arakelian.cirjson.ImmutableStreamReadConstraints;
import com.arakelian.cirjson.StreamReadFeature;
import com.arakelian.cirjson.exc.CirJsonProcessingException;
import com.arakelian.cirjson.exc.StreamConstraintsException;
import com.arakelian.cirjson.exc.StreamReadException;
import com.arakelian.cirjson.json.async.NonBlockingByteArrayCirJsonParser;

public class CirJsonParserTest {
    /**
     * The ways a document can be handed to a {@link CirJsonFactory}.
     */
    public enum Mode {
        STRING, READER, BYTES, STREAM, DATA_INPUT, ASYNC;

        public CirJsonParser createParser(final CirJsonFactory factory, final String doc) throws IOException {
            final byte[] bytes = doc.getBytes(StandardCharsets.UTF_8);
            switch (this) {
            case STRING:
                return factory.createParser(doc);
            case READER:
                return factory.createParser(new StringReader(doc));
            case BYTES:
                return factory.createParser(bytes);
            case STREAM:
                return factory.createParser(new ByteArrayInputStream(bytes));
            case DATA_INPUT:
                return factory.createParser((DataInput) new DataInputStream(new ByteArrayInputStream(bytes)));
            case ASYNC:
            default:
                final NonBlockingByteArrayCirJsonParser p = factory.createNonBlockingByteArrayParser();
                p.feedInput(bytes, 0, bytes.length);
                p.endOfInput();
                return p;
            }
        }
    }

    private static final CirJsonFactory DEFAULT = new CirJsonFactory();

    private static CirJsonFactory factoryWith(final CirJsonReadFeature... features) {
        final CirJsonFactoryOptions options = ImmutableCirJsonFactoryOptions.builder() //
                .addEnabledReadFeatures(features) //
                .build();
        return new CirJsonFactory(options);
    }

    private static void assertError(
            final CirJsonFactory factory,
            final Mode mode,
            final String doc,
            final String expectedMessage) throws IOException {
        try (final CirJsonParser p = mode.createParser(factory, doc)) {
            final StreamReadException e = Assertions.assertThrows(StreamReadException.class, () -> {
                while (p.nextToken() != null) {
                    // consume
                }
            });
            Assertions.assertTrue(e.getMessage().contains(expectedMessage), e.getMessage());
        }
    }

    private static void assertTokens(
            final CirJsonFactory factory,
            final Mode mode,
            final String doc,
            final CirJsonToken... expected) throws IOException {
        try (final CirJsonParser p = mode.createParser(factory, doc)) {
            for (final CirJsonToken t : expected) {
                Assertions.assertEquals(t, p.nextToken());
            }
            Assertions.assertNull(p.nextToken());
        }
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testArrayIdRequired(final Mode mode) throws IOException {
        assertError(DEFAULT, mode, "[]", "Expected array identifier, received end of array");
        assertError(DEFAULT, mode, "[1]", "expected a String as the identifier of an array");
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testComments(final Mode mode) throws IOException {
        final String doc = "/* start */ [\"0\", // one\n 1 /* two */, 2]";
        assertError(DEFAULT, mode, doc, "ALLOW_JAVA_COMMENTS");
        assertTokens(factoryWith(CirJsonReadFeature.ALLOW_JAVA_COMMENTS), mode, doc, //
                CirJsonToken.START_ARRAY, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.END_ARRAY);

        assertTokens(factoryWith(CirJsonReadFeature.ALLOW_YAML_COMMENTS), mode, "# yaml\n[\"0\"]", //
                CirJsonToken.START_ARRAY, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.END_ARRAY);
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testDuplicateNames(final Mode mode) throws IOException {
        final String doc = "{\"__cirJsonId__\":\"0\",\"a\":1,\"a\":2}";
        assertError(DEFAULT, mode, doc, "Duplicate Object property \"a\"");
        assertError(DEFAULT, mode, "{\"__cirJsonId__\":\"0\",\"__cirJsonId__\":\"1\"}",
                "Duplicate Object property \"__cirJsonId__\"");

        final CirJsonFactory lenient = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .addDisabledStreamReadFeatures(StreamReadFeature.STRICT_DUPLICATE_DETECTION) //
                .build());
        assertTokens(lenient, mode, doc, //
                CirJsonToken.START_OBJECT, //
                CirJsonToken.CIRJSON_ID_PROPERTY_NAME, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.PROPERTY_NAME, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.PROPERTY_NAME, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.END_OBJECT);

        // same name in sibling objects is fine
        assertTokens(DEFAULT, mode, "[\"0\",{\"__cirJsonId__\":\"1\",\"a\":1},{\"__cirJsonId__\":\"2\",\"a\":2}]", //
                CirJsonToken.START_ARRAY, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.START_OBJECT, //
                CirJsonToken.CIRJSON_ID_PROPERTY_NAME, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.PROPERTY_NAME, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.END_OBJECT, //
                CirJsonToken.START_OBJECT, //
                CirJsonToken.CIRJSON_ID_PROPERTY_NAME, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.PROPERTY_NAME, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.END_OBJECT, //
                CirJsonToken.END_ARRAY);
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testEscapesAndUnicode(final Mode mode) throws IOException {
        final String doc = "[\"0\",\"a\\n\\u0041\\\"b\\/\",\"caf\u00e9 \u20ac \ud83d\ude00\"]";
        try (final CirJsonParser p = mode.createParser(DEFAULT, doc)) {
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertEquals("0", p.nextTextValue());
            Assertions.assertEquals("a\nA\"b/", p.nextTextValue());
            Assertions.assertEquals("caf\u00e9 \u20ac \ud83d\ude00", p.nextTextValue());
            Assertions.assertEquals(CirJsonToken.END_ARRAY, p.nextToken());
        }
        assertError(DEFAULT, mode, "[\"0\",\"\\q\"]", "Unrecognized character escape");
        assertError(DEFAULT, mode, "[\"0\",\"a\tb\"]", "Illegal unquoted character");
        assertError(DEFAULT, mode, "[\"0\",\"abc", "was expecting closing quote for a string value");
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testLeadingZeros(final Mode mode) throws IOException {
        assertError(DEFAULT, mode, "[\"0\",01]", "Leading zeroes not allowed");
        try (final CirJsonParser p = mode
                .createParser(factoryWith(CirJsonReadFeature.ALLOW_LEADING_ZEROS_FOR_NUMBERS), "[\"0\",007]")) {
            p.nextToken();
            p.nextToken();
            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_INT, p.nextToken());
            Assertions.assertEquals(7, p.getIntValue());
        }
    }

    @Test
    public void testLocation() throws IOException {
        try (final CirJsonParser p = DEFAULT.createParser("[\"0\",\n  true]")) {
            p.nextToken();
            p.nextToken();
            Assertions.assertEquals(CirJsonToken.VALUE_TRUE, p.nextToken());
            Assertions.assertEquals(2, p.currentTokenLocation().getLineNr());
            Assertions.assertEquals(3, p.currentTokenLocation().getColumnNr());
            Assertions.assertEquals(8L, p.currentTokenLocation().getCharOffset());
        }
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testMaxNestingDepth(final Mode mode) throws IOException {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .streamReadConstraints(ImmutableStreamReadConstraints.builder().maxNestingDepth(2).build()) //
                .build());
        assertTokens(factory, mode, "[\"0\",[\"1\"]]", //
                CirJsonToken.START_ARRAY, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.START_ARRAY, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.END_ARRAY, //
                CirJsonToken.END_ARRAY);
        try (final CirJsonParser p = mode.createParser(factory, "[\"0\",[\"1\",[\"2\"]]]")) {
            final StreamConstraintsException e = Assertions.assertThrows(StreamConstraintsException.class, () -> {
                while (p.nextToken() != null) {
                    // consume
                }
            });
            Assertions.assertTrue(e.getMessage().contains("Document nesting depth (3) exceeds"), e.getMessage());
        }
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testMaxStringLength(final Mode mode) throws IOException {
        final CirJsonFactory factory = new CirJsonFactory(ImmutableCirJsonFactoryOptions.builder() //
                .streamReadConstraints(ImmutableStreamReadConstraints.builder().maxStringLength(5).build()) //
                .build());
        try (final CirJsonParser p = mode.createParser(factory, "[\"0\",\"12345\"]")) {
            p.nextToken();
            p.nextToken();
            Assertions.assertEquals("12345", p.nextTextValue());
        }
        try (final CirJsonParser p = mode.createParser(factory, "[\"0\",\"123456\"]")) {
            p.nextToken();
            p.nextToken();
            Assertions.assertThrows(StreamConstraintsException.class, () -> p.nextToken());
        }
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testMissingValues(final Mode mode) throws IOException {
        final String doc = "[\"0\",1,,2]";
        assertError(DEFAULT, mode, doc, "expected a valid value");
        assertTokens(factoryWith(CirJsonReadFeature.ALLOW_MISSING_VALUES), mode, doc, //
                CirJsonToken.START_ARRAY, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.VALUE_NULL, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.END_ARRAY);
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testNonNumericNumbers(final Mode mode) throws IOException {
        final String doc = "[\"0\",NaN,-Infinity,Infinity]";
        assertError(DEFAULT, mode, doc, "ALLOW_NON_NUMERIC_NUMBERS");
        try (final CirJsonParser p = mode.createParser(factoryWith(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS),
                doc)) {
            p.nextToken();
            p.nextToken();
            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_FLOAT, p.nextToken());
            Assertions.assertTrue(p.isNaN());
            Assertions.assertTrue(Double.isNaN(p.getDoubleValue()));
            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_FLOAT, p.nextToken());
            Assertions.assertEquals(Double.NEGATIVE_INFINITY, p.getDoubleValue());
            Assertions.assertEquals("-Infinity", p.getText());
            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_FLOAT, p.nextToken());
            Assertions.assertEquals(Double.POSITIVE_INFINITY, p.getDoubleValue());
        }
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testNumbers(final Mode mode) throws IOException {
        final String doc = "[\"0\",0,-12,3000000000,12345678901234567890123,0.25,-1.5e3,1E-2]";
        try (final CirJsonParser p = mode.createParser(DEFAULT, doc)) {
            p.nextToken();
            p.nextToken();

            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_INT, p.nextToken());
            Assertions.assertEquals(NumberType.INT, p.getNumberType());
            Assertions.assertEquals(0, p.getIntValue());

            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_INT, p.nextToken());
            Assertions.assertEquals(-12, p.getIntValue());
            Assertions.assertEquals(-12L, p.getLongValue());

            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_INT, p.nextToken());
            Assertions.assertEquals(NumberType.LONG, p.getNumberType());
            Assertions.assertEquals(3000000000L, p.getLongValue());
            Assertions.assertThrows(StreamReadException.class, () -> p.getIntValue());

            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_INT, p.nextToken());
            Assertions.assertEquals(NumberType.BIG_INTEGER, p.getNumberType());
            Assertions.assertEquals(new BigInteger("12345678901234567890123"), p.getBigIntegerValue());

            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_FLOAT, p.nextToken());
            Assertions.assertEquals(0.25, p.getDoubleValue());
            Assertions.assertEquals("0.25", p.getDecimalValue().toString());

            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_FLOAT, p.nextToken());
            Assertions.assertEquals(-1500.0, p.getDoubleValue());
            Assertions.assertEquals("-1.5e3", p.getText());

            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_FLOAT, p.nextToken());
            Assertions.assertEquals(0.01f, p.getFloatValue());
            Assertions.assertEquals(CirJsonToken.END_ARRAY, p.nextToken());
        }
        assertError(DEFAULT, mode, "[\"0\",1.]", "Decimal point not followed by a digit");
        assertError(DEFAULT, mode, "[\"0\",1e]", "Exponent indicator not followed by a digit");
        assertError(DEFAULT, mode, "[\"0\",+1]", "ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS");
        assertError(DEFAULT, mode, "[\"0\",.5]", "ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS");
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testObjectIdRequired(final Mode mode) throws IOException {
        assertError(DEFAULT, mode, "{\"a\":1}", "Expected property name '__cirJsonId__', received 'a'");
        assertError(DEFAULT, mode, "{}", "Expected property name '__cirJsonId__', received end of object");
        assertError(DEFAULT, mode, "{\"__cirJsonId__\":1}", "expected a String as the value of '__cirJsonId__'");
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testRootValues(final Mode mode) throws IOException {
        assertTokens(DEFAULT, mode, "[\"0\"] {\"__cirJsonId__\":\"1\"}\n12 \"x\" true", //
                CirJsonToken.START_ARRAY, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.END_ARRAY, //
                CirJsonToken.START_OBJECT, //
                CirJsonToken.CIRJSON_ID_PROPERTY_NAME, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.END_OBJECT, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.VALUE_TRUE);
        assertTokens(DEFAULT, mode, "");
        assertError(DEFAULT, mode, "[\"0\"", "expected close marker for ARRAY");
        assertError(DEFAULT, mode, "tru", "Unrecognized token 'tru'");
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testRelaxedNamesAndQuotes(final Mode mode) throws IOException {
        final String doc = "{'__cirJsonId__':'0',name:'it\\'s'}";
        assertError(DEFAULT, mode, doc, "Unexpected character ('''");
        try (final CirJsonParser p = mode.createParser(
                factoryWith(CirJsonReadFeature.ALLOW_SINGLE_QUOTES, CirJsonReadFeature.ALLOW_UNQUOTED_PROPERTY_NAMES),
                doc)) {
            Assertions.assertEquals(CirJsonToken.START_OBJECT, p.nextToken());
            Assertions.assertEquals(CirJsonToken.CIRJSON_ID_PROPERTY_NAME, p.nextToken());
            Assertions.assertEquals("0", p.nextTextValue());
            Assertions.assertEquals("name", p.nextName());
            Assertions.assertEquals("it's", p.nextTextValue());
            Assertions.assertEquals(CirJsonToken.END_OBJECT, p.nextToken());
        }
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testSkipChildren(final Mode mode) throws IOException {
        final String doc = "{\"__cirJsonId__\":\"0\",\"skip\":[\"1\",{\"__cirJsonId__\":\"2\",\"a\":[\"3\"]}],\"b\":1}";
        try (final CirJsonParser p = mode.createParser(DEFAULT, doc)) {
            p.nextToken();
            p.nextToken();
            p.nextToken();
            Assertions.assertEquals("skip", p.nextName());
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertSame(p, p.skipChildren());
            Assertions.assertEquals(CirJsonToken.END_ARRAY, p.currentToken());
            Assertions.assertEquals("b", p.nextName());
            Assertions.assertEquals("/b", p.getParsingContext().pathAsString());
        }
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testTokensAndIdentifiers(final Mode mode) throws IOException {
        final String doc = "{ \"__cirJsonId__\" : \"0\", \"a\" : [ \"1\", 1, -2.5, true, false, null, \"x\" ],"
                + " \"b\" : { \"__cirJsonId__\" : \"2\" } }";
        try (final CirJsonParser p = mode.createParser(DEFAULT, doc)) {
            Assertions.assertEquals(CirJsonToken.START_OBJECT, p.nextToken());
            Assertions.assertTrue(p.isExpectedStartObjectToken());
            Assertions.assertEquals(CirJsonToken.CIRJSON_ID_PROPERTY_NAME, p.nextToken());
            Assertions.assertEquals(CirJsonParser.ID_NAME, p.currentName());
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals("0", p.getText());
            final CirJsonReadContext root = (CirJsonReadContext) p.getParsingContext();
            Assertions.assertEquals("0", root.getContainerId());

            Assertions.assertEquals(CirJsonToken.PROPERTY_NAME, p.nextToken());
            Assertions.assertEquals("a", p.currentName());
            Assertions.assertEquals(CirJsonToken.START_ARRAY, p.nextToken());
            Assertions.assertEquals("a", p.currentName());
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals("1", ((CirJsonReadContext) p.getParsingContext()).getContainerId());
            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_INT, p.nextToken());
            Assertions.assertEquals(1, p.getIntValue());
            Assertions.assertEquals("/a/1", p.getParsingContext().pathAsString());
            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_FLOAT, p.nextToken());
            Assertions.assertEquals(-2.5, p.getDoubleValue());
            Assertions.assertEquals(CirJsonToken.VALUE_TRUE, p.nextToken());
            Assertions.assertTrue(p.getBooleanValue());
            Assertions.assertEquals(CirJsonToken.VALUE_FALSE, p.nextToken());
            Assertions.assertEquals(CirJsonToken.VALUE_NULL, p.nextToken());
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals("x", p.getText());
            Assertions.assertEquals(CirJsonToken.END_ARRAY, p.nextToken());

            Assertions.assertEquals(CirJsonToken.PROPERTY_NAME, p.nextToken());
            Assertions.assertEquals(CirJsonToken.START_OBJECT, p.nextToken());
            Assertions.assertEquals(CirJsonToken.CIRJSON_ID_PROPERTY_NAME, p.nextToken());
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals("2", p.getText());
            Assertions.assertEquals(CirJsonToken.END_OBJECT, p.nextToken());
            Assertions.assertEquals(CirJsonToken.END_OBJECT, p.nextToken());
            Assertions.assertNull(p.nextToken());
            Assertions.assertTrue(p.isClosed());
        }
    }

    @ParameterizedTest
    @EnumSource(Mode.class)
    public void testTrailingComma(final Mode mode) throws IOException {
        assertError(DEFAULT, mode, "[\"0\",1,]", "expected a valid value");
        assertError(DEFAULT, mode, "{\"__cirJsonId__\":\"0\",\"a\":1,}", "was expecting double-quote");

        final CirJsonFactory factory = factoryWith(CirJsonReadFeature.ALLOW_TRAILING_COMMA);
        assertTokens(factory, mode, "[\"0\",1,]", //
                CirJsonToken.START_ARRAY, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.END_ARRAY);
        assertTokens(factory, mode, "{\"__cirJsonId__\":\"0\",\"a\":1,}", //
                CirJsonToken.START_OBJECT, //
                CirJsonToken.CIRJSON_ID_PROPERTY_NAME, //
                CirJsonToken.VALUE_STRING, //
                CirJsonToken.PROPERTY_NAME, //
                CirJsonToken.VALUE_NUMBER_INT, //
                CirJsonToken.END_OBJECT);
    }

    @Test
    public void testProcessingExceptionCarriesLocation() throws IOException {
        try (final CirJsonParser p = DEFAULT.createParser("[\"0\",\n  ?]")) {
            final CirJsonProcessingException e = Assertions.assertThrows(CirJsonProcessingException.class, () -> {
                while (p.nextToken() != null) {
                    // consume
                }
            });
            Assertions.assertTrue(e.getOriginalMessage().startsWith("Unexpected character ('?'"),
                    e.getOriginalMessage());
            Assertions.assertNotNull(e.getLocation());
            Assertions.assertEquals(2, e.getLocation().getLineNr());
        }
    }
}
