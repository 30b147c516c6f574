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


package com.arakelian.cirjson.filter;

import java.io.IOException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.arakelian.cirjson.exc.StreamReadException;

public class CirJsonFilterTest {
    private static final String PRODUCT = "" + //
            "{\n" + //
            "    \"__cirJsonId__\": \"a\",\n" + //
            "    \"$schema\": \"http://json-schema.org/draft-04/schema#\",\n" + //
            "    \"title\": \"Product\",\n" + //
            "    \"description\": \"A product from Acme's catalog\",\n" + //
            "    \"type\": \"object\",\n" + //
            "    \"properties\": {\n" + //
            "        \"__cirJsonId__\": \"b\",\n" + //
            "        \"id\": {\n" + //
            "            \"__cirJsonId__\": \"c\",\n" + //
            "            \"description\": \"The unique identifier for a product\",\n" + //
            "            \"type\": \"integer\"\n" + //
            "        }\n" + //
            "    },\n" + //
            "    \"required\": [\"d\", \"id\"]\n" + //
            "}";

    @Test
    public void testCallback() throws IOException {
        final CirJsonFilterCallback callback = new CirJsonFilterCallback() {
            @Override
            public void afterStartObject(final CirJsonFilter filter) throws IOException {
                filter.getGenerator().writeNumberProperty("depth", filter.getDepth());
            }

            @Override
            public void beforeEndObject(final CirJsonFilter filter) throws IOException {
                filter.getGenerator().writeBooleanProperty("end", true);
            }
        };
        final String json = "{\"__cirJsonId__\":\"a\",\"x\":{\"__cirJsonId__\":\"b\",\"y\":1}}";
        assertEquals(
                "{\"__cirJsonId__\":\"0\",\"depth\":1,"
                        + "\"x\":{\"__cirJsonId__\":\"1\",\"depth\":2,\"y\":1,\"end\":true},\"end\":true}",
                CirJsonFilter.filter(
                        json, //
                        ImmutableCirJsonFilterOptions.builder() //
                                .callback(callback) //
                                .build()));
    }

    @Test
    public void testCallbackSkipsExcludedObjects() throws IOException {
        final CirJsonFilterCallback callback = new CirJsonFilterCallback() {
            @Override
            public void beforeEndObject(final CirJsonFilter filter) throws IOException {
                filter.getGenerator().writeStringProperty("seen", "yes");
            }
        };
        final String json = "{\"__cirJsonId__\":\"a\",\"x\":{\"__cirJsonId__\":\"b\",\"y\":1},\"z\":2}";
        assertEquals(
                "{\"__cirJsonId__\":\"0\",\"z\":2,\"seen\":\"yes\"}",
                CirJsonFilter.filter(
                        json, //
                        ImmutableCirJsonFilterOptions.builder() //
                                .addExcludes("x") //
                                .callback(callback) //
                                .build()));
    }

    @Test
    public void testEmptyOptionsReturnInput() throws IOException {
        final String json = "{\"__cirJsonId__\":\"7\",\"a\" : 1}";
        Assertions.assertSame(json, CirJsonFilter.filter(json, ImmutableCirJsonFilterOptions.builder().build()));
        Assertions.assertSame(json, CirJsonFilter.filter(json, null));
        Assertions.assertEquals("", CirJsonFilter.filter("", ImmutableCirJsonFilterOptions.builder().build()));
    }

    @Test
    public void testExcludeComplex() throws IOException {
        final String expected = "" + //
                "{\n" + //
                "  \"__cirJsonId__\" : \"0\",\n" + //
                "  \"$schema\" : \"http:\\/\\/json-schema.org\\/draft-04\\/schema#\",\n" + //
                "  \"title\" : \"Product\",\n" + //
                "  \"description\" : \"A product from Acme's catalog\",\n" + //
                "  \"type\" : \"object\",\n" + //
                "  \"properties\" : {\n" + //
                "    \"__cirJsonId__\" : \"1\",\n" + //
                "    \"id\" : {\n" + //
                "      \"__cirJsonId__\" : \"2\",\n" + //
                "      \"type\" : \"integer\"\n" + //
                "    }\n" + //
                "  },\n" + //
                "  \"required\" : [\n" + //
                "    \"3\",\n" + //
                "    \"id\"\n" + //
                "  ]\n" + //
                "}";
        assertEquals(
                expected,
                CirJsonFilter.filter(
                        PRODUCT, //
                        ImmutableCirJsonFilterOptions.builder() //
                                .addExcludes("properties/id/description") //
                                .pretty(true) //
                                .build()));
    }

    @Test
    public void testExcludeSimple() throws IOException {
        final String json = "" + //
                "{\n" + //
                "    \"__cirJsonId__\": \"door\",\n" + //
                "    \"id\": 1,\n" + //
                "    \"name\": \"A green door\",\n" + //
                "    \"created\": \"2016-12-21T16:46:39.000Z\",\n" + //
                "    \"updated\": \"2016-12-21T16:46:39.000Z\"\n" + //
                "}";
        final String expected = "" + //
                "{\n" + //
                "  \"__cirJsonId__\" : \"0\",\n" + //
                "  \"id\" : 1,\n" + //
                "  \"name\" : \"A green door\"\n" + //
                "}";
        assertEquals(
                expected,
                CirJsonFilter.filter(
                        json, //
                        ImmutableCirJsonFilterOptions.builder() //
                                .addExcludes("created", "/updated") //
                                .pretty(true) //
                                .build()));
    }

    @Test
    public void testIncludeComplex() throws IOException {
        final String expected = "{\n" + //
                "  \"__cirJsonId__\" : \"0\",\n" + //
                "  \"properties\" : {\n" + //
                "    \"__cirJsonId__\" : \"1\",\n" + //
                "    \"id\" : {\n" + //
                "      \"__cirJsonId__\" : \"2\",\n" + //
                "      \"description\" : \"The unique identifier for a product\",\n" + //
                "      \"type\" : \"integer\"\n" + //
                "    }\n" + //
                "  }\n" + //
                "}";
        assertEquals(
                expected,
                CirJsonFilter.filter(
                        PRODUCT,
                        ImmutableCirJsonFilterOptions.builder() //
                                .addIncludes("properties/id") //
                                .pretty(true) //
                                .build()));
    }

    @Test
    public void testIncludeSimple() throws IOException {
        final String json = "" + //
                "{\n" + //
                "    \"__cirJsonId__\": \"door\",\n" + //
                "    \"id\": 1,\n" + //
                "    \"name\": \"A green door\",\n" + //
                "    \"price\": 12.50,\n" + //
                "    \"tags\": [\"t\", \"home\", \"green\"]\n" + //
                "}";
        final String expected = "" + //
                "{\n" + //
                "  \"__cirJsonId__\" : \"0\",\n" + //
                "  \"name\" : \"A green door\"\n" + //
                "}";
        assertEquals(
                expected,
                CirJsonFilter.filter(
                        json,
                        ImmutableCirJsonFilterOptions.builder() //
                                .addIncludes("name") //
                                .pretty(true) //
                                .build()));
    }

    @Test
    public void testIncludeWithinArrays() throws IOException {
        final String json = "{\"__cirJsonId__\":\"r\",\"items\":[\"l\",{\"__cirJsonId__\":\"x\",\"a\":1,\"b\":2},"
                + "{\"__cirJsonId__\":\"y\",\"a\":3,\"b\":4}],\"c\":5}";
        assertEquals(
                "{\"__cirJsonId__\":\"0\",\"items\":[\"1\",{\"__cirJsonId__\":\"2\",\"b\":2},"
                        + "{\"__cirJsonId__\":\"3\",\"b\":4}]}",
                CirJsonFilter.filter(
                        json,
                        ImmutableCirJsonFilterOptions.builder() //
                                .addIncludes("items/b") //
                                .build()));
    }

    @Test
    public void testInvalidStructure() {
        final CirJsonFilterOptions opts = ImmutableCirJsonFilterOptions.builder() //
                .identityTransform(true) //
                .build();
        final StreamReadException e = Assertions
                .assertThrows(StreamReadException.class, () -> CirJsonFilter.filter("123", opts));
        Assertions.assertTrue(e.getMessage().contains("Expected start of object or array"), e.getMessage());
        Assertions.assertThrows(
                StreamReadException.class,
                () -> CirJsonFilter.filter("[\"0\",1][\"1\",2]", opts));
    }

    @Test
    public void testPrettyArrays() {
        // ignore invalid CirJSON
        assertEquals("[blah]", CirJsonFilter.prettyifyQuietly("[blah]"));
        assertEquals("[blah]", CirJsonFilter.compactQuietly("[blah]"));
        assertEquals("[1,2]", CirJsonFilter.compactQuietly("[1,2]"));
        assertEquals(
                "[\"0\",\"a\",\"b\"][\"c\":\"d\"]",
                CirJsonFilter.prettyifyQuietly("[\"0\",\"a\",\"b\"][\"c\":\"d\"]"));
        assertEquals(
                "[\"0\",\"a\",\"b\"][\"c\":\"d\"]",
                CirJsonFilter.compactQuietly("[\"0\",\"a\",\"b\"][\"c\":\"d\"]"));

        // make it pretty
        final String prettyify = CirJsonFilter.prettyifyQuietly("\n\n[\"x\",1,2,\"3\"\n,\nfalse ]\n\n").toString();
        assertEquals("[\n" + //
                "  \"0\",\n" + //
                "  1,\n" + //
                "  2,\n" + //
                "  \"3\",\n" + //
                "  false\n" + //
                "]", prettyify);

        // make it compact
        final String compact = CirJsonFilter.compactQuietly(prettyify).toString();
        assertEquals("[\"0\",1,2,\"3\",false]", compact);
        Assertions.assertSame(compact, CirJsonFilter.compactQuietly(compact));
    }

    @Test
    public void testPrettyObjects() {
        // ignore invalid CirJSON
        assertEquals("{blah}", CirJsonFilter.prettyifyQuietly("{blah}"));
        assertEquals("{blah}", CirJsonFilter.compactQuietly("{blah}"));
        assertEquals("{\"id\":\"100\"}", CirJsonFilter.compactQuietly("{\"id\":\"100\"}"));
        assertEquals(
                "{\"__cirJsonId__\":\"0\",\"a\":1}{\"__cirJsonId__\":\"1\",\"b\":2}",
                CirJsonFilter.prettyifyQuietly("{\"__cirJsonId__\":\"0\",\"a\":1}{\"__cirJsonId__\":\"1\",\"b\":2}"));

        // make it pretty
        final String prettyify = CirJsonFilter
                .prettyifyQuietly("\n\n{\"__cirJsonId__\":\"p\",\"id\":\"100\",\"name\":\"Greg Arakelian\"}\n\n")
                .toString();
        assertEquals("{\n" + //
                "  \"__cirJsonId__\" : \"0\",\n" + //
                "  \"id\" : \"100\",\n" + //
                "  \"name\" : \"Greg Arakelian\"\n" + //
                "}", prettyify);

        // make it compact
        final String compact = CirJsonFilter.compactQuietly(prettyify).toString();
        assertEquals("{\"__cirJsonId__\":\"0\",\"id\":\"100\",\"name\":\"Greg Arakelian\"}", compact);
    }

    private void assertEquals(final String expected, final CharSequence filter) {
        Assertions.assertEquals(expected, filter != null ? filter.toString() : null);
    }
}
