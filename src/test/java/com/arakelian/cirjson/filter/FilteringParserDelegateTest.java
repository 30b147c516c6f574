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
import java.io.StringWriter;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.arakelian.cirjson.CirJsonFactory;
import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.filter.TokenFilter.Inclusion;
import com.google.common.collect.ImmutableSet;

public class FilteringParserDelegateTest {
    static class IncludeEmptyIfNotFilteredFilter extends TokenFilter {
        @Override
        public boolean includeEmptyArray(final boolean contentsFiltered) {
            return !contentsFiltered;
        }

        @Override
        public boolean includeEmptyObject(final boolean contentsFiltered) {
            return !contentsFiltered;
        }

        @Override
        public boolean includeScalar() {
            return false;
        }
    }

    static class IndexMatchFilter extends TokenFilter {
        private final int index;

        public IndexMatchFilter(final int index) {
            this.index = index;
        }

        @Override
        public TokenFilter includeElement(final int ix) {
            return ix == index ? TokenFilter.INCLUDE_ALL : null;
        }

        @Override
        public boolean includeScalar() {
            return false;
        }
    }

    static class NameMatchFilter extends TokenFilter {
        private final Set<String> names;

        public NameMatchFilter(final String... names) {
            this.names = ImmutableSet.copyOf(names);
        }

        @Override
        public TokenFilter includeProperty(final String name) {
            return names.contains(name) ? TokenFilter.INCLUDE_ALL : this;
        }

        @Override
        public boolean includeScalar() {
            return false;
        }
    }

    static class NoArraysFilter extends TokenFilter {
        @Override
        public TokenFilter filterStartArray() {
            return null;
        }
    }

    static class NoObjectsFilter extends TokenFilter {
        @Override
        public TokenFilter filterStartObject() {
            return null;
        }
    }

    private static final String SIMPLE = q(
            "{'__cirJsonId__':'root','a':123,'array':['1',1,2],"
                    + "'ob':{'__cirJsonId__':'2','value0':2,'value':3,'value2':4},'b':true}");

    private static String q(final String s) {
        return s.replace('\'', '"');
    }

    private final CirJsonFactory factory = new CirJsonFactory();

    private String filter(
            final String json,
            final TokenFilter filter,
            final Inclusion inclusion,
            final boolean allowMultipleMatches,
            final int expectedMatches) throws IOException {
        final StringWriter w = new StringWriter();
        try (final FilteringParserDelegate p = new FilteringParserDelegate(factory.createParser(json), filter,
                inclusion, allowMultipleMatches); final CirJsonGenerator gen = factory.createGenerator(w)) {
            while (p.nextToken() != null) {
                gen.copyCurrentEvent(p);
            }
            Assertions.assertEquals(expectedMatches, p.getMatchCount());
        }
        return w.toString();
    }

    @Test
    public void testEmptyContainersIncludedIfNotFiltered() throws IOException {
        final String json = q(
                "{'__cirJsonId__':'0','empty_array':['1'],'filtered_array':['2',6],"
                        + "'empty_object':{'__cirJsonId__':'3'},'filtered_object':{'__cirJsonId__':'4','a':6}}");
        Assertions.assertEquals(
                q("{'__cirJsonId__':'0','empty_array':['1'],'empty_object':{'__cirJsonId__':'3'}}"),
                filter(json, new IncludeEmptyIfNotFilteredFilter(), Inclusion.INCLUDE_ALL_AND_PATH, true, 0));
    }

    @Test
    public void testHeldBackTokens() throws IOException {
        try (final CirJsonParser p = new FilteringParserDelegate(factory.createParser(SIMPLE),
                new NameMatchFilter("value"), Inclusion.INCLUDE_ALL_AND_PATH, false)) {
            Assertions.assertEquals(CirJsonToken.START_OBJECT, p.nextToken());
            Assertions.assertEquals(CirJsonToken.CIRJSON_ID_PROPERTY_NAME, p.nextToken());
            Assertions.assertEquals(CirJsonParser.ID_NAME, p.currentName());
            Assertions.assertEquals(CirJsonToken.VALUE_STRING, p.nextToken());
            Assertions.assertEquals("root", p.getText());
            Assertions.assertEquals(CirJsonParser.ID_NAME, p.currentName());
            Assertions.assertEquals("ob", p.nextName());
            Assertions.assertEquals(CirJsonToken.START_OBJECT, p.nextToken());
            Assertions.assertEquals("ob", p.currentName());
            Assertions.assertEquals(CirJsonToken.CIRJSON_ID_PROPERTY_NAME, p.nextToken());
            Assertions.assertEquals("2", p.nextTextValue());
            Assertions.assertEquals(CirJsonToken.PROPERTY_NAME, p.nextToken());
            Assertions.assertEquals("value", p.getText());
            Assertions.assertEquals(CirJsonToken.VALUE_NUMBER_INT, p.nextToken());
            Assertions.assertEquals(3, p.getIntValue());
            Assertions.assertEquals("value", p.currentName());
            Assertions.assertEquals(CirJsonToken.END_OBJECT, p.nextToken());
            Assertions.assertEquals(CirJsonToken.END_OBJECT, p.nextToken());
            Assertions.assertNull(p.nextToken());
        }
    }

    @Test
    public void testIncludeNonNull() throws IOException {
        // containers are returned as soon as they start, matched or not
        Assertions.assertEquals(
                q("{'__cirJsonId__':'root','array':['1'],'ob':{'__cirJsonId__':'2','value':3}}"),
                filter(SIMPLE, new NameMatchFilter("value"), Inclusion.INCLUDE_NON_NULL, true, 1));
    }

    @Test
    public void testIndexMatchWithPath() throws IOException {
        Assertions.assertEquals(
                q("{'__cirJsonId__':'root','array':['1',2]}"),
                filter(SIMPLE, new IndexMatchFilter(1), Inclusion.INCLUDE_ALL_AND_PATH, true, 1));
        Assertions.assertEquals(
                q("{'__cirJsonId__':'root','array':['1',1]}"),
                filter(SIMPLE, new IndexMatchFilter(0), Inclusion.INCLUDE_ALL_AND_PATH, true, 1));
    }

    @Test
    public void testMultipleMatches() throws IOException {
        final String json = q(
                "{'__cirJsonId__':'0','a':{'__cirJsonId__':'1','value':1},'b':{'__cirJsonId__':'2','value':2}}");
        Assertions.assertEquals(
                q("{'__cirJsonId__':'0','a':{'__cirJsonId__':'1','value':1}}"),
                filter(json, new NameMatchFilter("value"), Inclusion.INCLUDE_ALL_AND_PATH, false, 1));
        Assertions.assertEquals(
                json,
                filter(json, new NameMatchFilter("value"), Inclusion.INCLUDE_ALL_AND_PATH, true, 2));
    }

    @Test
    public void testMultipleMatchesInclude() throws IOException {
        final String json = q(
                "{'__cirJsonId__':'0','a':123,'array':['1',1,2],"
                        + "'ob':{'__cirJsonId__':'2','value0':2,'value':['3','x'],'value2':'foo'},'b':true}");
        Assertions.assertEquals(
                q("{'__cirJsonId__':'0','ob':{'__cirJsonId__':'2','value':['3','x']}}"),
                filter(json, new NameMatchFilter("value"), Inclusion.INCLUDE_ALL_AND_PATH, true, 1));
    }

    @Test
    public void testNoArrays() throws IOException {
        Assertions.assertEquals(
                q("{'__cirJsonId__':'root','a':123,'ob':{'__cirJsonId__':'2','value0':2,'value':3,'value2':4},"
                        + "'b':true}"),
                filter(SIMPLE, new NoArraysFilter(), Inclusion.INCLUDE_ALL_AND_PATH, true, 5));
    }

    @Test
    public void testNoObjects() throws IOException {
        Assertions.assertEquals(
                q("['a',1,3]"),
                filter(
                        q("['a',1,{'__cirJsonId__':'b','a':2},3]"),
                        new NoObjectsFilter(),
                        Inclusion.INCLUDE_ALL_AND_PATH,
                        true,
                        2));
    }

    @Test
    public void testNonFiltering() throws IOException {
        Assertions.assertEquals(
                SIMPLE,
                filter(SIMPLE, TokenFilter.INCLUDE_ALL, Inclusion.INCLUDE_ALL_AND_PATH, true, 0));
    }

    @Test
    public void testSingleMatchOnlyValue() throws IOException {
        Assertions.assertEquals(
                "3",
                filter(SIMPLE, new NameMatchFilter("value"), Inclusion.ONLY_INCLUDE_ALL, false, 1));
    }

    @Test
    public void testSingleMatchWithPath() throws IOException {
        Assertions.assertEquals(
                q("{'__cirJsonId__':'root','ob':{'__cirJsonId__':'2','value':3}}"),
                filter(SIMPLE, new NameMatchFilter("value"), Inclusion.INCLUDE_ALL_AND_PATH, false, 1));
    }

    @Test
    public void testSkipChildren() throws IOException {
        try (final CirJsonParser p = new FilteringParserDelegate(factory.createParser(SIMPLE),
                TokenFilter.INCLUDE_ALL, Inclusion.INCLUDE_ALL_AND_PATH, true)) {
            CirJsonToken t;
            while ((t = p.nextToken()) != CirJsonToken.START_OBJECT || !"ob".equals(p.currentName())) {
                Assertions.assertNotNull(t);
            }
            p.skipChildren();
            Assertions.assertEquals(CirJsonToken.END_OBJECT, p.currentToken());
            Assertions.assertEquals("b", p.nextName());
            Assertions.assertEquals(CirJsonToken.VALUE_TRUE, p.nextToken());
        }
    }
}
