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


package com.arakelian.cirjson.sym;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.arakelian.cirjson.CirJsonFactory;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonToken;

public class PropertyNameMatcherTest {
    private static final List<String> NAMES = Arrays.asList("id", "name", null, "description", "naïve", "id");

    private static final String DOC = "{\"__cirJsonId__\":\"0\",\"name\":\"x\",\"NAME\":1,\"other\":true,"
            + "\"naïve\":2,\"a-rather-long-property-name\":3}";

    private static void assertDocumentMatches(final CirJsonParser p, final PropertyNameMatcher matcher)
            throws IOException {
        Assertions.assertEquals(PropertyNameMatcher.MATCH_ODD_TOKEN, p.nextNameMatch(matcher));
        Assertions.assertEquals(PropertyNameMatcher.MATCH_UNKNOWN_NAME, p.nextNameMatch(matcher));
        Assertions.assertEquals(CirJsonToken.CIRJSON_ID_PROPERTY_NAME, p.currentToken());
        Assertions.assertEquals(PropertyNameMatcher.MATCH_ODD_TOKEN, p.nextNameMatch(matcher));

        Assertions.assertEquals(1, p.nextNameMatch(matcher));
        p.nextToken();
        final int upper = p.nextNameMatch(matcher);
        Assertions.assertEquals(matcher.isCaseInsensitive() ? 1 : PropertyNameMatcher.MATCH_UNKNOWN_NAME, upper);
        p.nextToken();
        Assertions.assertEquals(PropertyNameMatcher.MATCH_UNKNOWN_NAME, p.nextNameMatch(matcher));
        p.nextToken();
        Assertions.assertEquals(4, p.nextNameMatch(matcher));
        p.nextToken();
        Assertions.assertEquals(PropertyNameMatcher.MATCH_UNKNOWN_NAME, p.nextNameMatch(matcher));
        p.nextToken();
        Assertions.assertEquals(PropertyNameMatcher.MATCH_END_OBJECT, p.nextNameMatch(matcher));
    }

    @Test
    public void testBinaryMatcher() {
        final BinaryNameMatcher matcher = BinaryNameMatcher.construct(NAMES);
        Assertions.assertTrue(matcher.supportsQuadMatching());
        Assertions.assertFalse(matcher.isCaseInsensitive());
        Assertions.assertEquals(6, matcher.getNameLookup().length);

        for (final String name : new String[] { "id", "name", "description", "naïve" }) {
            final int[] q = BinaryNameMatcher.quads(name);
            Assertions.assertEquals(NAMES.indexOf(name), matcher.matchByQuad(q, q.length), name);
            Assertions.assertEquals(NAMES.indexOf(name), matcher.matchName(name), name);
        }
        Assertions.assertEquals(0, matcher.matchByQuad(BinaryNameMatcher.quads("id")[0]));
        final int[] name = BinaryNameMatcher.quads("name");
        Assertions.assertEquals(1, name.length);
        Assertions.assertEquals(1, matcher.matchByQuad(name[0]));
        final int[] desc = BinaryNameMatcher.quads("description");
        Assertions.assertEquals(3, desc.length);
        Assertions.assertEquals(3, matcher.matchByQuad(desc[0], desc[1], desc[2]));

        final int[] missing = BinaryNameMatcher.quads("nam");
        Assertions.assertEquals(PropertyNameMatcher.MATCH_UNKNOWN_NAME, matcher.matchByQuad(missing[0]));
        Assertions.assertEquals(0, BinaryNameMatcher.quads("").length);
    }

    @Test
    public void testCaseInsensitive() {
        final SimpleNameMatcher simple = SimpleNameMatcher.constructCaseInsensitive(Locale.ROOT, NAMES);
        Assertions.assertTrue(simple.isCaseInsensitive());
        Assertions.assertEquals(3, simple.matchName("Description"));
        Assertions.assertEquals(PropertyNameMatcher.MATCH_UNKNOWN_NAME, simple.matchName("Descriptions"));

        final BinaryNameMatcher binary = BinaryNameMatcher.constructCaseInsensitive(Locale.ROOT, NAMES);
        Assertions.assertFalse(binary.supportsQuadMatching());
        Assertions.assertEquals(1, binary.matchName("NAME"));
    }

    @Test
    public void testMatchWhileParsingBytes() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory();
        try (final CirJsonParser p = factory.createParser(DOC.getBytes(StandardCharsets.UTF_8))) {
            assertDocumentMatches(p, BinaryNameMatcher.construct(NAMES));
        }
        try (final CirJsonParser p = factory.createParser(DOC.getBytes(StandardCharsets.UTF_8))) {
            assertDocumentMatches(p, SimpleNameMatcher.constructCaseInsensitive(Locale.ROOT, NAMES));
        }
    }

    @Test
    public void testMatchWhileParsingChars() throws IOException {
        final CirJsonFactory factory = new CirJsonFactory();
        try (final CirJsonParser p = factory.createParser(DOC)) {
            assertDocumentMatches(p, SimpleNameMatcher.construct(Locale.ROOT, NAMES));
        }
        try (final CirJsonParser p = factory.createParser(DOC)) {
            assertDocumentMatches(p, BinaryNameMatcher.constructCaseInsensitive(Locale.ROOT, NAMES));
        }
    }

    @Test
    public void testSimpleMatcher() {
        final SimpleNameMatcher matcher = SimpleNameMatcher.construct(Locale.ROOT, NAMES);
        Assertions.assertFalse(matcher.supportsQuadMatching());
        Assertions.assertEquals(0, matcher.matchName("id"));
        Assertions.assertEquals(3, matcher.matchName(new String("description".toCharArray())));
        Assertions.assertEquals(PropertyNameMatcher.MATCH_UNKNOWN_NAME, matcher.matchName("Name"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> matcher.matchByQuad(1));
    }
}
