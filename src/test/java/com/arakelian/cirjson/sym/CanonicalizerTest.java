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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.arakelian.cirjson.ImmutableStreamReadConstraints;
import com.arakelian.cirjson.StreamReadConstraints;
import com.arakelian.cirjson.exc.StreamConstraintsException;

public class CanonicalizerTest {
    private static int[] quads(final String name) {
        return BinaryNameMatcher.quads(name);
    }

    @Test
    public void testByteQuadsChildMergesIntoRoot() {
        final ByteQuadsCanonicalizer root = ByteQuadsCanonicalizer.createRoot(7, false);
        final ByteQuadsCanonicalizer child = root.makeChild();
        Assertions.assertNull(child.findName(quads("abc")[0]));

        final String abc = child.addName("abc", quads("abc")[0]);
        final int[] longName = quads("a-longer-name");
        final String longer = child.addName("a-longer-name", longName, longName.length);
        Assertions.assertSame(abc, child.findName(quads("abc")[0]));
        Assertions.assertSame(longer, child.findName(longName, longName.length));
        Assertions.assertEquals(2, child.size());
        Assertions.assertEquals(0, root.size());

        child.release();
        Assertions.assertEquals(2, root.size());
        Assertions.assertSame(abc, root.makeChild().findName(quads("abc")[0]));
    }

    @Test
    public void testByteQuadsRehash() {
        final ByteQuadsCanonicalizer table = ByteQuadsCanonicalizer.createRoot(1, false).makeChild();
        final int initial = table.bucketCount();
        for (int i = 0; i < 1000; i++) {
            final int[] q = quads("name" + i);
            table.addName("name" + i, q, q.length);
        }
        Assertions.assertTrue(table.bucketCount() > initial);
        Assertions.assertEquals(1000, table.size());
        for (int i = 0; i < 1000; i++) {
            final int[] q = quads("name" + i);
            Assertions.assertEquals("name" + i, table.findName(q, q.length));
        }
    }

    @Test
    public void testCharsChildMergesIntoRoot() throws StreamConstraintsException {
        final CharsToNameCanonicalizer root = CharsToNameCanonicalizer
                .createRoot(StreamReadConstraints.defaults(), 11, true, false);
        final CharsToNameCanonicalizer child = root.makeChild();
        final char[] buf = "xxnamexx".toCharArray();
        final String first = child.findSymbol(buf, 2, 4, child.calcHash(buf, 2, 4));
        Assertions.assertEquals("name", first);
        Assertions.assertSame(first, child.findSymbol("name".toCharArray(), 0, 4, child.calcHash("name")));
        Assertions.assertEquals("", child.findSymbol(buf, 0, 0, 1));
        Assertions.assertEquals(1, child.size());

        child.release();
        Assertions.assertEquals(1, root.size());
        final CharsToNameCanonicalizer next = root.makeChild();
        Assertions.assertSame(first, next.findSymbol("name".toCharArray(), 0, 4, next.calcHash("name")));
    }

    @Test
    public void testInterning() throws StreamConstraintsException {
        final CharsToNameCanonicalizer chars = CharsToNameCanonicalizer
                .createRoot(StreamReadConstraints.defaults(), 13, true, true)
                .makeChild();
        final char[] buf = new String("interned").toCharArray();
        Assertions.assertSame("interned", chars.findSymbol(buf, 0, buf.length, chars.calcHash(buf, 0, buf.length)));

        final ByteQuadsCanonicalizer bytes = ByteQuadsCanonicalizer.createRoot(13, true).makeChild();
        final int[] q = quads("interned");
        Assertions.assertSame("interned", bytes.addName(new String(buf), q, q.length));
    }

    @Test
    public void testCharsNameLengthWithoutCanonicalizing() throws StreamConstraintsException {
        final StreamReadConstraints constraints = ImmutableStreamReadConstraints.builder() //
                .maxNameLength(3) //
                .build();
        final CharsToNameCanonicalizer table = CharsToNameCanonicalizer.createRoot(constraints, 3, false, false)
                .makeChild();
        Assertions.assertFalse(table.isCanonicalizing());
        final char[] buf = "abcd".toCharArray();
        Assertions.assertEquals("abc", table.findSymbol(buf, 0, 3, table.calcHash(buf, 0, 3)));
        Assertions.assertThrows(StreamConstraintsException.class,
                () -> table.findSymbol(buf, 0, 4, table.calcHash(buf, 0, 4)));
    }

    @Test
    public void testCharsRehash() throws StreamConstraintsException {
        final CharsToNameCanonicalizer table = CharsToNameCanonicalizer
                .createRoot(StreamReadConstraints.defaults(), 5, true, false)
                .makeChild();
        final int initial = table.bucketCount();
        for (int i = 0; i < 2000; i++) {
            final char[] name = ("name" + i).toCharArray();
            table.findSymbol(name, 0, name.length, table.calcHash(name, 0, name.length));
        }
        Assertions.assertTrue(table.bucketCount() > initial);
        Assertions.assertEquals(2000, table.size());
        Assertions.assertTrue(table.maxCollisionLength() < CharsToNameCanonicalizer.MAX_COLL_CHAIN_LENGTH);
    }

    @Test
    public void testPad() {
        Assertions.assertEquals(0x61626364, ByteQuadsCanonicalizer.pad(0x61626364, 4));
        Assertions.assertEquals(0xFFFF6162, ByteQuadsCanonicalizer.pad(0x6162, 2));
        Assertions.assertArrayEquals(new int[] { 0x61626364, 0xFFFFFF65 }, quads("abcde"));
    }
}
