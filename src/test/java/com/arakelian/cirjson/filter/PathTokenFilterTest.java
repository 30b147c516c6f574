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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

public class PathTokenFilterTest {
    @Test
    public void testExcludeBelowInclude() {
        final PathTokenFilter filter = new PathTokenFilter(ImmutableSet.of("a"), ImmutableSet.of("a/b/c"));

        final TokenFilter a = filter.includeProperty("a");
        Assertions.assertTrue(a instanceof PathTokenFilter);
        Assertions.assertEquals("a", ((PathTokenFilter) a).getPath());

        Assertions.assertSame(TokenFilter.INCLUDE_ALL, a.includeProperty("x"));
        final TokenFilter b = a.includeProperty("b");
        Assertions.assertEquals("a/b", ((PathTokenFilter) b).getPath());
        Assertions.assertNull(b.includeProperty("c"));
        Assertions.assertSame(TokenFilter.INCLUDE_ALL, b.includeProperty("cd"));
    }

    @Test
    public void testExcludesOnly() {
        final PathTokenFilter filter = new PathTokenFilter(null, ImmutableSet.of("/secret", "user/password"));
        Assertions.assertNull(filter.includeProperty("secret"));
        Assertions.assertSame(TokenFilter.INCLUDE_ALL, filter.includeProperty("secrets"));
        Assertions.assertSame(TokenFilter.INCLUDE_ALL, filter.includeProperty("name"));

        final TokenFilter user = filter.includeProperty("user");
        Assertions.assertEquals("PathTokenFilter[user]", user.toString());
        Assertions.assertNull(user.includeProperty("password"));
        Assertions.assertSame(TokenFilter.INCLUDE_ALL, user.includeProperty("login"));
    }

    @Test
    public void testExcludeWinsOverInclude() {
        final PathTokenFilter filter = new PathTokenFilter(ImmutableSet.of("a"), ImmutableSet.of("a"));
        Assertions.assertNull(filter.includeProperty("a"));
    }

    @Test
    public void testIncludes() {
        final PathTokenFilter filter = new PathTokenFilter(ImmutableSet.of("a/b", "c"), ImmutableSet.of());
        Assertions.assertEquals("PathTokenFilter[/]", filter.toString());
        Assertions.assertNull(filter.includeProperty("d"));
        Assertions.assertSame(TokenFilter.INCLUDE_ALL, filter.includeProperty("c"));

        final TokenFilter a = filter.includeProperty("a");
        Assertions.assertTrue(a instanceof PathTokenFilter);
        Assertions.assertSame(TokenFilter.INCLUDE_ALL, a.includeProperty("b"));
        Assertions.assertNull(a.includeProperty("bc"));

        // arrays do not add a path segment
        Assertions.assertSame(a, a.includeElement(3));
        Assertions.assertTrue(a.includeEmptyObject(true));
        Assertions.assertTrue(a.includeEmptyArray(false));
    }
}
