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

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link PropertyNameMatcher} that matches Strings only, optionally ignoring case.
 */
public final class SimpleNameMatcher extends PropertyNameMatcher {
    /**
     * Creates a case-sensitive matcher.
     *
     * @param locale
     *            locale, used only for case-insensitive matching
     * @param names
     *            expected names; the index of each is its ordinal, and null entries are skipped
     * @return new matcher
     */
    public static SimpleNameMatcher construct(final Locale locale, final List<String> names) {
        return new SimpleNameMatcher(locale, null, names);
    }

    public static SimpleNameMatcher constructCaseInsensitive(final Locale locale, final List<String> names) {
        final SimpleNameMatcher backup = construct(locale, lowercase(locale, names));
        return new SimpleNameMatcher(locale, backup, names);
    }

    private final Map<String, Integer> ordinals;

    private SimpleNameMatcher(final Locale locale, final SimpleNameMatcher backup, final List<String> names) {
        super(locale, backup, names.toArray(new String[names.size()]));
        this.ordinals = new HashMap<>(findSize(names.size()));
        for (int i = 0, size = names.size(); i < size; i++) {
            final String name = names.get(i);
            if (name != null) {
                // first occurrence wins
                ordinals.putIfAbsent(name, Integer.valueOf(i));
            }
        }
    }

    @Override
    public int matchByQuad(final int q1) {
        throw new UnsupportedOperationException("SimpleNameMatcher does not match by quads");
    }

    @Override
    public int matchByQuad(final int q1, final int q2) {
        throw new UnsupportedOperationException("SimpleNameMatcher does not match by quads");
    }

    @Override
    public int matchByQuad(final int q1, final int q2, final int q3) {
        throw new UnsupportedOperationException("SimpleNameMatcher does not match by quads");
    }

    @Override
    public int matchByQuad(final int[] q, final int qlen) {
        throw new UnsupportedOperationException("SimpleNameMatcher does not match by quads");
    }

    @Override
    public int matchName(final String name) {
        final Integer ix = ordinals.get(name);
        if (ix != null) {
            return ix.intValue();
        }
        return matchSecondary(name);
    }
}
