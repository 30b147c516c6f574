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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps property names to the ordinals of a fixed set of expected names, so that callers that only
 * need "which of my properties is this" can skip String comparisons.
 *
 * <p>
 * Matching returns the non-negative index of the name in the list the matcher was built from, or
 * one of the negative <code>MATCH_</code> codes.
 * </p>
 */
public abstract class PropertyNameMatcher {
    /** Returned when positioned at the end of an object **/
    public static final int MATCH_END_OBJECT = -1;

    /** Returned for a property name that is not one of the expected names **/
    public static final int MATCH_UNKNOWN_NAME = -2;

    /** Returned when the current token is neither a property name nor the end of an object **/
    public static final int MATCH_ODD_TOKEN = -3;

    protected static int findSize(final int size) {
        if (size <= 5) {
            return 8;
        }
        if (size <= 11) {
            return 16;
        }
        if (size <= 23) {
            return 32;
        }
        final int needed = size + (size >> 2) + (size >> 4);
        int result = 64;
        while (result < needed) {
            result += result;
        }
        return result;
    }

    protected static List<String> lowercase(final Locale locale, final List<String> names) {
        final List<String> result = new ArrayList<>(names.size());
        for (final String name : names) {
            result.add(name == null ? null : name.toLowerCase(locale));
        }
        return result;
    }

    protected final Locale locale;

    /** Lower-case matcher consulted when the exact match fails; null when case-sensitive **/
    protected final PropertyNameMatcher backupMatcher;

    protected final String[] nameLookup;

    protected PropertyNameMatcher(
            final Locale locale,
            final PropertyNameMatcher backupMatcher,
            final String[] nameLookup) {
        this.locale = locale;
        this.backupMatcher = backupMatcher;
        this.nameLookup = nameLookup;
    }

    /**
     * Returns the names this matcher was built from, indexed by ordinal.
     *
     * @return names by ordinal; entries may be null
     */
    public String[] getNameLookup() {
        return nameLookup;
    }

    public boolean isCaseInsensitive() {
        return backupMatcher != null;
    }

    public abstract int matchByQuad(int q1);

    public abstract int matchByQuad(int q1, int q2);

    public abstract int matchByQuad(int q1, int q2, int q3);

    public abstract int matchByQuad(int[] q, int qlen);

    /**
     * Returns the ordinal of the given name. The name need not be interned.
     *
     * @param name
     *            name to match
     * @return ordinal, or {@link #MATCH_UNKNOWN_NAME}
     */
    public abstract int matchName(String name);

    protected final int matchSecondary(final String name) {
        if (backupMatcher == null) {
            return MATCH_UNKNOWN_NAME;
        }
        return backupMatcher.matchName(name.toLowerCase(locale));
    }

    /**
     * Returns true if {@link #matchByQuad(int[], int)} gives complete answers, so that byte parsers
     * can match without decoding the name.
     *
     * @return true if quad matching is supported
     */
    public boolean supportsQuadMatching() {
        return false;
    }
}
