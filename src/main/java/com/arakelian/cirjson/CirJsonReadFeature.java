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

/**
 * Lenient-parsing features specific to CirJSON text. All are disabled by default, which means
 * strict RFC 8259 syntax plus the identifier rules of CirJSON.
 */
public enum CirJsonReadFeature implements CirJsonFeature {
    /** Allow <code>/* ... *&#47;</code> and <code>// ...</code> comments **/
    ALLOW_JAVA_COMMENTS(false),

    /** Allow <code># ...</code> comments **/
    ALLOW_YAML_COMMENTS(false),

    /** Allow property names without quotes, using Java identifier rules **/
    ALLOW_UNQUOTED_PROPERTY_NAMES(false),

    /** Allow apostrophes as quotes for names and string values **/
    ALLOW_SINGLE_QUOTES(false),

    /** Allow raw control characters (below 32) inside strings **/
    ALLOW_UNESCAPED_CONTROL_CHARS(false),

    /** Allow a backslash before any character, not just the standard escapes **/
    ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER(false),

    /** Allow numbers such as <code>00012</code> **/
    ALLOW_LEADING_ZEROS_FOR_NUMBERS(false),

    /** Allow numbers such as <code>+1</code> **/
    ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS(false),

    /** Allow numbers such as <code>.5</code> **/
    ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS(false),

    /** Allow numbers such as <code>5.</code> **/
    ALLOW_TRAILING_DECIMAL_POINT_FOR_NUMBERS(false),

    /** Allow <code>NaN</code>, <code>Infinity</code>, <code>+Infinity</code> and <code>-Infinity</code> **/
    ALLOW_NON_NUMERIC_NUMBERS(false),

    /** Allow missing array values, as in <code>["id",1,,3]</code>, which are reported as null **/
    ALLOW_MISSING_VALUES(false),

    /** Allow a single trailing comma before a closing bracket or brace **/
    ALLOW_TRAILING_COMMA(false);

    public static int collectDefaults() {
        return CirJsonFeature.collectDefaults(CirJsonReadFeature.class);
    }

    private final boolean defaultState;

    private final int mask;

    private CirJsonReadFeature(final boolean defaultState) {
        this.defaultState = defaultState;
        this.mask = 1 << ordinal();
    }

    @Override
    public boolean enabledByDefault() {
        return defaultState;
    }

    @Override
    public int getMask() {
        return mask;
    }
}
