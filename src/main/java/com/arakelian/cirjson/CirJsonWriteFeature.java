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
 * Output features specific to CirJSON text.
 */
public enum CirJsonWriteFeature implements CirJsonFeature {
    /** Quote property names; disabling produces non-standard output **/
    QUOTE_PROPERTY_NAMES(true),

    /** Write NaN and infinite values as quoted strings instead of bare tokens **/
    WRITE_NAN_AS_STRINGS(true),

    /** Write all numbers as quoted strings **/
    WRITE_NUMBERS_AS_STRINGS(false),

    /** Escape every character above 0x7F with a <code>\\uXXXX</code> sequence **/
    ESCAPE_NON_ASCII(false),

    /** Use upper case hex digits in <code>\\uXXXX</code> escapes **/
    WRITE_HEX_UPPER_CASE(true),

    /** Escape forward slashes as <code>\/</code> **/
    ESCAPE_FORWARD_SLASHES(true);

    public static int collectDefaults() {
        return CirJsonFeature.collectDefaults(CirJsonWriteFeature.class);
    }

    private final boolean defaultState;

    private final int mask;

    private CirJsonWriteFeature(final boolean defaultState) {
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
