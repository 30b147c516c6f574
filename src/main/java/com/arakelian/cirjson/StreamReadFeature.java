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
 * Format-independent features of parsers.
 */
public enum StreamReadFeature implements CirJsonFeature {
    /** Close the underlying input when the parser is closed, unless the parser does not own it **/
    AUTO_CLOSE_SOURCE(true),

    /**
     * Report a property name that appears twice within the same object. A container identifier
     * that appears twice is always reported, regardless of this setting.
     */
    STRICT_DUPLICATE_DETECTION(true),

    /** Ignore unknown properties when a schema is in use; no effect for plain CirJSON **/
    IGNORE_UNDEFINED(false),

    /** Quote in-memory input content in error locations **/
    INCLUDE_SOURCE_IN_LOCATION(false),

    /** Parse floating point values with the fastdoubleparser library **/
    USE_FAST_DOUBLE_PARSER(true),

    /** Parse long BigInteger and BigDecimal values with the fastdoubleparser library **/
    USE_FAST_BIG_NUMBER_PARSER(true);

    public static int collectDefaults() {
        return CirJsonFeature.collectDefaults(StreamReadFeature.class);
    }

    private final boolean defaultState;

    private final int mask;

    private StreamReadFeature(final boolean defaultState) {
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
