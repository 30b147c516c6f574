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
 * Format-independent features of generators.
 */
public enum StreamWriteFeature implements CirJsonFeature {
    /** Close the underlying output when the generator is closed, unless the generator does not own it **/
    AUTO_CLOSE_TARGET(true),

    /** Write end markers for all open arrays and objects when the generator is closed **/
    AUTO_CLOSE_CONTENT(true),

    /** Pass {@code flush()} calls through to the underlying output **/
    FLUSH_PASSED_TO_STREAM(true),

    /** Write BigDecimal values with {@link java.math.BigDecimal#toPlainString()} **/
    WRITE_BIG_DECIMAL_AS_PLAIN(false),

    /** Report a property name written twice within the same object **/
    STRICT_DUPLICATE_DETECTION(true),

    /** Ignore unknown properties when a schema is in use; no effect for plain CirJSON **/
    IGNORE_UNKNOWN(false),

    /** Format floating point values with the Schubfach shortest-decimal algorithm **/
    USE_FAST_DOUBLE_WRITER(false);

    public static int collectDefaults() {
        return CirJsonFeature.collectDefaults(StreamWriteFeature.class);
    }

    private final boolean defaultState;

    private final int mask;

    private StreamWriteFeature(final boolean defaultState) {
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
