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
 * Common contract of the on/off feature enumerations. Feature sets are stored as {@code int} bit
 * masks, one bit per constant.
 */
public interface CirJsonFeature {
    /**
     * Computes the bit mask of all features of the given enumeration that are enabled by default.
     *
     * @param type
     *            feature enumeration
     * @param <F>
     *            feature type
     * @return default feature mask
     */
    public static <F extends Enum<F> & CirJsonFeature> int collectDefaults(final Class<F> type) {
        int flags = 0;
        for (final F f : type.getEnumConstants()) {
            if (f.enabledByDefault()) {
                flags |= f.getMask();
            }
        }
        return flags;
    }

    public boolean enabledByDefault();

    public default boolean enabledIn(final int flags) {
        return (flags & getMask()) != 0;
    }

    public int getMask();
}
