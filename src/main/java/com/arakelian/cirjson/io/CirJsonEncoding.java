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

package com.arakelian.cirjson.io;

/**
 * Character encodings that CirJSON byte input may use.
 */
public enum CirJsonEncoding {
    UTF8("UTF-8", false, 8),

    UTF16_BE("UTF-16BE", true, 16),

    UTF16_LE("UTF-16LE", false, 16),

    UTF32_BE("UTF-32BE", true, 32),

    UTF32_LE("UTF-32LE", false, 32);

    private final String javaName;

    private final boolean bigEndian;

    private final int bits;

    private CirJsonEncoding(final String javaName, final boolean bigEndian, final int bits) {
        this.javaName = javaName;
        this.bigEndian = bigEndian;
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    /**
     * Returns the charset name to use with {@link java.io.InputStreamReader} and similar classes.
     *
     * @return Java charset name
     */
    public String getJavaName() {
        return javaName;
    }

    public boolean isBigEndian() {
        return bigEndian;
    }
}
