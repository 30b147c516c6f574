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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;

/**
 * A Base64 alphabet and line layout used by {@link CirJsonGenerator#writeBinary} and
 * {@link CirJsonParser#getBinaryValue}. Encoding and decoding are done by Guava's
 * {@link BaseEncoding}.
 */
public final class Base64Variant {
    /** Line separator of encoded output, an escaped linefeed inside a string value **/
    static final String LINE_SEPARATOR = "\\n";

    private final String name;

    private final BaseEncoding encoding;

    /** Same as {@link #encoding} without the line separator **/
    private final BaseEncoding decoding;

    private final boolean usesPadding;

    private final int maxLineLength;

    Base64Variant(final String name, final BaseEncoding base, final boolean usesPadding, final int maxLineLength) {
        Preconditions.checkArgument(name != null, "name must be non-null");
        Preconditions.checkArgument(base != null, "base must be non-null");
        this.name = name;
        this.usesPadding = usesPadding;
        this.maxLineLength = maxLineLength;
        BaseEncoding enc = usesPadding ? base : base.omitPadding();
        this.decoding = enc;
        if (maxLineLength != Integer.MAX_VALUE) {
            enc = enc.withSeparator("\n", maxLineLength);
        }
        this.encoding = enc;
    }

    /**
     * Decodes the given Base64 text. White space, including the linefeeds inserted by line
     * wrapping variants, is ignored.
     *
     * @param text
     *            encoded text
     * @return decoded bytes
     * @throws IllegalArgumentException
     *             if the text contains characters outside of this variant's alphabet
     */
    public byte[] decode(final String text) {
        Preconditions.checkArgument(text != null, "text must be non-null");
        final String stripped = CharMatcher.whitespace().removeFrom(text);
        return decoding.decode(stripped);
    }

    public String encode(final byte[] input) {
        return encode(input, 0, input.length);
    }

    public String encode(final byte[] input, final boolean addQuotes) {
        final String encoded = encode(input);
        return addQuotes ? '"' + encoded + '"' : encoded;
    }

    public String encode(final byte[] input, final int offset, final int len) {
        Preconditions.checkArgument(input != null, "input must be non-null");
        final String encoded = encoding.encode(input, offset, len);
        return maxLineLength == Integer.MAX_VALUE ? encoded : encoded.replace("\n", LINE_SEPARATOR);
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public String getName() {
        return name;
    }

    public char getPaddingChar() {
        return '=';
    }

    @Override
    public String toString() {
        return name;
    }

    public boolean usesPadding() {
        return usesPadding;
    }
}
