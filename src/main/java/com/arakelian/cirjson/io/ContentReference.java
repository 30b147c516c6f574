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

import java.nio.charset.StandardCharsets;

/**
 * Reference to the input source of a parser, used when building error locations. Only sources that
 * are in memory (strings, char arrays and byte arrays) can have their content quoted.
 */
public final class ContentReference {
    /** Maximum number of characters of content quoted in a location description **/
    public static final int DEFAULT_MAX_CONTENT_SNIPPET = 500;

    private static final ContentReference UNKNOWN_CONTENT = new ContentReference(false, null, 0, -1);

    private static final ContentReference REDACTED_CONTENT = new ContentReference(false, null, 0, -1);

    public static ContentReference construct(final boolean textual, final Object content) {
        return new ContentReference(textual, content, 0, -1);
    }

    public static ContentReference construct(
            final boolean textual,
            final Object content,
            final int offset,
            final int length) {
        return new ContentReference(textual, content, offset, length);
    }

    /**
     * Returns a reference that does not expose the source, used when
     * {@code StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION} is disabled.
     *
     * @return a reference that hides the source content
     */
    public static ContentReference redacted() {
        return REDACTED_CONTENT;
    }

    public static ContentReference unknown() {
        return UNKNOWN_CONTENT;
    }

    private final boolean textual;

    private final Object rawContent;

    private final int offset;

    private final int length;

    private ContentReference(final boolean textual, final Object rawContent, final int offset, final int length) {
        this.textual = textual;
        this.rawContent = rawContent;
        this.offset = offset;
        this.length = length;
    }

    /**
     * Appends a short description of the source to the given buffer, for example
     * <code>(String)"{"__cirJsonId__"..."</code>.
     *
     * @param sb
     *            buffer to append to
     * @return the same buffer
     */
    public StringBuilder appendSourceDescription(final StringBuilder sb) {
        if (this == REDACTED_CONTENT) {
            sb.append("REDACTED (`StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION` disabled)");
            return sb;
        }
        if (rawContent == null) {
            sb.append("UNKNOWN");
            return sb;
        }

        final Class<?> type = rawContent instanceof Class ? (Class<?>) rawContent : rawContent.getClass();
        String typeName = type.getName();
        if (typeName.startsWith("java.")) {
            typeName = type.getSimpleName();
        } else if (rawContent instanceof byte[]) {
            typeName = "byte[]";
        } else if (rawContent instanceof char[]) {
            typeName = "char[]";
        }
        sb.append('(').append(typeName).append(')');

        if (textual) {
            final String snippet;
            if (rawContent instanceof CharSequence) {
                snippet = truncate((CharSequence) rawContent);
            } else if (rawContent instanceof char[]) {
                final char[] chars = (char[]) rawContent;
                snippet = truncate(new String(chars, offset, actualLength(chars.length)));
            } else if (rawContent instanceof byte[]) {
                final byte[] bytes = (byte[]) rawContent;
                snippet = truncate(new String(bytes, offset, actualLength(bytes.length), StandardCharsets.UTF_8));
            } else {
                snippet = null;
            }
            if (snippet != null) {
                sb.append('"');
                for (int i = 0, len = snippet.length(); i < len; i++) {
                    final char ch = snippet.charAt(i);
                    if (Character.isISOControl(ch) && ch != '\n' && ch != '\r' && ch != '\t') {
                        sb.append("\\u").append(String.format("%04x", (int) ch));
                    } else {
                        sb.append(ch);
                    }
                }
                sb.append('"');
            }
        }
        return sb;
    }

    private int actualLength(final int total) {
        return length < 0 ? total - offset : Math.min(length, total - offset);
    }

    public int getContentLength() {
        return length;
    }

    public int getContentOffset() {
        return offset;
    }

    public Object getRawContent() {
        return rawContent;
    }

    public boolean hasTextualContent() {
        return textual;
    }

    private String truncate(final CharSequence csq) {
        final int len = csq.length();
        if (len <= DEFAULT_MAX_CONTENT_SNIPPET) {
            return csq.toString();
        }
        return csq.subSequence(0, DEFAULT_MAX_CONTENT_SNIPPET) + "[truncated " + (len - DEFAULT_MAX_CONTENT_SNIPPET)
                + " chars]";
    }
}
