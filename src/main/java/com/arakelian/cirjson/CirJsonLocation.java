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

import java.util.Objects;

import com.arakelian.cirjson.io.ContentReference;

/**
 * Immutable position within an input source. Line and column numbers are 1-based; offsets are
 * 0-based and -1 when not known.
 */
public final class CirJsonLocation {
    public static final CirJsonLocation NA = new CirJsonLocation(ContentReference.unknown(), -1L, -1L, -1, -1);

    private final ContentReference contentReference;

    private final long totalBytes;

    private final long totalChars;

    private final int lineNr;

    private final int columnNr;

    public CirJsonLocation(
            final ContentReference contentReference,
            final long totalBytes,
            final long totalChars,
            final int lineNr,
            final int columnNr) {
        this.contentReference = contentReference != null ? contentReference : ContentReference.unknown();
        this.totalBytes = totalBytes;
        this.totalChars = totalChars;
        this.lineNr = lineNr;
        this.columnNr = columnNr;
    }

    /**
     * Returns a description of this location, without the source reference.
     *
     * @return description such as <code>line: 3, column: 12</code>
     */
    public String offsetDescription() {
        final StringBuilder sb = new StringBuilder(40);
        appendOffsetDescription(sb);
        return sb.toString();
    }

    private void appendOffsetDescription(final StringBuilder sb) {
        if (lineNr > 0) {
            sb.append("line: ").append(lineNr);
            if (columnNr > 0) {
                sb.append(", column: ").append(columnNr);
            }
        } else {
            sb.append("line: UNKNOWN");
            if (columnNr > 0) {
                sb.append(", column: ").append(columnNr);
            }
        }
        if (totalBytes >= 0) {
            sb.append(", byte offset: #").append(totalBytes);
        } else if (totalChars >= 0) {
            sb.append(", char offset: #").append(totalChars);
        }
    }

    public String sourceDescription() {
        return contentReference.appendSourceDescription(new StringBuilder(100)).toString();
    }

    public ContentReference contentReference() {
        return contentReference;
    }

    public long getByteOffset() {
        return totalBytes;
    }

    public long getCharOffset() {
        return totalChars;
    }

    public int getColumnNr() {
        return columnNr;
    }

    public int getLineNr() {
        return lineNr;
    }

    @Override
    public boolean equals(final Object other) {
        if (other == this) {
            return true;
        }
        if (!(other instanceof CirJsonLocation)) {
            return false;
        }
        final CirJsonLocation that = (CirJsonLocation) other;
        return lineNr == that.lineNr && columnNr == that.columnNr && totalChars == that.totalChars
                && totalBytes == that.totalBytes && contentReference.equals(that.contentReference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentReference, lineNr, columnNr, totalChars, totalBytes);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(80);
        sb.append("[Source: ");
        contentReference.appendSourceDescription(sb);
        sb.append("; ");
        appendOffsetDescription(sb);
        sb.append(']');
        return sb.toString();
    }
}
