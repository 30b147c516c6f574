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

import java.io.IOException;
import java.io.OutputStream;

/**
 * A String whose escaped and encoded forms can be computed once and then written many times, used
 * for property names that repeat throughout a document.
 */
public interface SerializableString {
    /**
     * Appends the escaped characters to the given buffer.
     *
     * @param buffer
     *            destination
     * @param offset
     *            position of the first char to write
     * @return number of chars written, or -1 if the buffer has no room
     */
    public int appendQuoted(char[] buffer, int offset);

    public int appendQuotedUTF8(byte[] buffer, int offset);

    public int appendUnquoted(char[] buffer, int offset);

    public int appendUnquotedUTF8(byte[] buffer, int offset);

    public char[] asQuotedChars();

    public byte[] asQuotedUTF8();

    public byte[] asUnquotedUTF8();

    public int charLength();

    /**
     * Returns the unescaped value.
     *
     * @return unescaped value
     */
    public String getValue();

    public int writeQuotedUTF8(OutputStream out) throws IOException;

    public int writeUnquotedUTF8(OutputStream out) throws IOException;
}
