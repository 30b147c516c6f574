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

import javax.annotation.Nullable;

import com.arakelian.cirjson.SerializableString;

/**
 * Customizes how generators escape characters in property names and string values.
 *
 * <p>
 * The table returned by {@link #getEscapeCodesForAscii()} decides for each 7-bit character: no
 * escaping, the standard <code>\\uXXXX</code> escape, a backslash followed by the character code
 * stored in the table, or a custom sequence from {@link #getEscapeSequence(int)}. Characters above
 * 127 are escaped whenever {@link #getEscapeSequence(int)} returns a sequence for them.
 * </p>
 *
 * <pre>
 * class HtmlEscapes extends CharacterEscapes {
 *     private final int[] codes = standardAsciiEscapesForCirJson();
 *     {
 *         codes['&lt;'] = ESCAPE_STANDARD;
 *     }
 *     ...
 * }
 * </pre>
 */
public abstract class CharacterEscapes {
    public static final int ESCAPE_NONE = 0;

    /** <code>\\uXXXX</code> escape **/
    public static final int ESCAPE_STANDARD = CharTypes.ESCAPE_STANDARD;

    /** Escape with the sequence returned by {@link #getEscapeSequence(int)} **/
    public static final int ESCAPE_CUSTOM = -2;

    /**
     * Returns a copy of the standard CirJSON escape table, for subclasses that change only a few
     * entries.
     *
     * @return 128-entry escape table owned by the caller
     */
    public static int[] standardAsciiEscapesForCirJson() {
        return CharTypes.getSevenBitOutputEscapes(false).clone();
    }

    /**
     * Returns the escape table for the first 128 characters. Callers must not modify it.
     *
     * @return table of at least 128 entries, each <code>ESCAPE_</code> code or a positive
     *         character to write after a backslash
     */
    public abstract int[] getEscapeCodesForAscii();

    /**
     * Returns the sequence to write in place of the given character.
     *
     * @param ch
     *            character to escape
     * @return escape sequence, or null to write the character as the table says
     */
    @Nullable
    public abstract SerializableString getEscapeSequence(int ch);
}
