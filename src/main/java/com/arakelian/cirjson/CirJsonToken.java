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
 * Tokens returned by {@link CirJsonParser#nextToken()}.
 */
public enum CirJsonToken {
    /**
     * Returned by the non-blocking parser when the buffered input does not contain a complete
     * token.
     */
    NOT_AVAILABLE(null, CirJsonTokenId.ID_NOT_AVAILABLE),

    START_OBJECT("{", CirJsonTokenId.ID_START_OBJECT),

    END_OBJECT("}", CirJsonTokenId.ID_END_OBJECT),

    START_ARRAY("[", CirJsonTokenId.ID_START_ARRAY),

    END_ARRAY("]", CirJsonTokenId.ID_END_ARRAY),

    PROPERTY_NAME(null, CirJsonTokenId.ID_PROPERTY_NAME),

    /**
     * The identifier property that starts every object; it is always followed by a
     * {@link #VALUE_STRING} holding the identifier.
     */
    CIRJSON_ID_PROPERTY_NAME(null, CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME),

    VALUE_EMBEDDED_OBJECT(null, CirJsonTokenId.ID_EMBEDDED_OBJECT),

    VALUE_STRING(null, CirJsonTokenId.ID_STRING),

    VALUE_NUMBER_INT(null, CirJsonTokenId.ID_NUMBER_INT),

    VALUE_NUMBER_FLOAT(null, CirJsonTokenId.ID_NUMBER_FLOAT),

    VALUE_TRUE("true", CirJsonTokenId.ID_TRUE),

    VALUE_FALSE("false", CirJsonTokenId.ID_FALSE),

    VALUE_NULL("null", CirJsonTokenId.ID_NULL);

    /**
     * Returns a short description of the kind of value a token represents, for use in error
     * messages.
     *
     * @param t
     *            token, may be null
     * @return description such as "Object value" or "Int value"
     */
    public static String valueDescFor(final CirJsonToken t) {
        if (t == null) {
            return "<end of input>";
        }
        switch (t) {
        case START_OBJECT:
        case END_OBJECT:
        case PROPERTY_NAME:
        case CIRJSON_ID_PROPERTY_NAME:
            return "Object value";
        case START_ARRAY:
        case END_ARRAY:
            return "Array value";
        case VALUE_FALSE:
        case VALUE_TRUE:
            return "Boolean value";
        case VALUE_EMBEDDED_OBJECT:
            return "Embedded Object value";
        case VALUE_NUMBER_FLOAT:
            return "Floating-point value";
        case VALUE_NUMBER_INT:
            return "Int value";
        case VALUE_STRING:
            return "String value";
        case VALUE_NULL:
            return "Null value";
        case NOT_AVAILABLE:
        default:
            return "[Unavailable value]";
        }
    }

    private final String token;

    private final char[] chars;

    private final byte[] bytes;

    private final int id;

    private final boolean isStructStart;

    private final boolean isStructEnd;

    private final boolean isNumber;

    private final boolean isBoolean;

    private final boolean isScalar;

    private CirJsonToken(final String token, final int id) {
        this.token = token;
        if (token == null) {
            this.chars = null;
            this.bytes = null;
        } else {
            this.chars = token.toCharArray();
            this.bytes = new byte[chars.length];
            for (int i = 0; i < chars.length; i++) {
                bytes[i] = (byte) chars[i];
            }
        }
        this.id = id;
        this.isBoolean = id == CirJsonTokenId.ID_FALSE || id == CirJsonTokenId.ID_TRUE;
        this.isNumber = id == CirJsonTokenId.ID_NUMBER_INT || id == CirJsonTokenId.ID_NUMBER_FLOAT;
        this.isStructStart = id == CirJsonTokenId.ID_START_OBJECT || id == CirJsonTokenId.ID_START_ARRAY;
        this.isStructEnd = id == CirJsonTokenId.ID_END_OBJECT || id == CirJsonTokenId.ID_END_ARRAY;
        this.isScalar = !isStructStart && !isStructEnd && id != CirJsonTokenId.ID_PROPERTY_NAME
                && id != CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME && id != CirJsonTokenId.ID_NOT_AVAILABLE;
    }

    public final byte[] asByteArray() {
        return bytes;
    }

    public final char[] asCharArray() {
        return chars;
    }

    public final String asString() {
        return token;
    }

    public final int id() {
        return id;
    }

    public final boolean isBoolean() {
        return isBoolean;
    }

    /**
     * Returns true for {@link #PROPERTY_NAME} and {@link #CIRJSON_ID_PROPERTY_NAME}.
     *
     * @return true if this token is a property name
     */
    public final boolean isName() {
        return id == CirJsonTokenId.ID_PROPERTY_NAME || id == CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME;
    }

    public final boolean isNumeric() {
        return isNumber;
    }

    public final boolean isScalarValue() {
        return isScalar;
    }

    public final boolean isStructEnd() {
        return isStructEnd;
    }

    public final boolean isStructStart() {
        return isStructStart;
    }
}
