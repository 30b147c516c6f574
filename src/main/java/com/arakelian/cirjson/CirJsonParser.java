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

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;

import com.arakelian.cirjson.exc.StreamReadException;
import com.arakelian.cirjson.sym.PropertyNameMatcher;

/**
 * Pull parser over CirJSON content. Each call to {@link #nextToken()} advances to the next token;
 * accessors return details of the current token.
 *
 * <p>
 * Every object starts with a {@link CirJsonToken#CIRJSON_ID_PROPERTY_NAME} token followed by a
 * {@link CirJsonToken#VALUE_STRING} holding the identifier, and the first element of every array
 * is a {@link CirJsonToken#VALUE_STRING} identifier.
 * </p>
 */
public abstract class CirJsonParser implements Closeable {
    /** Name of the identifier property that starts every object **/
    public static final String ID_NAME = "__cirJsonId__";

    public enum NumberType {
        INT, LONG, BIG_INTEGER, FLOAT, DOUBLE, BIG_DECIMAL;
    }

    protected final ObjectReadContext objectReadContext;

    protected int streamReadFeatures;

    protected int formatReadFeatures;

    protected CirJsonParser(
            final ObjectReadContext objectReadContext,
            final int streamReadFeatures,
            final int formatReadFeatures) {
        this.objectReadContext = objectReadContext != null ? objectReadContext : ObjectReadContext.empty();
        this.streamReadFeatures = streamReadFeatures;
        this.formatReadFeatures = formatReadFeatures;
    }

    @Override
    public abstract void close() throws IOException;

    /**
     * Returns the ordinal of the current property name within the given matcher.
     *
     * @param matcher
     *            matcher of expected names
     * @return ordinal, or one of the <code>MATCH_</code> codes of {@link PropertyNameMatcher}
     * @throws IOException
     *             if the name cannot be matched
     */
    public abstract int currentNameMatch(PropertyNameMatcher matcher) throws IOException;

    public abstract CirJsonLocation currentLocation();

    /**
     * Returns the name associated with the current token: the property name for name tokens and
     * for values within objects, otherwise null.
     *
     * @return current name, may be null
     */
    public abstract String currentName();

    public abstract CirJsonToken currentToken();

    public abstract int currentTokenId();

    public abstract CirJsonLocation currentTokenLocation();

    /**
     * Completes parsing of the current token if it was parsed lazily. Parsers in this library
     * parse eagerly, so this only validates that a token is current.
     *
     * @throws IOException
     *             if the token cannot be completed
     */
    public void finishToken() throws IOException {
    }

    public abstract BigInteger getBigIntegerValue() throws IOException;

    public byte[] getBinaryValue() throws IOException {
        return getBinaryValue(Base64Variants.getDefaultVariant());
    }

    public abstract byte[] getBinaryValue(Base64Variant variant) throws IOException;

    public boolean getBooleanValue() throws IOException {
        final CirJsonToken t = currentToken();
        if (t == CirJsonToken.VALUE_TRUE) {
            return true;
        }
        if (t == CirJsonToken.VALUE_FALSE) {
            return false;
        }
        throw new StreamReadException(this, String.format("Current token (%s) not of boolean type", t));
    }

    public abstract BigDecimal getDecimalValue() throws IOException;

    public abstract double getDoubleValue() throws IOException;

    public abstract Object getEmbeddedObject() throws IOException;

    public abstract float getFloatValue() throws IOException;

    public int getFormatReadFeatures() {
        return formatReadFeatures;
    }

    /**
     * Returns the name of the identifier property, {@value #ID_NAME}.
     *
     * @return identifier property name
     */
    public String getIdName() {
        return ID_NAME;
    }

    public abstract int getIntValue() throws IOException;

    public abstract long getLongValue() throws IOException;

    public abstract NumberType getNumberType() throws IOException;

    public abstract Number getNumberValue() throws IOException;

    public ObjectReadContext getObjectReadContext() {
        return objectReadContext;
    }

    public abstract TokenStreamContext getParsingContext();

    public abstract StreamReadConstraints getStreamReadConstraints();

    public int getStreamReadFeatures() {
        return streamReadFeatures;
    }

    /**
     * Returns the textual representation of the current token: the decoded value of strings, the
     * name of name tokens, the literal text of numbers and keywords.
     *
     * @return text of the current token, or null if there is none
     * @throws IOException
     *             if the text cannot be accessed
     */
    public abstract String getText() throws IOException;

    public abstract char[] getTextCharacters() throws IOException;

    public abstract int getTextLength() throws IOException;

    public abstract int getTextOffset() throws IOException;

    public String getValueAsString() throws IOException {
        final CirJsonToken t = currentToken();
        if (t == CirJsonToken.VALUE_STRING) {
            return getText();
        }
        if (t == null || t == CirJsonToken.VALUE_NULL || !t.isScalarValue()) {
            return null;
        }
        return getText();
    }

    public abstract boolean hasTextCharacters();

    public boolean hasToken(final CirJsonToken t) {
        return currentToken() == t;
    }

    public boolean hasTokenId(final int id) {
        return currentTokenId() == id;
    }

    public abstract boolean isClosed();

    public boolean isEnabled(final CirJsonReadFeature f) {
        return f.enabledIn(formatReadFeatures);
    }

    public boolean isEnabled(final StreamReadFeature f) {
        return f.enabledIn(streamReadFeatures);
    }

    public boolean isExpectedStartArrayToken() {
        return currentToken() == CirJsonToken.START_ARRAY;
    }

    public boolean isExpectedStartObjectToken() {
        return currentToken() == CirJsonToken.START_OBJECT;
    }

    public boolean isNaN() throws IOException {
        return false;
    }

    /**
     * Advances to the next token and returns the property name if it is a name token, including
     * the identifier property.
     *
     * @return property name, or null if the next token is not a name
     * @throws IOException
     *             if the input cannot be read
     */
    public String nextName() throws IOException {
        final CirJsonToken t = nextToken();
        return t != null && t.isName() ? currentName() : null;
    }

    public boolean nextName(final SerializableString str) throws IOException {
        final String name = nextName();
        return name != null && name.equals(str.getValue());
    }

    /**
     * Advances to the next token and matches it against the given matcher.
     *
     * @param matcher
     *            matcher of expected names
     * @return ordinal of the matched name, or one of the <code>MATCH_</code> codes of
     *         {@link PropertyNameMatcher}
     * @throws IOException
     *             if the input cannot be read
     */
    public int nextNameMatch(final PropertyNameMatcher matcher) throws IOException {
        nextToken();
        return currentNameMatch(matcher);
    }

    public String nextTextValue() throws IOException {
        return nextToken() == CirJsonToken.VALUE_STRING ? getText() : null;
    }

    public abstract CirJsonToken nextToken() throws IOException;

    /**
     * Advances to the next value token, skipping property names.
     *
     * @return next value token, or null at the end of input
     * @throws IOException
     *             if the input cannot be read
     */
    public CirJsonToken nextValue() throws IOException {
        CirJsonToken t = nextToken();
        if (t != null && t.isName()) {
            t = nextToken();
        }
        return t;
    }

    /**
     * Reads the value at the current token through the configured {@link ObjectReadContext}.
     *
     * @param type
     *            type of value to produce
     * @param <T>
     *            value type
     * @return value read
     * @throws IOException
     *             if the value cannot be read
     */
    public <T> T readValueAs(final Class<T> type) throws IOException {
        return objectReadContext.readValue(this, type);
    }

    public int releaseBuffered(final OutputStream out) throws IOException {
        return -1;
    }

    public int releaseBuffered(final Writer w) throws IOException {
        return -1;
    }

    /**
     * If the current token starts an array or object, skips to its matching end token. Does
     * nothing for other tokens.
     *
     * @return this parser
     * @throws IOException
     *             if the input cannot be read
     */
    public abstract CirJsonParser skipChildren() throws IOException;

    public abstract Object streamReadInputSource();
}
