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

package com.arakelian.cirjson.util;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;

import com.arakelian.cirjson.Base64Variant;
import com.arakelian.cirjson.CirJsonLocation;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonReadFeature;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.SerializableString;
import com.arakelian.cirjson.StreamReadConstraints;
import com.arakelian.cirjson.StreamReadFeature;
import com.arakelian.cirjson.TokenStreamContext;
import com.arakelian.cirjson.sym.PropertyNameMatcher;
import com.google.common.base.Preconditions;

/**
 * Parser that forwards every call to another parser. Subclasses override the calls they want to
 * intercept.
 */
public class CirJsonParserDelegate extends CirJsonParser {
    protected CirJsonParser delegate;

    public CirJsonParserDelegate(final CirJsonParser delegate) {
        super(Preconditions.checkNotNull(delegate, "delegate must be non-null").getObjectReadContext(),
                delegate.getStreamReadFeatures(), delegate.getFormatReadFeatures());
        this.delegate = delegate;
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }

    @Override
    public CirJsonLocation currentLocation() {
        return delegate.currentLocation();
    }

    @Override
    public String currentName() {
        return delegate.currentName();
    }

    @Override
    public int currentNameMatch(final PropertyNameMatcher matcher) throws IOException {
        return delegate.currentNameMatch(matcher);
    }

    @Override
    public CirJsonToken currentToken() {
        return delegate.currentToken();
    }

    @Override
    public int currentTokenId() {
        return delegate.currentTokenId();
    }

    @Override
    public CirJsonLocation currentTokenLocation() {
        return delegate.currentTokenLocation();
    }

    @Override
    public void finishToken() throws IOException {
        delegate.finishToken();
    }

    @Override
    public BigInteger getBigIntegerValue() throws IOException {
        return delegate.getBigIntegerValue();
    }

    @Override
    public byte[] getBinaryValue(final Base64Variant variant) throws IOException {
        return delegate.getBinaryValue(variant);
    }

    @Override
    public boolean getBooleanValue() throws IOException {
        return delegate.getBooleanValue();
    }

    @Override
    public BigDecimal getDecimalValue() throws IOException {
        return delegate.getDecimalValue();
    }

    public CirJsonParser getDelegate() {
        return delegate;
    }

    @Override
    public double getDoubleValue() throws IOException {
        return delegate.getDoubleValue();
    }

    @Override
    public Object getEmbeddedObject() throws IOException {
        return delegate.getEmbeddedObject();
    }

    @Override
    public float getFloatValue() throws IOException {
        return delegate.getFloatValue();
    }

    @Override
    public int getFormatReadFeatures() {
        return delegate.getFormatReadFeatures();
    }

    @Override
    public String getIdName() {
        return delegate.getIdName();
    }

    @Override
    public int getIntValue() throws IOException {
        return delegate.getIntValue();
    }

    @Override
    public long getLongValue() throws IOException {
        return delegate.getLongValue();
    }

    @Override
    public NumberType getNumberType() throws IOException {
        return delegate.getNumberType();
    }

    @Override
    public Number getNumberValue() throws IOException {
        return delegate.getNumberValue();
    }

    @Override
    public TokenStreamContext getParsingContext() {
        return delegate.getParsingContext();
    }

    @Override
    public StreamReadConstraints getStreamReadConstraints() {
        return delegate.getStreamReadConstraints();
    }

    @Override
    public int getStreamReadFeatures() {
        return delegate.getStreamReadFeatures();
    }

    @Override
    public String getText() throws IOException {
        return delegate.getText();
    }

    @Override
    public char[] getTextCharacters() throws IOException {
        return delegate.getTextCharacters();
    }

    @Override
    public int getTextLength() throws IOException {
        return delegate.getTextLength();
    }

    @Override
    public int getTextOffset() throws IOException {
        return delegate.getTextOffset();
    }

    @Override
    public String getValueAsString() throws IOException {
        return delegate.getValueAsString();
    }

    @Override
    public boolean hasTextCharacters() {
        return delegate.hasTextCharacters();
    }

    @Override
    public boolean hasToken(final CirJsonToken t) {
        return delegate.hasToken(t);
    }

    @Override
    public boolean hasTokenId(final int id) {
        return delegate.hasTokenId(id);
    }

    @Override
    public boolean isClosed() {
        return delegate.isClosed();
    }

    @Override
    public boolean isEnabled(final CirJsonReadFeature f) {
        return delegate.isEnabled(f);
    }

    @Override
    public boolean isEnabled(final StreamReadFeature f) {
        return delegate.isEnabled(f);
    }

    @Override
    public boolean isExpectedStartArrayToken() {
        return delegate.isExpectedStartArrayToken();
    }

    @Override
    public boolean isExpectedStartObjectToken() {
        return delegate.isExpectedStartObjectToken();
    }

    @Override
    public boolean isNaN() throws IOException {
        return delegate.isNaN();
    }

    @Override
    public String nextName() throws IOException {
        return delegate.nextName();
    }

    @Override
    public boolean nextName(final SerializableString str) throws IOException {
        return delegate.nextName(str);
    }

    @Override
    public int nextNameMatch(final PropertyNameMatcher matcher) throws IOException {
        return delegate.nextNameMatch(matcher);
    }

    @Override
    public String nextTextValue() throws IOException {
        return delegate.nextTextValue();
    }

    @Override
    public CirJsonToken nextToken() throws IOException {
        return delegate.nextToken();
    }

    @Override
    public CirJsonToken nextValue() throws IOException {
        return delegate.nextValue();
    }

    @Override
    public <T> T readValueAs(final Class<T> type) throws IOException {
        return delegate.readValueAs(type);
    }

    @Override
    public int releaseBuffered(final OutputStream out) throws IOException {
        return delegate.releaseBuffered(out);
    }

    @Override
    public int releaseBuffered(final Writer w) throws IOException {
        return delegate.releaseBuffered(w);
    }

    @Override
    public CirJsonParser skipChildren() throws IOException {
        delegate.skipChildren();
        return this;
    }

    @Override
    public Object streamReadInputSource() {
        return delegate.streamReadInputSource();
    }
}
