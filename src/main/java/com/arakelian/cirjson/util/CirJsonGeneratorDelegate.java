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
import java.math.BigDecimal;
import java.math.BigInteger;

import com.arakelian.cirjson.Base64Variant;
import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.CirJsonWriteFeature;
import com.arakelian.cirjson.ObjectWriteContext;
import com.arakelian.cirjson.PrettyPrinter;
import com.arakelian.cirjson.SerializableString;
import com.arakelian.cirjson.StreamWriteConstraints;
import com.arakelian.cirjson.StreamWriteFeature;
import com.arakelian.cirjson.TokenStreamContext;
import com.arakelian.cirjson.io.CharacterEscapes;
import com.google.common.base.Preconditions;

/**
 * Generator that forwards every call to another generator. Convenience methods such as
 * {@link #writeStringProperty(String, String)} and {@link #copyCurrentEvent} are not forwarded as
 * such; they call the primitive write methods of this instance, so subclasses see every token.
 */
public class CirJsonGeneratorDelegate extends CirJsonGenerator {
    protected CirJsonGenerator delegate;

    public CirJsonGeneratorDelegate(final CirJsonGenerator delegate) {
        this.delegate = Preconditions.checkNotNull(delegate, "delegate must be non-null");
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }

    @Override
    public void flush() throws IOException {
        delegate.flush();
    }

    @Override
    public CharacterEscapes getCharacterEscapes() {
        return delegate.getCharacterEscapes();
    }

    public CirJsonGenerator getDelegate() {
        return delegate;
    }

    @Override
    public String getId(final Object target, final boolean isArray) {
        return delegate.getId(target, isArray);
    }

    @Override
    public ObjectWriteContext getObjectWriteContext() {
        return delegate.getObjectWriteContext();
    }

    @Override
    public int getOutputBuffered() {
        return delegate.getOutputBuffered();
    }

    @Override
    public PrettyPrinter getPrettyPrinter() {
        return delegate.getPrettyPrinter();
    }

    @Override
    public TokenStreamContext getStreamWriteContext() {
        return delegate.getStreamWriteContext();
    }

    @Override
    public StreamWriteConstraints getStreamWriteConstraints() {
        return delegate.getStreamWriteConstraints();
    }

    @Override
    public boolean isClosed() {
        return delegate.isClosed();
    }

    @Override
    public boolean isEnabled(final CirJsonWriteFeature f) {
        return delegate.isEnabled(f);
    }

    @Override
    public boolean isEnabled(final StreamWriteFeature f) {
        return delegate.isEnabled(f);
    }

    @Override
    public Object streamWriteOutputTarget() {
        return delegate.streamWriteOutputTarget();
    }

    @Override
    public void writeBinary(final Base64Variant variant, final byte[] data, final int offset, final int length)
            throws IOException {
        delegate.writeBinary(variant, data, offset, length);
    }

    @Override
    public void writeBoolean(final boolean state) throws IOException {
        delegate.writeBoolean(state);
    }

    @Override
    public void writeEndArray() throws IOException {
        delegate.writeEndArray();
    }

    @Override
    public void writeEndObject() throws IOException {
        delegate.writeEndObject();
    }

    @Override
    public void writeName(final SerializableString name) throws IOException {
        delegate.writeName(name);
    }

    @Override
    public void writeName(final String name) throws IOException {
        delegate.writeName(name);
    }

    @Override
    public void writeNull() throws IOException {
        delegate.writeNull();
    }

    @Override
    public void writeNumber(final BigDecimal value) throws IOException {
        delegate.writeNumber(value);
    }

    @Override
    public void writeNumber(final BigInteger value) throws IOException {
        delegate.writeNumber(value);
    }

    @Override
    public void writeNumber(final double value) throws IOException {
        delegate.writeNumber(value);
    }

    @Override
    public void writeNumber(final float value) throws IOException {
        delegate.writeNumber(value);
    }

    @Override
    public void writeNumber(final int value) throws IOException {
        delegate.writeNumber(value);
    }

    @Override
    public void writeNumber(final long value) throws IOException {
        delegate.writeNumber(value);
    }

    @Override
    public void writeNumber(final short value) throws IOException {
        delegate.writeNumber(value);
    }

    @Override
    public void writeNumber(final String encodedValue) throws IOException {
        delegate.writeNumber(encodedValue);
    }

    @Override
    public void writeObject(final Object value) throws IOException {
        delegate.writeObject(value);
    }

    @Override
    public void writeRaw(final char c) throws IOException {
        delegate.writeRaw(c);
    }

    @Override
    public void writeRaw(final char[] text, final int offset, final int len) throws IOException {
        delegate.writeRaw(text, offset, len);
    }

    @Override
    public void writeRaw(final String text, final int offset, final int len) throws IOException {
        delegate.writeRaw(text, offset, len);
    }

    @Override
    public void writeRawUTF8String(final byte[] buffer, final int offset, final int len) throws IOException {
        delegate.writeRawUTF8String(buffer, offset, len);
    }

    @Override
    public void writeRawValue(final String text, final int offset, final int len) throws IOException {
        delegate.writeRawValue(text, offset, len);
    }

    @Override
    public void writeStartArray(final Object currentValue) throws IOException {
        delegate.writeStartArray(currentValue);
    }

    @Override
    public void writeStartObject(final Object currentValue) throws IOException {
        delegate.writeStartObject(currentValue);
    }

    @Override
    public void writeString(final char[] text, final int offset, final int len) throws IOException {
        delegate.writeString(text, offset, len);
    }

    @Override
    public void writeString(final SerializableString text) throws IOException {
        delegate.writeString(text);
    }

    @Override
    public void writeString(final String text) throws IOException {
        delegate.writeString(text);
    }

    @Override
    public void writeUTF8String(final byte[] buffer, final int offset, final int len) throws IOException {
        delegate.writeUTF8String(buffer, offset, len);
    }
}
