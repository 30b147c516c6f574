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
import java.io.Flushable;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;

import com.arakelian.cirjson.exc.StreamWriteException;
import com.arakelian.cirjson.io.CharacterEscapes;
import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;

/**
 * Streaming writer of CirJSON content.
 *
 * <p>
 * Every object must start with the identifier property {@value #ID_NAME} and every array with an
 * identifier string. {@link #writeObjectId(Object)} and {@link #writeArrayId(Object)} write
 * identifiers assigned by the generator, one per distinct object instance.
 * </p>
 *
 * <pre>
 * g.writeStartObject(value);
 * g.writeObjectId(value);
 * g.writeStringProperty("name", "abc");
 * g.writeEndObject();
 * </pre>
 */
public abstract class CirJsonGenerator implements Closeable, Flushable {
    /** Name of the identifier property that starts every object **/
    public static final String ID_NAME = "__cirJsonId__";

    @Override
    public abstract void close() throws IOException;

    /**
     * Copies the current token of the parser. Identifiers are copied as ordinary names and
     * strings, so the output keeps the identifiers of the input.
     *
     * @param p
     *            parser positioned on a token
     * @throws IOException
     *             if the token cannot be read or written
     */
    public void copyCurrentEvent(final CirJsonParser p) throws IOException {
        final CirJsonToken t = p.currentToken();
        if (t == null) {
            throw new StreamWriteException(this, "No current event to copy");
        }
        switch (t.id()) {
        case CirJsonTokenId.ID_START_OBJECT:
            writeStartObject();
            break;
        case CirJsonTokenId.ID_END_OBJECT:
            writeEndObject();
            break;
        case CirJsonTokenId.ID_START_ARRAY:
            writeStartArray();
            break;
        case CirJsonTokenId.ID_END_ARRAY:
            writeEndArray();
            break;
        case CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME:
            writeName(p.getIdName());
            break;
        case CirJsonTokenId.ID_PROPERTY_NAME:
            writeName(p.currentName());
            break;
        case CirJsonTokenId.ID_STRING:
            if (p.hasTextCharacters()) {
                writeString(p.getTextCharacters(), p.getTextOffset(), p.getTextLength());
            } else {
                writeString(p.getText());
            }
            break;
        case CirJsonTokenId.ID_NUMBER_INT:
            copyCurrentIntValue(p);
            break;
        case CirJsonTokenId.ID_NUMBER_FLOAT:
            copyCurrentFloatValue(p);
            break;
        case CirJsonTokenId.ID_TRUE:
            writeBoolean(true);
            break;
        case CirJsonTokenId.ID_FALSE:
            writeBoolean(false);
            break;
        case CirJsonTokenId.ID_NULL:
            writeNull();
            break;
        case CirJsonTokenId.ID_EMBEDDED_OBJECT:
            writeEmbeddedObject(p.getEmbeddedObject());
            break;
        default:
            throw new IllegalStateException("Internal error: unknown current token, " + t);
        }
    }

    private void copyCurrentFloatValue(final CirJsonParser p) throws IOException {
        if (p.isNaN()) {
            writeNumber(p.getDoubleValue());
            return;
        }
        switch (p.getNumberType()) {
        case BIG_DECIMAL:
            writeNumber(p.getDecimalValue());
            break;
        case FLOAT:
            writeNumber(p.getFloatValue());
            break;
        default:
            writeNumber(p.getDoubleValue());
            break;
        }
    }

    private void copyCurrentIntValue(final CirJsonParser p) throws IOException {
        switch (p.getNumberType()) {
        case INT:
            writeNumber(p.getIntValue());
            break;
        case LONG:
            writeNumber(p.getLongValue());
            break;
        default:
            writeNumber(p.getBigIntegerValue());
            break;
        }
    }

    /**
     * Copies the current token and, for a name or a container start, everything up to the end of
     * the value.
     *
     * @param p
     *            parser positioned on a token
     * @throws IOException
     *             if the content cannot be read or written
     */
    public void copyCurrentStructure(final CirJsonParser p) throws IOException {
        CirJsonToken t = p.currentToken();
        if (t == null) {
            throw new StreamWriteException(this, "No current event to copy");
        }
        if (t.isName()) {
            copyCurrentEvent(p);
            t = p.nextToken();
        }
        copyCurrentEvent(p);
        if (!t.isStructStart()) {
            return;
        }
        int depth = 1;
        while (depth > 0) {
            t = p.nextToken();
            if (t == null) {
                return;
            }
            copyCurrentEvent(p);
            if (t.isStructStart()) {
                ++depth;
            } else if (t.isStructEnd()) {
                --depth;
            }
        }
    }

    /**
     * Returns the custom escaping in effect, or null if only the standard escapes are used.
     *
     * @return character escapes, may be null
     */
    public CharacterEscapes getCharacterEscapes() {
        return null;
    }

    /**
     * Returns the identifier of the given container instance, assigning the next sequential
     * identifier on first use.
     *
     * @param target
     *            array, collection, map or other container value
     * @param isArray
     *            true if the target is written as an array
     * @return identifier, unique within this generator
     */
    public abstract String getId(Object target, boolean isArray);

    public abstract ObjectWriteContext getObjectWriteContext();

    /**
     * Returns the number of characters or bytes buffered and not yet written to the target.
     *
     * @return buffered output size
     */
    public abstract int getOutputBuffered();

    public abstract PrettyPrinter getPrettyPrinter();

    public abstract TokenStreamContext getStreamWriteContext();

    public abstract StreamWriteConstraints getStreamWriteConstraints();

    public abstract boolean isClosed();

    public abstract boolean isEnabled(CirJsonWriteFeature f);

    public abstract boolean isEnabled(StreamWriteFeature f);

    public abstract Object streamWriteOutputTarget();

    public void writeArray(final double[] array, final int offset, final int length) throws IOException {
        verifyOffsets(array.length, offset, length);
        writeStartArray(array);
        writeArrayId(array);
        for (int i = offset, end = offset + length; i < end; ++i) {
            writeNumber(array[i]);
        }
        writeEndArray();
    }

    public void writeArray(final int[] array, final int offset, final int length) throws IOException {
        verifyOffsets(array.length, offset, length);
        writeStartArray(array);
        writeArrayId(array);
        for (int i = offset, end = offset + length; i < end; ++i) {
            writeNumber(array[i]);
        }
        writeEndArray();
    }

    public void writeArray(final long[] array, final int offset, final int length) throws IOException {
        verifyOffsets(array.length, offset, length);
        writeStartArray(array);
        writeArrayId(array);
        for (int i = offset, end = offset + length; i < end; ++i) {
            writeNumber(array[i]);
        }
        writeEndArray();
    }

    public void writeArray(final String[] array, final int offset, final int length) throws IOException {
        verifyOffsets(array.length, offset, length);
        writeStartArray(array);
        writeArrayId(array);
        for (int i = offset, end = offset + length; i < end; ++i) {
            writeString(array[i]);
        }
        writeEndArray();
    }

    /**
     * Writes the identifier of the given array value; must be the first value after
     * {@link #writeStartArray(Object)}.
     *
     * @param referenced
     *            array, collection or other value written as an array
     * @throws IOException
     *             if the identifier is not expected here or cannot be written
     */
    public void writeArrayId(final Object referenced) throws IOException {
        writeString(getId(referenced, true));
    }

    public void writeArrayPropertyStart(final String name) throws IOException {
        writeName(name);
        writeStartArray();
    }

    public void writeBinary(final Base64Variant variant, final InputStream data, final int dataLength)
            throws IOException {
        final byte[] bytes = dataLength < 0 ? ByteStreams.toByteArray(data)
                : ByteStreams.toByteArray(ByteStreams.limit(data, dataLength));
        if (dataLength >= 0 && bytes.length < dataLength) {
            throw new StreamWriteException(this, "Too few bytes available: missing " + (dataLength - bytes.length)
                    + " bytes (out of " + dataLength + ")");
        }
        writeBinary(variant, bytes, 0, bytes.length);
    }

    public abstract void writeBinary(Base64Variant variant, byte[] data, int offset, int length)
            throws IOException;

    public void writeBinary(final byte[] data) throws IOException {
        writeBinary(Base64Variants.getDefaultVariant(), data, 0, data.length);
    }

    public void writeBinary(final InputStream data, final int dataLength) throws IOException {
        writeBinary(Base64Variants.getDefaultVariant(), data, dataLength);
    }

    public void writeBinaryProperty(final String name, final byte[] data) throws IOException {
        writeName(name);
        writeBinary(data);
    }

    public abstract void writeBoolean(boolean state) throws IOException;

    public void writeBooleanProperty(final String name, final boolean value) throws IOException {
        writeName(name);
        writeBoolean(value);
    }

    /**
     * Writes a value the format has no native representation for. Byte arrays are written as
     * Base64 strings and null as a null token.
     *
     * @param object
     *            value to write
     * @throws IOException
     *             if the value type is not supported
     */
    public void writeEmbeddedObject(final Object object) throws IOException {
        if (object == null) {
            writeNull();
            return;
        }
        if (object instanceof byte[]) {
            writeBinary((byte[]) object);
            return;
        }
        throw new StreamWriteException(this,
                "No native support for writing embedded objects of type " + object.getClass().getName());
    }

    public abstract void writeEndArray() throws IOException;

    public abstract void writeEndObject() throws IOException;

    public abstract void writeName(SerializableString name) throws IOException;

    public abstract void writeName(String name) throws IOException;

    public abstract void writeNull() throws IOException;

    public void writeNullProperty(final String name) throws IOException {
        writeName(name);
        writeNull();
    }

    public abstract void writeNumber(BigDecimal value) throws IOException;

    public abstract void writeNumber(BigInteger value) throws IOException;

    public abstract void writeNumber(double value) throws IOException;

    public abstract void writeNumber(float value) throws IOException;

    public abstract void writeNumber(int value) throws IOException;

    public abstract void writeNumber(long value) throws IOException;

    public void writeNumber(final short value) throws IOException {
        writeNumber((int) value);
    }

    /**
     * Writes a number that is already encoded as text, without validation.
     *
     * @param encodedValue
     *            textual number
     * @throws IOException
     *             if a value is not expected here or cannot be written
     */
    public abstract void writeNumber(String encodedValue) throws IOException;

    public void writeNumberProperty(final String name, final BigDecimal value) throws IOException {
        writeName(name);
        writeNumber(value);
    }

    public void writeNumberProperty(final String name, final BigInteger value) throws IOException {
        writeName(name);
        writeNumber(value);
    }

    public void writeNumberProperty(final String name, final double value) throws IOException {
        writeName(name);
        writeNumber(value);
    }

    public void writeNumberProperty(final String name, final float value) throws IOException {
        writeName(name);
        writeNumber(value);
    }

    public void writeNumberProperty(final String name, final int value) throws IOException {
        writeName(name);
        writeNumber(value);
    }

    public void writeNumberProperty(final String name, final long value) throws IOException {
        writeName(name);
        writeNumber(value);
    }

    public void writeNumberProperty(final String name, final short value) throws IOException {
        writeName(name);
        writeNumber(value);
    }

    /**
     * Writes any value: null, strings, numbers, booleans, byte arrays, maps, collections and
     * object arrays natively, everything else through the {@link ObjectWriteContext}. Maps,
     * collections and arrays that were already written are written as their identifier string.
     *
     * @param value
     *            value to write
     * @throws IOException
     *             if the value cannot be written
     */
    public abstract void writeObject(Object value) throws IOException;

    /**
     * Writes the identifier property of the given object value; must directly follow
     * {@link #writeStartObject(Object)}.
     *
     * @param referenced
     *            value written as an object
     * @throws IOException
     *             if the identifier is not expected here or cannot be written
     */
    public void writeObjectId(final Object referenced) throws IOException {
        writeName(ID_NAME);
        writeString(getId(referenced, false));
    }

    public void writeObjectProperty(final String name, final Object value) throws IOException {
        writeName(name);
        writeObject(value);
    }

    public void writeObjectPropertyStart(final String name) throws IOException {
        writeName(name);
        writeStartObject();
    }

    public void writePropertyId(final long id) throws IOException {
        writeName(Long.toString(id));
    }

    public abstract void writeRaw(char c) throws IOException;

    public abstract void writeRaw(char[] text, int offset, int len) throws IOException;

    public void writeRaw(final SerializableString raw) throws IOException {
        writeRaw(raw.getValue());
    }

    public void writeRaw(final String text) throws IOException {
        writeRaw(text, 0, text.length());
    }

    public abstract void writeRaw(String text, int offset, int len) throws IOException;

    /**
     * Writes pre-encoded UTF-8 content as a string value, adding quotes but no escaping.
     *
     * @param buffer
     *            encoded bytes
     * @param offset
     *            offset of the first byte
     * @param len
     *            number of bytes
     * @throws IOException
     *             if a value is not expected here or cannot be written
     */
    public abstract void writeRawUTF8String(byte[] buffer, int offset, int len) throws IOException;

    public void writeRawValue(final SerializableString raw) throws IOException {
        writeRawValue(raw.getValue());
    }

    public void writeRawValue(final String text) throws IOException {
        writeRawValue(text, 0, text.length());
    }

    /**
     * Writes text verbatim as a complete value, with separators handled as for any other value.
     *
     * @param text
     *            text to write
     * @param offset
     *            offset of the first character
     * @param len
     *            number of characters
     * @throws IOException
     *             if a value is not expected here or cannot be written
     */
    public abstract void writeRawValue(String text, int offset, int len) throws IOException;

    public void writeStartArray() throws IOException {
        writeStartArray(null);
    }

    public abstract void writeStartArray(Object currentValue) throws IOException;

    public void writeStartObject() throws IOException {
        writeStartObject(null);
    }

    public abstract void writeStartObject(Object currentValue) throws IOException;

    public abstract void writeString(char[] text, int offset, int len) throws IOException;

    public abstract void writeString(SerializableString text) throws IOException;

    public abstract void writeString(String text) throws IOException;

    public void writeStringProperty(final String name, final String value) throws IOException {
        writeName(name);
        writeString(value);
    }

    /**
     * Writes UTF-8 encoded text as a string value, escaping as needed.
     *
     * @param buffer
     *            encoded bytes
     * @param offset
     *            offset of the first byte
     * @param len
     *            number of bytes
     * @throws IOException
     *             if a value is not expected here or cannot be written
     */
    public abstract void writeUTF8String(byte[] buffer, int offset, int len) throws IOException;

    protected final void verifyOffsets(final int arrayLength, final int offset, final int length) {
        Preconditions.checkArgument(offset >= 0 && length >= 0 && offset + length <= arrayLength,
                "invalid argument(s) (offset=%s, length=%s) for input array of %s element", offset, length,
                arrayLength);
    }
}
