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

package com.arakelian.cirjson.base;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.Map;

import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.CirJsonWriteFeature;
import com.arakelian.cirjson.ObjectWriteContext;
import com.arakelian.cirjson.PrettyPrinter;
import com.arakelian.cirjson.StreamWriteConstraints;
import com.arakelian.cirjson.StreamWriteFeature;
import com.arakelian.cirjson.exc.StreamWriteException;
import com.arakelian.cirjson.io.IOContext;
import com.arakelian.cirjson.json.CirJsonWriteContext;
import com.arakelian.cirjson.json.DuplicateDetector;

/**
 * Generator state shared by all implementations: features, the output context, identifier
 * bookkeeping and the checks that keep written content valid CirJSON.
 */
public abstract class GeneratorBase extends CirJsonGenerator {
    protected static final String WRITE_BINARY = "write a binary value";

    protected static final String WRITE_BOOLEAN = "write a boolean value";

    protected static final String WRITE_NULL = "write a null";

    protected static final String WRITE_NUMBER = "write a number";

    protected static final String WRITE_RAW = "write a raw (unencoded) value";

    protected static final String WRITE_STRING = "write a string";

    protected static final String START_ARRAY = "start an array";

    protected static final String START_OBJECT = "start an object";

    /** Largest BigDecimal scale written in plain notation **/
    protected static final int MAX_BIG_DECIMAL_SCALE = 9999;

    protected final IOContext ioContext;

    protected final ObjectWriteContext objectWriteContext;

    protected final StreamWriteConstraints streamWriteConstraints;

    protected int streamWriteFeatures;

    protected int formatWriteFeatures;

    protected CirJsonWriteContext writeContext;

    protected PrettyPrinter prettyPrinter;

    protected boolean closed;

    /** Identifiers assigned so far, keyed by instance identity **/
    private final IdentityHashMap<Object, String> ids = new IdentityHashMap<>();

    private int nextId;

    protected GeneratorBase(
            final ObjectWriteContext writeCtxt,
            final IOContext ioContext,
            final int streamWriteFeatures,
            final int formatWriteFeatures,
            final PrettyPrinter prettyPrinter) {
        this.objectWriteContext = writeCtxt != null ? writeCtxt : ObjectWriteContext.empty();
        this.ioContext = ioContext;
        this.streamWriteConstraints = ioContext.getStreamWriteConstraints();
        this.streamWriteFeatures = streamWriteFeatures;
        this.formatWriteFeatures = formatWriteFeatures;
        this.prettyPrinter = prettyPrinter;
        final DuplicateDetector dups = StreamWriteFeature.STRICT_DUPLICATE_DETECTION.enabledIn(streamWriteFeatures)
                ? DuplicateDetector.rootDetector(this)
                : null;
        this.writeContext = CirJsonWriteContext.createRootContext(dups);
    }

    /**
     * Writes the end markers of all open containers.
     *
     * @throws IOException
     *             if a container cannot be closed
     */
    protected final void closeOpenContent() throws IOException {
        for (;;) {
            if (writeContext.isInArray()) {
                writeEndArray();
            } else if (writeContext.isInObject()) {
                if (writeContext.hasCurrentName()) {
                    writeNull();
                }
                writeEndObject();
            } else {
                break;
            }
        }
    }

    @Override
    public String getId(final Object target, final boolean isArray) {
        String id = ids.get(target);
        if (id == null) {
            id = Integer.toString(nextId++);
            ids.put(target, id);
        }
        return id;
    }

    @Override
    public ObjectWriteContext getObjectWriteContext() {
        return objectWriteContext;
    }

    @Override
    public PrettyPrinter getPrettyPrinter() {
        return prettyPrinter;
    }

    @Override
    public CirJsonWriteContext getStreamWriteContext() {
        return writeContext;
    }

    @Override
    public StreamWriteConstraints getStreamWriteConstraints() {
        return streamWriteConstraints;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public boolean isEnabled(final CirJsonWriteFeature f) {
        return f.enabledIn(formatWriteFeatures);
    }

    @Override
    public boolean isEnabled(final StreamWriteFeature f) {
        return f.enabledIn(streamWriteFeatures);
    }

    protected final void reportError(final String msg) throws StreamWriteException {
        throw new StreamWriteException(this, msg);
    }

    protected final String toPlainString(final BigDecimal value) throws StreamWriteException {
        final int scale = value.scale();
        if (scale < -MAX_BIG_DECIMAL_SCALE || scale > MAX_BIG_DECIMAL_SCALE) {
            reportError(String.format(
                    "Attempt to write plain `java.math.BigDecimal` (see StreamWriteFeature.WRITE_BIG_DECIMAL_AS_PLAIN) "
                            + "with illegal scale (%d): needs to be between [-%d, %d]",
                    scale, MAX_BIG_DECIMAL_SCALE, MAX_BIG_DECIMAL_SCALE));
        }
        return value.toPlainString();
    }

    /**
     * Checks that a container may be closed here, including that its identifier was written.
     *
     * @param array
     *            true for an array, false for an object
     * @throws StreamWriteException
     *             if the current context is not the expected container
     */
    protected final void verifyEndWrite(final boolean array) throws StreamWriteException {
        if (array ? !writeContext.isInArray() : !writeContext.isInObject()) {
            reportError("Current context not " + (array ? "Array" : "Object") + " but " + writeContext.typeDesc());
        }
        if (writeContext.isExpectingId()) {
            reportError("Can not close " + (array ? "Array" : "Object") + " without writing its identifier"
                    + (array ? "" : " '" + ID_NAME + "'"));
        }
        if (!array && writeContext.hasCurrentName()) {
            reportError("Can not close Object, expecting a value for property '" + writeContext.getCurrentName()
                    + "'");
        }
    }

    /**
     * Checks that the property name may be written here and records it.
     *
     * @param name
     *            property name
     * @return one of the <code>STATUS_</code> codes of {@link CirJsonWriteContext}
     * @throws StreamWriteException
     *             if a name is not expected, or breaks the identifier protocol
     */
    protected final int verifyNameWrite(final String name) throws StreamWriteException {
        if (writeContext.isInObject() && !writeContext.hasCurrentName()) {
            final boolean isId = ID_NAME.equals(name);
            if (writeContext.isExpectingId() && !isId) {
                reportError("Can not write property name '" + name + "', expecting '" + ID_NAME
                        + "' as the first property");
            }
            if (!writeContext.isExpectingId() && isId) {
                reportError("Can not write '" + ID_NAME + "' twice in the same Object");
            }
        }
        final int status = writeContext.writeName(name);
        if (status == CirJsonWriteContext.STATUS_EXPECT_VALUE) {
            reportError("Can not write a property name, expecting a value");
        }
        return status;
    }

    /**
     * Checks that a string value may be written here and records it as the container identifier
     * when it is one.
     *
     * @param text
     *            the string, or null if it is not cheaply available
     * @param chars
     *            characters of the string, used when <code>text</code> is null
     * @param offset
     *            offset into <code>chars</code>
     * @param len
     *            length in <code>chars</code>
     * @return one of the <code>STATUS_</code> codes of {@link CirJsonWriteContext}
     * @throws StreamWriteException
     *             if a value is not expected here
     */
    protected final int verifyStringWrite(final String text, final char[] chars, final int offset, final int len)
            throws StreamWriteException {
        if (writeContext.isExpectingIdValue()) {
            writeContext.setContainerId(text != null ? text : new String(chars, offset, len));
        }
        return verifyValue(WRITE_STRING);
    }

    /**
     * Checks that a non-string value may be written here.
     *
     * @param typeMsg
     *            description of the write, used in error messages
     * @return one of the <code>STATUS_</code> codes of {@link CirJsonWriteContext}
     * @throws StreamWriteException
     *             if a value is not expected here, or an identifier string is expected
     */
    protected final int verifyValueWrite(final String typeMsg) throws StreamWriteException {
        if (writeContext.isExpectingIdValue()) {
            reportError("Can not " + typeMsg + ", expecting " + (writeContext.isInArray() ? "the array identifier"
                    : "the value of '" + ID_NAME + "'") + " (a String)");
        }
        return verifyValue(typeMsg);
    }

    private int verifyValue(final String typeMsg) throws StreamWriteException {
        if (writeContext.isInObject() && writeContext.isExpectingId() && !writeContext.hasCurrentName()) {
            reportError("Can not " + typeMsg + ", expecting '" + ID_NAME + "' as the first property");
        }
        final int status = writeContext.writeValue();
        if (status == CirJsonWriteContext.STATUS_EXPECT_NAME) {
            reportError("Can not " + typeMsg + ", expecting a property name");
        }
        return status;
    }

    @Override
    public void writeObject(final Object value) throws IOException {
        if (value == null) {
            writeNull();
            return;
        }

        if (value instanceof CharSequence) {
            writeString(value.toString());
            return;
        }

        if (value instanceof Number) {
            writeNumberObject((Number) value);
            return;
        }

        if (value instanceof Boolean) {
            writeBoolean(((Boolean) value).booleanValue());
            return;
        }

        if (value instanceof byte[]) {
            writeBinary((byte[]) value);
            return;
        }

        if (value instanceof Map || value instanceof Collection || value instanceof Object[]) {
            if (ids.containsKey(value)) {
                // already written: refer to it by identifier
                writeString(ids.get(value));
                return;
            }
            if (value instanceof Map) {
                writeMap((Map<?, ?>) value);
            } else if (value instanceof Collection) {
                writeCollection((Collection<?>) value);
            } else {
                writeObjectArray((Object[]) value);
            }
            return;
        }

        objectWriteContext.writeValue(this, value);
    }

    private void writeCollection(final Collection<?> collection) throws IOException {
        writeStartArray(collection);
        writeArrayId(collection);
        for (final Object item : collection) {
            writeObject(item);
        }
        writeEndArray();
    }

    private void writeMap(final Map<?, ?> map) throws IOException {
        writeStartObject(map);
        writeObjectId(map);
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            writeName(String.valueOf(entry.getKey()));
            writeObject(entry.getValue());
        }
        writeEndObject();
    }

    private void writeNumberObject(final Number value) throws IOException {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            writeNumber(value.intValue());
        } else if (value instanceof Long) {
            writeNumber(value.longValue());
        } else if (value instanceof Double) {
            writeNumber(value.doubleValue());
        } else if (value instanceof Float) {
            writeNumber(value.floatValue());
        } else if (value instanceof BigDecimal) {
            writeNumber((BigDecimal) value);
        } else if (value instanceof BigInteger) {
            writeNumber((BigInteger) value);
        } else {
            writeNumber(value.toString());
        }
    }

    private void writeObjectArray(final Object[] array) throws IOException {
        writeStartArray(array);
        writeArrayId(array);
        for (final Object item : array) {
            writeObject(item);
        }
        writeEndArray();
    }
}
