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
package com.arakelian.cirjson.json;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import com.arakelian.cirjson.Base64Variant;
import com.arakelian.cirjson.CirJsonWriteFeature;
import com.arakelian.cirjson.ObjectWriteContext;
import com.arakelian.cirjson.PrettyPrinter;
import com.arakelian.cirjson.SerializableString;
import com.arakelian.cirjson.StreamWriteFeature;
import com.arakelian.cirjson.base.GeneratorBase;
import com.arakelian.cirjson.exc.CirJsonIOException;
import com.arakelian.cirjson.exc.StreamWriteException;
import com.arakelian.cirjson.io.CharTypes;
import com.arakelian.cirjson.io.CharacterEscapes;
import com.arakelian.cirjson.io.IOContext;
import com.arakelian.cirjson.io.NumberOutput;

/**
 * Writes CirJSON tokens as characters. Subclasses decide how characters reach the output target.
 */
public abstract class CirJsonGeneratorBase extends GeneratorBase {
    private static final char[] NULL_CHARS = "null".toCharArray();

    private static final char[] TRUE_CHARS = "true".toCharArray();

    private static final char[] FALSE_CHARS = "false".toCharArray();

    /** Escape codes for 7-bit characters; 0 means no escaping **/
    protected final int[] outputEscapes;

    /** Custom escaping, or null **/
    protected final CharacterEscapes characterEscapes;

    protected final char[] hexChars;

    protected final boolean escapeNonAscii;

    protected final boolean quoteNames;

    /** Written between root-level values when there is no pretty printer **/
    protected final SerializableString rootValueSeparator;

    private final char[] numberBuffer = new char[24];

    protected CirJsonGeneratorBase(
            final ObjectWriteContext writeCtxt,
            final IOContext ioContext,
            final int streamWriteFeatures,
            final int formatWriteFeatures,
            final PrettyPrinter prettyPrinter,
            final SerializableString rootValueSeparator,
            final CharacterEscapes characterEscapes) {
        super(writeCtxt, ioContext, streamWriteFeatures, formatWriteFeatures, prettyPrinter);
        this.characterEscapes = characterEscapes;
        this.outputEscapes = characterEscapes != null ? characterEscapes.getEscapeCodesForAscii()
                : CharTypes.getSevenBitOutputEscapes(
                        CirJsonWriteFeature.ESCAPE_FORWARD_SLASHES.enabledIn(formatWriteFeatures));
        this.hexChars = CharTypes.copyHexChars(CirJsonWriteFeature.WRITE_HEX_UPPER_CASE.enabledIn(formatWriteFeatures));
        this.escapeNonAscii = CirJsonWriteFeature.ESCAPE_NON_ASCII.enabledIn(formatWriteFeatures);
        this.quoteNames = CirJsonWriteFeature.QUOTE_PROPERTY_NAMES.enabledIn(formatWriteFeatures);
        this.rootValueSeparator = rootValueSeparator;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            if (writeContext != null && isEnabled(StreamWriteFeature.AUTO_CLOSE_CONTENT)) {
                closeOpenContent();
            }
        } finally {
            closed = true;
            try {
                flushBuffer();
                closeOutput(ioContext.isResourceManaged() || isEnabled(StreamWriteFeature.AUTO_CLOSE_TARGET));
            } finally {
                releaseBuffers();
                ioContext.close();
            }
        }
    }

    @Override
    public CharacterEscapes getCharacterEscapes() {
        return characterEscapes;
    }

    @Override
    public void flush() throws IOException {
        flushBuffer();
        if (isEnabled(StreamWriteFeature.FLUSH_PASSED_TO_STREAM)) {
            flushOutput();
        }
    }

    @Override
    public void writeBinary(final Base64Variant variant, final byte[] data, final int offset, final int length)
            throws IOException {
        verifyOffsets(data.length, offset, length);
        writeSeparator(verifyValueWrite(WRITE_BINARY));
        emit('"');
        final String encoded = variant.encode(data, offset, length);
        emit(encoded, 0, encoded.length());
        emit('"');
    }

    @Override
    public void writeBoolean(final boolean state) throws IOException {
        writeSeparator(verifyValueWrite(WRITE_BOOLEAN));
        final char[] text = state ? TRUE_CHARS : FALSE_CHARS;
        emit(text, 0, text.length);
    }

    @Override
    public void writeEndArray() throws IOException {
        verifyEndWrite(true);
        if (prettyPrinter != null) {
            prettyPrinter.writeEndArray(this, writeContext.getEntryCount());
        } else {
            emit(']');
        }
        writeContext = writeContext.clearAndGetParent();
    }

    @Override
    public void writeEndObject() throws IOException {
        verifyEndWrite(false);
        if (prettyPrinter != null) {
            prettyPrinter.writeEndObject(this, writeContext.getEntryCount());
        } else {
            emit('}');
        }
        writeContext = writeContext.clearAndGetParent();
    }

    @Override
    public void writeName(final SerializableString name) throws IOException {
        writeName(name.getValue());
    }

    @Override
    public void writeName(final String name) throws IOException {
        final int status = verifyNameWrite(name);
        if (prettyPrinter != null) {
            if (status == CirJsonWriteContext.STATUS_OK_AFTER_COMMA) {
                prettyPrinter.writeObjectEntrySeparator(this);
            } else {
                prettyPrinter.beforeObjectEntries(this);
            }
        } else if (status == CirJsonWriteContext.STATUS_OK_AFTER_COMMA) {
            emit(',');
        }
        if (quoteNames) {
            emit('"');
            emitEscaped(name, 0, name.length());
            emit('"');
        } else {
            emitEscaped(name, 0, name.length());
        }
    }

    @Override
    public void writeNull() throws IOException {
        writeSeparator(verifyValueWrite(WRITE_NULL));
        emit(NULL_CHARS, 0, NULL_CHARS.length);
    }

    @Override
    public void writeNumber(final BigDecimal value) throws IOException {
        if (value == null) {
            writeNull();
            return;
        }
        final String text = isEnabled(StreamWriteFeature.WRITE_BIG_DECIMAL_AS_PLAIN) ? toPlainString(value)
                : value.toString();
        writeNumberText(text, numbersAsStrings());
    }

    @Override
    public void writeNumber(final BigInteger value) throws IOException {
        if (value == null) {
            writeNull();
            return;
        }
        writeNumberText(value.toString(), numbersAsStrings());
    }

    @Override
    public void writeNumber(final double value) throws IOException {
        final boolean quote = numbersAsStrings()
                || !Double.isFinite(value) && isEnabled(CirJsonWriteFeature.WRITE_NAN_AS_STRINGS);
        writeNumberText(NumberOutput.toString(value, isEnabled(StreamWriteFeature.USE_FAST_DOUBLE_WRITER)), quote);
    }

    @Override
    public void writeNumber(final float value) throws IOException {
        final boolean quote = numbersAsStrings()
                || !Float.isFinite(value) && isEnabled(CirJsonWriteFeature.WRITE_NAN_AS_STRINGS);
        writeNumberText(NumberOutput.toString(value, isEnabled(StreamWriteFeature.USE_FAST_DOUBLE_WRITER)), quote);
    }

    @Override
    public void writeNumber(final int value) throws IOException {
        writeSeparator(verifyValueWrite(WRITE_NUMBER));
        final boolean quote = numbersAsStrings();
        if (quote) {
            emit('"');
        }
        final int end = NumberOutput.outputInt(value, numberBuffer, 0);
        emit(numberBuffer, 0, end);
        if (quote) {
            emit('"');
        }
    }

    @Override
    public void writeNumber(final long value) throws IOException {
        writeSeparator(verifyValueWrite(WRITE_NUMBER));
        final boolean quote = numbersAsStrings();
        if (quote) {
            emit('"');
        }
        final int end = NumberOutput.outputLong(value, numberBuffer, 0);
        emit(numberBuffer, 0, end);
        if (quote) {
            emit('"');
        }
    }

    @Override
    public void writeNumber(final String encodedValue) throws IOException {
        if (encodedValue == null) {
            writeNull();
            return;
        }
        writeNumberText(encodedValue, numbersAsStrings());
    }

    @Override
    public void writeRaw(final char c) throws IOException {
        emit(c);
    }

    @Override
    public void writeRaw(final char[] text, final int offset, final int len) throws IOException {
        verifyOffsets(text.length, offset, len);
        emit(text, offset, len);
    }

    @Override
    public void writeRaw(final String text, final int offset, final int len) throws IOException {
        verifyOffsets(text.length(), offset, len);
        emit(text, offset, len);
    }

    @Override
    public void writeRawUTF8String(final byte[] buffer, final int offset, final int len) throws IOException {
        verifyOffsets(buffer.length, offset, len);
        final String text = new String(buffer, offset, len, StandardCharsets.UTF_8);
        writeSeparator(verifyStringWrite(text, null, 0, 0));
        emit('"');
        emit(text, 0, text.length());
        emit('"');
    }

    @Override
    public void writeRawValue(final String text, final int offset, final int len) throws IOException {
        verifyOffsets(text.length(), offset, len);
        writeSeparator(verifyValueWrite(WRITE_RAW));
        emit(text, offset, len);
    }

    @Override
    public void writeStartArray(final Object currentValue) throws IOException {
        writeSeparator(verifyValueWrite(START_ARRAY));
        writeContext = writeContext.createChildArrayContext(currentValue);
        streamWriteConstraints.validateNestingDepth(writeContext.getNestingDepth());
        if (prettyPrinter != null) {
            prettyPrinter.writeStartArray(this);
        } else {
            emit('[');
        }
    }

    @Override
    public void writeStartObject(final Object currentValue) throws IOException {
        writeSeparator(verifyValueWrite(START_OBJECT));
        writeContext = writeContext.createChildObjectContext(currentValue);
        streamWriteConstraints.validateNestingDepth(writeContext.getNestingDepth());
        if (prettyPrinter != null) {
            prettyPrinter.writeStartObject(this);
        } else {
            emit('{');
        }
    }

    @Override
    public void writeString(final char[] text, final int offset, final int len) throws IOException {
        if (text == null) {
            writeNull();
            return;
        }
        verifyOffsets(text.length, offset, len);
        writeSeparator(verifyStringWrite(null, text, offset, len));
        emit('"');
        emitEscaped(text, offset, len);
        emit('"');
    }

    @Override
    public void writeString(final SerializableString text) throws IOException {
        writeString(text != null ? text.getValue() : null);
    }

    @Override
    public void writeString(final String text) throws IOException {
        if (text == null) {
            writeNull();
            return;
        }
        writeSeparator(verifyStringWrite(text, null, 0, 0));
        emit('"');
        emitEscaped(text, 0, text.length());
        emit('"');
    }

    @Override
    public void writeUTF8String(final byte[] buffer, final int offset, final int len) throws IOException {
        verifyOffsets(buffer.length, offset, len);
        writeString(new String(buffer, offset, len, StandardCharsets.UTF_8));
    }

    /**
     * Closes or flushes the output target once all buffered content has been written.
     *
     * @param closeTarget
     *            true if the target itself should be closed
     * @throws IOException
     *             if the target fails
     */
    protected abstract void closeOutput(boolean closeTarget) throws IOException;

    protected abstract void emit(char c) throws IOException;

    protected abstract void emit(char[] text, int offset, int len) throws IOException;

    protected abstract void emit(String text, int offset, int len) throws IOException;

    protected abstract void flushBuffer() throws IOException;

    protected abstract void flushOutput() throws IOException;

    protected abstract void releaseBuffers();

    /**
     * Wraps a failure of the underlying output target.
     *
     * @param e
     *            transport failure
     * @return exception to throw
     */
    protected final IOException wrapIOFailure(final IOException e) {
        return CirJsonIOException.wrap(e);
    }

    /**
     * Writes the separator that precedes a value, given the status returned by the write context.
     *
     * @param status
     *            one of the <code>STATUS_</code> codes of {@link CirJsonWriteContext}
     * @throws IOException
     *             if the separator cannot be written
     */
    protected final void writeSeparator(final int status) throws IOException {
        if (prettyPrinter != null) {
            switch (status) {
            case CirJsonWriteContext.STATUS_OK_AFTER_COMMA:
                prettyPrinter.writeArrayValueSeparator(this);
                break;
            case CirJsonWriteContext.STATUS_OK_AFTER_COLON:
                prettyPrinter.writeObjectNameValueSeparator(this);
                break;
            case CirJsonWriteContext.STATUS_OK_AFTER_SPACE:
                prettyPrinter.writeRootValueSeparator(this);
                break;
            default:
                if (writeContext.isInArray()) {
                    prettyPrinter.beforeArrayValues(this);
                }
                break;
            }
            return;
        }
        switch (status) {
        case CirJsonWriteContext.STATUS_OK_AFTER_COMMA:
            emit(',');
            break;
        case CirJsonWriteContext.STATUS_OK_AFTER_COLON:
            emit(':');
            break;
        case CirJsonWriteContext.STATUS_OK_AFTER_SPACE:
            if (rootValueSeparator != null) {
                final String sep = rootValueSeparator.getValue();
                emit(sep, 0, sep.length());
            }
            break;
        default:
            break;
        }
    }

    private void emitEscape(final char c) throws IOException {
        final int esc = c < 128 ? outputEscapes[c] : CharTypes.ESCAPE_STANDARD;
        if (characterEscapes != null && (esc == CharacterEscapes.ESCAPE_CUSTOM || c >= 128)) {
            final SerializableString seq = characterEscapes.getEscapeSequence(c);
            if (seq != null) {
                final String text = seq.getValue();
                emit(text, 0, text.length());
                return;
            }
            if (esc == CharacterEscapes.ESCAPE_CUSTOM) {
                throw new StreamWriteException(this,
                        "Invalid custom escape definitions; custom escape not found for character code 0x"
                                + Integer.toHexString(c) + ", although was supposed to have one");
            }
        }
        emit('\\');
        if (esc > 0) {
            emit((char) esc);
            return;
        }
        emit('u');
        emit(hexChars[c >> 12 & 0xF]);
        emit(hexChars[c >> 8 & 0xF]);
        emit(hexChars[c >> 4 & 0xF]);
        emit(hexChars[c & 0xF]);
    }

    private void emitEscaped(final char[] text, final int offset, final int len) throws IOException {
        final int end = offset + len;
        int start = offset;
        for (int i = offset; i < end; i++) {
            final char c = text[i];
            if (!needsEscape(c)) {
                continue;
            }
            if (i > start) {
                emit(text, start, i - start);
            }
            emitEscape(c);
            start = i + 1;
        }
        if (end > start) {
            emit(text, start, end - start);
        }
    }

    private void emitEscaped(final String text, final int offset, final int len) throws IOException {
        final int end = offset + len;
        int start = offset;
        for (int i = offset; i < end; i++) {
            final char c = text.charAt(i);
            if (!needsEscape(c)) {
                continue;
            }
            if (i > start) {
                emit(text, start, i - start);
            }
            emitEscape(c);
            start = i + 1;
        }
        if (end > start) {
            emit(text, start, end - start);
        }
    }

    private boolean needsEscape(final char c) {
        if (c < 128) {
            return outputEscapes[c] != 0;
        }
        return escapeNonAscii || characterEscapes != null && characterEscapes.getEscapeSequence(c) != null;
    }

    private boolean numbersAsStrings() {
        return isEnabled(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS);
    }

    private void writeNumberText(final String text, final boolean quote) throws IOException {
        writeSeparator(verifyValueWrite(WRITE_NUMBER));
        if (quote) {
            emit('"');
        }
        emit(text, 0, text.length());
        if (quote) {
            emit('"');
        }
    }
}
