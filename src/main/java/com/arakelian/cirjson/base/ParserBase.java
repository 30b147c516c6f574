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

import com.arakelian.cirjson.Base64Variant;
import com.arakelian.cirjson.CirJsonLocation;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonReadFeature;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.CirJsonTokenId;
import com.arakelian.cirjson.ObjectReadContext;
import com.arakelian.cirjson.StreamReadConstraints;
import com.arakelian.cirjson.StreamReadFeature;
import com.arakelian.cirjson.exc.InputCoercionException;
import com.arakelian.cirjson.exc.StreamReadException;
import com.arakelian.cirjson.io.ContentReference;
import com.arakelian.cirjson.io.IOContext;
import com.arakelian.cirjson.io.NumberInput;
import com.arakelian.cirjson.json.CirJsonReadContext;
import com.arakelian.cirjson.json.DuplicateDetector;
import com.arakelian.cirjson.sym.PropertyNameMatcher;
import com.arakelian.cirjson.util.TextBuffer;

/**
 * State and accessors shared by all parsers: the current token, its text, lazily decoded numeric
 * values, input location tracking and resource release.
 */
public abstract class ParserBase extends CirJsonParser {
    protected static final int NR_UNKNOWN = 0;

    protected static final int NR_INT = 0x0001;

    protected static final int NR_LONG = 0x0002;

    protected static final int NR_BIGINT = 0x0004;

    protected static final int NR_DOUBLE = 0x0008;

    protected static final int NR_BIGDECIMAL = 0x0010;

    protected static final int NR_FLOAT = 0x0020;

    private static final BigInteger BI_MIN_INT = BigInteger.valueOf(Integer.MIN_VALUE);

    private static final BigInteger BI_MAX_INT = BigInteger.valueOf(Integer.MAX_VALUE);

    private static final BigInteger BI_MIN_LONG = BigInteger.valueOf(Long.MIN_VALUE);

    private static final BigInteger BI_MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);

    private static final BigDecimal BD_MIN_LONG = new BigDecimal(BI_MIN_LONG);

    private static final BigDecimal BD_MAX_LONG = new BigDecimal(BI_MAX_LONG);

    private static final BigDecimal BD_MIN_INT = new BigDecimal(BI_MIN_INT);

    private static final BigDecimal BD_MAX_INT = new BigDecimal(BI_MAX_INT);

    protected final IOContext ioContext;

    protected final StreamReadConstraints streamReadConstraints;

    protected boolean closed;

    /** Position of the next unit to read in the input buffer **/
    protected int inputPtr;

    /** One past the last valid unit in the input buffer **/
    protected int inputEnd;

    /** Number of units (bytes or chars) consumed before the start of the input buffer **/
    protected long currInputProcessed;

    /** Zero-based line of the read position **/
    protected int currInputRow;

    /** Absolute offset of the first unit of the current line **/
    protected long currInputRowStart;

    protected long tokenInputTotal;

    protected int tokenInputRow = 1;

    protected int tokenInputCol;

    protected CirJsonReadContext parsingContext;

    protected CirJsonToken currToken;

    protected final TextBuffer textBuffer;

    protected byte[] binaryValue;

    protected long tokenCount;

    protected int numTypesValid = NR_UNKNOWN;

    protected int numberInt;

    protected long numberLong;

    protected float numberFloat;

    protected double numberDouble;

    protected BigInteger numberBigInt;

    protected BigDecimal numberBigDecimal;

    protected boolean numberNegative;

    protected boolean numberIsNaN;

    protected int intLength;

    protected int fractLength;

    protected int expLength;

    protected ParserBase(
            final ObjectReadContext readCtxt,
            final IOContext ioContext,
            final int streamReadFeatures,
            final int formatReadFeatures) {
        super(readCtxt, streamReadFeatures, formatReadFeatures);
        this.ioContext = ioContext;
        this.streamReadConstraints = ioContext.getStreamReadConstraints();
        this.textBuffer = ioContext.constructReadConstrainedTextBuffer();
        final DuplicateDetector dups = StreamReadFeature.STRICT_DUPLICATE_DETECTION.enabledIn(streamReadFeatures)
                ? DuplicateDetector.rootDetector(this)
                : null;
        this.parsingContext = CirJsonReadContext.createRootContext(dups);
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            inputPtr = Math.max(inputPtr, inputEnd);
            closed = true;
            try {
                closeInput();
            } finally {
                releaseBuffers();
                ioContext.close();
            }
        }
    }

    /**
     * Closes the underlying input if the parser owns it or auto-close is enabled.
     *
     * @throws IOException
     *             if the input fails to close
     */
    protected abstract void closeInput() throws IOException;

    protected CirJsonLocation createLocation(final long offset, final int row, final int col) {
        return new CirJsonLocation(contentReference(), -1L, offset, row, col);
    }

    protected final ContentReference contentReference() {
        return isEnabled(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION) ? ioContext.contentReference()
                : ContentReference.redacted();
    }

    @Override
    public CirJsonLocation currentLocation() {
        final long offset = currInputProcessed + inputPtr;
        final int col = (int) (offset - currInputRowStart) + 1;
        return createLocation(offset, currInputRow + 1, col);
    }

    @Override
    public String currentName() {
        if (currToken == CirJsonToken.START_OBJECT || currToken == CirJsonToken.START_ARRAY) {
            final CirJsonReadContext parent = parsingContext.getParent();
            if (parent != null) {
                return parent.getCurrentName();
            }
        }
        return parsingContext.getCurrentName();
    }

    @Override
    public int currentNameMatch(final PropertyNameMatcher matcher) throws IOException {
        if (currToken == CirJsonToken.PROPERTY_NAME || currToken == CirJsonToken.CIRJSON_ID_PROPERTY_NAME) {
            return matcher.matchName(parsingContext.getCurrentName());
        }
        if (currToken == CirJsonToken.END_OBJECT) {
            return PropertyNameMatcher.MATCH_END_OBJECT;
        }
        return PropertyNameMatcher.MATCH_ODD_TOKEN;
    }

    @Override
    public CirJsonToken currentToken() {
        return currToken;
    }

    @Override
    public int currentTokenId() {
        return currToken == null ? CirJsonTokenId.ID_NO_TOKEN : currToken.id();
    }

    @Override
    public CirJsonLocation currentTokenLocation() {
        return createLocation(tokenInputTotal, tokenInputRow, tokenInputCol);
    }

    private void convertNumberToBigDecimal() throws IOException {
        if ((numTypesValid & NR_DOUBLE) != 0) {
            if (numberIsNaN) {
                throw new StreamReadException(this, "Cannot convert NaN or Infinity (" + getText() + ") to BigDecimal");
            }
            numberBigDecimal = NumberInput.parseBigDecimal(textBuffer.contentsAsString(), useFastBigNumberParser());
        } else if ((numTypesValid & NR_FLOAT) != 0) {
            numberBigDecimal = NumberInput.parseBigDecimal(textBuffer.contentsAsString(), useFastBigNumberParser());
        } else if ((numTypesValid & NR_BIGINT) != 0) {
            numberBigDecimal = new BigDecimal(numberBigInt);
        } else if ((numTypesValid & NR_LONG) != 0) {
            numberBigDecimal = BigDecimal.valueOf(numberLong);
        } else if ((numTypesValid & NR_INT) != 0) {
            numberBigDecimal = BigDecimal.valueOf(numberInt);
        } else {
            throwInternal();
        }
        numTypesValid |= NR_BIGDECIMAL;
    }

    private void convertNumberToBigInteger() throws IOException {
        if ((numTypesValid & NR_BIGDECIMAL) != 0) {
            streamReadConstraints.validateBigIntegerScale(numberBigDecimal.scale());
            numberBigInt = numberBigDecimal.toBigInteger();
        } else if ((numTypesValid & NR_LONG) != 0) {
            numberBigInt = BigInteger.valueOf(numberLong);
        } else if ((numTypesValid & NR_INT) != 0) {
            numberBigInt = BigInteger.valueOf(numberInt);
        } else if ((numTypesValid & (NR_DOUBLE | NR_FLOAT)) != 0) {
            convertNumberToBigDecimal();
            streamReadConstraints.validateBigIntegerScale(numberBigDecimal.scale());
            numberBigInt = numberBigDecimal.toBigInteger();
        } else {
            throwInternal();
        }
        numTypesValid |= NR_BIGINT;
    }

    private void convertNumberToDouble() throws IOException {
        if ((numTypesValid & NR_BIGDECIMAL) != 0) {
            numberDouble = numberBigDecimal.doubleValue();
        } else if ((numTypesValid & NR_FLOAT) != 0) {
            numberDouble = numberFloat;
        } else if ((numTypesValid & NR_BIGINT) != 0) {
            numberDouble = numberBigInt.doubleValue();
        } else if ((numTypesValid & NR_LONG) != 0) {
            numberDouble = numberLong;
        } else if ((numTypesValid & NR_INT) != 0) {
            numberDouble = numberInt;
        } else {
            throwInternal();
        }
        numTypesValid |= NR_DOUBLE;
    }

    private void convertNumberToFloat() throws IOException {
        if ((numTypesValid & NR_BIGDECIMAL) != 0) {
            numberFloat = numberBigDecimal.floatValue();
        } else if ((numTypesValid & NR_DOUBLE) != 0) {
            numberFloat = (float) numberDouble;
        } else if ((numTypesValid & NR_BIGINT) != 0) {
            numberFloat = numberBigInt.floatValue();
        } else if ((numTypesValid & NR_LONG) != 0) {
            numberFloat = numberLong;
        } else if ((numTypesValid & NR_INT) != 0) {
            numberFloat = numberInt;
        } else {
            throwInternal();
        }
        numTypesValid |= NR_FLOAT;
    }

    private void convertNumberToInt() throws IOException {
        if ((numTypesValid & NR_LONG) != 0) {
            final int result = (int) numberLong;
            if (result != numberLong) {
                reportOverflowInt(getText());
            }
            numberInt = result;
        } else if ((numTypesValid & NR_BIGINT) != 0) {
            if (BI_MIN_INT.compareTo(numberBigInt) > 0 || BI_MAX_INT.compareTo(numberBigInt) < 0) {
                reportOverflowInt(getText());
            }
            numberInt = numberBigInt.intValue();
        } else if ((numTypesValid & NR_DOUBLE) != 0) {
            if (numberDouble < Integer.MIN_VALUE || numberDouble > Integer.MAX_VALUE || numberIsNaN) {
                reportOverflowInt(getText());
            }
            numberInt = (int) numberDouble;
        } else if ((numTypesValid & NR_FLOAT) != 0) {
            if (numberFloat < Integer.MIN_VALUE || numberFloat > Integer.MAX_VALUE) {
                reportOverflowInt(getText());
            }
            numberInt = (int) numberFloat;
        } else if ((numTypesValid & NR_BIGDECIMAL) != 0) {
            if (BD_MIN_INT.compareTo(numberBigDecimal) > 0 || BD_MAX_INT.compareTo(numberBigDecimal) < 0) {
                reportOverflowInt(getText());
            }
            numberInt = numberBigDecimal.intValue();
        } else {
            throwInternal();
        }
        numTypesValid |= NR_INT;
    }

    private void convertNumberToLong() throws IOException {
        if ((numTypesValid & NR_INT) != 0) {
            numberLong = numberInt;
        } else if ((numTypesValid & NR_BIGINT) != 0) {
            if (BI_MIN_LONG.compareTo(numberBigInt) > 0 || BI_MAX_LONG.compareTo(numberBigInt) < 0) {
                reportOverflowLong(getText());
            }
            numberLong = numberBigInt.longValue();
        } else if ((numTypesValid & NR_DOUBLE) != 0) {
            if (numberDouble < Long.MIN_VALUE || numberDouble > Long.MAX_VALUE || numberIsNaN) {
                reportOverflowLong(getText());
            }
            numberLong = (long) numberDouble;
        } else if ((numTypesValid & NR_FLOAT) != 0) {
            if (numberFloat < Long.MIN_VALUE || numberFloat > Long.MAX_VALUE) {
                reportOverflowLong(getText());
            }
            numberLong = (long) numberFloat;
        } else if ((numTypesValid & NR_BIGDECIMAL) != 0) {
            if (BD_MIN_LONG.compareTo(numberBigDecimal) > 0 || BD_MAX_LONG.compareTo(numberBigDecimal) < 0) {
                reportOverflowLong(getText());
            }
            numberLong = numberBigDecimal.longValue();
        } else {
            throwInternal();
        }
        numTypesValid |= NR_LONG;
    }

    @Override
    public BigInteger getBigIntegerValue() throws IOException {
        if ((numTypesValid & NR_BIGINT) == 0) {
            if (numTypesValid == NR_UNKNOWN) {
                parseNumericValue(NR_BIGINT);
            }
            if ((numTypesValid & NR_BIGINT) == 0) {
                convertNumberToBigInteger();
            }
        }
        return numberBigInt;
    }

    @Override
    public byte[] getBinaryValue(final Base64Variant variant) throws IOException {
        if (currToken != CirJsonToken.VALUE_STRING) {
            throw new StreamReadException(this, "Current token (" + currToken
                    + ") not VALUE_STRING, can not access as binary");
        }
        if (binaryValue == null) {
            try {
                binaryValue = variant.decode(getText());
            } catch (final IllegalArgumentException e) {
                throw new StreamReadException(this,
                        "Failed to decode VALUE_STRING as base64 (" + variant + "): " + e.getMessage(), e);
            }
        }
        return binaryValue;
    }

    @Override
    public BigDecimal getDecimalValue() throws IOException {
        if ((numTypesValid & NR_BIGDECIMAL) == 0) {
            if (numTypesValid == NR_UNKNOWN) {
                parseNumericValue(NR_BIGDECIMAL);
            }
            if ((numTypesValid & NR_BIGDECIMAL) == 0) {
                convertNumberToBigDecimal();
            }
        }
        return numberBigDecimal;
    }

    @Override
    public double getDoubleValue() throws IOException {
        if ((numTypesValid & NR_DOUBLE) == 0) {
            if (numTypesValid == NR_UNKNOWN) {
                parseNumericValue(NR_DOUBLE);
            }
            if ((numTypesValid & NR_DOUBLE) == 0) {
                convertNumberToDouble();
            }
        }
        return numberDouble;
    }

    @Override
    public Object getEmbeddedObject() throws IOException {
        return null;
    }

    @Override
    public float getFloatValue() throws IOException {
        if ((numTypesValid & NR_FLOAT) == 0) {
            if (numTypesValid == NR_UNKNOWN) {
                parseNumericValue(NR_FLOAT);
            }
            if ((numTypesValid & NR_FLOAT) == 0) {
                convertNumberToFloat();
            }
        }
        return numberFloat;
    }

    @Override
    public int getIntValue() throws IOException {
        if ((numTypesValid & NR_INT) == 0) {
            if (numTypesValid == NR_UNKNOWN) {
                return parseIntValue();
            }
            convertNumberToInt();
        }
        return numberInt;
    }

    @Override
    public long getLongValue() throws IOException {
        if ((numTypesValid & NR_LONG) == 0) {
            if (numTypesValid == NR_UNKNOWN) {
                parseNumericValue(NR_LONG);
            }
            if ((numTypesValid & NR_LONG) == 0) {
                convertNumberToLong();
            }
        }
        return numberLong;
    }

    @Override
    public NumberType getNumberType() throws IOException {
        if (numTypesValid == NR_UNKNOWN) {
            parseNumericValue(NR_UNKNOWN);
        }
        if (currToken == CirJsonToken.VALUE_NUMBER_INT) {
            if ((numTypesValid & NR_INT) != 0) {
                return NumberType.INT;
            }
            if ((numTypesValid & NR_LONG) != 0) {
                return NumberType.LONG;
            }
            return NumberType.BIG_INTEGER;
        }
        if ((numTypesValid & NR_BIGDECIMAL) != 0) {
            return NumberType.BIG_DECIMAL;
        }
        if ((numTypesValid & NR_FLOAT) != 0) {
            return NumberType.FLOAT;
        }
        return NumberType.DOUBLE;
    }

    @Override
    public Number getNumberValue() throws IOException {
        if (numTypesValid == NR_UNKNOWN) {
            parseNumericValue(NR_UNKNOWN);
        }
        if (currToken == CirJsonToken.VALUE_NUMBER_INT) {
            if ((numTypesValid & NR_INT) != 0) {
                return numberInt;
            }
            if ((numTypesValid & NR_LONG) != 0) {
                return numberLong;
            }
            if ((numTypesValid & NR_BIGINT) != 0) {
                return numberBigInt;
            }
            throwInternal();
        }
        if ((numTypesValid & NR_BIGDECIMAL) != 0) {
            return numberBigDecimal;
        }
        if ((numTypesValid & NR_FLOAT) != 0) {
            return numberFloat;
        }
        if ((numTypesValid & NR_DOUBLE) == 0) {
            throwInternal();
        }
        return numberDouble;
    }

    @Override
    public CirJsonReadContext getParsingContext() {
        return parsingContext;
    }

    @Override
    public StreamReadConstraints getStreamReadConstraints() {
        return streamReadConstraints;
    }

    @Override
    public String getText() throws IOException {
        final CirJsonToken t = currToken;
        if (t == null) {
            return null;
        }
        switch (t.id()) {
        case CirJsonTokenId.ID_PROPERTY_NAME:
        case CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME:
            return parsingContext.getCurrentName();
        case CirJsonTokenId.ID_STRING:
        case CirJsonTokenId.ID_NUMBER_INT:
        case CirJsonTokenId.ID_NUMBER_FLOAT:
            return textBuffer.contentsAsString();
        default:
            return t.asString();
        }
    }

    @Override
    public char[] getTextCharacters() throws IOException {
        final CirJsonToken t = currToken;
        if (t == null) {
            return null;
        }
        switch (t.id()) {
        case CirJsonTokenId.ID_PROPERTY_NAME:
        case CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME:
            return parsingContext.getCurrentName().toCharArray();
        case CirJsonTokenId.ID_STRING:
        case CirJsonTokenId.ID_NUMBER_INT:
        case CirJsonTokenId.ID_NUMBER_FLOAT:
            return textBuffer.getTextBuffer();
        default:
            return t.asCharArray();
        }
    }

    @Override
    public int getTextLength() throws IOException {
        final CirJsonToken t = currToken;
        if (t == null) {
            return 0;
        }
        switch (t.id()) {
        case CirJsonTokenId.ID_PROPERTY_NAME:
        case CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME:
            return parsingContext.getCurrentName().length();
        case CirJsonTokenId.ID_STRING:
        case CirJsonTokenId.ID_NUMBER_INT:
        case CirJsonTokenId.ID_NUMBER_FLOAT:
            return textBuffer.size();
        default:
            final char[] chars = t.asCharArray();
            return chars == null ? 0 : chars.length;
        }
    }

    @Override
    public int getTextOffset() throws IOException {
        final CirJsonToken t = currToken;
        if (t == null) {
            return 0;
        }
        switch (t.id()) {
        case CirJsonTokenId.ID_STRING:
        case CirJsonTokenId.ID_NUMBER_INT:
        case CirJsonTokenId.ID_NUMBER_FLOAT:
            return textBuffer.getTextOffset();
        default:
            return 0;
        }
    }

    @Override
    public boolean hasTextCharacters() {
        if (currToken == CirJsonToken.VALUE_STRING) {
            return textBuffer.hasTextAsCharacters();
        }
        return false;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public boolean isNaN() throws IOException {
        return currToken == CirJsonToken.VALUE_NUMBER_FLOAT && numberIsNaN;
    }

    private int parseIntValue() throws IOException {
        if (closed) {
            throw new StreamReadException(this, "Internal error: number value requested after parser was closed");
        }
        if (currToken == CirJsonToken.VALUE_NUMBER_INT && intLength <= 9) {
            numberInt = textBuffer.contentsAsInt(numberNegative);
            numTypesValid = NR_INT;
            return numberInt;
        }
        parseNumericValue(NR_INT);
        if ((numTypesValid & NR_INT) == 0) {
            convertNumberToInt();
        }
        return numberInt;
    }

    /**
     * Decodes the text of the current numeric token into the narrowest fitting representation.
     *
     * @param expType
     *            one of the <code>NR_</code> flags, the type the caller wants
     * @throws IOException
     *             if the current token is not a number
     */
    protected void parseNumericValue(final int expType) throws IOException {
        if (closed) {
            throw new StreamReadException(this, "Internal error: number value requested after parser was closed");
        }
        if (currToken == CirJsonToken.VALUE_NUMBER_INT) {
            final int len = intLength;
            if (len <= 9) {
                numberInt = textBuffer.contentsAsInt(numberNegative);
                numTypesValid = NR_INT;
                return;
            }
            if (len <= 18) {
                final long l = textBuffer.contentsAsLong(numberNegative);
                if (len == 10 && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                    numberInt = (int) l;
                    numTypesValid = NR_INT;
                    return;
                }
                numberLong = l;
                numTypesValid = NR_LONG;
                return;
            }
            final String numStr = textBuffer.contentsAsString();
            if (len == 19) {
                final String digits = numberNegative ? numStr.substring(1) : numStr;
                if (NumberInput.inLongRange(digits, numberNegative)) {
                    numberLong = Long.parseLong(numStr);
                    numTypesValid = NR_LONG;
                    return;
                }
            }
            streamReadConstraints.validateIntegerLength(len);
            try {
                numberBigInt = NumberInput.parseBigInteger(numStr, useFastBigNumberParser());
            } catch (final NumberFormatException e) {
                throw new StreamReadException(this, "Malformed numeric value (" + numStr + ")", e);
            }
            numTypesValid = NR_BIGINT;
            return;
        }
        if (currToken == CirJsonToken.VALUE_NUMBER_FLOAT) {
            final String numStr = textBuffer.contentsAsString();
            try {
                if (expType == NR_BIGDECIMAL) {
                    numberBigDecimal = NumberInput.parseBigDecimal(numStr, useFastBigNumberParser());
                    numTypesValid = NR_BIGDECIMAL;
                } else if (expType == NR_FLOAT) {
                    numberFloat = NumberInput.parseFloat(numStr, useFastDoubleParser());
                    numTypesValid = NR_FLOAT;
                } else {
                    numberDouble = NumberInput.parseDouble(numStr, useFastDoubleParser());
                    numTypesValid = NR_DOUBLE;
                }
            } catch (final NumberFormatException e) {
                throw new StreamReadException(this, "Malformed numeric value (" + numStr + ")", e);
            }
            return;
        }
        throw new StreamReadException(this,
                "Current token (" + currToken + ") not numeric, can not use numeric value accessors");
    }

    protected void releaseBuffers() throws IOException {
        textBuffer.releaseBuffers();
    }

    protected void reportOverflowInt(final String numDesc) throws InputCoercionException {
        throw new InputCoercionException(this,
                String.format("Numeric value (%s) out of range of int (%d - %s)", numDesc, Integer.MIN_VALUE,
                        Integer.MAX_VALUE),
                currToken, Integer.TYPE);
    }

    protected void reportOverflowLong(final String numDesc) throws InputCoercionException {
        throw new InputCoercionException(this,
                String.format("Numeric value (%s) out of range of long (%d - %s)", numDesc, Long.MIN_VALUE,
                        Long.MAX_VALUE),
                currToken, Long.TYPE);
    }

    /**
     * Resets numeric state for a floating point token.
     *
     * @param negative
     *            true if the value has a minus sign
     * @param intLen
     *            number of integer digits
     * @param fractLen
     *            number of fraction digits
     * @param expLen
     *            number of exponent digits
     * @return {@link CirJsonToken#VALUE_NUMBER_FLOAT}
     */
    protected final CirJsonToken resetFloat(
            final boolean negative,
            final int intLen,
            final int fractLen,
            final int expLen) {
        numberNegative = negative;
        numberIsNaN = false;
        intLength = intLen;
        fractLength = fractLen;
        expLength = expLen;
        numTypesValid = NR_UNKNOWN;
        return CirJsonToken.VALUE_NUMBER_FLOAT;
    }

    protected final CirJsonToken resetInt(final boolean negative, final int intLen) {
        numberNegative = negative;
        numberIsNaN = false;
        intLength = intLen;
        fractLength = 0;
        expLength = 0;
        numTypesValid = NR_UNKNOWN;
        return CirJsonToken.VALUE_NUMBER_INT;
    }

    protected final CirJsonToken resetAsNaN(final String valueStr, final double value) throws IOException {
        textBuffer.resetWithString(valueStr);
        numberDouble = value;
        numTypesValid = NR_DOUBLE;
        numberIsNaN = true;
        return CirJsonToken.VALUE_NUMBER_FLOAT;
    }

    @Override
    public CirJsonParser skipChildren() throws IOException {
        if (currToken != CirJsonToken.START_OBJECT && currToken != CirJsonToken.START_ARRAY) {
            return this;
        }
        int open = 1;
        for (;;) {
            final CirJsonToken t = nextToken();
            if (t == null) {
                throw new StreamReadException(this, "Unexpected end-of-input while skipping children of "
                        + parsingContext.typeDesc());
            }
            if (t.isStructStart()) {
                ++open;
            } else if (t.isStructEnd()) {
                if (--open == 0) {
                    return this;
                }
            }
        }
    }

    @Override
    public Object streamReadInputSource() {
        return ioContext.contentReference().getRawContent();
    }

    private void throwInternal() {
        throw new IllegalStateException("Internal error: this code path should never get executed");
    }

    protected final boolean useFastBigNumberParser() {
        return isEnabled(StreamReadFeature.USE_FAST_BIG_NUMBER_PARSER);
    }

    protected final boolean useFastDoubleParser() {
        return isEnabled(StreamReadFeature.USE_FAST_DOUBLE_PARSER);
    }

    protected final boolean allows(final CirJsonReadFeature f) {
        return f.enabledIn(formatReadFeatures);
    }
}
