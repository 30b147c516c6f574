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

package com.arakelian.cirjson.json.async;

import java.io.IOException;

import com.arakelian.cirjson.CirJsonReadFeature;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.ObjectReadContext;
import com.arakelian.cirjson.io.IOContext;
import com.arakelian.cirjson.json.UTF8StreamCirJsonParser;
import com.arakelian.cirjson.sym.ByteQuadsCanonicalizer;

/**
 * Parser fed with byte chunks by the caller instead of pulling from a stream. When the bytes
 * received so far end inside a token, {@link #nextToken()} returns
 * {@link CirJsonToken#NOT_AVAILABLE}; the partial token stays in the parser (decoded characters in
 * the text buffer, a pending escape or UTF-8 sequence in the minor state) and decoding resumes
 * with the next byte fed. Every byte is decoded once.
 *
 * <p>
 * The parser references the array passed to {@link #feedInput(byte[], int, int)} without copying
 * it, so the caller must not modify that range until {@link #needMoreInput()} returns true.
 * </p>
 *
 * <p>
 * Typical use:
 * </p>
 *
 * <pre>
 * parser.feedInput(chunk, 0, chunk.length);
 * CirJsonToken t;
 * while ((t = parser.nextToken()) != CirJsonToken.NOT_AVAILABLE &amp;&amp; t != null) {
 *     ...
 * }
 * </pre>
 */
public class NonBlockingByteArrayCirJsonParser extends UTF8StreamCirJsonParser {
    /** Token in progress when the input ran out **/
    private enum Minor {
        NONE,

        /** Inside a quoted string or property name **/
        STRING,

        /** Backslash read inside a string **/
        STRING_ESCAPE,

        /** Inside the four hex digits of a <code>\\u</code> escape **/
        STRING_UNICODE,

        /** Inside an unquoted property name **/
        UNQUOTED_NAME,

        /** Sign read, expecting the first digit **/
        NUMBER_SIGN,

        /** Expecting the first character of the magnitude **/
        NUMBER_START,

        /** Leading zero read **/
        NUMBER_ZERO,

        /** Skipping redundant leading zeroes **/
        NUMBER_ZEROES,

        NUMBER_INTEGER_DIGITS,

        NUMBER_FRACTION_DIGITS,

        /** Integer and fraction done, an exponent may follow **/
        NUMBER_EXPONENT_MARKER,

        /** Exponent marker read, a sign may follow **/
        NUMBER_EXPONENT_SIGN,

        NUMBER_EXPONENT_DIGITS,

        /** Inside <code>true</code>, <code>false</code>, <code>null</code> or a non-numeric number **/
        LITERAL,

        /** Leading plus read while plus signs are not allowed; only <code>+Infinity</code> remains **/
        PLUS_SIGN;
    }

    /** What a completed string turns into **/
    private enum StringKind {
        VALUE, ARRAY_ID, OBJECT_ID, PROPERTY_NAME, ID_PROPERTY_NAME;
    }

    /** Returned by {@link #readRaw()} when the bytes fed so far are exhausted **/
    private static final int NEED_INPUT = -3;

    private static final int COMMENT_NONE = 0;

    private static final int COMMENT_START = 1;

    private static final int COMMENT_LINE = 2;

    private static final int COMMENT_BLOCK = 3;

    private static final int COMMENT_BLOCK_STAR = 4;

    private static final byte[] NO_BYTES = new byte[0];

    private boolean endOfInput;

    private Minor minor = Minor.NONE;

    /** Second half of a two step structural state, such as the value after a comma **/
    private boolean afterSeparator;

    private int commentState = COMMENT_NONE;

    // partial UTF-8 sequence
    private int utf8Code;

    private int utf8Remaining;

    private int utf8Length;

    private long utf8Start;

    // string in progress
    private StringKind stringKind;

    private int quoteChar;

    private char[] outBuf;

    private int outPtr;

    private int unicodeValue;

    private int unicodeDigits;

    // number in progress
    private boolean numNegative;

    private boolean numFloat;

    private int numIntLen;

    private int numFractLen;

    private int numExpLen;

    // literal in progress
    private String literal;

    private int literalPtr;

    /** Token the literal produces, or null for a non-numeric number **/
    private CirJsonToken literalToken;

    private String nonNumericText;

    private double nonNumericValue;

    public NonBlockingByteArrayCirJsonParser(
            final ObjectReadContext readCtxt,
            final IOContext ioContext,
            final int streamReadFeatures,
            final int formatReadFeatures,
            final ByteQuadsCanonicalizer symbols) {
        super(readCtxt, ioContext, streamReadFeatures, formatReadFeatures, null, symbols, NO_BYTES, 0, 0, 0,
                false);
    }

    private boolean acceptNumberChar(final int ch) throws IOException {
        for (;;) {
            switch (minor) {
            case NUMBER_SIGN:
                if (ch == '.' && !allows(CirJsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS)
                        || ch != '.' && !isDigit(ch)) {
                    reportUnexpectedChar(ch, numNegative
                            ? "expected digit (0-9) to follow minus sign, for valid numeric value"
                            : "expected digit (0-9) for valid numeric value");
                }
                minor = Minor.NUMBER_START;
                continue;
            case NUMBER_START:
                if (ch == '0') {
                    minor = Minor.NUMBER_ZERO;
                    return true;
                }
                minor = Minor.NUMBER_INTEGER_DIGITS;
                continue;
            case NUMBER_ZERO:
                if (isDigit(ch)) {
                    if (!allows(CirJsonReadFeature.ALLOW_LEADING_ZEROS_FOR_NUMBERS)) {
                        reportError("Invalid numeric value: Leading zeroes not allowed");
                    }
                    minor = Minor.NUMBER_ZEROES;
                    continue;
                }
                textBuffer.append('0');
                ++numIntLen;
                minor = Minor.NUMBER_INTEGER_DIGITS;
                continue;
            case NUMBER_ZEROES:
                if (ch == '0') {
                    return true;
                }
                if (!isDigit(ch)) {
                    textBuffer.append('0');
                    ++numIntLen;
                }
                minor = Minor.NUMBER_INTEGER_DIGITS;
                continue;
            case NUMBER_INTEGER_DIGITS:
                if (isDigit(ch)) {
                    textBuffer.append((char) ch);
                    ++numIntLen;
                    return true;
                }
                if (ch == '.') {
                    numFloat = true;
                    textBuffer.append('.');
                    minor = Minor.NUMBER_FRACTION_DIGITS;
                    return true;
                }
                minor = Minor.NUMBER_EXPONENT_MARKER;
                continue;
            case NUMBER_FRACTION_DIGITS:
                if (isDigit(ch)) {
                    textBuffer.append((char) ch);
                    ++numFractLen;
                    return true;
                }
                if (numFractLen == 0 && !allows(CirJsonReadFeature.ALLOW_TRAILING_DECIMAL_POINT_FOR_NUMBERS)) {
                    reportUnexpectedChar(ch, "Decimal point not followed by a digit");
                }
                minor = Minor.NUMBER_EXPONENT_MARKER;
                continue;
            case NUMBER_EXPONENT_MARKER:
                if (ch == 'e' || ch == 'E') {
                    numFloat = true;
                    textBuffer.append((char) ch);
                    minor = Minor.NUMBER_EXPONENT_SIGN;
                    return true;
                }
                return false;
            case NUMBER_EXPONENT_SIGN:
                minor = Minor.NUMBER_EXPONENT_DIGITS;
                if (ch == '-' || ch == '+') {
                    textBuffer.append((char) ch);
                    return true;
                }
                continue;
            case NUMBER_EXPONENT_DIGITS:
                if (isDigit(ch)) {
                    textBuffer.append((char) ch);
                    ++numExpLen;
                    return true;
                }
                if (numExpLen == 0) {
                    reportUnexpectedChar(ch, "Exponent indicator not followed by a digit");
                }
                return false;
            default:
                throw new IllegalStateException("Not inside a number: " + minor);
            }
        }
    }

    private CirJsonToken continueLiteral() throws IOException {
        for (;;) {
            final int ch = readChar();
            if (ch == NEED_INPUT) {
                return CirJsonToken.NOT_AVAILABLE;
            }
            if (literalPtr < literal.length()) {
                if (ch != literal.charAt(literalPtr)) {
                    reportInvalidToken(literal.substring(0, literalPtr), ch);
                }
                ++literalPtr;
                continue;
            }
            if (ch >= 0 && Character.isJavaIdentifierPart(ch)) {
                reportInvalidToken(literal, ch);
            }
            unreadChar(ch);
            minor = Minor.NONE;
            if (literalToken != null) {
                return literalToken;
            }
            if (!allows(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)) {
                reportError("Non-standard token '" + nonNumericText
                        + "': enable `CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS` to allow");
            }
            return resetAsNaN(nonNumericText, nonNumericValue);
        }
    }

    private CirJsonToken continueNumber() throws IOException {
        for (;;) {
            final int ch = readChar();
            if (ch == NEED_INPUT) {
                return CirJsonToken.NOT_AVAILABLE;
            }
            if (minor == Minor.NUMBER_SIGN && ch == 'I') {
                return startNonNumeric(numNegative ? "-Infinity" : "+Infinity",
                        numNegative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
            }
            if (!acceptNumberChar(ch)) {
                return finishNumber(ch);
            }
        }
    }

    private CirJsonToken continuePlusSign() throws IOException {
        final int ch = readChar();
        if (ch == NEED_INPUT) {
            return CirJsonToken.NOT_AVAILABLE;
        }
        minor = Minor.NONE;
        if (ch == 'I') {
            return startNonNumeric("+Infinity", Double.POSITIVE_INFINITY);
        }
        reportUnexpectedChar('+', "JSON does not allow numbers to have plus signs: enable "
                + "`CirJsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS` to allow");
        return null;
    }

    private CirJsonToken continueString() throws IOException {
        char[] out = outBuf;
        int ptr = outPtr;
        for (;;) {
            int ch = readChar();
            if (ch == NEED_INPUT) {
                outBuf = out;
                outPtr = ptr;
                return CirJsonToken.NOT_AVAILABLE;
            }
            if (minor == Minor.STRING) {
                if (ch == quoteChar) {
                    break;
                }
                if (ch == '\\') {
                    minor = Minor.STRING_ESCAPE;
                    continue;
                }
                if (ch < ' ') {
                    if (ch < 0) {
                        reportInvalidEOF(": was expecting closing quote for a string value");
                    }
                    if (!allows(CirJsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)) {
                        reportError("Illegal unquoted character (" + getCharDesc(ch)
                                + "): has to be escaped using backslash to be included in string value");
                    }
                }
            } else if (minor == Minor.STRING_ESCAPE) {
                if (ch == 'u') {
                    unicodeValue = 0;
                    unicodeDigits = 0;
                    minor = Minor.STRING_UNICODE;
                    continue;
                }
                ch = decodeEscape(ch);
                minor = Minor.STRING;
            } else {
                unicodeValue = unicodeValue << 4 | toHexDigit(ch);
                if (++unicodeDigits < 4) {
                    continue;
                }
                ch = unicodeValue;
                minor = Minor.STRING;
            }
            if (ptr >= out.length) {
                out = textBuffer.finishCurrentSegment();
                ptr = 0;
            }
            out[ptr++] = (char) ch;
        }
        outBuf = null;
        minor = Minor.NONE;
        textBuffer.setCurrentLength(ptr);
        streamReadConstraints.validateStringLength(textBuffer.size());
        return finishString();
    }

    private CirJsonToken continueUnquotedName() throws IOException {
        for (;;) {
            final int ch = readChar();
            if (ch == NEED_INPUT) {
                return CirJsonToken.NOT_AVAILABLE;
            }
            if (ch >= 0 && Character.isJavaIdentifierPart(ch)) {
                textBuffer.append((char) ch);
                continue;
            }
            unreadChar(ch);
            minor = Minor.NONE;
            return finishName();
        }
    }

    /**
     * Signals that no more input will be fed. Tokens still pending are completed or reported as
     * truncated by the following calls to {@link #nextToken()}.
     */
    public void endOfInput() {
        endOfInput = true;
    }

    /**
     * Hands the next chunk of input to the parser. All bytes of the previous chunk must have been
     * consumed, which {@link #needMoreInput()} reports.
     *
     * @param buf
     *            buffer holding the chunk
     * @param start
     *            offset of the first byte
     * @param end
     *            offset one past the last byte
     * @throws IOException
     *             if the previous chunk is not consumed yet, the range is invalid, input was already
     *             closed with {@link #endOfInput()}, or the document grows too long
     */
    public void feedInput(final byte[] buf, final int start, final int end) throws IOException {
        if (inputPtr < inputEnd) {
            reportError("Still have " + (inputEnd - inputPtr) + " undecoded bytes, should not call 'feedInput'");
        }
        if (end < start) {
            reportError("Input end (" + end + ") may not be before start (" + start + ")");
        }
        if (endOfInput) {
            reportError("Already closed, can not feed more input");
        }
        // keep offsets absolute: the end of the previous chunk maps to the start of this one
        currInputProcessed += inputEnd - start;
        inputBuffer = buf;
        inputPtr = start;
        inputEnd = end;
        if (streamReadConstraints.hasMaxDocumentLength()) {
            streamReadConstraints.validateDocumentLength(currInputProcessed + inputEnd);
        }
    }

    private CirJsonToken finishName() throws IOException {
        streamReadConstraints.validateNameLength(textBuffer.size());
        final String name = canonicalizeName();
        final CirJsonToken t;
        if (stringKind == StringKind.ID_PROPERTY_NAME) {
            if (!ID_NAME.equals(name)) {
                reportError("Expected property name '" + ID_NAME + "', received '" + name + "'");
            }
            t = CirJsonToken.CIRJSON_ID_PROPERTY_NAME;
        } else {
            if (ID_NAME.equals(name)) {
                reportError("Duplicate Object property \"" + ID_NAME + "\"");
            }
            t = CirJsonToken.PROPERTY_NAME;
        }
        parsingContext.expectComma();
        parsingContext.setCurrentName(name);
        state = ParserState.DID_MEMNAME;
        return t;
    }

    private CirJsonToken finishNumber(final int ch) throws IOException {
        minor = Minor.NONE;
        if (parsingContext.isInRoot() && !isRootSeparator(ch)) {
            reportUnexpectedChar(ch, "Expected space separating root-level values");
        }
        unreadChar(ch);
        if (numFloat) {
            streamReadConstraints.validateFPLength(textBuffer.size());
            return resetFloat(numNegative, numIntLen, numFractLen, numExpLen);
        }
        streamReadConstraints.validateIntegerLength(numIntLen);
        return resetInt(numNegative, numIntLen);
    }

    private CirJsonToken finishString() throws IOException {
        switch (stringKind) {
        case ARRAY_ID:
            final String id = textBuffer.contentsAsString();
            parsingContext.expectComma();
            parsingContext.setContainerId(id);
            state = ParserState.DID_ARRELEM;
            return CirJsonToken.VALUE_STRING;
        case OBJECT_ID:
            parsingContext.setContainerId(textBuffer.contentsAsString());
            return CirJsonToken.VALUE_STRING;
        case PROPERTY_NAME:
        case ID_PROPERTY_NAME:
            return finishName();
        case VALUE:
        default:
            return CirJsonToken.VALUE_STRING;
        }
    }

    private static boolean isDigit(final int ch) {
        return ch >= '0' && ch <= '9';
    }

    /**
     * Returns true if every byte fed so far has been consumed and more input may be fed. Tokens
     * completed by the last byte can still be returned by {@link #nextToken()}.
     *
     * @return true if {@link #feedInput(byte[], int, int)} may be called
     */
    public boolean needMoreInput() {
        return !endOfInput && inputPtr >= inputEnd;
    }

    private CirJsonToken nextArrayElement() throws IOException {
        int ch;
        if (!afterSeparator) {
            ch = skipWsAsync();
            if (ch == NEED_INPUT) {
                return CirJsonToken.NOT_AVAILABLE;
            }
            if (ch == ']') {
                return closeScope(CirJsonToken.END_ARRAY);
            }
            if (ch != ',') {
                if (ch < 0) {
                    reportInvalidEOF(": expected close marker for ARRAY");
                }
                reportUnexpectedChar(ch, "was expecting comma to separate Array entries");
            }
            afterSeparator = true;
        }
        ch = skipWsAsync();
        if (ch == NEED_INPUT) {
            return CirJsonToken.NOT_AVAILABLE;
        }
        afterSeparator = false;
        if (ch == ']' && allows(CirJsonReadFeature.ALLOW_TRAILING_COMMA)) {
            return closeScope(CirJsonToken.END_ARRAY);
        }
        if ((ch == ',' || ch == ']') && allows(CirJsonReadFeature.ALLOW_MISSING_VALUES)) {
            unreadChar(ch);
            markToken();
            parsingContext.expectComma();
            return CirJsonToken.VALUE_NULL;
        }
        markToken();
        parsingContext.expectComma();
        return startValue(ch);
    }

    private CirJsonToken nextArrayId() throws IOException {
        final int ch = skipWsAsync();
        if (ch == NEED_INPUT) {
            return CirJsonToken.NOT_AVAILABLE;
        }
        markToken();
        if (ch == ']') {
            reportError("Expected array identifier, received end of array");
        }
        if (!isQuote(ch)) {
            if (ch < 0) {
                reportInvalidEOF(": expected array identifier");
            }
            reportUnexpectedChar(ch, "expected a String as the identifier of an array");
        }
        return startString(ch, StringKind.ARRAY_ID);
    }

    private CirJsonToken nextObjectEntry() throws IOException {
        int ch;
        if (!afterSeparator) {
            ch = skipWsAsync();
            if (ch == NEED_INPUT) {
                return CirJsonToken.NOT_AVAILABLE;
            }
            if (ch == '}') {
                return closeScope(CirJsonToken.END_OBJECT);
            }
            if (ch != ',') {
                if (ch < 0) {
                    reportInvalidEOF(": expected close marker for OBJECT");
                }
                reportUnexpectedChar(ch, "was expecting comma to separate Object entries");
            }
            afterSeparator = true;
        }
        ch = skipWsAsync();
        if (ch == NEED_INPUT) {
            return CirJsonToken.NOT_AVAILABLE;
        }
        afterSeparator = false;
        if (ch == '}' && allows(CirJsonReadFeature.ALLOW_TRAILING_COMMA)) {
            return closeScope(CirJsonToken.END_OBJECT);
        }
        markToken();
        return startName(ch, StringKind.PROPERTY_NAME);
    }

    private CirJsonToken nextObjectId() throws IOException {
        final int ch = skipWsAsync();
        if (ch == NEED_INPUT) {
            return CirJsonToken.NOT_AVAILABLE;
        }
        markToken();
        if (ch == '}') {
            reportError("Expected property name '" + ID_NAME + "', received end of object");
        }
        return startName(ch, StringKind.ID_PROPERTY_NAME);
    }

    private CirJsonToken nextPropertyValue() throws IOException {
        int ch;
        if (!afterSeparator) {
            ch = skipWsAsync();
            if (ch == NEED_INPUT) {
                return CirJsonToken.NOT_AVAILABLE;
            }
            if (ch != ':') {
                if (ch < 0) {
                    reportInvalidEOF(": was expecting a colon to separate property name and value");
                }
                reportUnexpectedChar(ch, "was expecting a colon to separate property name and value");
            }
            afterSeparator = true;
        }
        ch = skipWsAsync();
        if (ch == NEED_INPUT) {
            return CirJsonToken.NOT_AVAILABLE;
        }
        afterSeparator = false;
        markToken();
        state = ParserState.DID_MEMVAL;
        if (!parsingContext.hasContainerId()) {
            if (!isQuote(ch)) {
                if (ch < 0) {
                    reportInvalidEOF(": expected value of '" + ID_NAME + "'");
                }
                reportUnexpectedChar(ch, "expected a String as the value of '" + ID_NAME + "'");
            }
            return startString(ch, StringKind.OBJECT_ID);
        }
        return startValue(ch);
    }

    private CirJsonToken nextRootValue() throws IOException {
        final int ch = skipWsAsync();
        if (ch == NEED_INPUT) {
            return CirJsonToken.NOT_AVAILABLE;
        }
        if (ch < 0) {
            close();
            return null;
        }
        markToken();
        parsingContext.expectComma();
        return startValue(ch);
    }

    @Override
    public CirJsonToken nextToken() throws IOException {
        if (closed) {
            return null;
        }
        if (currToken != CirJsonToken.NOT_AVAILABLE) {
            binaryValue = null;
            numTypesValid = NR_UNKNOWN;
        }
        final CirJsonToken t;
        switch (minor) {
        case NONE:
            t = nextStructural();
            break;
        case STRING:
        case STRING_ESCAPE:
        case STRING_UNICODE:
            t = continueString();
            break;
        case UNQUOTED_NAME:
            t = continueUnquotedName();
            break;
        case LITERAL:
            t = continueLiteral();
            break;
        case PLUS_SIGN:
            t = continuePlusSign();
            break;
        default:
            t = continueNumber();
            break;
        }
        currToken = t;
        if (t != null && t != CirJsonToken.NOT_AVAILABLE && streamReadConstraints.hasMaxTokenCount()) {
            streamReadConstraints.validateTokenCount(++tokenCount);
        }
        return t;
    }

    private CirJsonToken nextStructural() throws IOException {
        switch (state) {
        case DID_OBJSTART:
            return nextObjectId();
        case DID_MEMNAME:
            return nextPropertyValue();
        case DID_MEMVAL:
            return nextObjectEntry();
        case DID_ARRSTART:
            return nextArrayId();
        case DID_ARRELEM:
            return nextArrayElement();
        default:
            return nextRootValue();
        }
    }

    /**
     * Decodes the next UTF-16 unit from the fed bytes. A multi-byte sequence cut off by the end of
     * a chunk is kept in the parser and completed from the next chunk.
     *
     * @return next unit, -1 once input is exhausted after {@link #endOfInput()}, or
     *         {@link #NEED_INPUT}
     */
    @Override
    protected int readRaw() throws IOException {
        if (pendingLowSurrogate >= 0) {
            final int c = pendingLowSurrogate;
            pendingLowSurrogate = -1;
            return c;
        }
        while (inputPtr < inputEnd) {
            final int b = inputBuffer[inputPtr++] & 0xFF;
            if (utf8Remaining == 0) {
                if (b < 0x80) {
                    return b;
                }
                utf8Start = inputOffset() - 1;
                if ((b & 0xE0) == 0xC0) {
                    utf8Code = b & 0x1F;
                    utf8Remaining = 1;
                } else if ((b & 0xF0) == 0xE0) {
                    utf8Code = b & 0x0F;
                    utf8Remaining = 2;
                } else if ((b & 0xF8) == 0xF0) {
                    utf8Code = b & 0x07;
                    utf8Remaining = 3;
                } else {
                    reportError("Invalid UTF-8 start byte 0x" + Integer.toHexString(b));
                }
                utf8Length = utf8Remaining;
                continue;
            }
            if ((b & 0xC0) != 0x80) {
                reportError("Invalid UTF-8 middle byte 0x" + Integer.toHexString(b));
            }
            utf8Code = utf8Code << 6 | b & 0x3F;
            if (--utf8Remaining > 0) {
                continue;
            }
            lastCharStart = utf8Start;
            if (utf8Length == 3) {
                if (utf8Code > Character.MAX_CODE_POINT) {
                    reportError("Invalid UTF-8 code point 0x" + Integer.toHexString(utf8Code));
                }
                pendingLowSurrogate = Character.lowSurrogate(utf8Code);
                return Character.highSurrogate(utf8Code);
            }
            return utf8Code;
        }
        if (!endOfInput) {
            return NEED_INPUT;
        }
        if (utf8Remaining > 0) {
            reportInvalidEOF(" in a multi-byte UTF-8 character");
        }
        return -1;
    }

    /**
     * Continues a comment started by an earlier character.
     *
     * @return false if the input ran out inside the comment
     */
    private boolean skipComment() throws IOException {
        for (;;) {
            final int ch = readChar();
            if (ch == NEED_INPUT) {
                return false;
            }
            switch (commentState) {
            case COMMENT_START:
                if (ch == '/') {
                    commentState = COMMENT_LINE;
                } else if (ch == '*') {
                    commentState = COMMENT_BLOCK;
                } else {
                    reportUnexpectedChar(ch, "was expecting either '*' or '/' for a comment");
                }
                break;
            case COMMENT_LINE:
                if (ch == '\n' || ch == '\r' || ch < 0) {
                    commentState = COMMENT_NONE;
                    return true;
                }
                break;
            case COMMENT_BLOCK_STAR:
                if (ch == '/') {
                    commentState = COMMENT_NONE;
                    return true;
                }
                commentState = COMMENT_BLOCK;
                // fall through
            default:
                if (ch < 0) {
                    reportInvalidEOF(" in a comment");
                }
                if (ch == '*') {
                    commentState = COMMENT_BLOCK_STAR;
                }
                break;
            }
        }
    }

    /**
     * Skips whitespace and, where enabled, comments, resuming a comment cut off by the previous
     * chunk.
     *
     * @return the first significant character, -1 at end of input, or {@link #NEED_INPUT}
     */
    private int skipWsAsync() throws IOException {
        for (;;) {
            if (commentState != COMMENT_NONE && !skipComment()) {
                return NEED_INPUT;
            }
            final int ch = readChar();
            if (ch < 64) {
                if (ch >= 0 && (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n')) {
                    continue;
                }
                if (ch == '/') {
                    if (!allows(CirJsonReadFeature.ALLOW_JAVA_COMMENTS)) {
                        reportUnexpectedChar('/', COMMENTS_NOT_ENABLED);
                    }
                    commentState = COMMENT_START;
                    continue;
                }
                if (ch == '#' && allows(CirJsonReadFeature.ALLOW_YAML_COMMENTS)) {
                    commentState = COMMENT_LINE;
                    continue;
                }
            } else if (ch == 0xFEFF && lastCharStart == 0) {
                continue;
            }
            return ch;
        }
    }

    private CirJsonToken startLiteral(final String text, final CirJsonToken token) throws IOException {
        literal = text;
        literalPtr = 1;
        literalToken = token;
        minor = Minor.LITERAL;
        return continueLiteral();
    }

    private CirJsonToken startName(final int ch, final StringKind kind) throws IOException {
        if (isQuote(ch)) {
            return startString(ch, kind);
        }
        if (ch < 0) {
            reportInvalidEOF(": was expecting property name");
        }
        if (!allows(CirJsonReadFeature.ALLOW_UNQUOTED_PROPERTY_NAMES) || !Character.isJavaIdentifierStart(ch)) {
            reportUnexpectedChar(ch, "was expecting double-quote to start property name");
        }
        stringKind = kind;
        textBuffer.resetWithEmpty();
        textBuffer.append((char) ch);
        minor = Minor.UNQUOTED_NAME;
        return continueUnquotedName();
    }

    private CirJsonToken startNonNumeric(final String text, final double value) throws IOException {
        nonNumericText = text;
        nonNumericValue = value;
        final char first = text.charAt(0);
        return startLiteral(first == '-' || first == '+' ? text.substring(1) : text, null);
    }

    private CirJsonToken startNumber(final int ch) throws IOException {
        textBuffer.resetWithEmpty();
        numNegative = false;
        numFloat = false;
        numIntLen = 0;
        numFractLen = 0;
        numExpLen = 0;
        if (ch == '-' || ch == '+') {
            numNegative = ch == '-';
            if (numNegative) {
                textBuffer.append('-');
            }
            minor = Minor.NUMBER_SIGN;
        } else {
            minor = Minor.NUMBER_START;
            acceptNumberChar(ch);
        }
        return continueNumber();
    }

    private CirJsonToken startString(final int quote, final StringKind kind) throws IOException {
        stringKind = kind;
        quoteChar = quote;
        outBuf = textBuffer.emptyAndGetCurrentSegment();
        outPtr = 0;
        minor = Minor.STRING;
        return continueString();
    }

    private CirJsonToken startValue(final int ch) throws IOException {
        switch (ch) {
        case '"':
            return startString(ch, StringKind.VALUE);
        case '\'':
            if (allows(CirJsonReadFeature.ALLOW_SINGLE_QUOTES)) {
                return startString(ch, StringKind.VALUE);
            }
            break;
        case '{':
            parsingContext = parsingContext.createChildObjectContext(tokenInputRow, tokenInputCol);
            streamReadConstraints.validateNestingDepth(parsingContext.getNestingDepth());
            state = ParserState.DID_OBJSTART;
            return CirJsonToken.START_OBJECT;
        case '[':
            parsingContext = parsingContext.createChildArrayContext(tokenInputRow, tokenInputCol);
            streamReadConstraints.validateNestingDepth(parsingContext.getNestingDepth());
            state = ParserState.DID_ARRSTART;
            return CirJsonToken.START_ARRAY;
        case 't':
            return startLiteral("true", CirJsonToken.VALUE_TRUE);
        case 'f':
            return startLiteral("false", CirJsonToken.VALUE_FALSE);
        case 'n':
            return startLiteral("null", CirJsonToken.VALUE_NULL);
        case 'N':
            return startNonNumeric("NaN", Double.NaN);
        case 'I':
            return startNonNumeric("Infinity", Double.POSITIVE_INFINITY);
        case '+':
            if (allows(CirJsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS)) {
                return startNumber(ch);
            }
            minor = Minor.PLUS_SIGN;
            return continuePlusSign();
        case '.':
            if (allows(CirJsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS)) {
                return startNumber(ch);
            }
            reportUnexpectedChar(ch, "Decimal point not preceded by a digit: enable "
                    + "`CirJsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS` to allow");
            break;
        case '-':
        case '0':
        case '1':
        case '2':
        case '3':
        case '4':
        case '5':
        case '6':
        case '7':
        case '8':
        case '9':
            return startNumber(ch);
        case -1:
            reportInvalidEOF(": expected a value");
            break;
        default:
            break;
        }
        if (Character.isJavaIdentifierStart(ch)) {
            reportInvalidToken("", ch);
        }
        reportUnexpectedChar(ch, "expected a valid value " + VALID_VALUES);
        return null;
    }

    @Override
    public Object streamReadInputSource() {
        return null;
    }
}
