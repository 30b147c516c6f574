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

import com.arakelian.cirjson.CirJsonReadFeature;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.ObjectReadContext;
import com.arakelian.cirjson.base.ParserBase;
import com.arakelian.cirjson.exc.StreamReadException;
import com.arakelian.cirjson.io.IOContext;

/**
 * Character level state machine shared by the textual parsers. Subclasses supply decoded UTF-16
 * units through {@link #readRaw()} and canonicalize property names.
 *
 * <p>
 * Beyond plain JSON, the grammar enforces the identifier protocol: the first property of every
 * object must be {@value #ID_NAME} with a string value, and the first element of every array must
 * be a string.
 * </p>
 */
public abstract class CirJsonParserBase extends ParserBase {
    protected enum ParserState {
        /** Expecting a root-level value or end of input **/
        ROOT_VALUE,

        /** '{' read, expecting the identifier property **/
        DID_OBJSTART,

        /** '[' read, expecting the identifier string **/
        DID_ARRSTART,

        /** Array element read, expecting ',' or ']' **/
        DID_ARRELEM,

        /** Property name read, expecting ':' and a value **/
        DID_MEMNAME,

        /** Property value read, expecting ',' or '}' **/
        DID_MEMVAL;
    }

    /** Marks an empty pushback slot; -1 is a legal pushback value meaning end-of-input **/
    protected static final int NO_PUSHBACK = -2;

    private static final long WS_MASK = 1L << ' ' | 1L << '\t' | 1L << '\r' | 1L << '\n';

    protected static final String VALID_VALUES = "(JSON String, Number, Array, Object or token 'null', 'true' "
            + "or 'false')";

    protected static final String COMMENTS_NOT_ENABLED = "maybe a (non-standard) comment? (not recognized as one "
            + "since Feature 'ALLOW_JAVA_COMMENTS' not enabled for parser)";

    protected ParserState state = ParserState.ROOT_VALUE;

    protected int pushback = NO_PUSHBACK;

    protected long pushbackStart;

    /** Absolute offset of the first unit of the character last returned by {@link #readChar()} **/
    protected long lastCharStart;

    protected CirJsonParserBase(
            final ObjectReadContext readCtxt,
            final IOContext ioContext,
            final int streamReadFeatures,
            final int formatReadFeatures) {
        super(readCtxt, ioContext, streamReadFeatures, formatReadFeatures);
    }

    /**
     * Returns the property name held in the text buffer, canonicalized through the symbol table of
     * the parser.
     *
     * @return property name
     * @throws IOException
     *             if the name is too long
     */
    protected abstract String canonicalizeName() throws IOException;

    protected final CirJsonToken closeScope(final CirJsonToken t) {
        markToken();
        parsingContext = parsingContext.clearAndGetParent();
        if (parsingContext.isInRoot()) {
            state = ParserState.ROOT_VALUE;
        } else if (parsingContext.isInArray()) {
            state = ParserState.DID_ARRELEM;
        } else {
            state = ParserState.DID_MEMVAL;
        }
        return t;
    }

    protected static String getCharDesc(final int ch) {
        if (ch < 0) {
            return "(end-of-input)";
        }
        final char c = (char) ch;
        if (Character.isISOControl(c)) {
            return "(CTRL-CHAR, code " + ch + ")";
        }
        if (ch > 255) {
            return "'" + c + "' (code " + ch + " / 0x" + Integer.toHexString(ch) + ")";
        }
        return "'" + c + "' (code " + ch + ")";
    }

    /**
     * Returns extra text appended to parse error messages, such as the input around the error.
     *
     * @return error context, never null
     */
    protected String getErrorContext() {
        return "";
    }

    protected final long inputOffset() {
        return currInputProcessed + inputPtr;
    }

    protected final boolean isRootSeparator(final int ch) {
        return ch < 0 || ch < 64 && (WS_MASK >> ch & 0x01) != 0 || ch == '/' || ch == '#' || ch == '{'
                || ch == '[';
    }

    protected final void markToken() {
        tokenInputTotal = lastCharStart;
        tokenInputRow = currInputRow + 1;
        tokenInputCol = (int) (lastCharStart - currInputRowStart) + 1;
    }

    private void matchLiteral(final String literal) throws IOException {
        for (int i = 1, len = literal.length(); i < len; i++) {
            final int ch = readChar();
            if (ch != literal.charAt(i)) {
                reportInvalidToken(literal.substring(0, i), ch);
            }
        }
        final int ch = readChar();
        if (ch >= 0 && Character.isJavaIdentifierPart(ch)) {
            reportInvalidToken(literal, ch);
        }
        unreadChar(ch);
    }

    private CirJsonToken nextArrayElement() throws IOException {
        int ch = skipWs();
        if (ch == ']') {
            return closeScope(CirJsonToken.END_ARRAY);
        }
        if (ch != ',') {
            if (ch < 0) {
                reportInvalidEOF(": expected close marker for ARRAY");
            }
            reportUnexpectedChar(ch, "was expecting comma to separate Array entries");
        }
        ch = skipWs();
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
        return parseValue(ch);
    }

    private CirJsonToken nextArrayId() throws IOException {
        final int ch = skipWs();
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
        parseString(ch);
        final String id = textBuffer.contentsAsString();
        parsingContext.expectComma();
        parsingContext.setContainerId(id);
        state = ParserState.DID_ARRELEM;
        return CirJsonToken.VALUE_STRING;
    }

    private CirJsonToken nextObjectEntry() throws IOException {
        int ch = skipWs();
        if (ch == '}') {
            return closeScope(CirJsonToken.END_OBJECT);
        }
        if (ch != ',') {
            if (ch < 0) {
                reportInvalidEOF(": expected close marker for OBJECT");
            }
            reportUnexpectedChar(ch, "was expecting comma to separate Object entries");
        }
        ch = skipWs();
        if (ch == '}' && allows(CirJsonReadFeature.ALLOW_TRAILING_COMMA)) {
            return closeScope(CirJsonToken.END_OBJECT);
        }
        markToken();
        final String name = readPropertyName(ch);
        if (ID_NAME.equals(name)) {
            reportError("Duplicate Object property \"" + ID_NAME + "\"");
        }
        parsingContext.expectComma();
        parsingContext.setCurrentName(name);
        state = ParserState.DID_MEMNAME;
        return CirJsonToken.PROPERTY_NAME;
    }

    private CirJsonToken nextObjectId() throws IOException {
        final int ch = skipWs();
        markToken();
        if (ch == '}') {
            reportError("Expected property name '" + ID_NAME + "', received end of object");
        }
        final String name = readPropertyName(ch);
        if (!ID_NAME.equals(name)) {
            reportError("Expected property name '" + ID_NAME + "', received '" + name + "'");
        }
        parsingContext.expectComma();
        parsingContext.setCurrentName(name);
        state = ParserState.DID_MEMNAME;
        return CirJsonToken.CIRJSON_ID_PROPERTY_NAME;
    }

    private CirJsonToken nextPropertyValue() throws IOException {
        int ch = skipWs();
        if (ch != ':') {
            if (ch < 0) {
                reportInvalidEOF(": was expecting a colon to separate property name and value");
            }
            reportUnexpectedChar(ch, "was expecting a colon to separate property name and value");
        }
        ch = skipWs();
        markToken();
        if (!parsingContext.hasContainerId()) {
            if (!isQuote(ch)) {
                if (ch < 0) {
                    reportInvalidEOF(": expected value of '" + ID_NAME + "'");
                }
                reportUnexpectedChar(ch, "expected a String as the value of '" + ID_NAME + "'");
            }
            parseString(ch);
            parsingContext.setContainerId(textBuffer.contentsAsString());
            state = ParserState.DID_MEMVAL;
            return CirJsonToken.VALUE_STRING;
        }
        state = ParserState.DID_MEMVAL;
        return parseValue(ch);
    }

    private CirJsonToken nextRootValue() throws IOException {
        final int ch = skipWs();
        if (ch < 0) {
            close();
            return null;
        }
        markToken();
        parsingContext.expectComma();
        return parseValue(ch);
    }

    @Override
    public CirJsonToken nextToken() throws IOException {
        if (closed) {
            return null;
        }
        binaryValue = null;
        numTypesValid = NR_UNKNOWN;
        final CirJsonToken t;
        switch (state) {
        case DID_OBJSTART:
            t = nextObjectId();
            break;
        case DID_MEMNAME:
            t = nextPropertyValue();
            break;
        case DID_MEMVAL:
            t = nextObjectEntry();
            break;
        case DID_ARRSTART:
            t = nextArrayId();
            break;
        case DID_ARRELEM:
            t = nextArrayElement();
            break;
        default:
            t = nextRootValue();
            break;
        }
        currToken = t;
        if (t != null && streamReadConstraints.hasMaxTokenCount()) {
            streamReadConstraints.validateTokenCount(++tokenCount);
        }
        return t;
    }

    protected final boolean isQuote(final int ch) {
        return ch == '"' || ch == '\'' && allows(CirJsonReadFeature.ALLOW_SINGLE_QUOTES);
    }

    private CirJsonToken parseNonNumeric(final String text, final double value) throws IOException {
        matchLiteral(text.charAt(0) == '-' || text.charAt(0) == '+' ? text.substring(1) : text);
        if (!allows(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)) {
            reportError("Non-standard token '" + text
                    + "': enable `CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS` to allow");
        }
        return resetAsNaN(text, value);
    }

    private CirJsonToken parseNumber(int ch) throws IOException {
        textBuffer.resetWithEmpty();
        boolean negative = false;
        if (ch == '-' || ch == '+') {
            negative = ch == '-';
            if (negative) {
                textBuffer.append('-');
            }
            ch = readChar();
            if (ch == 'I') {
                return parseNonNumeric(negative ? "-Infinity" : "+Infinity",
                        negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
            }
            if (ch == '.' && !allows(CirJsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS) || ch != '.'
                    && (ch < '0' || ch > '9')) {
                reportUnexpectedChar(ch, negative
                        ? "expected digit (0-9) to follow minus sign, for valid numeric value"
                        : "expected digit (0-9) for valid numeric value");
            }
        }

        int intLen = 0;
        if (ch == '0') {
            ch = readChar();
            if (ch >= '0' && ch <= '9') {
                if (!allows(CirJsonReadFeature.ALLOW_LEADING_ZEROS_FOR_NUMBERS)) {
                    reportError("Invalid numeric value: Leading zeroes not allowed");
                }
                while (ch == '0') {
                    ch = readChar();
                }
            }
            if (ch < '0' || ch > '9') {
                textBuffer.append('0');
                intLen = 1;
            }
        }
        while (ch >= '0' && ch <= '9') {
            textBuffer.append((char) ch);
            ++intLen;
            ch = readChar();
        }

        boolean isFloat = false;
        int fractLen = 0;
        if (ch == '.') {
            isFloat = true;
            textBuffer.append('.');
            ch = readChar();
            while (ch >= '0' && ch <= '9') {
                textBuffer.append((char) ch);
                ++fractLen;
                ch = readChar();
            }
            if (fractLen == 0 && !allows(CirJsonReadFeature.ALLOW_TRAILING_DECIMAL_POINT_FOR_NUMBERS)) {
                reportUnexpectedChar(ch, "Decimal point not followed by a digit");
            }
        }

        int expLen = 0;
        if (ch == 'e' || ch == 'E') {
            isFloat = true;
            textBuffer.append((char) ch);
            ch = readChar();
            if (ch == '-' || ch == '+') {
                textBuffer.append((char) ch);
                ch = readChar();
            }
            while (ch >= '0' && ch <= '9') {
                textBuffer.append((char) ch);
                ++expLen;
                ch = readChar();
            }
            if (expLen == 0) {
                reportUnexpectedChar(ch, "Exponent indicator not followed by a digit");
            }
        }

        if (parsingContext.isInRoot() && !isRootSeparator(ch)) {
            reportUnexpectedChar(ch, "Expected space separating root-level values");
        }
        unreadChar(ch);

        if (isFloat) {
            streamReadConstraints.validateFPLength(textBuffer.size());
            return resetFloat(negative, intLen, fractLen, expLen);
        }
        streamReadConstraints.validateIntegerLength(intLen);
        return resetInt(negative, intLen);
    }

    /**
     * Reads a quoted string into the text buffer. The opening quote has already been read.
     *
     * @param quote
     *            quote character that closes the string
     * @throws IOException
     *             if the string is malformed or too long
     */
    protected final void parseString(final int quote) throws IOException {
        char[] out = textBuffer.emptyAndGetCurrentSegment();
        int outPtr = 0;
        for (;;) {
            int ch = readChar();
            if (ch == quote) {
                break;
            }
            if (ch == '\\') {
                ch = readEscapedChar();
            } else if (ch < ' ') {
                if (ch < 0) {
                    reportInvalidEOF(": was expecting closing quote for a string value");
                }
                if (!allows(CirJsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)) {
                    reportError("Illegal unquoted character (" + getCharDesc(ch)
                            + "): has to be escaped using backslash to be included in string value");
                }
            }
            if (outPtr >= out.length) {
                out = textBuffer.finishCurrentSegment();
                outPtr = 0;
            }
            out[outPtr++] = (char) ch;
        }
        textBuffer.setCurrentLength(outPtr);
        streamReadConstraints.validateStringLength(textBuffer.size());
    }

    private CirJsonToken parseValue(final int ch) throws IOException {
        switch (ch) {
        case '"':
            parseString(ch);
            return CirJsonToken.VALUE_STRING;
        case '\'':
            if (allows(CirJsonReadFeature.ALLOW_SINGLE_QUOTES)) {
                parseString(ch);
                return CirJsonToken.VALUE_STRING;
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
            matchLiteral("true");
            return CirJsonToken.VALUE_TRUE;
        case 'f':
            matchLiteral("false");
            return CirJsonToken.VALUE_FALSE;
        case 'n':
            matchLiteral("null");
            return CirJsonToken.VALUE_NULL;
        case 'N':
            return parseNonNumeric("NaN", Double.NaN);
        case 'I':
            return parseNonNumeric("Infinity", Double.POSITIVE_INFINITY);
        case '+':
            if (allows(CirJsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS)) {
                return parseNumber(ch);
            }
            final int next = readChar();
            if (next == 'I') {
                return parseNonNumeric("+Infinity", Double.POSITIVE_INFINITY);
            }
            reportUnexpectedChar(ch, "JSON does not allow numbers to have plus signs: enable "
                    + "`CirJsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS` to allow");
            break;
        case '.':
            if (allows(CirJsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS)) {
                return parseNumber(ch);
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
            return parseNumber(ch);
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

    /**
     * Reads the next UTF-16 unit from the input.
     *
     * @return next unit, or -1 at end of input
     * @throws IOException
     *             if the input cannot be read or decoded
     */
    protected abstract int readRaw() throws IOException;

    protected final int readChar() throws IOException {
        if (pushback != NO_PUSHBACK) {
            final int ch = pushback;
            pushback = NO_PUSHBACK;
            lastCharStart = pushbackStart;
            return ch;
        }
        lastCharStart = inputOffset();
        final int ch = readRaw();
        if (ch == '\n') {
            ++currInputRow;
            currInputRowStart = inputOffset();
        }
        return ch;
    }

    private int readEscapedChar() throws IOException {
        final int ch = readChar();
        if (ch == 'u') {
            return toHexDigit(readChar()) << 12 | toHexDigit(readChar()) << 8 | toHexDigit(readChar()) << 4
                    | toHexDigit(readChar());
        }
        return decodeEscape(ch);
    }

    /**
     * Decodes the character following a backslash, other than the <code>u</code> of a Unicode
     * escape.
     *
     * @param ch
     *            character following the backslash
     * @return the character the escape stands for
     * @throws IOException
     *             if the escape is not recognized
     */
    protected final int decodeEscape(final int ch) throws IOException {
        switch (ch) {
        case '"':
            return '"';
        case '\\':
            return '\\';
        case '/':
            return '/';
        case 'n':
            return '\n';
        case 'r':
            return '\r';
        case 't':
            return '\t';
        case 'f':
            return '\f';
        case 'b':
            return '\b';
        case -1:
            reportInvalidEOF(" in character escape sequence");
            return -1;
        default:
            if (ch == '\'' && allows(CirJsonReadFeature.ALLOW_SINGLE_QUOTES)
                    || allows(CirJsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)) {
                return ch;
            }
            reportError("Unrecognized character escape " + getCharDesc(ch));
            return -1;
        }
    }

    private String readPropertyName(int ch) throws IOException {
        if (isQuote(ch)) {
            parseString(ch);
            streamReadConstraints.validateNameLength(textBuffer.size());
            return canonicalizeName();
        }
        if (ch < 0) {
            reportInvalidEOF(": was expecting property name");
        }
        if (!allows(CirJsonReadFeature.ALLOW_UNQUOTED_PROPERTY_NAMES) || !Character.isJavaIdentifierStart(ch)) {
            reportUnexpectedChar(ch, "was expecting double-quote to start property name");
        }
        textBuffer.resetWithEmpty();
        while (ch >= 0 && Character.isJavaIdentifierPart(ch)) {
            textBuffer.append((char) ch);
            ch = readChar();
        }
        unreadChar(ch);
        streamReadConstraints.validateNameLength(textBuffer.size());
        return canonicalizeName();
    }

    protected final void reportError(final String msg) throws StreamReadException {
        throw new StreamReadException(this, msg + getErrorContext());
    }

    protected final void reportInvalidEOF(final String msg) throws StreamReadException {
        reportError("Unexpected end-of-input" + msg);
    }

    protected final void reportInvalidToken(final String matched, int ch) throws IOException {
        final StringBuilder sb = new StringBuilder(matched);
        while (ch >= 0 && Character.isJavaIdentifierPart(ch) && sb.length() < 256) {
            sb.append((char) ch);
            ch = readChar();
        }
        reportError("Unrecognized token '" + sb + "': was expecting " + VALID_VALUES);
    }

    protected final void reportUnexpectedChar(final int ch, final String comment) throws StreamReadException {
        if (ch < 0) {
            reportInvalidEOF(comment == null ? "" : ": " + comment);
        }
        String msg = "Unexpected character (" + getCharDesc(ch) + ")";
        if (comment != null) {
            msg += ": " + comment;
        }
        reportError(msg);
    }

    private void skipComment() throws IOException {
        if (!allows(CirJsonReadFeature.ALLOW_JAVA_COMMENTS)) {
            reportUnexpectedChar('/', COMMENTS_NOT_ENABLED);
        }
        int ch = readChar();
        if (ch == '/') {
            skipLine();
        } else if (ch == '*') {
            for (;;) {
                ch = readChar();
                if (ch < 0) {
                    reportInvalidEOF(" in a comment");
                }
                if (ch == '*') {
                    ch = readChar();
                    if (ch == '/') {
                        return;
                    }
                    unreadChar(ch);
                }
            }
        } else {
            reportUnexpectedChar(ch, "was expecting either '*' or '/' for a comment");
        }
    }

    private void skipLine() throws IOException {
        for (;;) {
            final int ch = readChar();
            if (ch == '\n' || ch == '\r' || ch < 0) {
                return;
            }
        }
    }

    /**
     * Skips whitespace and, where enabled, comments.
     *
     * @return the first significant character, or -1 at end of input
     * @throws IOException
     *             if the input cannot be read or a comment is malformed
     */
    protected final int skipWs() throws IOException {
        for (;;) {
            final int ch = readChar();
            if (ch < 64) {
                if (ch >= 0 && (WS_MASK >> ch & 0x01) != 0) {
                    continue;
                }
                if (ch == '/') {
                    skipComment();
                    continue;
                }
                if (ch == '#' && allows(CirJsonReadFeature.ALLOW_YAML_COMMENTS)) {
                    skipLine();
                    continue;
                }
            } else if (ch == 0xFEFF && lastCharStart == 0) {
                continue;
            }
            return ch;
        }
    }

    protected final int toHexDigit(final int hexDigit) throws StreamReadException {
        if (hexDigit >= '0' && hexDigit <= '9') {
            return hexDigit - '0';
        } else if (hexDigit >= 'A' && hexDigit <= 'F') {
            return hexDigit + 10 - 'A';
        } else if (hexDigit >= 'a' && hexDigit <= 'f') {
            return hexDigit + 10 - 'a';
        }
        reportUnexpectedChar(hexDigit, "expected a hex-digit for character escape sequence");
        return -1;
    }

    protected final void unreadChar(final int ch) {
        pushback = ch;
        pushbackStart = lastCharStart;
    }
}
