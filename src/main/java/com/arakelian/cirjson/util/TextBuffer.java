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
import java.io.Writer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;

import com.arakelian.cirjson.exc.StreamConstraintsException;
import com.arakelian.cirjson.io.NumberInput;

/**
 * Segmented character accumulator used by parsers and generators to build token text without
 * repeated copying.
 *
 * <p>
 * Content is held in one of three forms, only one of which is current at any time:
 * </p>
 * <ul>
 * <li>a slice of a caller-owned array ("shared"), which is never copied unless appended to</li>
 * <li>a list of completed segments plus the active current segment</li>
 * <li>a cached result String or char array</li>
 * </ul>
 *
 * <p>
 * Every growth and every finalization passes the total length to
 * {@link #validateStringLength(int)}, which does nothing here but enforces limits in
 * {@link ReadConstrainedTextBuffer}.
 * </p>
 */
public class TextBuffer {
    static final char[] NO_CHARS = new char[0];

    /** Smallest segment allocated **/
    static final int MIN_SEGMENT_LEN = 500;

    /** Largest segment allocated; content beyond this spills into more segments **/
    static final int MAX_SEGMENT_LEN = 0x10000;

    /**
     * Returns a buffer that starts with the given segment, not backed by a recycler.
     *
     * @param initialSegment
     *            first segment
     * @return new text buffer
     */
    public static TextBuffer fromInitial(final char[] initialSegment) {
        return new TextBuffer(null, initialSegment);
    }

    private final BufferRecycler allocator;

    /** Shared input buffer; only valid when {@link #inputStart} is non-negative **/
    private char[] inputBuffer;

    private int inputStart;

    private int inputLen;

    /** Completed segments, oldest first **/
    private ArrayList<char[]> segments;

    private boolean hasSegments;

    /** Total length of all completed segments **/
    private int segmentSize;

    private char[] currentSegment;

    /** Number of characters used in the current segment **/
    private int currentSize;

    private String resultString;

    private char[] resultArray;

    public TextBuffer(final BufferRecycler allocator) {
        this.allocator = allocator;
        this.inputStart = -1;
    }

    protected TextBuffer(final BufferRecycler allocator, final char[] initialSegment) {
        this(allocator);
        this.currentSegment = initialSegment;
        this.currentSize = initialSegment.length;
        this.inputStart = -1;
    }

    public void append(final char c) throws StreamConstraintsException {
        if (inputStart >= 0) {
            unshare(16);
        }
        resultString = null;
        resultArray = null;
        char[] curr = ensureCurrentSegment();
        if (currentSize >= curr.length) {
            validateAppend(1);
            expand();
            curr = currentSegment;
        }
        curr[currentSize++] = c;
    }

    public void append(final char[] c, int start, int len) throws StreamConstraintsException {
        if (inputStart >= 0) {
            unshare(len);
        }
        resultString = null;
        resultArray = null;

        final char[] curr = ensureCurrentSegment();
        final int max = curr.length - currentSize;
        if (max >= len) {
            System.arraycopy(c, start, curr, currentSize, len);
            currentSize += len;
            return;
        }

        validateAppend(len);
        if (max > 0) {
            System.arraycopy(c, start, curr, currentSize, max);
            start += max;
            len -= max;
        }
        do {
            expand();
            final int amount = Math.min(currentSegment.length, len);
            System.arraycopy(c, start, currentSegment, 0, amount);
            currentSize += amount;
            start += amount;
            len -= amount;
        } while (len > 0);
    }

    public void append(final String str, int offset, int len) throws StreamConstraintsException {
        if (inputStart >= 0) {
            unshare(len);
        }
        resultString = null;
        resultArray = null;

        final char[] curr = ensureCurrentSegment();
        final int max = curr.length - currentSize;
        if (max >= len) {
            str.getChars(offset, offset + len, curr, currentSize);
            currentSize += len;
            return;
        }

        validateAppend(len);
        if (max > 0) {
            str.getChars(offset, offset + max, curr, currentSize);
            len -= max;
            offset += max;
        }
        do {
            expand();
            final int amount = Math.min(currentSegment.length, len);
            str.getChars(offset, offset + amount, currentSegment, 0);
            currentSize += amount;
            offset += amount;
            len -= amount;
        } while (len > 0);
    }

    private char[] buf(final int needed) {
        if (allocator != null) {
            return allocator.allocCharBuffer(BufferRecycler.CHAR_TEXT_BUFFER, needed);
        }
        return new char[Math.max(needed, MIN_SEGMENT_LEN)];
    }

    private void clearSegments() {
        hasSegments = false;
        segments.clear();
        currentSize = segmentSize = 0;
    }

    /**
     * Returns the contents as a char array, which may be cached and must not be modified.
     *
     * @return contents as a char array
     * @throws StreamConstraintsException
     *             if the content is too long
     */
    public char[] contentsAsArray() throws StreamConstraintsException {
        char[] result = resultArray;
        if (result == null) {
            resultArray = result = resultArray();
        }
        return result;
    }

    /**
     * Parses the contents as a BigDecimal.
     *
     * @param useFastParser
     *            true to use the fastdoubleparser library for long values
     * @return parsed value
     * @throws NumberFormatException
     *             if the contents are not a valid number
     * @throws StreamConstraintsException
     *             if the content is too long
     */
    public BigDecimal contentsAsDecimal(final boolean useFastParser)
            throws NumberFormatException, StreamConstraintsException {
        if (resultString != null) {
            return NumberInput.parseBigDecimal(resultString, useFastParser);
        }
        if (resultArray != null) {
            return NumberInput.parseBigDecimal(resultArray, useFastParser);
        }
        if (inputStart >= 0 && inputBuffer != null) {
            return NumberInput.parseBigDecimal(inputBuffer, inputStart, inputLen, useFastParser);
        }
        if (segmentSize == 0 && currentSegment != null) {
            return NumberInput.parseBigDecimal(currentSegment, 0, currentSize, useFastParser);
        }
        return NumberInput.parseBigDecimal(contentsAsArray(), useFastParser);
    }

    public double contentsAsDouble(final boolean useFastParser)
            throws NumberFormatException, StreamConstraintsException {
        return NumberInput.parseDouble(contentsAsString(), useFastParser);
    }

    public float contentsAsFloat(final boolean useFastParser)
            throws NumberFormatException, StreamConstraintsException {
        return NumberInput.parseFloat(contentsAsString(), useFastParser);
    }

    /**
     * Parses the contents as an int. Contents must already be known to be a valid integer of at
     * most 9 digits, optionally preceded by a minus sign.
     *
     * @param neg
     *            true if the contents start with a minus sign
     * @return parsed value
     * @throws StreamConstraintsException
     *             if the content is too long
     */
    public int contentsAsInt(final boolean neg) throws StreamConstraintsException {
        if (inputStart >= 0 && inputBuffer != null) {
            if (neg) {
                return -NumberInput.parseInt(inputBuffer, inputStart + 1, inputLen - 1);
            }
            return NumberInput.parseInt(inputBuffer, inputStart, inputLen);
        }
        if (hasSegments || currentSegment == null) {
            final char[] chars = contentsAsArray();
            return neg ? -NumberInput.parseInt(chars, 1, chars.length - 1)
                    : NumberInput.parseInt(chars, 0, chars.length);
        }
        if (neg) {
            return -NumberInput.parseInt(currentSegment, 1, currentSize - 1);
        }
        return NumberInput.parseInt(currentSegment, 0, currentSize);
    }

    /**
     * Parses the contents as a long. Contents must already be known to be a valid integer within
     * the range of a long, optionally preceded by a minus sign.
     *
     * @param neg
     *            true if the contents start with a minus sign
     * @return parsed value
     * @throws StreamConstraintsException
     *             if the content is too long
     */
    public long contentsAsLong(final boolean neg) throws StreamConstraintsException {
        if (inputStart >= 0 && inputBuffer != null) {
            if (neg) {
                return -NumberInput.parseLong(inputBuffer, inputStart + 1, inputLen - 1);
            }
            return NumberInput.parseLong(inputBuffer, inputStart, inputLen);
        }
        if (hasSegments || currentSegment == null) {
            final char[] chars = contentsAsArray();
            return neg ? -NumberInput.parseLong(chars, 1, chars.length - 1)
                    : NumberInput.parseLong(chars, 0, chars.length);
        }
        if (neg) {
            return -NumberInput.parseLong(currentSegment, 1, currentSize - 1);
        }
        return NumberInput.parseLong(currentSegment, 0, currentSize);
    }

    /**
     * Returns the contents as a String, which is cached until the contents change.
     *
     * @return contents as a String
     * @throws StreamConstraintsException
     *             if the content is too long
     */
    public String contentsAsString() throws StreamConstraintsException {
        if (resultString == null) {
            if (resultArray != null) {
                resultString = new String(resultArray);
            } else if (inputStart >= 0) {
                if (inputLen < 1) {
                    return resultString = "";
                }
                validateStringLength(inputLen);
                resultString = new String(inputBuffer, inputStart, inputLen);
            } else {
                final int segLen = segmentSize;
                final int currLen = currentSize;
                if (segLen == 0) {
                    if (currLen == 0) {
                        resultString = "";
                    } else {
                        validateStringLength(currLen);
                        resultString = new String(currentSegment, 0, currLen);
                    }
                } else {
                    final int total = segLen + currLen;
                    if (total < 0) {
                        validateStringLength(Integer.MAX_VALUE);
                    }
                    validateStringLength(total);
                    final StringBuilder sb = new StringBuilder(total);
                    if (segments != null) {
                        for (final char[] seg : segments) {
                            sb.append(seg, 0, seg.length);
                        }
                    }
                    sb.append(currentSegment, 0, currentSize);
                    resultString = sb.toString();
                }
            }
        }
        return resultString;
    }

    /**
     * Writes the contents to the given writer.
     *
     * @param w
     *            destination
     * @return number of characters written
     * @throws IOException
     *             if the writer fails
     */
    public int contentsToWriter(final Writer w) throws IOException {
        if (resultArray != null) {
            w.write(resultArray);
            return resultArray.length;
        }
        if (resultString != null) {
            w.write(resultString);
            return resultString.length();
        }
        if (inputStart >= 0) {
            final int len = inputLen;
            if (len > 0) {
                w.write(inputBuffer, inputStart, len);
            }
            return len;
        }
        int total = 0;
        if (segments != null) {
            for (final char[] seg : segments) {
                w.write(seg);
                total += seg.length;
            }
        }
        if (currentSize > 0) {
            w.write(currentSegment, 0, currentSize);
            total += currentSize;
        }
        return total;
    }

    /**
     * Clears the buffer and returns the current segment for direct writing by the caller, who
     * then reports the number of characters written through {@link #setCurrentLength(int)}.
     *
     * @return empty current segment
     */
    public char[] emptyAndGetCurrentSegment() {
        inputStart = -1;
        currentSize = 0;
        inputLen = 0;
        inputBuffer = null;
        resultString = null;
        resultArray = null;
        if (hasSegments) {
            clearSegments();
        }
        char[] curr = currentSegment;
        if (curr == null) {
            currentSegment = curr = buf(0);
        }
        return curr;
    }

    private char[] ensureCurrentSegment() {
        if (currentSegment == null) {
            currentSegment = buf(0);
        }
        return currentSegment;
    }

    private void expand() throws StreamConstraintsException {
        if (segments == null) {
            segments = new ArrayList<>();
        }
        final char[] curr = currentSegment;
        hasSegments = true;
        segments.add(curr);
        segmentSize += curr.length;
        if (segmentSize < 0) {
            validateStringLength(Integer.MAX_VALUE);
        }
        currentSize = 0;

        final int oldLen = curr.length;
        int newLen = oldLen + (oldLen >> 1);
        if (newLen < MIN_SEGMENT_LEN) {
            newLen = MIN_SEGMENT_LEN;
        } else if (newLen > MAX_SEGMENT_LEN) {
            newLen = MAX_SEGMENT_LEN;
        }
        currentSegment = new char[newLen];
    }

    /**
     * Grows the current segment by copying it into a larger array, keeping its contents.
     *
     * @return the new, larger current segment
     */
    public char[] expandCurrentSegment() {
        final char[] curr = currentSegment;
        final int len = curr.length;
        int newLen = len + (len >> 1);
        if (newLen > MAX_SEGMENT_LEN) {
            newLen = len + (len >> 2);
        }
        return currentSegment = Arrays.copyOf(curr, newLen);
    }

    public char[] expandCurrentSegment(final int minSize) {
        final char[] curr = currentSegment;
        if (curr.length >= minSize) {
            return curr;
        }
        return currentSegment = Arrays.copyOf(curr, minSize);
    }

    /**
     * Moves the current segment to the completed list and starts a new, larger one.
     *
     * @return the new current segment
     * @throws StreamConstraintsException
     *             if the total length is too long
     */
    public char[] finishCurrentSegment() throws StreamConstraintsException {
        if (segments == null) {
            segments = new ArrayList<>();
        }
        hasSegments = true;
        segments.add(currentSegment);
        final int oldLen = currentSegment.length;
        segmentSize += oldLen;
        if (segmentSize < 0) {
            validateStringLength(Integer.MAX_VALUE);
        }
        validateStringLength(segmentSize);
        currentSize = 0;

        int newLen = oldLen + (oldLen >> 1);
        if (newLen < MIN_SEGMENT_LEN) {
            newLen = MIN_SEGMENT_LEN;
        } else if (newLen > MAX_SEGMENT_LEN) {
            newLen = MAX_SEGMENT_LEN;
        }
        final char[] curr = new char[newLen];
        currentSegment = curr;
        return curr;
    }

    public char[] getBufferWithoutReset() {
        return currentSegment;
    }

    /**
     * Returns the current segment, ready for appending, unsharing or growing it as needed.
     *
     * @return current segment
     */
    public char[] getCurrentSegment() {
        if (inputStart >= 0) {
            unshare(1);
        } else {
            final char[] curr = currentSegment;
            if (curr == null) {
                currentSegment = buf(0);
            } else if (currentSize >= curr.length) {
                expandCurrentSegment();
            }
        }
        return currentSegment;
    }

    public int getCurrentSegmentSize() {
        return currentSize;
    }

    /**
     * Returns the array holding the contents, to be used with {@link #getTextOffset()} and
     * {@link #size()}.
     *
     * @return array holding the contents
     * @throws StreamConstraintsException
     *             if the content is too long
     */
    public char[] getTextBuffer() throws StreamConstraintsException {
        if (inputStart >= 0) {
            return inputBuffer;
        }
        if (resultArray != null) {
            return resultArray;
        }
        if (resultString != null) {
            return resultArray = resultString.toCharArray();
        }
        if (!hasSegments) {
            return currentSegment == null ? NO_CHARS : currentSegment;
        }
        return contentsAsArray();
    }

    public int getTextOffset() {
        return inputStart >= 0 ? inputStart : 0;
    }

    /**
     * Returns true if the contents are available as a char array without creating a String.
     *
     * @return true if {@link #getTextBuffer()} is cheap
     */
    public boolean hasTextAsCharacters() {
        if (inputStart >= 0 || resultArray != null) {
            return true;
        }
        return resultString == null;
    }

    /**
     * Returns segment buffers to the recycler. The cached result String, if any, stays available.
     */
    public void releaseBuffers() {
        inputStart = -1;
        currentSize = 0;
        inputLen = 0;
        inputBuffer = null;
        resultArray = null;
        if (hasSegments) {
            clearSegments();
        }
        if (allocator != null && currentSegment != null) {
            final char[] buf = currentSegment;
            currentSegment = null;
            allocator.releaseCharBuffer(BufferRecycler.CHAR_TEXT_BUFFER, buf);
        }
    }

    public void resetWith(final char ch) throws StreamConstraintsException {
        inputStart = -1;
        inputLen = 0;
        resultString = null;
        resultArray = null;
        if (hasSegments) {
            clearSegments();
        } else if (currentSegment == null) {
            currentSegment = buf(1);
        }
        currentSegment[0] = ch;
        segmentSize = 0;
        currentSize = 1;
    }

    public void resetWithCopy(final char[] buf, final int offset, final int len) throws StreamConstraintsException {
        inputBuffer = null;
        inputStart = -1;
        inputLen = 0;
        resultString = null;
        resultArray = null;
        if (hasSegments) {
            clearSegments();
        } else if (currentSegment == null) {
            currentSegment = buf(len);
        }
        currentSize = segmentSize = 0;
        append(buf, offset, len);
    }

    public void resetWithCopy(final String text, final int start, final int len) throws StreamConstraintsException {
        inputBuffer = null;
        inputStart = -1;
        inputLen = 0;
        resultString = null;
        resultArray = null;
        if (hasSegments) {
            clearSegments();
        } else if (currentSegment == null) {
            currentSegment = buf(len);
        }
        currentSize = segmentSize = 0;
        append(text, start, len);
    }

    public void resetWithEmpty() {
        inputStart = -1;
        currentSize = 0;
        inputLen = 0;
        inputBuffer = null;
        resultString = null;
        resultArray = null;
        if (hasSegments) {
            clearSegments();
        }
    }

    /**
     * Points this buffer at a slice of a caller-owned array, without copying.
     *
     * @param buf
     *            caller-owned array
     * @param offset
     *            start of the slice
     * @param len
     *            length of the slice
     */
    public void resetWithShared(final char[] buf, final int offset, final int len) {
        resultString = null;
        resultArray = null;
        inputBuffer = buf;
        inputStart = offset;
        inputLen = len;
        if (hasSegments) {
            clearSegments();
        }
    }

    public void resetWithString(final String value) throws StreamConstraintsException {
        inputBuffer = null;
        inputStart = -1;
        inputLen = 0;
        validateStringLength(value.length());
        resultString = value;
        resultArray = null;
        if (hasSegments) {
            clearSegments();
        }
        currentSize = 0;
    }

    private char[] resultArray() throws StreamConstraintsException {
        if (resultString != null) {
            return resultString.toCharArray();
        }
        if (inputStart >= 0) {
            final int len = inputLen;
            if (len < 1) {
                return NO_CHARS;
            }
            validateStringLength(len);
            return Arrays.copyOfRange(inputBuffer, inputStart, inputStart + len);
        }
        final int size = size();
        if (size < 1) {
            if (size < 0) {
                throw new IllegalStateException("TextBuffer overrun: size reported as negative");
            }
            return NO_CHARS;
        }
        validateStringLength(size);
        final char[] result = new char[size];
        int offset = 0;
        if (segments != null && hasSegments) {
            for (final char[] seg : segments) {
                System.arraycopy(seg, 0, result, offset, seg.length);
                offset += seg.length;
            }
        }
        System.arraycopy(currentSegment, 0, result, offset, currentSize);
        return result;
    }

    /**
     * Sets the length of the current segment and returns the contents as a String.
     *
     * @param len
     *            number of characters used in the current segment
     * @return contents as a String
     * @throws StreamConstraintsException
     *             if the content is too long
     */
    public String setCurrentAndReturn(final int len) throws StreamConstraintsException {
        currentSize = len;
        if (segmentSize > 0) {
            return contentsAsString();
        }
        validateStringLength(len);
        final String str = len == 0 ? "" : new String(currentSegment, 0, len);
        resultString = str;
        return str;
    }

    public void setCurrentLength(final int len) {
        currentSize = len;
    }

    /**
     * Returns the number of characters in the buffer.
     *
     * @return length of the contents
     */
    public int size() {
        if (inputStart >= 0) {
            return inputLen;
        }
        if (resultArray != null) {
            return resultArray.length;
        }
        if (resultString != null) {
            return resultString.length();
        }
        return segmentSize + currentSize;
    }

    @Override
    public String toString() {
        try {
            return contentsAsString();
        } catch (final StreamConstraintsException e) {
            return "TextBuffer: Exception when reading contents";
        }
    }

    private void unshare(final int needExtra) {
        final int sharedLen = inputLen;
        inputLen = 0;
        final char[] inputBuf = inputBuffer;
        inputBuffer = null;
        final int start = inputStart;
        inputStart = -1;

        final int needed = sharedLen + needExtra;
        if (currentSegment == null || needed > currentSegment.length) {
            currentSegment = buf(needed);
        }
        if (sharedLen > 0) {
            System.arraycopy(inputBuf, start, currentSegment, 0, sharedLen);
        }
        segmentSize = 0;
        currentSize = sharedLen;
    }

    private void validateAppend(final int toAppend) throws StreamConstraintsException {
        int newTotal = segmentSize + currentSize + toAppend;
        if (newTotal < 0) {
            // overflow
            newTotal = Integer.MAX_VALUE;
        }
        validateStringLength(newTotal);
    }

    /**
     * Checks the total length of the content. Does nothing by default.
     *
     * @param length
     *            total length
     * @throws StreamConstraintsException
     *             if the length exceeds a configured limit
     */
    protected void validateStringLength(final int length) throws StreamConstraintsException {
        // no limit
    }
}
