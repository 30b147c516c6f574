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

package com.arakelian.cirjson.filter;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

import com.arakelian.cirjson.Base64Variant;
import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.SerializableString;
import com.arakelian.cirjson.TokenStreamContext;
import com.arakelian.cirjson.filter.TokenFilter.Inclusion;
import com.arakelian.cirjson.util.CirJsonGeneratorDelegate;
import com.google.common.base.Preconditions;

/**
 * Generator that passes on only the tokens a {@link TokenFilter} includes.
 *
 * <p>
 * Identifiers written to this generator are consumed and never passed on. Every container that
 * ends up in the output is given a fresh identifier from the wrapped generator instead, so that
 * the output is valid CirJSON however much of the input was filtered out.
 * </p>
 *
 * <pre>
 * CirJsonGenerator g = new FilteringGeneratorDelegate(factory.createGenerator(writer), filter,
 *         Inclusion.INCLUDE_ALL_AND_PATH, true);
 * g.copyCurrentStructure(parser);
 * </pre>
 */
public class FilteringGeneratorDelegate extends CirJsonGeneratorDelegate {
    /** Filter applied at the root level **/
    protected final TokenFilter rootFilter;

    /** False to stop including anything after the first match **/
    protected final boolean allowMultipleMatches;

    protected final Inclusion inclusion;

    protected TokenFilterContext filterContext;

    /** Filter in effect for the next value, or null if it is skipped **/
    protected TokenFilter itemFilter;

    protected int matchCount;

    public FilteringGeneratorDelegate(
            final CirJsonGenerator delegate,
            final TokenFilter filter,
            final Inclusion inclusion,
            final boolean allowMultipleMatches) {
        super(delegate);
        this.rootFilter = Preconditions.checkNotNull(filter, "filter must be non-null");
        this.itemFilter = filter;
        this.filterContext = TokenFilterContext.createRootContext(filter);
        this.inclusion = Preconditions.checkNotNull(inclusion, "inclusion must be non-null");
        this.allowMultipleMatches = allowMultipleMatches;
    }

    private boolean checkBinaryWrite() throws IOException {
        if (itemFilter == null) {
            return false;
        }
        if (itemFilter == TokenFilter.INCLUDE_ALL) {
            return true;
        }
        final TokenFilter state = filterContext.checkValue(itemFilter);
        if (state == null) {
            return false;
        }
        if (state != TokenFilter.INCLUDE_ALL && !state.includeBinary()) {
            return false;
        }
        checkParentPath(true);
        return true;
    }

    private void checkParentPath(final boolean isMatch) throws IOException {
        if (isMatch) {
            ++matchCount;
        }
        if (inclusion == Inclusion.INCLUDE_ALL_AND_PATH) {
            filterContext.writePath(delegate);
        } else if (inclusion == Inclusion.INCLUDE_NON_NULL) {
            filterContext.ensurePropertyNameWritten(delegate);
        }
        if (!allowMultipleMatches) {
            filterContext.skipParentChecks();
        }
    }

    private boolean checkRawValueWrite() throws IOException {
        if (itemFilter == null) {
            return false;
        }
        if (itemFilter == TokenFilter.INCLUDE_ALL) {
            return true;
        }
        if (!itemFilter.includeRawValue()) {
            return false;
        }
        checkParentPath(true);
        return true;
    }

    /**
     * Returns the filter decision for a value about to be written, or null if the value is
     * skipped. Writes the enclosing path of included values as configured.
     */
    private TokenFilter checkScalar() {
        if (itemFilter == null) {
            return null;
        }
        if (itemFilter == TokenFilter.INCLUDE_ALL) {
            return itemFilter;
        }
        return filterContext.checkValue(itemFilter);
    }

    /**
     * Returns the number of times a value was included by the filter, as opposed to being
     * written because an enclosing container was included.
     *
     * @return match count
     */
    public int getMatchCount() {
        return matchCount;
    }

    public TokenFilter getFilter() {
        return rootFilter;
    }

    public TokenFilterContext getFilterContext() {
        return filterContext;
    }

    @Override
    public TokenStreamContext getStreamWriteContext() {
        return filterContext;
    }

    /**
     * Returns true if the string about to be written is the identifier of the current container.
     */
    private boolean isIdValue() {
        return filterContext.consumeIdValue();
    }

    private boolean startScalar(final TokenFilter state, final boolean include) throws IOException {
        if (state == null) {
            return false;
        }
        if (state != TokenFilter.INCLUDE_ALL) {
            if (!include) {
                return false;
            }
            checkParentPath(true);
        } else if (itemFilter != TokenFilter.INCLUDE_ALL) {
            checkParentPath(true);
        }
        return true;
    }

    @Override
    public void writeArrayId(final Object referenced) throws IOException {
        if (!isIdValue()) {
            super.writeArrayId(referenced);
        }
    }

    @Override
    public void writeBinary(final Base64Variant variant, final byte[] data, final int offset, final int length)
            throws IOException {
        filterContext.clearIdState();
        if (checkBinaryWrite()) {
            delegate.writeBinary(variant, data, offset, length);
        }
    }

    @Override
    public void writeBoolean(final boolean state) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeBoolean(state))) {
            delegate.writeBoolean(state);
        }
    }

    @Override
    public void writeEndArray() throws IOException {
        filterContext = filterContext.closeArray(delegate);
        if (filterContext != null) {
            itemFilter = filterContext.getFilter();
        }
    }

    @Override
    public void writeEndObject() throws IOException {
        filterContext = filterContext.closeObject(delegate);
        if (filterContext != null) {
            itemFilter = filterContext.getFilter();
        }
    }

    @Override
    public void writeName(final SerializableString name) throws IOException {
        if (filterContext.consumeIdName(name.getValue())) {
            return;
        }
        if (writeNameFiltered(name.getValue())) {
            delegate.writeName(name);
        }
    }

    @Override
    public void writeName(final String name) throws IOException {
        if (filterContext.consumeIdName(name)) {
            return;
        }
        if (writeNameFiltered(name)) {
            delegate.writeName(name);
        }
    }

    /**
     * Applies the filter to a property name.
     *
     * @return true if the name must be written now
     */
    private boolean writeNameFiltered(final String name) throws IOException {
        TokenFilter state = filterContext.setPropertyName(name);
        if (state == null) {
            itemFilter = null;
            return false;
        }
        if (state == TokenFilter.INCLUDE_ALL) {
            itemFilter = state;
            filterContext.needToHandleName = false;
            return true;
        }
        state = state.includeProperty(name);
        itemFilter = state;
        if (state == TokenFilter.INCLUDE_ALL) {
            // name written as part of the path
            checkParentPath(true);
        }
        return false;
    }

    @Override
    public void writeNull() throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeNull())) {
            delegate.writeNull();
        }
    }

    @Override
    public void writeNumber(final BigDecimal value) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeNumber(value))) {
            delegate.writeNumber(value);
        }
    }

    @Override
    public void writeNumber(final BigInteger value) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeNumber(value))) {
            delegate.writeNumber(value);
        }
    }

    @Override
    public void writeNumber(final double value) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeNumber(value))) {
            delegate.writeNumber(value);
        }
    }

    @Override
    public void writeNumber(final float value) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeNumber(value))) {
            delegate.writeNumber(value);
        }
    }

    @Override
    public void writeNumber(final int value) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeNumber(value))) {
            delegate.writeNumber(value);
        }
    }

    @Override
    public void writeNumber(final long value) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeNumber(value))) {
            delegate.writeNumber(value);
        }
    }

    @Override
    public void writeNumber(final short value) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeNumber(value))) {
            delegate.writeNumber(value);
        }
    }

    @Override
    public void writeNumber(final String encodedValue) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeRawValue())) {
            delegate.writeNumber(encodedValue);
        }
    }

    @Override
    public void writeObject(final Object value) throws IOException {
        if (value == null) {
            writeNull();
        } else if (value instanceof String) {
            writeString((String) value);
        } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            writeNumber(((Number) value).intValue());
        } else if (value instanceof Long) {
            writeNumber(((Long) value).longValue());
        } else if (value instanceof Double) {
            writeNumber(((Double) value).doubleValue());
        } else if (value instanceof Float) {
            writeNumber(((Float) value).floatValue());
        } else if (value instanceof BigInteger) {
            writeNumber((BigInteger) value);
        } else if (value instanceof BigDecimal) {
            writeNumber((BigDecimal) value);
        } else if (value instanceof Boolean) {
            writeBoolean(((Boolean) value).booleanValue());
        } else if (value instanceof byte[]) {
            writeBinary((byte[]) value);
        } else {
            filterContext.clearIdState();
            final TokenFilter f = checkScalar();
            if (startScalar(f, f != null && f.includeEmbeddedValue(value))) {
                delegate.writeObject(value);
            }
        }
    }

    @Override
    public void writeObjectId(final Object referenced) throws IOException {
        if (filterContext.consumeIdName(ID_NAME)) {
            // the identifier string follows
            filterContext.consumeIdValue();
            return;
        }
        super.writeObjectId(referenced);
    }

    @Override
    public void writeRaw(final char c) throws IOException {
        if (checkRawValueWrite()) {
            delegate.writeRaw(c);
        }
    }

    @Override
    public void writeRaw(final char[] text, final int offset, final int len) throws IOException {
        if (checkRawValueWrite()) {
            delegate.writeRaw(text, offset, len);
        }
    }

    @Override
    public void writeRaw(final String text, final int offset, final int len) throws IOException {
        if (checkRawValueWrite()) {
            delegate.writeRaw(text, offset, len);
        }
    }

    @Override
    public void writeRawUTF8String(final byte[] buffer, final int offset, final int len) throws IOException {
        if (isIdValue()) {
            return;
        }
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeRawValue())) {
            delegate.writeRawUTF8String(buffer, offset, len);
        }
    }

    @Override
    public void writeRawValue(final String text, final int offset, final int len) throws IOException {
        filterContext.clearIdState();
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeRawValue())) {
            delegate.writeRawValue(text, offset, len);
        }
    }

    @Override
    public void writeStartArray(final Object currentValue) throws IOException {
        filterContext.clearIdState();
        if (itemFilter == null) {
            filterContext = filterContext.createChildArrayContext(null, false);
            return;
        }
        if (itemFilter == TokenFilter.INCLUDE_ALL) {
            filterContext = filterContext.createChildArrayContext(itemFilter, true);
            filterContext.writeImmediateStart(delegate);
            return;
        }
        TokenFilter f = filterContext.checkValue(itemFilter);
        if (f == null) {
            filterContext = filterContext.createChildArrayContext(null, false);
            return;
        }
        if (f != TokenFilter.INCLUDE_ALL) {
            f = f.filterStartArray();
        }
        if (f == TokenFilter.INCLUDE_ALL) {
            checkParentPath(true);
            filterContext = filterContext.createChildArrayContext(f, true);
            filterContext.writeImmediateStart(delegate);
        } else if (f != null && inclusion == Inclusion.INCLUDE_NON_NULL) {
            checkParentPath(false);
            filterContext = filterContext.createChildArrayContext(f, true);
            filterContext.writeImmediateStart(delegate);
        } else {
            filterContext = filterContext.createChildArrayContext(f, false);
        }
        itemFilter = f;
    }

    @Override
    public void writeStartObject(final Object currentValue) throws IOException {
        filterContext.clearIdState();
        if (itemFilter == null) {
            filterContext = filterContext.createChildObjectContext(null, false);
            return;
        }
        if (itemFilter == TokenFilter.INCLUDE_ALL) {
            filterContext = filterContext.createChildObjectContext(itemFilter, true);
            filterContext.writeImmediateStart(delegate);
            return;
        }
        TokenFilter f = filterContext.checkValue(itemFilter);
        if (f == null) {
            filterContext = filterContext.createChildObjectContext(null, false);
            return;
        }
        if (f != TokenFilter.INCLUDE_ALL) {
            f = f.filterStartObject();
        }
        if (f == TokenFilter.INCLUDE_ALL) {
            checkParentPath(true);
            filterContext = filterContext.createChildObjectContext(f, true);
            filterContext.writeImmediateStart(delegate);
        } else if (f != null && inclusion == Inclusion.INCLUDE_NON_NULL) {
            checkParentPath(false);
            filterContext = filterContext.createChildObjectContext(f, true);
            filterContext.writeImmediateStart(delegate);
        } else {
            filterContext = filterContext.createChildObjectContext(f, false);
        }
        itemFilter = f;
    }

    @Override
    public void writeString(final char[] text, final int offset, final int len) throws IOException {
        if (isIdValue()) {
            return;
        }
        final TokenFilter f = checkScalar();
        if (startScalar(f,
                f != null && (f == TokenFilter.INCLUDE_ALL || f.includeString(new String(text, offset, len))))) {
            delegate.writeString(text, offset, len);
        }
    }

    @Override
    public void writeString(final SerializableString text) throws IOException {
        if (isIdValue()) {
            return;
        }
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeString(text.getValue()))) {
            delegate.writeString(text);
        }
    }

    @Override
    public void writeString(final String text) throws IOException {
        if (isIdValue()) {
            return;
        }
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeString(text))) {
            delegate.writeString(text);
        }
    }

    @Override
    public void writeUTF8String(final byte[] buffer, final int offset, final int len) throws IOException {
        if (isIdValue()) {
            return;
        }
        final TokenFilter f = checkScalar();
        if (startScalar(f, f != null && f.includeRawValue())) {
            delegate.writeUTF8String(buffer, offset, len);
        }
    }
}
