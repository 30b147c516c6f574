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

import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonTokenId;

/**
 * Decides which parts of a token stream a {@link FilteringGeneratorDelegate} passes on.
 *
 * <p>
 * Container hooks return the filter to apply to the content below that point: {@link #INCLUDE_ALL}
 * to include everything without further calls, null to exclude everything, or some other filter
 * to keep deciding. Scalar hooks return true to include the value. All scalar hooks delegate to
 * {@link #includeScalar()} by default.
 * </p>
 *
 * <p>
 * Identifiers are never passed to a filter: they are not properties or elements, and the
 * filtering generator writes its own.
 * </p>
 */
public class TokenFilter {
    /**
     * How much of the enclosing structure is written for included values.
     */
    public enum Inclusion {
        /** Only included values themselves, without the names and containers leading to them **/
        ONLY_INCLUDE_ALL,

        /** Included values along with the enclosing containers and property names **/
        INCLUDE_ALL_AND_PATH,

        /**
         * Like {@link #INCLUDE_ALL_AND_PATH}, but containers whose filter is not null are written
         * even if nothing in them is included
         **/
        INCLUDE_NON_NULL
    }

    /** Marker filter that includes everything without further checks **/
    public static final TokenFilter INCLUDE_ALL = new TokenFilter();

    protected TokenFilter() {
    }

    /**
     * Called after the end of an array whose start returned this filter.
     */
    public void filterFinishArray() {
    }

    public void filterFinishObject() {
    }

    /**
     * Called for the start of an array, after the property or element check returned this filter.
     *
     * @return filter for the array content, {@link #INCLUDE_ALL}, or null to skip the array
     */
    public TokenFilter filterStartArray() {
        return this;
    }

    public TokenFilter filterStartObject() {
        return this;
    }

    public boolean includeBinary() {
        return includeScalar();
    }

    public boolean includeBoolean(@SuppressWarnings("unused") final boolean value) {
        return includeScalar();
    }

    /**
     * Called for the end of an array whose start was deferred and never written, because nothing
     * inside it was included.
     *
     * @param contentsFiltered
     *            true if the array had elements that were all filtered out
     * @return true to write the array anyway, as an empty array
     */
    public boolean includeEmptyArray(@SuppressWarnings("unused") final boolean contentsFiltered) {
        return false;
    }

    public boolean includeEmptyObject(@SuppressWarnings("unused") final boolean contentsFiltered) {
        return false;
    }

    /**
     * Called for an array element at the given index. The identifier is not an element, so the
     * first element has index 0.
     *
     * @param index
     *            element index
     * @return filter for the element, {@link #INCLUDE_ALL}, or null to skip it
     */
    public TokenFilter includeElement(@SuppressWarnings("unused") final int index) {
        return this;
    }

    public boolean includeEmbeddedValue(@SuppressWarnings("unused") final Object value) {
        return includeScalar();
    }

    public boolean includeNull() {
        return includeScalar();
    }

    public boolean includeNumber(@SuppressWarnings("unused") final BigDecimal value) {
        return includeScalar();
    }

    public boolean includeNumber(@SuppressWarnings("unused") final BigInteger value) {
        return includeScalar();
    }

    public boolean includeNumber(@SuppressWarnings("unused") final double value) {
        return includeScalar();
    }

    public boolean includeNumber(@SuppressWarnings("unused") final float value) {
        return includeScalar();
    }

    public boolean includeNumber(@SuppressWarnings("unused") final int value) {
        return includeScalar();
    }

    public boolean includeNumber(@SuppressWarnings("unused") final long value) {
        return includeScalar();
    }

    /**
     * Called for a property name of an object.
     *
     * @param name
     *            property name
     * @return filter for the property value, {@link #INCLUDE_ALL}, or null to skip it
     */
    public TokenFilter includeProperty(@SuppressWarnings("unused") final String name) {
        return this;
    }

    /**
     * Called for raw values and for numbers written as pre-encoded text.
     *
     * @return true to include the value
     */
    public boolean includeRawValue() {
        return includeScalar();
    }

    /**
     * Checks the scalar value a parser is positioned on, by calling the hook for its type, so
     * that a filter decides the same way whether it filters a generator or a parser.
     *
     * @param p
     *            parser positioned on a scalar value
     * @return true to include the value
     * @throws IOException
     *             if the value cannot be read
     */
    public boolean includeValue(final CirJsonParser p) throws IOException {
        switch (p.currentTokenId()) {
        case CirJsonTokenId.ID_STRING:
            return includeString(p.getText());
        case CirJsonTokenId.ID_TRUE:
            return includeBoolean(true);
        case CirJsonTokenId.ID_FALSE:
            return includeBoolean(false);
        case CirJsonTokenId.ID_NULL:
            return includeNull();
        case CirJsonTokenId.ID_NUMBER_INT:
        case CirJsonTokenId.ID_NUMBER_FLOAT:
            switch (p.getNumberType()) {
            case INT:
                return includeNumber(p.getIntValue());
            case LONG:
                return includeNumber(p.getLongValue());
            case BIG_INTEGER:
                return includeNumber(p.getBigIntegerValue());
            case FLOAT:
                return includeNumber(p.getFloatValue());
            case DOUBLE:
                return includeNumber(p.getDoubleValue());
            default:
                return includeNumber(p.getDecimalValue());
            }
        case CirJsonTokenId.ID_EMBEDDED_OBJECT:
            return includeEmbeddedValue(p.getEmbeddedObject());
        default:
            return includeScalar();
        }
    }

    public TokenFilter includeRootValue(@SuppressWarnings("unused") final int index) {
        return this;
    }

    /**
     * Default for all scalar hooks.
     *
     * @return true to include scalar values
     */
    public boolean includeScalar() {
        return true;
    }

    public boolean includeString(@SuppressWarnings("unused") final String value) {
        return includeScalar();
    }

    @Override
    public String toString() {
        if (this == INCLUDE_ALL) {
            return "TokenFilter.INCLUDE_ALL";
        }
        return super.toString();
    }
}
