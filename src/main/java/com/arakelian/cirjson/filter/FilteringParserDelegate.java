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

import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.CirJsonTokenId;
import com.arakelian.cirjson.SerializableString;
import com.arakelian.cirjson.TokenStreamContext;
import com.arakelian.cirjson.exc.StreamReadException;
import com.arakelian.cirjson.filter.TokenFilter.Inclusion;
import com.arakelian.cirjson.sym.PropertyNameMatcher;
import com.arakelian.cirjson.util.CirJsonParserDelegate;
import com.google.common.base.Preconditions;

/**
 * Parser that returns only the tokens a {@link TokenFilter} includes.
 *
 * <p>
 * Containers whose inclusion is not known when they start are held back until a match is found
 * inside them. Their start marker, identifier and pending property name are then returned ahead
 * of the match. Identifiers are never passed to the filter; every container returned is followed
 * by the identifier it had in the input, so the filtered stream is still valid CirJSON.
 * </p>
 *
 * <pre>
 * CirJsonParser p = new FilteringParserDelegate(factory.createParser(json), filter,
 *         Inclusion.INCLUDE_ALL_AND_PATH, true);
 * </pre>
 */
public class FilteringParserDelegate extends CirJsonParserDelegate {
    /** Filter applied at the root level **/
    protected final TokenFilter rootFilter;

    /** False to stop including anything after the first match **/
    protected final boolean allowMultipleMatches;

    protected final Inclusion inclusion;

    /** Context of the token the wrapped parser is positioned on **/
    protected TokenFilterContext headContext;

    /** Context whose held back tokens are being returned, or null if there are none **/
    protected TokenFilterContext exposedContext;

    /** Filter in effect for the next value, or null if it is skipped **/
    protected TokenFilter itemFilter;

    protected int matchCount;

    protected CirJsonToken currToken;

    /** Identifier returned as the current token when it was held back **/
    private String heldBackId;

    /** True if the current token identifies its container **/
    private boolean currentIsId;

    public FilteringParserDelegate(
            final CirJsonParser delegate,
            final TokenFilter filter,
            final Inclusion inclusion,
            final boolean allowMultipleMatches) {
        super(delegate);
        this.rootFilter = Preconditions.checkNotNull(filter, "filter must be non-null");
        this.itemFilter = filter;
        this.headContext = TokenFilterContext.createRootContext(filter);
        this.inclusion = Preconditions.checkNotNull(inclusion, "inclusion must be non-null");
        this.allowMultipleMatches = allowMultipleMatches;
    }

    private TokenFilterContext createChildContext(
            final boolean isArray,
            final TokenFilter f,
            final boolean startHandled) {
        return isArray ? headContext.createChildArrayContext(f, startHandled)
                : headContext.createChildObjectContext(f, startHandled);
    }

    @Override
    public String currentName() {
        if (currToken == CirJsonToken.CIRJSON_ID_PROPERTY_NAME) {
            return getIdName();
        }
        final TokenStreamContext ctxt = filterContext();
        if (currentIsId) {
            return ctxt.isInObject() ? getIdName() : null;
        }
        if (currToken == CirJsonToken.START_OBJECT || currToken == CirJsonToken.START_ARRAY) {
            final TokenStreamContext parent = ctxt.getParent();
            return parent == null ? null : parent.getCurrentName();
        }
        return ctxt.getCurrentName();
    }

    @Override
    public int currentNameMatch(final PropertyNameMatcher matcher) throws IOException {
        if (currToken != null && currToken.isName()) {
            return matcher.matchName(currentName());
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

    /**
     * Pops the context of a container the wrapped parser has just ended.
     *
     * @return true if the start of the container was returned, so its end must be too
     */
    private boolean endContainer(final boolean isArray) {
        final boolean returnEnd = headContext.isStartHandled();
        final TokenFilter f = headContext.getFilter();
        if (f != null && f != TokenFilter.INCLUDE_ALL) {
            if (isArray) {
                f.filterFinishArray();
            } else {
                f.filterFinishObject();
            }
        }
        headContext = headContext.getParent();
        itemFilter = headContext.getFilter();
        return returnEnd;
    }

    private CirJsonToken exposed(final CirJsonToken t, final TokenFilterContext ctxt) {
        currentIsId = t == CirJsonToken.VALUE_STRING || t == CirJsonToken.CIRJSON_ID_PROPERTY_NAME;
        heldBackId = t == CirJsonToken.VALUE_STRING ? ctxt.getContainerId() : null;
        currToken = t;
        return t;
    }

    private TokenFilterContext filterContext() {
        return exposedContext != null ? exposedContext : headContext;
    }

    /**
     * Returns the number of values and containers included by the filter itself, as opposed to
     * those returned because an enclosing container was included.
     *
     * @return match count
     */
    public int getMatchCount() {
        return matchCount;
    }

    public TokenFilter getFilter() {
        return rootFilter;
    }

    @Override
    public TokenStreamContext getParsingContext() {
        return filterContext();
    }

    @Override
    public String getText() throws IOException {
        final String text = heldBackText();
        return text != null ? text : delegate.getText();
    }

    @Override
    public char[] getTextCharacters() throws IOException {
        final String text = heldBackText();
        return text != null ? text.toCharArray() : delegate.getTextCharacters();
    }

    @Override
    public int getTextLength() throws IOException {
        final String text = heldBackText();
        return text != null ? text.length() : delegate.getTextLength();
    }

    @Override
    public int getTextOffset() throws IOException {
        return heldBackText() != null ? 0 : delegate.getTextOffset();
    }

    @Override
    public String getValueAsString() throws IOException {
        if (currToken == CirJsonToken.VALUE_STRING) {
            return getText();
        }
        if (currToken == null || currToken == CirJsonToken.VALUE_NULL || !currToken.isScalarValue()) {
            return null;
        }
        return delegate.getValueAsString();
    }

    @Override
    public boolean hasTextCharacters() {
        return currToken != null && !currToken.isName() && heldBackId == null && delegate.hasTextCharacters();
    }

    @Override
    public boolean hasToken(final CirJsonToken t) {
        return currToken == t;
    }

    @Override
    public boolean hasTokenId(final int id) {
        return currentTokenId() == id;
    }

    /**
     * Returns the text of the current token if the wrapped parser may not be positioned on it:
     * names are taken from the filter context and held back identifiers from their container.
     */
    private String heldBackText() {
        if (currToken != null && currToken.isName()) {
            return currentName();
        }
        if (currToken != null && currToken.isStructStart()) {
            return currToken.asString();
        }
        return heldBackId;
    }

    private CirJsonToken included(final CirJsonToken t, final boolean isId) {
        currentIsId = isId;
        heldBackId = null;
        currToken = t;
        return t;
    }

    @Override
    public boolean isExpectedStartArrayToken() {
        return currToken == CirJsonToken.START_ARRAY;
    }

    @Override
    public boolean isExpectedStartObjectToken() {
        return currToken == CirJsonToken.START_OBJECT;
    }

    @Override
    public String nextName() throws IOException {
        final CirJsonToken t = nextToken();
        return t != null && t.isName() ? currentName() : null;
    }

    @Override
    public boolean nextName(final SerializableString str) throws IOException {
        final String name = nextName();
        return name != null && name.equals(str.getValue());
    }

    @Override
    public int nextNameMatch(final PropertyNameMatcher matcher) throws IOException {
        nextToken();
        return currentNameMatch(matcher);
    }

    @Override
    public String nextTextValue() throws IOException {
        return nextToken() == CirJsonToken.VALUE_STRING ? getText() : null;
    }

    @Override
    public CirJsonToken nextToken() throws IOException {
        // a single value returned by itself cannot be followed by anything
        if (!allowMultipleMatches && currToken != null && exposedContext == null && currToken.isScalarValue()
                && !currentIsId && !headContext.isStartHandled() && inclusion == Inclusion.ONLY_INCLUDE_ALL
                && itemFilter == TokenFilter.INCLUDE_ALL) {
            return included(null, false);
        }

        TokenFilterContext ctxt = exposedContext;
        while (ctxt != null) {
            final CirJsonToken t = ctxt.nextTokenToRead();
            if (t != null) {
                return exposed(t, ctxt);
            }
            if (ctxt == headContext) {
                // held back tokens are done; the wrapped parser is still on the token that matched
                exposedContext = null;
                final CirJsonToken current = delegate.currentToken();
                if (current == CirJsonToken.END_ARRAY || current == CirJsonToken.END_OBJECT) {
                    headContext = headContext.getParent();
                    itemFilter = headContext.getFilter();
                    return included(current, false);
                }
                if (ctxt.isInArray() || current != CirJsonToken.PROPERTY_NAME) {
                    return included(current, false);
                }
                break;
            }
            ctxt = headContext.findChildOf(ctxt);
            exposedContext = ctxt;
            if (ctxt == null) {
                throw new StreamReadException(this, "Unexpected problem: chain of filtered context broken");
            }
        }

        while (true) {
            CirJsonToken t = delegate.nextToken();
            if (t == null) {
                return included(null, false);
            }
            if (headContext.consumeIdToken(t, delegate)) {
                if (headContext.isStartHandled()) {
                    return included(t, true);
                }
                continue;
            }

            TokenFilter f;
            switch (t.id()) {
            case CirJsonTokenId.ID_START_ARRAY:
            case CirJsonTokenId.ID_START_OBJECT: {
                final boolean isArray = t == CirJsonToken.START_ARRAY;
                f = itemFilter;
                if (f == TokenFilter.INCLUDE_ALL) {
                    headContext = createChildContext(isArray, f, true);
                    return included(t, false);
                }
                if (f == null) {
                    delegate.skipChildren();
                    continue;
                }
                f = headContext.checkValue(f);
                if (f == null) {
                    delegate.skipChildren();
                    continue;
                }
                if (f != TokenFilter.INCLUDE_ALL) {
                    f = isArray ? f.filterStartArray() : f.filterStartObject();
                }
                if (f == null) {
                    delegate.skipChildren();
                    continue;
                }
                if (f == TokenFilter.INCLUDE_ALL) {
                    if (!verifyAllowedMatches()) {
                        delegate.skipChildren();
                        continue;
                    }
                    itemFilter = f;
                    headContext = createChildContext(isArray, f, true);
                    return included(t, false);
                }
                itemFilter = f;
                if (inclusion == Inclusion.INCLUDE_NON_NULL) {
                    headContext = createChildContext(isArray, f, true);
                    return included(t, false);
                }
                headContext = createChildContext(isArray, f, false);
                if (inclusion == Inclusion.INCLUDE_ALL_AND_PATH) {
                    t = nextTokenWithBuffering(headContext);
                    if (t != null) {
                        return t;
                    }
                }
                continue;
            }

            case CirJsonTokenId.ID_END_ARRAY:
            case CirJsonTokenId.ID_END_OBJECT: {
                final boolean isArray = t == CirJsonToken.END_ARRAY;
                if (includeEmpty(isArray)) {
                    return nextBuffered(bufferRootOf(headContext));
                }
                if (endContainer(isArray)) {
                    return included(t, false);
                }
                continue;
            }

            case CirJsonTokenId.ID_PROPERTY_NAME: {
                final String name = delegate.currentName();
                f = headContext.setPropertyName(name);
                if (f == TokenFilter.INCLUDE_ALL) {
                    itemFilter = f;
                    return included(t, false);
                }
                f = f == null ? null : f.includeProperty(name);
                if (f == null) {
                    skipValue();
                    continue;
                }
                itemFilter = f;
                if (f == TokenFilter.INCLUDE_ALL) {
                    if (!verifyAllowedMatches()) {
                        skipValue();
                    } else if (inclusion != Inclusion.ONLY_INCLUDE_ALL) {
                        return included(t, false);
                    }
                    continue;
                }
                if (inclusion != Inclusion.ONLY_INCLUDE_ALL) {
                    t = nextTokenWithBuffering(headContext);
                    if (t != null) {
                        return t;
                    }
                }
                continue;
            }

            default:
                // scalar values, and names the context does not expect as identifiers
                if (t.isName()) {
                    throw new StreamReadException(this, "Unexpected identifier property outside of object start");
                }
                f = itemFilter;
                if (f == TokenFilter.INCLUDE_ALL) {
                    return included(t, false);
                }
                if (f != null) {
                    f = headContext.checkValue(f);
                    if ((f == TokenFilter.INCLUDE_ALL || f != null && f.includeValue(delegate))
                            && verifyAllowedMatches()) {
                        return included(t, false);
                    }
                }
                continue;
            }
        }
    }

    /**
     * Returns the outermost container whose start was held back and which encloses
     * <code>ctxt</code>, so that the whole path to <code>ctxt</code> is returned with it.
     */
    private TokenFilterContext bufferRootOf(final TokenFilterContext ctxt) {
        if (inclusion != Inclusion.INCLUDE_ALL_AND_PATH) {
            return ctxt;
        }
        TokenFilterContext root = ctxt;
        while (root.getParent() != null && !root.getParent().isStartHandled()) {
            root = root.getParent();
        }
        return root;
    }

    /**
     * Checks whether an empty container ending now, whose start was held back, is included by its
     * filter. Finishes the filter if so.
     */
    private boolean includeEmpty(final boolean isArray) {
        final TokenFilter f = headContext.getFilter();
        if (headContext.isStartHandled() || f == null || f == TokenFilter.INCLUDE_ALL) {
            return false;
        }
        final boolean include = isArray ? f.includeEmptyArray(headContext.hasCurrentIndex())
                : f.includeEmptyObject(headContext.hasCurrentName());
        if (include) {
            if (isArray) {
                f.filterFinishArray();
            } else {
                f.filterFinishObject();
            }
        }
        return include;
    }

    private CirJsonToken nextBuffered(final TokenFilterContext bufferRoot) throws IOException {
        exposedContext = bufferRoot;
        TokenFilterContext ctxt = bufferRoot;
        CirJsonToken t = ctxt.nextTokenToRead();
        if (t != null) {
            return exposed(t, ctxt);
        }
        while (true) {
            if (ctxt == headContext) {
                throw new StreamReadException(this, "Internal error: failed to locate expected buffered tokens");
            }
            ctxt = headContext.findChildOf(ctxt);
            exposedContext = ctxt;
            if (ctxt == null) {
                throw new StreamReadException(this, "Unexpected problem: chain of filtered context broken");
            }
            t = ctxt.nextTokenToRead();
            if (t != null) {
                return exposed(t, ctxt);
            }
        }
    }

    /**
     * Reads ahead while the inclusion of <code>bufferRoot</code> is undecided. Returns the first
     * held back token once something inside it matches, or null if it ends without a match.
     */
    private CirJsonToken nextTokenWithBuffering(final TokenFilterContext bufferRoot) throws IOException {
        while (true) {
            final CirJsonToken t = delegate.nextToken();
            if (t == null) {
                return null;
            }
            if (headContext.consumeIdToken(t, delegate)) {
                continue;
            }

            TokenFilter f;
            switch (t.id()) {
            case CirJsonTokenId.ID_START_ARRAY:
            case CirJsonTokenId.ID_START_OBJECT: {
                final boolean isArray = t == CirJsonToken.START_ARRAY;
                f = itemFilter == null ? null : headContext.checkValue(itemFilter);
                if (f != null && f != TokenFilter.INCLUDE_ALL) {
                    f = isArray ? f.filterStartArray() : f.filterStartObject();
                }
                if (f == null) {
                    delegate.skipChildren();
                    continue;
                }
                if (f == TokenFilter.INCLUDE_ALL) {
                    if (!verifyAllowedMatches()) {
                        delegate.skipChildren();
                        continue;
                    }
                    itemFilter = f;
                    headContext = createChildContext(isArray, f, true);
                    return nextBuffered(bufferRoot);
                }
                itemFilter = f;
                if (inclusion == Inclusion.INCLUDE_NON_NULL) {
                    headContext = createChildContext(isArray, f, true);
                    return nextBuffered(bufferRoot);
                }
                headContext = createChildContext(isArray, f, false);
                continue;
            }

            case CirJsonTokenId.ID_END_ARRAY:
            case CirJsonTokenId.ID_END_OBJECT: {
                final boolean isArray = t == CirJsonToken.END_ARRAY;
                if (includeEmpty(isArray)) {
                    return nextBuffered(bufferRoot);
                }
                final boolean gotEnd = headContext == bufferRoot;
                final boolean returnEnd = endContainer(isArray);
                if (gotEnd) {
                    return returnEnd ? included(t, false) : null;
                }
                continue;
            }

            case CirJsonTokenId.ID_PROPERTY_NAME: {
                final String name = delegate.currentName();
                f = headContext.setPropertyName(name);
                if (f == TokenFilter.INCLUDE_ALL) {
                    itemFilter = f;
                    return nextBuffered(bufferRoot);
                }
                f = f == null ? null : f.includeProperty(name);
                if (f == null) {
                    skipValue();
                    continue;
                }
                if (f == TokenFilter.INCLUDE_ALL) {
                    if (verifyAllowedMatches()) {
                        itemFilter = f;
                        return nextBuffered(bufferRoot);
                    }
                    skipValue();
                    continue;
                }
                itemFilter = f;
                continue;
            }

            default:
                if (t.isName()) {
                    throw new StreamReadException(this, "Unexpected identifier property outside of object start");
                }
                f = itemFilter;
                if (f == TokenFilter.INCLUDE_ALL) {
                    return nextBuffered(bufferRoot);
                }
                if (f != null) {
                    f = headContext.checkValue(f);
                    if ((f == TokenFilter.INCLUDE_ALL || f != null && f.includeValue(delegate))
                            && verifyAllowedMatches()) {
                        return nextBuffered(bufferRoot);
                    }
                }
                continue;
            }
        }
    }

    @Override
    public CirJsonToken nextValue() throws IOException {
        CirJsonToken t = nextToken();
        if (t != null && t.isName()) {
            t = nextToken();
        }
        return t;
    }

    @Override
    public CirJsonParser skipChildren() throws IOException {
        if (currToken != CirJsonToken.START_OBJECT && currToken != CirJsonToken.START_ARRAY) {
            return this;
        }
        int open = 1;
        while (true) {
            final CirJsonToken t = nextToken();
            if (t == null) {
                return this;
            }
            if (t.isStructStart()) {
                ++open;
            } else if (t.isStructEnd() && --open == 0) {
                return this;
            }
        }
    }

    /**
     * Skips the value of the property the wrapped parser is positioned on.
     */
    private void skipValue() throws IOException {
        delegate.nextToken();
        delegate.skipChildren();
    }

    private boolean verifyAllowedMatches() {
        if (matchCount == 0 || allowMultipleMatches) {
            ++matchCount;
            return true;
        }
        return false;
    }
}
