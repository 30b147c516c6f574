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

import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.TokenStreamContext;

/**
 * Nesting context of a {@link FilteringGeneratorDelegate} or a {@link FilteringParserDelegate}.
 * Besides the filter in effect, each level remembers whether its start marker has been written
 * (or returned) yet, and the property name that is still pending, so that the path to an included
 * value can be produced once a match is found.
 *
 * <p>
 * On the read side a level also keeps the identifier read from the input, which is returned
 * after the start marker when a deferred container is exposed.
 * </p>
 *
 * <p>
 * Array indexes count elements only; the identifier that starts an array is not an element.
 * </p>
 */
public class TokenFilterContext extends TokenStreamContext {
    public static TokenFilterContext createRootContext(final TokenFilter filter) {
        // root context is always handled
        return new TokenFilterContext(TYPE_ROOT, null, filter, true);
    }

    private static String nextId(final CirJsonGenerator gen, final boolean isArray) {
        // fresh key, so every written container gets the next identifier of the generator
        return gen.getId(new Object(), isArray);
    }

    protected final TokenFilterContext parent;

    protected TokenFilterContext child;

    protected String currentName;

    protected TokenFilter filter;

    /** True if the start marker of this container has been written **/
    protected boolean startHandled;

    /** True if {@link #currentName} has not been written yet **/
    protected boolean needToHandleName;

    /** True while the incoming identifier name of an object is expected **/
    protected boolean expectingIdName;

    /** True while the incoming identifier string is expected **/
    protected boolean expectingIdValue;

    /** Identifier read from the input, if any **/
    protected String containerId;

    /** Identifier tokens still to be returned after a deferred start marker **/
    protected int pendingIdTokens;

    protected TokenFilterContext(
            final int type,
            final TokenFilterContext parent,
            final TokenFilter filter,
            final boolean startHandled) {
        super(type, -1);
        this.parent = parent;
        this.nestingDepth = parent == null ? 0 : parent.nestingDepth + 1;
        this.filter = filter;
        this.startHandled = startHandled;
        this.expectingIdName = type == TYPE_OBJECT;
        this.expectingIdValue = type == TYPE_ARRAY;
    }

    /**
     * Checks a value about to be written here: the root value or array element check of the
     * filter. Objects have checked the property name already.
     *
     * @param f
     *            filter in effect
     * @return filter for the value, or null to skip it
     */
    public TokenFilter checkValue(final TokenFilter f) {
        if (type == TYPE_OBJECT) {
            return f;
        }
        final int ix = ++index;
        if (type == TYPE_ARRAY) {
            return f.includeElement(ix);
        }
        return f.includeRootValue(ix);
    }

    public void clearIdState() {
        expectingIdName = false;
        expectingIdValue = false;
    }

    /**
     * Writes the end of this array, or an empty array if nothing was written but the filter asks
     * for empty arrays.
     *
     * @param gen
     *            target generator
     * @return parent context
     * @throws IOException
     *             if the output cannot be written
     */
    public TokenFilterContext closeArray(final CirJsonGenerator gen) throws IOException {
        if (startHandled) {
            gen.writeEndArray();
        } else if (filter != null && filter != TokenFilter.INCLUDE_ALL) {
            if (filter.includeEmptyArray(hasCurrentIndex())) {
                if (parent != null) {
                    parent.writePath(gen);
                }
                writeStart(gen);
                gen.writeEndArray();
            }
        }
        if (filter != null && filter != TokenFilter.INCLUDE_ALL) {
            filter.filterFinishArray();
        }
        return parent;
    }

    public TokenFilterContext closeObject(final CirJsonGenerator gen) throws IOException {
        if (startHandled) {
            gen.writeEndObject();
        } else if (filter != null && filter != TokenFilter.INCLUDE_ALL) {
            if (filter.includeEmptyObject(hasCurrentName())) {
                if (parent != null) {
                    parent.writePath(gen);
                }
                writeStart(gen);
                gen.writeEndObject();
            }
        }
        if (filter != null && filter != TokenFilter.INCLUDE_ALL) {
            filter.filterFinishObject();
        }
        return parent;
    }

    /**
     * Consumes the incoming identifier property name, if one is expected here.
     *
     * @param name
     *            property name being written
     * @return true if the name was the identifier name and must not be written
     */
    public boolean consumeIdName(final String name) {
        if (expectingIdName && CirJsonGenerator.ID_NAME.equals(name)) {
            expectingIdName = false;
            expectingIdValue = true;
            return true;
        }
        clearIdState();
        return false;
    }

    /**
     * Consumes the incoming identifier string, if one is expected here.
     *
     * @return true if a string written now is the identifier and must not be written
     */
    public boolean consumeIdValue() {
        if (expectingIdValue) {
            expectingIdValue = false;
            return true;
        }
        expectingIdName = false;
        return false;
    }

    /**
     * Consumes a token read from a parser if it identifies this container: the identifier name
     * token of an object, or the identifier string that follows it (or starts an array).
     *
     * @param t
     *            token just read
     * @param p
     *            parser positioned on the token
     * @return true if the token identifies this container and is not subject to filtering
     * @throws IOException
     *             if the identifier text cannot be read
     */
    public boolean consumeIdToken(final CirJsonToken t, final CirJsonParser p) throws IOException {
        if (t == CirJsonToken.CIRJSON_ID_PROPERTY_NAME && expectingIdName) {
            expectingIdName = false;
            expectingIdValue = true;
            return true;
        }
        if (t == CirJsonToken.VALUE_STRING && expectingIdValue) {
            expectingIdValue = false;
            containerId = p.getText();
            return true;
        }
        clearIdState();
        return false;
    }

    public TokenFilterContext createChildArrayContext(final TokenFilter f, final boolean writeStart) {
        TokenFilterContext ctxt = child;
        if (ctxt == null) {
            child = ctxt = new TokenFilterContext(TYPE_ARRAY, this, f, writeStart);
            return ctxt;
        }
        return ctxt.reset(TYPE_ARRAY, f, writeStart);
    }

    public TokenFilterContext createChildObjectContext(final TokenFilter f, final boolean writeStart) {
        TokenFilterContext ctxt = child;
        if (ctxt == null) {
            child = ctxt = new TokenFilterContext(TYPE_OBJECT, this, f, writeStart);
            return ctxt;
        }
        return ctxt.reset(TYPE_OBJECT, f, writeStart);
    }

    /**
     * Writes the pending property name, if any. Used when only the name of an included value, not
     * its enclosing containers, must be written.
     *
     * @param gen
     *            target generator
     * @throws IOException
     *             if the output cannot be written
     */
    public void ensurePropertyNameWritten(final CirJsonGenerator gen) throws IOException {
        if (needToHandleName) {
            needToHandleName = false;
            gen.writeName(currentName);
        }
    }

    /**
     * Returns the context below <code>parent</code> on the way from <code>parent</code> to this
     * context.
     *
     * @param parent
     *            an ancestor of this context
     * @return child of <code>parent</code> that is this context or one of its ancestors, or null
     *         if <code>parent</code> is not an ancestor
     */
    public TokenFilterContext findChildOf(final TokenFilterContext parent) {
        if (this.parent == parent) {
            return this;
        }
        TokenFilterContext curr = this.parent;
        while (curr != null) {
            final TokenFilterContext p = curr.parent;
            if (p == parent) {
                return curr;
            }
            curr = p;
        }
        return null;
    }

    public String getContainerId() {
        return containerId;
    }

    @Override
    public String getCurrentName() {
        return currentName;
    }

    public TokenFilter getFilter() {
        return filter;
    }

    @Override
    public TokenFilterContext getParent() {
        return parent;
    }

    public boolean hasCurrentIndex() {
        return index >= 0;
    }

    @Override
    public boolean hasPathSegment() {
        if (type == TYPE_ARRAY) {
            return index >= 0;
        }
        return super.hasPathSegment();
    }

    public boolean isStartHandled() {
        return startHandled;
    }

    /**
     * Returns the next token of this level that was held back while its inclusion was undecided:
     * the start marker, then the identifier tokens, then the pending property name.
     *
     * @return next held back token, or null if there are none left
     */
    public CirJsonToken nextTokenToRead() {
        if (!startHandled) {
            startHandled = true;
            if (type == TYPE_OBJECT) {
                pendingIdTokens = 2;
                return CirJsonToken.START_OBJECT;
            }
            pendingIdTokens = 1;
            return CirJsonToken.START_ARRAY;
        }
        if (pendingIdTokens > 0) {
            // object identifiers are a name and a string, array identifiers a string only
            final int remaining = pendingIdTokens--;
            return remaining == 2 ? CirJsonToken.CIRJSON_ID_PROPERTY_NAME : CirJsonToken.VALUE_STRING;
        }
        if (needToHandleName && type == TYPE_OBJECT) {
            needToHandleName = false;
            return CirJsonToken.PROPERTY_NAME;
        }
        return null;
    }

    private TokenFilterContext reset(final int newType, final TokenFilter f, final boolean writeStart) {
        type = newType;
        filter = f;
        index = -1;
        currentName = null;
        startHandled = writeStart;
        needToHandleName = false;
        containerId = null;
        pendingIdTokens = 0;
        expectingIdName = newType == TYPE_OBJECT;
        expectingIdValue = newType == TYPE_ARRAY;
        return this;
    }

    /**
     * Records the property name about to be written; it is written only if the value turns out to
     * be included.
     *
     * @param name
     *            property name
     * @return filter in effect for this object
     */
    public TokenFilter setPropertyName(final String name) {
        currentName = name;
        needToHandleName = true;
        return filter;
    }

    /**
     * Clears the filters of this context and all of its parents, so that nothing else is
     * included after the first match.
     */
    public void skipParentChecks() {
        for (TokenFilterContext ctxt = this; ctxt != null; ctxt = ctxt.parent) {
            ctxt.filter = null;
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(64);
        sb.append(super.toString());
        if (!startHandled) {
            sb.append(" (deferred)");
        }
        return sb.toString();
    }

    /**
     * Writes the start markers, identifiers and names of this context and its parents that have
     * not been written yet, so that a value included here can be written next.
     *
     * @param gen
     *            target generator
     * @throws IOException
     *             if the output cannot be written
     */
    public void writePath(final CirJsonGenerator gen) throws IOException {
        if (filter == null || filter == TokenFilter.INCLUDE_ALL) {
            return;
        }
        if (parent != null) {
            parent.writePath(gen);
        }
        if (!startHandled) {
            writeStart(gen);
        }
        ensurePropertyNameWritten(gen);
    }

    private void writeStart(final CirJsonGenerator gen) throws IOException {
        startHandled = true;
        if (type == TYPE_OBJECT) {
            gen.writeStartObject();
            gen.writeName(CirJsonGenerator.ID_NAME);
            gen.writeString(nextId(gen, false));
        } else if (type == TYPE_ARRAY) {
            gen.writeStartArray();
            gen.writeString(nextId(gen, true));
        }
    }

    /**
     * Writes the start of a container whose filter included it immediately, followed by its
     * identifier.
     *
     * @param gen
     *            target generator
     * @throws IOException
     *             if the output cannot be written
     */
    public void writeImmediateStart(final CirJsonGenerator gen) throws IOException {
        writeStart(gen);
    }
}
