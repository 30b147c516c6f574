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

package com.arakelian.cirjson;

import java.util.ArrayDeque;
import java.util.Deque;

import com.arakelian.cirjson.io.CharTypes;
import com.arakelian.cirjson.io.ContentReference;

/**
 * One level of the nesting stack maintained by parsers and generators: the root, an array or an
 * object. Contexts form a singly linked list from child to parent.
 */
public abstract class TokenStreamContext {
    public static final int TYPE_ROOT = 0;

    public static final int TYPE_ARRAY = 1;

    public static final int TYPE_OBJECT = 2;

    protected int type;

    /**
     * Index of the current entry; -1 before the first entry. In arrays the identifier occupies
     * index 0.
     */
    protected int index;

    protected int nestingDepth;

    protected TokenStreamContext(final int type, final int index) {
        this.type = type;
        this.index = index;
    }

    public void assignCurrentValue(final Object value) {
    }

    public Object currentValue() {
        return null;
    }

    public final int getCurrentIndex() {
        return index < 0 ? 0 : index;
    }

    public abstract String getCurrentName();

    public final int getEntryCount() {
        return index + 1;
    }

    public final int getNestingDepth() {
        return nestingDepth;
    }

    public abstract TokenStreamContext getParent();

    public boolean hasCurrentName() {
        return getCurrentName() != null;
    }

    /**
     * Returns true if this context has a path segment: an object with a current name, or an array
     * positioned past its identifier.
     *
     * @return true if {@link #pathAsString()} would include a segment for this context
     */
    public boolean hasPathSegment() {
        if (type == TYPE_ARRAY) {
            return isIndexValid();
        }
        if (type == TYPE_OBJECT) {
            return hasCurrentName();
        }
        return false;
    }

    public final boolean isInArray() {
        return type == TYPE_ARRAY;
    }

    public final boolean isIndexValid() {
        return type == TYPE_ARRAY ? index > 0 : index >= 0;
    }

    public final boolean isInObject() {
        return type == TYPE_OBJECT;
    }

    public final boolean isInRoot() {
        return type == TYPE_ROOT;
    }

    /**
     * Returns the path from the root to the current position, for example {@code /ob/value} or
     * {@code /array/2}. Array segments use the raw entry index, so the first element after the
     * identifier is {@code 1}.
     *
     * @return path of the current position
     */
    public String pathAsString() {
        final Deque<TokenStreamContext> contexts = new ArrayDeque<>();
        for (TokenStreamContext ctx = this; ctx != null; ctx = ctx.getParent()) {
            if (ctx.hasPathSegment()) {
                contexts.push(ctx);
            }
        }
        if (contexts.isEmpty()) {
            return "/";
        }
        final StringBuilder sb = new StringBuilder(64);
        for (final TokenStreamContext ctx : contexts) {
            sb.append('/');
            if (ctx.type == TYPE_ARRAY) {
                sb.append(ctx.index);
            } else {
                sb.append(ctx.getCurrentName());
            }
        }
        return sb.toString();
    }

    public CirJsonLocation startLocation(final ContentReference reference) {
        return CirJsonLocation.NA;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(64);
        switch (type) {
        case TYPE_ROOT:
            sb.append('/');
            break;
        case TYPE_ARRAY:
            sb.append('[').append(getCurrentIndex()).append(']');
            break;
        case TYPE_OBJECT:
        default:
            sb.append('{');
            final String currentName = getCurrentName();
            if (currentName != null) {
                sb.append('"');
                CharTypes.appendQuoted(sb, currentName);
                sb.append('"');
            } else {
                sb.append('?');
            }
            sb.append('}');
            break;
        }
        return sb.toString();
    }

    public final String typeDesc() {
        switch (type) {
        case TYPE_ROOT:
            return "root";
        case TYPE_ARRAY:
            return "Array";
        case TYPE_OBJECT:
            return "Object";
        default:
            return "?";
        }
    }
}
