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

import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.TokenStreamContext;
import com.arakelian.cirjson.exc.StreamWriteException;

/**
 * Write-side nesting context. {@link #writeName(String)} and {@link #writeValue()} return a status
 * code telling the generator which separator, if any, to output before the name or value.
 */
public class CirJsonWriteContext extends TokenStreamContext {
    public static final int STATUS_OK_AS_IS = 0;

    public static final int STATUS_OK_AFTER_COMMA = 1;

    public static final int STATUS_OK_AFTER_COLON = 2;

    public static final int STATUS_OK_AFTER_SPACE = 3;

    public static final int STATUS_EXPECT_VALUE = 4;

    public static final int STATUS_EXPECT_NAME = 5;

    public static CirJsonWriteContext createRootContext(final DuplicateDetector dups) {
        return new CirJsonWriteContext(TYPE_ROOT, null, dups, null);
    }

    protected final CirJsonWriteContext parent;

    protected DuplicateDetector dups;

    protected CirJsonWriteContext child;

    protected String currentName;

    protected Object currentValue;

    /** True after a name has been written and before its value **/
    protected boolean gotName;

    protected String containerId;

    protected CirJsonWriteContext(
            final int type,
            final CirJsonWriteContext parent,
            final DuplicateDetector dups,
            final Object currentValue) {
        super(type, -1);
        this.parent = parent;
        this.nestingDepth = parent == null ? 0 : parent.nestingDepth + 1;
        this.dups = dups;
        this.currentValue = currentValue;
    }

    @Override
    public void assignCurrentValue(final Object value) {
        currentValue = value;
    }

    public CirJsonWriteContext clearAndGetParent() {
        currentValue = null;
        return parent;
    }

    public CirJsonWriteContext createChildArrayContext(final Object value) {
        CirJsonWriteContext ctx = child;
        if (ctx == null) {
            child = ctx = new CirJsonWriteContext(TYPE_ARRAY, this, dups == null ? null : dups.child(), value);
            return ctx;
        }
        return ctx.reset(TYPE_ARRAY, value);
    }

    public CirJsonWriteContext createChildObjectContext(final Object value) {
        CirJsonWriteContext ctx = child;
        if (ctx == null) {
            child = ctx = new CirJsonWriteContext(TYPE_OBJECT, this, dups == null ? null : dups.child(), value);
            return ctx;
        }
        return ctx.reset(TYPE_OBJECT, value);
    }

    @Override
    public Object currentValue() {
        return currentValue;
    }

    public String getContainerId() {
        return containerId;
    }

    @Override
    public String getCurrentName() {
        return currentName;
    }

    public DuplicateDetector getDupDetector() {
        return dups;
    }

    @Override
    public CirJsonWriteContext getParent() {
        return parent;
    }

    @Override
    public boolean hasCurrentName() {
        return gotName;
    }

    /**
     * Returns true if the container identifier has not been written yet, meaning the next entry
     * must be the identifier.
     *
     * @return true if the identifier is still expected
     */
    public boolean isExpectingId() {
        return type != TYPE_ROOT && index < 0;
    }

    /**
     * Returns true if a name was written in an object and the value that follows must be the
     * container identifier.
     *
     * @return true if the identifier value is expected next
     */
    public boolean isExpectingIdValue() {
        return type == TYPE_OBJECT ? gotName && index < 0 : type == TYPE_ARRAY && index < 0;
    }

    protected CirJsonWriteContext reset(final int newType, final Object value) {
        type = newType;
        index = -1;
        currentName = null;
        gotName = false;
        currentValue = value;
        containerId = null;
        if (dups != null) {
            dups.reset();
        }
        return this;
    }

    public void setContainerId(final String id) {
        this.containerId = id;
    }

    public CirJsonWriteContext withDupDetector(final DuplicateDetector dups) {
        this.dups = dups;
        return this;
    }

    /**
     * Records a property name.
     *
     * @param name
     *            property name
     * @return {@link #STATUS_EXPECT_VALUE} if a name is not allowed here, otherwise the separator
     *         status
     * @throws StreamWriteException
     *             if duplicate detection is enabled and the name was already written
     */
    public int writeName(final String name) throws StreamWriteException {
        if (type != TYPE_OBJECT || gotName) {
            return STATUS_EXPECT_VALUE;
        }
        gotName = true;
        currentName = name;
        if (dups != null && dups.isDuplicate(name)) {
            final Object src = dups.getSource();
            throw new StreamWriteException(src instanceof CirJsonGenerator ? (CirJsonGenerator) src : null,
                    "Duplicate Object property \"" + name + "\"");
        }
        return index < 0 ? STATUS_OK_AS_IS : STATUS_OK_AFTER_COMMA;
    }

    /**
     * Records a value.
     *
     * @return {@link #STATUS_EXPECT_NAME} if an object needs a name first, otherwise the separator
     *         status
     */
    public int writeValue() {
        if (type == TYPE_OBJECT) {
            if (!gotName) {
                return STATUS_EXPECT_NAME;
            }
            gotName = false;
            ++index;
            return STATUS_OK_AFTER_COLON;
        }
        if (type == TYPE_ARRAY) {
            final int ix = index;
            ++index;
            return ix < 0 ? STATUS_OK_AS_IS : STATUS_OK_AFTER_COMMA;
        }
        ++index;
        return index == 0 ? STATUS_OK_AS_IS : STATUS_OK_AFTER_SPACE;
    }
}
