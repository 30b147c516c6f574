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

import java.util.HashSet;

import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.CirJsonLocation;
import com.arakelian.cirjson.CirJsonParser;

/**
 * Detects repeated property names within a single object. The first two names are kept in fields
 * and a {@link HashSet} is only allocated once a third name is seen.
 */
public final class DuplicateDetector {
    public static DuplicateDetector rootDetector(final CirJsonGenerator generator) {
        return new DuplicateDetector(generator);
    }

    public static DuplicateDetector rootDetector(final CirJsonParser parser) {
        return new DuplicateDetector(parser);
    }

    /** Parser or generator that owns this detector **/
    private final Object source;

    private String firstName;

    private String secondName;

    private HashSet<String> seen;

    private DuplicateDetector(final Object source) {
        this.source = source;
    }

    public DuplicateDetector child() {
        return new DuplicateDetector(source);
    }

    public CirJsonLocation findLocation() {
        if (source instanceof CirJsonParser) {
            return ((CirJsonParser) source).currentLocation();
        }
        return null;
    }

    public Object getSource() {
        return source;
    }

    /**
     * Records the given name and reports whether it was already seen.
     *
     * @param name
     *            property name
     * @return true if the name was already recorded since the last {@link #reset()}
     */
    public boolean isDuplicate(final String name) {
        if (firstName == null) {
            firstName = name;
            return false;
        }
        if (name.equals(firstName)) {
            return true;
        }
        if (secondName == null) {
            secondName = name;
            return false;
        }
        if (name.equals(secondName)) {
            return true;
        }
        if (seen == null) {
            seen = new HashSet<>(16);
            seen.add(firstName);
            seen.add(secondName);
        }
        return !seen.add(name);
    }

    public void reset() {
        firstName = null;
        secondName = null;
        seen = null;
    }
}
