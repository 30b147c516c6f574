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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Small bounded cache of {@link String#intern() interned} property names. When full, the whole
 * cache is cleared; a lock guards only that path.
 */
public final class InternCache extends ConcurrentHashMap<String, String> {
    private static final long serialVersionUID = 1L;

    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(InternCache.class);

    /** Maximum number of cached entries **/
    static final int MAX_ENTRIES = 180;

    public static final InternCache INSTANCE = new InternCache();

    private final transient ReentrantLock lock = new ReentrantLock();

    private InternCache() {
        super(MAX_ENTRIES, 0.8f, 4);
    }

    /**
     * Returns the canonical instance of the given name.
     *
     * @param input
     *            name to intern
     * @return interned name
     */
    public String intern(final String input) {
        final String result = get(input);
        if (result != null) {
            return result;
        }
        if (size() >= MAX_ENTRIES) {
            // only one thread needs to flush
            if (lock.tryLock()) {
                try {
                    if (size() >= MAX_ENTRIES) {
                        LOGGER.debug("Flushing intern cache after {} entries", size());
                        clear();
                    }
                } finally {
                    lock.unlock();
                }
            }
        }
        final String interned = input.intern();
        put(interned, interned);
        return interned;
    }
}
