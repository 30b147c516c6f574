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

package com.arakelian.cirjson.sym;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arakelian.cirjson.util.InternCache;

/**
 * Symbol table used by byte parsers to map UTF-8 encoded property names to canonical Strings
 * without decoding them. Names are looked up by their bytes packed into big-endian 32-bit
 * "quads"; a partial last quad is padded with 1 bits in its unused high bytes so that names of
 * different lengths never share a quad sequence.
 *
 * <p>
 * Root and child tables work as in {@link CharsToNameCanonicalizer}.
 * </p>
 */
public final class ByteQuadsCanonicalizer {
    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(ByteQuadsCanonicalizer.class);

    static final int DEFAULT_T_SIZE = 64;

    static final int MAX_T_SIZE = 0x10000;

    static final int MAX_ENTRIES_FOR_REUSE = 6000;

    private static final int MULT = 33;

    private static final int[] NO_QUADS = new int[0];

    public static ByteQuadsCanonicalizer createRoot(final boolean intern) {
        final long now = System.currentTimeMillis();
        final int seed = (int) now + (int) (now >>> 32) | 1;
        return createRoot(seed, intern);
    }

    public static ByteQuadsCanonicalizer createRoot(final int seed, final boolean intern) {
        return new ByteQuadsCanonicalizer(seed, intern);
    }

    /**
     * Pads a partial last quad the way every lookup and insert expects.
     *
     * @param q
     *            quad holding 1 to 4 bytes in its low end
     * @param bytes
     *            number of bytes in the quad
     * @return padded quad
     */
    public static int pad(final int q, final int bytes) {
        return bytes == 4 ? q : q | -1 << (bytes << 3);
    }

    private final ByteQuadsCanonicalizer parent;

    private final AtomicReference<TableInfo> tableInfo;

    private final int seed;

    private final boolean intern;

    private int[] hashes;

    private int[][] quads;

    private String[] names;

    private int count;

    private boolean hashShared;

    private ByteQuadsCanonicalizer(final ByteQuadsCanonicalizer parent, final TableInfo state) {
        this.parent = parent;
        this.tableInfo = null;
        this.seed = parent.seed;
        this.intern = parent.intern;
        this.hashes = state.hashes;
        this.quads = state.quads;
        this.names = state.names;
        this.count = state.count;
        this.hashShared = true;
    }

    private ByteQuadsCanonicalizer(final int seed, final boolean intern) {
        this.parent = null;
        this.seed = seed;
        this.intern = intern;
        final TableInfo initial = TableInfo.createInitial(DEFAULT_T_SIZE);
        this.tableInfo = new AtomicReference<>(initial);
        this.hashes = initial.hashes;
        this.quads = initial.quads;
        this.names = initial.names;
        this.hashShared = true;
    }

    public String addName(final String name, final int q1) {
        return addName(name, new int[] { q1 }, 1);
    }

    public String addName(final String name, final int q1, final int q2) {
        return addName(name, new int[] { q1, q2 }, 2);
    }

    public String addName(final String name, final int q1, final int q2, final int q3) {
        return addName(name, new int[] { q1, q2, q3 }, 3);
    }

    /**
     * Adds a name with the given quads, returning the canonical instance.
     *
     * @param name
     *            decoded name
     * @param q
     *            quads of the UTF-8 encoded name
     * @param qlen
     *            number of quads used
     * @return canonical name
     */
    public String addName(String name, final int[] q, final int qlen) {
        if (intern) {
            name = InternCache.INSTANCE.intern(name);
        }
        if (hashShared) {
            hashes = Arrays.copyOf(hashes, hashes.length);
            quads = Arrays.copyOf(quads, quads.length);
            names = Arrays.copyOf(names, names.length);
            hashShared = false;
        }
        if (count >= threshold()) {
            rehash();
        }
        final int h = calcHash(q, qlen);
        final int[] copy = qlen == 0 ? NO_QUADS : Arrays.copyOf(q, qlen);
        insert(h, copy, name);
        ++count;
        return name;
    }

    public int bucketCount() {
        return names.length;
    }

    public int calcHash(final int q1) {
        return finish(mix(seed, q1));
    }

    public int calcHash(final int q1, final int q2) {
        return finish(mix(mix(seed, q1), q2));
    }

    public int calcHash(final int q1, final int q2, final int q3) {
        return finish(mix(mix(mix(seed, q1), q2), q3));
    }

    public int calcHash(final int[] q, final int qlen) {
        int h = seed;
        for (int i = 0; i < qlen; i++) {
            h = mix(h, q[i]);
        }
        return finish(h);
    }

    private boolean equalQuads(final int[] stored, final int[] q, final int qlen) {
        if (stored.length != qlen) {
            return false;
        }
        for (int i = 0; i < qlen; i++) {
            if (stored[i] != q[i]) {
                return false;
            }
        }
        return true;
    }

    public String findName(final int q1) {
        final int h = calcHash(q1);
        final int mask = names.length - 1;
        for (int ix = h & mask;; ix = ix + 1 & mask) {
            final String name = names[ix];
            if (name == null) {
                return null;
            }
            final int[] stored = quads[ix];
            if (hashes[ix] == h && stored.length == 1 && stored[0] == q1) {
                return name;
            }
        }
    }

    public String findName(final int q1, final int q2) {
        final int h = calcHash(q1, q2);
        final int mask = names.length - 1;
        for (int ix = h & mask;; ix = ix + 1 & mask) {
            final String name = names[ix];
            if (name == null) {
                return null;
            }
            final int[] stored = quads[ix];
            if (hashes[ix] == h && stored.length == 2 && stored[0] == q1 && stored[1] == q2) {
                return name;
            }
        }
    }

    public String findName(final int q1, final int q2, final int q3) {
        final int h = calcHash(q1, q2, q3);
        final int mask = names.length - 1;
        for (int ix = h & mask;; ix = ix + 1 & mask) {
            final String name = names[ix];
            if (name == null) {
                return null;
            }
            final int[] stored = quads[ix];
            if (hashes[ix] == h && stored.length == 3 && stored[0] == q1 && stored[1] == q2
                    && stored[2] == q3) {
                return name;
            }
        }
    }

    /**
     * Looks up a name by its quads.
     *
     * @param q
     *            quads of the UTF-8 encoded name
     * @param qlen
     *            number of quads used
     * @return canonical name, or null if not present
     */
    public String findName(final int[] q, final int qlen) {
        final int h = calcHash(q, qlen);
        final int mask = names.length - 1;
        for (int ix = h & mask;; ix = ix + 1 & mask) {
            final String name = names[ix];
            if (name == null) {
                return null;
            }
            if (hashes[ix] == h && equalQuads(quads[ix], q, qlen)) {
                return name;
            }
        }
    }

    private int finish(int h) {
        h ^= h >>> 16;
        h *= 0x85EBCA6B;
        h ^= h >>> 13;
        return h;
    }

    public int hashSeed() {
        return seed;
    }

    private void insert(final int h, final int[] q, final String name) {
        final int mask = names.length - 1;
        int ix = h & mask;
        while (names[ix] != null) {
            ix = ix + 1 & mask;
        }
        hashes[ix] = h;
        quads[ix] = q;
        names[ix] = name;
    }

    public ByteQuadsCanonicalizer makeChild() {
        return new ByteQuadsCanonicalizer(this, tableInfo.get());
    }

    private void mergeChild(TableInfo childState) {
        final TableInfo currState = tableInfo.get();
        if (childState.count <= currState.count) {
            return;
        }
        if (childState.count > MAX_ENTRIES_FOR_REUSE) {
            LOGGER.debug("Discarding byte symbol table with {} entries", Integer.valueOf(childState.count));
            childState = TableInfo.createInitial(DEFAULT_T_SIZE);
        }
        tableInfo.compareAndSet(currState, childState);
    }

    private int mix(int h, final int q) {
        h = h * MULT + q;
        return h ^ h >>> 15;
    }

    private void rehash() {
        final int oldSize = names.length;
        final int newSize = oldSize << 1;
        final int[] oldHashes = hashes;
        final int[][] oldQuads = quads;
        final String[] oldNames = names;

        if (newSize > MAX_T_SIZE) {
            LOGGER.debug("Byte symbol table reached {} entries, clearing", Integer.valueOf(count));
            hashes = new int[DEFAULT_T_SIZE];
            quads = new int[DEFAULT_T_SIZE][];
            names = new String[DEFAULT_T_SIZE];
            count = 0;
            return;
        }

        hashes = new int[newSize];
        quads = new int[newSize][];
        names = new String[newSize];
        for (int i = 0; i < oldSize; i++) {
            if (oldNames[i] != null) {
                insert(oldHashes[i], oldQuads[i], oldNames[i]);
            }
        }
    }

    /**
     * Merges names added by this child back into the root.
     */
    public void release() {
        if (parent != null && !hashShared) {
            parent.mergeChild(new TableInfo(count, hashes, quads, names));
            hashShared = true;
        }
    }

    public int size() {
        if (tableInfo != null) {
            return tableInfo.get().count;
        }
        return count;
    }

    private int threshold() {
        // 50% fill rate
        return names.length >> 1;
    }

    private static final class TableInfo {
        static TableInfo createInitial(final int size) {
            return new TableInfo(0, new int[size], new int[size][], new String[size]);
        }

        final int count;

        final int[] hashes;

        final int[][] quads;

        final String[] names;

        TableInfo(final int count, final int[] hashes, final int[][] quads, final String[] names) {
            this.count = count;
            this.hashes = hashes;
            this.quads = quads;
            this.names = names;
        }
    }
}
