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
import java.util.BitSet;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arakelian.cirjson.StreamReadConstraints;
import com.arakelian.cirjson.exc.StreamConstraintsException;
import com.arakelian.cirjson.util.InternCache;

/**
 * Symbol table that maps property names read from char input to canonical String instances.
 *
 * <p>
 * A factory owns one root table, which is never used for lookups directly. Each parser works on a
 * child created by {@link #makeChild()}; the child shares the root's arrays until it adds a name,
 * and on {@link #release()} hands its state back to the root so that later parsers start with the
 * names seen so far.
 * </p>
 *
 * <p>
 * Hashing uses a per-root seed, and collision chains longer than {@link #MAX_COLL_CHAIN_LENGTH}
 * are treated as a possible hash flooding attack.
 * </p>
 */
public final class CharsToNameCanonicalizer {
    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(CharsToNameCanonicalizer.class);

    public static final int HASH_MULT = 33;

    static final int DEFAULT_T_SIZE = 64;

    static final int MAX_T_SIZE = 0x10000;

    /** Children bigger than this are not merged back into the root **/
    static final int MAX_ENTRIES_FOR_REUSE = 12000;

    /** Longest collision chain allowed before the bucket is flagged as overflowing **/
    public static final int MAX_COLL_CHAIN_LENGTH = 50;

    /**
     * Creates a root table with a seed derived from the current time.
     *
     * @param constraints
     *            limits on name length
     * @param canonicalize
     *            false to return a new String for every name
     * @param intern
     *            true to {@link String#intern()} canonical names
     * @return new root table
     */
    public static CharsToNameCanonicalizer createRoot(
            final StreamReadConstraints constraints,
            final boolean canonicalize,
            final boolean intern) {
        final long now = System.currentTimeMillis();
        // bit of scrambling for the low bits
        final int seed = (int) now + (int) (now >>> 32) | 1;
        return createRoot(constraints, seed, canonicalize, intern);
    }

    public static CharsToNameCanonicalizer createRoot(
            final StreamReadConstraints constraints,
            final int seed,
            final boolean canonicalize,
            final boolean intern) {
        return new CharsToNameCanonicalizer(constraints, seed, canonicalize, intern);
    }

    private static int thresholdSize(final int hashAreaSize) {
        // 75% fill rate
        return hashAreaSize - (hashAreaSize >> 2);
    }

    private final CharsToNameCanonicalizer parent;

    /** Shared state of the root; null for children **/
    private final AtomicReference<TableInfo> tableInfo;

    private final StreamReadConstraints constraints;

    private final int seed;

    private final boolean canonicalize;

    private final boolean intern;

    private String[] symbols;

    /** Overflow chains, one per pair of primary slots **/
    private Bucket[] buckets;

    private int size;

    private int sizeThreshold;

    private int indexMask;

    private int longestCollisionList;

    /** True while the arrays are still those of the parent **/
    private boolean hashShared;

    /** Buckets that have overflowed once already **/
    private BitSet overflows;

    private CharsToNameCanonicalizer(
            final CharsToNameCanonicalizer parent,
            final StreamReadConstraints constraints,
            final int seed,
            final boolean canonicalize,
            final boolean intern,
            final TableInfo state) {
        this.parent = parent;
        this.tableInfo = null;
        this.constraints = constraints;
        this.seed = seed;
        this.canonicalize = canonicalize;
        this.intern = intern;
        this.symbols = state.symbols;
        this.buckets = state.buckets;
        this.size = state.size;
        this.longestCollisionList = state.longestCollisionList;
        final int arrayLen = symbols.length;
        this.sizeThreshold = thresholdSize(arrayLen);
        this.indexMask = arrayLen - 1;
        this.hashShared = true;
    }

    private CharsToNameCanonicalizer(
            final StreamReadConstraints constraints,
            final int seed,
            final boolean canonicalize,
            final boolean intern) {
        this.parent = null;
        this.constraints = constraints != null ? constraints : StreamReadConstraints.defaults();
        this.seed = seed;
        this.canonicalize = canonicalize;
        this.intern = intern;
        final TableInfo initial = TableInfo.createInitial(DEFAULT_T_SIZE);
        this.tableInfo = new AtomicReference<>(initial);
        // root is never used for lookups
        this.symbols = initial.symbols;
        this.buckets = initial.buckets;
        this.hashShared = true;
        this.indexMask = DEFAULT_T_SIZE - 1;
        this.sizeThreshold = thresholdSize(DEFAULT_T_SIZE);
    }

    private String addSymbol(final char[] buffer, final int start, final int len, final int h, int index)
            throws StreamConstraintsException {
        if (hashShared) {
            copyArrays();
            hashShared = false;
        }
        if (size >= sizeThreshold) {
            rehash();
            index = hashToIndex(calcHash(buffer, start, len));
        }

        constraints.validateNameLength(len);
        String newSymbol = new String(buffer, start, len);
        if (intern) {
            newSymbol = InternCache.INSTANCE.intern(newSymbol);
        }
        ++size;

        if (symbols[index] == null) {
            symbols[index] = newSymbol;
        } else {
            final int bix = index >> 1;
            final Bucket newBucket = new Bucket(newSymbol, buckets[bix]);
            final int collLen = newBucket.length;
            if (collLen > MAX_COLL_CHAIN_LENGTH) {
                handleSpillOverflow(bix, newBucket, index);
            } else {
                buckets[bix] = newBucket;
                longestCollisionList = Math.max(collLen, longestCollisionList);
            }
        }
        return newSymbol;
    }

    public int bucketCount() {
        return symbols.length;
    }

    public int calcHash(final char[] buffer, final int start, final int len) {
        int hash = seed;
        for (int i = start, end = start + len; i < end; ++i) {
            hash = hash * HASH_MULT + buffer[i];
        }
        // zero is reserved
        return hash == 0 ? 1 : hash;
    }

    public int calcHash(final String key) {
        int hash = seed;
        for (int i = 0, len = key.length(); i < len; ++i) {
            hash = hash * HASH_MULT + key.charAt(i);
        }
        return hash == 0 ? 1 : hash;
    }

    /**
     * Returns the number of names stored in overflow buckets.
     *
     * @return number of colliding names
     */
    public int collisionCount() {
        int count = 0;
        for (final Bucket bucket : buckets) {
            if (bucket != null) {
                count += bucket.length;
            }
        }
        return count;
    }

    private void copyArrays() {
        symbols = Arrays.copyOf(symbols, symbols.length);
        buckets = Arrays.copyOf(buckets, buckets.length);
    }

    /**
     * Returns the canonical String for the given characters, adding it if not yet present.
     *
     * @param buffer
     *            characters of the name
     * @param start
     *            offset of the first character
     * @param len
     *            number of characters
     * @param h
     *            hash from {@link #calcHash(char[], int, int)}
     * @return canonical name
     * @throws StreamConstraintsException
     *             if the name is too long or the table is being flooded
     */
    public String findSymbol(final char[] buffer, final int start, final int len, final int h)
            throws StreamConstraintsException {
        if (len < 1) {
            return "";
        }
        if (!canonicalize) {
            constraints.validateNameLength(len);
            return new String(buffer, start, len);
        }

        final int index = hashToIndex(h);
        String sym = symbols[index];

        if (sym != null) {
            if (sym.length() == len && matches(sym, buffer, start, len)) {
                return sym;
            }
            final Bucket b = buckets[index >> 1];
            if (b != null) {
                sym = b.find(buffer, start, len);
                if (sym != null) {
                    return sym;
                }
            }
        }
        return addSymbol(buffer, start, len, h, index);
    }

    private void handleSpillOverflow(final int bucketIndex, final Bucket newBucket, final int mainIndex)
            throws StreamConstraintsException {
        if (overflows == null) {
            overflows = new BitSet();
            overflows.set(bucketIndex);
        } else if (overflows.get(bucketIndex)) {
            throw new StreamConstraintsException("Longest collision chain in symbol table (of size " + size
                    + ") now exceeds maximum, " + MAX_COLL_CHAIN_LENGTH
                    + " -- suspect a DoS attack based on hash collisions");
        } else {
            overflows.set(bucketIndex);
        }
        symbols[mainIndex] = newBucket.symbol;
        buckets[bucketIndex] = null;
        size -= newBucket.length;
        longestCollisionList = -1;
    }

    public int hashSeed() {
        return seed;
    }

    public int hashToIndex(int rawHash) {
        rawHash += rawHash >>> 15;
        rawHash ^= rawHash << 7;
        rawHash += rawHash >>> 3;
        return rawHash & indexMask;
    }

    public boolean isCanonicalizing() {
        return canonicalize;
    }

    /**
     * Creates a child table for one parser, starting from the latest state of this root.
     *
     * @return child table
     */
    public CharsToNameCanonicalizer makeChild() {
        return new CharsToNameCanonicalizer(this, constraints, seed, canonicalize, intern, tableInfo.get());
    }

    private boolean matches(final String sym, final char[] buffer, final int start, final int len) {
        for (int i = 0; i < len; i++) {
            if (sym.charAt(i) != buffer[start + i]) {
                return false;
            }
        }
        return true;
    }

    public int maxCollisionLength() {
        return longestCollisionList;
    }

    private void mergeChild(TableInfo childState) {
        final int childCount = childState.size;
        final TableInfo currState = tableInfo.get();
        if (childCount == currState.size) {
            return;
        }
        if (childCount > MAX_ENTRIES_FOR_REUSE) {
            LOGGER.debug("Discarding symbol table with {} entries", Integer.valueOf(childCount));
            childState = TableInfo.createInitial(DEFAULT_T_SIZE);
        }
        tableInfo.compareAndSet(currState, childState);
    }

    private void rehash() {
        final int oldSize = symbols.length;
        final int newSize = oldSize + oldSize;

        if (newSize > MAX_T_SIZE) {
            // too big; start over rather than keep growing
            LOGGER.debug("Symbol table reached {} entries, clearing", Integer.valueOf(size));
            size = 0;
            longestCollisionList = 0;
            symbols = new String[DEFAULT_T_SIZE];
            buckets = new Bucket[DEFAULT_T_SIZE >> 1];
            indexMask = DEFAULT_T_SIZE - 1;
            sizeThreshold = thresholdSize(DEFAULT_T_SIZE);
            overflows = null;
            return;
        }

        final String[] oldSyms = symbols;
        final Bucket[] oldBuckets = buckets;
        symbols = new String[newSize];
        buckets = new Bucket[newSize >> 1];
        indexMask = newSize - 1;
        sizeThreshold = thresholdSize(newSize);

        int count = 0;
        int maxColl = 0;
        for (final String symbol : oldSyms) {
            if (symbol != null) {
                ++count;
                maxColl = Math.max(maxColl, store(symbol));
            }
        }
        for (Bucket b : oldBuckets) {
            while (b != null) {
                ++count;
                maxColl = Math.max(maxColl, store(b.symbol));
                b = b.next;
            }
        }
        longestCollisionList = maxColl;
        overflows = null;

        if (count != size) {
            throw new IllegalStateException(
                    "Internal error on symbol table rehash: count after rehash " + count + "; should be " + size);
        }
    }

    /**
     * Merges the names added by this child back into the root, if it added any.
     */
    public void release() {
        if (parent == null || hashShared || !canonicalize) {
            return;
        }
        parent.mergeChild(new TableInfo(this));
        // arrays now belong to the root
        hashShared = true;
    }

    public int size() {
        if (tableInfo != null) {
            return tableInfo.get().size;
        }
        return size;
    }

    private int store(final String symbol) {
        final int index = hashToIndex(calcHash(symbol));
        if (symbols[index] == null) {
            symbols[index] = symbol;
            return 0;
        }
        final int bix = index >> 1;
        final Bucket newB = new Bucket(symbol, buckets[bix]);
        buckets[bix] = newB;
        return newB.length;
    }

    private static final class Bucket {
        final String symbol;

        final Bucket next;

        final int length;

        Bucket(final String symbol, final Bucket next) {
            this.symbol = symbol;
            this.next = next;
            this.length = next == null ? 1 : next.length + 1;
        }

        String find(final char[] buf, final int start, final int len) {
            Bucket b = this;
            do {
                final String sym = b.symbol;
                if (sym.length() == len) {
                    int i = 0;
                    while (sym.charAt(i) == buf[start + i]) {
                        if (++i == len) {
                            return sym;
                        }
                    }
                }
                b = b.next;
            } while (b != null);
            return null;
        }
    }

    private static final class TableInfo {
        static TableInfo createInitial(final int sz) {
            return new TableInfo(0, 0, new String[sz], new Bucket[sz >> 1]);
        }

        final int size;

        final int longestCollisionList;

        final String[] symbols;

        final Bucket[] buckets;

        TableInfo(final CharsToNameCanonicalizer src) {
            this(src.size, src.longestCollisionList, src.symbols, src.buckets);
        }

        TableInfo(final int size, final int longestCollisionList, final String[] symbols, final Bucket[] buckets) {
            this.size = size;
            this.longestCollisionList = longestCollisionList;
            this.symbols = symbols;
            this.buckets = buckets;
        }
    }
}
