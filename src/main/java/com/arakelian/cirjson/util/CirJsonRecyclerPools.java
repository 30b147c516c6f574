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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory methods for the {@link BufferRecycler} pools used by parsers and generators.
 */
public final class CirJsonRecyclerPools {
    /**
     * Pool that keeps one recycler per thread.
     */
    public static class ThreadLocalPool extends RecyclerPool.ThreadLocalPoolBase<BufferRecycler> {
        static final ThreadLocalPool GLOBAL = new ThreadLocalPool();

        @Override
        public BufferRecycler createPooled() {
            return new BufferRecycler();
        }
    }

    /**
     * Pool that creates a new recycler for every parser or generator.
     */
    public static class NonRecyclingPool extends RecyclerPool.NonRecyclingPoolBase<BufferRecycler> {
        static final NonRecyclingPool GLOBAL = new NonRecyclingPool();

        @Override
        public BufferRecycler acquirePooled() {
            return new BufferRecycler();
        }
    }

    /**
     * Unbounded pool shared by all threads.
     */
    public static class ConcurrentDequePool extends RecyclerPool.ConcurrentDequePoolBase<BufferRecycler> {
        @Override
        public BufferRecycler createPooled() {
            return new BufferRecycler();
        }
    }

    /**
     * Pool shared by all threads that retains at most a fixed number of recyclers.
     */
    public static class BoundedPool extends RecyclerPool.BoundedPoolBase<BufferRecycler> {
        public BoundedPool(final int capacity) {
            super(capacity);
        }

        @Override
        public BufferRecycler createPooled() {
            return new BufferRecycler();
        }

        @Override
        protected void discarded(final BufferRecycler pooled) {
            LOGGER.debug("Bounded pool at capacity {}, discarding released recycler", capacity());
        }
    }

    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(CirJsonRecyclerPools.class);

    /**
     * Returns the pool used when none is configured, currently the thread-local pool.
     *
     * @return the default pool
     */
    public static RecyclerPool<BufferRecycler> defaultPool() {
        return threadLocalPool();
    }

    public static RecyclerPool<BufferRecycler> newBoundedPool() {
        return new BoundedPool(RecyclerPool.BoundedPoolBase.DEFAULT_CAPACITY);
    }

    public static RecyclerPool<BufferRecycler> newBoundedPool(final int capacity) {
        return new BoundedPool(capacity);
    }

    public static RecyclerPool<BufferRecycler> newConcurrentDequePool() {
        return new ConcurrentDequePool();
    }

    public static RecyclerPool<BufferRecycler> nonRecyclingPool() {
        return NonRecyclingPool.GLOBAL;
    }

    public static RecyclerPool<BufferRecycler> threadLocalPool() {
        return ThreadLocalPool.GLOBAL;
    }

    private CirJsonRecyclerPools() {
        // utility class
    }
}
