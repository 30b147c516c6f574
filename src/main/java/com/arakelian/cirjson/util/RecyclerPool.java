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

import java.lang.ref.SoftReference;
import java.util.Deque;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentLinkedDeque;

import com.google.common.base.Preconditions;

/**
 * Pool of reusable objects, typically {@link BufferRecycler}s. Pools are safe to share between
 * threads; the objects they hand out are used by one thread at a time.
 *
 * @param <P>
 *            type of pooled object
 */
public interface RecyclerPool<P extends RecyclerPool.WithPool<P>> {
    /**
     * Pool implementation that shares state between all users, with a method to create new
     * pooled objects.
     *
     * @param <P>
     *            type of pooled object
     */
    public abstract static class StatefulImplBase<P extends WithPool<P>> implements RecyclerPool<P> {
        public abstract P createPooled();
    }

    /**
     * Pool that keeps at most one object per thread. Objects are never linked to the pool, so
     * releasing them is a no-op and they stay with their thread.
     *
     * @param <P>
     *            type of pooled object
     */
    public abstract static class ThreadLocalPoolBase<P extends WithPool<P>> implements RecyclerPool<P> {
        private final ThreadLocal<SoftReference<P>> pooled = new ThreadLocal<>();

        @Override
        public P acquireAndLinkPooled() {
            // no linking, objects stay with the thread that created them
            return acquirePooled();
        }

        @Override
        public P acquirePooled() {
            final SoftReference<P> ref = pooled.get();
            P value = ref != null ? ref.get() : null;
            if (value == null) {
                value = createPooled();
                pooled.set(new SoftReference<>(value));
            }
            return value;
        }

        /**
         * Thread-local state cannot be cleared from another thread.
         *
         * @return false
         */
        @Override
        public boolean clear() {
            return false;
        }

        public abstract P createPooled();

        @Override
        public void releasePooled(final P pooled) {
            // nothing to do, object remains with its thread
        }
    }

    /**
     * Pool that never reuses anything.
     *
     * @param <P>
     *            type of pooled object
     */
    public abstract static class NonRecyclingPoolBase<P extends WithPool<P>> implements RecyclerPool<P> {
        @Override
        public P acquireAndLinkPooled() {
            // nothing is released back, so no need to link
            return acquirePooled();
        }

        @Override
        public boolean clear() {
            return true;
        }

        @Override
        public int pooledCount() {
            return 0;
        }

        @Override
        public void releasePooled(final P pooled) {
            // nothing to do
        }
    }

    /**
     * Unbounded pool backed by a lock-free {@link ConcurrentLinkedDeque}.
     *
     * @param <P>
     *            type of pooled object
     */
    public abstract static class ConcurrentDequePoolBase<P extends WithPool<P>> extends StatefulImplBase<P> {
        protected final transient Deque<P> pool = new ConcurrentLinkedDeque<>();

        @Override
        public P acquirePooled() {
            final P pooled = pool.pollFirst();
            return pooled != null ? pooled : createPooled();
        }

        @Override
        public boolean clear() {
            pool.clear();
            return true;
        }

        @Override
        public int pooledCount() {
            return pool.size();
        }

        @Override
        public void releasePooled(final P pooled) {
            pool.offerLast(pooled);
        }
    }

    /**
     * Pool backed by an {@link ArrayBlockingQueue} of fixed capacity. Objects released when the
     * pool is full are discarded.
     *
     * @param <P>
     *            type of pooled object
     */
    public abstract static class BoundedPoolBase<P extends WithPool<P>> extends StatefulImplBase<P> {
        public static final int DEFAULT_CAPACITY = 100;

        protected final transient ArrayBlockingQueue<P> pool;

        private final int capacity;

        protected BoundedPoolBase(final int capacity) {
            Preconditions.checkArgument(capacity >= 0, "capacity must be non-negative");
            this.capacity = capacity == 0 ? DEFAULT_CAPACITY : capacity;
            this.pool = new ArrayBlockingQueue<>(this.capacity);
        }

        @Override
        public P acquirePooled() {
            final P pooled = pool.poll();
            return pooled != null ? pooled : createPooled();
        }

        public int capacity() {
            return capacity;
        }

        @Override
        public boolean clear() {
            pool.clear();
            return true;
        }

        /**
         * Called when an object is released but the pool is already at capacity.
         *
         * @param pooled
         *            object being discarded
         */
        protected void discarded(final P pooled) {
            // subclasses may log
        }

        @Override
        public int pooledCount() {
            return pool.size();
        }

        @Override
        public void releasePooled(final P pooled) {
            if (!pool.offer(pooled)) {
                discarded(pooled);
            }
        }
    }

    /**
     * Implemented by objects that can be pooled, so that they can be returned to the pool that
     * handed them out.
     *
     * @param <P>
     *            type of pooled object
     */
    public interface WithPool<P extends WithPool<P>> {
        /**
         * Returns this object to the pool it is linked to, if any. Calling this more than once is
         * harmless.
         */
        public void releaseToPool();

        /**
         * Links this object to the pool it should be returned to.
         *
         * @param pool
         *            owning pool
         * @return this object
         * @throws IllegalStateException
         *             if already linked to a pool
         */
        public P withPool(RecyclerPool<P> pool);
    }

    /**
     * Acquires an object and links it to this pool, so that {@link WithPool#releaseToPool()}
     * returns it here.
     *
     * @return pooled object
     */
    public default P acquireAndLinkPooled() {
        return acquirePooled().withPool(this);
    }

    public P acquirePooled();

    /**
     * Removes all pooled objects, where supported.
     *
     * @return true if the pool was cleared, false if this kind of pool cannot be cleared
     */
    public boolean clear();

    /**
     * Returns the number of objects currently available in the pool.
     *
     * @return number of pooled objects, or -1 if not known
     */
    public default int pooledCount() {
        return -1;
    }

    public void releasePooled(P pooled);
}
