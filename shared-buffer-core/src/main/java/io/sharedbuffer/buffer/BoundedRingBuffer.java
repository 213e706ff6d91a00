/*-
 * #%L
 * Shared Buffer
 * %%
 * Copyright (C) 2026 Shared Buffer contributors
 * %%
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
 * #L%
 */
package io.sharedbuffer.buffer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link Buffer} backed by a fixed size ring which retains the most recently appended values.
 * <p>
 * When an append would exceed the capacity, the oldest values are overwritten.
 * Producers are never rejected, they just push the oldest, unread values out of the window.
 * Overwritten values are lost and are counted in {@link #getEvictedCount()}.
 * </p>
 * <p>
 * The ring and its indices are guarded by a single lock which is held for the whole duration of
 * {@link #append(List)} and {@link #getAndClear()}.
 * </p>
 */
public final class BoundedRingBuffer<T> implements Buffer<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Object[] ring;
    private final int capacity;
    /**
     * The slot of the oldest stored value
     */
    private int head;
    private int size;
    private long evictedCount;

    BoundedRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive but was " + capacity);
        }
        this.capacity = capacity;
        this.ring = new Object[capacity];
    }

    @Override
    public int append(List<? extends T> batch) {
        Objects.requireNonNull(batch, "batch");
        final Object[] values = batch.toArray();
        // only the last capacity values of an oversized batch can survive
        final int skip = Math.max(0, values.length - capacity);
        lock.lock();
        try {
            if (skip > 0) {
                evictedCount += size + skip;
                reset();
            }
            for (int i = skip; i < values.length; i++) {
                write(values[i]);
            }
            return size;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<T> getAndClear() {
        lock.lock();
        try {
            final List<T> drained = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                drained.add(elementAt(slot(i)));
            }
            reset();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Returns the total number of values which have been overwritten since this buffer has been created.
     * Draining the buffer does not reset this counter.
     */
    public long getEvictedCount() {
        lock.lock();
        try {
            return evictedCount;
        } finally {
            lock.unlock();
        }
    }

    private void write(Object value) {
        if (size == capacity) {
            ring[head] = value;
            head = slot(1);
            evictedCount++;
        } else {
            ring[slot(size)] = value;
            size++;
        }
    }

    private int slot(int offset) {
        final int slot = head + offset;
        return slot >= capacity ? slot - capacity : slot;
    }

    @SuppressWarnings("unchecked")
    private T elementAt(int slot) {
        return (T) ring[slot];
    }

    private void reset() {
        // release references so drained values can be garbage collected
        for (int i = 0; i < size; i++) {
            ring[slot(i)] = null;
        }
        head = 0;
        size = 0;
    }
}
