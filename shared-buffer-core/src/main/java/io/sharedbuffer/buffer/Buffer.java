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

import java.util.List;

/**
 * A thread-safe buffer which accumulates values appended by any number of producers
 * until a consumer drains them with {@link #getAndClear()}.
 * <p>
 * A {@link Buffer} reference is the handle to the underlying storage.
 * Every thread holding a reference to the same instance shares the same storage,
 * so passing the reference around is all it takes to add another producer or consumer.
 * </p>
 * <p>
 * {@link #append(List)} and {@link #getAndClear()} are atomic with respect to each other:
 * a drain never observes half of a concurrent append.
 * </p>
 *
 * @param <T> the type of the buffered values
 */
public interface Buffer<T> {

    /**
     * Creates a buffer which grows as needed and never drops values.
     */
    static <T> Buffer<T> unbounded() {
        return new UnboundedBuffer<>();
    }

    /**
     * Creates a buffer which holds at most {@code capacity} values and overwrites the oldest ones when full.
     *
     * @param capacity the maximum number of values to retain, must be positive
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    static <T> Buffer<T> bounded(int capacity) {
        return new BoundedRingBuffer<>(capacity);
    }

    /**
     * Appends all values of the batch, preserving their order.
     *
     * @param batch the values to append, may be empty
     * @return the number of values stored right after this append
     */
    int append(List<? extends T> batch);

    /**
     * Removes and returns all currently stored values in the order they were appended.
     *
     * @return the drained values, empty if nothing has been appended since the last drain
     */
    List<T> getAndClear();
}
