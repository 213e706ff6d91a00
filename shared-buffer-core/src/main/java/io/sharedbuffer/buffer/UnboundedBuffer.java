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
 * A {@link Buffer} without a capacity limit.
 * <p>
 * NOTE: this buffer grows indefinitely if it is not drained.
 * </p>
 */
public final class UnboundedBuffer<T> implements Buffer<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private ArrayList<T> elements = new ArrayList<>();

    UnboundedBuffer() {
    }

    @Override
    public int append(List<? extends T> batch) {
        Objects.requireNonNull(batch, "batch");
        // snapshot before locking, the stored sequence only ever receives a complete batch
        final List<? extends T> copy = new ArrayList<>(batch);
        lock.lock();
        try {
            elements.addAll(copy);
            return elements.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<T> getAndClear() {
        lock.lock();
        try {
            final List<T> drained = elements;
            elements = new ArrayList<>();
            return drained;
        } finally {
            lock.unlock();
        }
    }
}
