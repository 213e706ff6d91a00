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
package io.sharedbuffer.drain;

import org.jctools.queues.MessagePassingQueue;

public interface FlushableConsumer<T> extends MessagePassingQueue.Consumer<T> {

    /**
     * Gets called after all values of a non-empty drain have been {@linkplain #accept(Object) accepted}.
     * <p>
     * This lets implementations know when's a good time to flush accumulated values,
     * for example by writing a whole batch to a downstream system.
     * </p>
     */
    void flush();

    class ConsumerAdapter<T> implements FlushableConsumer<T> {

        private final MessagePassingQueue.Consumer<T> consumer;

        private ConsumerAdapter(MessagePassingQueue.Consumer<T> consumer) {
            this.consumer = consumer;
        }

        public static <T> FlushableConsumer<T> of(MessagePassingQueue.Consumer<T> consumer) {
            return new ConsumerAdapter<>(consumer);
        }

        @Override
        public void accept(T e) {
            consumer.accept(e);
        }

        @Override
        public void flush() {
        }
    }
}
