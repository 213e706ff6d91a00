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

import io.sharedbuffer.buffer.Buffer;
import io.sharedbuffer.configuration.BufferConfiguration;
import io.sharedbuffer.configuration.BufferConfigurationRegistryBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class BufferDrainerTest {

    private static final long ONE_HOUR_MILLIS = TimeUnit.HOURS.toMillis(1);

    private final List<String> processedValues = new CopyOnWriteArrayList<>();
    @Nullable
    private BufferDrainer<String> drainer;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (drainer != null) {
            drainer.stop();
        }
    }

    @Test
    void testDrainsInIntervals() {
        drainer = new BufferDrainer<>(Buffer.<String>unbounded(), FlushableConsumer.ConsumerAdapter.of(processedValues::add),
            DrainLifecycleCallback.Noop.INSTANCE, 10, 0, 1000, "test-drainer");
        drainer.start();

        drainer.getBuffer().append(List.of("foo", "bar"));

        await().untilAsserted(() -> assertThat(processedValues).containsExactly("foo", "bar"));
    }

    @Test
    void testFlushThresholdTriggersEarlyDrain() {
        DrainLifecycleCallback callback = mock(DrainLifecycleCallback.class);
        drainer = new BufferDrainer<>(Buffer.<String>unbounded(), FlushableConsumer.ConsumerAdapter.of(processedValues::add),
            callback, ONE_HOUR_MILLIS, 3, 1000, "test-drainer");
        drainer.start();
        // the initial drain is done, the next regular one is an hour away
        verify(callback, timeout(5000)).onDrain(0);

        assertThat(drainer.append(List.of("1", "2"))).isEqualTo(2);
        assertThat(drainer.append(List.of("3"))).isEqualTo(3);

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(processedValues).containsExactly("1", "2", "3"));
    }

    @Test
    void testFinalDrainOnStop() throws InterruptedException {
        DrainLifecycleCallback callback = mock(DrainLifecycleCallback.class);
        drainer = new BufferDrainer<>(Buffer.<String>bounded(2), FlushableConsumer.ConsumerAdapter.of(processedValues::add),
            callback, ONE_HOUR_MILLIS, 0, 1000, "test-drainer");
        drainer.start();
        verify(callback, timeout(5000)).onStart();

        drainer.append(List.of("foo", "bar", "baz"));
        drainer.stop();
        drainer = null;

        assertThat(processedValues).containsExactly("bar", "baz");
        verify(callback).onDrain(2);
        verify(callback).onShutdown();
    }

    @Test
    void testStopWithoutStartDrainsOnCallingThread() throws InterruptedException {
        DrainLifecycleCallback callback = mock(DrainLifecycleCallback.class);
        drainer = new BufferDrainer<>(Buffer.<String>unbounded(), FlushableConsumer.ConsumerAdapter.of(processedValues::add),
            callback, ONE_HOUR_MILLIS, 0, 1000, "test-drainer");

        drainer.append(List.of("foo", "bar"));
        drainer.stop();
        drainer = null;

        assertThat(processedValues).containsExactly("foo", "bar");
        verify(callback).onDrain(2);
        verify(callback, never()).onStart();
    }

    @Test
    void testFlushIsCalledAfterEachNonEmptyDrain() throws InterruptedException {
        @SuppressWarnings("unchecked")
        FlushableConsumer<String> consumer = mock(FlushableConsumer.class);
        drainer = new BufferDrainer<>(Buffer.<String>unbounded(), consumer,
            DrainLifecycleCallback.Noop.INSTANCE, ONE_HOUR_MILLIS, 0, 1000, "test-drainer");
        drainer.start();

        drainer.append(List.of("foo", "bar"));
        drainer.stop();
        drainer = null;

        InOrder inOrder = inOrder(consumer);
        inOrder.verify(consumer).accept("foo");
        inOrder.verify(consumer).accept("bar");
        inOrder.verify(consumer).flush();
    }

    @Test
    void testEmptyDrainDoesNotFlush() throws InterruptedException {
        @SuppressWarnings("unchecked")
        FlushableConsumer<String> consumer = mock(FlushableConsumer.class);
        drainer = new BufferDrainer<>(Buffer.<String>unbounded(), consumer,
            DrainLifecycleCallback.Noop.INSTANCE, 10, 0, 1000, "test-drainer");
        drainer.start();
        drainer.stop();
        drainer = null;

        verify(consumer, never()).flush();
    }

    @Test
    void testConsumerErrorDoesNotStopDraining() {
        @SuppressWarnings("unchecked")
        FlushableConsumer<String> consumer = mock(FlushableConsumer.class);
        doThrow(new IllegalStateException("expected")).when(consumer).accept("poison");
        drainer = new BufferDrainer<>(Buffer.<String>unbounded(), consumer,
            DrainLifecycleCallback.Noop.INSTANCE, 10, 0, 1000, "test-drainer");
        drainer.start();

        drainer.append(List.of("poison"));
        verify(consumer, timeout(5000)).accept("poison");
        drainer.append(List.of("foo"));

        verify(consumer, timeout(5000)).accept("foo");
        verify(consumer, timeout(5000)).flush();
    }

    @Test
    void testConsumerErrorDoesNotDropRemainingValues() throws InterruptedException {
        @SuppressWarnings("unchecked")
        FlushableConsumer<String> consumer = mock(FlushableConsumer.class);
        doThrow(new IllegalStateException("expected")).when(consumer).accept("poison");
        drainer = new BufferDrainer<>(Buffer.<String>unbounded(), consumer,
            DrainLifecycleCallback.Noop.INSTANCE, ONE_HOUR_MILLIS, 0, 1000, "test-drainer");
        drainer.start();

        drainer.append(List.of("poison", "foo", "bar"));
        drainer.stop();
        drainer = null;

        InOrder inOrder = inOrder(consumer);
        inOrder.verify(consumer).accept("poison");
        inOrder.verify(consumer).accept("foo");
        inOrder.verify(consumer).accept("bar");
        inOrder.verify(consumer).flush();
    }

    @Test
    void testCreateFromConfiguration() {
        BufferConfiguration config = new BufferConfigurationRegistryBuilder()
            .withConfig(BufferConfiguration.BUFFER_TYPE, "BOUNDED")
            .withConfig(BufferConfiguration.BUFFER_CAPACITY, "2")
            .withConfig(BufferConfiguration.DRAIN_INTERVAL_MS, "10")
            .build()
            .getConfig(BufferConfiguration.class);
        drainer = BufferDrainer.of(config, FlushableConsumer.ConsumerAdapter.of(processedValues::add));
        drainer.start();

        drainer.append(List.of("foo", "bar", "baz"));

        await().untilAsserted(() -> assertThat(processedValues).containsExactly("bar", "baz"));
    }
}
