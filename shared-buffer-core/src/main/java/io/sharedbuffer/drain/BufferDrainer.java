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
import org.jctools.queues.MessagePassingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Periodically drains a {@link Buffer} on a dedicated thread and hands the drained values to a {@link FlushableConsumer}.
 * <p>
 * Producers may either append to the {@link #getBuffer() buffer} directly or via {@link #append(List)}.
 * The latter wakes the draining thread up as soon as the buffer holds at least {@code flushThreshold} values,
 * without ever blocking the producer.
 * </p>
 */
public class BufferDrainer<T> implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(BufferDrainer.class);
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MILLIS = 5000;

    private final Buffer<T> buffer;
    private final FlushableConsumer<T> consumer;
    private final DrainLifecycleCallback callback;
    private final UnparkOnSignalWaitStrategy waitStrategy;
    private final MessagePassingQueue.ExitCondition exitCondition;
    private final int flushThreshold;
    private final long shutdownTimeoutMillis;
    private final Thread drainingThread;
    private volatile boolean stopRequested = false;
    private volatile boolean started = false;

    public BufferDrainer(Buffer<T> buffer,
                         FlushableConsumer<T> consumer,
                         DrainLifecycleCallback callback,
                         long drainIntervalMillis,
                         int flushThreshold,
                         long shutdownTimeoutMillis,
                         String threadName) {
        this.buffer = buffer;
        this.consumer = consumer;
        this.callback = callback;
        this.flushThreshold = flushThreshold;
        this.shutdownTimeoutMillis = shutdownTimeoutMillis;
        this.waitStrategy = new UnparkOnSignalWaitStrategy(TimeUnit.MILLISECONDS.toNanos(drainIntervalMillis));
        this.exitCondition = new MessagePassingQueue.ExitCondition() {
            @Override
            public boolean keepRunning() {
                return !stopRequested;
            }
        };
        this.drainingThread = new Thread(this, threadName);
        this.drainingThread.setDaemon(true);
        this.waitStrategy.setDrainingThread(drainingThread);
    }

    /**
     * Creates a drainer for a new buffer of the configured type which is drained every {@code drain_interval_ms}
     * and whenever an {@link #append(List)} reaches the configured {@code flush_threshold}.
     */
    public static <T> BufferDrainer<T> of(BufferConfiguration configuration, FlushableConsumer<T> consumer) {
        return new BufferDrainer<>(configuration.<T>createBuffer(),
            consumer,
            DrainLifecycleCallback.Noop.INSTANCE,
            configuration.getDrainIntervalMs(),
            configuration.getFlushThreshold(),
            DEFAULT_SHUTDOWN_TIMEOUT_MILLIS,
            "shared-buffer-drainer");
    }

    public void start() {
        logger.debug("Starting {}", drainingThread.getName());
        started = true;
        drainingThread.start();
    }

    /**
     * Appends to the underlying buffer and requests an early drain if the flush threshold has been reached.
     *
     * @return the number of values stored right after this append
     */
    public int append(List<? extends T> batch) {
        final int size = buffer.append(batch);
        if (flushThreshold > 0 && size >= flushThreshold) {
            waitStrategy.onDrainRequested();
        }
        return size;
    }

    public Buffer<T> getBuffer() {
        return buffer;
    }

    @Override
    public void run() {
        callback.onStart();
        while (exitCondition.keepRunning()) {
            drain();
            if (exitCondition.keepRunning()) {
                waitStrategy.idle(0);
            }
        }
        // values appended after the last regular drain
        drain();
        callback.onShutdown();
    }

    private int drain() {
        final List<T> drained = buffer.getAndClear();
        if (!drained.isEmpty()) {
            for (T value : drained) {
                try {
                    consumer.accept(value);
                } catch (Exception e) {
                    logger.error("Unexpected error while consuming drained value", e);
                }
            }
            try {
                consumer.flush();
            } catch (Exception e) {
                logger.error("Unexpected error while flushing drained values", e);
            }
        }
        callback.onDrain(drained.size());
        return drained.size();
    }

    /**
     * Stops the draining thread after a final drain and waits up to the shutdown timeout for it to terminate.
     * <p>
     * If the drainer has never been started, the final drain happens on the calling thread.
     * </p>
     */
    public void stop() throws InterruptedException {
        stopRequested = true;
        if (!started) {
            drain();
            logger.debug("Stopped {} before it has been started", drainingThread.getName());
            return;
        }
        waitStrategy.wakeUp();
        drainingThread.join(shutdownTimeoutMillis);
        if (drainingThread.isAlive()) {
            logger.warn("{} did not terminate within {} ms", drainingThread.getName(), shutdownTimeoutMillis);
        } else {
            logger.debug("Stopped {}", drainingThread.getName());
        }
    }
}
