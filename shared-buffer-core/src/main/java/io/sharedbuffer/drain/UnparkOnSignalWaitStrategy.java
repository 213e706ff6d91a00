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

import javax.annotation.Nullable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

/**
 * Parks the draining thread for up to {@code parkTimeNanos} and lets producers wake it up early.
 * <p>
 * Only the first producer requesting a drain unparks the draining thread.
 * The request is cleared when the draining thread wakes up, before it drains the buffer.
 * A request which arrives while the thread is busy leaves an unpark permit behind,
 * so the next {@link #idle(int)} returns immediately.
 * </p>
 */
public class UnparkOnSignalWaitStrategy implements MessagePassingQueue.WaitStrategy, DrainSignalHandler {

    private final AtomicBoolean drainRequested = new AtomicBoolean(false);
    private final long parkTimeNanos;
    @Nullable
    private volatile Thread drainingThread;

    public UnparkOnSignalWaitStrategy(long parkTimeNanos) {
        this.parkTimeNanos = parkTimeNanos;
    }

    void setDrainingThread(Thread drainingThread) {
        this.drainingThread = drainingThread;
    }

    @Override
    public int idle(int idleCounter) {
        LockSupport.parkNanos(this, parkTimeNanos);
        drainRequested.set(false);
        return idleCounter;
    }

    @Override
    public void onDrainRequested() {
        if (!drainRequested.get() && drainRequested.compareAndSet(false, true)) {
            wakeUp();
        }
    }

    /**
     * Unparks the draining thread regardless of pending drain requests.
     */
    void wakeUp() {
        final Thread thread = drainingThread;
        if (thread != null) {
            LockSupport.unpark(thread);
        }
    }
}
