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
package io.sharedbuffer.configuration;

import io.sharedbuffer.buffer.Buffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

public class BufferConfiguration extends ConfigurationOptionProvider {

    public static final String BUFFER_TYPE = "buffer_type";
    public static final String BUFFER_CAPACITY = "buffer_capacity";
    public static final String DRAIN_INTERVAL_MS = "drain_interval_ms";
    public static final String FLUSH_THRESHOLD = "flush_threshold";

    private static final Logger logger = LoggerFactory.getLogger(BufferConfiguration.class);
    private static final String BUFFER_CATEGORY = "Buffer";

    private final ConfigurationOption<BufferType> bufferType = ConfigurationOption.enumOption(BufferType.class)
        .key(BUFFER_TYPE)
        .configurationCategory(BUFFER_CATEGORY)
        .description("The storage strategy of the buffer.\n" +
            "\n" +
            "`UNBOUNDED` keeps every value until it is drained.\n" +
            "`BOUNDED` keeps at most `" + BUFFER_CAPACITY + "` values and overwrites the oldest ones when full.")
        .dynamic(false)
        .buildWithDefault(BufferType.UNBOUNDED);

    private final ConfigurationOption<Integer> bufferCapacity = ConfigurationOption.integerOption()
        .key(BUFFER_CAPACITY)
        .configurationCategory(BUFFER_CATEGORY)
        .description("The maximum number of values a `BOUNDED` buffer retains. Ignored for `UNBOUNDED` buffers.")
        .dynamic(false)
        .addValidator(RangeValidator.min(1))
        .buildWithDefault(100_000);

    private final ConfigurationOption<Long> drainIntervalMs = ConfigurationOption.longOption()
        .key(DRAIN_INTERVAL_MS)
        .configurationCategory(BUFFER_CATEGORY)
        .description("The maximum time in milliseconds between two drains of the buffer.")
        .dynamic(false)
        .addValidator(RangeValidator.min(1L))
        .buildWithDefault(1000L);

    private final ConfigurationOption<Integer> flushThreshold = ConfigurationOption.integerOption()
        .key(FLUSH_THRESHOLD)
        .configurationCategory(BUFFER_CATEGORY)
        .description("When an append leaves at least this many values in the buffer, " +
            "the buffer is drained right away instead of waiting for the next drain interval.\n" +
            "\n" +
            "Set to `0` to only drain in intervals.")
        .dynamic(false)
        .addValidator(RangeValidator.min(0))
        .buildWithDefault(0);

    public BufferType getBufferType() {
        return bufferType.get();
    }

    public int getBufferCapacity() {
        return bufferCapacity.get();
    }

    public long getDrainIntervalMs() {
        return drainIntervalMs.get();
    }

    public int getFlushThreshold() {
        return flushThreshold.get();
    }

    /**
     * Creates a new buffer of the configured {@link #getBufferType() type}.
     */
    public <T> Buffer<T> createBuffer() {
        switch (getBufferType()) {
            case BOUNDED:
                logger.debug("Creating bounded ring buffer with a capacity of {}", getBufferCapacity());
                return Buffer.bounded(getBufferCapacity());
            case UNBOUNDED:
            default:
                logger.debug("Creating unbounded buffer");
                return Buffer.unbounded();
        }
    }
}
