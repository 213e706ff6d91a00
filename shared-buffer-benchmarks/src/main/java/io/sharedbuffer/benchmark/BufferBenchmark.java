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
package io.sharedbuffer.benchmark;

import io.sharedbuffer.buffer.Buffer;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Group;
import org.openjdk.jmh.annotations.GroupThreads;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.runner.RunnerException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class BufferBenchmark extends AbstractBenchmark {

    @Param({"1", "100"})
    public int batchSize;

    private Buffer<Integer> unboundedBuffer;
    private Buffer<Integer> boundedBuffer;
    private List<Integer> batch;

    public static void main(String[] args) throws RunnerException {
        run(BufferBenchmark.class);
    }

    @Setup
    public void setUp() {
        unboundedBuffer = Buffer.unbounded();
        boundedBuffer = Buffer.bounded(100_000);
        batch = new ArrayList<>(batchSize);
        for (int i = 0; i < batchSize; i++) {
            batch.add(i);
        }
    }

    @Benchmark
    @Threads(16)
    public int testBoundedAppend() {
        return boundedBuffer.append(batch);
    }

    @Benchmark
    @Group("unbounded")
    @GroupThreads(15)
    public int testUnboundedAppend() {
        return unboundedBuffer.append(batch);
    }

    // without a consumer, the unbounded buffer would grow until the benchmark runs out of memory
    @Benchmark
    @Group("unbounded")
    @GroupThreads(1)
    public List<Integer> testUnboundedGetAndClear() {
        return unboundedBuffer.getAndClear();
    }

    @Benchmark
    @Group("bounded")
    @GroupThreads(15)
    public int testBoundedAppendWhileDraining() {
        return boundedBuffer.append(batch);
    }

    @Benchmark
    @Group("bounded")
    @GroupThreads(1)
    public List<Integer> testBoundedGetAndClear() {
        return boundedBuffer.getAndClear();
    }
}
