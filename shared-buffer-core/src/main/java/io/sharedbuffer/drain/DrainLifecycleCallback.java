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

public interface DrainLifecycleCallback {

    /**
     * Called on the draining thread when the drainer starts
     */
    void onStart();

    /**
     * Called after each drain, including empty ones
     *
     * @param drained the number of values which have been drained
     */
    void onDrain(int drained);

    /**
     * Called right after the final drain, before the draining thread terminates
     */
    void onShutdown();

    class Noop implements DrainLifecycleCallback {

        public static final DrainLifecycleCallback INSTANCE = new Noop();

        @Override
        public void onStart() {
        }

        @Override
        public void onDrain(int drained) {
        }

        @Override
        public void onShutdown() {
        }
    }
}
