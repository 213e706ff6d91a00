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

import org.stagemonitor.configuration.ConfigurationOption;

import javax.annotation.Nullable;

public class RangeValidator<T extends Comparable<T>> implements ConfigurationOption.Validator<T> {

    private final T min;

    private RangeValidator(T min) {
        this.min = min;
    }

    public static <T extends Comparable<T>> RangeValidator<T> min(T min) {
        return new RangeValidator<>(min);
    }

    @Override
    public void assertValid(@Nullable T value) {
        if (value != null && value.compareTo(min) < 0) {
            throw new IllegalArgumentException(value + " must be greater than or equal to " + min);
        }
    }
}
