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

import org.stagemonitor.configuration.source.AbstractConfigurationSource;

import javax.annotation.Nullable;

public class SystemPropertyConfigurationSource extends AbstractConfigurationSource {

    @Nullable
    @Override
    public String getValue(String key) {
        return System.getProperty(key);
    }

    @Override
    public String getName() {
        return "Java System Properties";
    }
}
