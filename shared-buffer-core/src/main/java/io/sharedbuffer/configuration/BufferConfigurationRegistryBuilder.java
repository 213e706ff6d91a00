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

import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.ConfigurationSource;
import org.stagemonitor.configuration.source.EnvironmentVariableConfigurationSource;
import org.stagemonitor.configuration.source.SimpleSource;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Builds a {@link ConfigurationRegistry} containing the {@link BufferConfiguration}.
 * <p>
 * Sources in order of precedence:
 * <ol>
 *     <li>inline configuration added via {@link #withConfig(String, String)}</li>
 *     <li>system properties prefixed with {@value #SYSTEM_PROPERTY_PREFIX}</li>
 *     <li>environment variables prefixed with {@value #ENVIRONMENT_VARIABLE_PREFIX}</li>
 * </ol>
 */
public class BufferConfigurationRegistryBuilder {

    public static final String SYSTEM_PROPERTY_PREFIX = "shared.buffer.";
    public static final String ENVIRONMENT_VARIABLE_PREFIX = "SHARED_BUFFER_";

    private final SimpleSource inlineConfig = new SimpleSource("Inline configuration");

    public BufferConfigurationRegistryBuilder withConfig(String key, String value) {
        inlineConfig.add(key, value);
        return this;
    }

    public ConfigurationRegistry build() {
        return ConfigurationRegistry.builder()
            .configSources(getConfigSources())
            .optionProviders(ServiceLoader.load(ConfigurationOptionProvider.class, BufferConfiguration.class.getClassLoader()))
            .build();
    }

    private List<ConfigurationSource> getConfigSources() {
        List<ConfigurationSource> result = new ArrayList<>();
        result.add(inlineConfig);
        result.add(new PrefixingConfigurationSource(new SystemPropertyConfigurationSource(), SYSTEM_PROPERTY_PREFIX));
        result.add(new PrefixingConfigurationSource(new EnvironmentVariableConfigurationSource(), ENVIRONMENT_VARIABLE_PREFIX));
        return result;
    }
}
