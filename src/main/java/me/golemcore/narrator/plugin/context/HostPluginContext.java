package me.golemcore.narrator.plugin.context;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.narrator.infrastructure.config.NarratorProperties;
import me.golemcore.narrator.infrastructure.event.EventBus;
import me.golemcore.narrator.plugin.api.PluginContext;
import me.golemcore.narrator.port.outbound.StoragePort;

import java.util.Map;

/**
 * {@link PluginContext} assembled by the runtime at startup.
 */
public record HostPluginContext(
        EventBus eventBus,
        StoragePort storage,
        NarratorProperties properties
) implements PluginContext {

    @Override
    public Map<String, Object> pluginConfig(String pluginId) {
        if (properties == null) {
            return Map.of();
        }
        return Map.copyOf(properties.pluginProperties(pluginId).getSettings());
    }
}
