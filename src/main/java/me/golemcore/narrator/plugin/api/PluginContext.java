package me.golemcore.narrator.plugin.api;

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

import me.golemcore.narrator.infrastructure.event.EventBus;
import me.golemcore.narrator.port.outbound.StoragePort;

import java.util.Map;

/**
 * Host-provided context for plugins, built once at startup and handed to
 * every plugin's {@code init}.
 */
public interface PluginContext {

    EventBus eventBus();

    StoragePort storage();

    /**
     * Read-only plugin configuration section.
     */
    Map<String, Object> pluginConfig(String pluginId);
}
