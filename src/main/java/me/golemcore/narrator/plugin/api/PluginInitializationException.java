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

/**
 * A required plugin or collaborator could not initialize. Fatal at startup.
 */
public class PluginInitializationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String pluginId;

    public PluginInitializationException(String pluginId, String message) {
        this(pluginId, message, null);
    }

    public PluginInitializationException(String pluginId, String message, Throwable cause) {
        super("Plugin " + pluginId + " failed to initialize: " + message, cause);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
