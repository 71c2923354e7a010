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
 * A required plugin failed while processing an event; processing of that
 * event was aborted.
 */
public class PluginProcessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String pluginId;
    private final String eventId;

    public PluginProcessException(String pluginId, String eventId, Throwable cause) {
        super("Plugin " + pluginId + " failed on event " + eventId + ": "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.pluginId = pluginId;
        this.eventId = eventId;
    }

    public String getPluginId() {
        return pluginId;
    }

    public String getEventId() {
        return eventId;
    }
}
