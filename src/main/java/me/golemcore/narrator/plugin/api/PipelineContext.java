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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-event processing state shared by the plugins of one pipeline pass.
 */
public class PipelineContext {

    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<String> completed = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();

    private String haltReason;
    private String haltedBy;
    private String currentPluginId;

    /**
     * Stop processing after the current plugin. The event is not forwarded.
     */
    public void halt(String reason) {
        if (haltReason == null) {
            haltReason = reason != null ? reason : "halted";
            haltedBy = currentPluginId;
        }
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public String getHaltReason() {
        return haltReason;
    }

    public String getHaltedBy() {
        return haltedBy;
    }

    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public List<String> getCompleted() {
        return Collections.unmodifiableList(completed);
    }

    public List<String> getFailed() {
        return Collections.unmodifiableList(failed);
    }

    // Host bookkeeping, called by the pipeline around each plugin.

    public void enter(String pluginId) {
        currentPluginId = pluginId;
    }

    public void markCompleted(String pluginId) {
        completed.add(pluginId);
    }

    public void markFailed(String pluginId) {
        failed.add(pluginId);
    }
}
