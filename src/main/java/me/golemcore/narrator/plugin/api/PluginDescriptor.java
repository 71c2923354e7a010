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

import me.golemcore.narrator.domain.model.PipelineStage;

import java.util.Map;
import java.util.Objects;

/**
 * Static plugin identity.
 *
 * @param id
 *            stable plugin identifier
 * @param name
 *            display name
 * @param version
 *            plugin version
 * @param stage
 *            pipeline phase the plugin runs in
 * @param priority
 *            order within the stage, higher first
 * @param optional
 *            optional plugins may fail without aborting startup or
 *            processing
 * @param config
 *            effective plugin settings
 */
public record PluginDescriptor(
        String id,
        String name,
        String version,
        PipelineStage stage,
        int priority,
        boolean optional,
        Map<String, Object> config
) {

    public PluginDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(stage, "stage must not be null");
        config = config != null ? Map.copyOf(config) : Map.of();
    }
}
