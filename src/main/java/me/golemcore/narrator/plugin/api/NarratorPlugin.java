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

import me.golemcore.narrator.domain.model.NarrationEvent;

/**
 * Pluggable processing unit hosted by the pipeline. Every plugin variant
 * implements this single lifecycle contract; the host never depends on
 * concrete plugin types.
 */
public interface NarratorPlugin {

    /**
     * Identity, stage and ordering of this plugin.
     */
    PluginDescriptor descriptor();

    /**
     * Initializes the plugin with the host context.
     *
     * @return {@code false} if the plugin could not initialize; treated like a
     *         thrown exception
     */
    boolean init(PluginContext context);

    /**
     * Whether {@link #process} applies to this event. Default accepts all.
     */
    default boolean accepts(NarrationEvent<?> event) {
        return true;
    }

    /**
     * Processes an event on its way through the pipeline. Returns the event
     * to hand to the next plugin, possibly a transformed copy. Call
     * {@link PipelineContext#halt(String)} to stop processing.
     */
    default NarrationEvent<?> process(NarrationEvent<?> event, PipelineContext context) {
        return event;
    }

    /**
     * Releases plugin resources. Default implementation does nothing.
     */
    default void cleanup() {
        // Default no-op
    }

    default PluginHealth healthCheck() {
        return PluginHealth.ok();
    }
}
