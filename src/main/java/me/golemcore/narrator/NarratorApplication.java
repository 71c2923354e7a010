package me.golemcore.narrator;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the narrator core.
 *
 * <p>
 * The narrator core arbitrates text-to-speech sessions: at most one request is
 * synthesized and played at a time, and every new request either supersedes
 * the current one or waits in a priority queue.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters) around a plugin pipeline:
 *
 * <pre>
 * Input Layer        → NarrationController, EventBus topics
 * Domain Layer       → NarratorRuntime, PluginPipeline, SessionQueueManager
 * Infrastructure     → Storage/Scheduler Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code narrator.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class NarratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(NarratorApplication.class, args);
    }

}
