package me.golemcore.narrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the narrator core, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code narrator.*} prefix:
 * <ul>
 * <li>{@link QueueProperties} - session queue manager behavior</li>
 * <li>{@link RequestProperties} - request normalization defaults</li>
 * <li>{@link LatencyProperties} - admission/cancellation budgets</li>
 * <li>{@link StorageProperties} - persistence location</li>
 * <li>{@link EventBusProperties} - bus history</li>
 * <li>{@link PluginProperties} - per-plugin enablement and settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "narrator")
@Data
public class NarratorProperties {

    private QueueProperties queue = new QueueProperties();
    private RequestProperties request = new RequestProperties();
    private LatencyProperties latency = new LatencyProperties();
    private StorageProperties storage = new StorageProperties();
    private EventBusProperties eventBus = new EventBusProperties();
    private Map<String, PluginProperties> plugins = new HashMap<>();

    /**
     * Settings for a plugin id; unknown plugins get enabled defaults.
     */
    public PluginProperties pluginProperties(String pluginId) {
        PluginProperties properties = plugins.get(pluginId);
        return properties != null ? properties : new PluginProperties();
    }

    // ==================== QUEUE ====================

    @Data
    public static class QueueProperties {
        private int maxQueueSize = 10;

        /** Cancel the current session whenever a new request arrives. */
        private boolean stopPrevious = true;

        /** Active sessions older than this are stopped by the sweep. */
        private Duration sessionTimeout = Duration.ofMinutes(5);

        private boolean persistState = true;

        /** Grace window before a completed session leaves the slot. */
        private Duration clearDelay = Duration.ofSeconds(1);

        private Duration sweepInterval = Duration.ofSeconds(60);
        private Duration persistDebounce = Duration.ofMillis(250);
        private Duration restoreTimeout = Duration.ofSeconds(2);
        private OverflowPolicy overflowPolicy = OverflowPolicy.REJECT;
    }

    public enum OverflowPolicy {
        /** Refuse the newcomer. */
        REJECT,
        /** Drop the lowest-priority, newest entry if the newcomer outranks it. */
        EVICT_LOWEST
    }

    // ==================== REQUEST ====================

    @Data
    public static class RequestProperties {
        private String defaultVoice = "af_bella";
        private double minSpeed = 0.5;
        private double maxSpeed = 3.0;
        private int maxTextLength = 50000;
    }

    // ==================== LATENCY ====================

    @Data
    public static class LatencyProperties {
        private Duration admissionBudget = Duration.ofMillis(10);
        private Duration cancellationBudget = Duration.ofMillis(50);
        private Duration stageBudget = Duration.ofMillis(50);
        private int maxSamples = 1000;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String directory = "state";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/narrator";
    }

    // ==================== EVENT BUS ====================

    @Data
    public static class EventBusProperties {
        private int historySize = 100;
    }

    // ==================== PLUGINS ====================

    @Data
    public static class PluginProperties {
        private boolean enabled = true;
        private Map<String, Object> settings = new HashMap<>();
    }
}
