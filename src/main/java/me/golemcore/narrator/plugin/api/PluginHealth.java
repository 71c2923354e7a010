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

import java.util.Map;

/**
 * Self-reported plugin health.
 *
 * @param healthy
 *            overall verdict
 * @param status
 *            short status word
 * @param details
 *            plugin-specific diagnostics
 */
public record PluginHealth(boolean healthy, String status, Map<String, Object> details) {

    public static final String STATUS_HEALTHY = "healthy";
    public static final String STATUS_UNHEALTHY = "unhealthy";
    public static final String STATUS_FAILED = "failed";

    public PluginHealth {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static PluginHealth ok() {
        return new PluginHealth(true, STATUS_HEALTHY, Map.of());
    }

    public static PluginHealth ok(Map<String, Object> details) {
        return new PluginHealth(true, STATUS_HEALTHY, details);
    }

    public static PluginHealth unhealthy(String error) {
        return new PluginHealth(false, STATUS_UNHEALTHY, Map.of("error", String.valueOf(error)));
    }
}
