package me.golemcore.narrator.domain.model;

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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordering tier for queued requests. Higher rank is served first.
 */
public enum RequestPriority {

    LOW("low", 0), NORMAL("normal", 1), HIGH("high", 2);

    private final String value;
    private final int rank;

    RequestPriority(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Parse a wire value. Blank input maps to {@link #NORMAL}.
     *
     * @throws IllegalArgumentException
     *             for unknown values
     */
    public static RequestPriority parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RequestPriority priority : values()) {
            if (priority.value.equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
