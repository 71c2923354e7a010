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

/**
 * Lifecycle status of a narration session. Transitions only move forward,
 * except for the playing/paused cycle.
 */
public enum SessionStatus {

    QUEUED("queued"), PLAYING("playing"), PAUSED("paused"), STOPPED("stopped"), COMPLETED("completed");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == STOPPED || this == COMPLETED;
    }

    public boolean canTransitionTo(SessionStatus target) {
        return switch (this) {
        case QUEUED -> target == PLAYING || target == STOPPED || target == COMPLETED;
        case PLAYING -> target == PAUSED || target == STOPPED || target == COMPLETED;
        case PAUSED -> target == PLAYING || target == STOPPED || target == COMPLETED;
        case STOPPED, COMPLETED -> false;
        };
    }
}
