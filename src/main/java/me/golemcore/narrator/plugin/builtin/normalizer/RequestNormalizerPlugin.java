package me.golemcore.narrator.plugin.builtin.normalizer;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.narrator.domain.model.NarrationEvent;
import me.golemcore.narrator.domain.model.NarrationTopics;
import me.golemcore.narrator.domain.model.PipelineStage;
import me.golemcore.narrator.domain.model.SpeechRequest;
import me.golemcore.narrator.infrastructure.config.NarratorProperties;
import me.golemcore.narrator.plugin.api.NarratorPlugin;
import me.golemcore.narrator.plugin.api.PipelineContext;
import me.golemcore.narrator.plugin.api.PluginContext;
import me.golemcore.narrator.plugin.api.PluginDescriptor;
import me.golemcore.narrator.plugin.api.PluginInitializationException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Preparation-stage plugin that cleans up speech requests before they reach
 * the queue manager.
 *
 * <p>
 * Text is trimmed; empty or oversized text halts the event. Speed is clamped
 * to the configured range, and missing voice, priority and id are filled in.
 *
 * <p>
 * Limits come from {@code narrator.request.*} and may be overridden per
 * plugin through {@code narrator.plugins.request-normalizer.settings.*} with
 * the keys {@code default-voice}, {@code min-speed}, {@code max-speed} and
 * {@code max-text-length}.
 */
@Component
@Slf4j
public class RequestNormalizerPlugin implements NarratorPlugin {

    public static final String PLUGIN_ID = "request-normalizer";
    public static final String HALT_EMPTY_TEXT = "empty-text";
    public static final String HALT_TEXT_TOO_LONG = "text-too-long";

    static final String SETTING_DEFAULT_VOICE = "default-voice";
    static final String SETTING_MIN_SPEED = "min-speed";
    static final String SETTING_MAX_SPEED = "max-speed";
    static final String SETTING_MAX_TEXT_LENGTH = "max-text-length";

    private static final double DEFAULT_SPEED = 1.0;

    private volatile String defaultVoice;
    private volatile double minSpeed;
    private volatile double maxSpeed;
    private volatile int maxTextLength;

    public RequestNormalizerPlugin(NarratorProperties properties) {
        NarratorProperties.RequestProperties config = properties.getRequest();
        this.defaultVoice = config.getDefaultVoice();
        this.minSpeed = config.getMinSpeed();
        this.maxSpeed = config.getMaxSpeed();
        this.maxTextLength = config.getMaxTextLength();
    }

    @Override
    public PluginDescriptor descriptor() {
        return new PluginDescriptor(PLUGIN_ID, "RequestNormalizer", "1.0.0", PipelineStage.PREPARATION, 0, false,
                Map.of(
                        "defaultVoice", defaultVoice,
                        "minSpeed", minSpeed,
                        "maxSpeed", maxSpeed,
                        "maxTextLength", maxTextLength));
    }

    @Override
    public boolean init(PluginContext context) {
        Map<String, Object> settings = context != null ? context.pluginConfig(PLUGIN_ID) : Map.of();
        if (settings == null || settings.isEmpty()) {
            return true;
        }

        String voice = stringSetting(settings, SETTING_DEFAULT_VOICE, defaultVoice);
        double min = numberSetting(settings, SETTING_MIN_SPEED, minSpeed);
        double max = numberSetting(settings, SETTING_MAX_SPEED, maxSpeed);
        int textLimit = (int) numberSetting(settings, SETTING_MAX_TEXT_LENGTH, maxTextLength);
        if (min <= 0 || min > max) {
            throw new PluginInitializationException(PLUGIN_ID,
                    "Invalid speed range " + min + ".." + max);
        }
        if (textLimit <= 0) {
            throw new PluginInitializationException(PLUGIN_ID, "max-text-length must be positive");
        }

        this.defaultVoice = voice;
        this.minSpeed = min;
        this.maxSpeed = max;
        this.maxTextLength = textLimit;
        log.info("[Normalizer] Settings applied: voice={}, speed={}..{}, maxTextLength={}",
                voice, min, max, textLimit);
        return true;
    }

    @Override
    public boolean accepts(NarrationEvent<?> event) {
        return event.isOn(NarrationTopics.REQUEST);
    }

    @Override
    public NarrationEvent<?> process(NarrationEvent<?> event, PipelineContext context) {
        NarrationEvent<SpeechRequest> request = event.as(NarrationTopics.REQUEST);
        SpeechRequest original = request.payload();
        if (original == null) {
            context.halt(HALT_EMPTY_TEXT);
            return event;
        }

        String text = original.text() != null ? original.text().trim() : "";
        if (text.isEmpty()) {
            log.debug("[Normalizer] Dropping request {} with empty text", original.id());
            context.halt(HALT_EMPTY_TEXT);
            return event;
        }
        if (text.length() > maxTextLength) {
            log.warn("[Normalizer] Dropping request {}: {} chars exceeds limit {}",
                    original.id(), text.length(), maxTextLength);
            context.halt(HALT_TEXT_TOO_LONG);
            return event;
        }

        SpeechRequest normalized = original.toBuilder()
                .id(isBlank(original.id()) ? "tts-" + UUID.randomUUID() : original.id())
                .text(text)
                .voice(isBlank(original.voice()) ? defaultVoice : original.voice().trim())
                .speed(clampSpeed(original.speed()))
                .priority(original.effectivePriority())
                .build();
        return request.withPayload(normalized);
    }

    double clampSpeed(Double speed) {
        if (speed == null || speed.isNaN()) {
            return DEFAULT_SPEED;
        }
        return Math.max(minSpeed, Math.min(maxSpeed, speed));
    }

    private static String stringSetting(Map<String, Object> settings, String key, String fallback) {
        Object value = settings.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            return fallback;
        }
        return String.valueOf(value).trim();
    }

    private static double numberSetting(Map<String, Object> settings, String key, double fallback) {
        Object value = settings.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new PluginInitializationException(PLUGIN_ID, "Setting " + key + " is not a number: " + value, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
