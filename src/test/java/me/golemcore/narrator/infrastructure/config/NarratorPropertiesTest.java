package me.golemcore.narrator.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NarratorPropertiesTest {

    private static NarratorProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bind("narrator", NarratorProperties.class).orElseGet(NarratorProperties::new);
    }

    @Test
    void defaultsMatchDocumentedValues() {
        NarratorProperties properties = new NarratorProperties();

        assertEquals(10, properties.getQueue().getMaxQueueSize());
        assertTrue(properties.getQueue().isStopPrevious());
        assertEquals(Duration.ofMinutes(5), properties.getQueue().getSessionTimeout());
        assertEquals(Duration.ofSeconds(1), properties.getQueue().getClearDelay());
        assertEquals(NarratorProperties.OverflowPolicy.REJECT, properties.getQueue().getOverflowPolicy());
        assertEquals("af_bella", properties.getRequest().getDefaultVoice());
        assertEquals(Duration.ofMillis(10), properties.getLatency().getAdmissionBudget());
        assertEquals(100, properties.getEventBus().getHistorySize());
    }

    @Test
    void bindsRelaxedNamesAndDurations() {
        NarratorProperties properties = bind(Map.of(
                "narrator.queue.stop-previous", "false",
                "narrator.queue.session-timeout", "90s",
                "narrator.queue.overflow-policy", "evict-lowest",
                "narrator.request.max-speed", "2.5",
                "narrator.plugins.request-normalizer.enabled", "false",
                "narrator.plugins.request-normalizer.settings.mode", "strict"));

        assertFalse(properties.getQueue().isStopPrevious());
        assertEquals(Duration.ofSeconds(90), properties.getQueue().getSessionTimeout());
        assertEquals(NarratorProperties.OverflowPolicy.EVICT_LOWEST, properties.getQueue().getOverflowPolicy());
        assertEquals(2.5, properties.getRequest().getMaxSpeed());
        assertFalse(properties.pluginProperties("request-normalizer").isEnabled());
        assertEquals("strict", properties.pluginProperties("request-normalizer").getSettings().get("mode"));
    }

    @Test
    void unknownPluginGetsEnabledDefaults() {
        NarratorProperties properties = new NarratorProperties();

        assertTrue(properties.pluginProperties("anything").isEnabled());
        assertTrue(properties.pluginProperties("anything").getSettings().isEmpty());
    }
}
