package me.golemcore.narrator.domain.service;

import me.golemcore.narrator.infrastructure.config.NarratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LatencyMonitorTest {

    private NarratorProperties properties;
    private LatencyMonitor monitor;

    @BeforeEach
    void setUp() {
        properties = new NarratorProperties();
        properties.getLatency().setMaxSamples(5);
        monitor = new LatencyMonitor(properties);
    }

    @Test
    void computesStatistics() {
        for (int i = 1; i <= 4; i++) {
            monitor.record(LatencyMonitor.ADMISSION, Duration.ofMillis(i));
        }

        LatencyMonitor.LatencyStats stats = monitor.getStats(LatencyMonitor.ADMISSION).orElseThrow();

        assertEquals(4, stats.count());
        assertEquals(Duration.ofMillis(1), stats.min());
        assertEquals(Duration.ofMillis(4), stats.max());
        assertEquals(Duration.ofNanos(2_500_000), stats.mean());
        assertEquals(Duration.ofMillis(4), stats.p95());
    }

    @Test
    void keepsBoundedWindow() {
        for (int i = 1; i <= 8; i++) {
            monitor.record(LatencyMonitor.CANCELLATION, Duration.ofMillis(i));
        }

        LatencyMonitor.LatencyStats stats = monitor.getStats(LatencyMonitor.CANCELLATION).orElseThrow();

        assertEquals(5, stats.count());
        assertEquals(Duration.ofMillis(4), stats.min());
    }

    @Test
    void budgetsFollowConfiguration() {
        assertEquals(Duration.ofMillis(10), monitor.budgetFor(LatencyMonitor.ADMISSION).orElseThrow());
        assertEquals(Duration.ofMillis(50), monitor.budgetFor(LatencyMonitor.CANCELLATION).orElseThrow());
        assertEquals(Duration.ofMillis(50), monitor.budgetFor(LatencyMonitor.STAGE_PREFIX + "x").orElseThrow());
        assertTrue(monitor.budgetFor("custom").isEmpty());
    }

    @Test
    void overBudgetSamplesAreStillRecorded() {
        monitor.record(LatencyMonitor.ADMISSION, Duration.ofSeconds(1));

        assertEquals(1, monitor.getStats(LatencyMonitor.ADMISSION).orElseThrow().count());
    }

    @Test
    void recordSinceMeasuresElapsedTime() {
        Duration measured = monitor.recordSince("custom", System.nanoTime());

        assertFalse(measured.isNegative());
        assertTrue(monitor.getAllStats().containsKey("custom"));
    }

    @Test
    void resetDropsSamples() {
        monitor.record(LatencyMonitor.ADMISSION, Duration.ofMillis(1));

        monitor.reset();

        assertTrue(monitor.getStats(LatencyMonitor.ADMISSION).isEmpty());
        assertTrue(monitor.getAllStats().isEmpty());
    }
}
