package com.kotsin.margin.monitoring;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.event.RiskEngineEventType;
import com.kotsin.margin.event.RiskEventDispatcher;
import com.kotsin.margin.model.TrendDirection;
import com.kotsin.margin.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarginLevelMonitor threshold bands, rapid change detection and the trend window
 */
class MarginLevelMonitorTest {

    private static final double LOSS_CUT = 20.0;

    private ScheduledExecutorService scheduler;
    private MarginLevelMonitor monitor;
    private final List<RiskEngineEvent> dispatched = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        RiskEventDispatcher dispatcher = new RiskEventDispatcher();
        dispatcher.register(dispatched::add);
        monitor = new MarginLevelMonitor(new MarginGuardProperties(), scheduler, dispatcher,
                MutableClock.at("2026-01-16T10:00:00Z"));
    }

    @AfterEach
    void tearDown() {
        monitor.stopAllMonitoring();
        scheduler.shutdownNow();
    }

    private List<RiskEngineEventType> types(List<RiskEngineEvent> events) {
        return events.stream().map(RiskEngineEvent::getType).collect(Collectors.toList());
    }

    // ======================== THRESHOLDS ========================

    @ParameterizedTest
    @DisplayName("Each level breaches exactly one band")
    @CsvSource({
            "180.0, WARNING_THRESHOLD",
            "200.0, WARNING_THRESHOLD",
            "150.0, DANGER_THRESHOLD",
            "120.0, DANGER_THRESHOLD",
            "100.0, CRITICAL_THRESHOLD",
            "60.0, CRITICAL_THRESHOLD"
    })
    void testDisjointBands(double level, RiskEngineEventType expected) {
        List<RiskEngineEvent> events = monitor.checkThresholds("acc-1", level,
                new MarginGuardProperties.Thresholds(), LOSS_CUT);
        assertEquals(List.of(expected), types(events));
    }

    @Test
    @DisplayName("Healthy level emits nothing")
    void testHealthyLevel() {
        assertTrue(monitor.checkThresholds("acc-1", 250, new MarginGuardProperties.Thresholds(), LOSS_CUT).isEmpty());
    }

    @Test
    @DisplayName("Loss-cut band is checked on top of the critical band")
    void testLossCutBand() {
        List<RiskEngineEvent> events = monitor.checkThresholds("acc-1", 15, new MarginGuardProperties.Thresholds(), LOSS_CUT);
        assertEquals(List.of(RiskEngineEventType.CRITICAL_THRESHOLD, RiskEngineEventType.LOSSCUT_LEVEL_REACHED), types(events));
        assertEquals(RiskEngineEvent.Severity.CRITICAL, events.get(1).getSeverity());
    }

    // ======================== RAPID CHANGE ========================

    @Test
    @DisplayName("A drop of 5% or more between readings is a rapid change")
    void testRapidChange() {
        monitor.processMarginLevel("acc-1", 300, 3000, 1000, LOSS_CUT);
        List<RiskEngineEvent> events = monitor.processMarginLevel("acc-1", 280, 2800, 1000, LOSS_CUT);

        assertEquals(List.of(RiskEngineEventType.RAPID_MARGIN_CHANGE), types(events));
        assertTrue(dispatched.stream().anyMatch(e -> e.getType() == RiskEngineEventType.RAPID_MARGIN_CHANGE));
    }

    @Test
    @DisplayName("Small moves are not rapid changes")
    void testSmallChange() {
        monitor.processMarginLevel("acc-1", 300, 3000, 1000, LOSS_CUT);
        assertTrue(monitor.processMarginLevel("acc-1", 295, 2950, 1000, LOSS_CUT).isEmpty());
    }

    // ======================== TREND WINDOW ========================

    @Test
    @DisplayName("Trend window keeps only the ten most recent readings")
    void testTrendWindowBounded() {
        for (int i = 0; i < 15; i++) {
            double level = 300 - i;
            monitor.processMarginLevel("acc-1", level, level * 10, 1000, LOSS_CUT);
        }
        List<Double> history = monitor.trendHistory("acc-1");
        assertEquals(MarginLevelMonitor.TREND_WINDOW, history.size());
        assertEquals(295.0, history.get(0));
        assertEquals(286.0, history.get(history.size() - 1));
    }

    @Test
    @DisplayName("A re-delivered reading is not counted twice in the trend window")
    void testTrendWindowDedupe() {
        monitor.processMarginLevel("acc-1", 250, 2500, 1000, LOSS_CUT);
        monitor.processMarginLevel("acc-1", 240, 2400, 1000, LOSS_CUT);
        monitor.processMarginLevel("acc-1", 240, 2400, 1000, LOSS_CUT);

        assertEquals(List.of(250.0, 240.0), monitor.trendHistory("acc-1"));
    }

    @Test
    @DisplayName("Trend direction compares the last three readings")
    void testTrendDirection() {
        assertEquals(TrendDirection.STABLE, monitor.trendDirection("acc-1"));
        monitor.processMarginLevel("acc-1", 250, 2500, 1000, LOSS_CUT);
        monitor.processMarginLevel("acc-1", 240, 2400, 1000, LOSS_CUT);
        monitor.processMarginLevel("acc-1", 230, 2300, 1000, LOSS_CUT);
        assertEquals(TrendDirection.DETERIORATING, monitor.trendDirection("acc-1"));
    }

    // ======================== LIFECYCLE ========================

    @Test
    @DisplayName("Start and stop emit lifecycle events and track the timer")
    void testStartStop() {
        monitor.startMonitoring("acc-1", "xm");
        assertTrue(monitor.isMonitoring("acc-1"));

        monitor.stopMonitoring("acc-1");
        assertFalse(monitor.isMonitoring("acc-1"));
        assertEquals(List.of(RiskEngineEventType.MONITORING_STARTED, RiskEngineEventType.MONITORING_STOPPED),
                types(dispatched));
    }

    @Test
    @DisplayName("Polling interval must be positive")
    void testInvalidPollingInterval() {
        assertThrows(IllegalArgumentException.class, () -> monitor.updatePollingInterval(0));
    }

    @Test
    @DisplayName("Changing the interval keeps every account monitored")
    void testPollingIntervalRebinds() {
        monitor.startMonitoring("acc-1", "xm");
        monitor.startMonitoring("acc-2", "xm");

        monitor.updatePollingInterval(5000);

        assertEquals(5000, monitor.getPollingIntervalMs());
        assertEquals(2, monitor.monitoredAccounts().size());
    }

    @Test
    @DisplayName("Removing an account drops its trend data")
    void testRemoveAccount() {
        monitor.startMonitoring("acc-1", "xm");
        monitor.processMarginLevel("acc-1", 250, 2500, 1000, LOSS_CUT);

        monitor.removeAccount("acc-1");

        assertFalse(monitor.isMonitoring("acc-1"));
        assertTrue(monitor.trendHistory("acc-1").isEmpty());
    }
}
