package com.kotsin.margin.monitoring;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.event.RiskEngineEventType;
import com.kotsin.margin.event.RiskEventDispatcher;
import com.kotsin.margin.model.RiskLevel;
import com.kotsin.margin.model.TrendDirection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-account polling plus threshold, rapid-change and short trend bookkeeping.
 *
 * <p>Each monitored account owns one fixed-rate timer on the engine scheduler. Timer bodies and
 * {@link #stopMonitoring} synchronize on the same lock, so once {@code stopMonitoring} returns
 * no callback for that account runs.</p>
 */
@Component
@Slf4j
public class MarginLevelMonitor {

    static final int TREND_WINDOW = 10;
    static final double RAPID_CHANGE_PERCENT = 5.0;
    private static final double TREND_DIRECTION_DELTA = 5.0;

    private final MarginGuardProperties properties;
    private final ScheduledExecutorService scheduler;
    private final RiskEventDispatcher dispatcher;
    private final Clock clock;

    private final Object timerLock = new Object();
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private final Map<String, String> brokers = new ConcurrentHashMap<>();
    private final Map<String, Double> lastLevels = new ConcurrentHashMap<>();
    private final Map<String, Deque<Double>> trendWindows = new ConcurrentHashMap<>();
    private final Map<String, TrendKey> lastTrendKeys = new ConcurrentHashMap<>();

    private volatile MarginDataRequester requester = (accountId, broker) ->
            log.debug("[MONITOR] No data requester registered, skipping poll for {}", accountId);
    private volatile long pollingIntervalMs;

    public MarginLevelMonitor(MarginGuardProperties properties,
                              @Qualifier("riskEngineScheduler") ScheduledExecutorService scheduler,
                              RiskEventDispatcher dispatcher,
                              Clock clock) {
        this.properties = properties;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.pollingIntervalMs = properties.getMonitor().getPollingIntervalMs();
    }

    public void setRequester(MarginDataRequester requester) {
        this.requester = requester;
    }

    // ======================== POLLING ========================

    public void startMonitoring(String accountId, String broker) {
        synchronized (timerLock) {
            if (timers.containsKey(accountId)) {
                stopMonitoring(accountId);
            }
            String resolvedBroker = broker != null ? broker : "";
            brokers.put(accountId, resolvedBroker);
            ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
            self[0] = scheduler.scheduleAtFixedRate(
                    () -> poll(accountId, self[0]),
                    pollingIntervalMs, pollingIntervalMs, TimeUnit.MILLISECONDS);
            timers.put(accountId, self[0]);
        }
        log.info("[MONITOR] Started monitoring account={} broker={} intervalMs={}", accountId, broker, pollingIntervalMs);
        dispatcher.dispatch(RiskEngineEvent.of(RiskEngineEventType.MONITORING_STARTED, accountId,
                RiskEngineEvent.Severity.INFO, "Monitoring started", null, clock.instant()));
    }

    public void stopMonitoring(String accountId) {
        ScheduledFuture<?> timer;
        synchronized (timerLock) {
            timer = timers.remove(accountId);
            if (timer == null) {
                return;
            }
            timer.cancel(false);
        }
        log.info("[MONITOR] Stopped monitoring account={}", accountId);
        dispatcher.dispatch(RiskEngineEvent.of(RiskEngineEventType.MONITORING_STOPPED, accountId,
                RiskEngineEvent.Severity.INFO, "Monitoring stopped", null, clock.instant()));
    }

    public void stopAllMonitoring() {
        for (String accountId : List.copyOf(timers.keySet())) {
            stopMonitoring(accountId);
        }
    }

    public boolean isMonitoring(String accountId) {
        return timers.containsKey(accountId);
    }

    public Set<String> monitoredAccounts() {
        return Set.copyOf(timers.keySet());
    }

    public long getPollingIntervalMs() {
        return pollingIntervalMs;
    }

    /**
     * Changes the polling interval and rebinds every running timer to it.
     */
    public void updatePollingInterval(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Polling interval must be > 0, got " + intervalMs);
        }
        if (intervalMs == pollingIntervalMs) {
            return;
        }
        log.info("[MONITOR] Polling interval {}ms -> {}ms, restarting {} timers",
                pollingIntervalMs, intervalMs, timers.size());
        pollingIntervalMs = intervalMs;
        for (String accountId : List.copyOf(timers.keySet())) {
            String broker = brokers.getOrDefault(accountId, "");
            stopMonitoring(accountId);
            startMonitoring(accountId, broker);
        }
    }

    private void poll(String accountId, ScheduledFuture<?> handle) {
        synchronized (timerLock) {
            if (handle == null || timers.get(accountId) != handle) {
                return;
            }
            try {
                requester.requestMarginData(accountId, brokers.getOrDefault(accountId, ""));
            } catch (Exception e) {
                // keep the timer alive; a thrown exception would cancel the fixed-rate task
                log.error("[MONITOR] Poll failed for {}: {}", accountId, e.getMessage(), e);
            }
        }
    }

    // ======================== PROCESSING ========================

    /**
     * Feeds one validated reading through trend bookkeeping, band checks and rapid-change detection.
     *
     * @return the events emitted for this reading, in emission order
     */
    public List<RiskEngineEvent> processMarginLevel(String accountId, double marginLevel, double equity,
                                                    double usedMargin, double lossCutLevel) {
        Double previous = lastLevels.get(accountId);
        updateTrendWindow(accountId, new TrendKey(marginLevel, equity, usedMargin));
        lastLevels.put(accountId, marginLevel);

        List<RiskEngineEvent> events = new ArrayList<>(checkThresholds(accountId, marginLevel,
                properties.getMonitor().getThresholds(), lossCutLevel));

        if (previous != null) {
            RiskEngineEvent rapid = checkRapidChange(accountId, previous, marginLevel);
            if (rapid != null) {
                events.add(rapid);
            }
        }
        events.forEach(dispatcher::dispatch);
        return events;
    }

    /**
     * One event per breached band. Bands are disjoint: a level in (danger, warning] is a warning,
     * (critical, danger] a danger, anything at or below critical is critical. The loss-cut band is
     * checked independently.
     */
    public List<RiskEngineEvent> checkThresholds(String accountId, double marginLevel,
                                                 MarginGuardProperties.Thresholds thresholds,
                                                 double lossCutLevel) {
        List<RiskEngineEvent> events = new ArrayList<>();
        Instant now = clock.instant();
        double warning = thresholds.getWarning();
        double danger = thresholds.getDanger();
        double critical = thresholds.getCritical();

        if (marginLevel <= warning && marginLevel > danger) {
            events.add(RiskEngineEvent.thresholdBreached(accountId, RiskEngineEventType.WARNING_THRESHOLD,
                    marginLevel, warning, now));
        }
        if (marginLevel <= danger && marginLevel > critical) {
            events.add(RiskEngineEvent.thresholdBreached(accountId, RiskEngineEventType.DANGER_THRESHOLD,
                    marginLevel, danger, now));
        }
        if (marginLevel <= critical) {
            events.add(RiskEngineEvent.thresholdBreached(accountId, RiskEngineEventType.CRITICAL_THRESHOLD,
                    marginLevel, critical, now));
        }
        if (marginLevel <= lossCutLevel) {
            events.add(RiskEngineEvent.thresholdBreached(accountId, RiskEngineEventType.LOSSCUT_LEVEL_REACHED,
                    marginLevel, lossCutLevel, now));
        }
        return events;
    }

    private RiskEngineEvent checkRapidChange(String accountId, double previous, double current) {
        if (previous == 0 || Double.isInfinite(previous) || Double.isInfinite(current)) {
            return null;
        }
        double changePercent = (current - previous) / previous * 100.0;
        if (Math.abs(changePercent) >= RAPID_CHANGE_PERCENT) {
            log.warn("[MONITOR] Rapid margin change account={} {}% -> {}% ({}%)",
                    accountId, fmt(previous), fmt(current), fmt(changePercent));
            return RiskEngineEvent.rapidChange(accountId, previous, current, changePercent, clock.instant());
        }
        return null;
    }

    // ======================== TREND WINDOW ========================

    private void updateTrendWindow(String accountId, TrendKey key) {
        // a re-delivered reading (same values, new timestamp) is not a new data point
        if (key.equals(lastTrendKeys.get(accountId))) {
            return;
        }
        lastTrendKeys.put(accountId, key);
        Deque<Double> window = trendWindows.computeIfAbsent(accountId, id -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(key.marginLevel());
            while (window.size() > TREND_WINDOW) {
                window.pollFirst();
            }
        }
    }

    public List<Double> trendHistory(String accountId) {
        Deque<Double> window = trendWindows.get(accountId);
        if (window == null) {
            return List.of();
        }
        synchronized (window) {
            return List.copyOf(window);
        }
    }

    /**
     * Direction over the last three readings: more than 5 points up is improving, more than
     * 5 points down is deteriorating.
     */
    public TrendDirection trendDirection(String accountId) {
        List<Double> history = trendHistory(accountId);
        if (history.size() < 3) {
            return TrendDirection.STABLE;
        }
        double first = history.get(history.size() - 3);
        double last = history.get(history.size() - 1);
        double change = last - first;
        if (change > TREND_DIRECTION_DELTA) return TrendDirection.IMPROVING;
        if (change < -TREND_DIRECTION_DELTA) return TrendDirection.DETERIORATING;
        return TrendDirection.STABLE;
    }

    // ======================== LIFECYCLE ========================

    public void removeAccount(String accountId) {
        stopMonitoring(accountId);
        brokers.remove(accountId);
        lastLevels.remove(accountId);
        trendWindows.remove(accountId);
        lastTrendKeys.remove(accountId);
    }

    public Statistics statistics() {
        List<Double> levels = new ArrayList<>(lastLevels.values());
        Map<RiskLevel, Integer> distribution = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            distribution.put(level, 0);
        }
        double sum = 0;
        int finite = 0;
        for (double level : levels) {
            distribution.merge(RiskLevel.fromMarginLevel(level), 1, Integer::sum);
            if (Double.isFinite(level)) {
                sum += level;
                finite++;
            }
        }
        return Statistics.builder()
                .monitoringCount(timers.size())
                .averageLevel(finite > 0 ? sum / finite : 0.0)
                .riskDistribution(distribution)
                .enabled(properties.getMonitor().isEnabled())
                .pollingIntervalMs(pollingIntervalMs)
                .build();
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }

    private record TrendKey(double marginLevel, double equity, double usedMargin) {
    }

    @Value
    @Builder
    public static class Statistics {
        int monitoringCount;
        double averageLevel;
        Map<RiskLevel, Integer> riskDistribution;
        boolean enabled;
        long pollingIntervalMs;
    }
}
