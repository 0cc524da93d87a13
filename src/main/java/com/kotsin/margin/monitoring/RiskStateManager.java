package com.kotsin.margin.monitoring;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.event.RiskEngineEventType;
import com.kotsin.margin.event.RiskEventDispatcher;
import com.kotsin.margin.model.AccountMarginInfo;
import com.kotsin.margin.model.RiskLevel;
import com.kotsin.margin.model.RiskMonitoringState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * State of record for every account: the current {@link RiskMonitoringState}, an alert log and
 * a bounded event log. Only the engine thread writes here; readers get copies.
 */
@Component
@Slf4j
public class RiskStateManager {

    static final int HISTORY_LIMIT = 100;

    private final RiskEventDispatcher dispatcher;
    private final Clock clock;
    private final Duration staleAfter;

    private final Map<String, RiskMonitoringState> states = new ConcurrentHashMap<>();
    private final Map<String, Deque<LossCutAlert>> alerts = new ConcurrentHashMap<>();
    private final Map<String, Deque<RiskEngineEvent>> events = new ConcurrentHashMap<>();

    public RiskStateManager(RiskEventDispatcher dispatcher, Clock clock, MarginGuardProperties properties) {
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.staleAfter = Duration.ofMillis(properties.getMonitor().getTelemetryStaleAfterMs());
    }

    /**
     * Replaces the account's state with one built from validated telemetry.
     *
     * @return the new state
     */
    public RiskMonitoringState updateMarginInfo(AccountMarginInfo info, double lossCutLevel) {
        String accountId = info.getAccountId();
        Instant now = clock.instant();
        RiskMonitoringState previous = states.get(accountId);
        RiskMonitoringState next = RiskMonitoringState.from(info, lossCutLevel, now);
        if (previous != null) {
            // forecasts stay attached until the forecaster replaces them
            next = next.toBuilder().predictions(previous.getPredictions()).build();
        }
        states.put(accountId, next);

        publish(RiskEngineEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(RiskEngineEventType.MARGIN_LEVEL_UPDATE)
                .accountId(accountId)
                .severity(RiskEngineEvent.Severity.INFO)
                .message(String.format("Margin level %.2f%% (%s)", next.getMarginLevel(), next.getRiskLevel()))
                .marginLevel(next.getMarginLevel())
                .timestamp(now)
                .build());

        if (previous != null && previous.getRiskLevel() != next.getRiskLevel()) {
            handleRiskLevelChange(accountId, previous.getRiskLevel(), next);
        } else if (previous == null && next.getRiskLevel() == RiskLevel.CRITICAL) {
            // first reading already critical
            publishLossCutDetected(accountId, next);
        }

        if (next.getRiskLevel() == RiskLevel.CRITICAL) {
            generateCriticalAlert(accountId, next.getMarginLevel(), now);
        }
        return next;
    }

    /**
     * Attaches forecast output to the current state. The risk level is not touched.
     */
    public void updatePredictions(String accountId, RiskMonitoringState.Predictions predictions) {
        states.computeIfPresent(accountId, (id, state) -> state.toBuilder().predictions(predictions).build());
    }

    private void handleRiskLevelChange(String accountId, RiskLevel from, RiskMonitoringState state) {
        RiskLevel to = state.getRiskLevel();
        log.info("[RISK-STATE] account={} risk level {} -> {} marginLevel={}",
                accountId, from, to, String.format("%.2f", state.getMarginLevel()));
        publish(RiskEngineEvent.riskLevelChanged(accountId, from, to, state.getMarginLevel(), clock.instant()));

        if (to == RiskLevel.CRITICAL) {
            publishLossCutDetected(accountId, state);
        }
    }

    private void publishLossCutDetected(String accountId, RiskMonitoringState state) {
        log.warn("[RISK-STATE] Loss-cut risk detected account={} marginLevel={}",
                accountId, String.format("%.2f", state.getMarginLevel()));
        publish(RiskEngineEvent.lossCutDetected(accountId, state.getMarginLevel(),
                state.getLossCutLevel(), clock.instant()));
    }

    private void generateCriticalAlert(String accountId, double marginLevel, Instant now) {
        LossCutAlert alert = LossCutAlert.builder()
                .id(accountId + "-critical-" + now.toEpochMilli())
                .accountId(accountId)
                .severity(RiskEngineEvent.Severity.CRITICAL)
                .marginLevel(marginLevel)
                .message(String.format("Critical margin level: %.2f%%", marginLevel))
                .timestamp(now)
                .acknowledged(false)
                .autoResolve(false)
                .build();
        addAlert(accountId, alert);
    }

    public void addAlert(String accountId, LossCutAlert alert) {
        Deque<LossCutAlert> accountAlerts = alerts.computeIfAbsent(accountId, id -> new ConcurrentLinkedDeque<>());
        accountAlerts.addLast(alert);
        while (accountAlerts.size() > HISTORY_LIMIT) {
            accountAlerts.pollFirst();
        }
        publish(RiskEngineEvent.of(RiskEngineEventType.ALERT_GENERATED, accountId, alert.getSeverity(),
                alert.getMessage(), alert, clock.instant()));
    }

    /**
     * Records the event in the account's log and forwards it to the dispatcher.
     */
    public void publish(RiskEngineEvent event) {
        if (event.getAccountId() != null) {
            recordEvent(event);
        }
        dispatcher.dispatch(event);
    }

    private void recordEvent(RiskEngineEvent event) {
        Deque<RiskEngineEvent> accountEvents = events.computeIfAbsent(event.getAccountId(), id -> new ConcurrentLinkedDeque<>());
        accountEvents.addLast(event);
        while (accountEvents.size() > HISTORY_LIMIT) {
            accountEvents.pollFirst();
        }
    }

    public boolean acknowledgeAlert(String alertId) {
        for (Deque<LossCutAlert> accountAlerts : alerts.values()) {
            for (LossCutAlert alert : accountAlerts) {
                if (alert.getId().equals(alertId)) {
                    alert.setAcknowledged(true);
                    log.info("[RISK-STATE] Alert acknowledged id={} account={}", alertId, alert.getAccountId());
                    return true;
                }
            }
        }
        return false;
    }

    public Optional<RiskMonitoringState> getRiskState(String accountId) {
        return Optional.ofNullable(states.get(accountId));
    }

    public Map<String, RiskMonitoringState> getAllRiskStates() {
        return Map.copyOf(states);
    }

    public Collection<RiskMonitoringState> statesAtOrAbove(RiskLevel level) {
        List<RiskMonitoringState> result = new ArrayList<>();
        for (RiskMonitoringState state : states.values()) {
            if (state.getRiskLevel().isAtLeast(level)) {
                result.add(state);
            }
        }
        return result;
    }

    public List<LossCutAlert> getAlerts(String accountId) {
        Deque<LossCutAlert> accountAlerts = alerts.get(accountId);
        return accountAlerts == null ? List.of() : List.copyOf(accountAlerts);
    }

    public List<RiskEngineEvent> getEvents(String accountId) {
        Deque<RiskEngineEvent> accountEvents = events.get(accountId);
        return accountEvents == null ? List.of() : List.copyOf(accountEvents);
    }

    /**
     * Accounts that have not reported within the stale window are listed as errors.
     */
    public MonitoringStatus getMonitoringStatus() {
        Instant now = clock.instant();
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, RiskMonitoringState> entry : states.entrySet()) {
            Instant lastUpdate = entry.getValue().getLastUpdate();
            if (lastUpdate != null && Duration.between(lastUpdate, now).compareTo(staleAfter) > 0) {
                errors.add(String.format("Account %s: No data for over %d seconds",
                        entry.getKey(), staleAfter.toSeconds()));
            }
        }
        List<String> connected = List.copyOf(states.keySet());
        return MonitoringStatus.builder()
                .active(!connected.isEmpty())
                .connectedAccounts(connected)
                .lastUpdate(now)
                .errors(errors)
                .build();
    }

    public Statistics getStatistics() {
        Map<RiskLevel, Integer> riskLevels = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            riskLevels.put(level, 0);
        }
        double sum = 0;
        int finite = 0;
        for (RiskMonitoringState state : states.values()) {
            riskLevels.merge(state.getRiskLevel(), 1, Integer::sum);
            if (Double.isFinite(state.getMarginLevel())) {
                sum += state.getMarginLevel();
                finite++;
            }
        }
        int totalAlerts = 0;
        int unacknowledged = 0;
        for (Deque<LossCutAlert> accountAlerts : alerts.values()) {
            for (LossCutAlert alert : accountAlerts) {
                totalAlerts++;
                if (!alert.isAcknowledged()) {
                    unacknowledged++;
                }
            }
        }
        return Statistics.builder()
                .totalAccounts(states.size())
                .riskLevels(riskLevels)
                .totalAlerts(totalAlerts)
                .unacknowledgedAlerts(unacknowledged)
                .averageMarginLevel(finite > 0 ? sum / finite : 0.0)
                .build();
    }

    public void removeAccount(String accountId) {
        states.remove(accountId);
        alerts.remove(accountId);
        events.remove(accountId);
        log.info("[RISK-STATE] Removed account {}", accountId);
    }

    public void clear() {
        states.clear();
        alerts.clear();
        events.clear();
    }

    @Value
    @Builder
    public static class Statistics {
        int totalAccounts;
        Map<RiskLevel, Integer> riskLevels;
        int totalAlerts;
        int unacknowledgedAlerts;
        double averageMarginLevel;
    }
}
