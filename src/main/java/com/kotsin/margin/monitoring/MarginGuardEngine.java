package com.kotsin.margin.monitoring;

import com.kotsin.margin.analysis.EffectAnalyzer;
import com.kotsin.margin.analysis.StateSnapshot;
import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.emergency.EmergencyActionEngine;
import com.kotsin.margin.emergency.EmergencyResponse;
import com.kotsin.margin.emergency.mode.EmergencyModeManager;
import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.event.RiskEventDispatcher;
import com.kotsin.margin.forecast.LossCutForecaster;
import com.kotsin.margin.gateway.PositionDataService;
import com.kotsin.margin.model.AccountMarginInfo;
import com.kotsin.margin.model.LossCutForecast;
import com.kotsin.margin.model.MarginSample;
import com.kotsin.margin.model.RiskMonitoringState;
import com.kotsin.margin.recovery.AccountState;
import com.kotsin.margin.recovery.CrossAccountContext;
import com.kotsin.margin.recovery.RecoveryPlan;
import com.kotsin.margin.recovery.RecoveryScenarioCalculator;
import com.kotsin.margin.validation.MarginInfoValidator;
import com.kotsin.margin.validation.TelemetryCheck;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the monitoring, forecasting and emergency components together.
 *
 * <p>Telemetry from any thread is handed to the engine scheduler, so every per-account update
 * runs on one thread in arrival order.</p>
 */
@Component
@Slf4j
public class MarginGuardEngine {

    private final MarginGuardProperties properties;
    private final MarginInfoValidator validator;
    private final RiskStateManager riskStateManager;
    private final MarginLevelMonitor monitor;
    private final LossCutForecaster forecaster;
    private final MarginSampleStore sampleStore;
    private final CachedTelemetrySource telemetrySource;
    private final PositionDataService positionDataService;
    private final EmergencyActionEngine actionEngine;
    private final EmergencyModeManager emergencyModeManager;
    private final EffectAnalyzer effectAnalyzer;
    private final RecoveryScenarioCalculator recoveryCalculator;
    private final RiskEventDispatcher dispatcher;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Map<String, AccountMarginInfo> lastAccepted = new ConcurrentHashMap<>();

    public MarginGuardEngine(MarginGuardProperties properties,
                             MarginInfoValidator validator,
                             RiskStateManager riskStateManager,
                             MarginLevelMonitor monitor,
                             LossCutForecaster forecaster,
                             MarginSampleStore sampleStore,
                             CachedTelemetrySource telemetrySource,
                             PositionDataService positionDataService,
                             EmergencyActionEngine actionEngine,
                             EmergencyModeManager emergencyModeManager,
                             EffectAnalyzer effectAnalyzer,
                             RecoveryScenarioCalculator recoveryCalculator,
                             RiskEventDispatcher dispatcher,
                             @Qualifier("riskEngineScheduler") ScheduledExecutorService scheduler,
                             Clock clock) {
        this.properties = properties;
        this.validator = validator;
        this.riskStateManager = riskStateManager;
        this.monitor = monitor;
        this.forecaster = forecaster;
        this.sampleStore = sampleStore;
        this.telemetrySource = telemetrySource;
        this.positionDataService = positionDataService;
        this.actionEngine = actionEngine;
        this.emergencyModeManager = emergencyModeManager;
        this.effectAnalyzer = effectAnalyzer;
        this.recoveryCalculator = recoveryCalculator;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        List<String> errors = properties.validate();
        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("[ENGINE] Configuration error: {}", e));
            throw new IllegalStateException("Invalid margin-guard configuration: " + String.join("; ", errors));
        }
        monitor.setRequester((accountId, broker) -> telemetrySource.latest(accountId).ifPresent(this::ingest));
        dispatcher.register(this::onEngineEvent);
        forecaster.start();
        log.info("[ENGINE] Margin guard started pollingMs={} thresholds={}/{}/{} defaultLossCut={}",
                properties.getMonitor().getPollingIntervalMs(),
                properties.getMonitor().getThresholds().getWarning(),
                properties.getMonitor().getThresholds().getDanger(),
                properties.getMonitor().getThresholds().getCritical(),
                properties.getMonitor().getDefaultLossCutLevel());
    }

    // ======================== TELEMETRY ========================

    /**
     * Entry point for pushed telemetry. Caches the reading and queues it on the engine thread.
     */
    public void onTelemetry(AccountMarginInfo info) {
        if (info.getAccountId() != null && !info.getAccountId().isBlank()) {
            telemetrySource.update(info);
        }
        try {
            scheduler.execute(() -> {
                try {
                    ingest(info);
                } catch (Exception e) {
                    log.error("[ENGINE] Failed to ingest telemetry for {}: {}", info.getAccountId(), e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[ENGINE] Engine stopped, dropping telemetry for {}", info.getAccountId());
        }
    }

    /**
     * Validates one reading and feeds it through state, monitor and forecaster.
     *
     * @return false when the reading was rejected or already seen
     */
    public boolean ingest(AccountMarginInfo info) {
        Instant now = clock.instant();
        TelemetryCheck check = validator.validate(info);
        if (!check.isAccepted()) {
            log.warn("[VALIDATION] Rejected telemetry account={} errors={}", check.getAccountId(), check.summary());
            dispatcher.dispatch(RiskEngineEvent.invalidTelemetry(check.getAccountId(), check.summary(), now));
            return false;
        }
        if (check.hasAdvisories()) {
            log.debug("[VALIDATION] account={} advisories={}", check.getAccountId(), check.getAdvisories());
        }

        String accountId = info.getAccountId();
        AccountMarginInfo previous = lastAccepted.get(accountId);
        if (previous != null && info.getLastUpdate() != null && previous.getLastUpdate() != null
                && !info.getLastUpdate().isAfter(previous.getLastUpdate())) {
            log.debug("[ENGINE] Skipping already ingested telemetry account={} lastUpdate={}", accountId, info.getLastUpdate());
            return false;
        }
        lastAccepted.put(accountId, info);

        MarginGuardProperties.Monitor config = properties.getMonitor();
        if (config.isEnabled() && config.isAutoMonitorNewAccounts() && !monitor.isMonitoring(accountId)) {
            monitor.startMonitoring(accountId, info.getBroker());
        }

        double lossCutLevel = config.lossCutLevelFor(info.getBroker());
        RiskMonitoringState state = riskStateManager.updateMarginInfo(info, lossCutLevel);
        monitor.processMarginLevel(accountId, state.getMarginLevel(), info.getEquity(), info.getUsedMargin(), lossCutLevel);
        forecaster.addMarginData(accountId, MarginSample.from(info, now), lossCutLevel);
        return true;
    }

    // ======================== EVENT WIRING ========================

    void onEngineEvent(RiskEngineEvent event) {
        String accountId = event.getAccountId();
        switch (event.getType()) {
            case LOSSCUT_DETECTED -> riskStateManager.getRiskState(accountId)
                    .ifPresent(state -> actionEngine.handleLossCutDetection(accountId, state));
            case LOSSCUT_LEVEL_REACHED -> {
                AccountMarginInfo info = lastAccepted.get(accountId);
                if (info != null) {
                    actionEngine.handleCriticalMarginLevel(accountId, info);
                }
            }
            case FORECAST_UPDATED -> {
                if (event.getPayload() instanceof LossCutForecast forecast) {
                    riskStateManager.updatePredictions(accountId, RiskMonitoringState.Predictions.builder()
                            .timeToCriticalMinutes(forecast.getTimeToLossCutMinutes())
                            .requiredRecovery(forecast.getRequiredRecoveryAmount())
                            .build());
                }
            }
            case RESPONSE_COMPLETED -> {
                if (event.getPayload() instanceof EmergencyResponse response) {
                    onEngineThread(() -> scheduleEffectMeasurement(response), response.getId());
                }
            }
            default -> {
                // other events are for external listeners
            }
        }
    }

    /**
     * Responses finish on emergency worker threads; their follow-up work moves back here.
     */
    private void onEngineThread(Runnable task, String responseId) {
        try {
            scheduler.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("[ENGINE] Engine stopped, skipping effect measurement for {}", responseId);
        }
    }

    private void scheduleEffectMeasurement(EmergencyResponse response) {
        Optional<RiskMonitoringState> before = riskStateManager.getRiskState(response.getAccountId());
        if (before.isEmpty()) {
            return;
        }
        StateSnapshot beforeSnapshot = StateSnapshot.of(before.get(),
                positionDataService.openPositions(response.getAccountId()).size());
        long delayMs = properties.getEmergency().getEffectMeasurementDelayMs();
        try {
            scheduler.schedule(() -> {
                try {
                    riskStateManager.getRiskState(response.getAccountId()).ifPresent(after ->
                            effectAnalyzer.measureEmergencyResponse(response, beforeSnapshot,
                                    StateSnapshot.of(after, positionDataService.openPositions(response.getAccountId()).size())));
                } catch (Exception e) {
                    log.error("[ENGINE] Effect measurement failed for {}: {}", response.getId(), e.getMessage(), e);
                }
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[ENGINE] Engine stopped, skipping effect measurement for {}", response.getId());
        }
    }

    // ======================== ACCOUNTS ========================

    public void addAccount(String accountId, String broker) {
        monitor.startMonitoring(accountId, broker);
    }

    /**
     * Stops monitoring and drops every piece of per-account state.
     */
    public void removeAccount(String accountId) {
        monitor.removeAccount(accountId);
        riskStateManager.removeAccount(accountId);
        forecaster.removeAccount(accountId);
        sampleStore.removeAccount(accountId);
        telemetrySource.evict(accountId);
        lastAccepted.remove(accountId);
        log.info("[ENGINE] Account {} removed", accountId);
    }

    /**
     * Ranked recovery options for one account, with every other known account as a transfer donor.
     */
    public RecoveryPlan recoveryPlan(String accountId, double targetLevel) {
        RiskMonitoringState state = riskStateManager.getRiskState(accountId)
                .orElseThrow(() -> new NoSuchElementException("Unknown account: " + accountId));
        AccountState account = AccountState.from(state, positionDataService.openPositions(accountId));

        List<AccountState> others = new ArrayList<>();
        for (RiskMonitoringState other : riskStateManager.getAllRiskStates().values()) {
            if (!other.getAccountId().equals(accountId)) {
                others.add(AccountState.from(other, positionDataService.openPositions(other.getAccountId())));
            }
        }
        CrossAccountContext context = others.isEmpty() ? null : CrossAccountContext.of(others);
        return recoveryCalculator.calculateOptimizedRecovery(account, context, targetLevel);
    }

    @PreDestroy
    public void shutdown() {
        log.info("[ENGINE] Shutting down margin guard");
        monitor.stopAllMonitoring();
        forecaster.stop();
        actionEngine.shutdown();
        emergencyModeManager.shutdown();
    }
}
