package com.kotsin.margin.controller;

import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.forecast.EarlyWarning;
import com.kotsin.margin.forecast.ForecastMetrics;
import com.kotsin.margin.forecast.ForecastResult;
import com.kotsin.margin.forecast.LossCutForecaster;
import com.kotsin.margin.gateway.InMemoryPositionDataService;
import com.kotsin.margin.model.AccountMarginInfo;
import com.kotsin.margin.model.Position;
import com.kotsin.margin.model.RiskMonitoringState;
import com.kotsin.margin.monitoring.LossCutAlert;
import com.kotsin.margin.monitoring.MarginGuardEngine;
import com.kotsin.margin.monitoring.MarginLevelMonitor;
import com.kotsin.margin.monitoring.MonitoringStatus;
import com.kotsin.margin.monitoring.RiskStateManager;
import com.kotsin.margin.recovery.RecoveryPlan;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * REST API for account risk state, forecasts and recovery plans.
 */
@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
@Tag(name = "Risk Monitoring", description = "Margin levels, alerts, loss-cut forecasts and recovery plans")
public class RiskController {

    private final MarginGuardEngine engine;
    private final RiskStateManager riskStateManager;
    private final MarginLevelMonitor monitor;
    private final LossCutForecaster forecaster;
    private final InMemoryPositionDataService positionDataService;

    @GetMapping("/status")
    @Operation(summary = "Monitoring status", description = "Connected accounts and accounts whose telemetry went stale")
    public ResponseEntity<MonitoringStatus> getStatus() {
        return ResponseEntity.ok(riskStateManager.getMonitoringStatus());
    }

    @GetMapping("/statistics")
    public ResponseEntity<Map<String, Object>> getStatistics() {
        return ResponseEntity.ok(Map.of(
                "riskState", riskStateManager.getStatistics(),
                "monitor", monitor.statistics()
        ));
    }

    // ======================== ACCOUNTS ========================

    @GetMapping("/accounts")
    public ResponseEntity<Map<String, RiskMonitoringState>> getAccounts() {
        return ResponseEntity.ok(riskStateManager.getAllRiskStates());
    }

    @GetMapping("/accounts/{accountId}")
    public ResponseEntity<RiskMonitoringState> getAccount(@PathVariable String accountId) {
        return riskStateManager.getRiskState(accountId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/accounts/{accountId}/monitor")
    public ResponseEntity<Map<String, Object>> startMonitoring(@PathVariable String accountId,
                                                               @RequestParam(required = false) String broker) {
        engine.addAccount(accountId, broker);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Monitoring started for " + accountId
        ));
    }

    @DeleteMapping("/accounts/{accountId}")
    public ResponseEntity<Map<String, Object>> removeAccount(@PathVariable String accountId) {
        engine.removeAccount(accountId);
        positionDataService.removeAccount(accountId);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Account removed: " + accountId
        ));
    }

    @PutMapping("/accounts/{accountId}/positions")
    @Operation(summary = "Replace open positions", description = "Position snapshot used by the optimizer and emergency engine")
    public ResponseEntity<Map<String, Object>> replacePositions(@PathVariable String accountId,
                                                                @RequestBody List<Position> positions) {
        positionDataService.replacePositions(accountId, positions);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "positions", positions.size()
        ));
    }

    @PostMapping("/telemetry")
    @Operation(summary = "Submit margin telemetry", description = "Same path as the margin-telemetry topic")
    public ResponseEntity<Map<String, Object>> submitTelemetry(@RequestBody AccountMarginInfo info) {
        engine.onTelemetry(info);
        return ResponseEntity.accepted().body(Map.of(
                "success", true,
                "message", "Telemetry queued"
        ));
    }

    @PutMapping("/monitor/polling-interval")
    public ResponseEntity<Map<String, Object>> updatePollingInterval(@RequestParam long intervalMs) {
        try {
            monitor.updatePollingInterval(intervalMs);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "pollingIntervalMs", intervalMs
        ));
    }

    // ======================== ALERTS & EVENTS ========================

    @GetMapping("/accounts/{accountId}/alerts")
    public ResponseEntity<List<LossCutAlert>> getAlerts(@PathVariable String accountId) {
        return ResponseEntity.ok(riskStateManager.getAlerts(accountId));
    }

    @PostMapping("/alerts/{alertId}/acknowledge")
    public ResponseEntity<Map<String, Object>> acknowledgeAlert(@PathVariable String alertId) {
        if (!riskStateManager.acknowledgeAlert(alertId)) {
            return ResponseEntity.status(404).body(Map.of("error", "no alert " + alertId));
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Alert acknowledged: " + alertId
        ));
    }

    @GetMapping("/accounts/{accountId}/events")
    public ResponseEntity<List<RiskEngineEvent>> getEvents(@PathVariable String accountId) {
        return ResponseEntity.ok(riskStateManager.getEvents(accountId));
    }

    // ======================== FORECASTS ========================

    @GetMapping("/accounts/{accountId}/forecast")
    @Operation(summary = "Loss-cut forecast", description = "Forecast, trend, early warnings and recovery scenarios for one account")
    public ResponseEntity<ForecastResult> getForecast(@PathVariable String accountId) {
        return forecaster.getPrediction(accountId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/forecasts")
    public ResponseEntity<Map<String, ForecastResult>> getForecasts() {
        return ResponseEntity.ok(forecaster.getAllPredictions());
    }

    @GetMapping("/warnings/critical")
    public ResponseEntity<List<EarlyWarning>> getCriticalWarnings() {
        return ResponseEntity.ok(forecaster.criticalWarnings());
    }

    @PostMapping("/accounts/{accountId}/forecast/outcome")
    @Operation(summary = "Record forecast outcome", description = "Scores the current forecast against whether a loss-cut happened")
    public ResponseEntity<Map<String, Object>> recordOutcome(
            @PathVariable String accountId,
            @RequestParam boolean lossCutOccurred,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant actualTime) {
        forecaster.recordOutcome(accountId, lossCutOccurred, actualTime);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "metrics", forecaster.getMetrics()
        ));
    }

    @GetMapping("/forecast/metrics")
    public ResponseEntity<ForecastMetrics> getForecastMetrics() {
        return ResponseEntity.ok(forecaster.getMetrics());
    }

    // ======================== RECOVERY ========================

    @GetMapping("/accounts/{accountId}/recovery-plan")
    @Operation(summary = "Recovery plan", description = "Ranked deposit, position and cross-account recovery scenarios")
    public ResponseEntity<?> getRecoveryPlan(
            @PathVariable String accountId,
            @RequestParam(defaultValue = "200") double targetLevel) {
        try {
            RecoveryPlan plan = engine.recoveryPlan(accountId, targetLevel);
            return ResponseEntity.ok(plan);
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        }
    }
}
