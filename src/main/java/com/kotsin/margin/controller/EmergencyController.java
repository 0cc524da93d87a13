package com.kotsin.margin.controller;

import com.kotsin.margin.analysis.EffectAnalyzer;
import com.kotsin.margin.analysis.EffectMeasurement;
import com.kotsin.margin.analysis.EffectTrendReport;
import com.kotsin.margin.analysis.PerformanceMetrics;
import com.kotsin.margin.emergency.EmergencyActionEngine;
import com.kotsin.margin.emergency.EmergencyResponse;
import com.kotsin.margin.emergency.EmergencyStrategyRegistry;
import com.kotsin.margin.emergency.StrategyNotFoundException;
import com.kotsin.margin.emergency.StrategyTemplate;
import com.kotsin.margin.emergency.mode.EmergencyLevel;
import com.kotsin.margin.emergency.mode.EmergencyModeHistoryEntry;
import com.kotsin.margin.emergency.mode.EmergencyModeManager;
import com.kotsin.margin.emergency.mode.EmergencyModeState;
import com.kotsin.margin.emergency.mode.EmergencyTrigger;
import com.kotsin.margin.emergency.mode.OperationType;
import com.kotsin.margin.emergency.mode.RecoveryAction;
import com.kotsin.margin.emergency.mode.RecoveryActionException;
import com.kotsin.margin.emergency.mode.TriggerType;
import com.kotsin.margin.model.RiskMonitoringState;
import com.kotsin.margin.monitoring.RiskStateManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Emergency mode control, emergency responses, strategy templates and effect analysis.
 */
@RestController
@RequestMapping("/api/emergency")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Emergency", description = "Emergency mode, automated responses and their measured effect")
public class EmergencyController {

    private final EmergencyModeManager modeManager;
    private final EmergencyActionEngine actionEngine;
    private final EmergencyStrategyRegistry strategyRegistry;
    private final EffectAnalyzer effectAnalyzer;
    private final RiskStateManager riskStateManager;
    private final Clock clock;

    // ======================== MODE ========================

    @GetMapping("/mode")
    public ResponseEntity<EmergencyModeState> getMode() {
        return ResponseEntity.ok(modeManager.getState());
    }

    @GetMapping("/mode/history")
    public ResponseEntity<List<EmergencyModeHistoryEntry>> getModeHistory() {
        return ResponseEntity.ok(modeManager.getHistory());
    }

    @GetMapping("/mode/recovery-actions")
    public ResponseEntity<List<RecoveryAction>> getRecoveryActions() {
        return ResponseEntity.ok(modeManager.getRecoveryActions());
    }

    @PostMapping("/mode/activate")
    @Operation(summary = "Activate emergency mode manually", description = "Manual activations always need a manual deactivation")
    public ResponseEntity<Map<String, Object>> activate(@RequestParam(defaultValue = "HIGH") EmergencyLevel level,
                                                        @RequestParam(required = false) String accountId,
                                                        @RequestParam(required = false) String reason) {
        EmergencyTrigger.EmergencyTriggerBuilder trigger = EmergencyTrigger.builder()
                .id(UUID.randomUUID().toString())
                .type(TriggerType.MANUAL)
                .severity(level)
                .accountId(accountId)
                .timestamp(clock.instant());
        if (reason != null) {
            trigger.detail("reason", reason);
        }
        modeManager.activateEmergencyMode(trigger.build());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "state", modeManager.getState()
        ));
    }

    @PostMapping("/mode/deactivate")
    public ResponseEntity<Map<String, Object>> deactivate(
            @RequestParam(defaultValue = EmergencyModeManager.MANUAL) String reason) {
        boolean deactivated = modeManager.deactivateEmergencyMode(reason);
        if (!deactivated) {
            return ResponseEntity.status(409).body(Map.of(
                    "success", false,
                    "message", "Emergency mode could not be deactivated",
                    "state", modeManager.getState()
            ));
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Emergency mode deactivated"
        ));
    }

    @PostMapping("/mode/escalate")
    public ResponseEntity<Map<String, Object>> escalate() {
        boolean changed = modeManager.escalateLevel();
        return ResponseEntity.ok(Map.of(
                "success", changed,
                "state", modeManager.getState()
        ));
    }

    @PostMapping("/mode/de-escalate")
    public ResponseEntity<Map<String, Object>> deEscalate() {
        boolean changed = modeManager.deEscalateLevel();
        return ResponseEntity.ok(Map.of(
                "success", changed,
                "state", modeManager.getState()
        ));
    }

    @PostMapping("/mode/recovery-actions/{actionId}/execute")
    public ResponseEntity<Map<String, Object>> executeRecoveryAction(@PathVariable String actionId) {
        try {
            boolean success = modeManager.executeRecoveryAction(actionId);
            return ResponseEntity.ok(Map.of(
                    "success", success,
                    "actions", modeManager.getRecoveryActions()
            ));
        } catch (RecoveryActionException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/mode/recovery-actions/execute")
    public ResponseEntity<Map<String, Object>> executeAllRecoveryActions() {
        int succeeded = modeManager.executeAllRecoveryActions();
        return ResponseEntity.ok(Map.of(
                "succeeded", succeeded,
                "actions", modeManager.getRecoveryActions()
        ));
    }

    @GetMapping("/mode/operations/{operation}")
    @Operation(summary = "Check an operation", description = "Whether the operation may run for the account under the current mode")
    public ResponseEntity<Map<String, Object>> isOperationAllowed(@PathVariable OperationType operation,
                                                                  @RequestParam(required = false) String accountId) {
        boolean allowed = accountId != null
                ? modeManager.isOperationAllowed(operation, accountId)
                : modeManager.isOperationAllowed(operation);
        return ResponseEntity.ok(Map.of(
                "operation", operation,
                "allowed", allowed
        ));
    }

    // ======================== RESPONSES ========================

    @GetMapping("/responses/active")
    public ResponseEntity<Collection<EmergencyResponse>> getActiveResponses() {
        return ResponseEntity.ok(actionEngine.getActiveResponses());
    }

    @GetMapping("/responses/history")
    public ResponseEntity<List<EmergencyResponse>> getResponseHistory() {
        return ResponseEntity.ok(actionEngine.getExecutionHistory());
    }

    @GetMapping("/responses/{responseId}")
    public ResponseEntity<EmergencyResponse> getResponse(@PathVariable String responseId) {
        return actionEngine.findResponse(responseId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/accounts/{accountId}/respond")
    @Operation(summary = "Run an emergency response",
            description = "Same path as an automatic loss-cut detection. 202 while the response is still executing; poll /responses/{responseId}")
    public ResponseEntity<?> respond(@PathVariable String accountId) {
        Optional<RiskMonitoringState> state = riskStateManager.getRiskState(accountId);
        if (state.isEmpty()) {
            return ResponseEntity.status(404).body(Map.of("error", "Unknown account: " + accountId));
        }
        log.warn("[EMERGENCY] Manual response requested for {}", accountId);
        EmergencyResponse response = actionEngine.handleLossCutDetection(accountId, state.get());
        return response.getStatus().isTerminal()
                ? ResponseEntity.ok(response)
                : ResponseEntity.accepted().body(response);
    }

    // ======================== STRATEGIES ========================

    @GetMapping("/strategies")
    public ResponseEntity<Collection<StrategyTemplate>> getStrategies() {
        return ResponseEntity.ok(strategyRegistry.allTemplates());
    }

    @GetMapping("/strategies/{templateId}")
    public ResponseEntity<?> getStrategy(@PathVariable String templateId) {
        try {
            return ResponseEntity.ok(strategyRegistry.template(templateId));
        } catch (StrategyNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        }
    }

    // ======================== EFFECTS ========================

    @GetMapping("/effects")
    public ResponseEntity<List<EffectMeasurement>> getMeasurements() {
        return ResponseEntity.ok(effectAnalyzer.getAllMeasurements());
    }

    @GetMapping("/effects/{measurementId}")
    public ResponseEntity<EffectMeasurement> getMeasurement(@PathVariable String measurementId) {
        return effectAnalyzer.getMeasurement(measurementId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/effects/{measurementId}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getReport(@PathVariable String measurementId) {
        try {
            return ResponseEntity.ok(effectAnalyzer.generateDetailedReport(measurementId));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(404).body(e.getMessage());
        }
    }

    @GetMapping("/effects/performance")
    public ResponseEntity<PerformanceMetrics> getPerformance(@RequestParam(defaultValue = "24") int hours) {
        return ResponseEntity.ok(effectAnalyzer.analyzePerformance(hours));
    }

    @GetMapping("/effects/trends")
    public ResponseEntity<EffectTrendReport> getTrends(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(effectAnalyzer.analyzeTrends(days));
    }
}
