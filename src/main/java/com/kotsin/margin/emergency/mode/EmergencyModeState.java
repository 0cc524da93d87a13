package com.kotsin.margin.emergency.mode;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of the process-wide emergency mode. {@link EmergencyModeManager} is the only
 * writer; it swaps in a new snapshot on every transition.
 */
@Value
@Builder(toBuilder = true)
public class EmergencyModeState {
    boolean active;
    EmergencyLevel level;
    Instant triggeredAt;
    TriggerType triggeredBy;
    String reason;
    List<String> affectedAccounts;
    List<OperationType> suspendedOperations;
    List<OperationType> allowedOperations;
    boolean autoRecoveryEnabled;
    boolean manualInterventionRequired;
    Integer estimatedRecoveryTimeMinutes;

    public static EmergencyModeState inactive() {
        return EmergencyModeState.builder()
                .active(false)
                .level(EmergencyLevel.LOW)
                .reason("")
                .affectedAccounts(List.of())
                .suspendedOperations(List.of())
                .allowedOperations(List.of())
                .autoRecoveryEnabled(false)
                .manualInterventionRequired(false)
                .build();
    }
}
