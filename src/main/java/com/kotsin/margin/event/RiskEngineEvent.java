package com.kotsin.margin.event;

import com.kotsin.margin.model.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Single envelope for everything the engine publishes. The {@code type} tells listeners how
 * to read {@code payload}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskEngineEvent {

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    private String eventId;
    private RiskEngineEventType type;
    private String accountId;
    private Severity severity;
    private String message;

    private Double marginLevel;
    private Double threshold;
    private Object payload;

    private Instant timestamp;

    public static RiskEngineEvent thresholdBreached(String accountId, RiskEngineEventType type,
                                                    double marginLevel, double threshold, Instant now) {
        Severity severity = switch (type) {
            case WARNING_THRESHOLD -> Severity.INFO;
            case DANGER_THRESHOLD -> Severity.WARNING;
            default -> Severity.CRITICAL;
        };
        return RiskEngineEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .accountId(accountId)
                .severity(severity)
                .message(String.format("Margin level %.1f%% breached %s (%.1f%%)", marginLevel, type, threshold))
                .marginLevel(marginLevel)
                .threshold(threshold)
                .timestamp(now)
                .build();
    }

    public static RiskEngineEvent rapidChange(String accountId, double previous, double current,
                                              double changePercent, Instant now) {
        return RiskEngineEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(RiskEngineEventType.RAPID_MARGIN_CHANGE)
                .accountId(accountId)
                .severity(Severity.WARNING)
                .message(String.format("Margin level moved %.1f%% (%.1f%% -> %.1f%%)", changePercent, previous, current))
                .marginLevel(current)
                .payload(Map.of("previous", previous, "changePercent", changePercent))
                .timestamp(now)
                .build();
    }

    public static RiskEngineEvent riskLevelChanged(String accountId, RiskLevel from, RiskLevel to,
                                                   double marginLevel, Instant now) {
        return RiskEngineEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(RiskEngineEventType.RISK_LEVEL_CHANGED)
                .accountId(accountId)
                .severity(to.isAtLeast(RiskLevel.DANGER) ? Severity.CRITICAL
                        : to == RiskLevel.WARNING ? Severity.WARNING : Severity.INFO)
                .message(String.format("Risk level changed %s -> %s at %.1f%%", from, to, marginLevel))
                .marginLevel(marginLevel)
                .payload(Map.of("from", from.name(), "to", to.name()))
                .timestamp(now)
                .build();
    }

    public static RiskEngineEvent lossCutDetected(String accountId, double marginLevel, double lossCutLevel, Instant now) {
        return RiskEngineEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(RiskEngineEventType.LOSSCUT_DETECTED)
                .accountId(accountId)
                .severity(Severity.CRITICAL)
                .message(String.format("Loss-cut level reached: %.1f%% <= %.1f%%", marginLevel, lossCutLevel))
                .marginLevel(marginLevel)
                .threshold(lossCutLevel)
                .timestamp(now)
                .build();
    }

    public static RiskEngineEvent invalidTelemetry(String accountId, String reason, Instant now) {
        return RiskEngineEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(RiskEngineEventType.INVALID_TELEMETRY)
                .accountId(accountId)
                .severity(Severity.WARNING)
                .message("Telemetry rejected: " + reason)
                .timestamp(now)
                .build();
    }

    public static RiskEngineEvent of(RiskEngineEventType type, String accountId, Severity severity,
                                     String message, Object payload, Instant now) {
        return RiskEngineEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .accountId(accountId)
                .severity(severity)
                .message(message)
                .payload(payload)
                .timestamp(now)
                .build();
    }
}
