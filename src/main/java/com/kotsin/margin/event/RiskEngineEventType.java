package com.kotsin.margin.event;

/**
 * Every kind of event the margin guard emits.
 */
public enum RiskEngineEventType {
    // Threshold bands
    WARNING_THRESHOLD,
    DANGER_THRESHOLD,
    CRITICAL_THRESHOLD,
    LOSSCUT_LEVEL_REACHED,
    RAPID_MARGIN_CHANGE,

    // State of record
    MARGIN_LEVEL_UPDATE,
    RISK_LEVEL_CHANGED,
    LOSSCUT_DETECTED,
    ALERT_GENERATED,
    INVALID_TELEMETRY,

    // Monitor lifecycle
    MONITORING_STARTED,
    MONITORING_STOPPED,

    // Forecasting
    FORECAST_UPDATED,
    EARLY_WARNING,

    // Emergency handling
    RESPONSE_COMPLETED,
    EMERGENCY_MODE_CHANGED
}
