package com.kotsin.margin.emergency.mode;

public enum TriggerType {
    LOSSCUT("Loss-cut detected", 1.5),
    MARGIN_CRITICAL("Margin level critical", 1.0),
    SYSTEM_ERROR("System error", 2.0),
    NETWORK_ISSUE("Network issue", 1.0),
    MANUAL("Manual activation", 1.0);

    private final String label;
    private final double recoveryMultiplier;

    TriggerType(String label, double recoveryMultiplier) {
        this.label = label;
        this.recoveryMultiplier = recoveryMultiplier;
    }

    public String getLabel() {
        return label;
    }

    public double getRecoveryMultiplier() {
        return recoveryMultiplier;
    }
}
