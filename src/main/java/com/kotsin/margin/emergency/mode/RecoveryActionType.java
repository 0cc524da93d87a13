package com.kotsin.margin.emergency.mode;

import java.util.Locale;

public enum RecoveryActionType {
    POSITION_VALIDATION("Validate open positions"),
    MARGIN_CHECK("Confirm margin levels"),
    SYSTEM_HEALTH("System health check"),
    CONNECTIVITY_TEST("Check command channel connectivity");

    private final String description;

    RecoveryActionType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
