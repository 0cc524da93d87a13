package com.kotsin.margin.emergency.mode;

public enum EmergencyLevel {
    LOW(5),
    MEDIUM(15),
    HIGH(30),
    CRITICAL(60);

    private final int baseRecoveryMinutes;

    EmergencyLevel(int baseRecoveryMinutes) {
        this.baseRecoveryMinutes = baseRecoveryMinutes;
    }

    public int getBaseRecoveryMinutes() {
        return baseRecoveryMinutes;
    }

    /**
     * One step up; {@code CRITICAL} stays where it is.
     */
    public EmergencyLevel escalated() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    /**
     * One step down, or {@code null} below {@code LOW}.
     */
    public EmergencyLevel deEscalated() {
        return this == LOW ? null : values()[ordinal() - 1];
    }
}
