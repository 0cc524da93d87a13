package com.kotsin.margin.model;

/**
 * Health bucket of an account, ordered from healthiest to worst.
 */
public enum RiskLevel {
    SAFE,
    WARNING,
    DANGER,
    CRITICAL;

    public static final double SAFE_FLOOR = 200.0;
    public static final double WARNING_FLOOR = 150.0;
    public static final double DANGER_FLOOR = 100.0;

    /**
     * The only mapping from margin level to risk level.
     * An undefined level (no used margin) counts as safe.
     */
    public static RiskLevel fromMarginLevel(double marginLevel) {
        if (Double.isNaN(marginLevel)) {
            return CRITICAL;
        }
        if (marginLevel >= SAFE_FLOOR) return SAFE;
        if (marginLevel >= WARNING_FLOOR) return WARNING;
        if (marginLevel >= DANGER_FLOOR) return DANGER;
        return CRITICAL;
    }

    public boolean isWorseThan(RiskLevel other) {
        return ordinal() > other.ordinal();
    }

    public boolean isAtLeast(RiskLevel other) {
        return ordinal() >= other.ordinal();
    }

    public static RiskLevel worst(RiskLevel a, RiskLevel b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
