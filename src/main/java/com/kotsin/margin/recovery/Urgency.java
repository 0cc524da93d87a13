package com.kotsin.margin.recovery;

import com.kotsin.margin.model.RiskLevel;

public enum Urgency {
    LOW(0.4, 1),
    MEDIUM(0.6, 2),
    HIGH(0.8, 3),
    CRITICAL(1.0, 4);

    private final double weight;
    private final int rank;

    Urgency(double weight, int rank) {
        this.weight = weight;
        this.rank = rank;
    }

    public double weight() {
        return weight;
    }

    public int rank() {
        return rank;
    }

    public static Urgency fromMarginLevel(double marginLevel) {
        if (marginLevel < 50) return CRITICAL;
        if (marginLevel < 100) return HIGH;
        if (marginLevel < 150) return MEDIUM;
        return LOW;
    }

    public static Urgency fromRiskLevel(RiskLevel riskLevel) {
        return switch (riskLevel) {
            case CRITICAL -> CRITICAL;
            case DANGER -> HIGH;
            case WARNING -> MEDIUM;
            case SAFE -> LOW;
        };
    }
}
