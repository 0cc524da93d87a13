package com.kotsin.margin.recovery;

public enum RecoveryType {
    DEPOSIT(0.7, 60),
    POSITION_REDUCTION(1.0, 2),
    PROFIT_TAKING(0.9, 2),
    CROSS_ACCOUNT(0.7, 30);

    private final double timeWeight;
    private final int executionMinutes;

    RecoveryType(double timeWeight, int executionMinutes) {
        this.timeWeight = timeWeight;
        this.executionMinutes = executionMinutes;
    }

    /** Faster-acting scenario types score higher. */
    public double timeWeight() {
        return timeWeight;
    }

    public int executionMinutes() {
        return executionMinutes;
    }
}
