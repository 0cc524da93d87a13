package com.kotsin.margin.model;

/**
 * Margin arithmetic shared by the monitor, the forecaster and the recovery calculator.
 */
public final class MarginMath {

    private MarginMath() {
    }

    /**
     * Equity over used margin in percent. Undefined (positive infinity) without used margin.
     */
    public static double marginLevel(double equity, double usedMargin) {
        if (usedMargin <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return equity / usedMargin * 100.0;
    }

    /**
     * Equity needed on top of the current equity to bring the account to {@code targetLevel}.
     */
    public static double requiredRecovery(double usedMargin, double equity, double targetLevel) {
        double requiredEquity = usedMargin * targetLevel / 100.0;
        return Math.max(0.0, requiredEquity - equity);
    }

    /**
     * Caps undefined levels so they can be averaged and reported.
     */
    public static double reportable(double marginLevel) {
        if (Double.isNaN(marginLevel)) {
            return 0.0;
        }
        return Math.min(marginLevel, 9999.0);
    }
}
