package com.kotsin.margin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Margin telemetry for one account as delivered by the broker bridge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountMarginInfo {
    private String accountId;
    private String broker;

    private double balance;
    private double equity;
    private double freeMargin;
    private double usedMargin;
    private double marginLevel;
    private double bonusAmount;
    private double unrealizedPL;

    private Instant lastUpdate;

    /**
     * Margin level as reported, or recomputed from equity when the bridge sent none.
     */
    public double effectiveMarginLevel() {
        if (usedMargin <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return marginLevel > 0 ? marginLevel : MarginMath.marginLevel(equity, usedMargin);
    }
}
