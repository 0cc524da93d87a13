package com.kotsin.margin.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Forward-looking view of one account. Replaced wholesale on every recompute.
 * {@code riskLevel} here may be worse than the canonical state's level because it also
 * considers the countdown and the predicted level.
 */
@Value
@Builder
public class LossCutForecast {
    String accountId;
    double currentMarginLevel;
    Instant predictedLossCutTime;
    Double timeToLossCutMinutes;
    double requiredRecoveryAmount;
    double confidenceLevel;
    TrendDirection trendDirection;
    Horizons forecast;
    RiskLevel riskLevel;
    double lossCutLevel;
    double usedMargin;
    double equity;
    Instant lastUpdate;

    public boolean hasCountdown() {
        return timeToLossCutMinutes != null;
    }

    @Value
    @Builder
    public static class Horizons {
        double in15Min;
        double in30Min;
        double in1Hour;
    }
}
