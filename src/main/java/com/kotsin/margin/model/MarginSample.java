package com.kotsin.margin.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One recorded margin observation. Immutable once recorded.
 */
@Value
@Builder(toBuilder = true)
public class MarginSample {
    Instant timestamp;
    double marginLevel;
    double equity;
    double freeMargin;
    double usedMargin;
    double unrealizedPL;
    double bonusAmount;

    public static MarginSample from(AccountMarginInfo info, Instant timestamp) {
        return MarginSample.builder()
                .timestamp(timestamp)
                .marginLevel(info.effectiveMarginLevel())
                .equity(info.getEquity())
                .freeMargin(info.getFreeMargin())
                .usedMargin(info.getUsedMargin())
                .unrealizedPL(info.getUnrealizedPL())
                .bonusAmount(info.getBonusAmount())
                .build();
    }
}
