package com.kotsin.margin.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TrendEstimate {
    double slope;
    TrendDirection direction;
    double volatility;
    double confidence;
    int sampleCount;
    Instant computedAt;

    public static TrendEstimate neutral(int sampleCount, Instant computedAt) {
        return TrendEstimate.builder()
                .slope(0.0)
                .direction(TrendDirection.STABLE)
                .volatility(0.0)
                .confidence(0.0)
                .sampleCount(sampleCount)
                .computedAt(computedAt)
                .build();
    }
}
