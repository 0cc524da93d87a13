package com.kotsin.margin.emergency;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EmergencyActionResult {
    EmergencyAction action;
    boolean success;
    long executionTimeMs;
    String result;
    String error;
    Double lossReduction;
    Instant executedAt;

    public double lossReductionOrZero() {
        return lossReduction != null ? lossReduction : 0.0;
    }
}
