package com.kotsin.margin.analysis;

import com.kotsin.margin.emergency.ScenarioType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class EffectMeasurement {
    String id;
    String responseId;
    String accountId;
    ScenarioType scenarioType;
    Instant measurementTime;
    StateSnapshot before;
    StateSnapshot after;
    Effects effects;
    Evaluation evaluation;

    @Value
    @Builder
    public static class Effects {
        double lossReduction;
        double marginImprovement;
        /** Positive when the risk level got better, e.g. CRITICAL to DANGER is +1. */
        int riskLevelChange;
        long executionTimeMs;
        double successRate;
        int actionCount;
    }

    @Value
    @Builder
    public static class Evaluation {
        double effectiveness;
        double efficiency;
        double overallScore;
        List<String> recommendations;
    }
}
