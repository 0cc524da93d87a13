package com.kotsin.margin.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class PerformanceMetrics {
    Instant computedAt;
    int timeRangeHours;
    int totalResponses;
    int successfulResponses;
    double successRate;
    double averageExecutionTimeMs;
    double averageLossReduction;
    double averageMarginImprovement;
    Map<String, Double> successRateByScenario;
    Map<String, Double> successRateByRiskLevel;
    ExecutionTimes executionTimes;
    List<Improvement> improvements;

    @Value
    @Builder
    public static class ExecutionTimes {
        long fastestMs;
        long slowestMs;
        long medianMs;
        long percentile95Ms;
    }

    @Value
    @Builder
    public static class Improvement {
        String category;
        String description;
        String priority;
        double estimatedImpact;
    }
}
