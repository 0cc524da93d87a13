package com.kotsin.margin.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class EffectTrendReport {
    int periodDays;
    List<DailyDataPoint> dataPoints;
    TrendClassification effectiveness;
    TrendClassification efficiency;
    TrendClassification reliability;

    @Value
    public static class DailyDataPoint {
        LocalDate date;
        double averageEffectiveness;
        int totalResponses;
        double successRate;
    }
}
