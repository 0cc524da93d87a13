package com.kotsin.margin.forecast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Running accuracy of loss-cut predictions against reported outcomes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ForecastMetrics {
    private double accuracy;
    private double falsePositiveRate;
    private double falseNegativeRate;
    private double averageLeadTimeMinutes;
    private int totalPredictions;
    private int successfulPredictions;
    private int falsePositives;
    private int falseNegatives;
}
