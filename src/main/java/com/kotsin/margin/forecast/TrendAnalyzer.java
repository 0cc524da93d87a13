package com.kotsin.margin.forecast;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.model.MarginSample;
import com.kotsin.margin.model.TrendDirection;
import com.kotsin.margin.model.TrendEstimate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * OLS slope over sample index, volatility over the most recent window, and a confidence that
 * grows with sample count and shrinks with volatility.
 */
@Component
public class TrendAnalyzer {

    private final int volatilityWindow;
    private final double trendSensitivity;
    private final Clock clock;

    public TrendAnalyzer(MarginGuardProperties properties, Clock clock) {
        this.volatilityWindow = properties.getForecast().getVolatilityWindow();
        this.trendSensitivity = properties.getForecast().getTrendSensitivity();
        this.clock = clock;
    }

    public TrendEstimate analyze(List<MarginSample> history) {
        int n = history.size();
        if (n < 2) {
            return TrendEstimate.neutral(n, clock.instant());
        }
        double[] values = ForecastAlgorithms.levels(history);
        double slope = ForecastAlgorithms.linearRegression(values).slope();

        int from = Math.max(0, n - volatilityWindow);
        double[] recent = new double[n - from];
        System.arraycopy(values, from, recent, 0, recent.length);
        double volatility = populationStdDev(recent);

        TrendDirection direction;
        if (Math.abs(slope) < trendSensitivity) {
            direction = TrendDirection.STABLE;
        } else if (slope > 0) {
            direction = TrendDirection.IMPROVING;
        } else {
            direction = TrendDirection.DETERIORATING;
        }

        double confidence = Math.min(1.0, (n / 20.0) * (1 - volatility / 100.0));
        return TrendEstimate.builder()
                .slope(slope)
                .direction(direction)
                .volatility(volatility)
                .confidence(Math.max(0.0, confidence))
                .sampleCount(n)
                .computedAt(clock.instant())
                .build();
    }

    private static double populationStdDev(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double variance = 0;
        for (double v : values) {
            variance += Math.pow(v - mean, 2);
        }
        return Math.sqrt(variance / values.length);
    }
}
