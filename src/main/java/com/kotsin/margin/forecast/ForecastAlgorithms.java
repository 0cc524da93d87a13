package com.kotsin.margin.forecast;

import com.kotsin.margin.model.MarginSample;

import java.util.List;

/**
 * Margin level estimators. Samples are assumed to arrive every {@value #SAMPLE_INTERVAL_MINUTES}
 * minutes, so a horizon in minutes maps to {@code minutesAhead / 5} steps.
 *
 * <p>Every method returns a zero result instead of failing when it has too little data.</p>
 */
public final class ForecastAlgorithms {

    public static final double SAMPLE_INTERVAL_MINUTES = 5.0;

    public static final String MOVING_AVERAGE = "moving_average";
    public static final String EXPONENTIAL_MOVING_AVERAGE = "exponential_moving_average";
    public static final String LINEAR_REGRESSION = "linear_regression";
    public static final String POLYNOMIAL_REGRESSION = "polynomial_regression";
    public static final String ARIMA_LIKE = "arima_like";
    public static final String ENSEMBLE = "ensemble";
    public static final String VOLATILITY_ADJUSTED = "volatility_adjusted";

    static final int MOVING_AVERAGE_WINDOW = 5;
    static final double EMA_ALPHA = 0.3;

    private ForecastAlgorithms() {
    }

    public static AlgorithmResult movingAverage(List<MarginSample> history, int windowSize, double minutesAhead) {
        if (history.size() < windowSize || windowSize < 1) {
            return AlgorithmResult.none(MOVING_AVERAGE);
        }
        double[] recent = levels(history.subList(history.size() - windowSize, history.size()));
        double average = mean(recent);
        double trend = simpleTrend(recent);
        double prediction = average + trend * minutesAhead;
        // steep trends make the average meaningless; never below zero
        double confidence = Math.max(0.0, Math.min(1.0, windowSize / 10.0) * (1 - Math.abs(trend) / 10.0));
        return new AlgorithmResult(prediction, confidence, MOVING_AVERAGE);
    }

    public static AlgorithmResult exponentialMovingAverage(List<MarginSample> history, double alpha, double minutesAhead) {
        if (history.size() < 2) {
            return AlgorithmResult.none(EXPONENTIAL_MOVING_AVERAGE);
        }
        double[] values = levels(history);
        double[] emaSeries = new double[values.length];
        double ema = values[0];
        emaSeries[0] = ema;
        for (int i = 1; i < values.length; i++) {
            ema = alpha * values[i] + (1 - alpha) * ema;
            emaSeries[i] = ema;
        }
        double emaTrend = linearRegression(emaSeries).slope();
        double prediction = ema + emaTrend * minutesAhead;
        double confidence = Math.min(1.0, history.size() / 15.0) * 0.8;
        return new AlgorithmResult(prediction, confidence, EXPONENTIAL_MOVING_AVERAGE);
    }

    public static AlgorithmResult linearRegression(List<MarginSample> history, double minutesAhead) {
        if (history.size() < 3) {
            return AlgorithmResult.none(LINEAR_REGRESSION);
        }
        Regression regression = linearRegression(levels(history));
        double nextX = history.size() + minutesAhead / SAMPLE_INTERVAL_MINUTES;
        double prediction = regression.slope() * nextX + regression.intercept();
        return new AlgorithmResult(prediction, regression.r2(), LINEAR_REGRESSION);
    }

    /**
     * Quadratic extrapolation. The coefficients come from a simplified solver
     * (a0 = mean, a1 = sumXY/sumX2, a2 = (sumX2Y - a1*sumX3)/sumX4), not a least-squares fit.
     * Confidence is discounted by 10% for that reason.
     */
    public static AlgorithmResult polynomialRegression(List<MarginSample> history, double minutesAhead) {
        if (history.size() < 5) {
            return AlgorithmResult.none(POLYNOMIAL_REGRESSION);
        }
        double[] y = levels(history);
        int n = y.length;
        double sumX2 = 0, sumX3 = 0, sumX4 = 0, sumY = 0, sumXY = 0, sumX2Y = 0;
        for (int i = 0; i < n; i++) {
            double x = i;
            sumX2 += x * x;
            sumX3 += x * x * x;
            sumX4 += x * x * x * x;
            sumY += y[i];
            sumXY += x * y[i];
            sumX2Y += x * x * y[i];
        }
        double a0 = sumY / n;
        double a1 = sumXY / sumX2;
        double a2 = (sumX2Y - a1 * sumX3) / sumX4;

        double meanY = sumY / n;
        double ssRes = 0, ssTot = 0;
        for (int i = 0; i < n; i++) {
            double predicted = a0 + a1 * i + a2 * i * i;
            ssRes += Math.pow(y[i] - predicted, 2);
            ssTot += Math.pow(y[i] - meanY, 2);
        }
        double r2 = ssTot > 0 ? Math.max(0.0, 1 - ssRes / ssTot) : 0.0;

        double nextX = n + minutesAhead / SAMPLE_INTERVAL_MINUTES;
        double prediction = a0 + a1 * nextX + a2 * nextX * nextX;
        return new AlgorithmResult(prediction, r2 * 0.9, POLYNOMIAL_REGRESSION);
    }

    /**
     * Extrapolates the mean of the last five first differences. Confidence drops as the
     * differences get less stable.
     */
    public static AlgorithmResult arimaLike(List<MarginSample> history, double minutesAhead) {
        if (history.size() < 10) {
            return AlgorithmResult.none(ARIMA_LIKE);
        }
        double[] values = levels(history);
        double[] diffs = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            diffs[i - 1] = values[i] - values[i - 1];
        }
        int window = Math.min(5, diffs.length);
        double[] recent = new double[window];
        System.arraycopy(diffs, diffs.length - window, recent, 0, window);
        double avgDiff = mean(recent);

        double stepsAhead = minutesAhead / SAMPLE_INTERVAL_MINUTES;
        double prediction = values[values.length - 1] + avgDiff * stepsAhead;

        double variance = 0;
        for (double d : recent) {
            variance += Math.pow(d - avgDiff, 2);
        }
        double diffStdDev = Math.sqrt(variance / window);
        double confidence = Math.max(0.0, 1 - diffStdDev / 5.0);
        return new AlgorithmResult(prediction, confidence, ARIMA_LIKE);
    }

    /**
     * Confidence-weighted mean of the five base methods. Methods without confidence carry no weight.
     */
    public static AlgorithmResult ensemble(List<MarginSample> history, double minutesAhead) {
        AlgorithmResult[] methods = {
                movingAverage(history, MOVING_AVERAGE_WINDOW, minutesAhead),
                exponentialMovingAverage(history, EMA_ALPHA, minutesAhead),
                linearRegression(history, minutesAhead),
                polynomialRegression(history, minutesAhead),
                arimaLike(history, minutesAhead)
        };
        double totalWeight = 0;
        double weighted = 0;
        for (AlgorithmResult m : methods) {
            totalWeight += m.confidence();
            weighted += m.prediction() * m.confidence();
        }
        if (totalWeight == 0) {
            return AlgorithmResult.none(ENSEMBLE);
        }
        return new AlgorithmResult(weighted / totalWeight, totalWeight / methods.length, ENSEMBLE);
    }

    /**
     * Ensemble shifted down by {@code volatility * 0.1 * sqrt(minutesAhead / 30)}, with confidence
     * scaled by {@code max(0.1, 1 - volatility / 50)}. Below 10 samples the ensemble is returned as is.
     */
    public static AlgorithmResult volatilityAdjusted(List<MarginSample> history, double minutesAhead) {
        AlgorithmResult base = ensemble(history, minutesAhead);
        if (history.size() < 10) {
            return base;
        }
        double volatility = populationStdDev(levels(history));
        double volatilityFactor = Math.max(0.1, 1 - volatility / 50.0);
        double pessimisticAdjustment = volatility * 0.1 * Math.sqrt(minutesAhead / 30.0);
        return new AlgorithmResult(base.prediction() - pessimisticAdjustment,
                base.confidence() * volatilityFactor, VOLATILITY_ADJUSTED);
    }

    // ---- helpers ----

    record Regression(double slope, double intercept, double r2) {
    }

    /**
     * Ordinary least squares of {@code values[i]} against {@code i}.
     */
    static Regression linearRegression(double[] values) {
        int n = values.length;
        if (n < 2) {
            return new Regression(0.0, n == 1 ? values[0] : 0.0, 0.0);
        }
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += values[i];
            sumXY += i * values[i];
            sumXX += (double) i * i;
        }
        double slope = (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
        double intercept = (sumY - slope * sumX) / n;

        double meanY = sumY / n;
        double ssRes = 0, ssTot = 0;
        for (int i = 0; i < n; i++) {
            double predicted = slope * i + intercept;
            ssRes += Math.pow(values[i] - predicted, 2);
            ssTot += Math.pow(values[i] - meanY, 2);
        }
        double r2 = ssTot > 0 ? 1 - ssRes / ssTot : 0.0;
        return new Regression(slope, intercept, r2);
    }

    static double populationStdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double variance = 0;
        for (double v : values) {
            variance += Math.pow(v - mean, 2);
        }
        return Math.sqrt(variance / values.length);
    }

    static double[] levels(List<MarginSample> samples) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).getMarginLevel();
        }
        return values;
    }

    private static double simpleTrend(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return (values[values.length - 1] - values[0]) / (values.length - 1);
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
