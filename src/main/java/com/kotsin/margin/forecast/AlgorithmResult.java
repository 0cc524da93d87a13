package com.kotsin.margin.forecast;

/**
 * Output of one estimator: predicted margin level, how far to trust it, and which method produced it.
 */
public record AlgorithmResult(double prediction, double confidence, String method) {

    static AlgorithmResult none(String method) {
        return new AlgorithmResult(0.0, 0.0, method);
    }
}
