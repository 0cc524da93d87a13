package com.kotsin.margin.optimizer;

/**
 * Partial close of one position, as a whole-number percentage of its lots.
 */
public record PositionReduction(String positionId, int reductionPercentage) {
}
