package com.kotsin.margin.optimizer;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MinimizationResult {
    MinimizationPolicy policy;
    double requiredMarginReduction;
    List<String> positionsToClose;
    List<PositionReduction> positionsToReduce;
    List<HedgeOrder> hedgePositions;
    double expectedLossReduction;
    double expectedMarginImprovement;
    double confidence;

    public boolean isEmpty() {
        return positionsToClose.isEmpty() && positionsToReduce.isEmpty() && hedgePositions.isEmpty();
    }
}
