package com.kotsin.margin.emergency;

import com.kotsin.margin.model.Position;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Live account figures that switch strategy selection to the dynamic generator.
 */
@Value
@Builder
public class DynamicStrategyParameters {
    double marginLevel;
    double balance;
    double equity;
    double usedMargin;
    double freeMargin;
    double unrealizedPL;
    List<Position> positions;
    ScenarioType scenarioType;
}
