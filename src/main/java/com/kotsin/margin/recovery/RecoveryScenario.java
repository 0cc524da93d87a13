package com.kotsin.margin.recovery;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A candidate corrective action with its estimated cost and effect. Generated per query.
 */
@Value
@Builder(toBuilder = true)
public class RecoveryScenario {
    RecoveryType type;
    String description;
    double requiredAmount;
    double impactPercent;
    Urgency urgency;
    double feasibility;
    List<String> instructions;
    double score;
}
