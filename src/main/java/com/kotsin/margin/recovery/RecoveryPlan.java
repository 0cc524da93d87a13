package com.kotsin.margin.recovery;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RecoveryPlan {
    /** Every candidate, best score first. */
    List<RecoveryScenario> scenarios;
    RecoveryScenario optimalScenario;
    int timeToExecuteMinutes;
    double successProbability;
    double riskReduction;
}
