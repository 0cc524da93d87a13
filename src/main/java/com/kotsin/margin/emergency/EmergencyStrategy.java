package com.kotsin.margin.emergency;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder(toBuilder = true)
public class EmergencyStrategy {
    String name;
    ScenarioType scenarioType;
    List<EmergencyAction> actions;
    long maxExecutionTimeMs;
    SuccessCriteria successCriteria;

    /**
     * Actions in execution order: descending priority, ties keep their declared order.
     */
    public List<EmergencyAction> actionsByPriority() {
        return actions.stream()
                .sorted(Comparator.comparingInt(EmergencyAction::getPriority).reversed())
                .collect(Collectors.toList());
    }
}
