package com.kotsin.margin.emergency;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class EmergencyAction {
    EmergencyActionType type;
    /** Higher runs earlier. */
    int priority;
    @Builder.Default
    List<String> targetPositions = List.of();
    @Builder.Default
    ActionParameters parameters = ActionParameters.none();

    public EmergencyAction withTargets(List<String> targets) {
        return toBuilder().targetPositions(List.copyOf(targets)).build();
    }

    static EmergencyAction immediateClose(int priority, double percentage, double maxLoss) {
        return EmergencyAction.builder()
                .type(EmergencyActionType.IMMEDIATE_CLOSE)
                .priority(priority)
                .parameters(ActionParameters.builder().percentage(percentage).maxLoss(maxLoss).build())
                .build();
    }

    static EmergencyAction partialClose(int priority, double percentage, double maxLoss) {
        return EmergencyAction.builder()
                .type(EmergencyActionType.PARTIAL_CLOSE)
                .priority(priority)
                .parameters(ActionParameters.builder().percentage(percentage).maxLoss(maxLoss).build())
                .build();
    }

    static EmergencyAction hedge(int priority, double hedgeRatio) {
        return hedge(priority, hedgeRatio, null);
    }

    static EmergencyAction hedge(int priority, double hedgeRatio, Double maxLoss) {
        return EmergencyAction.builder()
                .type(EmergencyActionType.HEDGE_OPEN)
                .priority(priority)
                .parameters(ActionParameters.builder().hedgeRatio(hedgeRatio).maxLoss(maxLoss).build())
                .build();
    }

    static EmergencyAction transfer(int priority, double amount) {
        return EmergencyAction.builder()
                .type(EmergencyActionType.BALANCE_TRANSFER)
                .priority(priority)
                .parameters(ActionParameters.builder().amount(amount).build())
                .build();
    }
}
