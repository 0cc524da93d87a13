package com.kotsin.margin.emergency;

import lombok.Builder;
import lombok.Value;

/**
 * Optional knobs of an {@link EmergencyAction}; which ones apply depends on the action type.
 */
@Value
@Builder(toBuilder = true)
public class ActionParameters {
    Double percentage;
    Double maxLoss;
    Double hedgeRatio;
    Double amount;

    public static ActionParameters none() {
        return ActionParameters.builder().build();
    }
}
