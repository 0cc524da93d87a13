package com.kotsin.margin.emergency;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SuccessCriteria {
    double marginLevelTarget;
    double maxAcceptableLoss;
    double timeoutMinutes;
}
