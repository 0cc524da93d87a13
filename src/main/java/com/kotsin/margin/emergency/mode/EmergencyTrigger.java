package com.kotsin.margin.emergency.mode;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class EmergencyTrigger {
    String id;
    TriggerType type;
    EmergencyLevel severity;
    String accountId;
    @Singular
    Map<String, Object> details;
    Instant timestamp;
}
