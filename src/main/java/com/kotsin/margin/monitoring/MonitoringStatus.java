package com.kotsin.margin.monitoring;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class MonitoringStatus {
    boolean active;
    List<String> connectedAccounts;
    Instant lastUpdate;
    List<String> errors;
}
