package com.kotsin.margin.emergency.mode;

import lombok.Value;

import java.time.Instant;

@Value
public class EmergencyModeHistoryEntry {
    EmergencyModeState state;
    Instant deactivatedAt;
    String reason;
}
