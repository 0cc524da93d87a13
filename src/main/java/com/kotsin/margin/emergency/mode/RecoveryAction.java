package com.kotsin.margin.emergency.mode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryAction {
    private String id;
    private RecoveryActionType type;
    private String description;
    private boolean required;
    private boolean completed;
    private RecoveryResult result;
    private String detail;
    private Instant executedAt;

    public boolean succeeded() {
        return completed && result == RecoveryResult.SUCCESS;
    }
}
