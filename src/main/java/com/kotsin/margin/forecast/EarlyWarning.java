package com.kotsin.margin.forecast;

import com.kotsin.margin.model.RiskLevel;
import com.kotsin.margin.recovery.RecoveryScenario;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EarlyWarning {
    private String id;
    private String accountId;
    private RiskLevel level;
    private String message;
    private Double timeToActionMinutes;
    private List<RecoveryScenario> suggestedActions;
    private boolean active;
    private Instant createdAt;
}
