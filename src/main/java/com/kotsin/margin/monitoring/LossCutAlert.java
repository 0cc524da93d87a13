package com.kotsin.margin.monitoring;

import com.kotsin.margin.event.RiskEngineEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LossCutAlert {
    private String id;
    private String accountId;
    private RiskEngineEvent.Severity severity;
    private double marginLevel;
    private String message;
    private Instant timestamp;
    private boolean acknowledged;
    private boolean autoResolve;
}
