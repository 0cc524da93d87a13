package com.kotsin.margin.forecast;

import com.kotsin.margin.model.LossCutForecast;
import com.kotsin.margin.model.TrendEstimate;
import com.kotsin.margin.recovery.RecoveryScenario;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ForecastResult {
    LossCutForecast forecast;
    TrendEstimate trend;
    List<EarlyWarning> warnings;
    List<RecoveryScenario> recoveryScenarios;
    Instant nextUpdateAt;
}
