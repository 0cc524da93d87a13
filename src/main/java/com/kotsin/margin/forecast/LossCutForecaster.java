package com.kotsin.margin.forecast;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.event.RiskEngineEventType;
import com.kotsin.margin.event.RiskEventDispatcher;
import com.kotsin.margin.model.LossCutForecast;
import com.kotsin.margin.model.MarginMath;
import com.kotsin.margin.model.MarginSample;
import com.kotsin.margin.model.RiskLevel;
import com.kotsin.margin.model.TrendDirection;
import com.kotsin.margin.model.TrendEstimate;
import com.kotsin.margin.monitoring.MarginSampleStore;
import com.kotsin.margin.recovery.RecoveryScenario;
import com.kotsin.margin.recovery.RecoveryScenarioCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Turns each account's sample buffer into a {@link LossCutForecast}, keeps early warnings for
 * risky forecasts and tracks how well past predictions matched reality.
 *
 * <p>Forecasts are recomputed when a sample arrives and on a slower periodic cadence.</p>
 */
@Component
@Slf4j
public class LossCutForecaster {

    static final double CRITICAL_FLOOR = 50.0;
    static final double DANGER_FLOOR = 100.0;
    static final double WARNING_FLOOR = 150.0;
    static final double DANGER_COUNTDOWN_MINUTES = 30.0;
    static final double WARNING_COUNTDOWN_MINUTES = 60.0;
    static final int SUSTAINED_DECLINE_SAMPLES = 10;
    private static final double MIN_RECOVERY_TARGET = 200.0;
    private static final double SUCCESSFUL_PREDICTION_MINUTES = 30.0;
    private static final int MAX_WARNINGS_PER_ACCOUNT = 50;

    private final MarginSampleStore store;
    private final TrendAnalyzer trendAnalyzer;
    private final RecoveryScenarioCalculator recoveryCalculator;
    private final RiskEventDispatcher dispatcher;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final MarginGuardProperties.Forecast config;
    private final double defaultLossCutLevel;

    private final Map<String, LossCutForecast> forecasts = new ConcurrentHashMap<>();
    private final Map<String, List<EarlyWarning>> warnings = new ConcurrentHashMap<>();
    private final Map<String, Double> lossCutLevels = new ConcurrentHashMap<>();
    private final ForecastMetrics metrics = new ForecastMetrics();
    private volatile ScheduledFuture<?> updateTask;

    public LossCutForecaster(MarginSampleStore store,
                             TrendAnalyzer trendAnalyzer,
                             RecoveryScenarioCalculator recoveryCalculator,
                             RiskEventDispatcher dispatcher,
                             @Qualifier("riskEngineScheduler") ScheduledExecutorService scheduler,
                             Clock clock,
                             MarginGuardProperties properties) {
        this.store = store;
        this.trendAnalyzer = trendAnalyzer;
        this.recoveryCalculator = recoveryCalculator;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.clock = clock;
        this.config = properties.getForecast();
        this.defaultLossCutLevel = properties.getMonitor().getDefaultLossCutLevel();
    }

    // ======================== LIFECYCLE ========================

    public synchronized void start() {
        if (updateTask != null) {
            return;
        }
        updateTask = scheduler.scheduleAtFixedRate(this::recomputeAll,
                config.getUpdateIntervalMs(), config.getUpdateIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("[FORECAST] Periodic recompute every {}ms", config.getUpdateIntervalMs());
    }

    public synchronized void stop() {
        if (updateTask != null) {
            updateTask.cancel(false);
            updateTask = null;
            log.info("[FORECAST] Periodic recompute stopped");
        }
    }

    void recomputeAll() {
        for (String accountId : store.accounts()) {
            try {
                updatePrediction(accountId);
            } catch (Exception e) {
                log.error("[FORECAST] Recompute failed for {}: {}", accountId, e.getMessage(), e);
            }
        }
    }

    // ======================== INPUT ========================

    public Optional<LossCutForecast> addMarginData(String accountId, MarginSample sample, double lossCutLevel) {
        lossCutLevels.put(accountId, lossCutLevel);
        store.record(accountId, sample);
        return updatePrediction(accountId);
    }

    public Optional<LossCutForecast> addMarginData(String accountId, MarginSample sample) {
        return addMarginData(accountId, sample, lossCutLevels.getOrDefault(accountId, defaultLossCutLevel));
    }

    /**
     * Recomputes and replaces the account's forecast. Empty while fewer than
     * {@code minDataPoints} samples are buffered.
     */
    public Optional<LossCutForecast> updatePrediction(String accountId) {
        List<MarginSample> history = store.samples(accountId);
        if (history.size() < config.getMinDataPoints()) {
            return Optional.empty();
        }
        TrendEstimate trend = trendAnalyzer.analyze(history);
        LossCutForecast forecast = predictLossCut(accountId, history, trend,
                lossCutLevels.getOrDefault(accountId, defaultLossCutLevel));
        LossCutForecast previous = forecasts.put(accountId, forecast);
        updateWarnings(accountId, forecast);

        if (previous == null || previous.getRiskLevel() != forecast.getRiskLevel()) {
            log.info("[FORECAST] account={} riskLevel={} level={} trend={} countdownMin={} confidence={}",
                    accountId, forecast.getRiskLevel(), fmt(forecast.getCurrentMarginLevel()),
                    forecast.getTrendDirection(), forecast.getTimeToLossCutMinutes() != null
                            ? fmt(forecast.getTimeToLossCutMinutes()) : "n/a",
                    fmt(forecast.getConfidenceLevel()));
        }
        dispatcher.dispatch(RiskEngineEvent.of(RiskEngineEventType.FORECAST_UPDATED, accountId,
                RiskEngineEvent.Severity.INFO, "Forecast updated", forecast, clock.instant()));
        return Optional.of(forecast);
    }

    // ======================== PREDICTION ========================

    LossCutForecast predictLossCut(String accountId, List<MarginSample> history, TrendEstimate trend,
                                   double lossCutLevel) {
        MarginSample latest = history.get(history.size() - 1);
        Instant now = clock.instant();

        Double timeToLossCut = null;
        Instant predictedTime = null;
        // a countdown needs a deteriorating trend the data actually supports
        if (trend.getDirection() == TrendDirection.DETERIORATING
                && trend.getConfidence() > config.getConfidenceThreshold()) {
            double ratePerMinute = Math.abs(trend.getSlope()) / ForecastAlgorithms.SAMPLE_INTERVAL_MINUTES;
            if (ratePerMinute > 0) {
                timeToLossCut = Math.max(0.0, (latest.getMarginLevel() - lossCutLevel) / ratePerMinute);
                predictedTime = now.plus(Duration.ofMillis(Math.round(timeToLossCut * 60_000)));
            }
        }

        LossCutForecast.Horizons horizons = LossCutForecast.Horizons.builder()
                .in15Min(predictMarginLevel(history, trend, 15))
                .in30Min(predictMarginLevel(history, trend, 30))
                .in1Hour(predictMarginLevel(history, trend, 60))
                .build();

        RiskLevel riskLevel = forecastRiskLevel(history, latest.getMarginLevel(), timeToLossCut, lossCutLevel);
        double required = MarginMath.requiredRecovery(latest.getUsedMargin(), latest.getEquity(),
                Math.max(config.getTargetMarginLevel(), MIN_RECOVERY_TARGET));

        return LossCutForecast.builder()
                .accountId(accountId)
                .currentMarginLevel(latest.getMarginLevel())
                .predictedLossCutTime(predictedTime)
                .timeToLossCutMinutes(timeToLossCut)
                .requiredRecoveryAmount(required)
                .confidenceLevel(trend.getConfidence())
                .trendDirection(trend.getDirection())
                .forecast(horizons)
                .riskLevel(riskLevel)
                .lossCutLevel(lossCutLevel)
                .usedMargin(latest.getUsedMargin())
                .equity(latest.getEquity())
                .lastUpdate(now)
                .build();
    }

    /**
     * Current level and countdown first; then the ensemble's 30 minute prediction and a sustained
     * decline over the last ten samples can each raise the level to at least DANGER.
     */
    RiskLevel forecastRiskLevel(List<MarginSample> history, double level, Double timeToLossCut, double lossCutLevel) {
        RiskLevel risk;
        if (level < CRITICAL_FLOOR) {
            risk = RiskLevel.CRITICAL;
        } else if (level < DANGER_FLOOR || (timeToLossCut != null && timeToLossCut < DANGER_COUNTDOWN_MINUTES)) {
            risk = RiskLevel.DANGER;
        } else if (level < WARNING_FLOOR || (timeToLossCut != null && timeToLossCut < WARNING_COUNTDOWN_MINUTES)) {
            risk = RiskLevel.WARNING;
        } else {
            risk = RiskLevel.SAFE;
        }

        AlgorithmResult ensemble = ForecastAlgorithms.ensemble(history, 30);
        if (ensemble.confidence() > 0 && ensemble.prediction() < lossCutLevel) {
            risk = RiskLevel.worst(risk, RiskLevel.DANGER);
        }
        if (isSustainedDecline(history)) {
            risk = RiskLevel.worst(risk, RiskLevel.DANGER);
        }
        return risk;
    }

    /**
     * True when each of the last ten samples is at or below its predecessor and the level fell overall.
     */
    static boolean isSustainedDecline(List<MarginSample> history) {
        if (history.size() < SUSTAINED_DECLINE_SAMPLES) {
            return false;
        }
        List<MarginSample> recent = history.subList(history.size() - SUSTAINED_DECLINE_SAMPLES, history.size());
        for (int i = 1; i < recent.size(); i++) {
            if (recent.get(i).getMarginLevel() > recent.get(i - 1).getMarginLevel()) {
                return false;
            }
        }
        return recent.get(recent.size() - 1).getMarginLevel() < recent.get(0).getMarginLevel();
    }

    private double predictMarginLevel(List<MarginSample> history, TrendEstimate trend, int minutesAhead) {
        AlgorithmResult adjusted = ForecastAlgorithms.volatilityAdjusted(history, minutesAhead);
        if (adjusted.confidence() > 0) {
            return Math.max(0.0, adjusted.prediction());
        }
        MarginSample latest = history.get(history.size() - 1);
        double ratePerMinute = trend.getSlope() / ForecastAlgorithms.SAMPLE_INTERVAL_MINUTES;
        double base = latest.getMarginLevel() + ratePerMinute * minutesAhead;
        return Math.max(0.0, base - trend.getVolatility() * 0.1);
    }

    // ======================== WARNINGS ========================

    private void updateWarnings(String accountId, LossCutForecast forecast) {
        List<EarlyWarning> existing = warnings.getOrDefault(accountId, List.of());
        existing.forEach(w -> w.setActive(false));

        List<EarlyWarning> next = new ArrayList<>(existing);
        EarlyWarning created = newWarning(accountId, forecast);
        if (created != null) {
            next.add(created);
            dispatcher.dispatch(RiskEngineEvent.of(RiskEngineEventType.EARLY_WARNING, accountId,
                    created.getLevel() == RiskLevel.CRITICAL ? RiskEngineEvent.Severity.CRITICAL
                            : RiskEngineEvent.Severity.WARNING,
                    created.getMessage(), created, clock.instant()));
        }
        while (next.size() > MAX_WARNINGS_PER_ACCOUNT) {
            next.remove(0);
        }
        warnings.put(accountId, List.copyOf(next));
    }

    private EarlyWarning newWarning(String accountId, LossCutForecast forecast) {
        List<RecoveryScenario> scenarios = recoveryCalculator.fromForecast(forecast);
        String message;
        List<RecoveryScenario> suggested;
        switch (forecast.getRiskLevel()) {
            case CRITICAL -> {
                message = String.format("Urgent: margin level down to %.1f%%", forecast.getCurrentMarginLevel());
                suggested = scenarios.subList(0, Math.min(2, scenarios.size()));
            }
            case DANGER -> {
                message = String.format("Warning: loss-cut risk rising (%.1f%%)", forecast.getCurrentMarginLevel());
                suggested = scenarios.subList(0, Math.min(3, scenarios.size()));
            }
            case WARNING -> {
                message = String.format("Notice: margin level trending down (%.1f%%)", forecast.getCurrentMarginLevel());
                suggested = scenarios;
            }
            default -> {
                return null;
            }
        }
        return EarlyWarning.builder()
                .id(UUID.randomUUID().toString())
                .accountId(accountId)
                .level(forecast.getRiskLevel())
                .message(message)
                .timeToActionMinutes(forecast.getRiskLevel() == RiskLevel.WARNING ? null : forecast.getTimeToLossCutMinutes())
                .suggestedActions(List.copyOf(suggested))
                .active(true)
                .createdAt(clock.instant())
                .build();
    }

    // ======================== QUERIES ========================

    public Optional<LossCutForecast> getForecast(String accountId) {
        return Optional.ofNullable(forecasts.get(accountId));
    }

    public Optional<ForecastResult> getPrediction(String accountId) {
        LossCutForecast forecast = forecasts.get(accountId);
        if (forecast == null) {
            return Optional.empty();
        }
        return Optional.of(ForecastResult.builder()
                .forecast(forecast)
                .trend(trendAnalyzer.analyze(store.samples(accountId)))
                .warnings(activeWarnings(accountId))
                .recoveryScenarios(recoveryCalculator.fromForecast(forecast))
                .nextUpdateAt(clock.instant().plusMillis(config.getUpdateIntervalMs()))
                .build());
    }

    public Map<String, ForecastResult> getAllPredictions() {
        Map<String, ForecastResult> results = new LinkedHashMap<>();
        for (String accountId : forecasts.keySet()) {
            getPrediction(accountId).ifPresent(r -> results.put(accountId, r));
        }
        return results;
    }

    public List<EarlyWarning> activeWarnings(String accountId) {
        return warnings.getOrDefault(accountId, List.of()).stream()
                .filter(EarlyWarning::isActive)
                .collect(Collectors.toList());
    }

    /**
     * Active DANGER and CRITICAL warnings, critical first, then oldest first.
     */
    public List<EarlyWarning> criticalWarnings() {
        List<EarlyWarning> result = new ArrayList<>();
        for (List<EarlyWarning> accountWarnings : warnings.values()) {
            for (EarlyWarning w : accountWarnings) {
                if (w.isActive() && w.getLevel().isAtLeast(RiskLevel.DANGER)) {
                    result.add(w);
                }
            }
        }
        result.sort(Comparator
                .comparing((EarlyWarning w) -> w.getLevel() == RiskLevel.CRITICAL ? 0 : 1)
                .thenComparing(EarlyWarning::getCreatedAt));
        return result;
    }

    // ======================== ACCURACY ========================

    /**
     * Scores the account's current prediction against what happened. A loss-cut within
     * 30 minutes of the predicted time counts as a successful prediction.
     */
    public synchronized void recordOutcome(String accountId, boolean lossCutOccurred, Instant actualTime) {
        LossCutForecast forecast = forecasts.get(accountId);
        if (forecast == null) {
            return;
        }
        metrics.setTotalPredictions(metrics.getTotalPredictions() + 1);

        if (lossCutOccurred && forecast.getPredictedLossCutTime() != null && actualTime != null) {
            double errorMinutes = Math.abs(Duration.between(forecast.getPredictedLossCutTime(), actualTime).toMillis()) / 60_000.0;
            if (errorMinutes <= SUCCESSFUL_PREDICTION_MINUTES) {
                metrics.setSuccessfulPredictions(metrics.getSuccessfulPredictions() + 1);
            }
            metrics.setAverageLeadTimeMinutes((metrics.getAverageLeadTimeMinutes() * (metrics.getTotalPredictions() - 1)
                    + errorMinutes) / metrics.getTotalPredictions());
        } else if (lossCutOccurred) {
            metrics.setFalseNegatives(metrics.getFalseNegatives() + 1);
        } else if (forecast.getPredictedLossCutTime() != null) {
            metrics.setFalsePositives(metrics.getFalsePositives() + 1);
        }

        int total = metrics.getTotalPredictions();
        metrics.setAccuracy((double) metrics.getSuccessfulPredictions() / total);
        metrics.setFalsePositiveRate((double) metrics.getFalsePositives() / total);
        metrics.setFalseNegativeRate((double) metrics.getFalseNegatives() / total);
    }

    public synchronized ForecastMetrics getMetrics() {
        return metrics.toBuilder().build();
    }

    public void removeAccount(String accountId) {
        forecasts.remove(accountId);
        warnings.remove(accountId);
        lossCutLevels.remove(accountId);
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }
}
