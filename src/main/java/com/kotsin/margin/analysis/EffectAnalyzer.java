package com.kotsin.margin.analysis;

import com.kotsin.margin.emergency.EmergencyResponse;
import com.kotsin.margin.emergency.ScenarioType;
import com.kotsin.margin.model.MarginMath;
import com.kotsin.margin.model.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Scores finished emergency responses by comparing the account before and after, and rolls the
 * scores up into performance and trend reports.
 */
@Component
@Slf4j
public class EffectAnalyzer {

    static final int MEASUREMENT_LIMIT = 1000;
    static final int PERFORMANCE_HISTORY_LIMIT = 100;
    static final double SUCCESS_EFFECTIVENESS = 0.7;
    static final double TREND_CHANGE = 0.1;

    private final Clock clock;

    private final Map<String, EffectMeasurement> measurements = new LinkedHashMap<>();
    private final Deque<PerformanceMetrics> performanceHistory = new ArrayDeque<>();

    public EffectAnalyzer(Clock clock) {
        this.clock = clock;
    }

    // ======================== MEASUREMENT ========================

    public synchronized EffectMeasurement measureEmergencyResponse(EmergencyResponse response,
                                                                   StateSnapshot before,
                                                                   StateSnapshot after) {
        Instant now = clock.instant();
        EffectMeasurement.Effects effects = calculateEffects(response, before, after);
        EffectMeasurement.Evaluation evaluation = evaluate(effects);

        ScenarioType scenario = response.getStrategy() != null ? response.getStrategy().getScenarioType() : null;
        EffectMeasurement measurement = EffectMeasurement.builder()
                .id("measurement_" + response.getId() + "_" + now.toEpochMilli())
                .responseId(response.getId())
                .accountId(response.getAccountId())
                .scenarioType(scenario)
                .measurementTime(now)
                .before(before)
                .after(after)
                .effects(effects)
                .evaluation(evaluation)
                .build();

        measurements.put(measurement.getId(), measurement);
        while (measurements.size() > MEASUREMENT_LIMIT) {
            measurements.remove(measurements.keySet().iterator().next());
        }
        log.info("[EFFECT] Measured response={} account={} score={} effectiveness={} efficiency={}",
                response.getId(), response.getAccountId(), fmt(evaluation.getOverallScore()),
                fmt(evaluation.getEffectiveness()), fmt(evaluation.getEfficiency()));
        return measurement;
    }

    EffectMeasurement.Effects calculateEffects(EmergencyResponse response, StateSnapshot before, StateSnapshot after) {
        long executionTime = response.getEndTime() != null && response.getStartTime() != null
                ? Duration.between(response.getStartTime(), response.getEndTime()).toMillis()
                : 0L;
        int actionCount = response.getExecutedActions().size();
        double successRate = actionCount > 0 ? (double) response.successfulActions() / actionCount : 0.0;

        return EffectMeasurement.Effects.builder()
                .lossReduction(Math.max(0.0, before.getTotalLoss() - after.getTotalLoss()))
                .marginImprovement(MarginMath.reportable(after.getMarginLevel())
                        - MarginMath.reportable(before.getMarginLevel()))
                .riskLevelChange(riskLevelChange(before.getRiskLevel(), after.getRiskLevel()))
                .executionTimeMs(executionTime)
                .successRate(successRate)
                .actionCount(actionCount)
                .build();
    }

    static int riskLevelChange(RiskLevel before, RiskLevel after) {
        // enum order runs SAFE..CRITICAL, so a drop in ordinal is an improvement
        return before.ordinal() - after.ordinal();
    }

    /**
     * Effectiveness: 0.4 for margin improvement, 0.4 for loss reduction, 0.2 for a better risk
     * level. Efficiency: 0.4 under 30 s, 0.4 above 80% action success, 0.2 for at most three
     * actions. Overall is 0.6 effectiveness plus 0.4 efficiency.
     */
    EffectMeasurement.Evaluation evaluate(EffectMeasurement.Effects effects) {
        double effectiveness = 0;
        if (effects.getMarginImprovement() > 0) effectiveness += 0.4;
        if (effects.getLossReduction() > 0) effectiveness += 0.4;
        if (effects.getRiskLevelChange() > 0) effectiveness += 0.2;

        double efficiency = 0;
        if (effects.getExecutionTimeMs() < 30_000) efficiency += 0.4;
        if (effects.getSuccessRate() > 0.8) efficiency += 0.4;
        if (effects.getActionCount() <= 3) efficiency += 0.2;

        effectiveness = Math.min(1.0, effectiveness);
        efficiency = Math.min(1.0, efficiency);
        double overall = Math.min(1.0, effectiveness * 0.6 + efficiency * 0.4);

        return EffectMeasurement.Evaluation.builder()
                .effectiveness(effectiveness)
                .efficiency(efficiency)
                .overallScore(overall)
                .recommendations(recommendations(effects, overall))
                .build();
    }

    private static List<String> recommendations(EffectMeasurement.Effects effects, double overall) {
        List<String> recommendations = new ArrayList<>();
        if (effects.getExecutionTimeMs() > 60_000) {
            recommendations.add("Execution took too long; simplify the strategy");
        }
        if (effects.getSuccessRate() < 0.7) {
            recommendations.add("Low action success rate; action reliability needs work");
        }
        if (effects.getMarginImprovement() < 10) {
            recommendations.add("Small margin improvement; consider a more aggressive strategy");
        }
        if (effects.getActionCount() > 5) {
            recommendations.add("Too many actions; review the strategy for efficiency");
        }
        if (overall < 0.5) {
            recommendations.add("Low overall effect; the strategy needs a fundamental review");
        }
        return List.copyOf(recommendations);
    }

    // ======================== PERFORMANCE ========================

    public synchronized PerformanceMetrics analyzePerformance(int timeRangeHours) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofHours(timeRangeHours));
        List<EffectMeasurement> recent = measurements.values().stream()
                .filter(m -> !m.getMeasurementTime().isBefore(cutoff))
                .collect(Collectors.toList());

        int successful = (int) recent.stream().filter(EffectAnalyzer::successful).count();
        PerformanceMetrics metrics = PerformanceMetrics.builder()
                .computedAt(now)
                .timeRangeHours(timeRangeHours)
                .totalResponses(recent.size())
                .successfulResponses(successful)
                .successRate(recent.isEmpty() ? 0.0 : (double) successful / recent.size())
                .averageExecutionTimeMs(average(recent, m -> m.getEffects().getExecutionTimeMs()))
                .averageLossReduction(average(recent, m -> m.getEffects().getLossReduction()))
                .averageMarginImprovement(average(recent, m -> m.getEffects().getMarginImprovement()))
                .successRateByScenario(successRateByScenario(recent))
                .successRateByRiskLevel(successRateByRiskLevel(recent))
                .executionTimes(executionTimes(recent))
                .improvements(improvements(recent))
                .build();

        performanceHistory.addLast(metrics);
        while (performanceHistory.size() > PERFORMANCE_HISTORY_LIMIT) {
            performanceHistory.pollFirst();
        }
        return metrics;
    }

    private static Map<String, Double> successRateByScenario(List<EffectMeasurement> recent) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (ScenarioType scenario : ScenarioType.values()) {
            List<EffectMeasurement> filtered = recent.stream()
                    .filter(m -> m.getScenarioType() == scenario)
                    .collect(Collectors.toList());
            result.put(scenario.key(), rate(filtered));
        }
        return result;
    }

    private static Map<String, Double> successRateByRiskLevel(List<EffectMeasurement> recent) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (RiskLevel level : RiskLevel.values()) {
            List<EffectMeasurement> filtered = recent.stream()
                    .filter(m -> m.getBefore().getRiskLevel() == level)
                    .collect(Collectors.toList());
            result.put(level.name().toLowerCase(Locale.ROOT), rate(filtered));
        }
        return result;
    }

    static PerformanceMetrics.ExecutionTimes executionTimes(List<EffectMeasurement> recent) {
        long[] times = recent.stream().mapToLong(m -> m.getEffects().getExecutionTimeMs()).sorted().toArray();
        if (times.length == 0) {
            return PerformanceMetrics.ExecutionTimes.builder().build();
        }
        return PerformanceMetrics.ExecutionTimes.builder()
                .fastestMs(times[0])
                .slowestMs(times[times.length - 1])
                .medianMs(times[times.length / 2])
                .percentile95Ms(times[Math.min(times.length - 1, (int) Math.floor(times.length * 0.95))])
                .build();
    }

    private static List<PerformanceMetrics.Improvement> improvements(List<EffectMeasurement> recent) {
        List<PerformanceMetrics.Improvement> improvements = new ArrayList<>();
        double avgEffectiveness = average(recent, m -> m.getEvaluation().getEffectiveness());
        if (avgEffectiveness < SUCCESS_EFFECTIVENESS) {
            improvements.add(PerformanceMetrics.Improvement.builder()
                    .category("strategy")
                    .description("Emergency strategies are losing effect; review the strategy set")
                    .priority("high")
                    .estimatedImpact(0.3)
                    .build());
        }
        long slow = recent.stream().filter(m -> m.getEffects().getExecutionTimeMs() > 30_000).count();
        if (slow > recent.size() * 0.3) {
            improvements.add(PerformanceMetrics.Improvement.builder()
                    .category("speed")
                    .description("Too many responses exceed 30 seconds; optimize command dispatch")
                    .priority("medium")
                    .estimatedImpact(0.2)
                    .build());
        }
        return improvements;
    }

    // ======================== TRENDS ========================

    /**
     * One UTC day bucket per day of the period, oldest first, including today.
     */
    public synchronized EffectTrendReport analyzeTrends(int days) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        LocalDate start = today.minusDays(days);

        List<EffectTrendReport.DailyDataPoint> points = new ArrayList<>();
        for (LocalDate date = start; !date.isAfter(today); date = date.plusDays(1)) {
            LocalDate day = date;
            List<EffectMeasurement> dayMeasurements = measurements.values().stream()
                    .filter(m -> LocalDate.ofInstant(m.getMeasurementTime(), ZoneOffset.UTC).equals(day))
                    .collect(Collectors.toList());
            points.add(new EffectTrendReport.DailyDataPoint(
                    day,
                    average(dayMeasurements, m -> m.getEvaluation().getEffectiveness()),
                    dayMeasurements.size(),
                    rate(dayMeasurements)));
        }

        return EffectTrendReport.builder()
                .periodDays(days)
                .dataPoints(points)
                .effectiveness(classify(points.stream().mapToDouble(EffectTrendReport.DailyDataPoint::getAverageEffectiveness).toArray()))
                .efficiency(classify(points.stream()
                        .mapToDouble(p -> p.getTotalResponses() / Math.max(p.getSuccessRate(), 0.1)).toArray()))
                .reliability(classify(points.stream().mapToDouble(EffectTrendReport.DailyDataPoint::getSuccessRate).toArray()))
                .build();
    }

    /**
     * Compares the mean of the second half against the first; more than 10% either way is a trend.
     */
    static TrendClassification classify(double[] values) {
        if (values.length < 2) {
            return TrendClassification.STABLE;
        }
        int mid = values.length / 2;
        double first = 0;
        for (int i = 0; i < mid; i++) first += values[i];
        first /= mid;
        double second = 0;
        for (int i = mid; i < values.length; i++) second += values[i];
        second /= (values.length - mid);

        if (first == 0) {
            return second > 0 ? TrendClassification.IMPROVING : TrendClassification.STABLE;
        }
        double change = (second - first) / Math.abs(first);
        if (change > TREND_CHANGE) return TrendClassification.IMPROVING;
        if (change < -TREND_CHANGE) return TrendClassification.DECLINING;
        return TrendClassification.STABLE;
    }

    // ======================== REPORTS & QUERIES ========================

    public synchronized String generateDetailedReport(String measurementId) {
        EffectMeasurement m = measurements.get(measurementId);
        if (m == null) {
            throw new NoSuchElementException("Measurement not found: " + measurementId);
        }
        StringBuilder report = new StringBuilder();
        report.append("# Emergency Response Effect Report\n\n");
        report.append("## Summary\n");
        report.append("- Response: ").append(m.getResponseId()).append('\n');
        report.append("- Account: ").append(m.getAccountId()).append('\n');
        report.append("- Measured at: ").append(m.getMeasurementTime()).append("\n\n");
        report.append("## State change\n");
        appendState(report, "Before", m.getBefore());
        appendState(report, "After", m.getAfter());
        EffectMeasurement.Effects e = m.getEffects();
        report.append("## Effects\n");
        report.append(String.format("- Loss reduction: %.2f%n", e.getLossReduction()));
        report.append(String.format("- Margin improvement: %.2f%n", e.getMarginImprovement()));
        report.append(String.format("- Execution time: %dms%n", e.getExecutionTimeMs()));
        report.append(String.format("- Success rate: %.1f%%%n%n", e.getSuccessRate() * 100));
        EffectMeasurement.Evaluation v = m.getEvaluation();
        report.append("## Evaluation\n");
        report.append(String.format("- Effectiveness: %.1f%%%n", v.getEffectiveness() * 100));
        report.append(String.format("- Efficiency: %.1f%%%n", v.getEfficiency() * 100));
        report.append(String.format("- Overall: %.1f%%%n%n", v.getOverallScore() * 100));
        report.append("## Recommendations\n");
        v.getRecommendations().forEach(r -> report.append("- ").append(r).append('\n'));
        return report.toString();
    }

    private static void appendState(StringBuilder report, String title, StateSnapshot s) {
        report.append("### ").append(title).append('\n');
        report.append(String.format("- Margin level: %.2f%%%n", s.getMarginLevel()));
        report.append(String.format("- Total loss: %.2f%n", s.getTotalLoss()));
        report.append(String.format("- Used margin: %.2f%n", s.getUsedMargin()));
        report.append("- Positions: ").append(s.getPositionCount()).append('\n');
        report.append("- Risk level: ").append(s.getRiskLevel()).append("\n\n");
    }

    public synchronized Optional<EffectMeasurement> getMeasurement(String id) {
        return Optional.ofNullable(measurements.get(id));
    }

    public synchronized List<EffectMeasurement> getAllMeasurements() {
        return List.copyOf(measurements.values());
    }

    public synchronized List<PerformanceMetrics> getPerformanceHistory() {
        return List.copyOf(performanceHistory);
    }

    private static boolean successful(EffectMeasurement m) {
        return m.getEvaluation().getEffectiveness() > SUCCESS_EFFECTIVENESS;
    }

    private static double rate(List<EffectMeasurement> measurements) {
        if (measurements.isEmpty()) {
            return 0.0;
        }
        return (double) measurements.stream().filter(EffectAnalyzer::successful).count() / measurements.size();
    }

    private static double average(List<EffectMeasurement> measurements, ToDoubleFunction<EffectMeasurement> f) {
        return measurements.stream().mapToDouble(f).average().orElse(0.0);
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }
}
