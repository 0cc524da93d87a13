package com.kotsin.margin.analysis;

import com.kotsin.margin.emergency.EmergencyAction;
import com.kotsin.margin.emergency.EmergencyActionResult;
import com.kotsin.margin.emergency.EmergencyActionType;
import com.kotsin.margin.emergency.EmergencyResponse;
import com.kotsin.margin.emergency.EmergencyStrategy;
import com.kotsin.margin.emergency.ResponseStatus;
import com.kotsin.margin.emergency.ScenarioType;
import com.kotsin.margin.emergency.SuccessCriteria;
import com.kotsin.margin.model.RiskLevel;
import com.kotsin.margin.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EffectAnalyzer scoring, performance and trend reports
 */
class EffectAnalyzerTest {

    private static final StateSnapshot CRITICAL_BEFORE = new StateSnapshot(40, 1000, 1000, 4, RiskLevel.CRITICAL);
    private static final StateSnapshot RECOVERED = new StateSnapshot(160, 400, 600, 2, RiskLevel.WARNING);
    private static final StateSnapshot WORSE = new StateSnapshot(30, 1200, 1000, 4, RiskLevel.CRITICAL);

    private MutableClock clock;
    private EffectAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-16T10:00:00Z");
        analyzer = new EffectAnalyzer(clock);
    }

    private EmergencyResponse response(String id, boolean... outcomes) {
        EmergencyAction close = EmergencyAction.builder().type(EmergencyActionType.IMMEDIATE_CLOSE).priority(10).build();
        EmergencyStrategy strategy = EmergencyStrategy.builder()
                .name("test")
                .scenarioType(ScenarioType.SINGLE_ACCOUNT)
                .actions(List.of(close, close, close))
                .maxExecutionTimeMs(30_000)
                .successCriteria(SuccessCriteria.builder().marginLevelTarget(100).maxAcceptableLoss(1000).timeoutMinutes(1).build())
                .build();
        EmergencyResponse response = new EmergencyResponse(id, "acc-1", strategy, clock.instant());
        for (boolean success : outcomes) {
            response.addResult(EmergencyActionResult.builder()
                    .action(close)
                    .success(success)
                    .lossReduction(success ? 100.0 : null)
                    .executedAt(clock.instant())
                    .build());
        }
        response.complete(ResponseStatus.COMPLETED, clock.instant().plusSeconds(5));
        return response;
    }

    // ======================== SCORING ========================

    @Test
    @DisplayName("A response that fixed the account scores full marks")
    void testSuccessfulResponse() {
        EffectMeasurement m = analyzer.measureEmergencyResponse(response("r-1", true, true), CRITICAL_BEFORE, RECOVERED);

        assertEquals(600.0, m.getEffects().getLossReduction(), 1e-9);
        assertEquals(120.0, m.getEffects().getMarginImprovement(), 1e-9);
        assertEquals(2, m.getEffects().getRiskLevelChange());
        assertEquals(5000, m.getEffects().getExecutionTimeMs());
        assertEquals(1.0, m.getEffects().getSuccessRate(), 1e-9);
        assertEquals(1.0, m.getEvaluation().getEffectiveness(), 1e-9);
        assertEquals(1.0, m.getEvaluation().getEfficiency(), 1e-9);
        assertEquals(1.0, m.getEvaluation().getOverallScore(), 1e-9);
        assertTrue(m.getEvaluation().getRecommendations().isEmpty());
        assertEquals(ScenarioType.SINGLE_ACCOUNT, m.getScenarioType());
    }

    @Test
    @DisplayName("A response that made things worse scores low with recommendations")
    void testFailedResponse() {
        EffectMeasurement m = analyzer.measureEmergencyResponse(response("r-1", true, false), CRITICAL_BEFORE, WORSE);

        assertEquals(0.0, m.getEffects().getLossReduction(), 1e-9);
        assertEquals(0.0, m.getEvaluation().getEffectiveness(), 1e-9);
        assertEquals(0.6, m.getEvaluation().getEfficiency(), 1e-9);
        assertEquals(0.24, m.getEvaluation().getOverallScore(), 1e-9);
        assertEquals(3, m.getEvaluation().getRecommendations().size());
    }

    @Test
    @DisplayName("Closing every position leaves a finite, capped margin improvement")
    void testImprovementWithNoUsedMarginAfter() {
        StateSnapshot flat = new StateSnapshot(Double.POSITIVE_INFINITY, 0, 0, 0, RiskLevel.SAFE);

        EffectMeasurement m = analyzer.measureEmergencyResponse(response("r-1", true), CRITICAL_BEFORE, flat);

        assertEquals(9999.0 - 40.0, m.getEffects().getMarginImprovement(), 1e-9);
        assertEquals(1.0, m.getEvaluation().getEffectiveness(), 1e-9);
    }

    @Test
    @DisplayName("No used margin on both sides is no improvement")
    void testImprovementWithNoUsedMarginEitherSide() {
        StateSnapshot flat = new StateSnapshot(Double.POSITIVE_INFINITY, 0, 0, 0, RiskLevel.SAFE);

        EffectMeasurement m = analyzer.measureEmergencyResponse(response("r-1", true), flat, flat);

        assertEquals(0.0, m.getEffects().getMarginImprovement(), 1e-9);
        assertFalse(Double.isNaN(m.getEvaluation().getOverallScore()));
        assertTrue(m.getEvaluation().getRecommendations().contains(
                "Small margin improvement; consider a more aggressive strategy"));
    }

    @ParameterizedTest
    @DisplayName("Risk level change is positive for improvements")
    @CsvSource({
            "CRITICAL, SAFE, 3",
            "DANGER, WARNING, 1",
            "WARNING, WARNING, 0",
            "SAFE, CRITICAL, -3"
    })
    void testRiskLevelChange(RiskLevel before, RiskLevel after, int expected) {
        assertEquals(expected, EffectAnalyzer.riskLevelChange(before, after));
    }

    // ======================== PERFORMANCE ========================

    @Test
    @DisplayName("Performance covers only measurements inside the window")
    void testPerformance() {
        analyzer.measureEmergencyResponse(response("r-1", true, true), CRITICAL_BEFORE, RECOVERED);
        analyzer.measureEmergencyResponse(response("r-2", true, false), CRITICAL_BEFORE, WORSE);

        PerformanceMetrics metrics = analyzer.analyzePerformance(24);
        assertEquals(2, metrics.getTotalResponses());
        assertEquals(1, metrics.getSuccessfulResponses());
        assertEquals(0.5, metrics.getSuccessRate(), 1e-9);
        assertEquals(0.5, metrics.getSuccessRateByScenario().get("single_account"), 1e-9);
        assertEquals(0.0, metrics.getSuccessRateByScenario().get("multi_account"), 1e-9);
        assertEquals(0.5, metrics.getSuccessRateByRiskLevel().get("critical"), 1e-9);
        assertEquals(5000, metrics.getExecutionTimes().getMedianMs());
        assertEquals("strategy", metrics.getImprovements().get(0).getCategory());

        clock.advance(Duration.ofHours(25));
        assertEquals(0, analyzer.analyzePerformance(24).getTotalResponses());
        assertEquals(2, analyzer.getPerformanceHistory().size());
    }

    // ======================== TRENDS ========================

    @Test
    @DisplayName("Trend report has one bucket per day including today")
    void testTrendBuckets() {
        analyzer.measureEmergencyResponse(response("r-1", true, true), CRITICAL_BEFORE, RECOVERED);

        EffectTrendReport report = analyzer.analyzeTrends(7);
        assertEquals(8, report.getDataPoints().size());
        EffectTrendReport.DailyDataPoint today = report.getDataPoints().get(7);
        assertEquals(1, today.getTotalResponses());
        assertEquals(1.0, today.getSuccessRate(), 1e-9);
        assertEquals(TrendClassification.IMPROVING, report.getEffectiveness());
    }

    @Test
    @DisplayName("Second half against first half decides the trend")
    void testClassify() {
        assertEquals(TrendClassification.IMPROVING, EffectAnalyzer.classify(new double[]{1, 1, 2, 2}));
        assertEquals(TrendClassification.DECLINING, EffectAnalyzer.classify(new double[]{2, 2, 1, 1}));
        assertEquals(TrendClassification.STABLE, EffectAnalyzer.classify(new double[]{1, 1.05}));
        assertEquals(TrendClassification.STABLE, EffectAnalyzer.classify(new double[]{0, 0}));
        assertEquals(TrendClassification.STABLE, EffectAnalyzer.classify(new double[]{5}));
    }

    // ======================== REPORTS ========================

    @Test
    @DisplayName("Detailed report for a known measurement, error for an unknown one")
    void testDetailedReport() {
        EffectMeasurement m = analyzer.measureEmergencyResponse(response("r-1", true, true), CRITICAL_BEFORE, RECOVERED);

        String report = analyzer.generateDetailedReport(m.getId());
        assertTrue(report.contains("- Account: acc-1"));
        assertTrue(report.contains("- Overall: 100.0%"));
        assertTrue(analyzer.getMeasurement(m.getId()).isPresent());

        assertThrows(NoSuchElementException.class, () -> analyzer.generateDetailedReport("missing"));
    }
}
