package com.kotsin.margin.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for margin arithmetic and the margin level to risk level mapping
 */
class MarginMathTest {

    // ======================== MARGIN LEVEL ========================

    @Test
    @DisplayName("Margin level is equity over used margin in percent")
    void testMarginLevel() {
        assertEquals(125.0, MarginMath.marginLevel(500, 400), 1e-9);
    }

    @Test
    @DisplayName("Zero used margin gives an infinite level instead of dividing by zero")
    void testZeroUsedMargin() {
        double level = MarginMath.marginLevel(1000, 0);
        assertTrue(Double.isInfinite(level), "Level without used margin must be infinite");
        assertEquals(RiskLevel.SAFE, RiskLevel.fromMarginLevel(level));
    }

    @Test
    @DisplayName("Telemetry with no used margin reports an infinite effective level")
    void testEffectiveLevelWithoutUsedMargin() {
        AccountMarginInfo info = AccountMarginInfo.builder()
                .accountId("acc-1").equity(1000).usedMargin(0).marginLevel(0)
                .lastUpdate(Instant.parse("2026-01-16T10:00:00Z"))
                .build();
        assertTrue(Double.isInfinite(info.effectiveMarginLevel()));
    }

    @Test
    @DisplayName("Effective level is recomputed when the bridge sends none")
    void testEffectiveLevelRecomputed() {
        AccountMarginInfo info = AccountMarginInfo.builder()
                .accountId("acc-1").equity(500).usedMargin(400).marginLevel(0)
                .build();
        assertEquals(125.0, info.effectiveMarginLevel(), 1e-9);
    }

    // ======================== RECOVERY ========================

    @Test
    @DisplayName("Required recovery for 125% to 150% on 400 used margin is 100")
    void testRequiredRecovery() {
        assertEquals(100.0, MarginMath.requiredRecovery(400, 500, 150), 1e-9);
    }

    @Test
    @DisplayName("Required recovery is zero once the target is met")
    void testRequiredRecoveryAlreadyHealthy() {
        assertEquals(0.0, MarginMath.requiredRecovery(400, 1000, 150), 1e-9);
    }

    @Test
    @DisplayName("Reportable level caps infinity and maps NaN to zero")
    void testReportable() {
        assertEquals(9999.0, MarginMath.reportable(Double.POSITIVE_INFINITY));
        assertEquals(0.0, MarginMath.reportable(Double.NaN));
        assertEquals(120.5, MarginMath.reportable(120.5));
    }

    // ======================== RISK LEVEL ========================

    @ParameterizedTest
    @DisplayName("Risk level follows the 200/150/100 thresholds")
    @CsvSource({
            "250.0, SAFE",
            "200.0, SAFE",
            "199.9, WARNING",
            "150.0, WARNING",
            "149.9, DANGER",
            "100.0, DANGER",
            "99.9, CRITICAL",
            "0.0, CRITICAL"
    })
    void testRiskLevelMapping(double marginLevel, RiskLevel expected) {
        assertEquals(expected, RiskLevel.fromMarginLevel(marginLevel));
    }

    @Test
    @DisplayName("A state cannot carry a risk level that disagrees with its margin level")
    void testStateDerivesRiskLevel() {
        RiskMonitoringState state = RiskMonitoringState.builder()
                .accountId("acc-1")
                .marginLevel(120.0)
                .build();
        assertEquals(RiskLevel.DANGER, state.getRiskLevel());
        assertEquals(RiskLevel.CRITICAL, state.toBuilder().marginLevel(40.0).build().getRiskLevel());
    }

    @Test
    @DisplayName("Worst of two risk levels is the higher ordinal")
    void testWorst() {
        assertEquals(RiskLevel.DANGER, RiskLevel.worst(RiskLevel.WARNING, RiskLevel.DANGER));
        assertEquals(RiskLevel.CRITICAL, RiskLevel.worst(RiskLevel.CRITICAL, RiskLevel.SAFE));
    }
}
