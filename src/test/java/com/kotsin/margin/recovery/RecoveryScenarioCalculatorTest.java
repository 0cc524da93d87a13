package com.kotsin.margin.recovery;

import com.kotsin.margin.model.Position;
import com.kotsin.margin.model.PositionSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RecoveryScenarioCalculator
 */
class RecoveryScenarioCalculatorTest {

    private final RecoveryScenarioCalculator calculator = new RecoveryScenarioCalculator();

    private static Position position(String id, double profit, double margin) {
        return Position.builder()
                .id(id).accountId("acc-1").symbol("EURUSD").side(PositionSide.BUY)
                .lots(1.0).profit(profit).marginRequired(margin)
                .build();
    }

    private static AccountState account(String id, double marginLevel, double usedMargin, double freeMargin,
                                        List<Position> positions) {
        return AccountState.builder()
                .accountId(id)
                .broker("xm")
                .usedMargin(usedMargin)
                .equity(usedMargin * marginLevel / 100.0)
                .marginLevel(marginLevel)
                .freeMargin(freeMargin)
                .positions(positions)
                .build();
    }

    @ParameterizedTest
    @DisplayName("Basic recovery is the equity gap to the target level")
    @CsvSource({
            "125.0, 400.0, 150.0, 100.0",
            "50.0, 1000.0, 200.0, 1500.0",
            "250.0, 1000.0, 200.0, 0.0"
    })
    void testBasicRecovery(double level, double usedMargin, double target, double expected) {
        assertEquals(expected, calculator.basicRecovery(level, usedMargin, target), 1e-9);
    }

    @Test
    @DisplayName("Deposit scenarios carry urgency from the current margin level")
    void testDepositScenarios() {
        List<RecoveryScenario> scenarios = calculator.depositScenarios(account("acc-1", 40, 1000, 0, List.of()), 200);

        assertEquals(2, scenarios.size());
        assertEquals(1600.0, scenarios.get(0).getRequiredAmount(), 1e-9);
        assertEquals(Urgency.CRITICAL, scenarios.get(0).getUrgency());
        assertEquals(2400.0, scenarios.get(1).getRequiredAmount(), 1e-9);
    }

    @Test
    @DisplayName("Healthy account needs no deposit")
    void testNoDepositNeeded() {
        assertTrue(calculator.depositScenarios(account("acc-1", 300, 1000, 2000, List.of()), 200).isEmpty());
    }

    @Test
    @DisplayName("Position reduction offers closing the worst loser and taking the best profit")
    void testPositionReduction() {
        List<Position> positions = List.of(
                position("p1", -300, 200),
                position("p2", -50, 200),
                position("p3", 120, 200));

        List<RecoveryScenario> scenarios = calculator.positionReduction(account("acc-1", 90, 600, 0, positions), 200);

        assertEquals(3, scenarios.size());
        assertEquals(RecoveryType.POSITION_REDUCTION, scenarios.get(0).getType());
        assertTrue(scenarios.get(0).getInstructions().get(0).contains("EURUSD"));
        assertEquals(RecoveryType.PROFIT_TAKING, scenarios.get(1).getType());
        assertEquals(Urgency.LOW, scenarios.get(1).getUrgency());
    }

    @Test
    @DisplayName("Cross-account transfer picks the donor with the most free margin")
    void testCrossAccount() {
        AccountState risk = account("acc-1", 50, 1000, 0, List.of());
        CrossAccountContext context = CrossAccountContext.of(List.of(
                risk,
                account("acc-2", 500, 1000, 3000, List.of()),
                account("acc-3", 800, 1000, 6000, List.of())));

        List<RecoveryScenario> scenarios = calculator.crossAccountRebalance(risk, context, 200);

        assertEquals(2, scenarios.size());
        assertTrue(scenarios.get(0).getDescription().contains("acc-3"));
        assertEquals(1500.0, scenarios.get(0).getRequiredAmount(), 1e-9);
    }

    @Test
    @DisplayName("No context means no cross-account scenarios")
    void testNoContext() {
        assertTrue(calculator.crossAccountRebalance(account("acc-1", 50, 1000, 0, List.of()), null, 200).isEmpty());
    }

    @Test
    @DisplayName("Optimized plan is ranked by score, best first")
    void testOptimizedRecovery() {
        List<Position> positions = List.of(position("p1", -300, 500), position("p2", 100, 500));
        RecoveryPlan plan = calculator.calculateOptimizedRecovery(
                account("acc-1", 40, 1000, 0, positions), null, 200);

        assertFalse(plan.getScenarios().isEmpty());
        assertSame(plan.getScenarios().get(0), plan.getOptimalScenario());
        for (int i = 1; i < plan.getScenarios().size(); i++) {
            assertTrue(plan.getScenarios().get(i - 1).getScore() >= plan.getScenarios().get(i).getScore());
        }
        assertEquals(plan.getOptimalScenario().getFeasibility(), plan.getSuccessProbability(), 1e-9);
    }

    @Test
    @DisplayName("Healthy account gets a default plan with nothing to do")
    void testHealthyPlan() {
        RecoveryPlan plan = calculator.calculateOptimizedRecovery(account("acc-1", 400, 1000, 3000, List.of()), null, 200);

        assertTrue(plan.getScenarios().isEmpty());
        assertEquals(0.0, plan.getOptimalScenario().getRequiredAmount(), 1e-9);
    }
}
