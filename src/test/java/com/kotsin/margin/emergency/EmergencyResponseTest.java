package com.kotsin.margin.emergency;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the EmergencyResponse lifecycle
 */
class EmergencyResponseTest {

    private static final Instant START = Instant.parse("2026-01-16T10:00:00Z");

    private EmergencyStrategy strategy;
    private EmergencyResponse response;

    @BeforeEach
    void setUp() {
        strategy = EmergencyStrategy.builder()
                .name("test")
                .scenarioType(ScenarioType.SINGLE_ACCOUNT)
                .actions(List.of(EmergencyAction.immediateClose(10, 100, 500), EmergencyAction.transfer(5, 300)))
                .maxExecutionTimeMs(30_000)
                .successCriteria(SuccessCriteria.builder().marginLevelTarget(100).maxAcceptableLoss(1000).timeoutMinutes(0.5).build())
                .build();
        response = new EmergencyResponse("r-1", "acc-1", strategy, START);
    }

    private static EmergencyActionResult result(EmergencyAction action, boolean success, double lossReduction) {
        return EmergencyActionResult.builder()
                .action(action)
                .success(success)
                .lossReduction(success ? lossReduction : null)
                .executedAt(START)
                .build();
    }

    @Test
    @DisplayName("Results never exceed the strategy's action count")
    void testResultCap() {
        EmergencyAction first = strategy.getActions().get(0);
        assertTrue(response.addResult(result(first, true, 100)));
        assertTrue(response.addResult(result(first, false, 0)));
        assertFalse(response.addResult(result(first, true, 100)));
        assertEquals(2, response.getExecutedActions().size());
    }

    @Test
    @DisplayName("Terminal status is set exactly once")
    void testTerminalOnce() {
        assertEquals(ResponseStatus.EXECUTING, response.getStatus());

        assertTrue(response.complete(ResponseStatus.COMPLETED, START.plusSeconds(5)));
        assertFalse(response.complete(ResponseStatus.FAILED, START.plusSeconds(9)));

        assertEquals(ResponseStatus.COMPLETED, response.getStatus());
        assertEquals(START.plusSeconds(5), response.getEndTime());
    }

    @Test
    @DisplayName("No results are accepted after the response finished")
    void testNoResultsAfterTerminal() {
        response.complete(ResponseStatus.TIMEOUT, START.plusSeconds(31));
        assertFalse(response.addResult(result(strategy.getActions().get(0), true, 100)));
        assertTrue(response.getExecutedActions().isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Only terminal statuses can complete a response")
    @EnumSource(value = ResponseStatus.class, names = "EXECUTING")
    void testNonTerminalRejected(ResponseStatus status) {
        assertThrows(IllegalArgumentException.class, () -> response.complete(status, START));
    }

    @Test
    @DisplayName("Total loss avoidance sums successful results at completion")
    void testLossAvoidance() {
        response.addResult(result(strategy.getActions().get(0), true, 450));
        response.addResult(result(strategy.getActions().get(1), false, 0));

        response.complete(ResponseStatus.FAILED, START.plusSeconds(2));

        assertEquals(450.0, response.getTotalLossAvoidance(), 1e-9);
        assertEquals(1, response.successfulActions());
    }

    @Test
    @DisplayName("Actions run highest priority first")
    void testActionsByPriority() {
        EmergencyStrategy unordered = strategy.toBuilder()
                .actions(List.of(EmergencyAction.transfer(5, 300), EmergencyAction.hedge(9, 0.5),
                        EmergencyAction.immediateClose(10, 100, 500)))
                .build();
        assertEquals(List.of(EmergencyActionType.IMMEDIATE_CLOSE, EmergencyActionType.HEDGE_OPEN,
                        EmergencyActionType.BALANCE_TRANSFER),
                unordered.actionsByPriority().stream().map(EmergencyAction::getType).collect(Collectors.toList()));
    }
}
