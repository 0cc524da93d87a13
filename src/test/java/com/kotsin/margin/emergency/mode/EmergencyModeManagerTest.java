package com.kotsin.margin.emergency.mode;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.event.RiskEngineEventType;
import com.kotsin.margin.event.RiskEventDispatcher;
import com.kotsin.margin.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EmergencyModeManager transitions, recovery actions and operation gating
 */
class EmergencyModeManagerTest {

    private MarginGuardProperties properties;
    private ScheduledExecutorService scheduler;
    private MutableClock clock;
    private RiskEventDispatcher dispatcher;
    private final Map<RecoveryActionType, String> failures = new EnumMap<>(RecoveryActionType.class);
    private final List<RiskEngineEvent> dispatched = new ArrayList<>();
    private EmergencyModeManager manager;

    @BeforeEach
    void setUp() {
        properties = new MarginGuardProperties();
        properties.getEmergencyMode().setAutoDeactivationDelayMs(60_000);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = MutableClock.at("2026-01-16T10:00:00Z");
        dispatcher = new RiskEventDispatcher();
        dispatcher.register(dispatched::add);
        manager = newManager();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        scheduler.shutdownNow();
    }

    private EmergencyModeManager newManager() {
        List<RecoveryCheck> checks = new ArrayList<>();
        for (RecoveryActionType type : RecoveryActionType.values()) {
            checks.add(new RecoveryCheck() {
                @Override
                public RecoveryActionType type() {
                    return type;
                }

                @Override
                public Optional<String> verify(EmergencyModeState state) {
                    return Optional.ofNullable(failures.get(type));
                }
            });
        }
        return new EmergencyModeManager(properties, checks, dispatcher, scheduler, clock);
    }

    private EmergencyTrigger trigger(TriggerType type, EmergencyLevel severity) {
        return EmergencyTrigger.builder()
                .id("t-1")
                .type(type)
                .severity(severity)
                .accountId("acc-1")
                .detail("marginLevel", 45.0)
                .timestamp(clock.instant())
                .build();
    }

    private List<String> actionIds() {
        return manager.getRecoveryActions().stream().map(RecoveryAction::getId).collect(Collectors.toList());
    }

    // ======================== ACTIVATION ========================

    @Test
    @DisplayName("Inactive mode cannot be deactivated")
    void testDeactivateInactive() {
        assertFalse(manager.getState().isActive());
        assertFalse(manager.deactivateEmergencyMode(EmergencyModeManager.MANUAL));
    }

    @Test
    @DisplayName("Loss-cut activation at HIGH requires validation, margin and health checks")
    void testActivationRecoveryActions() {
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));

        EmergencyModeState state = manager.getState();
        assertTrue(state.isActive());
        assertEquals(EmergencyLevel.HIGH, state.getLevel());
        assertFalse(state.isManualInterventionRequired());
        assertTrue(state.isAutoRecoveryEnabled());
        assertEquals(45, state.getEstimatedRecoveryTimeMinutes());
        assertTrue(state.getReason().contains("acc-1"));
        assertEquals(List.of("position_validation", "margin_check", "system_health", "connectivity_test"), actionIds());
        assertFalse(manager.getRecoveryActions().get(3).isRequired());
    }

    @ParameterizedTest
    @DisplayName("Recovery estimate is base minutes times the trigger multiplier")
    @CsvSource({
            "LOW, LOSSCUT, 8",
            "MEDIUM, MARGIN_CRITICAL, 15",
            "HIGH, SYSTEM_ERROR, 60",
            "CRITICAL, LOSSCUT, 90",
            "CRITICAL, MANUAL, 60"
    })
    void testRecoveryEstimate(EmergencyLevel level, TriggerType trigger, int expected) {
        assertEquals(expected, EmergencyModeManager.estimateRecoveryMinutes(level, trigger));
    }

    @Test
    @DisplayName("Activation notifies listeners with the new state")
    void testStateChangeEvent() {
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));

        RiskEngineEvent last = dispatched.get(dispatched.size() - 1);
        assertEquals(RiskEngineEventType.EMERGENCY_MODE_CHANGED, last.getType());
        assertSame(manager.getState(), last.getPayload());
    }

    // ======================== DEACTIVATION ========================

    @Test
    @DisplayName("Deactivation is refused until every required action succeeded")
    void testDeactivateNeedsRequiredActions() {
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));
        assertFalse(manager.deactivateEmergencyMode("resolved"));

        manager.executeRecoveryAction("position_validation");
        manager.executeRecoveryAction("margin_check");
        assertFalse(manager.deactivateEmergencyMode("resolved"));

        manager.executeRecoveryAction("system_health");
        assertTrue(manager.deactivateEmergencyMode("resolved"));
        assertFalse(manager.getState().isActive());
        assertEquals(1, manager.getHistory().size());
        assertEquals("resolved", manager.getHistory().get(0).getReason());
    }

    @Test
    @DisplayName("A failed required check keeps emergency mode on")
    void testFailedRequiredAction() {
        failures.put(RecoveryActionType.MARGIN_CHECK, "still critical");
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));

        assertEquals(2, manager.executeAllRecoveryActions());

        RecoveryAction marginCheck = manager.getRecoveryActions().get(1);
        assertTrue(marginCheck.isCompleted());
        assertEquals(RecoveryResult.FAILED, marginCheck.getResult());
        assertEquals("still critical", marginCheck.getDetail());
        assertFalse(manager.deactivateEmergencyMode("resolved"));
    }

    @Test
    @DisplayName("An optional check failing does not block deactivation")
    void testOptionalActionFailure() {
        failures.put(RecoveryActionType.CONNECTIVITY_TEST, "gateway down");
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));

        manager.executeAllRecoveryActions();

        assertTrue(manager.deactivateEmergencyMode("resolved"));
    }

    @Test
    @DisplayName("Critical mode only ends on a manual deactivation")
    void testManualInterventionRequired() {
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.CRITICAL));
        assertTrue(manager.getState().isManualInterventionRequired());
        assertFalse(manager.getState().isAutoRecoveryEnabled());

        manager.executeAllRecoveryActions();
        assertFalse(manager.deactivateEmergencyMode("auto_recovery"));
        assertTrue(manager.deactivateEmergencyMode(EmergencyModeManager.MANUAL));
    }

    @Test
    @DisplayName("Recovery actions cannot be unknown or run twice")
    void testRecoveryActionErrors() {
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));

        assertThrows(RecoveryActionException.class, () -> manager.executeRecoveryAction("reboot"));
        manager.executeRecoveryAction("position_validation");
        assertThrows(RecoveryActionException.class, () -> manager.executeRecoveryAction("position_validation"));
    }

    @Test
    @DisplayName("Completed recovery deactivates automatically after the delay")
    void testAutoDeactivation() throws InterruptedException {
        properties.getEmergencyMode().setAutoDeactivationDelayMs(20);
        manager = newManager();
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));

        manager.executeAllRecoveryActions();

        long deadline = System.currentTimeMillis() + 5_000;
        while (manager.getState().isActive() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(manager.getState().isActive());
        assertEquals("auto_recovery", manager.getHistory().get(0).getReason());
    }

    // ======================== LEVELS ========================

    @Test
    @DisplayName("Escalating to CRITICAL turns on the manual hold")
    void testEscalateToCritical() {
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));

        assertTrue(manager.escalateLevel());
        assertEquals(EmergencyLevel.CRITICAL, manager.getState().getLevel());
        assertTrue(manager.getState().isManualInterventionRequired());
        assertFalse(manager.escalateLevel());
    }

    @Test
    @DisplayName("De-escalating lifts the manual hold for non-manual triggers")
    void testDeEscalate() {
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.CRITICAL));

        assertTrue(manager.deEscalateLevel());
        assertEquals(EmergencyLevel.HIGH, manager.getState().getLevel());
        assertFalse(manager.getState().isManualInterventionRequired());
    }

    @Test
    @DisplayName("De-escalating below LOW attempts deactivation")
    void testDeEscalateBelowLow() {
        manager.activateEmergencyMode(trigger(TriggerType.NETWORK_ISSUE, EmergencyLevel.LOW));
        manager.executeAllRecoveryActions();

        assertTrue(manager.deEscalateLevel());
        assertFalse(manager.getState().isActive());
        assertEquals("auto_de_escalation", manager.getHistory().get(0).getReason());
    }

    // ======================== OPERATIONS ========================

    @Test
    @DisplayName("Every operation is allowed while inactive")
    void testOperationsWhenInactive() {
        for (OperationType op : OperationType.values()) {
            assertTrue(manager.isOperationAllowed(op, "acc-1"));
        }
    }

    @Test
    @DisplayName("Suspended operations follow the level's configuration")
    void testOperationsAtHigh() {
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));

        assertFalse(manager.isOperationAllowed(OperationType.AUTO_TRADING, "acc-1"));
        assertFalse(manager.isOperationAllowed(OperationType.NEW_POSITIONS));
        assertTrue(manager.isOperationAllowed(OperationType.MONITORING, "acc-1"));
        assertTrue(manager.isOperationAllowed(OperationType.MANUAL_TRADING, "acc-2"));
    }

    @Test
    @DisplayName("Affected accounts are added once")
    void testAddAffectedAccount() {
        manager.activateEmergencyMode(trigger(TriggerType.LOSSCUT, EmergencyLevel.HIGH));

        manager.addAffectedAccount("acc-2");
        manager.addAffectedAccount("acc-2");

        assertEquals(List.of("acc-1", "acc-2"), manager.getState().getAffectedAccounts());
    }
}
