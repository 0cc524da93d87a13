package com.kotsin.margin.emergency;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.emergency.mode.EmergencyLevel;
import com.kotsin.margin.emergency.mode.EmergencyModeManager;
import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.event.RiskEngineEventType;
import com.kotsin.margin.event.RiskEventDispatcher;
import com.kotsin.margin.gateway.CommandType;
import com.kotsin.margin.gateway.InMemoryPositionDataService;
import com.kotsin.margin.model.AccountMarginInfo;
import com.kotsin.margin.model.Position;
import com.kotsin.margin.model.PositionSide;
import com.kotsin.margin.model.RiskMonitoringState;
import com.kotsin.margin.monitoring.RiskStateManager;
import com.kotsin.margin.optimizer.LossMinimizer;
import com.kotsin.margin.support.MutableClock;
import com.kotsin.margin.support.RecordingCommandGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EmergencyActionEngine
 */
class EmergencyActionEngineTest {

    private MutableClock clock;
    private ScheduledExecutorService scheduler;
    private SimpleMeterRegistry meterRegistry;
    private RecordingCommandGateway gateway;
    private InMemoryPositionDataService positions;
    private RiskStateManager riskStateManager;
    private EmergencyModeManager modeManager;
    private MarginGuardProperties properties;
    private EmergencyActionEngine engine;
    private ExecutorService responseExecutor;
    private final List<RiskEngineEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new MarginGuardProperties();
        clock = MutableClock.at("2026-01-16T10:00:00Z");
        scheduler = Executors.newSingleThreadScheduledExecutor();
        meterRegistry = new SimpleMeterRegistry();
        gateway = new RecordingCommandGateway();
        positions = new InMemoryPositionDataService();
        RiskEventDispatcher dispatcher = new RiskEventDispatcher();
        dispatcher.register(events::add);
        riskStateManager = new RiskStateManager(dispatcher, clock, properties);
        modeManager = new EmergencyModeManager(properties, List.of(), dispatcher, scheduler, clock);
        engine = newEngine(Runnable::run);
    }

    @AfterEach
    void tearDown() {
        modeManager.shutdown();
        scheduler.shutdownNow();
        if (responseExecutor != null) {
            responseExecutor.shutdownNow();
        }
    }

    private EmergencyActionEngine newEngine(Executor executor) {
        return new EmergencyActionEngine(riskStateManager, positions, new LossMinimizer(properties),
                new EmergencyStrategyRegistry(), modeManager, gateway, meterRegistry, clock, properties, executor);
    }

    /**
     * Engine whose responses run on a worker thread, like the production executor.
     */
    private EmergencyActionEngine asyncEngine() {
        responseExecutor = Executors.newSingleThreadExecutor();
        return newEngine(responseExecutor);
    }

    private void awaitWorkers() throws InterruptedException {
        responseExecutor.shutdown();
        assertTrue(responseExecutor.awaitTermination(5, TimeUnit.SECONDS));
    }

    private long completedEvents(String responseId) {
        return events.stream()
                .filter(e -> e.getType() == RiskEngineEventType.RESPONSE_COMPLETED)
                .filter(e -> e.getPayload() instanceof EmergencyResponse r && r.getId().equals(responseId))
                .count();
    }

    private static Position position(String accountId, String id, String symbol, double profit) {
        return Position.builder()
                .id(id).accountId(accountId).symbol(symbol).side(PositionSide.BUY)
                .lots(1).profit(profit).marginRequired(500)
                .build();
    }

    private AccountMarginInfo telemetry(String accountId, double equity) {
        return AccountMarginInfo.builder()
                .accountId(accountId)
                .broker("xm")
                .balance(10_000)
                .equity(equity)
                .usedMargin(1000)
                .freeMargin(equity - 1000)
                .lastUpdate(clock.instant())
                .build();
    }

    /**
     * 40% margin level, heavy unrealized loss and negative free margin: risk score 9.
     */
    private RiskMonitoringState criticalAccount(String accountId) {
        positions.replacePositions(accountId, losingBook(accountId));
        return riskStateManager.updateMarginInfo(telemetry(accountId, 400), 20);
    }

    /**
     * 80% margin level with the same losing book: risk score 8, a partial close followed by a hedge
     * that together stay short of the success criteria.
     */
    private RiskMonitoringState reduceThenHedgeAccount(String accountId) {
        positions.replacePositions(accountId, losingBook(accountId));
        return riskStateManager.updateMarginInfo(telemetry(accountId, 800), 20);
    }

    private static List<Position> losingBook(String accountId) {
        return List.of(
                position(accountId, accountId + "-p1", "EURUSD", -3000),
                position(accountId, accountId + "-p2", "GBPUSD", -6600));
    }

    private double counter(String name, String... tags) {
        return meterRegistry.counter(name, tags).count();
    }

    // ======================== LOSS-CUT RESPONSES ========================

    @Test
    @DisplayName("A high-risk account is closed out and the response completes")
    void testLossCutResponseCompletes() {
        RiskMonitoringState state = criticalAccount("acc-1");

        EmergencyResponse response = engine.handleLossCutDetection("acc-1", state);

        assertEquals("dynamic_9", response.getStrategy().getName());
        assertEquals(ResponseStatus.COMPLETED, response.getStatus());
        assertNotNull(response.getEndTime());
        assertEquals(1, response.getExecutedActions().size());
        assertTrue(response.getExecutedActions().get(0).isSuccess());
        assertEquals(1000.0, response.getTotalLossAvoidance(), 1e-9);
        assertEquals(1, gateway.commands().size());
        assertTrue(gateway.commands().get(0).startsWith("CLOSE_POSITIONS: acc-1 close"));

        assertTrue(engine.getActiveResponses().isEmpty());
        assertEquals(1, engine.getExecutionHistory().size());
        assertTrue(engine.findResponse(response.getId()).isPresent());
        assertEquals(1.0, counter("margin_guard.emergency.responses", "status", "COMPLETED"));
        assertEquals(1.0, counter("margin_guard.emergency.actions", "type", "IMMEDIATE_CLOSE", "outcome", "accepted"));
        assertEquals(1, completedEvents(response.getId()));
    }

    @Test
    @DisplayName("A loss-cut puts the platform into emergency mode")
    void testLossCutActivatesEmergencyMode() {
        engine.handleLossCutDetection("acc-1", criticalAccount("acc-1"));

        assertTrue(modeManager.getState().isActive());
        assertEquals(EmergencyLevel.HIGH, modeManager.getState().getLevel());
        assertEquals(List.of("acc-1"), modeManager.getState().getAffectedAccounts());
    }

    @Test
    @DisplayName("A second loss-cut joins the active emergency")
    void testSecondLossCutJoinsEmergency() {
        engine.handleLossCutDetection("acc-1", criticalAccount("acc-1"));
        engine.handleLossCutDetection("acc-2", criticalAccount("acc-2"));

        assertEquals(List.of("acc-1", "acc-2"), modeManager.getState().getAffectedAccounts());
        assertEquals(2, engine.getExecutionHistory().size());
    }

    @Test
    @DisplayName("A rejected command is recorded as a failed action")
    void testRejectedCommand() {
        gateway.reject(CommandType.CLOSE_POSITIONS);

        EmergencyResponse response = engine.handleLossCutDetection("acc-1", criticalAccount("acc-1"));

        assertEquals(ResponseStatus.FAILED, response.getStatus());
        EmergencyActionResult result = response.getExecutedActions().get(0);
        assertFalse(result.isSuccess());
        assertEquals("Rejected: rejected by test", result.getError());
        assertEquals(1.0, counter("margin_guard.emergency.actions", "type", "IMMEDIATE_CLOSE", "outcome", "rejected"));
        assertEquals(1.0, counter("margin_guard.emergency.responses", "status", "FAILED"));
    }

    @Test
    @DisplayName("Without positions the static strategy runs and its close actions fail")
    void testNoPositions() {
        RiskMonitoringState state = riskStateManager.updateMarginInfo(telemetry("acc-1", 150), 20);

        EmergencyResponse response = engine.handleLossCutDetection("acc-1", state);

        assertEquals("single_account_critical", response.getStrategy().getName());
        assertEquals(ResponseStatus.FAILED, response.getStatus());
        assertEquals(2, response.getExecutedActions().size());
        assertTrue(response.getExecutedActions().stream().noneMatch(EmergencyActionResult::isSuccess));
        assertEquals("No positions to close", response.getExecutedActions().get(0).getError());
        assertTrue(gateway.commands().isEmpty());
    }

    @Test
    @DisplayName("Executed results never outnumber the strategy's actions")
    void testResultsBoundedByActions() {
        positions.replacePositions("acc-1", List.of(
                position("acc-1", "p1", "EURUSD", -300),
                position("acc-1", "p2", "GBPUSD", -200)));
        RiskMonitoringState state = riskStateManager.updateMarginInfo(telemetry("acc-1", 800), 20);

        EmergencyResponse response = engine.handleLossCutDetection("acc-1", state);

        assertTrue(response.getStatus().isTerminal());
        assertTrue(response.getExecutedActions().size() <= response.getStrategy().getActions().size());
    }

    // ======================== LIFECYCLE ========================

    @Test
    @DisplayName("The caller gets the response back while a command is still in flight")
    void testResponseRunsOffCallerThread() throws InterruptedException {
        EmergencyActionEngine async = asyncEngine();
        RecordingCommandGateway.Gate gate = gateway.hold(CommandType.REDUCE_POSITIONS);

        EmergencyResponse response = async.handleLossCutDetection("acc-1", reduceThenHedgeAccount("acc-1"));
        assertTrue(gate.awaitEntered());

        assertEquals(ResponseStatus.EXECUTING, response.getStatus());
        assertSame(response, async.getActiveResponse("acc-1").orElseThrow());
        assertSame(response, async.handleLossCutDetection("acc-1", riskStateManager.getRiskState("acc-1").orElseThrow()));

        gate.release();
        awaitWorkers();

        assertEquals(ResponseStatus.FAILED, response.getStatus());
        assertEquals(2, response.getExecutedActions().size());
        assertTrue(async.getActiveResponses().isEmpty());
        assertEquals(1, async.getExecutionHistory().size());
        assertEquals(1, completedEvents(response.getId()));
    }

    @Test
    @DisplayName("Shutdown during a command archives the response once and sends nothing further")
    void testShutdownWhileCommandInFlight() throws InterruptedException {
        EmergencyActionEngine async = asyncEngine();
        RecordingCommandGateway.Gate gate = gateway.hold(CommandType.REDUCE_POSITIONS);

        EmergencyResponse response = async.handleLossCutDetection("acc-1", reduceThenHedgeAccount("acc-1"));
        assertTrue(gate.awaitEntered());

        async.shutdown();
        assertEquals(ResponseStatus.FAILED, response.getStatus());

        gate.release();
        awaitWorkers();

        assertEquals(ResponseStatus.FAILED, response.getStatus());
        assertEquals(1, gateway.commands().size());
        assertTrue(gateway.commands().get(0).startsWith("REDUCE_POSITIONS: acc-1"));
        assertTrue(response.getExecutedActions().isEmpty());
        assertEquals(1, async.getExecutionHistory().size());
        assertEquals(1, completedEvents(response.getId()));
        assertEquals(1.0, counter("margin_guard.emergency.responses", "status", "FAILED"));
        assertTrue(async.getActiveResponses().isEmpty());
    }

    @Test
    @DisplayName("Each finished response is archived and announced exactly once")
    void testEachResponseArchivedOnce() {
        EmergencyResponse first = engine.handleLossCutDetection("acc-1", criticalAccount("acc-1"));
        EmergencyResponse second = engine.handleLossCutDetection("acc-2", reduceThenHedgeAccount("acc-2"));
        engine.shutdown();

        assertEquals(List.of(first, second), engine.getExecutionHistory());
        assertEquals(1, completedEvents(first.getId()));
        assertEquals(1, completedEvents(second.getId()));
        assertTrue(first.getStatus().isTerminal());
        assertTrue(second.getStatus().isTerminal());
        assertEquals(2.0, counter("margin_guard.emergency.responses", "status", "COMPLETED")
                + counter("margin_guard.emergency.responses", "status", "FAILED"));
    }

    @Test
    @DisplayName("A response the executor refuses fails at once and is archived")
    void testRejectedByExecutor() {
        EmergencyActionEngine refusing = newEngine(task -> {
            throw new RejectedExecutionException("stopped");
        });

        EmergencyResponse response = refusing.handleLossCutDetection("acc-1", criticalAccount("acc-1"));

        assertEquals(ResponseStatus.FAILED, response.getStatus());
        assertTrue(gateway.commands().isEmpty());
        assertTrue(refusing.getActiveResponses().isEmpty());
        assertEquals(1, refusing.getExecutionHistory().size());
        assertEquals(1, completedEvents(response.getId()));
    }

    // ======================== TARGETS & SCENARIOS ========================

    @Test
    @DisplayName("Close and reduce actions get concrete targets before running")
    void testResolveTargets() {
        List<Position> book = List.of(
                position("acc-1", "p1", "EURUSD", -3000),
                position("acc-1", "p2", "GBPUSD", 100));
        RiskMonitoringState state = riskStateManager.updateMarginInfo(telemetry("acc-1", 400), 20);

        EmergencyStrategy resolved = engine.resolveTargets(
                EmergencyStrategyRegistry.defaultStrategy(), state, book);

        assertFalse(resolved.getActions().get(0).getTargetPositions().isEmpty());
        assertEquals(EmergencyStrategyRegistry.defaultStrategy().getActions().size(), resolved.getActions().size());
    }

    @Test
    @DisplayName("Hedges are sized from the positions the strategy was planned on")
    void testHedgeUsesPlannedPositions() {
        positions.replacePositions("acc-1", List.of(position("acc-1", "other", "XAUUSD", -50)));
        RiskMonitoringState state = riskStateManager.updateMarginInfo(telemetry("acc-1", 800), 20);

        EmergencyResponse response = engine.handleLossCutDetection("acc-1", state, losingBook("acc-1"));

        List<String> hedges = gateway.commands().stream()
                .filter(c -> c.startsWith("OPEN_HEDGE"))
                .collect(Collectors.toList());
        assertEquals(1, hedges.size());
        assertTrue(hedges.get(0).contains("EURUSD"));
        assertTrue(hedges.get(0).contains("GBPUSD"));
        assertFalse(hedges.get(0).contains("XAUUSD"));
        assertTrue(response.getExecutedActions().stream().allMatch(EmergencyActionResult::isSuccess));
    }

    @Test
    @DisplayName("Scenario follows book size and other accounts at risk")
    void testScenarioType() {
        List<Position> many = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            many.add(position("acc-1", "p" + i, "EURUSD", -10));
        }
        assertEquals(ScenarioType.CORRELATED_POSITIONS, engine.determineScenarioType("acc-1", many));
        assertEquals(ScenarioType.SINGLE_ACCOUNT, engine.determineScenarioType("acc-1", many.subList(0, 2)));

        riskStateManager.updateMarginInfo(telemetry("acc-2", 1200), 20);
        assertEquals(ScenarioType.MULTI_ACCOUNT, engine.determineScenarioType("acc-1", many.subList(0, 2)));
    }

    // ======================== PREVENTIVE ========================

    @Test
    @DisplayName("Preventive response only below the critical margin level")
    void testCriticalMarginLevelThreshold() {
        assertTrue(engine.handleCriticalMarginLevel("acc-1", telemetry("acc-1", 600)).isEmpty());

        criticalAccount("acc-1");
        Optional<EmergencyResponse> response = engine.handleCriticalMarginLevel("acc-1", telemetry("acc-1", 400));

        assertTrue(response.isPresent());
        assertEquals("preventive_critical", response.get().getStrategy().getName());
        assertTrue(response.get().getStatus().isTerminal());
    }

    @Test
    @DisplayName("Preventive responses respect the cooldown")
    void testCriticalMarginLevelCooldown() {
        criticalAccount("acc-1");
        assertTrue(engine.handleCriticalMarginLevel("acc-1", telemetry("acc-1", 400)).isPresent());

        clock.advance(Duration.ofSeconds(30));
        assertTrue(engine.handleCriticalMarginLevel("acc-1", telemetry("acc-1", 400)).isEmpty());

        clock.advance(Duration.ofSeconds(31));
        assertTrue(engine.handleCriticalMarginLevel("acc-1", telemetry("acc-1", 400)).isPresent());
    }
}
