package com.kotsin.margin.emergency;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.emergency.mode.EmergencyLevel;
import com.kotsin.margin.emergency.mode.EmergencyModeManager;
import com.kotsin.margin.emergency.mode.EmergencyTrigger;
import com.kotsin.margin.emergency.mode.TriggerType;
import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.event.RiskEngineEventType;
import com.kotsin.margin.gateway.CommandReceipt;
import com.kotsin.margin.gateway.EmergencyCommandGateway;
import com.kotsin.margin.gateway.PositionDataService;
import com.kotsin.margin.model.AccountMarginInfo;
import com.kotsin.margin.model.Position;
import com.kotsin.margin.model.RiskLevel;
import com.kotsin.margin.model.RiskMonitoringState;
import com.kotsin.margin.monitoring.RiskStateManager;
import com.kotsin.margin.optimizer.HedgeOrder;
import com.kotsin.margin.optimizer.LossMinimizer;
import com.kotsin.margin.optimizer.MinimizationResult;
import com.kotsin.margin.optimizer.PositionReduction;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Turns a loss-cut or critical margin signal into an {@link EmergencyResponse}: picks a strategy,
 * resolves each action's targets and runs the actions one after another through the
 * {@link EmergencyCommandGateway}.
 *
 * <p>At most one response runs per account. A second signal while one is running gets the
 * running response back. Actions run on the {@code emergencyResponseExecutor}, so the caller gets the
 * response back while it is still EXECUTING and broker acknowledgements never hold up the engine thread.</p>
 */
@Component
@Slf4j
public class EmergencyActionEngine {

    static final double CRITICAL_MARGIN_LEVEL = 50.0;
    static final int CORRELATED_POSITION_COUNT = 5;
    static final double DEFAULT_PARTIAL_PERCENT = 50.0;
    static final double HEDGE_LOSS_REDUCTION_SHARE = 0.1;
    static final int HISTORY_LIMIT = 1000;

    private final RiskStateManager riskStateManager;
    private final PositionDataService positionDataService;
    private final LossMinimizer lossMinimizer;
    private final EmergencyStrategyRegistry strategyRegistry;
    private final EmergencyModeManager emergencyModeManager;
    private final EmergencyCommandGateway gateway;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final MarginGuardProperties properties;
    private final Executor responseExecutor;

    private final Timer actionLatency;

    private final Map<String, EmergencyResponse> activeResponses = new ConcurrentHashMap<>();
    private final Deque<EmergencyResponse> executionHistory = new ConcurrentLinkedDeque<>();

    public EmergencyActionEngine(RiskStateManager riskStateManager,
                                 PositionDataService positionDataService,
                                 LossMinimizer lossMinimizer,
                                 EmergencyStrategyRegistry strategyRegistry,
                                 EmergencyModeManager emergencyModeManager,
                                 EmergencyCommandGateway gateway,
                                 MeterRegistry meterRegistry,
                                 Clock clock,
                                 MarginGuardProperties properties,
                                 @Qualifier("emergencyResponseExecutor") Executor responseExecutor) {
        this.riskStateManager = riskStateManager;
        this.positionDataService = positionDataService;
        this.lossMinimizer = lossMinimizer;
        this.strategyRegistry = strategyRegistry;
        this.emergencyModeManager = emergencyModeManager;
        this.gateway = gateway;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.properties = properties;
        this.responseExecutor = responseExecutor;
        this.actionLatency = meterRegistry.timer("margin_guard.emergency.action.latency");
    }

    // ======================== ENTRY POINTS ========================

    public EmergencyResponse handleLossCutDetection(String accountId, RiskMonitoringState riskState) {
        return handleLossCutDetection(accountId, riskState, positionDataService.openPositions(accountId));
    }

    /**
     * Puts the platform into emergency mode for the account, then selects and runs a strategy.
     */
    public EmergencyResponse handleLossCutDetection(String accountId, RiskMonitoringState riskState,
                                                    List<Position> relatedPositions) {
        EmergencyResponse running = activeResponses.get(accountId);
        if (running != null) {
            log.info("[EMERGENCY] Response {} already running for {}, not starting another", running.getId(), accountId);
            return running;
        }
        log.warn("[EMERGENCY] Loss-cut detected account={} marginLevel={} positions={}",
                accountId, fmt(riskState.getMarginLevel()), relatedPositions.size());

        activateEmergencyMode(accountId, riskState);

        ScenarioType scenario = determineScenarioType(accountId, relatedPositions);
        DynamicStrategyParameters params = relatedPositions.isEmpty() ? null : dynamicParameters(riskState, relatedPositions, scenario);
        EmergencyStrategy strategy = strategyRegistry.select(scenario, riskState.getRiskLevel(), params);
        log.info("[EMERGENCY] Selected strategy {} scenario={} account={}", strategy.getName(), scenario, accountId);

        return execute(accountId, strategy, riskState, relatedPositions);
    }

    /**
     * Preventive response once the margin level is at or below 50%. Returns empty above that level
     * or while the account is inside its response cooldown.
     */
    public Optional<EmergencyResponse> handleCriticalMarginLevel(String accountId, AccountMarginInfo info) {
        double marginLevel = info.effectiveMarginLevel();
        if (!(marginLevel <= CRITICAL_MARGIN_LEVEL)) {
            return Optional.empty();
        }
        EmergencyResponse running = activeResponses.get(accountId);
        if (running != null) {
            return Optional.of(running);
        }
        if (recentlyResponded(accountId)) {
            log.debug("[EMERGENCY] {} inside response cooldown, skipping preventive response", accountId);
            return Optional.empty();
        }
        log.warn("[EMERGENCY] Critical margin level {}% account={}", fmt(marginLevel), accountId);

        double lossCutLevel = riskStateManager.getRiskState(accountId)
                .map(RiskMonitoringState::getLossCutLevel)
                .orElse(properties.getMonitor().lossCutLevelFor(info.getBroker()));
        RiskMonitoringState riskState = RiskMonitoringState.from(info, lossCutLevel, clock.instant()).toBuilder()
                .predictions(RiskMonitoringState.Predictions.builder()
                        .timeToCriticalMinutes(0.0)
                        .requiredRecovery(info.getUsedMargin() * 0.3)
                        .build())
                .build();

        return Optional.of(execute(accountId, strategyRegistry.preventiveCritical(), riskState,
                positionDataService.openPositions(accountId)));
    }

    // ======================== EXECUTION ========================

    private EmergencyResponse execute(String accountId, EmergencyStrategy strategy, RiskMonitoringState riskState,
                                      List<Position> positions) {
        EmergencyStrategy resolved = resolveTargets(strategy, riskState, positions);
        EmergencyResponse response = new EmergencyResponse(
                "emergency_" + accountId + "_" + UUID.randomUUID(), accountId, resolved, clock.instant());

        EmergencyResponse existing = activeResponses.putIfAbsent(accountId, response);
        if (existing != null) {
            return existing;
        }

        try {
            responseExecutor.execute(() -> runActions(response, riskState, positions));
        } catch (RejectedExecutionException e) {
            log.error("[EMERGENCY] Response {} could not be scheduled: {}", response.getId(), e.getMessage());
            response.complete(ResponseStatus.FAILED, clock.instant());
            finish(response);
        }
        return response;
    }

    private void runActions(EmergencyResponse response, RiskMonitoringState riskState, List<Position> positions) {
        String accountId = response.getAccountId();
        EmergencyStrategy strategy = response.getStrategy();
        try {
            for (EmergencyAction action : strategy.actionsByPriority()) {
                if (response.getStatus().isTerminal()) {
                    break;
                }
                EmergencyActionResult result = executeAction(accountId, action, riskState, positions);
                if (!response.addResult(result)) {
                    break;
                }
                if (!result.isSuccess()) {
                    log.error("[EMERGENCY] Action {} failed for {}: {}", action.getType(), accountId, result.getError());
                }

                long elapsedMs = clock.millis() - response.getStartTime().toEpochMilli();
                if (successCriteriaMet(response, strategy.getSuccessCriteria(), elapsedMs)) {
                    response.complete(ResponseStatus.COMPLETED, clock.instant());
                    break;
                }
                if (elapsedMs > strategy.getMaxExecutionTimeMs()) {
                    response.complete(ResponseStatus.TIMEOUT, clock.instant());
                    break;
                }
            }
            response.complete(ResponseStatus.FAILED, clock.instant());
        } catch (RuntimeException e) {
            log.error("[EMERGENCY] Response {} aborted: {}", response.getId(), e.getMessage(), e);
            response.complete(ResponseStatus.FAILED, clock.instant());
        } finally {
            finish(response);
        }
    }

    EmergencyActionResult executeAction(String accountId, EmergencyAction action, RiskMonitoringState riskState,
                                        List<Position> positions) {
        long start = clock.millis();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ActionOutcome outcome = switch (action.getType()) {
                case IMMEDIATE_CLOSE -> immediateClose(accountId, action);
                case PARTIAL_CLOSE -> partialClose(accountId, action);
                case HEDGE_OPEN -> hedgeOpen(accountId, action, riskState, positions);
                case BALANCE_TRANSFER -> balanceTransfer(accountId, action);
            };
            meterRegistry.counter("margin_guard.emergency.actions",
                    "type", action.getType().name(), "outcome", outcome.receipt().isAccepted() ? "accepted" : "rejected")
                    .increment();
            if (!outcome.receipt().isAccepted()) {
                return failure(action, start, "Rejected: " + outcome.receipt().getMessage());
            }
            return EmergencyActionResult.builder()
                    .action(action)
                    .success(true)
                    .executionTimeMs(clock.millis() - start)
                    .result(outcome.description())
                    .lossReduction(outcome.lossReduction())
                    .executedAt(clock.instant())
                    .build();
        } catch (Exception e) {
            meterRegistry.counter("margin_guard.emergency.actions",
                    "type", action.getType().name(), "outcome", "error").increment();
            return failure(action, start, e.getMessage());
        } finally {
            sample.stop(actionLatency);
        }
    }

    private ActionOutcome immediateClose(String accountId, EmergencyAction action) {
        List<String> targets = requireTargets(action, "No positions to close");
        log.info("[EMERGENCY] Closing {} positions account={}", targets.size(), accountId);
        CommandReceipt receipt = gateway.closePositions(accountId, targets);
        return new ActionOutcome(receipt, "Closed " + targets.size() + " positions",
                orZero(action.getParameters().getMaxLoss()));
    }

    private ActionOutcome partialClose(String accountId, EmergencyAction action) {
        List<String> targets = requireTargets(action, "No positions to reduce");
        double percentage = action.getParameters().getPercentage() != null
                ? action.getParameters().getPercentage() : DEFAULT_PARTIAL_PERCENT;
        log.info("[EMERGENCY] Reducing {} positions by {}% account={}", targets.size(), fmt(percentage), accountId);
        CommandReceipt receipt = gateway.reducePositions(accountId, targets, percentage);
        return new ActionOutcome(receipt, "Partially closed " + fmt(percentage) + "% of " + targets.size() + " positions",
                orZero(action.getParameters().getMaxLoss()) * percentage / 100.0);
    }

    private ActionOutcome hedgeOpen(String accountId, EmergencyAction action, RiskMonitoringState riskState,
                                    List<Position> positions) {
        double ratio = action.getParameters().getHedgeRatio() != null
                ? action.getParameters().getHedgeRatio() : properties.getLossMinimization().getHedgeRatio();
        List<HedgeOrder> hedges = lossMinimizer.calculateOptimalHedges(positions, ratio);
        if (hedges.isEmpty()) {
            throw new IllegalStateException("No net exposure to hedge");
        }
        log.info("[EMERGENCY] Opening {} hedges ratio={} account={}", hedges.size(), ratio, accountId);
        CommandReceipt receipt = gateway.openHedge(accountId, hedges);
        return new ActionOutcome(receipt, "Opened " + hedges.size() + " hedge positions with ratio " + ratio,
                riskState.getUsedMargin() * HEDGE_LOSS_REDUCTION_SHARE);
    }

    private ActionOutcome balanceTransfer(String accountId, EmergencyAction action) {
        double amount = orZero(action.getParameters().getAmount());
        log.info("[EMERGENCY] Transferring {} into account={}", fmt(amount), accountId);
        CommandReceipt receipt = gateway.transferBalance(accountId, amount);
        return new ActionOutcome(receipt, "Transferred " + fmt(amount) + " to account", amount);
    }

    /**
     * Met when the summed loss reduction reaches {@code maxAcceptableLoss} inside the timeout.
     */
    static boolean successCriteriaMet(EmergencyResponse response, SuccessCriteria criteria, long elapsedMs) {
        if (elapsedMs > criteria.getTimeoutMinutes() * 60_000) {
            return false;
        }
        return response.cumulativeLossReduction() >= criteria.getMaxAcceptableLoss();
    }

    /**
     * Archives, counts and announces a terminal response. Only the caller that removes it from the
     * active map does so, so each response is archived once.
     */
    private void finish(EmergencyResponse response) {
        if (!activeResponses.remove(response.getAccountId(), response)) {
            return;
        }
        executionHistory.addLast(response);
        while (executionHistory.size() > HISTORY_LIMIT) {
            executionHistory.pollFirst();
        }
        meterRegistry.counter("margin_guard.emergency.responses", "status", response.getStatus().name()).increment();

        log.info("[EMERGENCY] Response {} finished status={} actions={} lossAvoidance={}",
                response.getId(), response.getStatus(), response.getExecutedActions().size(),
                fmt(response.getTotalLossAvoidance() != null ? response.getTotalLossAvoidance() : 0.0));

        RiskEngineEvent.Severity severity = response.getStatus() == ResponseStatus.COMPLETED
                ? RiskEngineEvent.Severity.INFO : RiskEngineEvent.Severity.CRITICAL;
        riskStateManager.publish(RiskEngineEvent.of(RiskEngineEventType.RESPONSE_COMPLETED, response.getAccountId(),
                severity, "Emergency response " + response.getStatus(), response, clock.instant()));
    }

    // ======================== STRATEGY PREPARATION ========================

    private void activateEmergencyMode(String accountId, RiskMonitoringState riskState) {
        if (emergencyModeManager.getState().isActive()) {
            emergencyModeManager.addAffectedAccount(accountId);
            return;
        }
        EmergencyLevel level = riskState.getMarginLevel() <= riskState.getLossCutLevel()
                ? EmergencyLevel.CRITICAL : EmergencyLevel.HIGH;
        emergencyModeManager.activateEmergencyMode(EmergencyTrigger.builder()
                .id(UUID.randomUUID().toString())
                .type(TriggerType.LOSSCUT)
                .severity(level)
                .accountId(accountId)
                .detail("marginLevel", riskState.getMarginLevel())
                .timestamp(clock.instant())
                .build());
    }

    ScenarioType determineScenarioType(String accountId, List<Position> relatedPositions) {
        if (relatedPositions.size() > CORRELATED_POSITION_COUNT) {
            return ScenarioType.CORRELATED_POSITIONS;
        }
        long atRisk = riskStateManager.statesAtOrAbove(RiskLevel.DANGER).stream()
                .map(RiskMonitoringState::getAccountId)
                .filter(id -> !id.equals(accountId))
                .count();
        return atRisk > 0 ? ScenarioType.MULTI_ACCOUNT : ScenarioType.SINGLE_ACCOUNT;
    }

    private static DynamicStrategyParameters dynamicParameters(RiskMonitoringState state, List<Position> positions,
                                                               ScenarioType scenario) {
        double unrealized = positions.stream().mapToDouble(Position::getProfit).sum();
        return DynamicStrategyParameters.builder()
                .marginLevel(state.getMarginLevel())
                .balance(state.getBalance())
                .equity(state.getEquity())
                .usedMargin(state.getUsedMargin())
                .freeMargin(state.getFreeMargin())
                .unrealizedPL(unrealized)
                .positions(positions)
                .scenarioType(scenario)
                .build();
    }

    /**
     * Fills empty target lists from the loss minimizer so every close or reduce command names the
     * positions it acts on.
     */
    EmergencyStrategy resolveTargets(EmergencyStrategy strategy, RiskMonitoringState riskState, List<Position> positions) {
        if (positions.isEmpty()) {
            return strategy;
        }
        MinimizationResult plan = lossMinimizer.calculateOptimalMinimization(positions, riskState,
                strategy.getSuccessCriteria().getMarginLevelTarget());
        List<String> worst = lossMinimizer.selectWorstPositions(positions, 1.0).stream()
                .map(Position::getId)
                .collect(Collectors.toList());

        List<EmergencyAction> actions = new ArrayList<>();
        for (EmergencyAction action : strategy.getActions()) {
            if (!action.getTargetPositions().isEmpty()) {
                actions.add(action);
                continue;
            }
            List<String> targets = switch (action.getType()) {
                case IMMEDIATE_CLOSE -> !plan.getPositionsToClose().isEmpty() ? plan.getPositionsToClose() : worst;
                case PARTIAL_CLOSE -> !plan.getPositionsToReduce().isEmpty()
                        ? plan.getPositionsToReduce().stream().map(PositionReduction::positionId).collect(Collectors.toList())
                        : worst;
                case HEDGE_OPEN, BALANCE_TRANSFER -> List.of();
            };
            actions.add(action.withTargets(targets));
        }
        return strategy.toBuilder().actions(List.copyOf(actions)).build();
    }

    // ======================== QUERIES & LIFECYCLE ========================

    public Optional<EmergencyResponse> getActiveResponse(String accountId) {
        return Optional.ofNullable(activeResponses.get(accountId));
    }

    public Collection<EmergencyResponse> getActiveResponses() {
        return List.copyOf(activeResponses.values());
    }

    public List<EmergencyResponse> getExecutionHistory() {
        return List.copyOf(executionHistory);
    }

    public Optional<EmergencyResponse> findResponse(String responseId) {
        for (EmergencyResponse response : activeResponses.values()) {
            if (response.getId().equals(responseId)) {
                return Optional.of(response);
            }
        }
        return executionHistory.stream().filter(r -> r.getId().equals(responseId)).findFirst();
    }

    /**
     * Marks every still-running response FAILED and archives it. A worker still inside a gateway call
     * stops before its next action.
     */
    public void shutdown() {
        for (EmergencyResponse response : List.copyOf(activeResponses.values())) {
            if (response.complete(ResponseStatus.FAILED, clock.instant())) {
                log.warn("[EMERGENCY] Response {} marked FAILED on shutdown", response.getId());
                finish(response);
            }
        }
    }

    private boolean recentlyResponded(String accountId) {
        Instant cutoff = clock.instant().minus(Duration.ofMillis(properties.getEmergency().getResponseCooldownMs()));
        for (EmergencyResponse response : executionHistory) {
            if (response.getAccountId().equals(accountId)
                    && response.getEndTime() != null && response.getEndTime().isAfter(cutoff)) {
                return true;
            }
        }
        return false;
    }

    private EmergencyActionResult failure(EmergencyAction action, long start, String error) {
        return EmergencyActionResult.builder()
                .action(action)
                .success(false)
                .executionTimeMs(clock.millis() - start)
                .error(error != null ? error : "Unknown error")
                .executedAt(clock.instant())
                .build();
    }

    private static List<String> requireTargets(EmergencyAction action, String message) {
        if (action.getTargetPositions().isEmpty()) {
            throw new IllegalStateException(message);
        }
        return action.getTargetPositions();
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }

    private record ActionOutcome(CommandReceipt receipt, String description, double lossReduction) {
    }
}
