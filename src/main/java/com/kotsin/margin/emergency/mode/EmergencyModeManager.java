package com.kotsin.margin.emergency.mode;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.event.RiskEngineEvent;
import com.kotsin.margin.event.RiskEngineEventType;
import com.kotsin.margin.event.RiskEventDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single process-wide {@link EmergencyModeState}.
 *
 * <p>All transitions are synchronized on this instance. Observers receive an
 * {@link RiskEngineEventType#EMERGENCY_MODE_CHANGED} event carrying the new snapshot.</p>
 */
@Component
@Slf4j
public class EmergencyModeManager {

    public static final String MANUAL = "manual";

    private final MarginGuardProperties.EmergencyMode config;
    private final Map<RecoveryActionType, RecoveryCheck> checks = new EnumMap<>(RecoveryActionType.class);
    private final RiskEventDispatcher dispatcher;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private volatile EmergencyModeState state = EmergencyModeState.inactive();
    private final List<EmergencyModeHistoryEntry> history = new ArrayList<>();
    private final List<RecoveryAction> recoveryActions = new ArrayList<>();

    private ScheduledFuture<?> autoRecoveryTask;
    private ScheduledFuture<?> autoDeactivationTask;

    public EmergencyModeManager(MarginGuardProperties properties,
                                List<RecoveryCheck> recoveryChecks,
                                RiskEventDispatcher dispatcher,
                                @Qualifier("riskEngineScheduler") ScheduledExecutorService scheduler,
                                Clock clock) {
        this.config = properties.getEmergencyMode();
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.clock = clock;
        for (RecoveryCheck check : recoveryChecks) {
            checks.put(check.type(), check);
        }
    }

    // ======================== TRANSITIONS ========================

    public synchronized void activateEmergencyMode(EmergencyTrigger trigger) {
        activateEmergencyMode(trigger, null);
    }

    /**
     * Enters emergency mode at {@code level}, or at the trigger's severity when {@code level} is null.
     * A state that is already active is archived first.
     */
    public synchronized void activateEmergencyMode(EmergencyTrigger trigger, EmergencyLevel level) {
        EmergencyLevel resolved = level != null ? level
                : trigger.getSeverity() != null ? trigger.getSeverity() : EmergencyLevel.LOW;
        log.warn("[EMERGENCY-MODE] Activating level={} trigger={} account={}",
                resolved, trigger.getType(), trigger.getAccountId());

        Instant now = clock.instant();
        if (state.isActive()) {
            history.add(new EmergencyModeHistoryEntry(state, now, "superseded by " + trigger.getType()));
        }
        cancelTimers();

        List<String> affected = new ArrayList<>();
        if (trigger.getAccountId() != null) {
            affected.add(trigger.getAccountId());
        }
        boolean autoRecovery = config.isAutoRecoveryEnabled() && resolved != EmergencyLevel.CRITICAL;
        state = EmergencyModeState.builder()
                .active(true)
                .level(resolved)
                .triggeredAt(now)
                .triggeredBy(trigger.getType())
                .reason(buildReason(trigger))
                .affectedAccounts(List.copyOf(affected))
                .suspendedOperations(List.copyOf(config.suspendedFor(resolved)))
                .allowedOperations(allowedFor(resolved))
                .autoRecoveryEnabled(autoRecovery)
                .manualInterventionRequired(resolved == EmergencyLevel.CRITICAL || trigger.getType() == TriggerType.MANUAL)
                .estimatedRecoveryTimeMinutes(estimateRecoveryMinutes(resolved, trigger.getType()))
                .build();

        initializeRecoveryActions(resolved, trigger.getType());
        notifyStateChange();

        if (state.isAutoRecoveryEnabled()) {
            scheduleAutoRecovery();
        }
    }

    /**
     * Returns to the inactive state.
     *
     * @return false when mode is inactive, when a manual hold applies and {@code reason} is not
     *         {@value #MANUAL}, or when any required recovery action has not succeeded
     */
    public synchronized boolean deactivateEmergencyMode(String reason) {
        if (!state.isActive()) {
            log.info("[EMERGENCY-MODE] Deactivation ignored, emergency mode is not active");
            return false;
        }
        if (state.isManualInterventionRequired() && !MANUAL.equals(reason)) {
            log.info("[EMERGENCY-MODE] Manual intervention required, refusing deactivation reason={}", reason);
            return false;
        }
        if (!requiredActionsSucceeded()) {
            log.info("[EMERGENCY-MODE] Required recovery actions not completed, refusing deactivation reason={}", reason);
            return false;
        }

        log.info("[EMERGENCY-MODE] Deactivating level={} reason={}", state.getLevel(), reason);
        history.add(new EmergencyModeHistoryEntry(state, clock.instant(), reason));
        cancelTimers();
        state = EmergencyModeState.inactive();
        recoveryActions.clear();
        notifyStateChange();
        return true;
    }

    public synchronized boolean escalateLevel() {
        if (!state.isActive() || state.getLevel() == EmergencyLevel.CRITICAL) {
            return false;
        }
        EmergencyLevel from = state.getLevel();
        EmergencyLevel to = from.escalated();
        log.warn("[EMERGENCY-MODE] Escalating {} -> {}", from, to);

        EmergencyModeState.EmergencyModeStateBuilder next = withLevel(to);
        if (to == EmergencyLevel.CRITICAL) {
            next.manualInterventionRequired(true).autoRecoveryEnabled(false);
            cancelTimers();
        }
        state = next.build();
        notifyStateChange();
        return true;
    }

    /**
     * One level down; below {@code LOW} this attempts a deactivation instead.
     */
    public synchronized boolean deEscalateLevel() {
        if (!state.isActive()) {
            return false;
        }
        EmergencyLevel from = state.getLevel();
        EmergencyLevel to = from.deEscalated();
        if (to == null) {
            return deactivateEmergencyMode("auto_de_escalation");
        }
        log.info("[EMERGENCY-MODE] De-escalating {} -> {}", from, to);

        EmergencyModeState.EmergencyModeStateBuilder next = withLevel(to)
                .manualInterventionRequired(state.getTriggeredBy() == TriggerType.MANUAL)
                .autoRecoveryEnabled(config.isAutoRecoveryEnabled());
        state = next.build();
        notifyStateChange();
        if (state.isAutoRecoveryEnabled() && from == EmergencyLevel.CRITICAL) {
            scheduleAutoRecovery();
        }
        return true;
    }

    /**
     * Adds an account to the active emergency; does nothing when mode is inactive.
     */
    public synchronized void addAffectedAccount(String accountId) {
        if (!state.isActive() || state.getAffectedAccounts().contains(accountId)) {
            return;
        }
        List<String> affected = new ArrayList<>(state.getAffectedAccounts());
        affected.add(accountId);
        state = state.toBuilder().affectedAccounts(List.copyOf(affected)).build();
        notifyStateChange();
    }

    // ======================== RECOVERY ========================

    public synchronized boolean executeRecoveryAction(String actionId) {
        RecoveryAction action = recoveryActions.stream()
                .filter(a -> a.getId().equals(actionId))
                .findFirst()
                .orElseThrow(() -> new RecoveryActionException("Recovery action not found: " + actionId));
        if (action.isCompleted()) {
            throw new RecoveryActionException("Recovery action already completed: " + actionId);
        }
        boolean success = perform(action);
        checkRecoveryCompletion();
        return success;
    }

    /**
     * Runs every pending recovery action in order.
     *
     * @return number of actions that succeeded in this call
     */
    public synchronized int executeAllRecoveryActions() {
        int successCount = 0;
        for (RecoveryAction action : recoveryActions) {
            if (!action.isCompleted() && perform(action)) {
                successCount++;
            }
        }
        checkRecoveryCompletion();
        return successCount;
    }

    private boolean perform(RecoveryAction action) {
        log.info("[EMERGENCY-MODE] Executing recovery action {}", action.getId());
        action.setExecutedAt(clock.instant());
        RecoveryCheck check = checks.get(action.getType());
        try {
            if (check == null) {
                throw new RecoveryActionException("Unknown recovery action type: " + action.getType());
            }
            Optional<String> failure = check.verify(state);
            action.setCompleted(true);
            if (failure.isPresent()) {
                action.setResult(RecoveryResult.FAILED);
                action.setDetail(failure.get());
                log.warn("[EMERGENCY-MODE] Recovery action {} failed: {}", action.getId(), failure.get());
                return false;
            }
            action.setResult(RecoveryResult.SUCCESS);
            log.info("[EMERGENCY-MODE] Recovery action {} completed", action.getId());
            return true;
        } catch (Exception e) {
            action.setCompleted(true);
            action.setResult(RecoveryResult.FAILED);
            action.setDetail(e.getMessage());
            log.error("[EMERGENCY-MODE] Recovery action {} failed: {}", action.getId(), e.getMessage(), e);
            return false;
        }
    }

    private void checkRecoveryCompletion() {
        if (!state.isActive() || !state.isAutoRecoveryEnabled() || !requiredActionsSucceeded()) {
            return;
        }
        if (autoDeactivationTask != null) {
            autoDeactivationTask.cancel(false);
        }
        Instant activation = state.getTriggeredAt();
        autoDeactivationTask = scheduler.schedule(() -> autoDeactivate(activation),
                config.getAutoDeactivationDelayMs(), TimeUnit.MILLISECONDS);
        log.info("[EMERGENCY-MODE] Required recovery actions complete, auto deactivation in {}ms",
                config.getAutoDeactivationDelayMs());
    }

    private synchronized void autoDeactivate(Instant activation) {
        if (state.isActive() && activation.equals(state.getTriggeredAt())) {
            deactivateEmergencyMode("auto_recovery");
        }
    }

    private void scheduleAutoRecovery() {
        Integer minutes = state.getEstimatedRecoveryTimeMinutes();
        if (minutes == null) {
            return;
        }
        long delayMs = Math.min(TimeUnit.MINUTES.toMillis(minutes), config.getAutoRecoveryTimeoutMs());
        if (autoRecoveryTask != null) {
            autoRecoveryTask.cancel(false);
        }
        Instant activation = state.getTriggeredAt();
        autoRecoveryTask = scheduler.schedule(() -> runAutoRecovery(activation), delayMs, TimeUnit.MILLISECONDS);
        log.info("[EMERGENCY-MODE] Auto recovery scheduled in {}ms", delayMs);
    }

    private synchronized void runAutoRecovery(Instant activation) {
        if (state.isActive() && state.isAutoRecoveryEnabled() && activation.equals(state.getTriggeredAt())) {
            int succeeded = executeAllRecoveryActions();
            log.info("[EMERGENCY-MODE] Auto recovery ran, {} of {} actions succeeded", succeeded, recoveryActions.size());
        }
    }

    private boolean requiredActionsSucceeded() {
        return recoveryActions.stream().filter(RecoveryAction::isRequired).allMatch(RecoveryAction::succeeded);
    }

    private void initializeRecoveryActions(EmergencyLevel level, TriggerType trigger) {
        recoveryActions.clear();
        recoveryActions.add(recoveryAction(RecoveryActionType.POSITION_VALIDATION, true));
        if (trigger == TriggerType.LOSSCUT || trigger == TriggerType.MARGIN_CRITICAL) {
            recoveryActions.add(recoveryAction(RecoveryActionType.MARGIN_CHECK, true));
        }
        if (level == EmergencyLevel.HIGH || level == EmergencyLevel.CRITICAL) {
            recoveryActions.add(recoveryAction(RecoveryActionType.SYSTEM_HEALTH, true));
        }
        recoveryActions.add(recoveryAction(RecoveryActionType.CONNECTIVITY_TEST, false));
    }

    private static RecoveryAction recoveryAction(RecoveryActionType type, boolean required) {
        return RecoveryAction.builder()
                .id(type.id())
                .type(type)
                .description(type.getDescription())
                .required(required)
                .completed(false)
                .build();
    }

    // ======================== QUERIES ========================

    /**
     * When inactive every operation is allowed. Affected accounts are checked against the allowed
     * set, everyone else against the suspended set.
     */
    public boolean isOperationAllowed(OperationType operation, String accountId) {
        EmergencyModeState current = state;
        if (!current.isActive()) {
            return true;
        }
        if (accountId != null && current.getAffectedAccounts().contains(accountId)) {
            return current.getAllowedOperations().contains(operation);
        }
        return !current.getSuspendedOperations().contains(operation);
    }

    public boolean isOperationAllowed(OperationType operation) {
        return isOperationAllowed(operation, null);
    }

    public EmergencyModeState getState() {
        return state;
    }

    public synchronized List<EmergencyModeHistoryEntry> getHistory() {
        return List.copyOf(history);
    }

    public synchronized List<RecoveryAction> getRecoveryActions() {
        List<RecoveryAction> copy = new ArrayList<>();
        recoveryActions.forEach(a -> copy.add(a.toBuilder().build()));
        return copy;
    }

    public synchronized void shutdown() {
        cancelTimers();
    }

    // ======================== HELPERS ========================

    private EmergencyModeState.EmergencyModeStateBuilder withLevel(EmergencyLevel level) {
        return state.toBuilder()
                .level(level)
                .suspendedOperations(List.copyOf(config.suspendedFor(level)))
                .allowedOperations(allowedFor(level));
    }

    private List<OperationType> allowedFor(EmergencyLevel level) {
        List<OperationType> suspended = config.suspendedFor(level);
        List<OperationType> allowed = new ArrayList<>();
        for (OperationType op : OperationType.values()) {
            if (!suspended.contains(op)) {
                allowed.add(op);
            }
        }
        return List.copyOf(allowed);
    }

    static int estimateRecoveryMinutes(EmergencyLevel level, TriggerType trigger) {
        return (int) Math.round(level.getBaseRecoveryMinutes() * trigger.getRecoveryMultiplier());
    }

    private static String buildReason(EmergencyTrigger trigger) {
        StringBuilder reason = new StringBuilder(trigger.getType().getLabel());
        if (trigger.getAccountId() != null) {
            reason.append(" (account: ").append(trigger.getAccountId()).append(')');
        }
        Object marginLevel = trigger.getDetails().get("marginLevel");
        if (marginLevel instanceof Number number) {
            reason.append(String.format(" margin level: %.2f%%", number.doubleValue()));
        }
        return reason.toString();
    }

    private void cancelTimers() {
        if (autoRecoveryTask != null) {
            autoRecoveryTask.cancel(false);
            autoRecoveryTask = null;
        }
        if (autoDeactivationTask != null) {
            autoDeactivationTask.cancel(false);
            autoDeactivationTask = null;
        }
    }

    private void notifyStateChange() {
        EmergencyModeState snapshot = state;
        RiskEngineEvent.Severity severity = !snapshot.isActive() ? RiskEngineEvent.Severity.INFO
                : snapshot.getLevel() == EmergencyLevel.CRITICAL ? RiskEngineEvent.Severity.CRITICAL
                : RiskEngineEvent.Severity.WARNING;
        String message = snapshot.isActive()
                ? "Emergency mode " + snapshot.getLevel() + ": " + snapshot.getReason()
                : "Emergency mode inactive";
        dispatcher.dispatch(RiskEngineEvent.of(RiskEngineEventType.EMERGENCY_MODE_CHANGED, null,
                severity, message, snapshot, clock.instant()));
    }
}
