package com.kotsin.margin.emergency;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One dispatch of an {@link EmergencyStrategy} against an account. Status moves from
 * {@code EXECUTING} to a terminal value exactly once.
 */
@Slf4j
public class EmergencyResponse {

    @Getter
    private final String id;
    @Getter
    private final String accountId;
    @Getter
    private final EmergencyStrategy strategy;
    @Getter
    private final Instant startTime;

    private final List<EmergencyActionResult> executedActions = new ArrayList<>();
    private ResponseStatus status = ResponseStatus.EXECUTING;
    private Instant endTime;
    private Double totalLossAvoidance;

    public EmergencyResponse(String id, String accountId, EmergencyStrategy strategy, Instant startTime) {
        this.id = id;
        this.accountId = accountId;
        this.strategy = strategy;
        this.startTime = startTime;
    }

    /**
     * @return false once the response is terminal or every strategy action already has a result
     */
    public synchronized boolean addResult(EmergencyActionResult result) {
        if (status.isTerminal() || executedActions.size() >= strategy.getActions().size()) {
            log.warn("[EMERGENCY] Ignoring action result for response {} status={} results={}",
                    id, status, executedActions.size());
            return false;
        }
        executedActions.add(result);
        return true;
    }

    /**
     * Moves to {@code terminal}. Later calls are ignored.
     *
     * @return true only for the call that changed the status
     */
    public synchronized boolean complete(ResponseStatus terminal, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (status.isTerminal()) {
            return false;
        }
        status = terminal;
        endTime = now;
        totalLossAvoidance = cumulativeLossReduction();
        return true;
    }

    public synchronized double cumulativeLossReduction() {
        double total = 0;
        for (EmergencyActionResult result : executedActions) {
            total += result.lossReductionOrZero();
        }
        return total;
    }

    public synchronized List<EmergencyActionResult> getExecutedActions() {
        return List.copyOf(executedActions);
    }

    public synchronized ResponseStatus getStatus() {
        return status;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized Double getTotalLossAvoidance() {
        return totalLossAvoidance;
    }

    public synchronized long successfulActions() {
        return executedActions.stream().filter(EmergencyActionResult::isSuccess).count();
    }
}
