package com.kotsin.margin.gateway;

import com.kotsin.margin.optimizer.HedgeOrder;

import java.util.List;

/**
 * Boundary to whatever turns emergency decisions into broker-side changes.
 * Every call either returns a receipt or throws {@link CommandDispatchException}.
 */
public interface EmergencyCommandGateway {

    /**
     * Close the given positions in full.
     */
    CommandReceipt closePositions(String accountId, List<String> positionIds) throws CommandDispatchException;

    /**
     * Close {@code percentage} percent of each given position.
     */
    CommandReceipt reducePositions(String accountId, List<String> positionIds, double percentage)
            throws CommandDispatchException;

    CommandReceipt openHedge(String accountId, List<HedgeOrder> hedges) throws CommandDispatchException;

    /**
     * Move {@code amount} into the account from the operator's funding source.
     */
    CommandReceipt transferBalance(String accountId, double amount) throws CommandDispatchException;

    boolean isAvailable();
}
