package com.kotsin.margin.analysis;

import com.kotsin.margin.model.MarginMath;
import com.kotsin.margin.model.RiskLevel;
import com.kotsin.margin.model.RiskMonitoringState;
import lombok.Value;

/**
 * The figures of an account the analyzer compares before and after a response.
 */
@Value
public class StateSnapshot {
    double marginLevel;
    double totalLoss;
    double usedMargin;
    int positionCount;
    RiskLevel riskLevel;

    /**
     * Total loss is the balance not covered by equity, never negative.
     */
    public static StateSnapshot of(RiskMonitoringState state, int positionCount) {
        return new StateSnapshot(
                MarginMath.reportable(state.getMarginLevel()),
                Math.max(0.0, state.getBalance() - state.getEquity()),
                state.getUsedMargin(),
                positionCount,
                state.getRiskLevel());
    }
}
