package com.kotsin.margin.recovery;

import com.kotsin.margin.model.Position;
import com.kotsin.margin.model.RiskMonitoringState;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Account figures plus open positions, as the recovery calculator sees them.
 */
@Value
@Builder
public class AccountState {
    String accountId;
    String broker;
    double equity;
    double freeMargin;
    double usedMargin;
    double marginLevel;
    double bonusAmount;
    List<Position> positions;

    public static AccountState from(RiskMonitoringState state, List<Position> positions) {
        return AccountState.builder()
                .accountId(state.getAccountId())
                .broker(state.getBroker())
                .equity(state.getEquity())
                .freeMargin(state.getFreeMargin())
                .usedMargin(state.getUsedMargin())
                .marginLevel(state.getMarginLevel())
                .bonusAmount(state.getBonusAmount())
                .positions(positions != null ? List.copyOf(positions) : List.of())
                .build();
    }
}
