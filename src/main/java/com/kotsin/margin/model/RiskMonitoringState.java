package com.kotsin.margin.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Canonical per-account snapshot. The risk level is derived from the margin level in the
 * constructor and cannot be supplied by callers.
 */
@Value
public class RiskMonitoringState {
    String accountId;
    String broker;
    double marginLevel;
    double freeMargin;
    double usedMargin;
    double balance;
    double equity;
    double bonusAmount;
    RiskLevel riskLevel;
    Instant lastUpdate;
    double lossCutLevel;
    Predictions predictions;

    @Builder(toBuilder = true)
    private RiskMonitoringState(String accountId, String broker, double marginLevel, double freeMargin,
                                double usedMargin, double balance, double equity, double bonusAmount,
                                Instant lastUpdate, double lossCutLevel, Predictions predictions) {
        this.accountId = accountId;
        this.broker = broker;
        this.marginLevel = marginLevel;
        this.freeMargin = freeMargin;
        this.usedMargin = usedMargin;
        this.balance = balance;
        this.equity = equity;
        this.bonusAmount = bonusAmount;
        this.riskLevel = RiskLevel.fromMarginLevel(marginLevel);
        this.lastUpdate = lastUpdate;
        this.lossCutLevel = lossCutLevel;
        this.predictions = predictions != null ? predictions : Predictions.none();
    }

    public static RiskMonitoringState from(AccountMarginInfo info, double lossCutLevel, Instant now) {
        return RiskMonitoringState.builder()
                .accountId(info.getAccountId())
                .broker(info.getBroker())
                .marginLevel(info.effectiveMarginLevel())
                .freeMargin(info.getFreeMargin())
                .usedMargin(info.getUsedMargin())
                .balance(info.getBalance())
                .equity(info.getEquity())
                .bonusAmount(info.getBonusAmount())
                .lastUpdate(info.getLastUpdate() != null ? info.getLastUpdate() : now)
                .lossCutLevel(lossCutLevel)
                .build();
    }

    @Value
    @Builder
    public static class Predictions {
        Double timeToCriticalMinutes;
        double requiredRecovery;

        public static Predictions none() {
            return new Predictions(null, 0.0);
        }
    }
}
