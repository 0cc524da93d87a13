package com.kotsin.margin.recovery;

import lombok.Builder;
import lombok.Value;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class CrossAccountContext {
    List<AccountState> accounts;
    double totalEquity;
    double totalFreeMargin;
    Map<String, Double> riskDistribution;

    public static CrossAccountContext of(List<AccountState> accounts) {
        double equity = 0;
        double freeMargin = 0;
        Map<String, Double> distribution = new HashMap<>();
        for (AccountState account : accounts) {
            equity += account.getEquity();
            freeMargin += account.getFreeMargin();
        }
        for (AccountState account : accounts) {
            distribution.put(account.getAccountId(), equity > 0 ? account.getEquity() / equity : 0.0);
        }
        return CrossAccountContext.builder()
                .accounts(List.copyOf(accounts))
                .totalEquity(equity)
                .totalFreeMargin(freeMargin)
                .riskDistribution(distribution)
                .build();
    }
}
