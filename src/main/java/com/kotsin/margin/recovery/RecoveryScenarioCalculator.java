package com.kotsin.margin.recovery;

import com.kotsin.margin.model.LossCutForecast;
import com.kotsin.margin.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Generates and ranks the ways an account can get back to a healthy margin level.
 * Stateless; every call works on the figures it is given.
 */
@Component
@Slf4j
public class RecoveryScenarioCalculator {

    public static final double DEFAULT_TARGET_LEVEL = 200.0;
    private static final double UNDEFINED_LEVEL = 999.0;
    private static final double DONOR_BUFFER = 1.2;
    private static final double MIN_DONOR_FREE_MARGIN = 1000.0;
    private static final double DONOR_SHARE = 0.8;

    /**
     * Equity to add so that {@code currentLevel} reaches {@code targetLevel}.
     */
    public double basicRecovery(double currentLevel, double usedMargin, double targetLevel) {
        if (currentLevel >= targetLevel) {
            return 0.0;
        }
        double requiredEquity = usedMargin * targetLevel / 100.0;
        double currentEquity = usedMargin * currentLevel / 100.0;
        return Math.max(0.0, requiredEquity - currentEquity);
    }

    public List<RecoveryScenario> positionReduction(AccountState account, double targetLevel) {
        List<RecoveryScenario> scenarios = new ArrayList<>();
        if (account.getMarginLevel() >= targetLevel) {
            return scenarios;
        }

        List<Position> losers = account.getPositions().stream()
                .filter(p -> p.getProfit() < 0)
                .sorted(Comparator.comparingDouble(Position::getProfit))
                .collect(Collectors.toList());
        List<Position> winners = account.getPositions().stream()
                .filter(p -> p.getProfit() > 0)
                .sorted(Comparator.comparingDouble(Position::getProfit).reversed())
                .collect(Collectors.toList());

        if (!losers.isEmpty()) {
            Position worst = losers.get(0);
            double loss = Math.abs(worst.getProfit());
            double newLevel = levelAfter(account.getUsedMargin() - worst.getMarginRequired(), account.getEquity() - loss);
            scenarios.add(RecoveryScenario.builder()
                    .type(RecoveryType.POSITION_REDUCTION)
                    .description(String.format("Close largest losing position %s (%.2f lot)", worst.getSymbol(), worst.getLots()))
                    .requiredAmount(0.0)
                    .impactPercent(impactPercentage(account.getMarginLevel(), newLevel, targetLevel))
                    .urgency(newLevel >= targetLevel ? Urgency.MEDIUM : Urgency.HIGH)
                    .feasibility(0.95)
                    .instructions(List.of(
                            String.format("Close %s %s %.2f lot", worst.getSymbol(), worst.getSide(), worst.getLots()),
                            String.format("Expected realized loss: %.2f", loss),
                            String.format("Expected margin level: %.1f%%", newLevel),
                            "Review the account after closing"))
                    .build());
        }

        if (!winners.isEmpty()) {
            Position best = winners.get(0);
            double gain = best.getProfit();
            double newLevel = levelAfter(account.getUsedMargin() - best.getMarginRequired(), account.getEquity() + gain);
            scenarios.add(RecoveryScenario.builder()
                    .type(RecoveryType.PROFIT_TAKING)
                    .description(String.format("Take profit on largest winner %s (%.2f lot)", best.getSymbol(), best.getLots()))
                    .requiredAmount(0.0)
                    .impactPercent(impactPercentage(account.getMarginLevel(), newLevel, targetLevel))
                    .urgency(Urgency.LOW)
                    .feasibility(0.9)
                    .instructions(List.of(
                            String.format("Close %s %s %.2f lot", best.getSymbol(), best.getSide(), best.getLots()),
                            String.format("Realized profit: %.2f", gain),
                            String.format("Expected margin level: %.1f%%", newLevel),
                            "Consider re-entry once the margin level has recovered"))
                    .build());
        }

        if (!losers.isEmpty()) {
            Position position = losers.get(0);
            double partialLots = Math.max(0.01, position.getLots() * 0.5);
            double partialLoss = Math.abs(position.getProfit()) * 0.5;
            double newLevel = levelAfter(account.getUsedMargin() - position.getMarginRequired() * 0.5,
                    account.getEquity() - partialLoss);
            scenarios.add(RecoveryScenario.builder()
                    .type(RecoveryType.POSITION_REDUCTION)
                    .description(String.format("Close 50%% of %s", position.getSymbol()))
                    .requiredAmount(0.0)
                    .impactPercent(impactPercentage(account.getMarginLevel(), newLevel, targetLevel))
                    .urgency(Urgency.MEDIUM)
                    .feasibility(0.9)
                    .instructions(List.of(
                            String.format("Partially close %s %s %.2f lot", position.getSymbol(), position.getSide(), partialLots),
                            String.format("Expected realized loss: %.2f", partialLoss),
                            String.format("Remaining position: %.2f lot", position.getLots() - partialLots),
                            String.format("Expected margin level: %.1f%%", newLevel)))
                    .build());
        }
        return scenarios;
    }

    public List<RecoveryScenario> crossAccountRebalance(AccountState riskAccount, CrossAccountContext context,
                                                        double targetLevel) {
        List<RecoveryScenario> scenarios = new ArrayList<>();
        if (context == null || context.getAccounts() == null) {
            return scenarios;
        }
        double required = basicRecovery(riskAccount.getMarginLevel(), riskAccount.getUsedMargin(), targetLevel);
        if (required <= 0) {
            return scenarios;
        }
        Urgency urgency = Urgency.fromMarginLevel(riskAccount.getMarginLevel());

        List<AccountState> donors = context.getAccounts().stream()
                .filter(a -> !a.getAccountId().equals(riskAccount.getAccountId()))
                .filter(a -> a.getFreeMargin() > required * DONOR_BUFFER)
                .sorted(Comparator.comparingDouble(AccountState::getFreeMargin).reversed())
                .collect(Collectors.toList());
        if (!donors.isEmpty()) {
            AccountState donor = donors.get(0);
            scenarios.add(RecoveryScenario.builder()
                    .type(RecoveryType.CROSS_ACCOUNT)
                    .description(String.format("Transfer funds from %s to %s", label(donor), label(riskAccount)))
                    .requiredAmount(required)
                    .impactPercent(100)
                    .urgency(urgency)
                    .feasibility(0.7)
                    .instructions(List.of(
                            String.format("Source: %s (free margin %.0f)", label(donor), donor.getFreeMargin()),
                            String.format("Amount: %.0f", required),
                            "Execute the transfer",
                            "Apply other measures until the transfer settles",
                            "Check the margin level after settlement"))
                    .build());
        }

        List<AccountState> available = context.getAccounts().stream()
                .filter(a -> !a.getAccountId().equals(riskAccount.getAccountId()))
                .filter(a -> a.getFreeMargin() > MIN_DONOR_FREE_MARGIN)
                .sorted(Comparator.comparingDouble(AccountState::getFreeMargin).reversed())
                .collect(Collectors.toList());
        if (available.size() >= 2) {
            double totalAvailable = available.stream().mapToDouble(a -> a.getFreeMargin() * DONOR_SHARE).sum();
            if (totalAvailable >= required) {
                List<String> instructions = new ArrayList<>();
                available.stream().limit(3).forEach(a -> instructions.add(String.format("%s: %.0f",
                        label(a), Math.min(a.getFreeMargin() * DONOR_SHARE, required / 2))));
                instructions.add("Run the transfers in parallel");
                instructions.add("Track settlement of each transfer");
                scenarios.add(RecoveryScenario.builder()
                        .type(RecoveryType.CROSS_ACCOUNT)
                        .description("Distributed transfer from several accounts")
                        .requiredAmount(required)
                        .impactPercent(95)
                        .urgency(urgency)
                        .feasibility(0.6)
                        .instructions(List.copyOf(instructions))
                        .build());
            }
        }
        return scenarios;
    }

    public List<RecoveryScenario> depositScenarios(AccountState account, double targetLevel) {
        double required = basicRecovery(account.getMarginLevel(), account.getUsedMargin(), targetLevel);
        if (required <= 0) {
            return List.of();
        }
        double buffered = required * 1.5;
        return List.of(
                RecoveryScenario.builder()
                        .type(RecoveryType.DEPOSIT)
                        .description("Deposit the minimum required amount")
                        .requiredAmount(required)
                        .impactPercent(100)
                        .urgency(Urgency.fromMarginLevel(account.getMarginLevel()))
                        .feasibility(0.8)
                        .instructions(List.of(
                                String.format("Required deposit: %.0f", required),
                                "Start the deposit immediately",
                                "Apply other measures until the deposit is credited",
                                "Check the margin level once credited"))
                        .build(),
                RecoveryScenario.builder()
                        .type(RecoveryType.DEPOSIT)
                        .description("Deposit with safety buffer")
                        .requiredAmount(buffered)
                        .impactPercent(120)
                        .urgency(Urgency.MEDIUM)
                        .feasibility(0.7)
                        .instructions(List.of(
                                String.format("Recommended deposit: %.0f (including buffer)", buffered),
                                "Covers further adverse moves",
                                "Leaves room for new trades",
                                "Targets a margin level above 300%"))
                        .build());
    }

    /**
     * All scenarios for the account ranked by score, with the best one picked as optimal.
     *
     * @param context other accounts that may fund a transfer; {@code null} skips cross-account scenarios
     */
    public RecoveryPlan calculateOptimizedRecovery(AccountState account, CrossAccountContext context, double targetLevel) {
        List<RecoveryScenario> all = new ArrayList<>();
        all.addAll(positionReduction(account, targetLevel));
        all.addAll(crossAccountRebalance(account, context, targetLevel));
        all.addAll(depositScenarios(account, targetLevel));

        List<RecoveryScenario> ranked = all.stream()
                .map(s -> s.toBuilder().score(score(s, account.getMarginLevel())).build())
                .sorted(Comparator.comparingDouble(RecoveryScenario::getScore).reversed())
                .collect(Collectors.toList());

        RecoveryScenario optimal = ranked.isEmpty()
                ? RecoveryScenario.builder()
                        .type(RecoveryType.DEPOSIT)
                        .description("Default deposit plan")
                        .requiredAmount(basicRecovery(account.getMarginLevel(), account.getUsedMargin(), targetLevel))
                        .impactPercent(100)
                        .urgency(Urgency.HIGH)
                        .feasibility(0.8)
                        .instructions(List.of("Deposit additional funds"))
                        .score(0.0)
                        .build()
                : ranked.get(0);

        log.debug("[RECOVERY] account={} scenarios={} optimal={} score={}",
                account.getAccountId(), ranked.size(), optimal.getType(), String.format("%.3f", optimal.getScore()));

        return RecoveryPlan.builder()
                .scenarios(ranked)
                .optimalScenario(optimal)
                .timeToExecuteMinutes(optimal.getType().executionMinutes())
                .successProbability(optimal.getFeasibility())
                .riskReduction(optimal.getImpactPercent())
                .build();
    }

    /**
     * feasibility x impact x urgency weight x time weight.
     */
    public double score(RecoveryScenario scenario, double currentLevel) {
        return scenario.getFeasibility()
                * (scenario.getImpactPercent() / 100.0)
                * urgencyScore(scenario.getUrgency(), currentLevel)
                * scenario.getType().timeWeight();
    }

    private static double urgencyScore(Urgency urgency, double marginLevel) {
        if (marginLevel < 50 && urgency == Urgency.CRITICAL) return 1.0;
        if (marginLevel < 100 && urgency == Urgency.HIGH) return 0.9;
        return urgency.weight();
    }

    /**
     * Scenarios derived only from a forecast, for accounts whose positions are not at hand.
     * Empty when the forecast needs no recovery.
     */
    public List<RecoveryScenario> fromForecast(LossCutForecast forecast) {
        double required = forecast.getRequiredRecoveryAmount();
        if (required <= 0) {
            return List.of();
        }
        Urgency urgency = Urgency.fromRiskLevel(forecast.getRiskLevel());
        List<RecoveryScenario> scenarios = new ArrayList<>(List.of(
                RecoveryScenario.builder()
                        .type(RecoveryType.DEPOSIT)
                        .description("Restore the margin level with an additional deposit")
                        .requiredAmount(required)
                        .impactPercent(100)
                        .urgency(urgency)
                        .feasibility(0.8)
                        .instructions(List.of(
                                String.format("Deposit %.0f", required),
                                "Check the margin level once credited",
                                "Review open positions"))
                        .build(),
                RecoveryScenario.builder()
                        .type(RecoveryType.POSITION_REDUCTION)
                        .description("Partially close losing positions")
                        .requiredAmount(required * 0.5)
                        .impactPercent(60)
                        .urgency(urgency)
                        .feasibility(0.9)
                        .instructions(List.of(
                                "Identify the position with the largest loss",
                                "Close 50% of its lots",
                                "Confirm the margin level improved"))
                        .build(),
                RecoveryScenario.builder()
                        .type(RecoveryType.PROFIT_TAKING)
                        .description("Close profitable positions")
                        .requiredAmount(0.0)
                        .impactPercent(40)
                        .urgency(Urgency.MEDIUM)
                        .feasibility(0.7)
                        .instructions(List.of(
                                "Review profitable positions",
                                "Take partial profit",
                                "Confirm free margin increased"))
                        .build(),
                RecoveryScenario.builder()
                        .type(RecoveryType.CROSS_ACCOUNT)
                        .description("Transfer funds from another account")
                        .requiredAmount(required)
                        .impactPercent(80)
                        .urgency(urgency)
                        .feasibility(0.6)
                        .instructions(List.of(
                                "Check spare funds on other accounts",
                                "Execute the transfer",
                                "Check the margin level after settlement"))
                        .build()));
        scenarios.sort(Comparator.comparingDouble(
                (RecoveryScenario s) -> s.getFeasibility() * s.getUrgency().rank()).reversed());
        return scenarios;
    }

    private static double levelAfter(double usedMargin, double equity) {
        return usedMargin > 0 ? equity / usedMargin * 100.0 : UNDEFINED_LEVEL;
    }

    private static double impactPercentage(double currentLevel, double newLevel, double targetLevel) {
        if (currentLevel >= targetLevel) {
            return 0.0;
        }
        double improvement = newLevel - currentLevel;
        double required = targetLevel - currentLevel;
        return Math.min(100.0, improvement / required * 100.0);
    }

    private static String label(AccountState account) {
        return account.getBroker() != null && !account.getBroker().isBlank()
                ? account.getBroker() + "/" + account.getAccountId()
                : account.getAccountId();
    }
}
