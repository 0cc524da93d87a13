package com.kotsin.margin.optimizer;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.model.Position;
import com.kotsin.margin.model.PositionSide;
import com.kotsin.margin.model.RiskMonitoringState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Works out which positions to close, shrink or hedge so an account gets back to a target margin
 * level while giving up as little as possible.
 *
 * <p>Exactly one policy applies per call, chosen by how much margin has to be released.</p>
 */
@Component
@Slf4j
public class LossMinimizer {

    public static final double DEFAULT_TARGET_LEVEL = 150.0;

    static final double CLOSE_WORST_TRIGGER = 0.3;
    static final double WORST_SHARE = 0.4;
    static final double MAX_REDUCTION_SHARE = 0.75;
    static final double MIN_REDUCTION_PERCENT = 10.0;
    static final double MIN_LOTS = 0.01;
    static final double CLOSED_LOSS_AVOIDED = 0.9;
    static final double REDUCED_LOSS_AVOIDED = 0.8;

    private final MarginGuardProperties.LossMinimization config;

    public LossMinimizer(MarginGuardProperties properties) {
        this.config = properties.getLossMinimization();
    }

    public MinimizationResult calculateOptimalMinimization(List<Position> positions, RiskMonitoringState riskState) {
        return calculateOptimalMinimization(positions, riskState, config.getTargetMarginLevel());
    }

    public MinimizationResult calculateOptimalMinimization(List<Position> positions, RiskMonitoringState riskState,
                                                           double targetLevel) {
        double required = requiredMarginReduction(riskState.getMarginLevel(), riskState.getEquity(),
                riskState.getUsedMargin(), targetLevel);

        List<String> toClose = new ArrayList<>();
        List<PositionReduction> toReduce = new ArrayList<>();
        List<HedgeOrder> hedges = new ArrayList<>();
        MinimizationPolicy policy;

        if (required > riskState.getUsedMargin() * CLOSE_WORST_TRIGGER) {
            policy = MinimizationPolicy.CLOSE_WORST;
            selectWorstPositions(positions, WORST_SHARE).forEach(p -> toClose.add(p.getId()));
        } else if (config.isPreferPartialClose()) {
            policy = MinimizationPolicy.PARTIAL_REDUCTION;
            toReduce.addAll(calculatePartialReduction(positions, required));
            if (config.isEnableHedging()) {
                hedges.addAll(calculateOptimalHedges(positions, config.getHedgeRatio()));
            }
        } else {
            policy = MinimizationPolicy.PROFIT_AND_LOSS_CLEANUP;
            List<Position> winners = positions.stream().filter(p -> p.getProfit() > 0).collect(Collectors.toList());
            List<Position> losers = positions.stream().filter(p -> p.getProfit() < 0).collect(Collectors.toList());
            selectProfitableForClose(winners).forEach(p -> toClose.add(p.getId()));
            selectLosingForClose(losers, required).forEach(p -> toClose.add(p.getId()));
        }

        Map<String, Position> byId = positions.stream()
                .collect(Collectors.toMap(Position::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        MinimizationResult result = MinimizationResult.builder()
                .policy(policy)
                .requiredMarginReduction(required)
                .positionsToClose(List.copyOf(toClose))
                .positionsToReduce(List.copyOf(toReduce))
                .hedgePositions(List.copyOf(hedges))
                .expectedLossReduction(expectedLossReduction(byId, toClose, toReduce, hedges))
                .expectedMarginImprovement(marginImprovement(byId, toClose, toReduce))
                .confidence(confidence(positions, required))
                .build();

        log.info("[LOSS-MIN] account={} policy={} required={} close={} reduce={} hedges={} lossReduction={} confidence={}",
                riskState.getAccountId(), policy, fmt(required), toClose.size(), toReduce.size(), hedges.size(),
                fmt(result.getExpectedLossReduction()), fmt(result.getConfidence()));
        return result;
    }

    /**
     * Margin to release so that {@code equity / usedMargin} reaches {@code targetLevel}; zero when
     * the account is already there.
     */
    public static double requiredMarginReduction(double marginLevel, double equity, double usedMargin, double targetLevel) {
        if (marginLevel >= targetLevel) {
            return 0.0;
        }
        double allowedMargin = equity / (targetLevel / 100.0);
        return Math.max(0.0, usedMargin - allowedMargin);
    }

    /**
     * The worst {@code share} of losing positions by loss, at least one when any position loses.
     * Profitable positions are never selected.
     */
    public List<Position> selectWorstPositions(List<Position> positions, double share) {
        List<Position> losers = positions.stream()
                .filter(p -> p.getProfit() < 0)
                .sorted(Comparator.comparingDouble(Position::getProfit))
                .collect(Collectors.toList());
        if (losers.isEmpty()) {
            return List.of();
        }
        int count = Math.max(1, (int) Math.floor(losers.size() * share));
        return losers.subList(0, Math.min(count, losers.size()));
    }

    List<PositionReduction> calculatePartialReduction(List<Position> positions, double requiredReduction) {
        List<Position> inefficient = positions.stream()
                .filter(p -> p.getMarginRequired() > 0 && p.profitPerMargin() < 0)
                .sorted(Comparator.comparingDouble(Position::profitPerMargin))
                .collect(Collectors.toList());

        List<PositionReduction> reductions = new ArrayList<>();
        double remaining = requiredReduction;
        for (Position position : inefficient) {
            if (remaining <= 0) {
                break;
            }
            double amount = Math.min(remaining, position.getMarginRequired() * MAX_REDUCTION_SHARE);
            double percentage = amount / position.getMarginRequired() * 100.0;
            // smaller cuts do not move the margin level enough to be worth the order
            if (percentage >= MIN_REDUCTION_PERCENT) {
                reductions.add(new PositionReduction(position.getId(), (int) Math.round(percentage)));
                remaining -= amount;
            }
        }
        return reductions;
    }

    /**
     * One opposite-side order per symbol whose net exposure is at least 0.01 lot, sized at
     * {@code hedgeRatio} of that exposure and rounded to 0.01 lot.
     */
    public List<HedgeOrder> calculateOptimalHedges(List<Position> positions, double hedgeRatio) {
        Map<String, Double> netLots = new LinkedHashMap<>();
        for (Position position : positions) {
            double signed = position.getSide() == PositionSide.SELL ? -position.getLots() : position.getLots();
            netLots.merge(position.getSymbol(), signed, Double::sum);
        }
        List<HedgeOrder> hedges = new ArrayList<>();
        for (Map.Entry<String, Double> entry : netLots.entrySet()) {
            double net = entry.getValue();
            if (Math.abs(net) < MIN_LOTS) {
                continue;
            }
            double lots = BigDecimal.valueOf(Math.abs(net) * hedgeRatio).setScale(2, RoundingMode.HALF_UP).doubleValue();
            if (lots >= MIN_LOTS) {
                PositionSide exposure = net >= 0 ? PositionSide.BUY : PositionSide.SELL;
                hedges.add(new HedgeOrder(entry.getKey(), exposure.opposite(), lots));
            }
        }
        return hedges;
    }

    List<Position> selectProfitableForClose(List<Position> winners) {
        int limit = Math.max(1, (int) Math.floor(winners.size() * 0.3));
        return winners.stream()
                .filter(p -> p.getProfit() > p.getMarginRequired() * 0.05)
                .sorted(Comparator.comparingDouble(Position::profitPerMargin).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    List<Position> selectLosingForClose(List<Position> losers, double requiredReduction) {
        List<Position> candidates = losers.stream()
                .filter(p -> Math.abs(p.getProfit()) > p.getMarginRequired() * 0.1)
                .sorted(Comparator.comparingDouble(Position::getProfit))
                .collect(Collectors.toList());
        List<Position> selected = new ArrayList<>();
        double released = 0;
        for (Position position : candidates) {
            if (released >= requiredReduction) {
                break;
            }
            selected.add(position);
            released += position.getMarginRequired();
        }
        return selected;
    }

    private double expectedLossReduction(Map<String, Position> byId, List<String> toClose,
                                         List<PositionReduction> toReduce, List<HedgeOrder> hedges) {
        double reduction = 0;
        for (String id : toClose) {
            Position p = byId.get(id);
            if (p != null && p.getProfit() < 0) {
                reduction += Math.abs(p.getProfit()) * CLOSED_LOSS_AVOIDED;
            }
        }
        for (PositionReduction r : toReduce) {
            Position p = byId.get(r.positionId());
            if (p != null && p.getProfit() < 0) {
                reduction += Math.abs(p.getProfit()) * (r.reductionPercentage() / 100.0) * REDUCED_LOSS_AVOIDED;
            }
        }
        reduction += hedges.size() * config.getHedgeExpectedOffset();
        return reduction;
    }

    private static double marginImprovement(Map<String, Position> byId, List<String> toClose,
                                            List<PositionReduction> toReduce) {
        double improvement = 0;
        for (String id : toClose) {
            Position p = byId.get(id);
            if (p != null) {
                improvement += p.getMarginRequired();
            }
        }
        for (PositionReduction r : toReduce) {
            Position p = byId.get(r.positionId());
            if (p != null) {
                improvement += p.getMarginRequired() * (r.reductionPercentage() / 100.0);
            }
        }
        return improvement;
    }

    /**
     * Starts at 0.7; small books, healthy profit/loss balance and a modest required cut raise it,
     * the opposites lower it. Clamped to [0.1, 0.95].
     */
    double confidence(List<Position> positions, double requiredReduction) {
        double confidence = 0.7;

        if (positions.size() < 5) confidence += 0.1;
        else if (positions.size() > 20) confidence -= 0.1;

        double totalProfit = 0;
        double totalLoss = 0;
        double totalMargin = 0;
        for (Position p : positions) {
            if (p.getProfit() > 0) totalProfit += p.getProfit();
            if (p.getProfit() < 0) totalLoss += Math.abs(p.getProfit());
            totalMargin += p.getMarginRequired();
        }
        if (totalProfit > 0 || totalLoss > 0) {
            double ratio = totalLoss > 0 ? totalProfit / totalLoss : Double.POSITIVE_INFINITY;
            if (ratio > 1.5) confidence += 0.1;
            else if (ratio < 0.5) confidence -= 0.1;
        }
        if (totalMargin > 0) {
            double reductionRatio = requiredReduction / totalMargin;
            if (reductionRatio < 0.2) confidence += 0.1;
            else if (reductionRatio > 0.6) confidence -= 0.2;
        }
        return Math.max(0.1, Math.min(0.95, confidence));
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }
}
