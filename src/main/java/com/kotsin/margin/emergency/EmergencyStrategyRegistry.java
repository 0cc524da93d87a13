package com.kotsin.margin.emergency;

import com.kotsin.margin.model.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import static com.kotsin.margin.emergency.EmergencyAction.hedge;
import static com.kotsin.margin.emergency.EmergencyAction.immediateClose;
import static com.kotsin.margin.emergency.EmergencyAction.partialClose;
import static com.kotsin.margin.emergency.EmergencyAction.transfer;

/**
 * Static strategy templates keyed by {@code scenario_riskLevel}, plus a generator that sizes a
 * strategy from live account figures.
 */
@Component
@Slf4j
public class EmergencyStrategyRegistry {

    private final Map<String, StrategyTemplate> templates = new LinkedHashMap<>();
    private final Map<String, EmergencyStrategy> byKey = new LinkedHashMap<>();

    public EmergencyStrategyRegistry() {
        registerTemplates();
        registerKeys();
    }

    // ======================== SELECTION ========================

    /**
     * Dynamic parameters win; otherwise the {@code scenario_riskLevel} entry; otherwise the
     * built-in single-account critical strategy.
     */
    public EmergencyStrategy select(ScenarioType scenarioType, RiskLevel riskLevel, DynamicStrategyParameters params) {
        if (params != null) {
            return generateDynamicStrategy(params);
        }
        EmergencyStrategy strategy = byKey.get(key(scenarioType, riskLevel));
        if (strategy != null) {
            return strategy;
        }
        log.warn("[STRATEGY] No strategy for {}, using default", key(scenarioType, riskLevel));
        return defaultStrategy();
    }

    public StrategyTemplate template(String id) {
        StrategyTemplate template = templates.get(id);
        if (template == null) {
            throw new StrategyNotFoundException("Strategy template not found: " + id);
        }
        return template;
    }

    public Collection<StrategyTemplate> allTemplates() {
        return List.copyOf(templates.values());
    }

    static String key(ScenarioType scenarioType, RiskLevel riskLevel) {
        return scenarioType.key() + "_" + riskLevel.name().toLowerCase(Locale.ROOT);
    }

    // ======================== DYNAMIC ========================

    public EmergencyStrategy generateDynamicStrategy(DynamicStrategyParameters params) {
        int score = riskScore(params);
        double balance = Math.max(0.0, params.getBalance());
        List<EmergencyAction> actions = new ArrayList<>();
        long maxExecutionTimeMs;
        double target;

        if (score >= 9) {
            actions.add(immediateClose(10, 100, balance * 0.1));
            maxExecutionTimeMs = 15_000;
            target = 80;
        } else if (score >= 7) {
            actions.add(partialClose(9, 80, balance * 0.08));
            actions.add(hedge(7, 0.7, balance * 0.05));
            maxExecutionTimeMs = 25_000;
            target = 100;
        } else if (score >= 5) {
            actions.add(hedge(8, 0.5, balance * 0.03));
            actions.add(partialClose(6, 40, balance * 0.04));
            maxExecutionTimeMs = 45_000;
            target = 150;
        } else {
            actions.add(hedge(7, 0.3, balance * 0.02));
            maxExecutionTimeMs = 60_000;
            target = 200;
        }

        ScenarioType scenario = params.getScenarioType() != null ? params.getScenarioType() : ScenarioType.SINGLE_ACCOUNT;
        if (scenario == ScenarioType.MULTI_ACCOUNT && params.getFreeMargin() < params.getUsedMargin() * 0.2) {
            actions.add(transfer(5, params.getUsedMargin() * 0.3));
        }
        actions.sort(Comparator.comparingInt(EmergencyAction::getPriority).reversed());

        log.info("[STRATEGY] Dynamic strategy riskScore={} scenario={} actions={}",
                score, scenario, actions.stream().map(a -> a.getType().name()).collect(Collectors.joining(",")));
        return EmergencyStrategy.builder()
                .name("dynamic_" + score)
                .scenarioType(scenario)
                .actions(List.copyOf(actions))
                .maxExecutionTimeMs(maxExecutionTimeMs)
                .successCriteria(SuccessCriteria.builder()
                        .marginLevelTarget(target)
                        .maxAcceptableLoss(balance * 0.1)
                        .timeoutMinutes(maxExecutionTimeMs / 60_000.0)
                        .build())
                .build();
    }

    /**
     * 0 to 10 from margin level, loss-to-balance ratio, book size and free-margin ratio.
     */
    public int riskScore(DynamicStrategyParameters params) {
        int score = 0;

        double level = params.getMarginLevel();
        if (level < 50) score += 4;
        else if (level < 100) score += 3;
        else if (level < 150) score += 2;
        else if (level < 200) score += 1;

        if (params.getBalance() > 0) {
            double lossRatio = Math.abs(params.getUnrealizedPL()) / params.getBalance();
            if (lossRatio > 0.1) score += 3;
            else if (lossRatio > 0.05) score += 2;
            else if (lossRatio > 0.02) score += 1;
        }

        int positions = params.getPositions() != null ? params.getPositions().size() : 0;
        if (positions > 20) score += 2;
        else if (positions > 10) score += 1;

        if (params.getUsedMargin() > 0) {
            double freeRatio = params.getFreeMargin() / params.getUsedMargin();
            if (freeRatio < 0.1) score += 2;
            else if (freeRatio < 0.2) score += 1;
        }

        return Math.min(score, 10);
    }

    // ======================== STATIC ========================

    static EmergencyStrategy defaultStrategy() {
        return EmergencyStrategy.builder()
                .name("default_single_critical")
                .scenarioType(ScenarioType.SINGLE_ACCOUNT)
                .actions(List.of(immediateClose(10, 100, 1000)))
                .maxExecutionTimeMs(30_000)
                .successCriteria(criteria(100, 1000, 0.5))
                .build();
    }

    private void registerTemplates() {
        addTemplate("single_critical", "Single account in critical state", EmergencyStrategy.builder()
                .name("single_critical")
                .scenarioType(ScenarioType.SINGLE_ACCOUNT)
                .actions(List.of(immediateClose(10, 100, 500), partialClose(8, 75, 300), hedge(6, 1.0, 200.0)))
                .maxExecutionTimeMs(30_000)
                .successCriteria(criteria(100, 1000, 0.5))
                .build());
        addTemplate("multi_account", "Several accounts at risk at once", EmergencyStrategy.builder()
                .name("multi_account")
                .scenarioType(ScenarioType.MULTI_ACCOUNT)
                .actions(List.of(transfer(10, 1000), hedge(9, 0.8, 500.0), partialClose(7, 50, 800)))
                .maxExecutionTimeMs(60_000)
                .successCriteria(criteria(150, 2000, 1.0))
                .build());
        addTemplate("correlated_positions", "Many correlated positions moving together", EmergencyStrategy.builder()
                .name("correlated_positions")
                .scenarioType(ScenarioType.CORRELATED_POSITIONS)
                .actions(List.of(hedge(10, 0.6, 400.0), partialClose(8, 40, 600), immediateClose(6, 100, 800)))
                .maxExecutionTimeMs(45_000)
                .successCriteria(criteria(120, 1500, 0.75))
                .build());
        addTemplate("preventive", "Early intervention before the account turns critical", EmergencyStrategy.builder()
                .name("preventive")
                .scenarioType(ScenarioType.SINGLE_ACCOUNT)
                .actions(List.of(hedge(9, 0.3, 150.0), partialClose(7, 20, 200), transfer(5, 500)))
                .maxExecutionTimeMs(90_000)
                .successCriteria(criteria(200, 500, 1.5))
                .build());
        addTemplate("high_frequency", "Fast-moving market, minimal steps", EmergencyStrategy.builder()
                .name("high_frequency")
                .scenarioType(ScenarioType.SINGLE_ACCOUNT)
                .actions(List.of(immediateClose(10, 100, 200), hedge(8, 0.5, 100.0)))
                .maxExecutionTimeMs(15_000)
                .successCriteria(criteria(80, 300, 0.25))
                .build());
    }

    private void registerKeys() {
        byKey.put("single_account_critical", EmergencyStrategy.builder()
                .name("single_account_critical")
                .scenarioType(ScenarioType.SINGLE_ACCOUNT)
                .actions(List.of(immediateClose(10, 100, 500), partialClose(8, 50, 300)))
                .maxExecutionTimeMs(30_000)
                .successCriteria(criteria(100, 1000, 0.5))
                .build());
        byKey.put("preventive_critical", EmergencyStrategy.builder()
                .name("preventive_critical")
                .scenarioType(ScenarioType.SINGLE_ACCOUNT)
                .actions(List.of(hedge(9, 0.5), partialClose(7, 25, 200)))
                .maxExecutionTimeMs(60_000)
                .successCriteria(criteria(150, 500, 1.0))
                .build());
        byKey.put("multi_account_critical", template("multi_account").getStrategy());
        byKey.put("correlated_positions_critical", template("correlated_positions").getStrategy());
        byKey.put("single_account_danger", template("preventive").getStrategy());
        byKey.put("single_account_warning", template("preventive").getStrategy());
    }

    /**
     * The strategy run when a margin level drops to the critical floor before any loss-cut
     * response has started.
     */
    public EmergencyStrategy preventiveCritical() {
        return byKey.get("preventive_critical");
    }

    private void addTemplate(String id, String description, EmergencyStrategy strategy) {
        templates.put(id, new StrategyTemplate(id, description, strategy));
    }

    private static SuccessCriteria criteria(double target, double maxAcceptableLoss, double timeoutMinutes) {
        return SuccessCriteria.builder()
                .marginLevelTarget(target)
                .maxAcceptableLoss(maxAcceptableLoss)
                .timeoutMinutes(timeoutMinutes)
                .build();
    }
}
