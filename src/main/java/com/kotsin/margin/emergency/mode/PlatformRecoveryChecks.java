package com.kotsin.margin.emergency.mode;

import com.kotsin.margin.gateway.EmergencyCommandGateway;
import com.kotsin.margin.gateway.PositionDataService;
import com.kotsin.margin.model.Position;
import com.kotsin.margin.model.RiskLevel;
import com.kotsin.margin.model.RiskMonitoringState;
import com.kotsin.margin.monitoring.MonitoringStatus;
import com.kotsin.margin.monitoring.RiskStateManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

/**
 * Recovery checks backed by the live platform state.
 */
@Configuration
public class PlatformRecoveryChecks {

    @Bean
    public RecoveryCheck positionValidationCheck(PositionDataService positionDataService) {
        return new RecoveryCheck() {
            @Override
            public RecoveryActionType type() {
                return RecoveryActionType.POSITION_VALIDATION;
            }

            @Override
            public Optional<String> verify(EmergencyModeState state) {
                for (String accountId : state.getAffectedAccounts()) {
                    for (Position p : positionDataService.openPositions(accountId)) {
                        if (p.getId() == null || p.getSymbol() == null || p.getSide() == null) {
                            return Optional.of("Incomplete position on account " + accountId);
                        }
                        if (!(p.getLots() > 0) || p.getMarginRequired() < 0 || !Double.isFinite(p.getProfit())) {
                            return Optional.of("Invalid position " + p.getId() + " on account " + accountId);
                        }
                    }
                }
                return Optional.empty();
            }
        };
    }

    @Bean
    public RecoveryCheck marginLevelCheck(RiskStateManager riskStateManager) {
        return new RecoveryCheck() {
            @Override
            public RecoveryActionType type() {
                return RecoveryActionType.MARGIN_CHECK;
            }

            @Override
            public Optional<String> verify(EmergencyModeState state) {
                for (String accountId : state.getAffectedAccounts()) {
                    Optional<RiskMonitoringState> risk = riskStateManager.getRiskState(accountId);
                    if (risk.isEmpty()) {
                        return Optional.of("No margin data for account " + accountId);
                    }
                    if (risk.get().getRiskLevel() == RiskLevel.CRITICAL) {
                        return Optional.of(String.format("Account %s still critical at %.2f%%",
                                accountId, risk.get().getMarginLevel()));
                    }
                }
                return Optional.empty();
            }
        };
    }

    @Bean
    public RecoveryCheck systemHealthCheck(RiskStateManager riskStateManager) {
        return new RecoveryCheck() {
            @Override
            public RecoveryActionType type() {
                return RecoveryActionType.SYSTEM_HEALTH;
            }

            @Override
            public Optional<String> verify(EmergencyModeState state) {
                MonitoringStatus status = riskStateManager.getMonitoringStatus();
                return status.getErrors().isEmpty()
                        ? Optional.empty()
                        : Optional.of(String.join("; ", status.getErrors()));
            }
        };
    }

    @Bean
    public RecoveryCheck connectivityCheck(EmergencyCommandGateway gateway) {
        return new RecoveryCheck() {
            @Override
            public RecoveryActionType type() {
                return RecoveryActionType.CONNECTIVITY_TEST;
            }

            @Override
            public Optional<String> verify(EmergencyModeState state) {
                return gateway.isAvailable() ? Optional.empty() : Optional.of("Command gateway unavailable");
            }
        };
    }
}
