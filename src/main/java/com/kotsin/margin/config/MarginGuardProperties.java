package com.kotsin.margin.config;

import com.kotsin.margin.emergency.mode.EmergencyLevel;
import com.kotsin.margin.emergency.mode.OperationType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.kotsin.margin.emergency.mode.OperationType.*;

/**
 * All tunables of the margin guard, bound from {@code margin-guard.*}.
 * Defaults match the production configuration so components can be built without Spring.
 */
@Data
@ConfigurationProperties(prefix = "margin-guard")
public class MarginGuardProperties {

    private Monitor monitor = new Monitor();
    private Forecast forecast = new Forecast();
    private Emergency emergency = new Emergency();
    private EmergencyMode emergencyMode = new EmergencyMode();
    private LossMinimization lossMinimization = new LossMinimization();

    @Data
    public static class Monitor {
        private boolean enabled = true;
        private long pollingIntervalMs = 1000;
        private boolean autoMonitorNewAccounts = true;
        private long telemetryStaleAfterMs = 60_000;
        private Thresholds thresholds = new Thresholds();
        private double defaultLossCutLevel = 20.0;
        private Map<String, Double> lossCutLevels = new HashMap<>();

        public double lossCutLevelFor(String broker) {
            if (broker == null || broker.isBlank()) {
                return defaultLossCutLevel;
            }
            return lossCutLevels.getOrDefault(broker.toLowerCase(Locale.ROOT), defaultLossCutLevel);
        }
    }

    @Data
    public static class Thresholds {
        private double warning = 200.0;
        private double danger = 150.0;
        private double critical = 100.0;
    }

    @Data
    public static class Forecast {
        private int minDataPoints = 5;
        private int volatilityWindow = 10;
        private double confidenceThreshold = 0.7;
        private double trendSensitivity = 0.1;
        private long updateIntervalMs = 30_000;
        private long retentionMinutes = 120;
        private double targetMarginLevel = 200.0;
    }

    @Data
    public static class Emergency {
        private long effectMeasurementDelayMs = 30_000;
        private long commandTimeoutMs = 5_000;
        private long responseCooldownMs = 60_000;
        private int responseThreads = 4;
    }

    @Data
    public static class EmergencyMode {
        private boolean autoRecoveryEnabled = true;
        private long autoRecoveryTimeoutMs = 3_600_000;
        private long autoDeactivationDelayMs = 5_000;
        private Map<EmergencyLevel, List<OperationType>> suspendedOperationsByLevel = defaultSuspensions();

        public List<OperationType> suspendedFor(EmergencyLevel level) {
            return suspendedOperationsByLevel.getOrDefault(level, List.of());
        }

        private static Map<EmergencyLevel, List<OperationType>> defaultSuspensions() {
            Map<EmergencyLevel, List<OperationType>> map = new EnumMap<>(EmergencyLevel.class);
            map.put(EmergencyLevel.LOW, new ArrayList<>(List.of(BULK_OPERATIONS)));
            map.put(EmergencyLevel.MEDIUM, new ArrayList<>(List.of(AUTO_TRADING, BULK_OPERATIONS)));
            map.put(EmergencyLevel.HIGH, new ArrayList<>(List.of(
                    AUTO_TRADING, NEW_POSITIONS, BULK_OPERATIONS, ACCOUNT_SWITCHING)));
            map.put(EmergencyLevel.CRITICAL, new ArrayList<>(List.of(
                    AUTO_TRADING, NEW_POSITIONS, POSITION_MODIFICATIONS, BULK_OPERATIONS,
                    ACCOUNT_SWITCHING, API_INTEGRATIONS)));
            return map;
        }
    }

    @Data
    public static class LossMinimization {
        private double maxLossPercentage = 10.0;
        private boolean preferPartialClose = true;
        private boolean enableHedging = true;
        private double hedgeRatio = 0.5;
        private boolean prioritizeMarginEfficiency = true;
        private double hedgeExpectedOffset = 100.0;
        private double targetMarginLevel = 150.0;
    }

    /**
     * Collects every invalid setting; an empty list means the configuration is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (monitor.getPollingIntervalMs() <= 0) {
            errors.add(String.format("Invalid monitor.polling-interval-ms: %d (must be > 0)", monitor.getPollingIntervalMs()));
        }
        Thresholds t = monitor.getThresholds();
        if (!(t.getWarning() > t.getDanger() && t.getDanger() > t.getCritical() && t.getCritical() > 0)) {
            errors.add(String.format("Invalid thresholds: warning=%.1f danger=%.1f critical=%.1f (must be strictly descending and > 0)",
                    t.getWarning(), t.getDanger(), t.getCritical()));
        }
        if (monitor.getDefaultLossCutLevel() < 0) {
            errors.add(String.format("Invalid monitor.default-loss-cut-level: %.1f", monitor.getDefaultLossCutLevel()));
        }
        if (forecast.getMinDataPoints() < 2) {
            errors.add(String.format("Invalid forecast.min-data-points: %d (must be >= 2)", forecast.getMinDataPoints()));
        }
        if (forecast.getConfidenceThreshold() < 0 || forecast.getConfidenceThreshold() > 1) {
            errors.add(String.format("Invalid forecast.confidence-threshold: %.2f (must be between 0 and 1)", forecast.getConfidenceThreshold()));
        }
        if (forecast.getUpdateIntervalMs() <= 0) {
            errors.add(String.format("Invalid forecast.update-interval-ms: %d", forecast.getUpdateIntervalMs()));
        }
        if (emergency.getResponseThreads() < 1) {
            errors.add(String.format("Invalid emergency.response-threads: %d (must be >= 1)", emergency.getResponseThreads()));
        }
        if (lossMinimization.getHedgeRatio() < 0 || lossMinimization.getHedgeRatio() > 1) {
            errors.add(String.format("Invalid loss-minimization.hedge-ratio: %.2f (must be between 0 and 1)", lossMinimization.getHedgeRatio()));
        }
        if (lossMinimization.getTargetMarginLevel() <= 0) {
            errors.add(String.format("Invalid loss-minimization.target-margin-level: %.1f", lossMinimization.getTargetMarginLevel()));
        }
        return errors;
    }
}
