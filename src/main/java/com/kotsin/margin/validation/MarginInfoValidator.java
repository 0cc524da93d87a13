package com.kotsin.margin.validation;

import com.kotsin.margin.model.AccountMarginInfo;
import org.springframework.stereotype.Component;

/**
 * Schema checks for incoming margin telemetry. Invalid records are rejected, never defaulted.
 * Logging the verdict is left to the caller.
 */
@Component
public class MarginInfoValidator {

    static final double LEVEL_TOLERANCE_SHARE = 0.05;

    public TelemetryCheck validate(AccountMarginInfo info) {
        if (info == null) {
            return TelemetryCheck.builder().reject("telemetry", "is null").build();
        }
        TelemetryCheck.TelemetryCheckBuilder check = TelemetryCheck.builder().accountId(info.getAccountId());

        if (info.getAccountId() == null || info.getAccountId().isBlank()) {
            check.reject("accountId", "is required");
        }

        requireFinite(check, "balance", info.getBalance());
        requireNonNegative(check, "equity", info.getEquity());
        requireFinite(check, "freeMargin", info.getFreeMargin());
        requireNonNegative(check, "usedMargin", info.getUsedMargin());
        requireNonNegative(check, "marginLevel", info.getMarginLevel());
        requireFinite(check, "bonusAmount", info.getBonusAmount());

        if (info.getLastUpdate() == null) {
            check.advisory("lastUpdate missing, receive time will be used");
        }
        if (info.getUsedMargin() > 0 && info.getMarginLevel() > 0) {
            double computed = info.getEquity() / info.getUsedMargin() * 100.0;
            if (Math.abs(computed - info.getMarginLevel()) > Math.max(1.0, computed * LEVEL_TOLERANCE_SHARE)) {
                check.advisory(String.format("marginLevel %.1f%% disagrees with equity/usedMargin %.1f%%",
                        info.getMarginLevel(), computed));
            }
        }
        return check.build();
    }

    private static boolean requireFinite(TelemetryCheck.TelemetryCheckBuilder check, String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            check.reject(field, "must be a finite number");
            return false;
        }
        return true;
    }

    private static void requireNonNegative(TelemetryCheck.TelemetryCheckBuilder check, String field, double value) {
        if (requireFinite(check, field, value) && value < 0) {
            check.reject(field, String.format("must be >= 0 (got %.2f)", value));
        }
    }
}
