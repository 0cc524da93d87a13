package com.kotsin.margin.emergency.mode;

/**
 * Operations other components must clear with {@link EmergencyModeManager#isOperationAllowed}
 * before running them.
 */
public enum OperationType {
    AUTO_TRADING,
    NEW_POSITIONS,
    POSITION_MODIFICATIONS,
    ACCOUNT_SWITCHING,
    BULK_OPERATIONS,
    API_INTEGRATIONS,
    NOTIFICATION_SENDING,
    DATA_SYNC,
    MONITORING,
    MANUAL_TRADING
}
