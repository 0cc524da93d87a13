package com.kotsin.margin.emergency;

public enum EmergencyActionType {
    IMMEDIATE_CLOSE,
    PARTIAL_CLOSE,
    HEDGE_OPEN,
    BALANCE_TRANSFER
}
