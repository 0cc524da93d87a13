package com.kotsin.margin.emergency.mode;

public enum RecoveryResult {
    SUCCESS,
    FAILED,
    SKIPPED
}
