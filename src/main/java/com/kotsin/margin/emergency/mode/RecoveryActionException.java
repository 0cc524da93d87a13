package com.kotsin.margin.emergency.mode;

/**
 * Thrown for a recovery action id that does not exist or has already run.
 */
public class RecoveryActionException extends RuntimeException {

    public RecoveryActionException(String message) {
        super(message);
    }
}
