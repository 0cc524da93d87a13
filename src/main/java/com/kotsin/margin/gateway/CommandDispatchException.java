package com.kotsin.margin.gateway;

/**
 * Wraps any failure to hand an emergency command to the execution side.
 */
public class CommandDispatchException extends RuntimeException {

    public CommandDispatchException(String message) {
        super(message);
    }

    public CommandDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
