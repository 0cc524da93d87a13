package com.kotsin.margin.emergency;

public enum ResponseStatus {
    EXECUTING,
    COMPLETED,
    FAILED,
    TIMEOUT;

    public boolean isTerminal() {
        return this != EXECUTING;
    }
}
