package com.kotsin.margin.model;

public enum PositionSide {
    BUY,
    SELL;

    public PositionSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
