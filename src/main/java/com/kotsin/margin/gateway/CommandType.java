package com.kotsin.margin.gateway;

public enum CommandType {
    CLOSE_POSITIONS,
    REDUCE_POSITIONS,
    OPEN_HEDGE,
    TRANSFER_BALANCE
}
