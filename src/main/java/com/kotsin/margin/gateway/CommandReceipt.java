package com.kotsin.margin.gateway;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CommandReceipt {
    String commandId;
    boolean accepted;
    String message;
    long latencyMs;

    public static CommandReceipt accepted(String commandId, String message, long latencyMs) {
        return new CommandReceipt(commandId, true, message, latencyMs);
    }

    public static CommandReceipt rejected(String commandId, String message, long latencyMs) {
        return new CommandReceipt(commandId, false, message, latencyMs);
    }
}
