package com.kotsin.margin.gateway;

import com.kotsin.margin.optimizer.HedgeOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Wire format of a command sent to the order-routing side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyCommand {
    private String commandId;
    private String accountId;
    private CommandType type;

    private List<String> positionIds;
    private Double percentage;
    private List<HedgeOrder> hedges;
    private Double amount;

    private String reason;
    private Instant issuedAt;
}
