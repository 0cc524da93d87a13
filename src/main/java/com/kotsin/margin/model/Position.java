package com.kotsin.margin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Open position as supplied by the position data service.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {
    private String id;
    private String accountId;
    private String symbol;
    private PositionSide side;
    private double lots;
    private double openPrice;
    private double currentPrice;
    private double profit;
    private double marginRequired;

    public boolean isLosing() {
        return profit < 0;
    }

    /**
     * Profit earned per unit of margin tied up; zero when the position holds no margin.
     */
    public double profitPerMargin() {
        return marginRequired > 0 ? profit / marginRequired : 0.0;
    }
}
