package com.kotsin.margin.optimizer;

import com.kotsin.margin.model.PositionSide;

public record HedgeOrder(String symbol, PositionSide side, double lots) {
}
