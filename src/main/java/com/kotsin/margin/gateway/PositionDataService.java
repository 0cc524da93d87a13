package com.kotsin.margin.gateway;

import com.kotsin.margin.model.Position;

import java.util.List;

/**
 * Boundary to the service that owns open positions.
 */
public interface PositionDataService {

    List<Position> openPositions(String accountId);
}
