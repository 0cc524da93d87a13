package com.kotsin.margin.gateway;

import com.kotsin.margin.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest position snapshot per account, replaced wholesale by whoever feeds positions.
 */
@Component
@Slf4j
public class InMemoryPositionDataService implements PositionDataService {

    private final Map<String, List<Position>> positions = new ConcurrentHashMap<>();

    public void replacePositions(String accountId, List<Position> snapshot) {
        positions.put(accountId, List.copyOf(snapshot));
        log.debug("[POSITIONS] account={} positions={}", accountId, snapshot.size());
    }

    @Override
    public List<Position> openPositions(String accountId) {
        return positions.getOrDefault(accountId, List.of());
    }

    public void removeAccount(String accountId) {
        positions.remove(accountId);
    }
}
