package com.kotsin.margin.monitoring;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.model.MarginSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-account rolling buffer of margin samples used for forecasting.
 * Buffers are created on first record and torn down only through {@link #removeAccount}.
 */
@Component
@Slf4j
public class MarginSampleStore {

    private final ConcurrentHashMap<String, Deque<MarginSample>> buffers = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    public MarginSampleStore(MarginGuardProperties properties, Clock clock) {
        this.retention = Duration.ofMinutes(properties.getForecast().getRetentionMinutes());
        this.clock = clock;
    }

    public void record(String accountId, MarginSample sample) {
        Deque<MarginSample> buffer = buffers.computeIfAbsent(accountId, id -> {
            log.debug("[SAMPLE-STORE] Created buffer for {}", id);
            return new ArrayDeque<>();
        });
        Instant cutoff = clock.instant().minus(retention);
        synchronized (buffer) {
            buffer.addLast(sample);
            while (!buffer.isEmpty() && !buffer.peekFirst().getTimestamp().isAfter(cutoff)) {
                buffer.pollFirst();
            }
        }
    }

    /**
     * Samples for the account, oldest first. Empty for unknown accounts.
     */
    public List<MarginSample> samples(String accountId) {
        Deque<MarginSample> buffer = buffers.get(accountId);
        if (buffer == null) {
            return List.of();
        }
        synchronized (buffer) {
            return List.copyOf(buffer);
        }
    }

    public int size(String accountId) {
        Deque<MarginSample> buffer = buffers.get(accountId);
        if (buffer == null) {
            return 0;
        }
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public Set<String> accounts() {
        return Set.copyOf(buffers.keySet());
    }

    public void removeAccount(String accountId) {
        if (buffers.remove(accountId) != null) {
            log.debug("[SAMPLE-STORE] Removed buffer for {}", accountId);
        }
    }

    public void clear() {
        buffers.clear();
    }
}
