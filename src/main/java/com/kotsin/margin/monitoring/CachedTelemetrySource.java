package com.kotsin.margin.monitoring;

import com.github.benmanes.caffeine.cache.Cache;
import com.kotsin.margin.model.AccountMarginInfo;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Latest pushed telemetry per account. Entries expire when the feed goes quiet, so polling
 * stops producing samples instead of replaying stale data.
 */
@Component
public class CachedTelemetrySource implements MarginTelemetrySource {

    private final Cache<String, AccountMarginInfo> cache;

    public CachedTelemetrySource(@Qualifier("latestTelemetryCache") Cache<String, AccountMarginInfo> cache) {
        this.cache = cache;
    }

    public void update(AccountMarginInfo info) {
        cache.put(info.getAccountId(), info);
    }

    @Override
    public Optional<AccountMarginInfo> latest(String accountId) {
        return Optional.ofNullable(cache.getIfPresent(accountId));
    }

    public void evict(String accountId) {
        cache.invalidate(accountId);
    }
}
