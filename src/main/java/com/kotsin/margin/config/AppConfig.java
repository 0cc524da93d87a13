package com.kotsin.margin.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kotsin.margin.model.AccountMarginInfo;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(MarginGuardProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The engine thread. Every timer (polling, forecast refresh, auto recovery) and every
     * state mutation runs here, which serializes per-account updates.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService riskEngineScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "margin-guard-engine");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs emergency action sequences, whose gateway calls wait on broker acknowledgements.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService emergencyResponseExecutor(MarginGuardProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getEmergency().getResponseThreads(), r -> {
            Thread t = new Thread(r, "margin-guard-emergency-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Latest telemetry per account; entries expire so a silent feed stops producing samples.
     */
    @Bean
    public Cache<String, AccountMarginInfo> latestTelemetryCache(MarginGuardProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(properties.getMonitor().getTelemetryStaleAfterMs()))
                .maximumSize(10_000)
                .build();
    }

    @Bean
    public Cache<String, Boolean> riskEventCooldownCache(
            @Value("${kafka.risk-events.cooldown-ms:60000}") long cooldownMs) {
        return Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(cooldownMs))
                .maximumSize(100_000)
                .build();
    }
}
