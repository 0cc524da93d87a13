package com.kotsin.margin.consumer;

import com.kotsin.margin.model.AccountMarginInfo;
import com.kotsin.margin.monitoring.MarginGuardEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Consumes account margin snapshots pushed by the trading terminals.
 *
 * Topic: margin-telemetry (JSON {@link AccountMarginInfo}, keyed by account id)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarginTelemetryConsumer {

    private final MarginGuardEngine engine;

    @KafkaListener(
            topics = "${kafka.topics.margin-telemetry:margin-telemetry}",
            containerFactory = "marginTelemetryKafkaListenerContainerFactory",
            errorHandler = "telemetryErrorHandler"
    )
    public void onMarginTelemetry(AccountMarginInfo info, ConsumerRecord<?, ?> rec) {
        if (info == null) {
            // ErrorHandlingDeserializer hands over a null value for undecodable payloads
            log.warn("[TELEMETRY] Undecodable record topic={} partition={} offset={} key={}",
                    rec.topic(), rec.partition(), rec.offset(), rec.key());
            return;
        }
        log.debug("[TELEMETRY] account={} broker={} marginLevel={} offset={}",
                info.getAccountId(), info.getBroker(), info.getMarginLevel(), rec.offset());
        engine.onTelemetry(info);
    }
}
