package com.kotsin.margin.event;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Forwards engine events to the notification layer over Kafka.
 * Repeated threshold events for the same account and band are held back for a cooldown.
 */
@Component
@Slf4j
public class RiskEventProducer implements RiskEventListener {

    private static final Set<RiskEngineEventType> THROTTLED = EnumSet.of(
            RiskEngineEventType.WARNING_THRESHOLD,
            RiskEngineEventType.DANGER_THRESHOLD,
            RiskEngineEventType.CRITICAL_THRESHOLD,
            RiskEngineEventType.RAPID_MARGIN_CHANGE);

    // high-volume events that only matter in-process
    private static final Set<RiskEngineEventType> LOCAL_ONLY = EnumSet.of(
            RiskEngineEventType.MARGIN_LEVEL_UPDATE,
            RiskEngineEventType.FORECAST_UPDATED);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Cache<String, Boolean> cooldown;
    private final String topic;

    public RiskEventProducer(KafkaTemplate<String, Object> kafkaTemplate,
                             @Qualifier("riskEventCooldownCache") Cache<String, Boolean> cooldown,
                             @Value("${kafka.topics.risk-events:risk-events}") String topic,
                             RiskEventDispatcher dispatcher) {
        this.kafkaTemplate = kafkaTemplate;
        this.cooldown = cooldown;
        this.topic = topic;
        dispatcher.register(this);
    }

    @Override
    public void onEvent(RiskEngineEvent event) {
        if (LOCAL_ONLY.contains(event.getType())) {
            return;
        }
        if (THROTTLED.contains(event.getType())) {
            String key = event.getAccountId() + ":" + event.getType();
            if (cooldown.asMap().putIfAbsent(key, Boolean.TRUE) != null) {
                log.debug("[RISK-EVENTS] Suppressed repeat {} for {}", event.getType(), event.getAccountId());
                return;
            }
        }
        publish(event);
    }

    private void publish(RiskEngineEvent event) {
        String key = event.getAccountId() != null ? event.getAccountId() : "system";
        try {
            kafkaTemplate.send(topic, key, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("[RISK-EVENTS] Failed to publish {} for {}: {}",
                                    event.getType(), key, ex.getMessage());
                        } else {
                            log.debug("[RISK-EVENTS] Published {} for {} offset={}",
                                    event.getType(), key, result.getRecordMetadata().offset());
                        }
                    });
        } catch (Exception e) {
            log.error("[RISK-EVENTS] Error sending {} for {}: {}", event.getType(), key, e.getMessage());
        }
    }
}
