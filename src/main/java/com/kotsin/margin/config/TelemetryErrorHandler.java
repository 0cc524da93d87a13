package com.kotsin.margin.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.common.TopicPartition;
import org.springframework.kafka.listener.ConsumerAwareListenerErrorHandler;
import org.springframework.kafka.listener.ListenerExecutionFailedException;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.messaging.Message;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Logs and skips telemetry records the listener cannot handle.
 */
@Component("telemetryErrorHandler")
@Slf4j
public class TelemetryErrorHandler implements ConsumerAwareListenerErrorHandler {

    static final int PREVIEW_BYTES = 500;

    @Override
    public Object handleError(Message<?> message, ListenerExecutionFailedException exception, Consumer<?, ?> consumer) {
        Object topicHeader = message.getHeaders().get(KafkaHeaders.RECEIVED_TOPIC);
        String topic = topicHeader != null ? topicHeader.toString() : null;
        Integer partition = (Integer) message.getHeaders().get(KafkaHeaders.RECEIVED_PARTITION);
        Long offset = (Long) message.getHeaders().get(KafkaHeaders.OFFSET);

        Throwable root = rootCause(exception);
        if (root instanceof DeserializationException de) {
            log.error("[TELEMETRY] Deserialization error topic={} partition={} offset={} payload={}",
                    topic, partition, offset, preview(de.getData()));
        } else {
            log.error("[TELEMETRY] Processing error topic={} partition={} offset={} err={}",
                    topic, partition, offset, root.toString(), root);
        }

        try {
            if (topic != null && partition != null && offset != null) {
                consumer.seek(new TopicPartition(topic, partition), offset + 1);
                log.warn("[TELEMETRY] Skipped record {}-{}@{}", topic, partition, offset);
            }
        } catch (Exception seekEx) {
            log.warn("[TELEMETRY] Failed to seek past bad record: {}", seekEx.toString(), seekEx);
        }
        return null;
    }

    /**
     * First {@value #PREVIEW_BYTES} bytes of a rejected payload as UTF-8. A character cut at the
     * limit decodes as U+FFFD.
     */
    static String preview(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return "<empty>";
        }
        return new String(payload, 0, Math.min(PREVIEW_BYTES, payload.length), StandardCharsets.UTF_8);
    }

    private static Throwable rootCause(Throwable t) {
        Throwable result = t;
        while (result.getCause() != null && result.getCause() != result) {
            result = result.getCause();
        }
        return result;
    }
}
