package com.kotsin.margin.gateway;

import com.kotsin.margin.config.MarginGuardProperties;
import com.kotsin.margin.optimizer.HedgeOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes emergency commands to Kafka and blocks until the broker acknowledges the write,
 * so the action result carries the real dispatch latency and outcome.
 */
@Component
@Slf4j
public class KafkaEmergencyCommandGateway implements EmergencyCommandGateway {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final long timeoutMs;
    private final Clock clock;

    private volatile boolean available = true;

    public KafkaEmergencyCommandGateway(KafkaTemplate<String, Object> kafkaTemplate,
                                        @Value("${kafka.topics.emergency-commands:emergency-commands}") String topic,
                                        MarginGuardProperties properties,
                                        Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.timeoutMs = properties.getEmergency().getCommandTimeoutMs();
        this.clock = clock;
    }

    @Override
    public CommandReceipt closePositions(String accountId, List<String> positionIds) {
        return send(base(accountId, CommandType.CLOSE_POSITIONS)
                .positionIds(List.copyOf(positionIds))
                .percentage(100.0)
                .build());
    }

    @Override
    public CommandReceipt reducePositions(String accountId, List<String> positionIds, double percentage) {
        if (percentage <= 0 || percentage > 100) {
            throw new CommandDispatchException("Reduction percentage out of range: " + percentage);
        }
        return send(base(accountId, CommandType.REDUCE_POSITIONS)
                .positionIds(List.copyOf(positionIds))
                .percentage(percentage)
                .build());
    }

    @Override
    public CommandReceipt openHedge(String accountId, List<HedgeOrder> hedges) {
        return send(base(accountId, CommandType.OPEN_HEDGE)
                .hedges(List.copyOf(hedges))
                .build());
    }

    @Override
    public CommandReceipt transferBalance(String accountId, double amount) {
        if (amount <= 0) {
            throw new CommandDispatchException("Transfer amount must be positive: " + amount);
        }
        return send(base(accountId, CommandType.TRANSFER_BALANCE)
                .amount(amount)
                .build());
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    private EmergencyCommand.EmergencyCommandBuilder base(String accountId, CommandType type) {
        return EmergencyCommand.builder()
                .commandId(UUID.randomUUID().toString())
                .accountId(accountId)
                .type(type)
                .reason("margin-guard emergency response")
                .issuedAt(clock.instant());
    }

    private CommandReceipt send(EmergencyCommand command) {
        long start = System.nanoTime();
        try {
            SendResult<String, Object> result = kafkaTemplate.send(topic, command.getAccountId(), command)
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            available = true;
            log.info("[COMMAND] {} account={} id={} partition={} offset={} latencyMs={}",
                    command.getType(), command.getAccountId(), command.getCommandId(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset(), latencyMs);
            return CommandReceipt.accepted(command.getCommandId(),
                    command.getType() + " dispatched at offset " + result.getRecordMetadata().offset(), latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandDispatchException("Interrupted while dispatching " + command.getType(), e);
        } catch (TimeoutException e) {
            available = false;
            throw new CommandDispatchException(command.getType() + " not acknowledged within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            available = false;
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CommandDispatchException(command.getType() + " dispatch failed: " + cause.getMessage(), cause);
        } catch (Exception e) {
            available = false;
            throw new CommandDispatchException(command.getType() + " dispatch failed: " + e.getMessage(), e);
        }
    }
}
