package com.kotsin.margin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Main Spring Boot application for the Margin Guard module.
 *
 * Consumes account margin telemetry, forecasts loss-cut risk per account and drives
 * the emergency response pipeline when margin levels collapse.
 */
@SpringBootApplication
@EnableKafka
public class MarginGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarginGuardApplication.class, args);
    }
}
