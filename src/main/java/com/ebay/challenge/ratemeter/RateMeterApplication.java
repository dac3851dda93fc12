package com.ebay.challenge.ratemeter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the Rate Meter service.
 *
 * Wires a meter factory and registry and logs the registered meters' rates periodically.
 */
@Slf4j
@SpringBootApplication
public class RateMeterApplication {

    public static void main(String[] args) {
        log.info("Starting Rate Meter Application...");
        SpringApplication.run(RateMeterApplication.class, args);
        log.info("Rate Meter Application started successfully");
    }
}
