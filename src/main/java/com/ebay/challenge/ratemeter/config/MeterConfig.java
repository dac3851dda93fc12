package com.ebay.challenge.ratemeter.config;

import com.ebay.challenge.ratemeter.meter.MeterArbiter;
import com.ebay.challenge.ratemeter.meter.MeterFactory;
import com.ebay.challenge.ratemeter.registry.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Meter wiring.
 *
 * Key design decisions:
 * - meter.disabled is read once, when the factory bean is built
 * - all live meters share the process-wide arbiter
 * - one registry per application context
 */
@Slf4j
@Configuration
@EnableScheduling
public class MeterConfig {

    @Value("${meter.disabled:false}")
    private boolean disabled;

    @Bean
    public MeterArbiter meterArbiter() {
        return MeterArbiter.getDefault();
    }

    @Bean
    public MeterFactory meterFactory(MeterArbiter meterArbiter) {
        if (disabled) {
            log.info("Meters disabled, all meters will be no-op");
        }
        return new MeterFactory(disabled, meterArbiter);
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new MeterRegistry();
    }
}
