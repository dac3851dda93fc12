package com.ebay.challenge.ratemeter.report;

import com.ebay.challenge.ratemeter.meter.Meter;
import com.ebay.challenge.ratemeter.meter.MeterSnapshot;
import com.ebay.challenge.ratemeter.registry.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Periodically logs every registered meter.
 *
 * Used for debugging and operations, nothing is exported.
 */
@Slf4j
@Component
public class MeterReporter {

    private final MeterRegistry meterRegistry;
    private final boolean enabled;

    public MeterReporter(
            MeterRegistry meterRegistry,
            @Value("${meter.report.enabled:true}") boolean enabled
    ) {
        this.meterRegistry = meterRegistry;
        this.enabled = enabled;
        log.info("Initialized MeterReporter (enabled={})", enabled);
    }

    @Scheduled(fixedRateString = "${meter.report.interval-ms:60000}")
    public void report() {
        if (enabled) {
            logSnapshots();
        }
    }

    /**
     * Log one line per meter, sorted by name.
     *
     * @return number of meters logged
     */
    int logSnapshots() {
        Map<String, Meter> sorted = new TreeMap<>(meterRegistry.getMeters());
        sorted.forEach((name, meter) -> {
            MeterSnapshot s = meter.snapshot();
            log.info(
                    "meter {}: count={} m1={} m5={} m15={} mean={}",
                    name, s.count(),
                    format(s.rate1()), format(s.rate5()), format(s.rate15()), format(s.rateMean())
            );
        });
        return sorted.size();
    }

    private static String format(double rate) {
        return String.format("%.3f/s", rate);
    }
}
