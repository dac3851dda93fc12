package com.ebay.challenge.ratemeter.report;

import com.ebay.challenge.ratemeter.meter.MeterSnapshot;
import com.ebay.challenge.ratemeter.registry.MeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class MeterReporterTest {

    @Test
    void testLogsEveryRegisteredMeter() {
        MeterRegistry registry = new MeterRegistry();
        registry.register("requests", new MeterSnapshot(10, 1.5, 1.2, 1.1, 0.9));
        registry.register("errors", MeterSnapshot.EMPTY);

        MeterReporter reporter = new MeterReporter(registry, true);

        assertThat(reporter.logSnapshots()).isEqualTo(2);
    }

    @Test
    void testEmptyRegistry() {
        MeterReporter reporter = new MeterReporter(new MeterRegistry(), true);

        reporter.report();

        assertThat(reporter.logSnapshots()).isZero();
    }
}
