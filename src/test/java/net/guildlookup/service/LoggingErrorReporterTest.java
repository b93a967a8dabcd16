package net.guildlookup.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.guildlookup.exception.RegionNotSupportedException;
import org.junit.jupiter.api.Test;

class LoggingErrorReporterTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final LoggingErrorReporter reporter = new LoggingErrorReporter(meterRegistry);

    @Test
    void report_countsByExceptionAndContext() {
        reporter.report(new RegionNotSupportedException("CN"), "guild-refresh");
        reporter.report(new RegionNotSupportedException("CN"), "guild-refresh");

        double count = meterRegistry.get(LoggingErrorReporter.ERRORS_METRIC)
            .tag("exception", "RegionNotSupportedException")
            .tag("context", "guild-refresh")
            .counter()
            .count();
        assertThat(count).isEqualTo(2.0);
    }

    @Test
    void report_ignoresNullError() {
        assertThatCode(() -> reporter.report(null, "guild-refresh")).doesNotThrowAnyException();
        assertThat(meterRegistry.find(LoggingErrorReporter.ERRORS_METRIC).counter()).isNull();
    }
}
