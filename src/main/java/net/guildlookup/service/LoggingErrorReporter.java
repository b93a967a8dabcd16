package net.guildlookup.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reports tracked failures to the error log and to the {@code guild.errors.reported}
 * counter, tagged by exception type and context.
 */
@Component
@Slf4j
public class LoggingErrorReporter implements ErrorReporter {

    static final String ERRORS_METRIC = "guild.errors.reported";

    private final MeterRegistry meterRegistry;

    public LoggingErrorReporter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void report(Throwable error, String context) {
        if (error == null) {
            return;
        }
        log.error("[{}] {}: {}", context, error.getClass().getSimpleName(), error.getMessage(), error);
        meterRegistry.counter(ERRORS_METRIC,
            "exception", error.getClass().getSimpleName(),
            "context", context).increment();
    }
}
