package net.guildlookup.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import net.guildlookup.config.BattleNetApiProperties;
import net.guildlookup.exception.RegionNotSupportedException;
import net.guildlookup.exception.UpstreamHttpException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/**
 * Maps guild fetch failures onto {@link UpstreamFailure}.
 *
 * <p>Rules are tried in order; the first match wins and anything unmatched is
 * {@link UpstreamFailure.Unexpected}. A 404 only counts as "not found" when the body
 * also carries the configured marker, so a change in the API's error format
 * surfaces as an unexpected failure instead of silently hiding guilds.</p>
 */
@Component
public class UpstreamErrorClassifier {

    static final int DEFAULT_STATUS = HttpStatus.INTERNAL_SERVER_ERROR.value();

    private final String notFoundMarker;
    private final List<Function<Throwable, Optional<UpstreamFailure>>> rules;

    @Autowired
    public UpstreamErrorClassifier(BattleNetApiProperties properties) {
        this(properties.getNotFoundMarker());
    }

    UpstreamErrorClassifier(String notFoundMarker) {
        this.notFoundMarker = notFoundMarker.toLowerCase(Locale.ROOT);
        this.rules = List.of(
            this::unsupportedRegion,
            this::guildNotFound
        );
    }

    /**
     * Classifies a failure. Pure: no I/O, no state.
     *
     * @param error failure raised while fetching or normalizing a guild
     * @return the matching failure variant, never null
     */
    public UpstreamFailure classify(Throwable error) {
        Throwable unwrapped = Exceptions.unwrap(error);
        for (Function<Throwable, Optional<UpstreamFailure>> rule : rules) {
            Optional<UpstreamFailure> match = rule.apply(unwrapped);
            if (match.isPresent()) {
                return match.get();
            }
        }
        return unexpected(unwrapped);
    }

    private Optional<UpstreamFailure> unsupportedRegion(Throwable error) {
        if (error instanceof RegionNotSupportedException) {
            return Optional.of(new UpstreamFailure.UnsupportedRegion(error));
        }
        return Optional.empty();
    }

    private Optional<UpstreamFailure> guildNotFound(Throwable error) {
        return httpDetails(error)
            .filter(details -> details.statusCode() == HttpStatus.NOT_FOUND.value())
            .filter(details -> StringUtils.hasText(details.body())
                && details.body().toLowerCase(Locale.ROOT).contains(notFoundMarker))
            .map(details -> new UpstreamFailure.NotFound(error));
    }

    private UpstreamFailure unexpected(Throwable error) {
        Optional<HttpDetails> details = httpDetails(error);
        int statusCode = details.map(HttpDetails::statusCode).orElse(DEFAULT_STATUS);
        String detail = details.map(HttpDetails::body)
            .filter(StringUtils::hasText)
            .orElseGet(() -> messageOf(error));
        return new UpstreamFailure.Unexpected(statusCode, detail, error);
    }

    private Optional<HttpDetails> httpDetails(Throwable error) {
        if (error instanceof UpstreamHttpException upstream) {
            return Optional.of(new HttpDetails(upstream.getStatusCode(), upstream.getResponseBody()));
        }
        if (error instanceof WebClientResponseException response) {
            return Optional.of(new HttpDetails(response.getStatusCode().value(), response.getResponseBodyAsString()));
        }
        return Optional.empty();
    }

    private static String messageOf(Throwable error) {
        return StringUtils.hasText(error.getMessage()) ? error.getMessage() : error.getClass().getSimpleName();
    }

    private record HttpDetails(int statusCode, String body) {}
}
