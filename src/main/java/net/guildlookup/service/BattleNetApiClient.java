package net.guildlookup.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import net.guildlookup.config.BattleNetApiProperties;
import net.guildlookup.exception.GuildNormalizationException;
import net.guildlookup.exception.RegionNotSupportedException;
import net.guildlookup.exception.UpstreamHttpException;
import net.guildlookup.util.BattleNetSlugs;
import net.guildlookup.util.ExternalApiLogger;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Client for the Battle.net World of Warcraft guild profile API.
 * Unsupported regions are refused before any network traffic; everything else goes
 * through the shared rate limiter with one transient-failure retry.
 */
@Service
@Slf4j
public class BattleNetApiClient implements GuildProfileClient {

    private static final String API_NAME = "BattleNet";
    private static final String OPERATION = "FETCH_GUILD";
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(500);

    private final WebClient webClient;
    private final BattleNetApiProperties properties;
    private final BattleNetAccessTokenProvider tokenProvider;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public BattleNetApiClient(WebClient.Builder webClientBuilder,
                              BattleNetApiProperties properties,
                              BattleNetAccessTokenProvider tokenProvider,
                              RateLimiter battleNetRateLimiter,
                              ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.tokenProvider = tokenProvider;
        this.rateLimiter = battleNetRateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<JsonNode> fetchGuild(String region, String realm, String name) {
        String identifier = region + "/" + realm + "/" + name;
        if (!properties.isRegionSupported(region)) {
            ExternalApiLogger.logApiCallSkipped(log, API_NAME, identifier, "region not supported");
            return Mono.error(new RegionNotSupportedException(region));
        }

        URI uri = buildGuildUri(region, realm, name);
        return Mono.defer(() -> {
                ExternalApiLogger.logApiCallAttempt(log, API_NAME, OPERATION, identifier);
                return tokenProvider.getAccessToken()
                    .flatMap(token -> webClient.get()
                        .uri(uri)
                        .headers(headers -> headers.setBearerAuth(token))
                        .retrieve()
                        .bodyToMono(String.class));
            })
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .timeout(properties.getRequestTimeout())
            .retryWhen(Retry.backoff(1, RETRY_BACKOFF)
                .filter(this::isTransient)
                .doBeforeRetry(signal -> log.warn("Retrying Battle.net guild fetch for '{}' after {}",
                    identifier, signal.failure().toString()))
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
            .doOnSuccess(body -> ExternalApiLogger.logApiCallSuccess(log, API_NAME, OPERATION, identifier,
                body == null ? 0 : body.length()))
            .map(body -> parse(body, identifier))
            .onErrorMap(error -> translate(error, identifier));
    }

    URI buildGuildUri(String region, String realm, String name) {
        String normalizedRegion = region.toLowerCase(Locale.ROOT);
        return UriComponentsBuilder.fromUriString(properties.apiBaseUrl(normalizedRegion))
            .pathSegment("data", "wow", "guild", BattleNetSlugs.slugify(realm), BattleNetSlugs.slugify(name))
            .queryParam("namespace", "profile-" + normalizedRegion)
            .queryParam("locale", properties.getLocale())
            .encode()
            .build()
            .toUri();
    }

    private boolean isTransient(Throwable error) {
        if (error instanceof WebClientResponseException response) {
            return response.getStatusCode().is5xxServerError();
        }
        return error instanceof IOException || error instanceof WebClientRequestException;
    }

    private JsonNode parse(String body, String identifier) {
        try {
            return objectMapper.readTree(body);
        } catch (JacksonException ex) {
            throw new GuildNormalizationException("Guild response for '" + identifier + "' is not valid JSON", ex);
        }
    }

    private Throwable translate(Throwable error, String identifier) {
        if (error instanceof WebClientResponseException response) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, OPERATION, identifier,
                "HTTP " + response.getStatusCode().value());
            return new UpstreamHttpException(
                response.getStatusCode().value(),
                response.getResponseBodyAsString(),
                "Battle.net guild request failed with status " + response.getStatusCode().value(),
                response);
        }
        if (error instanceof RequestNotPermitted) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, OPERATION, identifier, "rate limited");
            return new UpstreamHttpException(HttpStatus.TOO_MANY_REQUESTS.value(), null,
                "Battle.net request rate limit reached", error);
        }
        if (error instanceof TimeoutException) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, OPERATION, identifier, "timed out");
            return new UpstreamHttpException(HttpStatus.GATEWAY_TIMEOUT.value(), null,
                "Battle.net guild request timed out after " + properties.getRequestTimeout(), error);
        }
        if (!(error instanceof UpstreamHttpException) && !(error instanceof GuildNormalizationException)) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, OPERATION, identifier, error.getMessage());
        }
        return error;
    }
}
