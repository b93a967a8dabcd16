package net.guildlookup.service;

import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import net.guildlookup.config.BattleNetApiProperties;
import net.guildlookup.exception.UpstreamHttpException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Obtains and caches the OAuth client-credentials token used for profile API calls.
 *
 * <p>The token is shared across requests until shortly before it expires. Failed token
 * requests are not cached, so the next guild fetch asks again.</p>
 */
@Service
@Slf4j
public class BattleNetAccessTokenProvider {

    static final Duration EXPIRY_MARGIN = Duration.ofMinutes(5);

    private final WebClient webClient;
    private final BattleNetApiProperties properties;
    private final ObjectMapper objectMapper;
    private final Mono<String> cachedToken;

    public BattleNetAccessTokenProvider(WebClient.Builder webClientBuilder,
                                        BattleNetApiProperties properties,
                                        ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.cachedToken = requestToken()
            .cache(AccessToken::cacheFor, error -> Duration.ZERO, () -> Duration.ZERO)
            .map(AccessToken::value);
    }

    /**
     * @return a valid bearer token, fetched on first use and after expiry
     */
    public Mono<String> getAccessToken() {
        return cachedToken;
    }

    private Mono<AccessToken> requestToken() {
        return Mono.defer(() -> {
            if (!properties.hasCredentials()) {
                log.warn("Battle.net client credentials are not configured - cannot request an access token");
                return Mono.error(new IllegalStateException("Battle.net client credentials are not configured"));
            }
            log.debug("Requesting Battle.net access token from {}", properties.getTokenUrl());
            return webClient.post()
                .uri(properties.getTokenUrl())
                .headers(headers -> headers.setBasicAuth(properties.getClientId(), properties.getClientSecret()))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("grant_type", "client_credentials"))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(properties.getRequestTimeout())
                .map(this::parseToken)
                .doOnSuccess(token -> log.info("Obtained Battle.net access token, cached for {}", token.cacheFor()))
                .onErrorMap(WebClientResponseException.class, ex -> new UpstreamHttpException(
                    ex.getStatusCode().value(),
                    ex.getResponseBodyAsString(),
                    "Battle.net token request failed with status " + ex.getStatusCode().value(),
                    ex));
        });
    }

    private AccessToken parseToken(String body) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Battle.net token response is not valid JSON", ex);
        }
        JsonNode accessToken = json.get("access_token");
        if (accessToken == null || !accessToken.isString() || !StringUtils.hasText(accessToken.asString())) {
            throw new IllegalStateException("Battle.net token response has no access_token");
        }
        JsonNode expiresIn = json.get("expires_in");
        long expiresInSeconds = expiresIn != null && expiresIn.canConvertToLong() ? expiresIn.asLong() : 0L;
        Duration cacheFor = Duration.ofSeconds(expiresInSeconds).minus(EXPIRY_MARGIN);
        return new AccessToken(accessToken.asString(), cacheFor.isNegative() ? Duration.ZERO : cacheFor);
    }

    private record AccessToken(String value, Duration cacheFor) {}
}
