package net.guildlookup.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the Battle.net API client.
 * Injected into the client at construction; nothing reads these values globally.
 */
@Component
@ConfigurationProperties(prefix = "battlenet.api")
public class BattleNetApiProperties {

    /**
     * OAuth client id issued by the Battle.net developer portal.
     */
    private String clientId = "";

    /**
     * OAuth client secret paired with {@link #clientId}.
     */
    private String clientSecret = "";

    /**
     * API host template; {@code %s} is replaced by the lower-case region.
     */
    private String apiBaseUrlTemplate = "https://%s.api.blizzard.com";

    /**
     * Client-credentials token endpoint.
     */
    private String tokenUrl = "https://oauth.battle.net/token";

    /**
     * Locale requested for localized fields.
     */
    private String locale = "en_US";

    /**
     * Regions the API can serve with global credentials.
     */
    private List<String> supportedRegions = new ArrayList<>(List.of("us", "eu", "kr", "tw"));

    /**
     * Text that must appear in a 404 body for it to count as "guild not found".
     */
    private String notFoundMarker = "Not found";

    /**
     * Per-request timeout for guild fetches.
     */
    private Duration requestTimeout = Duration.ofSeconds(5);

    /**
     * Client-side cap on guild requests per second.
     */
    private int requestsPerSecond = 50;

    @PostConstruct
    void validate() {
        Assert.hasText(apiBaseUrlTemplate, "battlenet.api.api-base-url-template must be set");
        Assert.isTrue(apiBaseUrlTemplate.contains("%s"), "battlenet.api.api-base-url-template must contain %s");
        Assert.hasText(tokenUrl, "battlenet.api.token-url must be set");
        Assert.hasText(notFoundMarker, "battlenet.api.not-found-marker must be set");
        Assert.isTrue(requestsPerSecond > 0, "battlenet.api.requests-per-second must be positive");
        Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(),
            "battlenet.api.request-timeout must be positive");
    }

    public boolean isRegionSupported(String region) {
        if (region == null) {
            return false;
        }
        String normalized = region.toLowerCase(Locale.ROOT);
        return supportedRegions.stream().anyMatch(supported -> supported.equalsIgnoreCase(normalized));
    }

    public String apiBaseUrl(String region) {
        return String.format(apiBaseUrlTemplate, region.toLowerCase(Locale.ROOT));
    }

    public boolean hasCredentials() {
        return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public String getApiBaseUrlTemplate() {
        return apiBaseUrlTemplate;
    }

    public void setApiBaseUrlTemplate(String apiBaseUrlTemplate) {
        this.apiBaseUrlTemplate = apiBaseUrlTemplate;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public void setTokenUrl(String tokenUrl) {
        this.tokenUrl = tokenUrl;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public List<String> getSupportedRegions() {
        return supportedRegions;
    }

    public void setSupportedRegions(List<String> supportedRegions) {
        this.supportedRegions = supportedRegions != null ? new ArrayList<>(supportedRegions) : new ArrayList<>();
    }

    public String getNotFoundMarker() {
        return notFoundMarker;
    }

    public void setNotFoundMarker(String notFoundMarker) {
        this.notFoundMarker = notFoundMarker;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(5);
    }

    public int getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public void setRequestsPerSecond(int requestsPerSecond) {
        this.requestsPerSecond = requestsPerSecond;
    }
}
