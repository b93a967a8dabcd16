/**
 * Configuration for the Battle.net API rate limiter
 * - Keeps guild refreshes under the per-second quota of the API client
 * - Fails fast instead of queueing when the quota is spent
 */
package net.guildlookup.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AppRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppRateLimiterConfig.class);

    /**
     * Rate limiter for Battle.net guild requests.
     * Token requests are not limited; they happen once per token lifetime.
     *
     * @param properties Battle.net client settings
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter battleNetRateLimiter(BattleNetApiProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(properties.getRequestsPerSecond())
                .timeoutDuration(Duration.ZERO)
                .build();

        RateLimiter rateLimiter = RateLimiter.of("battleNetApiRateLimiter", config);

        logger.info("Battle.net API rate limiter initialized with limit of {} requests/second",
                properties.getRequestsPerSecond());

        return rateLimiter;
    }
}
