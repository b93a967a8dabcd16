package net.guildlookup.controller;

import lombok.extern.slf4j.Slf4j;
import net.guildlookup.controller.dto.GuildErrorResponse;
import net.guildlookup.model.GuildKey;
import net.guildlookup.service.GuildLookupResult;
import net.guildlookup.service.GuildRefreshOrchestrator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Public guild lookup endpoint.
 *
 * <p>Always answers with whatever the orchestrator resolves first; every outcome,
 * including upstream failures, is mapped to a response here rather than thrown.</p>
 */
@RestController
@RequestMapping("/i/guild")
@Slf4j
public class GuildController {

    static final String REGION_NOT_SUPPORTED = "This region is not supported";
    static final String UPSTREAM_ERROR = "Blizzard API error";
    static final MediaType JSON_UTF8 = MediaType.parseMediaType("application/json;charset=UTF-8");

    private final GuildRefreshOrchestrator guildRefreshOrchestrator;

    public GuildController(GuildRefreshOrchestrator guildRefreshOrchestrator) {
        this.guildRefreshOrchestrator = guildRefreshOrchestrator;
    }

    @GetMapping("/{region:[A-Z]{2}}/{realm:.{2,}}/{name:.{2,}}")
    public Mono<ResponseEntity<Object>> getGuild(@PathVariable String region,
                                                 @PathVariable String realm,
                                                 @PathVariable String name) {
        GuildKey key = new GuildKey(region, realm, name);
        log.debug("Guild lookup requested for {}", key);
        return guildRefreshOrchestrator.lookup(key).map(this::toResponse);
    }

    private ResponseEntity<Object> toResponse(GuildLookupResult result) {
        if (result instanceof GuildLookupResult.Found found) {
            return json(HttpStatus.OK.value(), found.guild());
        }
        if (result instanceof GuildLookupResult.NotFound) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .build();
        }
        if (result instanceof GuildLookupResult.RegionNotSupported) {
            return json(HttpStatus.INTERNAL_SERVER_ERROR.value(), GuildErrorResponse.of(REGION_NOT_SUPPORTED));
        }
        GuildLookupResult.UpstreamError upstreamError = (GuildLookupResult.UpstreamError) result;
        // non-standard upstream codes are passed through as-is
        return json(upstreamError.statusCode(),
            new GuildErrorResponse(UPSTREAM_ERROR, upstreamError.message()));
    }

    private static ResponseEntity<Object> json(int status, Object body) {
        return ResponseEntity.status(status)
            .header(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
            .contentType(JSON_UTF8)
            .body(body);
    }
}
