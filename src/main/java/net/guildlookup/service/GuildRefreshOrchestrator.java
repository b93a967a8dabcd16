package net.guildlookup.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Optional;
import net.guildlookup.mapper.BattleNetGuildMapper;
import net.guildlookup.model.Guild;
import net.guildlookup.model.GuildKey;
import net.guildlookup.repository.GuildRepository;
import net.guildlookup.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.NullNode;

/**
 * Serves guild lookups stale-while-revalidate.
 *
 * <p>A lookup answers from the Postgres cache when it can and then always refreshes the
 * record from Battle.net. When the cache misses, the refresh itself produces the answer.
 * Refreshed records are upserted in the background; the caller never waits on the write.</p>
 *
 * <p>Every failure ends as a {@link GuildLookupResult} (when a caller is still waiting)
 * and/or an {@link ErrorReporter} report. Nothing here throws to the caller.</p>
 */
@Service
public class GuildRefreshOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(GuildRefreshOrchestrator.class);

    static final String CONTEXT_LOOKUP = "guild-lookup";
    static final String CONTEXT_REFRESH = "guild-refresh";
    static final String CONTEXT_UPSERT = "guild-upsert";

    private final GuildRepository guildRepository;
    private final GuildProfileClient guildProfileClient;
    private final BattleNetGuildMapper guildMapper;
    private final UpstreamErrorClassifier errorClassifier;
    private final ErrorReporter errorReporter;
    private final MeterRegistry meterRegistry;

    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter refreshSuccesses;
    private final Counter upsertFailures;
    private final Timer upstreamFetchTimer;

    public GuildRefreshOrchestrator(GuildRepository guildRepository,
                                    GuildProfileClient guildProfileClient,
                                    BattleNetGuildMapper guildMapper,
                                    UpstreamErrorClassifier errorClassifier,
                                    ErrorReporter errorReporter,
                                    MeterRegistry meterRegistry) {
        this.guildRepository = guildRepository;
        this.guildProfileClient = guildProfileClient;
        this.guildMapper = guildMapper;
        this.errorClassifier = errorClassifier;
        this.errorReporter = errorReporter;
        this.meterRegistry = meterRegistry;

        this.cacheHits = meterRegistry.counter("guild.lookup.cache.hit");
        this.cacheMisses = meterRegistry.counter("guild.lookup.cache.miss");
        this.refreshSuccesses = meterRegistry.counter("guild.refresh.success");
        this.upsertFailures = meterRegistry.counter("guild.upsert.failure");
        this.upstreamFetchTimer = meterRegistry.timer("guild.upstream.fetch");
    }

    /**
     * Looks a guild up for a waiting caller.
     *
     * <p>The returned Mono emits as soon as either the cache or the upstream refresh has an
     * answer. The refresh is subscribed independently of the returned Mono, so it keeps
     * running (and persisting) after the caller has been answered or has gone away.</p>
     *
     * @param key region, realm and name as requested
     * @return the single answer for this request
     */
    public Mono<GuildLookupResult> lookup(GuildKey key) {
        GuildResponseSink sink = GuildResponseSink.open();

        findCached(key)
            .doOnNext(cached -> {
                if (sink.emit(new GuildLookupResult.Found(cached, GuildLookupResult.Source.CACHE))) {
                    cacheHits.increment();
                    ExternalApiLogger.logLookupServed(logger, key.toString(), "CACHE");
                }
            })
            .switchIfEmpty(Mono.fromRunnable(cacheMisses::increment))
            .then(Mono.defer(() -> refresh(key, sink)))
            .subscribe(
                outcome -> ExternalApiLogger.logRefreshComplete(logger, key.toString(), outcome.name()),
                error -> {
                    errorReporter.report(error, CONTEXT_REFRESH);
                    sink.emit(new GuildLookupResult.UpstreamError(
                        UpstreamErrorClassifier.DEFAULT_STATUS, "Guild refresh failed"));
                }
            );

        return sink.asMono();
    }

    /**
     * Refreshes a guild with nobody waiting for the answer.
     *
     * @param key region, realm and name to refresh
     * @return how the refresh ended; completes before the background upsert does
     */
    public Mono<RefreshOutcome> refreshInBackground(GuildKey key) {
        return refresh(key, GuildResponseSink.detached());
    }

    /**
     * Fetches, normalizes and persists one guild, answering the sink if it is still open.
     * Exactly one upstream attempt; retries belong to the client.
     */
    Mono<RefreshOutcome> refresh(GuildKey key, GuildResponseSink sink) {
        return fetchPayload(key)
            .defaultIfEmpty(NullNode.getInstance())
            .map(payload -> guildMapper.normalize(payload, key.region(), key.realm(), key.name()))
            .map(guild -> {
                refreshSuccesses.increment();
                if (sink.emit(new GuildLookupResult.Found(guild, GuildLookupResult.Source.UPSTREAM))) {
                    ExternalApiLogger.logLookupServed(logger, key.toString(), "UPSTREAM");
                }
                persistInBackground(guild);
                return RefreshOutcome.REFRESHED;
            })
            .onErrorResume(error -> Mono.just(handleFailure(key, error, sink)));
    }

    private Mono<Optional<Guild>> lookupCached(GuildKey key) {
        return Mono.fromCallable(() -> guildRepository.findByKey(key))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Guild> findCached(GuildKey key) {
        return lookupCached(key)
            .flatMap(Mono::justOrEmpty)
            .onErrorResume(error -> {
                logger.warn("Cache lookup failed for guild {}; continuing with upstream fetch: {}",
                    key, error.getMessage());
                errorReporter.report(error, CONTEXT_LOOKUP);
                return Mono.empty();
            });
    }

    private Mono<JsonNode> fetchPayload(GuildKey key) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return guildProfileClient.fetchGuild(key.region(), key.realm(), key.name())
                .doFinally(signal -> upstreamFetchTimer.record(Duration.ofNanos(System.nanoTime() - startNanos)));
        });
    }

    private RefreshOutcome handleFailure(GuildKey key, Throwable error, GuildResponseSink sink) {
        UpstreamFailure failure = errorClassifier.classify(error);
        meterRegistry.counter("guild.refresh.failure", "kind", failure.kind()).increment();

        if (failure.reportable()) {
            logger.warn("Refresh of guild {} failed ({}): {}", key, failure.kind(), failure.cause().getMessage());
            errorReporter.report(failure.cause(), CONTEXT_REFRESH);
        } else {
            logger.debug("Guild {} not found upstream", key);
        }

        if (failure instanceof UpstreamFailure.UnsupportedRegion) {
            sink.emit(new GuildLookupResult.RegionNotSupported());
            return RefreshOutcome.REGION_NOT_SUPPORTED;
        }
        if (failure instanceof UpstreamFailure.NotFound) {
            sink.emit(new GuildLookupResult.NotFound());
            return RefreshOutcome.NOT_FOUND;
        }
        UpstreamFailure.Unexpected unexpected = (UpstreamFailure.Unexpected) failure;
        sink.emit(new GuildLookupResult.UpstreamError(unexpected.statusCode(), unexpected.detail()));
        return RefreshOutcome.FAILED;
    }

    private void persistInBackground(Guild guild) {
        Mono.fromCallable(() -> guildRepository.upsert(guild))
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                stored -> logger.debug("Stored guild {} at {}", stored.key(), stored.updatedAt()),
                error -> {
                    upsertFailures.increment();
                    logger.error("Background upsert of guild {} failed: {}", guild.key(), error.getMessage());
                    errorReporter.report(error, CONTEXT_UPSERT);
                }
            );
    }
}
