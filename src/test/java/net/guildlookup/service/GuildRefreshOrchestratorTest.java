package net.guildlookup.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import net.guildlookup.GuildFixtures;
import net.guildlookup.exception.GuildNormalizationException;
import net.guildlookup.exception.RegionNotSupportedException;
import net.guildlookup.exception.UpstreamHttpException;
import net.guildlookup.mapper.BattleNetGuildMapper;
import net.guildlookup.model.Guild;
import net.guildlookup.model.GuildKey;
import net.guildlookup.repository.GuildRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

@ExtendWith(MockitoExtension.class)
class GuildRefreshOrchestratorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final long VERIFY_MILLIS = 2000;

    private static final GuildKey KEY = new GuildKey("EU", "Tarren Mill", "Method");

    @Mock
    private GuildRepository guildRepository;

    @Mock
    private GuildProfileClient guildProfileClient;

    @Mock
    private ErrorReporter errorReporter;

    private SimpleMeterRegistry meterRegistry;
    private GuildRefreshOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new GuildRefreshOrchestrator(
            guildRepository,
            guildProfileClient,
            new BattleNetGuildMapper(),
            new UpstreamErrorClassifier("Not found"),
            errorReporter,
            meterRegistry
        );
    }

    @Test
    @DisplayName("cache miss answers with the upstream record and stores it")
    void lookup_cacheMiss_returnsUpstreamRecordAndPersists() {
        when(guildRepository.findByKey(KEY)).thenReturn(Optional.empty());
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method"))
            .thenReturn(Mono.just(GuildFixtures.profilePayload()));
        when(guildRepository.upsert(any(Guild.class)))
            .thenAnswer(invocation -> ((Guild) invocation.getArgument(0)).withUpdatedAt(Instant.now()));

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isInstanceOf(GuildLookupResult.Found.class);
        GuildLookupResult.Found found = (GuildLookupResult.Found) result;
        assertThat(found.source()).isEqualTo(GuildLookupResult.Source.UPSTREAM);
        assertThat(found.guild().region()).isEqualTo("eu");
        assertThat(found.guild().realm()).isEqualTo("Tarren Mill");
        assertThat(found.guild().memberCount()).isEqualTo(42);

        verify(guildRepository, timeout(VERIFY_MILLIS)).upsert(found.guild());
        verify(errorReporter, never()).report(any(), anyString());
        assertThat(meterRegistry.counter("guild.lookup.cache.miss").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("cache hit answers from the cache and still refreshes")
    void lookup_cacheHit_returnsCachedRecordAndRefreshes() {
        Guild cached = GuildFixtures.guild("eu", "Tarren Mill", "Method").withUpdatedAt(Instant.EPOCH);
        when(guildRepository.findByKey(KEY)).thenReturn(Optional.of(cached));
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method"))
            .thenReturn(Mono.just(GuildFixtures.profilePayload()));
        when(guildRepository.upsert(any(Guild.class)))
            .thenAnswer(invocation -> invocation.getArgument(0));

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isEqualTo(new GuildLookupResult.Found(cached, GuildLookupResult.Source.CACHE));
        verify(guildRepository, timeout(VERIFY_MILLIS)).upsert(any(Guild.class));
        assertThat(meterRegistry.counter("guild.lookup.cache.hit").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("cache hit answers while the upstream fetch is still pending")
    void lookup_cacheHit_answersBeforeUpstreamResolves() {
        Guild cached = GuildFixtures.guild("eu", "Tarren Mill", "Method").withUpdatedAt(Instant.EPOCH);
        Sinks.One<JsonNode> pendingFetch = Sinks.one();
        when(guildRepository.findByKey(KEY)).thenReturn(Optional.of(cached));
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method")).thenReturn(pendingFetch.asMono());
        when(guildRepository.upsert(any(Guild.class))).thenAnswer(invocation -> invocation.getArgument(0));

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isEqualTo(new GuildLookupResult.Found(cached, GuildLookupResult.Source.CACHE));
        verify(guildRepository, never()).upsert(any());

        pendingFetch.tryEmitValue(GuildFixtures.profilePayload());

        verify(guildRepository, timeout(VERIFY_MILLIS)).upsert(any(Guild.class));
    }

    @Test
    @DisplayName("cached record is still served when the refresh fails with 500")
    void lookup_cacheHitThenServerError_servesCacheAndReportsOnce() {
        Guild cached = GuildFixtures.guild("eu", "Tarren Mill", "Method").withUpdatedAt(Instant.EPOCH);
        UpstreamHttpException serverError = new UpstreamHttpException(500, "boom", "HTTP 500", null);
        when(guildRepository.findByKey(KEY)).thenReturn(Optional.of(cached));
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method")).thenReturn(Mono.error(serverError));

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isEqualTo(new GuildLookupResult.Found(cached, GuildLookupResult.Source.CACHE));
        verify(errorReporter, timeout(VERIFY_MILLIS).times(1))
            .report(serverError, GuildRefreshOrchestrator.CONTEXT_REFRESH);
        verify(guildRepository, after(200).never()).upsert(any());
    }

    @Test
    @DisplayName("CN answers region-not-supported and reports once")
    void lookup_unsupportedRegion_answersAndReports() {
        GuildKey cnKey = new GuildKey("CN", "Some Realm", "Some Guild");
        RegionNotSupportedException error = new RegionNotSupportedException("CN");
        when(guildRepository.findByKey(cnKey)).thenReturn(Optional.empty());
        when(guildProfileClient.fetchGuild("CN", "Some Realm", "Some Guild")).thenReturn(Mono.error(error));

        StepVerifier.create(orchestrator.lookup(cnKey))
            .expectNext(new GuildLookupResult.RegionNotSupported())
            .expectComplete()
            .verify(WAIT);

        verify(errorReporter, timeout(VERIFY_MILLIS).times(1)).report(error, GuildRefreshOrchestrator.CONTEXT_REFRESH);
        verify(guildRepository, never()).upsert(any());
    }

    @Test
    @DisplayName("404 with the not-found marker answers not found without reporting")
    void lookup_notFound_answersWithoutReportingOrWriting() {
        when(guildRepository.findByKey(KEY)).thenReturn(Optional.empty());
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method"))
            .thenReturn(Mono.error(new UpstreamHttpException(404, "{\"detail\":\"Not found\"}", "HTTP 404", null)));

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isEqualTo(new GuildLookupResult.NotFound());
        verify(errorReporter, after(200).never()).report(any(), anyString());
        verify(guildRepository, never()).upsert(any());
        assertThat(meterRegistry.counter("guild.refresh.failure", "kind", "not_found").count()).isEqualTo(1.0);
    }

    @Test
    void lookup_unexpectedStatus_isSurfacedWithUpstreamDetail() {
        when(guildRepository.findByKey(KEY)).thenReturn(Optional.empty());
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method"))
            .thenReturn(Mono.error(new UpstreamHttpException(503, "maintenance", "HTTP 503", null)));

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isEqualTo(new GuildLookupResult.UpstreamError(503, "maintenance"));
    }

    @Test
    void lookup_malformedPayload_isReportedAsUnexpected() {
        ObjectNode payload = (ObjectNode) GuildFixtures.profilePayload();
        payload.remove("id");
        when(guildRepository.findByKey(KEY)).thenReturn(Optional.empty());
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method")).thenReturn(Mono.just(payload));

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isInstanceOf(GuildLookupResult.UpstreamError.class);
        assertThat(((GuildLookupResult.UpstreamError) result).statusCode()).isEqualTo(500);
        verify(errorReporter, timeout(VERIFY_MILLIS))
            .report(any(GuildNormalizationException.class), eq(GuildRefreshOrchestrator.CONTEXT_REFRESH));
        verify(guildRepository, never()).upsert(any());
    }

    @Test
    void lookup_emptyUpstreamBody_isInvalidResponse() {
        when(guildRepository.findByKey(KEY)).thenReturn(Optional.empty());
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method")).thenReturn(Mono.empty());

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isEqualTo(new GuildLookupResult.UpstreamError(500, "Invalid guild response received"));
    }

    @Test
    @DisplayName("cache read failure is reported and the lookup falls through to upstream")
    void lookup_cacheReadFailure_fallsThroughToUpstream() {
        DataAccessResourceFailureException dbDown = new DataAccessResourceFailureException("db down");
        when(guildRepository.findByKey(KEY)).thenThrow(dbDown);
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method"))
            .thenReturn(Mono.just(GuildFixtures.profilePayload()));
        when(guildRepository.upsert(any(Guild.class))).thenAnswer(invocation -> invocation.getArgument(0));

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isInstanceOf(GuildLookupResult.Found.class);
        assertThat(((GuildLookupResult.Found) result).source()).isEqualTo(GuildLookupResult.Source.UPSTREAM);
        verify(errorReporter).report(dbDown, GuildRefreshOrchestrator.CONTEXT_LOOKUP);
        verify(guildRepository, timeout(VERIFY_MILLIS)).upsert(any(Guild.class));
    }

    @Test
    @DisplayName("background upsert failure is reported without affecting the answer")
    void lookup_upsertFailure_isReportedAfterAnswering() {
        DataAccessResourceFailureException writeFailed = new DataAccessResourceFailureException("write failed");
        when(guildRepository.findByKey(KEY)).thenReturn(Optional.empty());
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method"))
            .thenReturn(Mono.just(GuildFixtures.profilePayload()));
        when(guildRepository.upsert(any(Guild.class))).thenThrow(writeFailed);

        GuildLookupResult result = orchestrator.lookup(KEY).block(WAIT);

        assertThat(result).isInstanceOf(GuildLookupResult.Found.class);
        verify(errorReporter, timeout(VERIFY_MILLIS)).report(writeFailed, GuildRefreshOrchestrator.CONTEXT_UPSERT);
    }

    @Test
    void refreshInBackground_reportsOutcomeWithoutCaller() {
        when(guildProfileClient.fetchGuild("EU", "Tarren Mill", "Method"))
            .thenReturn(Mono.error(new UpstreamHttpException(404, "Not found", "HTTP 404", null)));

        StepVerifier.create(orchestrator.refreshInBackground(KEY))
            .expectNext(RefreshOutcome.NOT_FOUND)
            .expectComplete()
            .verify(WAIT);
    }
}
