package net.guildlookup.service;

import java.util.concurrent.atomic.AtomicBoolean;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Single channel back to the caller of a lookup. The first {@link #emit} wins;
 * later emissions are dropped and report {@code false}.
 */
public final class GuildResponseSink {

    private final Sinks.One<GuildLookupResult> sink = Sinks.one();
    private final AtomicBoolean consumed;

    private GuildResponseSink(boolean consumed) {
        this.consumed = new AtomicBoolean(consumed);
    }

    /** Sink for a caller that is waiting. */
    public static GuildResponseSink open() {
        return new GuildResponseSink(false);
    }

    /** Sink for refreshes nobody waits on; already consumed. */
    public static GuildResponseSink detached() {
        return new GuildResponseSink(true);
    }

    /**
     * Emits the response if none has been emitted yet.
     *
     * @return whether this call produced the response
     */
    public boolean emit(GuildLookupResult result) {
        if (!consumed.compareAndSet(false, true)) {
            return false;
        }
        sink.emitValue(result, Sinks.EmitFailureHandler.FAIL_FAST);
        return true;
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    public Mono<GuildLookupResult> asMono() {
        return sink.asMono();
    }
}
