package com.sealpost.sync;

import com.sealpost.conversation.MessagingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Coalesces cache writes: at most one pending state and one scheduled flush.
 *
 * <p>A submit with new messages is written immediately when nothing is pending and no write
 * happened within the delay; any other submit replaces the pending state and the flush fires
 * after the delay, so a burst of live messages costs one immediate write and one deferred one. {@link #cancel()} drops
 * the pending state and the scheduled flush, so nothing is written after it returns.
 */
public class DebouncedCacheWriter {

    private static final Logger log = LoggerFactory.getLogger(DebouncedCacheWriter.class);

    private final Function<MessagingState, Mono<Void>> writer;
    private final Duration delay;
    private final Scheduler scheduler;

    private MessagingState pending;
    private Disposable scheduledFlush;
    private Disposable inFlight;
    private long lastWriteAt = Long.MIN_VALUE;
    private boolean cancelled;

    public DebouncedCacheWriter(Function<MessagingState, Mono<Void>> writer, Duration delay, Scheduler scheduler) {
        this.writer = writer;
        this.delay = delay;
        this.scheduler = scheduler;
    }

    public synchronized void submit(MessagingState state, boolean newMessages) {
        if (cancelled) {
            return;
        }
        boolean wasPending = pending != null;
        pending = state;
        if (newMessages && !wasPending && !wroteRecently()) {
            flush();
            return;
        }
        if (scheduledFlush == null) {
            scheduledFlush = scheduler.schedule(this::flush, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /** Writes {@code state} right away, replacing whatever was pending. */
    public synchronized Mono<Void> flushNow(MessagingState state) {
        if (cancelled) {
            return Mono.empty();
        }
        pending = null;
        disposeScheduled();
        lastWriteAt = scheduler.now(TimeUnit.MILLISECONDS);
        return writer.apply(state);
    }

    public synchronized boolean hasPending() {
        return pending != null;
    }

    /** Stops for good: drops the pending state, the scheduled flush and any write in flight. */
    public synchronized void cancel() {
        cancelled = true;
        discardPending();
    }

    /** Drops the pending state, the scheduled flush and any write in flight, but keeps accepting submits. */
    public synchronized void discardPending() {
        pending = null;
        disposeScheduled();
        if (inFlight != null) {
            inFlight.dispose();
            inFlight = null;
        }
    }

    synchronized void flush() {
        disposeScheduled();
        MessagingState state = pending;
        pending = null;
        if (state == null || cancelled) {
            return;
        }
        lastWriteAt = scheduler.now(TimeUnit.MILLISECONDS);
        inFlight = writer.apply(state)
                .subscribe(
                        unused -> { },
                        error -> log.warn("Cache write failed: {}", error.getMessage(), error));
    }

    private boolean wroteRecently() {
        return lastWriteAt != Long.MIN_VALUE
                && scheduler.now(TimeUnit.MILLISECONDS) - lastWriteAt < delay.toMillis();
    }

    private void disposeScheduled() {
        if (scheduledFlush != null) {
            scheduledFlush.dispose();
            scheduledFlush = null;
        }
    }
}
