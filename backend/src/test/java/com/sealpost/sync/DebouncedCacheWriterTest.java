package com.sealpost.sync;

import com.sealpost.conversation.MessagingState;
import com.sealpost.conversation.SyncState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class DebouncedCacheWriterTest {

    private static final Duration DELAY = Duration.ofSeconds(15);

    private final List<MessagingState> written = new CopyOnWriteArrayList<>();
    private VirtualTimeScheduler scheduler;
    private DebouncedCacheWriter writer;

    @BeforeEach
    void setup() {
        scheduler = VirtualTimeScheduler.create();
        writer = new DebouncedCacheWriter(state -> Mono.fromRunnable(() -> written.add(state)), DELAY, scheduler);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static MessagingState state(long marker) {
        return MessagingState.empty().withSyncState(new SyncState(marker, List.of(), false, Map.of()));
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void newMessagesWithNothingPendingAreWrittenImmediately() {
        writer.submit(state(1), true);

        assertEquals(List.of(state(1)), written);
        assertFalse(writer.hasPending());
    }

    @Test
    void otherChangesWaitForTheDelay() {
        writer.submit(state(1), false);

        scheduler.advanceTimeBy(DELAY.minusSeconds(1));
        assertTrue(written.isEmpty());
        assertTrue(writer.hasPending());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(List.of(state(1)), written);
    }

    @Test
    void burstCoalescesIntoOneWriteOfTheLatestState() {
        writer.submit(state(1), false);
        writer.submit(state(2), true);
        writer.submit(state(3), false);

        scheduler.advanceTimeBy(DELAY);

        assertEquals(List.of(state(3)), written, "new messages while pending do not force a write");
    }

    @Test
    void liveBurstAfterAWriteWaitsForTheDelay() {
        for (int i = 1; i <= 5; i++) {
            writer.submit(state(i), true);
        }

        assertEquals(List.of(state(1)), written, "only the first message of the burst is written at once");
        assertTrue(writer.hasPending());

        scheduler.advanceTimeBy(DELAY);
        assertEquals(List.of(state(1), state(5)), written);
    }

    @Test
    void newMessagesAfterAQuietPeriodAreWrittenImmediatelyAgain() {
        writer.submit(state(1), true);
        scheduler.advanceTimeBy(DELAY);

        writer.submit(state(2), true);

        assertEquals(List.of(state(1), state(2)), written);
    }

    @Test
    void flushNowReplacesThePendingWrite() {
        writer.submit(state(1), false);

        writer.flushNow(state(2)).block();
        scheduler.advanceTimeBy(DELAY.multipliedBy(2));

        assertEquals(List.of(state(2)), written);
    }

    @Test
    void nothingIsWrittenAfterCancel() {
        writer.submit(state(1), false);
        writer.cancel();

        scheduler.advanceTimeBy(DELAY);
        writer.submit(state(2), true);
        writer.flushNow(state(3)).block();

        assertTrue(written.isEmpty());
    }

    @Test
    void discardPendingKeepsTheWriterUsable() {
        writer.submit(state(1), false);
        writer.discardPending();
        scheduler.advanceTimeBy(DELAY);
        assertTrue(written.isEmpty());

        writer.submit(state(2), true);
        assertEquals(List.of(state(2)), written);
    }

    @Test
    void failedWriteDoesNotStopLaterWrites() {
        List<MessagingState> attempts = new CopyOnWriteArrayList<>();
        DebouncedCacheWriter failing = new DebouncedCacheWriter(state -> {
            attempts.add(state);
            return attempts.size() == 1 ? Mono.error(new IllegalStateException("disk full")) : Mono.empty();
        }, DELAY, scheduler);

        failing.submit(state(1), true);
        scheduler.advanceTimeBy(DELAY);
        failing.submit(state(2), true);

        assertEquals(List.of(state(1), state(2)), attempts);
    }
}
