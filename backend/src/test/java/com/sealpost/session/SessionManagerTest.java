package com.sealpost.session;

import com.sealpost.config.DirectMessageProperties;
import com.sealpost.crypto.LocalKeySigner;
import com.sealpost.relay.FakeRelayTransport;
import com.sealpost.relay.RelayMode;
import com.sealpost.relay.RelaySetResolver;
import com.sealpost.store.MessageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionManagerTest {

    private final FakeRelayTransport transport = new FakeRelayTransport();
    private SessionManager manager;

    @BeforeEach
    void setup() {
        MessageStore store = mock(MessageStore.class);
        when(store.readCache(anyString())).thenReturn(Mono.empty());
        when(store.writeCache(anyString(), any())).thenReturn(Mono.empty());
        Clock clock = Clock.systemUTC();
        DirectMessageProperties properties = DirectMessageProperties.defaults();
        RelaySetResolver resolver = new RelaySetResolver(transport, List.of("wss://discovery.test"), RelayMode.STRICT_OUTBOX,
                Duration.ofSeconds(5), 0.6, clock);
        manager = new SessionManager(transport, resolver, store, properties, VirtualTimeScheduler.create(), clock);
    }

    @AfterEach
    void shutdown() {
        manager.shutdown();
    }

    @Test
    void nobodyLoggedInIsAnError() {
        assertThrows(NoActiveSessionException.class, manager::current);
        assertFalse(manager.logout());
    }

    @Test
    void loggingInAgainAsTheSameUserKeepsTheSession() {
        String secret = "0".repeat(63) + "1";

        MessagingSession first = manager.login(LocalKeySigner.fromHex(secret));
        MessagingSession second = manager.login(LocalKeySigner.fromHex(secret));

        assertSame(first, second);
        assertSame(first, manager.current());
    }

    @Test
    void switchingUsersClosesThePreviousSession() {
        MessagingSession alice = manager.login(LocalKeySigner.generate());

        MessagingSession bob = manager.login(LocalKeySigner.generate());

        assertNotSame(alice, bob);
        assertThrows(IllegalStateException.class, alice::start, "closed sessions cannot restart");
        assertTrue(transport.activeSubscriptions().stream()
                .noneMatch(subscription -> subscription.filters().stream()
                        .anyMatch(filter -> filter.authors() != null && filter.authors().contains(alice.localPubkey()))));
    }

    @Test
    void logoutClosesTheSession() {
        MessagingSession session = manager.login(LocalKeySigner.generate());

        assertTrue(manager.logout());

        assertThrows(IllegalStateException.class, session::start);
        assertThrows(NoActiveSessionException.class, manager::current);
    }
}
