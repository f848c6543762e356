package com.sealpost.session;

import com.sealpost.config.DirectMessageProperties;
import com.sealpost.crypto.Signer;
import com.sealpost.relay.RelaySetResolver;
import com.sealpost.relay.RelayTransport;
import com.sealpost.store.MessageStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;

/**
 * Holds the one active {@link MessagingSession}. Logging in as someone else closes the previous
 * session (queries, subscriptions and pending cache writes) before the new one starts.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final RelayTransport transport;
    private final RelaySetResolver resolver;
    private final MessageStore store;
    private final DirectMessageProperties properties;
    private final Scheduler cacheWriteScheduler;
    private final Clock clock;

    private MessagingSession current;

    public SessionManager(RelayTransport transport, RelaySetResolver resolver, MessageStore store,
                          DirectMessageProperties properties, Scheduler cacheWriteScheduler, Clock clock) {
        this.transport = transport;
        this.resolver = resolver;
        this.store = store;
        this.properties = properties;
        this.cacheWriteScheduler = cacheWriteScheduler;
        this.clock = clock;
    }

    public synchronized MessagingSession login(Signer signer) {
        if (current != null) {
            if (current.localPubkey().equals(signer.publicKey())) {
                return current;
            }
            log.info("Switching user, closing session for {}", current.localPubkey());
            current.close();
            current = null;
        }
        MessagingSession session = new MessagingSession(signer, transport, resolver, store, properties,
                cacheWriteScheduler, clock);
        current = session;
        session.start();
        log.info("Started messaging session for {}", signer.publicKey());
        return session;
    }

    public synchronized boolean logout() {
        if (current == null) {
            return false;
        }
        current.close();
        current = null;
        return true;
    }

    /**
     * @throws NoActiveSessionException when nobody is logged in
     */
    public synchronized MessagingSession current() {
        if (current == null) {
            throw new NoActiveSessionException();
        }
        return current;
    }

    @PreDestroy
    public void shutdown() {
        logout();
    }
}
