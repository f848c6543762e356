package com.sealpost.relay;

import com.sealpost.event.EventFilter;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Derives relay sets from published routing documents (outbox model).
 *
 * <p>Reading someone's direct messages: their DM inbox list, else the read relays of their relay
 * list, else the discovery relays. Writing: their write relays, else discovery. Routing
 * documents are fetched from the discovery relays, each queried on its own, and the lookup
 * completes as soon as a majority has answered.
 *
 * <p>Failures never propagate: they fall back to the discovery set and are reported as
 * {@link RelayResolutionDegraded}.
 */
public class RelaySetResolver {

    private static final Logger log = LoggerFactory.getLogger(RelaySetResolver.class);

    private final RelayTransport transport;
    private final List<String> discoveryRelays;
    private final RelayMode relayMode;
    private final Duration resolutionTimeout;
    private final double majorityRatio;
    private final Clock clock;

    public RelaySetResolver(RelayTransport transport, List<String> discoveryRelays, RelayMode relayMode,
                            Duration resolutionTimeout, double majorityRatio, Clock clock) {
        this.transport = transport;
        this.discoveryRelays = RelayUrls.clean(discoveryRelays);
        this.relayMode = relayMode;
        this.resolutionTimeout = resolutionTimeout;
        this.majorityRatio = majorityRatio;
        this.clock = clock;
    }

    public List<String> discoveryRelays() {
        return discoveryRelays;
    }

    public RelayMode relayMode() {
        return relayMode;
    }

    /**
     * Relay set for one pubkey and purpose.
     */
    public Mono<Resolution> resolve(String pubkey, RelayPurpose purpose) {
        if (purpose == RelayPurpose.DISCOVERY) {
            return Mono.just(new Resolution(pubkey, purpose, discoveryRelays, null));
        }
        return fetchRelayLists(List.of(pubkey))
                .map(lookup -> {
                    if (!lookup.answered()) {
                        RelayResolutionDegraded degraded = new RelayResolutionDegraded(pubkey, purpose,
                                String.join("; ", lookup.errors()), discoveryRelays);
                        log.warn(degraded.describe());
                        return new Resolution(pubkey, purpose, discoveryRelays, degraded);
                    }
                    return new Resolution(pubkey, purpose, select(lookup.listsFor(pubkey), purpose, discoveryRelays), null);
                });
    }

    /**
     * Fetches routing documents for all {@code pubkeys} with one filter per discovery relay. Keeps
     * the newest document per pubkey and kind.
     */
    public Mono<RelayListsLookup> fetchRelayLists(Collection<String> pubkeys) {
        List<String> authors = List.copyOf(new LinkedHashSet<>(pubkeys));
        if (authors.isEmpty() || discoveryRelays.isEmpty()) {
            return Mono.just(new RelayListsLookup(Map.of(), Map.of(), authors.isEmpty(),
                    discoveryRelays.isEmpty() ? List.of("no discovery relays configured") : List.of()));
        }
        EventFilter filter = EventFilter.ofKinds(EventKinds.RELAY_LIST, EventKinds.DM_INBOX_RELAYS,
                        EventKinds.BLOCKED_RELAYS)
                .authors(authors);
        int majority = Math.max(1, (int) Math.ceil(discoveryRelays.size() * majorityRatio));

        return transport.query(discoveryRelays, List.of(filter), resolutionTimeout)
                .take(majority)
                .collectList()
                .map(responses -> {
                    if (responses.size() < discoveryRelays.size()) {
                        log.debug("Relay lists: early exit after {}/{} discovery relays", responses.size(),
                                discoveryRelays.size());
                    }
                    Map<String, RelayHealth> health = new HashMap<>();
                    List<NostrEvent> events = new ArrayList<>();
                    List<String> errors = new ArrayList<>();
                    boolean answered = false;
                    for (RelayResponse response : responses) {
                        health.put(response.relay(), response.health());
                        if (response.succeeded()) {
                            answered = true;
                            events.addAll(response.events());
                        } else {
                            errors.add(response.relay() + ": " + response.error());
                        }
                    }
                    Map<String, RelayLists> lists = new HashMap<>();
                    for (String author : authors) {
                        lists.put(author, RelayLists.newestOf(author, events));
                    }
                    return new RelayListsLookup(lists, health, answered, errors);
                });
    }

    /**
     * Builds participants for {@code pubkeys} from freshly fetched routing documents.
     */
    public Mono<ParticipantLookup> resolveParticipants(Collection<String> pubkeys) {
        if (pubkeys.isEmpty()) {
            return Mono.just(ParticipantLookup.empty());
        }
        return fetchRelayLists(pubkeys)
                .map(lookup -> {
                    Map<String, Participant> participants = new HashMap<>();
                    List<RelayResolutionDegraded> degraded = new ArrayList<>();
                    for (String pubkey : new LinkedHashSet<>(pubkeys)) {
                        participants.put(pubkey, buildParticipant(pubkey, lookup.listsFor(pubkey)));
                        if (!lookup.answered()) {
                            degraded.add(new RelayResolutionDegraded(pubkey, RelayPurpose.READ_INBOX,
                                    String.join("; ", lookup.errors()), discoveryRelays));
                        }
                    }
                    if (!degraded.isEmpty()) {
                        log.warn("Relay lists unavailable for {} participants, using discovery relays", degraded.size());
                    }
                    return new ParticipantLookup(participants, lookup.health(), degraded);
                });
    }

    /**
     * Derived relay set according to the configured {@link RelayMode}. Blocked relays are
     * recorded on the participant, not removed from its set.
     */
    public Participant buildParticipant(String pubkey, RelayLists lists) {
        long now = clock.instant().getEpochSecond();
        List<String> blocked = lists.blocked();
        if (relayMode == RelayMode.DISCOVERY) {
            return new Participant(pubkey, discoveryRelays, blocked, now);
        }
        LinkedHashSet<String> relays = new LinkedHashSet<>(lists.inboxRelays());
        if (relays.isEmpty() || relayMode == RelayMode.HYBRID) {
            relays.addAll(lists.readRelays());
        }
        if (relayMode == RelayMode.HYBRID) {
            relays.addAll(discoveryRelays);
        }
        return new Participant(pubkey, new ArrayList<>(relays), blocked, now);
    }

    /**
     * Priority selection for a purpose, falling back to {@code discovery} when the preferred
     * lists are empty.
     */
    public static List<String> select(RelayLists lists, RelayPurpose purpose, List<String> discovery) {
        switch (purpose) {
            case READ_INBOX -> {
                List<String> inbox = lists.inboxRelays();
                if (!inbox.isEmpty()) {
                    return inbox;
                }
                List<String> read = lists.readRelays();
                return read.isEmpty() ? discovery : read;
            }
            case WRITE -> {
                List<String> write = lists.writeRelays();
                return write.isEmpty() ? discovery : write;
            }
            default -> {
                return discovery;
            }
        }
    }

    /**
     * Write set plus any relays declared inside the event itself, so that a first routing
     * document reaches the relays it announces.
     */
    public static List<String> publishRelays(List<String> writeRelays, NostrEvent event) {
        LinkedHashSet<String> relays = new LinkedHashSet<>(writeRelays);
        relays.addAll(declaredRelays(event));
        return new ArrayList<>(relays);
    }

    static List<String> declaredRelays(NostrEvent event) {
        return switch (event.kind()) {
            case EventKinds.RELAY_LIST -> RelayLists.markedRelays(event, "write");
            case EventKinds.DM_INBOX_RELAYS -> RelayUrls.clean(event.tagValues("relay"));
            default -> List.of();
        };
    }
}
