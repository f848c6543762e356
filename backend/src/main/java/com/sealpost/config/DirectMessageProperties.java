package com.sealpost.config;

import com.sealpost.relay.RelayMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Direct-message engine settings, bound from {@code sealpost.dm.*}.
 *
 * <p>{@code discoveryRelays} and {@code relayMode} also form the settings fingerprint of the
 * cache: changing either invalidates cached state.
 */
@ConfigurationProperties("sealpost.dm")
public record DirectMessageProperties(
        List<String> discoveryRelays,
        @DefaultValue("HYBRID") RelayMode relayMode,
        @DefaultValue("24h") Duration relayTtl,
        @DefaultValue("1000") int batchSize,
        @DefaultValue("20000") int queryLimit,
        @DefaultValue("5s") Duration queryTimeout,
        @DefaultValue("5s") Duration resolutionTimeout,
        @DefaultValue("10s") Duration publishTimeout,
        @DefaultValue("60s") Duration reconcileTolerance,
        @DefaultValue("15s") Duration cacheWriteDelay,
        @DefaultValue("0.6") double discoveryMajority,
        @DefaultValue("5s") Duration recentMessageThreshold
) {

    public static final List<String> DEFAULT_DISCOVERY_RELAYS = List.of(
            "wss://relay.damus.io",
            "wss://nos.lol",
            "wss://relay.primal.net");

    public DirectMessageProperties {
        discoveryRelays = discoveryRelays == null || discoveryRelays.isEmpty()
                ? DEFAULT_DISCOVERY_RELAYS
                : List.copyOf(discoveryRelays);
        if (batchSize <= 0) {
            throw new IllegalArgumentException("sealpost.dm.batch-size must be positive");
        }
        if (queryLimit < batchSize) {
            throw new IllegalArgumentException("sealpost.dm.query-limit must be at least the batch size");
        }
        if (discoveryMajority <= 0 || discoveryMajority > 1) {
            throw new IllegalArgumentException("sealpost.dm.discovery-majority must be in (0, 1]");
        }
    }

    public static DirectMessageProperties defaults() {
        return new DirectMessageProperties(DEFAULT_DISCOVERY_RELAYS, RelayMode.HYBRID, Duration.ofHours(24), 1000,
                20000, Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(60),
                Duration.ofSeconds(15), 0.6, Duration.ofSeconds(5));
    }

    /** Identifies the settings that change derived state. */
    public String fingerprint() {
        return relayMode.name() + "|" + String.join(",", discoveryRelays.stream().sorted().toList());
    }
}
