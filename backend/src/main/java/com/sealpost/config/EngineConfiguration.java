package com.sealpost.config;

import com.sealpost.relay.RelaySetResolver;
import com.sealpost.relay.RelayTransport;
import com.sealpost.relay.WebSocketRelayTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Scheduler cacheWriteScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public RelayTransport relayTransport(DirectMessageProperties properties) {
        return new WebSocketRelayTransport(new ReactorNettyWebSocketClient(), properties.publishTimeout());
    }

    @Bean
    public RelaySetResolver relaySetResolver(RelayTransport transport, DirectMessageProperties properties,
                                             Clock clock) {
        return new RelaySetResolver(transport, properties.discoveryRelays(), properties.relayMode(),
                properties.resolutionTimeout(), properties.discoveryMajority(), clock);
    }
}
