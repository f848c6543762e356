package com.sealpost.session;

import com.sealpost.conversation.Message;
import com.sealpost.relay.PublishReport;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/dm")
public class MessagingController {

    private final SessionManager sessionManager;

    public MessagingController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @GetMapping("/snapshot")
    public Mono<MessagingSnapshot> snapshot() {
        return Mono.fromCallable(() -> sessionManager.current().snapshot());
    }

    /** Server-sent events: the latest snapshot first, then one per change. */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<MessagingSnapshot> stream() {
        return Flux.defer(() -> sessionManager.current().snapshots());
    }

    @GetMapping("/conversations/{conversationId}/messages")
    public Flux<Message> messages(@PathVariable String conversationId) {
        return Flux.defer(() -> Flux.fromIterable(sessionManager.current().messages(conversationId)));
    }

    @PostMapping("/messages")
    public Mono<SendReceipt> send(@RequestBody SendMessageRequest request) {
        return Mono.defer(() -> sessionManager.current().sendMessage(request));
    }

    @PostMapping("/refresh")
    public Mono<Void> refresh() {
        return Mono.fromRunnable(() -> sessionManager.current().start());
    }

    @PostMapping("/cache/refetch")
    public Mono<Void> refetch() {
        return Mono.defer(() -> sessionManager.current().clearCacheAndRefetch());
    }

    @DeleteMapping("/relay-error")
    public Mono<Void> dismissRelayError() {
        return Mono.fromRunnable(() -> sessionManager.current().dismissRelayError());
    }

    @PostMapping("/relay-lists")
    public Mono<PublishReport> publishRelayList(@RequestBody RelayListRequest request) {
        return Mono.defer(() -> sessionManager.current().publishRelayList(request.kind(), request.relays()));
    }
}
