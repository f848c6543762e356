package com.sealpost.sync;

import com.sealpost.conversation.MergeEngine;
import com.sealpost.conversation.MergeResult;
import com.sealpost.conversation.Message;
import com.sealpost.conversation.MessagingState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Collection;
import java.util.function.UnaryOperator;

/**
 * Owns the canonical {@link MessagingState} of one session. Producers propose message batches;
 * the {@link MergeEngine} computes the next state under this holder's lock, and every new state
 * is replayed to subscribers.
 */
public class MessagingStateHolder {

    private final MergeEngine mergeEngine;
    private final Sinks.Many<MessagingState> states = Sinks.many().replay().latest();
    private MessagingState current;

    public MessagingStateHolder(MergeEngine mergeEngine, MessagingState initial) {
        this.mergeEngine = mergeEngine;
        this.current = initial;
        states.tryEmitNext(initial);
    }

    public synchronized MessagingState current() {
        return current;
    }

    public MergeEngine mergeEngine() {
        return mergeEngine;
    }

    public synchronized MergeResult propose(Collection<Message> messages) {
        MergeResult result = mergeEngine.merge(current, messages);
        if (result.changed()) {
            publish(result.state());
        }
        return result;
    }

    public synchronized MergeResult proposePending(Message placeholder) {
        MergeResult result = mergeEngine.addPending(current, placeholder);
        publish(result.state());
        return result;
    }

    public synchronized MessagingState update(UnaryOperator<MessagingState> change) {
        MessagingState next = change.apply(current);
        if (next != current) {
            publish(next);
        }
        return next;
    }

    public synchronized void replace(MessagingState state) {
        publish(state);
    }

    public Flux<MessagingState> states() {
        return states.asFlux();
    }

    public void complete() {
        states.tryEmitComplete();
    }

    private void publish(MessagingState next) {
        current = next;
        states.tryEmitNext(next);
    }
}
