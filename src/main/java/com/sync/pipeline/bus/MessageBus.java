package com.sync.pipeline.bus;

/**
 * Topic-based publish/subscribe transport shared by all tenants and integrations.
 *
 * <p>Envelopes are published on {@link EventEnvelope#getTopic()}; subscribers register a
 * pattern where {@code *} matches one topic segment (see {@link Topic#matches}).</p>
 */
public interface MessageBus extends AutoCloseable {

    void publish(EventEnvelope envelope);

    Subscription subscribe(String pattern, MessageHandler handler);

    @Override
    void close();
}
