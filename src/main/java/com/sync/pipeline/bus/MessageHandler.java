package com.sync.pipeline.bus;

/**
 * Consumer of bus events.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(EventEnvelope envelope);
}
