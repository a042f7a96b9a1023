package com.sync.pipeline.bus;

/**
 * Handle on a bus subscription; closing it stops delivery.
 */
public interface Subscription extends AutoCloseable {

    String pattern();

    @Override
    void close();
}
