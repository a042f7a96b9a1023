package com.sync.pipeline.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link MessageBus}.
 *
 * <p>Each published envelope is encoded once through the {@link EventCodec} and every
 * matching subscriber receives its own decoded copy, so subscribers observe exactly the
 * wire contract. Delivery runs on a bounded pool, or on the publishing thread when built
 * with {@link #synchronous()}.</p>
 */
public class InMemoryMessageBus implements MessageBus {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final List<SubscriptionImpl> subscriptions = new CopyOnWriteArrayList<>();
    private final EventCodec codec;
    private final ExecutorService executor;
    private final Object idleMonitor = new Object();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong handlerFailures = new AtomicLong();
    private volatile boolean closed = false;

    /**
     * Creates a bus delivering on a fixed pool of {@code concurrency} threads.
     */
    public InMemoryMessageBus(int concurrency) {
        this(new EventCodec(), Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r, "bus-delivery");
            t.setDaemon(true);
            return t;
        }));
    }

    public InMemoryMessageBus(EventCodec codec, ExecutorService executor) {
        this.codec = codec;
        this.executor = executor;
    }

    /**
     * Creates a bus that delivers on the publishing thread.
     */
    public static InMemoryMessageBus synchronous() {
        return new InMemoryMessageBus(new EventCodec(), null);
    }

    @Override
    public void publish(EventEnvelope envelope) {
        if (closed) {
            throw new IllegalStateException("Message bus is closed");
        }
        String topic = envelope.getTopic();
        byte[] wire = codec.encode(envelope);
        published.incrementAndGet();
        log.debug("bus.published topic={} eventId={} parentEventId={}",
                topic, envelope.getEventId(), envelope.getParentEventId());

        for (SubscriptionImpl subscription : subscriptions) {
            if (Topic.matches(subscription.pattern, topic)) {
                deliver(subscription, topic, wire);
            }
        }
    }

    private void deliver(SubscriptionImpl subscription, String topic, byte[] wire) {
        inFlight.incrementAndGet();
        Runnable delivery = () -> {
            try {
                if (subscription.active) {
                    subscription.handler.handle(codec.decode(wire));
                }
            } catch (RuntimeException e) {
                handlerFailures.incrementAndGet();
                log.error("bus.handler.failed topic={} pattern={} error={}",
                        topic, subscription.pattern, e.getMessage(), e);
            } finally {
                if (inFlight.decrementAndGet() == 0) {
                    synchronized (idleMonitor) {
                        idleMonitor.notifyAll();
                    }
                }
            }
        };
        if (executor == null) {
            delivery.run();
            return;
        }
        try {
            executor.execute(delivery);
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            throw new IllegalStateException("Message bus rejected delivery on " + topic, e);
        }
    }

    @Override
    public Subscription subscribe(String pattern, MessageHandler handler) {
        SubscriptionImpl subscription = new SubscriptionImpl(pattern, handler);
        subscriptions.add(subscription);
        log.info("bus.subscribed pattern={}", pattern);
        return subscription;
    }

    /**
     * Blocks until no delivery is in flight or the timeout elapses.
     *
     * @return true if the bus became idle
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (idleMonitor) {
            while (inFlight.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
        }
        return true;
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getHandlerFailureCount() {
        return handlerFailures.get();
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    @Override
    public void close() {
        closed = true;
        subscriptions.clear();
        if (executor != null) {
            executor.shutdown();
        }
    }

    private final class SubscriptionImpl implements Subscription {
        private final String pattern;
        private final MessageHandler handler;
        private volatile boolean active = true;

        private SubscriptionImpl(String pattern, MessageHandler handler) {
            this.pattern = pattern;
            this.handler = handler;
        }

        @Override
        public String pattern() {
            return pattern;
        }

        @Override
        public void close() {
            active = false;
            subscriptions.remove(this);
        }
    }
}
