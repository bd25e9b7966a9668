package io.indexer.core.events;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Handle returned by {@link EventBus#subscribe}. The bus fills the bounded queue without blocking;
 * the owner drains it with {@link #poll()} or {@link #poll(Duration)}. Once closed, no further events
 * are delivered, but events already queued can still be drained.
 */
public final class Subscription {
    private final String id;
    private final Set<EventType> eventTypes;
    private final EventFilter filter;
    private final BlockingQueue<ChainEvent> queue;
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final Instant createdAt = Instant.now();
    private volatile Instant lastEventTime;
    private volatile boolean closed;

    Subscription(String id, Set<EventType> eventTypes, EventFilter filter, int capacity) {
        this.id = id;
        this.eventTypes = Set.copyOf(eventTypes);
        this.filter = filter;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public String id() {
        return id;
    }

    public Set<EventType> eventTypes() {
        return eventTypes;
    }

    public EventFilter filter() {
        return filter;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Next queued event, or null when none is waiting. */
    public ChainEvent poll() {
        return queue.poll();
    }

    /** Waits up to {@code timeout} for an event; null on timeout. */
    public ChainEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public int drainTo(Collection<? super ChainEvent> sink) {
        return queue.drainTo(sink);
    }

    public SubscriberInfo info() {
        return new SubscriberInfo(id, eventTypes, received.get(), dropped.get(), queue.size(), createdAt, lastEventTime);
    }

    boolean accepts(ChainEvent event) {
        return !closed && eventTypes.contains(event.type()) && filter.matches(event);
    }

    /** Non-blocking enqueue; returns false and counts a drop when the queue is full. */
    boolean offer(ChainEvent event) {
        if (queue.offer(event)) {
            received.incrementAndGet();
            lastEventTime = Instant.now();
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    void close() {
        closed = true;
    }
}
