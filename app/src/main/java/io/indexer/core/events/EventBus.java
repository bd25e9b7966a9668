package io.indexer.core.events;

import io.indexer.core.error.InvalidInputException;
import io.indexer.core.metrics.EventMetrics;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe hub for committed chain data.
 *
 * <p>{@link #publish} only enqueues into a bounded ingress queue and never blocks. A single dispatch
 * thread drains that queue and offers each event to every matching subscription without blocking;
 * a full subscriber queue drops the event for that subscriber only. Delivery is at most once.
 */
public final class EventBus {
    private static final Logger LOG = Logger.getLogger(EventBus.class.getName());
    private static final long POLL_INTERVAL_MS = 100;

    private enum State { NEW, RUNNING, STOPPED }

    private final BlockingQueue<ChainEvent> ingress;
    private final int historySize;
    private final Map<String, Subscription> subscribers = new ConcurrentHashMap<>();
    // guards history and the subscriber set against a concurrent replaying subscribe
    private final Object dispatchLock = new Object();
    private final Deque<ChainEvent> history = new ArrayDeque<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private Thread dispatcher;

    public EventBus(int ingressCapacity, int historySize) {
        if (ingressCapacity <= 0) {
            throw new IllegalArgumentException("ingressCapacity must be > 0");
        }
        if (historySize < 0) {
            throw new IllegalArgumentException("historySize must be >= 0");
        }
        this.ingress = new ArrayBlockingQueue<>(ingressCapacity);
        this.historySize = historySize;
    }

    public synchronized void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("event bus already " + state.get().name().toLowerCase());
        }
        dispatcher = new Thread(this::dispatchLoop, "chain-indexer-event-bus");
        dispatcher.setDaemon(true);
        dispatcher.start();
        LOG.info(() -> "Event bus started (ingress=" + ingress.remainingCapacity() + ", history=" + historySize + ")");
    }

    /** Stops dispatching and closes every subscription. Idempotent. */
    public synchronized void stop() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return;
        }
        if (dispatcher != null) {
            dispatcher.interrupt();
            try {
                dispatcher.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        synchronized (dispatchLock) {
            for (Subscription s : subscribers.values()) {
                s.close();
            }
            subscribers.clear();
            history.clear();
        }
        int pending = ingress.size();
        ingress.clear();
        LOG.info(() -> "Event bus stopped (" + pending + " undelivered events discarded)");
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    /**
     * Hands an event to the dispatcher. Returns false, without blocking, when the bus is not running
     * or its ingress queue is full.
     */
    public boolean publish(ChainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (state.get() != State.RUNNING || !ingress.offer(event)) {
            rejected.incrementAndGet();
            EventMetrics.recordRejected();
            return false;
        }
        published.incrementAndGet();
        EventMetrics.recordPublished();
        return true;
    }

    public Subscription subscribe(String id, Set<EventType> eventTypes, EventFilter filter, int capacity) {
        return subscribe(id, eventTypes, filter, capacity, 0);
    }

    /**
     * Registers a subscription. An empty type set means every type, a null filter matches everything.
     * Up to {@code replayLast} of the most recent dispatched events that match are queued first,
     * capped by the configured history size.
     *
     * @throws InvalidInputException on a blank or duplicate id, a non-positive capacity or an invalid filter
     */
    public Subscription subscribe(String id, Set<EventType> eventTypes, EventFilter filter, int capacity, int replayLast) {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("subscription id must not be blank");
        }
        if (capacity <= 0) {
            throw new InvalidInputException("queue capacity must be > 0: " + capacity);
        }
        if (replayLast < 0) {
            throw new InvalidInputException("replay count must be >= 0: " + replayLast);
        }
        EventFilter f = filter == null ? EventFilter.any() : filter;
        f.validate();
        Set<EventType> types = eventTypes == null || eventTypes.isEmpty()
                ? EnumSet.allOf(EventType.class)
                : EnumSet.copyOf(eventTypes);
        Subscription sub = new Subscription(id, types, f, capacity);

        synchronized (dispatchLock) {
            if (state.get() == State.STOPPED) {
                throw new IllegalStateException("event bus stopped");
            }
            if (subscribers.containsKey(id)) {
                throw new InvalidInputException("subscription " + id + " already exists");
            }
            if (replayLast > 0) {
                replay(sub, Math.min(replayLast, historySize));
            }
            subscribers.put(id, sub);
        }
        LOG.fine(() -> "Subscribed " + id + " to " + types + " (capacity " + capacity + ")");
        return sub;
    }

    /** Removes and closes a subscription. Unknown ids are ignored. */
    public void unsubscribe(String id) {
        Subscription sub = subscribers.remove(id);
        if (sub != null) {
            sub.close();
            LOG.fine(() -> "Unsubscribed " + id);
        }
    }

    public Optional<SubscriberInfo> subscriberInfo(String id) {
        Subscription sub = subscribers.get(id);
        return sub == null ? Optional.empty() : Optional.of(sub.info());
    }

    public List<SubscriberInfo> subscribers() {
        List<SubscriberInfo> out = new ArrayList<>();
        for (Subscription s : subscribers.values()) {
            out.add(s.info());
        }
        return out;
    }

    public BusStats stats() {
        return new BusStats(published.get(), delivered.get(), dropped.get(), rejected.get(), subscribers.size());
    }

    /**
     * Waits until every accepted event has been dispatched. Returns false on timeout or when the bus
     * stopped with events still pending.
     */
    public boolean awaitDispatched(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (processed.get() < published.get()) {
            if (state.get() == State.STOPPED || System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    private void dispatchLoop() {
        while (state.get() == State.RUNNING) {
            ChainEvent event;
            try {
                event = ingress.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                continue;
            }
            try {
                dispatch(event);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Dispatch of " + event.type() + " event at block " + event.blockNumber() + " failed", e);
            } finally {
                processed.incrementAndGet();
            }
        }
    }

    private void dispatch(ChainEvent event) {
        synchronized (dispatchLock) {
            deliverAll(subscribers.values(), event);
            if (historySize > 0) {
                if (history.size() == historySize) {
                    history.removeFirst();
                }
                history.addLast(event);
            }
        }
    }

    private void deliverAll(Collection<Subscription> targets, ChainEvent event) {
        for (Subscription sub : targets) {
            if (sub.accepts(event)) {
                deliver(sub, event);
            }
        }
    }

    private void deliver(Subscription sub, ChainEvent event) {
        if (sub.offer(event)) {
            delivered.incrementAndGet();
            EventMetrics.recordDelivered();
        } else {
            dropped.incrementAndGet();
            EventMetrics.recordDropped();
        }
    }

    private void replay(Subscription sub, int count) {
        Deque<ChainEvent> picked = new ArrayDeque<>();
        Iterator<ChainEvent> newestFirst = history.descendingIterator();
        while (newestFirst.hasNext() && picked.size() < count) {
            ChainEvent e = newestFirst.next();
            if (sub.accepts(e)) {
                picked.addFirst(e);
            }
        }
        for (ChainEvent e : picked) {
            deliver(sub, e);
        }
    }
}
