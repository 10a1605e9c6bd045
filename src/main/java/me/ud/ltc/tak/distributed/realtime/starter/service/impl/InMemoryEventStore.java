package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.service.EventStore;

/**
 * Event history kept in process memory, for single node deployments and as the local copy behind
 * {@link FallbackEventStore}
 *
 * @author takltc
 */
public class InMemoryEventStore implements EventStore {

    private final int maxEvents;
    private final long maxAge;
    private final Clock clock;

    /**
     * Newest first
     */
    private final Deque<Event> events = new ArrayDeque<>();

    public InMemoryEventStore(int maxEvents) {
        this(maxEvents, 0L, Clock.systemUTC());
    }

    /**
     * @param maxAge Age in milliseconds after which events are dropped, 0 keeps them until evicted by the cap
     */
    public InMemoryEventStore(int maxEvents, long maxAge, Clock clock) {
        if (maxEvents <= 0) {
            throw new IllegalStateException("Maximum stored events must be greater than 0");
        }
        if (maxAge < 0) {
            throw new IllegalStateException("Maximum event age must not be negative");
        }
        this.maxEvents = maxEvents;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    @Override
    public synchronized String append(Event event) {
        events.addFirst(event);
        while (events.size() > maxEvents) {
            events.removeLast();
        }
        pruneExpired();
        return event.getId();
    }

    @Override
    public synchronized List<Event> list(Long since) {
        pruneExpired();
        List<Event> result = new ArrayList<>(events.size());
        for (Event event : events) {
            if (since == null || event.getTimestamp() > since) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public synchronized void clear() {
        events.clear();
    }

    public synchronized int size() {
        pruneExpired();
        return events.size();
    }

    private void pruneExpired() {
        if (maxAge <= 0) {
            return;
        }
        long oldest = clock.millis() - maxAge;
        while (!events.isEmpty() && events.peekLast().getTimestamp() < oldest) {
            events.removeLast();
        }
    }
}
