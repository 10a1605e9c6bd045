package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.model.PollingBatch;
import me.ud.ltc.tak.distributed.realtime.starter.model.PollingQuery;
import me.ud.ltc.tak.distributed.realtime.starter.service.EventStore;
import me.ud.ltc.tak.distributed.realtime.starter.service.PollingGateway;

/**
 * Polling over the event history. Reads only, so repeating a poll with the same cursor returns the same events as
 * long as the history has not moved on.
 * <p>
 * With an {@link EmissionSequencer} events newer than {@link EmissionSequencer#visibleThrough()} are held back
 * until the emissions before them are stored, so a cursor taken from one poll never passes an event that a later
 * poll would still find.
 *
 * @author takltc
 */
public class DefaultPollingGateway implements PollingGateway {

    private final EventStore eventStore;
    private final EmissionSequencer sequencer;
    private final Clock clock;

    public DefaultPollingGateway(EventStore eventStore) {
        this(eventStore, null);
    }

    public DefaultPollingGateway(EventStore eventStore, EmissionSequencer sequencer) {
        this(eventStore, sequencer, Clock.systemUTC());
    }

    /**
     * @param sequencer Sequencer of the emitting service in this process, null when nothing emits here
     */
    public DefaultPollingGateway(EventStore eventStore, EmissionSequencer sequencer, Clock clock) {
        this.eventStore = eventStore;
        this.sequencer = sequencer;
        this.clock = clock;
    }

    @Override
    public List<Event> poll(String userId, Collection<String> roles, Long since) {
        return poll(userId, roles, since, null);
    }

    @Override
    public List<Event> poll(String userId, Collection<String> roles, Long since, Set<String> types) {
        return poll(PollingQuery.builder().userId(userId).roles(roles).since(since).types(types).build())
            .getEvents();
    }

    @Override
    public PollingBatch poll(PollingQuery query) {
        // Bound first: an emission completing between the two reads must stay above it
        long visibleThrough = sequencer == null ? Long.MAX_VALUE : sequencer.visibleThrough();
        long oldest = query.getMaxAge() > 0 ? clock.millis() - query.getMaxAge() : Long.MIN_VALUE;
        Set<String> types = query.getTypes();

        List<Event> matching = eventStore.list(query.getSince()).stream()
            .filter(event -> event.getTimestamp() <= visibleThrough)
            .filter(event -> event.getTimestamp() >= oldest)
            .filter(event -> event.isVisibleTo(query.getUserId(), query.getRoles()))
            .filter(event -> types == null || types.isEmpty() || types.contains(event.getType()))
            .sorted(Comparator.comparingLong(Event::getTimestamp)).collect(Collectors.toList());

        boolean hasMore = query.getLimit() > 0 && matching.size() > query.getLimit();
        List<Event> events = hasMore ? new ArrayList<>(matching.subList(0, query.getLimit())) : matching;
        long cursor = events.isEmpty() ? (query.getSince() != null ? query.getSince() : 0L)
            : events.get(events.size() - 1).getTimestamp();
        return new PollingBatch(events, hasMore, cursor);
    }
}
