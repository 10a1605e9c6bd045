package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;

/**
 * In-Memory Event Store Test
 *
 * @author takltc
 */
public class InMemoryEventStoreTest {

    private static Event event(String id, long timestamp) {
        return Event.builder().id(id).type("notification").timestamp(timestamp).build();
    }

    @Test
    public void testNewestFirst() {
        InMemoryEventStore store = new InMemoryEventStore(10);
        store.append(event("e1", 1));
        store.append(event("e2", 2));
        store.append(event("e3", 3));

        List<String> ids = store.list(null).stream().map(Event::getId).collect(Collectors.toList());

        assertEquals(3, ids.size());
        assertEquals("e3", ids.get(0), "Newest event should come first");
        assertEquals("e1", ids.get(2), "Oldest event should come last");
    }

    @Test
    public void testCapacityDropsOldest() {
        InMemoryEventStore store = new InMemoryEventStore(100);
        for (int i = 1; i <= 150; i++) {
            store.append(event("e" + i, i));
        }

        List<Event> events = store.list(null);

        assertEquals(100, events.size(), "Store should keep at most 100 events");
        assertEquals("e150", events.get(0).getId());
        assertEquals("e51", events.get(99).getId(), "The 50 oldest events should be gone");
    }

    @Test
    public void testSinceIsExclusive() {
        InMemoryEventStore store = new InMemoryEventStore(10);
        store.append(event("e1", 100));
        store.append(event("e2", 200));

        assertEquals(1, store.list(100L).size(), "Event at the cursor should be excluded");
        assertEquals("e2", store.list(100L).get(0).getId());
        assertTrue(store.list(200L).isEmpty(), "Nothing is newer than the latest event");
    }

    @Test
    public void testClear() {
        InMemoryEventStore store = new InMemoryEventStore(10);
        store.append(event("e1", 1));

        store.clear();

        assertEquals(0, store.size());
        assertTrue(store.list(null).isEmpty());
    }

    @Test
    public void testInvalidCapacity() {
        assertThrows(IllegalStateException.class, () -> new InMemoryEventStore(0));
        assertThrows(IllegalStateException.class, () -> new InMemoryEventStore(10, -1L, new MutableClock(0L)));
    }

    @Test
    public void testExpiredEventsAreDropped() {
        MutableClock clock = new MutableClock(10_000_000L);
        InMemoryEventStore store = new InMemoryEventStore(10, 3_600_000L, clock);
        store.append(event("old", clock.millis()));
        clock.advance(1_800_000L);
        store.append(event("recent", clock.millis()));

        clock.advance(1_800_001L);

        List<String> ids = store.list(null).stream().map(Event::getId).collect(Collectors.toList());
        assertEquals(Collections.singletonList("recent"), ids, "Events older than an hour should be gone");
        assertEquals(1, store.size());
    }
}
