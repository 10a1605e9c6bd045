package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.fasterxml.jackson.databind.ObjectMapper;

import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.connection.ClientConnection;
import me.ud.ltc.tak.distributed.realtime.starter.connection.RecordingEventSink;
import me.ud.ltc.tak.distributed.realtime.starter.exception.EventStoreException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.NoDeliveryPathException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.RateLimitExceededException;
import me.ud.ltc.tak.distributed.realtime.starter.model.ConnectionState;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.model.EventTargets;
import me.ud.ltc.tak.distributed.realtime.starter.model.Priority;
import me.ud.ltc.tak.distributed.realtime.starter.service.CrossProcessRelay;
import me.ud.ltc.tak.distributed.realtime.starter.service.EventStore;
import me.ud.ltc.tak.distributed.realtime.starter.service.RateLimiter;

/**
 * Realtime Event Service Implementation Test
 *
 * @author takltc
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class RealtimeEventServiceImplTest {

    @Mock
    private RateLimiter rateLimiter;

    @Mock
    private CrossProcessRelay relay;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryEventStore eventStore;
    private DefaultLocalBroadcaster broadcaster;
    private MutableClock clock;
    private RealtimeEventServiceImpl eventService;

    @BeforeEach
    public void setUp() {
        eventStore = new InMemoryEventStore(100);
        broadcaster = new DefaultLocalBroadcaster();
        clock = new MutableClock(1_700_000_000_000L);
        eventService = new RealtimeEventServiceImpl(rateLimiter, eventStore, broadcaster, relay, objectMapper, clock);
        when(rateLimiter.tryAdmit(anyString(), any(), any())).thenReturn(true);
        when(relay.publish(any())).thenReturn(true);
    }

    private RecordingEventSink connect(DefaultLocalBroadcaster target, String connectionId, String userId,
        String... roles) {
        RecordingEventSink sink = new RecordingEventSink();
        ClientConnection connection = ClientConnection.builder().connectionId(connectionId).userId(userId)
            .roles(Arrays.asList(roles)).sink(sink).sendExecutor(Runnable::run).sendQueueCapacity(16).build();
        connection.transition(ConnectionState.CONNECTING, ConnectionState.OPEN);
        target.registerConnection(connection);
        return sink;
    }

    // ====== Emission Pipeline Tests ======

    @Test
    public void testEmitStoresDeliversAndPublishes() {
        RecordingEventSink sink = connect(broadcaster, "c1", "u1");
        Map<String, Object> data = new HashMap<>();
        data.put("title", "Report ready");

        String eventId = eventService.emit("notification", data, EventTargets.users("u1"), Priority.NORMAL);

        assertNotNull(eventId, "Event ID should not be null");
        List<Event> stored = eventStore.list(null);
        assertEquals(1, stored.size(), "Event should be stored");
        assertEquals(eventId, stored.get(0).getId());
        assertEquals("Report ready", stored.get(0).getData().get("title").asText(), "Payload should be kept");
        assertEquals(1, sink.getSent().size(), "Local connection should receive the event");
        assertEquals(eventId, sink.getSent().get(0).getId());

        ArgumentCaptor<Event> published = ArgumentCaptor.forClass(Event.class);
        verify(relay).publish(published.capture());
        assertEquals(eventId, published.getValue().getId(), "Same event should be relayed");
        verify(rateLimiter).tryAdmit("notification", Collections.singleton("u1"), Priority.NORMAL);
    }

    @Test
    public void testDefaultsToBroadcastAndNormalPriority() {
        eventService.emit("dashboardUpdate", null, null, null);

        Event stored = eventStore.list(null).get(0);
        assertTrue(stored.getTargets().isBroadcast(), "Missing targets should mean broadcast");
        assertTrue(stored.getData().isNull(), "Missing data should be stored as null");
        verify(rateLimiter).tryAdmit("dashboardUpdate", Collections.emptySet(), Priority.NORMAL);
    }

    @Test
    public void testEmptyTypeRejected() {
        assertThrows(IllegalArgumentException.class, () -> eventService.broadcastEvent(" ", "x"));
    }

    @Test
    public void testRateLimitedEmissionHasNoEffect() {
        RecordingEventSink sink = connect(broadcaster, "c1", "u1");
        when(rateLimiter.tryAdmit(anyString(), any(), any())).thenReturn(false);

        RateLimitExceededException exception = assertThrows(RateLimitExceededException.class,
            () -> eventService.sendEventToUser("u1", "notification", "hello"));

        assertEquals("notification", exception.getEventType());
        assertTrue(eventStore.list(null).isEmpty(), "Rejected event should not be stored");
        assertTrue(sink.getSent().isEmpty(), "Rejected event should not be delivered");
        verify(relay, never()).publish(any());
    }

    @Test
    public void testTimestampsStrictlyIncrease() {
        long previous = 0;
        for (int i = 0; i < 5; i++) {
            eventService.broadcastEvent("tick", i);
        }
        List<Event> events = eventStore.list(null);
        Collections.reverse(events);
        for (Event event : events) {
            assertTrue(event.getTimestamp() > previous, "Timestamps should never repeat under a frozen clock");
            previous = event.getTimestamp();
        }
        assertEquals(clock.millis() + 4, previous);
    }

    // ====== Degraded Mode Tests ======

    @Test
    public void testStoreFailureWithLocalDelivery() {
        EventStore failingStore = mock(EventStore.class);
        when(failingStore.append(any())).thenThrow(new EventStoreException("down"));
        when(relay.publish(any())).thenReturn(false);
        RealtimeEventServiceImpl service =
            new RealtimeEventServiceImpl(rateLimiter, failingStore, broadcaster, relay, objectMapper, clock);
        RecordingEventSink sink = connect(broadcaster, "c1", "u1");

        assertNotNull(service.broadcastEvent("notification", "hello"), "Local delivery should be enough");
        assertEquals(1, sink.getSent().size());
    }

    @Test
    public void testNoDeliveryPath() {
        EventStore failingStore = mock(EventStore.class);
        when(failingStore.append(any())).thenThrow(new EventStoreException("down"));
        when(relay.publish(any())).thenReturn(false);
        RealtimeEventServiceImpl service =
            new RealtimeEventServiceImpl(rateLimiter, failingStore, broadcaster, relay, objectMapper, clock);

        assertThrows(NoDeliveryPathException.class, () -> service.broadcastEvent("notification", "hello"));
    }

    @Test
    public void testRelayFailureStillStores() {
        when(relay.publish(any())).thenReturn(false);

        assertNotNull(eventService.broadcastEvent("notification", "hello"));
        assertEquals(1, eventStore.size(), "Event should be stored for polling clients");
    }

    // ====== Typed Payload Tests ======

    @Test
    public void testEmitNotification() {
        RecordingEventSink sink = connect(broadcaster, "c1", "u1");

        eventService.emitNotification("Build finished", "All green", null, "u1");

        Event event = eventStore.list(null).get(0);
        assertEquals("notification", event.getType());
        assertEquals("Build finished", event.getData().get("title").asText());
        assertEquals("info", event.getData().get("level").asText(), "Level should default to info");
        assertFalse(event.getData().has("eventType"), "Type discriminator should not leak into the payload");
        assertEquals(Collections.singleton("u1"), event.getTargets().getUserIds());
        assertEquals(1, sink.getSent().size());
    }

    @Test
    public void testEmitDashboardUpdate() {
        Map<String, Object> data = new HashMap<>();
        data.put("activeUsers", 12);

        eventService.emitDashboardUpdate("stats", data);

        Event event = eventStore.list(null).get(0);
        assertEquals("dashboardUpdate", event.getType());
        assertEquals("stats", event.getData().get("updateType").asText());
        assertEquals(12, event.getData().get("data").get("activeUsers").asInt());
        assertTrue(event.getTargets().isBroadcast());
    }

    // ====== Relay Tests ======

    @Test
    @SuppressWarnings("unchecked")
    public void testRemoteEventsAreDeliveredButNotStored() {
        RecordingEventSink sink = connect(broadcaster, "c1", "u1");
        eventService.start();
        eventService.start();

        ArgumentCaptor<Consumer<Event>> handler = ArgumentCaptor.forClass(Consumer.class);
        verify(relay, times(1)).subscribe(handler.capture());
        handler.getValue().accept(Event.builder().id("remote").type("notification").timestamp(5L).build());

        assertEquals(1, sink.getSent().size(), "Remote event should be delivered locally");
        assertTrue(eventStore.list(null).isEmpty(), "Remote event should not be stored again");
        verify(relay, never()).publish(any());
    }

    @Test
    public void testEventReachesEveryInstanceExactlyOnce() {
        InMemoryRelayBus bus = new InMemoryRelayBus();
        InMemoryEventStore sharedStore = new InMemoryEventStore(100);
        DefaultLocalBroadcaster broadcasterA = new DefaultLocalBroadcaster();
        DefaultLocalBroadcaster broadcasterB = new DefaultLocalBroadcaster();
        RealtimeEventServiceImpl serviceA = new RealtimeEventServiceImpl(rateLimiter, sharedStore, broadcasterA,
            bus.relay("node-a"), objectMapper, clock);
        RealtimeEventServiceImpl serviceB = new RealtimeEventServiceImpl(rateLimiter, sharedStore, broadcasterB,
            bus.relay("node-b"), objectMapper, clock);
        serviceA.start();
        serviceB.start();
        RecordingEventSink onA = connect(broadcasterA, "a1", "u1");
        RecordingEventSink onB = connect(broadcasterB, "b1", "u1");
        RecordingEventSink otherOnB = connect(broadcasterB, "b2", "u2");

        serviceA.sendEventToUser("u1", "notification", "hello");

        assertEquals(1, onA.getSent().size(), "Connection on the emitting instance should get the event once");
        assertEquals(1, onB.getSent().size(), "Connection on the other instance should get the event once");
        assertTrue(otherOnB.getSent().isEmpty(), "Other users should not get the event");
        assertEquals(1, sharedStore.size(), "Event should be stored once");
    }

    /**
     * Pub/sub channel shared by relays in one process
     */
    private static class InMemoryRelayBus {

        private final List<BusRelay> relays = new CopyOnWriteArrayList<>();

        CrossProcessRelay relay(String instanceId) {
            BusRelay relay = new BusRelay(instanceId);
            relays.add(relay);
            return relay;
        }

        private class BusRelay implements CrossProcessRelay {

            private final String instanceId;
            private final List<Consumer<Event>> handlers = new ArrayList<>();

            BusRelay(String instanceId) {
                this.instanceId = instanceId;
            }

            @Override
            public boolean publish(Event event) {
                for (BusRelay relay : relays) {
                    if (!relay.instanceId.equals(instanceId)) {
                        relay.handlers.forEach(handler -> handler.accept(event));
                    }
                }
                return true;
            }

            @Override
            public void subscribe(Consumer<Event> handler) {
                handlers.add(handler);
            }

            @Override
            public boolean isLocalOnly() {
                return false;
            }

            @Override
            public Set<String> getActiveInstances() {
                return Collections.singleton(instanceId);
            }

            @Override
            public void start() {
            }

            @Override
            public void stop() {
            }
        }
    }
}
