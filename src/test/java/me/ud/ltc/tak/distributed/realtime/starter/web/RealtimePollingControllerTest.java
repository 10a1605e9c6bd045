package me.ud.ltc.tak.distributed.realtime.starter.web;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.exception.EventStoreException;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.model.PollingBatch;
import me.ud.ltc.tak.distributed.realtime.starter.model.PollingQuery;
import me.ud.ltc.tak.distributed.realtime.starter.service.PollingGateway;
import me.ud.ltc.tak.distributed.realtime.starter.service.RateLimiter;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.ClaimedRoleResolver;

/**
 * Polling Endpoint Test
 *
 * @author takltc
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class RealtimePollingControllerTest {

    @Mock
    private PollingGateway pollingGateway;

    @Mock
    private RateLimiter rateLimiter;

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        when(rateLimiter.tryAcquire(anyString(), anyString(), anyInt())).thenReturn(true);
        RealtimePollingController controller = new RealtimePollingController(pollingGateway,
            new ClaimedRoleResolver(), rateLimiter, new RealtimeProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller).setControllerAdvice(new RealtimeExceptionHandler())
            .build();
    }

    private static Event event(String id, long timestamp) {
        return Event.builder().id(id).type("notification").timestamp(timestamp).build();
    }

    private PollingQuery capturedQuery() {
        ArgumentCaptor<PollingQuery> query = ArgumentCaptor.forClass(PollingQuery.class);
        verify(pollingGateway).poll(query.capture());
        return query.getValue();
    }

    private void returnBatch(PollingBatch batch) {
        when(pollingGateway.poll(any(PollingQuery.class))).thenReturn(batch);
    }

    // ====== Cursor ======

    @Test
    public void testPollReturnsEventsAndCursor() throws Exception {
        returnBatch(new PollingBatch(Arrays.asList(event("e1", 200), event("e2", 300)), false, 300L));

        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1").param("roles", "admin, ops")
            .param("since", "100")).andExpect(status().isOk()).andExpect(jsonPath("$.userId").value("u1"))
            .andExpect(jsonPath("$.since").value(100)).andExpect(jsonPath("$.cursor").value(300))
            .andExpect(jsonPath("$.events.length()").value(2)).andExpect(jsonPath("$.events[0].id").value("e1"))
            .andExpect(jsonPath("$.hasMore").value(false)).andExpect(jsonPath("$.nextPollRecommended").exists());

        PollingQuery query = capturedQuery();
        assertEquals("u1", query.getUserId());
        assertEquals(new LinkedHashSet<>(Arrays.asList("admin", "ops")), query.getRoles());
        assertEquals(Long.valueOf(100L), query.getSince());
        assertNull(query.getTypes(), "No type filter requested");
    }

    @Test
    public void testEmptyPollKeepsCursor() throws Exception {
        returnBatch(new PollingBatch(Collections.emptyList(), false, 500L));

        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1").param("since", "500"))
            .andExpect(status().isOk()).andExpect(jsonPath("$.cursor").value(500))
            .andExpect(jsonPath("$.events.length()").value(0));
    }

    @Test
    public void testTypeFilter() throws Exception {
        returnBatch(new PollingBatch(Collections.emptyList(), false, 0L));

        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1").param("types", "notification"))
            .andExpect(status().isOk());

        PollingQuery query = capturedQuery();
        assertEquals(Collections.emptySet(), query.getRoles());
        assertNull(query.getSince(), "First poll has no cursor");
        assertEquals(new LinkedHashSet<>(Collections.singletonList("notification")), query.getTypes());
    }

    // ====== Limit and age ======

    @Test
    public void testDefaultLimitAndMaxAge() throws Exception {
        returnBatch(new PollingBatch(Collections.emptyList(), false, 0L));

        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1")).andExpect(status().isOk())
            .andExpect(jsonPath("$.limit").value(20));

        PollingQuery query = capturedQuery();
        assertEquals(20, query.getLimit(), "Default limit");
        assertEquals(1800000L, query.getMaxAge(), "Events older than 30 minutes are skipped by default");
    }

    @Test
    public void testLimitIsClamped() throws Exception {
        returnBatch(new PollingBatch(Collections.emptyList(), false, 0L));

        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1").param("limit", "500"))
            .andExpect(status().isOk()).andExpect(jsonPath("$.limit").value(50));
        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1").param("limit", "0"))
            .andExpect(status().isOk()).andExpect(jsonPath("$.limit").value(1));
    }

    @Test
    public void testIncludeExpired() throws Exception {
        returnBatch(new PollingBatch(Collections.emptyList(), false, 0L));

        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1").param("includeExpired", "true"))
            .andExpect(status().isOk());

        assertEquals(0L, capturedQuery().getMaxAge(), "Expired events requested");
    }

    @Test
    public void testHasMoreAsksForAnImmediatePoll() throws Exception {
        returnBatch(new PollingBatch(Collections.singletonList(event("e1", 200)), true, 200L));

        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1").param("limit", "1"))
            .andExpect(status().isOk()).andExpect(jsonPath("$.hasMore").value(true))
            .andExpect(jsonPath("$.cursor").value(200));
    }

    // ====== Rate limit ======

    @Test
    public void testPollingRequestsAreRateLimited() throws Exception {
        when(rateLimiter.tryAcquire(RealtimePollingController.POLLING_SCOPE, "u1", 60)).thenReturn(false);

        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1"))
            .andExpect(status().isTooManyRequests()).andExpect(jsonPath("$.error").value("rate_limited"));

        verify(pollingGateway, never()).poll(any(PollingQuery.class));
    }

    // ====== Errors ======

    @Test
    public void testStoreUnavailable() throws Exception {
        when(pollingGateway.poll(any(PollingQuery.class))).thenThrow(new EventStoreException("down"));

        mockMvc.perform(get("/api/realtime/polling").param("userId", "u1"))
            .andExpect(status().isServiceUnavailable()).andExpect(jsonPath("$.error").value("store_unavailable"));
    }

    @Test
    public void testMissingUserId() throws Exception {
        mockMvc.perform(get("/api/realtime/polling")).andExpect(status().isBadRequest());
    }
}
