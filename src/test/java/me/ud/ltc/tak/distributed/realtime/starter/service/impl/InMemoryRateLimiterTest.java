package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.model.Priority;

/**
 * In-Memory Rate Limiter Test
 *
 * @author takltc
 */
public class InMemoryRateLimiterTest {

    private RealtimeProperties properties;
    private MutableClock clock;
    private InMemoryRateLimiter rateLimiter;

    @BeforeEach
    public void setUp() {
        properties = new RealtimeProperties();
        clock = new MutableClock(1_700_000_000_000L);
        rateLimiter = new InMemoryRateLimiter(properties, clock);
    }

    private static List<String> users(String... ids) {
        return Arrays.asList(ids);
    }

    @Test
    public void testPerUserLimit() {
        for (int i = 0; i < 10; i++) {
            assertTrue(rateLimiter.tryAdmit("notification", users("u1"), Priority.NORMAL), "Event " + i);
        }

        assertFalse(rateLimiter.tryAdmit("notification", users("u1"), Priority.NORMAL),
            "Eleventh event should be rejected");
        assertTrue(rateLimiter.tryAdmit("notification", users("u2"), Priority.NORMAL),
            "Other users should be unaffected");
    }

    @Test
    public void testPerTypeLimit() {
        for (int i = 0; i < 30; i++) {
            assertTrue(rateLimiter.tryAdmit("alert", users("user" + i), Priority.NORMAL));
        }

        assertFalse(rateLimiter.tryAdmit("alert", users("fresh"), Priority.NORMAL),
            "Thirty-first event of the type should be rejected");
        assertTrue(rateLimiter.tryAdmit("other", users("fresh"), Priority.NORMAL),
            "Other types should be unaffected");
    }

    @Test
    public void testBroadcastCountsTypeOnly() {
        for (int i = 0; i < 30; i++) {
            assertTrue(rateLimiter.tryAdmit("dashboardUpdate", Collections.emptySet(), Priority.NORMAL));
        }

        assertFalse(rateLimiter.tryAdmit("dashboardUpdate", Collections.emptySet(), Priority.NORMAL));
    }

    @Test
    public void testHighPriorityBypasses() {
        for (int i = 0; i < 10; i++) {
            rateLimiter.tryAdmit("notification", users("u1"), Priority.NORMAL);
        }

        for (int i = 0; i < 50; i++) {
            assertTrue(rateLimiter.tryAdmit("notification", users("u1"), Priority.HIGH),
                "High priority should never be limited");
        }
    }

    @Test
    public void testRejectionConsumesNothing() {
        for (int i = 0; i < 10; i++) {
            rateLimiter.tryAdmit("notification", users("u1"), Priority.NORMAL);
        }

        assertFalse(rateLimiter.tryAdmit("notification", users("u1", "u2"), Priority.NORMAL),
            "Multi-user emission should be rejected when one user is at the limit");

        for (int i = 0; i < 10; i++) {
            assertTrue(rateLimiter.tryAdmit("notification", users("u2"), Priority.NORMAL),
                "Rejected emission should not have counted for u2");
        }
    }

    @Test
    public void testWindowResets() {
        for (int i = 0; i < 10; i++) {
            rateLimiter.tryAdmit("notification", users("u1"), Priority.NORMAL);
        }
        assertFalse(rateLimiter.tryAdmit("notification", users("u1"), Priority.NORMAL));

        clock.advance(60_000);

        assertTrue(rateLimiter.tryAdmit("notification", users("u1"), Priority.NORMAL),
            "Counters should reset in the next window");
    }

    @Test
    public void testDisabled() {
        properties.getRateLimit().setEnabled(false);
        InMemoryRateLimiter disabled = new InMemoryRateLimiter(properties, clock);

        for (int i = 0; i < 100; i++) {
            assertTrue(disabled.tryAdmit("notification", users("u1"), Priority.LOW));
        }
    }

    // ====== Request counters ======

    @Test
    public void testRequestCounterPerKey() {
        for (int i = 0; i < 60; i++) {
            assertTrue(rateLimiter.tryAcquire("polling", "u1", 60), "Poll " + i);
        }

        assertFalse(rateLimiter.tryAcquire("polling", "u1", 60), "Sixty-first poll should be rejected");
        assertTrue(rateLimiter.tryAcquire("polling", "u2", 60), "Other users should be unaffected");
        assertTrue(rateLimiter.tryAcquire("connect-user", "u1", 5), "Other scopes should be unaffected");
    }

    @Test
    public void testRequestCounterDoesNotShareEmissionCounters() {
        for (int i = 0; i < 5; i++) {
            assertTrue(rateLimiter.tryAcquire("connect-user", "u1", 5));
        }

        assertTrue(rateLimiter.tryAdmit("notification", users("u1"), Priority.NORMAL),
            "Connection attempts should not count as emissions");
    }

    @Test
    public void testRequestCounterResetsAndCanBeDisabled() {
        assertTrue(rateLimiter.tryAcquire("connect-ip", "10.0.0.1", 1));
        assertFalse(rateLimiter.tryAcquire("connect-ip", "10.0.0.1", 1));

        clock.advance(60_000);
        assertTrue(rateLimiter.tryAcquire("connect-ip", "10.0.0.1", 1), "Counter should reset in the next window");

        for (int i = 0; i < 100; i++) {
            assertTrue(rateLimiter.tryAcquire("connect-ip", "10.0.0.1", 0), "A zero limit disables the check");
        }
    }

    @Test
    public void testWindowStart() {
        assertEquals(120_000L, RedisRateLimiter.windowStart(150_000L, 60));
        assertEquals(120_000L, RedisRateLimiter.windowStart(120_000L, 60));
    }
}
