package me.ud.ltc.tak.distributed.realtime.starter.balancer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis Health Checker Test
 *
 * @author takltc
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class RedisHealthCheckerTest {

    @Mock
    private StringRedisTemplate redis;

    private BackendInstance instance;

    @BeforeEach
    public void setUp() {
        instance = new BackendInstance("redis-0", 1, true, redis);
    }

    @Test
    public void testSuccessfulProbePromotes() {
        instance.recordFailure(1, System.currentTimeMillis());
        RedisHealthChecker checker =
            new RedisHealthChecker(Collections.singletonList(instance), i -> { }, 1000, 500, 3);

        assertTrue(checker.check(instance), "Probe should succeed");

        assertTrue(instance.isHealthy(), "Successful probe should promote the instance");
        assertEquals(0, instance.snapshot().getConsecutiveErrors());
    }

    @Test
    public void testFailedProbesDemote() {
        RedisHealthChecker checker = new RedisHealthChecker(Collections.singletonList(instance), i -> {
            throw new RedisConnectionFailureException("Connection refused");
        }, 1000, 500, 2);

        assertFalse(checker.check(instance));
        assertTrue(instance.isHealthy(), "One failure is below the threshold");
        assertFalse(checker.check(instance));
        assertFalse(instance.isHealthy(), "Second failure should demote");
    }

    @Test
    public void testSlowProbeTimesOut() {
        RedisHealthChecker checker = new RedisHealthChecker(Collections.singletonList(instance), i -> {
            Thread.sleep(2000);
        }, 60000, 50, 1);
        checker.start();
        try {
            long started = System.currentTimeMillis();
            assertFalse(checker.check(instance), "Slow probe should fail");
            assertTrue(System.currentTimeMillis() - started < 1500, "Check should not wait for the probe");
            assertFalse(instance.isHealthy());
        } finally {
            checker.stop();
        }
    }

    @Test
    public void testCheckAllSkipsInactive() {
        BackendInstance inactive = new BackendInstance("redis-1", 1, false, redis);
        AtomicInteger probes = new AtomicInteger();
        RedisHealthChecker checker = new RedisHealthChecker(Arrays.asList(instance, inactive),
            i -> probes.incrementAndGet(), 1000, 500, 3);

        checker.checkAll();

        assertEquals(1, probes.get(), "Only active instances should be probed");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testPingProbe() throws Exception {
        when(redis.execute(any(RedisCallback.class))).thenReturn("PONG");

        assertDoesNotThrow(() -> RedisHealthChecker.PING_PROBE.probe(instance));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testPingProbeUnexpectedReply() {
        when(redis.execute(any(RedisCallback.class))).thenReturn("LOADING");

        assertThrows(IllegalStateException.class, () -> RedisHealthChecker.PING_PROBE.probe(instance));
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalStateException.class,
            () -> new RedisHealthChecker(Collections.singletonList(instance), null, 0, 500, 3));
    }
}
