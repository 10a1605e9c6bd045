package me.ud.ltc.tak.distributed.realtime.starter.script;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import me.ud.ltc.tak.distributed.realtime.starter.exception.RealtimeDeliveryException;

/**
 * Lua Script Service Test
 *
 * @author takltc
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class LuaScriptServiceImplTest {

    @Mock
    private StringRedisTemplate redis;

    private LuaScriptProperties properties;
    private LuaScriptServiceImpl luaScriptService;

    @BeforeEach
    public void setUp() {
        properties = new LuaScriptProperties();
        properties.setRetryCount(1);
        properties.setRetryInterval(1);
        luaScriptService = new LuaScriptServiceImpl(properties);
    }

    // ====== Script Loading Tests ======

    @Test
    public void testAppendEventScriptContent() {
        String content = luaScriptService.getScriptContent(LuaScript.APPEND_EVENT);

        assertNotNull(content, "Script content should not be null");
        assertTrue(content.contains("LPUSH"), "History script should push to the list head");
        assertTrue(content.contains("LTRIM"), "History script should trim the list");
    }

    @Test
    public void testRateLimitScriptContent() {
        String content = luaScriptService.getScriptContent(LuaScript.RATE_LIMIT_ADMIT);

        assertNotNull(content, "Script content should not be null");
        assertTrue(content.contains("INCR"), "Rate limit script should increment counters");
        assertTrue(content.contains("EXPIRE"), "Rate limit script should expire counters");
    }

    @Test
    public void testReloadAllScripts() {
        String before = luaScriptService.getScriptContent(LuaScript.APPEND_EVENT);

        assertDoesNotThrow(() -> luaScriptService.reloadAllScripts());

        assertEquals(before, luaScriptService.getScriptContent(LuaScript.APPEND_EVENT),
            "Reloaded script should be unchanged");
    }

    @Test
    public void testMissingScriptFails() {
        LuaScriptProperties missing = new LuaScriptProperties();
        missing.setScriptPathPrefix("missing/");
        missing.setScriptCacheEnabled(false);
        LuaScriptServiceImpl service = new LuaScriptServiceImpl(missing);

        assertThrows(RealtimeDeliveryException.class, () -> service.getScriptContent(LuaScript.APPEND_EVENT),
            "Missing script should fail");
    }

    // ====== Execution Tests ======

    @Test
    @SuppressWarnings("unchecked")
    public void testExecuteScriptReturnsResult() {
        when(redis.execute(any(RedisCallback.class))).thenReturn(3L);

        Long result = luaScriptService.executeScript(redis, LuaScript.APPEND_EVENT,
            Collections.singletonList("realtime:events"), Arrays.asList("{}", "100", "0"), ReturnType.INTEGER);

        assertEquals(Long.valueOf(3L), result, "Script result should be returned");
        verify(redis, times(1)).execute(any(RedisCallback.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testExecuteScriptRetriesOnce() {
        when(redis.execute(any(RedisCallback.class)))
            .thenThrow(new RedisConnectionFailureException("Connection refused")).thenReturn(1L);

        Long result = luaScriptService.executeScript(redis, LuaScript.RATE_LIMIT_ADMIT,
            Collections.singletonList("realtime:{ratelimit}:type:alert:0"), Arrays.asList("10", "30", "60"),
            ReturnType.INTEGER);

        assertEquals(Long.valueOf(1L), result, "Retry should return the second result");
        verify(redis, times(2)).execute(any(RedisCallback.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testExecuteScriptFailsAfterRetries() {
        when(redis.execute(any(RedisCallback.class)))
            .thenThrow(new RedisConnectionFailureException("Connection refused"));

        RealtimeDeliveryException exception = assertThrows(RealtimeDeliveryException.class,
            () -> luaScriptService.executeScript(redis, LuaScript.APPEND_EVENT,
                Collections.singletonList("realtime:events"), Arrays.asList("{}", "100", "0"), ReturnType.INTEGER));

        assertTrue(exception.getMessage().contains("APPEND_EVENT"), "Message should name the script");
        assertTrue(exception.getCause() instanceof RedisConnectionFailureException, "Cause should be kept");
        verify(redis, times(2)).execute(any(RedisCallback.class));
    }
}
