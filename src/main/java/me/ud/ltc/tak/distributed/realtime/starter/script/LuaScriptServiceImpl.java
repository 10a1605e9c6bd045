package me.ud.ltc.tak.distributed.realtime.starter.script;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.util.StreamUtils;

import me.ud.ltc.tak.distributed.realtime.starter.exception.RealtimeDeliveryException;

import lombok.extern.slf4j.Slf4j;

/**
 * Lua script service implementation class
 *
 * @author takltc
 */
@Slf4j
public class LuaScriptServiceImpl implements LuaScriptService {

    private final LuaScriptProperties luaScriptProperties;

    /**
     * Script cache
     */
    private final Map<LuaScript, String> scriptCache = new ConcurrentHashMap<>();

    public LuaScriptServiceImpl(LuaScriptProperties luaScriptProperties) {
        this.luaScriptProperties = luaScriptProperties != null ? luaScriptProperties : new LuaScriptProperties();
        if (this.luaScriptProperties.isScriptCacheEnabled()) {
            preloadScripts();
        }
    }

    public LuaScriptServiceImpl() {
        this(null);
    }

    /**
     * Preload all scripts
     */
    private void preloadScripts() {
        for (LuaScript script : LuaScript.values()) {
            try {
                scriptCache.put(script, loadScriptFromFile(script.getFileName()));
                log.debug("Preloading Lua script: {}", script.name());
            } catch (Exception e) {
                log.error("Failed to preload Lua script: {}", script.name(), e);
            }
        }
    }

    @Override
    public <T> T executeScript(RedisOperations<String, String> redis, LuaScript script, List<String> keys,
        List<String> args, ReturnType returnType) {
        int maxRetries = Math.max(0, luaScriptProperties.getRetryCount());
        int retryInterval = luaScriptProperties.getRetryInterval();
        byte[] scriptBytes = getScriptContent(script).getBytes(StandardCharsets.UTF_8);

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return redis.execute((RedisCallback<T>)connection -> {
                    byte[][] keysAndArgs = new byte[keys.size() + args.size()][];
                    int index = 0;
                    for (String key : keys) {
                        keysAndArgs[index++] = key.getBytes(StandardCharsets.UTF_8);
                    }
                    for (String arg : args) {
                        keysAndArgs[index++] = arg.getBytes(StandardCharsets.UTF_8);
                    }
                    return connection.eval(scriptBytes, returnType, keys.size(), keysAndArgs);
                });
            } catch (Exception e) {
                if (attempt < maxRetries) {
                    log.warn("Failed to execute Lua script: {}, attempt: {}/{}", script.name(), attempt + 1,
                        maxRetries + 1, e);
                    try {
                        Thread.sleep(retryInterval);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RealtimeDeliveryException("Execution of Lua script interrupted: " + script.name(), ie);
                    }
                } else {
                    log.error("Failed to execute Lua script ultimately: {}", script.name(), e);
                    throw new RealtimeDeliveryException("Failed to execute Lua script ultimately: " + script.name(), e);
                }
            }
        }

        throw new RealtimeDeliveryException("Failed to execute Lua script: " + script.name());
    }

    @Override
    public String getScriptContent(LuaScript script) {
        String cached = scriptCache.get(script);
        if (cached != null) {
            return cached;
        }

        try {
            String content = loadScriptFromFile(script.getFileName());
            if (luaScriptProperties.isScriptCacheEnabled()) {
                scriptCache.put(script, content);
            }
            return content;
        } catch (IOException e) {
            log.error("Failed to get Lua script content: {}", script.name(), e);
            throw new RealtimeDeliveryException("Failed to get Lua script content: " + script.name(), e);
        }
    }

    @Override
    public void reloadAllScripts() {
        scriptCache.clear();
        for (LuaScript script : LuaScript.values()) {
            try {
                getScriptContent(script);
                log.info("Successfully reloaded Lua script: {}", script.name());
            } catch (Exception e) {
                log.error("Failed to reload Lua script: {}", script.name(), e);
            }
        }
    }

    /**
     * Load script content from file
     *
     * @param fileName File name
     * @return Script content
     * @throws IOException IO exception
     */
    private String loadScriptFromFile(String fileName) throws IOException {
        String fullPath = luaScriptProperties.getScriptPathPrefix() + fileName;
        ClassPathResource resource = new ClassPathResource(fullPath);

        try (InputStream inputStream = resource.getInputStream()) {
            return StreamUtils.copyToString(inputStream, StandardCharsets.UTF_8);
        }
    }
}
