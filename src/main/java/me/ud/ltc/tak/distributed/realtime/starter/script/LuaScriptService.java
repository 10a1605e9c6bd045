package me.ud.ltc.tak.distributed.realtime.starter.script;

import java.util.List;

import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.core.RedisOperations;

/**
 * Lua script service interface
 *
 * @author takltc
 */
public interface LuaScriptService {

    /**
     * Execute Lua script on the given Redis instance
     *
     * @param redis Redis instance to run the script on
     * @param script Script
     * @param keys Key list
     * @param args Argument list
     * @param returnType Return type
     * @return Execution result
     */
    <T> T executeScript(RedisOperations<String, String> redis, LuaScript script, List<String> keys,
        List<String> args, ReturnType returnType);

    /**
     * Get script content
     *
     * @param script Script
     * @return Script content
     */
    String getScriptContent(LuaScript script);

    /**
     * Reload all scripts
     */
    void reloadAllScripts();
}
