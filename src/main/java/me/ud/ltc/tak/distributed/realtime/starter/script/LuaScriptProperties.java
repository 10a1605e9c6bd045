package me.ud.ltc.tak.distributed.realtime.starter.script;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Lua script configuration properties class
 *
 * @author takltc
 */
@Data
@ConfigurationProperties(prefix = "takltc.realtime.script")
public class LuaScriptProperties {

    /**
     * Script file path prefix
     */
    private String scriptPathPrefix = "lua/";

    /**
     * Lua script retry count
     */
    private int retryCount = 1;

    /**
     * Lua script retry interval (milliseconds)
     */
    private int retryInterval = 50;

    /**
     * Whether to enable script caching
     */
    private boolean scriptCacheEnabled = true;
}
