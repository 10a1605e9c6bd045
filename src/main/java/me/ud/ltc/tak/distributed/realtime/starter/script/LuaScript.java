package me.ud.ltc.tak.distributed.realtime.starter.script;

import lombok.Getter;

/**
 * Lua script enumeration
 *
 * @author takltc
 */
@Getter
public enum LuaScript {

    /**
     * Push an event to the head of the history list and trim it
     */
    APPEND_EVENT("append_event.lua"),

    /**
     * Check and increment rate limit counters, all or nothing
     */
    RATE_LIMIT_ADMIT("rate_limit_admit.lua");

    private final String fileName;

    LuaScript(String fileName) {
        this.fileName = fileName;
    }

}
