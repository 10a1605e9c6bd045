package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.springframework.data.redis.connection.ReturnType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import me.ud.ltc.tak.distributed.realtime.starter.balancer.OperationResult;
import me.ud.ltc.tak.distributed.realtime.starter.balancer.RedisLoadBalancer;
import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.exception.EventStoreException;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.script.LuaScript;
import me.ud.ltc.tak.distributed.realtime.starter.script.LuaScriptService;
import me.ud.ltc.tak.distributed.realtime.starter.service.EventStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Event history in a capped Redis list, newest at the head. Push and trim run in one Lua script so the cap holds
 * under concurrent appends from every instance.
 *
 * @author takltc
 */
@Slf4j
public class RedisEventStore implements EventStore {

    private final RedisLoadBalancer loadBalancer;
    private final LuaScriptService luaScriptService;
    private final ObjectMapper objectMapper;
    private final String key;
    private final int maxEvents;
    private final int historyTtl;

    public RedisEventStore(RealtimeProperties properties, RedisLoadBalancer loadBalancer,
        LuaScriptService luaScriptService, ObjectMapper objectMapper) {
        this.loadBalancer = loadBalancer;
        this.luaScriptService = luaScriptService;
        this.objectMapper = objectMapper;
        this.key = properties.getRedis().getPrefix() + "events";
        this.maxEvents = properties.getEventStore().getMaxEvents();
        this.historyTtl = properties.getEventStore().getHistoryTtl();
        if (maxEvents <= 0) {
            throw new IllegalStateException("Maximum stored events must be greater than 0");
        }
    }

    @Override
    public String append(Event event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to serialize event: " + event.getId(), e);
        }

        OperationResult<Long> result = loadBalancer.execute(redis -> luaScriptService.executeScript(redis,
            LuaScript.APPEND_EVENT, Collections.singletonList(key),
            Arrays.asList(json, String.valueOf(maxEvents), String.valueOf(historyTtl)), ReturnType.INTEGER));
        if (!result.isSuccess()) {
            throw new EventStoreException("Failed to append event " + event.getId() + " to " + key,
                result.getError());
        }
        log.debug("Appended event {} on instance {}, history size: {}", event.getId(), result.getInstanceId(),
            result.getData());
        return event.getId();
    }

    @Override
    public List<Event> list(Long since) {
        OperationResult<List<String>> result = loadBalancer.execute(redis -> redis.opsForList().range(key, 0, -1));
        if (!result.isSuccess()) {
            throw new EventStoreException("Failed to read event history " + key, result.getError());
        }
        List<String> entries = result.getData();
        if (entries == null || entries.isEmpty()) {
            return Collections.emptyList();
        }

        List<Event> events = new ArrayList<>(entries.size());
        for (String entry : entries) {
            try {
                Event event = objectMapper.readValue(entry, Event.class);
                if (since == null || event.getTimestamp() > since) {
                    events.add(event);
                }
            } catch (Exception e) {
                log.warn("Skipping unparsable event history entry in {}", key, e);
            }
        }
        return events;
    }

    @Override
    public void clear() {
        OperationResult<Boolean> result = loadBalancer.execute(redis -> redis.delete(key));
        if (!result.isSuccess()) {
            throw new EventStoreException("Failed to clear event history " + key, result.getError());
        }
    }
}
