package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import com.fasterxml.jackson.databind.ObjectMapper;

import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.model.RelayEnvelope;
import me.ud.ltc.tak.distributed.realtime.starter.service.CrossProcessRelay;

import lombok.extern.slf4j.Slf4j;

/**
 * Relay over Redis pub/sub. Every envelope carries the publishing instance ID so an instance never redelivers its
 * own events. Publish failures switch the relay to local-only mode until the next successful publish.
 *
 * @author takltc
 */
@Slf4j
public class RedisCrossProcessRelay implements CrossProcessRelay {

    private final RedisOperations<String, String> redis;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final String instanceId;
    private final String prefix;
    private final ChannelTopic topic;
    private final int instanceTtl;

    private final List<Consumer<Event>> handlers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean localOnly = new AtomicBoolean(false);
    private final MessageListener messageListener =
        (message, pattern) -> handleMessage(new String(message.getBody(), StandardCharsets.UTF_8));

    private volatile ScheduledExecutorService registrationExecutor;

    public RedisCrossProcessRelay(RealtimeProperties properties, RedisOperations<String, String> redis,
        RedisMessageListenerContainer listenerContainer, ObjectMapper objectMapper, String instanceId) {
        this.redis = redis;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper;
        this.instanceId = instanceId;
        this.prefix = properties.getRedis().getPrefix();
        this.topic = new ChannelTopic(properties.getRelay().getChannel());
        this.instanceTtl = properties.getRelay().getInstanceTtl();
        if (instanceTtl <= 0) {
            throw new IllegalStateException("Instance registration TTL must be greater than 0");
        }
    }

    @Override
    public synchronized void start() {
        try {
            listenerContainer.addMessageListener(messageListener, topic);
            log.info("Subscribed to relay channel {} as instance {}", topic.getTopic(), instanceId);
        } catch (Exception e) {
            localOnly.set(true);
            log.warn("Unable to subscribe to relay channel {}, running in local-only mode", topic.getTopic(), e);
        }

        registerInstance();
        if (registrationExecutor == null) {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
                Thread t = new Thread(r, "realtime-instance-registration");
                t.setDaemon(true);
                return t;
            });
            executor.setRemoveOnCancelPolicy(true);
            long refresh = Math.max(1, instanceTtl / 3);
            executor.scheduleAtFixedRate(this::registerInstance, refresh, refresh, TimeUnit.SECONDS);
            registrationExecutor = executor;
        }
    }

    @Override
    public synchronized void stop() {
        if (registrationExecutor != null) {
            registrationExecutor.shutdownNow();
            registrationExecutor = null;
        }
        try {
            listenerContainer.removeMessageListener(messageListener, topic);
        } catch (Exception e) {
            log.warn("Error unsubscribing from relay channel {}", topic.getTopic(), e);
        }
        try {
            redis.delete(instanceKey(instanceId));
            log.info("Instance {} unregistered", instanceId);
        } catch (Exception e) {
            log.warn("Error unregistering instance {}", instanceId, e);
        }
    }

    @Override
    public boolean publish(Event event) {
        try {
            String body = objectMapper.writeValueAsString(new RelayEnvelope(instanceId, event));
            redis.convertAndSend(topic.getTopic(), body);
            if (localOnly.compareAndSet(true, false)) {
                log.info("Relay channel {} reachable again, leaving local-only mode", topic.getTopic());
            }
            return true;
        } catch (Exception e) {
            if (localOnly.compareAndSet(false, true)) {
                log.warn("Unable to publish to relay channel {}, running in local-only mode", topic.getTopic(), e);
            } else {
                log.debug("Relay publish of event {} failed", event.getId(), e);
            }
            return false;
        }
    }

    @Override
    public void subscribe(Consumer<Event> handler) {
        handlers.add(handler);
    }

    @Override
    public boolean isLocalOnly() {
        return localOnly.get();
    }

    /**
     * Handle a raw envelope received on the relay channel
     *
     * @param body Envelope JSON
     */
    void handleMessage(String body) {
        RelayEnvelope envelope;
        try {
            envelope = objectMapper.readValue(body, RelayEnvelope.class);
        } catch (Exception e) {
            log.error("Error processing relay message", e);
            return;
        }
        if (envelope.getEvent() == null || instanceId.equals(envelope.getSource())) {
            return;
        }
        log.debug("Received event {} from instance {}", envelope.getEvent().getId(), envelope.getSource());
        for (Consumer<Event> handler : handlers) {
            try {
                handler.accept(envelope.getEvent());
            } catch (Exception e) {
                log.error("Error handling relayed event {}", envelope.getEvent().getId(), e);
            }
        }
    }

    private void registerInstance() {
        try {
            redis.opsForValue().set(instanceKey(instanceId), String.valueOf(System.currentTimeMillis()),
                Duration.ofSeconds(instanceTtl));
        } catch (Exception e) {
            log.warn("Unable to register instance {}", instanceId, e);
        }
    }

    @Override
    public Set<String> getActiveInstances() {
        String keyPrefix = instanceKey("");
        String pattern = keyPrefix + "*";
        try {
            Set<String> keys = redis.execute(new RedisCallback<Set<String>>() {
                @Override
                public Set<String> doInRedis(RedisConnection connection) throws DataAccessException {
                    Set<String> result = new HashSet<>();
                    Cursor<byte[]> cursor =
                        connection.scan(ScanOptions.scanOptions().match(pattern).count(100).build());
                    try {
                        while (cursor.hasNext()) {
                            result.add(new String(cursor.next(), StandardCharsets.UTF_8));
                        }
                    } finally {
                        try {
                            cursor.close();
                        } catch (Exception e) {
                            log.warn("Error closing SCAN cursor", e);
                        }
                    }
                    return result;
                }
            });
            Set<String> instances = new HashSet<>();
            if (keys != null) {
                for (String key : keys) {
                    instances.add(key.substring(keyPrefix.length()));
                }
            }
            return instances;
        } catch (Exception e) {
            log.warn("Unable to list active instances", e);
            return Collections.singleton(instanceId);
        }
    }

    private String instanceKey(String id) {
        return prefix + "instances:" + id;
    }
}
