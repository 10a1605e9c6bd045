package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.util.Collections;
import java.util.Set;
import java.util.function.Consumer;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.service.CrossProcessRelay;

/**
 * Relay of a single node deployment: there is nobody to forward to, so publishing always succeeds
 *
 * @author takltc
 */
public class LocalOnlyRelay implements CrossProcessRelay {

    private final String instanceId;

    public LocalOnlyRelay(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public boolean publish(Event event) {
        return true;
    }

    @Override
    public void subscribe(Consumer<Event> handler) {
        // Nothing is ever received
    }

    @Override
    public boolean isLocalOnly() {
        return true;
    }

    @Override
    public Set<String> getActiveInstances() {
        return Collections.singleton(instanceId);
    }

    @Override
    public void start() {
        // No resources
    }

    @Override
    public void stop() {
        // No resources
    }
}
