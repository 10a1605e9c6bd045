package me.ud.ltc.tak.distributed.realtime.starter.service;

import java.util.Set;
import java.util.function.Consumer;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;

/**
 * Forwards events to the other processes of the cluster
 *
 * @author takltc
 */
public interface CrossProcessRelay {

    /**
     * Publish an event to the other processes
     *
     * @param event Event
     * @return false if the event could not be published; the relay is then in local-only mode
     */
    boolean publish(Event event);

    /**
     * Register the handler for events published by other processes. Events published by this process are never
     * handed back to it.
     *
     * @param handler Handler
     */
    void subscribe(Consumer<Event> handler);

    boolean isLocalOnly();

    /**
     * Instances currently registered in the cluster
     *
     * @return Instance IDs
     */
    Set<String> getActiveInstances();

    void start();

    void stop();
}
