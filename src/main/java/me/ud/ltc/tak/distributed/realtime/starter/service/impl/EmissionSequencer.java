package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.time.Clock;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import lombok.extern.slf4j.Slf4j;

/**
 * Orders the emissions of this process.
 * <p>
 * Every emission takes a timestamp, strictly greater than the previous one, before it is appended to the history
 * and completes it once the append has returned. Appends run concurrently; completion actions (local fan-out) are
 * run in timestamp order, an emission waiting for the ones before it. Polling reads are bounded by
 * {@link #visibleThrough()}, so a cursor never passes an emission whose append is still in flight.
 *
 * @author takltc
 */
@Slf4j
public class EmissionSequencer {

    private final Clock clock;

    /**
     * Emissions that have a timestamp and are not released yet, by timestamp
     */
    private final NavigableMap<Long, Slot> inFlight = new TreeMap<>();

    private long lastTimestamp;

    public EmissionSequencer() {
        this(Clock.systemUTC());
    }

    public EmissionSequencer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Take the timestamp of a new emission; it must be passed to {@link #complete(long, Runnable)} exactly once
     *
     * @return Timestamp, epoch milliseconds, strictly increasing
     */
    public synchronized long next() {
        long timestamp = Math.max(lastTimestamp + 1, clock.millis());
        lastTimestamp = timestamp;
        inFlight.put(timestamp, new Slot());
        return timestamp;
    }

    /**
     * Mark an emission as appended and run the completion actions that are now in order
     *
     * @param timestamp Timestamp from {@link #next()}
     * @param release Action run once every earlier emission is released, null for none
     */
    public synchronized void complete(long timestamp, Runnable release) {
        Slot slot = inFlight.get(timestamp);
        if (slot == null) {
            log.warn("Emission {} completed twice or never started", timestamp);
            return;
        }
        slot.release = release;
        slot.completed = true;

        Map.Entry<Long, Slot> head;
        while ((head = inFlight.firstEntry()) != null && head.getValue().completed) {
            inFlight.pollFirstEntry();
            Runnable action = head.getValue().release;
            if (action != null) {
                try {
                    action.run();
                } catch (Exception e) {
                    log.error("Release of emission {} failed", head.getKey(), e);
                }
            }
        }
    }

    /**
     * Greatest timestamp a reader may hand out as a cursor: every emission of this process at or below it has been
     * appended, and every later one gets a greater timestamp. Read it before reading the history.
     */
    public synchronized long visibleThrough() {
        long bound = Math.max(clock.millis() - 1, lastTimestamp);
        if (!inFlight.isEmpty()) {
            bound = Math.min(bound, inFlight.firstKey() - 1);
        }
        return bound;
    }

    public synchronized int getInFlight() {
        return inFlight.size();
    }

    private static class Slot {
        private boolean completed;
        private Runnable release;
    }
}
