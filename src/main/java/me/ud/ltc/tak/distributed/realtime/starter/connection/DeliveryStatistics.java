package me.ud.ltc.tak.distributed.realtime.starter.connection;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters shared by the connection manager and the broadcaster
 *
 * @author takltc
 */
public class DeliveryStatistics {

    private final AtomicLong eventsSent = new AtomicLong();
    private final AtomicLong heartbeatsSent = new AtomicLong();
    private final AtomicLong slowConsumersDropped = new AtomicLong();
    private final AtomicLong writeErrors = new AtomicLong();
    private final AtomicLong writeTimeouts = new AtomicLong();

    public void recordSent(OutboundMessage message) {
        if (message.isHeartbeat()) {
            heartbeatsSent.incrementAndGet();
        } else {
            eventsSent.incrementAndGet();
        }
    }

    public void recordSlowConsumer() {
        slowConsumersDropped.incrementAndGet();
    }

    public void recordWriteError() {
        writeErrors.incrementAndGet();
    }

    public void recordWriteTimeout() {
        writeTimeouts.incrementAndGet();
    }

    public long getEventsSent() {
        return eventsSent.get();
    }

    public long getHeartbeatsSent() {
        return heartbeatsSent.get();
    }

    public long getSlowConsumersDropped() {
        return slowConsumersDropped.get();
    }

    public long getWriteErrors() {
        return writeErrors.get();
    }

    public long getWriteTimeouts() {
        return writeTimeouts.get();
    }
}
