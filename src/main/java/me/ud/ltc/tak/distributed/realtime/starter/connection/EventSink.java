package me.ud.ltc.tak.distributed.realtime.starter.connection;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Write side of a push connection
 *
 * @author takltc
 */
public interface EventSink {

    /**
     * Write one message; blocks for the duration of the write
     *
     * @param message Message
     * @throws IOException If the peer is gone
     */
    void send(OutboundMessage message) throws IOException;

    void complete();

    void completeWithError(Throwable cause);

    /**
     * Register a callback invoked once when the underlying transport terminates. The argument is null on normal
     * completion and the cause otherwise.
     *
     * @param callback Callback
     */
    void onTermination(Consumer<Throwable> callback);
}
