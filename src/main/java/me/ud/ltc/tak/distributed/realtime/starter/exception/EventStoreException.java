package me.ud.ltc.tak.distributed.realtime.starter.exception;

/**
 * The event history backing store could not be reached
 *
 * @author takltc
 */
public class EventStoreException extends RealtimeDeliveryException {

    private static final long serialVersionUID = 1L;

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
