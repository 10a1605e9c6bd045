package me.ud.ltc.tak.distributed.realtime.starter.exception;

/**
 * An event could neither be stored, relayed, nor delivered to any local connection
 *
 * @author takltc
 */
public class NoDeliveryPathException extends RealtimeDeliveryException {

    private static final long serialVersionUID = 1L;

    public NoDeliveryPathException(String eventId) {
        super("No delivery path available for event: " + eventId);
    }
}
