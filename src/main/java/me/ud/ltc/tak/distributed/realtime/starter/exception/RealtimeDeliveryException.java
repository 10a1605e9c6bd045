package me.ud.ltc.tak.distributed.realtime.starter.exception;

/**
 * Base class of errors surfaced by the realtime delivery core
 *
 * @author takltc
 */
public class RealtimeDeliveryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RealtimeDeliveryException(String message) {
        super(message);
    }

    public RealtimeDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
