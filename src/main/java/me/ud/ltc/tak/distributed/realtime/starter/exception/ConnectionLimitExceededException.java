package me.ud.ltc.tak.distributed.realtime.starter.exception;

/**
 * A push connection was refused because a capacity limit was reached
 *
 * @author takltc
 */
public class ConnectionLimitExceededException extends RealtimeDeliveryException {

    private static final long serialVersionUID = 1L;

    public ConnectionLimitExceededException(String message) {
        super(message);
    }
}
