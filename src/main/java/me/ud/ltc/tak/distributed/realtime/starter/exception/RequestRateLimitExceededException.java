package me.ud.ltc.tak.distributed.realtime.starter.exception;

import lombok.Getter;

/**
 * A polling request or connection attempt was rejected by the rate limiter
 *
 * @author takltc
 */
@Getter
public class RequestRateLimitExceededException extends RealtimeDeliveryException {

    private static final long serialVersionUID = 1L;

    private final String scope;

    public RequestRateLimitExceededException(String scope, String key) {
        super("Too many " + scope + " requests from " + key);
        this.scope = scope;
    }
}
