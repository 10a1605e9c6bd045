package me.ud.ltc.tak.distributed.realtime.starter.exception;

import lombok.Getter;

/**
 * An emitted event was rejected by the rate limiter
 *
 * @author takltc
 */
@Getter
public class RateLimitExceededException extends RealtimeDeliveryException {

    private static final long serialVersionUID = 1L;

    private final String eventType;

    public RateLimitExceededException(String eventType) {
        super("Rate limit exceeded for event type: " + eventType);
        this.eventType = eventType;
    }
}
