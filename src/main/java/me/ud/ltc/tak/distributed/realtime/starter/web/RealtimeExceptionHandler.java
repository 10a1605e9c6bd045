package me.ud.ltc.tak.distributed.realtime.starter.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import me.ud.ltc.tak.distributed.realtime.starter.exception.ConnectionLimitExceededException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.EventStoreException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.NoDeliveryPathException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.RateLimitExceededException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.RealtimeDeliveryException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.RequestRateLimitExceededException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps realtime errors to JSON responses without exposing internals
 *
 * @author takltc
 */
@Slf4j
@RestControllerAdvice(assignableTypes = {RealtimeStreamController.class, RealtimePollingController.class,
    RealtimeEventController.class})
public class RealtimeExceptionHandler {

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException e) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "rate_limited", e.getMessage());
    }

    @ExceptionHandler(RequestRateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRequestRateLimit(RequestRateLimitExceededException e) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "rate_limited", e.getMessage());
    }

    @ExceptionHandler(ConnectionLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleConnectionLimit(ConnectionLimitExceededException e) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "connection_limit", e.getMessage());
    }

    @ExceptionHandler(NoDeliveryPathException.class)
    public ResponseEntity<ErrorResponse> handleNoDeliveryPath(NoDeliveryPathException e) {
        log.error("Event could not be delivered", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "no_delivery_path", "Realtime delivery is unavailable");
    }

    @ExceptionHandler(EventStoreException.class)
    public ResponseEntity<ErrorResponse> handleEventStore(EventStoreException e) {
        log.error("Event history unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", "Event history is unavailable");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(RealtimeDeliveryException.class)
    public ResponseEntity<ErrorResponse> handleDelivery(RealtimeDeliveryException e) {
        log.error("Realtime request failed", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "unavailable", "Realtime delivery is unavailable");
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, System.currentTimeMillis()));
    }
}
