package me.ud.ltc.tak.distributed.realtime.starter.balancer;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a load balanced operation
 *
 * @param <T> Result type
 * @author takltc
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult<T> {

    boolean success;

    T data;

    Exception error;

    /**
     * Instance that served the operation, null when no instance was available
     */
    String instanceId;

    public static <T> OperationResult<T> success(T data, String instanceId) {
        return new OperationResult<>(true, data, null, instanceId);
    }

    public static <T> OperationResult<T> failure(Exception error, String instanceId) {
        return new OperationResult<>(false, null, error, instanceId);
    }
}
