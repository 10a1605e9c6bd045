package me.ud.ltc.tak.distributed.realtime.starter.web;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body of the realtime endpoints
 *
 * @author takltc
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    /**
     * Machine readable error code
     */
    private String error;

    private String message;

    private long timestamp;
}
