package me.ud.ltc.tak.distributed.realtime.starter.web;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author takltc
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmitResponse {

    private String eventId;
}
