package me.ud.ltc.tak.distributed.realtime.starter.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import me.ud.ltc.tak.distributed.realtime.starter.model.Priority;
import me.ud.ltc.tak.distributed.realtime.starter.service.RealtimeEventService;

/**
 * Emission endpoint
 *
 * @author takltc
 */
@RestController
@RequestMapping("/api/realtime")
public class RealtimeEventController {

    private final RealtimeEventService realtimeEventService;

    public RealtimeEventController(RealtimeEventService realtimeEventService) {
        this.realtimeEventService = realtimeEventService;
    }

    @PostMapping("/events")
    public EmitResponse emit(@RequestBody EmitRequest request) {
        String eventId = realtimeEventService.emit(request.getType(), request.getData(), request.getTargets(),
            Priority.fromValue(request.getPriority()));
        return new EmitResponse(eventId);
    }
}
