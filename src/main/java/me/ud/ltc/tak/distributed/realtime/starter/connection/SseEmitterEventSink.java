package me.ud.ltc.tak.distributed.realtime.starter.connection;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import lombok.Getter;

/**
 * {@link EventSink} backed by a Spring MVC {@link SseEmitter}
 *
 * @author takltc
 */
public class SseEmitterEventSink implements EventSink {

    @Getter
    private final SseEmitter emitter;

    private final List<Consumer<Throwable>> callbacks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    public SseEmitterEventSink(SseEmitter emitter) {
        this.emitter = emitter;
        emitter.onCompletion(() -> terminate(null));
        emitter.onTimeout(() -> terminate(new TimeoutException("SSE emitter timed out")));
        emitter.onError(this::terminate);
    }

    @Override
    public void send(OutboundMessage message) throws IOException {
        SseEmitter.SseEventBuilder event = SseEmitter.event().name(message.getEventName()).data(message.getData());
        if (message.getId() != null) {
            event.id(message.getId());
        }
        emitter.send(event);
    }

    @Override
    public void complete() {
        emitter.complete();
    }

    @Override
    public void completeWithError(Throwable cause) {
        emitter.completeWithError(cause);
    }

    @Override
    public void onTermination(Consumer<Throwable> callback) {
        callbacks.add(callback);
    }

    private void terminate(Throwable cause) {
        if (terminated.compareAndSet(false, true)) {
            callbacks.forEach(callback -> callback.accept(cause));
        }
    }
}
