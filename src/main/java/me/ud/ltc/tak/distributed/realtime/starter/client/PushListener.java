package me.ud.ltc.tak.distributed.realtime.starter.client;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;

/**
 * Callbacks of a push stream. After {@link #onError(Throwable)} no further callbacks are made.
 *
 * @author takltc
 */
public interface PushListener {

    void onOpen();

    void onEvent(Event event);

    /**
     * The stream failed or ended
     */
    void onError(Throwable cause);
}
