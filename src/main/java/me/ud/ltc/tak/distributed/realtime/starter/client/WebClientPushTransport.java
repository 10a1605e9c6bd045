package me.ud.ltc.tak.distributed.realtime.starter.client;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

/**
 * Push transport reading the server's SSE stream through WebClient
 *
 * @author takltc
 */
@Slf4j
public class WebClientPushTransport implements PushTransport {

    public static final String DEFAULT_STREAM_PATH = "/api/realtime/stream";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<ServerSentEvent<String>>() {};

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String streamPath;

    public WebClientPushTransport(WebClient webClient, ObjectMapper objectMapper) {
        this(webClient, objectMapper, DEFAULT_STREAM_PATH);
    }

    public WebClientPushTransport(WebClient webClient, ObjectMapper objectMapper, String streamPath) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.streamPath = streamPath;
    }

    @Override
    public PushSubscription connect(ClientIdentity identity, PushListener listener) {
        Disposable disposable = webClient.get()
            .uri(uriBuilder -> uriBuilder.path(streamPath).queryParam("userId", identity.getUserId())
                .queryParam("roles", String.join(",", identity.getRoles())).build())
            .accept(MediaType.TEXT_EVENT_STREAM).retrieve().bodyToFlux(SSE_TYPE)
            .subscribe(sse -> handle(sse, listener), listener::onError,
                () -> listener.onError(new IllegalStateException("Push stream closed by server")));
        return disposable::dispose;
    }

    private void handle(ServerSentEvent<String> sse, PushListener listener) {
        String name = sse.event();
        if ("connected".equals(name)) {
            listener.onOpen();
            return;
        }
        if ("heartbeat".equals(name) || sse.data() == null) {
            return;
        }
        if ("system".equals(name)) {
            log.info("System message on push stream: {}", sse.data());
            return;
        }
        try {
            listener.onEvent(objectMapper.readValue(sse.data(), Event.class));
        } catch (Exception e) {
            log.warn("Ignoring unparsable push event {} of type {}", sse.id(), name, e);
        }
    }
}
