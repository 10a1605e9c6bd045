package me.ud.ltc.tak.distributed.realtime.starter.client;

import java.util.Collections;
import java.util.List;

import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import me.ud.ltc.tak.distributed.realtime.starter.exception.RealtimeDeliveryException;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.web.PollingResponse;

/**
 * Polling transport calling the server's polling endpoint with RestTemplate
 *
 * @author takltc
 */
public class RestTemplatePollingTransport implements PollingTransport {

    public static final String DEFAULT_POLLING_PATH = "/api/realtime/polling";

    private final RestTemplate restTemplate;
    private final String pollingUrl;

    public RestTemplatePollingTransport(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.pollingUrl = baseUrl + DEFAULT_POLLING_PATH;
    }

    @Override
    public List<Event> poll(ClientIdentity identity, long since) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(pollingUrl)
            .queryParam("userId", identity.getUserId()).queryParam("since", since);
        if (!identity.getRoles().isEmpty()) {
            uri.queryParam("roles", String.join(",", identity.getRoles()));
        }
        PollingResponse response = restTemplate.getForObject(uri.build().encode().toUri(), PollingResponse.class);
        if (response == null) {
            throw new RealtimeDeliveryException("Empty polling response");
        }
        return response.getEvents() != null ? response.getEvents() : Collections.emptyList();
    }
}
