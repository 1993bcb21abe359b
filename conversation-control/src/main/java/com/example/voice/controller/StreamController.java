package com.example.voice.controller;

import com.example.voice.service.exception.ServiceException;
import com.example.voice.websocket.RealtimeBroadcastHub;
import com.example.voice.websocket.SseOutboundChannel;
import com.example.voice.websocket.Subscription;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/stream")
public class StreamController {

    private final RealtimeBroadcastHub hub;

    public StreamController(RealtimeBroadcastHub hub) {
        this.hub = hub;
    }

    @GetMapping(path = "/{clientId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @PathVariable String clientId,
            @RequestParam(name = "organizationId", required = false) String organizationParam,
            @RequestHeader(name = RequestHeaders.ORGANIZATION_ID, required = false) String organizationHeader) {
        String organizationId = StringUtils.hasText(organizationParam) ? organizationParam : organizationHeader;
        if (!StringUtils.hasText(organizationId)) {
            throw ServiceException.badRequest("missing_organization", "Organization id is required");
        }
        // no server-side timeout; heartbeats detect dead clients
        SseEmitter emitter = new SseEmitter(0L);
        SseOutboundChannel channel = new SseOutboundChannel(emitter);
        Subscription subscription = hub.subscribe(clientId, organizationId, channel);
        channel.onClose(subscription::cancel);
        return emitter;
    }
}
