package com.example.voice.controller;

import com.example.voice.dto.ConversationInitiationResponse;
import com.example.voice.dto.WebhookAck;
import com.example.voice.service.WebhookIngestionService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Provider callbacks. Bodies are taken raw so that a malformed payload is acknowledged rather
 * than rejected by message conversion.
 */
@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

    private final WebhookIngestionService ingestionService;

    public WebhookController(WebhookIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(path = "/conversation-initiation", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConversationInitiationResponse> conversationInitiation(
            @RequestBody(required = false) String body) {
        return ResponseEntity.ok(ingestionService.handleInitiation(body));
    }

    @PostMapping(path = "/conversation-events", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookAck> conversationEvent(@RequestBody(required = false) String body) {
        return ResponseEntity.ok(ingestionService.handleConversationEvent(body));
    }

    @PostMapping(path = "/post-call", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookAck> postCall(@RequestBody(required = false) String body) {
        return ResponseEntity.ok(ingestionService.handlePostCall(body));
    }

    @PostMapping(
            path = "/call-status",
            consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookAck> callStatus(
            @RequestParam(name = "CallSid", required = false) String callSid,
            @RequestParam(name = "CallStatus", required = false) String callStatus,
            @RequestParam(name = "CallDuration", required = false) String callDuration) {
        return ResponseEntity.ok(ingestionService.handleCallStatus(callSid, callStatus, callDuration));
    }

    @PostMapping(
            path = "/sms/incoming",
            consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
            produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> incomingSms(
            @RequestParam(name = "From", required = false) String from,
            @RequestParam(name = "To", required = false) String to,
            @RequestParam(name = "Body", required = false) String body,
            @RequestParam(name = "MessageSid", required = false) String messageSid) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_XML)
                .body(ingestionService.handleIncomingSms(from, to, body, messageSid));
    }
}
