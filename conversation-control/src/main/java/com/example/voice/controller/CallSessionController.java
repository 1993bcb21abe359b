package com.example.voice.controller;

import com.example.voice.domain.CallDirection;
import com.example.voice.domain.CallSession;
import com.example.voice.dto.OutboundCallRequest;
import com.example.voice.service.CallSessionService;
import com.example.voice.service.LeadService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/call-sessions")
public class CallSessionController {

    private final CallSessionService callSessionService;
    private final LeadService leadService;

    public CallSessionController(CallSessionService callSessionService, LeadService leadService) {
        this.callSessionService = callSessionService;
        this.leadService = leadService;
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<CallSession> getSession(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId, @PathVariable String sessionId) {
        return ResponseEntity.ok(callSessionService.getSession(organizationId, sessionId));
    }

    /**
     * 204 when the lead has no open call.
     */
    @GetMapping("/active")
    public ResponseEntity<CallSession> getActive(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId, @RequestParam String leadId) {
        return callSessionService.getActiveSession(organizationId, leadId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/history")
    public ResponseEntity<List<CallSession>> history(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId,
            @RequestParam String leadId,
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        return ResponseEntity.ok(callSessionService.getSessionHistory(organizationId, leadId, limit));
    }

    @PostMapping("/outbound")
    public ResponseEntity<CallSession> registerOutbound(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId,
            @Valid @RequestBody OutboundCallRequest request) {
        leadService.getLead(organizationId, request.getLeadId());
        CallSession session = callSessionService.createSession(
                organizationId, request.getLeadId(), request.getExternalId(), CallDirection.OUTBOUND,
                request.getProviderAgentId());
        return ResponseEntity.ok(session);
    }
}
