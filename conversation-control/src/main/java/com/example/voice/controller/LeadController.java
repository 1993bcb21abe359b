package com.example.voice.controller;

import com.example.voice.domain.ConversationContext;
import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.ConversationSummary;
import com.example.voice.domain.Lead;
import com.example.voice.dto.LeadUpdateRequest;
import com.example.voice.service.ConversationContextService;
import com.example.voice.service.ConversationService;
import com.example.voice.service.LeadService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/leads")
public class LeadController {

    private final LeadService leadService;
    private final ConversationService conversationService;
    private final ConversationContextService contextService;

    public LeadController(
            LeadService leadService,
            ConversationService conversationService,
            ConversationContextService contextService) {
        this.leadService = leadService;
        this.conversationService = conversationService;
        this.contextService = contextService;
    }

    @GetMapping("/{leadId}")
    public ResponseEntity<Lead> getLead(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId, @PathVariable String leadId) {
        return ResponseEntity.ok(leadService.getLead(organizationId, leadId));
    }

    @PatchMapping("/{leadId}")
    public ResponseEntity<Lead> updateLead(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId,
            @PathVariable String leadId,
            @Valid @RequestBody LeadUpdateRequest request) {
        return ResponseEntity.ok(leadService.updateLead(
                organizationId, leadId, request.getCustomerName(), request.getEmail(), request.getStatus()));
    }

    @GetMapping("/{leadId}/context")
    public ResponseEntity<ConversationContext> getContext(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId, @PathVariable String leadId) {
        return ResponseEntity.ok(contextService.getContext(organizationId, leadId));
    }

    @GetMapping("/{leadId}/messages")
    public ResponseEntity<List<ConversationMessage>> getMessages(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId,
            @PathVariable String leadId,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        leadService.getLead(organizationId, leadId);
        return ResponseEntity.ok(conversationService.getRecentMessages(organizationId, leadId, limit));
    }

    @GetMapping("/{leadId}/summaries")
    public ResponseEntity<List<ConversationSummary>> getSummaries(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId,
            @PathVariable String leadId,
            @RequestParam(name = "limit", defaultValue = "10") int limit) {
        leadService.getLead(organizationId, leadId);
        return ResponseEntity.ok(conversationService.getRecentSummaries(organizationId, leadId, limit));
    }
}
