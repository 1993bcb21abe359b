package com.example.voice.controller;

import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.HumanControlSession;
import com.example.voice.dto.HumanControlResponse;
import com.example.voice.dto.HumanControlStatusResponse;
import com.example.voice.dto.HumanMessageRequest;
import com.example.voice.dto.JoinHumanControlRequest;
import com.example.voice.dto.LeaveHumanControlRequest;
import com.example.voice.service.HumanControlService;
import com.example.voice.service.JoinResult;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/human-control")
public class HumanControlController {

    private final HumanControlService humanControlService;

    public HumanControlController(HumanControlService humanControlService) {
        this.humanControlService = humanControlService;
    }

    /**
     * Losing the race to another operator is answered with 200 and {@code success=false}.
     */
    @PostMapping("/join")
    public ResponseEntity<HumanControlResponse> join(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId,
            @Valid @RequestBody JoinHumanControlRequest request) {
        JoinResult result = humanControlService.join(organizationId, request.getLeadId(), request.getOperatorName());
        return ResponseEntity.ok(HumanControlResponse.fromJoin(request.getLeadId(), result));
    }

    @PostMapping("/leave")
    public ResponseEntity<HumanControlResponse> leave(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId,
            @Valid @RequestBody LeaveHumanControlRequest request) {
        Optional<HumanControlSession> ended = humanControlService.leave(organizationId, request.getLeadId());
        return ResponseEntity.ok(HumanControlResponse.builder()
                .success(true)
                .status(ended.isPresent() ? "left" : "not_controlled")
                .leadId(request.getLeadId())
                .message(ended.isPresent() ? "AI assistant has resumed control" : "Conversation was not under human control")
                .session(ended.orElse(null))
                .build());
    }

    @PostMapping("/send-message")
    public ResponseEntity<ConversationMessage> sendMessage(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId,
            @Valid @RequestBody HumanMessageRequest request) {
        return ResponseEntity.ok(humanControlService.sendMessage(
                organizationId, request.getLeadId(), request.getContent(), request.getChannel()));
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<HumanControlSession>> activeSessions(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId) {
        return ResponseEntity.ok(humanControlService.getActiveSessions(organizationId));
    }

    @GetMapping("/status/{leadId}")
    public ResponseEntity<HumanControlStatusResponse> status(
            @RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId, @PathVariable String leadId) {
        Optional<HumanControlSession> session = humanControlService.getActiveSession(organizationId, leadId);
        return ResponseEntity.ok(HumanControlStatusResponse.builder()
                .leadId(leadId)
                .underHumanControl(session.isPresent())
                .operatorName(session.map(HumanControlSession::getOperatorName).orElse(null))
                .session(session.orElse(null))
                .build());
    }
}
