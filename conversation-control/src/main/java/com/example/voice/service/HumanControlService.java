package com.example.voice.service;

import com.example.voice.config.VoiceProperties;
import com.example.voice.domain.CallSession;
import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.HumanControlSession;
import com.example.voice.domain.Lead;
import com.example.voice.domain.MessageChannel;
import com.example.voice.domain.MessageSender;
import com.example.voice.event.ConversationEventPublisher;
import com.example.voice.event.ConversationEventType;
import com.example.voice.event.OutboundMessageCommand;
import com.example.voice.service.exception.ServiceException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Decides whether the AI or a human operator authors replies for a lead.
 *
 * <p>Ownership lives in the datastore only. A join inserts a row carrying the lead's unique
 * active marker, so of any number of concurrent joins exactly one insert succeeds; the others
 * read back the winner. Operator messages are checked against the persisted session at send
 * time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HumanControlService {

    public static final String REASON_OPERATOR_LEFT = "operator_left";
    public static final String REASON_CALL_TERMINATED = "call_session_terminated";
    public static final String REASON_STALE = "stale_human_session";

    private final HumanControlRepository humanControlRepository;
    private final CallSessionRepository callSessionRepository;
    private final LeadDirectory leadDirectory;
    private final ConversationService conversationService;
    private final ConversationContextService contextService;
    private final ConversationEventPublisher eventPublisher;
    private final TransientFailureRetrier retrier;
    private final VoiceProperties voiceProperties;

    public JoinResult join(String organizationId, String leadId, String operatorName) {
        requireIds(organizationId, leadId);
        if (!StringUtils.hasText(operatorName)) {
            throw ServiceException.badRequest("missing_operator", "Operator name is required");
        }
        String operator = operatorName.trim();
        leadDirectory.findLead(organizationId, leadId)
                .orElseThrow(() -> ServiceException.notFound("lead_not_found", "Lead not found: " + leadId));

        int attempts = Math.max(voiceProperties.getHumanControl().getJoinAttempts(), 1);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<HumanControlSession> active = retrier.execute(
                    "human control lookup", () -> humanControlRepository.findActive(organizationId, leadId));
            if (active.isPresent()) {
                return ownedResult(active.get(), operator);
            }

            HumanControlSession candidate = HumanControlSession.builder()
                    .id(UUID.randomUUID().toString())
                    .organizationId(organizationId)
                    .leadId(leadId)
                    .callSessionId(callSessionRepository.findLatestOpen(organizationId, leadId)
                            .map(CallSession::getId)
                            .orElse(null))
                    .operatorName(operator)
                    .startedAt(Instant.now())
                    .messagesHandled(0)
                    .build();
            try {
                HumanControlSession created = retrier.execute(
                        "human control insert", () -> humanControlRepository.insertActive(candidate));
                onJoined(created);
                return JoinResult.joined(created);
            } catch (DataIntegrityViolationException ex) {
                Optional<HumanControlSession> winner = humanControlRepository.findActive(organizationId, leadId);
                if (winner.isPresent()) {
                    log.info("Operator {} lost the join race for lead {} to {}",
                            operator, leadId, winner.get().getOperatorName());
                    return ownedResult(winner.get(), operator);
                }
                log.debug("Join race winner for lead {} already left, retrying ({}/{})", leadId, attempt, attempts);
            }
        }
        throw new ServiceException(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Human control for lead " + leadId + " is changing too quickly, retry later",
                "join_contention");
    }

    /**
     * Ends the lead's active session.
     *
     * @return the ended session, or empty when the lead was not under human control
     */
    public Optional<HumanControlSession> leave(String organizationId, String leadId) {
        requireIds(organizationId, leadId);
        Optional<HumanControlSession> active = retrier.execute(
                "human control lookup", () -> humanControlRepository.findActive(organizationId, leadId));
        if (active.isEmpty()) {
            log.debug("Leave for lead {} ignored: no active human control session", leadId);
            return Optional.empty();
        }
        HumanControlSession session = active.get();
        Instant now = Instant.now();
        boolean ended = retrier.execute("human control end",
                () -> humanControlRepository.end(organizationId, session.getId(), now, REASON_OPERATOR_LEFT));
        if (!ended) {
            log.debug("Human control session {} was already ended", session.getId());
            return Optional.empty();
        }
        session.setEndedAt(now);
        session.setEndReason(REASON_OPERATOR_LEFT);
        log.info("Operator {} released lead {} after {} messages",
                session.getOperatorName(), leadId, session.getMessagesHandled());

        recordSystemMessage(session, "AI assistant has resumed control");
        contextService.invalidate(organizationId, leadId);
        eventPublisher.publish(ConversationEventType.HUMAN_CONTROL_LEFT, organizationId, leadId, sessionPayload(session));
        return Optional.of(session);
    }

    /**
     * Records an operator message for a lead that is currently under human control and hands
     * it over for delivery.
     */
    public ConversationMessage sendMessage(String organizationId, String leadId, String content, MessageChannel channel) {
        requireIds(organizationId, leadId);
        if (!StringUtils.hasText(content)) {
            throw ServiceException.badRequest("empty_message", "Message content is required");
        }
        MessageChannel resolvedChannel = channel == null ? MessageChannel.SMS : channel;
        if (resolvedChannel == MessageChannel.SYSTEM) {
            throw ServiceException.badRequest("invalid_channel", "Operators can send over SMS or voice only");
        }

        HumanControlSession session = retrier.execute(
                        "human control lookup", () -> humanControlRepository.findActive(organizationId, leadId))
                .orElseThrow(() -> notUnderControl(leadId));
        boolean counted = retrier.execute("human control message count",
                () -> humanControlRepository.incrementMessagesHandled(organizationId, session.getId()));
        if (!counted) {
            throw notUnderControl(leadId);
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("operatorName", session.getOperatorName());
        metadata.put("humanControlSessionId", session.getId());
        ConversationMessage message = conversationService.recordMessage(
                        ConversationMessage.builder()
                                .organizationId(organizationId)
                                .leadId(leadId)
                                .callSessionId(session.getCallSessionId())
                                .sender(MessageSender.HUMAN_AGENT)
                                .channel(resolvedChannel)
                                .content(content.trim())
                                .metadata(metadata)
                                .build(),
                        ConversationEventType.HUMAN_MESSAGE_SENT)
                .orElseThrow(() -> new IllegalStateException("Operator message was not stored"));

        String phone = leadDirectory.findLead(organizationId, leadId).map(Lead::getPhoneNumber).orElse(null);
        eventPublisher.publishOutbound(OutboundMessageCommand.builder()
                .eventId(UUID.randomUUID().toString())
                .organizationId(organizationId)
                .leadId(leadId)
                .messageId(message.getId())
                .phoneNumber(phone)
                .channel(resolvedChannel)
                .content(message.getContent())
                .operatorName(session.getOperatorName())
                .occurredAt(message.getCreatedAt())
                .build());
        return message;
    }

    public List<HumanControlSession> getActiveSessions(String organizationId) {
        return humanControlRepository.findAllActive(organizationId);
    }

    public Optional<HumanControlSession> getActiveSession(String organizationId, String leadId) {
        return humanControlRepository.findActive(organizationId, leadId);
    }

    public boolean isUnderHumanControl(String organizationId, String leadId) {
        return getActiveSession(organizationId, leadId).isPresent();
    }

    public long countActiveSessions(String organizationId) {
        return humanControlRepository.countActive(organizationId);
    }

    /**
     * Ends active sessions whose call has already terminated, and unlinked sessions that have
     * outlived the configured maximum. Stops early when the calling thread is interrupted.
     */
    public List<HumanControlSession> endOrphanedSessions(String organizationId) {
        Duration maxDuration = voiceProperties.getHumanControl().getMaxDuration();
        Instant now = Instant.now();
        List<HumanControlSession> ended = new ArrayList<>();
        for (HumanControlSession session : humanControlRepository.findAllActive(organizationId)) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Orphaned human control cleanup for {} interrupted", organizationId);
                break;
            }
            String reason = orphanReason(session, maxDuration, now);
            if (reason == null) {
                continue;
            }
            try {
                if (humanControlRepository.end(organizationId, session.getId(), now, reason)) {
                    session.setEndedAt(now);
                    session.setEndReason(reason);
                    log.warn("Force-ended human control session {} (organization {}, lead {}, operator {}, "
                                    + "call session {}, started {}, messages {}, reason {})",
                            session.getId(), organizationId, session.getLeadId(), session.getOperatorName(),
                            session.getCallSessionId(), session.getStartedAt(), session.getMessagesHandled(), reason);
                    contextService.invalidate(organizationId, session.getLeadId());
                    eventPublisher.publish(ConversationEventType.HUMAN_CONTROL_FORCE_ENDED,
                            organizationId, session.getLeadId(), sessionPayload(session));
                    ended.add(session);
                }
            } catch (RuntimeException ex) {
                log.warn("Failed to end orphaned human control session {}", session.getId(), ex);
            }
        }
        return ended;
    }

    private String orphanReason(HumanControlSession session, Duration maxDuration, Instant now) {
        if (StringUtils.hasText(session.getCallSessionId())) {
            boolean callEnded = callSessionRepository.findById(session.getOrganizationId(), session.getCallSessionId())
                    .map(call -> call.getStatus().isTerminal())
                    .orElse(true);
            return callEnded ? REASON_CALL_TERMINATED : null;
        }
        if (maxDuration != null && !maxDuration.isZero() && !maxDuration.isNegative()
                && session.getStartedAt().plus(maxDuration).isBefore(now)) {
            return REASON_STALE;
        }
        return null;
    }

    private JoinResult ownedResult(HumanControlSession owner, String operator) {
        if (owner.getOperatorName().equals(operator)) {
            return JoinResult.alreadyOwned(owner);
        }
        return JoinResult.conflict(owner);
    }

    private void onJoined(HumanControlSession session) {
        log.info("Operator {} took control of lead {} (call session {})",
                session.getOperatorName(), session.getLeadId(), session.getCallSessionId());
        recordSystemMessage(session, session.getOperatorName() + " has joined the conversation");
        contextService.invalidate(session.getOrganizationId(), session.getLeadId());
        eventPublisher.publish(ConversationEventType.HUMAN_CONTROL_JOINED,
                session.getOrganizationId(), session.getLeadId(), sessionPayload(session));
    }

    private void recordSystemMessage(HumanControlSession session, String text) {
        try {
            conversationService.recordMessage(
                    ConversationMessage.builder()
                            .organizationId(session.getOrganizationId())
                            .leadId(session.getLeadId())
                            .callSessionId(session.getCallSessionId())
                            .sender(MessageSender.SYSTEM)
                            .channel(MessageChannel.SYSTEM)
                            .content(text)
                            .metadata(Map.of("humanControlSessionId", session.getId()))
                            .build(),
                    ConversationEventType.CONVERSATION_ADDED);
        } catch (RuntimeException ex) {
            log.warn("Could not record control change for lead {}: {}", session.getLeadId(), text, ex);
        }
    }

    private Map<String, Object> sessionPayload(HumanControlSession session) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("humanControlSessionId", session.getId());
        payload.put("operatorName", session.getOperatorName());
        payload.put("startedAt", session.getStartedAt().toString());
        payload.put("messagesHandled", session.getMessagesHandled());
        if (session.getCallSessionId() != null) {
            payload.put("callSessionId", session.getCallSessionId());
        }
        if (session.getEndedAt() != null) {
            payload.put("endedAt", session.getEndedAt().toString());
            payload.put("endReason", session.getEndReason());
        }
        return payload;
    }

    private static ServiceException notUnderControl(String leadId) {
        return ServiceException.conflict("not_under_human_control", "Lead " + leadId + " is not under human control");
    }

    private static void requireIds(String organizationId, String leadId) {
        if (!StringUtils.hasText(organizationId)) {
            throw ServiceException.badRequest("missing_organization", "Organization id is required");
        }
        if (!StringUtils.hasText(leadId)) {
            throw ServiceException.badRequest("missing_lead", "Lead id is required");
        }
    }
}
