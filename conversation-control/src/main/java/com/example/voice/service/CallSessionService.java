package com.example.voice.service;

import com.example.voice.config.VoiceProperties;
import com.example.voice.domain.CallDirection;
import com.example.voice.domain.CallSession;
import com.example.voice.domain.CallSessionEvent;
import com.example.voice.domain.CallSessionStatus;
import com.example.voice.event.ConversationEventPublisher;
import com.example.voice.event.ConversationEventType;
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
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Lifecycle of call sessions. Every state change is a conditional update keyed on the
 * current status, so duplicate and reordered provider events cannot move a session backwards
 * or out of a terminal state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallSessionService {

    public static final String STALE_SESSION_REASON = "stale_session";

    private final CallSessionRepository callSessionRepository;
    private final ConversationContextService contextService;
    private final ConversationEventPublisher eventPublisher;
    private final TransientFailureRetrier retrier;
    private final VoiceProperties voiceProperties;

    public CallSession createSession(String organizationId, String leadId, String externalId, CallDirection direction) {
        return createSession(organizationId, leadId, externalId, direction, null);
    }

    /**
     * Creates the session for a provider correlation id, or returns the one already created for it.
     */
    public CallSession createSession(
            String organizationId, String leadId, String externalId, CallDirection direction, String providerAgentId) {
        if (!StringUtils.hasText(organizationId) || !StringUtils.hasText(leadId)) {
            throw ServiceException.badRequest("missing_lead", "Organization and lead are required");
        }
        if (!StringUtils.hasText(externalId)) {
            throw ServiceException.badRequest("missing_external_id", "Provider correlation id is required");
        }
        Optional<CallSession> existing = retrier.execute(
                "call session lookup", () -> callSessionRepository.findByExternalId(organizationId, externalId));
        if (existing.isPresent()) {
            log.debug("Call session for {} already exists as {}", externalId, existing.get().getId());
            return existing.get();
        }

        Instant now = Instant.now();
        CallSession session = CallSession.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(organizationId)
                .leadId(leadId)
                .externalId(externalId)
                .direction(direction == null ? CallDirection.INBOUND : direction)
                .status(CallSessionStatus.INITIATED)
                .providerAgentId(providerAgentId)
                .startedAt(now)
                .updatedAt(now)
                .build();

        CallSession created;
        try {
            created = retrier.execute("call session insert", () -> callSessionRepository.insert(session));
        } catch (DataIntegrityViolationException ex) {
            log.info("Concurrent initiation for {} lost the insert race, returning the existing session", externalId);
            return callSessionRepository.findByExternalId(organizationId, externalId).orElseThrow(() -> ex);
        }

        log.info("Call session {} initiated for lead {} ({}, external id {})",
                created.getId(), leadId, created.getDirection(), externalId);
        eventPublisher.publish(ConversationEventType.CALL_INITIATED, organizationId, leadId, sessionPayload(created));
        return created;
    }

    public CallSession transition(String organizationId, String sessionId, CallSessionEvent event) {
        return transition(organizationId, sessionId, event, null);
    }

    /**
     * Applies {@code event} if the session's current state allows it. A disallowed or lost
     * transition is logged and the session is returned unchanged.
     */
    public CallSession transition(String organizationId, String sessionId, CallSessionEvent event, String reason) {
        CallSession current = getSession(organizationId, sessionId);
        return apply(current, event, reason, false);
    }

    /**
     * Applies a provider event addressed by correlation id.
     *
     * @return the session after the event, or empty when no session is known for the id
     */
    public Optional<CallSession> transitionByExternalId(String externalId, CallSessionEvent event, String reason) {
        Optional<CallSession> session = findByExternalId(externalId);
        if (session.isEmpty()) {
            log.warn("Ignoring {} for unknown call session {}", event, externalId);
            return Optional.empty();
        }
        return Optional.of(apply(session.get(), event, reason, false));
    }

    public Optional<CallSession> findByExternalId(String externalId) {
        return retrier.execute("call session lookup", () -> callSessionRepository.findLatestByExternalId(externalId));
    }

    public void recordDuration(String organizationId, String sessionId, Integer durationSeconds) {
        if (durationSeconds == null || durationSeconds < 0) {
            return;
        }
        retrier.run("call duration update",
                () -> callSessionRepository.updateDuration(organizationId, sessionId, durationSeconds));
    }

    public CallSession getSession(String organizationId, String sessionId) {
        return callSessionRepository.findById(organizationId, sessionId)
                .orElseThrow(() -> ServiceException.notFound(
                        "call_session_not_found", "Call session not found: " + sessionId));
    }

    public Optional<CallSession> getActiveSession(String organizationId, String leadId) {
        if (!StringUtils.hasText(organizationId) || !StringUtils.hasText(leadId)) {
            return Optional.empty();
        }
        return callSessionRepository.findLatestOpen(organizationId, leadId);
    }

    public List<CallSession> getSessionHistory(String organizationId, String leadId, int limit) {
        int max = Math.max(voiceProperties.getCallSession().getMaxHistory(), 1);
        return callSessionRepository.findHistory(organizationId, leadId, Math.max(1, Math.min(limit, max)));
    }

    /**
     * Force-completes sessions of the organization that are still open after {@code maxAge}.
     * Stops early, keeping what was already closed, when the calling thread is interrupted.
     */
    public List<CallSession> cleanupStale(String organizationId, Duration maxAge) {
        if (maxAge == null || maxAge.isZero() || maxAge.isNegative()) {
            return List.of();
        }
        Instant cutoff = Instant.now().minus(maxAge);
        List<CallSession> candidates = callSessionRepository.findOpenStartedBefore(organizationId, cutoff);
        List<CallSession> closed = new ArrayList<>();
        for (CallSession candidate : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Stale session cleanup for {} interrupted after {} of {} sessions",
                        organizationId, closed.size(), candidates.size());
                break;
            }
            CallSession result = apply(candidate, CallSessionEvent.COMPLETE, STALE_SESSION_REASON, true);
            if (result.isAutoClosed() && STALE_SESSION_REASON.equals(result.getEndReason())) {
                closed.add(result);
            }
        }
        return closed;
    }

    public long countSessions(String organizationId) {
        return callSessionRepository.count(organizationId);
    }

    public long countOpenSessions(String organizationId) {
        return callSessionRepository.countOpen(organizationId);
    }

    private CallSession apply(CallSession current, CallSessionEvent event, String reason, boolean autoClose) {
        if (!event.canLeave(current.getStatus())) {
            log.info("Ignoring {} for call session {}: status is {}", event, current.getId(), current.getStatus());
            return current;
        }
        Instant now = Instant.now();
        String endReason = event.getTarget().isTerminal() ? reason : null;
        boolean applied = retrier.execute("call session transition", () -> callSessionRepository.transition(
                current.getOrganizationId(),
                current.getId(),
                event.getSources(),
                event.getTarget(),
                now,
                endReason,
                autoClose));
        if (!applied) {
            log.info("Ignoring {} for call session {}: status changed concurrently", event, current.getId());
            return callSessionRepository.findById(current.getOrganizationId(), current.getId()).orElse(current);
        }

        CallSessionStatus previousStatus = current.getStatus();
        CallSession updated = callSessionRepository.findById(current.getOrganizationId(), current.getId())
                .orElseGet(() -> {
                    current.setStatus(event.getTarget());
                    current.setUpdatedAt(now);
                    current.setEndedAt(event.getTarget().isTerminal() ? now : null);
                    current.setEndReason(endReason);
                    current.setAutoClosed(autoClose);
                    return current;
                });

        if (autoClose) {
            log.warn("Force-closed stale call session {} (organization {}, lead {}, external id {}, previous status {}, "
                            + "started {}, age {}s, reason {})",
                    updated.getId(), updated.getOrganizationId(), updated.getLeadId(), updated.getExternalId(),
                    previousStatus, updated.getStartedAt(),
                    Duration.between(updated.getStartedAt(), now).toSeconds(), endReason);
        } else {
            log.info("Call session {} moved {} -> {}", updated.getId(), previousStatus, updated.getStatus());
        }
        contextService.invalidate(updated.getOrganizationId(), updated.getLeadId());

        Map<String, Object> payload = sessionPayload(updated);
        payload.put("previousStatus", previousStatus.name());
        eventPublisher.publish(eventTypeFor(event, autoClose), updated.getOrganizationId(), updated.getLeadId(), payload);
        return updated;
    }

    private ConversationEventType eventTypeFor(CallSessionEvent event, boolean autoClose) {
        if (autoClose) {
            return ConversationEventType.SESSION_AUTO_CLOSED;
        }
        return event == CallSessionEvent.COMPLETE
                ? ConversationEventType.CALL_COMPLETED
                : ConversationEventType.CALL_STATUS_CHANGED;
    }

    private Map<String, Object> sessionPayload(CallSession session) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("callSessionId", session.getId());
        payload.put("externalId", session.getExternalId());
        payload.put("direction", session.getDirection().name());
        payload.put("status", session.getStatus().name());
        payload.put("startedAt", session.getStartedAt().toString());
        if (session.getEndedAt() != null) {
            payload.put("endedAt", session.getEndedAt().toString());
        }
        if (session.getEndReason() != null) {
            payload.put("endReason", session.getEndReason());
        }
        if (session.isAutoClosed()) {
            payload.put("autoClosed", true);
        }
        return payload;
    }
}
