package com.example.voice.service;

import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.ConversationSummary;
import com.example.voice.event.ConversationEventPublisher;
import com.example.voice.event.ConversationEventType;
import com.example.voice.service.exception.ServiceException;
import java.time.Instant;
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
 * Records conversation messages and summaries. Every write invalidates the lead's context and
 * is announced to dashboards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private static final int MAX_PAGE = 200;

    private final ConversationHistoryRepository historyRepository;
    private final ConversationContextService contextService;
    private final ConversationEventPublisher eventPublisher;
    private final TransientFailureRetrier retrier;

    /**
     * Stores a message and announces it with {@code eventType}.
     *
     * @return the stored message, or empty when a message with the same provider id was already recorded
     */
    public Optional<ConversationMessage> recordMessage(ConversationMessage draft, ConversationEventType eventType) {
        validate(draft);
        ConversationMessage message = ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(draft.getOrganizationId())
                .leadId(draft.getLeadId())
                .callSessionId(draft.getCallSessionId())
                .sender(draft.getSender())
                .channel(draft.getChannel())
                .content(draft.getContent())
                .externalId(draft.getExternalId())
                .metadata(draft.getMetadata() == null ? Map.of() : draft.getMetadata())
                .createdAt(draft.getCreatedAt() != null ? draft.getCreatedAt() : Instant.now())
                .build();

        ConversationMessage stored;
        try {
            stored = retrier.execute("append message", () -> historyRepository.append(message));
        } catch (DataIntegrityViolationException ex) {
            if (StringUtils.hasText(message.getExternalId())) {
                log.info("Message {} for lead {} already recorded, skipping duplicate delivery",
                        message.getExternalId(), message.getLeadId());
                return Optional.empty();
            }
            throw ex;
        }

        contextService.invalidate(stored.getOrganizationId(), stored.getLeadId());
        eventPublisher.publish(eventType, stored.getOrganizationId(), stored.getLeadId(), messagePayload(stored));
        return Optional.of(stored);
    }

    /**
     * Stores the summary of a call. A call session has at most one summary.
     *
     * @return the stored summary, or empty when the call session already had one
     */
    public Optional<ConversationSummary> recordSummary(
            String organizationId, String leadId, String callSessionId, String text) {
        if (!StringUtils.hasText(text)) {
            return Optional.empty();
        }
        ConversationSummary summary = ConversationSummary.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(organizationId)
                .leadId(leadId)
                .callSessionId(callSessionId)
                .summary(text.trim())
                .createdAt(Instant.now())
                .build();
        ConversationSummary stored;
        try {
            stored = retrier.execute("save summary", () -> historyRepository.saveSummary(summary));
        } catch (DataIntegrityViolationException ex) {
            log.info("Call session {} already has a summary, skipping duplicate", callSessionId);
            return Optional.empty();
        }
        contextService.invalidate(organizationId, leadId);
        eventPublisher.publish(ConversationEventType.SUMMARY_ADDED, organizationId, leadId, Map.of(
                "summaryId", stored.getId(),
                "callSessionId", callSessionId == null ? "" : callSessionId,
                "summary", stored.getSummary()));
        return Optional.of(stored);
    }

    public List<ConversationMessage> getRecentMessages(String organizationId, String leadId, int limit) {
        return historyRepository.findRecent(organizationId, leadId, clamp(limit));
    }

    public List<ConversationSummary> getRecentSummaries(String organizationId, String leadId, int limit) {
        return historyRepository.findRecentSummaries(organizationId, leadId, clamp(limit));
    }

    public boolean hasMessagesForCallSession(String organizationId, String callSessionId) {
        return historyRepository.countForCallSession(organizationId, callSessionId) > 0;
    }

    private void validate(ConversationMessage draft) {
        if (draft == null
                || !StringUtils.hasText(draft.getOrganizationId())
                || !StringUtils.hasText(draft.getLeadId())) {
            throw ServiceException.badRequest("missing_lead", "Organization and lead are required");
        }
        if (draft.getSender() == null || draft.getChannel() == null) {
            throw ServiceException.badRequest("invalid_message", "Sender and channel are required");
        }
        if (!StringUtils.hasText(draft.getContent())) {
            throw ServiceException.badRequest("empty_message", "Message content is required");
        }
    }

    private Map<String, Object> messagePayload(ConversationMessage message) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("messageId", message.getId());
        payload.put("sender", message.getSender().name());
        payload.put("channel", message.getChannel().name());
        payload.put("content", message.getContent());
        payload.put("createdAt", message.getCreatedAt().toString());
        if (message.getCallSessionId() != null) {
            payload.put("callSessionId", message.getCallSessionId());
        }
        return payload;
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_PAGE));
    }
}
