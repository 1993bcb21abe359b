package com.example.voice.service;

import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.ConversationSummary;
import java.util.List;

public interface ConversationHistoryRepository {

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when a message with the
     *         same provider id was already stored for the organization
     */
    ConversationMessage append(ConversationMessage message);

    /**
     * Most recent messages of the lead, oldest first.
     */
    List<ConversationMessage> findRecent(String organizationId, String leadId, int limit);

    long countForCallSession(String organizationId, String callSessionId);

    long count(String organizationId);

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when the call session already has a summary
     */
    ConversationSummary saveSummary(ConversationSummary summary);

    /**
     * Most recent summaries of the lead, newest first.
     */
    List<ConversationSummary> findRecentSummaries(String organizationId, String leadId, int limit);
}
