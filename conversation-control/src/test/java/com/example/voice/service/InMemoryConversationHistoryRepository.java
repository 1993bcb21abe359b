package com.example.voice.service;

import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.ConversationSummary;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.dao.DataIntegrityViolationException;

class InMemoryConversationHistoryRepository implements ConversationHistoryRepository {

    private final List<ConversationMessage> messages = new CopyOnWriteArrayList<>();
    private final List<ConversationSummary> summaries = new CopyOnWriteArrayList<>();
    private final Map<String, String> messageExternalIds = new ConcurrentHashMap<>();
    private final Map<String, String> summaryCallSessions = new ConcurrentHashMap<>();
    private final AtomicInteger recentReads = new AtomicInteger();

    @Override
    public ConversationMessage append(ConversationMessage message) {
        if (message.getExternalId() != null
                && messageExternalIds.putIfAbsent(
                        message.getOrganizationId() + ":" + message.getExternalId(), message.getId()) != null) {
            throw new DataIntegrityViolationException("duplicate message " + message.getExternalId());
        }
        messages.add(message);
        return message;
    }

    @Override
    public List<ConversationMessage> findRecent(String organizationId, String leadId, int limit) {
        recentReads.incrementAndGet();
        List<ConversationMessage> newestFirst = messages.stream()
                .filter(m -> m.getOrganizationId().equals(organizationId) && m.getLeadId().equals(leadId))
                .sorted(Comparator.comparing(ConversationMessage::getCreatedAt).reversed())
                .limit(limit)
                .toList();
        List<ConversationMessage> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }

    @Override
    public long countForCallSession(String organizationId, String callSessionId) {
        return messages.stream()
                .filter(m -> m.getOrganizationId().equals(organizationId))
                .filter(m -> callSessionId.equals(m.getCallSessionId()))
                .count();
    }

    @Override
    public long count(String organizationId) {
        return messages.stream().filter(m -> m.getOrganizationId().equals(organizationId)).count();
    }

    @Override
    public ConversationSummary saveSummary(ConversationSummary summary) {
        if (summary.getCallSessionId() != null
                && summaryCallSessions.putIfAbsent(summary.getCallSessionId(), summary.getId()) != null) {
            throw new DataIntegrityViolationException("duplicate summary for " + summary.getCallSessionId());
        }
        summaries.add(summary);
        return summary;
    }

    @Override
    public List<ConversationSummary> findRecentSummaries(String organizationId, String leadId, int limit) {
        return summaries.stream()
                .filter(s -> s.getOrganizationId().equals(organizationId) && s.getLeadId().equals(leadId))
                .sorted(Comparator.comparing(ConversationSummary::getCreatedAt).reversed())
                .limit(limit)
                .toList();
    }

    List<ConversationMessage> messagesOf(String leadId) {
        return messages.stream().filter(m -> m.getLeadId().equals(leadId)).toList();
    }

    List<ConversationSummary> summariesOf(String leadId) {
        return summaries.stream().filter(s -> s.getLeadId().equals(leadId)).toList();
    }

    int recentReads() {
        return recentReads.get();
    }
}
