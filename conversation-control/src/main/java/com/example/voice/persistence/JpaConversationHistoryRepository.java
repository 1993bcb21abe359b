package com.example.voice.persistence;

import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.ConversationSummary;
import com.example.voice.service.ConversationHistoryRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaConversationHistoryRepository implements ConversationHistoryRepository {

    private final ConversationMessageJpaRepository messageJpaRepository;
    private final ConversationSummaryJpaRepository summaryJpaRepository;
    private final VoiceEntityMapper mapper;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public ConversationMessage append(ConversationMessage message) {
        ConversationMessageEntity entity = mapper.toEntity(message);
        entityManager.persist(entity);
        entityManager.flush();
        return mapper.toMessage(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationMessage> findRecent(String organizationId, String leadId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<ConversationMessage> newestFirst = messageJpaRepository
                .findByOrganizationIdAndLeadIdOrderByCreatedAtDescIdDesc(organizationId, leadId, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toMessage)
                .toList();
        List<ConversationMessage> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }

    @Override
    @Transactional(readOnly = true)
    public long countForCallSession(String organizationId, String callSessionId) {
        return messageJpaRepository.countByOrganizationIdAndCallSessionId(organizationId, callSessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public long count(String organizationId) {
        return messageJpaRepository.countByOrganizationId(organizationId);
    }

    @Override
    @Transactional
    public ConversationSummary saveSummary(ConversationSummary summary) {
        ConversationSummaryEntity entity = mapper.toEntity(summary);
        entityManager.persist(entity);
        entityManager.flush();
        return mapper.toSummary(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationSummary> findRecentSummaries(String organizationId, String leadId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return summaryJpaRepository
                .findByOrganizationIdAndLeadIdOrderByCreatedAtDescIdDesc(organizationId, leadId, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toSummary)
                .toList();
    }
}
