package com.example.voice.persistence;

import com.example.voice.domain.HumanControlSession;
import com.example.voice.service.HumanControlRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaHumanControlRepository implements HumanControlRepository {

    private final HumanControlSessionJpaRepository humanControlJpaRepository;
    private final VoiceEntityMapper mapper;

    @PersistenceContext
    private EntityManager entityManager;

    static String activeMarker(String organizationId, String leadId) {
        return organizationId + ":" + leadId;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<HumanControlSession> findActive(String organizationId, String leadId) {
        if (!StringUtils.hasText(organizationId) || !StringUtils.hasText(leadId)) {
            return Optional.empty();
        }
        return humanControlJpaRepository.findByActiveMarker(activeMarker(organizationId, leadId))
                .map(mapper::toHumanControlSession);
    }

    @Override
    @Transactional
    public HumanControlSession insertActive(HumanControlSession session) {
        HumanControlSessionEntity entity =
                mapper.toEntity(session, activeMarker(session.getOrganizationId(), session.getLeadId()));
        entityManager.persist(entity);
        entityManager.flush();
        return mapper.toHumanControlSession(entity);
    }

    @Override
    @Transactional
    public boolean end(String organizationId, String sessionId, Instant endedAt, String endReason) {
        return humanControlJpaRepository.end(organizationId, sessionId, endedAt, endReason) > 0;
    }

    @Override
    @Transactional
    public boolean incrementMessagesHandled(String organizationId, String sessionId) {
        return humanControlJpaRepository.incrementMessagesHandled(organizationId, sessionId) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<HumanControlSession> findAllActive(String organizationId) {
        return humanControlJpaRepository.findByOrganizationIdAndEndedAtIsNullOrderByStartedAtAsc(organizationId)
                .stream()
                .map(mapper::toHumanControlSession)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findOrganizationsWithActiveSessions() {
        return humanControlJpaRepository.findOrganizationIdsWithActiveSessions();
    }

    @Override
    @Transactional(readOnly = true)
    public long countActive(String organizationId) {
        return humanControlJpaRepository.countByOrganizationIdAndEndedAtIsNull(organizationId);
    }
}
