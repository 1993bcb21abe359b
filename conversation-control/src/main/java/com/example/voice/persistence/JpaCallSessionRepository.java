package com.example.voice.persistence;

import com.example.voice.domain.CallSession;
import com.example.voice.domain.CallSessionStatus;
import com.example.voice.service.CallSessionRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaCallSessionRepository implements CallSessionRepository {

    private final CallSessionJpaRepository callSessionJpaRepository;
    private final VoiceEntityMapper mapper;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public CallSession insert(CallSession session) {
        CallSessionEntity entity = mapper.toEntity(session);
        entityManager.persist(entity);
        entityManager.flush();
        return mapper.toCallSession(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CallSession> findById(String organizationId, String sessionId) {
        if (!StringUtils.hasText(organizationId) || !StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        return callSessionJpaRepository.findByIdAndOrganizationId(sessionId, organizationId).map(mapper::toCallSession);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CallSession> findByExternalId(String organizationId, String externalId) {
        if (!StringUtils.hasText(organizationId) || !StringUtils.hasText(externalId)) {
            return Optional.empty();
        }
        return callSessionJpaRepository.findByOrganizationIdAndExternalId(organizationId, externalId)
                .map(mapper::toCallSession);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CallSession> findLatestByExternalId(String externalId) {
        if (!StringUtils.hasText(externalId)) {
            return Optional.empty();
        }
        return callSessionJpaRepository.findFirstByExternalIdOrderByStartedAtDesc(externalId)
                .map(mapper::toCallSession);
    }

    @Override
    @Transactional
    public boolean transition(
            String organizationId,
            String sessionId,
            Set<CallSessionStatus> sources,
            CallSessionStatus target,
            Instant at,
            String endReason,
            boolean autoClosed) {
        Instant endedAt = target.isTerminal() ? at : null;
        int updated = callSessionJpaRepository.transition(
                organizationId, sessionId, sources, target, at, endedAt, endReason, autoClosed);
        return updated > 0;
    }

    @Override
    @Transactional
    public void updateDuration(String organizationId, String sessionId, int durationSeconds) {
        callSessionJpaRepository.updateDuration(organizationId, sessionId, durationSeconds, Instant.now());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CallSession> findLatestOpen(String organizationId, String leadId) {
        return callSessionJpaRepository
                .findFirstByOrganizationIdAndLeadIdAndStatusInOrderByStartedAtDesc(
                        organizationId, leadId, CallSessionStatus.OPEN)
                .map(mapper::toCallSession);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CallSession> findHistory(String organizationId, String leadId, int limit) {
        return callSessionJpaRepository
                .findByOrganizationIdAndLeadIdOrderByStartedAtDesc(organizationId, leadId, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toCallSession)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CallSession> findOpenStartedBefore(String organizationId, Instant cutoff) {
        var cb = entityManager.getCriteriaBuilder();
        var cq = cb.createQuery(CallSessionEntity.class);
        var root = cq.from(CallSessionEntity.class);

        cq.where(cb.and(
                cb.equal(root.get("organizationId"), organizationId),
                root.get("status").in(CallSessionStatus.OPEN),
                cb.lessThan(root.<Instant>get("startedAt"), cutoff)));
        cq.orderBy(cb.asc(root.get("startedAt")));

        return entityManager.createQuery(cq).getResultList().stream()
                .map(mapper::toCallSession)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findOrganizationsWithOpenSessions() {
        return callSessionJpaRepository.findOrganizationIdsWithStatusIn(CallSessionStatus.OPEN);
    }

    @Override
    @Transactional(readOnly = true)
    public long count(String organizationId) {
        return callSessionJpaRepository.countByOrganizationId(organizationId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countOpen(String organizationId) {
        return callSessionJpaRepository.countByOrganizationIdAndStatusIn(organizationId, CallSessionStatus.OPEN);
    }
}
