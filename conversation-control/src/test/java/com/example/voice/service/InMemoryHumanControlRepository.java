package com.example.voice.service;

import com.example.voice.domain.HumanControlSession;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Mirrors the unique active marker of the real table: inserting a second active session for a
 * lead fails with an integrity violation.
 */
class InMemoryHumanControlRepository implements HumanControlRepository {

    private final Map<String, HumanControlSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> activeMarkers = new ConcurrentHashMap<>();

    @Override
    public synchronized Optional<HumanControlSession> findActive(String organizationId, String leadId) {
        return Optional.ofNullable(activeMarkers.get(marker(organizationId, leadId)))
                .map(sessions::get)
                .filter(HumanControlSession::isActive)
                .map(InMemoryHumanControlRepository::copy);
    }

    @Override
    public synchronized HumanControlSession insertActive(HumanControlSession session) {
        if (activeMarkers.putIfAbsent(marker(session.getOrganizationId(), session.getLeadId()), session.getId()) != null) {
            throw new DataIntegrityViolationException("lead " + session.getLeadId() + " already under human control");
        }
        sessions.put(session.getId(), copy(session));
        return copy(session);
    }

    @Override
    public synchronized boolean end(String organizationId, String sessionId, Instant endedAt, String endReason) {
        HumanControlSession session = sessions.get(sessionId);
        if (session == null || !session.getOrganizationId().equals(organizationId) || !session.isActive()) {
            return false;
        }
        session.setEndedAt(endedAt);
        session.setEndReason(endReason);
        activeMarkers.remove(marker(organizationId, session.getLeadId()), sessionId);
        return true;
    }

    @Override
    public synchronized boolean incrementMessagesHandled(String organizationId, String sessionId) {
        HumanControlSession session = sessions.get(sessionId);
        if (session == null || !session.getOrganizationId().equals(organizationId) || !session.isActive()) {
            return false;
        }
        session.setMessagesHandled(session.getMessagesHandled() + 1);
        return true;
    }

    @Override
    public List<HumanControlSession> findAllActive(String organizationId) {
        return sessions.values().stream()
                .filter(session -> session.getOrganizationId().equals(organizationId))
                .filter(HumanControlSession::isActive)
                .sorted(Comparator.comparing(HumanControlSession::getStartedAt))
                .map(InMemoryHumanControlRepository::copy)
                .toList();
    }

    @Override
    public List<String> findOrganizationsWithActiveSessions() {
        return sessions.values().stream()
                .filter(HumanControlSession::isActive)
                .map(HumanControlSession::getOrganizationId)
                .distinct()
                .toList();
    }

    @Override
    public long countActive(String organizationId) {
        return findAllActive(organizationId).size();
    }

    long countActiveForLead(String organizationId, String leadId) {
        return sessions.values().stream()
                .filter(session -> session.getOrganizationId().equals(organizationId))
                .filter(session -> session.getLeadId().equals(leadId))
                .filter(HumanControlSession::isActive)
                .count();
    }

    Optional<HumanControlSession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(InMemoryHumanControlRepository::copy);
    }

    void age(String sessionId, Duration age) {
        sessions.get(sessionId).setStartedAt(Instant.now().minus(age));
    }

    private static String marker(String organizationId, String leadId) {
        return organizationId + ":" + leadId;
    }

    private static HumanControlSession copy(HumanControlSession source) {
        return HumanControlSession.builder()
                .id(source.getId())
                .organizationId(source.getOrganizationId())
                .leadId(source.getLeadId())
                .callSessionId(source.getCallSessionId())
                .operatorName(source.getOperatorName())
                .startedAt(source.getStartedAt())
                .endedAt(source.getEndedAt())
                .endReason(source.getEndReason())
                .messagesHandled(source.getMessagesHandled())
                .build();
    }
}
