package com.example.voice.service;

import com.example.voice.domain.CallSession;
import com.example.voice.domain.CallSessionStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface CallSessionRepository {

    /**
     * Inserts a new session.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when a session with the
     *         same organization and external id already exists
     */
    CallSession insert(CallSession session);

    Optional<CallSession> findById(String organizationId, String sessionId);

    Optional<CallSession> findByExternalId(String organizationId, String externalId);

    /**
     * Resolves a provider correlation id to the newest matching session across organizations.
     * Only used to discover the organization of an unauthenticated provider callback.
     */
    Optional<CallSession> findLatestByExternalId(String externalId);

    /**
     * Moves the session to {@code target} only if its current status is one of {@code sources}.
     *
     * @return {@code true} when the row was updated
     */
    boolean transition(
            String organizationId,
            String sessionId,
            Set<CallSessionStatus> sources,
            CallSessionStatus target,
            Instant at,
            String endReason,
            boolean autoClosed);

    void updateDuration(String organizationId, String sessionId, int durationSeconds);

    Optional<CallSession> findLatestOpen(String organizationId, String leadId);

    List<CallSession> findHistory(String organizationId, String leadId, int limit);

    List<CallSession> findOpenStartedBefore(String organizationId, Instant cutoff);

    List<String> findOrganizationsWithOpenSessions();

    long count(String organizationId);

    long countOpen(String organizationId);
}
