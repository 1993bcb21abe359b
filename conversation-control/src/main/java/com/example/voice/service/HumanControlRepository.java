package com.example.voice.service;

import com.example.voice.domain.HumanControlSession;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface HumanControlRepository {

    Optional<HumanControlSession> findActive(String organizationId, String leadId);

    /**
     * Inserts a session carrying the lead's active marker. The marker is unique, so at most one
     * concurrent insert for a lead succeeds.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when the lead already has an active session
     */
    HumanControlSession insertActive(HumanControlSession session);

    /**
     * Ends the session if it is still active and releases the lead's marker.
     *
     * @return {@code true} when this call ended it
     */
    boolean end(String organizationId, String sessionId, Instant endedAt, String endReason);

    /**
     * Counts one operator message against the session, provided it is still active.
     *
     * @return {@code false} when the session has ended in the meantime
     */
    boolean incrementMessagesHandled(String organizationId, String sessionId);

    List<HumanControlSession> findAllActive(String organizationId);

    List<String> findOrganizationsWithActiveSessions();

    long countActive(String organizationId);
}
