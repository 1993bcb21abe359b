package com.example.voice.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HumanControlSessionJpaRepository extends JpaRepository<HumanControlSessionEntity, String> {

    Optional<HumanControlSessionEntity> findByActiveMarker(String activeMarker);

    List<HumanControlSessionEntity> findByOrganizationIdAndEndedAtIsNullOrderByStartedAtAsc(String organizationId);

    long countByOrganizationIdAndEndedAtIsNull(String organizationId);

    @Query("select distinct h.organizationId from HumanControlSessionEntity h where h.endedAt is null")
    List<String> findOrganizationIdsWithActiveSessions();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update HumanControlSessionEntity h "
                    + "set h.endedAt = :endedAt, h.endReason = :endReason, h.activeMarker = null "
                    + "where h.id = :id and h.organizationId = :organizationId and h.endedAt is null")
    int end(
            @Param("organizationId") String organizationId,
            @Param("id") String id,
            @Param("endedAt") Instant endedAt,
            @Param("endReason") String endReason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update HumanControlSessionEntity h set h.messagesHandled = h.messagesHandled + 1 "
                    + "where h.id = :id and h.organizationId = :organizationId and h.endedAt is null")
    int incrementMessagesHandled(@Param("organizationId") String organizationId, @Param("id") String id);
}
