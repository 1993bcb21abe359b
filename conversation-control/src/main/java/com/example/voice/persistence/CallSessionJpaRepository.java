package com.example.voice.persistence;

import com.example.voice.domain.CallSessionStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CallSessionJpaRepository extends JpaRepository<CallSessionEntity, String> {

    Optional<CallSessionEntity> findByIdAndOrganizationId(String id, String organizationId);

    Optional<CallSessionEntity> findByOrganizationIdAndExternalId(String organizationId, String externalId);

    Optional<CallSessionEntity> findFirstByExternalIdOrderByStartedAtDesc(String externalId);

    Optional<CallSessionEntity> findFirstByOrganizationIdAndLeadIdAndStatusInOrderByStartedAtDesc(
            String organizationId, String leadId, Collection<CallSessionStatus> statuses);

    List<CallSessionEntity> findByOrganizationIdAndLeadIdOrderByStartedAtDesc(
            String organizationId, String leadId, Pageable pageable);

    long countByOrganizationId(String organizationId);

    long countByOrganizationIdAndStatusIn(String organizationId, Collection<CallSessionStatus> statuses);

    @Query("select distinct c.organizationId from CallSessionEntity c where c.status in (:statuses)")
    List<String> findOrganizationIdsWithStatusIn(@Param("statuses") Collection<CallSessionStatus> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update CallSessionEntity c "
                    + "set c.status = :target, c.updatedAt = :at, c.endedAt = :endedAt, "
                    + "c.endReason = :endReason, c.autoClosed = :autoClosed "
                    + "where c.id = :id and c.organizationId = :organizationId and c.status in (:sources)")
    int transition(
            @Param("organizationId") String organizationId,
            @Param("id") String id,
            @Param("sources") Collection<CallSessionStatus> sources,
            @Param("target") CallSessionStatus target,
            @Param("at") Instant at,
            @Param("endedAt") Instant endedAt,
            @Param("endReason") String endReason,
            @Param("autoClosed") boolean autoClosed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update CallSessionEntity c set c.durationSeconds = :durationSeconds, c.updatedAt = :at "
                    + "where c.id = :id and c.organizationId = :organizationId")
    int updateDuration(
            @Param("organizationId") String organizationId,
            @Param("id") String id,
            @Param("durationSeconds") Integer durationSeconds,
            @Param("at") Instant at);
}
