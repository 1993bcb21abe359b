package com.example.voice.persistence;

import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeadJpaRepository extends JpaRepository<LeadEntity, String> {

    Optional<LeadEntity> findByIdAndOrganizationId(String id, String organizationId);

    Optional<LeadEntity> findByOrganizationIdAndPhoneNumber(String organizationId, String phoneNumber);

    long countByOrganizationId(String organizationId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update LeadEntity l set l.lastContactAt = :at "
                    + "where l.id = :id and l.organizationId = :organizationId "
                    + "and (l.lastContactAt is null or l.lastContactAt < :at)")
    int touchLastContact(
            @Param("organizationId") String organizationId,
            @Param("id") String id,
            @Param("at") Instant at);
}
