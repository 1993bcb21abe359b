package com.example.voice.persistence;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationMessageJpaRepository extends JpaRepository<ConversationMessageEntity, String> {

    List<ConversationMessageEntity> findByOrganizationIdAndLeadIdOrderByCreatedAtDescIdDesc(
            String organizationId, String leadId, Pageable pageable);

    long countByOrganizationIdAndCallSessionId(String organizationId, String callSessionId);

    long countByOrganizationId(String organizationId);
}
