package com.example.voice.persistence;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationSummaryJpaRepository extends JpaRepository<ConversationSummaryEntity, String> {

    List<ConversationSummaryEntity> findByOrganizationIdAndLeadIdOrderByCreatedAtDescIdDesc(
            String organizationId, String leadId, Pageable pageable);
}
