package com.example.voice.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "voice_conversation_summaries",
        indexes = @Index(name = "ix_summary_lead", columnList = "organization_id, lead_id, created_at"))
public class ConversationSummaryEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "organization_id", nullable = false, updatable = false, length = 64)
    private String organizationId;

    @Column(name = "lead_id", nullable = false, updatable = false, length = 64)
    private String leadId;

    @Column(name = "call_session_id", unique = true, length = 64)
    private String callSessionId;

    @Column(name = "summary", nullable = false, columnDefinition = "text")
    private String summary;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
