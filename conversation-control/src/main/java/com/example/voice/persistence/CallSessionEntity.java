package com.example.voice.persistence;

import com.example.voice.domain.CallDirection;
import com.example.voice.domain.CallSessionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "voice_call_sessions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_call_session_org_external",
                columnNames = {"organization_id", "external_id"}),
        indexes = {
            @Index(name = "ix_call_session_lead", columnList = "organization_id, lead_id, started_at"),
            @Index(name = "ix_call_session_status", columnList = "status, started_at")
        })
public class CallSessionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "organization_id", nullable = false, updatable = false, length = 64)
    private String organizationId;

    @Column(name = "lead_id", nullable = false, updatable = false, length = 64)
    private String leadId;

    @Column(name = "external_id", nullable = false, updatable = false, length = 128)
    private String externalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 16)
    private CallDirection direction;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CallSessionStatus status;

    @Column(name = "provider_agent_id", length = 128)
    private String providerAgentId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "duration_seconds")
    private Integer durationSeconds;

    @Column(name = "end_reason", length = 64)
    private String endReason;

    @Column(name = "auto_closed", nullable = false)
    private boolean autoClosed;
}
