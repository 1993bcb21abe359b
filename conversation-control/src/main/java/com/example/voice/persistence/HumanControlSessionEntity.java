package com.example.voice.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

/**
 * {@code active_marker} holds {@code organizationId:leadId} while the session is active and is
 * cleared when it ends; its unique constraint admits one active session per lead.
 */
@Getter
@Setter
@Entity
@Table(
        name = "voice_human_control_sessions",
        uniqueConstraints = @UniqueConstraint(name = "uk_human_control_active", columnNames = "active_marker"),
        indexes = @Index(name = "ix_human_control_lead", columnList = "organization_id, lead_id"))
public class HumanControlSessionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "organization_id", nullable = false, updatable = false, length = 64)
    private String organizationId;

    @Column(name = "lead_id", nullable = false, updatable = false, length = 64)
    private String leadId;

    @Column(name = "call_session_id", length = 64)
    private String callSessionId;

    @Column(name = "operator_name", nullable = false, length = 255)
    private String operatorName;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "end_reason", length = 64)
    private String endReason;

    @Column(name = "messages_handled", nullable = false)
    private int messagesHandled;

    @Column(name = "active_marker", length = 160)
    private String activeMarker;
}
