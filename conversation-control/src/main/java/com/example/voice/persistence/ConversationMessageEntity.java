package com.example.voice.persistence;

import com.example.voice.domain.MessageChannel;
import com.example.voice.domain.MessageSender;
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
        name = "voice_conversation_messages",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_message_org_external",
                columnNames = {"organization_id", "external_id"}),
        indexes = {
            @Index(name = "ix_message_lead", columnList = "organization_id, lead_id, created_at"),
            @Index(name = "ix_message_call_session", columnList = "organization_id, call_session_id")
        })
public class ConversationMessageEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "organization_id", nullable = false, updatable = false, length = 64)
    private String organizationId;

    @Column(name = "lead_id", nullable = false, updatable = false, length = 64)
    private String leadId;

    @Column(name = "call_session_id", length = 64)
    private String callSessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sender", nullable = false, length = 16)
    private MessageSender sender;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 16)
    private MessageChannel channel;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "external_id", length = 128)
    private String externalId;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
