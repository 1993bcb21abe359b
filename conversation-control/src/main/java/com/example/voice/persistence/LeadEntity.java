package com.example.voice.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "voice_leads",
        uniqueConstraints = @UniqueConstraint(name = "uk_lead_org_phone", columnNames = {"organization_id", "phone_number"}))
public class LeadEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "organization_id", nullable = false, updatable = false, length = 64)
    private String organizationId;

    @Column(name = "phone_number", nullable = false, length = 32)
    private String phoneNumber;

    @Column(name = "customer_name", length = 255)
    private String customerName;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "status", length = 64)
    private String status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "last_contact_at")
    private Instant lastContactAt;

    @Version
    @Column(name = "version")
    private Long version;
}
