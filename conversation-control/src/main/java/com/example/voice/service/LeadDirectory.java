package com.example.voice.service;

import com.example.voice.domain.Lead;
import com.example.voice.domain.Organization;
import java.time.Instant;
import java.util.Optional;

public interface LeadDirectory {

    Optional<Organization> findOrganization(String organizationId);

    Optional<Organization> findOrganizationByPhone(String normalizedPhone);

    Optional<Lead> findLead(String organizationId, String leadId);

    Optional<Lead> findLeadByPhone(String organizationId, String normalizedPhone);

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when the organization already has a lead with that phone
     */
    Lead insertLead(Lead lead);

    Lead saveLead(Lead lead);

    /**
     * Moves the lead's last contact forward to {@code at}; an older timestamp is ignored.
     */
    void touchLastContact(String organizationId, String leadId, Instant at);

    long countLeads(String organizationId);
}
