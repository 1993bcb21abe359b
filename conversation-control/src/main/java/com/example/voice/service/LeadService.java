package com.example.voice.service;

import com.example.voice.domain.Lead;
import com.example.voice.domain.Organization;
import com.example.voice.event.ConversationEventPublisher;
import com.example.voice.event.ConversationEventType;
import com.example.voice.service.exception.ServiceException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class LeadService {

    private final LeadDirectory leadDirectory;
    private final ConversationContextService contextService;
    private final ConversationEventPublisher eventPublisher;
    private final TransientFailureRetrier retrier;

    public Optional<Organization> findOrganizationByPhone(String rawPhone) {
        String phone = PhoneNumbers.normalize(rawPhone);
        if (phone == null) {
            return Optional.empty();
        }
        return retrier.execute("organization lookup", () -> leadDirectory.findOrganizationByPhone(phone));
    }

    public Organization getOrganization(String organizationId) {
        return leadDirectory.findOrganization(organizationId)
                .orElseThrow(() -> ServiceException.notFound(
                        "organization_not_found", "Organization not found: " + organizationId));
    }

    /**
     * Finds the organization's lead for a caller, creating it on first contact. Concurrent first
     * contacts from the same number resolve to one lead.
     */
    public Lead findOrCreateByPhone(String organizationId, String rawPhone) {
        String phone = PhoneNumbers.normalize(rawPhone);
        if (phone == null) {
            throw ServiceException.badRequest("invalid_phone", "A caller phone number is required");
        }
        Optional<Lead> existing =
                retrier.execute("lead lookup", () -> leadDirectory.findLeadByPhone(organizationId, phone));
        Instant now = Instant.now();
        if (existing.isPresent()) {
            Lead lead = existing.get();
            retrier.run("lead contact", () -> leadDirectory.touchLastContact(organizationId, lead.getId(), now));
            lead.setLastContactAt(now);
            return lead;
        }
        Lead lead = Lead.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(organizationId)
                .phoneNumber(phone)
                .status(Lead.DEFAULT_STATUS)
                .createdAt(now)
                .updatedAt(now)
                .lastContactAt(now)
                .build();
        try {
            Lead created = retrier.execute("lead insert", () -> leadDirectory.insertLead(lead));
            log.info("Created lead {} for organization {}", created.getId(), organizationId);
            return created;
        } catch (DataIntegrityViolationException ex) {
            return leadDirectory.findLeadByPhone(organizationId, phone).orElseThrow(() -> ex);
        }
    }

    public Lead getLead(String organizationId, String leadId) {
        return leadDirectory.findLead(organizationId, leadId)
                .orElseThrow(() -> ServiceException.notFound("lead_not_found", "Lead not found: " + leadId));
    }

    public Lead updateLead(String organizationId, String leadId, String customerName, String email, String status) {
        Lead lead = getLead(organizationId, leadId);
        Map<String, Object> changes = new HashMap<>();
        if (customerName != null && !customerName.equals(lead.getCustomerName())) {
            lead.setCustomerName(StringUtils.hasText(customerName) ? customerName.trim() : null);
            changes.put("customerName", customerName);
        }
        if (email != null && !email.equals(lead.getEmail())) {
            lead.setEmail(StringUtils.hasText(email) ? email.trim() : null);
            changes.put("email", email);
        }
        if (StringUtils.hasText(status) && !status.equals(lead.getStatus())) {
            lead.setStatus(status.trim());
            changes.put("status", status);
        }
        if (changes.isEmpty()) {
            return lead;
        }
        lead.setUpdatedAt(Instant.now());
        Lead saved = retrier.execute("lead update", () -> leadDirectory.saveLead(lead));
        contextService.invalidate(organizationId, leadId);
        eventPublisher.publish(ConversationEventType.LEAD_UPDATED, organizationId, leadId, changes);
        return saved;
    }

    public long countLeads(String organizationId) {
        return leadDirectory.countLeads(organizationId);
    }
}
