package com.example.voice.persistence;

import com.example.voice.domain.Lead;
import com.example.voice.domain.Organization;
import com.example.voice.service.LeadDirectory;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaLeadDirectory implements LeadDirectory {

    private final OrganizationJpaRepository organizationJpaRepository;
    private final LeadJpaRepository leadJpaRepository;
    private final VoiceEntityMapper mapper;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public Optional<Organization> findOrganization(String organizationId) {
        if (!StringUtils.hasText(organizationId)) {
            return Optional.empty();
        }
        return organizationJpaRepository.findById(organizationId).map(mapper::toOrganization);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Organization> findOrganizationByPhone(String normalizedPhone) {
        if (!StringUtils.hasText(normalizedPhone)) {
            return Optional.empty();
        }
        return organizationJpaRepository.findByPhoneNumber(normalizedPhone).map(mapper::toOrganization);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Lead> findLead(String organizationId, String leadId) {
        if (!StringUtils.hasText(organizationId) || !StringUtils.hasText(leadId)) {
            return Optional.empty();
        }
        return leadJpaRepository.findByIdAndOrganizationId(leadId, organizationId).map(mapper::toLead);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Lead> findLeadByPhone(String organizationId, String normalizedPhone) {
        if (!StringUtils.hasText(organizationId) || !StringUtils.hasText(normalizedPhone)) {
            return Optional.empty();
        }
        return leadJpaRepository.findByOrganizationIdAndPhoneNumber(organizationId, normalizedPhone)
                .map(mapper::toLead);
    }

    @Override
    @Transactional
    public Lead insertLead(Lead lead) {
        LeadEntity entity = mapper.toEntity(lead);
        entityManager.persist(entity);
        entityManager.flush();
        return mapper.toLead(entity);
    }

    @Override
    @Transactional
    public Lead saveLead(Lead lead) {
        LeadEntity entity = leadJpaRepository.findByIdAndOrganizationId(lead.getId(), lead.getOrganizationId())
                .orElseThrow(() -> new IllegalArgumentException("Lead not found: " + lead.getId()));
        mapper.copyMutableFields(lead, entity);
        return mapper.toLead(leadJpaRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional
    public void touchLastContact(String organizationId, String leadId, Instant at) {
        leadJpaRepository.touchLastContact(organizationId, leadId, at);
    }

    @Override
    @Transactional(readOnly = true)
    public long countLeads(String organizationId) {
        return leadJpaRepository.countByOrganizationId(organizationId);
    }
}
