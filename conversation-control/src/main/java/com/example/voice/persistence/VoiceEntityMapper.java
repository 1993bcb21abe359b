package com.example.voice.persistence;

import com.example.voice.domain.CallSession;
import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.ConversationSummary;
import com.example.voice.domain.HumanControlSession;
import com.example.voice.domain.Lead;
import com.example.voice.domain.Organization;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class VoiceEntityMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public Organization toOrganization(OrganizationEntity entity) {
        return Organization.builder()
                .id(entity.getId())
                .name(entity.getName())
                .phoneNumber(entity.getPhoneNumber())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public Lead toLead(LeadEntity entity) {
        return Lead.builder()
                .id(entity.getId())
                .organizationId(entity.getOrganizationId())
                .phoneNumber(entity.getPhoneNumber())
                .customerName(entity.getCustomerName())
                .email(entity.getEmail())
                .status(StringUtils.hasText(entity.getStatus()) ? entity.getStatus() : Lead.DEFAULT_STATUS)
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .lastContactAt(entity.getLastContactAt())
                .build();
    }

    public LeadEntity toEntity(Lead lead) {
        LeadEntity entity = new LeadEntity();
        entity.setId(lead.getId());
        entity.setOrganizationId(lead.getOrganizationId());
        copyMutableFields(lead, entity);
        entity.setCreatedAt(lead.getCreatedAt());
        return entity;
    }

    public void copyMutableFields(Lead lead, LeadEntity entity) {
        entity.setPhoneNumber(lead.getPhoneNumber());
        entity.setCustomerName(lead.getCustomerName());
        entity.setEmail(lead.getEmail());
        entity.setStatus(lead.getStatus());
        entity.setUpdatedAt(lead.getUpdatedAt());
        if (lead.getLastContactAt() != null
                && (entity.getLastContactAt() == null || lead.getLastContactAt().isAfter(entity.getLastContactAt()))) {
            entity.setLastContactAt(lead.getLastContactAt());
        }
    }

    public CallSession toCallSession(CallSessionEntity entity) {
        return CallSession.builder()
                .id(entity.getId())
                .organizationId(entity.getOrganizationId())
                .leadId(entity.getLeadId())
                .externalId(entity.getExternalId())
                .direction(entity.getDirection())
                .status(entity.getStatus())
                .providerAgentId(entity.getProviderAgentId())
                .startedAt(entity.getStartedAt())
                .updatedAt(entity.getUpdatedAt())
                .endedAt(entity.getEndedAt())
                .durationSeconds(entity.getDurationSeconds())
                .endReason(entity.getEndReason())
                .autoClosed(entity.isAutoClosed())
                .build();
    }

    public CallSessionEntity toEntity(CallSession session) {
        CallSessionEntity entity = new CallSessionEntity();
        entity.setId(session.getId());
        entity.setOrganizationId(session.getOrganizationId());
        entity.setLeadId(session.getLeadId());
        entity.setExternalId(session.getExternalId());
        entity.setDirection(session.getDirection());
        entity.setStatus(session.getStatus());
        entity.setProviderAgentId(session.getProviderAgentId());
        entity.setStartedAt(session.getStartedAt());
        entity.setUpdatedAt(session.getUpdatedAt());
        entity.setEndedAt(session.getEndedAt());
        entity.setDurationSeconds(session.getDurationSeconds());
        entity.setEndReason(session.getEndReason());
        entity.setAutoClosed(session.isAutoClosed());
        return entity;
    }

    public HumanControlSession toHumanControlSession(HumanControlSessionEntity entity) {
        return HumanControlSession.builder()
                .id(entity.getId())
                .organizationId(entity.getOrganizationId())
                .leadId(entity.getLeadId())
                .callSessionId(entity.getCallSessionId())
                .operatorName(entity.getOperatorName())
                .startedAt(entity.getStartedAt())
                .endedAt(entity.getEndedAt())
                .endReason(entity.getEndReason())
                .messagesHandled(entity.getMessagesHandled())
                .build();
    }

    public HumanControlSessionEntity toEntity(HumanControlSession session, String activeMarker) {
        HumanControlSessionEntity entity = new HumanControlSessionEntity();
        entity.setId(session.getId());
        entity.setOrganizationId(session.getOrganizationId());
        entity.setLeadId(session.getLeadId());
        entity.setCallSessionId(session.getCallSessionId());
        entity.setOperatorName(session.getOperatorName());
        entity.setStartedAt(session.getStartedAt());
        entity.setEndedAt(session.getEndedAt());
        entity.setEndReason(session.getEndReason());
        entity.setMessagesHandled(session.getMessagesHandled());
        entity.setActiveMarker(session.isActive() ? activeMarker : null);
        return entity;
    }

    public ConversationMessage toMessage(ConversationMessageEntity entity) {
        return ConversationMessage.builder()
                .id(entity.getId())
                .organizationId(entity.getOrganizationId())
                .leadId(entity.getLeadId())
                .callSessionId(entity.getCallSessionId())
                .sender(entity.getSender())
                .channel(entity.getChannel())
                .content(entity.getContent())
                .externalId(entity.getExternalId())
                .metadata(readMap(entity.getMetadata()))
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public ConversationMessageEntity toEntity(ConversationMessage message) {
        ConversationMessageEntity entity = new ConversationMessageEntity();
        entity.setId(message.getId());
        entity.setOrganizationId(message.getOrganizationId());
        entity.setLeadId(message.getLeadId());
        entity.setCallSessionId(message.getCallSessionId());
        entity.setSender(message.getSender());
        entity.setChannel(message.getChannel());
        entity.setContent(message.getContent());
        entity.setExternalId(StringUtils.hasText(message.getExternalId()) ? message.getExternalId() : null);
        entity.setMetadata(writeJson(message.getMetadata()));
        entity.setCreatedAt(message.getCreatedAt());
        return entity;
    }

    public ConversationSummary toSummary(ConversationSummaryEntity entity) {
        return ConversationSummary.builder()
                .id(entity.getId())
                .organizationId(entity.getOrganizationId())
                .leadId(entity.getLeadId())
                .callSessionId(entity.getCallSessionId())
                .summary(entity.getSummary())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public ConversationSummaryEntity toEntity(ConversationSummary summary) {
        ConversationSummaryEntity entity = new ConversationSummaryEntity();
        entity.setId(summary.getId());
        entity.setOrganizationId(summary.getOrganizationId());
        entity.setLeadId(summary.getLeadId());
        entity.setCallSessionId(summary.getCallSessionId());
        entity.setSummary(summary.getSummary());
        entity.setCreatedAt(summary.getCreatedAt());
        return entity;
    }

    private String writeJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize message metadata", e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable message metadata: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
