package com.example.voice.service;

import com.example.voice.config.VoiceProperties;
import com.example.voice.domain.ConversationContext;
import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.ConversationSummary;
import com.example.voice.domain.Lead;
import com.example.voice.domain.Organization;
import com.example.voice.service.cache.ContextCacheStore;
import com.example.voice.service.exception.ServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Read-through, write-invalidate cache of per-lead conversation context.
 *
 * <p>A hit returns without touching the datastore. A miss reads a bounded window of recent
 * messages and summaries, never the full history. Racing misses compute the same value and
 * the last write wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationContextService {

    public static final String FIRST_INTERACTION = "This is the first interaction with this customer.";
    public static final String NO_PREVIOUS_SUMMARY = "First time caller - no previous interactions";

    private final LeadDirectory leadDirectory;
    private final ConversationHistoryRepository historyRepository;
    private final ContextCacheStore cacheStore;
    private final RedisKeyFactory keyFactory;
    private final VoiceProperties voiceProperties;
    private final ObjectMapper objectMapper;

    public ConversationContext getContext(String organizationId, String leadId) {
        requireIds(organizationId, leadId);
        String key = keyFactory.contextKey(organizationId, leadId);
        Optional<ConversationContext> cached = readCached(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        ConversationContext computed = computeContext(organizationId, leadId);
        store(key, computed);
        return computed;
    }

    /**
     * Builds the context straight from the datastore, bypassing the cache.
     */
    public ConversationContext computeContext(String organizationId, String leadId) {
        requireIds(organizationId, leadId);
        Lead lead = leadDirectory.findLead(organizationId, leadId)
                .orElseThrow(() -> ServiceException.notFound("lead_not_found", "Lead not found: " + leadId));
        String organizationName = leadDirectory.findOrganization(organizationId)
                .map(Organization::getName)
                .orElse("");

        VoiceProperties.Cache cacheConfig = voiceProperties.getCache();
        List<ConversationMessage> messages =
                historyRepository.findRecent(organizationId, leadId, Math.max(cacheConfig.getHistoryWindow(), 0));
        List<ConversationSummary> summaries =
                historyRepository.findRecentSummaries(organizationId, leadId, Math.max(cacheConfig.getSummaryWindow(), 0));

        String conversationText = renderHistory(messages, summaries);
        String previousSummary = summaries.isEmpty() ? NO_PREVIOUS_SUMMARY : summaries.get(0).getSummary();

        ConversationContext context = ConversationContext.builder()
                .organizationId(organizationId)
                .leadId(leadId)
                .organizationName(organizationName)
                .customerName(lead.getCustomerName())
                .customerPhone(lead.getPhoneNumber())
                .leadStatus(StringUtils.hasText(lead.getStatus()) ? lead.getStatus() : Lead.DEFAULT_STATUS)
                .conversationContext(conversationText)
                .previousSummary(previousSummary)
                .messageCount(messages.size())
                .computedAt(Instant.now())
                .fallback(false)
                .build();
        context.setDynamicVariables(dynamicVariables(context));
        return context;
    }

    /**
     * Safe answer for a caller we could not look up in time.
     */
    public ConversationContext defaultContext(String organizationId, String customerPhone) {
        ConversationContext context = ConversationContext.builder()
                .organizationId(organizationId)
                .organizationName("")
                .customerName(null)
                .customerPhone(customerPhone)
                .leadStatus(Lead.DEFAULT_STATUS)
                .conversationContext(FIRST_INTERACTION)
                .previousSummary(NO_PREVIOUS_SUMMARY)
                .messageCount(0)
                .computedAt(Instant.now())
                .fallback(true)
                .build();
        context.setDynamicVariables(dynamicVariables(context));
        return context;
    }

    public void invalidate(String organizationId, String leadId) {
        if (!StringUtils.hasText(organizationId) || !StringUtils.hasText(leadId)) {
            return;
        }
        cacheStore.delete(keyFactory.contextKey(organizationId, leadId));
    }

    private Optional<ConversationContext> readCached(String key) {
        Optional<String> raw = cacheStore.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        ConversationContext context;
        try {
            context = objectMapper.readValue(raw.get(), ConversationContext.class);
        } catch (JsonProcessingException ex) {
            log.warn("Dropping unreadable context entry {}: {}", key, ex.getOriginalMessage());
            cacheStore.delete(key);
            return Optional.empty();
        }
        Duration ttl = voiceProperties.getCache().getContextTtl();
        if (context.getComputedAt() == null || ttl == null
                || !context.getComputedAt().plus(ttl).isAfter(Instant.now())) {
            return Optional.empty();
        }
        return Optional.of(context);
    }

    private void store(String key, ConversationContext context) {
        try {
            cacheStore.set(key, objectMapper.writeValueAsString(context), voiceProperties.getCache().getContextTtl());
        } catch (JsonProcessingException ex) {
            log.warn("Unable to serialize context for {}", key, ex);
        }
    }

    private String renderHistory(List<ConversationMessage> messages, List<ConversationSummary> summaries) {
        if (messages.isEmpty() && summaries.isEmpty()) {
            return FIRST_INTERACTION;
        }
        StringBuilder text = new StringBuilder();
        if (!messages.isEmpty()) {
            text.append("RECENT CONVERSATION HISTORY:");
            for (ConversationMessage message : messages) {
                text.append('\n')
                        .append(message.getSender().getLabel())
                        .append(" (")
                        .append(message.getChannel().getLabel())
                        .append("): ")
                        .append(message.getContent());
            }
        }
        if (summaries.size() > 1) {
            if (text.length() > 0) {
                text.append("\n\n");
            }
            text.append("EARLIER CALL SUMMARIES:");
            for (ConversationSummary summary : summaries.subList(1, summaries.size())) {
                text.append("\n- ").append(summary.getSummary());
            }
        }
        return text.length() > 0 ? text.toString() : FIRST_INTERACTION;
    }

    private Map<String, String> dynamicVariables(ConversationContext context) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("conversation_context", context.getConversationContext());
        variables.put("previous_summary", context.getPreviousSummary());
        variables.put("customer_name", nullToEmpty(context.getCustomerName()));
        variables.put("customer_phone", nullToEmpty(context.getCustomerPhone()));
        variables.put("lead_status", nullToEmpty(context.getLeadStatus()));
        variables.put("organization_name", nullToEmpty(context.getOrganizationName()));
        variables.put("organization_id", nullToEmpty(context.getOrganizationId()));
        variables.put("lead_id", nullToEmpty(context.getLeadId()));
        variables.put("has_customer_name", String.valueOf(StringUtils.hasText(context.getCustomerName())));
        return variables;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static void requireIds(String organizationId, String leadId) {
        if (!StringUtils.hasText(organizationId)) {
            throw ServiceException.badRequest("missing_organization", "Organization id is required");
        }
        if (!StringUtils.hasText(leadId)) {
            throw ServiceException.badRequest("missing_lead", "Lead id is required");
        }
    }
}
