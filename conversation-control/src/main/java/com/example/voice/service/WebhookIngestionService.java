package com.example.voice.service;

import com.example.voice.config.VoiceProperties;
import com.example.voice.domain.CallDirection;
import com.example.voice.domain.CallSession;
import com.example.voice.domain.CallSessionEvent;
import com.example.voice.domain.ConversationContext;
import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.Lead;
import com.example.voice.domain.MessageChannel;
import com.example.voice.domain.MessageSender;
import com.example.voice.domain.Organization;
import com.example.voice.dto.ConversationInitiationRequest;
import com.example.voice.dto.ConversationInitiationResponse;
import com.example.voice.dto.WebhookAck;
import com.example.voice.event.ConversationEventType;
import com.example.voice.service.exception.ServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Turns provider callbacks into call session transitions and conversation entries.
 *
 * <p>Deliveries are at-least-once and may arrive out of order. Every handler is idempotent:
 * sessions and messages are keyed on provider ids and transitions are conditional. Malformed
 * payloads are logged and acknowledged instead of failing the request.
 */
@Slf4j
@Service
public class WebhookIngestionService {

    static final String SMS_EMPTY_RESPONSE = "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response></Response>";
    static final String DEFAULT_CALL_SUMMARY = "Call completed";
    static final String POST_CALL_REASON = "call_ended";

    private final LeadService leadService;
    private final CallSessionService callSessionService;
    private final ConversationService conversationService;
    private final ConversationContextService contextService;
    private final HumanControlService humanControlService;
    private final VoiceProperties voiceProperties;
    private final ObjectMapper objectMapper;
    private final Executor webhookExecutor;

    public WebhookIngestionService(
            LeadService leadService,
            CallSessionService callSessionService,
            ConversationService conversationService,
            ConversationContextService contextService,
            HumanControlService humanControlService,
            VoiceProperties voiceProperties,
            ObjectMapper objectMapper,
            @Qualifier("webhookExecutor") Executor webhookExecutor) {
        this.leadService = leadService;
        this.callSessionService = callSessionService;
        this.conversationService = conversationService;
        this.contextService = contextService;
        this.humanControlService = humanControlService;
        this.voiceProperties = voiceProperties;
        this.objectMapper = objectMapper;
        this.webhookExecutor = webhookExecutor;
    }

    /**
     * Answers the provider's synchronous initiation callback. The lookup runs on the webhook
     * pool and is awaited for at most the configured budget; past it the caller gets the
     * default variables while the lookup keeps running and still records the session.
     */
    public ConversationInitiationResponse handleInitiation(String body) {
        ConversationInitiationRequest request;
        try {
            request = objectMapper.readValue(StringUtils.hasText(body) ? body : "{}", ConversationInitiationRequest.class);
        } catch (JsonProcessingException ex) {
            log.error("Malformed conversation initiation payload, answering with defaults: {}", body, ex);
            return ConversationInitiationResponse.of(contextService.defaultContext(null, null).getDynamicVariables());
        }
        String callerPhone = PhoneNumbers.normalize(request.getCallerId());

        Duration budget = voiceProperties.getWebhook().getInitiationBudget();
        CompletableFuture<ConversationContext> lookup =
                CompletableFuture.supplyAsync(() -> initiate(request), webhookExecutor);
        ConversationContext context;
        try {
            context = lookup.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("Initiation lookup for caller {} (conversation {}) exceeded {} ms, answering with defaults",
                    callerPhone, correlationId(request), budget.toMillis());
            context = contextService.defaultContext(null, callerPhone);
        } catch (ExecutionException ex) {
            log.error("Initiation lookup failed for caller {} (conversation {}), answering with defaults",
                    callerPhone, correlationId(request), ex.getCause());
            context = contextService.defaultContext(null, callerPhone);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            context = contextService.defaultContext(null, callerPhone);
        }
        return ConversationInitiationResponse.of(context.getDynamicVariables());
    }

    ConversationContext initiate(ConversationInitiationRequest request) {
        String callerPhone = PhoneNumbers.normalize(request.getCallerId());
        Optional<Organization> organization = leadService.findOrganizationByPhone(request.getCalledNumber());
        if (organization.isEmpty()) {
            log.warn("No organization owns called number {}, answering caller {} with defaults",
                    request.getCalledNumber(), callerPhone);
            return contextService.defaultContext(null, callerPhone);
        }
        String organizationId = organization.get().getId();
        if (callerPhone == null) {
            log.warn("Initiation for organization {} carried no caller id", organizationId);
            return contextService.defaultContext(organizationId, null);
        }
        Lead lead = leadService.findOrCreateByPhone(organizationId, callerPhone);
        String externalId = correlationId(request);
        if (StringUtils.hasText(externalId)) {
            callSessionService.createSession(
                    organizationId, lead.getId(), externalId, CallDirection.INBOUND, request.getAgentId());
        } else {
            log.warn("Initiation for lead {} carried no conversation id; no call session recorded", lead.getId());
        }
        return contextService.getContext(organizationId, lead.getId());
    }

    /**
     * Handles a mid-conversation event: live transcript turns and status changes.
     */
    public WebhookAck handleConversationEvent(String body) {
        JsonNode root = parse(body, "conversation event");
        if (root == null) {
            return WebhookAck.rejected("malformed_payload");
        }
        String type = text(root, "type");
        String conversationId = text(root, "conversation_id");
        if (!StringUtils.hasText(type) || !StringUtils.hasText(conversationId)) {
            log.error("Conversation event without type or conversation id: {}", body);
            return WebhookAck.rejected("missing_fields");
        }
        JsonNode data = root.path("data");

        Optional<CallSession> session = callSessionService.findByExternalId(conversationId);
        if (session.isEmpty()) {
            log.warn("Conversation event {} for unknown conversation {}", type, conversationId);
            return WebhookAck.ignored("unknown_conversation");
        }
        CallSession callSession = session.get();

        Optional<MessageSender> speaker = transcriptSpeaker(type, data);
        if (speaker.isPresent()) {
            String content = firstText(data, "text", "message", "transcript");
            if (!StringUtils.hasText(content)) {
                return WebhookAck.ignored("empty_transcript");
            }
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("conversationId", conversationId);
            if (data.hasNonNull("confidence")) {
                metadata.put("confidence", data.get("confidence").asDouble());
            }
            conversationService.recordMessage(
                    ConversationMessage.builder()
                            .organizationId(callSession.getOrganizationId())
                            .leadId(callSession.getLeadId())
                            .callSessionId(callSession.getId())
                            .sender(speaker.get())
                            .channel(MessageChannel.VOICE)
                            .content(content)
                            .externalId(firstText(root, "event_id", "message_id"))
                            .metadata(metadata)
                            .build(),
                    ConversationEventType.LIVE_TRANSCRIPT);
            return WebhookAck.received(callSession.getId());
        }

        Optional<CallSessionEvent> transition = CallSessionEvent.fromProviderStatus(type)
                .or(() -> CallSessionEvent.fromProviderStatus(text(data, "status")));
        if (transition.isPresent()) {
            CallSession updated = callSessionService.transition(
                    callSession.getOrganizationId(), callSession.getId(), transition.get(), type);
            return WebhookAck.received(updated.getId());
        }
        if ("error".equalsIgnoreCase(type)) {
            log.warn("Provider reported an error for conversation {}: {}", conversationId, data);
        } else {
            log.debug("Ignoring conversation event {} for {}", type, conversationId);
        }
        return WebhookAck.ignored("unhandled_event");
    }

    /**
     * Completes a call from the provider's post-call report: closes the session, stores the
     * summary and, when no live transcript was captured, the transcript turns.
     */
    public WebhookAck handlePostCall(String body) {
        JsonNode root = parse(body, "post-call");
        if (root == null) {
            return WebhookAck.rejected("malformed_payload");
        }
        JsonNode data = root.has("data") ? root.path("data") : root;
        JsonNode metadata = data.path("metadata");
        String conversationId = text(data, "conversation_id");
        String callSid = text(metadata.path("phone_call"), "call_sid");

        Optional<CallSession> session = Optional.empty();
        if (StringUtils.hasText(conversationId)) {
            session = callSessionService.findByExternalId(conversationId);
        }
        if (session.isEmpty() && StringUtils.hasText(callSid)) {
            session = callSessionService.findByExternalId(callSid);
        }
        if (session.isEmpty()) {
            log.warn("Post-call data for unknown conversation {} (call sid {})", conversationId, callSid);
            return WebhookAck.ignored("unknown_conversation");
        }
        CallSession callSession = callSessionService.transition(
                session.get().getOrganizationId(), session.get().getId(), CallSessionEvent.COMPLETE, POST_CALL_REASON);
        String organizationId = callSession.getOrganizationId();
        String leadId = callSession.getLeadId();

        if (metadata.hasNonNull("call_duration_secs")) {
            callSessionService.recordDuration(organizationId, callSession.getId(), metadata.get("call_duration_secs").asInt());
        }

        JsonNode analysis = root.has("analysis") ? root.path("analysis") : data.path("analysis");
        String summary = firstText(analysis, "transcript_summary", "call_summary_title");
        conversationService.recordSummary(organizationId, leadId, callSession.getId(),
                StringUtils.hasText(summary) ? summary : DEFAULT_CALL_SUMMARY);

        JsonNode transcript = data.path("transcript");
        if (transcript.isArray() && transcript.size() > 0
                && !conversationService.hasMessagesForCallSession(organizationId, callSession.getId())) {
            storeTranscript(callSession, transcript);
        }
        return WebhookAck.received(callSession.getId());
    }

    /**
     * Handles a telephony status callback.
     */
    public WebhookAck handleCallStatus(String callSid, String callStatus, String callDuration) {
        if (!StringUtils.hasText(callSid) || !StringUtils.hasText(callStatus)) {
            log.error("Call status callback without CallSid or CallStatus (sid={}, status={})", callSid, callStatus);
            return WebhookAck.rejected("missing_fields");
        }
        Optional<CallSessionEvent> event = CallSessionEvent.fromProviderStatus(callStatus);
        if (event.isEmpty()) {
            log.debug("Ignoring call status {} for {}", callStatus, callSid);
            return WebhookAck.ignored("unhandled_status");
        }
        Optional<CallSession> updated = callSessionService.transitionByExternalId(
                callSid, event.get(), callStatus.toLowerCase(Locale.ROOT));
        if (updated.isEmpty()) {
            return WebhookAck.ignored("unknown_conversation");
        }
        CallSession session = updated.get();
        Integer duration = parseDuration(callDuration);
        if (duration != null && session.getStatus().isTerminal()) {
            callSessionService.recordDuration(session.getOrganizationId(), session.getId(), duration);
        }
        return WebhookAck.received(session.getId());
    }

    /**
     * Records an inbound SMS and returns the empty TwiML answer. Replies are authored elsewhere.
     */
    public String handleIncomingSms(String from, String to, String body, String messageSid) {
        if (!StringUtils.hasText(from) || !StringUtils.hasText(body)) {
            log.error("Inbound SMS without sender or body (sid={})", messageSid);
            return SMS_EMPTY_RESPONSE;
        }
        Optional<Organization> organization = leadService.findOrganizationByPhone(to);
        if (organization.isEmpty()) {
            log.warn("Inbound SMS {} to unknown number {}", messageSid, to);
            return SMS_EMPTY_RESPONSE;
        }
        String organizationId = organization.get().getId();
        Lead lead;
        try {
            lead = leadService.findOrCreateByPhone(organizationId, from);
        } catch (ServiceException ex) {
            log.error("Inbound SMS {} has an unusable sender {}", messageSid, from, ex);
            return SMS_EMPTY_RESPONSE;
        }

        boolean humanControlled = humanControlService.isUnderHumanControl(organizationId, lead.getId());
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("from", PhoneNumbers.normalize(from));
        metadata.put("to", PhoneNumbers.normalize(to));
        metadata.put("humanControlled", humanControlled);
        Optional<ConversationMessage> stored = conversationService.recordMessage(
                ConversationMessage.builder()
                        .organizationId(organizationId)
                        .leadId(lead.getId())
                        .callSessionId(callSessionService.getActiveSession(organizationId, lead.getId())
                                .map(CallSession::getId)
                                .orElse(null))
                        .sender(MessageSender.USER)
                        .channel(MessageChannel.SMS)
                        .content(body.trim())
                        .externalId(StringUtils.hasText(messageSid) ? messageSid : null)
                        .metadata(metadata)
                        .build(),
                humanControlled ? ConversationEventType.SMS_RECEIVED_HUMAN_QUEUE : ConversationEventType.SMS_RECEIVED);
        if (stored.isPresent() && humanControlled) {
            log.info("SMS {} for lead {} queued for the human operator", messageSid, lead.getId());
        }
        return SMS_EMPTY_RESPONSE;
    }

    private void storeTranscript(CallSession session, JsonNode transcript) {
        int index = 0;
        for (JsonNode turn : transcript) {
            String content = firstText(turn, "message", "text");
            if (!StringUtils.hasText(content)) {
                index++;
                continue;
            }
            MessageSender sender = "user".equalsIgnoreCase(text(turn, "role")) ? MessageSender.USER : MessageSender.AGENT;
            Instant createdAt = turn.hasNonNull("time_in_call_secs")
                    ? session.getStartedAt().plusSeconds(turn.get("time_in_call_secs").asLong())
                    : session.getStartedAt().plusMillis(index);
            conversationService.recordMessage(
                    ConversationMessage.builder()
                            .organizationId(session.getOrganizationId())
                            .leadId(session.getLeadId())
                            .callSessionId(session.getId())
                            .sender(sender)
                            .channel(MessageChannel.VOICE)
                            .content(content)
                            .externalId(session.getExternalId() + ":turn:" + index)
                            .metadata(Map.of("source", "post_call"))
                            .createdAt(createdAt)
                            .build(),
                    ConversationEventType.CONVERSATION_ADDED);
            index++;
        }
        log.info("Stored {} post-call transcript turns for call session {}", index, session.getId());
    }

    private Optional<MessageSender> transcriptSpeaker(String type, JsonNode data) {
        switch (type.toLowerCase(Locale.ROOT)) {
            case "user_transcript":
                return Optional.of(MessageSender.USER);
            case "agent_response":
                return Optional.of(MessageSender.AGENT);
            case "transcript":
                return Optional.of("user".equalsIgnoreCase(text(data, "role")) ? MessageSender.USER : MessageSender.AGENT);
            default:
                return Optional.empty();
        }
    }

    private JsonNode parse(String body, String kind) {
        if (!StringUtils.hasText(body)) {
            log.error("Empty {} payload", kind);
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                log.error("Malformed {} payload: {}", kind, body);
                return null;
            }
            return root;
        } catch (JsonProcessingException ex) {
            log.error("Malformed {} payload: {}", kind, body, ex);
            return null;
        }
    }

    private static String correlationId(ConversationInitiationRequest request) {
        return StringUtils.hasText(request.getConversationId()) ? request.getConversationId() : request.getCallSid();
    }

    private static Integer parseDuration(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException ex) {
            log.warn("Ignoring unparseable call duration {}", raw);
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
