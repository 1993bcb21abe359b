package com.example.voice.event;

import com.example.voice.config.VoiceProperties;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Hands state changes to in-process listeners and to Kafka. Publishing is best-effort: a
 * failing listener or broker never fails the operation that produced the event.
 *
 * <p>Kafka sends run on the {@code eventPublishExecutor}, since the producer may block the
 * sending thread while it waits for cluster metadata. Callers only pay for the listeners.
 */
@Slf4j
@Component
public class ConversationEventPublisher {

    private final List<ConversationEventListener> listeners;
    private final KafkaTemplate<String, ConversationEvent> conversationEventKafkaTemplate;
    private final KafkaTemplate<String, OutboundMessageCommand> outboundMessageKafkaTemplate;
    private final VoiceProperties voiceProperties;
    private final Executor eventPublishExecutor;

    public ConversationEventPublisher(
            List<ConversationEventListener> listeners,
            KafkaTemplate<String, ConversationEvent> conversationEventKafkaTemplate,
            KafkaTemplate<String, OutboundMessageCommand> outboundMessageKafkaTemplate,
            VoiceProperties voiceProperties,
            @Qualifier("eventPublishExecutor") Executor eventPublishExecutor) {
        this.listeners = listeners;
        this.conversationEventKafkaTemplate = conversationEventKafkaTemplate;
        this.outboundMessageKafkaTemplate = outboundMessageKafkaTemplate;
        this.voiceProperties = voiceProperties;
        this.eventPublishExecutor = eventPublishExecutor;
    }

    public ConversationEvent publish(
            ConversationEventType type, String organizationId, String leadId, Map<String, Object> payload) {
        ConversationEvent event = ConversationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .organizationId(organizationId)
                .leadId(leadId)
                .occurredAt(Instant.now())
                .payload(payload == null ? Map.of() : payload)
                .build();
        publish(event);
        return event;
    }

    public void publish(ConversationEvent event) {
        for (ConversationEventListener listener : listeners) {
            try {
                listener.onConversationEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on {} event {}", listener.getClass().getSimpleName(),
                        event.getType(), event.getEventId(), ex);
            }
        }
        String topic = voiceProperties.getKafka().getEventTopic();
        handOff(() -> {
            try {
                conversationEventKafkaTemplate.send(topic, partitionKey(event), event)
                        .whenComplete((result, ex) -> {
                            if (ex != null) {
                                log.warn("Failed to publish {} event {} to {}",
                                        event.getType(), event.getEventId(), topic, ex);
                            }
                        });
            } catch (RuntimeException ex) {
                log.warn("Failed to publish {} event {} to {}", event.getType(), event.getEventId(), topic, ex);
            }
        }, "event " + event.getEventId());
    }

    public void publishOutbound(OutboundMessageCommand command) {
        String topic = voiceProperties.getKafka().getOutboundTopic();
        String key = command.getOrganizationId() + ":" + command.getLeadId();
        handOff(() -> {
            try {
                outboundMessageKafkaTemplate.send(topic, key, command)
                        .whenComplete((result, ex) -> {
                            if (ex != null) {
                                log.error("Outbound message {} for lead {} was not handed to {}",
                                        command.getMessageId(), command.getLeadId(), topic, ex);
                            }
                        });
            } catch (RuntimeException ex) {
                log.error("Outbound message {} for lead {} was not handed to {}",
                        command.getMessageId(), command.getLeadId(), topic, ex);
            }
        }, "outbound message " + command.getMessageId());
    }

    private void handOff(Runnable send, String description) {
        try {
            eventPublishExecutor.execute(send);
        } catch (RejectedExecutionException ex) {
            log.error("Kafka hand-off backlog is full, {} was not published", description);
        }
    }

    private String partitionKey(ConversationEvent event) {
        return event.getLeadId() != null
                ? event.getOrganizationId() + ":" + event.getLeadId()
                : event.getOrganizationId();
    }
}
