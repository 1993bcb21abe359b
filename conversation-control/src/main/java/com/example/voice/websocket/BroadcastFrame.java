package com.example.voice.websocket;

import com.example.voice.event.ConversationEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON frame pushed to dashboard clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BroadcastFrame implements Serializable {

    public static final String CONNECTED = "connected";
    public static final String HEARTBEAT = "heartbeat";

    private String type;
    private String organizationId;
    private String leadId;
    private Map<String, Object> payload;
    private Instant timestamp;

    public static BroadcastFrame from(ConversationEvent event) {
        return BroadcastFrame.builder()
                .type(event.getType().getWireName())
                .organizationId(event.getOrganizationId())
                .leadId(event.getLeadId())
                .payload(event.getPayload())
                .timestamp(event.getOccurredAt() != null ? event.getOccurredAt() : Instant.now())
                .build();
    }

    public static BroadcastFrame control(String type, String organizationId, Map<String, Object> payload) {
        return BroadcastFrame.builder()
                .type(type)
                .organizationId(organizationId)
                .payload(payload)
                .timestamp(Instant.now())
                .build();
    }

    boolean isHeartbeat() {
        return HEARTBEAT.equals(type);
    }
}
