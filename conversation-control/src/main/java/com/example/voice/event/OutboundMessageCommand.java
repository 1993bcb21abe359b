package com.example.voice.event;

import com.example.voice.domain.MessageChannel;
import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator-authored message handed to the delivery side (SMS gateway or live call bridge).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessageCommand implements Serializable {

    private String eventId;
    private String organizationId;
    private String leadId;
    private String messageId;
    private String phoneNumber;
    private MessageChannel channel;
    private String content;
    private String operatorName;
    private Instant occurredAt;
}
