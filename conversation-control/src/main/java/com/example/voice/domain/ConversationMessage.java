package com.example.voice.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage implements Serializable {

    private String id;
    private String organizationId;
    private String leadId;
    private String callSessionId;
    private MessageSender sender;
    private MessageChannel channel;
    private String content;
    private String externalId;
    private Map<String, Object> metadata;
    private Instant createdAt;
}
