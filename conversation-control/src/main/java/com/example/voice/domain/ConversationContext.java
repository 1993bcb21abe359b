package com.example.voice.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived view of a lead used to personalise or resume a conversation. Cached with a short
 * TTL; {@code computedAt} is checked on every read so an entry is never served past it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationContext implements Serializable {

    private String organizationId;
    private String leadId;
    private String organizationName;
    private String customerName;
    private String customerPhone;
    private String leadStatus;
    private String conversationContext;
    private String previousSummary;
    private int messageCount;
    private Map<String, String> dynamicVariables;
    private Instant computedAt;
    private boolean fallback;
}
