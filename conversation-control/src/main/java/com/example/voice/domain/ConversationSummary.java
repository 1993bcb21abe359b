package com.example.voice.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummary implements Serializable {

    private String id;
    private String organizationId;
    private String leadId;
    private String callSessionId;
    private String summary;
    private Instant createdAt;
}
