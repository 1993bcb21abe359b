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
public class HumanControlSession implements Serializable {

    private String id;
    private String organizationId;
    private String leadId;
    private String callSessionId;
    private String operatorName;
    private Instant startedAt;
    private Instant endedAt;
    private String endReason;
    private int messagesHandled;

    public boolean isActive() {
        return endedAt == null;
    }
}
