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
public class CallSession implements Serializable {

    private String id;
    private String organizationId;
    private String leadId;
    private String externalId;
    private CallDirection direction;
    private CallSessionStatus status;
    private String providerAgentId;
    private Instant startedAt;
    private Instant updatedAt;
    private Instant endedAt;
    private Integer durationSeconds;
    private String endReason;
    private boolean autoClosed;
}
