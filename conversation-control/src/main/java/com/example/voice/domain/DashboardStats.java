package com.example.voice.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DashboardStats {
    String organizationId;
    long totalLeads;
    long totalCalls;
    long totalMessages;
    long activeCalls;
    long activeHumanSessions;
    long activeSessions;
    int staleSessionsClosed;
    Instant generatedAt;
}
