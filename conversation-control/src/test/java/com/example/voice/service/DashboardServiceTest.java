package com.example.voice.service;

import static com.example.voice.service.VoiceTestHarness.ORG;
import static com.example.voice.service.VoiceTestHarness.OTHER_ORG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.voice.domain.CallDirection;
import com.example.voice.domain.CallSession;
import com.example.voice.domain.CallSessionEvent;
import com.example.voice.domain.ConversationMessage;
import com.example.voice.domain.DashboardStats;
import com.example.voice.domain.MessageChannel;
import com.example.voice.domain.MessageSender;
import com.example.voice.event.ConversationEventType;
import com.example.voice.service.exception.ServiceException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DashboardServiceTest {

    private VoiceTestHarness harness;

    @BeforeEach
    void setUp() {
        harness = new VoiceTestHarness();
        harness.leadDirectory.addOrganization(ORG, "Acme", "15550000000");
        harness.leadDirectory.addLead(ORG, "L1", "15551110001", "Dana");
        harness.leadDirectory.addLead(ORG, "L2", "15551110002", "Eli");
        harness.leadDirectory.addLead(OTHER_ORG, "L9", "15551110009", "Fay");
    }

    @Test
    void statsCountAfterClosingStaleSessions() {
        CallSession stale = start("L1", "conv-stale");
        harness.callSessions.age(stale.getId(), Duration.ofMinutes(45));
        start("L2", "conv-live");
        CallSession done = start("L2", "conv-done");
        harness.callSessionService.transition(ORG, done.getId(), CallSessionEvent.COMPLETE);
        harness.humanControlService.join(ORG, "L2", "Alice");
        harness.conversationService.recordMessage(ConversationMessage.builder()
                .organizationId(ORG)
                .leadId("L1")
                .sender(MessageSender.USER)
                .channel(MessageChannel.SMS)
                .content("hi")
                .build(), ConversationEventType.SMS_RECEIVED);

        DashboardStats stats = harness.dashboardService.getStats(ORG);

        assertThat(stats.getTotalLeads()).isEqualTo(2);
        assertThat(stats.getTotalCalls()).isEqualTo(3);
        assertThat(stats.getStaleSessionsClosed()).isEqualTo(1);
        assertThat(stats.getActiveCalls()).isEqualTo(1);
        assertThat(stats.getActiveHumanSessions()).isEqualTo(1);
        assertThat(stats.getActiveSessions()).isEqualTo(2);
        // one SMS plus the operator's join notice
        assertThat(stats.getTotalMessages()).isEqualTo(2);
    }

    @Test
    void statsRequireOrganization() {
        assertThatThrownBy(() -> harness.dashboardService.getStats(""))
                .isInstanceOf(ServiceException.class)
                .extracting("errorCode")
                .isEqualTo("missing_organization");
    }

    private CallSession start(String leadId, String externalId) {
        CallSession session = harness.callSessionService.createSession(ORG, leadId, externalId, CallDirection.INBOUND);
        return harness.callSessionService.transition(ORG, session.getId(), CallSessionEvent.ACTIVATE);
    }
}
