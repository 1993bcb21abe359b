package com.example.voice.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.voice.domain.CallDirection;
import com.example.voice.domain.CallSession;
import com.example.voice.domain.CallSessionEvent;
import com.example.voice.domain.CallSessionStatus;
import com.example.voice.domain.HumanControlSession;
import com.example.voice.domain.Lead;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.dao.PersistenceExceptionTranslationAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs without a surrounding test transaction so every repository call commits on its own,
 * the way the services use them.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@ImportAutoConfiguration({JacksonAutoConfiguration.class, PersistenceExceptionTranslationAutoConfiguration.class})
@Import({JpaCallSessionRepository.class, JpaHumanControlRepository.class, JpaLeadDirectory.class, VoiceEntityMapper.class})
class JpaVoiceRepositoriesTest {

    @Autowired
    private JpaCallSessionRepository callSessions;

    @Autowired
    private JpaHumanControlRepository humanControl;

    @Autowired
    private JpaLeadDirectory leadDirectory;

    @Test
    void lastContactOnlyMovesForward() {
        String org = uniqueId("org");
        Instant created = Instant.parse("2024-05-01T10:00:00Z");
        Lead lead = leadDirectory.insertLead(Lead.builder()
                .id(uniqueId("lead"))
                .organizationId(org)
                .phoneNumber("15551234567")
                .status(Lead.DEFAULT_STATUS)
                .createdAt(created)
                .updatedAt(created)
                .lastContactAt(created)
                .build());

        Instant returned = created.plus(Duration.ofDays(2));
        leadDirectory.touchLastContact(org, lead.getId(), returned);
        leadDirectory.touchLastContact(org, lead.getId(), created.plus(Duration.ofDays(1)));
        leadDirectory.touchLastContact(uniqueId("org"), lead.getId(), returned.plus(Duration.ofDays(1)));

        assertThat(leadDirectory.findLead(org, lead.getId()))
                .hasValueSatisfying(stored -> assertThat(stored.getLastContactAt()).isEqualTo(returned));

        lead.setCustomerName("Dana");
        Lead saved = leadDirectory.saveLead(lead);
        assertThat(saved.getCustomerName()).isEqualTo("Dana");
        assertThat(saved.getLastContactAt()).isEqualTo(returned);
    }

    @Test
    void secondActiveSessionForLeadViolatesMarker() {
        String org = uniqueId("org");
        humanControl.insertActive(humanSession(org, "lead-1", "Alice"));

        assertThatThrownBy(() -> humanControl.insertActive(humanSession(org, "lead-1", "Bob")))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThat(humanControl.findActive(org, "lead-1"))
                .map(HumanControlSession::getOperatorName)
                .contains("Alice");
        assertThat(humanControl.countActive(org)).isEqualTo(1);
    }

    @Test
    void endingReleasesMarkerOnce() {
        String org = uniqueId("org");
        HumanControlSession first = humanControl.insertActive(humanSession(org, "lead-1", "Alice"));

        assertThat(humanControl.end(org, first.getId(), Instant.now(), "operator_left")).isTrue();
        assertThat(humanControl.end(org, first.getId(), Instant.now(), "operator_left")).isFalse();
        assertThat(humanControl.incrementMessagesHandled(org, first.getId())).isFalse();
        assertThat(humanControl.findActive(org, "lead-1")).isEmpty();

        HumanControlSession second = humanControl.insertActive(humanSession(org, "lead-1", "Bob"));
        assertThat(humanControl.incrementMessagesHandled(org, second.getId())).isTrue();
        assertThat(humanControl.findActive(org, "lead-1"))
                .hasValueSatisfying(active -> assertThat(active.getMessagesHandled()).isEqualTo(1));
    }

    @Test
    void otherOrganizationCannotEndSession() {
        String org = uniqueId("org");
        HumanControlSession session = humanControl.insertActive(humanSession(org, "lead-1", "Alice"));

        assertThat(humanControl.end(uniqueId("org"), session.getId(), Instant.now(), "operator_left")).isFalse();
        assertThat(humanControl.findActive(org, "lead-1")).isPresent();
    }

    @Test
    void duplicateExternalIdIsRejected() {
        String org = uniqueId("org");
        callSessions.insert(callSession(org, "lead-1", "conv-1", Instant.now()));

        assertThatThrownBy(() -> callSessions.insert(callSession(org, "lead-1", "conv-1", Instant.now())))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThat(callSessions.count(org)).isEqualTo(1);
    }

    @Test
    void terminalStatusIsSticky() {
        String org = uniqueId("org");
        CallSession session = callSessions.insert(callSession(org, "lead-1", "conv-1", Instant.now()));
        Instant now = Instant.now();

        assertThat(callSessions.transition(org, session.getId(), CallSessionEvent.COMPLETE.getSources(),
                CallSessionStatus.COMPLETED, now, "call_ended", false)).isTrue();
        assertThat(callSessions.transition(org, session.getId(), CallSessionEvent.ACTIVATE.getSources(),
                CallSessionStatus.ACTIVE, now, null, false)).isFalse();

        CallSession stored = callSessions.findById(org, session.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(CallSessionStatus.COMPLETED);
        assertThat(stored.getEndReason()).isEqualTo("call_ended");
        assertThat(stored.getEndedAt()).isNotNull();
        assertThat(callSessions.findLatestOpen(org, "lead-1")).isEmpty();
    }

    @Test
    void openSessionsAreFoundByAgeWithinOrganization() {
        String org = uniqueId("org");
        Instant now = Instant.now();
        CallSession old = callSessions.insert(callSession(org, "lead-1", "conv-old", now.minus(Duration.ofHours(1))));
        callSessions.insert(callSession(org, "lead-2", "conv-new", now));
        CallSession closed = callSessions.insert(callSession(org, "lead-3", "conv-closed", now.minus(Duration.ofHours(2))));
        callSessions.transition(org, closed.getId(), CallSessionEvent.FAIL.getSources(),
                CallSessionStatus.FAILED, now, "failed", false);
        callSessions.insert(callSession(uniqueId("org"), "lead-9", "conv-other", now.minus(Duration.ofHours(1))));

        assertThat(callSessions.findOpenStartedBefore(org, now.minus(Duration.ofMinutes(5))))
                .extracting(CallSession::getId)
                .containsExactly(old.getId());
        assertThat(callSessions.countOpen(org)).isEqualTo(2);
        assertThat(callSessions.findOrganizationsWithOpenSessions()).contains(org);
    }

    @Test
    void latestByExternalIdResolvesOrganization() {
        String org = uniqueId("org");
        String externalId = uniqueId("conv");
        CallSession session = callSessions.insert(callSession(org, "lead-1", externalId, Instant.now()));

        callSessions.updateDuration(org, session.getId(), 61);

        assertThat(callSessions.findLatestByExternalId(externalId)).hasValueSatisfying(found -> {
            assertThat(found.getOrganizationId()).isEqualTo(org);
            assertThat(found.getDurationSeconds()).isEqualTo(61);
        });
        assertThat(callSessions.findById(uniqueId("org"), session.getId())).isEmpty();
    }

    private static HumanControlSession humanSession(String org, String leadId, String operator) {
        return HumanControlSession.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(org)
                .leadId(leadId)
                .operatorName(operator)
                .startedAt(Instant.now())
                .build();
    }

    private static CallSession callSession(String org, String leadId, String externalId, Instant startedAt) {
        return CallSession.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(org)
                .leadId(leadId)
                .externalId(externalId)
                .direction(CallDirection.INBOUND)
                .status(CallSessionStatus.ACTIVE)
                .startedAt(startedAt)
                .updatedAt(startedAt)
                .build();
    }

    private static String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
