package com.example.voice.service;

import static com.example.voice.service.VoiceTestHarness.ORG;
import static com.example.voice.service.VoiceTestHarness.OTHER_ORG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.voice.domain.CallDirection;
import com.example.voice.domain.CallSession;
import com.example.voice.domain.CallSessionEvent;
import com.example.voice.domain.CallSessionStatus;
import com.example.voice.domain.HumanControlSession;
import com.example.voice.service.StaleSessionReconciler.ReconciliationReport;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;

class StaleSessionReconcilerTest {

    private VoiceTestHarness harness;

    @BeforeEach
    void setUp() {
        harness = new VoiceTestHarness();
        harness.leadDirectory.addOrganization(ORG, "Acme", "15550000000");
        harness.leadDirectory.addOrganization(OTHER_ORG, "Globex", "15550000001");
        harness.leadDirectory.addLead(ORG, "L1", "15551110001", "Dana");
        harness.leadDirectory.addLead(ORG, "L2", "15551110002", "Eli");
        harness.leadDirectory.addLead(OTHER_ORG, "L9", "15551110009", "Fay");
    }

    @Test
    void onePassClosesStaleSessionsAndLeavesFreshOnes() {
        CallSession stale = openCall(ORG, "L1", "conv-stale");
        harness.callSessions.age(stale.getId(), Duration.ofMinutes(30));
        CallSession fresh = openCall(ORG, "L2", "conv-fresh");

        ReconciliationReport report = harness.reconciler.reconcile(ORG);

        assertThat(report.closedCallSessions()).isEqualTo(1);
        CallSession closed = harness.callSessionService.getSession(ORG, stale.getId());
        assertThat(closed.getStatus()).isEqualTo(CallSessionStatus.COMPLETED);
        assertThat(closed.getEndReason()).isEqualTo(CallSessionService.STALE_SESSION_REASON);
        assertThat(closed.isAutoClosed()).isTrue();
        assertThat(harness.callSessionService.getSession(ORG, fresh.getId()).getStatus())
                .isEqualTo(CallSessionStatus.ACTIVE);
    }

    @Test
    void humanSessionOfClosedCallIsEndedInTheSamePass() {
        CallSession stale = openCall(ORG, "L1", "conv-stale");
        HumanControlSession human = harness.humanControlService.join(ORG, "L1", "Alice").session();
        harness.callSessions.age(stale.getId(), Duration.ofMinutes(30));

        ReconciliationReport report = harness.reconciler.reconcile(ORG);

        assertThat(report).isEqualTo(new ReconciliationReport(ORG, 1, 1));
        assertThat(harness.humanControl.findById(human.getId()))
                .hasValueSatisfying(ended -> assertThat(ended.isActive()).isFalse());
        assertThat(harness.humanControlService.isUnderHumanControl(ORG, "L1")).isFalse();
    }

    @Test
    void repeatedPassChangesNothing() {
        CallSession stale = openCall(ORG, "L1", "conv-stale");
        harness.callSessions.age(stale.getId(), Duration.ofMinutes(30));
        harness.reconciler.reconcile(ORG);

        ReconciliationReport second = harness.reconciler.reconcile(ORG);

        assertThat(second.hasChanges()).isFalse();
    }

    @Test
    void sweepCoversEveryOrganizationWithOpenWork() {
        CallSession first = openCall(ORG, "L1", "conv-1");
        CallSession second = openCall(OTHER_ORG, "L9", "conv-9");
        harness.callSessions.age(first.getId(), Duration.ofHours(1));
        harness.callSessions.age(second.getId(), Duration.ofHours(1));

        List<ReconciliationReport> reports = harness.reconciler.reconcileAll();

        assertThat(reports).extracting(ReconciliationReport::organizationId)
                .containsExactlyInAnyOrder(ORG, OTHER_ORG);
        assertThat(reports).allSatisfy(report -> assertThat(report.closedCallSessions()).isEqualTo(1));
        assertThat(harness.reconciler.reconcileAll()).isEmpty();
    }

    @Test
    void disabledReconcilerSkipsScheduledSweep() {
        CallSession stale = openCall(ORG, "L1", "conv-stale");
        harness.callSessions.age(stale.getId(), Duration.ofMinutes(30));
        harness.properties.getReconciler().setEnabled(false);

        harness.reconciler.scheduledSweep();

        assertThat(harness.callSessionService.getSession(ORG, stale.getId()).getStatus())
                .isEqualTo(CallSessionStatus.ACTIVE);
    }

    @Test
    void passIsSkippedWhileAnotherInstanceHoldsTheLock() throws Exception {
        RLock lock = mock(RLock.class);
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenReturn(false);
        StaleSessionReconciler locked = reconcilerWithLock(lock);
        CallSession stale = openCall(ORG, "L1", "conv-stale");
        harness.callSessions.age(stale.getId(), Duration.ofMinutes(30));

        ReconciliationReport report = locked.reconcile(ORG);

        assertThat(report.hasChanges()).isFalse();
        assertThat(harness.callSessionService.getSession(ORG, stale.getId()).getStatus())
                .isEqualTo(CallSessionStatus.ACTIVE);
    }

    @Test
    void lockIsReleasedAfterPass() throws Exception {
        RLock lock = mock(RLock.class);
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);
        StaleSessionReconciler locked = reconcilerWithLock(lock);
        CallSession stale = openCall(ORG, "L1", "conv-stale");
        harness.callSessions.age(stale.getId(), Duration.ofMinutes(30));

        ReconciliationReport report = locked.reconcile(ORG);

        assertThat(report.closedCallSessions()).isEqualTo(1);
        verify(lock).unlock();
    }

    private CallSession openCall(String organizationId, String leadId, String externalId) {
        CallSession session = harness.callSessionService.createSession(
                organizationId, leadId, externalId, CallDirection.INBOUND);
        return harness.callSessionService.transition(organizationId, session.getId(), CallSessionEvent.ACTIVATE);
    }

    @SuppressWarnings("unchecked")
    private StaleSessionReconciler reconcilerWithLock(RLock lock) {
        harness.properties.getReconciler().setDistributedLock(true);
        RedissonClient client = mock(RedissonClient.class);
        when(client.getLock(harness.keyFactory.reconcileLockKey(ORG))).thenReturn(lock);
        ObjectProvider<RedissonClient> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(client);
        return new StaleSessionReconciler(
                harness.callSessionService, harness.humanControlService, harness.callSessions,
                harness.humanControl, harness.keyFactory, harness.properties, provider);
    }
}
