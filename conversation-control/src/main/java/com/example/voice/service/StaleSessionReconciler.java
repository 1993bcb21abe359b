package com.example.voice.service;

import com.example.voice.config.VoiceProperties;
import com.example.voice.domain.CallSession;
import com.example.voice.domain.HumanControlSession;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Periodic sweep that force-closes abandoned call sessions and ends human control sessions
 * left behind by them. Every close is a conditional update, so overlapping sweeps on several
 * instances only ever close a session once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleSessionReconciler {

    private final CallSessionService callSessionService;
    private final HumanControlService humanControlService;
    private final CallSessionRepository callSessionRepository;
    private final HumanControlRepository humanControlRepository;
    private final RedisKeyFactory keyFactory;
    private final VoiceProperties voiceProperties;
    private final ObjectProvider<RedissonClient> redissonClient;

    @Scheduled(
            initialDelayString = "#{T(java.time.Duration).parse('${voice.reconciler.interval:PT5M}').toMillis()}",
            fixedDelayString = "#{T(java.time.Duration).parse('${voice.reconciler.interval:PT5M}').toMillis()}")
    public void scheduledSweep() {
        if (!voiceProperties.getReconciler().isEnabled()) {
            return;
        }
        reconcileAll();
    }

    public List<ReconciliationReport> reconcileAll() {
        Set<String> organizations = new LinkedHashSet<>(callSessionRepository.findOrganizationsWithOpenSessions());
        organizations.addAll(humanControlRepository.findOrganizationsWithActiveSessions());
        List<ReconciliationReport> reports = new ArrayList<>();
        for (String organizationId : organizations) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Reconciliation sweep interrupted after {} of {} organizations",
                        reports.size(), organizations.size());
                break;
            }
            try {
                ReconciliationReport report = reconcile(organizationId);
                if (report.hasChanges()) {
                    log.info("Reconciled organization {}: closed {} call sessions, ended {} human sessions",
                            organizationId, report.closedCallSessions(), report.endedHumanSessions());
                }
                reports.add(report);
            } catch (Exception ex) {
                log.warn("Failed to reconcile organization {}", organizationId, ex);
            }
        }
        return reports;
    }

    /**
     * Runs one pass for an organization. When the distributed lock is enabled and another
     * instance holds it, the pass is skipped and an empty report is returned.
     */
    public ReconciliationReport reconcile(String organizationId) {
        if (!StringUtils.hasText(organizationId)) {
            return ReconciliationReport.empty(organizationId);
        }
        RLock lock = lockFor(organizationId);
        if (lock == null) {
            return sweep(organizationId);
        }
        boolean acquired;
        try {
            acquired = lock.tryLock(0, voiceProperties.getReconciler().getLockLease().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ReconciliationReport.empty(organizationId);
        }
        if (!acquired) {
            log.debug("Skipping reconciliation of {}: another instance holds the lock", organizationId);
            return ReconciliationReport.empty(organizationId);
        }
        try {
            return sweep(organizationId);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    private ReconciliationReport sweep(String organizationId) {
        Duration staleAfter = voiceProperties.getCallSession().getStaleAfter();
        List<CallSession> closed = callSessionService.cleanupStale(organizationId, staleAfter);
        List<HumanControlSession> ended = Thread.currentThread().isInterrupted()
                ? List.of()
                : humanControlService.endOrphanedSessions(organizationId);
        return new ReconciliationReport(organizationId, closed.size(), ended.size());
    }

    private RLock lockFor(String organizationId) {
        if (!voiceProperties.getReconciler().isDistributedLock()) {
            return null;
        }
        RedissonClient client = redissonClient.getIfAvailable();
        if (client == null) {
            log.warn("Distributed reconciliation lock requested but no Redisson client is configured");
            return null;
        }
        return client.getLock(keyFactory.reconcileLockKey(organizationId));
    }

    public record ReconciliationReport(String organizationId, int closedCallSessions, int endedHumanSessions) {

        static ReconciliationReport empty(String organizationId) {
            return new ReconciliationReport(organizationId, 0, 0);
        }

        public boolean hasChanges() {
            return closedCallSessions > 0 || endedHumanSessions > 0;
        }
    }
}
