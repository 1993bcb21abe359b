package com.example.voice.service;

import com.example.voice.domain.DashboardStats;
import com.example.voice.service.StaleSessionReconciler.ReconciliationReport;
import com.example.voice.service.exception.ServiceException;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final StaleSessionReconciler reconciler;
    private final LeadService leadService;
    private final CallSessionService callSessionService;
    private final HumanControlService humanControlService;
    private final ConversationHistoryRepository historyRepository;

    /**
     * Counts for the organization's dashboard. Stale sessions are closed first so the active
     * counts do not include abandoned calls.
     */
    public DashboardStats getStats(String organizationId) {
        if (!StringUtils.hasText(organizationId)) {
            throw ServiceException.badRequest("missing_organization", "Organization id is required");
        }
        int closed = 0;
        try {
            ReconciliationReport report = reconciler.reconcile(organizationId);
            closed = report.closedCallSessions();
        } catch (RuntimeException ex) {
            log.warn("Reconciliation before stats failed for organization {}", organizationId, ex);
        }

        long activeCalls = callSessionService.countOpenSessions(organizationId);
        long activeHuman = humanControlService.countActiveSessions(organizationId);
        return DashboardStats.builder()
                .organizationId(organizationId)
                .totalLeads(leadService.countLeads(organizationId))
                .totalCalls(callSessionService.countSessions(organizationId))
                .totalMessages(historyRepository.count(organizationId))
                .activeCalls(activeCalls)
                .activeHumanSessions(activeHuman)
                .activeSessions(activeCalls + activeHuman)
                .staleSessionsClosed(closed)
                .generatedAt(Instant.now())
                .build();
    }
}
