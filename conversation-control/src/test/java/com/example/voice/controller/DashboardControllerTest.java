package com.example.voice.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.voice.config.VoiceSecurityProperties;
import com.example.voice.domain.DashboardStats;
import com.example.voice.service.DashboardService;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DashboardController.class)
class DashboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DashboardService dashboardService;

    @MockBean
    private VoiceSecurityProperties securityProperties;

    @Test
    void statsAreScopedToOrganizationHeader() throws Exception {
        when(dashboardService.getStats("org-1")).thenReturn(DashboardStats.builder()
                .organizationId("org-1")
                .totalLeads(12)
                .activeCalls(2)
                .activeHumanSessions(1)
                .activeSessions(3)
                .generatedAt(Instant.now())
                .build());

        mockMvc.perform(get("/api/dashboard/stats").header(RequestHeaders.ORGANIZATION_ID, "org-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalLeads").value(12))
                .andExpect(jsonPath("$.activeSessions").value(3));
    }

    @Test
    void statsNeedOrganizationHeader() throws Exception {
        mockMvc.perform(get("/api/dashboard/stats"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("missing_organization"));
    }
}
