package com.example.voice.controller;

import com.example.voice.domain.DashboardStats;
import com.example.voice.service.DashboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/stats")
    public ResponseEntity<DashboardStats> stats(@RequestHeader(RequestHeaders.ORGANIZATION_ID) String organizationId) {
        return ResponseEntity.ok(dashboardService.getStats(organizationId));
    }
}
