package com.care.backoffice.controller;

import com.care.backoffice.dto.DashboardSummary;
import com.care.backoffice.service.DashboardService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/api/dashboard")
    public DashboardSummary summary() {
        return dashboardService.summary();
    }
}
