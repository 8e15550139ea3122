package com.eyelevel.uploadengine.controller;

import com.eyelevel.uploadengine.cost.CostLedger;
import com.eyelevel.uploadengine.dto.common.ApiResponse;
import com.eyelevel.uploadengine.dto.report.CostReport;
import com.eyelevel.uploadengine.dto.report.HealthReport;
import com.eyelevel.uploadengine.dto.report.PerformanceReport;
import com.eyelevel.uploadengine.report.ReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/reports")
@RequiredArgsConstructor
@Tag(name = "Reports", description = "Read-only views of provider health, spend and load.")
public class ReportController {

    private final ReportService reportService;
    private final CostLedger costLedger;

    @GetMapping("/v1/health")
    @Operation(summary = "Health Report", description = "Overall fleet health with the status of every provider.")
    public ResponseEntity<ApiResponse<HealthReport>> healthReport() {
        return ResponseEntity.ok(ApiResponse.ok("Health report generated.", reportService.healthReport()));
    }

    @GetMapping("/v1/cost")
    @Operation(summary = "Cost Report", description = "Spend of the current period per provider against the monthly budget.")
    public ResponseEntity<ApiResponse<CostReport>> costReport() {
        return ResponseEntity.ok(ApiResponse.ok("Cost report generated.", reportService.costReport()));
    }

    @GetMapping("/v1/performance")
    @Operation(summary = "Performance Report", description = "Active strategy with per-provider attempts, failures, bytes, selections and chunk size.")
    public ResponseEntity<ApiResponse<PerformanceReport>> performanceReport() {
        return ResponseEntity.ok(ApiResponse.ok("Performance report generated.", reportService.performanceReport()));
    }

    @PostMapping("/v1/cost/evaluate")
    @Operation(summary = "Evaluate Budget", description = "Compares the current spend with the budget and raises a threshold alert when it is over.")
    public ResponseEntity<ApiResponse<CostReport>> evaluateBudget() {
        final String message = costLedger.evaluateBudget()
                ? "Spend is within budget."
                : "Spend exceeds the monthly budget.";
        return ResponseEntity.ok(ApiResponse.ok(message, reportService.costReport()));
    }
}
