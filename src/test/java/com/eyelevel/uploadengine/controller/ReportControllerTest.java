package com.eyelevel.uploadengine.controller;

import com.eyelevel.uploadengine.cost.CostLedger;
import com.eyelevel.uploadengine.dto.report.CostReport;
import com.eyelevel.uploadengine.report.ReportService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ReportController.class)
@DisplayName("ReportController")
class ReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReportService reportService;
    @MockBean
    private CostLedger costLedger;

    @Test
    @DisplayName("GET /reports/v1/cost should return spend against budget")
    void shouldReturnCostReport() throws Exception {
        when(reportService.costReport()).thenReturn(new CostReport(12.5, 100.0, true, Map.of("aws", 12.5)));

        mockMvc.perform(get("/reports/v1/cost"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.budget").value(100.0))
               .andExpect(jsonPath("$.response.spendByProvider.aws").value(12.5));
    }

    @Test
    @DisplayName("POST /reports/v1/cost/evaluate should say when spend is over budget")
    void shouldEvaluateBudget() throws Exception {
        when(costLedger.evaluateBudget()).thenReturn(false);
        when(reportService.costReport()).thenReturn(new CostReport(120.0, 100.0, false, Map.of("aws", 120.0)));

        mockMvc.perform(post("/reports/v1/cost/evaluate"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.displayMessage").value("Spend exceeds the monthly budget."))
               .andExpect(jsonPath("$.response.withinBudget").value(false));
    }
}
