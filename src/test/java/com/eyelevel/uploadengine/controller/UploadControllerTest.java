package com.eyelevel.uploadengine.controller;

import com.eyelevel.uploadengine.failover.FailoverCoordinator;
import com.eyelevel.uploadengine.model.BatchUploadResult;
import com.eyelevel.uploadengine.model.UploadPriority;
import com.eyelevel.uploadengine.model.UploadRequest;
import com.eyelevel.uploadengine.model.UploadResult;
import com.eyelevel.uploadengine.model.UploadStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = UploadController.class)
@DisplayName("UploadController")
class UploadControllerTest {

    private static final String UPLOAD = """
            {
                "requestId": "req-42",
                "estimatedSizeBytes": 1048576,
                "targetPath": "invoices/42.pdf",
                "priority": "HIGH"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FailoverCoordinator failoverCoordinator;

    @Nested
    @DisplayName("POST /uploads/v1")
    class Upload {

        @Test
        @DisplayName("Should return the result of a failed-over upload")
        void shouldReturnFailedOverResult() throws Exception {
            when(failoverCoordinator.uploadWithFailover(any())).thenReturn(
                    new UploadResult("req-42", UploadStatus.FAILED_OVER, "p2", List.of("p1", "p2")));

            mockMvc.perform(post("/uploads/v1").contentType(MediaType.APPLICATION_JSON).content(UPLOAD))
                   .andExpect(status().isOk())
                   .andExpect(jsonPath("$.statusCode").value(200))
                   .andExpect(jsonPath("$.response.status").value("FAILED_OVER"))
                   .andExpect(jsonPath("$.response.providerId").value("p2"))
                   .andExpect(jsonPath("$.response.attemptedProviders[1]").value("p2"));
        }

        @Test
        @DisplayName("Should fill in the configured retry default")
        void shouldApplyRetryDefault() throws Exception {
            when(failoverCoordinator.uploadWithFailover(any())).thenReturn(
                    new UploadResult("req-42", UploadStatus.UPLOADED, "p1", List.of("p1")));

            mockMvc.perform(post("/uploads/v1").contentType(MediaType.APPLICATION_JSON).content(UPLOAD))
                   .andExpect(status().isOk());

            final ArgumentCaptor<UploadRequest> captor = ArgumentCaptor.forClass(UploadRequest.class);
            verify(failoverCoordinator).uploadWithFailover(captor.capture());
            assertEquals("req-42", captor.getValue().getRequestId());
            assertEquals(3, captor.getValue().getMaxRetries());
            assertEquals(UploadPriority.HIGH, captor.getValue().getPriority());
        }

        @Test
        @DisplayName("Should answer 503 when no provider is available")
        void shouldAnswerServiceUnavailable() throws Exception {
            when(failoverCoordinator.uploadWithFailover(any())).thenReturn(UploadResult.noProviderAvailable("req-42"));

            mockMvc.perform(post("/uploads/v1").contentType(MediaType.APPLICATION_JSON).content(UPLOAD))
                   .andExpect(status().isServiceUnavailable())
                   .andExpect(jsonPath("$.statusCode").value(503));
        }

        @Test
        @DisplayName("Should answer 502 when every provider failed")
        void shouldAnswerBadGateway() throws Exception {
            when(failoverCoordinator.uploadWithFailover(any())).thenReturn(
                    new UploadResult("req-42", UploadStatus.EXHAUSTED, null, List.of("p1", "p2")));

            mockMvc.perform(post("/uploads/v1").contentType(MediaType.APPLICATION_JSON).content(UPLOAD))
                   .andExpect(status().isBadGateway());
        }

        @Test
        @DisplayName("Should reject an upload without a target path")
        void shouldRejectMissingTargetPath() throws Exception {
            mockMvc.perform(post("/uploads/v1").contentType(MediaType.APPLICATION_JSON)
                                               .content("{\"estimatedSizeBytes\": 10}"))
                   .andExpect(status().isBadRequest())
                   .andExpect(jsonPath("$.displayMessage").value("Invalid input provided."));

            verifyNoInteractions(failoverCoordinator);
        }

        @Test
        @DisplayName("Should reject a malformed body")
        void shouldRejectMalformedBody() throws Exception {
            mockMvc.perform(post("/uploads/v1").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                   .andExpect(status().isBadRequest())
                   .andExpect(jsonPath("$.displayMessage").value("Malformed request body."));
        }
    }

    @Test
    @DisplayName("POST /uploads/v1/batch should return per-item results")
    void batchShouldReturnPerItemResults() throws Exception {
        when(failoverCoordinator.batchUploadOptimized(anyList())).thenReturn(new BatchUploadResult(List.of(
                new UploadResult("a", UploadStatus.UPLOADED, "p1", List.of("p1")),
                new UploadResult("b", UploadStatus.EXHAUSTED, null, List.of("p1", "p2")))));

        mockMvc.perform(post("/uploads/v1/batch").contentType(MediaType.APPLICATION_JSON).content("""
                       {"items": [
                           {"requestId": "a", "estimatedSizeBytes": 1, "targetPath": "a.bin"},
                           {"requestId": "b", "estimatedSizeBytes": 1, "targetPath": "b.bin"}
                       ]}
                       """))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.displayMessage").value("1 of 2 uploads succeeded."))
               .andExpect(jsonPath("$.response.results[1].status").value("EXHAUSTED"));
    }

    @Test
    @DisplayName("POST /uploads/v1/batch should reject an empty batch")
    void batchShouldRejectEmptyBatch() throws Exception {
        mockMvc.perform(post("/uploads/v1/batch").contentType(MediaType.APPLICATION_JSON).content("{\"items\": []}"))
               .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /uploads/v1/load-balanced should use strategy-only selection")
    void loadBalancedShouldUseStrategySelection() throws Exception {
        when(failoverCoordinator.uploadWithLoadBalancing(any())).thenReturn(
                new UploadResult("req-42", UploadStatus.UPLOADED, "p1", List.of("p1")));

        mockMvc.perform(post("/uploads/v1/load-balanced").contentType(MediaType.APPLICATION_JSON).content(UPLOAD))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.displayMessage").value("Upload completed successfully."));

        verify(failoverCoordinator).uploadWithLoadBalancing(any());
    }
}
