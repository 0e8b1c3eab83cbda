package com.sitecheck.api.controller;

import com.sitecheck.common.constants.QueueStatus;
import com.sitecheck.core.queue.AuditQueueCoordinator;
import com.sitecheck.core.queue.model.ReclaimedItem;
import com.sitecheck.core.queue.model.TickOutcome;
import com.sitecheck.core.queue.model.TickResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.matchesPattern;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class QueueControllerTest {

    private static final String SECRET = "queue-test-secret";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuditQueueCoordinator coordinator;

    @Test
    void rejectsTickWithoutSecret() throws Exception {
        mockMvc.perform(post("/api/process-queue"))
            .andExpect(status().isUnauthorized());

        verify(coordinator, never()).processNext();
    }

    @Test
    void rejectsTickWithWrongSecret() throws Exception {
        mockMvc.perform(post("/api/process-queue").header(HttpHeaders.AUTHORIZATION, "Bearer nope"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void runsTickWithBearerSecret() throws Exception {
        UUID auditId = UUID.randomUUID();
        when(coordinator.processNext()).thenReturn(TickResult.of(TickOutcome.COMPLETED, auditId, UUID.randomUUID(), null));

        mockMvc.perform(post("/api/process-queue").header(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(true))
            .andExpect(jsonPath("$.auditId").value(auditId.toString()))
            .andExpect(jsonPath("$.outcome").value("completed"))
            .andExpect(jsonPath("$.continuing").value(false))
            .andExpect(jsonPath("$.orphansQueued").doesNotExist());
    }

    @Test
    void acceptsSecretAsQueryParameterOnGet() throws Exception {
        ReclaimedItem reclaimed = ReclaimedItem.builder()
            .jobId(UUID.randomUUID())
            .auditId(UUID.randomUUID())
            .newStatus(QueueStatus.PENDING)
            .retryCount(1)
            .build();
        TickResult idle = TickResult.builder()
            .outcome(TickOutcome.IDLE)
            .message("Queue is empty")
            .stuckItemsReset(List.of(reclaimed))
            .orphansQueued(2)
            .build();
        when(coordinator.processNext()).thenReturn(idle);

        mockMvc.perform(get("/api/process-queue").param("secret", SECRET))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(false))
            .andExpect(jsonPath("$.outcome").value("idle"))
            .andExpect(jsonPath("$.stuckItemsReset[0].newStatus").value("pending"))
            .andExpect(jsonPath("$.stuckItemsReset[0].retryCount").value(1))
            .andExpect(jsonPath("$.orphansQueued").value(2));
    }

    @Test
    void reportsContinuingWhenDeadlineReached() throws Exception {
        when(coordinator.processNext()).thenReturn(
            TickResult.of(TickOutcome.CONTINUING, UUID.randomUUID(), UUID.randomUUID(), "Still running"));

        mockMvc.perform(post("/api/process-queue").header(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(true))
            .andExpect(jsonPath("$.continuing").value(true));
    }

    @Test
    void databaseFailureReturnsServerErrorWithRequestId() throws Exception {
        when(coordinator.processNext()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(post("/api/process-queue")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET)
                .header("X-Request-Id", "req-42"))
            .andExpect(status().isInternalServerError())
            .andExpect(header().string("X-Request-Id", "req-42"))
            .andExpect(jsonPath("$.message").value("Database error"))
            .andExpect(jsonPath("$.status").value(500))
            .andExpect(jsonPath("$.requestId").value("req-42"));
    }

    @Test
    void generatesRequestIdWhenMissing() throws Exception {
        when(coordinator.processNext()).thenReturn(TickResult.of(TickOutcome.IDLE, null, null, null));

        mockMvc.perform(post("/api/process-queue").header(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Request-Id", matchesPattern("[0-9a-f]{8}")));
    }
}
