package io.github.samzhu.timesheet.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import io.github.samzhu.timesheet.dto.api.ExportRequest;
import io.github.samzhu.timesheet.dto.api.ExportSummary;
import io.github.samzhu.timesheet.dto.api.FetchRequest;
import io.github.samzhu.timesheet.dto.api.IngestionSummary;
import io.github.samzhu.timesheet.dto.api.RunStatus;
import io.github.samzhu.timesheet.dto.api.SnapshotSummary;
import io.github.samzhu.timesheet.service.IngestionService;
import io.github.samzhu.timesheet.service.OpenTaskSnapshotService;
import io.github.samzhu.timesheet.service.ReportExportService;

class JobApiControllerTest {

    private static final Instant STARTED = Instant.parse("2024-04-01T00:00:00Z");

    private IngestionService ingestionService;
    private ReportExportService reportExportService;
    private OpenTaskSnapshotService snapshotService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ingestionService = mock(IngestionService.class);
        reportExportService = mock(ReportExportService.class);
        snapshotService = mock(OpenTaskSnapshotService.class);
        mockMvc = MockMvcBuilders
            .standaloneSetup(new JobApiController(ingestionService, reportExportService, snapshotService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void shouldRunFullFetchWithoutBody() throws Exception {
        // Given
        when(ingestionService.runFetch(any())).thenReturn(ingestion(RunStatus.SUCCESS));

        // When & Then
        mockMvc.perform(post("/api/v1/jobs/fetch"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SUCCESS"))
            .andExpect(jsonPath("$.inserted").value(3));

        ArgumentCaptor<FetchRequest> captor = ArgumentCaptor.forClass(FetchRequest.class);
        verify(ingestionService).runFetch(captor.capture());
        assertThat(captor.getValue().incremental()).isFalse();
        assertThat(captor.getValue().batched()).isFalse();
    }

    @Test
    void shouldPassFetchOptions() throws Exception {
        when(ingestionService.runFetch(any())).thenReturn(ingestion(RunStatus.PARTIAL));

        mockMvc.perform(post("/api/v1/jobs/fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"projectFilter\":\"Alpha\",\"incremental\":true,\"batchSize\":5,\"batchNumber\":2}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PARTIAL"));

        ArgumentCaptor<FetchRequest> captor = ArgumentCaptor.forClass(FetchRequest.class);
        verify(ingestionService).runFetch(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new FetchRequest("Alpha", true, 5, 2));
    }

    @Test
    void shouldRejectInvalidBatchNumber() throws Exception {
        mockMvc.perform(post("/api/v1/jobs/fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"batchSize\":5,\"batchNumber\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));

        verify(ingestionService, never()).runFetch(any());
    }

    @Test
    void shouldRespondServerErrorOnFailedRun() throws Exception {
        // 排程器依 HTTP 狀態判斷是否重試
        when(ingestionService.runFetch(any())).thenReturn(ingestion(RunStatus.FAILURE));

        mockMvc.perform(post("/api/v1/jobs/fetch"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.status").value("FAILURE"));
    }

    @Test
    void shouldExportRequestedMonths() throws Exception {
        when(reportExportService.runExport(any())).thenReturn(
            new ExportSummary(RunStatus.SUCCESS, STARTED, 10, List.of(), 0, 0, null));

        mockMvc.perform(post("/api/v1/jobs/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"from\":\"2024-01\",\"to\":\"2024-03\"}"))
            .andExpect(status().isOk());

        verify(reportExportService).runExport(new ExportRequest(YearMonth.of(2024, 1), YearMonth.of(2024, 3)));
    }

    @Test
    void shouldRejectReversedExportRange() throws Exception {
        mockMvc.perform(post("/api/v1/jobs/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"from\":\"2024-05\",\"to\":\"2024-03\"}"))
            .andExpect(status().isBadRequest());

        verify(reportExportService, never()).runExport(any());
    }

    @Test
    void shouldRunSnapshot() throws Exception {
        when(snapshotService.runSnapshot()).thenReturn(new SnapshotSummary(RunStatus.SUCCESS,
            LocalDate.of(2024, 4, 1), STARTED, 5, 2, 0, 7, 1, null));

        mockMvc.perform(post("/api/v1/jobs/snapshot"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rowsWritten").value(7))
            .andExpect(jsonPath("$.snapshotDate").value("2024-04-01"));
    }

    private static IngestionSummary ingestion(RunStatus status) {
        return new IngestionSummary(status, STARTED, 1200, 2, 2, 0, List.of(), 3, 3, 0, 0, 0, 1, null,
            status == RunStatus.FAILURE ? "Not Authorized" : null);
    }
}
