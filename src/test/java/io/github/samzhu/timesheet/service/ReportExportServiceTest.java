package io.github.samzhu.timesheet.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.timesheet.client.RunNotifier;
import io.github.samzhu.timesheet.dto.ExportOutcome;
import io.github.samzhu.timesheet.dto.ReportDimension;
import io.github.samzhu.timesheet.dto.ReportRow;
import io.github.samzhu.timesheet.dto.TabOutcome;
import io.github.samzhu.timesheet.dto.api.ExportRequest;
import io.github.samzhu.timesheet.dto.api.ExportSummary;
import io.github.samzhu.timesheet.dto.api.RunStatus;
import io.github.samzhu.timesheet.exception.SpreadsheetAuthException;

class ReportExportServiceTest {

    private static final YearMonth MARCH = YearMonth.of(2024, 3);

    private ReportAggregationService aggregationService;
    private SheetReportExporter exporter;
    private RunNotifier notifier;
    private ReportExportService service;

    @BeforeEach
    void setUp() {
        aggregationService = mock(ReportAggregationService.class);
        exporter = mock(SheetReportExporter.class);
        notifier = mock(RunNotifier.class);
        service = new ReportExportService(aggregationService, exporter, notifier,
            Clock.fixed(Instant.parse("2024-04-01T00:00:00Z"), ZoneOffset.UTC));

        when(aggregationService.reportData(any(ReportDimension.class), any(), any())).thenReturn(List.of());
    }

    @Test
    void shouldSucceedWhenAllTabsWritten() {
        // Given
        for (ReportDimension dimension : ReportDimension.values()) {
            when(exporter.write(eq(dimension), anyList(), anySet())).thenReturn(new ExportOutcome(dimension,
                List.of(TabOutcome.success("2024年3月", MARCH, dimension, 2))));
        }

        // When
        ExportSummary summary = service.runExport(new ExportRequest(MARCH, MARCH));

        // Then: 三個維度各寫入一次
        assertThat(summary.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(summary.tabsSucceeded()).isEqualTo(3);
        assertThat(summary.tabsFailed()).isZero();
        verify(aggregationService).reportData(ReportDimension.PROJECT, MARCH, MARCH);
        verify(aggregationService).reportData(ReportDimension.PROJECT_ASSIGNEE, MARCH, MARCH);
        verify(notifier).notify(eq(true), contains("[export] SUCCESS"));
    }

    @Test
    void shouldReportPartialWhenSomeTabsFail() {
        // Given: 負責人維度的 3 月分頁失敗
        when(exporter.write(eq(ReportDimension.PROJECT), anyList(), anySet())).thenReturn(new ExportOutcome(ReportDimension.PROJECT,
            List.of(TabOutcome.success("2024年3月", MARCH, ReportDimension.PROJECT, 2))));
        when(exporter.write(eq(ReportDimension.ASSIGNEE), anyList(), anySet())).thenReturn(new ExportOutcome(ReportDimension.ASSIGNEE,
            List.of(TabOutcome.failure("2024年3月", MARCH, ReportDimension.ASSIGNEE, "Quota exceeded"))));
        when(exporter.write(eq(ReportDimension.PROJECT_ASSIGNEE), anyList(), anySet())).thenReturn(new ExportOutcome(
            ReportDimension.PROJECT_ASSIGNEE, List.of()));

        // When
        ExportSummary summary = service.runExport(ExportRequest.allMonths());

        // Then
        assertThat(summary.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(summary.tabsFailed()).isEqualTo(1);
        assertThat(summary.summaryLine()).contains("2024年3月/ASSIGNEE: Quota exceeded");
        verify(notifier).notify(eq(false), contains("PARTIAL"));
    }

    @Test
    void shouldFailWhenAuthenticationFails() {
        when(exporter.write(eq(ReportDimension.PROJECT), anyList(), anySet()))
            .thenThrow(new SpreadsheetAuthException("Unable to obtain Google access token"));

        ExportSummary summary = service.runExport(ExportRequest.allMonths());

        assertThat(summary.status()).isEqualTo(RunStatus.FAILURE);
        assertThat(summary.error()).contains("access token");
        verify(exporter, never()).write(eq(ReportDimension.ASSIGNEE), anyList(), anySet());
    }

    @Test
    void shouldRewriteEveryDimensionForMonthsWithData() {
        // Given: 3 月只有專案維度有資料 (任務皆未指派)
        List<ReportRow> projectRows = List.of(new ReportRow(LocalDate.of(2024, 3, 1), "Alpha", null, 8.0, 10.0, 2, 0));
        when(aggregationService.reportData(eq(ReportDimension.PROJECT), any(), any())).thenReturn(projectRows);
        for (ReportDimension dimension : ReportDimension.values()) {
            when(exporter.write(eq(dimension), anyList(), anySet())).thenReturn(new ExportOutcome(dimension, List.of()));
        }

        // When
        service.runExport(ExportRequest.allMonths());

        // Then: 負責人相關欄區也會針對 3 月重寫
        verify(exporter).write(ReportDimension.PROJECT, projectRows, Set.of(MARCH));
        verify(exporter).write(ReportDimension.ASSIGNEE, List.of(), Set.of(MARCH));
        verify(exporter).write(ReportDimension.PROJECT_ASSIGNEE, List.of(), Set.of(MARCH));
    }

    @Test
    void shouldSucceedWithNoData() {
        for (ReportDimension dimension : ReportDimension.values()) {
            when(exporter.write(eq(dimension), anyList(), anySet())).thenReturn(new ExportOutcome(dimension, List.of()));
        }

        ExportSummary summary = service.runExport(ExportRequest.allMonths());

        assertThat(summary.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(summary.tabs()).isEmpty();
    }
}
