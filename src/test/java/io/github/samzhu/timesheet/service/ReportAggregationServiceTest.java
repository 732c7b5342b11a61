package io.github.samzhu.timesheet.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.timesheet.document.TaskRecord;
import io.github.samzhu.timesheet.dto.ReportDimension;
import io.github.samzhu.timesheet.dto.ReportRow;
import io.github.samzhu.timesheet.repository.TaskRecordRepository;

class ReportAggregationServiceTest {

    private TaskRecordRepository repository;
    private ReportAggregationService service;

    private final List<TaskRecord> records = List.of(
        task("t1", "Beta", "Bob", LocalDate.of(2024, 3, 2), 4.0, 5.0),
        task("t2", "Alpha", "Alice", LocalDate.of(2024, 3, 15), 8.0, 10.0),
        task("t3", "Alpha", "Bob", LocalDate.of(2024, 3, 31), 2.5, 2.0),
        task("t4", "Alpha", "Alice", LocalDate.of(2024, 2, 29), 1.0, 1.0),
        task("t5", "Alpha", null, LocalDate.of(2024, 3, 20), 3.0, 3.0),
        task("t6", "Alpha", "Alice", LocalDate.of(2024, 3, 21), null, null)
    );

    @BeforeEach
    void setUp() {
        repository = mock(TaskRecordRepository.class);
        service = new ReportAggregationService(repository);
    }

    @Test
    void shouldAggregateByProjectAndMonth() {
        // When
        List<ReportRow> rows = service.aggregate(ReportDimension.PROJECT, records);

        // Then: 依月份、專案排序
        assertThat(rows).extracting(ReportRow::month, ReportRow::primaryKey)
            .containsExactly(
                tuple(LocalDate.of(2024, 2, 1), "Alpha"),
                tuple(LocalDate.of(2024, 3, 1), "Alpha"),
                tuple(LocalDate.of(2024, 3, 1), "Beta"));

        ReportRow alphaMarch = rows.get(1);
        // 實績: 8.0 + 2.5 + 3.0 = 13.5 (t6 見積なし不計入)
        assertThat(alphaMarch.totalActualTime()).isCloseTo(13.5, within(1e-9));
        // 見積: 10.0 + 2.0 + 3.0 = 15.0
        assertThat(alphaMarch.totalEstimatedTime()).isCloseTo(15.0, within(1e-9));
        assertThat(alphaMarch.taskCount()).isEqualTo(4);
        assertThat(alphaMarch.unestimatedCount()).isEqualTo(1);
        assertThat(alphaMarch.secondaryKey()).isNull();
    }

    @Test
    void shouldExcludeUnassignedTasksFromAssigneeDimension() {
        // When
        List<ReportRow> rows = service.aggregate(ReportDimension.ASSIGNEE, records);

        // Then
        assertThat(rows).extracting(ReportRow::primaryKey)
            .containsExactly("Alice", "Alice", "Bob");
        int totalTasks = rows.stream().mapToInt(ReportRow::taskCount).sum();
        assertThat(totalTasks).isEqualTo(5);
    }

    @Test
    void shouldAggregateByProjectAndAssignee() {
        List<ReportRow> rows = service.aggregate(ReportDimension.PROJECT_ASSIGNEE, records);

        assertThat(rows).extracting(ReportRow::primaryKey, ReportRow::secondaryKey)
            .containsExactly(
                tuple("Alpha", "Alice"),
                tuple("Alpha", "Alice"),
                tuple("Alpha", "Bob"),
                tuple("Beta", "Bob"));
        ReportRow aliceMarch = rows.get(1);
        assertThat(aliceMarch.taskCount()).isEqualTo(2);
        assertThat(aliceMarch.totalActualTime()).isCloseTo(8.0, within(1e-9));
        assertThat(aliceMarch.unestimatedCount()).isEqualTo(1);
    }

    @Test
    void shouldMatchManualGroupingTotals() {
        // 整體合計與逐筆加總一致
        List<ReportRow> rows = service.aggregate(ReportDimension.PROJECT, records);

        double expectedActual = records.stream()
            .filter(r -> r.actualTime() != null)
            .mapToDouble(TaskRecord::actualTime)
            .sum();
        double actual = rows.stream().mapToDouble(ReportRow::totalActualTime).sum();
        assertThat(actual).isCloseTo(expectedActual, within(1e-9));
        assertThat(rows.stream().mapToInt(ReportRow::taskCount).sum()).isEqualTo(records.size());
    }

    @Test
    void shouldFallBackToProjectIdWhenNameBlank() {
        TaskRecord unnamed = new TaskRecord("t7", "Task", "p-404", " ", "u1", "Alice",
            LocalDate.of(2024, 3, 1), null, 1.0, null, 1.0, 1.0, List.of(), null, null, null);

        List<ReportRow> rows = service.aggregate(ReportDimension.PROJECT, List.of(unnamed));

        assertThat(rows).singleElement().extracting(ReportRow::primaryKey).isEqualTo("p-404");
    }

    @Test
    void shouldQueryInclusiveMonthRange() {
        // Given
        when(repository.findByCompletedAtBetween(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 4, 1)))
            .thenReturn(records);

        // When
        List<ReportRow> rows = service.reportData(ReportDimension.PROJECT, YearMonth.of(2024, 2), YearMonth.of(2024, 3));

        // Then: 查詢邊界往外各推一天
        verify(repository).findByCompletedAtBetween(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 4, 1));
        assertThat(rows).hasSize(3);
    }

    @Test
    void shouldLoadAllCompletedTasksWithoutRange() {
        when(repository.findByCompletedAtNotNull()).thenReturn(records);

        List<ReportRow> rows = service.reportData(ReportDimension.ASSIGNEE);

        assertThat(rows).hasSize(3);
    }

    private static TaskRecord task(String id, String project, String assignee, LocalDate completedAt,
            Double actual, Double estimated) {
        return new TaskRecord(id, "Task " + id, "gid-" + project, project,
            assignee != null ? "u-" + assignee : null, assignee,
            completedAt, null, estimated, null, actual, actual, List.of(), null,
            Instant.parse("2024-04-01T00:00:00Z"), null);
    }
}
