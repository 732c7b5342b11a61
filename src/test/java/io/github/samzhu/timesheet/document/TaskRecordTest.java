package io.github.samzhu.timesheet.document;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class TaskRecordTest {

    @Test
    void shouldNormalizeTags() {
        // Given: 未排序、重複、含空白與 null 的標籤
        TaskRecord record = record("t1", 8.0, Arrays.asList(" urgent", "backend", null, "urgent", " "));

        // Then
        assertThat(record.tags()).containsExactly("backend", "urgent");
    }

    @Test
    void shouldTreatTagOrderAsIrrelevant() {
        TaskRecord first = record("t1", 8.0, List.of("b", "a"));
        TaskRecord second = record("t1", 8.0, List.of("a", "b"));

        assertThat(first.sameTrackedFields(second)).isTrue();
    }

    @Test
    void shouldIgnoreTimestampsWhenComparing() {
        TaskRecord stored = record("t1", 8.0, List.of())
            .withInsertedAt(Instant.parse("2024-03-01T00:00:00Z"));
        TaskRecord fetched = new TaskRecord("t1", "Design review", "p1", "Alpha", "u1", "Alice",
            LocalDate.of(2024, 3, 5), null, 10.0, 0.8, null, 8.0, List.of(), null,
            Instant.parse("2024-03-10T00:00:00Z"), null);

        assertThat(fetched.sameTrackedFields(stored)).isTrue();
    }

    @Test
    void shouldDetectChangedActualTime() {
        TaskRecord stored = record("t1", 8.0, List.of());
        TaskRecord fetched = record("t1", 8.000000001, List.of());

        assertThat(fetched.sameTrackedFields(stored)).isFalse();
    }

    @Test
    void shouldReportUnestimatedWhenActualTimeMissing() {
        assertThat(record("t1", null, List.of()).unestimated()).isTrue();
        assertThat(record("t1", 0.0, List.of()).unestimated()).isFalse();
    }

    private static TaskRecord record(String taskId, Double actualTime, List<String> tags) {
        return new TaskRecord(taskId, "Design review", "p1", "Alpha", "u1", "Alice",
            LocalDate.of(2024, 3, 5), null, 10.0, 0.8, null, actualTime, tags, null,
            Instant.parse("2024-03-05T09:00:00Z"), null);
    }
}
