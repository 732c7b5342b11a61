package io.github.samzhu.timesheet.dto.api;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 未完成任務快照執行摘要。
 *
 * @param status 整體結果
 * @param snapshotDate 快照日期
 * @param startedAt 開始時間
 * @param durationMs 執行時間 (毫秒)
 * @param projectsProcessed 成功處理的專案數
 * @param projectsSkipped 因錯誤略過的專案數
 * @param rowsWritten 寫入的快照筆數
 * @param overdue 其中逾期的筆數
 * @param error 中止原因
 */
public record SnapshotSummary(
    RunStatus status,
    LocalDate snapshotDate,
    Instant startedAt,
    long durationMs,
    int projectsProcessed,
    int projectsSkipped,
    int rowsWritten,
    int overdue,
    String error
) {
    public String summaryLine() {
        StringBuilder line = new StringBuilder()
            .append("[snapshot] ").append(status)
            .append(' ').append(snapshotDate)
            .append(" projects=").append(projectsProcessed)
            .append(" skipped=").append(projectsSkipped)
            .append(" rows=").append(rowsWritten)
            .append(" overdue=").append(overdue)
            .append(" (").append(durationMs).append("ms)");
        if (error != null) {
            line.append(" error=").append(error);
        }
        return line.toString();
    }
}
