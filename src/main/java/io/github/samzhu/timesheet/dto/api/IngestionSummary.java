package io.github.samzhu.timesheet.dto.api;

import java.time.Instant;
import java.util.List;

/**
 * 抓取執行摘要。
 *
 * @param status 整體結果
 * @param startedAt 開始時間
 * @param durationMs 執行時間 (毫秒)
 * @param projectsTotal 本次要處理的專案數
 * @param projectsProcessed 成功處理的專案數
 * @param projectsSkipped 因錯誤略過的專案數
 * @param skippedProjects 略過的專案名稱
 * @param tasksFetched 抓取到的已完成任務數
 * @param inserted 新增任務數
 * @param updated 更新任務數
 * @param unchanged 未變動任務數
 * @param parseWarnings 自訂欄位解析警告數
 * @param unestimated 見積なし任務數
 * @param failedTaskId 寫入失敗的任務 gid
 * @param error 中止原因
 */
public record IngestionSummary(
    RunStatus status,
    Instant startedAt,
    long durationMs,
    int projectsTotal,
    int projectsProcessed,
    int projectsSkipped,
    List<String> skippedProjects,
    int tasksFetched,
    int inserted,
    int updated,
    int unchanged,
    int parseWarnings,
    int unestimated,
    String failedTaskId,
    String error
) {
    /**
     * 通知用的一行摘要。
     */
    public String summaryLine() {
        StringBuilder line = new StringBuilder()
            .append("[fetch] ").append(status)
            .append(" projects=").append(projectsProcessed).append('/').append(projectsTotal)
            .append(" skipped=").append(projectsSkipped)
            .append(" tasks=").append(tasksFetched)
            .append(" inserted=").append(inserted)
            .append(" updated=").append(updated)
            .append(" unchanged=").append(unchanged)
            .append(" warnings=").append(parseWarnings)
            .append(" (").append(durationMs).append("ms)");
        if (failedTaskId != null) {
            line.append(" failedTask=").append(failedTaskId);
        }
        if (error != null) {
            line.append(" error=").append(error);
        }
        return line.toString();
    }
}
