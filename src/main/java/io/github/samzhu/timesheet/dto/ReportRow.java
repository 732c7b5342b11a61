package io.github.samzhu.timesheet.dto;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * 報表的一列彙整結果，每次匯出時重新計算，不落地。
 *
 * @param month 月份 (該月 1 日)
 * @param primaryKey 主要鍵：專案名稱或負責人名稱
 * @param secondaryKey 次要鍵：僅 {@link ReportDimension#PROJECT_ASSIGNEE} 時為負責人名稱
 * @param totalActualTime 實績時間合計 (小時)，不含見積なし的任務
 * @param totalEstimatedTime 見積時間合計 (小時)
 * @param taskCount 完成任務數
 * @param unestimatedCount 見積なし任務數
 */
public record ReportRow(
    LocalDate month,
    String primaryKey,
    String secondaryKey,
    double totalActualTime,
    double totalEstimatedTime,
    int taskCount,
    int unestimatedCount
) {
    public YearMonth yearMonth() {
        return YearMonth.from(month);
    }
}
