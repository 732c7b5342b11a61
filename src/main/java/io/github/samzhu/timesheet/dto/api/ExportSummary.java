package io.github.samzhu.timesheet.dto.api;

import java.time.Instant;
import java.util.List;

import io.github.samzhu.timesheet.dto.TabOutcome;

/**
 * 匯出執行摘要。
 *
 * @param status 整體結果
 * @param startedAt 開始時間
 * @param durationMs 執行時間 (毫秒)
 * @param tabs 各分頁區塊的寫入結果
 * @param tabsSucceeded 成功數
 * @param tabsFailed 失敗數
 * @param error 中止原因
 */
public record ExportSummary(
    RunStatus status,
    Instant startedAt,
    long durationMs,
    List<TabOutcome> tabs,
    int tabsSucceeded,
    int tabsFailed,
    String error
) {
    public String summaryLine() {
        StringBuilder line = new StringBuilder()
            .append("[export] ").append(status)
            .append(" tabs ok=").append(tabsSucceeded)
            .append(" failed=").append(tabsFailed)
            .append(" (").append(durationMs).append("ms)");
        tabs.stream()
            .filter(tab -> !tab.succeeded())
            .forEach(tab -> line.append(" | ").append(tab.tabName())
                .append('/').append(tab.dimension()).append(": ").append(tab.errorDetail()));
        if (error != null) {
            line.append(" error=").append(error);
        }
        return line.toString();
    }
}
