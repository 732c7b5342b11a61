package io.github.samzhu.timesheet.dto;

import java.util.List;

/**
 * 一個維度的匯出結果，每個月份一筆 {@link TabOutcome}。
 *
 * @param dimension 報表維度
 * @param tabs 各分頁結果，依月份排序
 */
public record ExportOutcome(
    ReportDimension dimension,
    List<TabOutcome> tabs
) {
    public ExportOutcome {
        tabs = tabs != null ? List.copyOf(tabs) : List.of();
    }

    public long succeededCount() {
        return tabs.stream().filter(TabOutcome::succeeded).count();
    }

    public long failedCount() {
        return tabs.size() - succeededCount();
    }

    public boolean hasFailures() {
        return failedCount() > 0;
    }
}
