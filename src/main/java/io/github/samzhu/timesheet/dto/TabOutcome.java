package io.github.samzhu.timesheet.dto;

import java.time.YearMonth;

/**
 * 單一分頁區塊的寫入結果。
 *
 * @param tabName 分頁名稱，例如 {@code 2024年3月}
 * @param month 月份
 * @param dimension 寫入的報表維度
 * @param status 成功或失敗
 * @param rowsWritten 寫入的資料列數 (不含標題列)
 * @param errorDetail 失敗原因，成功時為 null
 */
public record TabOutcome(
    String tabName,
    YearMonth month,
    ReportDimension dimension,
    Status status,
    int rowsWritten,
    String errorDetail
) {
    public enum Status {
        SUCCESS,
        FAILURE
    }

    public static TabOutcome success(String tabName, YearMonth month, ReportDimension dimension, int rowsWritten) {
        return new TabOutcome(tabName, month, dimension, Status.SUCCESS, rowsWritten, null);
    }

    public static TabOutcome failure(String tabName, YearMonth month, ReportDimension dimension, String errorDetail) {
        return new TabOutcome(tabName, month, dimension, Status.FAILURE, 0, errorDetail);
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}
