package io.github.samzhu.timesheet.dto.api;

import java.time.YearMonth;

/**
 * 匯出選項。
 *
 * <p>用於 POST /api/v1/jobs/export 端點與 {@code export} 觸發訊息。
 * 兩個月份皆省略時匯出資料庫中所有月份。
 *
 * @param from 起始月份 (含)，格式 {@code yyyy-MM}
 * @param to 結束月份 (含)，格式 {@code yyyy-MM}
 */
public record ExportRequest(
    YearMonth from,
    YearMonth to
) {
    public ExportRequest {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
        }
    }

    public static ExportRequest allMonths() {
        return new ExportRequest(null, null);
    }
}
