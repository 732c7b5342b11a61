package io.github.samzhu.timesheet.dto.api;

import jakarta.validation.constraints.Min;

/**
 * 抓取選項。
 *
 * <p>用於 POST /api/v1/jobs/fetch 端點與 {@code fetch} 觸發訊息，所有欄位皆可省略。
 *
 * @param projectFilter 只處理名稱包含此字串的專案
 * @param incremental 只抓取各專案上次成功抓取後有修改的任務
 * @param batchSize 每批專案數，0 表示不分批
 * @param batchNumber 要處理的批次 (從 1 開始)
 */
public record FetchRequest(
    String projectFilter,
    Boolean incremental,

    @Min(value = 0, message = "batchSize must be positive or zero")
    Integer batchSize,

    @Min(value = 1, message = "batchNumber must be at least 1")
    Integer batchNumber
) {
    public FetchRequest {
        if (projectFilter != null && projectFilter.isBlank()) {
            projectFilter = null;
        }
        if (incremental == null) {
            incremental = Boolean.FALSE;
        }
        if (batchSize == null) {
            batchSize = 0;
        }
        if (batchNumber == null) {
            batchNumber = 1;
        }
    }

    /**
     * 全量抓取所有專案。
     */
    public static FetchRequest full() {
        return new FetchRequest(null, false, 0, 1);
    }

    public boolean batched() {
        return batchSize > 0;
    }
}
