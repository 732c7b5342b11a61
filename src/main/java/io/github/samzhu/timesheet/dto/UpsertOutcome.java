package io.github.samzhu.timesheet.dto;

/**
 * 單筆任務 upsert 的結果。
 */
public enum UpsertOutcome {
    /** 新任務，已新增 */
    INSERTED,
    /** 追蹤欄位有變動，已覆寫並更新 insertedAt */
    UPDATED,
    /** 追蹤欄位完全相同，未寫入 */
    UNCHANGED
}
