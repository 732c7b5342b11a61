package io.github.samzhu.timesheet.dto.api;

/**
 * 一次執行的整體結果。
 */
public enum RunStatus {
    /** 全部成功 */
    SUCCESS,
    /** 部分專案被略過或部分分頁寫入失敗 */
    PARTIAL,
    /** 執行中止 */
    FAILURE
}
