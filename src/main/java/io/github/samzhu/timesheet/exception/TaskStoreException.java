package io.github.samzhu.timesheet.exception;

/**
 * 任務寫入 MongoDB 失敗。
 *
 * <p>處理方式：
 * <ul>
 *   <li>中止本次抓取，避免在資料不一致的狀態下繼續寫入</li>
 *   <li>同次執行中已寫入的任務不回滾，下次執行會以 upsert 重新對齊</li>
 *   <li>摘要中回報失敗的 {@code taskId}</li>
 * </ul>
 */
public class TaskStoreException extends RuntimeException {

    private final String taskId;

    public TaskStoreException(String taskId, Throwable cause) {
        super(String.format("Failed to upsert task '%s': %s", taskId, cause.getMessage()), cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
