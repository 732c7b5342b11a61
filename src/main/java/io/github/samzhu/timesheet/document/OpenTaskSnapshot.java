package io.github.samzhu.timesheet.document;

import java.time.Instant;
import java.time.LocalDate;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 未完成任務快照文件。
 *
 * <p>每次快照執行時，為每個未完成任務新增一筆文件，用於追蹤未完成任務數量
 * 與逾期狀況的趨勢。此集合只新增、不更新也不去重；同一天執行兩次會留下兩筆，
 * 歷史本身就是資料。
 *
 * <p>文件 ID 由 MongoDB 自動產生 (ObjectId)。
 *
 * @param id 文件 ID
 * @param snapshotDate 快照日期 (報表時區)
 * @param taskId 任務 gid
 * @param taskName 任務名稱
 * @param projectId 專案 gid
 * @param projectName 專案名稱
 * @param assigneeName 負責人名稱
 * @param dueDate 截止日
 * @param status 任務狀態
 * @param hasTimeFields 是否已填寫見積時間或達成率
 * @param parentTaskId 父任務 gid，一般任務為 null
 * @param capturedAt 快照寫入時間
 */
@Document(collection = "open_task_snapshots")
public record OpenTaskSnapshot(
    @Id String id,
    LocalDate snapshotDate,
    String taskId,
    String taskName,
    String projectId,
    String projectName,
    String assigneeName,
    LocalDate dueDate,
    Status status,
    boolean hasTimeFields,
    String parentTaskId,
    Instant capturedAt
) {
    /**
     * 快照當下的任務狀態。
     */
    public enum Status {
        OPEN,
        OVERDUE
    }

    /**
     * 建立新的快照文件，ID 由資料庫產生。
     *
     * <p>截止日早於快照日期時狀態為 {@link Status#OVERDUE}，其餘為 {@link Status#OPEN}。
     */
    public static OpenTaskSnapshot create(LocalDate snapshotDate, String taskId, String taskName,
            String projectId, String projectName, String assigneeName, LocalDate dueDate,
            boolean hasTimeFields, String parentTaskId, Instant capturedAt) {
        Status status = dueDate != null && dueDate.isBefore(snapshotDate) ? Status.OVERDUE : Status.OPEN;
        return new OpenTaskSnapshot(null, snapshotDate, taskId, taskName, projectId, projectName,
            assigneeName, dueDate, status, hasTimeFields, parentTaskId, capturedAt);
    }
}
