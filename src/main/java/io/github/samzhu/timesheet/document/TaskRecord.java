package io.github.samzhu.timesheet.document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 已完成任務文件。
 *
 * <p>每個 Asana 任務只有一筆文件，文件 ID 即為任務 gid，因此重複抓取
 * 只會覆寫同一筆文件，不會產生重複資料。
 *
 * <p>變更偵測使用的追蹤欄位見 {@link #sameTrackedFields(TaskRecord)}；
 * {@code modifiedAt} 與 {@code insertedAt} 不列入比較。
 * {@code insertedAt} 只在新增或追蹤欄位有變動時更新，可作為增量抓取的基準點。
 *
 * <p>{@code actualTime} 由 {@link io.github.samzhu.timesheet.service.TimeFieldParser}
 * 依見積時間、達成率與實績時間推導，不會單獨被修改。
 *
 * @param taskId 任務 gid (文件 ID)
 * @param taskName 任務名稱，子任務帶有 {@code [Subtask] } 前綴
 * @param projectId 專案 gid
 * @param projectName 專案名稱
 * @param assigneeId 負責人 gid
 * @param assigneeName 負責人名稱
 * @param completedAt 完成日期 (報表時區)
 * @param dueOn 截止日
 * @param estimatedTime 見積時間 (小時)
 * @param timeAchievementRate 時間達成率
 * @param actualTimeRaw 直接回報的實績時間 (小時)
 * @param actualTime 推導後的實績時間 (小時)
 * @param tags 標籤名稱，已排序且不重複
 * @param parentTaskId 父任務 gid，一般任務為 null
 * @param modifiedAt Asana 回報的最後修改時間
 * @param insertedAt 最後一次寫入時間
 */
@Document(collection = "completed_tasks")
public record TaskRecord(
    @Id String taskId,
    String taskName,
    String projectId,
    String projectName,
    String assigneeId,
    String assigneeName,
    LocalDate completedAt,
    LocalDate dueOn,
    Double estimatedTime,
    Double timeAchievementRate,
    Double actualTimeRaw,
    Double actualTime,
    List<String> tags,
    String parentTaskId,
    Instant modifiedAt,
    Instant insertedAt
) {
    public TaskRecord {
        tags = normalizeTags(tags);
    }

    /**
     * 比較追蹤欄位是否完全相同。
     *
     * <p>數值欄位以 {@link Double#equals(Object)} 比較，即依位元值比較，
     * 因此 {@code 8.0} 與 {@code 8.000000001} 視為不同。
     *
     * @param other 已儲存的文件
     * @return true 表示不需要寫入
     */
    public boolean sameTrackedFields(TaskRecord other) {
        return Objects.equals(taskId, other.taskId)
            && Objects.equals(taskName, other.taskName)
            && Objects.equals(projectId, other.projectId)
            && Objects.equals(projectName, other.projectName)
            && Objects.equals(assigneeId, other.assigneeId)
            && Objects.equals(assigneeName, other.assigneeName)
            && Objects.equals(completedAt, other.completedAt)
            && Objects.equals(dueOn, other.dueOn)
            && Objects.equals(estimatedTime, other.estimatedTime)
            && Objects.equals(timeAchievementRate, other.timeAchievementRate)
            && Objects.equals(actualTimeRaw, other.actualTimeRaw)
            && Objects.equals(actualTime, other.actualTime)
            && Objects.equals(tags, other.tags)
            && Objects.equals(parentTaskId, other.parentTaskId);
    }

    /**
     * 回傳設定寫入時間後的副本。
     *
     * @param timestamp 寫入時間
     * @return 新的 TaskRecord
     */
    public TaskRecord withInsertedAt(Instant timestamp) {
        return new TaskRecord(taskId, taskName, projectId, projectName, assigneeId, assigneeName,
            completedAt, dueOn, estimatedTime, timeAchievementRate, actualTimeRaw, actualTime,
            tags, parentTaskId, modifiedAt, timestamp);
    }

    /**
     * 是否為見積なし (無法推導實績時間)。
     */
    public boolean unestimated() {
        return actualTime == null;
    }

    private static List<String> normalizeTags(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                sorted.add(tag.trim());
            }
        }
        return List.copyOf(sorted);
    }
}
