package io.github.samzhu.timesheet.dto.asana;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asana 任務 (含子任務) 的抓取欄位。
 *
 * <p>對應請求中的 {@code opt_fields}，見 {@link io.github.samzhu.timesheet.client.AsanaClient#TASK_FIELDS}。
 *
 * @param gid 任務 ID
 * @param name 任務名稱
 * @param completed 是否完成
 * @param completedAt 完成時間
 * @param modifiedAt 最後修改時間
 * @param dueOn 截止日
 * @param assignee 負責人
 * @param numSubtasks 子任務數
 * @param actualTimeMinutes Asana 內建時間追蹤的實績分鐘數
 * @param customFields 自訂欄位
 * @param tags 標籤
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsanaTask(
    String gid,
    String name,
    boolean completed,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("modified_at") Instant modifiedAt,
    @JsonProperty("due_on") LocalDate dueOn,
    AsanaUser assignee,
    @JsonProperty("num_subtasks") int numSubtasks,
    @JsonProperty("actual_time_minutes") Double actualTimeMinutes,
    @JsonProperty("custom_fields") List<CustomField> customFields,
    List<AsanaTag> tags
) {
    /**
     * 完成且有完成時間才視為已完成任務。
     */
    public boolean isCompletedWithTimestamp() {
        return completed && completedAt != null;
    }

    public List<CustomField> customFieldsOrEmpty() {
        return customFields != null ? customFields : List.of();
    }

    public List<AsanaTag> tagsOrEmpty() {
        return tags != null ? tags : List.of();
    }
}
