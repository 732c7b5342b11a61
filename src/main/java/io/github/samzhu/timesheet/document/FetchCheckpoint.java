package io.github.samzhu.timesheet.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 專案抓取進度文件。
 *
 * <p>每個專案一筆，記錄最後一次成功處理該專案的抓取「開始時間」。
 * 增量抓取以此作為 {@code modified_since}，因此在抓取進行中被修改的任務
 * 下次仍會被抓到；分批執行時未處理的專案沒有進度，會做全量抓取。
 *
 * @param projectId 專案 gid (文件 ID)
 * @param projectName 專案名稱
 * @param fetchStartedAt 最後一次成功處理時，該次抓取的開始時間
 */
@Document(collection = "fetch_checkpoints")
public record FetchCheckpoint(
    @Id String projectId,
    String projectName,
    Instant fetchStartedAt
) {
}
