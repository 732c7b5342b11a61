package io.github.samzhu.timesheet.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.timesheet.document.TaskRecord;

/**
 * 已完成任務資料存取介面。
 *
 * <p>提供對 {@code completed_tasks} 集合的 CRUD 操作。
 * 寫入只透過 {@link io.github.samzhu.timesheet.service.TaskStoreService#upsert} 進行，
 * 以文件 ID (任務 gid) 為鍵覆寫，不會產生重複文件。
 *
 * @see io.github.samzhu.timesheet.document.TaskRecord
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/query-methods.html">Query Methods</a>
 */
public interface TaskRecordRepository extends MongoRepository<TaskRecord, String> {

    /**
     * 查詢有完成日期的所有任務。
     *
     * @return 任務列表
     */
    List<TaskRecord> findByCompletedAtNotNull();

    /**
     * 查詢完成日期在區間內 (含頭尾) 的任務。
     *
     * <p>Spring Data 的 {@code Between} 預設不含邊界，因此呼叫端傳入
     * 開始日前一天與結束日後一天。
     *
     * @param after 開始日前一天
     * @param before 結束日後一天
     * @return 任務列表
     */
    List<TaskRecord> findByCompletedAtBetween(LocalDate after, LocalDate before);
}
