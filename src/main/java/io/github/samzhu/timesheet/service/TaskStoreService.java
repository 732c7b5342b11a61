package io.github.samzhu.timesheet.service;

import java.time.Clock;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.samzhu.timesheet.document.TaskRecord;
import io.github.samzhu.timesheet.dto.UpsertOutcome;
import io.github.samzhu.timesheet.exception.TaskStoreException;
import io.github.samzhu.timesheet.repository.TaskRecordRepository;

/**
 * 已完成任務的 upsert 服務。
 *
 * <p>處理流程：
 * <ol>
 *   <li>以 {@code taskId} 查詢現有文件</li>
 *   <li>不存在 → 寫入，{@code insertedAt = now}</li>
 *   <li>存在且追蹤欄位有差異 → 覆寫並更新 {@code insertedAt}</li>
 *   <li>存在且追蹤欄位完全相同 → 不寫入</li>
 * </ol>
 *
 * <p>寫入一律以文件 ID 為鍵 ({@code save})，即使兩次執行交錯或訊息重複投遞，
 * 也只會覆寫同一筆文件，不會產生重複資料，因此不需要任何鎖。
 * 重複執行同一批資料時，未變動的文件不會被寫入，{@code insertedAt} 也不會變動。
 *
 * @see TaskRecord#sameTrackedFields(TaskRecord)
 */
@Service
public class TaskStoreService {

    private static final Logger log = LoggerFactory.getLogger(TaskStoreService.class);

    private final TaskRecordRepository repository;
    private final Clock clock;

    public TaskStoreService(TaskRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * 寫入或更新單筆任務。
     *
     * @param record 由抓取結果建立的任務，{@code insertedAt} 會被忽略
     * @return 寫入結果
     * @throws TaskStoreException 資料庫讀寫失敗
     */
    public UpsertOutcome upsert(TaskRecord record) {
        try {
            Optional<TaskRecord> existing = repository.findById(record.taskId());
            if (existing.isEmpty()) {
                repository.save(record.withInsertedAt(clock.instant()));
                log.debug("Task inserted: {}", record.taskId());
                return UpsertOutcome.INSERTED;
            }
            if (record.sameTrackedFields(existing.get())) {
                return UpsertOutcome.UNCHANGED;
            }
            repository.save(record.withInsertedAt(clock.instant()));
            log.debug("Task updated: {}", record.taskId());
            return UpsertOutcome.UPDATED;
        } catch (DataAccessException e) {
            throw new TaskStoreException(record.taskId(), e);
        }
    }
}
