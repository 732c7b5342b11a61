package io.github.samzhu.timesheet.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.timesheet.document.OpenTaskSnapshot;

/**
 * 未完成任務快照資料存取介面。
 *
 * <p>此集合為 append-only：服務層只呼叫 {@code insert}，不呼叫 {@code save}。
 *
 * @see io.github.samzhu.timesheet.document.OpenTaskSnapshot
 */
public interface OpenTaskSnapshotRepository extends MongoRepository<OpenTaskSnapshot, String> {

    /**
     * 查詢特定日期的快照。
     *
     * @param snapshotDate 快照日期
     * @return 快照列表
     */
    List<OpenTaskSnapshot> findBySnapshotDate(LocalDate snapshotDate);
}
