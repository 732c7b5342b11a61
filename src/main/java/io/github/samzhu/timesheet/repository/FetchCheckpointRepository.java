package io.github.samzhu.timesheet.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.timesheet.document.FetchCheckpoint;

/**
 * 專案抓取進度資料存取介面，以專案 gid 為鍵覆寫。
 */
public interface FetchCheckpointRepository extends MongoRepository<FetchCheckpoint, String> {
}
