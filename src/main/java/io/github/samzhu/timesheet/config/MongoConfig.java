package io.github.samzhu.timesheet.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>Repository 自動掃描 {@code io.github.samzhu.timesheet.repository} 下的介面。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code completed_tasks} - 已完成任務，以 task_id 為主鍵 upsert</li>
 *   <li>{@code open_task_snapshots} - 未完成任務每日快照，只新增不更新</li>
 *   <li>{@code fetch_checkpoints} - 各專案增量抓取的進度，以專案 gid 為主鍵</li>
 * </ul>
 *
 * <p>{@code insertedAt} 由 {@link io.github.samzhu.timesheet.service.TaskStoreService}
 * 依欄位是否變更自行維護，因此不啟用 Mongo Auditing。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.timesheet.repository")
public class MongoConfig {
}
