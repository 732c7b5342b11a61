package io.github.samzhu.timesheet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Timesheet Service - Asana 完成任務工時彙整與月報輸出服務。
 *
 * <p>此服務負責：
 * <ul>
 *   <li>從 Asana 逐專案抓取已完成任務，解析自訂欄位中的工時資料</li>
 *   <li>以 task_id 為主鍵 upsert 到 MongoDB，重複執行不會產生重複資料</li>
 *   <li>依月份 × 專案 / 負責人 / 專案×負責人 彙整實績工時</li>
 *   <li>將彙整結果寫入 Google Sheets，每個月份一個分頁</li>
 *   <li>每日快照未完成任務，供趨勢分析使用</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Scheduler / HTTP / Pub/Sub → fetch    → Asana API → completed_tasks (upsert)
 *                            → export   → completed_tasks → Google Sheets (月分頁)
 *                            → snapshot → Asana API → open_task_snapshots (append-only)
 * </pre>
 *
 * @see <a href="https://developers.asana.com/reference/rest-api-reference">Asana REST API</a>
 * @see <a href="https://developers.google.com/sheets/api/reference/rest">Google Sheets API v4</a>
 */
@SpringBootApplication
@EnableScheduling
public class TimesheetApplication {

    private static final Logger log = LoggerFactory.getLogger(TimesheetApplication.class);

    public static void main(String[] args) {
        log.info("Starting Timesheet Service - Asana task hours reporting");
        SpringApplication.run(TimesheetApplication.class, args);
    }
}
