package io.github.samzhu.timesheet.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.github.samzhu.timesheet.dto.api.ExportRequest;
import io.github.samzhu.timesheet.dto.api.FetchRequest;

/**
 * 內建排程觸發。
 *
 * <p>正式環境由 Cloud Scheduler 經 HTTP 或 Pub/Sub 觸發，三個排程預設為 {@code -} (停用)。
 * 在沒有外部排程器的環境可設定 {@code timesheet.schedule.*} 啟用，例如：
 * <pre>
 * timesheet:
 *   schedule:
 *     fetch-cron: "0 0 2 * * *"
 *     export-cron: "0 30 2 * * *"
 *     snapshot-cron: "0 0 9 * * *"
 * </pre>
 */
@Component
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final IngestionService ingestionService;
    private final ReportExportService reportExportService;
    private final OpenTaskSnapshotService snapshotService;

    public JobScheduler(
            IngestionService ingestionService,
            ReportExportService reportExportService,
            OpenTaskSnapshotService snapshotService) {
        this.ingestionService = ingestionService;
        this.reportExportService = reportExportService;
        this.snapshotService = snapshotService;
    }

    @Scheduled(cron = "${timesheet.schedule.fetch-cron:-}", zone = "${timesheet.report.zone-id:Asia/Tokyo}")
    public void scheduledFetch() {
        log.info("Scheduled fetch triggered");
        ingestionService.runFetch(new FetchRequest(null, true, 0, 1));
    }

    @Scheduled(cron = "${timesheet.schedule.export-cron:-}", zone = "${timesheet.report.zone-id:Asia/Tokyo}")
    public void scheduledExport() {
        log.info("Scheduled export triggered");
        reportExportService.runExport(ExportRequest.allMonths());
    }

    @Scheduled(cron = "${timesheet.schedule.snapshot-cron:-}", zone = "${timesheet.report.zone-id:Asia/Tokyo}")
    public void scheduledSnapshot() {
        log.info("Scheduled snapshot triggered");
        snapshotService.runSnapshot();
    }
}
