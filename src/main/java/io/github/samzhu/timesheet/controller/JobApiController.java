package io.github.samzhu.timesheet.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.timesheet.dto.api.ExportRequest;
import io.github.samzhu.timesheet.dto.api.ExportSummary;
import io.github.samzhu.timesheet.dto.api.FetchRequest;
import io.github.samzhu.timesheet.dto.api.IngestionSummary;
import io.github.samzhu.timesheet.dto.api.RunStatus;
import io.github.samzhu.timesheet.dto.api.SnapshotSummary;
import io.github.samzhu.timesheet.service.IngestionService;
import io.github.samzhu.timesheet.service.OpenTaskSnapshotService;
import io.github.samzhu.timesheet.service.ReportExportService;

/**
 * 工作觸發 REST API 控制器。
 *
 * <p>提供以下端點 (供 Cloud Scheduler 或手動呼叫)：
 * <ul>
 *   <li>{@code POST /api/v1/jobs/fetch} - 抓取已完成任務</li>
 *   <li>{@code POST /api/v1/jobs/export} - 匯出月別報表</li>
 *   <li>{@code POST /api/v1/jobs/snapshot} - 未完成任務快照</li>
 * </ul>
 *
 * <p>請求本文皆可省略。執行結果為 FAILURE 時回應 500 並附上摘要，
 * 讓排程器視為失敗並依其設定重試；SUCCESS 與 PARTIAL 回應 200。
 */
@RestController
@RequestMapping("/api/v1/jobs")
public class JobApiController {

    private static final Logger log = LoggerFactory.getLogger(JobApiController.class);

    private final IngestionService ingestionService;
    private final ReportExportService reportExportService;
    private final OpenTaskSnapshotService snapshotService;

    public JobApiController(IngestionService ingestionService,
                            ReportExportService reportExportService,
                            OpenTaskSnapshotService snapshotService) {
        this.ingestionService = ingestionService;
        this.reportExportService = reportExportService;
        this.snapshotService = snapshotService;
    }

    /**
     * 抓取已完成任務。
     *
     * <p>端點：{@code POST /api/v1/jobs/fetch}
     *
     * @param request 抓取選項，省略時全量抓取
     * @return 執行摘要
     */
    @PostMapping("/fetch")
    public ResponseEntity<IngestionSummary> fetch(@Validated @RequestBody(required = false) FetchRequest request) {
        FetchRequest effective = request != null ? request : FetchRequest.full();
        log.info("API request: fetch {}", effective);
        IngestionSummary summary = ingestionService.runFetch(effective);
        return respond(summary.status(), summary);
    }

    /**
     * 匯出月別報表。
     *
     * <p>端點：{@code POST /api/v1/jobs/export}
     *
     * @param request 匯出選項，省略時匯出所有月份
     * @return 執行摘要，含各分頁結果
     */
    @PostMapping("/export")
    public ResponseEntity<ExportSummary> export(@RequestBody(required = false) ExportRequest request) {
        ExportRequest effective = request != null ? request : ExportRequest.allMonths();
        log.info("API request: export {}", effective);
        ExportSummary summary = reportExportService.runExport(effective);
        return respond(summary.status(), summary);
    }

    /**
     * 未完成任務快照。
     *
     * <p>端點：{@code POST /api/v1/jobs/snapshot}
     *
     * @return 執行摘要
     */
    @PostMapping("/snapshot")
    public ResponseEntity<SnapshotSummary> snapshot() {
        log.info("API request: snapshot");
        SnapshotSummary summary = snapshotService.runSnapshot();
        return respond(summary.status(), summary);
    }

    private static <T> ResponseEntity<T> respond(RunStatus status, T body) {
        HttpStatus httpStatus = status == RunStatus.FAILURE ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.OK;
        return ResponseEntity.status(httpStatus).body(body);
    }
}
