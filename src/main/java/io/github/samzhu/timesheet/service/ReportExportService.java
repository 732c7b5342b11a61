package io.github.samzhu.timesheet.service;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.timesheet.client.RunNotifier;
import io.github.samzhu.timesheet.dto.ExportOutcome;
import io.github.samzhu.timesheet.dto.ReportDimension;
import io.github.samzhu.timesheet.dto.ReportRow;
import io.github.samzhu.timesheet.dto.TabOutcome;
import io.github.samzhu.timesheet.dto.api.ExportRequest;
import io.github.samzhu.timesheet.dto.api.ExportSummary;
import io.github.samzhu.timesheet.dto.api.RunStatus;

/**
 * 報表匯出流程。
 *
 * <p>依序處理三個維度：彙整 ({@link ReportAggregationService}) → 寫入月別分頁 ({@link SheetReportExporter})。
 *
 * <p>狀態判定：
 * <pre>
 * 所有分頁成功           → SUCCESS
 * 部分分頁失敗           → PARTIAL
 * 全部失敗或執行中止     → FAILURE
 * </pre>
 */
@Service
public class ReportExportService {

    private static final Logger log = LoggerFactory.getLogger(ReportExportService.class);

    private final ReportAggregationService aggregationService;
    private final SheetReportExporter exporter;
    private final RunNotifier notifier;
    private final Clock clock;

    public ReportExportService(
            ReportAggregationService aggregationService,
            SheetReportExporter exporter,
            RunNotifier notifier,
            Clock clock) {
        this.aggregationService = aggregationService;
        this.exporter = exporter;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * 執行一次匯出。
     *
     * @param request 匯出選項
     * @return 執行摘要，不會拋出例外
     */
    public ExportSummary runExport(ExportRequest request) {
        Instant startedAt = clock.instant();
        log.info("Starting export: {} ~ {}", request.from(), request.to());

        List<TabOutcome> tabs = new ArrayList<>();
        String error = null;
        try {
            Map<ReportDimension, List<ReportRow>> rowsByDimension = new EnumMap<>(ReportDimension.class);
            Set<YearMonth> months = new TreeSet<>();
            for (ReportDimension dimension : ReportDimension.values()) {
                List<ReportRow> rows = aggregationService.reportData(dimension, request.from(), request.to());
                rowsByDimension.put(dimension, rows);
                rows.forEach(row -> months.add(row.yearMonth()));
            }
            // 每個月份的三個欄區都重寫，某維度沒有資料時只留標題
            for (ReportDimension dimension : ReportDimension.values()) {
                ExportOutcome outcome = exporter.write(dimension, rowsByDimension.get(dimension), months);
                tabs.addAll(outcome.tabs());
            }
        } catch (RuntimeException e) {
            error = e.getMessage();
            log.error("Export aborted: {}", e.getMessage(), e);
        }

        int succeeded = (int) tabs.stream().filter(TabOutcome::succeeded).count();
        int failed = tabs.size() - succeeded;
        RunStatus status;
        if (error != null || (failed > 0 && succeeded == 0)) {
            status = RunStatus.FAILURE;
        } else if (failed > 0) {
            status = RunStatus.PARTIAL;
        } else {
            status = RunStatus.SUCCESS;
        }

        ExportSummary summary = new ExportSummary(status, startedAt, clock.millis() - startedAt.toEpochMilli(),
            List.copyOf(tabs), succeeded, failed, error);
        log.info("Export completed: {}", summary.summaryLine());
        notifier.notify(status == RunStatus.SUCCESS, summary.summaryLine());
        return summary;
    }
}
